/*
 * Copyright 2017 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.javascript.ts2fable.ir;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/**
 * A method, constructor, call or construct signature, free function or function type.
 *
 * @param emit the Fable {@code Emit} template used instead of a member call, if any
 * @param name absent for function types; declarations always have one
 */
public record FsFunction(
    @Nullable String emit,
    boolean isStatic,
    @Nullable String name,
    ImmutableList<FsType> typeParameters,
    ImmutableList<FsParam> params,
    FsType returnType)
    implements FsType {
  public FsFunction {
    requireNonNull(typeParameters, "typeParameters");
    requireNonNull(params, "params");
    requireNonNull(returnType, "returnType");
  }

  @Override
  public Kind getKind() {
    return Kind.FUNCTION;
  }

  public FsFunction withName(@Nullable String newName) {
    return new FsFunction(emit, isStatic, newName, typeParameters, params, returnType);
  }

  public FsFunction withReturnType(FsType newReturnType) {
    return new FsFunction(emit, isStatic, name, typeParameters, params, newReturnType);
  }

  public FsFunction withEmitNameAndParams(
      @Nullable String newEmit, @Nullable String newName, ImmutableList<FsParam> newParams) {
    return new FsFunction(newEmit, isStatic, newName, typeParameters, newParams, returnType);
  }
}
