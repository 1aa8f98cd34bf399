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

package com.google.javascript.ts2fable;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.javascript.ts2fable.ir.FsFile;
import com.google.javascript.ts2fable.ir.FsFunction;
import com.google.javascript.ts2fable.ir.FsInterface;
import com.google.javascript.ts2fable.ir.FsThis;
import com.google.javascript.ts2fable.ir.FsType;
import com.google.javascript.ts2fable.ir.FsTypes;

/**
 * Replaces {@code this} return types of interface methods with a reference to the interface,
 * applied to its own type parameters. For example {@code interface List<T> { add(x: T): this }}
 * gets an {@code add} returning {@code List<T>}.
 */
final class ResolveThisTypes implements FixPass {

  @Override
  public FsFile process(FsFile file) {
    return FsTypeRewriter.rewriteModuleContents(ResolveThisTypes::resolve, file);
  }

  private static FsType resolve(FsType type) {
    if (!(type instanceof FsInterface it)) {
      return type;
    }
    return it.withMembers(
        it.members().stream()
            .map(
                member -> {
                  FsFunction fn = FsTypes.asFunction(member);
                  if (fn == null || !(fn.returnType() instanceof FsThis)) {
                    return member;
                  }
                  return fn.withReturnType(
                      FsTypes.generic(FsTypes.mapped(it.name()), it.typeParameters()));
                })
            .collect(toImmutableList()));
  }
}
