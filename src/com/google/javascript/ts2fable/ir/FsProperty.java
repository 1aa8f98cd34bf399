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

import org.jspecify.annotations.Nullable;

/**
 * A field, an index signature or a getter/setter pair.
 *
 * @param emit the Fable {@code Emit} template used instead of member access, if any
 * @param index the key parameter of an index signature
 * @param option whether the property was declared optional
 */
public record FsProperty(
    @Nullable String emit,
    @Nullable FsParam index,
    String name,
    boolean option,
    boolean isStatic,
    FsType type)
    implements FsType {
  public FsProperty {
    requireNonNull(name, "name");
    requireNonNull(type, "type");
  }

  /** Creates a plain, non-static property without emit template or index. */
  public static FsProperty of(String name, boolean option, FsType type) {
    return new FsProperty(null, null, name, option, false, type);
  }

  @Override
  public Kind getKind() {
    return Kind.PROPERTY;
  }

  public FsProperty withName(String newName) {
    return new FsProperty(emit, index, newName, option, isStatic, type);
  }

  public FsProperty withIndexAndType(@Nullable FsParam newIndex, FsType newType) {
    return new FsProperty(emit, newIndex, name, option, isStatic, newType);
  }
}
