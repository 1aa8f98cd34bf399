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

/**
 * A function parameter.
 *
 * @param paramArray whether this is a rest parameter ({@code ...args})
 */
public record FsParam(String name, boolean optional, boolean paramArray, FsType type)
    implements FsType {
  public FsParam {
    requireNonNull(name, "name");
    requireNonNull(type, "type");
  }

  @Override
  public Kind getKind() {
    return Kind.PARAM;
  }

  public FsParam withName(String newName) {
    return new FsParam(newName, optional, paramArray, type);
  }

  public FsParam withType(FsType newType) {
    return new FsParam(name, optional, paramArray, newType);
  }
}
