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
 * A type known only by name: a primitive such as {@code float}, a type parameter or a reference
 * to another declaration.
 */
public record FsMapped(String name) implements FsType {
  public FsMapped {
    requireNonNull(name, "name");
  }

  @Override
  public Kind getKind() {
    return Kind.MAPPED;
  }
}
