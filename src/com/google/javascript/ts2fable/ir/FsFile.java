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

/**
 * A whole translation unit.
 *
 * @param name the root F# namespace the file is printed under
 * @param opens the namespaces opened at the top of the file
 */
public record FsFile(String name, ImmutableList<String> opens, ImmutableList<FsModule> modules)
    implements FsType {
  public FsFile {
    requireNonNull(name, "name");
    requireNonNull(opens, "opens");
    requireNonNull(modules, "modules");
  }

  @Override
  public Kind getKind() {
    return Kind.FILE;
  }

  public FsFile withOpens(ImmutableList<String> newOpens) {
    return new FsFile(name, newOpens, modules);
  }

  public FsFile withModules(ImmutableList<FsModule> newModules) {
    return new FsFile(name, opens, newModules);
  }
}
