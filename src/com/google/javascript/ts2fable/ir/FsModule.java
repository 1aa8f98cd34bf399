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
 * A namespace. The name is empty only for the synthetic global module of a file.
 *
 * @param types the members of the namespace, in declaration order
 */
public record FsModule(String name, ImmutableList<FsType> types) implements FsType {
  public FsModule {
    requireNonNull(name, "name");
    requireNonNull(types, "types");
  }

  @Override
  public Kind getKind() {
    return Kind.MODULE;
  }

  public boolean isGlobal() {
    return name.isEmpty();
  }

  public FsModule withName(String newName) {
    return new FsModule(newName, types);
  }

  public FsModule withTypes(ImmutableList<FsType> newTypes) {
    return new FsModule(name, newTypes);
  }

  public ImmutableList<FsModule> getModules() {
    return types.stream()
        .filter(FsTypes::isModule)
        .map(FsModule.class::cast)
        .collect(ImmutableList.toImmutableList());
  }

  public ImmutableList<FsType> getNonModules() {
    return types.stream()
        .filter(t -> !FsTypes.isModule(t))
        .collect(ImmutableList.toImmutableList());
  }
}
