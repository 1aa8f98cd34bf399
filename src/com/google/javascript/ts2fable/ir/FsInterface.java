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
 * An interface or class shape.
 *
 * @param isStatic whether this interface was synthesized to hold the static members of another
 *     one
 * @param name the declared name
 * @param typeParameters the type parameters, as {@link FsMapped} names
 * @param inherits the extended and implemented types
 * @param members properties, functions and, for {@code IExports}, variables
 */
public record FsInterface(
    boolean isStatic,
    String name,
    ImmutableList<FsType> typeParameters,
    ImmutableList<FsType> inherits,
    ImmutableList<FsType> members)
    implements FsType {
  public FsInterface {
    requireNonNull(name, "name");
    requireNonNull(typeParameters, "typeParameters");
    requireNonNull(inherits, "inherits");
    requireNonNull(members, "members");
  }

  @Override
  public Kind getKind() {
    return Kind.INTERFACE;
  }

  public FsInterface withName(String newName) {
    return new FsInterface(isStatic, newName, typeParameters, inherits, members);
  }

  public FsInterface withMembers(ImmutableList<FsType> newMembers) {
    return new FsInterface(isStatic, name, typeParameters, inherits, newMembers);
  }

  public boolean hasStaticMembers() {
    return members.stream().anyMatch(FsTypes::isStatic);
  }

  public ImmutableList<FsType> getStaticMembers() {
    return members.stream().filter(FsTypes::isStatic).collect(ImmutableList.toImmutableList());
  }

  public ImmutableList<FsType> getNonStaticMembers() {
    return members.stream()
        .filter(m -> !FsTypes.isStatic(m))
        .collect(ImmutableList.toImmutableList());
  }
}
