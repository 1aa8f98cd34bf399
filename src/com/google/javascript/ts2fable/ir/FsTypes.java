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

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/** Construction and inspection helpers for {@link FsType} trees. */
public final class FsTypes {

  public static final FsMapped OBJ = new FsMapped("obj");
  public static final FsMapped UNIT = new FsMapped("unit");
  public static final FsMapped STRING = new FsMapped("string");
  public static final FsMapped FLOAT = new FsMapped("float");
  public static final FsMapped BOOL = new FsMapped("bool");

  private FsTypes() {}

  public static FsMapped mapped(String name) {
    return new FsMapped(name);
  }

  public static FsGeneric generic(FsType type, ImmutableList<FsType> typeParameters) {
    return new FsGeneric(type, typeParameters);
  }

  public static FsModule module(String name, FsType... types) {
    return new FsModule(name, ImmutableList.copyOf(types));
  }

  public static FsInterface emptyInterface(String name) {
    return new FsInterface(false, name, ImmutableList.of(), ImmutableList.of(), ImmutableList.of());
  }

  public static @Nullable FsFunction asFunction(FsType type) {
    return type instanceof FsFunction ? (FsFunction) type : null;
  }

  public static @Nullable FsInterface asInterface(FsType type) {
    return type instanceof FsInterface ? (FsInterface) type : null;
  }

  public static @Nullable FsGeneric asGeneric(FsType type) {
    return type instanceof FsGeneric ? (FsGeneric) type : null;
  }

  public static @Nullable FsModule asModule(FsType type) {
    return type instanceof FsModule ? (FsModule) type : null;
  }

  /** Returns the literal value if {@code type} is a string literal type. */
  public static @Nullable String asStringLiteral(FsType type) {
    return type instanceof FsStringLiteral ? ((FsStringLiteral) type).value() : null;
  }

  public static boolean isModule(FsType type) {
    return type.getKind() == FsType.Kind.MODULE;
  }

  public static boolean isFunction(FsType type) {
    return type.getKind() == FsType.Kind.FUNCTION;
  }

  public static boolean isStringLiteral(FsType type) {
    return type.getKind() == FsType.Kind.STRING_LITERAL;
  }

  /** Whether a member belongs on the static side of a class. */
  public static boolean isStatic(FsType type) {
    switch (type.getKind()) {
      case FUNCTION:
        return ((FsFunction) type).isStatic();
      case PROPERTY:
        return ((FsProperty) type).isStatic();
      case INTERFACE:
        return ((FsInterface) type).isStatic();
      default:
        return false;
    }
  }
}
