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

/**
 * A node of the simplified F# syntax tree that declarations are lowered into.
 *
 * <p>The set of implementations is closed: every variant is one of the records in this package
 * and is identified by its {@link Kind}. Nodes are immutable and own their children, so a tree
 * can be rewritten by building a new one.
 */
public interface FsType {

  /** The tag of an IR variant. */
  enum Kind {
    INTERFACE,
    ENUM,
    PROPERTY,
    PARAM,
    ARRAY,
    TODO,
    NONE,
    MAPPED,
    FUNCTION,
    UNION,
    ALIAS,
    GENERIC,
    TUPLE,
    MODULE,
    FILE,
    VARIABLE,
    STRING_LITERAL,
    IMPORT,
    THIS
  }

  Kind getKind();
}
