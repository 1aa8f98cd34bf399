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
 * A binding to a value living in an external JavaScript namespace.
 *
 * @param namespace the segments of the enclosing namespace path
 * @param variable the name of the bound value
 * @param type the already printed F# type of the value
 */
public record FsImport(ImmutableList<String> namespace, String variable, String type)
    implements FsType {
  public FsImport {
    requireNonNull(namespace, "namespace");
    requireNonNull(variable, "variable");
    requireNonNull(type, "type");
  }

  @Override
  public Kind getKind() {
    return Kind.IMPORT;
  }

  public FsImport withNamespace(ImmutableList<String> newNamespace) {
    return new FsImport(newNamespace, variable, type);
  }
}
