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

import static com.google.common.collect.ImmutableSet.toImmutableSet;

import com.google.common.collect.ImmutableSet;
import com.google.javascript.ts2fable.ir.FsMapped;
import com.google.javascript.ts2fable.ir.FsType;
import com.google.javascript.ts2fable.ir.FsTypes;
import java.util.List;

/** Marks references to generic type parameters with the F# tick: {@code T} becomes {@code 'T}. */
final class TypeParameterQuoting {

  private TypeParameterQuoting() {}

  /**
   * Rewrites every mapped name inside {@code type} that equals one of {@code typeParameters},
   * including the parameter declarations themselves.
   */
  static FsType quote(List<FsType> typeParameters, FsType type) {
    if (typeParameters.isEmpty()) {
      return type;
    }
    ImmutableSet<String> names =
        typeParameters.stream().map(CodePrinter::printType).collect(toImmutableSet());
    return FsTypeRewriter.rewrite(
        t ->
            t instanceof FsMapped mapped && names.contains(mapped.name())
                ? FsTypes.mapped("'" + mapped.name())
                : t,
        type);
  }
}
