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

import com.google.javascript.ts2fable.ir.FsAlias;
import com.google.javascript.ts2fable.ir.FsFile;
import com.google.javascript.ts2fable.ir.FsInterface;
import com.google.javascript.ts2fable.ir.FsType;

/** Quotes the type parameters of generic interfaces and aliases over the whole declaration. */
final class QuoteGenericTypeParameters implements FixPass {

  @Override
  public FsFile process(FsFile file) {
    return FsTypeRewriter.rewriteFile(
        type -> {
          if (type instanceof FsInterface it) {
            return TypeParameterQuoting.quote(it.typeParameters(), it);
          } else if (type instanceof FsAlias al) {
            return TypeParameterQuoting.quote(al.typeParameters(), al);
          }
          return type;
        },
        file);
  }
}
