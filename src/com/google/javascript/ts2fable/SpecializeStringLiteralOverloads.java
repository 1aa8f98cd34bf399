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

import com.google.javascript.ts2fable.ir.FsFile;
import com.google.javascript.ts2fable.ir.FsFunction;
import com.google.javascript.ts2fable.ir.FsType;
import com.google.javascript.ts2fable.ir.FsTypes;

/**
 * Gives TypeScript overloads on string parameters their own F# members. A function whose first
 * parameter is a string literal type, such as {@code on(event: "click", handler: Handler)},
 * becomes {@code on_click(handler: Handler)} emitting {@code $0.on('click',$1...)}.
 *
 * <p>The specialized name is escaped again when the literal makes it an invalid identifier.
 * Functions without a name are left alone.
 */
final class SpecializeStringLiteralOverloads implements FixPass {

  @Override
  public FsFile process(FsFile file) {
    return FsTypeRewriter.rewriteFile(SpecializeStringLiteralOverloads::specialize, file);
  }

  private static FsType specialize(FsType type) {
    if (!(type instanceof FsFunction fn) || fn.name() == null || fn.params().isEmpty()) {
      return type;
    }
    String literal = FsTypes.asStringLiteral(fn.params().get(0).type());
    if (literal == null) {
      return type;
    }
    String name = ReservedWords.unescape(fn.name());
    return fn.withEmitNameAndParams(
        String.format("$0.%s('%s',$1...)", name, literal),
        ReservedWords.escape(String.format("%s_%s", name, literal)),
        fn.params().subList(1, fn.params().size()));
  }
}
