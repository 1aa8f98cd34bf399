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

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableSet;

/** F# keywords and the escaping of identifiers that collide with them. */
public final class ReservedWords {

  static final ImmutableSet<String> KEYWORDS =
      ImmutableSet.of(
          "abstract", "and", "as", "assert", "base", "begin", "class", "default", "delegate",
          "do", "done", "downcast", "downto", "elif", "else", "end", "exception", "extern",
          "false", "finally", "for", "fun", "function", "global", "if", "in", "inherit",
          "inline", "interface", "internal", "lazy", "let", "match", "member", "module",
          "mutable", "namespace", "new", "null", "of", "open", "or", "override", "private",
          "public", "rec", "return", "sig", "static", "struct", "then", "to", "true", "try",
          "type", "upcast", "use", "val", "void", "when", "while", "with", "yield");

  /** Identifiers reserved by F# for future use. */
  static final ImmutableSet<String> RESERVED =
      ImmutableSet.of(
          "atomic", "break", "checked", "component", "const", "constraint", "constructor",
          "continue", "eager", "fixed", "fori", "functor", "include", "measure", "method",
          "mixin", "object", "parallel", "params", "process", "protected", "pure", "recursive",
          "sealed", "tailcall", "trait", "virtual", "volatile");

  private static final CharMatcher IDENTIFIER_CHARS =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.anyOf("_.'"))
          .precomputed();

  private ReservedWords() {}

  public static boolean isReserved(String name) {
    return KEYWORDS.contains(name) || RESERVED.contains(name);
  }

  /**
   * Wraps {@code name} in double backticks when it is not usable as a plain F# identifier: when
   * it is a keyword or reserved word, starts with a digit, or contains characters other than
   * ASCII letters, digits, {@code _}, {@code .} and {@code '}.
   */
  public static String escape(String name) {
    if (name.isEmpty()) {
      return name;
    }
    if (isReserved(name)
        || !IDENTIFIER_CHARS.matchesAllOf(name)
        || CharMatcher.inRange('0', '9').matches(name.charAt(0))) {
      return "``" + name + "``";
    }
    return name;
  }

  /** Removes the double backticks added by {@link #escape}, if any. */
  public static String unescape(String name) {
    if (name.length() > 4 && name.startsWith("``") && name.endsWith("``")) {
      return name.substring(2, name.length() - 2);
    }
    return name;
  }
}
