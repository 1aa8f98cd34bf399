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

import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;

/** Turns enum case names into F# union case identifiers. */
public final class EnumNames {

  private static final Splitter WORDS =
      Splitter.on(
              CharMatcher.inRange('a', 'z')
                  .or(CharMatcher.inRange('A', 'Z'))
                  .or(CharMatcher.inRange('0', '9'))
                  .negate())
          .omitEmptyStrings();

  private EnumNames() {}

  /**
   * Capitalizes every alphanumeric run of {@code name} and joins the runs. A result that is empty
   * or starts with a digit is prefixed with {@code _}. For example {@code "max-age"} becomes
   * {@code MaxAge} and {@code "2d"} becomes {@code _2d}.
   */
  public static String normalize(String name) {
    StringBuilder b = new StringBuilder();
    for (String word : WORDS.split(name)) {
      b.append(Ascii.toUpperCase(word.charAt(0))).append(word, 1, word.length());
    }
    if (b.length() == 0 || CharMatcher.inRange('0', '9').matches(b.charAt(0))) {
      b.insert(0, '_');
    }
    return b.toString();
  }
}
