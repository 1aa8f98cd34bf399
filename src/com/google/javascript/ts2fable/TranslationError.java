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

import static java.util.Objects.requireNonNull;

import java.io.Serializable;
import org.jspecify.annotations.Nullable;

/**
 * Translation error description.
 *
 * @param type A type of the error.
 * @param description Description of the error.
 * @param sourceName Name of the source
 * @param lineno One-indexed line number of the error location, or -1 if unknown.
 * @param charno Zero-indexed character number of the error location, or -1 if unknown.
 * @param defaultLevel The level the error is reported at.
 */
public record TranslationError(
    DiagnosticType type,
    String description,
    @Nullable String sourceName,
    int lineno,
    int charno,
    CheckLevel defaultLevel)
    implements Serializable {
  public TranslationError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(defaultLevel, "defaultLevel");
  }

  private static final int DEFAULT_LINENO = -1;
  private static final int DEFAULT_CHARNO = -1;

  /**
   * Creates a TranslationError with no source information
   *
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static TranslationError make(DiagnosticType type, String... arguments) {
    return new TranslationError(
        type, type.format(arguments), null, DEFAULT_LINENO, DEFAULT_CHARNO, type.level);
  }

  /**
   * Creates a TranslationError at a given source location
   *
   * @param sourceName The source file name
   * @param lineno Line number with source file, or -1 if unknown
   * @param charno Column number within line, or -1 for whole line.
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static TranslationError make(
      String sourceName, int lineno, int charno, DiagnosticType type, String... arguments) {
    return new TranslationError(
        type, type.format(arguments), sourceName, lineno, charno, type.level);
  }

  /** Formats this error as {@code source:line:column: LEVEL - [KEY] description}. */
  public String format(CheckLevel level) {
    StringBuilder b = new StringBuilder();
    if (sourceName != null) {
      b.append(sourceName);
      if (lineno > 0) {
        b.append(':').append(lineno);
        if (charno >= 0) {
          b.append(':').append(charno);
        }
      }
      b.append(": ");
    }
    b.append(level).append(" - [").append(type.key).append("] ").append(description);
    return b.toString();
  }

  @Override
  public String toString() {
    return format(defaultLevel);
  }
}
