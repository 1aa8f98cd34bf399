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

package com.google.javascript.ts2fable.parsing;

/** Thrown when declaration source cannot be parsed. */
public class DeclarationSyntaxException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String sourceName;
  private final int lineno;
  private final int charno;

  DeclarationSyntaxException(String message, String sourceName, int lineno, int charno) {
    super(message);
    this.sourceName = sourceName;
    this.lineno = lineno;
    this.charno = charno;
  }

  public String getSourceName() {
    return sourceName;
  }

  /** One-based line number of the offending token. */
  public int getLineno() {
    return lineno;
  }

  /** Zero-based column of the offending token. */
  public int getCharno() {
    return charno;
  }

  /** The message without the source location. */
  public String getDescription() {
    return super.getMessage();
  }

  @Override
  public String getMessage() {
    return sourceName + ":" + lineno + ":" + charno + ": " + super.getMessage();
  }
}
