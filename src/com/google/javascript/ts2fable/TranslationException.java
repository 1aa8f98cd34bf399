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

/**
 * Thrown when a problem makes the translation of a file impossible. The translator reports the
 * carried error and produces no output for the file.
 */
public class TranslationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final TranslationError error;

  public TranslationException(TranslationError error) {
    super(error.toString());
    this.error = error;
  }

  public TranslationException(TranslationError error, Throwable cause) {
    super(error.toString(), cause);
    this.error = error;
  }

  public TranslationError getError() {
    return error;
  }
}
