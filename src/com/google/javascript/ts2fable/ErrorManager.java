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

import com.google.common.collect.ImmutableList;

/** The error handler used during translation. */
public interface ErrorManager {

  /**
   * Reports an error or a warning. Errors at {@link CheckLevel#OFF} are dropped.
   *
   * @param level the reporting level
   * @param error the error to report
   */
  void report(CheckLevel level, TranslationError error);

  /** Writes a report of everything collected so far. */
  void generateReport();

  int getErrorCount();

  int getWarningCount();

  ImmutableList<TranslationError> getErrors();

  ImmutableList<TranslationError> getWarnings();
}
