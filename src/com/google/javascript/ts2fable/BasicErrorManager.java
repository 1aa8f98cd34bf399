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
import java.util.ArrayList;
import java.util.List;

/**
 * An error manager that collects diagnostics in memory, in reporting order, and prints them
 * when {@link #generateReport()} is called.
 *
 * <p>This error manager does not produce any output itself; subclasses override {@link
 * #println(CheckLevel, TranslationError)} and {@link #printSummary()}.
 */
public abstract class BasicErrorManager implements ErrorManager {
  private final List<TranslationError> errors = new ArrayList<>();
  private final List<TranslationError> warnings = new ArrayList<>();

  @Override
  public void report(CheckLevel level, TranslationError error) {
    switch (level) {
      case ERROR:
        errors.add(error);
        break;
      case WARNING:
        warnings.add(error);
        break;
      case OFF:
        return;
    }
    println(level, error);
  }

  @Override
  public void generateReport() {
    printSummary();
  }

  /** Prints one diagnostic as soon as it is reported. */
  public abstract void println(CheckLevel level, TranslationError error);

  /** Prints the number of errors and warnings. */
  protected abstract void printSummary();

  @Override
  public int getErrorCount() {
    return errors.size();
  }

  @Override
  public int getWarningCount() {
    return warnings.size();
  }

  @Override
  public ImmutableList<TranslationError> getErrors() {
    return ImmutableList.copyOf(errors);
  }

  @Override
  public ImmutableList<TranslationError> getWarnings() {
    return ImmutableList.copyOf(warnings);
  }
}
