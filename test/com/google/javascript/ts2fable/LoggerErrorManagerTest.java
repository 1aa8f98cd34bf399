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

import static com.google.common.truth.Truth.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class LoggerErrorManagerTest {

  private static final DiagnosticType ERROR = DiagnosticType.error("TEST_ERROR", "bad {0}");
  private static final DiagnosticType WARNING =
      DiagnosticType.warning("TEST_WARNING", "odd {0} at {1}");

  private final Logger logger = Logger.getLogger(LoggerErrorManagerTest.class.getName());
  private final List<LogRecord> records = new ArrayList<>();
  private final Handler handler =
      new Handler() {
        @Override
        public void publish(LogRecord record) {
          records.add(record);
        }

        @Override
        public void flush() {}

        @Override
        public void close() {}
      };

  @Before
  public void setUp() {
    logger.setUseParentHandlers(false);
    logger.addHandler(handler);
  }

  @After
  public void tearDown() {
    logger.removeHandler(handler);
    logger.setUseParentHandlers(true);
  }

  @Test
  public void testErrorsAndWarningsAreCollectedAndLogged() {
    LoggerErrorManager errorManager = new LoggerErrorManager(logger);
    TranslationError error = TranslationError.make(ERROR, "thing");
    TranslationError warning = TranslationError.make("a.d.ts", 3, 7, WARNING, "x", "y");
    errorManager.report(CheckLevel.ERROR, error);
    errorManager.report(CheckLevel.WARNING, warning);
    errorManager.report(CheckLevel.OFF, warning);

    assertThat(errorManager.getErrors()).containsExactly(error);
    assertThat(errorManager.getWarnings()).containsExactly(warning);
    assertThat(records).hasSize(2);
    assertThat(records.get(0).getLevel()).isEqualTo(Level.SEVERE);
    assertThat(records.get(0).getMessage()).isEqualTo("ERROR - [TEST_ERROR] bad thing");
    assertThat(records.get(1).getLevel()).isEqualTo(Level.WARNING);
    assertThat(records.get(1).getMessage())
        .isEqualTo("a.d.ts:3:7: WARNING - [TEST_WARNING] odd x at y");
  }

  @Test
  public void testSummary() {
    LoggerErrorManager errorManager = new LoggerErrorManager(logger);
    errorManager.generateReport();
    assertThat(records.get(0).getLevel()).isEqualTo(Level.INFO);

    errorManager.report(CheckLevel.WARNING, TranslationError.make(WARNING, "x", "y"));
    records.clear();
    errorManager.generateReport();
    assertThat(records.get(0).getLevel()).isEqualTo(Level.WARNING);
    assertThat(records.get(0).getParameters()).asList().containsExactly(0, 1).inOrder();
  }

  @Test
  public void testDiagnosticTypesCompareByKey() {
    assertThat(DiagnosticType.error("TEST_ERROR", "other")).isEqualTo(ERROR);
    assertThat(ERROR.compareTo(WARNING)).isLessThan(0);
    assertThat(ERROR.level).isEqualTo(CheckLevel.ERROR);
    assertThat(CheckLevel.OFF.isOn()).isFalse();
  }
}
