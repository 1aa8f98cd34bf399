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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class EnumNamesTest {

  @Test
  public void testWordsAreCapitalizedAndJoined() {
    assertThat(EnumNames.normalize("max-age")).isEqualTo("MaxAge");
    assertThat(EnumNames.normalize("no_cache")).isEqualTo("NoCache");
    assertThat(EnumNames.normalize("text/html")).isEqualTo("TextHtml");
  }

  @Test
  public void testValidNamesAreKept() {
    assertThat(EnumNames.normalize("Red")).isEqualTo("Red");
    assertThat(EnumNames.normalize("camelCase")).isEqualTo("CamelCase");
  }

  @Test
  public void testLeadingDigitIsPrefixed() {
    assertThat(EnumNames.normalize("2d")).isEqualTo("_2d");
    assertThat(EnumNames.normalize("3-way")).isEqualTo("_3Way");
  }

  @Test
  public void testNothingAlphanumeric() {
    assertThat(EnumNames.normalize("")).isEqualTo("_");
    assertThat(EnumNames.normalize("--")).isEqualTo("_");
  }
}
