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
import static com.google.common.truth.Truth.assertWithMessage;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ReservedWordsTest {

  @Test
  public void testKeywordsAreEscaped() {
    for (String keyword : ReservedWords.KEYWORDS) {
      assertWithMessage(keyword)
          .that(ReservedWords.escape(keyword))
          .isEqualTo("``" + keyword + "``");
    }
    assertThat(ReservedWords.escape("type")).isEqualTo("``type``");
  }

  @Test
  public void testReservedIdentifiersAreEscaped() {
    assertThat(ReservedWords.isReserved("constructor")).isTrue();
    assertThat(ReservedWords.escape("process")).isEqualTo("``process``");
  }

  @Test
  public void testInvalidCharactersAreEscaped() {
    assertThat(ReservedWords.escape("$")).isEqualTo("``$``");
    assertThat(ReservedWords.escape("foo-bar")).isEqualTo("``foo-bar``");
    assertThat(ReservedWords.escape("2d")).isEqualTo("``2d``");
  }

  @Test
  public void testPlainIdentifiersAreKept() {
    assertThat(ReservedWords.escape("value")).isEqualTo("value");
    assertThat(ReservedWords.escape("Foo.Bar")).isEqualTo("Foo.Bar");
    assertThat(ReservedWords.escape("'T")).isEqualTo("'T");
    assertThat(ReservedWords.escape("_private1")).isEqualTo("_private1");
    assertThat(ReservedWords.escape("")).isEmpty();
  }

  @Test
  public void testUnescape() {
    assertThat(ReservedWords.unescape("``type``")).isEqualTo("type");
    assertThat(ReservedWords.unescape("``foo-bar``")).isEqualTo("foo-bar");
    assertThat(ReservedWords.unescape("value")).isEqualTo("value");
    assertThat(ReservedWords.unescape("````")).isEqualTo("````");
  }
}
