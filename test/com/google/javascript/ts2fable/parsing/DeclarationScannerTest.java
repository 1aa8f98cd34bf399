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

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.javascript.ts2fable.parsing.DeclarationScanner.Token;
import com.google.javascript.ts2fable.parsing.DeclarationScanner.TokenType;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class DeclarationScannerTest {

  private static ImmutableList<Token> scan(String source) {
    return new DeclarationScanner("test.d.ts", source).scan();
  }

  private static ImmutableList<String> texts(String source) {
    return scan(source).stream().map(Token::text).collect(toImmutableList());
  }

  @Test
  public void testNestedTypeArgumentsDoNotFormShiftOperators() {
    assertThat(texts("let x: A<B<C>> = 1;"))
        .containsExactly("let", "x", ":", "A", "<", "B", "<", "C", ">", ">", "=", "1", ";", "")
        .inOrder();
  }

  @Test
  public void testArrowAndSpreadAreSingleTokens() {
    assertThat(texts("(...args) => void"))
        .containsExactly("(", "...", "args", ")", "=>", "void", "")
        .inOrder();
  }

  @Test
  public void testCommentsAreSkipped() {
    assertThat(texts("/// <reference path=\"x.d.ts\" />\nfoo /* a */ bar // b"))
        .containsExactly("foo", "bar", "")
        .inOrder();
  }

  @Test
  public void testStringValueIsUnescaped() {
    Token string = scan("'a\\'b\\n'").get(0);
    assertThat(string.type()).isEqualTo(TokenType.STRING);
    assertThat(string.text()).isEqualTo("'a\\'b\\n'");
    assertThat(string.value()).isEqualTo("a'b\n");
  }

  @Test
  public void testNumbers() {
    ImmutableList<Token> tokens = scan("0x1F 1_000n 1.5e-3 .5");
    assertThat(tokens.stream().map(Token::type).collect(toImmutableList()))
        .containsExactly(
            TokenType.NUMBER, TokenType.NUMBER, TokenType.NUMBER, TokenType.NUMBER, TokenType.EOF)
        .inOrder();
    assertThat(tokens.get(1).text()).isEqualTo("1_000n");
    assertThat(tokens.get(2).text()).isEqualTo("1.5e-3");
  }

  @Test
  public void testTemplateLiteral() {
    Token template = scan("`a${b}\nc`").get(0);
    assertThat(template.type()).isEqualTo(TokenType.TEMPLATE);
    assertThat(template.text()).isEqualTo("`a${b}\nc`");
  }

  @Test
  public void testLocationAfterMultilineComment() {
    Token b = scan("a\n/* x\n */ b").get(1);
    assertThat(b.text()).isEqualTo("b");
    assertThat(b.lineno()).isEqualTo(3);
    assertThat(b.charno()).isEqualTo(4);
    assertThat(b.newlineBefore()).isTrue();
  }

  @Test
  public void testNewlineBefore() {
    ImmutableList<Token> tokens = scan("a b\nc");
    assertThat(tokens.get(1).newlineBefore()).isFalse();
    assertThat(tokens.get(2).newlineBefore()).isTrue();
  }

  @Test
  public void testPrivateNameIsIdentifier() {
    Token name = scan("#secret").get(0);
    assertThat(name.type()).isEqualTo(TokenType.IDENTIFIER);
    assertThat(name.text()).isEqualTo("#secret");
  }

  @Test
  public void testIsMatchesOnlyWordsAndPunctuators() {
    ImmutableList<Token> tokens = scan("interface \"interface\"");
    assertThat(tokens.get(0).is("interface")).isTrue();
    assertThat(tokens.get(1).is("interface")).isFalse();
  }

  @Test
  public void testUnterminatedString() {
    DeclarationSyntaxException e =
        assertThrows(DeclarationSyntaxException.class, () -> scan("let x = 'abc\n'"));
    assertThat(e.getDescription()).isEqualTo("unterminated string literal");
    assertThat(e.getLineno()).isEqualTo(1);
  }

  @Test
  public void testUnterminatedComment() {
    DeclarationSyntaxException e =
        assertThrows(DeclarationSyntaxException.class, () -> scan("a /* b"));
    assertThat(e.getMessage()).isEqualTo("test.d.ts:1:2: unterminated comment");
  }
}
