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

import com.google.common.collect.ImmutableList;

/**
 * Splits TypeScript declaration source into tokens.
 *
 * <p>Comments and whitespace are dropped, including {@code ///} reference directives. Every
 * punctuator is a single character except {@code =>} and {@code ...}, so that nested type
 * arguments such as {@code A<B<C>>} never produce a shift operator.
 */
final class DeclarationScanner {

  enum TokenType {
    IDENTIFIER,
    STRING,
    NUMBER,
    TEMPLATE,
    PUNCTUATOR,
    EOF
  }

  /**
   * A scanned token.
   *
   * @param text the raw source text of the token
   * @param value for strings, the contents without quotes; otherwise the same as {@code text}
   * @param newlineBefore whether a line break separates this token from the previous one
   */
  record Token(
      TokenType type,
      String text,
      String value,
      int start,
      int end,
      int lineno,
      int charno,
      boolean newlineBefore) {

    boolean is(String punctuatorOrWord) {
      return (type == TokenType.PUNCTUATOR || type == TokenType.IDENTIFIER)
          && text.equals(punctuatorOrWord);
    }
  }

  private final String sourceName;
  private final String source;
  private int pos = 0;
  private int lineno = 1;
  private int lineStart = 0;

  DeclarationScanner(String sourceName, String source) {
    this.sourceName = sourceName;
    this.source = source;
  }

  /** Scans the whole source. The last token is always {@link TokenType#EOF}. */
  ImmutableList<Token> scan() {
    ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    while (true) {
      boolean newline = skipWhitespaceAndComments();
      Token token = next(newline);
      tokens.add(token);
      if (token.type() == TokenType.EOF) {
        return tokens.build();
      }
    }
  }

  private Token next(boolean newline) {
    int start = pos;
    int line = lineno;
    int column = pos - lineStart;
    if (pos >= source.length()) {
      return new Token(TokenType.EOF, "", "", start, start, line, column, newline);
    }
    char c = source.charAt(pos);
    if (isIdentifierStart(c) || (c == '#' && pos + 1 < source.length()
        && isIdentifierStart(source.charAt(pos + 1)))) {
      pos++;
      while (pos < source.length() && Character.isJavaIdentifierPart(source.charAt(pos))) {
        pos++;
      }
      String text = source.substring(start, pos);
      return new Token(TokenType.IDENTIFIER, text, text, start, pos, line, column, newline);
    }
    if (isDigit(c) || (c == '.' && pos + 1 < source.length() && isDigit(source.charAt(pos + 1)))) {
      scanNumber();
      String text = source.substring(start, pos);
      return new Token(TokenType.NUMBER, text, text, start, pos, line, column, newline);
    }
    if (c == '"' || c == '\'') {
      String value = scanString(c);
      String text = source.substring(start, pos);
      return new Token(TokenType.STRING, text, value, start, pos, line, column, newline);
    }
    if (c == '`') {
      scanTemplate();
      String text = source.substring(start, pos);
      return new Token(TokenType.TEMPLATE, text, text, start, pos, line, column, newline);
    }
    if (source.startsWith("=>", pos) || source.startsWith("...", pos)) {
      pos += source.startsWith("=>", pos) ? 2 : 3;
    } else {
      pos++;
    }
    String text = source.substring(start, pos);
    return new Token(TokenType.PUNCTUATOR, text, text, start, pos, line, column, newline);
  }

  /** Returns whether a line break was skipped. */
  private boolean skipWhitespaceAndComments() {
    boolean newline = false;
    while (pos < source.length()) {
      char c = source.charAt(pos);
      if (c == '\n') {
        newline = true;
        pos++;
        lineno++;
        lineStart = pos;
      } else if (Character.isWhitespace(c) || c == '\uFEFF') {
        pos++;
      } else if (source.startsWith("//", pos)) {
        while (pos < source.length() && source.charAt(pos) != '\n') {
          pos++;
        }
      } else if (source.startsWith("/*", pos)) {
        int close = source.indexOf("*/", pos + 2);
        if (close < 0) {
          throw error("unterminated comment");
        }
        for (int i = pos; i < close; i++) {
          if (source.charAt(i) == '\n') {
            newline = true;
            lineno++;
            lineStart = i + 1;
          }
        }
        pos = close + 2;
      } else {
        break;
      }
    }
    return newline;
  }

  private void scanNumber() {
    if (source.startsWith("0x", pos) || source.startsWith("0X", pos)
        || source.startsWith("0b", pos) || source.startsWith("0B", pos)
        || source.startsWith("0o", pos) || source.startsWith("0O", pos)) {
      pos += 2;
      while (pos < source.length()
          && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
        pos++;
      }
      return;
    }
    while (pos < source.length()) {
      char c = source.charAt(pos);
      if (isDigit(c) || c == '.' || c == '_') {
        pos++;
      } else if ((c == 'e' || c == 'E') && pos + 1 < source.length()) {
        pos++;
        if (source.charAt(pos) == '+' || source.charAt(pos) == '-') {
          pos++;
        }
      } else {
        break;
      }
    }
    if (pos < source.length() && source.charAt(pos) == 'n') {
      pos++;
    }
  }

  private String scanString(char quote) {
    StringBuilder value = new StringBuilder();
    pos++;
    while (true) {
      if (pos >= source.length() || source.charAt(pos) == '\n') {
        throw error("unterminated string literal");
      }
      char c = source.charAt(pos++);
      if (c == quote) {
        return value.toString();
      }
      if (c == '\\' && pos < source.length()) {
        char escaped = source.charAt(pos++);
        switch (escaped) {
          case 'n':
            value.append('\n');
            break;
          case 't':
            value.append('\t');
            break;
          case 'r':
            value.append('\r');
            break;
          case '\n':
            lineno++;
            lineStart = pos;
            break;
          default:
            value.append(escaped);
        }
      } else {
        value.append(c);
      }
    }
  }

  private void scanTemplate() {
    pos++;
    while (true) {
      if (pos >= source.length()) {
        throw error("unterminated template literal");
      }
      char c = source.charAt(pos++);
      if (c == '\\') {
        pos++;
      } else if (c == '\n') {
        lineno++;
        lineStart = pos;
      } else if (c == '`') {
        return;
      }
    }
  }

  private DeclarationSyntaxException error(String message) {
    return new DeclarationSyntaxException(message, sourceName, lineno, pos - lineStart);
  }

  private static boolean isIdentifierStart(char c) {
    return Character.isJavaIdentifierStart(c);
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }
}
