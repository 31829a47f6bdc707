/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.kombi.parse;

import static java.util.Objects.requireNonNull;

import net.hydromatic.kombi.ast.Pos;

/**
 * Splits text into {@link Token}s.
 *
 * <p>Identifiers are sequences of letters (other than "λ"); indices are
 * sequences of ASCII digits. White space separates tokens and is otherwise
 * ignored.
 */
public class Lexer {
  private final String text;
  private final String file;
  private int offset = 0;
  private int line = 1;
  private int column = 1;

  /** Creates a Lexer. */
  public Lexer(String text, String file) {
    this.text = requireNonNull(text);
    this.file = requireNonNull(file);
  }

  /**
   * Returns the next token, or a token of kind {@link Token.Kind#EOF} if
   * there is no more input.
   *
   * @throws KombiParseException if a character cannot start a token
   */
  public Token next() {
    skipWhitespace();
    final int startLine = line;
    final int startColumn = column;
    if (offset >= text.length()) {
      return new Token(
          Token.Kind.EOF, "", pos(startLine, startColumn, startColumn + 1));
    }
    final int start = offset;
    final int c = text.codePointAt(offset);
    final Token.Kind kind;
    switch (c) {
      case '(':
        kind = Token.Kind.LPAREN;
        advance();
        break;
      case ')':
        kind = Token.Kind.RPAREN;
        advance();
        break;
      case 'λ':
      case '\\':
        kind = Token.Kind.LAMBDA;
        advance();
        break;
      case '.':
        kind = Token.Kind.DOT;
        advance();
        break;
      case ':':
        kind = Token.Kind.COLON;
        advance();
        break;
      case '→':
        kind = Token.Kind.ARROW;
        advance();
        break;
      case '-':
        if (offset + 1 < text.length() && text.charAt(offset + 1) == '>') {
          kind = Token.Kind.ARROW;
          advance();
          advance();
          break;
        }
        throw unexpected(c, startLine, startColumn);
      default:
        if (isIdentifierChar(c)) {
          kind = Token.Kind.IDENTIFIER;
          while (offset < text.length()
              && isIdentifierChar(text.codePointAt(offset))) {
            advance();
          }
        } else if (isDigit(c)) {
          kind = Token.Kind.INDEX;
          while (offset < text.length() && isDigit(text.charAt(offset))) {
            advance();
          }
        } else {
          throw unexpected(c, startLine, startColumn);
        }
    }
    return new Token(
        kind, text.substring(start, offset), pos(startLine, startColumn, column));
  }

  /**
   * Returns whether a code point may occur in an identifier. Letters outside
   * the Basic Multilingual Plane, such as '𝑥', are allowed.
   */
  static boolean isIdentifierChar(int codePoint) {
    return Character.isLetter(codePoint) && codePoint != 'λ';
  }

  private static boolean isDigit(int c) {
    return c >= '0' && c <= '9';
  }

  private KombiParseException unexpected(int codePoint, int line,
      int column) {
    return new KombiParseException(
        "unexpected character '" + new String(Character.toChars(codePoint))
            + "'",
        pos(line, column, column + 1));
  }

  private Pos pos(int startLine, int startColumn, int endColumn) {
    return new Pos(file, startLine, startColumn, startLine, endColumn);
  }

  private void skipWhitespace() {
    while (offset < text.length() && Character.isWhitespace(text.charAt(offset))) {
      advance();
    }
  }

  /** Moves past one code point; columns count code points, not chars. */
  private void advance() {
    final int c = text.codePointAt(offset);
    offset += Character.charCount(c);
    if (c == '\n') {
      ++line;
      column = 1;
    } else {
      ++column;
    }
  }
}

// End Lexer.java
