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

/** Token produced by the {@link Lexer}. */
public class Token {
  public final Kind kind;
  public final String text;
  public final Pos pos;

  Token(Kind kind, String text, Pos pos) {
    this.kind = requireNonNull(kind);
    this.text = requireNonNull(text);
    this.pos = requireNonNull(pos);
  }

  @Override
  public String toString() {
    return kind == Kind.EOF ? "<EOF>" : "\"" + text + "\"";
  }

  /** Kind of token. */
  public enum Kind {
    LPAREN("("),
    RPAREN(")"),
    /** "λ" or "\". */
    LAMBDA("λ"),
    DOT("."),
    COLON(":"),
    /** "→" or "->". */
    ARROW("→"),
    IDENTIFIER("identifier"),
    /** De Bruijn index, a sequence of digits. */
    INDEX("index"),
    EOF("<EOF>");

    /** How the token is described in error messages. */
    public final String description;

    Kind(String description) {
      this.description = description;
    }
  }
}

// End Token.java
