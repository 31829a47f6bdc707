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
import static net.hydromatic.kombi.ast.TermBuilder.term;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.kombi.ast.Ast;
import net.hydromatic.kombi.ast.Pos;
import net.hydromatic.kombi.ast.Term;
import net.hydromatic.kombi.type.Type;
import net.hydromatic.kombi.type.TypeSystem;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Recursive-descent parser for lambda terms.
 *
 * <p>The grammar is as follows:
 *
 * <pre>{@code
 * program     := term [ ":" type ] EOF
 * term        := identifier | index | abstraction | application
 * abstraction := "(" lambda [ identifier ] [ ":" type ] [ "." ] term ")"
 * application := "(" term term { term } ")"
 * lambda      := "λ" | "\"
 * type        := identifier | "(" type ")" arrow type
 * arrow       := "→" | "->"
 * }</pre>
 *
 * <p>Identifiers are resolved to de Bruijn indices as they are parsed; an
 * identifier that is not bound by an enclosing abstraction is an error. An
 * index is taken literally, but must be less than the number of enclosing
 * abstractions.
 *
 * <p>An application of more than one argument nests to the left: "{@code (f a
 * b)}" is the same term as "{@code ((f a) b)}".
 *
 * <p>A parser reads one piece of text and is not thread-safe.
 */
public class KombiParser {
  private final TypeSystem typeSystem;
  private final Lexer lexer;
  private Token token;

  /** Creates a parser. */
  public KombiParser(TypeSystem typeSystem, String text, String file) {
    this.typeSystem = requireNonNull(typeSystem);
    this.lexer = new Lexer(text, file);
    this.token = lexer.next();
  }

  /** Parses a term. */
  public static Term parse(String text) {
    return new KombiParser(new TypeSystem(), text, "").termEof();
  }

  /** Parses a program; that is, a term with an optional type ascription. */
  public static Ast.Program parseProgram(String text) {
    return new KombiParser(new TypeSystem(), text, "").program();
  }

  /** Parses a program, then checks that there is no more input. */
  public Ast.Program program() {
    final Term t = term(Scope.EMPTY);
    @Nullable Type type = null;
    if (token.kind == Token.Kind.COLON) {
      advance();
      type = type();
    }
    expectEof();
    return term.program(t, type);
  }

  /** Parses a term, then checks that there is no more input. */
  public Term termEof() {
    final Term t = term(Scope.EMPTY);
    expectEof();
    return t;
  }

  /** Parses a term in a given scope. */
  Term term(Scope scope) {
    final Token t = token;
    switch (t.kind) {
      case IDENTIFIER:
        advance();
        final int idx = scope.indexOf(t.text);
        if (idx < 0) {
          throw new UnboundVariableException(t.text, t.pos);
        }
        return term.variable(t.pos, idx);

      case INDEX:
        advance();
        final int index = parseIndex(t);
        if (index >= scope.depth) {
          throw new UnboundVariableException(t.text, t.pos);
        }
        return term.variable(t.pos, index);

      case LPAREN:
        advance();
        if (token.kind == Token.Kind.LAMBDA) {
          advance();
          return abstraction(t.pos, scope);
        }
        return application(t.pos, scope);

      default:
        throw unexpected("term");
    }
  }

  /**
   * Parses the rest of an abstraction, having consumed "(" and "λ". The body
   * is parsed in a scope that has one more binder.
   */
  private Term abstraction(Pos startPos, Scope scope) {
    @Nullable String name = null;
    if (token.kind == Token.Kind.IDENTIFIER) {
      name = token.text;
      advance();
    }
    @Nullable Type argumentType = null;
    if (token.kind == Token.Kind.COLON) {
      advance();
      argumentType = type();
    }
    if (token.kind == Token.Kind.DOT) {
      advance();
    }
    if (token.kind == Token.Kind.RPAREN || token.kind == Token.Kind.EOF) {
      throw new KombiParseException(
          "abstraction has no body; expected term but found " + token,
          token.pos);
    }
    final Term body = term(scope.bind(name));
    final Pos pos = startPos.plus(expect(Token.Kind.RPAREN).pos);
    return term.abstraction(pos, name, argumentType, body);
  }

  /**
   * Parses the rest of an application, having consumed "(". The function and
   * each argument are parsed in the same scope.
   */
  private Term application(Pos startPos, Scope scope) {
    final Term function = term(scope);
    if (token.kind == Token.Kind.RPAREN) {
      throw new KombiParseException(
          "application requires a function and at least one argument",
          startPos.plus(token.pos));
    }
    final List<Term> arguments = new ArrayList<>();
    do {
      arguments.add(term(scope));
    } while (token.kind != Token.Kind.RPAREN && token.kind != Token.Kind.EOF);
    final Pos endPos = startPos.plus(expect(Token.Kind.RPAREN).pos);
    Term t = function;
    for (int i = 0; i < arguments.size(); i++) {
      final Term argument = arguments.get(i);
      final Pos pos =
          i == arguments.size() - 1 ? endPos : startPos.plus(argument.pos);
      t = term.apply(pos, t, argument);
    }
    return t;
  }

  /** Parses a type. */
  Type type() {
    switch (token.kind) {
      case IDENTIFIER:
        final String name = token.text;
        advance();
        return typeSystem.baseType(name);

      case LPAREN:
        advance();
        final Type paramType = type();
        expect(Token.Kind.RPAREN);
        expect(Token.Kind.ARROW);
        final Type resultType = type();
        return typeSystem.fnType(paramType, resultType);

      default:
        throw unexpected("type");
    }
  }

  private static int parseIndex(Token t) {
    try {
      return Integer.parseInt(t.text);
    } catch (NumberFormatException e) {
      throw new KombiParseException("index " + t.text + " is too large", t.pos);
    }
  }

  private void advance() {
    token = lexer.next();
  }

  /** Consumes a token of a given kind, or throws. Returns the token. */
  private Token expect(Token.Kind kind) {
    if (token.kind != kind) {
      if (kind == Token.Kind.RPAREN && token.kind == Token.Kind.EOF) {
        throw new KombiParseException("missing closing parenthesis", token.pos);
      }
      throw unexpected("\"" + kind.description + "\"");
    }
    final Token t = token;
    advance();
    return t;
  }

  private void expectEof() {
    if (token.kind != Token.Kind.EOF) {
      throw new KombiParseException(
          "unexpected " + token + " after end of term", token.pos);
    }
  }

  private KombiParseException unexpected(String expected) {
    return new KombiParseException(
        "expected " + expected + " but found " + token, token.pos);
  }
}

// End KombiParser.java
