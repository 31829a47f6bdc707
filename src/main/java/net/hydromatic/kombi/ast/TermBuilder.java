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
package net.hydromatic.kombi.ast;

import net.hydromatic.kombi.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds terms. */
public enum TermBuilder {
  /**
   * The singleton instance of the term builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  term;

  /** Creates a variable with a given de Bruijn index. */
  public Ast.Variable variable(Pos pos, int idx) {
    return new Ast.Variable(pos, idx);
  }

  /** Creates a variable with a given de Bruijn index and no position. */
  public Ast.Variable variable(int idx) {
    return variable(Pos.ZERO, idx);
  }

  /** Creates an abstraction. */
  public Ast.Abstraction abstraction(
      Pos pos, @Nullable String name, @Nullable Type argumentType, Term body) {
    return new Ast.Abstraction(pos, name, argumentType, body);
  }

  /** Creates an untyped abstraction. */
  public Ast.Abstraction abstraction(Term body) {
    return abstraction(Pos.ZERO, null, null, body);
  }

  /** Creates a typed abstraction. */
  public Ast.Abstraction abstraction(Type argumentType, Term body) {
    return abstraction(Pos.ZERO, null, argumentType, body);
  }

  /** Creates an application. */
  public Ast.Application apply(Pos pos, Term function, Term argument) {
    return new Ast.Application(pos, function, argument);
  }

  /**
   * Creates an application of a function to one or more arguments.
   *
   * <p>Applications nest to the left: {@code apply(f, a, b)} is {@code ((f a)
   * b)}.
   */
  public Ast.Application apply(Term function, Term argument, Term... more) {
    Ast.Application application =
        apply(function.pos.plus(argument.pos), function, argument);
    for (Term term : more) {
      application = apply(application.pos.plus(term.pos), application, term);
    }
    return application;
  }

  /** Creates a program. */
  public Ast.Program program(Term term, @Nullable Type type) {
    return new Ast.Program(term, type);
  }
}

// End TermBuilder.java
