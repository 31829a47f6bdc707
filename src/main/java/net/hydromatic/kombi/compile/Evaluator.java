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
package net.hydromatic.kombi.compile;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.kombi.ast.TermBuilder.term;

import net.hydromatic.kombi.ast.Ast;
import net.hydromatic.kombi.ast.Term;
import net.hydromatic.kombi.ast.TermVisitor;
import net.hydromatic.kombi.ast.Terms;
import net.hydromatic.kombi.parse.KombiParser;
import net.hydromatic.kombi.type.Type;
import net.hydromatic.kombi.type.TypeSystem;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Parses, checks and reduces programs.
 *
 * <p>Used by both the command line and the interactive shell. The phases can
 * be invoked one at a time ({@link #parse}, {@link #apply}, {@link #check},
 * {@link #reduce}) or all together ({@link #evaluate}).
 */
public class Evaluator {
  private final TypeSystem typeSystem;
  private final Tracer tracer;
  private final int maxSteps;

  /**
   * Creates an Evaluator.
   *
   * @param typeSystem Type system
   * @param tracer Tracer
   * @param maxSteps Maximum number of β-steps, or {@link Reducer#UNBOUNDED}
   */
  public Evaluator(TypeSystem typeSystem, Tracer tracer, int maxSteps) {
    this.typeSystem = requireNonNull(typeSystem);
    this.tracer = requireNonNull(tracer);
    this.maxSteps = maxSteps;
  }

  /** Parses a program. */
  public Ast.Program parse(String text, String file) {
    final Ast.Program program =
        new KombiParser(typeSystem, text, file).program();
    tracer.onParse(program.term);
    return program;
  }

  /**
   * Returns the term to evaluate: the program's term, applied to the
   * argument's term if there is an argument.
   */
  public Term apply(Ast.Program program, Ast.@Nullable Program arg) {
    // The program and argument may come from different files; the
    // application takes the program's position.
    return arg == null
        ? program.term
        : term.apply(program.term.pos, program.term, arg.term);
  }

  /**
   * Checks the type of the term to evaluate, and of each program that has an
   * ascribed type.
   *
   * <p>Returns null if the term is untyped (no abstraction declares a type).
   * A term that mixes typed and untyped abstractions is an error.
   *
   * @throws TypeChecker.TypeException if the term is not well-typed
   */
  public @Nullable Type check(
      Ast.Program program, Ast.@Nullable Program arg, Term term) {
    if (Terms.abstractionCount(term) > 0 && Terms.isUntyped(term)) {
      checkNotAscribed(program);
      checkNotAscribed(arg);
      return null;
    }
    final TypeChecker typeChecker = new TypeChecker(typeSystem);
    typeChecker.deduceType(program);
    if (arg != null) {
      typeChecker.deduceType(arg);
    }
    final Type type = typeChecker.deduceType(term);
    tracer.onType(type);
    return type;
  }

  private static void checkNotAscribed(Ast.@Nullable Program program) {
    if (program != null && program.type != null) {
      final Ast.Abstraction abstraction =
          program.term.accept(new FirstUntypedAbstractionFinder());
      throw new TypeChecker.MissingTypeException(requireNonNull(abstraction));
    }
  }

  /**
   * Reduces a term to normal form.
   *
   * @throws IllegalArgumentException if the term is not closed
   */
  public Term reduce(Term term) {
    checkArgument(Terms.isClosed(term), "term is not closed: %s", term);
    return new Reducer(tracer, maxSteps).reduce(term);
  }

  /**
   * Applies, checks and reduces.
   *
   * <p>The type is checked before reduction, on the term as written.
   */
  public Result evaluate(Ast.Program program, Ast.@Nullable Program arg) {
    try {
      final Term term = apply(program, arg);
      final @Nullable Type type = check(program, arg, term);
      final Term result = reduce(term);
      return new Result(term, result, type);
    } catch (RuntimeException e) {
      tracer.onException(e);
      throw e;
    }
  }

  /** Parses, applies, checks and reduces. */
  public Result evaluate(String text, String file) {
    return evaluate(parse(text, file), null);
  }

  /** Finds the first abstraction that does not declare a type. */
  private static class FirstUntypedAbstractionFinder
      extends TermVisitor<Ast.Abstraction> {
    @Override
    public Ast.Abstraction visit(Ast.Abstraction abstraction) {
      return abstraction.argumentType == null
          ? abstraction
          : super.visit(abstraction);
    }

    @Override
    public Ast.Abstraction visit(Ast.Application application) {
      final Ast.Abstraction abstraction = application.function.accept(this);
      return abstraction != null
          ? abstraction
          : application.argument.accept(this);
    }
  }

  /** Result of evaluating a term. */
  public static class Result {
    /** The term before reduction. */
    public final Term term;
    /** The normal form. */
    public final Term normalForm;
    /** The type, or null if the term is untyped. */
    public final @Nullable Type type;

    public Result(Term term, Term normalForm, @Nullable Type type) {
      this.term = requireNonNull(term);
      this.normalForm = requireNonNull(normalForm);
      this.type = type;
    }

    /**
     * Describes the normal form, and its type if typed, as text that the
     * parser accepts; for example "{@code (λ:A. 0):(A)→A}". In debug mode,
     * uses the structural form of both.
     */
    public String describe(boolean debug) {
      final StringBuilder buf = new StringBuilder();
      if (debug) {
        buf.append('(').append(Terms.debug(normalForm)).append(')');
        if (type != null) {
          buf.append(':').append(Terms.debug(type));
        }
      } else {
        buf.append(Terms.unparse(normalForm));
        if (type != null) {
          buf.append(':').append(type);
        }
      }
      return buf.toString();
    }

    @Override
    public String toString() {
      return describe(false);
    }
  }
}

// End Evaluator.java
