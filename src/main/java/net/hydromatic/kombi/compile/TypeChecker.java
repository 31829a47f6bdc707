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

import static java.util.Objects.requireNonNull;

import net.hydromatic.kombi.ast.Ast;
import net.hydromatic.kombi.ast.Pos;
import net.hydromatic.kombi.ast.Term;
import net.hydromatic.kombi.type.FnType;
import net.hydromatic.kombi.type.Type;
import net.hydromatic.kombi.type.TypeSystem;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Deduces the type of a term in the simply typed lambda calculus.
 *
 * <p>Every abstraction must declare the type of its argument; there is no
 * inference. An application is well-typed if its function has type {@code
 * (A)→B} and its argument has a type structurally equal to {@code A}; the
 * application then has type {@code B}.
 */
public class TypeChecker {
  private final TypeSystem typeSystem;

  /** Creates a TypeChecker. */
  public TypeChecker(TypeSystem typeSystem) {
    this.typeSystem = requireNonNull(typeSystem);
  }

  /** Deduces the type of a closed term using a fresh type system. */
  public static Type typeOf(Term term) {
    return new TypeChecker(new TypeSystem()).deduceType(term);
  }

  /**
   * Deduces the type of a closed term.
   *
   * @throws TypeException if the term is not well-typed
   */
  public Type deduceType(Term term) {
    return deduceType(term, Context.EMPTY);
  }

  /**
   * Deduces the type of a program's term and, if the program has an
   * ascribed type, checks that the two are equal.
   */
  public Type deduceType(Ast.Program program) {
    final Type type = deduceType(program.term);
    if (program.type != null && !program.type.equals(type)) {
      throw new AscriptionException(program.term, type, program.type);
    }
    return type;
  }

  private Type deduceType(Term term, Context context) {
    switch (term.op) {
      case VARIABLE:
        return context.get(((Ast.Variable) term).idx);

      case ABSTRACTION:
        final Ast.Abstraction abstraction = (Ast.Abstraction) term;
        final @Nullable Type argumentType = abstraction.argumentType;
        if (argumentType == null) {
          throw new MissingTypeException(abstraction);
        }
        final Type resultType =
            deduceType(abstraction.body, context.bind(argumentType));
        return typeSystem.fnType(argumentType, resultType);

      case APPLICATION:
        // Function and argument are checked in the same context.
        final Ast.Application application = (Ast.Application) term;
        final Type functionType = deduceType(application.function, context);
        final Type argType = deduceType(application.argument, context);
        if (functionType instanceof FnType
            && ((FnType) functionType).paramType.equals(argType)) {
          return ((FnType) functionType).resultType;
        }
        throw new InvalidApplicationException(
            application.function, functionType, application.argument, argType);

      default:
        throw new AssertionError("unexpected " + term.op);
    }
  }

  /**
   * Types of the variables bound by the abstractions that enclose the term
   * being checked, innermost first. Immutable.
   */
  private static class Context {
    static final Context EMPTY = new Context(null, null);

    final @Nullable Type type;
    final @Nullable Context parent;

    private Context(@Nullable Type type, @Nullable Context parent) {
      this.type = type;
      this.parent = parent;
    }

    Context bind(Type type) {
      return new Context(type, this);
    }

    Type get(int idx) {
      Context c = this;
      for (int i = 0; i < idx && c.parent != null; i++) {
        c = c.parent;
      }
      if (c.type == null) {
        throw new IllegalStateException("variable " + idx + " is not bound");
      }
      return c.type;
    }
  }

  /** Error while deducing type. */
  public abstract static class TypeException extends CompileException {
    protected TypeException(String message, Pos pos) {
      super(message, pos);
    }
  }

  /**
   * Error that occurs when a function is applied to an argument whose type
   * is not the function's parameter type, or when something that is not a
   * function is applied.
   */
  public static class InvalidApplicationException extends TypeException {
    public final Term function;
    public final Type functionType;
    public final Term argument;
    public final Type argumentType;

    InvalidApplicationException(
        Term function, Type functionType, Term argument, Type argumentType) {
      super(
          "attempted to apply term (" + function + "):" + functionType
              + " to term (" + argument + "):" + argumentType,
          function.pos.plus(argument.pos));
      this.function = function;
      this.functionType = functionType;
      this.argument = argument;
      this.argumentType = argumentType;
    }
  }

  /** Error that occurs when an abstraction does not declare a type. */
  public static class MissingTypeException extends TypeException {
    public final Ast.Abstraction abstraction;

    MissingTypeException(Ast.Abstraction abstraction) {
      super(
          "abstraction (" + abstraction + ") does not declare the type of "
              + "its argument",
          abstraction.pos);
      this.abstraction = abstraction;
    }
  }

  /** Error that occurs when a term does not have its ascribed type. */
  public static class AscriptionException extends TypeException {
    public final Term term;
    public final Type actualType;
    public final Type ascribedType;

    AscriptionException(Term term, Type actualType, Type ascribedType) {
      super(
          "term (" + term + ") has type " + actualType
              + " but was ascribed type " + ascribedType,
          term.pos);
      this.term = term;
      this.actualType = actualType;
      this.ascribedType = ascribedType;
    }
  }
}

// End TypeChecker.java
