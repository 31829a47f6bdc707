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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import net.hydromatic.kombi.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Various sub-classes of term. */
public class Ast {
  private Ast() {}

  /**
   * Variable, identified by its de Bruijn index.
   *
   * <p>Index 0 refers to the innermost enclosing abstraction, 1 to the one
   * outside it, and so on.
   */
  public static class Variable extends Term {
    public final int idx;

    Variable(Pos pos, int idx) {
      super(pos, Op.VARIABLE);
      checkArgument(idx >= 0, "negative index %s", idx);
      this.idx = idx;
    }

    @Override
    public int hashCode() {
      return idx;
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Variable && idx == ((Variable) o).idx;
    }

    @Override
    TermWriter unparse(TermWriter w, int left, int right) {
      return w.append(Integer.toString(idx));
    }

    @Override
    public <R> R accept(TermVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /**
   * Abstraction, "{@code (λx.body)}" or, in the simply typed calculus, "{@code
   * (λx:T.body)}".
   *
   * <p>The name of the bound variable is retained for diagnostics only; it
   * does not take part in equality.
   */
  public static class Abstraction extends Term {
    public final @Nullable String name;
    public final @Nullable Type argumentType;
    public final Term body;

    Abstraction(
        Pos pos, @Nullable String name, @Nullable Type argumentType, Term body) {
      super(pos, Op.ABSTRACTION);
      this.name = name;
      this.argumentType = argumentType;
      this.body = requireNonNull(body);
    }

    @Override
    public int hashCode() {
      return Objects.hash(argumentType, body);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Abstraction
              && Objects.equals(argumentType, ((Abstraction) o).argumentType)
              && body.equals(((Abstraction) o).body);
    }

    @Override
    TermWriter unparse(TermWriter w, int left, int right) {
      if (left > 0 || right > 0) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      w.append("λ");
      if (argumentType != null) {
        w.append(":").append(argumentType.toString()).append(".");
      }
      return w.append(" ").append(body, 1, 1);
    }

    @Override
    public <R> R accept(TermVisitor<R> visitor) {
      return visitor.visit(this);
    }

    /**
     * Creates a copy of this {@code Abstraction} with a given body, or returns
     * this abstraction if the body is the same.
     */
    public Abstraction copy(Term body) {
      return this.body == body
          ? this
          : new Abstraction(pos, name, argumentType, body);
    }
  }

  /** Application of a function to an argument, "{@code (f a)}". */
  public static class Application extends Term {
    public final Term function;
    public final Term argument;

    Application(Pos pos, Term function, Term argument) {
      super(pos, Op.APPLICATION);
      this.function = requireNonNull(function);
      this.argument = requireNonNull(argument);
    }

    @Override
    public int hashCode() {
      return Objects.hash(function, argument);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Application
              && function.equals(((Application) o).function)
              && argument.equals(((Application) o).argument);
    }

    @Override
    TermWriter unparse(TermWriter w, int left, int right) {
      if (left > 0 || right > 0) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      // "((f a) b)" is written "f a b", the form that the parser folds
      // back into the same tree.
      final Deque<Term> args = new ArrayDeque<>();
      Term head = this;
      while (head instanceof Application) {
        args.push(((Application) head).argument);
        head = ((Application) head).function;
      }
      w.append(head, 0, 1);
      for (Term arg : args) {
        w.append(" ").append(arg, 1, 1);
      }
      return w;
    }

    @Override
    public <R> R accept(TermVisitor<R> visitor) {
      return visitor.visit(this);
    }

    /**
     * Creates a copy of this {@code Application} with given contents, or
     * returns this application if the contents are the same.
     */
    public Application copy(Term function, Term argument) {
      return this.function == function && this.argument == argument
          ? this
          : new Application(pos, function, argument);
    }
  }

  /**
   * Parsed program: a term and, optionally, the type that the author
   * ascribed to it, "{@code (λx:A.x):(A)→A}".
   */
  public static class Program {
    public final Term term;
    public final @Nullable Type type;

    Program(Term term, @Nullable Type type) {
      this.term = requireNonNull(term);
      this.type = type;
    }

    @Override
    public int hashCode() {
      return Objects.hash(term, type);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Program
              && term.equals(((Program) o).term)
              && Objects.equals(type, ((Program) o).type);
    }

    @Override
    public String toString() {
      final String s = Terms.unparse(term);
      return type == null ? s : s + ":" + type;
    }
  }
}

// End Ast.java
