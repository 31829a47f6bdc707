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

import com.google.common.base.MoreObjects;
import net.hydromatic.kombi.type.BaseType;
import net.hydromatic.kombi.type.FnType;
import net.hydromatic.kombi.type.Type;
import net.hydromatic.kombi.type.TypeVisitor;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for {@link Term}. */
public abstract class Terms {
  private Terms() {}

  /**
   * Converts a term to text that the parser accepts.
   *
   * <p>Unlike {@link Term#toString()}, an abstraction or application at the
   * top level is enclosed in parentheses; for example, the identity function
   * is "{@code (λ 0)}".
   */
  public static String unparse(Term term) {
    return term.unparse(new TermWriter(), 1, 1).toString();
  }

  /**
   * Converts a term to a structural description, for debugging; for example,
   * the identity function is "{@code Abstraction{body=Variable{idx=0}}}".
   */
  public static String debug(Term term) {
    return term.accept(DebugVisitor.INSTANCE);
  }

  /**
   * Converts a type to a structural description, for debugging; for example,
   * "{@code FnType{paramType=BaseType{name=A}, resultType=BaseType{name=A}}}".
   */
  public static String debug(Type type) {
    return type.accept(TypeDebugVisitor.INSTANCE);
  }

  /** Returns the number of abstractions in a term. */
  public static int abstractionCount(Term term) {
    final int[] counts = new int[2];
    countAbstractions(term, counts);
    return counts[0];
  }

  /**
   * Returns whether every abstraction in a term declares the type of its
   * argument. A term with no abstractions is typed.
   */
  public static boolean isTyped(Term term) {
    final int[] counts = new int[2];
    countAbstractions(term, counts);
    return counts[1] == counts[0];
  }

  /**
   * Returns whether no abstraction in a term declares the type of its
   * argument. A term with no abstractions is untyped.
   */
  public static boolean isUntyped(Term term) {
    final int[] counts = new int[2];
    countAbstractions(term, counts);
    return counts[1] == 0;
  }

  /**
   * Returns whether a term is closed; that is, every variable refers to an
   * enclosing abstraction.
   */
  public static boolean isClosed(Term term) {
    return freeDepth(term, 0) <= 0;
  }

  /**
   * Returns how many abstractions would need to enclose a term, at a given
   * depth, for every variable to be bound. Zero or less if the term is
   * closed at that depth.
   */
  private static int freeDepth(Term term, int depth) {
    switch (term.op) {
      case VARIABLE:
        return ((Ast.Variable) term).idx + 1 - depth;
      case ABSTRACTION:
        return freeDepth(((Ast.Abstraction) term).body, depth + 1);
      case APPLICATION:
        final Ast.Application application = (Ast.Application) term;
        return Math.max(
            freeDepth(application.function, depth),
            freeDepth(application.argument, depth));
      default:
        throw new AssertionError("unexpected " + term.op);
    }
  }

  /**
   * Populates {@code counts[0]} with the number of abstractions and {@code
   * counts[1]} with the number of typed abstractions.
   */
  private static void countAbstractions(Term term, int[] counts) {
    term.accept(
        new TermVisitor<Void>() {
          @Override
          public Void visit(Ast.Abstraction abstraction) {
            ++counts[0];
            if (abstraction.argumentType != null) {
              ++counts[1];
            }
            return super.visit(abstraction);
          }
        });
  }

  /** Visitor that converts a term to a debug string. */
  private static class DebugVisitor extends TermVisitor<String> {
    static final DebugVisitor INSTANCE = new DebugVisitor();

    @Override
    public String visit(Ast.Variable variable) {
      return MoreObjects.toStringHelper("Variable")
          .add("idx", variable.idx)
          .toString();
    }

    @Override
    public String visit(Ast.Abstraction abstraction) {
      final @Nullable Type argumentType = abstraction.argumentType;
      return MoreObjects.toStringHelper("Abstraction")
          .omitNullValues()
          .add("argumentType", argumentType == null ? null : debug(argumentType))
          .add("body", abstraction.body.accept(this))
          .toString();
    }

    @Override
    public String visit(Ast.Application application) {
      return MoreObjects.toStringHelper("Application")
          .add("function", application.function.accept(this))
          .add("argument", application.argument.accept(this))
          .toString();
    }
  }

  /** Visitor that converts a type to a debug string. */
  private static class TypeDebugVisitor extends TypeVisitor<String> {
    static final TypeDebugVisitor INSTANCE = new TypeDebugVisitor();

    @Override
    public String visit(BaseType baseType) {
      return MoreObjects.toStringHelper("BaseType")
          .add("name", baseType.name)
          .toString();
    }

    @Override
    public String visit(FnType fnType) {
      return MoreObjects.toStringHelper("FnType")
          .add("paramType", fnType.paramType.accept(this))
          .add("resultType", fnType.resultType.accept(this))
          .toString();
    }
  }
}

// End Terms.java
