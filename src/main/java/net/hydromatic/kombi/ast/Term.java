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

import static java.util.Objects.requireNonNull;

/**
 * Term of the lambda calculus.
 *
 * <p>Terms are immutable. Variables are represented by de Bruijn indices, so
 * two terms are equal if and only if they are alpha-equivalent. The position
 * of a term does not take part in equality.
 */
public abstract class Term {
  public final Pos pos;
  public final Op op;

  protected Term(Pos pos, Op op) {
    this.pos = requireNonNull(pos);
    this.op = requireNonNull(op);
  }

  /**
   * Converts this term into a string.
   *
   * <p>The outermost term is not parenthesized; nested abstractions and
   * applications are. To generate text that the parser accepts, use {@link
   * Terms#unparse(Term)}.
   */
  @Override
  public final String toString() {
    // Marked final because you should override unparse, not toString
    return unparse(new TermWriter());
  }

  /** Converts this term into a string, with a given writer. */
  public final String unparse(TermWriter w) {
    return unparse(w, 0, 0).toString();
  }

  /**
   * Writes this term to a writer.
   *
   * @param w Writer
   * @param left Binding strength of the context to the left; 0 at top level
   * @param right Binding strength of the context to the right; 0 at top level
   */
  abstract TermWriter unparse(TermWriter w, int left, int right);

  /**
   * Accepts a visitor, calling the {@link TermVisitor#visit} method
   * appropriate to the type of this term, and returning the result.
   */
  public abstract <R> R accept(TermVisitor<R> visitor);
}

// End Term.java
