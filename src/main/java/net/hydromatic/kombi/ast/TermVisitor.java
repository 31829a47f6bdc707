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

/**
 * Visitor over {@link Term} objects.
 *
 * <p>The default methods visit every sub-term and return the result of the
 * last visit.
 *
 * @param <R> return type from {@code visit} methods
 * @see Term#accept(TermVisitor)
 */
public class TermVisitor<R> {
  /** Visits a {@link Ast.Variable}. */
  public R visit(Ast.Variable variable) {
    return null;
  }

  /** Visits an {@link Ast.Abstraction}. */
  public R visit(Ast.Abstraction abstraction) {
    return abstraction.body.accept(this);
  }

  /** Visits an {@link Ast.Application}. */
  public R visit(Ast.Application application) {
    R r = application.function.accept(this);
    return application.argument.accept(this);
  }
}

// End TermVisitor.java
