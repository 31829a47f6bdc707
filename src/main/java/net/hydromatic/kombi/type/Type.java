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
package net.hydromatic.kombi.type;

import net.hydromatic.kombi.ast.Op;

/**
 * Type in the simply typed lambda calculus.
 *
 * <p>Types are immutable and structurally compared: two types are equal if
 * and only if their descriptions are equal.
 */
public interface Type {
  /**
   * Description of the type, e.g. "{@code A}", "{@code (A)→B}". The
   * description is valid input to the parser.
   */
  String key();

  /** Type operator. */
  Op op();

  /** Writes the description of this type to a builder. */
  StringBuilder describe(StringBuilder buf);

  <R> R accept(TypeVisitor<R> typeVisitor);
}

// End Type.java
