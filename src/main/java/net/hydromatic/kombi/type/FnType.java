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

import static java.util.Objects.requireNonNull;

import net.hydromatic.kombi.ast.Op;

/**
 * The type of a function, "{@code (A)→B}".
 *
 * <p>The parameter type is always enclosed in parentheses, so the arrow
 * associates to the right: "{@code (A)→(B)→C}" is a function that returns a
 * function.
 */
public class FnType extends AbstractType {
  public final Type paramType;
  public final Type resultType;

  FnType(Type paramType, Type resultType) {
    super(Op.FUNCTION_TYPE);
    this.paramType = requireNonNull(paramType);
    this.resultType = requireNonNull(resultType);
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    buf.append('(');
    paramType.describe(buf);
    buf.append(')').append(op.opName);
    return resultType.describe(buf);
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }
}

// End FnType.java
