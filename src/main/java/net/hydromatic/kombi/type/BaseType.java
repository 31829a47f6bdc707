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

import static com.google.common.base.Preconditions.checkArgument;

import net.hydromatic.kombi.ast.Op;

/**
 * Atomic type, identified by its name.
 *
 * <p>Base types are opaque: the only thing known about {@code A} is that it
 * is the same as {@code A} and different from {@code B}.
 */
public class BaseType extends AbstractType {
  public final String name;

  BaseType(String name) {
    super(Op.BASE_TYPE);
    checkArgument(!name.isEmpty(), "empty type name");
    this.name = name;
  }

  @Override
  public StringBuilder describe(StringBuilder buf) {
    return buf.append(name);
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }
}

// End BaseType.java
