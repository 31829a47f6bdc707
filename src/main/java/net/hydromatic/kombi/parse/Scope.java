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
package net.hydromatic.kombi.parse;

import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Names bound by the abstractions that enclose the term being parsed.
 *
 * <p>A scope is immutable. {@link #bind} returns a new scope and leaves this
 * one unchanged, so the two sides of an application, each parsed in the
 * same scope, cannot see each other's binders.
 *
 * <p>The index of a name is its distance from the innermost binder; if a
 * name is bound more than once, the innermost binder wins.
 */
public class Scope {
  /** Scope with no binders, used at the top level of a program. */
  public static final Scope EMPTY = new Scope(null, null, 0);

  private final @Nullable String name;
  private final @Nullable Scope parent;
  public final int depth;

  private Scope(@Nullable String name, @Nullable Scope parent, int depth) {
    this.name = name;
    this.parent = parent;
    this.depth = depth;
  }

  /**
   * Returns a scope with one more binder. If {@code name} is null, the binder
   * is anonymous and can only be referenced by index.
   */
  public Scope bind(@Nullable String name) {
    return new Scope(name, this, depth + 1);
  }

  /**
   * Returns the de Bruijn index of a name, or -1 if it is not bound in this
   * scope.
   */
  public int indexOf(String name) {
    int i = 0;
    for (Scope s = this; s.parent != null; s = s.parent) {
      if (Objects.equals(s.name, name)) {
        return i;
      }
      ++i;
    }
    return -1;
  }
}

// End Scope.java
