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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A table that contains all types in use, indexed by their description (e.g.
 * "{@code (A)→B}").
 *
 * <p>Asking twice for the same type returns the same object. Types from
 * different type systems are still equal if they have the same description.
 */
public class TypeSystem {
  final Map<String, Type> typeByKey = new HashMap<>();

  /** Creates or returns the base type with the given name. */
  public BaseType baseType(String name) {
    return (BaseType) typeByKey.computeIfAbsent(name, k -> new BaseType(name));
  }

  /** Creates or returns a function type. */
  public FnType fnType(Type paramType, Type resultType) {
    final FnType fnType = new FnType(paramType, resultType);
    return (FnType) typeByKey.computeIfAbsent(fnType.key(), k -> fnType);
  }

  /**
   * Creates a multi-step function type.
   *
   * <p>For example, {@code fnType(a, b, c, d)} returns the same as
   * <!-- prevent wrapping -->
   * {@code fnType(a, fnType(b, fnType(c, d)))},
   * <!-- prevent wrapping -->
   * viz <code>(a)&rarr;(b)&rarr;(c)&rarr;d</code>.
   */
  public Type fnType(Type paramType, Type type1, Type type2, Type... moreTypes) {
    final List<Type> types =
        ImmutableList.<Type>builder()
            .add(paramType)
            .add(type1)
            .add(type2)
            .add(moreTypes)
            .build();
    Type t = null;
    for (Type type : Lists.reverse(types)) {
      if (t == null) {
        t = type;
      } else {
        t = fnType(type, t);
      }
    }
    return requireNonNull(t);
  }
}

// End TypeSystem.java
