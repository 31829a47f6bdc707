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
package net.hydromatic.kombi;

import static java.util.Objects.requireNonNull;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;

import net.hydromatic.kombi.ast.Op;
import net.hydromatic.kombi.ast.Terms;
import net.hydromatic.kombi.parse.KombiParser;
import net.hydromatic.kombi.type.BaseType;
import net.hydromatic.kombi.type.FnType;
import net.hydromatic.kombi.type.Type;
import net.hydromatic.kombi.type.TypeSystem;
import org.junit.jupiter.api.Test;

/** Tests types and the type system. */
public class TypeTest {
  /** Parses a type, as the ascription of the identity function. */
  private static Type parseType(String s) {
    return requireNonNull(KombiParser.parseProgram("(λx.x):" + s).type);
  }

  @Test void testInterning() {
    final TypeSystem ts = new TypeSystem();
    final BaseType a = ts.baseType("A");
    final BaseType b = ts.baseType("B");
    assertThat(ts.baseType("A"), sameInstance(a));
    assertThat(a, not(b));

    final FnType ab = ts.fnType(a, b);
    assertThat(ts.fnType(a, b), sameInstance(ab));
    assertThat(ts.fnType(b, a), not(sameInstance(ab)));
    assertThat(ab.op(), is(Op.FUNCTION_TYPE));
    assertThat(a.op(), is(Op.BASE_TYPE));
  }

  /**
   * Types are equal if they have the same structure, even if they were
   * created by different type systems.
   */
  @Test void testStructuralEquality() {
    final TypeSystem ts1 = new TypeSystem();
    final TypeSystem ts2 = new TypeSystem();
    final Type t1 = ts1.fnType(ts1.baseType("A"), ts1.baseType("B"));
    final Type t2 = ts2.fnType(ts2.baseType("A"), ts2.baseType("B"));
    assertThat(t1, not(sameInstance(t2)));
    assertThat(t1, is(t2));
    assertThat(t1.hashCode(), is(t2.hashCode()));
    assertThat(ts1.baseType("A"), not((Type) t1));
  }

  @Test void testDescribe() {
    final TypeSystem ts = new TypeSystem();
    final Type a = ts.baseType("A");
    final Type b = ts.baseType("B");
    final Type c = ts.baseType("C");
    assertThat(a.toString(), is("A"));
    assertThat(ts.fnType(a, b).toString(), is("(A)→B"));
    assertThat(ts.fnType(ts.fnType(a, b), c).toString(), is("((A)→B)→C"));
    assertThat(ts.fnType(a, ts.fnType(b, c)).toString(), is("(A)→(B)→C"));

    // Multi-step function types nest to the right.
    final Type d = ts.baseType("D");
    assertThat(ts.fnType(a, b, c, d).toString(), is("(A)→(B)→(C)→D"));
    assertThat(ts.fnType(a, b, c), is((Type) ts.fnType(a, ts.fnType(b, c))));

    assertThat(Terms.debug(ts.fnType(a, b)),
        is("FnType{paramType=BaseType{name=A}, resultType=BaseType{name=B}}"));
  }

  /** The description of a type is valid input to the parser. */
  @Test void testParseType() {
    final String[] types = {
      "A", "(A)→B", "((A)→B)→C", "(A)→(B)→C", "(((A)→A)→A)→Nat",
    };
    for (String s : types) {
      final Type type = parseType(s);
      assertThat(type.toString(), is(s));
    }
    final Type type = parseType("(A) -> (B) -> C");
    assertThat(type, instanceOf(FnType.class));
    assertThat(((FnType) type).resultType.toString(), is("(B)→C"));
  }
}

// End TypeTest.java
