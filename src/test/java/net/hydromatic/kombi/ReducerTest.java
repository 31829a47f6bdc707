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

import static net.hydromatic.kombi.Kt.assertError;
import static net.hydromatic.kombi.Kt.kt;
import static net.hydromatic.kombi.Matchers.isTerm;
import static net.hydromatic.kombi.Matchers.throwsA;
import static net.hydromatic.kombi.ast.TermBuilder.term;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.fail;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import net.hydromatic.kombi.ast.Ast;
import net.hydromatic.kombi.ast.Term;
import net.hydromatic.kombi.compile.Evaluator;
import net.hydromatic.kombi.compile.Reducer;
import net.hydromatic.kombi.compile.ReductionLimitException;
import net.hydromatic.kombi.compile.Tracer;
import net.hydromatic.kombi.compile.Tracers;
import net.hydromatic.kombi.type.TypeSystem;
import org.junit.jupiter.api.Test;

/** Tests substitution and β-reduction. */
public class ReducerTest {
  static final String TRUE = "(λt.(λf.t))";
  static final String FALSE = "(λt.(λf.f))";
  static final String NOT = "(λb.((b " + FALSE + ") " + TRUE + "))";
  static final String TWO = "(λf.(λx.(f (f x))))";
  static final String THREE = "(λf.(λx.(f (f (f x)))))";
  static final String PLUS = "(λm.(λn.(λf.(λx.((m f) ((n f) x))))))";
  static final String OMEGA = "((λx.(x x)) (λx.(x x)))";

  @Test void testIdentity() {
    kt("((λx.x) (λy.y))")
        .assertReduce("λ 0")
        .assertSteps("λ 0");
    kt("(λx.x)")
        .assertReduce("λ 0")
        .assertSteps();
  }

  /** The K combinator returns its first argument. */
  @Test void testK() {
    kt("(((λx.(λy.x)) (λa.(λb.a))) (λc.c))")
        .assertReduceSame("(λa.(λb.a))")
        .assertSteps("λ (λ (λ 1))", "λ (λ 1)");
    kt("(((λx.(λy.x)) (λc.c)) (λa.(λb.a)))")
        .assertReduce("λ 0");
  }

  @Test void testBooleans() {
    kt("(" + NOT + " " + TRUE + ")").assertReduceSame(FALSE);
    kt("(" + NOT + " " + FALSE + ")").assertReduceSame(TRUE);
  }

  /**
   * Church numerals, observed by applying them to NOT and TRUE; the result is
   * TRUE if the numeral is even.
   */
  @Test void testChurchNumerals() {
    kt("(" + TWO + " " + NOT + " " + TRUE + ")").assertReduceSame(TRUE);
    kt("(" + THREE + " " + NOT + " " + TRUE + ")").assertReduceSame(FALSE);
    kt("(" + PLUS + " " + TWO + " " + THREE + " " + NOT + " " + TRUE + ")")
        .assertReduceSame(FALSE);
    kt("(" + PLUS + " " + THREE + " " + THREE + " " + NOT + " " + TRUE + ")")
        .assertReduceSame(TRUE);
  }

  /** Reduction does not look inside the body of an abstraction. */
  @Test void testWeakHead() {
    kt("(λx.((λy.y) x))")
        .assertReduce("λ ((λ 0) 0)")
        .assertSteps();
    kt("((λx.(λz.((λy.y) z))) (λw.w))")
        .assertReduce("λ ((λ 0) 0)");
  }

  /** Arguments are not reduced before they are substituted. */
  @Test void testLazy() {
    kt("((λx.(λy.y)) " + OMEGA + ")")
        .withMaxSteps(5)
        .assertReduce("λ 0");
    kt("(((λx.(λy.y)) " + OMEGA + ") (λz.z))")
        .withMaxSteps(5)
        .assertReduce("λ 0");
  }

  /** Ω has no normal form; each step gives Ω again. */
  @Test void testOmega() {
    kt(OMEGA)
        .withMaxSteps(100)
        .assertReduceThrows(
            throwsA(ReductionLimitException.class,
                is("reduction did not finish within 100 steps")));

    final List<String> steps = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnStep(Tracers.empty(),
            (term, step) -> steps.add(step + ": " + term));
    final Term omega = kt(OMEGA).term();
    try {
      new Reducer(tracer, 3).reduce(omega);
      fail("expected error");
    } catch (ReductionLimitException e) {
      assertThat(e.maxSteps, is(3));
    }
    assertThat(steps.size(), is(3));
    assertThat(steps.get(2), is("3: (λ (0 0)) (λ (0 0))"));
  }

  /** The evaluator only reduces closed terms. */
  @Test void testReduceOpenTerm() {
    final Evaluator evaluator =
        new Evaluator(new TypeSystem(), Tracers.empty(), Reducer.UNBOUNDED);
    assertError(() -> evaluator.reduce(term.variable(0)),
        throwsA(IllegalArgumentException.class, is("term is not closed: 0")));
    assertError(() -> evaluator.reduce(term.abstraction(term.variable(1))),
        throwsA(IllegalArgumentException.class,
            is("term is not closed: λ 1")));
  }

  @Test void testZeroSteps() {
    kt("(λx.x)").withMaxSteps(0).assertReduce("λ 0");
    kt("((λx.x) (λy.y))")
        .withMaxSteps(0)
        .assertReduceThrows(
            throwsA(ReductionLimitException.class,
                is("reduction did not finish within 0 steps")));
    kt("((λx.x) (λy.y))").withMaxSteps(1).assertReduce("λ 0");
  }

  /** A long chain of steps does not use a deep stack. */
  @Test void testManySteps() {
    final int n = 100_000;
    final Term id = term.abstraction(term.variable(0));
    Term t = id;
    for (int i = 0; i < n; i++) {
      t = term.apply(id, t);
    }
    final AtomicInteger stepCount = new AtomicInteger();
    final AtomicInteger resultCount = new AtomicInteger();
    Tracer tracer = Tracers.empty();
    tracer = Tracers.withOnStep(tracer, (term, step) -> stepCount.set(step));
    tracer = Tracers.withOnResult(tracer, term -> resultCount.incrementAndGet());
    final Term result = new Reducer(tracer, Reducer.UNBOUNDED).reduce(t);
    assertThat(result, sameInstance(id));
    assertThat(stepCount.get(), is(n));
    assertThat(resultCount.get(), is(1));
  }

  @Test void testFreeVariable() {
    final Term t = term.apply(term.variable(0), term.abstraction(term.variable(0)));
    assertError(() -> Reducer.betaReduce(t),
        throwsA(IllegalStateException.class,
            is("cannot reduce application of 0; term has free variables")));
  }

  @Test void testSubstitute() {
    final Term r = kt("(λa.a)").term();
    final Term v0 = term.variable(0);
    final Term v1 = term.variable(1);
    assertThat(Reducer.substitute(v0, 0, r), sameInstance(r));
    assertThat(Reducer.substitute(v1, 0, r), sameInstance(v1));
    assertThat(Reducer.substitute(v1, 1, r), sameInstance(r));

    // Inside an abstraction, the index to replace is one greater.
    final Term abs1 = term.abstraction(v1);
    assertThat(Reducer.substitute(abs1, 0, r), isTerm("λ (λ 0)"));
    final Term abs0 = term.abstraction(v0);
    assertThat(Reducer.substitute(abs0, 0, r), sameInstance(abs0));

    // Unchanged sub-terms are shared, not copied.
    final Ast.Application app = term.apply(v0, v1);
    final Ast.Application app2 =
        (Ast.Application) Reducer.substitute(app, 0, r);
    assertThat(app2.function, sameInstance(r));
    assertThat(app2.argument, sameInstance(v1));
    assertThat(app2, isTerm("(λ 0) 1"));
  }

  @Test void testBetaReduce() {
    assertThat(Reducer.betaReduce(kt("((λx.x) (λy.(y y)))").term()),
        isTerm("λ (0 0)"));
    assertError(() -> Reducer.betaReduce(kt(OMEGA).term(), 10),
        throwsA(ReductionLimitException.class,
            is("reduction did not finish within 10 steps")));
  }
}

// End ReducerTest.java
