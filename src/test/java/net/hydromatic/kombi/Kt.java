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

import static net.hydromatic.kombi.Matchers.isTerm;
import static net.hydromatic.kombi.Matchers.isTermEqualTo;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.fail;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.kombi.ast.Ast;
import net.hydromatic.kombi.ast.Pos;
import net.hydromatic.kombi.ast.Term;
import net.hydromatic.kombi.ast.Terms;
import net.hydromatic.kombi.compile.Evaluator;
import net.hydromatic.kombi.compile.Reducer;
import net.hydromatic.kombi.compile.Tracer;
import net.hydromatic.kombi.compile.Tracers;
import net.hydromatic.kombi.compile.TypeChecker;
import net.hydromatic.kombi.parse.KombiParser;
import net.hydromatic.kombi.type.Type;
import net.hydromatic.kombi.type.TypeSystem;
import net.hydromatic.kombi.util.KombiException;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.hamcrest.Matcher;

/**
 * Fluent test helper for lambda terms.
 *
 * <p>Each method performs one phase (parse, type-check, reduce, evaluate) and
 * checks its outcome; methods return {@code this} so that checks can be
 * chained.
 */
class Kt {
  private final String text;
  private final @Nullable Pos pos;
  private final int maxSteps;
  private final Tracer tracer;

  Kt(String text, @Nullable Pos pos, int maxSteps, Tracer tracer) {
    this.text = text;
    this.pos = pos;
    this.maxSteps = maxSteps;
    this.tracer = tracer;
  }

  /** Creates a {@code Kt}. */
  static Kt kt(String text) {
    return new Kt(text, null, 1_000, Tracers.empty());
  }

  /** Creates a {@code Kt} containing an error position delimited by '$'. */
  static Kt ktE(String text) {
    final Map.Entry<String, Pos> entry = Pos.split(text, '$', "stdIn");
    return new Kt(entry.getKey(), entry.getValue(), 1_000, Tracers.empty());
  }

  /**
   * Runs a task and checks that it throws an exception.
   *
   * @param runnable Task to run
   * @param matcher Checks whether exception is as expected
   */
  static void assertError(Runnable runnable, Matcher<Throwable> matcher) {
    try {
      runnable.run();
      fail("expected error");
    } catch (Throwable e) {
      assertThat(e, matcher);
    }
  }

  Kt withMaxSteps(int maxSteps) {
    return new Kt(text, pos, maxSteps, tracer);
  }

  Kt withTracer(Tracer tracer) {
    return new Kt(text, pos, maxSteps, tracer);
  }

  private KombiParser parser() {
    return new KombiParser(new TypeSystem(), text, "stdIn");
  }

  Term term() {
    return parser().termEof();
  }

  Ast.Program program() {
    return parser().program();
  }

  /** Checks that the text parses to a term with a given string form. */
  @CanIgnoreReturnValue
  Kt assertParse(String expected) {
    assertThat(term(), isTerm(expected));
    return this;
  }

  /** Checks that the text parses to a term with a given structural form. */
  @CanIgnoreReturnValue
  Kt assertParseDebug(String expected) {
    assertThat(Terms.debug(term()), is(expected));
    return this;
  }

  /** Checks that the text parses to the same term as another piece of text. */
  @CanIgnoreReturnValue
  Kt assertParseSame(String other) {
    assertThat(term(), isTermEqualTo(kt(other).term()));
    return this;
  }

  /**
   * Checks that the unparsed term parses back to an equal term, and that
   * unparsing that term gives the same text.
   */
  @CanIgnoreReturnValue
  Kt assertRoundTrip() {
    final Term t = term();
    final String s = Terms.unparse(t);
    final Term t2 = kt(s).term();
    assertThat(t2, isTermEqualTo(t));
    assertThat(Terms.unparse(t2), is(s));
    return this;
  }

  /** Checks that parsing throws, and that the error is at the '$' position. */
  @CanIgnoreReturnValue
  Kt assertParseThrows(Matcher<Throwable> matcher) {
    assertError(this::term, matcher);
    assertErrorPos(this::term);
    return this;
  }

  /** Checks that reduction gives a term with a given string form. */
  @CanIgnoreReturnValue
  Kt assertReduce(String expected) {
    assertThat(reduce(), isTerm(expected));
    return this;
  }

  /** Checks that reduction gives the same term as another piece of text. */
  @CanIgnoreReturnValue
  Kt assertReduceSame(String other) {
    assertThat(reduce(), isTermEqualTo(kt(other).term()));
    return this;
  }

  /** Checks that reduction throws. */
  @CanIgnoreReturnValue
  Kt assertReduceThrows(Matcher<Throwable> matcher) {
    assertError(this::reduce, matcher);
    assertErrorPos(this::reduce);
    return this;
  }

  private Term reduce() {
    return new Reducer(tracer, maxSteps).reduce(term());
  }

  /** Checks that the term has a given type. */
  @CanIgnoreReturnValue
  Kt assertType(String expected) {
    assertThat(TypeChecker.typeOf(term()).toString(), is(expected));
    return this;
  }

  /** Checks that type-checking throws. */
  @CanIgnoreReturnValue
  Kt assertTypeThrows(Matcher<Throwable> matcher) {
    final Runnable runnable =
        () -> new TypeChecker(new TypeSystem()).deduceType(program());
    assertError(runnable, matcher);
    assertErrorPos(runnable);
    return this;
  }

  /**
   * Checks that reduction preserves type: the term is well-typed, and its
   * normal form has the same type.
   */
  @CanIgnoreReturnValue
  Kt assertTypePreserved() {
    final Term t = term();
    final Type type = TypeChecker.typeOf(t);
    final Term normalForm = Reducer.betaReduce(t, maxSteps);
    assertThat(TypeChecker.typeOf(normalForm), is(type));
    return this;
  }

  /** Checks the printed result of evaluating the program. */
  @CanIgnoreReturnValue
  Kt assertEval(String expected) {
    return assertEval(false, expected);
  }

  /** Checks the printed result of evaluating the program, in debug mode. */
  @CanIgnoreReturnValue
  Kt assertEvalDebug(String expected) {
    return assertEval(true, expected);
  }

  private Kt assertEval(boolean debug, String expected) {
    final Evaluator evaluator =
        new Evaluator(new TypeSystem(), tracer, maxSteps);
    final Evaluator.Result result = evaluator.evaluate(text, "stdIn");
    assertThat(result.describe(debug), is(expected));
    return this;
  }

  /** Checks that evaluation throws. */
  @CanIgnoreReturnValue
  Kt assertEvalThrows(Matcher<Throwable> matcher) {
    final Runnable runnable =
        () -> new Evaluator(new TypeSystem(), tracer, maxSteps)
            .evaluate(text, "stdIn");
    assertError(runnable, matcher);
    assertErrorPos(runnable);
    return this;
  }

  /**
   * Checks that reduction takes a given number of steps, and returns the
   * intermediate terms.
   */
  @CanIgnoreReturnValue
  Kt assertSteps(String... expectedTerms) {
    final List<String> list = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnStep(this.tracer, (term, step) -> {
          assertThat(step, is(list.size() + 1));
          list.add(term.toString());
        });
    new Reducer(tracer, maxSteps).reduce(term());
    assertThat(list, is(List.of(expectedTerms)));
    return this;
  }

  /** If there is a '$' position, checks that the error is there. */
  private void assertErrorPos(Runnable runnable) {
    if (pos == null) {
      return;
    }
    try {
      runnable.run();
      fail("expected error");
    } catch (RuntimeException e) {
      assertThat(e, instanceOf(KombiException.class));
      final Pos errorPos = ((KombiException) e).pos();
      assertThat(errorPos, notNullValue());
      assertThat(errorPos.toString(), is(pos.toString()));
    }
  }

  /** Checks that the program is untyped. */
  @CanIgnoreReturnValue
  Kt assertUntyped() {
    final Evaluator evaluator =
        new Evaluator(new TypeSystem(), tracer, maxSteps);
    final Ast.Program program = program();
    assertThat(evaluator.check(program, null, program.term), nullValue());
    return this;
  }
}

// End Kt.java
