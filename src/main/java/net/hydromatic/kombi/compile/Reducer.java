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
package net.hydromatic.kombi.compile;

import static java.util.Objects.requireNonNull;

import net.hydromatic.kombi.ast.Ast;
import net.hydromatic.kombi.ast.Op;
import net.hydromatic.kombi.ast.Term;

/**
 * Reduces terms by β-reduction.
 *
 * <p>The strategy is normal order with lazy arguments: in an application, the
 * function is reduced first; if it is an abstraction, the argument is
 * substituted into its body without first being reduced, and the result is
 * reduced. Variables and abstractions are already reduced; reduction does not
 * look inside the body of an abstraction.
 *
 * <p>Reduction of a term that has no normal form does not terminate, unless
 * a limit on the number of β-steps is set.
 */
public class Reducer {
  /** Value of {@code maxSteps} that means "no limit". */
  public static final int UNBOUNDED = -1;

  private final Tracer tracer;
  private final int maxSteps;

  /**
   * Creates a Reducer.
   *
   * @param tracer Tracer, called after each step
   * @param maxSteps Maximum number of β-steps per call to {@link #reduce}, or
   *     {@link #UNBOUNDED}
   */
  public Reducer(Tracer tracer, int maxSteps) {
    this.tracer = requireNonNull(tracer);
    this.maxSteps = maxSteps;
  }

  /** Reduces a term to normal form. May not terminate. */
  public static Term betaReduce(Term term) {
    return new Reducer(Tracers.empty(), UNBOUNDED).reduce(term);
  }

  /**
   * Reduces a term to normal form, throwing {@link ReductionLimitException} if
   * it takes more than {@code maxSteps} β-steps.
   */
  public static Term betaReduce(Term term, int maxSteps) {
    return new Reducer(Tracers.empty(), maxSteps).reduce(term);
  }

  /**
   * Returns a copy of a term with every variable whose index is {@code index}
   * (at the current level of nesting) replaced by {@code replacement}.
   *
   * <p>Inside an abstraction, the index being replaced is one greater. The
   * replacement is inserted as is, without adjusting its indices; this is
   * correct when the replacement is closed, as it always is during {@link
   * #reduce reduction} of a closed term.
   *
   * <p>Sub-terms that contain no replaced variable are returned unchanged,
   * not copied.
   */
  public static Term substitute(Term term, int index, Term replacement) {
    switch (term.op) {
      case VARIABLE:
        return ((Ast.Variable) term).idx == index ? replacement : term;

      case ABSTRACTION:
        final Ast.Abstraction abstraction = (Ast.Abstraction) term;
        return abstraction.copy(
            substitute(abstraction.body, index + 1, replacement));

      case APPLICATION:
        final Ast.Application application = (Ast.Application) term;
        return application.copy(
            substitute(application.function, index, replacement),
            substitute(application.argument, index, replacement));

      default:
        throw new AssertionError("unexpected " + term.op);
    }
  }

  /**
   * Reduces a term to normal form.
   *
   * @throws ReductionLimitException if the limit on β-steps is exceeded
   * @throws IllegalStateException if the term contains an application whose
   *     function is a free variable
   */
  public Term reduce(Term term) {
    final int[] steps = {0};
    final Term result = reduce(term, steps);
    tracer.onResult(result);
    return result;
  }

  private Term reduce(Term term, int[] steps) {
    // Loop rather than recurse after each substitution, so that the stack
    // grows with the depth of the function spine, not the number of steps.
    for (;;) {
      if (term.op != Op.APPLICATION) {
        return term;
      }
      final Ast.Application application = (Ast.Application) term;
      final Term function = reduce(application.function, steps);
      if (!(function instanceof Ast.Abstraction)) {
        throw new IllegalStateException(
            "cannot reduce application of " + function
                + "; term has free variables");
      }
      if (maxSteps >= 0 && steps[0] >= maxSteps) {
        throw new ReductionLimitException(maxSteps, term.pos);
      }
      term =
          substitute(((Ast.Abstraction) function).body, 0, application.argument);
      tracer.onStep(++steps[0], term);
    }
  }
}

// End Reducer.java
