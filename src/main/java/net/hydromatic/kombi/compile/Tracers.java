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

import java.util.function.Consumer;
import java.util.function.ObjIntConsumer;
import net.hydromatic.kombi.ast.Term;
import net.hydromatic.kombi.type.Type;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action on a parsed term, then
   * calls the underlying tracer.
   */
  public static Tracer withOnParse(Tracer tracer, Consumer<Term> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onParse(Term term) {
        consumer.accept(term);
        super.onParse(term);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on a deduced type, then
   * calls the underlying tracer.
   */
  public static Tracer withOnType(Tracer tracer, Consumer<Type> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onType(Type type) {
        consumer.accept(type);
        super.onType(type);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action after each β-step, then
   * calls the underlying tracer.
   */
  public static Tracer withOnStep(Tracer tracer, ObjIntConsumer<Term> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onStep(int step, Term term) {
        consumer.accept(term, step);
        super.onStep(step, term);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on the normal form of a
   * term, then calls the underlying tracer.
   */
  public static Tracer withOnResult(Tracer tracer, Consumer<Term> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onResult(Term term) {
        consumer.accept(term);
        super.onResult(term);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on an exception thrown
   * during evaluation, then calls the underlying tracer.
   */
  public static Tracer withOnException(
      Tracer tracer, Consumer<Throwable> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onException(Throwable e) {
        consumer.accept(e);
        super.onException(e);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onParse(Term term) {}

    @Override
    public void onType(Type type) {}

    @Override
    public void onStep(int step, Term term) {}

    @Override
    public void onResult(Term term) {}

    @Override
    public void onException(Throwable e) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onParse(Term term) {
      tracer.onParse(term);
    }

    @Override
    public void onType(Type type) {
      tracer.onType(type);
    }

    @Override
    public void onStep(int step, Term term) {
      tracer.onStep(step, term);
    }

    @Override
    public void onResult(Term term) {
      tracer.onResult(term);
    }

    @Override
    public void onException(Throwable e) {
      tracer.onException(e);
    }
  }
}

// End Tracers.java
