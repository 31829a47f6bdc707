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

import net.hydromatic.kombi.ast.Term;
import net.hydromatic.kombi.ast.Terms;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Matcher;

/** Matchers for use in Kombi tests. */
public abstract class Matchers {
  private Matchers() {}

  /** Matches a term by its string representation. */
  static Matcher<Term> isTerm(String expected) {
    return new CustomTypeSafeMatcher<Term>("term " + expected) {
      @Override
      protected boolean matchesSafely(Term term) {
        return term.toString().equals(expected);
      }
    };
  }

  /** Matches a term that is structurally equal to a given term. */
  static Matcher<Term> isTermEqualTo(Term expected) {
    return new CustomTypeSafeMatcher<Term>(
        "term equal to " + Terms.debug(expected)) {
      @Override
      protected boolean matchesSafely(Term term) {
        return term.equals(expected) && term.hashCode() == expected.hashCode();
      }
    };
  }

  static Matcher<Throwable> throwsA(String message) {
    return new CustomTypeSafeMatcher<Throwable>("throwable: " + message) {
      @Override
      protected boolean matchesSafely(Throwable item) {
        return item.toString().contains(message);
      }
    };
  }

  static <T extends Throwable> Matcher<Throwable> throwsA(
      Class<T> clazz, Matcher<?> messageMatcher) {
    return new CustomTypeSafeMatcher<Throwable>(
        clazz + " with message " + messageMatcher) {
      @Override
      protected boolean matchesSafely(Throwable item) {
        return clazz.isInstance(item)
            && messageMatcher.matches(item.getMessage());
      }
    };
  }
}

// End Matchers.java
