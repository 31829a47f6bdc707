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

import net.hydromatic.kombi.ast.Term;
import net.hydromatic.kombi.type.Type;

/** Called on various events during evaluation. */
public interface Tracer {
  /** Called when a term has been parsed. */
  void onParse(Term term);

  /** Called when the type of a term has been deduced. */
  void onType(Type type);

  /**
   * Called after each β-step, with the number of steps so far (starting at 1)
   * and the term that resulted from the step.
   */
  void onStep(int step, Term term);

  /** Called with the normal form of a term. */
  void onResult(Term term);

  /** Called with the exception thrown while evaluating a term. */
  void onException(Throwable e);
}

// End Tracer.java
