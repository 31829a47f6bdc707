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
package net.hydromatic.kombi.ast;

/** Context for writing a term out as a string. */
public class TermWriter {
  private final StringBuilder b = new StringBuilder();

  /** Appends a string to the output. */
  public TermWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends a term to the output, in a context of given binding strength. */
  public TermWriter append(Term term, int left, int right) {
    return term.unparse(this, left, right);
  }

  @Override
  public String toString() {
    return b.toString();
  }
}

// End TermWriter.java
