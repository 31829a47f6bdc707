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
package net.hydromatic.kombi.util;

/** Utilities that are generally used via static import. */
public class Static {
  private Static() {}

  /**
   * Returns the contents of a builder as a string, and clears the builder.
   *
   * <p>Equivalent to {@code String s = b.toString(); b.setLength(0); return
   * s;}.
   */
  public static String str(StringBuilder b) {
    String s = b.toString();
    b.setLength(0);
    return s;
  }

  /**
   * Returns the net depth of parentheses in a string: the number of '(' minus
   * the number of ')'.
   */
  public static int parenDepth(CharSequence s) {
    int depth = 0;
    for (int i = 0; i < s.length(); i++) {
      switch (s.charAt(i)) {
        case '(':
          ++depth;
          break;
        case ')':
          --depth;
          break;
        default:
          break;
      }
    }
    return depth;
  }
}

// End Static.java
