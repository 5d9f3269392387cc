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
package net.hydromatic.formc.parse;

import static com.google.common.base.Preconditions.checkArgument;

/** Utilities for parsing. */
public final class Parsers {
  private Parsers() {}

  /**
   * Given quoted string {@code "abc"} or {@code 'abc'} returns {@code abc}.
   * A backslash escapes the character after it; for example,
   * {@code "a\"b"} returns {@code a"b}.
   */
  public static String unquoteString(String s) {
    checkArgument(s.length() >= 2);
    final char quote = s.charAt(0);
    checkArgument(quote == '"' || quote == '\'');
    checkArgument(s.charAt(s.length() - 1) == quote);
    s = s.substring(1, s.length() - 1);
    if (s.indexOf('\\') < 0) {
      return s;
    }
    final StringBuilder b = new StringBuilder();
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      if (c == '\\' && i + 1 < s.length()) {
        b.append(s.charAt(++i));
      } else {
        b.append(c);
      }
    }
    return b.toString();
  }
}

// End Parsers.java
