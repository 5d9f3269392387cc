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
package net.hydromatic.formc.codegen;

import static com.google.common.base.Preconditions.checkState;

import com.google.errorprone.annotations.CanIgnoreReturnValue;

/** Writes lines of code, keeping track of indentation. */
class CodeWriter {
  private static final String INDENT = "  ";

  private final StringBuilder b = new StringBuilder();
  private int indent;

  /** Writes a line at the current indentation; an empty string writes an
   * empty line. */
  @CanIgnoreReturnValue
  CodeWriter line(String s) {
    if (!s.isEmpty()) {
      for (int i = 0; i < indent; i++) {
        b.append(INDENT);
      }
      b.append(s);
    }
    b.append('\n');
    return this;
  }

  /** Writes a line that ends with an opening brace, and indents. */
  @CanIgnoreReturnValue
  CodeWriter begin(String s) {
    line(s.isEmpty() ? "{" : s + " {");
    ++indent;
    return this;
  }

  /** Outdents, and writes a closing brace. */
  @CanIgnoreReturnValue
  CodeWriter end() {
    return end("");
  }

  /** Outdents, and writes a closing brace followed by a suffix. */
  @CanIgnoreReturnValue
  CodeWriter end(String suffix) {
    checkState(indent > 0, "unbalanced end");
    --indent;
    return line("}" + suffix);
  }

  /** Changes indentation without writing anything. */
  @CanIgnoreReturnValue
  CodeWriter indent(int delta) {
    indent += delta;
    checkState(indent >= 0, "negative indent");
    return this;
  }

  @Override
  public String toString() {
    return b.toString();
  }
}

// End CodeWriter.java
