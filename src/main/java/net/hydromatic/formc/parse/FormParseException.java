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

import net.hydromatic.formc.ast.Pos;
import net.hydromatic.formc.util.FormcException;

/** Exception caused by a syntax error in a form file, or by a value of the
 * wrong kind.
 *
 * <p>Not to be confused with {@link ParseException}, which JavaCC generates,
 * and which {@link FormParser} converts to this. */
public class FormParseException extends RuntimeException
    implements FormcException {
  private final Pos pos;

  public FormParseException(String message, Pos pos) {
    super(message);
    this.pos = pos;
  }

  @Override
  public Pos pos() {
    return pos;
  }

  /** Returns the line of the error, 1-based. */
  public int line() {
    return pos.startLine;
  }

  /** Returns the column of the error, 1-based. */
  public int column() {
    return pos.startColumn;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("line ").append(pos.startLine).append(", column ")
        .append(pos.startColumn).append(": ").append(getMessage());
  }
}

// End FormParseException.java
