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
package net.hydromatic.formc.util;

import net.hydromatic.formc.ast.Pos;

/**
 * Exception raised while reading or compiling a form file, with a position
 * and a one-line description.
 *
 * <p>Implemented by {@link net.hydromatic.formc.compile.CompileException} and
 * {@link net.hydromatic.formc.parse.FormParseException}.
 */
public interface FormcException {
  /** Returns the position in the form file, or {@link Pos#ZERO}. */
  Pos pos();

  /** Appends a one-line description of this exception to a buffer. */
  StringBuilder describeTo(StringBuilder buf);
}

// End FormcException.java
