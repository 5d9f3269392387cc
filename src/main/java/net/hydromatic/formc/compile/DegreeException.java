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
package net.hydromatic.formc.compile;

import net.hydromatic.formc.ast.Pos;

/**
 * Quadrature degree could not be estimated, for example because the
 * estimate exceeds the largest allowed degree.
 *
 * <p>Recoverable: unless the user asked for strict degree estimation, the
 * compiler reports the exception as a warning and uses a fallback degree.
 */
public class DegreeException extends CompileException {
  /** The estimate that was rejected, or -1 if there is none. */
  public final int estimate;

  public DegreeException(String message, int estimate) {
    super(message, Pos.ZERO);
    this.estimate = estimate;
  }
}

// End DegreeException.java
