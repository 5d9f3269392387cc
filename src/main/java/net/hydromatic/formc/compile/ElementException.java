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
import net.hydromatic.formc.element.Cell;
import net.hydromatic.formc.element.Family;

/** Unsupported combination of element family, cell and degree. */
public class ElementException extends CompileException {
  public final Family family;
  public final Cell cell;
  public final int degree;

  public ElementException(String message, Family family, Cell cell,
      int degree) {
    super("unsupported element " + family.displayName + " on "
        + cell.lowerName() + " of degree " + degree + ": " + message,
        Pos.ZERO);
    this.family = family;
    this.cell = cell;
    this.degree = degree;
  }
}

// End ElementException.java
