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
package net.hydromatic.formc.ast;

/** Side of an interior facet that a restricted expression is evaluated on. */
public enum Side {
  PLUS("+", 0),
  MINUS("-", 1);

  /** Symbol in form files, e.g. "+" in {@code v('+')}. */
  public final String symbol;
  /** Index of the cell that the side refers to. */
  public final int cell;

  Side(String symbol, int cell) {
    this.symbol = symbol;
    this.cell = cell;
  }
}

// End Side.java
