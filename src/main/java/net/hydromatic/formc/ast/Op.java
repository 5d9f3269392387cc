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

import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Sub-types of {@link Expr}. */
public enum Op {
  // terminals
  ARGUMENT(true),
  COEFFICIENT(true),
  CONSTANT(true),
  ZERO(true),
  FACET_NORMAL(true),
  SPATIAL_COORDINATE(true),

  // differential operators
  GRAD("grad"),
  DIV("div"),
  CURL("curl"),

  // tensor algebra
  INNER("inner"),
  DOT("dot"),
  OUTER("outer"),
  TRANSPOSE("transpose"),

  // arithmetic
  PLUS(" + ", 6),
  TIMES(" * ", 7),
  DIVIDE(" / ", 7),
  NEGATE("-", 8),
  POWER(" ** ", 9, false),
  INDEXED("[]", 10),
  RESTRICTED("()", 10),

  // nonlinear functions
  SQRT("sqrt"),
  EXP("exp"),
  LN("ln"),
  SIN("sin"),
  COS("cos"),
  ABS("abs"),
  SIGN("sign");

  /** Padded name of an operator, e.g. " + "; or the name of a function,
   * e.g. "grad"; or empty for a terminal. */
  public final String padded;
  /** Left precedence. */
  public final int left;
  /** Right precedence. */
  public final int right;
  /** Whether the operator is written as a function call, e.g. "grad(u)". */
  public final boolean function;

  /** Functions by name, e.g. "sqrt" to {@link #SQRT}. */
  public static final ImmutableMap<String, Op> BY_FUNCTION_NAME;

  static {
    final ImmutableMap.Builder<String, Op> b = ImmutableMap.builder();
    for (Op op : values()) {
      if (op.function) {
        b.put(op.padded, op);
      }
    }
    BY_FUNCTION_NAME = b.build();
  }

  Op(boolean atom) {
    this("", 99 * 2, 99 * 2 + 1, false);
    assert atom;
  }

  Op(String functionName) {
    this(functionName, 99 * 2, 99 * 2 + 1, true);
  }

  Op(String padded, int precedence) {
    this(padded, precedence, true);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0),
        false);
  }

  Op(String padded, int left, int right, boolean function) {
    this.padded = padded;
    this.left = left;
    this.right = right;
    this.function = function;
  }

  /** Looks up a function by name; returns null if not found. */
  public static @Nullable Op lookupFunction(String name) {
    return BY_FUNCTION_NAME.get(name);
  }

  /** Whether this is one of the nonlinear scalar functions, such as
   * {@link #SQRT}. */
  public boolean isNonlinear() {
    return ordinal() >= SQRT.ordinal();
  }
}

// End Op.java
