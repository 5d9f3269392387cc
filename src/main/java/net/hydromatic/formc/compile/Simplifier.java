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

import static net.hydromatic.formc.ast.ExprBuilder.dsl;

import net.hydromatic.formc.ast.Expr;
import net.hydromatic.formc.ast.Op;
import net.hydromatic.formc.ast.Shuttle;

/**
 * Simplifier of expressions.
 *
 * <p>Folds arithmetic on constants, and removes zero terms, zero and unit
 * factors and double negation. The result has the same value and shape as
 * the original expression.
 */
class Simplifier extends Shuttle {
  private static final Simplifier INSTANCE = new Simplifier();

  private Simplifier() {}

  /** Simplifies an expression. */
  static Expr simplify(Expr e) {
    return e.accept(INSTANCE);
  }

  @Override
  protected Expr visit(Expr.Call1 call) {
    final Expr e = super.visit(call);
    if (!(e instanceof Expr.Call1)) {
      return e;
    }
    final Expr.Call1 call1 = (Expr.Call1) e;
    final Expr a = call1.a;
    switch (call1.op) {
      case NEGATE:
        if (isZero(a)) {
          return dsl.zero(e.shape);
        }
        if (a.op == Op.CONSTANT) {
          return dsl.real(-((Expr.Constant) a).value);
        }
        if (a.op == Op.NEGATE) {
          return ((Expr.Call1) a).a; // -(-x) is x
        }
        return e;
      case GRAD:
      case DIV:
      case CURL:
        if (isZero(a) || a.op == Op.CONSTANT) {
          return dsl.zero(e.shape);
        }
        return e;
      default:
        return e;
    }
  }

  @Override
  protected Expr visit(Expr.Call2 call) {
    final Expr e = super.visit(call);
    if (!(e instanceof Expr.Call2)) {
      return e;
    }
    final Expr.Call2 call2 = (Expr.Call2) e;
    final Expr a0 = call2.a0;
    final Expr a1 = call2.a1;
    switch (call2.op) {
      case PLUS:
        if (isZero(a0)) {
          return a1;
        }
        if (isZero(a1)) {
          return a0;
        }
        if (a0.op == Op.CONSTANT && a1.op == Op.CONSTANT) {
          return dsl.real(value(a0) + value(a1));
        }
        return e;

      case TIMES:
      case INNER:
      case DOT:
      case OUTER:
        if (isZero(a0) || isZero(a1)) {
          return dsl.zero(e.shape);
        }
        if (a0.op == Op.CONSTANT && a1.op == Op.CONSTANT) {
          return dsl.real(value(a0) * value(a1));
        }
        if (call2.op == Op.TIMES && isOne(a0)) {
          return a1;
        }
        if (call2.op == Op.TIMES && isOne(a1)) {
          return a0;
        }
        return e;

      case DIVIDE:
        if (isZero(a0)) {
          return dsl.zero(e.shape);
        }
        if (isOne(a1)) {
          return a0;
        }
        if (a0.op == Op.CONSTANT && a1.op == Op.CONSTANT && value(a1) != 0d) {
          return dsl.real(value(a0) / value(a1));
        }
        return e;

      default:
        return e;
    }
  }

  @Override
  protected Expr visit(Expr.Power power) {
    final Expr e = super.visit(power);
    if (!(e instanceof Expr.Power)) {
      return e;
    }
    final Expr.Power power1 = (Expr.Power) e;
    if (power1.exponent == 1d) {
      return power1.a;
    }
    if (power1.exponent == 0d) {
      return dsl.real(1d);
    }
    if (power1.a.op == Op.CONSTANT) {
      return dsl.real(Math.pow(value(power1.a), power1.exponent));
    }
    return e;
  }

  private static boolean isZero(Expr e) {
    return e.op == Op.ZERO
        || e.op == Op.CONSTANT && value(e) == 0d;
  }

  private static boolean isOne(Expr e) {
    return e.op == Op.CONSTANT && value(e) == 1d;
  }

  private static double value(Expr e) {
    return ((Expr.Constant) e).value;
  }
}

// End Simplifier.java
