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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import net.hydromatic.formc.ast.Expr;
import net.hydromatic.formc.ast.Exprs;
import net.hydromatic.formc.ast.Op;
import net.hydromatic.formc.ast.Pos;
import net.hydromatic.formc.ast.Side;
import net.hydromatic.formc.element.Domain;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Expands an expression into sums of monomials, one per scalar component.
 *
 * <p>Tensor algebra is carried out component by component; components are
 * stored in row-major order. Derivatives are pushed down to the terminals by
 * linearity, the product rule and the chain rule.
 */
public class Expander {
  private final Domain domain;

  private Expander(Domain domain) {
    this.domain = requireNonNull(domain);
  }

  /** Expands a scalar integrand on a domain. */
  public static Sum expand(Expr integrand, Domain domain) {
    checkArgument(integrand.shape.isScalar(), "not scalar: %s", integrand);
    final Expander expander = new Expander(domain);
    return expander.components(integrand, null)[0];
  }

  /** Returns the components of an expression. */
  Sum[] components(Expr e, @Nullable Side side) {
    final int d = domain.dimension();
    final Sum[] a;
    final Sum[] b;
    final Sum[] r;
    switch (e.op) {
      case ARGUMENT:
        final Expr.Argument argument = (Expr.Argument) e;
        r = new Sum[e.shape.size()];
        for (int c = 0; c < r.length; c++) {
          r[c] = Sum.of(
              new Atom.Basis(argument.number, argument.element, c,
                  ImmutableList.of(), side));
        }
        return r;

      case COEFFICIENT:
        final Expr.Coefficient coefficient = (Expr.Coefficient) e;
        r = new Sum[e.shape.size()];
        for (int c = 0; c < r.length; c++) {
          r[c] = Sum.of(
              new Atom.Coefficient(coefficient, c, ImmutableList.of(), side));
        }
        return r;

      case CONSTANT:
        return new Sum[] {Sum.constant(((Expr.Constant) e).value)};

      case ZERO:
        return zeros(e.shape.size());

      case FACET_NORMAL:
        r = new Sum[d];
        for (int c = 0; c < d; c++) {
          r[c] = Sum.of(new Atom.Normal(c, side));
        }
        return r;

      case SPATIAL_COORDINATE:
        r = new Sum[d];
        for (int c = 0; c < d; c++) {
          r[c] = Sum.of(new Atom.Coordinate(c));
        }
        return r;

      case GRAD:
        a = differentiable(((Expr.Call1) e).a, side);
        r = new Sum[a.length * d];
        for (int k = 0; k < a.length; k++) {
          for (int i = 0; i < d; i++) {
            r[k * d + i] = a[k].derivative(i);
          }
        }
        return r;

      case DIV:
        a = differentiable(((Expr.Call1) e).a, side);
        r = zeros(a.length / d);
        for (int k = 0; k < r.length; k++) {
          for (int i = 0; i < d; i++) {
            r[k] = r[k].plus(a[k * d + i].derivative(i));
          }
        }
        return r;

      case CURL:
        final Expr curlArg = ((Expr.Call1) e).a;
        a = differentiable(curlArg, side);
        if (d == 3) {
          return new Sum[] {
            a[2].derivative(1).plus(a[1].derivative(2).times(-1d)),
            a[0].derivative(2).plus(a[2].derivative(0).times(-1d)),
            a[1].derivative(0).plus(a[0].derivative(1).times(-1d))
          };
        } else if (curlArg.shape.isScalar()) {
          return new Sum[] {
            a[0].derivative(1), a[0].derivative(0).times(-1d)
          };
        } else {
          return new Sum[] {
            a[1].derivative(0).plus(a[0].derivative(1).times(-1d))
          };
        }

      case INNER:
        a = components(((Expr.Call2) e).a0, side);
        b = components(((Expr.Call2) e).a1, side);
        Sum s = Sum.ZERO;
        for (int k = 0; k < a.length; k++) {
          s = s.plus(a[k].times(b[k]));
        }
        return new Sum[] {s};

      case DOT:
        final Expr.Call2 dot = (Expr.Call2) e;
        a = components(dot.a0, side);
        b = components(dot.a1, side);
        if (dot.a0.shape.isScalar()) {
          return new Sum[] {a[0].times(b[0])};
        }
        final int n = dot.a0.shape.last();
        final int rows = a.length / n;
        final int columns = b.length / n;
        r = zeros(rows * columns);
        for (int i = 0; i < rows; i++) {
          for (int j = 0; j < columns; j++) {
            for (int k = 0; k < n; k++) {
              r[i * columns + j] = r[i * columns + j]
                  .plus(a[i * n + k].times(b[k * columns + j]));
            }
          }
        }
        return r;

      case OUTER:
        a = components(((Expr.Call2) e).a0, side);
        b = components(((Expr.Call2) e).a1, side);
        r = new Sum[a.length * b.length];
        for (int i = 0; i < a.length; i++) {
          for (int j = 0; j < b.length; j++) {
            r[i * b.length + j] = a[i].times(b[j]);
          }
        }
        return r;

      case TRANSPOSE:
        final Expr transposed = ((Expr.Call1) e).a;
        a = components(transposed, side);
        final int m0 = transposed.shape.dim(0);
        final int m1 = transposed.shape.dim(1);
        r = new Sum[a.length];
        for (int i = 0; i < m0; i++) {
          for (int j = 0; j < m1; j++) {
            r[j * m0 + i] = a[i * m1 + j];
          }
        }
        return r;

      case PLUS:
        a = components(((Expr.Call2) e).a0, side);
        b = components(((Expr.Call2) e).a1, side);
        r = new Sum[a.length];
        for (int k = 0; k < r.length; k++) {
          r[k] = a[k].plus(b[k]);
        }
        return r;

      case TIMES:
        a = components(((Expr.Call2) e).a0, side);
        b = components(((Expr.Call2) e).a1, side);
        if (a.length == 1) {
          return scale(b, a[0]);
        }
        return scale(a, b[0]);

      case DIVIDE:
        a = components(((Expr.Call2) e).a0, side);
        b = components(((Expr.Call2) e).a1, side);
        if (b[0].isZero()) {
          throw new CompileException("division by zero in " + e, Pos.ZERO);
        }
        return scale(a, Sum.apply(Op.POWER, -1d, b[0]));

      case NEGATE:
        a = components(((Expr.Call1) e).a, side);
        return scale(a, Sum.constant(-1d));

      case POWER:
        final Expr.Power power = (Expr.Power) e;
        a = components(power.a, side);
        return new Sum[] {Sum.apply(Op.POWER, power.exponent, a[0])};

      case INDEXED:
        final Expr.Indexed indexed = (Expr.Indexed) e;
        a = components(indexed.a, side);
        final int size = e.shape.size();
        return Arrays.copyOfRange(a, indexed.component * size,
            (indexed.component + 1) * size);

      case RESTRICTED:
        final Expr.Restricted restricted = (Expr.Restricted) e;
        return components(restricted.a, restricted.side);

      case SQRT:
      case EXP:
      case LN:
      case SIN:
      case COS:
      case ABS:
      case SIGN:
        a = components(((Expr.Call1) e).a, side);
        return new Sum[] {Sum.apply(e.op, 0d, a[0])};

      default:
        throw new AssertionError("unknown op " + e.op);
    }
  }

  /** Expands the operand of a differential operator. */
  private Sum[] differentiable(Expr e, @Nullable Side side) {
    if (!domain.isAffine() && Exprs.contains(e, Op.FACET_NORMAL)) {
      throw new CompileException("cannot differentiate the facet normal on "
          + "non-affine domain " + domain, Pos.ZERO);
    }
    return components(e, side);
  }

  private static Sum[] scale(Sum[] a, Sum factor) {
    final Sum[] r = new Sum[a.length];
    for (int k = 0; k < r.length; k++) {
      r[k] = a[k].times(factor);
    }
    return r;
  }

  private static Sum[] zeros(int n) {
    final Sum[] r = new Sum[n];
    Arrays.fill(r, Sum.ZERO);
    return r;
  }
}

// End Expander.java
