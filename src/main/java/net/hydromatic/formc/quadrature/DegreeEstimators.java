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
package net.hydromatic.formc.quadrature;

import static com.google.common.base.Preconditions.checkArgument;

import net.hydromatic.formc.ast.Expr;
import net.hydromatic.formc.compile.DegreeException;
import net.hydromatic.formc.element.Domain;

/** Implementations of {@link DegreeEstimator}. */
public abstract class DegreeEstimators {
  private DegreeEstimators() {}

  /** Degree added for each application of a function that is not a
   * polynomial, such as {@code sqrt} or {@code exp}. */
  public static final int NONLINEAR_INCREMENT = 2;

  /** Returns the standard estimator, which rejects estimates greater than
   * {@code maxDegree}. */
  public static DegreeEstimator standard(int maxDegree) {
    checkArgument(maxDegree >= 0, "negative max degree %s", maxDegree);
    return (integrand, domain) -> {
      final int degree;
      try {
        degree =
            Math.addExact(degree(integrand, domain), jacobianDegree(domain));
      } catch (ArithmeticException e) {
        throw new DegreeException("estimated degree of " + integrand
            + " exceeds maximum " + maxDegree, -1);
      }
      if (degree > maxDegree) {
        throw new DegreeException("estimated degree " + degree
            + " of " + integrand + " exceeds maximum " + maxDegree, degree);
      }
      return degree;
    };
  }

  /** Returns an estimator that always returns the same degree. */
  public static DegreeEstimator fixed(int degree) {
    checkArgument(degree >= 0, "negative degree %s", degree);
    return (integrand, domain) -> degree;
  }

  /** Returns the degree of the determinant of the Jacobian of the mapping
   * from the reference cell to a cell of {@code domain}. */
  public static int jacobianDegree(Domain domain) {
    if (domain.isAffine()) {
      return 0;
    }
    final int d = domain.dimension();
    final int q = domain.coordinateDegree;
    return domain.cell.isSimplex() ? d * (q - 1) : d * q - 1;
  }

  /** Returns the degree of an expression, not counting the Jacobian.
   *
   * @throws ArithmeticException if the degree overflows an {@code int} */
  static int degree(Expr e, Domain domain) {
    switch (e.op) {
      case ARGUMENT:
        return ((Expr.Argument) e).element.degree;
      case COEFFICIENT:
        return ((Expr.Coefficient) e).element.degree;
      case CONSTANT:
      case ZERO:
        return 0;
      case SPATIAL_COORDINATE:
        return domain.coordinateDegree;
      case FACET_NORMAL:
        return domain.isAffine() ? 0 : domain.coordinateDegree - 1;

      case GRAD:
      case DIV:
      case CURL:
        final int degree = degree(((Expr.Call1) e).a, domain);
        return domain.isAffine() ? Math.max(degree - 1, 0) : degree;

      case PLUS:
        final Expr.Call2 plus = (Expr.Call2) e;
        return Math.max(degree(plus.a0, domain), degree(plus.a1, domain));

      case TIMES:
      case DIVIDE:
      case INNER:
      case DOT:
      case OUTER:
        final Expr.Call2 product = (Expr.Call2) e;
        return Math.addExact(degree(product.a0, domain),
            degree(product.a1, domain));

      case POWER:
        final Expr.Power power = (Expr.Power) e;
        final int p = power.integerExponent();
        return p >= 0
            ? Math.multiplyExact(p, degree(power.a, domain))
            : Math.addExact(degree(power.a, domain), NONLINEAR_INCREMENT);

      case NEGATE:
      case TRANSPOSE:
        return degree(((Expr.Call1) e).a, domain);
      case INDEXED:
        return degree(((Expr.Indexed) e).a, domain);
      case RESTRICTED:
        return degree(((Expr.Restricted) e).a, domain);

      default:
        if (e.op.isNonlinear()) {
          return Math.addExact(degree(((Expr.Call1) e).a, domain),
              NONLINEAR_INCREMENT);
        }
        throw new AssertionError("unknown op " + e.op);
    }
  }
}

// End DegreeEstimators.java
