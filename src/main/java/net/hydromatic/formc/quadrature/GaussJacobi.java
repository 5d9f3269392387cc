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

/**
 * Gauss-Jacobi quadrature on [-1, 1] with weight function
 * (1 - x)<sup>a</sup> (1 + x)<sup>b</sup>.
 *
 * <p>With {@code a = b = 0} this is Gauss-Legendre quadrature. An
 * {@code m}-point rule integrates polynomials of degree {@code 2m - 1}
 * exactly.
 */
public abstract class GaussJacobi {
  private GaussJacobi() {}

  private static final int MAX_ITERATIONS = 100;
  private static final double TOLERANCE = 1e-15;

  /** Returns the {@code m} points, in ascending order. */
  public static double[] points(int a, int b, int m) {
    checkArgument(m >= 1, "need at least one point");
    final double[] x = new double[m];
    for (int k = 0; k < m; k++) {
      // Chebyshev initial guess, averaged with the previous root
      double r = -Math.cos((2d * k + 1d) * Math.PI / (2d * m));
      if (k > 0) {
        r = 0.5d * (r + x[k - 1]);
      }
      for (int j = 0; j < MAX_ITERATIONS; j++) {
        double s = 0d;
        for (int i = 0; i < k; i++) {
          s += 1d / (r - x[i]);
        }
        final double f = jacobi(a, b, m, r);
        final double fp = jacobiDerivative(a, b, m, r);
        final double delta = f / (fp - f * s);
        r -= delta;
        if (Math.abs(delta) < TOLERANCE) {
          break;
        }
      }
      x[k] = r;
    }
    return x;
  }

  /** Returns the weights that go with {@link #points(int, int, int)}. */
  public static double[] weights(int a, int b, int m) {
    final double[] x = points(a, b, m);
    final double a1 = Math.pow(2d, a + b + 1);
    final double a2 = factorial(a + m) * factorial(b + m);
    final double a3 = factorial(m + a + b);
    final double a4 = factorial(m);
    final double[] w = new double[m];
    for (int i = 0; i < m; i++) {
      final double fp = jacobiDerivative(a, b, m, x[i]);
      w[i] = a1 * a2 / a3 / a4 / ((1d - x[i] * x[i]) * fp * fp);
    }
    return w;
  }

  /** Evaluates the Jacobi polynomial P<sub>n</sub><sup>(a,b)</sup> at x by
   * the three-term recurrence. */
  public static double jacobi(int a, int b, int n, double x) {
    if (n == 0) {
      return 1d;
    }
    double p0 = 1d;
    double p1 = 0.5d * (a - b + (a + b + 2d) * x);
    for (int k = 2; k <= n; k++) {
      final double a1 = 2d * k * (k + a + b) * (2d * k + a + b - 2d);
      final double a2 = (2d * k + a + b - 1d) * (a * a - b * b);
      final double a3 =
          (2d * k + a + b - 2d) * (2d * k + a + b - 1d) * (2d * k + a + b);
      final double a4 = 2d * (k + a - 1d) * (k + b - 1d) * (2d * k + a + b);
      final double p2 = ((a2 + a3 * x) * p1 - a4 * p0) / a1;
      p0 = p1;
      p1 = p2;
    }
    return p1;
  }

  /** Evaluates the derivative of P<sub>n</sub><sup>(a,b)</sup> at x. */
  public static double jacobiDerivative(int a, int b, int n, double x) {
    if (n == 0) {
      return 0d;
    }
    return 0.5d * (a + b + n + 1d) * jacobi(a + 1, b + 1, n - 1, x);
  }

  private static double factorial(int n) {
    double f = 1d;
    for (int i = 2; i <= n; i++) {
      f *= i;
    }
    return f;
  }
}

// End GaussJacobi.java
