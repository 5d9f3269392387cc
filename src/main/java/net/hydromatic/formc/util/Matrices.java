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

import static com.google.common.base.Preconditions.checkArgument;

/** Small dense matrices, stored as {@code double[row][column]}. */
public abstract class Matrices {
  private Matrices() {}

  /** Returns the determinant of a square matrix of size 0 to 3. */
  public static double det(double[][] m) {
    switch (m.length) {
      case 0:
        return 1d;
      case 1:
        return m[0][0];
      case 2:
        return m[0][0] * m[1][1] - m[0][1] * m[1][0];
      case 3:
        return m[0][0] * (m[1][1] * m[2][2] - m[1][2] * m[2][1])
            - m[0][1] * (m[1][0] * m[2][2] - m[1][2] * m[2][0])
            + m[0][2] * (m[1][0] * m[2][1] - m[1][1] * m[2][0]);
      default:
        throw new IllegalArgumentException("matrix too large: " + m.length);
    }
  }

  /**
   * Returns the inverse of a square matrix of size 1 to 3.
   *
   * @throws ArithmeticException if the matrix is singular
   */
  public static double[][] inverse(double[][] m) {
    final double det = det(m);
    if (det == 0d) {
      throw new ArithmeticException("singular matrix");
    }
    switch (m.length) {
      case 1:
        return new double[][] {{1d / m[0][0]}};
      case 2:
        return new double[][] {
          {m[1][1] / det, -m[0][1] / det}, {-m[1][0] / det, m[0][0] / det}
        };
      case 3:
        final double[][] r = new double[3][3];
        for (int i = 0; i < 3; i++) {
          for (int j = 0; j < 3; j++) {
            // cofactor of (j, i), divided by the determinant
            final int i1 = (j + 1) % 3;
            final int i2 = (j + 2) % 3;
            final int j1 = (i + 1) % 3;
            final int j2 = (i + 2) % 3;
            r[i][j] = (m[i1][j1] * m[i2][j2] - m[i1][j2] * m[i2][j1]) / det;
          }
        }
        return r;
      default:
        throw new IllegalArgumentException("matrix too large: " + m.length);
    }
  }

  /**
   * Solves {@code A X = B} for {@code X} by Gaussian elimination with partial
   * pivoting. Neither argument is modified.
   *
   * @throws ArithmeticException if the matrix is singular
   */
  public static double[][] solve(double[][] a, double[][] b) {
    final int n = a.length;
    checkArgument(b.length == n, "row count mismatch");
    final int m = n == 0 ? 0 : b[0].length;
    final double[][] lu = new double[n][];
    final double[][] x = new double[n][];
    for (int i = 0; i < n; i++) {
      lu[i] = a[i].clone();
      x[i] = b[i].clone();
    }
    for (int k = 0; k < n; k++) {
      int pivot = k;
      for (int i = k + 1; i < n; i++) {
        if (Math.abs(lu[i][k]) > Math.abs(lu[pivot][k])) {
          pivot = i;
        }
      }
      if (Math.abs(lu[pivot][k]) < 1e-300) {
        throw new ArithmeticException("singular matrix");
      }
      swap(lu, k, pivot);
      swap(x, k, pivot);
      for (int i = k + 1; i < n; i++) {
        final double f = lu[i][k] / lu[k][k];
        if (f == 0d) {
          continue;
        }
        for (int j = k; j < n; j++) {
          lu[i][j] -= f * lu[k][j];
        }
        for (int j = 0; j < m; j++) {
          x[i][j] -= f * x[k][j];
        }
      }
    }
    for (int k = n - 1; k >= 0; k--) {
      for (int j = 0; j < m; j++) {
        double s = x[k][j];
        for (int i = k + 1; i < n; i++) {
          s -= lu[k][i] * x[i][j];
        }
        x[k][j] = s / lu[k][k];
      }
    }
    return x;
  }

  /** Returns an identity matrix. */
  public static double[][] identity(int n) {
    final double[][] m = new double[n][n];
    for (int i = 0; i < n; i++) {
      m[i][i] = 1d;
    }
    return m;
  }

  private static void swap(double[][] m, int i, int j) {
    if (i != j) {
      final double[] t = m[i];
      m[i] = m[j];
      m[j] = t;
    }
  }
}

// End Matrices.java
