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

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.formc.element.Cell;

/**
 * Quadrature rules on reference cells.
 *
 * <p>Simplices use collapsed Gauss-Jacobi rules: the Duffy transform maps the
 * unit square (cube) onto the triangle (tetrahedron) and the collapsed
 * directions absorb the Jacobian of the transform into a Jacobi weight. The
 * interval, quadrilateral and hexahedron use tensor products of
 * Gauss-Legendre rules.
 *
 * <p>Rules are computed once per (cell, facet, degree) and shared.
 */
public abstract class QuadratureRules {
  private QuadratureRules() {}

  /** Key is [cell ordinal, facet (or -1), degree]. */
  private static final LoadingCache<List<Integer>, QuadratureRule> CACHE =
      CacheBuilder.newBuilder().build(CacheLoader.from(QuadratureRules::build));

  /**
   * Returns a rule on a reference cell that integrates every polynomial of
   * total degree at most {@code degree} exactly.
   */
  public static QuadratureRule rule(Cell cell, int degree) {
    checkArgument(degree >= 0, "negative degree %s", degree);
    return CACHE.getUnchecked(ImmutableList.of(cell.ordinal(), -1, degree));
  }

  /**
   * Returns a rule on facet {@code facet} of a reference cell, obtained by
   * mapping the rule of the facet cell.
   */
  public static QuadratureRule facetRule(Cell cell, int facet, int degree) {
    checkArgument(degree >= 0, "negative degree %s", degree);
    checkArgument(facet >= 0 && facet < cell.facetCount(),
        "cell %s has no facet %s", cell, facet);
    return CACHE.getUnchecked(ImmutableList.of(cell.ordinal(), facet, degree));
  }

  /** Returns the number of points in each direction of a rule that is exact
   * to a given degree. */
  public static int pointsPerDirection(int degree) {
    return (degree + 2) / 2;
  }

  private static QuadratureRule build(List<Integer> key) {
    final Cell cell = Cell.values()[key.get(0)];
    final int facet = key.get(1);
    final int degree = key.get(2);
    if (facet >= 0) {
      final QuadratureRule r = rule(cell.facetCell(), degree);
      final double[][] points = new double[r.size()][];
      for (int i = 0; i < points.length; i++) {
        points[i] = cell.facetPoint(facet, r.point(i));
      }
      return new QuadratureRule(cell, facet, degree, points, r.weights());
    }
    final int m = pointsPerDirection(degree);
    switch (cell) {
      case VERTEX:
        return new QuadratureRule(cell, -1, degree, new double[][] {{}},
            new double[] {1d});
      case INTERVAL:
      case QUADRILATERAL:
      case HEXAHEDRON:
        return gaussLegendre(cell, degree, m);
      case TRIANGLE:
        return collapsedTriangle(degree, m);
      case TETRAHEDRON:
        return collapsedTetrahedron(degree, m);
      default:
        throw new AssertionError(cell);
    }
  }

  private static QuadratureRule gaussLegendre(Cell cell, int degree, int m) {
    final double[] x = GaussJacobi.points(0, 0, m);
    final double[] w = GaussJacobi.weights(0, 0, m);
    final int d = cell.dimension();
    int n = 1;
    for (int i = 0; i < d; i++) {
      n *= m;
    }
    final double[][] points = new double[n][d];
    final double[] weights = new double[n];
    for (int k = 0; k < n; k++) {
      // Index in direction 0 varies fastest
      double weight = 1d;
      int rest = k;
      for (int i = 0; i < d; i++) {
        final int j = rest % m;
        rest /= m;
        points[k][i] = 0.5d * (1d + x[j]);
        weight *= 0.5d * w[j];
      }
      weights[k] = weight;
    }
    return new QuadratureRule(cell, -1, degree, points, weights);
  }

  private static QuadratureRule collapsedTriangle(int degree, int m) {
    final double[] x = GaussJacobi.points(0, 0, m);
    final double[] wx = GaussJacobi.weights(0, 0, m);
    final double[] y = GaussJacobi.points(1, 0, m);
    final double[] wy = GaussJacobi.weights(1, 0, m);
    final double[][] points = new double[m * m][];
    final double[] weights = new double[m * m];
    int k = 0;
    for (int i = 0; i < m; i++) {
      for (int j = 0; j < m; j++) {
        final double u = 0.5d * (1d + x[i]);
        final double v = 0.5d * (1d + y[j]);
        points[k] = new double[] {u * (1d - v), v};
        weights[k] = wx[i] * wy[j] * 0.125d;
        ++k;
      }
    }
    return new QuadratureRule(Cell.TRIANGLE, -1, degree, points, weights);
  }

  private static QuadratureRule collapsedTetrahedron(int degree, int m) {
    final double[] x = GaussJacobi.points(0, 0, m);
    final double[] wx = GaussJacobi.weights(0, 0, m);
    final double[] y = GaussJacobi.points(1, 0, m);
    final double[] wy = GaussJacobi.weights(1, 0, m);
    final double[] z = GaussJacobi.points(2, 0, m);
    final double[] wz = GaussJacobi.weights(2, 0, m);
    final double[][] points = new double[m * m * m][];
    final double[] weights = new double[m * m * m];
    int k = 0;
    for (int i = 0; i < m; i++) {
      for (int j = 0; j < m; j++) {
        for (int l = 0; l < m; l++) {
          final double u = 0.5d * (1d + x[i]);
          final double v = 0.5d * (1d + y[j]);
          final double w = 0.5d * (1d + z[l]);
          points[k] =
              new double[] {u * (1d - v) * (1d - w), v * (1d - w), w};
          weights[k] = wx[i] * wy[j] * wz[l] * 0.015625d;
          ++k;
        }
      }
    }
    return new QuadratureRule(Cell.TETRAHEDRON, -1, degree, points, weights);
  }
}

// End QuadratureRules.java
