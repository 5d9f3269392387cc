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
package net.hydromatic.formc.element;

import com.google.common.collect.ImmutableMap;
import java.util.Locale;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Reference cell.
 *
 * <p>Vertices follow the UFC convention. Simplices have vertex 0 at the
 * origin and vertex {@code i} at the {@code i}th unit vector; facet {@code i}
 * of a simplex is the facet opposite vertex {@code i}. The unit square and
 * cube number their vertices lexicographically with x varying fastest.
 */
public enum Cell {
  VERTEX(0, true, new double[][] {{}}, new int[][] {}),

  INTERVAL(1, true, new double[][] {{0}, {1}}, new int[][] {{1}, {0}}),

  TRIANGLE(
      2,
      true,
      new double[][] {{0, 0}, {1, 0}, {0, 1}},
      new int[][] {{1, 2}, {0, 2}, {0, 1}}),

  TETRAHEDRON(
      3,
      true,
      new double[][] {{0, 0, 0}, {1, 0, 0}, {0, 1, 0}, {0, 0, 1}},
      new int[][] {{1, 2, 3}, {0, 2, 3}, {0, 1, 3}, {0, 1, 2}}),

  QUADRILATERAL(
      2,
      false,
      new double[][] {{0, 0}, {1, 0}, {0, 1}, {1, 1}},
      new int[][] {{0, 1}, {0, 2}, {1, 3}, {2, 3}}),

  HEXAHEDRON(
      3,
      false,
      new double[][] {
        {0, 0, 0}, {1, 0, 0}, {0, 1, 0}, {1, 1, 0},
        {0, 0, 1}, {1, 0, 1}, {0, 1, 1}, {1, 1, 1}
      },
      new int[][] {
        {0, 1, 2, 3}, {0, 1, 4, 5}, {0, 2, 4, 6},
        {1, 3, 5, 7}, {2, 3, 6, 7}, {4, 5, 6, 7}
      });

  private static final int[][] TETRAHEDRON_EDGES = {
    {2, 3}, {1, 3}, {1, 2}, {0, 3}, {0, 2}, {0, 1}
  };

  private static final int[][] HEXAHEDRON_EDGES = {
    {0, 1}, {0, 2}, {0, 4}, {1, 3}, {1, 5}, {2, 3},
    {2, 6}, {3, 7}, {4, 5}, {4, 6}, {5, 7}, {6, 7}
  };

  /** Map of cells by lower-case name, e.g. "triangle". */
  public static final ImmutableMap<String, Cell> BY_NAME;

  static {
    final ImmutableMap.Builder<String, Cell> b = ImmutableMap.builder();
    for (Cell cell : values()) {
      b.put(cell.lowerName(), cell);
    }
    BY_NAME = b.build();
  }

  private final int dimension;
  private final boolean simplex;
  private final double[][] vertices;
  private final int[][] facets;

  Cell(int dimension, boolean simplex, double[][] vertices, int[][] facets) {
    this.dimension = dimension;
    this.simplex = simplex;
    this.vertices = vertices;
    this.facets = facets;
  }

  /** Returns the name of this cell in form files, e.g. "triangle". */
  public String lowerName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Looks up a cell by name; returns null if not found. */
  public static @Nullable Cell lookup(String name) {
    return BY_NAME.get(name);
  }

  /** Topological dimension; also the geometric dimension. */
  public int dimension() {
    return dimension;
  }

  /** Whether this cell is a simplex (vertex, interval, triangle,
   * tetrahedron). */
  public boolean isSimplex() {
    return simplex;
  }

  /** Returns the coordinates of a vertex of the reference cell. */
  public double[] vertex(int i) {
    return vertices[i].clone();
  }

  public int facetCount() {
    return facets.length;
  }

  /**
   * Returns the vertices of each entity of a given dimension, numbered as in
   * UFC: the vertices themselves, then edges, facets and the cell. Within an
   * entity, vertex indices are ascending.
   *
   * <p>Edge {@code i} of a triangle, like facet {@code i} of any simplex, is
   * opposite vertex {@code i}.
   */
  public int[][] entities(int dim) {
    if (dim == 0) {
      final int[][] e = new int[vertices.length][];
      for (int i = 0; i < e.length; i++) {
        e[i] = new int[] {i};
      }
      return e;
    }
    if (dim == dimension) {
      final int[] all = new int[vertices.length];
      for (int i = 0; i < all.length; i++) {
        all[i] = i;
      }
      return new int[][] {all};
    }
    if (dim == dimension - 1) {
      return copy(facets);
    }
    if (dim == 1 && this == TETRAHEDRON) {
      return copy(TETRAHEDRON_EDGES);
    }
    if (dim == 1 && this == HEXAHEDRON) {
      return copy(HEXAHEDRON_EDGES);
    }
    throw new IllegalArgumentException("cell " + this
        + " has no entities of dimension " + dim);
  }

  private static int[][] copy(int[][] arrays) {
    final int[][] copy = new int[arrays.length][];
    for (int i = 0; i < arrays.length; i++) {
      copy[i] = arrays[i].clone();
    }
    return copy;
  }

  /** Returns the reference cell of this cell's facets. */
  public Cell facetCell() {
    switch (this) {
      case INTERVAL:
        return VERTEX;
      case TRIANGLE:
      case QUADRILATERAL:
        return INTERVAL;
      case TETRAHEDRON:
        return TRIANGLE;
      case HEXAHEDRON:
        return QUADRILATERAL;
      default:
        throw new IllegalArgumentException("cell " + this + " has no facets");
    }
  }

  /** Returns the volume (length, area) of the reference cell. */
  public double referenceVolume() {
    if (!simplex) {
      return 1d;
    }
    double v = 1d;
    for (int i = 2; i <= dimension; i++) {
      v /= i;
    }
    return v;
  }

  /** Returns the barycentre of the reference cell. */
  public double[] centroid() {
    final double[] c = new double[dimension];
    for (double[] vertex : vertices) {
      for (int i = 0; i < dimension; i++) {
        c[i] += vertex[i] / vertices.length;
      }
    }
    return c;
  }

  /**
   * Returns the tangent vectors of a facet: the edges from its first vertex to
   * its second (and third) vertex. A point with facet coordinates {@code s}
   * is at {@code v0 + sum s[k] * tangent[k]}.
   */
  public double[][] facetTangents(int facet) {
    final int[] f = facets[facet];
    final double[] v0 = vertices[f[0]];
    final int n = dimension - 1;
    final double[][] t = new double[n][dimension];
    for (int k = 0; k < n; k++) {
      final double[] v = vertices[f[k + 1]];
      for (int i = 0; i < dimension; i++) {
        t[k][i] = v[i] - v0[i];
      }
    }
    return t;
  }

  /** Maps a point of the facet cell to the coordinates of this cell. */
  public double[] facetPoint(int facet, double[] s) {
    final double[] x = vertices[facets[facet][0]].clone();
    final double[][] t = facetTangents(facet);
    for (int k = 0; k < t.length; k++) {
      for (int i = 0; i < dimension; i++) {
        x[i] += s[k] * t[k][i];
      }
    }
    return x;
  }

  /** Returns the outward unit normal of a facet of the reference cell. */
  public double[] referenceFacetNormal(int facet) {
    final double[] v0 = vertices[facets[facet][0]];
    final double[] n = new double[dimension];
    switch (dimension) {
      case 1:
        n[0] = 1d;
        break;
      case 2:
        final double[] t = facetTangents(facet)[0];
        n[0] = t[1];
        n[1] = -t[0];
        break;
      case 3:
        final double[][] ts = facetTangents(facet);
        n[0] = ts[0][1] * ts[1][2] - ts[0][2] * ts[1][1];
        n[1] = ts[0][2] * ts[1][0] - ts[0][0] * ts[1][2];
        n[2] = ts[0][0] * ts[1][1] - ts[0][1] * ts[1][0];
        break;
      default:
        throw new IllegalArgumentException("cell " + this + " has no facets");
    }
    // Point away from the centroid
    final double[] c = centroid();
    double dot = 0d;
    double norm = 0d;
    for (int i = 0; i < dimension; i++) {
      dot += n[i] * (c[i] - v0[i]);
      norm += n[i] * n[i];
    }
    final double scale = (dot > 0 ? -1d : 1d) / Math.sqrt(norm);
    for (int i = 0; i < dimension; i++) {
      n[i] *= scale;
    }
    return n;
  }
}

// End Cell.java
