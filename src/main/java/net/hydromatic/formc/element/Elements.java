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

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import com.google.common.primitives.Ints;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import net.hydromatic.formc.ast.Shape;
import net.hydromatic.formc.compile.ElementException;
import net.hydromatic.formc.util.Matrices;

/** Validating, caching factory of {@link FiniteElement}. */
public abstract class Elements {
  private Elements() {}

  /** Coefficients smaller than this are noise from inverting the
   * Vandermonde matrix. */
  private static final double EPSILON = 1e-12;

  private static final LoadingCache<Key, FiniteElement> CACHE =
      CacheBuilder.newBuilder().build(CacheLoader.from(Elements::build));

  /** Creates a scalar element. */
  public static FiniteElement create(Family family, Domain domain,
      int degree) {
    return create(family, domain, degree, Shape.SCALAR);
  }

  /** Creates a vector element with {@code dimension} components. */
  public static FiniteElement vector(Family family, Domain domain, int degree,
      int dimension) {
    if (dimension < 1) {
      throw new ElementException("vector dimension must be positive",
          family, domain.cell, degree);
    }
    return create(family, domain, degree, Shape.of(dimension));
  }

  /**
   * Creates an element, or returns an existing element with the same
   * family, domain, degree and value shape.
   *
   * @throws ElementException if the combination is not supported
   */
  public static FiniteElement create(Family family, Domain domain, int degree,
      Shape valueShape) {
    validate(family, domain.cell, degree, valueShape);
    return CACHE.getUnchecked(new Key(family, domain, degree, valueShape));
  }

  /**
   * Returns the scalar Lagrange element whose basis interpolates each
   * component of the coordinate field of a domain.
   *
   * <p>Coordinate dofs are stored node by node: component {@code i} of node
   * {@code n} is at position {@code n * dimension + i}.
   */
  public static FiniteElement coordinateElement(Domain domain) {
    return create(Family.LAGRANGE, domain, domain.coordinateDegree);
  }

  /** Returns the largest degree of a family on a cell. */
  public static int maxDegree(Family family, Cell cell) {
    switch (family) {
      case REAL:
        return 0;
      case CROUZEIX_RAVIART:
        return 1;
      default:
        return cell.isSimplex() ? 3 : 2;
    }
  }

  /** Returns the smallest degree of a family on a cell. */
  public static int minDegree(Family family) {
    switch (family) {
      case LAGRANGE:
      case CROUZEIX_RAVIART:
        return 1;
      default:
        return 0;
    }
  }

  private static void validate(Family family, Cell cell, int degree,
      Shape valueShape) {
    if (cell == Cell.VERTEX) {
      throw new ElementException("cell has no interior", family, cell,
          degree);
    }
    if (family == Family.CROUZEIX_RAVIART
        && cell != Cell.TRIANGLE
        && cell != Cell.TETRAHEDRON) {
      throw new ElementException(
          "Crouzeix-Raviart requires a triangle or tetrahedron", family, cell,
          degree);
    }
    if (degree < minDegree(family) || degree > maxDegree(family, cell)) {
      throw new ElementException(
          "degree must be between " + minDegree(family) + " and "
              + maxDegree(family, cell),
          family, cell, degree);
    }
    if (valueShape.rank() > 1) {
      throw new ElementException("value shape " + valueShape
          + " has rank greater than 1", family, cell, degree);
    }
  }

  private static FiniteElement build(Key key) {
    final Cell cell = key.domain.cell;
    final double[][] nodes = nodes(key.family, cell, key.degree);
    final List<Polynomial> basis =
        nodalBasis(nodes, cell.dimension(), key.degree, !cell.isSimplex());
    return new FiniteElement(key.family, key.domain, key.degree,
        key.valueShape, nodes, basis);
  }

  /** Returns the nodes of the scalar element. */
  static double[][] nodes(Family family, Cell cell, int degree) {
    if (degree == 0) {
      return new double[][] {cell.centroid()};
    }
    if (family == Family.CROUZEIX_RAVIART) {
      final double[][] nodes = new double[cell.facetCount()][];
      for (int f = 0; f < nodes.length; f++) {
        final double[] s = new double[cell.dimension() - 1];
        for (int k = 0; k < s.length; k++) {
          s[k] = 1d / cell.dimension();
        }
        nodes[f] = cell.facetPoint(f, s);
      }
      return nodes;
    }
    final List<Node> list = new ArrayList<>();
    final List<int[]> lattice = new ArrayList<>();
    addLattice(lattice, new int[cell.dimension()], 0, degree,
        cell.isSimplex());
    for (int[] p : lattice) {
      list.add(new Node(cell, p, degree));
    }
    final List<Node> sorted = Ordering.natural().sortedCopy(list);
    final double[][] nodes = new double[sorted.size()][];
    for (int n = 0; n < nodes.length; n++) {
      nodes[n] = sorted.get(n).x;
    }
    return nodes;
  }

  private static void addLattice(List<int[]> list, int[] point, int i,
      int degree, boolean simplex) {
    if (i == point.length) {
      list.add(point.clone());
      return;
    }
    int used = 0;
    for (int j = 0; j < i; j++) {
      used += point[j];
    }
    final int max = simplex ? degree - used : degree;
    for (int p = 0; p <= max; p++) {
      point[i] = p;
      addLattice(list, point, i + 1, degree, simplex);
    }
    point[i] = 0;
  }

  /** Returns the vertices of the reference cell whose closure contains a
   * lattice point, in ascending order. */
  private static int[] support(Cell cell, int[] p, int degree) {
    final List<Integer> list = new ArrayList<>();
    if (cell.isSimplex()) {
      int sum = 0;
      for (int c : p) {
        sum += c;
      }
      if (sum < degree) {
        list.add(0);
      }
      for (int i = 0; i < p.length; i++) {
        if (p[i] > 0) {
          list.add(i + 1);
        }
      }
    } else {
      final int vertexCount = cell.entities(0).length;
      vertex:
      for (int v = 0; v < vertexCount; v++) {
        final double[] x = cell.vertex(v);
        for (int i = 0; i < p.length; i++) {
          if (p[i] == 0 && x[i] != 0d
              || p[i] == degree && x[i] != 1d) {
            continue vertex;
          }
        }
        list.add(v);
      }
    }
    return Ints.toArray(list);
  }

  /** Computes the basis that is 1 at one node and 0 at the others by
   * inverting the Vandermonde matrix of a monomial basis. */
  private static List<Polynomial> nodalBasis(double[][] nodes, int dimension,
      int degree, boolean tensor) {
    final List<List<Integer>> exponents =
        Polynomial.basisExponents(dimension, degree, tensor);
    final List<Polynomial> monomials = new ArrayList<>();
    for (List<Integer> e : exponents) {
      monomials.add(Polynomial.monomial(e));
    }
    final int n = nodes.length;
    if (monomials.size() != n) {
      throw new IllegalStateException("expected " + monomials.size()
          + " nodes, got " + n);
    }
    final double[][] v = new double[n][n];
    for (int i = 0; i < n; i++) {
      for (int m = 0; m < n; m++) {
        v[i][m] = monomials.get(m).evaluate(nodes[i]);
      }
    }
    final double[][] c = Matrices.solve(v, Matrices.identity(n));
    final ImmutableList.Builder<Polynomial> basis = ImmutableList.builder();
    for (int i = 0; i < n; i++) {
      Polynomial p = Polynomial.constant(dimension, 0d);
      for (int m = 0; m < n; m++) {
        if (Math.abs(c[m][i]) > EPSILON) {
          p = p.plus(monomials.get(m).times(c[m][i]));
        }
      }
      basis.add(p);
    }
    return basis.build();
  }

  /** Node of an element, with the entity of the reference cell that it
   * belongs to.
   *
   * <p>Nodes sort by the dimension of their entity, then by the entity's
   * number, then by distance from the entity's first vertex. */
  private static class Node implements Comparable<Node> {
    final double[] x;
    final int entityDimension;
    final int entityIndex;
    final double distance;

    Node(Cell cell, int[] p, int degree) {
      x = new double[p.length];
      for (int i = 0; i < p.length; i++) {
        x[i] = (double) p[i] / degree;
      }
      final int[] support = support(cell, p, degree);
      final int[] entity = entity(cell, support);
      entityDimension = entity[0];
      entityIndex = entity[1];
      final double[] v0 = cell.vertex(support[0]);
      double s = 0d;
      for (int i = 0; i < x.length; i++) {
        s += (x[i] - v0[i]) * (x[i] - v0[i]);
      }
      distance = s;
    }

    /** Returns the dimension and number of the entity of a cell that has
     * the given vertices. */
    private static int[] entity(Cell cell, int[] vertices) {
      for (int d = 0; d <= cell.dimension(); d++) {
        final int[][] entities = cell.entities(d);
        for (int e = 0; e < entities.length; e++) {
          if (Arrays.equals(entities[e], vertices)) {
            return new int[] {d, e};
          }
        }
      }
      throw new IllegalStateException("no entity of " + cell
          + " has vertices " + Arrays.toString(vertices));
    }

    @Override
    public int compareTo(Node o) {
      return ComparisonChain.start()
          .compare(entityDimension, o.entityDimension)
          .compare(entityIndex, o.entityIndex)
          .compare(distance, o.distance)
          .result();
    }
  }

  /** Cache key. */
  private static class Key {
    final Family family;
    final Domain domain;
    final int degree;
    final Shape valueShape;

    Key(Family family, Domain domain, int degree, Shape valueShape) {
      this.family = family;
      this.domain = domain;
      this.degree = degree;
      this.valueShape = valueShape;
    }

    @Override
    public int hashCode() {
      return ImmutableList.of(family, domain, degree, valueShape).hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Key
              && family == ((Key) o).family
              && domain.equals(((Key) o).domain)
              && degree == ((Key) o).degree
              && valueShape.equals(((Key) o).valueShape);
    }
  }
}

// End Elements.java
