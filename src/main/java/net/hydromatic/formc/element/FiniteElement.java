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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.formc.ast.Shape;

/**
 * Finite element: a family, a domain, a polynomial degree and a value shape,
 * together with the nodal basis on the reference cell.
 *
 * <p>Create instances using {@link Elements#create}, which validates the
 * combination and returns a shared instance.
 *
 * <p>A vector element has {@code n} copies of the scalar basis. Its degrees
 * of freedom are numbered component by component: dof {@code i} belongs to
 * component {@code i / scalarDimension()} and is a copy of scalar basis
 * function {@code i % scalarDimension()}.
 */
public final class FiniteElement {
  public final Family family;
  public final Domain domain;
  public final int degree;
  public final Shape valueShape;
  private final double[][] nodes;
  private final ImmutableList<Polynomial> scalarBasis;

  FiniteElement(Family family, Domain domain, int degree, Shape valueShape,
      double[][] nodes, List<Polynomial> scalarBasis) {
    this.family = requireNonNull(family);
    this.domain = requireNonNull(domain);
    this.degree = degree;
    this.valueShape = requireNonNull(valueShape);
    this.nodes = nodes;
    this.scalarBasis = ImmutableList.copyOf(scalarBasis);
  }

  public Cell cell() {
    return domain.cell;
  }

  /** Number of basis functions of one component. */
  public int scalarDimension() {
    return scalarBasis.size();
  }

  /** Local dimension: the number of basis functions on one cell. */
  public int spaceDimension() {
    return scalarBasis.size() * valueShape.size();
  }

  /** Returns the component that basis function {@code dof} is nonzero in. */
  public int componentOf(int dof) {
    return dof / scalarBasis.size();
  }

  /** Returns the reference coordinates of the node of scalar dof {@code i}. */
  public double[] node(int i) {
    return nodes[i].clone();
  }

  /** Returns scalar basis function {@code i}. */
  public Polynomial scalarBasis(int i) {
    return scalarBasis.get(i);
  }

  /**
   * Returns component {@code component} of basis function {@code dof}; zero if
   * the function is nonzero only in another component.
   */
  public Polynomial basis(int dof, int component) {
    if (componentOf(dof) != component) {
      return Polynomial.constant(cell().dimension(), 0d);
    }
    return scalarBasis.get(dof % scalarBasis.size());
  }

  /**
   * Tabulates a reference derivative of one component of every basis
   * function at a list of points.
   *
   * @param component Value component
   * @param derivatives Reference directions to differentiate in, possibly
   *     empty; e.g. [0, 1] is the second derivative d/dX0 d/dX1
   * @param points Points on the reference cell
   * @return Values indexed by [dof][point]
   */
  public double[][] tabulate(int component, List<Integer> derivatives,
      List<double[]> points) {
    final int n = spaceDimension();
    final double[][] values = new double[n][points.size()];
    for (int dof = 0; dof < n; dof++) {
      if (componentOf(dof) != component) {
        continue;
      }
      final Polynomial p =
          scalarBasis.get(dof % scalarBasis.size()).derivative(derivatives);
      for (int k = 0; k < points.size(); k++) {
        values[dof][k] = p.evaluate(points.get(k));
      }
    }
    return values;
  }

  @Override
  public int hashCode() {
    return Objects.hash(family, domain, degree, valueShape);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof FiniteElement
            && family == ((FiniteElement) o).family
            && domain.equals(((FiniteElement) o).domain)
            && degree == ((FiniteElement) o).degree
            && valueShape.equals(((FiniteElement) o).valueShape);
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder();
    b.append(valueShape.isScalar() ? "FiniteElement" : "VectorElement")
        .append("(\"")
        .append(family.displayName)
        .append("\", ")
        .append(domain)
        .append(", ")
        .append(degree);
    if (!valueShape.isScalar()) {
      b.append(", ").append(valueShape.first());
    }
    return b.append(')').toString();
  }
}

// End FiniteElement.java
