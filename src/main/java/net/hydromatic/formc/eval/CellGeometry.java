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
package net.hydromatic.formc.eval;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import net.hydromatic.formc.element.Cell;
import net.hydromatic.formc.element.Domain;
import net.hydromatic.formc.element.Elements;
import net.hydromatic.formc.element.FiniteElement;
import net.hydromatic.formc.util.Matrices;

/**
 * Geometry of a physical cell: the mapping from the reference cell, given by
 * the coordinates of the nodes of the domain's coordinate element.
 *
 * <p>Coordinate dofs are stored node by node: component {@code i} of node
 * {@code n} is at position {@code n * dimension + i}. On an affine simplex the
 * nodes are the vertices.
 */
public final class CellGeometry {
  public final Domain domain;
  private final FiniteElement coordinateElement;
  private final double[] coordinateDofs;

  private CellGeometry(Domain domain, double[] coordinateDofs) {
    this.domain = requireNonNull(domain);
    this.coordinateElement = Elements.coordinateElement(domain);
    this.coordinateDofs = coordinateDofs.clone();
    checkArgument(coordinateDofs.length
            == coordinateElement.spaceDimension() * domain.dimension(),
        "expected %s coordinate dofs, got %s",
        coordinateElement.spaceDimension() * domain.dimension(),
        coordinateDofs.length);
  }

  /** Creates the geometry of a cell given the coordinates of its nodes. */
  public static CellGeometry of(Domain domain, double... coordinateDofs) {
    return new CellGeometry(domain, coordinateDofs);
  }

  /** Returns the geometry of the reference cell itself, whose mapping is
   * the identity. */
  public static CellGeometry reference(Domain domain) {
    return new CellGeometry(domain, referenceCoordinateDofs(domain));
  }

  /** Returns the coordinate dofs of the reference cell. */
  public static double[] referenceCoordinateDofs(Domain domain) {
    final FiniteElement e = Elements.coordinateElement(domain);
    final int d = domain.dimension();
    final double[] dofs = new double[e.spaceDimension() * d];
    for (int n = 0; n < e.spaceDimension(); n++) {
      System.arraycopy(e.node(n), 0, dofs, n * d, d);
    }
    return dofs;
  }

  /** Returns a copy of the coordinate dofs. */
  public double[] coordinateDofs() {
    return coordinateDofs.clone();
  }

  private int dimension() {
    return domain.dimension();
  }

  /** Returns the physical coordinates of a reference point. */
  public double[] x(double[] point) {
    final int d = dimension();
    final double[] x = new double[d];
    for (int n = 0; n < coordinateElement.spaceDimension(); n++) {
      final double phi = coordinateElement.scalarBasis(n).evaluate(point);
      for (int i = 0; i < d; i++) {
        x[i] += coordinateDofs[n * d + i] * phi;
      }
    }
    return x;
  }

  /** Returns the Jacobian of the mapping at a reference point;
   * {@code J[i][a]} is the derivative of physical coordinate {@code i} with
   * respect to reference coordinate {@code a}. */
  public double[][] jacobian(double[] point) {
    final int d = dimension();
    final double[][] j = new double[d][d];
    for (int n = 0; n < coordinateElement.spaceDimension(); n++) {
      for (int a = 0; a < d; a++) {
        final double dphi =
            coordinateElement.scalarBasis(n).derivative(a).evaluate(point);
        for (int i = 0; i < d; i++) {
          j[i][a] += coordinateDofs[n * d + i] * dphi;
        }
      }
    }
    return j;
  }

  /** Returns the absolute value of the determinant of the Jacobian. */
  public double det(double[] point) {
    return Math.abs(Matrices.det(jacobian(point)));
  }

  /** Returns the inverse of the Jacobian; {@code K[a][i]} is the derivative
   * of reference coordinate {@code a} with respect to physical coordinate
   * {@code i}. */
  public double[][] inverseJacobian(double[] point) {
    return Matrices.inverse(jacobian(point));
  }

  /** Returns the ratio of the measure of a physical facet to the measure of
   * the reference facet, at a reference point on the facet. */
  public double facetDet(int facet, double[] point) {
    final Cell cell = domain.cell;
    final int d = dimension();
    if (d == 1) {
      return 1d;
    }
    final double[][] j = jacobian(point);
    final double[][] tangents = cell.facetTangents(facet);
    final double[][] t = new double[tangents.length][d];
    for (int k = 0; k < tangents.length; k++) {
      for (int i = 0; i < d; i++) {
        for (int a = 0; a < d; a++) {
          t[k][i] += j[i][a] * tangents[k][a];
        }
      }
    }
    if (d == 2) {
      return Math.hypot(t[0][0], t[0][1]);
    }
    final double c0 = t[0][1] * t[1][2] - t[0][2] * t[1][1];
    final double c1 = t[0][2] * t[1][0] - t[0][0] * t[1][2];
    final double c2 = t[0][0] * t[1][1] - t[0][1] * t[1][0];
    return Math.sqrt(c0 * c0 + c1 * c1 + c2 * c2);
  }

  /** Returns the outward unit normal of a facet at a reference point on the
   * facet. */
  public double[] normal(int facet, double[] point) {
    final int d = dimension();
    final double[][] k = inverseJacobian(point);
    final double[] reference = domain.cell.referenceFacetNormal(facet);
    final double[] n = new double[d];
    double norm = 0d;
    for (int i = 0; i < d; i++) {
      for (int a = 0; a < d; a++) {
        n[i] += k[a][i] * reference[a];
      }
      norm += n[i] * n[i];
    }
    norm = Math.sqrt(norm);
    for (int i = 0; i < d; i++) {
      n[i] /= norm;
    }
    return n;
  }
}

// End CellGeometry.java
