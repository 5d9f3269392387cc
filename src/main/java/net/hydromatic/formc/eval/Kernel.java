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

import net.hydromatic.formc.ast.IntegralType;

/**
 * Computes the local tensor of a form over one cell or facet.
 *
 * <p>A kernel has the same contract as a generated procedure: it zeroes the
 * buffer, accumulates the terms of the requested subdomain, and returns
 * false if the form has no integral over that subdomain.
 *
 * @see Kernels
 */
public interface Kernel {
  /** Returns the integral type that this kernel computes. */
  IntegralType type();

  /** Returns the length of the output buffer. */
  int bufferLength();

  /**
   * Computes the local tensor.
   *
   * @param a Output buffer, of length {@link #bufferLength()}
   * @param w Coefficient dofs, one array per coefficient of the form; on
   *     interior facets, the dofs of both cells
   * @param cells Geometry of the cell, or of both cells of an interior
   *     facet
   * @param facets Local index of the facet in each cell; ignored for cell
   *     integrals
   * @param subdomainId Subdomain id
   */
  boolean tabulate(double[] a, double[][] w, CellGeometry[] cells,
      int[] facets, int subdomainId);

  /** Computes the local tensor of a cell integral. */
  default boolean tabulateCell(double[] a, double[][] w, CellGeometry cell,
      int subdomainId) {
    return tabulate(a, w, new CellGeometry[] {cell}, new int[] {0},
        subdomainId);
  }

  /** Computes the local tensor of an exterior facet integral. */
  default boolean tabulateExteriorFacet(double[] a, double[][] w,
      CellGeometry cell, int facet, int subdomainId) {
    return tabulate(a, w, new CellGeometry[] {cell}, new int[] {facet},
        subdomainId);
  }

  /** Computes the local tensor of an interior facet integral. */
  default boolean tabulateInteriorFacet(double[] a, double[][] w,
      CellGeometry cell0, CellGeometry cell1, int facet0, int facet1,
      int subdomainId) {
    return tabulate(a, w, new CellGeometry[] {cell0, cell1},
        new int[] {facet0, facet1}, subdomainId);
  }
}

// End Kernel.java
