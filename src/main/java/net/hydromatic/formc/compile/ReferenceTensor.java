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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Reference tensor, precomputed by integrating a product of reference basis
 * functions over the reference cell, together with the geometry tensor that
 * it is contracted with at run time.
 *
 * <p>The value of the term is
 * <code>A[i] += sum<sub>j</sub> A0[facet][i, j] * w[j] * G</code>, where
 * {@code i} ranges over argument dofs, {@code j} over coefficient dofs, and
 * {@code G} is the sum of the geometry terms.
 */
public final class ReferenceTensor {
  /** Argument factors sorted by argument number, then coefficient
   * factors. */
  public final ImmutableList<ReferenceFactor> factors;
  public final ImmutableList<GeometryTerm> geometry;
  /** Values indexed by facet (a single entry for cell integrals) and then by
   * the flattened dofs of the factors, in row-major order. */
  private final double[][] values;

  ReferenceTensor(List<ReferenceFactor> factors, List<GeometryTerm> geometry,
      double[][] values) {
    this.factors = ImmutableList.copyOf(factors);
    this.geometry = ImmutableList.copyOf(geometry);
    this.values = requireNonNull(values);
  }

  public int facetCount() {
    return values.length;
  }

  /** Returns the number of entries per facet. */
  public int size() {
    int n = 1;
    for (ReferenceFactor factor : factors) {
      n *= factor.dimension();
    }
    return n;
  }

  /** Returns the number of argument factors. */
  public int argumentCount() {
    int n = 0;
    for (ReferenceFactor factor : factors) {
      if (factor.kind == ReferenceFactor.Kind.ARGUMENT) {
        ++n;
      }
    }
    return n;
  }

  /** Returns the number of entries per argument-dof index, that is, the
   * product of the dimensions of the coefficient factors. */
  public int coefficientSize() {
    int n = 1;
    for (ReferenceFactor factor : factors) {
      if (factor.kind == ReferenceFactor.Kind.COEFFICIENT) {
        n *= factor.dimension();
      }
    }
    return n;
  }

  public double value(int facet, int index) {
    return values[facet][index];
  }

  /** Returns a copy of the values for a facet. */
  public double[] values(int facet) {
    return values[facet].clone();
  }

  @Override
  public String toString() {
    return "ReferenceTensor(" + factors + ", " + geometry + ")";
  }
}

// End ReferenceTensor.java
