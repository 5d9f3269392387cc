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
import java.util.Objects;
import net.hydromatic.formc.element.FiniteElement;

/**
 * Table of the values of a reference derivative of a component of the basis
 * functions of an element, at the points of a quadrature rule.
 *
 * <p>Values are indexed by facet (a single entry for cell integrals), point
 * and dof.
 */
public final class PsiTable {
  public final FiniteElement element;
  public final int component;
  /** Reference derivative directions, sorted; empty for values. */
  public final ImmutableList<Integer> derivatives;
  private final double[][][] values;

  PsiTable(FiniteElement element, int component,
      ImmutableList<Integer> derivatives, double[][][] values) {
    this.element = requireNonNull(element);
    this.component = component;
    this.derivatives = requireNonNull(derivatives);
    this.values = requireNonNull(values);
  }

  /** Returns whether this table holds the given derivative. */
  public boolean matches(FiniteElement element, int component,
      ImmutableList<Integer> derivatives) {
    return this.element.equals(element)
        && this.component == component
        && this.derivatives.equals(derivatives);
  }

  public int pointCount() {
    return values[0].length;
  }

  public int dofCount() {
    return element.spaceDimension();
  }

  public double value(int facet, int point, int dof) {
    return values[facet][point][dof];
  }

  /** Returns whether every entry for the given facet is zero. */
  public boolean isZero(int facet) {
    for (double[] row : values[facet]) {
      for (double v : row) {
        if (v != 0d) {
          return false;
        }
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    return Objects.hash(element, component, derivatives);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof PsiTable
            && matches(((PsiTable) o).element, ((PsiTable) o).component,
                ((PsiTable) o).derivatives);
  }

  @Override
  public String toString() {
    return "PsiTable(" + element + ", " + component + ", " + derivatives
        + ")";
  }
}

// End PsiTable.java
