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
import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.List;
import java.util.function.ToDoubleFunction;
import net.hydromatic.formc.element.Cell;

/**
 * Set of points and weights on a reference cell, or on one facet of a
 * reference cell.
 *
 * <p>Points are always in the coordinates of {@link #cell}. For a facet rule,
 * {@link #facet} is the facet index and the weights sum to the measure of
 * the reference facet cell (e.g. 1 for an edge, 1/2 for a triangle);
 * otherwise {@link #facet} is -1 and the weights sum to the measure of the
 * reference cell.
 */
public final class QuadratureRule {
  public final Cell cell;
  public final int facet;
  public final int degree;
  private final double[][] points;
  private final double[] weights;

  QuadratureRule(Cell cell, int facet, int degree, double[][] points,
      double[] weights) {
    checkArgument(points.length == weights.length, "length mismatch");
    this.cell = requireNonNull(cell);
    this.facet = facet;
    this.degree = degree;
    this.points = points;
    this.weights = weights;
  }

  /** Returns the number of points. */
  public int size() {
    return weights.length;
  }

  public double[] point(int i) {
    return points[i].clone();
  }

  public double weight(int i) {
    return weights[i];
  }

  /** Returns a copy of the points. */
  public List<double[]> points() {
    final List<double[]> list = new ArrayList<>(points.length);
    for (double[] point : points) {
      list.add(point.clone());
    }
    return list;
  }

  /** Returns a copy of the weights. */
  public double[] weights() {
    return weights.clone();
  }

  /** Integrates a function over the reference entity. */
  public double integrate(ToDoubleFunction<double[]> f) {
    double sum = 0d;
    for (int i = 0; i < weights.length; i++) {
      sum += weights[i] * f.applyAsDouble(points[i].clone());
    }
    return sum;
  }

  @Override
  public String toString() {
    return "QuadratureRule(" + cell.lowerName()
        + (facet >= 0 ? ", facet " + facet : "")
        + ", degree " + degree + ", " + size() + " points)";
  }
}

// End QuadratureRule.java
