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

import static net.hydromatic.formc.Matchers.closeTo;
import static org.hamcrest.MatcherAssert.assertThat;

import org.junit.jupiter.api.Test;

/** Tests {@link GaussJacobi}. */
public class GaussJacobiTest {
  @Test void testLegendre() {
    final double r = 1d / Math.sqrt(3d);
    assertThat(GaussJacobi.points(0, 0, 2), closeTo(-r, r));
    assertThat(GaussJacobi.weights(0, 0, 2), closeTo(1, 1));
    final double s = Math.sqrt(0.6d);
    assertThat(GaussJacobi.points(0, 0, 3), closeTo(-s, 0, s));
    assertThat(GaussJacobi.weights(0, 0, 3),
        closeTo(5d / 9d, 8d / 9d, 5d / 9d));
  }

  /** With weight (1 - x), the one-point rule is at the centroid, -1/3. */
  @Test void testJacobi() {
    assertThat(GaussJacobi.points(1, 0, 1), closeTo(-1d / 3d));
    assertThat(GaussJacobi.weights(1, 0, 1), closeTo(2d));
    assertThat(GaussJacobi.weights(2, 0, 1), closeTo(8d / 3d));
  }

  @Test void testPolynomial() {
    final double x = 0.3d;
    assertThat(new double[] {GaussJacobi.jacobi(0, 0, 2, x)},
        closeTo(0.5d * (3d * x * x - 1d)));
    assertThat(new double[] {GaussJacobi.jacobiDerivative(0, 0, 2, x)},
        closeTo(3d * x));
  }
}

// End GaussJacobiTest.java
