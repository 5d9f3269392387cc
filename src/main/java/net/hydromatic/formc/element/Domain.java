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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Objects;

/**
 * Integration domain: a reference cell plus the polynomial degree of the
 * coordinate field that maps it onto each physical cell.
 */
public final class Domain {
  public final Cell cell;
  public final int coordinateDegree;

  private Domain(Cell cell, int coordinateDegree) {
    this.cell = requireNonNull(cell);
    this.coordinateDegree = coordinateDegree;
    checkArgument(coordinateDegree >= 1, "coordinate degree must be positive");
  }

  /** Creates a domain whose cells are mapped by linear coordinates. */
  public static Domain of(Cell cell) {
    return new Domain(cell, 1);
  }

  /** Creates a domain whose coordinate field has a given degree. */
  public static Domain of(Cell cell, int coordinateDegree) {
    return new Domain(cell, coordinateDegree);
  }

  /** Geometric dimension. */
  public int dimension() {
    return cell.dimension();
  }

  /**
   * Returns whether the map from the reference cell is affine, and therefore
   * has a constant Jacobian.
   */
  public boolean isAffine() {
    return cell.isSimplex() && coordinateDegree == 1;
  }

  @Override
  public int hashCode() {
    return Objects.hash(cell, coordinateDegree);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Domain
            && cell == ((Domain) o).cell
            && coordinateDegree == ((Domain) o).coordinateDegree;
  }

  @Override
  public String toString() {
    return coordinateDegree == 1
        ? cell.lowerName()
        : "Mesh(" + cell.lowerName() + ", " + coordinateDegree + ")";
  }
}

// End Domain.java
