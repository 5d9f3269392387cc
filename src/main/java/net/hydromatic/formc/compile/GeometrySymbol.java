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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Objects;

/**
 * Quantity that depends on the geometry of a cell, and is a factor of an
 * entry of a geometry tensor.
 *
 * <p>Symbols are evaluated once per cell (or per facet) by generated code.
 */
public final class GeometrySymbol implements Comparable<GeometrySymbol> {
  public static final GeometrySymbol DET = new GeometrySymbol(Kind.DET, 0, 0);
  public static final GeometrySymbol FACET_DET =
      new GeometrySymbol(Kind.FACET_DET, 0, 0);

  public final Kind kind;
  /** Reference direction, for {@link Kind#K}. */
  public final int a;
  /** Physical direction, for {@link Kind#K} and {@link Kind#N}. */
  public final int i;

  private GeometrySymbol(Kind kind, int a, int i) {
    this.kind = kind;
    this.a = a;
    this.i = i;
  }

  /** Entry of the inverse Jacobian, the derivative of reference coordinate
   * {@code a} with respect to physical coordinate {@code i}. */
  public static GeometrySymbol k(int a, int i) {
    checkArgument(a >= 0 && i >= 0);
    return new GeometrySymbol(Kind.K, a, i);
  }

  /** Component {@code i} of the outward unit normal. */
  public static GeometrySymbol n(int i) {
    checkArgument(i >= 0);
    return new GeometrySymbol(Kind.N, 0, i);
  }

  @Override
  public int compareTo(GeometrySymbol o) {
    int c = kind.compareTo(o.kind);
    if (c == 0) {
      c = Integer.compare(a, o.a);
    }
    if (c == 0) {
      c = Integer.compare(i, o.i);
    }
    return c;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, a, i);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof GeometrySymbol
            && compareTo((GeometrySymbol) o) == 0;
  }

  @Override
  public String toString() {
    switch (kind) {
      case DET:
        return "det";
      case FACET_DET:
        return "det_f";
      case K:
        return "K[" + a + "][" + i + "]";
      case N:
        return "n[" + i + "]";
      default:
        throw new AssertionError(kind);
    }
  }

  /** Kind of geometry symbol. */
  public enum Kind {
    /** Absolute value of the determinant of the Jacobian. */
    DET,
    /** Ratio of the measure of a physical facet to the measure of the
     * reference facet. */
    FACET_DET,
    /** Entry of the inverse of the Jacobian. */
    K,
    /** Component of the outward unit normal of a facet. */
    N
  }
}

// End GeometrySymbol.java
