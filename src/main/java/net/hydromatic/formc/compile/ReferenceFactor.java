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
 * Factor of a reference tensor: a component of a derivative, with respect to
 * reference coordinates, of the basis functions of an element.
 *
 * <p>If the factor belongs to an argument, the reference tensor has one axis
 * for the argument's dofs; if it belongs to a coefficient, the axis is
 * contracted at run time with the coefficient's dof values.
 */
public final class ReferenceFactor implements Comparable<ReferenceFactor> {
  public final Kind kind;
  /** Argument number or coefficient count. */
  public final int number;
  public final FiniteElement element;
  public final int component;
  /** Reference derivative directions, sorted. */
  public final ImmutableList<Integer> derivatives;

  ReferenceFactor(Kind kind, int number, FiniteElement element,
      int component, ImmutableList<Integer> derivatives) {
    this.kind = requireNonNull(kind);
    this.number = number;
    this.element = requireNonNull(element);
    this.component = component;
    this.derivatives = requireNonNull(derivatives);
  }

  /** Returns the number of entries along this factor's axis. */
  public int dimension() {
    return element.spaceDimension();
  }

  @Override
  public int compareTo(ReferenceFactor o) {
    int c = kind.compareTo(o.kind);
    if (c == 0) {
      c = Integer.compare(number, o.number);
    }
    if (c == 0) {
      c = Integer.compare(component, o.component);
    }
    if (c == 0) {
      c = Atom.DERIVATIVE_ORDERING.compare(derivatives, o.derivatives);
    }
    return c;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, number, component, derivatives);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof ReferenceFactor
            && compareTo((ReferenceFactor) o) == 0;
  }

  @Override
  public String toString() {
    return (kind == Kind.ARGUMENT ? "v_" : "w_") + number
        + "[" + component + "]" + derivatives;
  }

  /** Whether a factor belongs to an argument or a coefficient. */
  public enum Kind {
    ARGUMENT,
    COEFFICIENT
  }
}

// End ReferenceFactor.java
