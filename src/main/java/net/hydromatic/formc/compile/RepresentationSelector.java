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

import net.hydromatic.formc.ast.Integral;
import net.hydromatic.formc.ast.IntegralType;
import net.hydromatic.formc.ast.Representation;
import net.hydromatic.formc.element.Domain;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Chooses the representation of an integral.
 *
 * <p>The option of the integral's measure takes precedence; then the
 * default representation of the compilation; if both are
 * {@link Representation#AUTO}, tensor representation is chosen if it can be
 * applied, otherwise quadrature.
 *
 * <p>A request for tensor representation that cannot be honored, whether it
 * comes from the measure or from the default, is an error; the selector
 * never falls back to quadrature.
 */
class RepresentationSelector {
  private final Representation defaultRepresentation;

  RepresentationSelector(Representation defaultRepresentation) {
    this.defaultRepresentation = requireNonNull(defaultRepresentation);
  }

  /** Returns the representation of an integral, given its expanded
   * integrand; never returns {@link Representation#AUTO}. */
  Representation select(Integral integral, Sum sum, Domain domain) {
    Representation representation = integral.measure.representation;
    if (representation == Representation.AUTO) {
      representation = defaultRepresentation;
    }
    final IntegralType type = integral.measure.type;
    final String obstacle = tensorObstacle(type, sum, domain);
    switch (representation) {
      case TENSOR:
        if (obstacle != null) {
          throw new TermException("tensor representation is not applicable: "
              + obstacle, type, integral.measure.subdomainId);
        }
        return Representation.TENSOR;
      case QUADRATURE:
        return Representation.QUADRATURE;
      default:
        return obstacle == null
            ? Representation.TENSOR
            : Representation.QUADRATURE;
    }
  }

  /** Returns the reason why an integral cannot be computed in tensor
   * representation, or null if it can. */
  static @Nullable String tensorObstacle(IntegralType type, Sum sum,
      Domain domain) {
    if (!domain.isAffine()) {
      return "domain " + domain + " is not affine";
    }
    if (type == IntegralType.INTERIOR_FACET) {
      return "integral is over interior facets";
    }
    if (sum.anyAtom(atom -> atom instanceof Atom.Coordinate)) {
      return "integrand depends on the spatial coordinate";
    }
    if (sum.anyAtom(atom -> atom instanceof Atom.Nonlinear)) {
      return "integrand is not a polynomial";
    }
    return null;
  }
}

// End RepresentationSelector.java
