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

import java.util.List;
import java.util.Set;
import net.hydromatic.formc.ast.IntegralType;
import net.hydromatic.formc.element.Domain;
import net.hydromatic.formc.element.Family;

/**
 * Checks that the expanded integrand of an integral is valid for the kind of
 * domain it is integrated over.
 *
 * <p>Every monomial must be linear in each argument of the form, and must
 * not mention any other argument. Facet normals are allowed only on facets,
 * restrictions only on interior facets, and second derivatives only on
 * affine domains.
 */
class TermChecker {
  private final Set<Integer> argumentNumbers;
  private final Domain domain;
  private final IntegralType type;
  private final int subdomainId;

  TermChecker(Set<Integer> argumentNumbers, Domain domain, IntegralType type,
      int subdomainId) {
    this.argumentNumbers = requireNonNull(argumentNumbers);
    this.domain = requireNonNull(domain);
    this.type = requireNonNull(type);
    this.subdomainId = subdomainId;
  }

  /** Checks an expanded integrand; throws {@link TermException} if it is not
   * valid. */
  void check(Sum sum) {
    for (Monomial monomial : sum.monomials) {
      checkArguments(monomial);
      checkAtoms(monomial);
    }
  }

  private void checkArguments(Monomial monomial) {
    final List<Atom.Basis> basisList = monomial.atoms(Atom.Basis.class);
    for (int number : argumentNumbers) {
      int count = 0;
      for (Atom.Basis basis : basisList) {
        if (basis.argument == number) {
          ++count;
        }
      }
      if (count != 1) {
        throw fail("term " + monomial + " is not linear in argument v_"
            + number);
      }
    }
    for (Atom.Basis basis : basisList) {
      if (!argumentNumbers.contains(basis.argument)) {
        throw fail("term " + monomial + " uses argument v_" + basis.argument
            + " that the form does not have");
      }
    }
    for (Atom.Nonlinear nonlinear
        : monomial.atoms(Atom.Nonlinear.class)) {
      if (nonlinear.argument.anyAtom(a -> a instanceof Atom.Basis)) {
        throw fail("argument inside nonlinear function " + nonlinear);
      }
    }
  }

  private void checkAtoms(Monomial monomial) {
    if (!type.isFacet()
        && monomial.anyAtom(a -> a instanceof Atom.Normal)) {
      throw fail("facet normal in integral over cell");
    }
    if (type != IntegralType.INTERIOR_FACET
        && monomial.anyAtom(a -> a.side() != null)) {
      throw fail("restriction outside interior facet integral");
    }
    if (type == IntegralType.INTERIOR_FACET
        && monomial.anyAtom(TermChecker::isUnrestricted)) {
      throw fail("unrestricted term " + monomial
          + " in interior facet integral");
    }
    if (!domain.isAffine()
        && monomial.anyAtom(a -> derivativeOrder(a) > 1)) {
      throw fail("second derivative on non-affine domain " + domain);
    }
  }

  /** Returns whether an atom needs a restriction on an interior facet but
   * does not have one. A coefficient in the Real space has the same value on
   * both sides. */
  private static boolean isUnrestricted(Atom atom) {
    if (atom.side() != null) {
      return false;
    }
    switch (atom.kind) {
      case BASIS:
      case NORMAL:
        return true;
      case COEFFICIENT:
        return ((Atom.Coefficient) atom).element().family != Family.REAL;
      default:
        return false;
    }
  }

  private static int derivativeOrder(Atom atom) {
    switch (atom.kind) {
      case BASIS:
        return ((Atom.Basis) atom).derivatives.size();
      case COEFFICIENT:
        return ((Atom.Coefficient) atom).derivatives.size();
      default:
        return 0;
    }
  }

  TermException fail(String message) {
    return new TermException(message, type, subdomainId);
  }
}

// End TermChecker.java
