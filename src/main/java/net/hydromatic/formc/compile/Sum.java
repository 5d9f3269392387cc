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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Consumer;
import java.util.function.Predicate;
import net.hydromatic.formc.ast.Op;

/**
 * Sum of monomials; the expanded form of a scalar integrand.
 *
 * <p>A sum is canonical: no two monomials have the same atoms, no monomial
 * has a zero coefficient, and monomials are sorted by their atoms. Two
 * integrands that differ only in the order of their terms and factors
 * therefore expand to equal sums.
 */
public final class Sum implements Comparable<Sum> {
  public static final Sum ZERO = new Sum(ImmutableList.of());

  public final ImmutableList<Monomial> monomials;

  private Sum(ImmutableList<Monomial> monomials) {
    this.monomials = monomials;
  }

  /** Creates a canonical sum from a map from atom lists to coefficients. */
  private static Sum of(Map<List<Atom>, Double> map) {
    final ImmutableList.Builder<Monomial> b = ImmutableList.builder();
    map.forEach((atoms, c) -> {
      if (c != 0d) {
        b.add(new Monomial(c, ImmutableList.copyOf(atoms)));
      }
    });
    return new Sum(b.build());
  }

  private static Map<List<Atom>, Double> newMap() {
    return new TreeMap<>(Monomial.ATOMS_ORDERING);
  }

  public static Sum constant(double value) {
    if (value == 0d) {
      return ZERO;
    }
    return new Sum(
        ImmutableList.of(new Monomial(value, ImmutableList.of())));
  }

  public static Sum of(Atom atom) {
    return new Sum(
        ImmutableList.of(new Monomial(1d, ImmutableList.of(atom))));
  }

  /**
   * Applies a nonlinear function to a sum.
   *
   * <p>Folds the function if the argument is constant, and expands a power
   * whose exponent is a non-negative integer into a product.
   *
   * @param function A nonlinear function, or {@link Op#POWER}
   * @param exponent Exponent, if the function is {@link Op#POWER}
   * @param argument Argument
   */
  public static Sum apply(Op function, double exponent, Sum argument) {
    if (function == Op.POWER
        && exponent >= 0
        && exponent == Math.rint(exponent)) {
      Sum s = constant(1d);
      for (int i = 0; i < (int) exponent; i++) {
        s = s.times(argument);
      }
      return s;
    }
    if (argument.isConstant()) {
      return constant(fold(function, exponent, argument.constantValue()));
    }
    return of(new Atom.Nonlinear(function, exponent, argument));
  }

  static double fold(Op function, double exponent, double x) {
    switch (function) {
      case POWER:
        return Math.pow(x, exponent);
      case SQRT:
        return Math.sqrt(x);
      case EXP:
        return Math.exp(x);
      case LN:
        return Math.log(x);
      case SIN:
        return Math.sin(x);
      case COS:
        return Math.cos(x);
      case ABS:
        return Math.abs(x);
      case SIGN:
        return Math.signum(x);
      default:
        throw new AssertionError(function);
    }
  }

  public boolean isZero() {
    return monomials.isEmpty();
  }

  /** Whether this sum has no atoms. */
  public boolean isConstant() {
    return monomials.isEmpty()
        || monomials.size() == 1 && monomials.get(0).atoms.isEmpty();
  }

  public double constantValue() {
    checkArgument(isConstant(), "not constant: %s", this);
    return monomials.isEmpty() ? 0d : monomials.get(0).coefficient;
  }

  public Sum plus(Sum s) {
    if (s.isZero()) {
      return this;
    }
    if (isZero()) {
      return s;
    }
    final Map<List<Atom>, Double> map = newMap();
    for (Monomial m : monomials) {
      map.merge(m.atoms, m.coefficient, Double::sum);
    }
    for (Monomial m : s.monomials) {
      map.merge(m.atoms, m.coefficient, Double::sum);
    }
    return of(map);
  }

  public Sum times(double factor) {
    if (factor == 1d) {
      return this;
    }
    final Map<List<Atom>, Double> map = newMap();
    for (Monomial m : monomials) {
      map.put(m.atoms, m.coefficient * factor);
    }
    return of(map);
  }

  public Sum times(Sum s) {
    final Map<List<Atom>, Double> map = newMap();
    for (Monomial m1 : monomials) {
      for (Monomial m2 : s.monomials) {
        final List<Atom> atoms = new ArrayList<>(m1.atoms);
        atoms.addAll(m2.atoms);
        map.merge(Ordering.natural().immutableSortedCopy(atoms),
            m1.coefficient * m2.coefficient, Double::sum);
      }
    }
    return of(map);
  }

  /** Returns the derivative in physical direction {@code i}, by the product
   * rule. */
  public Sum derivative(int i) {
    Sum sum = ZERO;
    for (Monomial m : monomials) {
      for (int k = 0; k < m.atoms.size(); k++) {
        final Sum d = m.atoms.get(k).derivative(i);
        if (d.isZero()) {
          continue;
        }
        final List<Atom> others = new ArrayList<>(m.atoms);
        others.remove(k);
        sum = sum.plus(
            new Sum(
                ImmutableList.of(
                    new Monomial(m.coefficient,
                        ImmutableList.copyOf(others))))
                .times(d));
      }
    }
    return sum;
  }

  /** Returns whether any atom, at any depth, satisfies a predicate. */
  public boolean anyAtom(Predicate<Atom> predicate) {
    for (Monomial m : monomials) {
      if (m.anyAtom(predicate)) {
        return true;
      }
    }
    return false;
  }

  /** Calls a consumer for each atom, at any depth. */
  public void forEachAtom(Consumer<Atom> consumer) {
    monomials.forEach(m -> m.forEachAtom(consumer));
  }

  @Override
  public int compareTo(Sum o) {
    final int n = Math.min(monomials.size(), o.monomials.size());
    for (int i = 0; i < n; i++) {
      final Monomial m1 = monomials.get(i);
      final Monomial m2 = o.monomials.get(i);
      int c = Monomial.ATOMS_ORDERING.compare(m1.atoms, m2.atoms);
      if (c == 0) {
        c = Double.compare(m1.coefficient, m2.coefficient);
      }
      if (c != 0) {
        return c;
      }
    }
    return Integer.compare(monomials.size(), o.monomials.size());
  }

  @Override
  public int hashCode() {
    return monomials.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Sum && monomials.equals(((Sum) o).monomials);
  }

  @Override
  public String toString() {
    if (monomials.isEmpty()) {
      return "0";
    }
    final StringBuilder b = new StringBuilder();
    for (Monomial m : monomials) {
      if (b.length() > 0) {
        b.append(" + ");
      }
      b.append(m);
    }
    return b.toString();
  }
}

// End Sum.java
