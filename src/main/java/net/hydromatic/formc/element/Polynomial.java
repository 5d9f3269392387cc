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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Ordering;
import com.google.common.primitives.Ints;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Polynomial in {@code dimension} real variables, stored as a map from
 * exponent vectors to coefficients.
 *
 * <p>Immutable. Terms whose coefficient is zero are not stored.
 */
public final class Polynomial {
  /** Orders exponent vectors lexicographically. */
  public static final Ordering<Iterable<Integer>> EXPONENT_ORDERING =
      Ordering.<Integer>natural().lexicographical();

  public final int dimension;
  private final ImmutableSortedMap<List<Integer>, Double> terms;

  private Polynomial(int dimension, Map<List<Integer>, Double> terms) {
    this.dimension = dimension;
    this.terms = ImmutableSortedMap.copyOf(terms, EXPONENT_ORDERING);
  }

  /** Creates a constant polynomial. */
  public static Polynomial constant(int dimension, double c) {
    final Map<List<Integer>, Double> map = new TreeMap<>(EXPONENT_ORDERING);
    if (c != 0d) {
      map.put(Ints.asList(new int[dimension]), c);
    }
    return new Polynomial(dimension, map);
  }

  /** Creates a monomial with unit coefficient. */
  public static Polynomial monomial(List<Integer> exponents) {
    final Map<List<Integer>, Double> map = new TreeMap<>(EXPONENT_ORDERING);
    map.put(ImmutableList.copyOf(exponents), 1d);
    return new Polynomial(exponents.size(), map);
  }

  /** Creates the polynomial "x<sub>i</sub>". */
  public static Polynomial variable(int dimension, int i) {
    final int[] exponents = new int[dimension];
    exponents[i] = 1;
    return monomial(Ints.asList(exponents));
  }

  /**
   * Returns the exponent vectors of a monomial basis.
   *
   * <p>If {@code tensor} is false, the basis spans P<sub>k</sub>, polynomials
   * of total degree at most {@code degree}; if true, it spans
   * Q<sub>k</sub>, polynomials of degree at most {@code degree} in each
   * variable. Vectors are sorted by total degree, then lexicographically.
   */
  public static List<List<Integer>> basisExponents(
      int dimension, int degree, boolean tensor) {
    final List<List<Integer>> list = new ArrayList<>();
    addExponents(list, new int[dimension], 0, degree, tensor);
    list.sort(
        Ordering.<Integer>natural()
            .onResultOf((List<Integer> e) -> e.stream().mapToInt(i -> i).sum())
            .compound(EXPONENT_ORDERING));
    return list;
  }

  private static void addExponents(
      List<List<Integer>> list,
      int[] exponents,
      int i,
      int degree,
      boolean tensor) {
    if (i == exponents.length) {
      list.add(ImmutableList.copyOf(Ints.asList(exponents)));
      return;
    }
    int used = 0;
    for (int j = 0; j < i; j++) {
      used += exponents[j];
    }
    final int max = tensor ? degree : degree - used;
    for (int e = 0; e <= max; e++) {
      exponents[i] = e;
      addExponents(list, exponents, i + 1, degree, tensor);
    }
    exponents[i] = 0;
  }

  /** Returns the terms of this polynomial, sorted by exponent vector. */
  public ImmutableSortedMap<List<Integer>, Double> terms() {
    return terms;
  }

  public boolean isZero() {
    return terms.isEmpty();
  }

  /** Returns the total degree, or -1 for the zero polynomial. */
  public int degree() {
    int degree = -1;
    for (List<Integer> exponents : terms.keySet()) {
      int d = 0;
      for (int e : exponents) {
        d += e;
      }
      degree = Math.max(degree, d);
    }
    return degree;
  }

  /** Returns the coefficient of the monomial with given exponents. */
  public double coefficient(int... exponents) {
    final Double c = terms.get(Ints.asList(exponents));
    return c == null ? 0d : c;
  }

  public Polynomial plus(Polynomial p) {
    checkArgument(p.dimension == dimension, "dimension mismatch");
    final Map<List<Integer>, Double> map = new TreeMap<>(EXPONENT_ORDERING);
    map.putAll(terms);
    p.terms.forEach((e, c) -> add(map, e, c));
    return new Polynomial(dimension, map);
  }

  public Polynomial times(double factor) {
    final Map<List<Integer>, Double> map = new TreeMap<>(EXPONENT_ORDERING);
    if (factor != 0d) {
      terms.forEach((e, c) -> map.put(e, c * factor));
    }
    return new Polynomial(dimension, map);
  }

  public Polynomial times(Polynomial p) {
    checkArgument(p.dimension == dimension, "dimension mismatch");
    final Map<List<Integer>, Double> map = new TreeMap<>(EXPONENT_ORDERING);
    terms.forEach((e1, c1) ->
        p.terms.forEach((e2, c2) -> {
          final int[] e = new int[dimension];
          for (int i = 0; i < dimension; i++) {
            e[i] = e1.get(i) + e2.get(i);
          }
          add(map, ImmutableList.copyOf(Ints.asList(e)), c1 * c2);
        }));
    return new Polynomial(dimension, map);
  }

  /** Returns the partial derivative with respect to variable {@code i}. */
  public Polynomial derivative(int i) {
    checkArgument(i >= 0 && i < dimension, "no variable %s", i);
    final Map<List<Integer>, Double> map = new TreeMap<>(EXPONENT_ORDERING);
    terms.forEach((e, c) -> {
      final int n = e.get(i);
      if (n > 0) {
        final int[] e2 = Ints.toArray(e);
        e2[i] = n - 1;
        add(map, ImmutableList.copyOf(Ints.asList(e2)), c * n);
      }
    });
    return new Polynomial(dimension, map);
  }

  /** Applies {@link #derivative(int)} once for each element of a list. */
  public Polynomial derivative(List<Integer> directions) {
    Polynomial p = this;
    for (int i : directions) {
      p = p.derivative(i);
    }
    return p;
  }

  /** Evaluates this polynomial at a point. */
  public double evaluate(double[] x) {
    checkArgument(x.length == dimension, "dimension mismatch");
    double sum = 0d;
    for (Map.Entry<List<Integer>, Double> term : terms.entrySet()) {
      double v = term.getValue();
      final List<Integer> e = term.getKey();
      for (int i = 0; i < dimension; i++) {
        for (int j = e.get(i); j > 0; j--) {
          v *= x[i];
        }
      }
      sum += v;
    }
    return sum;
  }

  private static void add(
      Map<List<Integer>, Double> map, List<Integer> exponents, double c) {
    final double sum = map.getOrDefault(exponents, 0d) + c;
    if (sum == 0d) {
      map.remove(exponents);
    } else {
      map.put(exponents, sum);
    }
  }

  @Override
  public int hashCode() {
    return terms.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Polynomial
            && dimension == ((Polynomial) o).dimension
            && terms.equals(((Polynomial) o).terms);
  }

  @Override
  public String toString() {
    if (terms.isEmpty()) {
      return "0";
    }
    final StringBuilder b = new StringBuilder();
    terms.forEach((e, c) -> {
      if (b.length() > 0) {
        b.append(" + ");
      }
      b.append(c);
      for (int i = 0; i < dimension; i++) {
        if (e.get(i) > 0) {
          b.append("*X").append(i);
          if (e.get(i) > 1) {
            b.append('^').append(e.get(i));
          }
        }
      }
    });
    return b.toString();
  }
}

// End Polynomial.java
