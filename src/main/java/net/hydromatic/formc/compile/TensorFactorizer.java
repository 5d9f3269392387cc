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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Ordering;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import net.hydromatic.formc.ast.Integral;
import net.hydromatic.formc.ast.IntegralType;
import net.hydromatic.formc.element.Domain;
import net.hydromatic.formc.element.FiniteElement;
import net.hydromatic.formc.quadrature.QuadratureRule;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Factorizes an expanded integrand into reference tensors and geometry
 * tensors.
 *
 * <p>Each physical derivative {@code d/dx_i} of a basis function is
 * rewritten as {@code sum_a K[a][i] d/dX_a}, where {@code K} is the inverse
 * of the Jacobian; this is valid only on affine domains, where {@code K} is
 * constant on each cell. Monomials are then grouped by the reference factors
 * they contain; each group becomes one reference tensor, integrated once on
 * the reference cell, whose geometry tensor is the sum of the remaining
 * factors.
 */
class TensorFactorizer {
  private static final Ordering<Iterable<ReferenceFactor>> FACTORS_ORDERING =
      Ordering.<ReferenceFactor>natural().lexicographical();

  private static final Ordering<Iterable<GeometrySymbol>> SYMBOLS_ORDERING =
      Ordering.<GeometrySymbol>natural().lexicographical();

  private final Domain domain;
  private final IntegralType type;

  TensorFactorizer(Domain domain, IntegralType type) {
    this.domain = domain;
    this.type = type;
  }

  TermPlan.TensorTerm factorize(Integral integral, Sum sum, int degree) {
    final Map<List<ReferenceFactor>, Map<List<GeometrySymbol>, Double>>
        groups = new TreeMap<>(FACTORS_ORDERING);
    final GeometrySymbol scale =
        type.isFacet() ? GeometrySymbol.FACET_DET : GeometrySymbol.DET;
    for (Monomial monomial : sum.monomials) {
      final List<List<Choice>> choiceLists = new ArrayList<>();
      for (Atom atom : monomial.atoms) {
        choiceLists.add(choices(atom));
      }
      for (List<Choice> combination
          : Lists.cartesianProduct(choiceLists)) {
        final List<ReferenceFactor> factors = new ArrayList<>();
        final List<GeometrySymbol> symbols = new ArrayList<>();
        symbols.add(scale);
        for (Choice choice : combination) {
          if (choice.factor != null) {
            factors.add(choice.factor);
          }
          symbols.addAll(choice.symbols);
        }
        groups.computeIfAbsent(
                Ordering.natural().immutableSortedCopy(factors),
                k -> new TreeMap<>(SYMBOLS_ORDERING))
            .merge(Ordering.natural().immutableSortedCopy(symbols),
                monomial.coefficient, Double::sum);
      }
    }

    final List<QuadratureRule> rules =
        QuadratureFactorizer.rules(domain, type, degree);
    final List<ReferenceTensor> tensors = new ArrayList<>();
    groups.forEach((factors, symbolMap) -> {
      final List<GeometryTerm> geometry = new ArrayList<>();
      symbolMap.forEach((symbols, coefficient) -> {
        if (coefficient != 0d) {
          geometry.add(
              new GeometryTerm(coefficient, ImmutableList.copyOf(symbols)));
        }
      });
      if (!geometry.isEmpty()) {
        tensors.add(
            new ReferenceTensor(factors, geometry,
                integrate(factors, rules)));
      }
    });
    return new TermPlan.TensorTerm(integral, degree, tensors);
  }

  /** Returns the ways that an atom can be written as a reference factor
   * times geometry symbols. */
  private List<Choice> choices(Atom atom) {
    switch (atom.kind) {
      case BASIS:
        final Atom.Basis basis = (Atom.Basis) atom;
        return derivativeChoices(ReferenceFactor.Kind.ARGUMENT,
            basis.argument, basis.element, basis.component,
            basis.derivatives);
      case COEFFICIENT:
        final Atom.Coefficient coefficient = (Atom.Coefficient) atom;
        return derivativeChoices(ReferenceFactor.Kind.COEFFICIENT,
            coefficient.coefficient.count, coefficient.element(),
            coefficient.component, coefficient.derivatives);
      case NORMAL:
        final Atom.Normal normal = (Atom.Normal) atom;
        return ImmutableList.of(
            new Choice(null,
                ImmutableList.of(GeometrySymbol.n(normal.component))));
      default:
        throw new AssertionError("atom " + atom
            + " has no tensor representation");
    }
  }

  private List<Choice> derivativeChoices(ReferenceFactor.Kind kind,
      int number, FiniteElement element,
      int component, List<Integer> physicalDerivatives) {
    final int d = domain.dimension();
    final List<List<Integer>> directionLists = new ArrayList<>();
    for (int ignored : physicalDerivatives) {
      final List<Integer> directions = new ArrayList<>();
      for (int a = 0; a < d; a++) {
        directions.add(a);
      }
      directionLists.add(directions);
    }
    final List<Choice> choices = new ArrayList<>();
    for (List<Integer> reference : Lists.cartesianProduct(directionLists)) {
      final ImmutableList.Builder<GeometrySymbol> symbols =
          ImmutableList.builder();
      for (int j = 0; j < reference.size(); j++) {
        symbols.add(
            GeometrySymbol.k(reference.get(j), physicalDerivatives.get(j)));
      }
      choices.add(
          new Choice(
              new ReferenceFactor(kind, number, element, component,
                  Ordering.<Integer>natural().immutableSortedCopy(reference)),
              symbols.build()));
    }
    return choices;
  }

  /** Integrates the product of factors on the reference cell, or on each
   * facet of the reference cell. */
  private static double[][] integrate(List<ReferenceFactor> factors,
      List<QuadratureRule> rules) {
    final int n = factors.size();
    final int[] dims = new int[n];
    int size = 1;
    for (int k = 0; k < n; k++) {
      dims[k] = factors.get(k).dimension();
      size *= dims[k];
    }
    final double[][] values = new double[rules.size()][size];
    for (int f = 0; f < rules.size(); f++) {
      final QuadratureRule rule = rules.get(f);
      final List<double[]> points = rule.points();
      final double[][][] tables = new double[n][][];
      for (int k = 0; k < n; k++) {
        final ReferenceFactor factor = factors.get(k);
        tables[k] = factor.element.tabulate(factor.component,
            factor.derivatives, points);
      }
      final int[] index = new int[n];
      for (int flat = 0; flat < size; flat++) {
        // Decompose the flat index, last factor fastest.
        int r = flat;
        for (int k = n - 1; k >= 0; k--) {
          index[k] = r % dims[k];
          r /= dims[k];
        }
        double sum = 0d;
        for (int p = 0; p < rule.size(); p++) {
          double v = rule.weight(p);
          for (int k = 0; k < n && v != 0d; k++) {
            v *= tables[k][index[k]][p];
          }
          sum += v;
        }
        values[f][flat] = sum;
      }
    }
    return values;
  }

  /** A reference factor (or none) and the geometry symbols that multiply
   * it. */
  private static class Choice {
    final @Nullable ReferenceFactor factor;
    final ImmutableList<GeometrySymbol> symbols;

    Choice(@Nullable ReferenceFactor factor,
        ImmutableList<GeometrySymbol> symbols) {
      this.factor = factor;
      this.symbols = symbols;
    }
  }
}

// End TensorFactorizer.java
