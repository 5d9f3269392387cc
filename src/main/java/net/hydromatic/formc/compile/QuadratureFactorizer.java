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
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import net.hydromatic.formc.ast.Integral;
import net.hydromatic.formc.ast.IntegralType;
import net.hydromatic.formc.element.Cell;
import net.hydromatic.formc.element.Domain;
import net.hydromatic.formc.element.Elements;
import net.hydromatic.formc.element.FiniteElement;
import net.hydromatic.formc.quadrature.QuadratureRule;
import net.hydromatic.formc.quadrature.QuadratureRules;

/**
 * Builds the quadrature representation of an integral: the quadrature rule,
 * and tables of every reference derivative of every basis function that the
 * expanded integrand needs at the points of the rule.
 */
class QuadratureFactorizer {
  /** Orders table keys so that generated code does not depend on hash
   * order. */
  private static final Comparator<TableKey> KEY_COMPARATOR =
      Comparator.<TableKey, String>comparing(k -> k.element.toString())
          .thenComparing(k -> k.component)
          .thenComparing(k -> k.derivatives, Atom.DERIVATIVE_ORDERING);

  private final Domain domain;
  private final IntegralType type;

  QuadratureFactorizer(Domain domain, IntegralType type) {
    this.domain = domain;
    this.type = type;
  }

  /** Returns the rules for an integral type: one rule for cells, and one
   * rule per facet for facets. */
  static List<QuadratureRule> rules(Domain domain, IntegralType type,
      int degree) {
    final Cell cell = domain.cell;
    if (!type.isFacet()) {
      return ImmutableList.of(QuadratureRules.rule(cell, degree));
    }
    final ImmutableList.Builder<QuadratureRule> b = ImmutableList.builder();
    for (int f = 0; f < cell.facetCount(); f++) {
      b.add(QuadratureRules.facetRule(cell, f, degree));
    }
    return b.build();
  }

  TermPlan.QuadratureTerm factorize(Integral integral, Sum sum, int degree) {
    final List<QuadratureRule> rules = rules(domain, type, degree);
    final Set<TableKey> keys = new TreeSet<>(KEY_COMPARATOR);
    final FiniteElement coordinateElement =
        Elements.coordinateElement(domain);
    if (!domain.isAffine()) {
      for (int a = 0; a < domain.dimension(); a++) {
        keys.add(new TableKey(coordinateElement, 0, ImmutableList.of(a)));
      }
    }
    if (sum.anyAtom(atom -> atom instanceof Atom.Coordinate)) {
      keys.add(new TableKey(coordinateElement, 0, ImmutableList.of()));
    }
    sum.forEachAtom(atom -> {
      if (atom instanceof Atom.Basis) {
        final Atom.Basis basis = (Atom.Basis) atom;
        addKeys(keys, basis.element, basis.component,
            basis.derivatives.size());
      } else if (atom instanceof Atom.Coefficient) {
        final Atom.Coefficient coefficient = (Atom.Coefficient) atom;
        addKeys(keys, coefficient.element(), coefficient.component,
            coefficient.derivatives.size());
      }
    });

    final List<PsiTable> tables = new ArrayList<>();
    for (TableKey key : keys) {
      tables.add(tabulate(key, rules));
    }
    return new TermPlan.QuadratureTerm(integral, degree, rules, sum, tables,
        coordinateElement);
  }

  /** Adds a key for every sorted list of {@code order} reference
   * directions. */
  private void addKeys(Set<TableKey> keys, FiniteElement element,
      int component, int order) {
    final List<List<Integer>> directionLists = new ArrayList<>();
    for (int j = 0; j < order; j++) {
      final List<Integer> directions = new ArrayList<>();
      for (int a = 0; a < domain.dimension(); a++) {
        directions.add(a);
      }
      directionLists.add(directions);
    }
    for (List<Integer> directions : Lists.cartesianProduct(directionLists)) {
      keys.add(
          new TableKey(element, component,
              Ordering.<Integer>natural().immutableSortedCopy(directions)));
    }
  }

  private static PsiTable tabulate(TableKey key, List<QuadratureRule> rules) {
    final double[][][] values = new double[rules.size()][][];
    for (int f = 0; f < rules.size(); f++) {
      final QuadratureRule rule = rules.get(f);
      final double[][] byDof =
          key.element.tabulate(key.component, key.derivatives, rule.points());
      values[f] = new double[rule.size()][byDof.length];
      for (int dof = 0; dof < byDof.length; dof++) {
        for (int p = 0; p < rule.size(); p++) {
          values[f][p][dof] = byDof[dof][p];
        }
      }
    }
    return new PsiTable(key.element, key.component, key.derivatives, values);
  }

  /** Identifies a table. */
  private static class TableKey {
    final FiniteElement element;
    final int component;
    final ImmutableList<Integer> derivatives;

    TableKey(FiniteElement element, int component,
        ImmutableList<Integer> derivatives) {
      this.element = element;
      this.component = component;
      this.derivatives = derivatives;
    }
  }
}

// End QuadratureFactorizer.java
