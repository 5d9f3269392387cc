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
package net.hydromatic.formc.ast;

import static net.hydromatic.formc.ast.ExprBuilder.dsl;

import com.google.common.collect.ImmutableSortedSet;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** Utilities for {@link Expr}. */
public abstract class Exprs {
  private Exprs() {}

  /** Returns the additive terms of an expression; for example, the terms
   * of {@code a + (b + c)} are [a, b, c]. */
  public static List<Expr> terms(Expr e) {
    final List<Expr> list = new ArrayList<>();
    addTerms(list, e);
    return list;
  }

  private static void addTerms(List<Expr> list, Expr e) {
    if (e.op == Op.PLUS) {
      final Expr.Call2 plus = (Expr.Call2) e;
      addTerms(list, plus.a0);
      addTerms(list, plus.a1);
    } else {
      list.add(e);
    }
  }

  /**
   * Sorts the additive terms of an expression into canonical order.
   *
   * <p>Two sums that differ only in the order of their terms have the same
   * canonical sum.
   */
  public static Expr canonicalSum(Expr e) {
    final List<Expr> terms = terms(e);
    if (terms.size() == 1) {
      return e;
    }
    return dsl.sum(Expr.ORDERING.sortedCopy(terms));
  }

  /** Returns the arguments in an expression, sorted by number. */
  public static ImmutableSortedSet<Expr.Argument> arguments(Expr e) {
    final ImmutableSortedSet.Builder<Expr.Argument> b =
        ImmutableSortedSet.orderedBy(
            Comparator.comparingInt((Expr.Argument a) -> a.number)
                .thenComparing(Expr.ORDERING));
    e.accept(
        new Visitor() {
          @Override
          protected void visit(Expr.Argument argument) {
            b.add(argument);
          }
        });
    return b.build();
  }

  /** Returns the coefficients in an expression, sorted by count. */
  public static ImmutableSortedSet<Expr.Coefficient> coefficients(Expr e) {
    final ImmutableSortedSet.Builder<Expr.Coefficient> b =
        ImmutableSortedSet.orderedBy(
            Comparator.comparingInt((Expr.Coefficient c) -> c.count)
                .thenComparing(Expr.ORDERING));
    e.accept(
        new Visitor() {
          @Override
          protected void visit(Expr.Coefficient coefficient) {
            b.add(coefficient);
          }
        });
    return b.build();
  }

  /** Returns whether an expression contains a node with a given op. */
  public static boolean contains(Expr e, Op op) {
    if (e.op == op) {
      return true;
    }
    for (Expr operand : e.operands()) {
      if (contains(operand, op)) {
        return true;
      }
    }
    return false;
  }
}

// End Exprs.java
