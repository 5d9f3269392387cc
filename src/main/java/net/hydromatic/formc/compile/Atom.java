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
import com.google.common.collect.Ordering;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import net.hydromatic.formc.ast.Expr;
import net.hydromatic.formc.ast.Op;
import net.hydromatic.formc.ast.Side;
import net.hydromatic.formc.element.FiniteElement;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Scalar factor of a {@link Monomial}.
 *
 * <p>Atoms are immutable and totally ordered, so that a monomial's atoms can
 * be kept in canonical order.
 */
public abstract class Atom implements Comparable<Atom> {
  static final Ordering<Iterable<Integer>> DERIVATIVE_ORDERING =
      Ordering.<Integer>natural().lexicographical();

  static final Comparator<@Nullable Side> SIDE_ORDERING =
      Comparator.nullsFirst(Comparator.naturalOrder());

  public final Kind kind;

  Atom(Kind kind) {
    this.kind = requireNonNull(kind);
  }

  /** Returns the derivative of this atom in physical direction
   * {@code i}. */
  abstract Sum derivative(int i);

  /** Compares with another atom of the same kind. */
  abstract int compareSameKind(Atom o);

  /** Side of an interior facet; null if unrestricted. */
  public @Nullable Side side() {
    return null;
  }

  @Override
  public int compareTo(Atom o) {
    final int c = kind.compareTo(o.kind);
    return c != 0 ? c : compareSameKind(o);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Atom && compareTo((Atom) o) == 0;
  }

  private static ImmutableList<Integer> addDerivative(
      List<Integer> derivatives, int i) {
    final List<Integer> list = new ArrayList<>(derivatives);
    list.add(i);
    return Ordering.<Integer>natural().immutableSortedCopy(list);
  }

  private static String describe(String name, int component,
      boolean vector, List<Integer> derivatives, @Nullable Side side) {
    final StringBuilder b = new StringBuilder();
    if (!derivatives.isEmpty()) {
      b.append("D");
      derivatives.forEach(d -> b.append(d));
      b.append('(');
    }
    b.append(name);
    if (vector) {
      b.append('[').append(component).append(']');
    }
    if (!derivatives.isEmpty()) {
      b.append(')');
    }
    if (side != null) {
      b.append("('").append(side.symbol).append("')");
    }
    return b.toString();
  }

  /** Kinds of atom, in canonical order. */
  public enum Kind {
    BASIS,
    COEFFICIENT,
    NORMAL,
    COORDINATE,
    NONLINEAR
  }

  /** Component of a derivative of a basis function of a form argument. */
  public static class Basis extends Atom {
    public final int argument;
    public final FiniteElement element;
    public final int component;
    /** Physical derivative directions, sorted; empty for the value. */
    public final ImmutableList<Integer> derivatives;
    public final @Nullable Side side;

    Basis(int argument, FiniteElement element, int component,
        ImmutableList<Integer> derivatives, @Nullable Side side) {
      super(Kind.BASIS);
      this.argument = argument;
      this.element = requireNonNull(element);
      this.component = component;
      this.derivatives = requireNonNull(derivatives);
      this.side = side;
    }

    @Override
    public @Nullable Side side() {
      return side;
    }

    @Override
    Sum derivative(int i) {
      return Sum.of(
          new Basis(argument, element, component,
              addDerivative(derivatives, i), side));
    }

    @Override
    int compareSameKind(Atom o) {
      final Basis b = (Basis) o;
      int c = Integer.compare(argument, b.argument);
      if (c == 0) {
        c = SIDE_ORDERING.compare(side, b.side);
      }
      if (c == 0) {
        c = Integer.compare(component, b.component);
      }
      if (c == 0) {
        c = DERIVATIVE_ORDERING.compare(derivatives, b.derivatives);
      }
      if (c == 0) {
        c = element.toString().compareTo(b.element.toString());
      }
      return c;
    }

    @Override
    public int hashCode() {
      return Objects.hash(argument, component, derivatives, side, element);
    }

    @Override
    public String toString() {
      return describe("v_" + argument, component,
          !element.valueShape.isScalar(), derivatives, side);
    }
  }

  /** Component of a derivative of a coefficient. */
  public static class Coefficient extends Atom {
    public final Expr.Coefficient coefficient;
    public final int component;
    /** Physical derivative directions, sorted; empty for the value. */
    public final ImmutableList<Integer> derivatives;
    public final @Nullable Side side;

    Coefficient(Expr.Coefficient coefficient, int component,
        ImmutableList<Integer> derivatives, @Nullable Side side) {
      super(Kind.COEFFICIENT);
      this.coefficient = requireNonNull(coefficient);
      this.component = component;
      this.derivatives = requireNonNull(derivatives);
      this.side = side;
    }

    public FiniteElement element() {
      return coefficient.element;
    }

    @Override
    public @Nullable Side side() {
      return side;
    }

    @Override
    Sum derivative(int i) {
      return Sum.of(
          new Coefficient(coefficient, component,
              addDerivative(derivatives, i), side));
    }

    @Override
    int compareSameKind(Atom o) {
      final Coefficient b = (Coefficient) o;
      int c = Integer.compare(coefficient.count, b.coefficient.count);
      if (c == 0) {
        c = SIDE_ORDERING.compare(side, b.side);
      }
      if (c == 0) {
        c = Integer.compare(component, b.component);
      }
      if (c == 0) {
        c = DERIVATIVE_ORDERING.compare(derivatives, b.derivatives);
      }
      return c;
    }

    @Override
    public int hashCode() {
      return Objects.hash(coefficient.count, component, derivatives, side);
    }

    @Override
    public String toString() {
      return describe(coefficient.name, component,
          !coefficient.shape.isScalar(), derivatives, side);
    }
  }

  /** Component of the outward unit normal of a facet. */
  public static class Normal extends Atom {
    public final int component;
    public final @Nullable Side side;

    Normal(int component, @Nullable Side side) {
      super(Kind.NORMAL);
      this.component = component;
      this.side = side;
    }

    @Override
    public @Nullable Side side() {
      return side;
    }

    /** The normal is constant on each facet of an affine cell. */
    @Override
    Sum derivative(int i) {
      return Sum.ZERO;
    }

    @Override
    int compareSameKind(Atom o) {
      final Normal b = (Normal) o;
      final int c = SIDE_ORDERING.compare(side, b.side);
      return c != 0 ? c : Integer.compare(component, b.component);
    }

    @Override
    public int hashCode() {
      return Objects.hash(component, side);
    }

    @Override
    public String toString() {
      return describe("n", component, true, ImmutableList.of(), side);
    }
  }

  /** Component of the spatial coordinate. */
  public static class Coordinate extends Atom {
    public final int component;

    Coordinate(int component) {
      super(Kind.COORDINATE);
      this.component = component;
    }

    @Override
    Sum derivative(int i) {
      return i == component ? Sum.constant(1d) : Sum.ZERO;
    }

    @Override
    int compareSameKind(Atom o) {
      return Integer.compare(component, ((Coordinate) o).component);
    }

    @Override
    public int hashCode() {
      return component;
    }

    @Override
    public String toString() {
      return "x[" + component + "]";
    }
  }

  /**
   * Nonlinear function of a sum, such as {@code sqrt(f + 1)}, or a sum raised
   * to a power that is not a non-negative integer.
   */
  public static class Nonlinear extends Atom {
    /** One of the nonlinear functions ({@link Op#isNonlinear()}) or
     * {@link Op#POWER}. */
    public final Op function;
    /** Exponent if {@link #function} is {@link Op#POWER}, otherwise 0. */
    public final double exponent;
    public final Sum argument;

    Nonlinear(Op function, double exponent, Sum argument) {
      super(Kind.NONLINEAR);
      this.function = requireNonNull(function);
      this.exponent = exponent;
      this.argument = requireNonNull(argument);
    }

    /** Applies the function to a value of its argument. */
    public double apply(double x) {
      return Sum.fold(function, exponent, x);
    }

    /** Returns the derivative by the chain rule. */
    @Override
    Sum derivative(int i) {
      final Sum inner = argument.derivative(i);
      if (inner.isZero()) {
        return Sum.ZERO;
      }
      final Sum outer;
      switch (function) {
        case SQRT:
          outer = Sum.apply(Op.POWER, -0.5d, argument).times(0.5d);
          break;
        case EXP:
          outer = Sum.of(this);
          break;
        case LN:
          outer = Sum.apply(Op.POWER, -1d, argument);
          break;
        case SIN:
          outer = Sum.apply(Op.COS, 0d, argument);
          break;
        case COS:
          outer = Sum.apply(Op.SIN, 0d, argument).times(-1d);
          break;
        case ABS:
          outer = Sum.apply(Op.SIGN, 0d, argument);
          break;
        case SIGN:
          return Sum.ZERO;
        case POWER:
          outer =
              Sum.apply(Op.POWER, exponent - 1d, argument).times(exponent);
          break;
        default:
          throw new AssertionError(function);
      }
      return outer.times(inner);
    }

    @Override
    int compareSameKind(Atom o) {
      final Nonlinear b = (Nonlinear) o;
      int c = function.compareTo(b.function);
      if (c == 0) {
        c = Double.compare(exponent, b.exponent);
      }
      if (c == 0) {
        c = argument.compareTo(b.argument);
      }
      return c;
    }

    @Override
    public int hashCode() {
      return Objects.hash(function, exponent, argument);
    }

    @Override
    public String toString() {
      return function == Op.POWER
          ? "(" + argument + ") ** " + exponent
          : function.padded + "(" + argument + ")";
    }
  }
}

// End Atom.java
