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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.formc.ast.ExprBuilder.dsl;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import java.util.List;
import java.util.Objects;
import net.hydromatic.formc.element.Domain;
import net.hydromatic.formc.element.FiniteElement;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Expression in a variational form.
 *
 * <p>Expressions are immutable. Create them using {@link ExprBuilder#dsl},
 * which checks shapes as each node is built. Equality is structural and
 * ignores the names given to coefficients.
 */
public abstract class Expr {
  /** Canonical total order of expressions: by op, then by attributes (such
   * as argument number or constant value), then by operands. */
  public static final Ordering<Expr> ORDERING = Ordering.from(Expr::compare);

  public final Op op;
  public final Shape shape;
  /** Domain of the terminals in this expression; null if there are none,
   * for example in a constant. */
  public final @Nullable Domain domain;

  protected Expr(Op op, Shape shape, @Nullable Domain domain) {
    this.op = requireNonNull(op);
    this.shape = requireNonNull(shape);
    this.domain = domain;
  }

  /** Returns the operands of this expression; empty for a terminal. */
  public abstract List<Expr> operands();

  /** Returns the values, other than operands, that distinguish this node
   * from other nodes with the same op. */
  List<Comparable<?>> attributes() {
    return ImmutableList.of();
  }

  /**
   * Converts this node into a string in form-file syntax.
   *
   * <p>Derived classes override {@link #unparse(ExprWriter, int, int)}, not
   * this method.
   */
  @Override
  public final String toString() {
    return unparse(new ExprWriter(), 0, 0).toString();
  }

  abstract ExprWriter unparse(ExprWriter w, int left, int right);

  /** Accepts a shuttle, calling the {@link Shuttle#visit} method appropriate
   * to the type of this node, and returning the result. */
  public abstract Expr accept(Shuttle shuttle);

  /** Accepts a visitor, calling the {@link Visitor#visit} method appropriate
   * to the type of this node. */
  public abstract void accept(Visitor visitor);

  /** Returns a copy of this expression with new operands, or this if the
   * operands are the same. */
  public abstract Expr copy(List<Expr> operands);

  @Override
  public int hashCode() {
    return Objects.hash(op, shape, attributes(), operands());
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Expr
            && op == ((Expr) o).op
            && shape.equals(((Expr) o).shape)
            && attributes().equals(((Expr) o).attributes())
            && operands().equals(((Expr) o).operands());
  }

  @SuppressWarnings({"rawtypes", "unchecked"})
  private static int compare(Expr e1, Expr e2) {
    if (e1 == e2) {
      return 0;
    }
    int c = e1.op.compareTo(e2.op);
    if (c != 0) {
      return c;
    }
    final List<Comparable<?>> a1 = e1.attributes();
    final List<Comparable<?>> a2 = e2.attributes();
    for (int i = 0; i < Math.min(a1.size(), a2.size()); i++) {
      final Comparable c1 = a1.get(i);
      final Comparable c2 = a2.get(i);
      c = c1.getClass() == c2.getClass()
          ? c1.compareTo(c2)
          : c1.getClass().getName().compareTo(c2.getClass().getName());
      if (c != 0) {
        return c;
      }
    }
    c = Integer.compare(a1.size(), a2.size());
    if (c != 0) {
      return c;
    }
    final List<Expr> o1 = e1.operands();
    final List<Expr> o2 = e2.operands();
    for (int i = 0; i < Math.min(o1.size(), o2.size()); i++) {
      c = compare(o1.get(i), o2.get(i));
      if (c != 0) {
        return c;
      }
    }
    c = Integer.compare(o1.size(), o2.size());
    if (c != 0) {
      return c;
    }
    return e1.shape.toString().compareTo(e2.shape.toString());
  }

  /** Base class for expressions that have no operands. */
  public abstract static class Terminal extends Expr {
    Terminal(Op op, Shape shape, @Nullable Domain domain) {
      super(op, shape, domain);
    }

    @Override
    public List<Expr> operands() {
      return ImmutableList.of();
    }

    @Override
    public Expr copy(List<Expr> operands) {
      return this;
    }
  }

  /** Argument of a form: the test function (number 0) or the trial function
   * (number 1). */
  public static class Argument extends Terminal {
    public final int number;
    public final FiniteElement element;

    Argument(int number, FiniteElement element) {
      super(Op.ARGUMENT, element.valueShape, element.domain);
      this.number = number;
      this.element = element;
    }

    @Override
    List<Comparable<?>> attributes() {
      return ImmutableList.of(number, element.toString());
    }

    @Override
    ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.append("v_").append(Integer.toString(number));
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Coefficient: a known function in a finite element space. */
  public static class Coefficient extends Terminal {
    /** Ordinal of the coefficient in its form file; coefficients are
     * numbered in order of declaration. */
    public final int count;
    public final String name;
    public final FiniteElement element;

    Coefficient(int count, String name, FiniteElement element) {
      super(Op.COEFFICIENT, element.valueShape, element.domain);
      this.count = count;
      this.name = requireNonNull(name);
      this.element = element;
    }

    @Override
    List<Comparable<?>> attributes() {
      return ImmutableList.of(count, name, element.toString());
    }

    @Override
    ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.append(name);
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Real literal. */
  public static class Constant extends Terminal {
    public final double value;

    Constant(double value) {
      super(Op.CONSTANT, Shape.SCALAR, null);
      this.value = value;
    }

    @Override
    List<Comparable<?>> attributes() {
      return ImmutableList.of(value);
    }

    @Override
    ExprWriter unparse(ExprWriter w, int left, int right) {
      if (value < 0) {
        return w.prefix(left, Op.NEGATE, new Constant(-value), right);
      }
      return w.append(value == Math.rint(value) && value < 1e15
          ? Long.toString((long) value)
          : Double.toString(value));
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Zero of a given shape. */
  public static class Zero extends Terminal {
    Zero(Shape shape) {
      super(Op.ZERO, shape, null);
    }

    @Override
    ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.append(shape.isScalar() ? "0" : "zero" + shape);
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Geometric quantity of a domain: the outward unit normal of a facet, or
   * the spatial coordinate. */
  public static class Geometric extends Terminal {
    Geometric(Op op, Domain domain) {
      super(op, Shape.of(domain.dimension()), domain);
    }

    @Override
    List<Comparable<?>> attributes() {
      return ImmutableList.of(requireNonNull(domain).toString());
    }

    @Override
    ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.append(op == Op.FACET_NORMAL ? "n" : "x");
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Call to an operator or function with one operand, such as
   * {@code grad(u)}, {@code -u} or {@code sqrt(f)}. */
  public static class Call1 extends Expr {
    public final Expr a;

    Call1(Op op, Shape shape, Expr a) {
      super(op, shape, a.domain);
      this.a = requireNonNull(a);
    }

    @Override
    public List<Expr> operands() {
      return ImmutableList.of(a);
    }

    @Override
    ExprWriter unparse(ExprWriter w, int left, int right) {
      if (op == Op.NEGATE) {
        return w.prefix(left, op, a, right);
      }
      return w.call(op.padded, operands());
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public Expr copy(List<Expr> operands) {
      return operands.get(0).equals(a) ? this : dsl.call(op, operands.get(0));
    }
  }

  /** Call to an operator or function with two operands, such as
   * {@code u + v} or {@code inner(u, v)}. */
  public static class Call2 extends Expr {
    public final Expr a0;
    public final Expr a1;

    Call2(Op op, Shape shape, @Nullable Domain domain, Expr a0, Expr a1) {
      super(op, shape, domain);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
    }

    @Override
    public List<Expr> operands() {
      return ImmutableList.of(a0, a1);
    }

    @Override
    ExprWriter unparse(ExprWriter w, int left, int right) {
      if (op.function) {
        return w.call(op.padded, operands());
      }
      return w.infix(left, a0, op, a1, right);
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public Expr copy(List<Expr> operands) {
      return operands.get(0).equals(a0) && operands.get(1).equals(a1)
          ? this
          : dsl.call(op, operands.get(0), operands.get(1));
    }
  }

  /** Scalar raised to a real power, {@code a ** exponent}. */
  public static class Power extends Expr {
    public final Expr a;
    public final double exponent;

    Power(Expr a, double exponent) {
      super(Op.POWER, Shape.SCALAR, a.domain);
      this.a = requireNonNull(a);
      this.exponent = exponent;
    }

    @Override
    public List<Expr> operands() {
      return ImmutableList.of(a);
    }

    @Override
    List<Comparable<?>> attributes() {
      return ImmutableList.of(exponent);
    }

    /** Returns the exponent if it is a non-negative integer, otherwise -1. */
    public int integerExponent() {
      return exponent >= 0 && exponent == Math.rint(exponent)
          && exponent < Integer.MAX_VALUE
          ? (int) exponent
          : -1;
    }

    @Override
    ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.infix(left, a, op, new Constant(exponent), right);
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public Expr copy(List<Expr> operands) {
      return operands.get(0).equals(a)
          ? this
          : dsl.power(operands.get(0), exponent);
    }
  }

  /** Component of a vector or row of a matrix, {@code a[component]}. */
  public static class Indexed extends Expr {
    public final Expr a;
    public final int component;

    Indexed(Expr a, int component) {
      super(Op.INDEXED, a.shape.dropFirst(), a.domain);
      this.a = requireNonNull(a);
      this.component = component;
    }

    @Override
    public List<Expr> operands() {
      return ImmutableList.of(a);
    }

    @Override
    List<Comparable<?>> attributes() {
      return ImmutableList.of(component);
    }

    @Override
    ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.postfix(left, a, op, "[" + component + "]", right);
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public Expr copy(List<Expr> operands) {
      return operands.get(0).equals(a)
          ? this
          : dsl.index(operands.get(0), component);
    }
  }

  /** Expression evaluated on one side of an interior facet,
   * {@code a('+')}. */
  public static class Restricted extends Expr {
    public final Expr a;
    public final Side side;

    Restricted(Expr a, Side side) {
      super(Op.RESTRICTED, a.shape, a.domain);
      this.a = requireNonNull(a);
      this.side = requireNonNull(side);
    }

    @Override
    public List<Expr> operands() {
      return ImmutableList.of(a);
    }

    @Override
    List<Comparable<?>> attributes() {
      return ImmutableList.of(side);
    }

    @Override
    ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.postfix(left, a, op, "('" + side.symbol + "')", right);
    }

    @Override
    public Expr accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public Expr copy(List<Expr> operands) {
      return operands.get(0).equals(a)
          ? this
          : dsl.restrict(operands.get(0), side);
    }
  }
}

// End Expr.java
