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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import net.hydromatic.formc.compile.CompileException;
import net.hydromatic.formc.compile.ShapeException;
import net.hydromatic.formc.element.Domain;
import net.hydromatic.formc.element.Elements;
import net.hydromatic.formc.element.Family;
import net.hydromatic.formc.element.FiniteElement;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Builds expressions, integrals and forms.
 *
 * <p>Every method checks the shapes of its operands before it creates a
 * node, and throws {@link ShapeException} if they are incompatible.
 */
public enum ExprBuilder {
  /**
   * The singleton instance of the expression builder. The short name is
   * convenient for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  dsl;

  // terminals

  /** Creates an argument; number 0 is the test function, 1 the trial
   * function. */
  public Expr.Argument argument(int number, FiniteElement element) {
    checkArgument(number == 0 || number == 1, "invalid argument number %s",
        number);
    return new Expr.Argument(number, element);
  }

  public Expr.Argument testFunction(FiniteElement element) {
    return argument(0, element);
  }

  public Expr.Argument trialFunction(FiniteElement element) {
    return argument(1, element);
  }

  public Expr.Coefficient coefficient(int count, String name,
      FiniteElement element) {
    return new Expr.Coefficient(count, name, element);
  }

  /** Creates a coefficient that is constant on each cell: a coefficient in
   * the Real space. */
  public Expr.Coefficient constant(int count, String name, Domain domain) {
    return coefficient(count, name, Elements.create(Family.REAL, domain, 0));
  }

  public Expr.Constant real(double value) {
    return new Expr.Constant(value);
  }

  public Expr.Zero zero(Shape shape) {
    return new Expr.Zero(shape);
  }

  public Expr.Geometric facetNormal(Domain domain) {
    return new Expr.Geometric(Op.FACET_NORMAL, domain);
  }

  public Expr.Geometric spatialCoordinate(Domain domain) {
    return new Expr.Geometric(Op.SPATIAL_COORDINATE, domain);
  }

  // differential operators

  /** Gradient; appends an axis whose extent is the dimension of the
   * domain. */
  public Expr grad(Expr a) {
    final Domain domain = differentiable(Op.GRAD, a);
    return new Expr.Call1(Op.GRAD, a.shape.append(domain.dimension()), a);
  }

  /** Divergence; removes the last axis, whose extent must be the dimension
   * of the domain. */
  public Expr div(Expr a) {
    final Domain domain = differentiable(Op.DIV, a);
    if (a.shape.isScalar() || a.shape.last() != domain.dimension()) {
      throw new ShapeException("divergence requires last axis of extent "
          + domain.dimension(), describe(Op.DIV, a), a.shape, null, Pos.ZERO);
    }
    return new Expr.Call1(Op.DIV, a.shape.dropLast(), a);
  }

  /** Curl of a 3-vector (a 3-vector), of a 2-vector (a scalar) or of a
   * scalar in 2 dimensions (a 2-vector). */
  public Expr curl(Expr a) {
    final Domain domain = differentiable(Op.CURL, a);
    final int d = domain.dimension();
    final Shape shape;
    if (d == 3 && a.shape.equals(Shape.of(3))) {
      shape = Shape.of(3);
    } else if (d == 2 && a.shape.equals(Shape.of(2))) {
      shape = Shape.SCALAR;
    } else if (d == 2 && a.shape.isScalar()) {
      shape = Shape.of(2);
    } else {
      throw new ShapeException("curl is not defined in " + d
          + " dimensions", describe(Op.CURL, a), a.shape, null, Pos.ZERO);
    }
    return new Expr.Call1(Op.CURL, shape, a);
  }

  private Domain differentiable(Op op, Expr a) {
    if (a.domain == null) {
      throw new ShapeException("cannot differentiate an expression that "
          + "has no domain", describe(op, a), a.shape, null, Pos.ZERO);
    }
    return a.domain;
  }

  // tensor algebra

  /** Inner product of two expressions of the same shape; a scalar. */
  public Expr inner(Expr a0, Expr a1) {
    if (!a0.shape.equals(a1.shape)) {
      throw mismatch("inner product requires equal shapes", Op.INNER, a0,
          a1);
    }
    return call2(Op.INNER, Shape.SCALAR, a0, a1);
  }

  /** Contracts the last axis of {@code a0} with the first axis of
   * {@code a1}. */
  public Expr dot(Expr a0, Expr a1) {
    if (a0.shape.isScalar() && a1.shape.isScalar()) {
      return call2(Op.DOT, Shape.SCALAR, a0, a1);
    }
    if (a0.shape.isScalar()
        || a1.shape.isScalar()
        || a0.shape.last() != a1.shape.first()) {
      throw mismatch("dot product requires last axis of left operand to "
          + "match first axis of right operand", Op.DOT, a0, a1);
    }
    return call2(Op.DOT, a0.shape.dropLast().concat(a1.shape.dropFirst()),
        a0, a1);
  }

  /** Outer product; the shape is the concatenation of the shapes. */
  public Expr outer(Expr a0, Expr a1) {
    return call2(Op.OUTER, a0.shape.concat(a1.shape), a0, a1);
  }

  public Expr transpose(Expr a) {
    if (a.shape.rank() != 2) {
      throw new ShapeException("transpose requires a matrix",
          describe(Op.TRANSPOSE, a), a.shape, null, Pos.ZERO);
    }
    return new Expr.Call1(Op.TRANSPOSE, a.shape.reverse(), a);
  }

  /** Trace of a square matrix, the sum of its diagonal entries. */
  public Expr tr(Expr a) {
    if (a.shape.rank() != 2 || a.shape.dim(0) != a.shape.dim(1)) {
      throw new ShapeException("trace requires a square matrix",
          "tr(" + a + ")", a.shape, null, Pos.ZERO);
    }
    final List<Expr> terms = new ArrayList<>();
    for (int i = 0; i < a.shape.dim(0); i++) {
      terms.add(index(index(a, i), i));
    }
    return sum(terms);
  }

  /** Component {@code i} of a vector, or row {@code i} of a matrix. */
  public Expr index(Expr a, int i) {
    if (a.shape.isScalar()) {
      throw new ShapeException("cannot index a scalar", a + "[" + i + "]",
          a.shape, null, Pos.ZERO);
    }
    if (i < 0 || i >= a.shape.first()) {
      throw new ShapeException("component " + i + " out of range",
          a + "[" + i + "]", a.shape, null, Pos.ZERO);
    }
    return new Expr.Indexed(a, i);
  }

  // arithmetic

  public Expr plus(Expr a0, Expr a1) {
    if (!a0.shape.equals(a1.shape)) {
      throw mismatch("sum requires equal shapes", Op.PLUS, a0, a1);
    }
    return call2(Op.PLUS, a0.shape, a0, a1);
  }

  public Expr minus(Expr a0, Expr a1) {
    if (!a0.shape.equals(a1.shape)) {
      throw mismatch("difference requires equal shapes", Op.PLUS, a0, a1);
    }
    return plus(a0, negate(a1));
  }

  /** Product; at least one operand must be a scalar. */
  public Expr times(Expr a0, Expr a1) {
    if (a0.shape.isScalar()) {
      return call2(Op.TIMES, a1.shape, a0, a1);
    }
    if (a1.shape.isScalar()) {
      return call2(Op.TIMES, a0.shape, a0, a1);
    }
    throw mismatch("product requires a scalar operand; use inner, dot or "
        + "outer", Op.TIMES, a0, a1);
  }

  /** Quotient; the denominator must be a scalar. */
  public Expr divide(Expr a0, Expr a1) {
    if (!a1.shape.isScalar()) {
      throw mismatch("denominator must be a scalar", Op.DIVIDE, a0, a1);
    }
    return call2(Op.DIVIDE, a0.shape, a0, a1);
  }

  public Expr negate(Expr a) {
    return new Expr.Call1(Op.NEGATE, a.shape, a);
  }

  /** Scalar raised to a real power. */
  public Expr power(Expr a, double exponent) {
    if (!a.shape.isScalar()) {
      throw new ShapeException("base of power must be a scalar",
          a + " ** " + exponent, a.shape, null, Pos.ZERO);
    }
    return new Expr.Power(a, exponent);
  }

  /** Applies a nonlinear function such as {@link Op#SQRT} to a scalar. */
  public Expr function(Op op, Expr a) {
    checkArgument(op.isNonlinear(), "not a function: %s", op);
    if (!a.shape.isScalar()) {
      throw new ShapeException("argument of " + op.padded
          + " must be a scalar", describe(op, a), a.shape, null, Pos.ZERO);
    }
    return new Expr.Call1(op, Shape.SCALAR, a);
  }

  public Expr sqrt(Expr a) {
    return function(Op.SQRT, a);
  }

  public Expr exp(Expr a) {
    return function(Op.EXP, a);
  }

  /** Builds a call to a unary operator or function. */
  public Expr call(Op op, Expr a) {
    switch (op) {
      case GRAD:
        return grad(a);
      case DIV:
        return div(a);
      case CURL:
        return curl(a);
      case NEGATE:
        return negate(a);
      case TRANSPOSE:
        return transpose(a);
      default:
        return function(op, a);
    }
  }

  /** Builds a call to a binary operator. */
  public Expr call(Op op, Expr a0, Expr a1) {
    switch (op) {
      case INNER:
        return inner(a0, a1);
      case DOT:
        return dot(a0, a1);
      case OUTER:
        return outer(a0, a1);
      case PLUS:
        return plus(a0, a1);
      case TIMES:
        return times(a0, a1);
      case DIVIDE:
        return divide(a0, a1);
      default:
        throw new IllegalArgumentException("not a binary operator: " + op);
    }
  }

  /** Sum of a non-empty list of expressions of equal shape, associated to
   * the left. */
  public Expr sum(List<Expr> terms) {
    checkArgument(!terms.isEmpty(), "empty sum");
    Expr e = terms.get(0);
    for (Expr term : terms.subList(1, terms.size())) {
      e = plus(e, term);
    }
    return e;
  }

  // interior facets

  /** Restricts an expression to one side of an interior facet. */
  public Expr restrict(Expr a, Side side) {
    if (a.op == Op.RESTRICTED) {
      throw new ShapeException("expression is already restricted",
          a + "('" + side.symbol + "')", a.shape, null, Pos.ZERO);
    }
    return new Expr.Restricted(a, side);
  }

  /** Average of the two sides of an interior facet. */
  public Expr avg(Expr a) {
    return times(real(0.5d),
        plus(restrict(a, Side.PLUS), restrict(a, Side.MINUS)));
  }

  /** Difference between the two sides of an interior facet. */
  public Expr jump(Expr a) {
    return minus(restrict(a, Side.PLUS), restrict(a, Side.MINUS));
  }

  /**
   * Jump of an expression across an interior facet, weighted by the facet
   * normal; a vector if {@code a} is a scalar, a scalar if {@code a} has the
   * same shape as the normal.
   */
  public Expr jump(Expr a, Expr n) {
    if (a.shape.isScalar()) {
      return plus(times(restrict(a, Side.PLUS), restrict(n, Side.PLUS)),
          times(restrict(a, Side.MINUS), restrict(n, Side.MINUS)));
    }
    if (a.shape.equals(n.shape)) {
      return plus(dot(restrict(a, Side.PLUS), restrict(n, Side.PLUS)),
          dot(restrict(a, Side.MINUS), restrict(n, Side.MINUS)));
    }
    throw new ShapeException("jump requires a scalar or an operand of the "
        + "same shape as the normal", "jump(" + a + ", " + n + ")", a.shape,
        n.shape, Pos.ZERO);
  }

  // measures, integrals and forms

  public Measure dx() {
    return Measure.of(IntegralType.CELL);
  }

  public Measure ds() {
    return Measure.of(IntegralType.EXTERIOR_FACET);
  }

  public Measure dS() {
    return Measure.of(IntegralType.INTERIOR_FACET);
  }

  /** Integrates a scalar expression over a measure. */
  public Integral integral(Expr integrand, Measure measure) {
    if (!integrand.shape.isScalar()) {
      throw new ShapeException("integrand must be a scalar",
          "(" + integrand + ") * " + measure, integrand.shape, null,
          Pos.ZERO);
    }
    if (integrand.domain == null) {
      throw new ShapeException("integrand has no domain; use a Constant "
          + "instead of a literal", "(" + integrand + ") * " + measure,
          integrand.shape, null, Pos.ZERO);
    }
    return new Integral(integrand, measure);
  }

  public Form form(Integral... integrals) {
    return form(Arrays.asList(integrals));
  }

  /**
   * Creates a form from a list of integrals.
   *
   * <p>Checks that all integrals are on the same domain, that the form has
   * at most one test and one trial function, and that each coefficient
   * number denotes a single coefficient.
   */
  public Form form(List<Integral> integrals) {
    checkArgument(!integrals.isEmpty(), "form has no integrals");
    final Domain domain = integrals.get(0).domain();
    final SortedMap<Integer, Expr.Argument> arguments = new TreeMap<>();
    final SortedMap<Integer, Expr.Coefficient> coefficients = new TreeMap<>();
    for (Integral integral : integrals) {
      if (!integral.domain().equals(domain)) {
        throw new CompileException("integrals are on different domains: "
            + domain + " and " + integral.domain(), Pos.ZERO);
      }
      for (Expr.Argument a : Exprs.arguments(integral.integrand)) {
        final Expr.Argument previous = arguments.put(a.number, a);
        if (previous != null && !previous.element.equals(a.element)) {
          throw new CompileException("argument " + a.number
              + " has elements " + previous.element + " and " + a.element,
              Pos.ZERO);
        }
      }
      for (Expr.Coefficient c : Exprs.coefficients(integral.integrand)) {
        final Expr.Coefficient previous = coefficients.put(c.count, c);
        if (previous != null && !previous.equals(c)) {
          throw new CompileException("coefficient number " + c.count
              + " denotes " + previous.name + " and " + c.name, Pos.ZERO);
        }
      }
    }
    if (arguments.containsKey(1) && !arguments.containsKey(0)) {
      throw new CompileException("form has a trial function but no test "
          + "function", Pos.ZERO);
    }
    return new Form(ImmutableList.copyOf(integrals), domain,
        ImmutableList.copyOf(arguments.values()),
        ImmutableList.copyOf(coefficients.values()));
  }

  // helpers

  private Expr call2(Op op, Shape shape, Expr a0, Expr a1) {
    return new Expr.Call2(op, shape, domain(op, a0, a1), a0, a1);
  }

  private @Nullable Domain domain(Op op, Expr a0, Expr a1) {
    if (a0.domain == null) {
      return a1.domain;
    }
    if (a1.domain != null && !a0.domain.equals(a1.domain)) {
      throw mismatch("operands are on different domains, " + a0.domain
          + " and " + a1.domain, op, a0, a1);
    }
    return a0.domain;
  }

  private static ShapeException mismatch(String reason, Op op, Expr a0,
      Expr a1) {
    return new ShapeException(reason, describe(op, a0, a1), a0.shape,
        a1.shape, Pos.ZERO);
  }

  /** Describes a call that could not be built, e.g. "inner(u, v)". */
  private static String describe(Op op, Expr... args) {
    final StringBuilder b = new StringBuilder();
    if (op.function) {
      b.append(op.padded).append('(');
      for (int i = 0; i < args.length; i++) {
        b.append(i > 0 ? ", " : "").append(args[i]);
      }
      return b.append(')').toString();
    }
    if (args.length == 1) {
      return op.padded + "(" + args[0] + ")";
    }
    return "(" + args[0] + ")" + op.padded + "(" + args[1] + ")";
  }
}

// End ExprBuilder.java
