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
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import net.hydromatic.formc.compile.CompileException;
import net.hydromatic.formc.compile.ShapeException;
import net.hydromatic.formc.element.Cell;
import net.hydromatic.formc.element.Domain;
import net.hydromatic.formc.element.Elements;
import net.hydromatic.formc.element.Family;
import net.hydromatic.formc.element.FiniteElement;
import org.junit.jupiter.api.Test;

/** Tests {@link ExprBuilder}. */
public class ExprBuilderTest {
  private static final Domain TRIANGLE = Domain.of(Cell.TRIANGLE);
  private static final FiniteElement P1 =
      Elements.create(Family.LAGRANGE, TRIANGLE, 1);
  private static final FiniteElement VP1 =
      Elements.vector(Family.LAGRANGE, TRIANGLE, 1, 2);

  private final Expr v = dsl.testFunction(P1);
  private final Expr u = dsl.trialFunction(P1);
  private final Expr f = dsl.coefficient(0, "f", P1);

  @Test void testShapes() {
    assertThat(v.shape, is(Shape.SCALAR));
    final Expr gradV = dsl.grad(v);
    assertThat(gradV.shape, is(Shape.of(2)));
    assertThat(gradV, hasToString("grad(v_0)"));
    assertThat(dsl.grad(gradV).shape, is(Shape.of(2, 2)));
    assertThat(dsl.div(gradV).shape, is(Shape.SCALAR));
    assertThat(dsl.curl(v).shape, is(Shape.of(2)));

    final Expr w = dsl.coefficient(1, "w", VP1);
    assertThat(w.shape, is(Shape.of(2)));
    assertThat(dsl.dot(w, gradV).shape, is(Shape.SCALAR));
    assertThat(dsl.curl(w).shape, is(Shape.SCALAR));
    final Expr outer = dsl.outer(w, gradV);
    assertThat(outer.shape, is(Shape.of(2, 2)));
    assertThat(dsl.transpose(dsl.grad(w)).shape, is(Shape.of(2, 2)));
    assertThat(dsl.dot(dsl.grad(w), w).shape, is(Shape.of(2)));
    assertThat(dsl.tr(outer).shape, is(Shape.SCALAR));
    assertThat(dsl.tr(outer),
        hasToString("outer(w, grad(v_0))[0][0] + outer(w, grad(v_0))[1][1]"));
    assertThat(dsl.index(w, 1), hasToString("w[1]"));
    assertThat(dsl.times(dsl.real(2), w).shape, is(Shape.of(2)));
  }

  @Test void testToString() {
    assertThat(dsl.inner(dsl.grad(u), dsl.grad(v)),
        hasToString("inner(grad(v_1), grad(v_0))"));
    assertThat(dsl.plus(dsl.times(u, v), dsl.times(f, v)),
        hasToString("v_1 * v_0 + f * v_0"));
    assertThat(dsl.times(dsl.plus(u, f), v),
        hasToString("(v_1 + f) * v_0"));
    assertThat(dsl.sqrt(f), hasToString("sqrt(f)"));
    assertThat(dsl.restrict(v, Side.MINUS), hasToString("v_0('-')"));
    assertThat(dsl.integral(dsl.times(u, v), dsl.dx()),
        hasToString("v_1 * v_0 * dx"));
    assertThat(dsl.integral(dsl.plus(u, f), dsl.ds()),
        hasToString("(v_1 + f) * ds"));
  }

  /** Shape errors are detected as each node is built. */
  @Test void testShapeErrors() {
    final ShapeException e =
        assertThrows(ShapeException.class,
            () -> dsl.inner(u, dsl.grad(v)));
    assertThat(e.getMessage(),
        is("inner product requires equal shapes in inner(v_1, grad(v_0)): "
            + "shapes () and (2)"));
    assertThat(e.left, is(Shape.SCALAR));
    assertThat(e.right, is(Shape.of(2)));
    assertThat(e.expression, is("inner(v_1, grad(v_0))"));

    final ShapeException e2 =
        assertThrows(ShapeException.class,
            () -> dsl.times(dsl.grad(u), dsl.grad(v)));
    assertThat(e2.getMessage(),
        is("product requires a scalar operand; use inner, dot or outer in "
            + "(grad(v_1)) * (grad(v_0)): shapes (2) and (2)"));

    final ShapeException e3 =
        assertThrows(ShapeException.class, () -> dsl.div(v));
    assertThat(e3.getMessage(),
        is("divergence requires last axis of extent 2 in div(v_0): "
            + "shape ()"));

    assertThrows(ShapeException.class, () -> dsl.plus(u, dsl.grad(v)));
    assertThrows(ShapeException.class, () -> dsl.index(v, 0));
    assertThrows(ShapeException.class, () -> dsl.index(dsl.grad(v), 2));
    assertThrows(ShapeException.class, () -> dsl.transpose(dsl.grad(v)));
    assertThrows(ShapeException.class, () -> dsl.sqrt(dsl.grad(v)));
    assertThrows(ShapeException.class,
        () -> dsl.power(dsl.grad(v), 2));
    assertThrows(ShapeException.class,
        () -> dsl.divide(v, dsl.grad(u)));
    assertThrows(ShapeException.class,
        () -> dsl.grad(dsl.real(1)));
    assertThrows(ShapeException.class,
        () -> dsl.restrict(dsl.restrict(v, Side.PLUS), Side.MINUS));
  }

  @Test void testDifferentDomains() {
    final FiniteElement tet =
        Elements.create(Family.LAGRANGE, Domain.of(Cell.TETRAHEDRON), 1);
    final ShapeException e =
        assertThrows(ShapeException.class,
            () -> dsl.times(dsl.trialFunction(tet), v));
    assertThat(e.getMessage(),
        is("operands are on different domains, tetrahedron and triangle in "
            + "(v_1) * (v_0): shapes () and ()"));
  }

  @Test void testIntegralErrors() {
    final ShapeException e =
        assertThrows(ShapeException.class,
            () -> dsl.integral(dsl.grad(v), dsl.dx()));
    assertThat(e.getMessage(),
        is("integrand must be a scalar in (grad(v_0)) * dx: shape (2)"));
    final ShapeException e2 =
        assertThrows(ShapeException.class,
            () -> dsl.integral(dsl.real(1), dsl.dx()));
    assertThat(e2.getMessage(),
        is("integrand has no domain; use a Constant instead of a literal in "
            + "(1) * dx: shape ()"));
  }

  @Test void testJump() {
    final Expr n = dsl.facetNormal(TRIANGLE);
    assertThat(dsl.jump(v).shape, is(Shape.SCALAR));
    assertThat(dsl.jump(v), hasToString("v_0('+') + -v_0('-')"));
    assertThat(dsl.jump(v, n).shape, is(Shape.of(2)));
    assertThat(dsl.jump(dsl.grad(v), n).shape, is(Shape.SCALAR));
    assertThat(dsl.avg(v).shape, is(Shape.SCALAR));
    assertThrows(ShapeException.class,
        () -> dsl.jump(dsl.grad(dsl.grad(v)), n));
  }

  @Test void testMeasure() {
    assertThat(dsl.dx(), hasToString("dx"));
    assertThat(dsl.dS().withSubdomain(3), hasToString("dS(3)"));
    assertThat(
        dsl.dx().withSubdomain(1).withDegree(2)
            .withRepresentation(Representation.TENSOR),
        hasToString("dx(1, degree=2, representation=\"tensor\")"));
    assertThat(dsl.ds().withDegree(2).withDegree(null), is(dsl.ds()));
  }

  @Test void testForm() {
    final Form a =
        dsl.form(dsl.integral(dsl.inner(dsl.grad(u), dsl.grad(v)), dsl.dx()),
            dsl.integral(dsl.times(u, v), dsl.ds().withSubdomain(2)),
            dsl.integral(dsl.times(u, v), dsl.ds()));
    assertThat(a.rank(), is(2));
    assertThat(a.domain, is(TRIANGLE));
    assertThat(a.arguments, hasToString("[v_0, v_1]"));
    assertThat(a.coefficients.isEmpty(), is(true));
    assertThat(a.integralTypes(),
        hasToString("[CELL, EXTERIOR_FACET]"));
    assertThat(a.subdomainIds(IntegralType.EXTERIOR_FACET),
        hasToString("[0, 2]"));
    assertThat(a.integrals(IntegralType.EXTERIOR_FACET, 2).size(), is(1));

    final Form l = dsl.form(dsl.integral(dsl.times(f, v), dsl.dx()));
    assertThat(l.rank(), is(1));
    assertThat(l.coefficients, hasToString("[f]"));
    final Form sum = l.plus(l);
    assertThat(sum.integrals.size(), is(2));
    assertThat(sum, hasToString("f * v_0 * dx + f * v_0 * dx"));
  }

  @Test void testFormErrors() {
    final CompileException e =
        assertThrows(CompileException.class,
            () -> dsl.form(dsl.integral(u, dsl.dx())));
    assertThat(e.getMessage(),
        is("form has a trial function but no test function"));
    final Expr g = dsl.coefficient(0, "g", P1);
    final CompileException e2 =
        assertThrows(CompileException.class,
            () -> dsl.form(dsl.integral(dsl.times(f, v), dsl.dx()),
                dsl.integral(dsl.times(g, v), dsl.dx())));
    assertThat(e2.getMessage(), is("coefficient number 0 denotes f and g"));
  }

  /** Sums that differ only in the order of their terms have the same
   * canonical form. */
  @Test void testCanonicalSum() {
    final Expr e1 = dsl.sum(
        Arrays.asList(dsl.times(u, v), dsl.times(f, v),
            dsl.inner(dsl.grad(u), dsl.grad(v))));
    final Expr e2 = dsl.sum(
        Arrays.asList(dsl.inner(dsl.grad(u), dsl.grad(v)),
            dsl.times(u, v), dsl.times(f, v)));
    assertThat(e1.equals(e2), is(false));
    assertThat(Exprs.canonicalSum(e1), is(Exprs.canonicalSum(e2)));
    assertThat(Exprs.terms(e1).size(), is(3));
    assertThat(Exprs.contains(e1, Op.GRAD), is(true));
    assertThat(Exprs.contains(e1, Op.SQRT), is(false));
  }
}

// End ExprBuilderTest.java
