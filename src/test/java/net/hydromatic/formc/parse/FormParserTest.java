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
package net.hydromatic.formc.parse;

import static net.hydromatic.formc.Fc.fc;
import static net.hydromatic.formc.ast.ExprBuilder.dsl;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.formc.ast.Expr;
import net.hydromatic.formc.ast.Form;
import net.hydromatic.formc.ast.FormFile;
import net.hydromatic.formc.ast.Op;
import net.hydromatic.formc.ast.Representation;
import net.hydromatic.formc.element.Cell;
import net.hydromatic.formc.element.Domain;
import net.hydromatic.formc.element.Elements;
import net.hydromatic.formc.element.Family;
import net.hydromatic.formc.element.FiniteElement;
import org.junit.jupiter.api.Test;

/** Tests {@link FormParser}. */
public class FormParserTest {
  private static final String P1_TRIANGLE =
      "element = FiniteElement(\"Lagrange\", triangle, 1)";
  private static final String ARGUMENTS =
      "u = TrialFunction(element)\nv = TestFunction(element)";

  /** Parses a file and returns one of its forms. */
  private static Form form(String formName, String... lines) {
    final Form form = fc(lines).parse().forms.get(formName);
    assertThat(form == null, is(false));
    return form;
  }

  /** The parser builds the same form as the expression builder. */
  @Test void testPoisson() {
    final FormFile file =
        fc(P1_TRIANGLE, ARGUMENTS,
            "f = Coefficient(element)",
            "g = Coefficient(element)",
            "L = f*v*dx + g*v*ds",
            "a = inner(grad(u), grad(v))*dx")
            .withFileName("demo/poisson.form")
            .parse();
    assertThat(file.name, is("poisson"));
    assertThat(file, hasToString("FormFile(poisson, [a, L])"));

    final FiniteElement p1 =
        Elements.create(Family.LAGRANGE, Domain.of(Cell.TRIANGLE), 1);
    assertThat(file.element, sameInstance(p1));
    final Expr u = dsl.trialFunction(p1);
    final Expr v = dsl.testFunction(p1);
    final Expr f = dsl.coefficient(0, "f", p1);
    final Expr g = dsl.coefficient(1, "g", p1);
    final Form a =
        dsl.form(
            dsl.integral(dsl.call(Op.INNER, dsl.grad(u), dsl.grad(v)),
                dsl.dx()));
    final Form l =
        dsl.form(dsl.integral(dsl.times(f, v), dsl.dx()))
            .plus(dsl.form(dsl.integral(dsl.times(g, v), dsl.ds())));
    assertThat(file.forms.get("a"), is(a));
    assertThat(file.forms.get("L"), is(l));
    assertThat(file.forms.get("L"),
        hasToString("f * v_0 * dx + g * v_0 * ds"));
  }

  /** Without a variable called "element", the first element created
   * drives the file. Coefficients are named after their variables. */
  @Test void testDrivingElement() {
    final FormFile file =
        fc("P2 = FiniteElement(\"CG\", triangle, 2)",
            "P1 = FiniteElement(\"P\", triangle, 1)",
            "v = TestFunction(P1)",
            "kappa = Function(P2)",
            "M = kappa*dx")
            .parse();
    assertThat(file.element,
        sameInstance(
            Elements.create(Family.LAGRANGE, Domain.of(Cell.TRIANGLE), 2)));
    assertThat(file.forms.get("M"), hasToString("kappa * dx"));
    assertThat(file.forms.get("M").rank(), is(0));
  }

  @Test void testMeasures() {
    assertThat(
        form("a", P1_TRIANGLE, ARGUMENTS,
            "a = u*v*dx(1, degree=5, representation=\"tensor\")"),
        hasToString("v_1 * v_0 * dx(1, degree=5, representation=\"tensor\")"));
    assertThat(
        form("a", P1_TRIANGLE, ARGUMENTS,
            "a = u*v*ds(subdomain_id=3) + u*v*dS(degree=2)"),
        hasToString("v_1 * v_0 * ds(3) + v_1 * v_0 * dS(0, degree=2)"));
    final Form a =
        form("a", P1_TRIANGLE, ARGUMENTS,
            "a = u*v*dx(representation=\"quadrature\")");
    assertThat(a.integrals.get(0).measure.representation,
        is(Representation.QUADRATURE));
  }

  /** Comments, blank lines and line breaks inside parentheses. */
  @Test void testLayout() {
    final Form a =
        form("a",
            "# Mass matrix",
            "",
            "element = FiniteElement(\"Lagrange\",",
            "                        triangle, 1)  # linear",
            ARGUMENTS,
            "a = (u",
            "     * v)*dx \\",
            "    + u*v*ds");
    assertThat(a, hasToString("v_1 * v_0 * dx + v_1 * v_0 * ds"));
  }

  @Test void testExpressions() {
    assertThat(
        form("L", P1_TRIANGLE, ARGUMENTS, "f = Coefficient(element)",
            "L = -f**2/2*v('+')*dS + sqrt(abs(f))*v*dx"),
        hasToString("-f ** 2 / 2 * v_0('+') * dS "
            + "+ sqrt(abs(f)) * v_0 * dx"));
    assertThat(
        form("L", P1_TRIANGLE, ARGUMENTS, "c = Constant(triangle)",
            "x = SpatialCoordinate(triangle)",
            "L = (2*3 - 1)*c*x[1]*v*dx"),
        hasToString("5 * c * x[1] * v_0 * dx"));
    assertThat(
        form("L", P1_TRIANGLE, ARGUMENTS, "f = Coefficient(element)",
            "L = jump(f)*avg(v)*dS"),
        hasToString("(f('+') + -f('-')) * (0.5 * (v_0('+') + v_0('-'))) "
            + "* dS"));
  }

  @Test void testFormNames() {
    fc(P1_TRIANGLE, ARGUMENTS, "M = v('+')*dS", "b = u*v*dx", "a = u*v*dx",
        "L = v*ds")
        .assertParse(hasToString("FormFile(test, [a, L, M])"));
  }

  @Test void testStem() {
    assertThat(FormParser.stem("demo/poisson.form"), is("poisson"));
    assertThat(FormParser.stem("poisson"), is("poisson"));
    assertThat(FormParser.stem("a.b.form"), is("a.b"));
    assertThat(FormParser.stem(".form"), is(".form"));
  }

  @Test void testErrors() {
    fc(P1_TRIANGLE, ARGUMENTS, "a = u*v")
        .assertError(
            is("line 4, column 5: 'a' must be a form, but is expression "
                + "v_1 * v_0"));
    fc(P1_TRIANGLE, ARGUMENTS, "a = u*w*dx")
        .assertError(is("line 4, column 7: unknown name 'w'"));
    fc("element = FiniteElement(\"Lagrange\", triangle)")
        .assertError(is("line 1, column 24: expected 3 arguments, got 2"));
    fc("element = FiniteElement(\"Fancy\", triangle, 1)")
        .assertError(
            is("line 1, column 24: unknown element family 'Fancy'"));
    fc(P1_TRIANGLE, "a = 1 $ 2")
        .assertError(is("line 2, column 7: unexpected character '$'"));
    fc(P1_TRIANGLE, "s = \"abc")
        .assertError(is("line 2, column 5: unterminated string"));
    fc(P1_TRIANGLE, ARGUMENTS, "a = u*v*dx(order=2)")
        .assertError(is("line 4, column 11: unknown measure option 'order'"));
    fc(P1_TRIANGLE, ARGUMENTS, "a = u*v*dx(representation=\"fast\")")
        .assertError(
            is("line 4, column 11: invalid representation string \"fast\"; "
                + "expected \"tensor\", \"quadrature\" or \"auto\""));
    fc(P1_TRIANGLE, ARGUMENTS, "a = u('x')*v*dS")
        .assertError(
            is("line 4, column 6: invalid side 'x'; expected '+' or '-'"));
    fc(P1_TRIANGLE, ARGUMENTS, "a = u*v*dx v")
        .assertError(is("line 4, column 12: unexpected 'v'"));
    fc(P1_TRIANGLE, ARGUMENTS, "a = u**v*dx")
        .assertError(
            is("line 4, column 6: exponent must be a number, but is "
                + "expression v_0"));
    fc(P1_TRIANGLE, ARGUMENTS, "a = u*")
        .assertError(is("line 4, column 7: unexpected end of line"));
    fc(P1_TRIANGLE, ARGUMENTS, "a = u*v*dx(degree=2, 1)")
        .assertError(
            is("line 4, column 22: positional argument follows keyword "
                + "argument"));
  }

  /** Strings may use either quote; a trailing comma ends an argument
   * list. */
  @Test void testStrings() {
    final FormFile file =
        fc("element = FiniteElement('Lagrange', triangle, 1,)",
            "v = TestFunction(element)",
            "L = v*dx(representation='tensor')")
            .parse();
    assertThat(file.element,
        sameInstance(
            Elements.create(Family.LAGRANGE, Domain.of(Cell.TRIANGLE), 1)));
    assertThat(file.forms.get("L"),
        hasToString("v_0 * dx(0, representation=\"tensor\")"));
  }

  /** Errors in the shapes of expressions carry the position of the
   * operator. */
  @Test void testShapeErrors() {
    fc(P1_TRIANGLE, ARGUMENTS, "a = grad(u)*v*dx")
        .assertError(
            is("test.form:4.14: integrand must be a scalar in "
                + "(grad(v_1) * v_0) * dx: shape (2)"));
    fc(P1_TRIANGLE, ARGUMENTS, "a = inner(grad(u), v)*dx")
        .assertError(
            is("test.form:4.5-4.10: inner product requires equal shapes in "
                + "inner(grad(v_1), v_0): shapes (2) and ()"));
  }

  @Test void testParseException() {
    final FormParseException e =
        assertThrows(FormParseException.class,
            () -> FormParser.parse("x.form", "a = (\n  )"));
    assertThat(e.line(), is(2));
    assertThat(e.column(), is(3));
    assertThat(e.getMessage(), is("unexpected ')'"));
  }

  @Test void testFormFile() {
    final Map<String, Form> forms =
        ImmutableMap.of("b", form("a", P1_TRIANGLE, ARGUMENTS, "a = u*v*dx"));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> FormFile.of("x", forms, null));
    assertThat(e.getMessage(),
        is("invalid form name 'b'; expected one of [a, L, M]"));
    assertThat(FormFile.of("x", ImmutableMap.of(), null).element,
        nullValue());
  }
}

// End FormParserTest.java
