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

import static net.hydromatic.formc.Fc.fc;
import static net.hydromatic.formc.Matchers.closeTo;
import static net.hydromatic.formc.Matchers.hasMessages;
import static net.hydromatic.formc.ast.ExprBuilder.dsl;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.formc.Fc;
import net.hydromatic.formc.ast.Expr;
import net.hydromatic.formc.ast.Form;
import net.hydromatic.formc.ast.IntegralType;
import net.hydromatic.formc.ast.Representation;
import net.hydromatic.formc.element.Cell;
import net.hydromatic.formc.element.Domain;
import net.hydromatic.formc.element.Elements;
import net.hydromatic.formc.element.Family;
import net.hydromatic.formc.element.FiniteElement;
import net.hydromatic.formc.quadrature.DegreeEstimators;
import org.junit.jupiter.api.Test;

/** Tests {@link FormCompiler}. */
public class FormCompilerTest {
  private static final String P1_TRIANGLE =
      "element = FiniteElement(\"Lagrange\", triangle, 1)";
  private static final String ARGUMENTS =
      "u = TrialFunction(element)\nv = TestFunction(element)";

  private static Representation representation(CompiledForm compiledForm) {
    return compiledForm.plans.get(0).terms.get(0).representation;
  }

  private static int degree(CompiledForm compiledForm) {
    return compiledForm.plans.get(0).terms.get(0).degree;
  }

  /** With no other instructions, tensor representation is chosen for
   * polynomial integrands on affine cells. */
  @Test void testAutoTensor() {
    final CompiledForm a =
        fc(P1_TRIANGLE, ARGUMENTS, "a = inner(grad(u), grad(v))*dx")
            .compiledForm("a");
    assertThat(representation(a), is(Representation.TENSOR));
    assertThat(a.plans.get(0).terms.get(0),
        instanceOf(TermPlan.TensorTerm.class));
    assertThat(degree(a), is(0));
    assertThat(a.bufferLength(IntegralType.CELL), is(9));
    assertThat(a.rank(), is(2));

    final CompiledForm facet =
        fc(P1_TRIANGLE, ARGUMENTS, "n = FacetNormal(triangle)",
            "L = dot(grad(v), n)*ds")
            .compiledForm("L");
    assertThat(representation(facet), is(Representation.TENSOR));
    assertThat(facet.bufferLength(IntegralType.EXTERIOR_FACET), is(3));
  }

  /** Quadrature is chosen when tensor representation cannot be applied. */
  @Test void testAutoQuadrature() {
    final CompiledForm coordinate =
        fc(P1_TRIANGLE, ARGUMENTS, "x = SpatialCoordinate(triangle)",
            "L = x[0]*v*dx")
            .compiledForm("L");
    assertThat(representation(coordinate), is(Representation.QUADRATURE));
    assertThat(degree(coordinate), is(2));

    final CompiledForm nonlinear =
        fc(P1_TRIANGLE, ARGUMENTS, "f = Coefficient(element)",
            "L = sqrt(f)*v*dx")
            .compiledForm("L");
    assertThat(representation(nonlinear), is(Representation.QUADRATURE));
    assertThat(degree(nonlinear), is(4));

    final CompiledForm quad =
        fc("element = FiniteElement(\"Q\", quadrilateral, 1)", ARGUMENTS,
            "a = u*v*dx")
            .compiledForm("a");
    assertThat(representation(quad), is(Representation.QUADRATURE));
    assertThat(quad.plans.get(0).terms.get(0),
        instanceOf(TermPlan.QuadratureTerm.class));

    final CompiledForm interior =
        fc(P1_TRIANGLE, ARGUMENTS, "a = jump(u)*jump(v)*dS")
            .compiledForm("a");
    assertThat(representation(interior), is(Representation.QUADRATURE));
    assertThat(interior.bufferLength(IntegralType.INTERIOR_FACET), is(36));
  }

  /** The measure's option beats the default, which beats the
   * heuristic. */
  @Test void testResolution() {
    final String[] massLines = {P1_TRIANGLE, ARGUMENTS, "a = u*v*dx"};
    assertThat(representation(fc(massLines).compiledForm("a")),
        is(Representation.TENSOR));
    assertThat(
        representation(
            fc(massLines)
                .with(Prop.REPRESENTATION, Representation.QUADRATURE)
                .compiledForm("a")),
        is(Representation.QUADRATURE));
    assertThat(
        representation(
            fc(P1_TRIANGLE, ARGUMENTS,
                "a = u*v*dx(representation=\"quadrature\")")
                .compiledForm("a")),
        is(Representation.QUADRATURE));
    assertThat(
        representation(
            fc(P1_TRIANGLE, ARGUMENTS,
                "a = u*v*dx(representation=\"tensor\")")
                .with(Prop.REPRESENTATION, Representation.QUADRATURE)
                .compiledForm("a")),
        is(Representation.TENSOR));
  }

  /** A request for tensor representation on a curved domain fails; it does
   * not fall back to quadrature. */
  @Test void testTensorOnCurvedDomain() {
    fc("mesh = Mesh(triangle, 2)",
        "element = FiniteElement(\"Lagrange\", mesh, 2)", ARGUMENTS,
        "a = u*v*dx(representation=\"tensor\")")
        .assertError(
            is("tensor representation is not applicable: domain "
                + "Mesh(triangle, 2) is not affine (dx, subdomain 0)"));
    fc("mesh = Mesh(triangle, 2)",
        "element = FiniteElement(\"Lagrange\", mesh, 2)", ARGUMENTS,
        "a = u*v*dx")
        .with(Prop.REPRESENTATION, Representation.TENSOR)
        .withCompileExceptionMatcher(instanceOf(TermException.class))
        .assertCompile();
  }

  @Test void testTensorNotApplicable() {
    fc(P1_TRIANGLE, ARGUMENTS, "f = Coefficient(element)",
        "L = sqrt(f)*v*dx(3)")
        .with(Prop.REPRESENTATION, Representation.TENSOR)
        .assertError(
            is("tensor representation is not applicable: integrand is not a "
                + "polynomial (dx, subdomain 3)"));
    fc(P1_TRIANGLE, ARGUMENTS,
        "a = jump(u)*jump(v)*dS(representation=\"tensor\")")
        .assertError(
            is("tensor representation is not applicable: integral is over "
                + "interior facets (dS, subdomain 0)"));
    fc("element = FiniteElement(\"Q\", quadrilateral, 1)", ARGUMENTS,
        "a = u*v*dx(representation=\"tensor\")")
        .assertError(
            is("tensor representation is not applicable: domain "
                + "quadrilateral is not affine (dx, subdomain 0)"));
  }

  @Test void testInvalidTerms() {
    fc(P1_TRIANGLE, ARGUMENTS, "a = u*u*v*dx")
        .assertError(
            is("term 1.0 * v_0 * v_1 * v_1 is not linear in argument v_1 "
                + "(dx, subdomain 0)"));
    fc(P1_TRIANGLE, ARGUMENTS, "n = FacetNormal(triangle)",
        "L = dot(grad(v), n)*dx")
        .assertError(
            is("facet normal in integral over cell (dx, subdomain 0)"));
    fc(P1_TRIANGLE, ARGUMENTS, "a = u*v*dS")
        .assertError(
            is("unrestricted term 1.0 * v_0 * v_1 in interior facet "
                + "integral (dS, subdomain 0)"));
    fc(P1_TRIANGLE, ARGUMENTS, "L = v('+')*ds(2)")
        .assertError(
            is("restriction outside interior facet integral "
                + "(ds, subdomain 2)"));
    fc(P1_TRIANGLE, ARGUMENTS, "L = v*sqrt(v)*dx")
        .assertError(
            is("argument inside nonlinear function sqrt(1.0 * v_0) "
                + "(dx, subdomain 0)"));
    fc("mesh = Mesh(triangle, 2)",
        "element = FiniteElement(\"Lagrange\", mesh, 2)", ARGUMENTS,
        "L = div(grad(v))*dx")
        .assertError(
            is("second derivative on non-affine domain Mesh(triangle, 2) "
                + "(dx, subdomain 0)"));
  }

  /** An estimate that exceeds the maximum degree falls back to a default
   * degree, with a warning; in strict mode, it is an error. */
  @Test void testDegreeFallback() {
    final Fc fc =
        fc(P1_TRIANGLE, ARGUMENTS, "a = u*v*dx").with(Prop.MAX_DEGREE, 1);
    fc.assertWarnings(
        hasMessages("estimated degree 2 of v_1 * v_0 exceeds maximum 1; "
            + "using degree 2"));
    final List<CompileException> warnings = new ArrayList<>();
    final List<CompiledForm> compiledForms =
        fc.with(Prop.FALLBACK_DEGREE, 3).compileForms(warnings);
    assertThat(warnings.size(), is(1));
    assertThat(warnings.get(0), instanceOf(DegreeException.class));
    assertThat(degree(compiledForms.get(0)), is(3));

    fc.with(Prop.STRICT_DEGREE, true)
        .assertError(is("estimated degree 2 of v_1 * v_0 exceeds maximum 1"));
  }

  /** An explicit degree is used as is. */
  @Test void testExplicitDegree() {
    final Fc fc = fc(P1_TRIANGLE, ARGUMENTS, "a = u*v*dx(degree=5)");
    assertThat(degree(fc.compiledForm("a")), is(5));
    fc.with(Prop.MAX_DEGREE, 1).with(Prop.STRICT_DEGREE, true)
        .assertWarnings(hasMessages());
  }

  /** Integrals are grouped by type and subdomain; subdomains are sorted. */
  @Test void testPlans() {
    final CompiledForm a =
        fc(P1_TRIANGLE, ARGUMENTS,
            "a = u*v*dx(2) + u*v*ds + inner(grad(u), grad(v))*dx(2) "
                + "+ u*v*dx(0)")
            .compiledForm("a");
    assertThat(a.integralTypes(), hasToString("[CELL, EXTERIOR_FACET]"));
    final List<IntegralPlan> cellPlans = a.plans(IntegralType.CELL);
    assertThat(cellPlans.size(), is(2));
    assertThat(cellPlans.get(0).subdomainId, is(0));
    assertThat(cellPlans.get(0).terms.size(), is(1));
    assertThat(cellPlans.get(1).subdomainId, is(2));
    assertThat(cellPlans.get(1).terms.size(), is(2));
    assertThat(a.plans(IntegralType.EXTERIOR_FACET).size(), is(1));
    assertThat(a.plans(IntegralType.INTERIOR_FACET).isEmpty(), is(true));
    assertThat(cellPlans.get(0).terms.get(0),
        hasToString("tensor(degree=2, v_1 * v_0 * dx)"));
  }

  /** The reference tensor of the mass matrix holds the exact integrals of
   * products of basis functions. */
  @Test void testReferenceTensor() {
    final CompiledForm a =
        fc(P1_TRIANGLE, ARGUMENTS, "a = u*v*dx").compiledForm("a");
    final TermPlan.TensorTerm term =
        (TermPlan.TensorTerm) a.plans.get(0).terms.get(0);
    assertThat(term.tensors.size(), is(1));
    final ReferenceTensor tensor = term.tensors.get(0);
    assertThat(tensor.facetCount(), is(1));
    assertThat(tensor.size(), is(9));
    assertThat(tensor.argumentCount(), is(2));
    assertThat(tensor.coefficientSize(), is(1));
    assertThat(tensor.geometry, hasToString("[1.0 * det]"));
    final double[] expected = new double[9];
    for (int i = 0; i < 3; i++) {
      for (int j = 0; j < 3; j++) {
        expected[i * 3 + j] = i == j ? 1d / 12d : 1d / 24d;
      }
    }
    assertThat(tensor.values(0), closeTo(expected));
  }

  /** The tracer sees each expanded integrand and each compiled form. */
  @Test void testTracer() {
    final List<Sum> sums = new ArrayList<>();
    final List<String> names = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnPlan(
            Tracers.withOnExpand(Tracers.empty(), (i, s) -> sums.add(s)),
            cf -> names.add(cf.name));
    fc(P1_TRIANGLE, ARGUMENTS, "f = Coefficient(element)",
        "a = inner(grad(u), grad(v))*dx", "L = f*v*dx + f*v*ds")
        .withTracer(tracer)
        .compileForms(new ArrayList<>());
    assertThat(names, hasToString("[a, L]"));
    assertThat(sums.size(), is(3));
    assertThat(sums.get(1), hasToString("1.0 * v_0 * f"));
  }

  /** The tracer sees warnings once all forms are compiled, then the
   * generated code. */
  @Test void testTracerWarnings() {
    final List<List<CompileException>> warningLists = new ArrayList<>();
    final List<String> fileNames = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnWarnings(
            Tracers.withOnCode(Tracers.empty(),
                module -> fileNames.add(module.fileName)),
            warningLists::add);
    fc(P1_TRIANGLE, ARGUMENTS, "a = u*v*dx", "L = v*dx(degree=1)")
        .with(Prop.MAX_DEGREE, 1)
        .withTracer(tracer)
        .assertCompile();
    assertThat(warningLists.size(), is(1));
    assertThat(warningLists.get(0),
        hasMessages("estimated degree 2 of v_1 * v_0 exceeds maximum 1; "
            + "using degree 2"));
    assertThat(fileNames, hasToString("[test.h]"));
  }

  /** A form built in Java compiles the same way as a parsed one; a custom
   * estimator decides the degree. */
  @Test void testBuiltForm() {
    final FiniteElement p2 =
        Elements.create(Family.LAGRANGE, Domain.of(Cell.TRIANGLE), 2);
    final Expr f = dsl.coefficient(0, "f", p2);
    final Form form =
        dsl.form(
            dsl.integral(dsl.times(dsl.sqrt(f), dsl.testFunction(p2)),
                dsl.dx()));
    final CompiledForm compiledForm = Fc.compile(form, ImmutableMap.of());
    assertThat(compiledForm.name, is("a"));
    assertThat(compiledForm.rank(), is(1));
    assertThat(compiledForm.coefficient(0), is(f));
    assertThat(compiledForm.coefficientIndex(0), is(0));
    assertThat(degree(compiledForm), is(6));

    final CompiledForm fixed =
        new FormCompiler(ImmutableMap.of(), DegreeEstimators.fixed(1),
            Tracers.empty())
            .compile("L", form, w -> { });
    assertThat(degree(fixed), is(1));
    assertThat(fixed.plans.get(0).terms.get(0),
        instanceOf(TermPlan.QuadratureTerm.class));
    assertThat(
        ((TermPlan.QuadratureTerm) fixed.plans.get(0).terms.get(0))
            .pointCount(),
        is(1));
  }
}

// End FormCompilerTest.java
