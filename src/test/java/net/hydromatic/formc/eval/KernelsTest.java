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
package net.hydromatic.formc.eval;

import static net.hydromatic.formc.Fc.fc;
import static net.hydromatic.formc.Fc.tabulate;
import static net.hydromatic.formc.Matchers.allZero;
import static net.hydromatic.formc.Matchers.closeTo;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.util.Arrays;
import net.hydromatic.formc.ast.IntegralType;
import net.hydromatic.formc.ast.Representation;
import net.hydromatic.formc.compile.CompiledForm;
import net.hydromatic.formc.compile.Prop;
import net.hydromatic.formc.element.Cell;
import net.hydromatic.formc.element.Domain;
import org.junit.jupiter.api.Test;

/** Tests {@link Kernels}. */
public class KernelsTest {
  private static final String P1_TRIANGLE =
      "element = FiniteElement(\"Lagrange\", triangle, 1)";
  private static final String ARGUMENTS =
      "u = TrialFunction(element)\nv = TestFunction(element)";
  private static final Domain TRIANGLE = Domain.of(Cell.TRIANGLE);

  /** A triangle with vertices (1, 1), (3, 1), (1, 4). */
  private static final CellGeometry PHYSICAL_TRIANGLE =
      CellGeometry.of(TRIANGLE, 1, 1, 3, 1, 1, 4);

  private static final double[] STIFFNESS = {
      1, -0.5, -0.5,
      -0.5, 0.5, 0,
      -0.5, 0, 0.5};

  private static final double[] MASS = {
      1d / 12, 1d / 24, 1d / 24,
      1d / 24, 1d / 12, 1d / 24,
      1d / 24, 1d / 24, 1d / 12};

  private static double[] scale(double[] values, double f) {
    final double[] r = values.clone();
    for (int i = 0; i < r.length; i++) {
      r[i] *= f;
    }
    return r;
  }

  /** Compiles a form twice, once in each representation. */
  private static CompiledForm[] both(String formName, String... lines) {
    return new CompiledForm[] {
        fc(lines).with(Prop.REPRESENTATION, Representation.TENSOR)
            .compiledForm(formName),
        fc(lines).with(Prop.REPRESENTATION, Representation.QUADRATURE)
            .compiledForm(formName)};
  }

  /** Checks that the tensor and quadrature representations of a form
   * compute the same local tensor, on every facet if {@code type} is a facet
   * type. */
  private static void assertRepresentationsAgree(IntegralType type,
      double[][] w, CellGeometry cell, String formName, String... lines) {
    final CompiledForm[] compiledForms = both(formName, lines);
    final int facetCount = type.isFacet() ? cell.domain.cell.facetCount() : 1;
    for (int facet = 0; facet < facetCount; facet++) {
      final CellGeometry[] cells = {cell};
      final int[] facets = {facet};
      final double[] tensor =
          tabulate(compiledForms[0], type, w, cells, facets, 0);
      final double[] quadrature =
          tabulate(compiledForms[1], type, w, cells, facets, 0);
      assertThat(tensor, closeTo(quadrature, 1e-10));
      assertThat(Arrays.stream(tensor).anyMatch(x -> x != 0d), is(true));
    }
  }

  @Test void testStiffnessOnReferenceTriangle() {
    fc(P1_TRIANGLE, ARGUMENTS, "a = inner(grad(u), grad(v))*dx")
        .assertReferenceTensor("a", closeTo(STIFFNESS));
    fc(P1_TRIANGLE, ARGUMENTS, "a = inner(grad(u), grad(v))*dx")
        .with(Prop.REPRESENTATION, Representation.QUADRATURE)
        .assertReferenceTensor("a", closeTo(STIFFNESS));
  }

  @Test void testMassOnReferenceTriangle() {
    fc(P1_TRIANGLE, ARGUMENTS, "a = u*v*dx")
        .assertReferenceTensor("a", closeTo(MASS));
    fc(P1_TRIANGLE, ARGUMENTS, "a = u*v*dx")
        .with(Prop.REPRESENTATION, Representation.QUADRATURE)
        .assertReferenceTensor("a", closeTo(MASS));
  }

  /** On a physical cell, the mass matrix scales with the area; the
   * stiffness matrix of a scaled copy of the reference triangle does
   * not change. */
  @Test void testPhysicalTriangle() {
    final CompiledForm mass =
        fc(P1_TRIANGLE, ARGUMENTS, "a = u*v*dx").compiledForm("a");
    final Kernel kernel = Kernels.of(mass, IntegralType.CELL);
    final double[] a = new double[kernel.bufferLength()];
    assertThat(kernel.tabulateCell(a, new double[0][], PHYSICAL_TRIANGLE, 0),
        is(true));
    assertThat(a, closeTo(scale(MASS, 6d)));

    final CompiledForm stiffness =
        fc(P1_TRIANGLE, ARGUMENTS, "a = inner(grad(u), grad(v))*dx")
            .compiledForm("a");
    final CellGeometry scaled = CellGeometry.of(TRIANGLE, 0, 0, 2, 0, 0, 2);
    assertThat(
        tabulate(stiffness, IntegralType.CELL, new double[0][],
            new CellGeometry[] {scaled}, new int[] {0}, 0),
        closeTo(STIFFNESS));
  }

  /** A functional integrates to a number; the integral of a coefficient
   * whose dofs are the vertex values of x + 2y. */
  @Test void testFunctional() {
    final CompiledForm m =
        fc(P1_TRIANGLE, "f = Coefficient(element)", "M = f*dx")
            .compiledForm("M");
    assertThat(m.bufferLength(IntegralType.CELL), is(1));
    // Mean of x + 2y over the triangle is 5/3 + 2 * 2 = 17/3; area is 3
    assertThat(
        tabulate(m, IntegralType.CELL, new double[][] {{3, 5, 9}},
            new CellGeometry[] {PHYSICAL_TRIANGLE}, new int[] {0}, 0),
        closeTo(17d));
  }

  @Test void testCoefficientForms() {
    final double[][] w = {{1, 2, 3}};
    assertRepresentationsAgree(IntegralType.CELL, w, PHYSICAL_TRIANGLE, "a",
        P1_TRIANGLE, ARGUMENTS, "f = Coefficient(element)",
        "a = f*inner(grad(u), grad(v))*dx + f*f*u*v*dx");
    assertRepresentationsAgree(IntegralType.CELL, w, PHYSICAL_TRIANGLE, "L",
        P1_TRIANGLE, ARGUMENTS, "f = Coefficient(element)",
        "L = f**2*v*dx + 0.5*dot(grad(f), grad(v))*dx");
  }

  @Test void testExteriorFacets() {
    final double[][] w = {{1, 2, 3}};
    assertRepresentationsAgree(IntegralType.EXTERIOR_FACET, w,
        PHYSICAL_TRIANGLE, "a",
        P1_TRIANGLE, ARGUMENTS, "f = Coefficient(element)",
        "n = FacetNormal(triangle)",
        "a = f*u*v*ds + dot(grad(u), n)*v*ds");
    assertRepresentationsAgree(IntegralType.EXTERIOR_FACET, w,
        CellGeometry.reference(TRIANGLE), "L",
        P1_TRIANGLE, ARGUMENTS, "f = Coefficient(element)",
        "n = FacetNormal(triangle)",
        "L = f*v*(n[0] + n[1])*ds");
  }

  /** The length of each edge of the physical triangle. */
  @Test void testFacetLength() {
    final CompiledForm m =
        fc(P1_TRIANGLE, "f = Coefficient(element)", "M = f*ds")
            .compiledForm("M");
    final Kernel kernel = Kernels.of(m, IntegralType.EXTERIOR_FACET);
    final double[][] w = {{1, 1, 1}};
    final double[] expected = {Math.sqrt(13), 3, 2};
    for (int facet = 0; facet < 3; facet++) {
      final double[] a = new double[1];
      assertThat(
          kernel.tabulateExteriorFacet(a, w, PHYSICAL_TRIANGLE, facet, 0),
          is(true));
      assertThat(a, closeTo(expected[facet]));
    }
  }

  @Test void testVectorElement() {
    assertRepresentationsAgree(IntegralType.CELL, new double[0][],
        PHYSICAL_TRIANGLE, "a",
        "element = VectorElement(\"Lagrange\", triangle, 2)", ARGUMENTS,
        "a = inner(grad(u), grad(v))*dx + div(u)*div(v)*dx");
  }

  @Test void testTetrahedron() {
    final CellGeometry tetrahedron =
        CellGeometry.of(Domain.of(Cell.TETRAHEDRON),
            1, 0, 0, 3, 0.5, 0, 1, 2, 0, 1.5, 0.5, 3);
    assertRepresentationsAgree(IntegralType.CELL, new double[0][],
        tetrahedron, "a",
        "element = FiniteElement(\"Lagrange\", tetrahedron, 1)", ARGUMENTS,
        "a = u*v*dx + inner(grad(u), grad(v))*dx");
    assertRepresentationsAgree(IntegralType.EXTERIOR_FACET, new double[0][],
        tetrahedron, "a",
        "element = FiniteElement(\"Lagrange\", tetrahedron, 1)", ARGUMENTS,
        "a = u*v*ds");
  }

  /** The order of terms does not change the local tensor. */
  @Test void testTermOrder() {
    final CompiledForm a =
        fc(P1_TRIANGLE, ARGUMENTS,
            "a = u*v*dx + inner(grad(u), grad(v))*dx")
            .compiledForm("a");
    final CompiledForm b =
        fc(P1_TRIANGLE, ARGUMENTS,
            "a = inner(grad(v), grad(u))*dx + v*u*dx")
            .compiledForm("a");
    final CellGeometry[] cells = {PHYSICAL_TRIANGLE};
    final int[] facets = {0};
    assertThat(
        tabulate(a, IntegralType.CELL, new double[0][], cells, facets, 0),
        closeTo(
            tabulate(b, IntegralType.CELL, new double[0][], cells, facets,
                0),
            1e-12));
  }

  /** Integrals over a facet shared by the reference triangle and the
   * triangle (1, 1), (1, 0), (0, 1). The coefficient is x + 2y, which is
   * continuous across the facet. */
  @Test void testInteriorFacet() {
    final CellGeometry cell0 = CellGeometry.reference(TRIANGLE);
    final CellGeometry cell1 = CellGeometry.of(TRIANGLE, 1, 1, 1, 0, 0, 1);
    final double[][] w = {{0, 1, 2, 3, 1, 2}};

    final CompiledForm m =
        fc(P1_TRIANGLE, "f = Coefficient(element)",
            "M = avg(f)*dS + jump(f)*jump(f)*dS(1)")
            .compiledForm("M");
    final Kernel kernel = Kernels.of(m, IntegralType.INTERIOR_FACET);
    final double[] a = new double[kernel.bufferLength()];
    assertThat(kernel.tabulateInteriorFacet(a, w, cell0, cell1, 0, 0, 0),
        is(true));
    assertThat(a, closeTo(1.5 * Math.sqrt(2)));
    assertThat(kernel.tabulateInteriorFacet(a, w, cell0, cell1, 0, 0, 1),
        is(true));
    assertThat(a, allZero());

    final CompiledForm jump =
        fc(P1_TRIANGLE, ARGUMENTS, "f = Coefficient(element)",
            "L = jump(f)*avg(v)*dS")
            .compiledForm("L");
    assertThat(jump.bufferLength(IntegralType.INTERIOR_FACET), is(6));
    assertThat(
        tabulate(jump, IntegralType.INTERIOR_FACET, w,
            new CellGeometry[] {cell0, cell1}, new int[] {0, 0}, 0),
        allZero());
  }

  /** A kernel zeroes its buffer and returns false for a subdomain that has
   * no integrals. */
  @Test void testMissingSubdomain() {
    final CompiledForm a =
        fc(P1_TRIANGLE, ARGUMENTS, "a = u*v*dx(1)").compiledForm("a");
    final Kernel kernel = Kernels.of(a, IntegralType.CELL);
    assertThat(kernel.type(), is(IntegralType.CELL));
    final double[] buffer = new double[9];
    Arrays.fill(buffer, 99d);
    assertThat(
        kernel.tabulateCell(buffer, new double[0][],
            CellGeometry.reference(TRIANGLE), 0),
        is(false));
    assertThat(buffer, allZero());
    assertThat(
        kernel.tabulateCell(buffer, new double[0][],
            CellGeometry.reference(TRIANGLE), 1),
        is(true));
    assertThat(buffer, closeTo(MASS));
    assertThat(Kernels.of(a, IntegralType.EXTERIOR_FACET)
            .tabulateExteriorFacet(buffer, new double[0][],
                CellGeometry.reference(TRIANGLE), 0, 1),
        is(false));
  }

  private static double sum(double[] values) {
    return Arrays.stream(values).sum();
  }

  /** Moving the midpoint node of the hypotenuse of a quadratic triangle by
   * (a, a) bends the hypotenuse into a parabola, and adds 4a/3 to the
   * area. */
  @Test void testCurvedTriangle() {
    final Domain curved = Domain.of(Cell.TRIANGLE, 2);
    assertThat(CellGeometry.referenceCoordinateDofs(curved),
        closeTo(0, 0, 1, 0, 0, 1, 0.5, 0.5, 0, 0.5, 0.5, 0));

    final double a = 0.1;
    final CellGeometry cell =
        CellGeometry.of(curved, 0, 0, 1, 0, 0, 1, 0.5 + a, 0.5 + a, 0, 0.5,
            0.5, 0);
    final CellGeometry[] cells = {cell};
    final int[] facets = {0};
    final CompiledForm m =
        fc("mesh = Mesh(triangle, 2)",
            "element = FiniteElement(\"Lagrange\", mesh, 1)",
            "f = Coefficient(element)", "M = f*dx")
            .compiledForm("M");
    assertThat(
        tabulate(m, IntegralType.CELL, new double[][] {{1, 1, 1}}, cells,
            facets, 0),
        closeTo(0.5 + 4 * a / 3));
    assertThat(
        tabulate(m, IntegralType.CELL, new double[][] {{1, 1, 1}},
            new CellGeometry[] {CellGeometry.reference(curved)}, facets, 0),
        closeTo(0.5));

    // The basis is a partition of unity, so the entries of the mass matrix
    // add up to the area
    final CompiledForm mass =
        fc("mesh = Mesh(triangle, 2)",
            "element = FiniteElement(\"Lagrange\", mesh, 2)", ARGUMENTS,
            "a = u*v*dx")
            .compiledForm("a");
    final double[] values =
        tabulate(mass, IntegralType.CELL, new double[0][], cells, facets, 0);
    assertThat(values.length, is(36));
    assertThat(new double[] {sum(values)}, closeTo(0.5 + 4 * a / 3));
  }

  /** The quadrilateral (0, 0), (2, 0), (0, 1), (3, 2) is not a
   * parallelogram. Its area is 3.5; its edges, in facet order, have lengths
   * 2, 1, sqrt(5) and sqrt(10). */
  @Test void testQuadrilateral() {
    final CellGeometry quad =
        CellGeometry.of(Domain.of(Cell.QUADRILATERAL), 0, 0, 2, 0, 0, 1, 3, 2);
    final CellGeometry[] cells = {quad};
    final String q1 =
        "element = FiniteElement(\"Lagrange\", quadrilateral, 1)";
    final CompiledForm m =
        fc(q1, "f = Coefficient(element)", "M = f*dx + f*ds")
            .compiledForm("M");
    final double[][] w = {{1, 1, 1, 1}};
    assertThat(
        tabulate(m, IntegralType.CELL, w, cells, new int[] {0}, 0),
        closeTo(3.5));
    final double[] lengths = {2, 1, Math.sqrt(5), Math.sqrt(10)};
    for (int facet = 0; facet < 4; facet++) {
      assertThat(
          tabulate(m, IntegralType.EXTERIOR_FACET, w, cells,
              new int[] {facet}, 0),
          closeTo(lengths[facet]));
    }

    final CompiledForm mass =
        fc(q1, ARGUMENTS, "a = u*v*dx").compiledForm("a");
    final double[] values =
        tabulate(mass, IntegralType.CELL, new double[0][], cells,
            new int[] {0}, 0);
    assertThat(new double[] {sum(values)}, closeTo(3.5));
  }

  /** A parallelepiped spanned by (2, 0, 0), (0.5, 1, 0), (0, 0.25, 3) has
   * volume 6; its bottom face has area 2. */
  @Test void testHexahedron() {
    final CellGeometry hex =
        CellGeometry.of(Domain.of(Cell.HEXAHEDRON),
            0, 0, 0, 2, 0, 0, 0.5, 1, 0, 2.5, 1, 0,
            0, 0.25, 3, 2, 0.25, 3, 0.5, 1.25, 3, 2.5, 1.25, 3);
    final CellGeometry[] cells = {hex};
    final CompiledForm m =
        fc("element = FiniteElement(\"Lagrange\", hexahedron, 1)",
            "f = Coefficient(element)", "M = f*dx + f*ds")
            .compiledForm("M");
    final double[][] w = {{1, 1, 1, 1, 1, 1, 1, 1}};
    assertThat(
        tabulate(m, IntegralType.CELL, w, cells, new int[] {0}, 0),
        closeTo(6));
    assertThat(
        tabulate(m, IntegralType.EXTERIOR_FACET, w, cells, new int[] {0}, 0),
        closeTo(2));
  }

  @Test void testCellGeometry() {
    final double[] centroid = Cell.TRIANGLE.centroid();
    assertThat(new double[] {PHYSICAL_TRIANGLE.det(centroid)}, closeTo(6));
    assertThat(PHYSICAL_TRIANGLE.x(new double[] {1, 0}), closeTo(3, 1));
    assertThat(PHYSICAL_TRIANGLE.x(new double[] {0.5, 0.5}),
        closeTo(2, 2.5));
    assertThat(PHYSICAL_TRIANGLE.inverseJacobian(centroid)[0],
        closeTo(0.5, 0));
    assertThat(new double[] {PHYSICAL_TRIANGLE.facetDet(0, centroid)},
        closeTo(Math.sqrt(13)));
    assertThat(PHYSICAL_TRIANGLE.normal(0, centroid),
        closeTo(3 / Math.sqrt(13), 2 / Math.sqrt(13)));
    assertThat(PHYSICAL_TRIANGLE.normal(1, centroid), closeTo(-1, 0));
    assertThat(PHYSICAL_TRIANGLE.normal(2, centroid), closeTo(0, -1));

    final CellGeometry reference = CellGeometry.reference(TRIANGLE);
    assertThat(reference.coordinateDofs(), closeTo(0, 0, 1, 0, 0, 1));
    assertThat(new double[] {reference.facetDet(0, centroid)},
        closeTo(Math.sqrt(2)));
    assertThat(reference.normal(0, centroid),
        closeTo(Math.sqrt(0.5), Math.sqrt(0.5)));
  }
}

// End KernelsTest.java
