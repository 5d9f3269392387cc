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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.Lists;
import com.google.common.collect.Ordering;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import net.hydromatic.formc.ast.IntegralType;
import net.hydromatic.formc.ast.Side;
import net.hydromatic.formc.compile.Atom;
import net.hydromatic.formc.compile.CompiledForm;
import net.hydromatic.formc.compile.GeometrySymbol;
import net.hydromatic.formc.compile.GeometryTerm;
import net.hydromatic.formc.compile.IntegralPlan;
import net.hydromatic.formc.compile.Monomial;
import net.hydromatic.formc.compile.PsiTable;
import net.hydromatic.formc.compile.ReferenceFactor;
import net.hydromatic.formc.compile.ReferenceTensor;
import net.hydromatic.formc.compile.Sum;
import net.hydromatic.formc.compile.TermPlan;
import net.hydromatic.formc.element.FiniteElement;
import net.hydromatic.formc.quadrature.QuadratureRule;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Implementations of {@link Kernel} that interpret the plans of a compiled
 * form.
 *
 * <p>An interpreted kernel performs the same arithmetic as the procedure
 * that the code generator emits for the same plans; it is used to check
 * compiled forms numerically without compiling generated code.
 */
public abstract class Kernels {
  private Kernels() {}

  /** Returns a kernel that computes the integrals of a given type of a
   * compiled form. */
  public static Kernel of(CompiledForm compiledForm, IntegralType type) {
    return new PlanKernel(compiledForm, type);
  }

  /** Kernel that interprets plans. */
  private static class PlanKernel implements Kernel {
    private final CompiledForm compiledForm;
    private final IntegralType type;

    PlanKernel(CompiledForm compiledForm, IntegralType type) {
      this.compiledForm = requireNonNull(compiledForm);
      this.type = requireNonNull(type);
    }

    @Override
    public IntegralType type() {
      return type;
    }

    @Override
    public int bufferLength() {
      return compiledForm.bufferLength(type);
    }

    @Override
    public boolean tabulate(double[] a, double[][] w, CellGeometry[] cells,
        int[] facets, int subdomainId) {
      Arrays.fill(a, 0, bufferLength(), 0d);
      for (IntegralPlan plan : compiledForm.plans(type)) {
        if (plan.subdomainId == subdomainId) {
          final Context cx = new Context(w, cells, facets);
          for (TermPlan term : plan.terms) {
            if (term instanceof TermPlan.TensorTerm) {
              tensor(a, (TermPlan.TensorTerm) term, cx);
            } else {
              quadrature(a, (TermPlan.QuadratureTerm) term, cx);
            }
          }
          return true;
        }
      }
      return false;
    }

    private void tensor(double[] a, TermPlan.TensorTerm term, Context cx) {
      final CellGeometry cell = cx.cells[0];
      final int facet = type.isFacet() ? cx.facets[0] : 0;
      final double[] point = type.isFacet()
          ? cell.domain.cell.facetPoint(facet,
              cell.domain.cell.facetCell().centroid())
          : cell.domain.cell.centroid();
      final double[][] k = cell.inverseJacobian(point);
      for (ReferenceTensor tensor : term.tensors) {
        double g = 0d;
        for (GeometryTerm geometryTerm : tensor.geometry) {
          g += geometryTerm.evaluate(symbol ->
              symbolValue(symbol, cell, facet, point, k));
        }
        final double[] coefficientProducts =
            coefficientProducts(tensor, cx.w);
        final int n = tensor.size() / coefficientProducts.length;
        for (int i = 0; i < n; i++) {
          double s = 0d;
          for (int j = 0; j < coefficientProducts.length; j++) {
            s += tensor.value(facet, i * coefficientProducts.length + j)
                * coefficientProducts[j];
          }
          a[i] += s * g;
        }
      }
    }

    private static double symbolValue(GeometrySymbol symbol,
        CellGeometry cell, int facet, double[] point, double[][] k) {
      switch (symbol.kind) {
        case DET:
          return cell.det(point);
        case FACET_DET:
          return cell.facetDet(facet, point);
        case K:
          return k[symbol.a][symbol.i];
        case N:
          return cell.normal(facet, point)[symbol.i];
        default:
          throw new AssertionError(symbol);
      }
    }

    /** Returns the products of coefficient dofs, one for each combination
     * of dofs of the coefficient factors of a reference tensor. */
    private double[] coefficientProducts(ReferenceTensor tensor,
        double[][] w) {
      final List<List<Double>> lists = new ArrayList<>();
      for (ReferenceFactor factor : tensor.factors) {
        if (factor.kind == ReferenceFactor.Kind.COEFFICIENT) {
          final double[] dofs =
              w[compiledForm.coefficientIndex(factor.number)];
          final List<Double> list = new ArrayList<>();
          for (int j = 0; j < factor.dimension(); j++) {
            list.add(dofs[j]);
          }
          lists.add(list);
        }
      }
      final List<List<Double>> combinations = Lists.cartesianProduct(lists);
      final double[] products = new double[combinations.size()];
      for (int j = 0; j < products.length; j++) {
        double p = 1d;
        for (double v : combinations.get(j)) {
          p *= v;
        }
        products[j] = p;
      }
      return products;
    }

    private void quadrature(double[] a, TermPlan.QuadratureTerm term,
        Context cx) {
      final QuadratureRule rule0 = term.rules.get(cx.facet(0));
      for (int p = 0; p < term.pointCount(); p++) {
        final PointContext px = new PointContext(term, cx, p);
        final double scale = type.isFacet()
            ? cx.cells[0].facetDet(cx.facets[0], px.points[0])
            : cx.cells[0].det(px.points[0]);
        final double weight = rule0.weight(p) * scale;
        for (Monomial monomial : term.integrand.monomials) {
          double f = monomial.coefficient * weight;
          final List<double[]> vectors = new ArrayList<>();
          for (Atom atom : monomial.atoms) {
            if (atom instanceof Atom.Basis) {
              vectors.add(px.basisVector((Atom.Basis) atom));
            } else {
              f *= px.value(atom);
            }
          }
          accumulate(a, vectors, f);
        }
      }
    }

    /** Adds {@code f} times the outer product of argument vectors, sorted by
     * argument number, to the buffer. */
    private static void accumulate(double[] a, List<double[]> vectors,
        double f) {
      switch (vectors.size()) {
        case 0:
          a[0] += f;
          break;
        case 1:
          final double[] v = vectors.get(0);
          for (int i = 0; i < v.length; i++) {
            a[i] += f * v[i];
          }
          break;
        case 2:
          final double[] v0 = vectors.get(0);
          final double[] v1 = vectors.get(1);
          for (int i = 0; i < v0.length; i++) {
            for (int j = 0; j < v1.length; j++) {
              a[i * v1.length + j] += f * v0[i] * v1[j];
            }
          }
          break;
        default:
          throw new AssertionError("rank " + vectors.size());
      }
    }

    /** Values that are fixed for one call to a kernel. */
    private class Context {
      final double[][] w;
      final CellGeometry[] cells;
      final int[] facets;

      Context(double[][] w, CellGeometry[] cells, int[] facets) {
        this.w = w;
        this.cells = cells;
        this.facets = facets;
      }

      /** Returns the index of the rule and tables for a cell. */
      int facet(int cell) {
        return type.isFacet() ? facets[cell] : 0;
      }
    }

    /** Values at one quadrature point. */
    private class PointContext {
      final TermPlan.QuadratureTerm term;
      final Context cx;
      final int p;
      /** The point in the reference coordinates of each cell. */
      final double[][] points;
      final double[][][] k;

      PointContext(TermPlan.QuadratureTerm term, Context cx, int p) {
        this.term = term;
        this.cx = cx;
        this.p = p;
        this.points = new double[cx.cells.length][];
        this.k = new double[cx.cells.length][][];
        for (int c = 0; c < cx.cells.length; c++) {
          points[c] = term.rules.get(cx.facet(c)).point(p);
          k[c] = cx.cells[c].inverseJacobian(points[c]);
        }
      }

      /** Returns the value of an atom that is not a basis atom. */
      double value(Atom atom) {
        switch (atom.kind) {
          case COEFFICIENT:
            final Atom.Coefficient coefficient = (Atom.Coefficient) atom;
            final double[] dofs = cx.w[
                compiledForm.coefficientIndex(
                    coefficient.coefficient.count)];
            final FiniteElement element = coefficient.element();
            final int cell = cellOf(coefficient.side);
            final int offset = type == IntegralType.INTERIOR_FACET
                ? cell * element.spaceDimension()
                : 0;
            double v = 0d;
            for (int dof = 0; dof < element.spaceDimension(); dof++) {
              v += dofs[offset + dof]
                  * physical(element, coefficient.component,
                      coefficient.derivatives, cell, dof);
            }
            return v;
          case NORMAL:
            final Atom.Normal normal = (Atom.Normal) atom;
            final int c = cellOf(normal.side);
            return cx.cells[c].normal(cx.facets[c], points[c])
                [normal.component];
          case COORDINATE:
            return cx.cells[0].x(points[0])
                [((Atom.Coordinate) atom).component];
          case NONLINEAR:
            final Atom.Nonlinear nonlinear = (Atom.Nonlinear) atom;
            return nonlinear.apply(evaluate(nonlinear.argument));
          default:
            throw new AssertionError(atom);
        }
      }

      private double evaluate(Sum sum) {
        double s = 0d;
        for (Monomial monomial : sum.monomials) {
          double f = monomial.coefficient;
          for (Atom atom : monomial.atoms) {
            f *= value(atom);
          }
          s += f;
        }
        return s;
      }

      /** Returns the values of a basis atom for each dof of its argument;
       * on interior facets, for the dofs of both cells. */
      double[] basisVector(Atom.Basis basis) {
        final int n = basis.element.spaceDimension();
        final int cell = cellOf(basis.side);
        final boolean interior = type == IntegralType.INTERIOR_FACET;
        final double[] v = new double[interior ? 2 * n : n];
        final int offset = interior ? cell * n : 0;
        for (int dof = 0; dof < n; dof++) {
          v[offset + dof] = physical(basis.element, basis.component,
              basis.derivatives, cell, dof);
        }
        return v;
      }

      /** Returns a physical derivative of a component of a basis
       * function, by the chain rule {@code d/dx_i = sum_a K[a][i]
       * d/dX_a}. */
      private double physical(FiniteElement element, int component,
          List<Integer> derivatives, int cell, int dof) {
        final int d = cx.cells[cell].domain.dimension();
        final List<List<Integer>> directionLists = new ArrayList<>();
        for (int j = 0; j < derivatives.size(); j++) {
          final List<Integer> directions = new ArrayList<>();
          for (int a = 0; a < d; a++) {
            directions.add(a);
          }
          directionLists.add(directions);
        }
        double v = 0d;
        for (List<Integer> reference
            : Lists.cartesianProduct(directionLists)) {
          double f = 1d;
          for (int j = 0; j < reference.size(); j++) {
            f *= k[cell][reference.get(j)][derivatives.get(j)];
          }
          final PsiTable table = term.table(element, component,
              Ordering.<Integer>natural().immutableSortedCopy(reference));
          v += f * table.value(cx.facet(cell), p, dof);
        }
        return v;
      }

      private int cellOf(@Nullable Side side) {
        return side == null ? 0 : side.cell;
      }
    }
  }
}

// End Kernels.java
