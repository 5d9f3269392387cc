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
import java.util.List;
import java.util.Locale;
import net.hydromatic.formc.ast.Integral;
import net.hydromatic.formc.ast.Representation;
import net.hydromatic.formc.element.FiniteElement;
import net.hydromatic.formc.quadrature.QuadratureRule;

/**
 * Plan for computing the contribution of one integral to a local tensor.
 *
 * <p>The representation and the quadrature degree are resolved once, when
 * the plan is created; code generation does not revisit the decision.
 */
public abstract class TermPlan {
  public final Integral integral;
  /** Resolved representation; never {@link Representation#AUTO}. */
  public final Representation representation;
  /** Resolved quadrature degree. */
  public final int degree;

  TermPlan(Integral integral, Representation representation, int degree) {
    this.integral = requireNonNull(integral);
    this.representation = requireNonNull(representation);
    this.degree = degree;
  }

  @Override
  public String toString() {
    return representation.name().toLowerCase(Locale.ROOT)
        + "(degree=" + degree + ", " + integral + ")";
  }

  /** Term in tensor representation. */
  public static class TensorTerm extends TermPlan {
    public final ImmutableList<ReferenceTensor> tensors;

    TensorTerm(Integral integral, int degree,
        List<ReferenceTensor> tensors) {
      super(integral, Representation.TENSOR, degree);
      this.tensors = ImmutableList.copyOf(tensors);
    }
  }

  /** Term in quadrature representation. */
  public static class QuadratureTerm extends TermPlan {
    /** Rules, one per facet (a single rule for cell integrals), with points
     * in reference cell coordinates. */
    public final ImmutableList<QuadratureRule> rules;
    /** Expanded integrand. */
    public final Sum integrand;
    /** Tables of basis functions of the arguments, coefficients and, if the
     * domain is not affine or the integrand mentions the spatial coordinate,
     * the coordinate element. */
    public final ImmutableList<PsiTable> tables;
    /** Scalar element of the coordinate field. */
    public final FiniteElement coordinateElement;

    QuadratureTerm(Integral integral, int degree, List<QuadratureRule> rules,
        Sum integrand, List<PsiTable> tables,
        FiniteElement coordinateElement) {
      super(integral, Representation.QUADRATURE, degree);
      this.rules = ImmutableList.copyOf(rules);
      this.integrand = requireNonNull(integrand);
      this.tables = ImmutableList.copyOf(tables);
      this.coordinateElement = requireNonNull(coordinateElement);
    }

    /** Returns the number of quadrature points, which is the same on every
     * facet. */
    public int pointCount() {
      return rules.get(0).size();
    }

    /** Returns the table for a reference derivative of a component of an
     * element; throws if there is none. */
    public PsiTable table(FiniteElement element, int component,
        List<Integer> derivatives) {
      final ImmutableList<Integer> list = ImmutableList.copyOf(derivatives);
      for (PsiTable table : tables) {
        if (table.matches(element, component, list)) {
          return table;
        }
      }
      throw new IllegalArgumentException("no table for " + element
          + ", component " + component + ", derivatives " + derivatives);
    }

    /** Returns the index of a table in {@link #tables}. */
    public int tableIndex(PsiTable table) {
      return tables.indexOf(table);
    }
  }
}

// End TermPlan.java
