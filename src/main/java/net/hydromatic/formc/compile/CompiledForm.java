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
import com.google.common.collect.ImmutableSortedSet;
import java.util.List;
import net.hydromatic.formc.ast.Expr;
import net.hydromatic.formc.ast.Form;
import net.hydromatic.formc.ast.IntegralType;

/**
 * Form together with the plans that compute its local tensors.
 *
 * <p>Plans are sorted by integral type, then by subdomain id.
 */
public final class CompiledForm {
  public final String name;
  public final Form form;
  public final ImmutableList<IntegralPlan> plans;

  CompiledForm(String name, Form form, List<IntegralPlan> plans) {
    this.name = requireNonNull(name);
    this.form = requireNonNull(form);
    this.plans = ImmutableList.copyOf(plans);
  }

  public int rank() {
    return form.rank();
  }

  public ImmutableSortedSet<IntegralType> integralTypes() {
    return form.integralTypes();
  }

  /** Returns the plans of an integral type, sorted by subdomain id. */
  public List<IntegralPlan> plans(IntegralType type) {
    final ImmutableList.Builder<IntegralPlan> b = ImmutableList.builder();
    for (IntegralPlan plan : plans) {
      if (plan.type == type) {
        b.add(plan);
      }
    }
    return b.build();
  }

  /** Returns the local dimension of the {@code i}th argument, counting the
   * dofs of both cells if {@code type} is an interior facet. */
  public int argumentDimension(IntegralType type, int i) {
    final int n = form.arguments.get(i).element.spaceDimension();
    return type == IntegralType.INTERIOR_FACET ? 2 * n : n;
  }

  /** Returns the length of the buffer that holds the local tensor; 1 for
   * functionals. */
  public int bufferLength(IntegralType type) {
    int n = 1;
    for (int i = 0; i < form.arguments.size(); i++) {
      n *= argumentDimension(type, i);
    }
    return n;
  }

  /** Returns the position of a coefficient in the array of coefficient dof
   * values passed to a procedure. */
  public int coefficientIndex(int count) {
    for (int i = 0; i < form.coefficients.size(); i++) {
      if (form.coefficients.get(i).count == count) {
        return i;
      }
    }
    throw new IllegalArgumentException("no coefficient " + count);
  }

  /** Returns the coefficient with a given count. */
  public Expr.Coefficient coefficient(int count) {
    return form.coefficients.get(coefficientIndex(count));
  }

  @Override
  public String toString() {
    return "CompiledForm(" + name + ", " + plans + ")";
  }
}

// End CompiledForm.java
