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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.formc.element.Domain;

/**
 * Multilinear form: an ordered list of integrals.
 *
 * <p>The rank is the number of arguments: 0 for a functional, 1 for a linear
 * form, 2 for a bilinear form. Create instances using
 * {@link ExprBuilder#form}, which validates them.
 */
public final class Form {
  public final ImmutableList<Integral> integrals;
  public final Domain domain;
  /** Arguments, sorted by number: the test function, then the trial
   * function. */
  public final ImmutableList<Expr.Argument> arguments;
  /** Coefficients, sorted by count. */
  public final ImmutableList<Expr.Coefficient> coefficients;

  Form(ImmutableList<Integral> integrals, Domain domain,
      ImmutableList<Expr.Argument> arguments,
      ImmutableList<Expr.Coefficient> coefficients) {
    this.integrals = requireNonNull(integrals);
    this.domain = requireNonNull(domain);
    this.arguments = requireNonNull(arguments);
    this.coefficients = requireNonNull(coefficients);
  }

  public int rank() {
    return arguments.size();
  }

  /** Returns a form whose integrals are those of this form followed by those
   * of another. */
  public Form plus(Form form) {
    return ExprBuilder.dsl.form(
        ImmutableList.<Integral>builder()
            .addAll(integrals)
            .addAll(form.integrals)
            .build());
  }

  /** Returns the kinds of integral present, in declaration order of
   * {@link IntegralType}. */
  public ImmutableSortedSet<IntegralType> integralTypes() {
    final ImmutableSortedSet.Builder<IntegralType> b =
        ImmutableSortedSet.naturalOrder();
    integrals.forEach(i -> b.add(i.measure.type));
    return b.build();
  }

  /** Returns the subdomain ids of integrals of a given kind, ascending. */
  public ImmutableSortedSet<Integer> subdomainIds(IntegralType type) {
    final ImmutableSortedSet.Builder<Integer> b =
        ImmutableSortedSet.naturalOrder();
    for (Integral integral : integrals) {
      if (integral.measure.type == type) {
        b.add(integral.measure.subdomainId);
      }
    }
    return b.build();
  }

  /** Returns the integrals of a given kind over a given subdomain, in
   * insertion order. */
  public List<Integral> integrals(IntegralType type, int subdomainId) {
    final List<Integral> list = new ArrayList<>();
    for (Integral integral : integrals) {
      if (integral.measure.type == type
          && integral.measure.subdomainId == subdomainId) {
        list.add(integral);
      }
    }
    return list;
  }

  @Override
  public int hashCode() {
    return integrals.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Form && integrals.equals(((Form) o).integrals);
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder();
    for (Integral integral : integrals) {
      if (b.length() > 0) {
        b.append(" + ");
      }
      b.append(integral);
    }
    return b.toString();
  }
}

// End Form.java
