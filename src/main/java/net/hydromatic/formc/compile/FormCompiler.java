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

import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import net.hydromatic.formc.ast.Expr;
import net.hydromatic.formc.ast.Exprs;
import net.hydromatic.formc.ast.Form;
import net.hydromatic.formc.ast.Integral;
import net.hydromatic.formc.ast.IntegralType;
import net.hydromatic.formc.ast.Representation;
import net.hydromatic.formc.element.Domain;
import net.hydromatic.formc.quadrature.DegreeEstimator;
import net.hydromatic.formc.quadrature.DegreeEstimators;

/**
 * Compiles a form into plans.
 *
 * <p>For each integral, in order: simplify (if {@link Prop#OPTIMIZE} is
 * set), sort terms into canonical order, expand into monomials, check the
 * monomials against the integral type, resolve the representation and the
 * quadrature degree, and build a tensor or quadrature plan.
 */
public class FormCompiler {
  private final Map<Prop, Object> props;
  private final DegreeEstimator estimator;
  private final Tracer tracer;

  public FormCompiler(Map<Prop, Object> props, DegreeEstimator estimator,
      Tracer tracer) {
    this.props = requireNonNull(props);
    this.estimator = requireNonNull(estimator);
    this.tracer = requireNonNull(tracer);
  }

  /** Creates a compiler with the standard degree estimator. */
  public FormCompiler(Map<Prop, Object> props, Tracer tracer) {
    this(props, DegreeEstimators.standard(Prop.MAX_DEGREE.intValue(props)),
        tracer);
  }

  /**
   * Compiles a form.
   *
   * @param name Name of the form, such as "a"
   * @param form Form
   * @param warningConsumer Receives recoverable errors, such as a degree
   *     that could not be estimated
   */
  public CompiledForm compile(String name, Form form,
      Consumer<CompileException> warningConsumer) {
    final RepresentationSelector selector =
        new RepresentationSelector(
            Prop.REPRESENTATION.enumValue(props, Representation.class));
    final Set<Integer> argumentNumbers = argumentNumbers(form);
    final List<IntegralPlan> plans = new ArrayList<>();
    for (IntegralType type : form.integralTypes()) {
      for (int subdomainId : form.subdomainIds(type)) {
        final TermChecker checker =
            new TermChecker(argumentNumbers, form.domain, type, subdomainId);
        final List<TermPlan> terms = new ArrayList<>();
        for (Integral integral : form.integrals(type, subdomainId)) {
          terms.add(
              plan(integral, form.domain, checker, selector,
                  warningConsumer));
        }
        plans.add(new IntegralPlan(type, subdomainId, terms));
      }
    }
    final CompiledForm compiledForm = new CompiledForm(name, form, plans);
    tracer.onPlan(compiledForm);
    return compiledForm;
  }

  private static Set<Integer> argumentNumbers(Form form) {
    final ImmutableSet.Builder<Integer> b = ImmutableSet.builder();
    form.arguments.forEach(a -> b.add(a.number));
    return b.build();
  }

  private TermPlan plan(Integral integral, Domain domain,
      TermChecker checker, RepresentationSelector selector,
      Consumer<CompileException> warningConsumer) {
    Expr integrand = integral.integrand;
    if (Prop.OPTIMIZE.booleanValue(props)) {
      integrand = Simplifier.simplify(integrand);
    }
    integrand = Exprs.canonicalSum(integrand);

    final Sum sum;
    try {
      sum = Expander.expand(integrand, domain);
    } catch (TermException e) {
      throw e;
    } catch (CompileException e) {
      throw checker.fail(e.getMessage());
    }
    tracer.onExpand(integral, sum);
    checker.check(sum);

    final Representation representation =
        selector.select(integral, sum, domain);
    final int degree = degree(integral, integrand, domain, warningConsumer);
    final IntegralType type = integral.measure.type;
    if (representation == Representation.TENSOR) {
      return new TensorFactorizer(domain, type)
          .factorize(integral, sum, degree);
    } else {
      return new QuadratureFactorizer(domain, type)
          .factorize(integral, sum, degree);
    }
  }

  /** Resolves the quadrature degree of an integral. An explicit degree
   * overrides the estimate. */
  private int degree(Integral integral, Expr integrand, Domain domain,
      Consumer<CompileException> warningConsumer) {
    if (integral.measure.degree != null) {
      return integral.measure.degree;
    }
    try {
      return estimator.estimate(integrand, domain);
    } catch (DegreeException e) {
      if (Prop.STRICT_DEGREE.booleanValue(props)) {
        throw e;
      }
      final int fallbackDegree = Prop.FALLBACK_DEGREE.intValue(props);
      warningConsumer.accept(
          new DegreeException(e.getMessage() + "; using degree "
              + fallbackDegree, e.estimate));
      return fallbackDegree;
    }
  }
}

// End FormCompiler.java
