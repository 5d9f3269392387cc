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
package net.hydromatic.formc.quadrature;

import net.hydromatic.formc.ast.Expr;
import net.hydromatic.formc.element.Domain;

/**
 * Policy that estimates the polynomial degree of an integrand, and therefore
 * the degree of the quadrature rule needed to integrate it.
 *
 * <p>An estimate is a guess; an integrand that contains non-polynomial
 * functions has no exact degree. Implementations are validated against
 * integrals whose values are known exactly.
 *
 * @see DegreeEstimators
 */
public interface DegreeEstimator {
  /**
   * Returns the estimated degree of a scalar integrand on a domain, including
   * the degree of the Jacobian of the mapping from the reference cell.
   *
   * @throws net.hydromatic.formc.compile.DegreeException if no acceptable
   *   estimate can be made
   */
  int estimate(Expr integrand, Domain domain);
}

// End DegreeEstimator.java
