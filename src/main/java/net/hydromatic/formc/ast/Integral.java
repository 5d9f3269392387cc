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

import java.util.Objects;
import net.hydromatic.formc.element.Domain;

/**
 * Scalar expression integrated over a measure.
 *
 * <p>Create instances using {@link ExprBuilder#integral}.
 */
public final class Integral {
  public final Expr integrand;
  public final Measure measure;

  Integral(Expr integrand, Measure measure) {
    this.integrand = requireNonNull(integrand);
    this.measure = requireNonNull(measure);
  }

  /** Returns the domain of the integrand. */
  public Domain domain() {
    return requireNonNull(integrand.domain);
  }

  @Override
  public int hashCode() {
    return Objects.hash(integrand, measure);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Integral
            && integrand.equals(((Integral) o).integrand)
            && measure.equals(((Integral) o).measure);
  }

  @Override
  public String toString() {
    final ExprWriter w = new ExprWriter();
    integrand.unparse(w, 0, Op.TIMES.left);
    return w.append(Op.TIMES.padded).append(measure.toString()).toString();
  }
}

// End Integral.java
