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
import java.util.Objects;
import java.util.function.ToDoubleFunction;

/** Product of a real coefficient and geometry symbols; an additive term of
 * an entry of a geometry tensor. */
public final class GeometryTerm {
  public final double coefficient;
  /** Symbols, sorted, possibly repeated. */
  public final ImmutableList<GeometrySymbol> symbols;

  GeometryTerm(double coefficient, ImmutableList<GeometrySymbol> symbols) {
    this.coefficient = coefficient;
    this.symbols = requireNonNull(symbols);
  }

  /** Evaluates this term, given a function that returns the value of each
   * symbol. */
  public double evaluate(ToDoubleFunction<GeometrySymbol> values) {
    double v = coefficient;
    for (GeometrySymbol symbol : symbols) {
      v *= values.applyAsDouble(symbol);
    }
    return v;
  }

  @Override
  public int hashCode() {
    return Objects.hash(coefficient, symbols);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof GeometryTerm
            && coefficient == ((GeometryTerm) o).coefficient
            && symbols.equals(((GeometryTerm) o).symbols);
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder().append(coefficient);
    symbols.forEach(s -> b.append(" * ").append(s));
    return b.toString();
  }
}

// End GeometryTerm.java
