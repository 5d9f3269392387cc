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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Locale;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Integration measure: the kind of domain, the subdomain, and options that
 * control how the integral is computed.
 */
public final class Measure {
  public final IntegralType type;
  public final int subdomainId;
  public final Representation representation;
  /** Quadrature degree, or null to estimate it. */
  public final @Nullable Integer degree;

  private Measure(IntegralType type, int subdomainId,
      Representation representation, @Nullable Integer degree) {
    checkArgument(subdomainId >= 0, "negative subdomain id %s", subdomainId);
    checkArgument(degree == null || degree >= 0, "negative degree %s",
        degree);
    this.type = requireNonNull(type);
    this.subdomainId = subdomainId;
    this.representation = requireNonNull(representation);
    this.degree = degree;
  }

  /** Creates a measure over subdomain 0 with default options. */
  public static Measure of(IntegralType type) {
    return new Measure(type, 0, Representation.AUTO, null);
  }

  public Measure withSubdomain(int subdomainId) {
    return new Measure(type, subdomainId, representation, degree);
  }

  public Measure withRepresentation(Representation representation) {
    return new Measure(type, subdomainId, representation, degree);
  }

  public Measure withDegree(@Nullable Integer degree) {
    return new Measure(type, subdomainId, representation, degree);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, subdomainId, representation, degree);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Measure
            && type == ((Measure) o).type
            && subdomainId == ((Measure) o).subdomainId
            && representation == ((Measure) o).representation
            && Objects.equals(degree, ((Measure) o).degree);
  }

  @Override
  public String toString() {
    if (subdomainId == 0
        && representation == Representation.AUTO
        && degree == null) {
      return type.measureName;
    }
    final StringBuilder b = new StringBuilder(type.measureName)
        .append('(')
        .append(subdomainId);
    if (degree != null) {
      b.append(", degree=").append(degree);
    }
    if (representation != Representation.AUTO) {
      b.append(", representation=\"")
          .append(representation.name().toLowerCase(Locale.ROOT))
          .append('"');
    }
    return b.append(')').toString();
  }
}

// End Measure.java
