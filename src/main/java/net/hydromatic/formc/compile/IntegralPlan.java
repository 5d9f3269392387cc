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
import net.hydromatic.formc.ast.IntegralType;

/** Plans for all integrals of a form over one integral type and one
 * subdomain, in insertion order. */
public final class IntegralPlan {
  public final IntegralType type;
  public final int subdomainId;
  public final ImmutableList<TermPlan> terms;

  IntegralPlan(IntegralType type, int subdomainId, List<TermPlan> terms) {
    this.type = requireNonNull(type);
    this.subdomainId = subdomainId;
    this.terms = ImmutableList.copyOf(terms);
  }

  @Override
  public String toString() {
    return "IntegralPlan(" + type.measureName + ", " + subdomainId + ", "
        + terms + ")";
  }
}

// End IntegralPlan.java
