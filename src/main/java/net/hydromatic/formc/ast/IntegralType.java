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

import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Kind of domain that an integral is taken over. */
public enum IntegralType {
  CELL("dx", "cell_interior"),
  EXTERIOR_FACET("ds", "exterior_facet"),
  INTERIOR_FACET("dS", "interior_facet");

  /** Name of the measure in form files, e.g. "dx". */
  public final String measureName;
  /** Suffix of the generated procedure, e.g. "cell_interior". */
  public final String procedureSuffix;

  private static final ImmutableMap<String, IntegralType> BY_MEASURE_NAME;

  static {
    final ImmutableMap.Builder<String, IntegralType> b =
        ImmutableMap.builder();
    for (IntegralType type : values()) {
      b.put(type.measureName, type);
    }
    BY_MEASURE_NAME = b.build();
  }

  IntegralType(String measureName, String procedureSuffix) {
    this.measureName = measureName;
    this.procedureSuffix = procedureSuffix;
  }

  /** Looks up a measure name such as "ds"; returns null if not found. */
  public static @Nullable IntegralType lookup(String measureName) {
    return BY_MEASURE_NAME.get(measureName);
  }

  /** Whether the integral is over facets rather than cells. */
  public boolean isFacet() {
    return this != CELL;
  }
}

// End IntegralType.java
