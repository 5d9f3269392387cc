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
package net.hydromatic.formc.element;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Finite element family. */
public enum Family {
  LAGRANGE("Lagrange", "CG", "P", "Q"),
  DISCONTINUOUS_LAGRANGE("Discontinuous Lagrange", "DG", "DQ"),
  CROUZEIX_RAVIART("Crouzeix-Raviart", "CR"),
  REAL("Real", "R");

  /** The name used in form files and in diagnostics, e.g. "Lagrange". */
  public final String displayName;
  public final ImmutableList<String> aliases;

  private static final ImmutableMap<String, Family> BY_NAME;

  static {
    final ImmutableMap.Builder<String, Family> b = ImmutableMap.builder();
    for (Family family : values()) {
      b.put(family.displayName, family);
      for (String alias : family.aliases) {
        b.put(alias, family);
      }
    }
    BY_NAME = b.build();
  }

  Family(String displayName, String... aliases) {
    this.displayName = displayName;
    this.aliases = ImmutableList.copyOf(aliases);
  }

  /** Looks up a family by display name or alias; returns null if not found. */
  public static @Nullable Family lookup(String name) {
    return BY_NAME.get(name);
  }
}

// End Family.java
