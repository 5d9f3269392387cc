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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.util.HashMap;
import java.util.Map;
import net.hydromatic.formc.ast.Representation;
import net.hydromatic.formc.codegen.Language;
import org.junit.jupiter.api.Test;

/** Tests {@link Prop}. */
public class PropTest {
  @Test void testDefaults() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThat(Prop.LANGUAGE.enumValue(map, Language.class),
        is(Language.CPP));
    assertThat(Prop.REPRESENTATION.enumValue(map, Representation.class),
        is(Representation.AUTO));
    assertThat(Prop.OPTIMIZE.booleanValue(map), is(false));
    assertThat(Prop.OUTPUT_DIR.fileValue(map), is(new File(".")));
    assertThat(Prop.PRECISION.intValue(map), is(15));
    assertThat(Prop.MAX_DEGREE.intValue(map), is(30));
    assertThat(Prop.FALLBACK_DEGREE.intValue(map), is(2));
    assertThat(Prop.STRICT_DEGREE.booleanValue(map), is(false));
  }

  @Test void testFlags() {
    assertThat(Prop.OUTPUT_DIR.flag(), is("--output-dir"));
    assertThat(Prop.STRICT_DEGREE.flag(), is("--strict-degree"));
    assertThat(Prop.LANGUAGE.flag(), is("--language"));
    for (Prop prop : Prop.values()) {
      assertThat(Prop.lookupFlag(prop.flag()), sameInstance(prop));
    }
    assertThat(Prop.lookupFlag("--outputDir"), nullValue());
    assertThat(Prop.lookupFlag("maxDegree"), nullValue());
  }

  @Test void testLookup() {
    assertThat(Prop.lookup("maxDegree"), is(Prop.MAX_DEGREE));
    assertThat(Prop.lookup("MAX_DEGREE"), is(Prop.MAX_DEGREE));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.lookup("degree"));
    assertThat(e.getMessage(), is("property degree not found"));
    assertThat(Prop.BY_CAMEL_NAME.get(0), is(Prop.FALLBACK_DEGREE));
  }

  /** Strings are converted to the type of the property. */
  @Test void testSetLenient() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.LANGUAGE.setLenient(map, "java");
    Prop.REPRESENTATION.setLenient(map, "Tensor");
    Prop.PRECISION.setLenient(map, "8");
    Prop.OPTIMIZE.setLenient(map, "true");
    Prop.OUTPUT_DIR.setLenient(map, "/tmp/out");
    assertThat(Prop.LANGUAGE.enumValue(map, Language.class),
        is(Language.JAVA));
    assertThat(Prop.REPRESENTATION.enumValue(map, Representation.class),
        is(Representation.TENSOR));
    assertThat(Prop.PRECISION.intValue(map), is(8));
    assertThat(Prop.OPTIMIZE.booleanValue(map), is(true));
    assertThat(Prop.OUTPUT_DIR.fileValue(map), is(new File("/tmp/out")));

    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.LANGUAGE.setLenient(map, "fortran"));
    assertThat(e.getMessage(),
        is("value of language must be one of: 'cpp', 'java'"));
    e = assertThrows(IllegalArgumentException.class,
        () -> Prop.MAX_DEGREE.setLenient(map, "high"));
    assertThat(e.getMessage(),
        is("value of maxDegree must be an integer: high"));
  }

  @Test void testSet() {
    final Map<Prop, Object> map = new HashMap<>();
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.PRECISION.set(map, "8"));
    assertThat(e.getMessage(),
        is("value for property precision must have type Integer"));
    Prop.PRECISION.set(map, 8);
    assertThat(Prop.PRECISION.intValue(map), is(8));
    Prop.PRECISION.set(map, null);
    assertThat(map.containsKey(Prop.PRECISION), is(false));
    assertThat(Prop.PRECISION.intValue(map), is(15));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.PRECISION.booleanValue(map));
  }
}

// End PropTest.java
