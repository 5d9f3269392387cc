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
package net.hydromatic.formc.util;

import static net.hydromatic.formc.util.Formats.real;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/** Tests {@link Formats}. */
public class FormatsTest {
  @Test void testReal() {
    assertThat(real(1d / 12d, 15), is("0.0833333333333333"));
    assertThat(real(1d / 24d, 15), is("0.0416666666666667"));
    assertThat(real(-1d / 24d, 15), is("-0.0416666666666667"));
    assertThat(real(0.5d, 15), is("0.5"));
    assertThat(real(1d / 3d, 3), is("0.333"));
  }

  /** Integers get a decimal point, so that they are floating-point
   * literals. */
  @Test void testRealInteger() {
    assertThat(real(2d, 15), is("2.0"));
    assertThat(real(-3d, 15), is("-3.0"));
    assertThat(real(100d, 15), is("100.0"));
  }

  @Test void testRealZero() {
    assertThat(real(0d, 15), is("0.0"));
    assertThat(real(-0d, 15), is("0.0"));
  }

  @Test void testRealSmall() {
    assertThat(real(1e-7, 15), is("1E-7"));
    assertThat(real(0.000125d, 15), is("0.000125"));
  }

  @Test void testRealInvalid() {
    assertThrows(IllegalArgumentException.class,
        () -> real(Double.NaN, 15));
    assertThrows(IllegalArgumentException.class,
        () -> real(Double.POSITIVE_INFINITY, 15));
    assertThrows(IllegalArgumentException.class, () -> real(1d, 0));
  }
}

// End FormatsTest.java
