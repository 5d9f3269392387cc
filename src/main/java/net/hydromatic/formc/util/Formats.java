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

import static com.google.common.base.Preconditions.checkArgument;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/** Locale-independent formatting of numbers. */
public abstract class Formats {
  private Formats() {}

  /**
   * Formats a real number with a given number of significant digits, so that
   * it is a valid floating-point literal in C++ and Java.
   *
   * <p>For example, {@code real(1d / 12d, 15)} returns
   * "0.0833333333333333", {@code real(2d, 15)} returns "2.0", and
   * {@code real(-0d, 15)} returns "0.0".
   */
  public static String real(double value, int precision) {
    checkArgument(precision > 0, "precision must be positive");
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      throw new IllegalArgumentException("not a finite number: " + value);
    }
    if (value == 0d) {
      return "0.0";
    }
    final BigDecimal d =
        new BigDecimal(value)
            .round(new MathContext(precision, RoundingMode.HALF_EVEN))
            .stripTrailingZeros();
    final int exponent = d.precision() - d.scale() - 1;
    String s =
        exponent < -5 || exponent > 15 ? d.toString() : d.toPlainString();
    if (s.indexOf('.') < 0 && s.indexOf('E') < 0) {
      s += ".0";
    }
    return s;
  }
}

// End Formats.java
