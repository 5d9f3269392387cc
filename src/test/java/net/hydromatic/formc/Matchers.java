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
package net.hydromatic.formc;

import java.util.Arrays;
import java.util.List;
import net.hydromatic.formc.compile.CompileException;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Description;
import org.hamcrest.Matcher;
import org.hamcrest.TypeSafeMatcher;

/** Matchers for use in formc tests. */
public abstract class Matchers {
  private Matchers() {}

  /** Tolerance for comparing computed tensors. */
  public static final double TOLERANCE = 1e-12;

  /** Matches an array of doubles, each element within
   * {@link #TOLERANCE} of the expected value. */
  public static Matcher<double[]> closeTo(double... expected) {
    return closeTo(expected, TOLERANCE);
  }

  /** Matches an array of doubles, each element within a tolerance of the
   * expected value. */
  public static Matcher<double[]> closeTo(double[] expected,
      double tolerance) {
    return new TypeSafeMatcher<double[]>() {
      @Override
      protected boolean matchesSafely(double[] actual) {
        if (actual.length != expected.length) {
          return false;
        }
        for (int i = 0; i < actual.length; i++) {
          if (!(Math.abs(actual[i] - expected[i]) <= tolerance)) {
            return false;
          }
        }
        return true;
      }

      @Override
      public void describeTo(Description description) {
        description.appendText("array within " + tolerance + " of "
            + Arrays.toString(expected));
      }

      @Override
      protected void describeMismatchSafely(double[] actual,
          Description description) {
        description.appendText("was " + Arrays.toString(actual));
      }
    };
  }

  /** Matches an array whose elements are all zero, to within
   * {@link #TOLERANCE}. */
  public static Matcher<double[]> allZero() {
    return new CustomTypeSafeMatcher<double[]>("all zero") {
      @Override
      protected boolean matchesSafely(double[] actual) {
        for (double v : actual) {
          if (Math.abs(v) > TOLERANCE) {
            return false;
          }
        }
        return true;
      }
    };
  }

  /** Matches a list of warnings by their messages. */
  public static Matcher<List<CompileException>> hasMessages(
      String... messages) {
    final List<String> expected = Arrays.asList(messages);
    return new CustomTypeSafeMatcher<List<CompileException>>(
        "warnings " + expected) {
      @Override
      protected boolean matchesSafely(List<CompileException> list) {
        if (list.size() != expected.size()) {
          return false;
        }
        for (int i = 0; i < list.size(); i++) {
          if (!list.get(i).getMessage().equals(expected.get(i))) {
            return false;
          }
        }
        return true;
      }
    };
  }
}

// End Matchers.java
