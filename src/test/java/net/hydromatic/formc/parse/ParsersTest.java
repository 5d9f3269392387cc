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
package net.hydromatic.formc.parse;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/** Tests {@link Parsers}. */
public class ParsersTest {
  @Test void testUnquoteString() {
    assertThat(Parsers.unquoteString("\"abc\""), is("abc"));
    assertThat(Parsers.unquoteString("'abc'"), is("abc"));
    assertThat(Parsers.unquoteString("\"\""), is(""));
    assertThat(Parsers.unquoteString("\"a\\\"b\""), is("a\"b"));
    assertThat(Parsers.unquoteString("'it\\'s'"), is("it's"));
    assertThat(Parsers.unquoteString("\"a\\\\b\""), is("a\\b"));
    assertThrows(IllegalArgumentException.class,
        () -> Parsers.unquoteString("\"abc'"));
  }
}

// End ParsersTest.java
