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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.formc.element.FiniteElement;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Contents of a form file: up to three forms and the element that drives
 * the element metadata of the generated module.
 */
public final class FormFile {
  /** Names that forms may be bound to: the bilinear form "a", the linear
   * form "L" and the functional "M". */
  public static final ImmutableList<String> FORM_NAMES =
      ImmutableList.of("a", "L", "M");

  /** Name of the file without its extension; names the generated module. */
  public final String name;
  /** Forms keyed by name, in the order of {@link #FORM_NAMES}. */
  public final ImmutableMap<String, Form> forms;
  public final @Nullable FiniteElement element;

  private FormFile(String name, ImmutableMap<String, Form> forms,
      @Nullable FiniteElement element) {
    this.name = requireNonNull(name);
    this.forms = requireNonNull(forms);
    this.element = element;
  }

  /** Creates a FormFile. Forms whose name is not "a", "L" or "M" are
   * rejected. */
  public static FormFile of(String name, Map<String, Form> forms,
      @Nullable FiniteElement element) {
    final ImmutableMap.Builder<String, Form> b = ImmutableMap.builder();
    for (String formName : FORM_NAMES) {
      final Form form = forms.get(formName);
      if (form != null) {
        b.put(formName, form);
      }
    }
    for (String formName : forms.keySet()) {
      if (!FORM_NAMES.contains(formName)) {
        throw new IllegalArgumentException("invalid form name '" + formName
            + "'; expected one of " + FORM_NAMES);
      }
    }
    return new FormFile(name, b.build(), element);
  }

  @Override
  public String toString() {
    return "FormFile(" + name + ", " + forms.keySet() + ")";
  }
}

// End FormFile.java
