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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.base.Enums;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.io.File;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import net.hydromatic.formc.ast.Representation;
import net.hydromatic.formc.codegen.Language;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Compiler option.
 *
 * <p>Options are held in a {@code Map<Prop, Object>}; a property that is
 * absent from the map has its default value.
 */
public enum Prop {
  /** Enum property "language" is the language of generated code. Default is
   * C++. */
  LANGUAGE("language", Language.class, Language.CPP),

  /**
   * Enum property "representation" is the representation of integrals whose
   * measure does not specify one. Default is "auto", which chooses tensor
   * representation where it can be applied and quadrature elsewhere.
   */
  REPRESENTATION("representation", Representation.class,
      Representation.AUTO),

  /**
   * Boolean property "optimize" controls whether to simplify integrands
   * before factorizing them, and to omit negligible entries of reference
   * tensors from generated code. Default is false.
   */
  OPTIMIZE("optimize", Boolean.class, false),

  /** File property "outputDir" is the directory where generated modules are
   * written. Default is the current directory. */
  OUTPUT_DIR("outputDir", File.class, new File(".")),

  /** Integer property "precision" is the number of significant digits of
   * real literals in generated code. Default is 15. */
  PRECISION("precision", Integer.class, 15),

  /** Integer property "maxDegree" is the largest quadrature degree that
   * automatic estimation may return. Default is 30. */
  MAX_DEGREE("maxDegree", Integer.class, 30),

  /** Integer property "fallbackDegree" is the quadrature degree used when
   * estimation fails. Default is 2. */
  FALLBACK_DEGREE("fallbackDegree", Integer.class, 2),

  /**
   * Boolean property "strictDegree" controls what happens if the quadrature
   * degree of an integral cannot be estimated. If true, compilation fails; if
   * false (the default), the compiler emits a warning and uses
   * {@link #FALLBACK_DEGREE}.
   */
  STRICT_DEGREE("strictDegree", Boolean.class, false);

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  /** Map of all properties, keyed by both {@link #name()} and
   * {@link #camelName}. */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = defaultValue;
    checkArgument(CaseFormat.LOWER_CAMEL
        .to(CaseFormat.UPPER_UNDERSCORE, camelName)
        .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Returns the command-line flag of this property, for example
   * "--output-dir" for {@link #OUTPUT_DIR}. */
  public String flag() {
    return "--" + CaseFormat.LOWER_CAMEL.to(CaseFormat.LOWER_HYPHEN,
        camelName);
  }

  /** Looks up a property by name. Throws if not found; never returns
   * null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName
          + " not found");
    }
    return prop;
  }

  /** Looks up a property by its command-line flag, for example
   * "--output-dir". Returns null if not found. */
  public static @Nullable Prop lookupFlag(String flag) {
    for (Prop prop : values()) {
      if (prop.flag().equals(flag)) {
        return prop;
      }
    }
    return null;
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(type == requestedType,
        "invalid type %s for property %s", type, camelName);
  }

  /** Returns whether this property is boolean. */
  public boolean isBoolean() {
    return type == Boolean.class;
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    return this.<Boolean>typeValue(map.get(this));
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    return this.<Integer>typeValue(map.get(this));
  }

  /** Returns the value of a file property. */
  public File fileValue(Map<Prop, Object> map) {
    checkType(File.class);
    return this.typeValue(map.get(this));
  }

  /** Returns the value of an enum property. */
  public <E extends Enum<E>> E enumValue(Map<Prop, Object> map,
      Class<E> type) {
    checkType(type);
    return this.typeValue(map.get(this));
  }

  @SuppressWarnings("unchecked")
  private <T> T typeValue(@Nullable Object o) {
    return (T) (o == null ? defaultValue : o);
  }

  /** Sets the value of a property, converting strings to the property's
   * type. */
  @SuppressWarnings({"rawtypes", "unchecked"})
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (value instanceof String) {
      final String s = (String) value;
      if (type.isEnum()) {
        Optional<Enum> optional =
            Enums.getIfPresent((Class<Enum>) type,
                s.toUpperCase(Locale.ROOT));
        if (!optional.isPresent()) {
          String values =
              Arrays.stream((Enum[]) type.getEnumConstants())
                  .map(e -> e.name().toLowerCase(Locale.ROOT))
                  .collect(Collectors.joining("', '", "'", "'"));
          throw new IllegalArgumentException("value of " + camelName
              + " must be one of: " + values);
        }
        set(map, optional.get());
        return;
      }
      if (type == Integer.class) {
        try {
          set(map, Integer.valueOf(s));
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException("value of " + camelName
              + " must be an integer: " + s, e);
        }
        return;
      }
      if (type == Boolean.class) {
        set(map, Boolean.valueOf(s));
        return;
      }
      if (type == File.class) {
        set(map, new File(s));
        return;
      }
    }
    set(map, value);
  }

  /** Sets the value of a property. Checks that its type is valid. A null
   * value removes the property, so that it reverts to its default. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new IllegalArgumentException("value for property " + camelName
            + " must have type " + type.getSimpleName());
      }
      map.put(this, value);
    }
  }
}

// End Prop.java
