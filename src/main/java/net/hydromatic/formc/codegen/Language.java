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
package net.hydromatic.formc.codegen;

import java.util.Locale;
import net.hydromatic.formc.ast.IntegralType;
import net.hydromatic.formc.ast.Op;

/**
 * Language of generated code.
 *
 * <p>Each language knows the syntax of the few constructs that the
 * generator emits: constants, arrays, tables, math functions and procedure
 * headers. Generated numeric code is otherwise the same in every language.
 */
public enum Language {
  /** C++, as a header file with a namespace per module. */
  CPP(".h", false) {
    @Override
    public String moduleName(String stem) {
      return identifier(stem);
    }

    @Override
    String booleanType() {
      return "bool";
    }

    @Override
    String constDouble(String name, String value) {
      return "const double " + name + " = " + value + ";";
    }

    @Override
    String array(String name, int length) {
      return "double " + name + "[" + length + "] = {};";
    }

    @Override
    String intArray(String name, int length) {
      return "int " + name + "[" + length + "] = {};";
    }

    @Override
    String functionHeader(String returnType, String name, boolean exported,
        String... parameters) {
      return "static " + returnType + " " + name + "("
          + String.join(", ", parameters) + ")";
    }

    @Override
    String doubleArrayParameter(String name, boolean output) {
      return (output ? "double* " : "const double* ") + name;
    }

    @Override
    String intArrayParameter(String name) {
      return "const int* " + name;
    }

    @Override
    String table(String name, int... dims) {
      final StringBuilder b = new StringBuilder("static const double ")
          .append(name);
      for (int dim : dims) {
        b.append('[').append(dim).append(']');
      }
      return b.append(" =").toString();
    }

    @Override
    String intConstant(String name, int value) {
      return "static constexpr int " + name + " = " + value + ";";
    }

    @Override
    String intArrayConstant(String name, int[] values) {
      return "static constexpr int " + name + "[" + values.length + "] = "
          + ints(values) + ";";
    }

    @Override
    String stringConstant(String name, String value) {
      return "static constexpr const char* " + name + " = " + quote(value)
          + ";";
    }

    @Override
    String function(Op function) {
      return "std::" + functionName(function);
    }

    @Override
    String sign(String x) {
      return "(" + x + " > 0.0 ? 1.0 : (" + x + " < 0.0 ? -1.0 : 0.0))";
    }

    @Override
    String pow(String x, String exponent) {
      return "std::pow(" + x + ", " + exponent + ")";
    }

    @Override
    String procedureHeader(String name, IntegralType type) {
      switch (type) {
        case CELL:
          return "inline bool " + name + "(double* A, "
              + "const double* const* w, const double* coordinate_dofs, "
              + "int subdomain_id)";
        case EXTERIOR_FACET:
          return "inline bool " + name + "(double* A, "
              + "const double* const* w, const double* coordinate_dofs, "
              + "int facet, int subdomain_id)";
        default:
          return "inline bool " + name + "(double* A, "
              + "const double* const* w, const double* coordinate_dofs_0, "
              + "const double* coordinate_dofs_1, int facet_0, int facet_1, "
              + "int subdomain_id)";
      }
    }
  },

  /** Java, as a final class with static methods. */
  JAVA(".java", true) {
    @Override
    public String moduleName(String stem) {
      final String s = identifier(stem);
      return s.substring(0, 1).toUpperCase(Locale.ROOT) + s.substring(1);
    }

    @Override
    String booleanType() {
      return "boolean";
    }

    @Override
    String constDouble(String name, String value) {
      return "final double " + name + " = " + value + ";";
    }

    @Override
    String array(String name, int length) {
      return "final double[] " + name + " = new double[" + length + "];";
    }

    @Override
    String intArray(String name, int length) {
      return "final int[] " + name + " = new int[" + length + "];";
    }

    @Override
    String functionHeader(String returnType, String name, boolean exported,
        String... parameters) {
      return (exported ? "public" : "private") + " static " + returnType
          + " " + name + "(" + String.join(", ", parameters) + ")";
    }

    @Override
    String doubleArrayParameter(String name, boolean output) {
      return "double[] " + name;
    }

    @Override
    String intArrayParameter(String name) {
      return "int[] " + name;
    }

    @Override
    String table(String name, int... dims) {
      final StringBuilder b = new StringBuilder("private static final double");
      for (int ignored : dims) {
        b.append("[]");
      }
      return b.append(' ').append(name).append(" =").toString();
    }

    @Override
    String intConstant(String name, int value) {
      return "public static final int " + name + " = " + value + ";";
    }

    @Override
    String intArrayConstant(String name, int[] values) {
      return "public static final int[] " + name + " = " + ints(values)
          + ";";
    }

    @Override
    String stringConstant(String name, String value) {
      return "public static final String " + name + " = " + quote(value)
          + ";";
    }

    @Override
    String function(Op function) {
      return "Math." + functionName(function);
    }

    @Override
    String sign(String x) {
      return "Math.signum(" + x + ")";
    }

    @Override
    String pow(String x, String exponent) {
      return "Math.pow(" + x + ", " + exponent + ")";
    }

    @Override
    String procedureHeader(String name, IntegralType type) {
      switch (type) {
        case CELL:
          return "public static boolean " + name + "(double[] A, "
              + "double[][] w, double[] coordinate_dofs, int subdomain_id)";
        case EXTERIOR_FACET:
          return "public static boolean " + name + "(double[] A, "
              + "double[][] w, double[] coordinate_dofs, int facet, "
              + "int subdomain_id)";
        default:
          return "public static boolean " + name + "(double[] A, "
              + "double[][] w, double[] coordinate_dofs_0, "
              + "double[] coordinate_dofs_1, int facet_0, int facet_1, "
              + "int subdomain_id)";
      }
    }
  };

  /** Extension of generated files, including the dot. */
  public final String extension;

  /** Whether static tables are written as text and decoded when the module
   * is loaded. A Java class initializer may not exceed 64 KB of bytecode,
   * and initializing an array element by element costs about 10 bytes. */
  final boolean encodesTables;

  Language(String extension, boolean encodesTables) {
    this.extension = extension;
    this.encodesTables = encodesTables;
  }

  /** Returns the name of the module (namespace or class) generated from a
   * form file. */
  public abstract String moduleName(String stem);

  /** Returns the name of the file generated from a form file. */
  public String fileName(String stem) {
    return moduleName(stem) + extension;
  }

  abstract String booleanType();

  /** Declares and initializes a local constant. */
  abstract String constDouble(String name, String value);

  /** Declares a local array, initialized to zero. */
  abstract String array(String name, int length);

  /** Declares a local array of integers, initialized to zero. */
  abstract String intArray(String name, int length);

  /** Returns the header of a function that is not a kernel. An exported
   * function is part of the module's interface. */
  abstract String functionHeader(String returnType, String name,
      boolean exported, String... parameters);

  abstract String doubleArrayParameter(String name, boolean output);

  abstract String intArrayParameter(String name);

  /** Returns the start of the declaration of a static table. */
  abstract String table(String name, int... dims);

  abstract String intConstant(String name, int value);

  abstract String intArrayConstant(String name, int[] values);

  abstract String stringConstant(String name, String value);

  /** Returns the name of a nonlinear function other than
   * {@link Op#SIGN}. */
  abstract String function(Op function);

  /** Returns an expression for the sign of {@code x}. */
  abstract String sign(String x);

  abstract String pow(String x, String exponent);

  abstract String procedureHeader(String name, IntegralType type);

  private static String functionName(Op function) {
    switch (function) {
      case SQRT:
        return "sqrt";
      case EXP:
        return "exp";
      case LN:
        return "log";
      case SIN:
        return "sin";
      case COS:
        return "cos";
      case ABS:
        return "abs";
      default:
        throw new AssertionError(function);
    }
  }

  /** Converts a file name stem to a valid identifier. */
  static String identifier(String stem) {
    final StringBuilder b = new StringBuilder();
    for (int i = 0; i < stem.length(); i++) {
      final char c = stem.charAt(i);
      b.append(c < 128 && Character.isLetterOrDigit(c) ? c : '_');
    }
    if (b.length() == 0 || Character.isDigit(b.charAt(0))) {
      b.insert(0, '_');
    }
    return b.toString();
  }

  private static String ints(int[] values) {
    final StringBuilder b = new StringBuilder("{");
    for (int i = 0; i < values.length; i++) {
      if (i > 0) {
        b.append(", ");
      }
      b.append(values[i]);
    }
    return b.append('}').toString();
  }

  private static String quote(String s) {
    return '"' + s.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
  }
}

// End Language.java
