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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Ordering;
import com.google.common.primitives.Ints;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import net.hydromatic.formc.ast.FormFile;
import net.hydromatic.formc.ast.IntegralType;
import net.hydromatic.formc.ast.Op;
import net.hydromatic.formc.ast.Shape;
import net.hydromatic.formc.ast.Side;
import net.hydromatic.formc.compile.Atom;
import net.hydromatic.formc.compile.CompiledForm;
import net.hydromatic.formc.compile.GeometrySymbol;
import net.hydromatic.formc.compile.GeometryTerm;
import net.hydromatic.formc.compile.IntegralPlan;
import net.hydromatic.formc.compile.Monomial;
import net.hydromatic.formc.compile.Prop;
import net.hydromatic.formc.compile.PsiTable;
import net.hydromatic.formc.compile.ReferenceFactor;
import net.hydromatic.formc.compile.ReferenceTensor;
import net.hydromatic.formc.compile.Sum;
import net.hydromatic.formc.compile.TermPlan;
import net.hydromatic.formc.element.Cell;
import net.hydromatic.formc.element.Domain;
import net.hydromatic.formc.element.Elements;
import net.hydromatic.formc.element.FiniteElement;
import net.hydromatic.formc.element.Polynomial;
import net.hydromatic.formc.util.Formats;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Generates the module for a form file: metadata, static tables, and one
 * procedure per form and integral type.
 *
 * <p>A generated procedure performs the same arithmetic as the kernel that
 * {@link net.hydromatic.formc.eval.Kernels} interprets from the same plans.
 * Output depends only on the input, so compiling the same file twice yields
 * identical text.
 */
public class CodeGenerator {
  /** Entries of a reference tensor whose magnitude is below this are
   * omitted, or written as zero, when optimizing. */
  static final double ZERO_TOLERANCE = 1e-14;

  /** Maximum number of characters in a string literal of an encoded
   * table. */
  static final int CHUNK_LENGTH = 8_192;

  /** Maximum number of Newton iterations that map a physical point to the
   * reference cell. */
  private static final int NEWTON_ITERATIONS = 32;

  /** Newton's method stops when the squared length of a step is below
   * this. */
  private static final String NEWTON_TOLERANCE = "1e-28";

  /** Number of reals on each line of an encoded table. */
  private static final int REALS_PER_LINE = 6;

  private final Language language;
  private final int precision;
  private final boolean optimize;

  public CodeGenerator(Language language, int precision, boolean optimize) {
    checkArgument(precision > 0, "precision must be positive: %s",
        precision);
    this.language = requireNonNull(language);
    this.precision = precision;
    this.optimize = optimize;
  }

  /** Creates a code generator configured by properties. */
  public static CodeGenerator of(Map<Prop, Object> props) {
    return new CodeGenerator(Prop.LANGUAGE.enumValue(props, Language.class),
        Prop.PRECISION.intValue(props), Prop.OPTIMIZE.booleanValue(props));
  }

  /**
   * Generates a module.
   *
   * @param file Form file
   * @param compiledForms Compiled forms of the file, in the order of
   *     {@link FormFile#FORM_NAMES}
   * @param sourceName Name of the source file, for the header comment
   */
  public GeneratedModule generate(FormFile file,
      List<CompiledForm> compiledForms, String sourceName) {
    final String moduleName = language.moduleName(file.name);
    final String fileName = language.fileName(file.name);
    final CodeWriter w = new CodeWriter();
    w.line("// " + fileName + " generated by formc from " + sourceName
        + "; do not edit");
    final String guard =
        "FORMC_" + Language.identifier(file.name).toUpperCase(Locale.ROOT)
            + "_H";
    switch (language) {
      case CPP:
        w.line("#ifndef " + guard)
            .line("#define " + guard)
            .line("")
            .line("#include <cmath>")
            .line("")
            .line("namespace " + moduleName + " {")
            .line("");
        break;
      default:
        w.begin("public final class " + moduleName)
            .line("private " + moduleName + "() {}")
            .line("");
        decoders(w);
    }

    w.line(
        language.intConstant("FORMC_CONTRACT_VERSION",
            FormMetadata.CONTRACT_VERSION));
    if (file.element != null) {
      w.line("");
      basisFunctions(w, file.element);
      elementMetadata(w, file.element);
    }
    for (CompiledForm compiledForm : compiledForms) {
      w.line("");
      formMetadata(w, FormMetadata.of(compiledForm));
      for (IntegralType type : compiledForm.integralTypes()) {
        w.line("");
        procedure(w, new Procedure(compiledForm, type));
      }
    }

    switch (language) {
      case CPP:
        w.line("")
            .line("}  // namespace " + moduleName)
            .line("")
            .line("#endif  // " + guard);
        break;
      default:
        w.end();
    }
    return new GeneratedModule(fileName, language, w.toString());
  }

  private String real(double v) {
    return Formats.real(v, precision);
  }

  // Metadata ----------------------------------------------------------------

  private void beginStruct(CodeWriter w, String name) {
    if (language == Language.CPP) {
      w.begin("struct " + name);
    } else {
      w.begin("public static final class " + name)
          .line("private " + name + "() {}");
    }
  }

  private void endStruct(CodeWriter w) {
    w.end(language == Language.CPP ? ";" : "");
  }

  private void intArray(CodeWriter w, String name, List<Integer> values) {
    if (!values.isEmpty()) {
      final int[] ints = new int[values.size()];
      for (int i = 0; i < ints.length; i++) {
        ints[i] = values.get(i);
      }
      w.line(language.intArrayConstant(name, ints));
    }
  }

  /** Writes the metadata of the element that drives the file. The caller
   * builds the dof map; it is not part of the metadata. */
  private void elementMetadata(CodeWriter w, FiniteElement element) {
    final Cell cell = element.cell();
    beginStruct(w, "element_metadata");
    w.line(language.intConstant("spatial_dimension", cell.dimension()))
        .line(language.intConstant("topological_dimension", cell.dimension()))
        .line(language.intConstant("value_rank", element.valueShape.rank()));
    intArray(w, "value_shape", element.valueShape.dims);
    w.line(language.intConstant("local_dimension", element.spaceDimension()))
        .line(language.stringConstant("family", element.family.displayName))
        .line(language.intConstant("degree", element.degree))
        .line(language.stringConstant("cell", cell.lowerName()))
        .line(language.stringConstant("signature", element.toString()))
        .line("// dofs are numbered by the caller");
    evaluateBasis(w, element);
    endStruct(w);
  }

  private void formMetadata(CodeWriter w, FormMetadata metadata) {
    beginStruct(w, metadata.name + "_metadata");
    w.line(language.intConstant("contract_version",
            FormMetadata.CONTRACT_VERSION))
        .line(language.stringConstant("name", metadata.name))
        .line(language.intConstant("rank", metadata.rank));
    intArray(w, "argument_dimensions", metadata.argumentDimensions);
    final List<Integer> ranks = new ArrayList<>();
    for (Shape shape : metadata.argumentValueShapes) {
      ranks.add(shape.rank());
    }
    intArray(w, "argument_value_ranks", ranks);
    for (int i = 0; i < metadata.argumentValueShapes.size(); i++) {
      intArray(w, "argument_" + i + "_value_shape",
          metadata.argumentValueShapes.get(i).dims);
    }
    w.line(language.intConstant("coefficient_count",
        metadata.coefficientNames.size()));
    intArray(w, "coefficient_dimensions", metadata.coefficientDimensions);
    for (int i = 0; i < metadata.coefficientNames.size(); i++) {
      w.line(language.stringConstant("coefficient_" + i + "_name",
          metadata.coefficientNames.get(i)));
    }
    w.line(language.intConstant("geometric_dimension",
            metadata.geometricDimension))
        .line(language.intConstant("topological_dimension",
            metadata.topologicalDimension))
        .line(language.stringConstant("cell", metadata.cell.lowerName()));
    metadata.subdomainIds.forEach((type, ids) -> {
      intArray(w, type.procedureSuffix + "_subdomain_ids", ids);
      w.line(language.intConstant(type.procedureSuffix + "_buffer_length",
          metadata.bufferLength(type)));
    });
    endStruct(w);
  }

  // Basis evaluation --------------------------------------------------------

  /** Writes the tables and helper functions that evaluate the basis of an
   * element, and its reference derivatives, at a point of the reference
   * cell; and a function that maps a physical point back to the reference
   * cell. */
  private void basisFunctions(CodeWriter w, FiniteElement element) {
    final Language l = language;
    final int d = element.cell().dimension();
    final FiniteElement coordinateElement =
        Elements.coordinateElement(element.domain);
    final int m = basisTables(w, "element", element);
    final int mc = basisTables(w, "element_coordinate", coordinateElement);
    w.line("");

    w.begin(
            l.functionHeader("double", "element_monomial", false,
                l.doubleArrayParameter("e", false),
                l.intArrayParameter("counts"),
                l.doubleArrayParameter("X", false)))
        .line("double v = 1.0;")
        .begin("for (int a = 0; a < " + d + "; a++)")
        .line("int p = (int) e[a];")
        .begin("for (int c = 0; c < counts[a]; c++)")
        .line("v *= p;")
        .line("--p;")
        .end()
        .begin("for (int c = 0; c < p; c++)")
        .line("v *= X[a];")
        .end()
        .end()
        .line("return v;")
        .end()
        .line("");
    basisFunction(w, "element", m);
    basisFunction(w, "element_coordinate", mc);

    // Newton's method; one step is exact on an affine cell.
    w.begin(
            l.functionHeader("void", "element_reference_point", false,
                l.doubleArrayParameter("X", true),
                l.doubleArrayParameter("K", true),
                l.doubleArrayParameter("x", false),
                l.doubleArrayParameter("coordinate_dofs", false)))
        .line(l.intArray("counts", d))
        .line(l.array("J", d * d))
        .line(l.array("y", d))
        .begin("for (int iteration = 0; iteration < " + NEWTON_ITERATIONS
            + "; iteration++)")
        .begin("for (int k = 0; k < " + d * d + "; k++)")
        .line("J[k] = 0.0;")
        .end()
        .begin("for (int i = 0; i < " + d + "; i++)")
        .line("y[i] = 0.0;")
        .end()
        .begin("for (int r = 0; r < "
            + coordinateElement.scalarDimension() + "; r++)")
        .line(l.constDouble("phi", "element_coordinate_basis(r, counts, X)"))
        .begin("for (int i = 0; i < " + d + "; i++)")
        .line("y[i] += phi * coordinate_dofs[r * " + d + " + i];")
        .end()
        .begin("for (int a = 0; a < " + d + "; a++)")
        .line("counts[a] = 1;")
        .line(l.constDouble("dphi",
            "element_coordinate_basis(r, counts, X)"))
        .line("counts[a] = 0;")
        .begin("for (int i = 0; i < " + d + "; i++)")
        .line("J[i * " + d + " + a] += dphi * coordinate_dofs[r * " + d
            + " + i];")
        .end()
        .end()
        .end();
    inverse(w, d);
    w.line("double step = 0.0;")
        .begin("for (int a = 0; a < " + d + "; a++)")
        .line("double dX = 0.0;")
        .begin("for (int i = 0; i < " + d + "; i++)")
        .line("dX += K[a * " + d + " + i] * (x[i] - y[i]);")
        .end()
        .line("X[a] += dX;")
        .line("step += dX * dX;")
        .end()
        .begin("if (step < " + NEWTON_TOLERANCE + ")")
        .line("return;")
        .end()
        .end()
        .end()
        .line("");

    // Values are indexed [component][derivative]; derivative t has
    // direction (t / d^j) % d in position j.
    final int s = element.scalarDimension();
    final int vs = element.valueShape.size();
    w.begin(
            l.functionHeader("void", "element_basis_derivatives", false,
                "int i", "int n", l.doubleArrayParameter("values", true),
                "int offset", l.doubleArrayParameter("X", false),
                l.doubleArrayParameter("K", false)))
        .line(l.intArray("counts", d))
        .line("int num = 1;")
        .begin("for (int j = 0; j < n; j++)")
        .line("num *= " + d + ";")
        .end()
        .begin("for (int t = 0; t < " + vs + " * num; t++)")
        .line("values[offset + t] = 0.0;")
        .end()
        .begin("for (int t = 0; t < num; t++)")
        .line("double sum = 0.0;")
        .begin("for (int u = 0; u < num; u++)")
        .begin("for (int a = 0; a < " + d + "; a++)")
        .line("counts[a] = 0;")
        .end()
        .line("double k = 1.0;")
        .line("int tt = t;")
        .line("int uu = u;")
        .begin("for (int j = 0; j < n; j++)")
        .line("k *= K[(uu % " + d + ") * " + d + " + tt % " + d + "];")
        .line("counts[uu % " + d + "]++;")
        .line("tt /= " + d + ";")
        .line("uu /= " + d + ";")
        .end()
        .line("sum += k * element_basis(i % " + s + ", counts, X);")
        .end()
        .line("values[offset + (i / " + s + ") * num + t] = sum;")
        .end()
        .end()
        .line("");
  }

  /** Writes the coefficient and exponent tables of the scalar basis of an
   * element, and returns the number of monomials. */
  private int basisTables(CodeWriter w, String prefix,
      FiniteElement element) {
    final SortedSet<List<Integer>> exponents =
        new TreeSet<>(Polynomial.EXPONENT_ORDERING);
    for (int i = 0; i < element.scalarDimension(); i++) {
      exponents.addAll(element.scalarBasis(i).terms().keySet());
    }
    final List<List<Integer>> monomials = ImmutableList.copyOf(exponents);
    final int d = element.cell().dimension();
    final double[][] coefficients =
        new double[element.scalarDimension()][monomials.size()];
    for (int i = 0; i < coefficients.length; i++) {
      for (int k = 0; k < monomials.size(); k++) {
        coefficients[i][k] =
            element.scalarBasis(i).coefficient(Ints.toArray(monomials.get(k)));
      }
    }
    final double[][] powers = new double[monomials.size()][d];
    for (int k = 0; k < monomials.size(); k++) {
      for (int a = 0; a < d; a++) {
        powers[k][a] = monomials.get(k).get(a);
      }
    }
    table(w, prefix + "_C", coefficients);
    table(w, prefix + "_E", powers);
    return monomials.size();
  }

  /** Writes a function that evaluates a reference derivative of scalar
   * basis function {@code i}. */
  private void basisFunction(CodeWriter w, String prefix, int monomials) {
    w.begin(
            language.functionHeader("double", prefix + "_basis", false,
                "int i", language.intArrayParameter("counts"),
                language.doubleArrayParameter("X", false)))
        .line("double v = 0.0;")
        .begin("for (int k = 0; k < " + monomials + "; k++)")
        .line("v += " + prefix + "_C[i][k] * element_monomial(" + prefix
            + "_E[k], counts, X);")
        .end()
        .line("return v;")
        .end()
        .line("");
  }

  /** Writes statements that set {@code K} to the inverse of the matrix
   * {@code J}; both are stored row by row. */
  private void inverse(CodeWriter w, int d) {
    switch (d) {
      case 1:
        w.line("K[0] = 1.0 / J[0];");
        break;
      case 2:
        w.line(language.constDouble("det", "J[0] * J[3] - J[1] * J[2]"))
            .line("K[0] = J[3] / det;")
            .line("K[1] = -J[1] / det;")
            .line("K[2] = -J[2] / det;")
            .line("K[3] = J[0] / det;");
        break;
      case 3:
        final StringBuilder det = new StringBuilder();
        for (int a = 0; a < 3; a++) {
          if (a > 0) {
            det.append(" + ");
          }
          det.append("J[").append(a).append("] * (")
              .append(cofactor(0, a)).append(')');
        }
        w.line(language.constDouble("det", det.toString()));
        for (int a = 0; a < 3; a++) {
          for (int i = 0; i < 3; i++) {
            w.line("K[" + (a * 3 + i) + "] = (" + cofactor(i, a)
                + ") / det;");
          }
        }
        break;
      default:
        throw new AssertionError(d);
    }
  }

  /** Returns the cofactor of entry (i, a) of a 3 by 3 matrix {@code J}. */
  private static String cofactor(int i, int a) {
    final int i1 = (i + 1) % 3;
    final int i2 = (i + 2) % 3;
    final int a1 = (a + 1) % 3;
    final int a2 = (a + 2) % 3;
    return "J[" + (i1 * 3 + a1) + "] * J[" + (i2 * 3 + a2) + "] - J["
        + (i1 * 3 + a2) + "] * J[" + (i2 * 3 + a1) + "]";
  }

  /** Writes the functions, members of the element's metadata, that
   * evaluate basis functions and their derivatives at a physical point.
   *
   * <p>The derivatives of order {@code n} of basis function {@code i} fill
   * {@code values[c * d^n + t]}, for each value component {@code c} and
   * each combination {@code t} of {@code n} physical directions. */
  private void evaluateBasis(CodeWriter w, FiniteElement element) {
    final Language l = language;
    final int d = element.cell().dimension();
    final int vs = element.valueShape.size();
    final String values = l.doubleArrayParameter("values", true);
    final String x = l.doubleArrayParameter("x", false);
    final String coordinateDofs =
        l.doubleArrayParameter("coordinate_dofs", false);
    final String referencePoint =
        "element_reference_point(X, K, x, coordinate_dofs);";
    w.line("")
        .begin(
            l.functionHeader("void", "evaluate_basis", true, "int i", values,
                x, coordinateDofs))
        .line(l.array("X", d))
        .line(l.array("K", d * d))
        .line(referencePoint)
        .line("element_basis_derivatives(i, 0, values, 0, X, K);")
        .end()
        .line("")
        .begin(
            l.functionHeader("void", "evaluate_basis_all", true, values, x,
                coordinateDofs))
        .line(l.array("X", d))
        .line(l.array("K", d * d))
        .line(referencePoint)
        .begin("for (int i = 0; i < " + element.spaceDimension() + "; i++)")
        .line("element_basis_derivatives(i, 0, values, i * " + vs
            + ", X, K);")
        .end()
        .end()
        .line("")
        .begin(
            l.functionHeader("void", "evaluate_basis_derivatives", true,
                "int i", "int n", values, x, coordinateDofs))
        .line(l.array("X", d))
        .line(l.array("K", d * d))
        .line(referencePoint)
        .line("element_basis_derivatives(i, n, values, 0, X, K);")
        .end()
        .line("")
        .begin(
            l.functionHeader("void", "evaluate_basis_derivatives_all", true,
                "int n", values, x, coordinateDofs))
        .line(l.array("X", d))
        .line(l.array("K", d * d))
        .line(referencePoint)
        .line("int num = 1;")
        .begin("for (int j = 0; j < n; j++)")
        .line("num *= " + d + ";")
        .end()
        .begin("for (int i = 0; i < " + element.spaceDimension() + "; i++)")
        .line("element_basis_derivatives(i, n, values, i * " + vs
            + " * num, X, K);")
        .end()
        .end();
  }

  // Tables ------------------------------------------------------------------

  /** Writes a static table of one, two or three dimensions. */
  private void table(CodeWriter w, String name, Object values) {
    final String declaration = language.table(name, dims(values));
    if (language.encodesTables) {
      encodedTable(w, declaration, values);
    } else if (values instanceof double[]) {
      w.line(declaration + " " + row((double[]) values) + ";");
    } else {
      w.begin(declaration);
      for (Object o : (Object[]) values) {
        rows(w, o);
      }
      w.end(";");
    }
  }

  private void rows(CodeWriter w, Object values) {
    if (values instanceof double[]) {
      w.line(row((double[]) values) + ",");
    } else {
      w.begin("");
      for (Object o : (Object[]) values) {
        rows(w, o);
      }
      w.end(",");
    }
  }

  /** Writes the methods that decode tables written by
   * {@link #encodedTable}. */
  private static void decoders(CodeWriter w) {
    w.begin("private static double[] decode(String[] chunks)")
        .line("final StringBuilder b = new StringBuilder();")
        .begin("for (String chunk : chunks)")
        .line("b.append(chunk).append(' ');")
        .end()
        .line("final String s = b.toString().trim();")
        .begin("if (s.isEmpty())")
        .line("return new double[0];")
        .end()
        .line("final String[] tokens = s.split(\" +\");")
        .line("final double[] values = new double[tokens.length];")
        .begin("for (int i = 0; i < tokens.length; i++)")
        .line("values[i] = Double.parseDouble(tokens[i]);")
        .end()
        .line("return values;")
        .end()
        .line("")
        .begin("private static double[] table1(String... chunks)")
        .line("return decode(chunks);")
        .end()
        .line("")
        .begin("private static double[][] table2(int n0, int n1, "
            + "String... chunks)")
        .line("final double[] values = decode(chunks);")
        .line("final double[][] table = new double[n0][n1];")
        .begin("for (int i = 0; i < n0; i++)")
        .line("System.arraycopy(values, i * n1, table[i], 0, n1);")
        .end()
        .line("return table;")
        .end()
        .line("")
        .begin("private static double[][][] table3(int n0, int n1, int n2, "
            + "String... chunks)")
        .line("final double[] values = decode(chunks);")
        .line("final double[][][] table = new double[n0][n1][n2];")
        .begin("for (int i = 0; i < n0; i++)")
        .begin("for (int j = 0; j < n1; j++)")
        .line("System.arraycopy(values, (i * n1 + j) * n2, table[i][j], 0, "
            + "n2);")
        .end()
        .end()
        .line("return table;")
        .end()
        .line("");
  }

  /** Writes a static table as string literals that the module decodes
   * when it is loaded.
   *
   * <p>Each literal holds at most {@link #CHUNK_LENGTH} characters; the
   * class file format limits a string constant to 65,535 bytes. */
  private void encodedTable(CodeWriter w, String declaration,
      Object values) {
    final int[] dims = dims(values);
    final List<String> reals = new ArrayList<>();
    flatten(values, reals);

    // Group the numbers into lines, and the lines into chunks.
    final List<List<String>> chunks = new ArrayList<>();
    List<String> chunk = new ArrayList<>();
    int chunkLength = 0;
    for (int i = 0; i < reals.size(); i += REALS_PER_LINE) {
      final String line =
          String.join(" ",
              reals.subList(i, Math.min(i + REALS_PER_LINE, reals.size())));
      if (!chunk.isEmpty() && chunkLength + line.length() > CHUNK_LENGTH) {
        chunks.add(chunk);
        chunk = new ArrayList<>();
        chunkLength = 0;
      }
      chunk.add(line);
      chunkLength += line.length() + 1;
    }
    if (!chunk.isEmpty()) {
      chunks.add(chunk);
    }

    final StringBuilder call =
        new StringBuilder("table").append(dims.length).append('(');
    for (int i = 0; dims.length > 1 && i < dims.length; i++) {
      if (i > 0) {
        call.append(", ");
      }
      call.append(dims[i]);
    }
    w.line(declaration).indent(2);
    if (chunks.isEmpty()) {
      w.line(call.append(");").toString()).indent(-2);
      return;
    }
    w.line(call.append(dims.length > 1 ? "," : "").toString()).indent(2);
    for (int c = 0; c < chunks.size(); c++) {
      final List<String> lines = chunks.get(c);
      for (int i = 0; i < lines.size(); i++) {
        if (i < lines.size() - 1) {
          w.line("\"" + lines.get(i) + " \" +");
        } else if (c < chunks.size() - 1) {
          w.line("\"" + lines.get(i) + "\",");
        } else {
          w.line("\"" + lines.get(i) + "\");");
        }
      }
    }
    w.indent(-4);
  }

  private void flatten(Object values, List<String> reals) {
    if (values instanceof double[]) {
      for (double v : (double[]) values) {
        reals.add(real(v));
      }
    } else {
      for (Object o : (Object[]) values) {
        flatten(o, reals);
      }
    }
  }

  private String row(double[] values) {
    final StringBuilder b = new StringBuilder("{");
    for (int i = 0; i < values.length; i++) {
      if (i > 0) {
        b.append(", ");
      }
      b.append(real(values[i]));
    }
    return b.append('}').toString();
  }

  private static int[] dims(Object values) {
    final List<Integer> dims = new ArrayList<>();
    Object o = values;
    while (o instanceof Object[]) {
      dims.add(((Object[]) o).length);
      o = ((Object[]) o)[0];
    }
    dims.add(((double[]) o).length);
    return dims.stream().mapToInt(Integer::intValue).toArray();
  }

  private static double[][][] psiValues(PsiTable table, int facetCount) {
    final double[][][] values =
        new double[facetCount][table.pointCount()][table.dofCount()];
    for (int f = 0; f < facetCount; f++) {
      for (int p = 0; p < table.pointCount(); p++) {
        for (int dof = 0; dof < table.dofCount(); dof++) {
          values[f][p][dof] = table.value(f, p, dof);
        }
      }
    }
    return values;
  }

  // Procedures --------------------------------------------------------------

  private void procedure(CodeWriter w, Procedure p) {
    final Cell cell = p.domain.cell;
    if (p.type.isFacet() && p.d >= 2) {
      final double[][][] tangents = new double[cell.facetCount()][][];
      for (int f = 0; f < tangents.length; f++) {
        tangents[f] = cell.facetTangents(f);
      }
      table(w, p.name + "_T", tangents);
    }
    if (p.usesNormal) {
      final double[][] normals = new double[cell.facetCount()][];
      for (int f = 0; f < normals.length; f++) {
        normals[f] = cell.referenceFacetNormal(f);
      }
      table(w, p.name + "_NR", normals);
    }
    for (IntegralPlan plan : p.compiledForm.plans(p.type)) {
      for (int t = 0; t < plan.terms.size(); t++) {
        termTables(w, termName(p, plan, t), plan.terms.get(t));
      }
    }

    w.begin(language.procedureHeader(p.name, p.type));
    w.begin("for (int i = 0; i < " + p.bufferLength + "; i++)")
        .line("A[i] = 0.0;")
        .end();
    if (p.domain.isAffine()) {
      for (int c = 0; c < p.cellCount; c++) {
        affineJacobian(w, p, c);
        inverse(w, p, c);
      }
      facetGeometry(w, p, p.usesNormal);
    }
    w.begin("switch (subdomain_id)");
    for (IntegralPlan plan : p.compiledForm.plans(p.type)) {
      w.begin("case " + plan.subdomainId + ":");
      for (int t = 0; t < plan.terms.size(); t++) {
        final TermPlan term = plan.terms.get(t);
        w.line("// " + term.representation.name().toLowerCase(Locale.ROOT)
            + ", degree " + term.degree + ": " + term.integral);
        w.begin("");
        if (term instanceof TermPlan.TensorTerm) {
          tensorTerm(w, p, termName(p, plan, t), (TermPlan.TensorTerm) term);
        } else {
          new QuadratureWriter(w, p, termName(p, plan, t),
              (TermPlan.QuadratureTerm) term).write();
        }
        w.end();
      }
      w.line("return true;");
      w.end();
    }
    w.line("default:")
        .indent(1)
        .line("return false;")
        .indent(-1);
    w.end();
    w.end();
  }

  private static String termName(Procedure p, IntegralPlan plan, int t) {
    return p.name + "_" + plan.subdomainId + "_" + t;
  }

  private void termTables(CodeWriter w, String termName, TermPlan term) {
    if (term instanceof TermPlan.TensorTerm) {
      final List<ReferenceTensor> tensors =
          ((TermPlan.TensorTerm) term).tensors;
      for (int s = 0; s < tensors.size(); s++) {
        final ReferenceTensor tensor = tensors.get(s);
        if (unrolls(tensor)) {
          continue; // entries are written inline
        }
        final double[][] values = new double[tensor.facetCount()][];
        for (int f = 0; f < values.length; f++) {
          values[f] = tensor.values(f);
          if (optimize) {
            for (int i = 0; i < values[f].length; i++) {
              if (Math.abs(values[f][i]) < ZERO_TOLERANCE) {
                values[f][i] = 0d;
              }
            }
          }
        }
        table(w, termName + "_A0_" + s, values);
      }
    } else {
      final TermPlan.QuadratureTerm quadratureTerm =
          (TermPlan.QuadratureTerm) term;
      table(w, termName + "_W", quadratureTerm.rules.get(0).weights());
      for (int k = 0; k < quadratureTerm.tables.size(); k++) {
        table(w, termName + "_FE" + k,
            psiValues(quadratureTerm.tables.get(k),
                quadratureTerm.rules.size()));
      }
    }
  }

  // Geometry ----------------------------------------------------------------

  private static String jacobian(int c, int i, int a) {
    return "J" + c + "_" + i + a;
  }

  private static String inverseJacobian(int c, int a, int i) {
    return "K" + c + "_" + a + i;
  }

  /** Declares the Jacobian of an affine cell, computed from its
   * vertices. */
  private void affineJacobian(CodeWriter w, Procedure p, int c) {
    final String cd = p.coordinateDofs(c);
    for (int i = 0; i < p.d; i++) {
      for (int a = 0; a < p.d; a++) {
        w.line(language.constDouble(jacobian(c, i, a),
            cd + "[" + ((a + 1) * p.d + i) + "] - " + cd + "[" + i + "]"));
      }
    }
  }

  /** Declares the Jacobian of a cell at quadrature point {@code ip},
   * computed from the derivatives of the coordinate element. */
  private void pointJacobian(CodeWriter w, Procedure p, int c,
      String termName, TermPlan.QuadratureTerm term) {
    final String cd = p.coordinateDofs(c);
    for (int i = 0; i < p.d; i++) {
      for (int a = 0; a < p.d; a++) {
        w.line("double " + jacobian(c, i, a) + " = 0.0;");
      }
    }
    w.begin("for (int r = 0; r < " + term.coordinateElement.spaceDimension()
        + "; r++)");
    for (int a = 0; a < p.d; a++) {
      final PsiTable table =
          term.table(term.coordinateElement, 0, ImmutableList.of(a));
      final String phi = termName + "_FE" + term.tableIndex(table)
          + "[" + p.facet(c) + "][ip][r]";
      for (int i = 0; i < p.d; i++) {
        w.line(jacobian(c, i, a) + " += " + cd + "[r * " + p.d + " + " + i
            + "] * " + phi + ";");
      }
    }
    w.end();
  }

  /** Declares the determinant and the inverse of the Jacobian of a
   * cell. */
  private void inverse(CodeWriter w, Procedure p, int c) {
    final String detJ = "detJ" + c;
    switch (p.d) {
      case 1:
        w.line(language.constDouble(detJ, jacobian(c, 0, 0)));
        w.line(language.constDouble(inverseJacobian(c, 0, 0),
            "1.0 / " + detJ));
        break;
      case 2:
        w.line(language.constDouble(detJ,
            jacobian(c, 0, 0) + " * " + jacobian(c, 1, 1) + " - "
                + jacobian(c, 0, 1) + " * " + jacobian(c, 1, 0)));
        w.line(language.constDouble(inverseJacobian(c, 0, 0),
            jacobian(c, 1, 1) + " / " + detJ));
        w.line(language.constDouble(inverseJacobian(c, 0, 1),
            "-" + jacobian(c, 0, 1) + " / " + detJ));
        w.line(language.constDouble(inverseJacobian(c, 1, 0),
            "-" + jacobian(c, 1, 0) + " / " + detJ));
        w.line(language.constDouble(inverseJacobian(c, 1, 1),
            jacobian(c, 0, 0) + " / " + detJ));
        break;
      case 3:
        // K[a][i] is the cofactor of J[i][a] divided by det J
        w.line(language.constDouble(detJ,
            jacobian(c, 0, 0) + " * " + minor(c, 1, 2, 1, 2) + " - "
                + jacobian(c, 0, 1) + " * " + minor(c, 1, 2, 0, 2) + " + "
                + jacobian(c, 0, 2) + " * " + minor(c, 1, 2, 0, 1)));
        for (int a = 0; a < 3; a++) {
          for (int i = 0; i < 3; i++) {
            final int r0 = i == 0 ? 1 : 0;
            final int r1 = i == 2 ? 1 : 2;
            final int c0 = a == 0 ? 1 : 0;
            final int c1 = a == 2 ? 1 : 2;
            w.line(language.constDouble(inverseJacobian(c, a, i),
                ((a + i) % 2 == 0 ? "" : "-") + minor(c, r0, r1, c0, c1)
                    + " / " + detJ));
          }
        }
        break;
      default:
        throw new AssertionError(p.d);
    }
    w.line(language.constDouble("det" + c,
        language.function(Op.ABS) + "(" + detJ + ")"));
  }

  private static String minor(int c, int r0, int r1, int c0, int c1) {
    return "(" + jacobian(c, r0, c0) + " * " + jacobian(c, r1, c1) + " - "
        + jacobian(c, r0, c1) + " * " + jacobian(c, r1, c0) + ")";
  }

  /** On facets, declares the facet scale factor {@code det_f} and, if
   * required, the outward normal of each cell. */
  private void facetGeometry(CodeWriter w, Procedure p,
      boolean normals) {
    if (!p.type.isFacet()) {
      return;
    }
    final String sqrt = language.function(Op.SQRT);
    final String f = p.facet(0);
    switch (p.d) {
      case 1:
        w.line(language.constDouble("det_f", "1.0"));
        break;
      case 2:
        for (int i = 0; i < 2; i++) {
          w.line(language.constDouble("t0_" + i,
              jacobian(0, i, 0) + " * " + p.name + "_T[" + f + "][0][0] + "
                  + jacobian(0, i, 1) + " * " + p.name + "_T[" + f
                  + "][0][1]"));
        }
        w.line(language.constDouble("det_f",
            sqrt + "(t0_0 * t0_0 + t0_1 * t0_1)"));
        break;
      default:
        for (int k = 0; k < 2; k++) {
          for (int i = 0; i < 3; i++) {
            final StringBuilder b = new StringBuilder();
            for (int a = 0; a < 3; a++) {
              if (a > 0) {
                b.append(" + ");
              }
              b.append(jacobian(0, i, a)).append(" * ").append(p.name)
                  .append("_T[").append(f).append("][").append(k)
                  .append("][").append(a).append(']');
            }
            w.line(language.constDouble("t" + k + "_" + i, b.toString()));
          }
        }
        w.line(language.constDouble("c_0", "t0_1 * t1_2 - t0_2 * t1_1"))
            .line(language.constDouble("c_1", "t0_2 * t1_0 - t0_0 * t1_2"))
            .line(language.constDouble("c_2", "t0_0 * t1_1 - t0_1 * t1_0"))
            .line(language.constDouble("det_f",
                sqrt + "(c_0 * c_0 + c_1 * c_1 + c_2 * c_2)"));
    }
    if (normals) {
      for (int c = 0; c < p.cellCount; c++) {
        normal(w, p, c);
      }
    }
  }

  /** Declares the outward unit normal of a cell's facet, the normalized
   * image of the reference normal under K transposed. */
  private void normal(CodeWriter w, Procedure p, int c) {
    final StringBuilder norm = new StringBuilder();
    for (int i = 0; i < p.d; i++) {
      final StringBuilder b = new StringBuilder();
      for (int a = 0; a < p.d; a++) {
        if (a > 0) {
          b.append(" + ");
        }
        b.append(inverseJacobian(c, a, i)).append(" * ").append(p.name)
            .append("_NR[").append(p.facet(c)).append("][").append(a)
            .append(']');
      }
      w.line(language.constDouble("nr" + c + "_" + i, b.toString()));
      if (i > 0) {
        norm.append(" + ");
      }
      norm.append("nr").append(c).append('_').append(i).append(" * nr")
          .append(c).append('_').append(i);
    }
    w.line(language.constDouble("nn" + c,
        language.function(Op.SQRT) + "(" + norm + ")"));
    for (int i = 0; i < p.d; i++) {
      w.line(language.constDouble("n" + c + "_" + i,
          "nr" + c + "_" + i + " / nn" + c));
    }
  }

  // Tensor representation ---------------------------------------------------

  private void tensorTerm(CodeWriter w, Procedure p, String termName,
      TermPlan.TensorTerm term) {
    final String f = p.facet(0);
    for (int s = 0; s < term.tensors.size(); s++) {
      final ReferenceTensor tensor = term.tensors.get(s);
      final String g = "G" + s;
      w.line(language.constDouble(g, geometry(tensor.geometry)));
      final int m = tensor.coefficientSize();
      final int n = tensor.size() / m;
      final String a0 = termName + "_A0_" + s;
      if (unrolls(tensor)) {
        if (p.type.isFacet()) {
          w.begin("switch (" + f + ")");
          for (int facet = 0; facet < tensor.facetCount(); facet++) {
            w.line("case " + facet + ":").indent(1);
            unrolled(w, tensor, facet, g);
            w.line("break;").indent(-1);
          }
          w.end();
        } else {
          unrolled(w, tensor, 0, g);
        }
      } else if (m == 1) {
        w.begin("for (int i = 0; i < " + n + "; i++)")
            .line("A[i] += " + a0 + "[" + f + "][i] * " + g + ";")
            .end();
      } else {
        final String wc = "wc" + s;
        w.line(language.array(wc, m));
        coefficientProducts(w, p, tensor, wc);
        w.begin("for (int i = 0; i < " + n + "; i++)")
            .line("double s = 0.0;")
            .begin("for (int j = 0; j < " + m + "; j++)")
            .line("s += " + a0 + "[" + f + "][i * " + m + " + j] * " + wc
                + "[j];")
            .end()
            .line("A[i] += s * " + g + ";")
            .end();
      }
    }
  }

  /** Returns whether the entries of a reference tensor are written inline.
   * Java methods may not exceed 64 KB of bytecode, so Java modules keep
   * every tensor in a table. */
  private boolean unrolls(ReferenceTensor tensor) {
    return optimize
        && !language.encodesTables
        && tensor.coefficientSize() == 1;
  }

  private void unrolled(CodeWriter w, ReferenceTensor tensor, int facet,
      String g) {
    for (int i = 0; i < tensor.size(); i++) {
      final double v = tensor.value(facet, i);
      if (Math.abs(v) >= ZERO_TOLERANCE) {
        w.line("A[" + i + "] += " + real(v) + " * " + g + ";");
      }
    }
  }

  /** Writes loops that fill {@code wc} with the products of the dofs of
   * the coefficient factors of a reference tensor, in row-major order. */
  private void coefficientProducts(CodeWriter w, Procedure p,
      ReferenceTensor tensor, String wc) {
    final List<ReferenceFactor> factors = new ArrayList<>();
    for (ReferenceFactor factor : tensor.factors) {
      if (factor.kind == ReferenceFactor.Kind.COEFFICIENT) {
        factors.add(factor);
      }
    }
    String index = "";
    final StringBuilder product = new StringBuilder();
    for (int k = 0; k < factors.size(); k++) {
      final ReferenceFactor factor = factors.get(k);
      final String j = "j" + k;
      w.begin("for (int " + j + " = 0; " + j + " < " + factor.dimension()
          + "; " + j + "++)");
      index = k == 0 ? j : "(" + index + ") * " + factor.dimension()
          + " + " + j;
      if (k > 0) {
        product.append(" * ");
      }
      product.append("w[")
          .append(p.compiledForm.coefficientIndex(factor.number))
          .append("][").append(j).append(']');
    }
    w.line(wc + "[" + index + "] = " + product + ";");
    for (int k = 0; k < factors.size(); k++) {
      w.end();
    }
  }

  /** Returns an expression for the sum of geometry terms. */
  private String geometry(List<GeometryTerm> terms) {
    if (terms.isEmpty()) {
      return "0.0";
    }
    final StringBuilder b = new StringBuilder();
    for (GeometryTerm term : terms) {
      if (b.length() > 0) {
        b.append(" + ");
      }
      b.append(real(term.coefficient));
      for (GeometrySymbol symbol : term.symbols) {
        b.append(" * ").append(symbol(symbol));
      }
    }
    return b.toString();
  }

  private static String symbol(GeometrySymbol symbol) {
    switch (symbol.kind) {
      case DET:
        return "det0";
      case FACET_DET:
        return "det_f";
      case K:
        return inverseJacobian(0, symbol.a, symbol.i);
      case N:
        return "n0_" + symbol.i;
      default:
        throw new AssertionError(symbol);
    }
  }

  // Quadrature representation -----------------------------------------------

  /** Writes the loop over the points of a term in quadrature
   * representation. */
  private class QuadratureWriter {
    final CodeWriter w;
    final Procedure p;
    final String termName;
    final TermPlan.QuadratureTerm term;
    /** Variable name of each atom, in the order the variables are
     * declared; the argument of a nonlinear atom precedes it. */
    final Map<Atom, String> names = new LinkedHashMap<>();

    QuadratureWriter(CodeWriter w, Procedure p, String termName,
        TermPlan.QuadratureTerm term) {
      this.w = requireNonNull(w);
      this.p = requireNonNull(p);
      this.termName = requireNonNull(termName);
      this.term = requireNonNull(term);
      register(term.integrand);
    }

    private void register(Sum sum) {
      for (Monomial monomial : sum.monomials) {
        for (Atom atom : monomial.atoms) {
          if (atom instanceof Atom.Nonlinear) {
            register(((Atom.Nonlinear) atom).argument);
          }
          if (!names.containsKey(atom)) {
            names.put(atom, name(atom));
          }
        }
      }
    }

    private String name(Atom atom) {
      switch (atom.kind) {
        case NORMAL:
          final Atom.Normal normal = (Atom.Normal) atom;
          return "n" + cell(normal.side) + "_" + normal.component;
        case COORDINATE:
          return "x_" + ((Atom.Coordinate) atom).component;
        case BASIS:
          return "b" + count(Atom.Kind.BASIS);
        case COEFFICIENT:
          return "wv" + count(Atom.Kind.COEFFICIENT);
        default:
          return "nl" + count(Atom.Kind.NONLINEAR);
      }
    }

    private int count(Atom.Kind kind) {
      int n = 0;
      for (Atom atom : names.keySet()) {
        if (atom.kind == kind) {
          ++n;
        }
      }
      return n;
    }

    private boolean uses(Atom.Kind kind) {
      return count(kind) > 0;
    }

    void write() {
      w.begin("for (int ip = 0; ip < " + term.pointCount() + "; ip++)");
      if (!p.domain.isAffine()) {
        for (int c = 0; c < p.cellCount; c++) {
          pointJacobian(w, p, c, termName, term);
          inverse(w, p, c);
        }
        facetGeometry(w, p, uses(Atom.Kind.NORMAL));
      }
      w.line(language.constDouble("scale", termName + "_W[ip] * "
          + (p.type.isFacet() ? "det_f" : "det0")));
      if (uses(Atom.Kind.COORDINATE)) {
        coordinates();
      }
      names.forEach((atom, name) -> {
        if (atom instanceof Atom.Coefficient) {
          coefficient((Atom.Coefficient) atom, name);
        }
      });
      names.forEach((atom, name) -> {
        if (atom instanceof Atom.Nonlinear) {
          nonlinear((Atom.Nonlinear) atom, name);
        }
      });
      names.forEach((atom, name) -> {
        if (atom instanceof Atom.Basis) {
          basis((Atom.Basis) atom, name);
        }
      });
      for (int m = 0; m < term.integrand.monomials.size(); m++) {
        accumulate(term.integrand.monomials.get(m), "f" + m);
      }
      w.end();
    }

    /** Declares the physical coordinates of the point, on the first
     * cell. */
    private void coordinates() {
      final PsiTable table =
          term.table(term.coordinateElement, 0, ImmutableList.of());
      final String phi = termName + "_FE" + term.tableIndex(table)
          + "[" + p.facet(0) + "][ip][r]";
      final String cd = p.coordinateDofs(0);
      for (int i = 0; i < p.d; i++) {
        w.line("double x_" + i + " = 0.0;");
      }
      w.begin("for (int r = 0; r < " + term.coordinateElement.spaceDimension()
          + "; r++)");
      for (int i = 0; i < p.d; i++) {
        w.line("x_" + i + " += " + cd + "[r * " + p.d + " + " + i + "] * "
            + phi + ";");
      }
      w.end();
    }

    private void coefficient(Atom.Coefficient atom, String name) {
      final FiniteElement element = atom.element();
      final int cell = cell(atom.side);
      final String dofs = "w["
          + p.compiledForm.coefficientIndex(atom.coefficient.count) + "]";
      w.line("double " + name + " = 0.0;");
      w.begin("for (int r = 0; r < " + element.spaceDimension() + "; r++)")
          .line(name + " += " + dofs + "[" + offset(element, cell) + "] * "
              + physical(element, atom.component, atom.derivatives, cell)
              + ";")
          .end();
    }

    private void nonlinear(Atom.Nonlinear atom, String name) {
      final String argument = name + "_x";
      w.line(language.constDouble(argument, expression(atom.argument)));
      final String value;
      switch (atom.function) {
        case POWER:
          value = language.pow(argument, real(atom.exponent));
          break;
        case SIGN:
          value = language.sign(argument);
          break;
        default:
          value = language.function(atom.function) + "(" + argument + ")";
      }
      w.line(language.constDouble(name, value));
    }

    private void basis(Atom.Basis atom, String name) {
      final int cell = cell(atom.side);
      final int n = atom.element.spaceDimension();
      w.line(language.array(name, p.interior() ? 2 * n : n));
      w.begin("for (int r = 0; r < " + n + "; r++)")
          .line(name + "[" + offset(atom.element, cell) + "] = "
              + physical(atom.element, atom.component, atom.derivatives,
                  cell)
              + ";")
          .end();
    }

    private void accumulate(Monomial monomial, String f) {
      final StringBuilder b =
          new StringBuilder(real(monomial.coefficient)).append(" * scale");
      final List<String> vectors = new ArrayList<>();
      for (Atom atom : monomial.atoms) {
        if (atom instanceof Atom.Basis) {
          vectors.add(names.get(atom));
        } else {
          b.append(" * ").append(names.get(atom));
        }
      }
      w.line(language.constDouble(f, b.toString()));
      switch (vectors.size()) {
        case 0:
          w.line("A[0] += " + f + ";");
          break;
        case 1:
          w.begin("for (int i = 0; i < "
                  + p.compiledForm.argumentDimension(p.type, 0) + "; i++)")
              .line("A[i] += " + f + " * " + vectors.get(0) + "[i];")
              .end();
          break;
        default:
          final int n1 = p.compiledForm.argumentDimension(p.type, 1);
          w.begin("for (int i = 0; i < "
                  + p.compiledForm.argumentDimension(p.type, 0) + "; i++)")
              .begin("for (int j = 0; j < " + n1 + "; j++)")
              .line("A[i * " + n1 + " + j] += " + f + " * " + vectors.get(0)
                  + "[i] * " + vectors.get(1) + "[j];")
              .end()
              .end();
      }
    }

    /** Returns an expression for the value of a sum at the point. */
    private String expression(Sum sum) {
      if (sum.monomials.isEmpty()) {
        return "0.0";
      }
      final StringBuilder b = new StringBuilder();
      for (Monomial monomial : sum.monomials) {
        if (b.length() > 0) {
          b.append(" + ");
        }
        b.append(real(monomial.coefficient));
        for (Atom atom : monomial.atoms) {
          b.append(" * ").append(names.get(atom));
        }
      }
      return b.toString();
    }

    /** Returns an expression for a physical derivative of dof {@code r} of
     * an element, applying the chain rule
     * {@code d/dx_i = sum_a K[a][i] d/dX_a}. */
    private String physical(FiniteElement element, int component,
        List<Integer> derivatives, int cell) {
      final List<List<Integer>> directionLists = new ArrayList<>();
      for (int j = 0; j < derivatives.size(); j++) {
        final List<Integer> directions = new ArrayList<>();
        for (int a = 0; a < p.d; a++) {
          directions.add(a);
        }
        directionLists.add(directions);
      }
      final List<String> terms = new ArrayList<>();
      for (List<Integer> reference : Lists.cartesianProduct(directionLists)) {
        final StringBuilder b = new StringBuilder();
        for (int j = 0; j < reference.size(); j++) {
          b.append(inverseJacobian(cell, reference.get(j),
              derivatives.get(j))).append(" * ");
        }
        final PsiTable table = term.table(element, component,
            Ordering.<Integer>natural().immutableSortedCopy(reference));
        b.append(termName).append("_FE").append(term.tableIndex(table))
            .append('[').append(p.facet(cell)).append("][ip][r]");
        terms.add(b.toString());
      }
      return terms.size() == 1
          ? terms.get(0)
          : "(" + String.join(" + ", terms) + ")";
    }

    private String offset(FiniteElement element, int cell) {
      return p.interior() && cell > 0
          ? cell * element.spaceDimension() + " + r"
          : "r";
    }

    private int cell(@Nullable Side side) {
      return side == null ? 0 : side.cell;
    }
  }

  /** Properties of the procedure for one form and integral type. */
  private static class Procedure {
    final CompiledForm compiledForm;
    final IntegralType type;
    final String name;
    final Domain domain;
    final int d;
    /** Number of cells that the integration entity touches. */
    final int cellCount;
    final int bufferLength;
    final boolean usesNormal;

    Procedure(CompiledForm compiledForm, IntegralType type) {
      this.compiledForm = compiledForm;
      this.type = type;
      this.name = compiledForm.name + "_" + type.procedureSuffix;
      this.domain = compiledForm.form.domain;
      this.d = domain.dimension();
      this.cellCount = interior() ? 2 : 1;
      this.bufferLength = compiledForm.bufferLength(type);
      this.usesNormal = usesNormal(compiledForm, type);
    }

    private static boolean usesNormal(CompiledForm compiledForm,
        IntegralType type) {
      final boolean[] uses = {false};
      for (IntegralPlan plan : compiledForm.plans(type)) {
        for (TermPlan term : plan.terms) {
          if (term instanceof TermPlan.TensorTerm) {
            for (ReferenceTensor tensor
                : ((TermPlan.TensorTerm) term).tensors) {
              for (GeometryTerm geometryTerm : tensor.geometry) {
                for (GeometrySymbol symbol : geometryTerm.symbols) {
                  uses[0] |= symbol.kind == GeometrySymbol.Kind.N;
                }
              }
            }
          } else {
            ((TermPlan.QuadratureTerm) term).integrand.forEachAtom(atom ->
                uses[0] |= atom.kind == Atom.Kind.NORMAL);
          }
        }
      }
      return uses[0];
    }

    boolean interior() {
      return type == IntegralType.INTERIOR_FACET;
    }

    String coordinateDofs(int c) {
      return interior() ? "coordinate_dofs_" + c : "coordinate_dofs";
    }

    /** Returns the expression for the local facet of a cell, which indexes
     * per-facet tables; "0" for cell integrals. */
    String facet(int c) {
      switch (type) {
        case CELL:
          return "0";
        case EXTERIOR_FACET:
          return "facet";
        default:
          return "facet_" + c;
      }
    }
  }
}

// End CodeGenerator.java
