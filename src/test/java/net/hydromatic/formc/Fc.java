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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.fail;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.formc.ast.Form;
import net.hydromatic.formc.ast.FormFile;
import net.hydromatic.formc.ast.IntegralType;
import net.hydromatic.formc.codegen.GeneratedModule;
import net.hydromatic.formc.compile.CompileException;
import net.hydromatic.formc.compile.CompiledForm;
import net.hydromatic.formc.compile.Compiles;
import net.hydromatic.formc.compile.FormCompiler;
import net.hydromatic.formc.compile.Prop;
import net.hydromatic.formc.compile.Tracer;
import net.hydromatic.formc.compile.Tracers;
import net.hydromatic.formc.eval.CellGeometry;
import net.hydromatic.formc.eval.Kernel;
import net.hydromatic.formc.eval.Kernels;
import net.hydromatic.formc.parse.FormParseException;
import net.hydromatic.formc.parse.FormParser;
import net.hydromatic.formc.util.FormcException;
import org.hamcrest.Matcher;

/**
 * Fluent test fixture: a form file, the options to compile it with, and
 * assertions about the result.
 */
public class Fc {
  private final String fileName;
  private final String source;
  private final Map<Prop, Object> propMap;
  private final Tracer tracer;

  Fc(String fileName, String source, Map<Prop, Object> propMap,
      Tracer tracer) {
    this.fileName = fileName;
    this.source = source;
    this.propMap = ImmutableMap.copyOf(propMap);
    this.tracer = tracer;
  }

  /** Creates an {@code Fc} whose lines are joined with newlines. */
  public static Fc fc(String... lines) {
    return new Fc("test.form", String.join("\n", lines) + "\n",
        ImmutableMap.of(), Tracers.empty());
  }

  /** Compiles a form built in Java, not parsed. */
  public static CompiledForm compile(Form form, Map<Prop, Object> propMap) {
    return new FormCompiler(propMap, Tracers.empty())
        .compile("a", form, w -> fail("unexpected warning " + w));
  }

  /** Computes the local tensor of a form's integrals of one type and
   * subdomain. */
  public static double[] tabulate(CompiledForm compiledForm, IntegralType type,
      double[][] w, CellGeometry[] cells, int[] facets, int subdomainId) {
    final Kernel kernel = Kernels.of(compiledForm, type);
    final double[] a = new double[kernel.bufferLength()];
    assertThat(kernel.tabulate(a, w, cells, facets, subdomainId), is(true));
    return a;
  }

  /** Computes the local tensor of a form's cell integrals on the reference
   * cell. */
  public static double[] tabulateReference(CompiledForm compiledForm,
      double[]... w) {
    final CellGeometry cell =
        CellGeometry.reference(compiledForm.form.domain);
    return tabulate(compiledForm, IntegralType.CELL, w,
        new CellGeometry[] {cell}, new int[] {0}, 0);
  }

  public Fc withFileName(String fileName) {
    return new Fc(fileName, source, propMap, tracer);
  }

  public Fc with(Prop prop, Object value) {
    final Map<Prop, Object> map = new LinkedHashMap<>(propMap);
    prop.set(map, value);
    return new Fc(fileName, source, map, tracer);
  }

  public Fc withTracer(Tracer tracer) {
    return new Fc(fileName, source, propMap, tracer);
  }

  public FormFile parse() {
    return FormParser.parse(fileName, source);
  }

  public List<CompiledForm> compileForms(List<CompileException> warnings) {
    return Compiles.compileForms(parse(), propMap, warnings::add, tracer);
  }

  /** Compiles the file and returns one of its forms. Fails if there are
   * warnings. */
  public CompiledForm compiledForm(String formName) {
    final List<CompileException> warnings = new ArrayList<>();
    final List<CompiledForm> compiledForms = compileForms(warnings);
    assertThat(warnings.isEmpty(), is(true));
    for (CompiledForm compiledForm : compiledForms) {
      if (compiledForm.name.equals(formName)) {
        return compiledForm;
      }
    }
    throw new AssertionError("form " + formName + " not found");
  }

  public GeneratedModule generate() {
    return Compiles.compile(parse(), fileName, propMap,
        w -> fail("unexpected warning " + w), tracer);
  }

  public Fc withCompileExceptionMatcher(Matcher<CompileException> matcher) {
    return withTracer(
        Tracers.withOnCompileException(tracer, e -> assertThat(e, matcher)));
  }

  /** Compiles the file, ignoring warnings, and hands any compile exception
   * to the tracer. */
  public Fc assertCompile() {
    final FormFile file = parse();
    try {
      Compiles.compile(file, fileName, propMap, w -> { }, tracer);
      tracer.handleCompileException(null);
    } catch (CompileException e) {
      if (!tracer.handleCompileException(e)) {
        throw e;
      }
    }
    return this;
  }

  public Fc assertParse(Matcher<FormFile> matcher) {
    assertThat(parse(), matcher);
    return this;
  }

  /** Checks that parsing or compiling fails, and that the one-line
   * description of the error matches. */
  public Fc assertError(Matcher<String> matcher) {
    try {
      final GeneratedModule module = generate();
      fail("expected error, got " + module.fileName);
    } catch (CompileException | FormParseException e) {
      final String description =
          ((FormcException) e).describeTo(new StringBuilder()).toString();
      assertThat(description, matcher);
    }
    return this;
  }

  public Fc assertWarnings(Matcher<List<CompileException>> matcher) {
    final List<CompileException> warnings = new ArrayList<>();
    compileForms(warnings);
    assertThat(warnings, matcher);
    return this;
  }

  /** Checks the local tensor of a form's cell integrals on the reference
   * cell. */
  public Fc assertReferenceTensor(String formName, Matcher<double[]> matcher,
      double[]... w) {
    assertThat(tabulateReference(compiledForm(formName), w), matcher);
    return this;
  }

  public Fc assertGenerated(Matcher<String> matcher) {
    assertThat(generate().text, matcher);
    return this;
  }
}

// End Fc.java
