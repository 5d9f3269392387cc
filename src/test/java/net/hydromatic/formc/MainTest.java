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

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.File;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Map;
import net.hydromatic.formc.codegen.Language;
import net.hydromatic.formc.compile.Prop;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests the command-line driver, {@link Main}. */
public class MainTest {
  private static final String USAGE = "Usage: formc [options] file...\n"
      + "Options:\n"
      + "  --fallback-degree=FALLBACKDEGREE\n"
      + "  --language=LANGUAGE\n"
      + "  --max-degree=MAXDEGREE\n"
      + "  --optimize\n"
      + "  --output-dir=OUTPUTDIR\n"
      + "  --precision=PRECISION\n"
      + "  --representation=REPRESENTATION\n"
      + "  --strict-degree\n"
      + "  --verbose\n"
      + "  --help\n";

  private static final String POISSON = "# Poisson equation\n"
      + "element = FiniteElement(\"Lagrange\", triangle, 1)\n"
      + "u = TrialFunction(element)\n"
      + "v = TestFunction(element)\n"
      + "f = Coefficient(element)\n"
      + "a = inner(grad(u), grad(v))*dx\n"
      + "L = f*v*dx\n";

  private static final String MASS =
      "element = FiniteElement(\"Lagrange\", triangle, 1)\n"
      + "u = TrialFunction(element)\n"
      + "v = TestFunction(element)\n"
      + "a = u*v*dx\n";

  private static final String BAD =
      "element = FiniteElement(\"Lagrange\", triangle, 1)\n"
      + "u = TrialFunction(element)\n"
      + "v = TestFunction(element)\n"
      + "a = u*v\n";

  /** Result of running the driver. */
  private static class Run {
    final int status;
    final String err;

    Run(int status, String err) {
      this.status = status;
      this.err = err;
    }
  }

  private static Run run(Map<Prop, Object> propMap, String... args) {
    final StringWriter sw = new StringWriter();
    final int status =
        new Main(ImmutableList.copyOf(args), sw, propMap).run();
    return new Run(status, sw.toString());
  }

  private static Run run(String... args) {
    return run(ImmutableMap.of(), args);
  }

  private static File write(File dir, String name, String text)
      throws IOException {
    final File file = new File(dir, name);
    Files.write(file.toPath(), text.getBytes(StandardCharsets.UTF_8));
    return file;
  }

  private static String read(File file) throws IOException {
    return new String(Files.readAllBytes(file.toPath()),
        StandardCharsets.UTF_8);
  }

  @Test void testHelp() {
    final Run run = run("--help");
    assertThat(run.status, is(Main.OK));
    assertThat(run.err, is(USAGE));
  }

  @Test void testUsageErrors() {
    Run run = run();
    assertThat(run.status, is(Main.USAGE));
    assertThat(run.err, is("formc: no input files\n" + USAGE));

    run = run("--fast", "x.form");
    assertThat(run.status, is(Main.USAGE));
    assertThat(run.err, startsWith("formc: unknown option --fast\n"));

    run = run("--precision", "x.form");
    assertThat(run.status, is(Main.USAGE));
    assertThat(run.err,
        startsWith("formc: option --precision requires a value\n"));

    run = run("--language=fortran", "x.form");
    assertThat(run.status, is(Main.USAGE));
    assertThat(run.err,
        startsWith("formc: value of language must be one of: "
            + "'cpp', 'java'\n"));

    run = run("--max-degree=high", "x.form");
    assertThat(run.status, is(Main.USAGE));
    assertThat(run.err,
        startsWith("formc: value of maxDegree must be an integer: high\n"));
  }

  @Test void testCompile(@TempDir File dir) throws IOException {
    final File file = write(dir, "poisson.form", POISSON);
    final File out = new File(dir, "out");
    final Run run = run("--output-dir=" + out, file.getPath());
    assertThat(run.err, is(""));
    assertThat(run.status, is(Main.OK));
    final String text = read(new File(out, "poisson.h"));
    assertThat(text,
        startsWith("// poisson.h generated by formc from poisson.form"));
    assertThat(text, containsString("inline bool a_cell_interior("));
    assertThat(text, containsString("inline bool L_cell_interior("));
  }

  /** The initial property map supplies defaults; flags override it. */
  @Test void testJava(@TempDir File dir) throws IOException {
    final File file = write(dir, "poisson.form", POISSON);
    final Run run =
        run(ImmutableMap.of(Prop.OUTPUT_DIR, dir, Prop.LANGUAGE,
                Language.CPP),
            "--language=java", "--optimize", "--precision=8",
            file.getPath());
    assertThat(run.status, is(Main.OK));
    assertThat(new File(dir, "poisson.h").exists(), is(false));
    assertThat(read(new File(dir, "Poisson.java")),
        containsString("public final class Poisson {"));
  }

  /** A file that fails does not produce output, and does not stop other
   * files from compiling. */
  @Test void testError(@TempDir File dir) throws IOException {
    final File bad = write(dir, "bad.form", BAD);
    final File good = write(dir, "mass.form", MASS);
    final Run run = run(ImmutableMap.of(Prop.OUTPUT_DIR, dir),
        bad.getPath(), good.getPath());
    assertThat(run.status, is(Main.ERROR));
    assertThat(run.err,
        is(bad.getPath() + ": error: line 4, column 5: 'a' must be a form, "
            + "but is expression v_1 * v_0\n"
            + "(use --verbose for a full trace)\n"));
    assertThat(new File(dir, "bad.h").exists(), is(false));
    assertThat(new File(dir, "mass.h").exists(), is(true));
  }

  @Test void testMissingFile(@TempDir File dir) {
    final File missing = new File(dir, "missing.form");
    final Run run = run(ImmutableMap.of(Prop.OUTPUT_DIR, dir),
        missing.getPath());
    assertThat(run.status, is(Main.ERROR));
    assertThat(run.err,
        startsWith(missing.getPath() + ": error: i/o error: "));
  }

  /** A degree that exceeds the maximum is a warning, unless
   * "--strict-degree" is set. */
  @Test void testDegreeWarning(@TempDir File dir) throws IOException {
    final File file = write(dir, "mass.form", MASS);
    final Map<Prop, Object> propMap = ImmutableMap.of(Prop.OUTPUT_DIR, dir);
    Run run = run(propMap, "--max-degree=1", file.getPath());
    assertThat(run.status, is(Main.OK));
    assertThat(run.err,
        is(file.getPath() + ": warning: estimated degree 2 of v_1 * v_0 "
            + "exceeds maximum 1; using degree 2\n"));
    assertThat(new File(dir, "mass.h").exists(), is(true));

    run = run(propMap, "--max-degree=1", "--strict-degree", file.getPath());
    assertThat(run.status, is(Main.ERROR));
    assertThat(run.err,
        startsWith(file.getPath() + ": error: estimated degree 2 of "
            + "v_1 * v_0 exceeds maximum 1\n"));
  }

  /** With "--verbose", the driver prints plans, the file written, and the
   * stack of any error. */
  @Test void testVerbose(@TempDir File dir) throws IOException {
    final File file = write(dir, "mass.form", MASS);
    final Map<Prop, Object> propMap = ImmutableMap.of(Prop.OUTPUT_DIR, dir);
    Run run = run(propMap, "--verbose", file.getPath());
    assertThat(run.status, is(Main.OK));
    final List<String> lines =
        ImmutableList.copyOf(run.err.split("\n"));
    assertThat(lines.size(), is(2));
    assertThat(lines.get(0),
        is(file.getPath() + ": a: cell_interior 0: "
            + "[tensor(degree=2, v_1 * v_0 * dx)]"));
    assertThat(lines.get(1),
        is(file.getPath() + ": wrote " + new File(dir, "mass.h")));

    final File bad = write(dir, "bad.form", BAD);
    run = run(propMap, "--verbose", bad.getPath());
    assertThat(run.status, is(Main.ERROR));
    assertThat(run.err, containsString("FormParseException"));
    assertThat(run.err, not(containsString("--verbose")));
  }
}

// End MainTest.java
