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

import com.google.common.collect.ImmutableList;
import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import net.hydromatic.formc.ast.FormFile;
import net.hydromatic.formc.codegen.GeneratedModule;
import net.hydromatic.formc.compile.CompileException;
import net.hydromatic.formc.compile.Compiles;
import net.hydromatic.formc.compile.IntegralPlan;
import net.hydromatic.formc.compile.Prop;
import net.hydromatic.formc.compile.Tracer;
import net.hydromatic.formc.compile.Tracers;
import net.hydromatic.formc.parse.FormParseException;
import net.hydromatic.formc.parse.FormParser;
import net.hydromatic.formc.util.FormcException;

/** Command-line driver; compiles each form file named on the command line
 * to a module. */
public class Main {
  /** Exit status if every file compiled. */
  public static final int OK = 0;
  /** Exit status if at least one file failed to compile. */
  public static final int ERROR = 1;
  /** Exit status if the command line is invalid. */
  public static final int USAGE = 2;

  private final List<String> argList;
  private final PrintWriter err;
  private final Map<Prop, Object> propMap;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final Main main =
        new Main(ImmutableList.copyOf(args), System.err,
            new LinkedHashMap<>());
    System.exit(main.run());
  }

  /** Creates a Main. */
  public Main(List<String> argList, PrintStream err,
      Map<Prop, Object> propMap) {
    this(argList, new OutputStreamWriter(err, StandardCharsets.UTF_8),
        propMap);
  }

  /** Creates a Main.
   *
   * @param argList Command-line arguments
   * @param err Writer for errors, warnings and traces
   * @param propMap Initial values of properties; flags override them
   */
  public Main(List<String> argList, Writer err, Map<Prop, Object> propMap) {
    this.argList = ImmutableList.copyOf(argList);
    this.err = err instanceof PrintWriter
        ? (PrintWriter) err
        : new PrintWriter(err);
    this.propMap = new LinkedHashMap<>(propMap);
  }

  /** Compiles the files, and returns the exit status. */
  public int run() {
    try {
      return run2();
    } finally {
      err.flush();
    }
  }

  private int run2() {
    final Map<Prop, Object> props = new LinkedHashMap<>(propMap);
    final List<File> files = new ArrayList<>();
    boolean verbose = false;
    for (String arg : argList) {
      if (arg.equals("--verbose")) {
        verbose = true;
      } else if (arg.equals("--help")) {
        usage();
        return OK;
      } else if (arg.startsWith("--")) {
        final int eq = arg.indexOf('=');
        final String flag = eq < 0 ? arg : arg.substring(0, eq);
        final Prop prop = Prop.lookupFlag(flag);
        if (prop == null) {
          return usageError("unknown option " + flag);
        }
        final String value;
        if (eq >= 0) {
          value = arg.substring(eq + 1);
        } else if (prop.isBoolean()) {
          value = "true";
        } else {
          return usageError("option " + flag + " requires a value");
        }
        try {
          prop.setLenient(props, value);
        } catch (IllegalArgumentException e) {
          return usageError(e.getMessage());
        }
      } else {
        files.add(new File(arg));
      }
    }
    if (files.isEmpty()) {
      return usageError("no input files");
    }
    int status = OK;
    for (File file : files) {
      if (!compile(file, props, verbose)) {
        status = ERROR;
      }
    }
    return status;
  }

  /** Compiles one file and writes its module; returns whether it
   * succeeded. Errors are reported, not thrown, so that the remaining
   * files are still compiled. */
  boolean compile(File file, Map<Prop, Object> props, boolean verbose) {
    final String name = file.getPath();
    Tracer tracer = Tracers.empty();
    if (verbose) {
      tracer = Tracers.withOnPlan(tracer, compiledForm -> {
        for (IntegralPlan plan : compiledForm.plans) {
          err.println(name + ": " + compiledForm.name + ": "
              + plan.type.procedureSuffix + " " + plan.subdomainId + ": "
              + plan.terms);
        }
      });
    }
    try {
      final FormFile formFile = FormParser.parse(file);
      final GeneratedModule module =
          Compiles.compile(formFile, file.getName(), props,
              w -> err.println(name + ": warning: " + describe(w)), tracer);
      final File written = module.writeTo(Prop.OUTPUT_DIR.fileValue(props));
      if (verbose) {
        err.println(name + ": wrote " + written);
      }
      return true;
    } catch (CompileException | FormParseException e) {
      report(name, describe((FormcException) e), e, verbose);
    } catch (IOException e) {
      report(name, "i/o error: " + e.getMessage(), e, verbose);
    } catch (RuntimeException e) {
      report(name, "internal error: " + e, e, verbose);
    }
    return false;
  }

  private void report(String name, String message, Exception e,
      boolean verbose) {
    err.println(name + ": error: " + message);
    if (verbose) {
      e.printStackTrace(err);
    } else {
      err.println("(use --verbose for a full trace)");
    }
  }

  private static String describe(FormcException e) {
    return e.describeTo(new StringBuilder()).toString();
  }

  private int usageError(String message) {
    err.println("formc: " + message);
    usage();
    return USAGE;
  }

  private void usage() {
    err.println("Usage: formc [options] file...");
    err.println("Options:");
    for (Prop prop : Prop.BY_CAMEL_NAME) {
      err.println("  " + prop.flag()
          + (prop.isBoolean()
              ? ""
              : "=" + prop.camelName.toUpperCase(Locale.ROOT)));
    }
    err.println("  --verbose");
    err.println("  --help");
  }
}

// End Main.java
