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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import net.hydromatic.formc.ast.Form;
import net.hydromatic.formc.ast.FormFile;
import net.hydromatic.formc.codegen.CodeGenerator;
import net.hydromatic.formc.codegen.GeneratedModule;

/** Helpers for compiling form files. */
public abstract class Compiles {
  private Compiles() {}

  /**
   * Compiles every form of a form file and generates the module.
   *
   * <p>Warnings are passed to {@code warningConsumer} as they occur, and to
   * {@link Tracer#onWarnings} once all forms are compiled. Errors are thrown.
   *
   * @param file Form file
   * @param sourceName Name of the source, such as "poisson.form"; appears
   *     in the generated header
   * @param props Compiler options
   * @param warningConsumer Receives warnings
   * @param tracer Tracer
   */
  public static GeneratedModule compile(FormFile file, String sourceName,
      Map<Prop, Object> props, Consumer<CompileException> warningConsumer,
      Tracer tracer) {
    final List<CompiledForm> compiledForms = compileForms(file, props,
        warningConsumer, tracer);
    final GeneratedModule module =
        CodeGenerator.of(props).generate(file, compiledForms, sourceName);
    tracer.onCode(module);
    return module;
  }

  /** Compiles every form of a form file, in the order of
   * {@link FormFile#FORM_NAMES}. */
  public static List<CompiledForm> compileForms(FormFile file,
      Map<Prop, Object> props, Consumer<CompileException> warningConsumer,
      Tracer tracer) {
    final FormCompiler compiler = new FormCompiler(props, tracer);
    final List<CompileException> warningList = new ArrayList<>();
    final Consumer<CompileException> consumer = w -> {
      warningList.add(w);
      warningConsumer.accept(w);
    };
    final ImmutableList.Builder<CompiledForm> compiledForms =
        ImmutableList.builder();
    for (Map.Entry<String, Form> entry : file.forms.entrySet()) {
      compiledForms.add(
          compiler.compile(entry.getKey(), entry.getValue(), consumer));
    }
    tracer.onWarnings(warningList);
    return compiledForms.build();
  }
}

// End Compiles.java
