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

import java.util.List;
import net.hydromatic.formc.ast.Integral;
import net.hydromatic.formc.codegen.GeneratedModule;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Called on various events during compilation. */
public interface Tracer {
  /** Called when the integrand of an integral has been expanded. */
  void onExpand(Integral integral, Sum sum);

  /** Called when the plans of a form have been built. */
  void onPlan(CompiledForm compiledForm);

  /** Called when code has been generated for a form file. */
  void onCode(GeneratedModule module);

  /** Called with the list of warnings after compiling a form file. */
  void onWarnings(List<CompileException> warningList);

  /**
   * Called with the exception thrown during compilation, or null if no
   * exception was thrown. Returns whether a handler was found.
   */
  boolean handleCompileException(@Nullable CompileException e);
}

// End Tracer.java
