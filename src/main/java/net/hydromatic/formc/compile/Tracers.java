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
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.formc.ast.Integral;
import net.hydromatic.formc.codegen.GeneratedModule;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on each expanded
   * integrand, then calls the underlying tracer. */
  public static Tracer withOnExpand(Tracer tracer,
      BiConsumer<Integral, Sum> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onExpand(Integral integral, Sum sum) {
        consumer.accept(integral, sum);
        super.onExpand(integral, sum);
      }
    };
  }

  /** Returns a tracer that performs the given action on each compiled form,
   * then calls the underlying tracer. */
  public static Tracer withOnPlan(Tracer tracer,
      Consumer<CompiledForm> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onPlan(CompiledForm compiledForm) {
        consumer.accept(compiledForm);
        super.onPlan(compiledForm);
      }
    };
  }

  /** Returns a tracer that performs the given action on generated code,
   * then calls the underlying tracer. */
  public static Tracer withOnCode(Tracer tracer,
      Consumer<GeneratedModule> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onCode(GeneratedModule module) {
        consumer.accept(module);
        super.onCode(module);
      }
    };
  }

  public static Tracer withOnWarnings(Tracer tracer,
      Consumer<List<CompileException>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onWarnings(List<CompileException> warningList) {
        consumer.accept(warningList);
        super.onWarnings(warningList);
      }
    };
  }

  public static Tracer withOnCompileException(Tracer tracer,
      Consumer<CompileException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public boolean handleCompileException(@Nullable CompileException e) {
        if (e != null) {
          consumer.accept(e);
        }
        super.handleCompileException(e);
        return true;
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onExpand(Integral integral, Sum sum) {
    }

    @Override
    public void onPlan(CompiledForm compiledForm) {
    }

    @Override
    public void onCode(GeneratedModule module) {
    }

    @Override
    public void onWarnings(List<CompileException> warningList) {
    }

    @Override
    public boolean handleCompileException(@Nullable CompileException e) {
      return false;
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onExpand(Integral integral, Sum sum) {
      tracer.onExpand(integral, sum);
    }

    @Override
    public void onPlan(CompiledForm compiledForm) {
      tracer.onPlan(compiledForm);
    }

    @Override
    public void onCode(GeneratedModule module) {
      tracer.onCode(module);
    }

    @Override
    public void onWarnings(List<CompileException> warningList) {
      tracer.onWarnings(warningList);
    }

    @Override
    public boolean handleCompileException(@Nullable CompileException e) {
      return tracer.handleCompileException(e);
    }
  }
}

// End Tracers.java
