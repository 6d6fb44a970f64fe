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
package net.hydromatic.rapter.compile;

import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.rapter.ast.Ast;
import net.hydromatic.rapter.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on each checked
   * program, then calls the underlying tracer. */
  public static Tracer withOnTypeMap(Tracer tracer,
      BiConsumer<Ast.Program, TypeMap> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onTypeMap(Ast.Program program, TypeMap typeMap) {
        consumer.accept(program, typeMap);
        super.onTypeMap(program, typeMap);
      }
    };
  }

  /** Returns a tracer that performs the given action on the collected
   * instantiations, then calls the underlying tracer. */
  public static Tracer withOnInstantiations(Tracer tracer,
      Consumer<Set<Type>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onInstantiations(Set<Type> instantiations) {
        consumer.accept(instantiations);
        super.onInstantiations(instantiations);
      }
    };
  }

  /** Returns a tracer that performs the given action on the generated code,
   * then calls the underlying tracer. */
  public static Tracer withOnOutput(Tracer tracer, Consumer<String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onOutput(String code) {
        consumer.accept(code);
        super.onOutput(code);
      }
    };
  }

  public static Tracer withOnCompileException(Tracer tracer,
      Consumer<CompileException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public boolean handleCompileException(@Nullable CompileException e) {
        consumer.accept(e);
        super.handleCompileException(e);
        return true;
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onTypeMap(Ast.Program program, TypeMap typeMap) {}

    @Override
    public void onInstantiations(Set<Type> instantiations) {}

    @Override
    public void onOutput(String code) {}

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
    public void onTypeMap(Ast.Program program, TypeMap typeMap) {
      tracer.onTypeMap(program, typeMap);
    }

    @Override
    public void onInstantiations(Set<Type> instantiations) {
      tracer.onInstantiations(instantiations);
    }

    @Override
    public void onOutput(String code) {
      tracer.onOutput(code);
    }

    @Override
    public boolean handleCompileException(@Nullable CompileException e) {
      return tracer.handleCompileException(e);
    }
  }
}

// End Tracers.java
