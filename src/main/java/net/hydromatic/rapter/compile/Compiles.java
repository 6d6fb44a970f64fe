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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.rapter.ast.Ast;
import net.hydromatic.rapter.codegen.CodeGenerator;
import net.hydromatic.rapter.codegen.CodegenContext;
import net.hydromatic.rapter.module.Module;
import net.hydromatic.rapter.module.ModuleLoader;
import net.hydromatic.rapter.module.ModuleLoaders;
import net.hydromatic.rapter.module.ModuleResolver;

/** Helpers for compiling programs. */
public abstract class Compiles {
  private Compiles() {}

  /**
   * Checks a program and the modules it imports, and generates C code.
   *
   * <p>Each imported module is checked, with its own imports, before the
   * modules that import it. All programs share one {@link TypeMap}, which
   * code generation then reads.
   *
   * @param program Program
   * @param loader Loads imported modules
   * @param props Properties; see {@link Prop}
   * @param tracer Tracer
   * @return Compiled unit
   * @throws CompileException if the program is invalid or cannot be
   *   lowered to C
   */
  public static CompiledUnit compile(Ast.Program program, ModuleLoader loader,
      Map<Prop, Object> props, Tracer tracer) {
    try {
      final ModuleResolver resolver = new ModuleResolver(loader);
      final ImmutableList<Module> modules =
          resolver.transitiveModules(program);
      final TypeMap typeMap = new TypeMap();
      final ImmutableList.Builder<Ast.Program> dependencies =
          ImmutableList.builder();
      for (Module module : modules) {
        check(resolver, module.program, typeMap, tracer);
        dependencies.add(module.program);
      }
      check(resolver, program, typeMap, tracer);

      final CodegenContext cx = new CodegenContext(props, typeMap);
      final String code =
          CodeGenerator.generate(cx, dependencies.build(), program);
      tracer.onInstantiations(cx.instantiations());
      tracer.onOutput(code);
      return new CompiledUnit(code, typeMap, modules, cx.instantiations());
    } catch (CompileException e) {
      tracer.handleCompileException(e);
      throw e;
    }
  }

  /** Compiles a program with no modules, default properties and no
   * tracing. */
  public static CompiledUnit compile(Ast.Program program) {
    return compile(program, ModuleLoaders.empty(), ImmutableMap.of(),
        Tracers.empty());
  }

  /** As {@link #compile(Ast.Program, ModuleLoader, Map, Tracer)}, but
   * returns the error rather than throwing it. */
  public static CompileOutcome tryCompile(Ast.Program program,
      ModuleLoader loader, Map<Prop, Object> props, Tracer tracer) {
    try {
      return CompileOutcome.success(
          compile(program, loader, props, tracer));
    } catch (CompileException e) {
      return CompileOutcome.failure(e);
    }
  }

  private static void check(ModuleResolver resolver, Ast.Program program,
      TypeMap typeMap, Tracer tracer) {
    final Environment env = new Environment();
    TypeResolver.deduceTypes(env, program, resolver.resolveImports(program),
        typeMap);
    tracer.onTypeMap(program, typeMap);
  }
}

// End Compiles.java
