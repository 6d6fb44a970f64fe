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
package net.hydromatic.rapter.module;

import static net.hydromatic.rapter.Fixtures.P;
import static net.hydromatic.rapter.Fixtures.fn;
import static net.hydromatic.rapter.Fixtures.i;
import static net.hydromatic.rapter.Fixtures.param;
import static net.hydromatic.rapter.Fixtures.programBuilder;
import static net.hydromatic.rapter.Fixtures.ret;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.rapter.ast.Ast;
import net.hydromatic.rapter.compile.CompileException;
import net.hydromatic.rapter.compile.ErrorKind;
import net.hydromatic.rapter.compile.Symbol;
import net.hydromatic.rapter.type.PrimitiveType;
import org.junit.jupiter.api.Test;

/** Tests for {@link ModuleResolver}. */
public class ModuleResolverTest {
  /** A module that exports a function {@code area} and a struct
   * {@code Point}. */
  private static final Ast.Program GEOMETRY =
      programBuilder()
          .export(Ast.ExportKind.FUNCTION, "area")
          .export(Ast.ExportKind.STRUCT, "Point")
          .struct("Point", "x", PrimitiveType.INT, "y", PrimitiveType.INT)
          .functions(
              fn("area", ImmutableList.of(param("w", PrimitiveType.INT)),
                  PrimitiveType.INT, ret(i(0))))
          .build();

  /** Another module that exports a function called {@code area}. */
  private static final Ast.Program SHAPES =
      programBuilder()
          .export(Ast.ExportKind.FUNCTION, "area")
          .functions(
              fn("area", ImmutableList.of(), PrimitiveType.INT, ret(i(1))))
          .build();

  private static ModuleResolver resolver(Map<String, Ast.Program> programs) {
    return new ModuleResolver(ModuleLoaders.of(programs));
  }

  @Test
  void testLoadIsMemoized() {
    final ModuleResolver resolver =
        resolver(ImmutableMap.of("geometry", GEOMETRY));
    assertThat(resolver.loadedCount(), is(0));
    final Module m1 = resolver.load("geometry", P);
    final Module m2 = resolver.load("geometry", P);
    assertThat(m2, sameInstance(m1));
    assertThat(resolver.loadedCount(), is(1));
    assertThat(m1.exports.keySet().toString(), is("[area, Point]"));
    assertThat(m1.exports.get("Point").kind, is(Symbol.Kind.STRUCT));
  }

  @Test
  void testNotFound() {
    final ModuleResolver resolver = resolver(ImmutableMap.of());
    final CompileException e =
        assertThrows(CompileException.class, () ->
            resolver.load("nowhere", P));
    assertThat(e.kind, is(ErrorKind.MODULE_NOT_FOUND));
    assertThat(e.getMessage(), is("module `nowhere` not found"));
  }

  @Test
  void testLoaderFailure() {
    final ModuleResolver resolver =
        new ModuleResolver(name -> {
          throw new IllegalStateException("disk on fire");
        });
    final CompileException e =
        assertThrows(CompileException.class, () -> resolver.load("a", P));
    assertThat(e.kind, is(ErrorKind.MODULE_LOAD_ERROR));
    assertThat(e.getMessage(),
        is("failed to load module `a`: disk on fire"));
  }

  @Test
  void testQualifiedNames() {
    final ModuleResolver resolver =
        resolver(ImmutableMap.of("geometry", GEOMETRY));
    final Ast.Program program =
        programBuilder().import_("geometry", "g").build();
    final ImmutableMap<String, Symbol> symbols =
        resolver.resolveImports(program);
    assertThat(symbols.keySet().toString(),
        is("[area, g.area, Point, g.Point]"));
    assertThat(symbols.get("g.area").name, is("g.area"));
    assertThat(symbols.get("area").name, is("area"));

    // Without an alias, the module name is the qualifier.
    final Ast.Program program2 =
        programBuilder().import_("geometry", null).build();
    assertThat(resolver.resolveImports(program2).containsKey("geometry.area"),
        is(true));
    assertThat(resolver.loadedCount(), is(1));
  }

  @Test
  void testImportConflict() {
    final ModuleResolver resolver =
        resolver(ImmutableMap.of("geometry", GEOMETRY, "shapes", SHAPES));
    final Ast.Program program =
        programBuilder()
            .import_("geometry", null)
            .import_("shapes", null)
            .build();
    final CompileException e =
        assertThrows(CompileException.class, () ->
            resolver.resolveImports(program));
    assertThat(e.kind, is(ErrorKind.IMPORT_CONFLICT));
    assertThat(e.getMessage(),
        is("`area` is exported by both `geometry` and `shapes`"));
  }

  @Test
  void testCircularImport() {
    final Ast.Program a = programBuilder().import_("b", null).build();
    final Ast.Program b = programBuilder().import_("a", null).build();
    final ModuleResolver resolver = resolver(ImmutableMap.of("a", a, "b", b));
    final Ast.Program root = programBuilder().import_("a", null).build();
    final CompileException e =
        assertThrows(CompileException.class, () ->
            resolver.transitiveModules(root));
    assertThat(e.kind, is(ErrorKind.CIRCULAR_IMPORT));
    assertThat(e.getMessage(), is("circular import: a -> b -> a"));
  }

  @Test
  void testDependencyOrder() {
    final Ast.Program base = programBuilder().build();
    final Ast.Program mid = programBuilder().import_("base", null).build();
    final Ast.Program top =
        programBuilder().import_("mid", null).import_("base", null).build();
    final ModuleResolver resolver =
        resolver(ImmutableMap.of("base", base, "mid", mid, "top", top));
    final Ast.Program root =
        programBuilder().import_("top", null).import_("mid", null).build();
    final ImmutableList<Module> modules = resolver.transitiveModules(root);
    assertThat(modules.toString(), is("[base, mid, top]"));
  }

  @Test
  void testExportErrors() {
    final Ast.Program missing =
        programBuilder().export(Ast.ExportKind.FUNCTION, "gone").build();
    final CompileException e =
        assertThrows(CompileException.class, () ->
            ModuleResolver.exports(missing));
    assertThat(e.kind, is(ErrorKind.EXPORT_NOT_FOUND));
    assertThat(e.getMessage(),
        is("exported function `gone` not found in module"));

    // "Point" exists, but as a struct, not a function.
    final Ast.Program wrongKind =
        programBuilder()
            .export(Ast.ExportKind.FUNCTION, "Point")
            .struct("Point", "x", PrimitiveType.INT)
            .build();
    final CompileException e2 =
        assertThrows(CompileException.class, () ->
            ModuleResolver.exports(wrongKind));
    assertThat(e2.kind, is(ErrorKind.MODULE_EXPORT_ERROR));
    assertThat(e2.getMessage(),
        is("`Point` is exported as a function, but is not a function"));
  }
}

// End ModuleResolverTest.java
