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

import static net.hydromatic.rapter.Fixtures.construct;
import static net.hydromatic.rapter.Fixtures.fn;
import static net.hydromatic.rapter.Fixtures.i;
import static net.hydromatic.rapter.Fixtures.id;
import static net.hydromatic.rapter.Fixtures.option;
import static net.hydromatic.rapter.Fixtures.program;
import static net.hydromatic.rapter.Fixtures.ret;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import net.hydromatic.rapter.ast.Ast;
import net.hydromatic.rapter.module.ModuleLoaders;
import net.hydromatic.rapter.type.PrimitiveType;
import net.hydromatic.rapter.type.Type;
import org.junit.jupiter.api.Test;

/** Tests for {@link Compiles} and {@link Tracers}. */
public class CompilesTest {
  @Test
  void testTracer() {
    final List<String> events = new ArrayList<>();
    final List<Set<Type>> instantiations = new ArrayList<>();
    Tracer tracer = Tracers.empty();
    tracer = Tracers.withOnTypeMap(tracer, (program, typeMap) ->
        events.add("typeMap " + program.functions.get(0).name));
    tracer = Tracers.withOnInstantiations(tracer, types -> {
      events.add("instantiations");
      instantiations.add(types);
    });
    tracer = Tracers.withOnOutput(tracer, code -> events.add("output"));
    tracer = Tracers.withOnCompileException(tracer, e -> events.add("error"));

    final Ast.Program program =
        program(
            fn("wrap", ImmutableList.of(), option(PrimitiveType.INT),
                ret(construct("Option", "Some", i(1)))));
    final CompiledUnit unit =
        Compiles.compile(program, ModuleLoaders.empty(), ImmutableMap.of(),
            tracer);
    assertThat(events.toString(),
        is("[typeMap wrap, instantiations, output]"));
    assertThat(instantiations.get(0).contains(option(PrimitiveType.INT)),
        is(true));
    assertThat(unit.instantiations, is(instantiations.get(0)));
    assertThat(unit.modules.isEmpty(), is(true));
    assertThat(unit.toString(), is(unit.code));
  }

  @Test
  void testTracerSeesError() {
    final List<CompileException> errors = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnCompileException(Tracers.empty(), errors::add);
    final Ast.Program program =
        program(fn("f", ImmutableList.of(), PrimitiveType.INT, ret(id("x"))));
    final CompileException e =
        assertThrows(CompileException.class, () ->
            Compiles.compile(program, ModuleLoaders.empty(),
                ImmutableMap.of(), tracer));
    assertThat(errors.size(), is(1));
    assertThat(errors.get(0), is(e));
    assertThat(Tracers.empty().handleCompileException(e), is(false));
  }

  @Test
  void testTryCompile() {
    final CompileOutcome good =
        Compiles.tryCompile(
            program(fn("f", ImmutableList.of(), PrimitiveType.INT,
                ret(i(0)))),
            ModuleLoaders.empty(), ImmutableMap.of(), Tracers.empty());
    assertThat(good.succeeded(), is(true));
    assertThat(good.error, nullValue());
    assertThat(good.code(), containsString("int f(void) {"));

    final CompileOutcome bad =
        Compiles.tryCompile(
            program(fn("f", ImmutableList.of(), PrimitiveType.INT,
                ret(id("x")))),
            ModuleLoaders.empty(), ImmutableMap.of(), Tracers.empty());
    assertThat(bad.succeeded(), is(false));
    assertThat(bad.error, notNullValue());
    assertThat(bad.error.kind, is(ErrorKind.UNDEFINED_VARIABLE));
    assertThrows(IllegalStateException.class, bad::code);
  }
}

// End CompilesTest.java
