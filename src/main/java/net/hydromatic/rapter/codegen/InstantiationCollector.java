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
package net.hydromatic.rapter.codegen;

import static java.lang.String.format;

import java.util.List;
import java.util.Map;
import net.hydromatic.rapter.ast.Ast;
import net.hydromatic.rapter.ast.Pos;
import net.hydromatic.rapter.compile.CompileException;
import net.hydromatic.rapter.compile.ErrorKind;
import net.hydromatic.rapter.compile.TypeMap;
import net.hydromatic.rapter.type.DynamicArrayType;
import net.hydromatic.rapter.type.GenericType;
import net.hydromatic.rapter.type.Type;
import net.hydromatic.rapter.type.TypeParam;
import net.hydromatic.rapter.type.TypeVisitor;

/**
 * Finds the types that need a C definition of their own: instantiations of
 * {@code Option} and {@code Result}, and dynamic arrays other than those of
 * the primitive types.
 *
 * <p>Types are added after their arguments, so {@code Option<Option<int>>}
 * follows {@code Option<int>}. Each type is added once, however many
 * times, and in however many modules, it occurs.
 */
class InstantiationCollector extends TypeVisitor<Void> {
  private final Map<String, Type> instantiations;

  private InstantiationCollector(Map<String, Type> instantiations) {
    this.instantiations = instantiations;
  }

  /** Adds the instantiations used by some programs to a map, keyed by C
   * type name.
   *
   * <p>The declarations of each program are visited first, in program
   * order, then every type that checking recorded. */
  static void collect(List<Ast.Program> programs, TypeMap typeMap,
      Map<String, Type> instantiations) {
    final InstantiationCollector collector =
        new InstantiationCollector(instantiations);
    for (Ast.Program program : programs) {
      collector.collect(program);
    }
    typeMap.types().forEach(collector::add);
  }

  private void collect(Ast.Program program) {
    for (Ast.ExternFunction externFunction : program.externFunctions) {
      externFunction.params.forEach(p -> add(p.type));
      add(externFunction.returnType);
    }
    for (Ast.StructDecl struct : program.structs) {
      struct.fields.forEach(f -> add(f.type));
    }
    for (Ast.Global global : program.globals) {
      if (global.type != null) {
        add(global.type);
      }
    }
    for (Ast.Function function : program.functions) {
      function.params.forEach(p -> add(p.type));
      add(function.returnType);
    }
  }

  private void add(Type type) {
    type.accept(this);
  }

  @Override public Void visit(DynamicArrayType dynamicArrayType) {
    super.visit(dynamicArrayType);
    if (!CTypes.isBuiltInDynamicArray(dynamicArrayType)) {
      instantiations.putIfAbsent(CTypes.cType(dynamicArrayType),
          dynamicArrayType);
    }
    return null;
  }

  @Override public Void visit(GenericType genericType) {
    super.visit(genericType);
    instantiations.putIfAbsent(CTypes.cType(genericType), genericType);
    return null;
  }

  @Override public Void visit(TypeParam typeParam) {
    throw new CompileException(ErrorKind.INTERNAL_ERROR,
        format("unresolved type parameter `%s`", typeParam.name), Pos.ZERO);
  }
}

// End InstantiationCollector.java
