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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import net.hydromatic.rapter.compile.NameGenerator;
import net.hydromatic.rapter.compile.Prop;
import net.hydromatic.rapter.compile.TypeMap;
import net.hydromatic.rapter.type.NamedType;
import net.hydromatic.rapter.type.Type;

/**
 * State of the generation of one C unit.
 *
 * <p>The caller creates a context, passes it to
 * {@link CodeGenerator#generate}, and may then read the instantiations that
 * generation collected. A context is used once.
 */
public class CodegenContext {
  public final ImmutableMap<Prop, Object> props;
  public final TypeMap typeMap;
  final NameGenerator nameGenerator = new NameGenerator();
  /** Generic and dynamic array types that have a definition in the unit,
   * keyed by C name, in order of definition. */
  final Map<String, Type> instantiations = new LinkedHashMap<>();
  /** Simple names of the enums declared by the unit and its modules. */
  final Set<String> enumNames = new HashSet<>();

  public CodegenContext(Map<Prop, Object> props, TypeMap typeMap) {
    this.props = ImmutableMap.copyOf(props);
    this.typeMap = requireNonNull(typeMap);
  }

  /** Returns the types that have a definition in the generated code, in the
   * order in which they are defined. */
  public ImmutableSet<Type> instantiations() {
    return ImmutableSet.copyOf(instantiations.values());
  }

  String prefix() {
    return Prop.RUNTIME_PREFIX.stringValue(props);
  }

  boolean lenient() {
    return Prop.LENIENT_LOWERING.booleanValue(props);
  }

  int indentWidth() {
    return Prop.INDENT_WIDTH.intValue(props);
  }

  boolean emitRuntimeHelpers() {
    return Prop.EMIT_RUNTIME_HELPERS.booleanValue(props);
  }

  /** Returns whether a type denotes a user enum. Values of such types are
   * C enum constants. The parser writes every named type as a struct, so
   * this looks at the name, not the class, of the type. */
  boolean isEnum(Type type) {
    return type instanceof NamedType
        && enumNames.contains(((NamedType) type).simpleName());
  }
}

// End CodegenContext.java
