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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import net.hydromatic.rapter.module.Module;
import net.hydromatic.rapter.type.Type;

/** Result of compiling a program: C code, and what checking and code
 * generation learned along the way. */
public class CompiledUnit {
  /** Source of the C translation unit. */
  public final String code;
  /** Types of the nodes of the program and of every module it imports. */
  public final TypeMap typeMap;
  /** Imported modules, in dependency order. */
  public final ImmutableList<Module> modules;
  /** Generic and dynamic array types defined in the code, in order of
   * definition. */
  public final ImmutableSet<Type> instantiations;

  CompiledUnit(String code, TypeMap typeMap, ImmutableList<Module> modules,
      ImmutableSet<Type> instantiations) {
    this.code = requireNonNull(code);
    this.typeMap = requireNonNull(typeMap);
    this.modules = requireNonNull(modules);
    this.instantiations = requireNonNull(instantiations);
  }

  @Override public String toString() {
    return code;
  }
}

// End CompiledUnit.java
