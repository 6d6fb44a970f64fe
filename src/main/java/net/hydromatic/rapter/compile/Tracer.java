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
import net.hydromatic.rapter.ast.Ast;
import net.hydromatic.rapter.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Called on various events during compilation. */
public interface Tracer {
  /** Called when a program (the root program or an imported module) has
   * been checked. */
  void onTypeMap(Ast.Program program, TypeMap typeMap);

  /** Called with the generic and dynamic array instantiations that code
   * generation collected, in the order their definitions are emitted. */
  void onInstantiations(Set<Type> instantiations);

  /** Called with the generated C code. */
  void onOutput(String code);

  /**
   * Called with the exception thrown during checking or code generation, or
   * null if no exception was thrown. Returns whether a handler was found.
   */
  boolean handleCompileException(@Nullable CompileException e);
}

// End Tracer.java
