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

import net.hydromatic.rapter.ast.Ast;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Supplies the parsed program of a module, given its name.
 *
 * <p>Finding, reading and parsing the module's source is the loader's
 * business. A loader may throw {@link net.hydromatic.rapter.compile.CompileException}
 * if the source does not parse. */
public interface ModuleLoader {
  /** Returns the program of the module with a given name, such as
   * "{@code geometry}" or "{@code std.strings}"; null if there is no such
   * module. */
  Ast.@Nullable Program load(String name);
}

// End ModuleLoader.java
