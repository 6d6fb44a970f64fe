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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import net.hydromatic.rapter.ast.Ast;
import net.hydromatic.rapter.compile.Symbol;

/** A loaded module: its parsed program, and the symbols it exports. */
public class Module {
  public final String name;
  public final Ast.Program program;
  /** Exported symbols, keyed by unqualified name. */
  public final ImmutableMap<String, Symbol> exports;

  Module(String name, Ast.Program program,
      ImmutableMap<String, Symbol> exports) {
    this.name = requireNonNull(name);
    this.program = requireNonNull(program);
    this.exports = requireNonNull(exports);
  }

  @Override
  public String toString() {
    return name;
  }
}

// End Module.java
