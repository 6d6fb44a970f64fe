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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.rapter.ast.Ast;

/** Utilities for {@link ModuleLoader}. */
public abstract class ModuleLoaders {
  private ModuleLoaders() {}

  /** Returns a loader that knows no modules. */
  public static ModuleLoader empty() {
    return name -> null;
  }

  /** Returns a loader backed by an in-memory map from module name to
   * program. */
  public static ModuleLoader of(Map<String, Ast.Program> programs) {
    final ImmutableMap<String, Ast.Program> map = ImmutableMap.copyOf(programs);
    return map::get;
  }
}

// End ModuleLoaders.java
