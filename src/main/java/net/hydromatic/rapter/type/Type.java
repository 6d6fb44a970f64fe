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
package net.hydromatic.rapter.type;

import net.hydromatic.rapter.ast.Op;

/**
 * Type of a value in a Rapter program.
 *
 * <p>Types are immutable values, equal if they have the same structure.
 * Whether a value of one type may be used where another is expected is a
 * weaker relation; see {@link Types#compatible(Type, Type)}.
 */
public interface Type {
  /** Type operator. */
  Op op();

  /**
   * Description of the type as it would be written in source code, e.g.
   * "{@code int}", "{@code *char}", "{@code Result<int, string>}".
   */
  String moniker();

  /** Accepts a visitor. */
  <R> R accept(TypeVisitor<R> typeVisitor);
}

// End Type.java
