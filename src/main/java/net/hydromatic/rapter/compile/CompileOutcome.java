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

import static com.google.common.base.Preconditions.checkArgument;

import org.checkerframework.checker.nullness.qual.Nullable;

/** Outcome of {@link Compiles#tryCompile}: either a compiled unit or the
 * error that prevented compilation. */
public class CompileOutcome {
  public final @Nullable CompiledUnit unit;
  public final @Nullable CompileException error;

  private CompileOutcome(@Nullable CompiledUnit unit,
      @Nullable CompileException error) {
    checkArgument((unit == null) != (error == null));
    this.unit = unit;
    this.error = error;
  }

  static CompileOutcome success(CompiledUnit unit) {
    return new CompileOutcome(unit, null);
  }

  static CompileOutcome failure(CompileException error) {
    return new CompileOutcome(null, error);
  }

  /** Returns whether compilation succeeded. */
  public boolean succeeded() {
    return unit != null;
  }

  /** Returns the generated code; throws if compilation failed. */
  public String code() {
    if (unit == null) {
      throw new IllegalStateException("compilation failed: " + error);
    }
    return unit.code;
  }
}

// End CompileOutcome.java
