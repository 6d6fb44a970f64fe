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

import com.google.common.base.Strings;

/** Accumulates lines of C code, indented to a current level. */
class CWriter {
  private final StringBuilder b = new StringBuilder();
  private final String unit;
  private int level;

  CWriter(int indentWidth) {
    this(Strings.repeat(" ", indentWidth), 0);
  }

  private CWriter(String unit, int level) {
    this.unit = unit;
    this.level = level;
  }

  @Override
  public String toString() {
    return b.toString();
  }

  /** Returns a new, empty writer whose lines are indented one level deeper
   * than this writer's current level. */
  CWriter nested() {
    return new CWriter(unit, level + 1);
  }

  /** Writes an indented line. An empty string writes an empty line. */
  CWriter line(String s) {
    if (!s.isEmpty()) {
      b.append(indentation());
    }
    b.append(s).append('\n');
    return this;
  }

  CWriter indent() {
    ++level;
    return this;
  }

  CWriter outdent() {
    --level;
    return this;
  }

  /** Returns the whitespace at the start of a line at the current level. */
  String indentation() {
    return Strings.repeat(unit, level);
  }
}

// End CWriter.java
