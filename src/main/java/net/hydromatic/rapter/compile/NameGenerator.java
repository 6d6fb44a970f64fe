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

/**
 * Generates unique names for temporary variables in generated code.
 *
 * <p>One generator serves a whole compilation unit, so that a temporary
 * declared inside an expanded expression never hides one declared by an
 * enclosing expression.
 */
public class NameGenerator {
  private int id = 0;

  /** Generates a name that is unique in this compilation unit, such as
   * "__match_temp_3". */
  public String get(String prefix) {
    return prefix + id++;
  }

  /** Returns the next ordinal, for a group of related names, such as
   * "__try_temp_4" and "__try_result_4". */
  public int next() {
    return id++;
  }
}

// End NameGenerator.java
