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

import static java.util.Objects.requireNonNull;

/** Variant of a {@link BuiltInGeneric}, such as {@code Some} or {@code Err}. */
public class BuiltInVariant {
  public final String name;
  /** Index of the type parameter that is the type of this variant's value,
   * or -1 if the variant carries no value. */
  public final int valueTypeParam;

  BuiltInVariant(String name, int valueTypeParam) {
    this.name = requireNonNull(name);
    this.valueTypeParam = valueTypeParam;
  }

  /** Returns whether this variant carries a value. */
  public boolean hasValue() {
    return valueTypeParam >= 0;
  }

  @Override
  public String toString() {
    return name;
  }
}

// End BuiltInVariant.java
