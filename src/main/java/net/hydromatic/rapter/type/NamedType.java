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

import net.hydromatic.rapter.ast.Op;

/**
 * Type that is referenced by name: a struct or an enum.
 *
 * <p>The name may be qualified by the alias of the module that declares it,
 * as in "{@code geometry.Point}".
 */
public abstract class NamedType extends BaseType {
  public final String name;

  protected NamedType(Op op, String name) {
    super(op);
    this.name = requireNonNull(name);
  }

  @Override
  public String moniker() {
    return name;
  }

  /** Returns the name without its module qualifier, e.g. "{@code Point}" for
   * "{@code geometry.Point}". */
  public String simpleName() {
    return simpleName(name);
  }

  /** Strips the module qualifier from a name. */
  public static String simpleName(String name) {
    final int i = name.lastIndexOf('.');
    return i < 0 ? name : name.substring(i + 1);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o != null
            && o.getClass() == getClass()
            && name.equals(((NamedType) o).name);
  }

  @Override
  public int hashCode() {
    return name.hashCode() * 31 + op.ordinal();
  }
}

// End NamedType.java
