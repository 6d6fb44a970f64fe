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

/** Unresolved type parameter, such as the "{@code T}" in "{@code Option<T>}".
 *
 * <p>Occurs only in descriptions of built-in generic types; it is an error
 * for one to reach code generation. */
public class TypeParam extends BaseType {
  public final String name;

  public TypeParam(String name) {
    super(Op.TYPE_PARAM);
    this.name = requireNonNull(name);
  }

  @Override
  public String moniker() {
    return name;
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof TypeParam && name.equals(((TypeParam) o).name);
  }

  @Override
  public int hashCode() {
    return name.hashCode() * 31 + 4;
  }
}

// End TypeParam.java
