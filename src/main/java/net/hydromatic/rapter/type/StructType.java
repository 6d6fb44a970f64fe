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
 * Named product type.
 *
 * <p>The parser cannot tell a struct name from an enum name, so every named
 * type that appears in a type annotation is a {@code StructType}. The name
 * "{@code str}" is an alias for {@link PrimitiveType#STRING}.
 */
public class StructType extends NamedType {
  /** Name of the struct that is an alias for {@code string}. */
  public static final String STR = "str";

  public StructType(String name) {
    super(Op.STRUCT_TYPE, name);
  }

  /** Returns whether this is the "{@code str}" alias. */
  public boolean isStr() {
    return name.equals(STR);
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }
}

// End StructType.java
