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

/**
 * Visitor over {@link Type} objects.
 *
 * <p>By default, composite types visit their component types and fold the
 * results using {@link #combine}; leaf types return {@link #leaf()}.
 *
 * @param <R> return type from {@code visit} methods
 * @see Type#accept(TypeVisitor)
 */
public class TypeVisitor<R> {
  /** Result for a type that has no components. */
  protected R leaf() {
    return null;
  }

  /** Combines the results of visiting two components. */
  protected R combine(R r0, R r1) {
    return r1;
  }

  /** Visits a {@link PrimitiveType}. */
  public R visit(PrimitiveType primitiveType) {
    return leaf();
  }

  /** Visits a {@link PointerType}. */
  public R visit(PointerType pointerType) {
    return pointerType.pointee.accept(this);
  }

  /** Visits an {@link ArrayType}. */
  public R visit(ArrayType arrayType) {
    return arrayType.elementType.accept(this);
  }

  /** Visits a {@link DynamicArrayType}. */
  public R visit(DynamicArrayType dynamicArrayType) {
    return dynamicArrayType.elementType.accept(this);
  }

  /** Visits a {@link StructType}. */
  public R visit(StructType structType) {
    return leaf();
  }

  /** Visits an {@link EnumType}. */
  public R visit(EnumType enumType) {
    return leaf();
  }

  /** Visits a {@link GenericType}. */
  public R visit(GenericType genericType) {
    R r = leaf();
    for (Type arg : genericType.args) {
      r = combine(r, arg.accept(this));
    }
    return r;
  }

  /** Visits a {@link TypeParam}. */
  public R visit(TypeParam typeParam) {
    return leaf();
  }
}

// End TypeVisitor.java
