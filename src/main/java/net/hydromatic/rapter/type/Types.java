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

import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for {@link Type}. */
public abstract class Types {
  private Types() {}

  /**
   * Returns whether a value of type {@code a} may be used where type {@code b}
   * is expected, and vice versa.
   *
   * <p>The rules, in order:
   *
   * <ol>
   *   <li>equal types are compatible;
   *   <li>a struct and an enum with the same name are compatible (the parser
   *       cannot tell them apart);
   *   <li>{@code string} and the struct {@code str} are compatible;
   *   <li>pointers, arrays and dynamic arrays are compatible if their
   *       element types are compatible;
   *   <li>named types are compatible if one is the other qualified by a
   *       module name, e.g. {@code geometry.Point} and {@code Point}.
   * </ol>
   *
   * <p>The relation is reflexive and symmetric, but not transitive:
   * {@code a.Point} and {@code b.Point} are both compatible with
   * {@code Point} but not with each other.
   */
  public static boolean compatible(Type a, Type b) {
    if (a.equals(b)) {
      return true;
    }
    if (a instanceof NamedType && b instanceof NamedType) {
      final String aName = ((NamedType) a).name;
      final String bName = ((NamedType) b).name;
      return aName.equals(bName)
          || aName.endsWith("." + bName)
          || bName.endsWith("." + aName);
    }
    if (isString(a) && isString(b)) {
      return true;
    }
    if (a instanceof PointerType && b instanceof PointerType) {
      return compatible(((PointerType) a).pointee, ((PointerType) b).pointee);
    }
    if (a instanceof ArrayType && b instanceof ArrayType) {
      return compatible(
          ((ArrayType) a).elementType, ((ArrayType) b).elementType);
    }
    if (a instanceof DynamicArrayType && b instanceof DynamicArrayType) {
      return compatible(
          ((DynamicArrayType) a).elementType,
          ((DynamicArrayType) b).elementType);
    }
    return false;
  }

  /** Returns whether a type is {@code string} or its alias {@code str}. */
  public static boolean isString(Type type) {
    return type == PrimitiveType.STRING
        || type instanceof StructType && ((StructType) type).isStr();
  }

  /** Returns whether a type is {@code int} or {@code float}. */
  public static boolean isNumeric(Type type) {
    return type instanceof PrimitiveType && ((PrimitiveType) type).isNumeric();
  }

  /** Converts the {@code str} alias to {@code string}; returns other types
   * unchanged. */
  public static Type normalize(Type type) {
    return isString(type) ? PrimitiveType.STRING : type;
  }

  /** Returns the element type of an array, dynamic array or pointer, or null
   * if the type is not indexable. */
  public static @Nullable Type elementType(Type type) {
    if (type instanceof ArrayType) {
      return ((ArrayType) type).elementType;
    }
    if (type instanceof DynamicArrayType) {
      return ((DynamicArrayType) type).elementType;
    }
    if (type instanceof PointerType) {
      return ((PointerType) type).pointee;
    }
    if (isString(type)) {
      return PrimitiveType.CHAR;
    }
    return null;
  }
}

// End Types.java
