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

import static java.lang.String.format;

import com.google.common.collect.ImmutableMap;
import java.util.Locale;
import java.util.stream.Collectors;
import net.hydromatic.rapter.ast.Pos;
import net.hydromatic.rapter.compile.CompileException;
import net.hydromatic.rapter.compile.ErrorKind;
import net.hydromatic.rapter.type.ArrayType;
import net.hydromatic.rapter.type.BuiltInVariant;
import net.hydromatic.rapter.type.DynamicArrayType;
import net.hydromatic.rapter.type.GenericType;
import net.hydromatic.rapter.type.NamedType;
import net.hydromatic.rapter.type.PointerType;
import net.hydromatic.rapter.type.PrimitiveType;
import net.hydromatic.rapter.type.Type;
import net.hydromatic.rapter.type.TypeParam;
import net.hydromatic.rapter.type.Types;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Maps types to C.
 *
 * <p>Every function here depends only on its argument. Two places in the
 * generated code that mention {@code Option<int>} must agree on the name
 * {@code Option_int} without consulting each other.
 */
public abstract class CTypes {
  private CTypes() {}

  /** Prefix of the name of a dynamic array carrier. */
  static final String DYNAMIC_ARRAY = "DynamicArray_";

  /** Element types whose dynamic array carrier is always emitted, and the
   * suffix of the carrier's name. */
  static final ImmutableMap<PrimitiveType, String> BUILT_IN_DYNAMIC_ARRAYS =
      ImmutableMap.of(PrimitiveType.INT, "int",
          PrimitiveType.FLOAT, "double",
          PrimitiveType.CHAR, "char",
          PrimitiveType.STRING, "charptr");

  /** Returns the C type that represents a type, e.g. "{@code char*}" for
   * {@code string}, "{@code Result_int_string}" for
   * {@code Result<int, string>}. */
  public static String cType(Type type) {
    switch (type.op()) {
      case PRIMITIVE_TYPE:
        switch ((PrimitiveType) type) {
          case INT:
          case BOOL:
            return "int";
          case FLOAT:
            return "double";
          case CHAR:
            return "char";
          case STRING:
            return "char*";
          case VOID:
            return "void";
          default:
            throw new AssertionError(type);
        }
      case POINTER_TYPE:
        return cType(((PointerType) type).pointee) + "*";
      case ARRAY_TYPE:
        return cType(((ArrayType) type).elementType) + "*";
      case DYN_ARRAY_TYPE:
        return dynamicArrayName((DynamicArrayType) type);
      case STRUCT_TYPE:
      case ENUM_TYPE:
        return Types.isString(type) ? "char*" : ((NamedType) type).simpleName();
      case GENERIC_TYPE:
        return mangle(type);
      case TYPE_PARAM:
      default:
        throw unresolved(type);
    }
  }

  /**
   * Returns the fragment of a C identifier that stands for a type.
   *
   * <p>Pointers, arrays and dynamic arrays become prefixes ("{@code ptr_}",
   * "{@code arr_}", "{@code vec_}"); user types keep their own name; a
   * generic instantiation becomes its family name followed by its
   * arguments, e.g. "{@code Result_int_ptr_char}".
   */
  public static String mangle(Type type) {
    switch (type.op()) {
      case PRIMITIVE_TYPE:
        return ((PrimitiveType) type).moniker;
      case POINTER_TYPE:
        return "ptr_" + mangle(((PointerType) type).pointee);
      case ARRAY_TYPE:
        return "arr_" + mangle(((ArrayType) type).elementType);
      case DYN_ARRAY_TYPE:
        return "vec_" + mangle(((DynamicArrayType) type).elementType);
      case STRUCT_TYPE:
      case ENUM_TYPE:
        return Types.isString(type)
            ? PrimitiveType.STRING.moniker
            : ((NamedType) type).simpleName();
      case GENERIC_TYPE:
        final GenericType genericType = (GenericType) type;
        return genericType.args.stream()
            .map(CTypes::mangle)
            .collect(Collectors.joining("_", genericType.name + "_", ""));
      case TYPE_PARAM:
      default:
        throw unresolved(type);
    }
  }

  /** Returns the name of the carrier struct of a dynamic array, e.g.
   * "{@code DynamicArray_double}", "{@code DynamicArray_Point}",
   * "{@code DynamicArray_Option_int}". */
  public static String dynamicArrayName(DynamicArrayType type) {
    final Type elementType = Types.normalize(type.elementType);
    final String suffix = BUILT_IN_DYNAMIC_ARRAYS.get(elementType);
    if (suffix != null) {
      return DYNAMIC_ARRAY + suffix;
    }
    return DYNAMIC_ARRAY + mangle(elementType);
  }

  /** Returns whether the carrier of a dynamic array type is one of the
   * carriers that every unit defines. */
  public static boolean isBuiltInDynamicArray(DynamicArrayType type) {
    return BUILT_IN_DYNAMIC_ARRAYS.containsKey(
        Types.normalize(type.elementType));
  }

  /** Returns the name of the tag constant of a variant of a generic
   * instantiation, e.g. "{@code Option_int_Some}". */
  public static String tagName(GenericType type, String variant) {
    return mangle(type) + "_" + variant;
  }

  /** Returns the name of the union member that holds the value of a
   * variant, e.g. "{@code err_value}". */
  public static String valueField(BuiltInVariant variant) {
    return variant.name.toLowerCase(Locale.ROOT) + "_value";
  }

  /** Returns the name of the function that constructs a value-less variant,
   * e.g. "{@code Option_int_None_new}". */
  public static String constructorName(GenericType type, String variant) {
    return tagName(type, variant) + "_new";
  }

  /** Returns the C constant for a variant of a user enum, e.g.
   * "{@code COLOR_RED}" for {@code Color::Red}. */
  public static String enumConstant(String enumName, String variant) {
    return NamedType.simpleName(enumName).toUpperCase(Locale.ROOT)
        + "_" + variant.toUpperCase(Locale.ROOT);
  }

  /** Returns the {@code printf} conversion for a scalar type, or null if
   * values of the type cannot be printed by a single conversion. Enums,
   * which the caller must recognize, print as {@code %d}. */
  static @Nullable String conversion(Type type) {
    if (Types.isString(type)) {
      return "%s";
    }
    if (type instanceof PointerType) {
      return "%p";
    }
    if (!(type instanceof PrimitiveType)) {
      return null;
    }
    switch ((PrimitiveType) type) {
      case INT:
      case BOOL:
        return "%d";
      case FLOAT:
        return "%f";
      case CHAR:
        return "%c";
      default:
        return null;
    }
  }

  private static CompileException unresolved(Type type) {
    final String name =
        type instanceof TypeParam ? ((TypeParam) type).name : type.moniker();
    return new CompileException(ErrorKind.INTERNAL_ERROR,
        format("type parameter `%s` was not substituted before code "
            + "generation", name),
        Pos.ZERO);
  }
}

// End CTypes.java
