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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import net.hydromatic.rapter.ast.Ast;
import net.hydromatic.rapter.ast.Pos;
import net.hydromatic.rapter.type.EnumType;
import net.hydromatic.rapter.type.StructType;
import net.hydromatic.rapter.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Named entity in an {@link Environment}.
 *
 * <p>The type of a function symbol is its return type; its parameter types
 * are in {@link #paramTypes}. Struct and enum symbols carry their layout,
 * so that a symbol imported from another module is self-contained.
 */
public class Symbol {
  public final String name;
  public final Kind kind;
  public final Type type;
  public final Pos pos;
  /** Whether a variable may be assigned after its declaration. */
  public final boolean mutable;
  /** Parameter types of a function; null if the symbol is not a function. */
  public final @Nullable ImmutableList<Type> paramTypes;
  public final boolean variadic;
  /** Field layout of a struct; null if the symbol is not a struct. */
  public final @Nullable ImmutableMap<String, Type> fields;
  /** Variants of an enum, and their discriminants; null if the symbol is not
   * an enum. */
  public final @Nullable ImmutableMap<String, Long> variants;

  private Symbol(
      String name,
      Kind kind,
      Type type,
      Pos pos,
      boolean mutable,
      @Nullable ImmutableList<Type> paramTypes,
      boolean variadic,
      @Nullable ImmutableMap<String, Type> fields,
      @Nullable ImmutableMap<String, Long> variants) {
    this.name = requireNonNull(name);
    this.kind = requireNonNull(kind);
    this.type = requireNonNull(type);
    this.pos = requireNonNull(pos);
    this.mutable = mutable;
    this.paramTypes = paramTypes;
    this.variadic = variadic;
    this.fields = fields;
    this.variants = variants;
  }

  /** Creates a local or global variable. */
  public static Symbol variable(String name, Type type, boolean mutable,
      Pos pos) {
    return new Symbol(name, Kind.VARIABLE, type, pos, mutable, null, false,
        null, null);
  }

  /** Creates a function parameter. Parameters are assignable, as in C. */
  public static Symbol parameter(String name, Type type, Pos pos) {
    return new Symbol(name, Kind.PARAMETER, type, pos, true, null, false,
        null, null);
  }

  /** Creates a function. */
  public static Symbol function(String name, Iterable<? extends Type> params,
      Type returnType, boolean variadic, Pos pos) {
    return new Symbol(name, Kind.FUNCTION, returnType, pos, false,
        ImmutableList.copyOf(params), variadic, null, null);
  }

  /** Creates a symbol for a function declaration. */
  public static Symbol of(Ast.Function function) {
    return function(function.name, paramTypes(function.params),
        function.returnType, false, function.pos);
  }

  /** Creates a symbol for an external function declaration. */
  public static Symbol of(Ast.ExternFunction function) {
    return function(function.name, paramTypes(function.params),
        function.returnType, function.variadic, function.pos);
  }

  /** Creates a symbol, with field layout, for a struct declaration. */
  public static Symbol of(Ast.StructDecl struct) {
    final ImmutableMap.Builder<String, Type> fields = ImmutableMap.builder();
    struct.fields.forEach(f -> fields.put(f.name, f.type));
    return new Symbol(struct.name, Kind.STRUCT, new StructType(struct.name),
        struct.pos, false, null, false, fields.buildKeepingLast(), null);
  }

  /** Creates a symbol, with discriminants, for an enum declaration. */
  public static Symbol of(Ast.EnumDecl enumDecl) {
    return new Symbol(enumDecl.name, Kind.ENUM, new EnumType(enumDecl.name),
        enumDecl.pos, false, null, false, null, discriminants(enumDecl));
  }

  /** Computes the discriminant of each variant of an enum. A variant without
   * an explicit value has the value of the previous variant plus one; the
   * first variant defaults to 0. */
  public static ImmutableMap<String, Long> discriminants(Ast.EnumDecl enumDecl) {
    final Map<String, Long> map = new LinkedHashMap<>();
    long next = 0;
    for (Ast.EnumVariant variant : enumDecl.variants) {
      final long value = variant.value != null ? variant.value : next;
      map.putIfAbsent(variant.name, value);
      next = value + 1;
    }
    return ImmutableMap.copyOf(map);
  }

  private static ImmutableList<Type> paramTypes(List<Ast.Param> params) {
    final ImmutableList.Builder<Type> b = ImmutableList.builder();
    params.forEach(p -> b.add(p.type));
    return b.build();
  }

  /** Returns a copy of this symbol with a different name; used to bind an
   * imported symbol under its qualified name. */
  public Symbol withName(String name) {
    return name.equals(this.name)
        ? this
        : new Symbol(name, kind, type, pos, mutable, paramTypes, variadic,
            fields, variants);
  }

  @Override
  public String toString() {
    return kind.name().toLowerCase(Locale.ROOT) + " " + name + ": "
        + type.moniker();
  }

  /** Role of a symbol. */
  public enum Kind {
    FUNCTION,
    STRUCT,
    ENUM,
    VARIABLE,
    PARAMETER;

    /** Returns whether a symbol of this kind denotes a value. */
    public boolean isValue() {
      return this == VARIABLE || this == PARAMETER;
    }
  }
}

// End Symbol.java
