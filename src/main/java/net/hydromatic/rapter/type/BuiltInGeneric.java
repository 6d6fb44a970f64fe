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

import static com.google.common.base.Preconditions.checkArgument;
import static java.lang.String.format;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import net.hydromatic.rapter.ast.Pos;
import net.hydromatic.rapter.compile.CompileException;
import net.hydromatic.rapter.compile.ErrorKind;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Built-in generic type family.
 *
 * <p>There are exactly two; users cannot define their own. In each family,
 * the first variant is the "success" variant and the second the "failure"
 * variant, which is what the {@code ?} operator relies upon.
 */
public enum BuiltInGeneric {
  /** {@code Option<T>}, with variants {@code Some(T)} and {@code None}. */
  OPTION(
      "Option",
      ImmutableList.of("T"),
      ImmutableList.of(new BuiltInVariant("Some", 0),
          new BuiltInVariant("None", -1))),

  /** {@code Result<T, E>}, with variants {@code Ok(T)} and {@code Err(E)}. */
  RESULT(
      "Result",
      ImmutableList.of("T", "E"),
      ImmutableList.of(new BuiltInVariant("Ok", 0),
          new BuiltInVariant("Err", 1)));

  /** Name of the family, e.g. "Option". */
  public final String familyName;
  public final ImmutableList<String> typeParams;
  public final ImmutableList<BuiltInVariant> variants;

  private static final ImmutableMap<String, BuiltInGeneric> BY_NAME;

  static {
    final ImmutableMap.Builder<String, BuiltInGeneric> b =
        ImmutableMap.builder();
    for (BuiltInGeneric g : values()) {
      b.put(g.familyName, g);
    }
    BY_NAME = b.build();
  }

  BuiltInGeneric(
      String familyName,
      ImmutableList<String> typeParams,
      ImmutableList<BuiltInVariant> variants) {
    this.familyName = familyName;
    this.typeParams = typeParams;
    this.variants = variants;
    for (BuiltInVariant variant : variants) {
      checkArgument(variant.valueTypeParam < typeParams.size());
    }
  }

  /** Returns whether there is a built-in generic type with the given name. */
  public static boolean isBuiltIn(String name) {
    return BY_NAME.containsKey(name);
  }

  /** Looks up a built-in generic type by name; returns null if not found. */
  public static @Nullable BuiltInGeneric lookup(String name) {
    return BY_NAME.get(name);
  }

  /** Returns the family of a generic type, or null if the type is not an
   * instantiation of a built-in generic. */
  public static @Nullable BuiltInGeneric of(Type type) {
    return type instanceof GenericType
        ? BY_NAME.get(((GenericType) type).name)
        : null;
  }

  /** Number of type parameters. */
  public int arity() {
    return typeParams.size();
  }

  /** Returns the family's declared signature, e.g. {@code Result<T, E>},
   * whose arguments are {@link TypeParam}s. */
  public GenericType signature() {
    final ImmutableList.Builder<Type> b = ImmutableList.builder();
    typeParams.forEach(p -> b.add(new TypeParam(p)));
    return new GenericType(familyName, b.build());
  }

  /** Returns the variant with a given name, or null. */
  public @Nullable BuiltInVariant variant(String name) {
    for (BuiltInVariant variant : variants) {
      if (variant.name.equals(name)) {
        return variant;
      }
    }
    return null;
  }

  /** The variant that {@code ?} unwraps, such as {@code Ok}. */
  public BuiltInVariant successVariant() {
    return variants.get(0);
  }

  /** The variant that {@code ?} returns early with, such as {@code Err}. */
  public BuiltInVariant failureVariant() {
    return variants.get(1);
  }

  /** Creates an instantiation of this family; throws if the number of type
   * arguments is wrong. */
  public GenericType substitute(List<? extends Type> typeArgs) {
    return substitute(typeArgs, Pos.ZERO);
  }

  /** Creates an instantiation of this family, reporting a wrong number of
   * type arguments at a given position. */
  public GenericType substitute(List<? extends Type> typeArgs, Pos pos) {
    if (typeArgs.size() != arity()) {
      throw new CompileException(ErrorKind.WRONG_ARGUMENT_COUNT,
          format("Type %s expects %d type parameters, got %d", familyName,
              arity(), typeArgs.size()),
          pos);
    }
    return new GenericType(familyName, typeArgs);
  }

  /**
   * Returns the type of the value carried by a variant, given the type
   * arguments of the instantiation; returns null if the variant carries no
   * value, or does not exist, or there are too few type arguments.
   *
   * <p>For example, for {@code Err} and {@code [int, string]}, returns
   * {@code string}.
   */
  public @Nullable Type variantValueType(
      String variantName, List<? extends Type> typeArgs) {
    final BuiltInVariant variant = variant(variantName);
    if (variant == null
        || !variant.hasValue()
        || variant.valueTypeParam >= typeArgs.size()) {
      return null;
    }
    return typeArgs.get(variant.valueTypeParam);
  }

  /** Checks that a generic type is a valid instantiation of this family. */
  public void validateInstantiation(GenericType type, Pos pos) {
    checkArgument(type.name.equals(familyName));
    substitute(type.args, pos);
  }
}

// End BuiltInGeneric.java
