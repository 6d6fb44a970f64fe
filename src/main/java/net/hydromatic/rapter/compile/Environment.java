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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.rapter.ast.Pos;
import net.hydromatic.rapter.type.NamedType;
import net.hydromatic.rapter.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Symbol table used while checking a program.
 *
 * <p>Holds a stack of scopes, innermost first. A name may be defined at most
 * once per scope, but may shadow a name in an enclosing scope. The outermost
 * scope holds imported symbols and the program's top-level declarations.
 *
 * <p>Also holds the layout of every struct (field name to type) and enum
 * (variant name to discriminant) that is visible to the program, keyed by
 * the name under which it is visible.
 *
 * <p>An environment belongs to one compilation of one program; it is not
 * thread-safe.
 */
public class Environment {
  private final Deque<Map<String, Symbol>> scopes = new ArrayDeque<>();
  private final Map<String, ImmutableMap<String, Type>> structLayouts =
      new HashMap<>();
  private final Map<String, ImmutableMap<String, Long>> enumLayouts =
      new HashMap<>();

  /** Creates an environment with one (global) scope. */
  public Environment() {
    pushScope();
  }

  /** Enters a new scope. */
  public void pushScope() {
    scopes.push(new LinkedHashMap<>());
  }

  /** Leaves the current scope, discarding its symbols. */
  public void popScope() {
    checkState(scopes.size() > 1, "cannot pop the global scope");
    scopes.pop();
  }

  /** Returns the number of scopes, including the global scope. */
  public int depth() {
    return scopes.size();
  }

  /** Defines a symbol in the current scope.
   *
   * @throws CompileException if the name is already defined in the current
   * scope */
  public void insert(Symbol symbol) {
    insert(symbol.name, symbol, symbol.pos);
  }

  /** Defines a symbol under a given name, reporting a duplicate at a given
   * position. */
  public void insert(String name, Symbol symbol, Pos pos) {
    final Map<String, Symbol> scope = scopes.element();
    final Symbol previous = scope.get(name);
    if (previous != null) {
      throw CompileException.duplicateDefinition(name, pos, previous.pos);
    }
    scope.put(name, symbol);
  }

  /** Looks up a name, innermost scope first; returns null if not found. */
  public @Nullable Symbol lookup(String name) {
    for (Map<String, Symbol> scope : scopes) {
      final Symbol symbol = scope.get(name);
      if (symbol != null) {
        return symbol;
      }
    }
    return null;
  }

  /** Returns whether any visible name is qualified by the given prefix,
   * that is, whether a module is imported under that name. */
  public boolean hasQualifier(String qualifier) {
    final String prefix = qualifier + ".";
    for (Map<String, Symbol> scope : scopes) {
      for (String name : scope.keySet()) {
        if (name.startsWith(prefix)) {
          return true;
        }
      }
    }
    return false;
  }

  /** Records the layout of a struct. */
  public void defineStruct(String name, ImmutableMap<String, Type> fields) {
    structLayouts.put(name, fields);
  }

  /** Records the variants of an enum. */
  public void defineEnum(String name, ImmutableMap<String, Long> variants) {
    enumLayouts.put(name, variants);
  }

  /** Returns the layout of a struct, or null if there is no such struct.
   * A qualified name such as "{@code geometry.Point}" falls back to its
   * simple name. */
  public @Nullable ImmutableMap<String, Type> structLayout(String name) {
    final ImmutableMap<String, Type> layout = structLayouts.get(name);
    return layout != null
        ? layout
        : structLayouts.get(NamedType.simpleName(name));
  }

  /** Returns the variants of an enum, or null if there is no such enum. */
  public @Nullable ImmutableMap<String, Long> enumLayout(String name) {
    final ImmutableMap<String, Long> layout = enumLayouts.get(name);
    return layout != null
        ? layout
        : enumLayouts.get(NamedType.simpleName(name));
  }

  /** Returns the variants of the enum that a type denotes, or null if the
   * type is not an enum. The parser writes every named type as a struct, so
   * this looks at the name, not the class, of the type. */
  public @Nullable ImmutableMap<String, Long> enumLayout(Type type) {
    return type instanceof NamedType
        ? enumLayout(((NamedType) type).name)
        : null;
  }
}

// End Environment.java
