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

import com.google.common.collect.ImmutableSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import net.hydromatic.rapter.ast.Ast;
import net.hydromatic.rapter.ast.AstNode;
import net.hydromatic.rapter.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The result of type checking: a map from AST nodes to types.
 *
 * <p>Expressions map to their type; {@code let}, {@code const} and global
 * declarations map to the type of the variable they declare; a {@code for}
 * statement maps to the type of its loop variable. Calls to built-in methods
 * also map to the {@link BuiltInMethod} they were resolved to, so that code
 * generation does not need to resolve them again.
 *
 * <p>Nodes are keyed by identity. One map may hold the nodes of several
 * programs, such as a program and the modules it imports.
 */
public class TypeMap {
  private final Map<AstNode, Type> nodeTypes = new IdentityHashMap<>();
  private final Map<Ast.Exp, BuiltInMethod> methods = new IdentityHashMap<>();
  /** Distinct types, in the order they were first recorded. */
  private final Set<Type> types = new LinkedHashSet<>();

  void put(AstNode node, Type type) {
    nodeTypes.put(node, type);
    types.add(type);
  }

  void putMethod(Ast.Exp call, BuiltInMethod method) {
    methods.put(call, method);
  }

  /** Returns the type of an AST node; throws if the node was not checked. */
  public Type getType(AstNode node) {
    final Type type = nodeTypes.get(node);
    if (type == null) {
      throw new CompileException(ErrorKind.INTERNAL_ERROR,
          "no type for " + node, node.pos);
    }
    return type;
  }

  /** Returns an AST node's type, or null if no type is known. */
  public @Nullable Type getTypeOpt(AstNode node) {
    return nodeTypes.get(node);
  }

  /** Returns the built-in method that a call resolved to, or null if the
   * call is not a call to a built-in method. */
  public @Nullable BuiltInMethod getMethod(Ast.Exp call) {
    return methods.get(call);
  }

  /** Returns the distinct types of all nodes, in the order in which they
   * were first recorded. */
  public ImmutableSet<Type> types() {
    return ImmutableSet.copyOf(types);
  }

  /** Returns the number of typed nodes. */
  public int size() {
    return nodeTypes.size();
  }
}

// End TypeMap.java
