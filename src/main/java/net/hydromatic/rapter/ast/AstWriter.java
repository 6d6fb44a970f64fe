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
package net.hydromatic.rapter.ast;

import java.util.List;
import net.hydromatic.rapter.type.Type;

/** Prints syntax trees in source form, inserting parentheses as operator
 * precedence requires. */
public class AstWriter {
  private final StringBuilder b = new StringBuilder();

  @Override
  public String toString() {
    return b.toString();
  }

  /** Appends a string. */
  public AstWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends the source form of a type. */
  public AstWriter append(Type type) {
    b.append(type.moniker());
    return this;
  }

  /** Appends a node, which binds at least as tightly as the context. */
  public AstWriter append(AstNode node, int left, int right) {
    return node.unparse(this, left, right);
  }

  /** Appends a string literal, escaping as necessary. */
  public AstWriter appendQuoted(String s, char quote) {
    b.append(quote);
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      switch (c) {
        case '\n':
          b.append("\\n");
          break;
        case '\t':
          b.append("\\t");
          break;
        case '\\':
          b.append("\\\\");
          break;
        default:
          if (c == quote) {
            b.append('\\');
          }
          b.append(c);
      }
    }
    b.append(quote);
    return this;
  }

  /** Appends a list of nodes separated by a string. */
  public AstWriter appendAll(
      List<? extends AstNode> nodes, String start, String sep, String end) {
    b.append(start);
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        b.append(sep);
      }
      nodes.get(i).unparse(this, 0, 0);
    }
    b.append(end);
    return this;
  }

  /** Appends a statement block, "{ s1; s2; }". */
  public AstWriter block(List<? extends AstNode> statements) {
    b.append("{");
    for (AstNode statement : statements) {
      b.append(' ');
      statement.unparse(this, 0, 0);
    }
    b.append(statements.isEmpty() ? "}" : " }");
    return this;
  }

  /** Appends a call to an infix operator. */
  public AstWriter infix(int left, AstNode a0, Op op, AstNode a1, int right) {
    if (left > op.left || op.right < right) {
      return append("(").infix(0, a0, op, a1, 0).append(")");
    }
    a0.unparse(this, left, op.left);
    b.append(op.padded);
    a1.unparse(this, op.right, right);
    return this;
  }

  /** Appends a call to a prefix operator. */
  public AstWriter prefix(int left, Op op, AstNode a, int right) {
    if (left > op.left || op.right < right) {
      return append("(").prefix(0, op, a, 0).append(")");
    }
    b.append(op.padded);
    a.unparse(this, op.right, right);
    return this;
  }
}

// End AstWriter.java
