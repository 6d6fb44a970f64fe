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

import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Sub-types of {@link AstNode}, and kinds of {@link
 * net.hydromatic.rapter.type.Type}. */
public enum Op {
  // identifiers
  ID(true),

  // literals
  BOOL_LITERAL(true),
  CHAR_LITERAL(true),
  INT_LITERAL(true),
  FLOAT_LITERAL(true),
  STRING_LITERAL(true),

  // patterns
  WILDCARD_PAT,
  LITERAL_PAT,
  VARIANT_PAT,

  // binary operators, loosest first
  OR(" || ", 1),
  AND(" && ", 2),
  EQ(" == ", 3),
  NE(" != ", 3),
  LT(" < ", 4),
  LE(" <= ", 4),
  GT(" > ", 4),
  GE(" >= ", 4),
  PLUS(" + ", 5),
  MINUS(" - ", 5),
  TIMES(" * ", 6),
  DIVIDE(" / ", 6),
  MOD(" % ", 6),

  // prefix operators
  NEGATE("-", 7),
  NOT("!", 7),
  DEREF("*", 7),
  ADDRESS_OF("&", 7),

  // other expressions
  APPLY(true),
  METHOD_CALL(true),
  ARRAY_LITERAL(true),
  DYN_ARRAY_LITERAL(true),
  INDEX(true),
  FIELD_ACCESS(true),
  STRUCT_LITERAL(true),
  RANGE(" .. ", 0),
  NEW("new ", 7),
  DELETE("delete ", 7),
  CAST(" as ", 8),
  TERNARY(" ? ", 0, false),
  ENUM_ACCESS(true),
  MATCH,
  MATCH_ARM,
  TRY(true),

  // statements
  LET,
  CONST,
  ASSIGN,
  RETURN,
  IF,
  WHILE,
  FOR,
  BREAK,
  CONTINUE,
  EXP_STMT,

  // declarations
  PROGRAM,
  IMPORT,
  EXPORT,
  EXTERN_FUNCTION,
  FUNCTION,
  PARAM,
  STRUCT_DECL,
  FIELD_DECL,
  ENUM_DECL,
  ENUM_VARIANT_DECL,
  GLOBAL,

  // types
  PRIMITIVE_TYPE,
  POINTER_TYPE,
  ARRAY_TYPE,
  DYN_ARRAY_TYPE,
  STRUCT_TYPE,
  ENUM_TYPE,
  GENERIC_TYPE,
  TYPE_PARAM;

  public final @Nullable String padded;
  public final int left;
  public final int right;

  /** The operator as it appears in source and in C, e.g. "&&" for
   * {@link #AND}; null if this op is not an operator. */
  public final @Nullable String opName;

  /** Binary operators, keyed by {@link #opName}. */
  public static final ImmutableMap<String, Op> BY_OP_NAME;

  static {
    final ImmutableMap.Builder<String, Op> b = ImmutableMap.builder();
    for (Op op : values()) {
      if (op.isBinary()) {
        b.put(op.opName, op);
      }
    }
    BY_OP_NAME = b.build();
  }

  Op() {
    this(null, 0, 0);
  }

  Op(boolean atom) {
    this("", 99, 99);
    assert atom;
  }

  Op(String padded, int precedence) {
    this(padded, precedence, true);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(
        padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0));
  }

  Op(@Nullable String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
    this.opName = padded == null || padded.isEmpty() ? null : padded.trim();
  }

  /** Returns whether this is a binary operator. */
  public boolean isBinary() {
    return ordinal() >= OR.ordinal() && ordinal() <= MOD.ordinal();
  }

  /** Returns whether this is an arithmetic operator. */
  public boolean isArithmetic() {
    return ordinal() >= PLUS.ordinal() && ordinal() <= MOD.ordinal();
  }

  /** Returns whether this is a comparison operator. */
  public boolean isComparison() {
    return ordinal() >= EQ.ordinal() && ordinal() <= GE.ordinal();
  }
}

// End Op.java
