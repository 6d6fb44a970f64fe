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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.rapter.type.PrimitiveType;
import net.hydromatic.rapter.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds parse tree nodes.
 *
 * <p>The parser calls these methods; so do tests, which build trees
 * directly. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  // program and declarations

  public Ast.Program program(
      Pos pos,
      List<Ast.Import> imports,
      List<Ast.Export> exports,
      List<Ast.ExternFunction> externFunctions,
      List<Ast.Function> functions,
      List<Ast.StructDecl> structs,
      List<Ast.EnumDecl> enums,
      List<Ast.Global> globals) {
    return new Ast.Program(
        pos,
        ImmutableList.copyOf(imports),
        ImmutableList.copyOf(exports),
        ImmutableList.copyOf(externFunctions),
        ImmutableList.copyOf(functions),
        ImmutableList.copyOf(structs),
        ImmutableList.copyOf(enums),
        ImmutableList.copyOf(globals));
  }

  public Ast.Import import_(Pos pos, String module, @Nullable String alias) {
    return new Ast.Import(pos, module, alias);
  }

  public Ast.Export export(Pos pos, Ast.ExportKind kind, String name) {
    return new Ast.Export(pos, kind, name);
  }

  public Ast.Param param(Pos pos, String name, Type type) {
    return new Ast.Param(pos, name, type);
  }

  public Ast.ExternFunction externFunction(
      Pos pos,
      String name,
      List<Ast.Param> params,
      @Nullable Type returnType,
      boolean variadic) {
    return new Ast.ExternFunction(
        pos,
        name,
        ImmutableList.copyOf(params),
        returnType == null ? PrimitiveType.VOID : returnType,
        variadic);
  }

  /** Creates a function; a null return type means "void". */
  public Ast.Function function(
      Pos pos,
      String name,
      List<Ast.Param> params,
      @Nullable Type returnType,
      List<? extends Ast.Stmt> body) {
    return new Ast.Function(
        pos,
        name,
        ImmutableList.copyOf(params),
        returnType == null ? PrimitiveType.VOID : returnType,
        ImmutableList.copyOf(body));
  }

  public Ast.Field field(Pos pos, String name, Type type) {
    return new Ast.Field(pos, name, type);
  }

  public Ast.StructDecl structDecl(
      Pos pos, String name, List<Ast.Field> fields) {
    return new Ast.StructDecl(pos, name, ImmutableList.copyOf(fields));
  }

  public Ast.EnumVariant enumVariant(
      Pos pos, String name, @Nullable Long value) {
    return new Ast.EnumVariant(pos, name, value);
  }

  public Ast.EnumDecl enumDecl(
      Pos pos, String name, List<Ast.EnumVariant> variants) {
    return new Ast.EnumDecl(pos, name, ImmutableList.copyOf(variants));
  }

  public Ast.Global global(
      Pos pos,
      String name,
      @Nullable Type type,
      boolean mutable,
      Ast.@Nullable Exp init) {
    return new Ast.Global(pos, name, type, mutable, init);
  }

  // statements

  public Ast.LetStmt let(
      Pos pos,
      String name,
      @Nullable Type type,
      boolean mutable,
      Ast.@Nullable Exp init) {
    return new Ast.LetStmt(pos, name, type, mutable, init);
  }

  public Ast.ConstStmt const_(
      Pos pos, String name, @Nullable Type type, Ast.Exp init) {
    return new Ast.ConstStmt(pos, name, type, init);
  }

  public Ast.AssignStmt assign(Pos pos, Ast.Exp target, Ast.Exp value) {
    return new Ast.AssignStmt(pos, target, value);
  }

  public Ast.ReturnStmt return_(Pos pos, Ast.@Nullable Exp value) {
    return new Ast.ReturnStmt(pos, value);
  }

  public Ast.IfStmt if_(
      Pos pos,
      Ast.Exp condition,
      List<? extends Ast.Stmt> thenBlock,
      @Nullable List<? extends Ast.Stmt> elseBlock) {
    return new Ast.IfStmt(
        pos,
        condition,
        ImmutableList.copyOf(thenBlock),
        elseBlock == null ? null : ImmutableList.copyOf(elseBlock));
  }

  public Ast.WhileStmt while_(
      Pos pos, Ast.Exp condition, List<? extends Ast.Stmt> body) {
    return new Ast.WhileStmt(pos, condition, ImmutableList.copyOf(body));
  }

  public Ast.ForStmt for_(
      Pos pos, String variable, Ast.Exp iterable,
      List<? extends Ast.Stmt> body) {
    return new Ast.ForStmt(pos, variable, iterable, ImmutableList.copyOf(body));
  }

  public Ast.JumpStmt break_(Pos pos) {
    return new Ast.JumpStmt(pos, Op.BREAK);
  }

  public Ast.JumpStmt continue_(Pos pos) {
    return new Ast.JumpStmt(pos, Op.CONTINUE);
  }

  public Ast.ExpStmt expStmt(Pos pos, Ast.Exp exp) {
    return new Ast.ExpStmt(pos, exp);
  }

  // literals

  public Ast.Literal intLiteral(Pos pos, long value) {
    return new Ast.Literal(pos, Op.INT_LITERAL, value);
  }

  public Ast.Literal floatLiteral(Pos pos, double value) {
    return new Ast.Literal(pos, Op.FLOAT_LITERAL, value);
  }

  public Ast.Literal boolLiteral(Pos pos, boolean value) {
    return new Ast.Literal(pos, Op.BOOL_LITERAL, value);
  }

  public Ast.Literal charLiteral(Pos pos, char value) {
    return new Ast.Literal(pos, Op.CHAR_LITERAL, value);
  }

  public Ast.Literal stringLiteral(Pos pos, String value) {
    return new Ast.Literal(pos, Op.STRING_LITERAL, value);
  }

  // expressions

  public Ast.Id id(Pos pos, String name) {
    return new Ast.Id(pos, name);
  }

  /** Creates a call to a binary operator. */
  public Ast.InfixCall infix(Pos pos, Op op, Ast.Exp a0, Ast.Exp a1) {
    return new Ast.InfixCall(pos, op, a0, a1);
  }

  /** Creates a call to a binary operator, given its source name, e.g. "+". */
  public Ast.InfixCall infix(Pos pos, String opName, Ast.Exp a0, Ast.Exp a1) {
    final Op op = Op.BY_OP_NAME.get(opName);
    if (op == null) {
      throw new IllegalArgumentException("unknown operator " + opName);
    }
    return infix(pos, op, a0, a1);
  }

  public Ast.PrefixCall negate(Pos pos, Ast.Exp a) {
    return new Ast.PrefixCall(pos, Op.NEGATE, a);
  }

  public Ast.PrefixCall not(Pos pos, Ast.Exp a) {
    return new Ast.PrefixCall(pos, Op.NOT, a);
  }

  public Ast.PrefixCall deref(Pos pos, Ast.Exp a) {
    return new Ast.PrefixCall(pos, Op.DEREF, a);
  }

  public Ast.PrefixCall addressOf(Pos pos, Ast.Exp a) {
    return new Ast.PrefixCall(pos, Op.ADDRESS_OF, a);
  }

  public Ast.Apply apply(Pos pos, Ast.Exp fn, List<? extends Ast.Exp> args) {
    return new Ast.Apply(pos, fn, ImmutableList.copyOf(args));
  }

  /** Creates a call to a named function, "f(args)". */
  public Ast.Apply call(Pos pos, String name, List<? extends Ast.Exp> args) {
    return apply(pos, id(pos, name), args);
  }

  public Ast.MethodCall methodCall(
      Pos pos, Ast.Exp object, String method, List<? extends Ast.Exp> args) {
    return new Ast.MethodCall(pos, object, method, ImmutableList.copyOf(args));
  }

  public Ast.ArrayLiteral arrayLiteral(
      Pos pos, List<? extends Ast.Exp> elements) {
    return new Ast.ArrayLiteral(pos, ImmutableList.copyOf(elements));
  }

  public Ast.DynArrayLiteral dynArrayLiteral(
      Pos pos, Type elementType, List<? extends Ast.Exp> elements) {
    return new Ast.DynArrayLiteral(
        pos, elementType, ImmutableList.copyOf(elements));
  }

  public Ast.Index index(Pos pos, Ast.Exp array, Ast.Exp index) {
    return new Ast.Index(pos, array, index);
  }

  public Ast.FieldAccess fieldAccess(Pos pos, Ast.Exp object, String field) {
    return new Ast.FieldAccess(pos, object, field);
  }

  public Ast.StructLiteral structLiteral(
      Pos pos, String name, Map<String, ? extends Ast.Exp> fields) {
    return new Ast.StructLiteral(pos, name, ImmutableMap.copyOf(fields));
  }

  public Ast.Range range(Pos pos, Ast.Exp start, Ast.Exp end) {
    return new Ast.Range(pos, start, end);
  }

  public Ast.Allocation new_(Pos pos, Ast.Exp exp) {
    return new Ast.Allocation(pos, Op.NEW, exp);
  }

  public Ast.Allocation delete(Pos pos, Ast.Exp exp) {
    return new Ast.Allocation(pos, Op.DELETE, exp);
  }

  public Ast.Cast cast(Pos pos, Ast.Exp exp, Type type) {
    return new Ast.Cast(pos, exp, type);
  }

  public Ast.Ternary ternary(
      Pos pos, Ast.Exp condition, Ast.Exp ifTrue, Ast.Exp ifFalse) {
    return new Ast.Ternary(pos, condition, ifTrue, ifFalse);
  }

  public Ast.EnumAccess enumAccess(Pos pos, String enumName, String variant) {
    return new Ast.EnumAccess(pos, enumName, variant);
  }

  /** Creates a variant construction, "Option::Some(x)". */
  public Ast.Apply construct(
      Pos pos, String enumName, String variant, Ast.Exp arg) {
    return apply(pos, enumAccess(pos, enumName, variant), ImmutableList.of(arg));
  }

  public Ast.Match match(
      Pos pos, Ast.Exp exp, List<Ast.MatchArm> arms) {
    return new Ast.Match(pos, exp, ImmutableList.copyOf(arms));
  }

  public Ast.MatchArm matchArm(Pos pos, Ast.Pat pat, Ast.Exp exp) {
    return new Ast.MatchArm(pos, pat, exp);
  }

  public Ast.Try try_(Pos pos, Ast.Exp exp) {
    return new Ast.Try(pos, exp);
  }

  // patterns

  public Ast.WildcardPat wildcardPat(Pos pos) {
    return new Ast.WildcardPat(pos);
  }

  public Ast.LiteralPat literalPat(Pos pos, Ast.Literal literal) {
    return new Ast.LiteralPat(pos, literal);
  }

  public Ast.VariantPat variantPat(
      Pos pos, String enumName, String variant, @Nullable String binding) {
    return new Ast.VariantPat(pos, enumName, variant, binding);
  }
}

// End AstBuilder.java
