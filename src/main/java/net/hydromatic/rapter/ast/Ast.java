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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.rapter.type.PrimitiveType;
import net.hydromatic.rapter.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Various sub-classes of AST nodes. */
public class Ast {
  private Ast() {}

  //---------------------------------------------------------------------------
  // Program and top-level declarations

  /** A compilation unit: one source file. */
  public static class Program extends AstNode {
    public final ImmutableList<Import> imports;
    public final ImmutableList<Export> exports;
    public final ImmutableList<ExternFunction> externFunctions;
    public final ImmutableList<Function> functions;
    public final ImmutableList<StructDecl> structs;
    public final ImmutableList<EnumDecl> enums;
    public final ImmutableList<Global> globals;

    Program(
        Pos pos,
        ImmutableList<Import> imports,
        ImmutableList<Export> exports,
        ImmutableList<ExternFunction> externFunctions,
        ImmutableList<Function> functions,
        ImmutableList<StructDecl> structs,
        ImmutableList<EnumDecl> enums,
        ImmutableList<Global> globals) {
      super(pos, Op.PROGRAM);
      this.imports = requireNonNull(imports);
      this.exports = requireNonNull(exports);
      this.externFunctions = requireNonNull(externFunctions);
      this.functions = requireNonNull(functions);
      this.structs = requireNonNull(structs);
      this.enums = requireNonNull(enums);
      this.globals = requireNonNull(globals);
    }

    /** Returns the function with a given name, or null. */
    public @Nullable Function function(String name) {
      for (Function function : functions) {
        if (function.name.equals(name)) {
          return function;
        }
      }
      return null;
    }

    /** Returns the struct with a given name, or null. */
    public @Nullable StructDecl struct(String name) {
      for (StructDecl struct : structs) {
        if (struct.name.equals(name)) {
          return struct;
        }
      }
      return null;
    }

    /** Returns the enum with a given name, or null. */
    public @Nullable EnumDecl enum_(String name) {
      for (EnumDecl enumDecl : enums) {
        if (enumDecl.name.equals(name)) {
          return enumDecl;
        }
      }
      return null;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      imports.forEach(i -> w.append(i, 0, 0).append("\n"));
      exports.forEach(e -> w.append(e, 0, 0).append("\n"));
      externFunctions.forEach(e -> w.append(e, 0, 0).append("\n"));
      structs.forEach(s -> w.append(s, 0, 0).append("\n"));
      enums.forEach(e -> w.append(e, 0, 0).append("\n"));
      globals.forEach(g -> w.append(g, 0, 0).append("\n"));
      functions.forEach(f -> w.append(f, 0, 0).append("\n"));
      return w;
    }
  }

  /** Import declaration, "import a.b as c;". */
  public static class Import extends AstNode {
    public final String module;
    public final @Nullable String alias;

    Import(Pos pos, String module, @Nullable String alias) {
      super(pos, Op.IMPORT);
      this.module = requireNonNull(module);
      this.alias = alias;
    }

    /** Returns the prefix by which the module's symbols are qualified. */
    public String prefix() {
      return alias != null ? alias : module;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("import ").append(module);
      if (alias != null) {
        w.append(" as ").append(alias);
      }
      return w.append(";");
    }
  }

  /** What kind of declaration an {@link Export} names. */
  public enum ExportKind {
    FUNCTION,
    STRUCT,
    ENUM
  }

  /** Export declaration, "export fn f;". */
  public static class Export extends AstNode {
    public final ExportKind kind;
    public final String name;

    Export(Pos pos, ExportKind kind, String name) {
      super(pos, Op.EXPORT);
      this.kind = requireNonNull(kind);
      this.name = requireNonNull(name);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      final String keyword =
          kind == ExportKind.FUNCTION ? "fn" : kind.name().toLowerCase();
      return w.append("export ").append(keyword).append(" ").append(name)
          .append(";");
    }
  }

  /** Parameter of a function, "name: type". */
  public static class Param extends AstNode {
    public final String name;
    public final Type type;

    Param(Pos pos, String name, Type type) {
      super(pos, Op.PARAM);
      this.name = requireNonNull(name);
      this.type = requireNonNull(type);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name).append(": ").append(type);
    }
  }

  /** Function implemented in C, "extern fn printf(fmt: string, ...);". */
  public static class ExternFunction extends AstNode {
    public final String name;
    public final ImmutableList<Param> params;
    public final Type returnType;
    public final boolean variadic;

    ExternFunction(
        Pos pos,
        String name,
        ImmutableList<Param> params,
        Type returnType,
        boolean variadic) {
      super(pos, Op.EXTERN_FUNCTION);
      this.name = requireNonNull(name);
      this.params = requireNonNull(params);
      this.returnType = requireNonNull(returnType);
      this.variadic = variadic;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("extern fn ").append(name)
          .appendAll(params, "(", ", ", variadic ? ", ...)" : ")");
      return w.append(" -> ").append(returnType).append(";");
    }
  }

  /** Function declaration. */
  public static class Function extends AstNode {
    public final String name;
    public final ImmutableList<Param> params;
    /** Declared return type; {@link PrimitiveType#VOID} if none. */
    public final Type returnType;
    public final ImmutableList<Stmt> body;

    Function(
        Pos pos,
        String name,
        ImmutableList<Param> params,
        Type returnType,
        ImmutableList<Stmt> body) {
      super(pos, Op.FUNCTION);
      this.name = requireNonNull(name);
      this.params = requireNonNull(params);
      this.returnType = requireNonNull(returnType);
      this.body = requireNonNull(body);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("fn ").append(name).appendAll(params, "(", ", ", ")");
      if (returnType != PrimitiveType.VOID) {
        w.append(" -> ").append(returnType);
      }
      return w.append(" ").block(body);
    }
  }

  /** Field of a struct declaration. */
  public static class Field extends AstNode {
    public final String name;
    public final Type type;

    Field(Pos pos, String name, Type type) {
      super(pos, Op.FIELD_DECL);
      this.name = requireNonNull(name);
      this.type = requireNonNull(type);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name).append(": ").append(type);
    }
  }

  /** Struct declaration, a named product type. */
  public static class StructDecl extends AstNode {
    public final String name;
    public final ImmutableList<Field> fields;

    StructDecl(Pos pos, String name, ImmutableList<Field> fields) {
      super(pos, Op.STRUCT_DECL);
      this.name = requireNonNull(name);
      this.fields = requireNonNull(fields);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("struct ").append(name).appendAll(fields, " { ", ", ",
          " }");
    }
  }

  /** Variant of an enum declaration, with an optional explicit value. */
  public static class EnumVariant extends AstNode {
    public final String name;
    public final @Nullable Long value;

    EnumVariant(Pos pos, String name, @Nullable Long value) {
      super(pos, Op.ENUM_VARIANT_DECL);
      this.name = requireNonNull(name);
      this.value = value;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(name);
      return value == null ? w : w.append(" = ").append(value.toString());
    }
  }

  /** Enum declaration, a named sum type without payloads. */
  public static class EnumDecl extends AstNode {
    public final String name;
    public final ImmutableList<EnumVariant> variants;

    EnumDecl(Pos pos, String name, ImmutableList<EnumVariant> variants) {
      super(pos, Op.ENUM_DECL);
      this.name = requireNonNull(name);
      this.variants = requireNonNull(variants);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("enum ").append(name).appendAll(variants, " { ", ", ",
          " }");
    }
  }

  /** Global variable declaration. */
  public static class Global extends AstNode {
    public final String name;
    public final @Nullable Type type;
    public final boolean mutable;
    public final @Nullable Exp init;

    Global(
        Pos pos,
        String name,
        @Nullable Type type,
        boolean mutable,
        @Nullable Exp init) {
      super(pos, Op.GLOBAL);
      this.name = requireNonNull(name);
      this.type = type;
      this.mutable = mutable;
      this.init = init;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return declaration(w, mutable ? "let mut " : "let ", name, type, init);
    }
  }

  static AstWriter declaration(
      AstWriter w,
      String keyword,
      String name,
      @Nullable Type type,
      @Nullable Exp init) {
    w.append(keyword).append(name);
    if (type != null) {
      w.append(": ").append(type);
    }
    if (init != null) {
      w.append(" = ").append(init, 0, 0);
    }
    return w.append(";");
  }

  //---------------------------------------------------------------------------
  // Statements

  /** Base class for statements. */
  public abstract static class Stmt extends AstNode {
    Stmt(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** "let" statement. */
  public static class LetStmt extends Stmt {
    public final String name;
    public final @Nullable Type type;
    public final boolean mutable;
    public final @Nullable Exp init;

    LetStmt(
        Pos pos,
        String name,
        @Nullable Type type,
        boolean mutable,
        @Nullable Exp init) {
      super(pos, Op.LET);
      this.name = requireNonNull(name);
      this.type = type;
      this.mutable = mutable;
      this.init = init;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return declaration(w, mutable ? "let mut " : "let ", name, type, init);
    }
  }

  /** "const" statement. */
  public static class ConstStmt extends Stmt {
    public final String name;
    public final @Nullable Type type;
    public final Exp init;

    ConstStmt(Pos pos, String name, @Nullable Type type, Exp init) {
      super(pos, Op.CONST);
      this.name = requireNonNull(name);
      this.type = type;
      this.init = requireNonNull(init);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return declaration(w, "const ", name, type, init);
    }
  }

  /** Assignment statement, "target = value;". */
  public static class AssignStmt extends Stmt {
    public final Exp target;
    public final Exp value;

    AssignStmt(Pos pos, Exp target, Exp value) {
      super(pos, Op.ASSIGN);
      this.target = requireNonNull(target);
      this.value = requireNonNull(value);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(target, 0, 0).append(" = ").append(value, 0, 0)
          .append(";");
    }
  }

  /** "return" statement, with an optional value. */
  public static class ReturnStmt extends Stmt {
    public final @Nullable Exp value;

    ReturnStmt(Pos pos, @Nullable Exp value) {
      super(pos, Op.RETURN);
      this.value = value;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (value == null) {
        return w.append("return;");
      }
      return w.append("return ").append(value, 0, 0).append(";");
    }
  }

  /** "if" statement; {@link #elseBlock} is null if there is no "else". */
  public static class IfStmt extends Stmt {
    public final Exp condition;
    public final ImmutableList<Stmt> thenBlock;
    public final @Nullable ImmutableList<Stmt> elseBlock;

    IfStmt(
        Pos pos,
        Exp condition,
        ImmutableList<Stmt> thenBlock,
        @Nullable ImmutableList<Stmt> elseBlock) {
      super(pos, Op.IF);
      this.condition = requireNonNull(condition);
      this.thenBlock = requireNonNull(thenBlock);
      this.elseBlock = elseBlock;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("if ").append(condition, 0, 0).append(" ").block(thenBlock);
      if (elseBlock != null) {
        w.append(" else ").block(elseBlock);
      }
      return w;
    }
  }

  /** "while" statement. */
  public static class WhileStmt extends Stmt {
    public final Exp condition;
    public final ImmutableList<Stmt> body;

    WhileStmt(Pos pos, Exp condition, ImmutableList<Stmt> body) {
      super(pos, Op.WHILE);
      this.condition = requireNonNull(condition);
      this.body = requireNonNull(body);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("while ").append(condition, 0, 0).append(" ")
          .block(body);
    }
  }

  /** "for" statement, "for v in iterable { ... }". */
  public static class ForStmt extends Stmt {
    public final String variable;
    public final Exp iterable;
    public final ImmutableList<Stmt> body;

    ForStmt(Pos pos, String variable, Exp iterable, ImmutableList<Stmt> body) {
      super(pos, Op.FOR);
      this.variable = requireNonNull(variable);
      this.iterable = requireNonNull(iterable);
      this.body = requireNonNull(body);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("for ").append(variable).append(" in ")
          .append(iterable, 0, 0).append(" ").block(body);
    }
  }

  /** "break" or "continue" statement. */
  public static class JumpStmt extends Stmt {
    JumpStmt(Pos pos, Op op) {
      super(pos, op);
      checkArgument(op == Op.BREAK || op == Op.CONTINUE);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(op == Op.BREAK ? "break;" : "continue;");
    }
  }

  /** Statement that evaluates an expression for its effects. */
  public static class ExpStmt extends Stmt {
    public final Exp exp;

    ExpStmt(Pos pos, Exp exp) {
      super(pos, Op.EXP_STMT);
      this.exp = requireNonNull(exp);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(exp, 0, 0).append(";");
    }
  }

  //---------------------------------------------------------------------------
  // Expressions

  /** Base class for expressions. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Literal. The value is a {@link Long}, {@link Double}, {@link Boolean},
   * {@link Character} or {@link String}, according to the op. */
  public static class Literal extends Exp {
    public final Comparable value;

    Literal(Pos pos, Op op, Comparable value) {
      super(pos, op);
      this.value = requireNonNull(value);
    }

    /** Returns whether this is a numeric literal whose value is zero. */
    public boolean isZero() {
      return op == Op.INT_LITERAL && (Long) value == 0L
          || op == Op.FLOAT_LITERAL && (Double) value == 0D;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      switch (op) {
        case STRING_LITERAL:
          return w.appendQuoted((String) value, '"');
        case CHAR_LITERAL:
          return w.appendQuoted(value.toString(), '\'');
        default:
          return w.append(value.toString());
      }
    }
  }

  /** Identifier. */
  public static class Id extends Exp {
    public final String name;

    Id(Pos pos, String name) {
      super(pos, Op.ID);
      this.name = requireNonNull(name);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name);
    }
  }

  /** Call to a binary operator, such as "a + b". */
  public static class InfixCall extends Exp {
    public final Exp a0;
    public final Exp a1;

    InfixCall(Pos pos, Op op, Exp a0, Exp a1) {
      super(pos, op);
      checkArgument(op.isBinary(), "not binary: %s", op);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, a0, op, a1, right);
    }
  }

  /** Call to a prefix operator, such as "-a" or "*p". */
  public static class PrefixCall extends Exp {
    public final Exp a;

    PrefixCall(Pos pos, Op op, Exp a) {
      super(pos, op);
      this.a = requireNonNull(a);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.prefix(left, op, a, right);
    }
  }

  /**
   * Function call, "fn(args)".
   *
   * <p>The callee is an {@link Id} ("f(x)"), a {@link FieldAccess} ("m.f(x)"
   * or "s.length()") or an {@link EnumAccess} ("Option::Some(x)").
   */
  public static class Apply extends Exp {
    public final Exp fn;
    public final ImmutableList<Exp> args;

    Apply(Pos pos, Exp fn, ImmutableList<Exp> args) {
      super(pos, Op.APPLY);
      this.fn = requireNonNull(fn);
      this.args = requireNonNull(args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(fn, left, op.left).appendAll(args, "(", ", ", ")");
    }
  }

  /** Method call, "object.method(args)". */
  public static class MethodCall extends Exp {
    public final Exp object;
    public final String method;
    public final ImmutableList<Exp> args;

    MethodCall(Pos pos, Exp object, String method, ImmutableList<Exp> args) {
      super(pos, Op.METHOD_CALL);
      this.object = requireNonNull(object);
      this.method = requireNonNull(method);
      this.args = requireNonNull(args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(object, left, op.left).append(".").append(method)
          .appendAll(args, "(", ", ", ")");
    }
  }

  /** Fixed-size array literal, "[a, b, c]". */
  public static class ArrayLiteral extends Exp {
    public final ImmutableList<Exp> elements;

    ArrayLiteral(Pos pos, ImmutableList<Exp> elements) {
      super(pos, Op.ARRAY_LITERAL);
      this.elements = requireNonNull(elements);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendAll(elements, "[", ", ", "]");
    }
  }

  /** Dynamic array literal, "DynamicArray[int][a, b]". */
  public static class DynArrayLiteral extends Exp {
    public final Type elementType;
    public final ImmutableList<Exp> elements;

    DynArrayLiteral(Pos pos, Type elementType, ImmutableList<Exp> elements) {
      super(pos, Op.DYN_ARRAY_LITERAL);
      this.elementType = requireNonNull(elementType);
      this.elements = requireNonNull(elements);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("DynamicArray[").append(elementType).append("]")
          .appendAll(elements, "[", ", ", "]");
    }
  }

  /** Index expression, "a[i]". */
  public static class Index extends Exp {
    public final Exp array;
    public final Exp index;

    Index(Pos pos, Exp array, Exp index) {
      super(pos, Op.INDEX);
      this.array = requireNonNull(array);
      this.index = requireNonNull(index);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(array, left, op.left).append("[").append(index, 0, 0)
          .append("]");
    }
  }

  /** Field access, "object.field". */
  public static class FieldAccess extends Exp {
    public final Exp object;
    public final String field;

    FieldAccess(Pos pos, Exp object, String field) {
      super(pos, Op.FIELD_ACCESS);
      this.object = requireNonNull(object);
      this.field = requireNonNull(field);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(object, left, op.left).append(".").append(field);
    }
  }

  /** Struct literal, "Point { x: 1, y: 2 }". */
  public static class StructLiteral extends Exp {
    public final String name;
    public final ImmutableMap<String, Exp> fields;

    StructLiteral(Pos pos, String name, ImmutableMap<String, Exp> fields) {
      super(pos, Op.STRUCT_LITERAL);
      this.name = requireNonNull(name);
      this.fields = requireNonNull(fields);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(name).append(" {");
      int i = 0;
      for (Map.Entry<String, Exp> field : fields.entrySet()) {
        w.append(i++ > 0 ? ", " : " ").append(field.getKey()).append(": ")
            .append(field.getValue(), 0, 0);
      }
      return w.append(" }");
    }
  }

  /** Range, "start .. end"; valid only as the iterable of a "for". */
  public static class Range extends Exp {
    public final Exp start;
    public final Exp end;

    Range(Pos pos, Exp start, Exp end) {
      super(pos, Op.RANGE);
      this.start = requireNonNull(start);
      this.end = requireNonNull(end);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, start, op, end, right);
    }
  }

  /** "new" or "delete" expression. */
  public static class Allocation extends Exp {
    public final Exp exp;

    Allocation(Pos pos, Op op, Exp exp) {
      super(pos, op);
      checkArgument(op == Op.NEW || op == Op.DELETE);
      this.exp = requireNonNull(exp);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.prefix(left, op, exp, right);
    }
  }

  /** Cast, "e as type". */
  public static class Cast extends Exp {
    public final Exp exp;
    public final Type type;

    Cast(Pos pos, Exp exp, Type type) {
      super(pos, Op.CAST);
      this.exp = requireNonNull(exp);
      this.type = requireNonNull(type);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append(exp, left, op.left).append(" as ").append(type);
    }
  }

  /** Conditional expression, "c ? a : b". */
  public static class Ternary extends Exp {
    public final Exp condition;
    public final Exp ifTrue;
    public final Exp ifFalse;

    Ternary(Pos pos, Exp condition, Exp ifTrue, Exp ifFalse) {
      super(pos, Op.TERNARY);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append(condition, left, op.left).append(" ? ")
          .append(ifTrue, op.right, op.left).append(" : ")
          .append(ifFalse, op.right, right);
    }
  }

  /** Reference to a variant, "Color::Red" or "Option::None". */
  public static class EnumAccess extends Exp {
    public final String enumName;
    public final String variant;

    EnumAccess(Pos pos, String enumName, String variant) {
      super(pos, Op.ENUM_ACCESS);
      this.enumName = requireNonNull(enumName);
      this.variant = requireNonNull(variant);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(enumName).append("::").append(variant);
    }
  }

  /** Match expression. */
  public static class Match extends Exp {
    public final Exp exp;
    public final ImmutableList<MatchArm> arms;

    Match(Pos pos, Exp exp, ImmutableList<MatchArm> arms) {
      super(pos, Op.MATCH);
      this.exp = requireNonNull(exp);
      this.arms = requireNonNull(arms);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("match ").append(exp, 0, 0)
          .appendAll(arms, " { ", ", ", " }");
    }
  }

  /** Arm of a match expression, "pat => exp". */
  public static class MatchArm extends AstNode {
    public final Pat pat;
    public final Exp exp;

    MatchArm(Pos pos, Pat pat, Exp exp) {
      super(pos, Op.MATCH_ARM);
      this.pat = requireNonNull(pat);
      this.exp = requireNonNull(exp);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(pat, 0, 0).append(" => ").append(exp, 0, 0);
    }
  }

  /** Error-propagation expression, "e?". */
  public static class Try extends Exp {
    public final Exp exp;

    Try(Pos pos, Exp exp) {
      super(pos, Op.TRY);
      this.exp = requireNonNull(exp);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(exp, left, op.left).append("?");
    }
  }

  //---------------------------------------------------------------------------
  // Patterns

  /** Base class for patterns. */
  public abstract static class Pat extends AstNode {
    Pat(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Wildcard pattern, "_". */
  public static class WildcardPat extends Pat {
    WildcardPat(Pos pos) {
      super(pos, Op.WILDCARD_PAT);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("_");
    }
  }

  /** Literal pattern, such as "1" or "\"abc\"". */
  public static class LiteralPat extends Pat {
    public final Literal literal;

    LiteralPat(Pos pos, Literal literal) {
      super(pos, Op.LITERAL_PAT);
      this.literal = requireNonNull(literal);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(literal, 0, 0);
    }
  }

  /** Variant pattern, "Color::Red" or "Option::Some(v)". */
  public static class VariantPat extends Pat {
    public final String enumName;
    public final String variant;
    public final @Nullable String binding;

    VariantPat(
        Pos pos, String enumName, String variant, @Nullable String binding) {
      super(pos, Op.VARIANT_PAT);
      this.enumName = requireNonNull(enumName);
      this.variant = requireNonNull(variant);
      this.binding = binding;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(enumName).append("::").append(variant);
      return binding == null ? w : w.append("(").append(binding).append(")");
    }
  }
}

// End Ast.java
