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
package net.hydromatic.rapter;

import static net.hydromatic.rapter.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.rapter.ast.Ast;
import net.hydromatic.rapter.ast.Pos;
import net.hydromatic.rapter.type.BuiltInGeneric;
import net.hydromatic.rapter.type.GenericType;
import net.hydromatic.rapter.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Short-hand for building syntax trees in tests.
 *
 * <p>Every node has position {@link Pos#ZERO}. */
public abstract class Fixtures {
  private Fixtures() {}

  public static final Pos P = Pos.ZERO;

  /** Creates a program that consists only of functions. */
  public static Ast.Program program(Ast.Function... functions) {
    return new ProgramBuilder().functions(functions).build();
  }

  public static ProgramBuilder programBuilder() {
    return new ProgramBuilder();
  }

  public static Ast.Function fn(String name, List<Ast.Param> params,
      @Nullable Type returnType, Ast.Stmt... body) {
    return ast.function(P, name, params, returnType,
        ImmutableList.copyOf(body));
  }

  public static Ast.Param param(String name, Type type) {
    return ast.param(P, name, type);
  }

  public static Ast.Id id(String name) {
    return ast.id(P, name);
  }

  public static Ast.Literal i(long value) {
    return ast.intLiteral(P, value);
  }

  public static Ast.Literal f(double value) {
    return ast.floatLiteral(P, value);
  }

  public static Ast.Literal b(boolean value) {
    return ast.boolLiteral(P, value);
  }

  public static Ast.Literal c(char value) {
    return ast.charLiteral(P, value);
  }

  public static Ast.Literal s(String value) {
    return ast.stringLiteral(P, value);
  }

  public static Ast.InfixCall infix(Ast.Exp a0, String op, Ast.Exp a1) {
    return ast.infix(P, op, a0, a1);
  }

  public static Ast.Apply call(String name, Ast.Exp... args) {
    return ast.call(P, name, ImmutableList.copyOf(args));
  }

  public static Ast.MethodCall methodCall(Ast.Exp object, String method,
      Ast.Exp... args) {
    return ast.methodCall(P, object, method, ImmutableList.copyOf(args));
  }

  public static Ast.Apply construct(String enumName, String variant,
      Ast.Exp arg) {
    return ast.construct(P, enumName, variant, arg);
  }

  public static Ast.EnumAccess enumAccess(String enumName, String variant) {
    return ast.enumAccess(P, enumName, variant);
  }

  public static Ast.MatchArm arm(Ast.Pat pat, Ast.Exp exp) {
    return ast.matchArm(P, pat, exp);
  }

  public static Ast.VariantPat variantPat(String enumName, String variant,
      @Nullable String binding) {
    return ast.variantPat(P, enumName, variant, binding);
  }

  public static Ast.Match match(Ast.Exp exp, Ast.MatchArm... arms) {
    return ast.match(P, exp, ImmutableList.copyOf(arms));
  }

  public static Ast.LetStmt let(String name, Ast.Exp init) {
    return ast.let(P, name, null, false, init);
  }

  public static Ast.LetStmt let(String name, Type type, Ast.Exp init) {
    return ast.let(P, name, type, false, init);
  }

  public static Ast.LetStmt letMut(String name, @Nullable Type type,
      Ast.@Nullable Exp init) {
    return ast.let(P, name, type, true, init);
  }

  public static Ast.ReturnStmt ret(Ast.Exp value) {
    return ast.return_(P, value);
  }

  public static Ast.ExpStmt stmt(Ast.Exp exp) {
    return ast.expStmt(P, exp);
  }

  public static Ast.IfStmt if_(Ast.Exp condition, Ast.Stmt... thenBlock) {
    return ast.if_(P, condition, ImmutableList.copyOf(thenBlock), null);
  }

  public static GenericType option(Type type) {
    return BuiltInGeneric.OPTION.substitute(ImmutableList.of(type));
  }

  public static GenericType result(Type okType, Type errType) {
    return BuiltInGeneric.RESULT.substitute(ImmutableList.of(okType, errType));
  }

  /** Builds a {@link Ast.Program}. */
  public static class ProgramBuilder {
    private final List<Ast.Import> imports = new ArrayList<>();
    private final List<Ast.Export> exports = new ArrayList<>();
    private final List<Ast.ExternFunction> externs = new ArrayList<>();
    private final List<Ast.Function> functions = new ArrayList<>();
    private final List<Ast.StructDecl> structs = new ArrayList<>();
    private final List<Ast.EnumDecl> enums = new ArrayList<>();
    private final List<Ast.Global> globals = new ArrayList<>();

    public ProgramBuilder import_(String module, @Nullable String alias) {
      imports.add(ast.import_(P, module, alias));
      return this;
    }

    public ProgramBuilder export(Ast.ExportKind kind, String name) {
      exports.add(ast.export(P, kind, name));
      return this;
    }

    public ProgramBuilder extern(String name, List<Ast.Param> params,
        @Nullable Type returnType, boolean variadic) {
      externs.add(ast.externFunction(P, name, params, returnType, variadic));
      return this;
    }

    public ProgramBuilder functions(Ast.Function... functions) {
      this.functions.addAll(ImmutableList.copyOf(functions));
      return this;
    }

    /** Adds a struct; {@code fields} alternates names and types. */
    public ProgramBuilder struct(String name, Object... fields) {
      final List<Ast.Field> list = new ArrayList<>();
      for (int i = 0; i < fields.length; i += 2) {
        list.add(ast.field(P, (String) fields[i], (Type) fields[i + 1]));
      }
      structs.add(ast.structDecl(P, name, list));
      return this;
    }

    public ProgramBuilder enum_(String name, String... variants) {
      final List<Ast.EnumVariant> list = new ArrayList<>();
      for (String variant : variants) {
        list.add(ast.enumVariant(P, variant, null));
      }
      enums.add(ast.enumDecl(P, name, list));
      return this;
    }

    public ProgramBuilder enumDecl(Ast.EnumDecl enumDecl) {
      enums.add(enumDecl);
      return this;
    }

    public ProgramBuilder global(String name, @Nullable Type type,
        boolean mutable, Ast.@Nullable Exp init) {
      globals.add(ast.global(P, name, type, mutable, init));
      return this;
    }

    public Ast.Program build() {
      return ast.program(P, imports, exports, externs, functions, structs,
          enums, globals);
    }
  }
}

// End Fixtures.java
