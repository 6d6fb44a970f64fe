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

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSetMultimap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import net.hydromatic.rapter.ast.Ast;
import net.hydromatic.rapter.ast.Op;
import net.hydromatic.rapter.ast.Pos;
import net.hydromatic.rapter.compile.CompileException.Suggestion;
import net.hydromatic.rapter.type.ArrayType;
import net.hydromatic.rapter.type.BuiltInGeneric;
import net.hydromatic.rapter.type.BuiltInVariant;
import net.hydromatic.rapter.type.DynamicArrayType;
import net.hydromatic.rapter.type.EnumType;
import net.hydromatic.rapter.type.GenericType;
import net.hydromatic.rapter.type.NamedType;
import net.hydromatic.rapter.type.PointerType;
import net.hydromatic.rapter.type.PrimitiveType;
import net.hydromatic.rapter.type.StructType;
import net.hydromatic.rapter.type.Type;
import net.hydromatic.rapter.type.Types;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Resolves all the types within a program, and checks that the program is
 * well-typed.
 *
 * <p>Inference is bottom-up, except that some expressions accept an
 * expected type (a "hint") from their context: the declared type of a
 * {@code let}, the return type of the enclosing function, the type of a
 * parameter. The hint is what allows {@code Result::Ok(1)} to have type
 * {@code Result<int, string>} rather than an instantiation invented from
 * the argument alone.
 *
 * <p>Checking stops at the first error, which is thrown as a
 * {@link CompileException}.
 */
public class TypeResolver {
  private final Environment env;
  private final TypeMap typeMap;

  /** Function whose body is being checked; null while checking global
   * initializers. */
  private Ast.@Nullable Function currentFunction;

  /** Number of loops enclosing the current statement. */
  private int loopDepth;

  /** Pairs of primitive types that may be converted by a cast. */
  private static final ImmutableSetMultimap<PrimitiveType, PrimitiveType>
      PRIMITIVE_CASTS =
          ImmutableSetMultimap.<PrimitiveType, PrimitiveType>builder()
              .putAll(PrimitiveType.INT, PrimitiveType.INT,
                  PrimitiveType.FLOAT, PrimitiveType.CHAR)
              .putAll(PrimitiveType.FLOAT, PrimitiveType.INT,
                  PrimitiveType.FLOAT)
              .putAll(PrimitiveType.CHAR, PrimitiveType.INT,
                  PrimitiveType.CHAR)
              .build();

  private TypeResolver(Environment env, TypeMap typeMap) {
    this.env = requireNonNull(env);
    this.typeMap = requireNonNull(typeMap);
  }

  /** Checks a program that imports nothing, and returns the types of its
   * nodes. */
  public static TypeMap deduceTypes(Ast.Program program) {
    final TypeMap typeMap = new TypeMap();
    deduceTypes(new Environment(), program, ImmutableMap.of(), typeMap);
    return typeMap;
  }

  /**
   * Checks a program, adding the types of its nodes to a type map.
   *
   * @param env Environment; on return, its global scope holds the program's
   *   declarations
   * @param program Program
   * @param imports Symbols imported from other modules, keyed by the name
   *   under which each is visible, qualified or not
   * @param typeMap Map to which to add types
   */
  public static void deduceTypes(Environment env, Ast.Program program,
      Map<String, Symbol> imports, TypeMap typeMap) {
    new TypeResolver(env, typeMap).deduceProgram(program, imports);
  }

  // declarations

  private void deduceProgram(Ast.Program program,
      Map<String, Symbol> imports) {
    imports.forEach((name, symbol) -> {
      env.insert(name, symbol.withName(name), symbol.pos);
      if (symbol.fields != null) {
        env.defineStruct(name, symbol.fields);
      }
      if (symbol.variants != null) {
        env.defineEnum(name, symbol.variants);
      }
    });
    for (Ast.ExternFunction externFunction : program.externFunctions) {
      env.insert(Symbol.of(externFunction));
    }
    for (Ast.Function function : program.functions) {
      env.insert(Symbol.of(function));
    }
    for (Ast.StructDecl struct : program.structs) {
      checkDistinct(struct.fields, f -> f.name, f -> f.pos);
      final Symbol symbol = Symbol.of(struct);
      env.insert(symbol);
      env.defineStruct(struct.name, requireNonNull(symbol.fields));
    }
    for (Ast.EnumDecl enumDecl : program.enums) {
      checkDistinct(enumDecl.variants, v -> v.name, v -> v.pos);
      final Symbol symbol = Symbol.of(enumDecl);
      env.insert(symbol);
      env.defineEnum(enumDecl.name, requireNonNull(symbol.variants));
    }

    // Now that every type is defined, check the types that declarations
    // refer to.
    for (Ast.ExternFunction externFunction : program.externFunctions) {
      externFunction.params.forEach(p -> validateType(p.type, p.pos));
      validateType(externFunction.returnType, externFunction.pos);
    }
    for (Ast.Function function : program.functions) {
      function.params.forEach(p -> validateType(p.type, p.pos));
      validateType(function.returnType, function.pos);
    }
    for (Ast.StructDecl struct : program.structs) {
      struct.fields.forEach(f -> validateValueType(f.type, f.pos));
    }

    for (Ast.Global global : program.globals) {
      deduceGlobal(global);
    }
    for (Ast.Function function : program.functions) {
      deduceFunction(function);
    }
  }

  /** Throws if two elements of a list have the same name. */
  private static <E> void checkDistinct(List<E> list,
      Function<E, String> nameFn, Function<E, Pos> posFn) {
    final Map<String, Pos> seen = new HashMap<>();
    for (E e : list) {
      final String name = nameFn.apply(e);
      final Pos previous = seen.putIfAbsent(name, posFn.apply(e));
      if (previous != null) {
        throw CompileException.duplicateDefinition(name, posFn.apply(e),
            previous);
      }
    }
  }

  private void deduceGlobal(Ast.Global global) {
    final Type type;
    if (global.type != null) {
      validateValueType(global.type, global.pos);
      type = global.type;
      if (global.init != null) {
        checkAssignable(type, global.init);
      }
    } else if (global.init != null) {
      type = deduceValueType(global.name, global.init);
    } else {
      throw new CompileException(ErrorKind.INVALID_SYNTAX,
          format("global `%s` must have a type annotation or an initializer",
              global.name),
          global.pos);
    }
    env.insert(Symbol.variable(global.name, type, global.mutable,
        global.pos));
    typeMap.put(global, type);
  }

  private void deduceFunction(Ast.Function function) {
    currentFunction = function;
    loopDepth = 0;
    env.pushScope();
    try {
      for (Ast.Param param : function.params) {
        env.insert(Symbol.parameter(param.name, param.type, param.pos));
        typeMap.put(param, param.type);
      }
      function.body.forEach(this::deduceStmt);
    } catch (CompileException e) {
      throw e.context == null
          ? e.withContext(format("in function `%s`", function.name))
          : e;
    } finally {
      env.popScope();
      currentFunction = null;
    }
    if (function.returnType != PrimitiveType.VOID
        && !ReturnPathChecker.blockReturns(function.body)) {
      throw new CompileException(ErrorKind.MISSING_RETURN,
          format("function `%s` is declared to return `%s` but not all paths "
                  + "return a value",
              function.name, function.returnType.moniker()),
          function.pos)
          .withSuggestion(
              Suggestion.of("add a `return` statement at the end of the "
                  + "function, or an `else` branch that returns"));
    }
  }

  /** Checks that a type is well-formed: every named type is defined, and
   * every generic type is a built-in family with the right number of
   * arguments. */
  void validateType(Type type, Pos pos) {
    switch (type.op()) {
      case PRIMITIVE_TYPE:
        return;
      case POINTER_TYPE:
        validateType(((PointerType) type).pointee, pos);
        return;
      case ARRAY_TYPE:
        validateValueType(((ArrayType) type).elementType, pos);
        return;
      case DYN_ARRAY_TYPE:
        validateValueType(((DynamicArrayType) type).elementType, pos);
        return;
      case STRUCT_TYPE:
      case ENUM_TYPE:
        final NamedType namedType = (NamedType) type;
        if (Types.isString(type)
            || env.structLayout(namedType.name) != null
            || env.enumLayout(namedType.name) != null) {
          return;
        }
        throw CompileException.undefinedType(namedType.name, pos);
      case GENERIC_TYPE:
        final GenericType genericType = (GenericType) type;
        final BuiltInGeneric family = BuiltInGeneric.lookup(genericType.name);
        if (family == null) {
          throw CompileException.undefinedType(genericType.name, pos)
              .withSuggestion(
                  Suggestion.of(
                      format("the only generic types are `%s` and `%s`",
                          BuiltInGeneric.OPTION.signature().moniker(),
                          BuiltInGeneric.RESULT.signature().moniker())));
        }
        family.validateInstantiation(genericType, pos);
        genericType.args.forEach(arg -> validateValueType(arg, pos));
        return;
      case TYPE_PARAM:
      default:
        throw CompileException.undefinedType(type.moniker(), pos);
    }
  }

  /** Checks that a type is well-formed and is not {@code void}. */
  private void validateValueType(Type type, Pos pos) {
    if (type == PrimitiveType.VOID) {
      throw new CompileException(ErrorKind.TYPE_MISMATCH,
          "`void` is not a valid type here", pos);
    }
    validateType(type, pos);
  }

  // statements

  private void deduceBlock(List<Ast.Stmt> stmts) {
    env.pushScope();
    try {
      stmts.forEach(this::deduceStmt);
    } finally {
      env.popScope();
    }
  }

  private void deduceStmt(Ast.Stmt stmt) {
    switch (stmt.op) {
      case LET:
        deduceLet((Ast.LetStmt) stmt);
        return;
      case CONST:
        deduceConst((Ast.ConstStmt) stmt);
        return;
      case ASSIGN:
        deduceAssign((Ast.AssignStmt) stmt);
        return;
      case RETURN:
        deduceReturn((Ast.ReturnStmt) stmt);
        return;
      case IF:
        final Ast.IfStmt ifStmt = (Ast.IfStmt) stmt;
        checkCondition(ifStmt.condition);
        deduceBlock(ifStmt.thenBlock);
        if (ifStmt.elseBlock != null) {
          deduceBlock(ifStmt.elseBlock);
        }
        return;
      case WHILE:
        final Ast.WhileStmt whileStmt = (Ast.WhileStmt) stmt;
        checkCondition(whileStmt.condition);
        ++loopDepth;
        try {
          deduceBlock(whileStmt.body);
        } finally {
          --loopDepth;
        }
        return;
      case FOR:
        deduceFor((Ast.ForStmt) stmt);
        return;
      case BREAK:
      case CONTINUE:
        if (loopDepth == 0) {
          throw CompileException.invalidOperation(
              format("`%s` outside of a loop", stmt.op.name().toLowerCase(
                  Locale.ROOT)),
              stmt.pos);
        }
        return;
      case EXP_STMT:
        deduceType(((Ast.ExpStmt) stmt).exp, null);
        return;
      default:
        throw new AssertionError("unknown statement " + stmt.op);
    }
  }

  private void deduceLet(Ast.LetStmt let) {
    final Type type;
    if (let.type != null) {
      validateValueType(let.type, let.pos);
      type = let.type;
      if (let.init != null) {
        checkAssignable(type, let.init);
      }
    } else if (let.init != null) {
      type = deduceValueType(let.name, let.init);
    } else {
      throw new CompileException(ErrorKind.INVALID_SYNTAX,
          format("variable `%s` must have a type annotation or an "
              + "initializer", let.name),
          let.pos)
          .withSuggestion(
              Suggestion.of("add a type annotation like `: int` or provide an "
                  + "initializer expression"));
    }
    env.insert(Symbol.variable(let.name, type, let.mutable, let.pos));
    typeMap.put(let, type);
  }

  private void deduceConst(Ast.ConstStmt constStmt) {
    final Type type;
    if (constStmt.type != null) {
      validateValueType(constStmt.type, constStmt.pos);
      type = constStmt.type;
      checkAssignable(type, constStmt.init);
    } else {
      type = deduceValueType(constStmt.name, constStmt.init);
    }
    env.insert(Symbol.variable(constStmt.name, type, false, constStmt.pos));
    typeMap.put(constStmt, type);
  }

  /** Deduces the type of a variable that has no type annotation from its
   * initializer. */
  private Type deduceValueType(String name, Ast.Exp init) {
    final Type type = deduceType(init, null);
    if (type == PrimitiveType.VOID) {
      throw new CompileException(ErrorKind.TYPE_MISMATCH,
          format("cannot bind `%s` to an expression of type `void`", name),
          init.pos);
    }
    return Types.normalize(type);
  }

  /** Checks that an expression can be stored in a location of a given
   * type, using the type as a hint. */
  private void checkAssignable(Type type, Ast.Exp exp) {
    final Type actual = deduceType(exp, type);
    if (!Types.compatible(type, actual)) {
      throw CompileException.typeMismatch(type, actual, exp.pos);
    }
  }

  private void deduceAssign(Ast.AssignStmt assign) {
    final Type targetType = deduceType(assign.target, null);
    checkMutable(assign.target, "assign to");
    checkAssignable(targetType, assign.value);
  }

  /** Checks that an expression denotes a location whose root variable may
   * be modified. */
  private void checkMutable(Ast.Exp target, String verb) {
    if (!isLvalue(target)) {
      throw CompileException.invalidOperation(
          format("cannot %s `%s`; it is not a variable, field, element or "
              + "dereferenced pointer", verb, target),
          target.pos);
    }
    final Ast.Id root = rootVariable(target);
    if (root == null) {
      return;
    }
    final Symbol symbol = env.lookup(root.name);
    if (symbol == null) {
      throw CompileException.undefinedVariable(root.name, root.pos);
    }
    if (!symbol.kind.isValue()) {
      throw CompileException.invalidOperation(
          format("cannot %s `%s`; it is not a variable", verb, root.name),
          root.pos);
    }
    if (!symbol.mutable) {
      throw new CompileException(ErrorKind.IMMUTABLE_ASSIGNMENT,
          format("cannot %s immutable variable `%s`", verb, root.name),
          target.pos)
          .withSuggestion(
              Suggestion.of("make the variable mutable",
                  format("let mut %s = ...;", root.name)))
          .withRelated(
              new CompileException(ErrorKind.IMMUTABLE_ASSIGNMENT,
                  format("`%s` is declared here", root.name), symbol.pos));
    }
  }

  /** Returns whether an expression denotes a location. */
  static boolean isLvalue(Ast.Exp exp) {
    switch (exp.op) {
      case ID:
      case INDEX:
      case FIELD_ACCESS:
      case DEREF:
        return true;
      default:
        return false;
    }
  }

  /** Returns the variable whose storage an lvalue is part of, or null if
   * the lvalue is reached through a pointer. */
  private Ast.@Nullable Id rootVariable(Ast.Exp exp) {
    switch (exp.op) {
      case ID:
        return (Ast.Id) exp;
      case FIELD_ACCESS:
        return rootVariable(((Ast.FieldAccess) exp).object);
      case INDEX:
        final Ast.Index index = (Ast.Index) exp;
        final Type arrayType = typeMap.getTypeOpt(index.array);
        if (arrayType instanceof ArrayType
            || arrayType instanceof DynamicArrayType) {
          return rootVariable(index.array);
        }
        return null;
      default:
        return null;
    }
  }

  private void deduceReturn(Ast.ReturnStmt returnStmt) {
    final Ast.Function function = requireNonNull(currentFunction);
    final Type returnType = function.returnType;
    if (returnStmt.value == null) {
      if (returnType != PrimitiveType.VOID) {
        throw new CompileException(ErrorKind.TYPE_MISMATCH,
            format("function `%s` must return a value of type `%s`",
                function.name, returnType.moniker()),
            returnStmt.pos);
      }
      return;
    }
    final Type type = deduceType(returnStmt.value, returnType);
    if (returnType == PrimitiveType.VOID) {
      throw new CompileException(ErrorKind.TYPE_MISMATCH,
          format("function `%s` does not return a value, but `return` has a "
              + "value of type `%s`", function.name, type.moniker()),
          returnStmt.value.pos);
    }
    if (!Types.compatible(returnType, type)) {
      throw CompileException.typeMismatch(returnType, type,
          returnStmt.value.pos);
    }
  }

  private void checkCondition(Ast.Exp condition) {
    final Type type = deduceType(condition, PrimitiveType.BOOL);
    if (type != PrimitiveType.BOOL) {
      throw CompileException.typeMismatch(PrimitiveType.BOOL, type,
          condition.pos);
    }
  }

  private void deduceFor(Ast.ForStmt forStmt) {
    final Type variableType;
    if (forStmt.iterable.op == Op.RANGE) {
      final Ast.Range range = (Ast.Range) forStmt.iterable;
      for (Ast.Exp bound : ImmutableList.of(range.start, range.end)) {
        final Type type = deduceType(bound, PrimitiveType.INT);
        if (type != PrimitiveType.INT) {
          throw CompileException.typeMismatch(PrimitiveType.INT, type,
              bound.pos);
        }
      }
      typeMap.put(range, PrimitiveType.INT);
      variableType = PrimitiveType.INT;
    } else {
      final Type type = Types.normalize(deduceType(forStmt.iterable, null));
      if (type instanceof ArrayType) {
        variableType = ((ArrayType) type).elementType;
      } else if (type instanceof DynamicArrayType) {
        variableType = ((DynamicArrayType) type).elementType;
      } else {
        throw CompileException.invalidOperation(
            format("cannot iterate over a value of type `%s`",
                type.moniker()),
            forStmt.iterable.pos)
            .withSuggestion(
                Suggestion.of("iterate over a range, an array or a dynamic "
                    + "array", "for i in 0..10 { ... }"));
      }
    }
    typeMap.put(forStmt, variableType);
    env.pushScope();
    ++loopDepth;
    try {
      env.insert(Symbol.variable(forStmt.variable, variableType, false,
          forStmt.pos));
      forStmt.body.forEach(this::deduceStmt);
    } finally {
      --loopDepth;
      env.popScope();
    }
  }

  // expressions

  /** Deduces the type of an expression, and records it in the type map.
   *
   * @param exp Expression
   * @param expected Type that the context expects, or null
   */
  private Type deduceType(Ast.Exp exp, @Nullable Type expected) {
    final Type type = deduceType_(exp, expected);
    typeMap.put(exp, type);
    return type;
  }

  private Type deduceType_(Ast.Exp exp, @Nullable Type expected) {
    switch (exp.op) {
      case INT_LITERAL:
      case FLOAT_LITERAL:
      case BOOL_LITERAL:
      case CHAR_LITERAL:
      case STRING_LITERAL:
        return literalType((Ast.Literal) exp);

      case ID:
        return deduceIdType((Ast.Id) exp);

      case OR:
      case AND:
      case EQ:
      case NE:
      case LT:
      case LE:
      case GT:
      case GE:
      case PLUS:
      case MINUS:
      case TIMES:
      case DIVIDE:
      case MOD:
        return deduceInfixType((Ast.InfixCall) exp);

      case NEGATE:
      case NOT:
      case DEREF:
      case ADDRESS_OF:
        return deducePrefixType((Ast.PrefixCall) exp);

      case APPLY:
        return deduceApplyType((Ast.Apply) exp, expected);

      case METHOD_CALL:
        final Ast.MethodCall methodCall = (Ast.MethodCall) exp;
        return deduceMethodType(methodCall, methodCall.object,
            methodCall.method, methodCall.args);

      case ARRAY_LITERAL:
        return deduceArrayLiteralType((Ast.ArrayLiteral) exp, expected);

      case DYN_ARRAY_LITERAL:
        final Ast.DynArrayLiteral dynArrayLiteral = (Ast.DynArrayLiteral) exp;
        validateValueType(dynArrayLiteral.elementType, dynArrayLiteral.pos);
        for (Ast.Exp element : dynArrayLiteral.elements) {
          checkAssignable(dynArrayLiteral.elementType, element);
        }
        return new DynamicArrayType(dynArrayLiteral.elementType);

      case INDEX:
        return deduceIndexType((Ast.Index) exp);

      case FIELD_ACCESS:
        return deduceFieldAccessType((Ast.FieldAccess) exp);

      case STRUCT_LITERAL:
        return deduceStructLiteralType((Ast.StructLiteral) exp);

      case RANGE:
        throw CompileException.invalidOperation(
            "a range can only be used as the iterable of a `for` loop",
            exp.pos);

      case NEW:
        return new PointerType(
            Types.normalize(deduceType(((Ast.Allocation) exp).exp, null)));

      case DELETE:
        final Ast.Allocation delete = (Ast.Allocation) exp;
        final Type deleted = deduceType(delete.exp, null);
        if (!(deleted instanceof PointerType) && !Types.isString(deleted)) {
          throw CompileException.invalidOperation(
              format("cannot delete a value of type `%s`; only pointers can "
                  + "be deleted", deleted.moniker()),
              delete.exp.pos);
        }
        return PrimitiveType.VOID;

      case CAST:
        return deduceCastType((Ast.Cast) exp);

      case TERNARY:
        final Ast.Ternary ternary = (Ast.Ternary) exp;
        checkCondition(ternary.condition);
        final Type ifTrue = deduceType(ternary.ifTrue, expected);
        final Type ifFalse = deduceType(ternary.ifFalse, expected);
        if (!Types.compatible(ifTrue, ifFalse)) {
          throw CompileException.typeMismatch(ifTrue, ifFalse,
              ternary.ifFalse.pos);
        }
        return ifTrue;

      case ENUM_ACCESS:
        return deduceEnumAccessType((Ast.EnumAccess) exp, expected);

      case MATCH:
        return deduceMatchType((Ast.Match) exp, expected);

      case TRY:
        return deduceTryType((Ast.Try) exp);

      default:
        throw new AssertionError("cannot deduce type for " + exp.op);
    }
  }

  private static Type literalType(Ast.Literal literal) {
    switch (literal.op) {
      case INT_LITERAL:
        return PrimitiveType.INT;
      case FLOAT_LITERAL:
        return PrimitiveType.FLOAT;
      case BOOL_LITERAL:
        return PrimitiveType.BOOL;
      case CHAR_LITERAL:
        return PrimitiveType.CHAR;
      case STRING_LITERAL:
        return PrimitiveType.STRING;
      default:
        throw new AssertionError(literal.op);
    }
  }

  private Type deduceIdType(Ast.Id id) {
    final Symbol symbol = env.lookup(id.name);
    if (symbol == null) {
      throw CompileException.undefinedVariable(id.name, id.pos);
    }
    if (!symbol.kind.isValue()) {
      throw CompileException.invalidOperation(
          format("`%s` is a %s, not a value", id.name,
              symbol.kind.name().toLowerCase(Locale.ROOT)),
          id.pos);
    }
    return Types.normalize(symbol.type);
  }

  private Type deduceInfixType(Ast.InfixCall call) {
    final Type left = deduceType(call.a0, null);
    final Type right = deduceType(call.a1, null);
    if ((call.op == Op.DIVIDE || call.op == Op.MOD)
        && call.a1 instanceof Ast.Literal
        && ((Ast.Literal) call.a1).isZero()) {
      throw CompileException.invalidOperation(
          call.op == Op.DIVIDE ? "division by zero" : "modulo by zero",
          call.a1.pos)
          .withSuggestion(
              Suggestion.of("division and modulo by zero cause a runtime "
                  + "error"));
    }
    if (call.op.isArithmetic()) {
      if (call.op == Op.PLUS
          && (Types.isString(left) || Types.isString(right))) {
        if (Types.isString(left) && Types.isString(right)) {
          return PrimitiveType.STRING;
        }
        throw CompileException.invalidOperation(
            format("cannot concatenate `%s` and `%s`", left.moniker(),
                right.moniker()),
            call.pos)
            .withSuggestion(
                Suggestion.of("both operands of string `+` must be strings"));
      }
      if (left == PrimitiveType.INT && right == PrimitiveType.INT) {
        return PrimitiveType.INT;
      }
      if (Types.isNumeric(left) && Types.isNumeric(right)) {
        return PrimitiveType.FLOAT;
      }
      throw CompileException.invalidOperation(
          format("cannot apply arithmetic operator `%s` to types `%s` and "
              + "`%s`", call.op.opName, left.moniker(), right.moniker()),
          call.pos)
          .withSuggestion(
              Suggestion.of("arithmetic operators require numeric operands "
                  + "(int or float)"));
    }
    if (call.op.isComparison()) {
      if (!Types.compatible(left, right)) {
        throw CompileException.invalidOperation(
            format("cannot compare `%s` with `%s`", left.moniker(),
                right.moniker()),
            call.pos);
      }
      return PrimitiveType.BOOL;
    }
    // AND, OR
    if (left != PrimitiveType.BOOL || right != PrimitiveType.BOOL) {
      throw CompileException.invalidOperation(
          format("logical operators require boolean operands, found `%s` "
              + "and `%s`", left.moniker(), right.moniker()),
          call.pos);
    }
    return PrimitiveType.BOOL;
  }

  private Type deducePrefixType(Ast.PrefixCall call) {
    final Type type = deduceType(call.a, null);
    switch (call.op) {
      case NEGATE:
        if (Types.isNumeric(type)) {
          return type;
        }
        throw CompileException.invalidOperation(
            format("cannot negate a value of type `%s`", type.moniker()),
            call.pos);
      case NOT:
        if (type == PrimitiveType.BOOL) {
          return type;
        }
        throw CompileException.invalidOperation(
            format("cannot apply `!` to a value of type `%s`",
                type.moniker()),
            call.pos);
      case DEREF:
        if (type instanceof PointerType) {
          return Types.normalize(((PointerType) type).pointee);
        }
        throw CompileException.invalidOperation(
            format("cannot dereference a value of type `%s`", type.moniker()),
            call.pos)
            .withSuggestion(Suggestion.of("`*` requires a pointer operand"));
      case ADDRESS_OF:
        return new PointerType(type);
      default:
        throw new AssertionError(call.op);
    }
  }

  // calls

  private Type deduceApplyType(Ast.Apply apply, @Nullable Type expected) {
    switch (apply.fn.op) {
      case ID:
        return deduceCallType(apply, ((Ast.Id) apply.fn).name);
      case FIELD_ACCESS:
        return deduceQualifiedCallType(apply, (Ast.FieldAccess) apply.fn);
      case ENUM_ACCESS:
        return deduceConstructType(apply, (Ast.EnumAccess) apply.fn,
            expected);
      default:
        throw CompileException.invalidOperation(
            format("`%s` cannot be called", apply.fn), apply.fn.pos)
            .withSuggestion(
                Suggestion.of("only function names and methods can be "
                    + "called"));
    }
  }

  /** Deduces the type of a call to a bare name: a built-in pseudo-function,
   * a declared function, or an intrinsic. */
  private Type deduceCallType(Ast.Apply apply, String name) {
    switch (name) {
      case "print":
      case "println":
        if (apply.args.size() > 1) {
          throw wrongArgumentCount(name, "at most 1", apply.args.size(),
              apply.pos);
        }
        for (Ast.Exp arg : apply.args) {
          checkPrintable(name, arg, deduceType(arg, null));
        }
        return PrimitiveType.VOID;

      case "len":
        if (apply.args.size() != 1) {
          throw wrongArgumentCount(name, "1", apply.args.size(), apply.pos);
        }
        final Type argType = deduceType(apply.args.get(0), null);
        if (!Types.isString(argType)) {
          throw new CompileException(ErrorKind.TYPE_MISMATCH,
              format("len() expects a string argument, found `%s`",
                  argType.moniker()),
              apply.args.get(0).pos)
              .withSuggestion(
                  Suggestion.of("use `.length()` for a dynamic array"));
        }
        return PrimitiveType.INT;

      default:
        break;
    }
    final Symbol symbol = env.lookup(name);
    if (symbol != null) {
      return deduceFunctionCallType(apply, name, symbol);
    }
    if (Intrinsics.isIntrinsic(name)) {
      apply.args.forEach(arg -> deduceType(arg, null));
      return PrimitiveType.INT;
    }
    throw CompileException.undefinedFunction(name, apply.fn.pos)
        .withSuggestion(
            Suggestion.of("check the function name for typos, or declare "
                + "it with `extern fn`"));
  }

  /** Checks that a value can be printed by {@code print}. */
  private void checkPrintable(String fnName, Ast.Exp arg, Type type) {
    if (type instanceof PrimitiveType && type != PrimitiveType.VOID
        || Types.isString(type)
        || type instanceof PointerType
        || env.enumLayout(type) != null
        || type instanceof DynamicArrayType
        || arg.op == Op.ARRAY_LITERAL) {
      return;
    }
    throw CompileException.invalidOperation(
        format("%s() cannot print a value of type `%s`", fnName,
            type.moniker()),
        arg.pos);
  }

  private Type deduceFunctionCallType(Ast.Apply apply, String name,
      Symbol symbol) {
    if (symbol.kind != Symbol.Kind.FUNCTION) {
      throw CompileException.invalidOperation(
          format("`%s` is not a function", name), apply.fn.pos)
          .withSuggestion(
              Suggestion.of("only functions can be called with "
                  + "parentheses"));
    }
    final List<Type> paramTypes = requireNonNull(symbol.paramTypes);
    final int argCount = apply.args.size();
    if (symbol.variadic
        ? argCount < paramTypes.size()
        : argCount != paramTypes.size()) {
      throw wrongArgumentCount(name,
          (symbol.variadic ? "at least " : "") + paramTypes.size(),
          argCount, apply.pos);
    }
    for (int i = 0; i < argCount; i++) {
      final Ast.Exp arg = apply.args.get(i);
      if (i < paramTypes.size()) {
        checkAssignable(paramTypes.get(i), arg);
      } else {
        deduceType(arg, null);
      }
    }
    return symbol.type;
  }

  /** Deduces the type of "{@code a.b(args)}", which is either a call to a
   * function {@code b} of a module imported as {@code a}, or a call to a
   * built-in method of the value {@code a}.
   *
   * <p>If the leftmost name of {@code a} is a variable or parameter, and no
   * module is imported as {@code a}, the call is a method call; so
   * {@code p.items.push(1)} pushes onto field {@code items} of {@code p}. */
  private Type deduceQualifiedCallType(Ast.Apply apply,
      Ast.FieldAccess fn) {
    final String qualifier = qualifier(fn.object);
    if (qualifier != null) {
      final String qualifiedName = qualifier + "." + fn.field;
      final Symbol symbol = env.lookup(qualifiedName);
      if (symbol != null) {
        return deduceFunctionCallType(apply, qualifiedName, symbol);
      }
      final Symbol root = env.lookup(rootName(qualifier));
      if (env.hasQualifier(qualifier)
          || root == null
          || !root.kind.isValue()) {
        throw CompileException.undefinedFunction(qualifiedName, fn.pos)
            .withSuggestion(
                Suggestion.of(
                    format("ensure `%s` is exported from module `%s`",
                        fn.field, qualifier)));
      }
    }
    return deduceMethodType(apply, fn.object, fn.field, apply.args);
  }

  /** Returns the dotted name of an expression that might be a module
   * qualifier, such as "{@code a.b}"; null if the expression is not a chain
   * of identifiers. */
  static @Nullable String qualifier(Ast.Exp exp) {
    switch (exp.op) {
      case ID:
        return ((Ast.Id) exp).name;
      case FIELD_ACCESS:
        final Ast.FieldAccess fieldAccess = (Ast.FieldAccess) exp;
        final String prefix = qualifier(fieldAccess.object);
        return prefix == null ? null : prefix + "." + fieldAccess.field;
      default:
        return null;
    }
  }

  /** Returns the leftmost part of a dotted name, e.g. "{@code p}" for
   * "{@code p.items}". */
  private static String rootName(String qualifier) {
    final int i = qualifier.indexOf('.');
    return i < 0 ? qualifier : qualifier.substring(0, i);
  }

  /** Deduces the type of a call to a built-in method, and records the
   * method in the type map. */
  private Type deduceMethodType(Ast.Exp call, Ast.Exp object, String name,
      List<Ast.Exp> args) {
    final Type receiverType = Types.normalize(deduceType(object, null));
    final BuiltInMethod method = BuiltInMethod.lookup(receiverType, name);
    if (method == null) {
      throw CompileException.undefinedFunction(name, call.pos)
          .withContext(
              format("no method `%s` on type `%s`", name,
                  receiverType.moniker()))
          .withSuggestion(
              Suggestion.of("check the method name, or ensure the type "
                  + "supports this operation"));
    }
    if (args.size() != method.arity()) {
      throw wrongArgumentCount(name, Integer.toString(method.arity()),
          args.size(), call.pos);
    }
    for (int i = 0; i < args.size(); i++) {
      final Ast.Exp arg = args.get(i);
      final Type paramType = method.paramType(i, receiverType);
      final Type argType = deduceType(arg, paramType);
      if (!method.accepts(i, argType, receiverType)) {
        throw CompileException.typeMismatch(paramType, argType, arg.pos);
      }
    }
    if (method.mutatesReceiver()) {
      checkMutable(object, "call `" + name + "` on");
    }
    typeMap.putMethod(call, method);
    return method.returnType(receiverType);
  }

  private static CompileException wrongArgumentCount(String name,
      String expected, int actual, Pos pos) {
    return new CompileException(ErrorKind.WRONG_ARGUMENT_COUNT,
        format("%s() expects %s argument(s), got %d", name, expected, actual),
        pos);
  }

  // variants

  /** Deduces the type of a variant construction,
   * "{@code Option::Some(x)}". */
  private Type deduceConstructType(Ast.Apply apply, Ast.EnumAccess fn,
      @Nullable Type expected) {
    final BuiltInGeneric family = BuiltInGeneric.lookup(fn.enumName);
    if (family == null) {
      final ImmutableMap<String, Long> variants = enumVariants(fn);
      throw CompileException.invalidOperation(
          format("variant `%s::%s` does not take a value", fn.enumName,
              fn.variant),
          apply.pos)
          .withContext(format("enum `%s` has variants %s", fn.enumName,
              variants.keySet()));
    }
    final BuiltInVariant variant = builtInVariant(family, fn);
    if (!variant.hasValue()) {
      throw CompileException.invalidOperation(
          format("variant `%s::%s` does not take a value", fn.enumName,
              fn.variant),
          apply.pos);
    }
    if (apply.args.size() != 1) {
      throw wrongArgumentCount(fn.enumName + "::" + fn.variant, "1",
          apply.args.size(), apply.pos);
    }
    final Ast.Exp arg = apply.args.get(0);
    final GenericType hint = hint(family, expected);
    if (hint != null) {
      final Type payloadType =
          requireNonNull(family.variantValueType(variant.name, hint.args));
      final Type argType = deduceType(arg, payloadType);
      if (!Types.compatible(payloadType, argType)) {
        throw new CompileException(ErrorKind.TYPE_MISMATCH,
            format("%s::%s expects an argument of type `%s`, found `%s`",
                fn.enumName, fn.variant, payloadType.moniker(),
                argType.moniker()),
            arg.pos);
      }
      return hint;
    }
    if (family.arity() > 1) {
      throw new CompileException(ErrorKind.TYPE_MISMATCH,
          format("cannot infer the type parameters of `%s::%s` from its "
              + "argument", fn.enumName, fn.variant),
          apply.pos)
          .withSuggestion(
              Suggestion.of("add a type annotation",
                  format("let r: %s<int, string> = %s::%s(...);",
                      family.familyName, fn.enumName, fn.variant)));
    }
    final Type argType = deduceType(arg, null);
    if (argType == PrimitiveType.VOID) {
      throw new CompileException(ErrorKind.TYPE_MISMATCH,
          format("%s::%s expects a value, found an expression of type "
              + "`void`", fn.enumName, fn.variant),
          arg.pos);
    }
    return family.substitute(ImmutableList.of(Types.normalize(argType)),
        apply.pos);
  }

  /** Deduces the type of a variant used without arguments, such as
   * "{@code Color::Red}" or "{@code Option::None}". */
  private Type deduceEnumAccessType(Ast.EnumAccess enumAccess,
      @Nullable Type expected) {
    final BuiltInGeneric family = BuiltInGeneric.lookup(enumAccess.enumName);
    if (family == null) {
      final ImmutableMap<String, Long> variants = enumVariants(enumAccess);
      if (!variants.containsKey(enumAccess.variant)) {
        throw new CompileException(ErrorKind.UNDEFINED_TYPE,
            format("enum `%s` has no variant `%s`", enumAccess.enumName,
                enumAccess.variant),
            enumAccess.pos);
      }
      return new EnumType(enumAccess.enumName);
    }
    final BuiltInVariant variant = builtInVariant(family, enumAccess);
    if (variant.hasValue()) {
      throw CompileException.invalidOperation(
          format("variant `%s::%s` requires a value", enumAccess.enumName,
              enumAccess.variant),
          enumAccess.pos)
          .withSuggestion(
              Suggestion.of("pass the value",
                  format("%s::%s(value)", enumAccess.enumName,
                      enumAccess.variant)));
    }
    final GenericType hint = hint(family, expected);
    if (hint == null) {
      throw new CompileException(ErrorKind.TYPE_MISMATCH,
          format("cannot use `%s::%s` without type parameters",
              enumAccess.enumName, enumAccess.variant),
          enumAccess.pos)
          .withSuggestion(
              Suggestion.of("add a type annotation",
                  format("let x: %s<int> = %s::%s;", family.familyName,
                      enumAccess.enumName, enumAccess.variant)));
    }
    return hint;
  }

  /** Returns the expected type if it is an instantiation of a given family,
   * otherwise null. */
  private static @Nullable GenericType hint(BuiltInGeneric family,
      @Nullable Type expected) {
    return expected != null && BuiltInGeneric.of(expected) == family
        ? (GenericType) expected
        : null;
  }

  private static BuiltInVariant builtInVariant(BuiltInGeneric family,
      Ast.EnumAccess enumAccess) {
    final BuiltInVariant variant = family.variant(enumAccess.variant);
    if (variant == null) {
      throw new CompileException(ErrorKind.UNDEFINED_TYPE,
          format("type `%s` has no variant `%s`", enumAccess.enumName,
              enumAccess.variant),
          enumAccess.pos);
    }
    return variant;
  }

  private ImmutableMap<String, Long> enumVariants(Ast.EnumAccess enumAccess) {
    final ImmutableMap<String, Long> variants =
        env.enumLayout(enumAccess.enumName);
    if (variants == null) {
      throw CompileException.undefinedType(enumAccess.enumName,
          enumAccess.pos);
    }
    return variants;
  }

  // aggregates

  private Type deduceArrayLiteralType(Ast.ArrayLiteral arrayLiteral,
      @Nullable Type expected) {
    final Type elementHint =
        expected instanceof ArrayType
            ? ((ArrayType) expected).elementType
            : null;
    if (arrayLiteral.elements.isEmpty()) {
      if (expected instanceof ArrayType) {
        return expected;
      }
      throw new CompileException(ErrorKind.INVALID_SYNTAX,
          "empty array literals need an explicit type annotation",
          arrayLiteral.pos)
          .withSuggestion(
              Suggestion.of("declare the type of the variable",
                  "let a: [int] = [];"));
    }
    // Compatibility is not transitive, so each element is compared with
    // every earlier one.
    final List<Type> types = new ArrayList<>();
    for (Ast.Exp element : arrayLiteral.elements) {
      final Type type = deduceType(element, elementHint);
      for (Type previous : types) {
        if (!Types.compatible(previous, type)) {
          throw new CompileException(ErrorKind.TYPE_MISMATCH,
              format("array elements must have compatible types: `%s` vs "
                  + "`%s`", previous.moniker(), type.moniker()),
              element.pos);
        }
      }
      types.add(type);
    }
    return new ArrayType(Types.normalize(types.get(0)));
  }

  private Type deduceIndexType(Ast.Index index) {
    final Type arrayType = Types.normalize(deduceType(index.array, null));
    final Type indexType = deduceType(index.index, PrimitiveType.INT);
    if (indexType != PrimitiveType.INT) {
      throw CompileException.typeMismatch(PrimitiveType.INT, indexType,
          index.index.pos);
    }
    if (isNegativeLiteral(index.index)) {
      throw CompileException.invalidOperation(
          format("index `%s` is negative", index.index), index.index.pos);
    }
    final Type elementType = Types.elementType(arrayType);
    if (elementType == null) {
      throw CompileException.invalidOperation(
          format("cannot index into a value of type `%s`",
              arrayType.moniker()),
          index.array.pos);
    }
    return Types.normalize(elementType);
  }

  private static boolean isNegativeLiteral(Ast.Exp exp) {
    if (exp.op == Op.INT_LITERAL) {
      return (Long) ((Ast.Literal) exp).value < 0;
    }
    return exp.op == Op.NEGATE
        && ((Ast.PrefixCall) exp).a.op == Op.INT_LITERAL
        && !((Ast.Literal) ((Ast.PrefixCall) exp).a).isZero();
  }

  private Type deduceFieldAccessType(Ast.FieldAccess fieldAccess) {
    final Type objectType = deduceType(fieldAccess.object, null);
    final ImmutableMap<String, Type> layout =
        objectType instanceof StructType
            ? env.structLayout(((StructType) objectType).name)
            : null;
    if (layout == null) {
      throw CompileException.invalidOperation(
          format("cannot access field `%s` of a value of type `%s`",
              fieldAccess.field, objectType.moniker()),
          fieldAccess.pos);
    }
    final Type fieldType = layout.get(fieldAccess.field);
    if (fieldType == null) {
      throw new CompileException(ErrorKind.UNDEFINED_VARIABLE,
          format("struct `%s` has no field `%s`", objectType.moniker(),
              fieldAccess.field),
          fieldAccess.pos)
          .withContext(format("fields are %s", layout.keySet()));
    }
    return Types.normalize(fieldType);
  }

  private Type deduceStructLiteralType(Ast.StructLiteral literal) {
    final ImmutableMap<String, Type> layout = env.structLayout(literal.name);
    final Symbol symbol = env.lookup(literal.name);
    if (layout == null
        || symbol != null && symbol.kind != Symbol.Kind.STRUCT) {
      throw CompileException.undefinedType(literal.name, literal.pos);
    }
    for (Map.Entry<String, Ast.Exp> field : literal.fields.entrySet()) {
      final Type fieldType = layout.get(field.getKey());
      if (fieldType == null) {
        throw new CompileException(ErrorKind.UNDEFINED_VARIABLE,
            format("struct `%s` has no field `%s`", literal.name,
                field.getKey()),
            field.getValue().pos);
      }
      checkAssignable(fieldType, field.getValue());
    }
    return new StructType(literal.name);
  }

  private Type deduceCastType(Ast.Cast cast) {
    final Type from = Types.normalize(deduceType(cast.exp, null));
    final Type to = cast.type;
    validateType(to, cast.pos);
    final boolean valid;
    if (from instanceof PrimitiveType && to instanceof PrimitiveType) {
      valid = PRIMITIVE_CASTS.containsEntry(from, to);
    } else if (from instanceof PointerType) {
      valid = to instanceof PointerType || to == PrimitiveType.INT;
    } else if (from == PrimitiveType.INT) {
      valid = to instanceof PointerType;
    } else {
      valid = false;
    }
    if (valid
        || from == PrimitiveType.STRING
            && to.equals(new PointerType(PrimitiveType.CHAR))) {
      return to;
    }
    throw CompileException.invalidOperation(
        format("cannot cast from type `%s` to `%s`", from.moniker(),
            to.moniker()),
        cast.pos)
        .withSuggestion(
            Suggestion.of("casts are valid between numeric types, between "
                + "pointers, and between pointers and int"));
  }

  // match and try

  private Type deduceMatchType(Ast.Match match, @Nullable Type expected) {
    final Type scrutineeType = Types.normalize(deduceType(match.exp, null));
    if (match.arms.isEmpty()) {
      throw new CompileException(ErrorKind.INVALID_SYNTAX,
          "match expression has no arms", match.pos);
    }
    final List<Type> armTypes = new ArrayList<>();
    for (Ast.MatchArm arm : match.arms) {
      env.pushScope();
      try {
        deducePatType(arm.pat, scrutineeType);
        final Type armType = deduceType(arm.exp, expected);
        typeMap.put(arm, armType);
        for (Type previous : armTypes) {
          if (!Types.compatible(previous, armType)) {
            throw new CompileException(ErrorKind.TYPE_MISMATCH,
                format("match arms have incompatible types: `%s` vs `%s`",
                    previous.moniker(), armType.moniker()),
                arm.exp.pos);
          }
        }
        armTypes.add(armType);
      } finally {
        env.popScope();
      }
    }
    final List<String> missing =
        MatchCoverageChecker.missingVariants(env, scrutineeType, match.arms);
    if (!missing.isEmpty()) {
      throw CompileException.invalidOperation(
          format("non-exhaustive match on enum `%s`, missing variants: %s",
              scrutineeType.moniker(), String.join(", ", missing)),
          match.pos)
          .withSuggestion(
              Suggestion.of("add arms for the missing variants, or a "
                  + "wildcard arm `_ => ...`"));
    }
    return armTypes.get(0);
  }

  /** Checks a pattern against the type of the value being matched, and
   * binds the variable that the pattern defines, if any. */
  private void deducePatType(Ast.Pat pat, Type scrutineeType) {
    switch (pat.op) {
      case WILDCARD_PAT:
        typeMap.put(pat, scrutineeType);
        return;

      case LITERAL_PAT:
        final Ast.Literal literal = ((Ast.LiteralPat) pat).literal;
        final Type literalType = deduceType(literal, null);
        if (!Types.compatible(literalType, scrutineeType)) {
          throw new CompileException(ErrorKind.TYPE_MISMATCH,
              format("pattern type `%s` does not match scrutinee type `%s`",
                  literalType.moniker(), scrutineeType.moniker()),
              pat.pos);
        }
        typeMap.put(pat, literalType);
        return;

      case VARIANT_PAT:
        deduceVariantPatType((Ast.VariantPat) pat, scrutineeType);
        return;

      default:
        throw new AssertionError(pat.op);
    }
  }

  private void deduceVariantPatType(Ast.VariantPat pat, Type scrutineeType) {
    final BuiltInGeneric family = BuiltInGeneric.of(scrutineeType);
    final String patName = pat.enumName + "::" + pat.variant;
    if (family != null) {
      if (!family.familyName.equals(pat.enumName)) {
        throw new CompileException(ErrorKind.TYPE_MISMATCH,
            format("pattern `%s` does not match scrutinee type `%s`",
                patName, scrutineeType.moniker()),
            pat.pos);
      }
      final BuiltInVariant variant = family.variant(pat.variant);
      if (variant == null) {
        throw new CompileException(ErrorKind.UNDEFINED_TYPE,
            format("type `%s` has no variant `%s`", pat.enumName,
                pat.variant),
            pat.pos);
      }
      checkBinding(pat, patName, variant.hasValue());
      if (pat.binding != null) {
        final Type bindingType =
            Types.normalize(
                requireNonNull(
                    family.variantValueType(variant.name,
                        ((GenericType) scrutineeType).args)));
        env.insert(Symbol.variable(pat.binding, bindingType, false,
            pat.pos));
        typeMap.put(pat, bindingType);
      } else {
        typeMap.put(pat, scrutineeType);
      }
      return;
    }
    final ImmutableMap<String, Long> variants = env.enumLayout(scrutineeType);
    if (variants == null
        || !Types.compatible(new EnumType(pat.enumName), scrutineeType)) {
      throw new CompileException(ErrorKind.TYPE_MISMATCH,
          format("pattern `%s` does not match scrutinee type `%s`",
              patName, scrutineeType.moniker()),
          pat.pos);
    }
    if (!variants.containsKey(pat.variant)) {
      throw new CompileException(ErrorKind.UNDEFINED_TYPE,
          format("enum `%s` has no variant `%s`", pat.enumName, pat.variant),
          pat.pos);
    }
    checkBinding(pat, patName, false);
    typeMap.put(pat, scrutineeType);
  }

  private static void checkBinding(Ast.VariantPat pat, String patName,
      boolean hasValue) {
    if (hasValue && pat.binding == null) {
      throw CompileException.invalidOperation(
          format("variant `%s` carries a value, which the pattern must bind",
              patName),
          pat.pos)
          .withSuggestion(Suggestion.of("bind the value",
              format("%s(v) => ...", patName)));
    }
    if (!hasValue && pat.binding != null) {
      throw CompileException.invalidOperation(
          format("variant `%s` does not carry a value", patName), pat.pos);
    }
  }

  private Type deduceTryType(Ast.Try aTry) {
    final Type type = Types.normalize(deduceType(aTry.exp, null));
    final BuiltInGeneric family = BuiltInGeneric.of(type);
    if (family == null) {
      throw new CompileException(ErrorKind.TYPE_MISMATCH,
          format("? operator can only be used on %s or %s, found `%s`",
              BuiltInGeneric.RESULT.signature().moniker(),
              BuiltInGeneric.OPTION.signature().moniker(), type.moniker()),
          aTry.pos)
          .withSuggestion(
              Suggestion.of("? is for error propagation and optional values"));
    }
    if (currentFunction == null) {
      throw CompileException.invalidOperation(
          "? operator can only be used inside a function", aTry.pos);
    }
    final Type returnType = currentFunction.returnType;
    if (BuiltInGeneric.of(returnType) != family) {
      throw new CompileException(ErrorKind.TYPE_MISMATCH,
          format("? operator used on `%s` but function `%s` returns `%s`",
              type.moniker(), currentFunction.name, returnType.moniker()),
          aTry.pos)
          .withSuggestion(
              Suggestion.of(
                  format("change the function's return type to a `%s`, or "
                      + "remove the ? operator", family.familyName)));
    }
    final GenericType operandType = (GenericType) type;
    final GenericType functionType = (GenericType) returnType;
    final BuiltInVariant failure = family.failureVariant();
    if (failure.hasValue()) {
      final Type operandError =
          requireNonNull(
              family.variantValueType(failure.name, operandType.args));
      final Type functionError =
          requireNonNull(
              family.variantValueType(failure.name, functionType.args));
      if (!Types.compatible(functionError, operandError)) {
        throw CompileException.typeMismatch(functionError, operandError,
            aTry.pos)
            .withContext("error types of ? operand and function return type "
                + "differ");
      }
    }
    return Types.normalize(
        requireNonNull(
            family.variantValueType(family.successVariant().name,
                operandType.args)));
  }
}

// End TypeResolver.java
