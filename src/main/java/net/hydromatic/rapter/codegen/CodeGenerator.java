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
package net.hydromatic.rapter.codegen;

import static net.hydromatic.rapter.codegen.CTypes.cType;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import net.hydromatic.rapter.ast.Ast;
import net.hydromatic.rapter.ast.Op;
import net.hydromatic.rapter.ast.Pos;
import net.hydromatic.rapter.compile.BuiltInMethod;
import net.hydromatic.rapter.compile.CompileException;
import net.hydromatic.rapter.compile.ErrorKind;
import net.hydromatic.rapter.compile.Intrinsics;
import net.hydromatic.rapter.compile.Symbol;
import net.hydromatic.rapter.compile.TypeMap;
import net.hydromatic.rapter.type.ArrayType;
import net.hydromatic.rapter.type.BuiltInGeneric;
import net.hydromatic.rapter.type.BuiltInVariant;
import net.hydromatic.rapter.type.DynamicArrayType;
import net.hydromatic.rapter.type.GenericType;
import net.hydromatic.rapter.type.NamedType;
import net.hydromatic.rapter.type.PointerType;
import net.hydromatic.rapter.type.PrimitiveType;
import net.hydromatic.rapter.type.StructType;
import net.hydromatic.rapter.type.Type;
import net.hydromatic.rapter.type.Types;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Generates a C translation unit from a checked program and the modules it
 * imports.
 *
 * <p>The unit is laid out so that every name is declared before it is used:
 * headers, enums, forward declarations of struct types, struct and
 * instantiation definitions (each after the types it contains by value),
 * runtime helpers, extern and function prototypes, globals, function
 * bodies, and finally the C {@code main} that calls the program's
 * {@code main}.
 *
 * <p>Expressions that need temporaries, such as {@code match}, {@code ?},
 * string {@code +} and {@code push}, become GNU C statement expressions,
 * "{@code ({ ...; value; })}".
 */
public class CodeGenerator {
  private final CodegenContext cx;
  private final TypeMap typeMap;
  private final String prefix;
  private CWriter out;

  /** Struct declarations of all programs, keyed by simple name. */
  private final Map<String, Ast.StructDecl> structs = new LinkedHashMap<>();
  /** Instantiations found by {@link InstantiationCollector}, in the order
   * found; {@link CodegenContext#instantiations} holds them in the order
   * defined. */
  private final Map<String, Type> collected = new LinkedHashMap<>();
  private final Set<String> defined = new HashSet<>();
  private final Set<String> defining = new HashSet<>();

  private Ast.@Nullable Function currentFunction;

  private CodeGenerator(CodegenContext cx) {
    this.cx = cx;
    this.typeMap = cx.typeMap;
    this.prefix = cx.prefix();
    this.out = new CWriter(cx.indentWidth());
  }

  /**
   * Generates C code.
   *
   * @param cx Context; on return, holds the instantiations that were defined
   * @param dependencies Imported modules, in dependency order
   * @param root Program being compiled
   * @return Source of a C translation unit
   */
  public static String generate(CodegenContext cx,
      List<Ast.Program> dependencies, Ast.Program root) {
    final CodeGenerator g = new CodeGenerator(cx);
    final List<Ast.Program> programs =
        ImmutableList.<Ast.Program>builder().addAll(dependencies).add(root)
            .build();
    g.generate(programs, root);
    return g.out.toString();
  }

  private void generate(List<Ast.Program> programs, Ast.Program root) {
    for (Ast.Program program : programs) {
      for (Ast.StructDecl struct : program.structs) {
        structs.putIfAbsent(NamedType.simpleName(struct.name), struct);
      }
      for (Ast.EnumDecl enumDecl : program.enums) {
        cx.enumNames.add(NamedType.simpleName(enumDecl.name));
      }
    }
    InstantiationCollector.collect(programs, typeMap, collected);
    for (Ast.StructDecl struct : structs.values()) {
      final DynamicArrayType arrayType =
          new DynamicArrayType(new StructType(struct.name));
      collected.putIfAbsent(cType(arrayType), arrayType);
    }
    final Ast.@Nullable Function main = root.function("main");

    for (String include : RuntimeLibrary.INCLUDES) {
      out.line("#include <" + include + ">");
    }
    out.line("");
    if (main != null) {
      RuntimeLibrary.arguments(prefix).forEach(out::line);
      out.line("");
    }

    CTypes.BUILT_IN_DYNAMIC_ARRAYS.forEach((elementType, suffix) ->
        out.line(
            RuntimeLibrary.dynamicArrayTypedef(CTypes.DYNAMIC_ARRAY + suffix,
                cType(elementType))));
    out.line("");

    for (Ast.Program program : programs) {
      program.enums.forEach(this::enumDefinition);
    }

    if (!structs.isEmpty() || !collected.isEmpty()) {
      structs.keySet().forEach(name ->
          out.line("typedef struct " + name + " " + name + ";"));
      collected.keySet().forEach(name ->
          out.line("typedef struct " + name + " " + name + ";"));
      out.line("");
      structs.keySet().forEach(name -> define(name, Pos.ZERO));
      collected.keySet().forEach(name -> define(name, Pos.ZERO));
    }

    if (cx.emitRuntimeHelpers()) {
      RuntimeLibrary.strings(prefix).forEach(out::line);
      if (main != null) {
        RuntimeLibrary.files(prefix).forEach(out::line);
      }
      out.line("");
    }

    final Set<String> externs = new HashSet<>();
    for (Ast.Program program : programs) {
      for (Ast.ExternFunction extern : program.externFunctions) {
        if (!Intrinsics.isIntrinsic(extern.name)
            && externs.add(extern.name)) {
          out.line(
              signature(extern.returnType, extern.name, extern.params,
                  extern.variadic) + ";");
        }
      }
    }

    final Map<String, Pos> functionNames = new HashMap<>();
    for (Ast.Program program : programs) {
      for (Ast.Function function : program.functions) {
        final String name = functionName(function.name);
        final Pos previous = functionNames.putIfAbsent(name, function.pos);
        if (previous != null) {
          throw CompileException.duplicateDefinition(name, function.pos,
              previous);
        }
        out.line(signature(function) + ";");
      }
    }
    out.line("");

    final boolean initGlobals = globals(programs);

    for (Ast.Program program : programs) {
      program.functions.forEach(this::functionDefinition);
    }

    if (main != null) {
      trampoline(main, initGlobals);
    }
  }

  // types

  private void enumDefinition(Ast.EnumDecl enumDecl) {
    out.line("typedef enum {");
    out.indent();
    final Map<String, Long> discriminants = Symbol.discriminants(enumDecl);
    int i = 0;
    for (Map.Entry<String, Long> entry : discriminants.entrySet()) {
      out.line(CTypes.enumConstant(enumDecl.name, entry.getKey()) + " = "
          + entry.getValue()
          + (++i < discriminants.size() ? "," : ""));
    }
    out.outdent();
    out.line("} " + NamedType.simpleName(enumDecl.name) + ";");
    out.line("");
  }

  /** Writes the definition of a struct or instantiation, after the
   * definitions of the types it contains by value. */
  private void define(String name, Pos pos) {
    if (defined.contains(name)) {
      return;
    }
    if (!defining.add(name)) {
      throw CompileException.invalidOperation(
          format("type `%s` contains itself", name), pos);
    }
    final Ast.StructDecl struct = structs.get(name);
    if (struct != null) {
      for (Ast.Field field : struct.fields) {
        defineDependency(field.type, field.pos);
      }
      structDefinition(struct);
    } else {
      final Type type = requireNonNull(collected.get(name), name);
      if (type instanceof GenericType) {
        ((GenericType) type).args.forEach(arg -> defineDependency(arg, pos));
        genericDefinition((GenericType) type);
      } else {
        final Type elementType = ((DynamicArrayType) type).elementType;
        out.line(
            RuntimeLibrary.dynamicArrayStruct(name, cType(elementType)));
        out.line("");
      }
      cx.instantiations.put(name, type);
    }
    defining.remove(name);
    defined.add(name);
  }

  private void defineDependency(Type type, Pos pos) {
    final Type t = Types.normalize(type);
    if (t instanceof GenericType
        || t instanceof DynamicArrayType
            && !CTypes.isBuiltInDynamicArray((DynamicArrayType) t)) {
      define(cType(t), pos);
    } else if (t instanceof NamedType
        && structs.containsKey(((NamedType) t).simpleName())) {
      define(((NamedType) t).simpleName(), pos);
    }
  }

  private void structDefinition(Ast.StructDecl struct) {
    out.line("struct " + NamedType.simpleName(struct.name) + " {");
    out.indent();
    for (Ast.Field field : struct.fields) {
      out.line(cType(field.type) + " " + field.name + ";");
    }
    out.outdent();
    out.line("};");
    out.line("");
  }

  /** Writes the tag enum, tagged union and constructors of a generic
   * instantiation, e.g. {@code Option<int>}. */
  private void genericDefinition(GenericType type) {
    final BuiltInGeneric family = requireNonNull(BuiltInGeneric.of(type));
    final String name = cType(type);
    final List<String> tags = new ArrayList<>();
    family.variants.forEach(v -> tags.add(CTypes.tagName(type, v.name)));
    out.line("// " + type.moniker());
    out.line("typedef enum { " + String.join(", ", tags) + " } " + name
        + "_Tag;");
    out.line("struct " + name + " {");
    out.indent();
    out.line(name + "_Tag tag;");
    out.line("union {");
    out.indent();
    for (BuiltInVariant variant : family.variants) {
      if (variant.hasValue()) {
        out.line(cType(type.arg(variant.valueTypeParam)) + " "
            + CTypes.valueField(variant) + ";");
      }
    }
    out.outdent();
    out.line("} data;");
    out.outdent();
    out.line("};");
    for (BuiltInVariant variant : family.variants) {
      if (!variant.hasValue()) {
        out.line("static inline " + name + " "
            + CTypes.constructorName(type, variant.name) + "(void) { return ("
            + name + "){ .tag = " + CTypes.tagName(type, variant.name)
            + " }; }");
      }
    }
    out.line("");
  }

  /** Returns whether values of a type are C structs, which are
   * zero-initialized with "{@code {0}}". */
  private boolean isAggregate(Type type) {
    return type instanceof GenericType
        || type instanceof DynamicArrayType
        || type instanceof NamedType
            && structs.containsKey(((NamedType) type).simpleName());
  }

  // declarations

  private String functionName(String name) {
    return name.equals("main") ? prefix + "_main" : name;
  }

  private String signature(Ast.Function function) {
    return signature(function.returnType, functionName(function.name),
        function.params, false);
  }

  private static String signature(Type returnType, String name,
      List<Ast.Param> params, boolean variadic) {
    final StringBuilder b = new StringBuilder();
    b.append(cType(returnType)).append(' ').append(name).append('(');
    for (Ast.Param param : params) {
      if (b.charAt(b.length() - 1) != '(') {
        b.append(", ");
      }
      b.append(cType(param.type)).append(' ').append(param.name);
    }
    if (variadic) {
      b.append(params.isEmpty() ? "..." : ", ...");
    } else if (params.isEmpty()) {
      b.append("void");
    }
    return b.append(')').toString();
  }

  /** Writes global variables. Globals whose initial value is not a constant
   * are assigned in an initialization function; returns whether there is
   * such a function. */
  private boolean globals(List<Ast.Program> programs) {
    final List<Ast.Global> deferred = new ArrayList<>();
    boolean any = false;
    for (Ast.Program program : programs) {
      for (Ast.Global global : program.globals) {
        any = true;
        final String declaration =
            "static " + cType(typeMap.getType(global)) + " " + global.name;
        if (global.init == null) {
          out.line(declaration + ";");
        } else if (isConstant(global.init)) {
          out.line(declaration + " = " + exp(global.init) + ";");
        } else {
          out.line(declaration + ";");
          deferred.add(global);
        }
      }
    }
    if (any) {
      out.line("");
    }
    if (deferred.isEmpty()) {
      return false;
    }
    out.line("void " + prefix + "_init_globals(void) {");
    out.indent();
    for (Ast.Global global : deferred) {
      out.line(global.name + " = " + exp(requireNonNull(global.init)) + ";");
    }
    out.outdent();
    out.line("}");
    out.line("");
    return true;
  }

  /** Returns whether an expression can initialize a C static variable. */
  private boolean isConstant(Ast.Exp exp) {
    switch (exp.op) {
      case INT_LITERAL:
      case FLOAT_LITERAL:
      case BOOL_LITERAL:
      case CHAR_LITERAL:
      case STRING_LITERAL:
        return true;
      case NEGATE:
        return ((Ast.PrefixCall) exp).a instanceof Ast.Literal;
      case ENUM_ACCESS:
        return BuiltInGeneric.of(typeMap.getType(exp)) == null;
      default:
        return false;
    }
  }

  private void functionDefinition(Ast.Function function) {
    currentFunction = function;
    try {
      out.line(signature(function) + " {");
      out.indent();
      function.body.forEach(this::stmt);
      out.outdent();
      out.line("}");
      out.line("");
    } finally {
      currentFunction = null;
    }
  }

  /** Writes the C entry point, which saves the command-line arguments and
   * calls the program's {@code main}. */
  private void trampoline(Ast.Function main, boolean initGlobals) {
    out.line("int main(int argc, char* argv[]) {");
    out.indent();
    out.line("__" + prefix + "_argc = argc;");
    out.line("__" + prefix + "_argv = argv;");
    if (initGlobals) {
      out.line(prefix + "_init_globals();");
    }
    final String call = functionName(main.name)
        + (main.params.size() == 2 ? "(argc, argv)" : "()");
    if (main.returnType == PrimitiveType.INT) {
      out.line("return " + call + ";");
    } else {
      out.line(call + ";");
      out.line("return 0;");
    }
    out.outdent();
    out.line("}");
  }

  // statements

  private void block(List<Ast.Stmt> stmts) {
    out.indent();
    stmts.forEach(this::stmt);
    out.outdent();
  }

  private void stmt(Ast.Stmt stmt) {
    switch (stmt.op) {
      case LET:
        final Ast.LetStmt let = (Ast.LetStmt) stmt;
        final Type letType = typeMap.getType(let);
        if (let.init != null) {
          out.line(cType(letType) + " " + let.name + " = " + exp(let.init)
              + ";");
        } else if (isAggregate(Types.normalize(letType))) {
          out.line(cType(letType) + " " + let.name + " = {0};");
        } else {
          out.line(cType(letType) + " " + let.name + ";");
        }
        return;

      case CONST:
        final Ast.ConstStmt constStmt = (Ast.ConstStmt) stmt;
        out.line(cType(typeMap.getType(constStmt)) + " " + constStmt.name
            + " = " + exp(constStmt.init) + ";");
        return;

      case ASSIGN:
        final Ast.AssignStmt assign = (Ast.AssignStmt) stmt;
        out.line(exp(assign.target) + " = " + exp(assign.value) + ";");
        return;

      case RETURN:
        final Ast.ReturnStmt returnStmt = (Ast.ReturnStmt) stmt;
        out.line(returnStmt.value == null
            ? "return;"
            : "return " + exp(returnStmt.value) + ";");
        return;

      case IF:
        final Ast.IfStmt ifStmt = (Ast.IfStmt) stmt;
        out.line("if (" + exp(ifStmt.condition) + ") {");
        block(ifStmt.thenBlock);
        if (ifStmt.elseBlock != null) {
          out.line("} else {");
          block(ifStmt.elseBlock);
        }
        out.line("}");
        return;

      case WHILE:
        final Ast.WhileStmt whileStmt = (Ast.WhileStmt) stmt;
        out.line("while (" + exp(whileStmt.condition) + ") {");
        block(whileStmt.body);
        out.line("}");
        return;

      case FOR:
        forStmt((Ast.ForStmt) stmt);
        return;

      case BREAK:
        out.line("break;");
        return;

      case CONTINUE:
        out.line("continue;");
        return;

      case EXP_STMT:
        out.line(exp(((Ast.ExpStmt) stmt).exp) + ";");
        return;

      default:
        throw new AssertionError(stmt.op);
    }
  }

  private void forStmt(Ast.ForStmt forStmt) {
    final Type variableType = typeMap.getType(forStmt);
    if (forStmt.iterable.op == Op.RANGE) {
      // Bounds are evaluated before the loop variable is declared, so that
      // they may refer to an outer variable of the same name.
      final Ast.Range range = (Ast.Range) forStmt.iterable;
      final String start = cx.nameGenerator.get("__start_");
      final String end = cx.nameGenerator.get("__end_");
      final String i = forStmt.variable;
      out.line("{");
      out.indent();
      out.line("int " + start + " = " + exp(range.start) + ";");
      out.line("int " + end + " = " + exp(range.end) + ";");
      out.line(
          format("for (int %s = %s; %s < %s; %s++) {", i, start, i, end, i));
      block(forStmt.body);
      out.line("}");
      out.outdent();
      out.line("}");
      return;
    }
    final Type iterableType = Types.normalize(typeMap.getType(forStmt.iterable));
    final String iter = cx.nameGenerator.get("__iter_");
    final String index = cx.nameGenerator.get("__index_");
    final String element;
    final String size;
    if (iterableType instanceof DynamicArrayType) {
      out.line("{");
      out.indent();
      out.line(cType(iterableType) + " " + iter + " = "
          + exp(forStmt.iterable) + ";");
      element = iter + ".data[" + index + "]";
      size = iter + ".size";
    } else if (forStmt.iterable.op == Op.ARRAY_LITERAL) {
      final Ast.ArrayLiteral literal = (Ast.ArrayLiteral) forStmt.iterable;
      out.line("{");
      out.indent();
      out.line(cType(variableType) + " " + iter + "[] = "
          + elements(literal.elements) + ";");
      element = iter + "[" + index + "]";
      size = Integer.toString(literal.elements.size());
    } else {
      out.line(
          unsupported("iteration over a fixed-size array whose length is "
              + "not known", forStmt.iterable.pos));
      return;
    }
    out.line(
        format("for (size_t %s = 0; %s < %s; %s++) {", index, index, size,
            index));
    out.indent();
    out.line(cType(variableType) + " " + forStmt.variable + " = " + element
        + ";");
    forStmt.body.forEach(this::stmt);
    out.outdent();
    out.line("}");
    out.outdent();
    out.line("}");
  }

  // expressions

  /** Returns the C code of an expression. */
  private String exp(Ast.Exp exp) {
    switch (exp.op) {
      case INT_LITERAL:
      case FLOAT_LITERAL:
      case BOOL_LITERAL:
      case CHAR_LITERAL:
      case STRING_LITERAL:
        return literal((Ast.Literal) exp);

      case ID:
        return ((Ast.Id) exp).name;

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
        return infix((Ast.InfixCall) exp);

      case NEGATE:
      case NOT:
      case DEREF:
      case ADDRESS_OF:
        // The operand is parenthesized; "-" before "-5" would read as "--".
        final Ast.PrefixCall prefixCall = (Ast.PrefixCall) exp;
        return "(" + prefixCall.op.padded + "(" + exp(prefixCall.a) + "))";

      case APPLY:
        return apply((Ast.Apply) exp);

      case METHOD_CALL:
        final Ast.MethodCall methodCall = (Ast.MethodCall) exp;
        return method(methodCall, methodCall.object, methodCall.args);

      case ARRAY_LITERAL:
        final Ast.ArrayLiteral arrayLiteral = (Ast.ArrayLiteral) exp;
        final Type arrayType = typeMap.getType(arrayLiteral);
        return "((" + cType(((ArrayType) arrayType).elementType) + "[])"
            + elements(arrayLiteral.elements) + ")";

      case DYN_ARRAY_LITERAL:
        return dynArrayLiteral((Ast.DynArrayLiteral) exp);

      case INDEX:
        final Ast.Index index = (Ast.Index) exp;
        final Type indexed = Types.normalize(typeMap.getType(index.array));
        return indexed instanceof DynamicArrayType
            ? "(" + exp(index.array) + ").data[" + exp(index.index) + "]"
            : exp(index.array) + "[" + exp(index.index) + "]";

      case FIELD_ACCESS:
        final Ast.FieldAccess fieldAccess = (Ast.FieldAccess) exp;
        return exp(fieldAccess.object) + "." + fieldAccess.field;

      case STRUCT_LITERAL:
        return structLiteral((Ast.StructLiteral) exp);

      case NEW:
        return allocation((Ast.Allocation) exp);

      case DELETE:
        return "free(" + exp(((Ast.Allocation) exp).exp) + ")";

      case CAST:
        final Ast.Cast cast = (Ast.Cast) exp;
        return "((" + cType(cast.type) + ") (" + exp(cast.exp) + "))";

      case TERNARY:
        final Ast.Ternary ternary = (Ast.Ternary) exp;
        return "(" + exp(ternary.condition) + " ? " + exp(ternary.ifTrue)
            + " : " + exp(ternary.ifFalse) + ")";

      case ENUM_ACCESS:
        return enumAccess((Ast.EnumAccess) exp);

      case MATCH:
        return match((Ast.Match) exp);

      case TRY:
        return try_((Ast.Try) exp);

      case RANGE:
      default:
        return unsupported(format("expression `%s`", exp), exp.pos);
    }
  }

  private static String literal(Ast.Literal literal) {
    switch (literal.op) {
      case BOOL_LITERAL:
        return (Boolean) literal.value ? "1" : "0";
      case CHAR_LITERAL:
        return quote(literal.value.toString(), '\'');
      case STRING_LITERAL:
        return quote((String) literal.value, '"');
      default:
        return literal.value.toString();
    }
  }

  /** Returns a C character or string literal. */
  static String quote(String s, char quote) {
    final StringBuilder b = new StringBuilder().append(quote);
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      switch (c) {
        case '\n':
          b.append("\\n");
          break;
        case '\r':
          b.append("\\r");
          break;
        case '\t':
          b.append("\\t");
          break;
        case '\\':
          b.append("\\\\");
          break;
        case '\0':
          b.append("\\0");
          break;
        case '"':
        case '\'':
          if (c == quote) {
            b.append('\\');
          }
          b.append(c);
          break;
        default:
          b.append(c);
      }
    }
    return b.append(quote).toString();
  }

  private String elements(List<Ast.Exp> elements) {
    final List<String> list = new ArrayList<>();
    elements.forEach(e -> list.add(exp(e)));
    return "{" + String.join(", ", list) + "}";
  }

  private String infix(Ast.InfixCall call) {
    final Type left = typeMap.getType(call.a0);
    final Type right = typeMap.getType(call.a1);
    if (call.op == Op.PLUS
        && Types.isString(typeMap.getType(call))) {
      return concat(call);
    }
    if (call.op.isComparison()
        && Types.isString(left) && Types.isString(right)) {
      return "(strcmp(" + exp(call.a0) + ", " + exp(call.a1) + ")"
          + call.op.padded + "0)";
    }
    if (call.op == Op.MOD
        && (left == PrimitiveType.FLOAT || right == PrimitiveType.FLOAT)) {
      return "fmod(" + exp(call.a0) + ", " + exp(call.a1) + ")";
    }
    return "(" + exp(call.a0) + call.op.padded + exp(call.a1) + ")";
  }

  /** Lowers string "{@code +}" to code that allocates a buffer and copies
   * both operands into it. */
  private String concat(Ast.InfixCall call) {
    final int n = cx.nameGenerator.next();
    final String left = "__str_left_" + n;
    final String right = "__str_right_" + n;
    final String result = "__concat_" + n;
    return statementExpression(w -> {
      w.line("char* " + left + " = " + exp(call.a0) + ";");
      w.line("char* " + right + " = " + exp(call.a1) + ";");
      w.line("char* " + result + " = (char*) malloc(strlen(" + left
          + ") + strlen(" + right + ") + 1);");
      w.line("strcpy(" + result + ", " + left + ");");
      w.line("strcat(" + result + ", " + right + ");");
      w.line(result + ";");
    });
  }

  private String dynArrayLiteral(Ast.DynArrayLiteral literal) {
    final DynamicArrayType type =
        (DynamicArrayType) typeMap.getType(literal);
    final String elementType = cType(literal.elementType);
    final String v = cx.nameGenerator.get("__dyn_");
    final int size = literal.elements.size();
    return statementExpression(w -> {
      w.line(cType(type) + " " + v + ";");
      w.line(v + ".size = " + size + ";");
      w.line(v + ".capacity = " + Math.max(size, 4) + ";");
      w.line(v + ".data = (" + elementType + "*) malloc(" + v
          + ".capacity * sizeof(" + elementType + "));");
      for (int i = 0; i < size; i++) {
        w.line(v + ".data[" + i + "] = " + exp(literal.elements.get(i))
            + ";");
      }
      w.line(v + ";");
    });
  }

  private String structLiteral(Ast.StructLiteral literal) {
    final List<String> fields = new ArrayList<>();
    literal.fields.forEach((name, value) ->
        fields.add("." + name + " = " + exp(value)));
    return "((" + NamedType.simpleName(literal.name) + "){ "
        + String.join(", ", fields) + " })";
  }

  private String allocation(Ast.Allocation allocation) {
    final PointerType type = (PointerType) typeMap.getType(allocation);
    final String pointee = cType(type.pointee);
    final String v = cx.nameGenerator.get("__new_");
    return statementExpression(w -> {
      w.line(pointee + "* " + v + " = (" + pointee + "*) malloc(sizeof("
          + pointee + "));");
      w.line("*" + v + " = " + exp(allocation.exp) + ";");
      w.line(v + ";");
    });
  }

  private String enumAccess(Ast.EnumAccess enumAccess) {
    final Type type = typeMap.getType(enumAccess);
    if (type instanceof GenericType) {
      return CTypes.constructorName((GenericType) type, enumAccess.variant)
          + "()";
    }
    return CTypes.enumConstant(enumAccess.enumName, enumAccess.variant);
  }

  // calls

  private String apply(Ast.Apply apply) {
    switch (apply.fn.op) {
      case ID:
        final String name = ((Ast.Id) apply.fn).name;
        switch (name) {
          case "print":
            return print(apply, false);
          case "println":
            return print(apply, true);
          case "len":
            return "((int) strlen(" + exp(apply.args.get(0)) + "))";
          default:
            return call(functionName(name), apply.args);
        }

      case FIELD_ACCESS:
        final Ast.FieldAccess fn = (Ast.FieldAccess) apply.fn;
        if (typeMap.getMethod(apply) != null) {
          return method(apply, fn.object, apply.args);
        }
        // A function of an imported module; modules share one namespace in
        // the generated code.
        return call(functionName(fn.field), apply.args);

      case ENUM_ACCESS:
        return construct(apply, (Ast.EnumAccess) apply.fn);

      default:
        throw new CompileException(ErrorKind.INTERNAL_ERROR,
            format("cannot call `%s`", apply.fn), apply.pos);
    }
  }

  private String call(String name, List<Ast.Exp> args) {
    final List<String> list = new ArrayList<>();
    args.forEach(arg -> list.add(exp(arg)));
    return name + "(" + String.join(", ", list) + ")";
  }

  /** Lowers "{@code Option::Some(x)}" to a compound literal of the type that
   * checking deduced for the call. */
  private String construct(Ast.Apply apply, Ast.EnumAccess fn) {
    final GenericType type = (GenericType) typeMap.getType(apply);
    final BuiltInGeneric family = requireNonNull(BuiltInGeneric.of(type));
    final BuiltInVariant variant = requireNonNull(family.variant(fn.variant));
    return "((" + cType(type) + "){ .tag = "
        + CTypes.tagName(type, variant.name) + ", .data = { ."
        + CTypes.valueField(variant) + " = " + exp(apply.args.get(0))
        + " } })";
  }

  private String print(Ast.Apply apply, boolean newline) {
    final String nl = newline ? "\\n" : "";
    if (apply.args.isEmpty()) {
      return newline ? "printf(\"\\n\")" : "((void) 0)";
    }
    final Ast.Exp arg = apply.args.get(0);
    final Type type = Types.normalize(typeMap.getType(arg));
    final String conversion = printFormat(type);
    if (conversion != null) {
      return "printf(\"" + conversion + nl + "\", " + printArg(type, exp(arg))
          + ")";
    }
    if (type instanceof DynamicArrayType) {
      return printDynamicArray(arg, (DynamicArrayType) type, nl);
    }
    if (arg.op == Op.ARRAY_LITERAL) {
      final Ast.ArrayLiteral literal = (Ast.ArrayLiteral) arg;
      final Type elementType =
          Types.normalize(((ArrayType) type).elementType);
      final String elementFormat = printFormat(elementType);
      if (elementFormat == null) {
        return unsupported(
            format("printing an array of `%s`", elementType.moniker()),
            arg.pos);
      }
      final List<String> formats = new ArrayList<>();
      final List<String> args = new ArrayList<>();
      for (Ast.Exp element : literal.elements) {
        formats.add(elementFormat);
        args.add(printArg(elementType, exp(element)));
      }
      final StringBuilder b = new StringBuilder("printf(\"[")
          .append(String.join(", ", formats)).append(']').append(nl)
          .append('"');
      args.forEach(a -> b.append(", ").append(a));
      return b.append(')').toString();
    }
    return unsupported(
        format("printing a value of type `%s`", type.moniker()), arg.pos);
  }

  private String printDynamicArray(Ast.Exp arg, DynamicArrayType type,
      String nl) {
    final Type elementType = Types.normalize(type.elementType);
    final String elementFormat = printFormat(elementType);
    if (elementFormat == null) {
      return unsupported(
          format("printing a dynamic array of `%s`", elementType.moniker()),
          arg.pos);
    }
    final int n = cx.nameGenerator.next();
    final String array = "__print_arr_" + n;
    final String i = "__print_i_" + n;
    return statementExpression(w -> {
      w.line(cType(type) + " " + array + " = " + exp(arg) + ";");
      w.line("printf(\"[\");");
      w.line(
          format("for (size_t %s = 0; %s < %s.size; %s++) {", i, i, array,
              i));
      w.indent();
      w.line("if (" + i + " > 0) printf(\", \");");
      w.line("printf(\"" + elementFormat + "\", "
          + printArg(elementType, array + ".data[" + i + "]") + ");");
      w.outdent();
      w.line("}");
      w.line("printf(\"]" + nl + "\");");
    });
  }

  /** Returns the {@code printf} conversion for a value, or null if the value
   * is not a scalar. */
  private @Nullable String printFormat(Type type) {
    return cx.isEnum(type) ? "%d" : CTypes.conversion(type);
  }

  private String printArg(Type type, String value) {
    if (cx.isEnum(type)) {
      return "(int) (" + value + ")";
    }
    if (type instanceof PointerType) {
      return "(void*) (" + value + ")";
    }
    return value;
  }

  /** Lowers a call to a built-in method. The method was resolved during
   * checking. */
  private String method(Ast.Exp call, Ast.Exp receiver, List<Ast.Exp> args) {
    final BuiltInMethod method = typeMap.getMethod(call);
    if (method == null) {
      throw new CompileException(ErrorKind.INTERNAL_ERROR,
          format("method call `%s` was not resolved", call), call.pos);
    }
    switch (method) {
      case STRING_LENGTH:
        return "((int) strlen(" + exp(receiver) + "))";
      case STRING_SUBSTRING:
        return prefix + "_substring(" + exp(receiver) + ", "
            + exp(args.get(0)) + ", " + exp(args.get(1)) + ")";
      case STRING_CONTAINS:
        return "(strstr(" + exp(receiver) + ", " + exp(args.get(0))
            + ") != NULL)";
      case STRING_TRIM:
        return prefix + "_trim(" + exp(receiver) + ")";
      case STRING_SPLIT:
        final Ast.Exp delimiter = args.get(0);
        final String d =
            typeMap.getType(delimiter) == PrimitiveType.CHAR
                ? "(char[]){" + exp(delimiter) + ", 0}"
                : exp(delimiter);
        return prefix + "_split(" + exp(receiver) + ", " + d + ")";
      case ARRAY_LENGTH:
        return "((int) (" + exp(receiver) + ").size)";
      case ARRAY_PUSH:
        return push(receiver, args.get(0));
      case ARRAY_POP:
        return pop(receiver);
      default:
        return unsupported(format("method `%s`", method.methodName()),
            call.pos);
    }
  }

  /** Lowers "{@code a.push(x)}". The buffer starts with room for 4 elements
   * and doubles when full. */
  private String push(Ast.Exp receiver, Ast.Exp value) {
    final DynamicArrayType type =
        (DynamicArrayType) Types.normalize(typeMap.getType(receiver));
    final String elementType = cType(type.elementType);
    final String p = cx.nameGenerator.get("__push_");
    return statementExpression(w -> {
      w.line(cType(type) + "* " + p + " = &(" + exp(receiver) + ");");
      w.line("if (" + p + "->size >= " + p + "->capacity) {");
      w.indent();
      w.line(p + "->capacity = " + p + "->capacity == 0 ? 4 : " + p
          + "->capacity * 2;");
      w.line(p + "->data = (" + elementType + "*) realloc(" + p + "->data, "
          + p + "->capacity * sizeof(" + elementType + "));");
      w.outdent();
      w.line("}");
      w.line(p + "->data[" + p + "->size++] = " + exp(value) + ";");
    });
  }

  /** Lowers "{@code a.pop()}". Popping an empty array yields a
   * zero-initialized element. */
  private String pop(Ast.Exp receiver) {
    final DynamicArrayType type =
        (DynamicArrayType) Types.normalize(typeMap.getType(receiver));
    final String p = cx.nameGenerator.get("__pop_");
    return statementExpression(w -> {
      w.line(cType(type) + "* " + p + " = &(" + exp(receiver) + ");");
      w.line(p + "->size > 0 ? " + p + "->data[--" + p + "->size] : ("
          + cType(type.elementType) + "){0};");
    });
  }

  // match and try

  private String match(Ast.Match match) {
    final Type scrutineeType = Types.normalize(typeMap.getType(match.exp));
    final Type resultType = typeMap.getType(match);
    final String temp = cx.nameGenerator.get("__match_temp_");
    final String result =
        resultType == PrimitiveType.VOID
            ? null
            : cx.nameGenerator.get("__match_result_");
    final List<Ast.MatchArm> arms = reachableArms(match.arms);
    return statementExpression(w -> {
      w.line(cType(scrutineeType) + " " + temp + " = " + exp(match.exp)
          + ";");
      if (result != null) {
        w.line(cType(resultType) + " " + result + ";");
      }
      if (scrutineeType instanceof GenericType) {
        variantSwitch(w, (GenericType) scrutineeType, temp, arms, result);
      } else if (scrutineeType == PrimitiveType.INT
          || scrutineeType == PrimitiveType.CHAR
          || cx.isEnum(scrutineeType)) {
        valueSwitch(w, temp, arms, result);
      } else {
        ifChain(w, scrutineeType, temp, arms, result);
      }
      if (result != null) {
        w.line(result + ";");
      }
    });
  }

  /** Returns the arms that can match: those up to and including the first
   * wildcard. */
  private static List<Ast.MatchArm> reachableArms(List<Ast.MatchArm> arms) {
    for (int i = 0; i < arms.size(); i++) {
      if (arms.get(i).pat.op == Op.WILDCARD_PAT) {
        return arms.subList(0, i + 1);
      }
    }
    return arms;
  }

  private void armBody(CWriter w, Ast.MatchArm arm, @Nullable String result) {
    w.line(result == null
        ? exp(arm.exp) + ";"
        : result + " = " + exp(arm.exp) + ";");
  }

  /** Writes a switch on the tag of an {@code Option} or {@code Result}. An
   * arm that binds the value declares a variable that holds the payload. */
  private void variantSwitch(CWriter w, GenericType type, String temp,
      List<Ast.MatchArm> arms, @Nullable String result) {
    final BuiltInGeneric family = requireNonNull(BuiltInGeneric.of(type));
    final Set<String> labels = new HashSet<>();
    w.line("switch (" + temp + ".tag) {");
    w.indent();
    for (Ast.MatchArm arm : arms) {
      if (arm.pat.op == Op.WILDCARD_PAT) {
        w.line("default: {");
      } else {
        final Ast.VariantPat pat = (Ast.VariantPat) arm.pat;
        final String label = CTypes.tagName(type, pat.variant);
        if (!labels.add(label)) {
          continue;
        }
        w.line("case " + label + ": {");
        if (pat.binding != null && !pat.binding.equals("_")) {
          final BuiltInVariant variant =
              requireNonNull(family.variant(pat.variant));
          w.indent();
          w.line(cType(typeMap.getType(pat)) + " " + pat.binding + " = "
              + temp + ".data." + CTypes.valueField(variant) + ";");
          w.outdent();
        }
      }
      w.indent();
      armBody(w, arm, result);
      w.line("break;");
      w.outdent();
      w.line("}");
    }
    w.outdent();
    w.line("}");
  }

  /** Writes a C switch on an {@code int}, {@code char} or enum value. */
  private void valueSwitch(CWriter w, String temp, List<Ast.MatchArm> arms,
      @Nullable String result) {
    final Set<String> labels = new HashSet<>();
    w.line("switch (" + temp + ") {");
    w.indent();
    for (Ast.MatchArm arm : arms) {
      switch (arm.pat.op) {
        case WILDCARD_PAT:
          w.line("default: {");
          break;
        case LITERAL_PAT:
        case VARIANT_PAT:
          final String label = label(arm.pat);
          if (!labels.add(label)) {
            continue;
          }
          w.line("case " + label + ": {");
          break;
        default:
          throw new AssertionError(arm.pat.op);
      }
      w.indent();
      armBody(w, arm, result);
      w.line("break;");
      w.outdent();
      w.line("}");
    }
    w.outdent();
    w.line("}");
  }

  private static String label(Ast.Pat pat) {
    if (pat instanceof Ast.LiteralPat) {
      return literal(((Ast.LiteralPat) pat).literal);
    }
    final Ast.VariantPat variantPat = (Ast.VariantPat) pat;
    return CTypes.enumConstant(variantPat.enumName, variantPat.variant);
  }

  /** Writes a chain of {@code if} statements, for values that C cannot
   * switch on, such as strings. */
  private void ifChain(CWriter w, Type type, String temp,
      List<Ast.MatchArm> arms, @Nullable String result) {
    for (int i = 0; i < arms.size(); i++) {
      final Ast.MatchArm arm = arms.get(i);
      final String keyword = i == 0 ? "if" : "} else if";
      switch (arm.pat.op) {
        case WILDCARD_PAT:
          w.line(i == 0 ? "{" : "} else {");
          break;
        case LITERAL_PAT:
          final String value = literal(((Ast.LiteralPat) arm.pat).literal);
          w.line(Types.isString(type)
              ? keyword + " (strcmp(" + temp + ", " + value + ") == 0) {"
              : keyword + " (" + temp + " == " + value + ") {");
          break;
        default:
          throw new CompileException(ErrorKind.INTERNAL_ERROR,
              format("pattern `%s` cannot match a value of type `%s`",
                  arm.pat, type.moniker()),
              arm.pat.pos);
      }
      w.indent();
      armBody(w, arm, result);
      w.outdent();
    }
    if (!arms.isEmpty()) {
      w.line("}");
    }
  }

  /** Lowers "{@code e?}". If {@code e} holds the success variant, the value
   * is its payload; otherwise the enclosing function returns the failure,
   * converted to the function's return type. */
  private String try_(Ast.Try aTry) {
    final GenericType operandType =
        (GenericType) Types.normalize(typeMap.getType(aTry.exp));
    final BuiltInGeneric family =
        requireNonNull(BuiltInGeneric.of(operandType));
    final Type valueType = typeMap.getType(aTry);
    if (currentFunction == null) {
      throw new CompileException(ErrorKind.INTERNAL_ERROR,
          "? operator outside a function", aTry.pos);
    }
    final GenericType returnType =
        (GenericType) Types.normalize(currentFunction.returnType);
    final BuiltInVariant success = family.successVariant();
    final BuiltInVariant failure = family.failureVariant();
    final String temp = cx.nameGenerator.get("__try_temp_");
    final String result = cx.nameGenerator.get("__try_result_");
    final String failureValue;
    if (failure.hasValue()) {
      failureValue = "((" + cType(returnType) + "){ .tag = "
          + CTypes.tagName(returnType, failure.name) + ", .data = { ."
          + CTypes.valueField(failure) + " = " + temp + ".data."
          + CTypes.valueField(failure) + " } })";
    } else {
      failureValue =
          CTypes.constructorName(returnType, failure.name) + "()";
    }
    return statementExpression(w -> {
      w.line(cType(operandType) + " " + temp + " = " + exp(aTry.exp) + ";");
      w.line(cType(valueType) + " " + result + ";");
      w.line("switch (" + temp + ".tag) {");
      w.indent();
      w.line("case " + CTypes.tagName(operandType, success.name) + ":");
      w.indent();
      w.line(result + " = " + temp + ".data." + CTypes.valueField(success)
          + ";");
      w.line("break;");
      w.outdent();
      w.line("case " + CTypes.tagName(operandType, failure.name) + ":");
      w.indent();
      w.line("return " + failureValue + ";");
      w.outdent();
      w.outdent();
      w.line("}");
      w.line(result + ";");
    });
  }

  // utilities

  /** Returns a GNU C statement expression, "{@code ({ ... })}", whose body
   * is written by an action. Expressions lowered during the action are
   * indented one level deeper than the current line. */
  private String statementExpression(Consumer<CWriter> action) {
    final CWriter saved = out;
    final CWriter w = saved.nested();
    out = w;
    try {
      action.accept(w);
    } finally {
      out = saved;
    }
    return "({\n" + w + saved.indentation() + "})";
  }

  /** Handles a construct that has no C lowering. By default, compilation
   * fails; with {@link net.hydromatic.rapter.compile.Prop#LENIENT_LOWERING},
   * the construct becomes a comment in the generated code. */
  private String unsupported(String what, Pos pos) {
    if (cx.lenient()) {
      return "/* unsupported: " + what + " */";
    }
    throw new CompileException(ErrorKind.UNSUPPORTED_FEATURE,
        format("code generation does not support %s", what), pos)
        .withSuggestion(
            CompileException.Suggestion.of("set the lenientLowering "
                + "property to emit a placeholder instead"));
  }
}

// End CodeGenerator.java
