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

import static net.hydromatic.rapter.Fixtures.arm;
import static net.hydromatic.rapter.Fixtures.b;
import static net.hydromatic.rapter.Fixtures.call;
import static net.hydromatic.rapter.Fixtures.construct;
import static net.hydromatic.rapter.Fixtures.enumAccess;
import static net.hydromatic.rapter.Fixtures.f;
import static net.hydromatic.rapter.Fixtures.fn;
import static net.hydromatic.rapter.Fixtures.i;
import static net.hydromatic.rapter.Fixtures.id;
import static net.hydromatic.rapter.Fixtures.if_;
import static net.hydromatic.rapter.Fixtures.infix;
import static net.hydromatic.rapter.Fixtures.let;
import static net.hydromatic.rapter.Fixtures.letMut;
import static net.hydromatic.rapter.Fixtures.match;
import static net.hydromatic.rapter.Fixtures.methodCall;
import static net.hydromatic.rapter.Fixtures.option;
import static net.hydromatic.rapter.Fixtures.param;
import static net.hydromatic.rapter.Fixtures.program;
import static net.hydromatic.rapter.Fixtures.programBuilder;
import static net.hydromatic.rapter.Fixtures.result;
import static net.hydromatic.rapter.Fixtures.ret;
import static net.hydromatic.rapter.Fixtures.s;
import static net.hydromatic.rapter.Fixtures.stmt;
import static net.hydromatic.rapter.Fixtures.variantPat;
import static net.hydromatic.rapter.ast.AstBuilder.ast;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.hydromatic.rapter.Fixtures;
import net.hydromatic.rapter.ast.Ast;
import net.hydromatic.rapter.type.ArrayType;
import net.hydromatic.rapter.type.DynamicArrayType;
import net.hydromatic.rapter.type.PointerType;
import net.hydromatic.rapter.type.PrimitiveType;
import net.hydromatic.rapter.type.StructType;
import net.hydromatic.rapter.type.Type;
import org.junit.jupiter.api.Test;

/** Tests for {@link TypeResolver}. */
public class TypeResolverTest {
  /** Checks a program that is expected to be invalid, and returns the
   * error. */
  private static CompileException fails(Ast.Program program) {
    return assertThrows(CompileException.class, () ->
        TypeResolver.deduceTypes(program));
  }

  private static Ast.Cast cast(Ast.Exp exp, Type type) {
    return ast.cast(Fixtures.P, exp, type);
  }

  @Test
  void testArithmeticPromotion() {
    final Ast.InfixCall intSum = infix(i(1), "+", i(2));
    final Ast.InfixCall mixedSum = infix(i(1), "+", f(2.5));
    final Ast.InfixCall comparison = infix(i(1), "<", i(2));
    final Ast.Program program =
        program(
            fn("f", ImmutableList.of(), PrimitiveType.FLOAT,
                let("a", intSum),
                let("c", comparison),
                ret(mixedSum)));
    final TypeMap typeMap = TypeResolver.deduceTypes(program);
    assertThat(typeMap.getType(intSum), is(PrimitiveType.INT));
    assertThat(typeMap.getType(mixedSum), is(PrimitiveType.FLOAT));
    assertThat(typeMap.getType(comparison), is(PrimitiveType.BOOL));
  }

  @Test
  void testStringConcatenation() {
    final Ast.InfixCall concat = infix(s("a"), "+", id("name"));
    final Ast.Program program =
        program(
            fn("greet",
                ImmutableList.of(param("name", PrimitiveType.STRING)),
                PrimitiveType.STRING,
                ret(concat)));
    final TypeMap typeMap = TypeResolver.deduceTypes(program);
    assertThat(typeMap.getType(concat), is(PrimitiveType.STRING));

    // A string may not be added to an int.
    final Ast.Program bad =
        program(
            fn("f", ImmutableList.of(), PrimitiveType.STRING,
                ret(infix(s("a"), "+", i(1)))));
    assertThat(fails(bad).kind, is(ErrorKind.INVALID_OPERATION));
  }

  @Test
  void testUndefinedVariable() {
    final Ast.Program program =
        program(fn("f", ImmutableList.of(), PrimitiveType.INT, ret(id("y"))));
    final CompileException e = fails(program);
    assertThat(e.kind, is(ErrorKind.UNDEFINED_VARIABLE));
    assertThat(e.context, is("in function `f`"));
  }

  @Test
  void testMissingReturn() {
    final Ast.Program program =
        program(
            fn("f", ImmutableList.of(param("x", PrimitiveType.INT)),
                PrimitiveType.INT,
                if_(infix(id("x"), ">", i(0)), ret(i(1)))));
    final CompileException e = fails(program);
    assertThat(e.kind, is(ErrorKind.MISSING_RETURN));
    assertThat(e.getMessage(), containsString("function `f`"));

    // With an else branch that also returns, every path returns.
    final Ast.Program good =
        program(
            fn("f", ImmutableList.of(param("x", PrimitiveType.INT)),
                PrimitiveType.INT,
                ast.if_(Fixtures.P, b(true), ImmutableList.of(ret(i(1))),
                    ImmutableList.of(ret(i(2))))));
    assertThat(TypeResolver.deduceTypes(good).size() > 0, is(true));
  }

  @Test
  void testReturnInLoopDoesNotCount() {
    final Ast.Program program =
        program(
            fn("f", ImmutableList.of(), PrimitiveType.INT,
                ast.while_(Fixtures.P, b(true),
                    ImmutableList.of(ret(i(1))))));
    assertThat(fails(program).kind, is(ErrorKind.MISSING_RETURN));
  }

  @Test
  void testNonExhaustiveMatch() {
    final Ast.Program program =
        programBuilder()
            .enum_("Color", "Red", "Green", "Blue")
            .functions(
                fn("f", ImmutableList.of(param("c", new StructType("Color"))),
                    PrimitiveType.INT,
                    ret(
                        match(id("c"),
                            arm(variantPat("Color", "Red", null), i(1)),
                            arm(variantPat("Color", "Green", null), i(2))))))
            .build();
    final CompileException e = fails(program);
    assertThat(e.kind, is(ErrorKind.INVALID_OPERATION));
    assertThat(e.getMessage(), containsString("missing variants: Blue"));

    // A wildcard makes the match exhaustive.
    final Ast.Program good =
        programBuilder()
            .enum_("Color", "Red", "Green", "Blue")
            .functions(
                fn("f", ImmutableList.of(param("c", new StructType("Color"))),
                    PrimitiveType.INT,
                    ret(
                        match(id("c"),
                            arm(variantPat("Color", "Red", null), i(1)),
                            arm(ast.wildcardPat(Fixtures.P), i(2))))))
            .build();
    TypeResolver.deduceTypes(good);

    // So does an arm for the missing variant.
    final Ast.Program complete =
        programBuilder()
            .enum_("Color", "Red", "Green", "Blue")
            .functions(
                fn("f", ImmutableList.of(param("c", new StructType("Color"))),
                    PrimitiveType.INT,
                    ret(
                        match(id("c"),
                            arm(variantPat("Color", "Red", null), i(1)),
                            arm(variantPat("Color", "Green", null), i(2)),
                            arm(variantPat("Color", "Blue", null), i(3))))))
            .build();
    TypeResolver.deduceTypes(complete);
  }

  @Test
  void testOptionMatchBinding() {
    final Ast.Exp v = id("v");
    final Ast.Match m =
        match(id("o"),
            arm(variantPat("Option", "Some", "v"), v),
            arm(variantPat("Option", "None", null), i(0)));
    final Ast.Program program =
        program(
            fn("f", ImmutableList.of(param("o", option(PrimitiveType.INT))),
                PrimitiveType.INT,
                ret(m)));
    final TypeMap typeMap = TypeResolver.deduceTypes(program);
    assertThat(typeMap.getType(v), is(PrimitiveType.INT));
    assertThat(typeMap.getType(m), is(PrimitiveType.INT));
  }

  @Test
  void testNoneNeedsHint() {
    final Ast.Program program =
        program(
            fn("f", ImmutableList.of(), PrimitiveType.VOID,
                let("x", enumAccess("Option", "None"))));
    final CompileException e = fails(program);
    assertThat(e.kind, is(ErrorKind.TYPE_MISMATCH));
    assertThat(e.getMessage(),
        is("cannot use `Option::None` without type parameters"));

    // The declared type of the variable is the hint.
    final Ast.EnumAccess none = enumAccess("Option", "None");
    final Ast.Program good =
        program(
            fn("f", ImmutableList.of(), PrimitiveType.VOID,
                let("x", option(PrimitiveType.INT), none)));
    assertThat(TypeResolver.deduceTypes(good).getType(none),
        is(option(PrimitiveType.INT)));
  }

  @Test
  void testErrNeedsHint() {
    final Ast.Apply err = construct("Result", "Err", s("oops"));
    final Ast.Program program =
        program(
            fn("f", ImmutableList.of(),
                result(PrimitiveType.INT, PrimitiveType.STRING),
                ret(err)));
    final TypeMap typeMap = TypeResolver.deduceTypes(program);
    assertThat(typeMap.getType(err).moniker(), is("Result<int, string>"));

    final Ast.Program bad =
        program(
            fn("f", ImmutableList.of(), PrimitiveType.VOID,
                let("r", construct("Result", "Ok", i(1)))));
    assertThat(fails(bad).kind, is(ErrorKind.TYPE_MISMATCH));
  }

  @Test
  void testTry() {
    final Ast.Try aTry = ast.try_(Fixtures.P, call("parse", s("1")));
    final Ast.Program program =
        program(
            fn("parse", ImmutableList.of(param("s", PrimitiveType.STRING)),
                result(PrimitiveType.INT, PrimitiveType.STRING),
                ret(construct("Result", "Ok", i(1)))),
            fn("twice", ImmutableList.of(),
                result(PrimitiveType.INT, PrimitiveType.STRING),
                let("n", aTry),
                ret(construct("Result", "Ok", infix(id("n"), "*", i(2))))));
    final TypeMap typeMap = TypeResolver.deduceTypes(program);
    assertThat(typeMap.getType(aTry), is(PrimitiveType.INT));
  }

  @Test
  void testTryInWrongFunction() {
    final Ast.Program program =
        program(
            fn("parse", ImmutableList.of(),
                result(PrimitiveType.INT, PrimitiveType.STRING),
                ret(construct("Result", "Ok", i(1)))),
            fn("f", ImmutableList.of(), PrimitiveType.INT,
                ret(ast.try_(Fixtures.P, call("parse")))));
    final CompileException e = fails(program);
    assertThat(e.kind, is(ErrorKind.TYPE_MISMATCH));
    assertThat(e.getMessage(),
        containsString("? operator used on `Result<int, string>`"));

    // The error types must agree.
    final Ast.Program program2 =
        program(
            fn("parse", ImmutableList.of(),
                result(PrimitiveType.INT, PrimitiveType.STRING),
                ret(construct("Result", "Ok", i(1)))),
            fn("f", ImmutableList.of(),
                result(PrimitiveType.INT, PrimitiveType.INT),
                ret(construct("Result", "Ok",
                    ast.try_(Fixtures.P, call("parse"))))));
    assertThat(fails(program2).kind, is(ErrorKind.TYPE_MISMATCH));
  }

  @Test
  void testTryResultInOptionFunction() {
    final Ast.Program program =
        program(
            fn("parse", ImmutableList.of(),
                result(PrimitiveType.INT, PrimitiveType.STRING),
                ret(construct("Result", "Ok", i(1)))),
            fn("f", ImmutableList.of(), option(PrimitiveType.INT),
                ret(construct("Option", "Some",
                    ast.try_(Fixtures.P, call("parse"))))));
    final CompileException e = fails(program);
    assertThat(e.kind, is(ErrorKind.TYPE_MISMATCH));
    assertThat(e.getMessage(),
        is("? operator used on `Result<int, string>` but function `f` "
            + "returns `Option<int>`"));
  }

  @Test
  void testMethods() {
    final Ast.MethodCall length = methodCall(id("s"), "length");
    final Ast.MethodCall split = methodCall(id("s"), "split", s(","));
    final Ast.MethodCall splitChar =
        methodCall(id("s"), "split", Fixtures.c(','));
    final Ast.Program program =
        program(
            fn("f", ImmutableList.of(param("s", PrimitiveType.STRING)),
                PrimitiveType.INT,
                let("parts", split),
                let("parts2", splitChar),
                ret(length)));
    final TypeMap typeMap = TypeResolver.deduceTypes(program);
    assertThat(typeMap.getType(length), is(PrimitiveType.INT));
    assertThat(typeMap.getMethod(length), is(BuiltInMethod.STRING_LENGTH));
    assertThat(typeMap.getType(split),
        is(new DynamicArrayType(PrimitiveType.STRING)));
    assertThat(typeMap.getMethod(splitChar), is(BuiltInMethod.STRING_SPLIT));

    final Ast.Program bad =
        program(
            fn("f", ImmutableList.of(param("s", PrimitiveType.STRING)),
                PrimitiveType.INT,
                ret(methodCall(id("s"), "frobnicate"))));
    final CompileException e = fails(bad);
    assertThat(e.kind, is(ErrorKind.UNDEFINED_FUNCTION));
  }

  @Test
  void testPushNeedsMutableReceiver() {
    final DynamicArrayType intVec = new DynamicArrayType(PrimitiveType.INT);
    final Ast.Program program =
        program(
            fn("f", ImmutableList.of(), PrimitiveType.VOID,
                let("xs", intVec,
                    ast.dynArrayLiteral(Fixtures.P, PrimitiveType.INT,
                        ImmutableList.of(i(1)))),
                stmt(methodCall(id("xs"), "push", i(2)))));
    final CompileException e = fails(program);
    assertThat(e.kind, is(ErrorKind.IMMUTABLE_ASSIGNMENT));
    assertThat(e.getMessage(),
        is("cannot call `push` on immutable variable `xs`"));

    final Ast.MethodCall pop = methodCall(id("xs"), "pop");
    final Ast.Program good =
        program(
            fn("f", ImmutableList.of(), PrimitiveType.INT,
                letMut("xs", intVec,
                    ast.dynArrayLiteral(Fixtures.P, PrimitiveType.INT,
                        ImmutableList.of(i(1)))),
                stmt(methodCall(id("xs"), "push", i(2))),
                ret(pop)));
    final TypeMap typeMap = TypeResolver.deduceTypes(good);
    assertThat(typeMap.getType(pop), is(PrimitiveType.INT));
    assertThat(typeMap.getMethod(pop), is(BuiltInMethod.ARRAY_POP));
  }

  /** A method may be called on a field of a struct variable; the receiver
   * is not mistaken for a module. */
  @Test
  void testMethodOnFieldReceiver() {
    final DynamicArrayType intVec = new DynamicArrayType(PrimitiveType.INT);
    final Ast.Apply push =
        ast.apply(Fixtures.P,
            ast.fieldAccess(Fixtures.P,
                ast.fieldAccess(Fixtures.P, id("p"), "items"), "push"),
            ImmutableList.of(i(1)));
    final Ast.Apply length =
        ast.apply(Fixtures.P,
            ast.fieldAccess(Fixtures.P,
                ast.fieldAccess(Fixtures.P, id("p"), "name"), "length"),
            ImmutableList.of());
    final Ast.Program program =
        programBuilder()
            .struct("Bag", "items", intVec, "name", PrimitiveType.STRING)
            .functions(
                fn("f", ImmutableList.of(param("p", new StructType("Bag"))),
                    PrimitiveType.INT,
                    stmt(push),
                    ret(length)))
            .build();
    final TypeMap typeMap = TypeResolver.deduceTypes(program);
    assertThat(typeMap.getMethod(push), is(BuiltInMethod.ARRAY_PUSH));
    assertThat(typeMap.getMethod(length), is(BuiltInMethod.STRING_LENGTH));
    assertThat(typeMap.getType(length), is(PrimitiveType.INT));

    // An unknown name before the dot is still reported as a missing module
    // function.
    final Ast.Program bad =
        program(
            fn("f", ImmutableList.of(), PrimitiveType.VOID,
                stmt(
                    ast.apply(Fixtures.P,
                        ast.fieldAccess(Fixtures.P, id("geo"), "area"),
                        ImmutableList.of()))));
    final CompileException e = fails(bad);
    assertThat(e.kind, is(ErrorKind.UNDEFINED_FUNCTION));
    assertThat(e.getMessage(), containsString("geo.area"));
  }

  @Test
  void testDivisionByZero() {
    final Ast.Program program =
        program(
            fn("f", ImmutableList.of(param("x", PrimitiveType.INT)),
                PrimitiveType.INT,
                ret(infix(id("x"), "/", i(0)))));
    final CompileException e = fails(program);
    assertThat(e.kind, is(ErrorKind.INVALID_OPERATION));
    assertThat(e.getMessage(), is("division by zero"));

    final Ast.Program program2 =
        program(
            fn("f", ImmutableList.of(param("x", PrimitiveType.FLOAT)),
                PrimitiveType.FLOAT,
                ret(infix(id("x"), "%", f(0.0)))));
    assertThat(fails(program2).getMessage(), is("modulo by zero"));

    // Dividing by a variable that may be zero is not checked.
    final Ast.Program good =
        program(
            fn("f",
                ImmutableList.of(param("x", PrimitiveType.INT),
                    param("y", PrimitiveType.INT)),
                PrimitiveType.INT,
                ret(infix(id("x"), "/", id("y")))));
    TypeResolver.deduceTypes(good);
  }

  @Test
  void testNegativeIndex() {
    final ArrayType intArray = new ArrayType(PrimitiveType.INT);
    final Ast.Program program =
        program(
            fn("f", ImmutableList.of(param("xs", intArray)),
                PrimitiveType.INT,
                ret(ast.index(Fixtures.P, id("xs"), i(-1)))));
    final CompileException e = fails(program);
    assertThat(e.kind, is(ErrorKind.INVALID_OPERATION));
    assertThat(e.getMessage(), is("index `-1` is negative"));

    final Ast.Program program2 =
        program(
            fn("f", ImmutableList.of(param("xs", intArray)),
                PrimitiveType.INT,
                ret(ast.index(Fixtures.P, id("xs"),
                    ast.negate(Fixtures.P, i(2))))));
    assertThat(fails(program2).kind, is(ErrorKind.INVALID_OPERATION));

    final Ast.Index index = ast.index(Fixtures.P, id("xs"), i(0));
    final Ast.Program good =
        program(
            fn("f", ImmutableList.of(param("xs", intArray)),
                PrimitiveType.INT,
                ret(index)));
    assertThat(TypeResolver.deduceTypes(good).getType(index),
        is(PrimitiveType.INT));
  }

  @Test
  void testCasts() {
    final PointerType charPtr = new PointerType(PrimitiveType.CHAR);
    final PointerType intPtr = new PointerType(PrimitiveType.INT);
    final Ast.Cast intToFloat = cast(id("n"), PrimitiveType.FLOAT);
    final Ast.Cast floatToInt = cast(id("x"), PrimitiveType.INT);
    final Ast.Cast charToInt = cast(id("c"), PrimitiveType.INT);
    final Ast.Cast stringToPtr = cast(id("s"), charPtr);
    final Ast.Cast ptrToPtr = cast(id("p"), intPtr);
    final Ast.Cast ptrToInt = cast(id("p"), PrimitiveType.INT);
    final Ast.Cast intToPtr = cast(id("n"), charPtr);
    final ImmutableList<Ast.Param> params =
        ImmutableList.of(param("n", PrimitiveType.INT),
            param("x", PrimitiveType.FLOAT),
            param("c", PrimitiveType.CHAR),
            param("s", PrimitiveType.STRING),
            param("p", charPtr),
            param("b", PrimitiveType.BOOL));
    final Ast.Program good =
        program(
            fn("f", params, PrimitiveType.VOID,
                let("a", intToFloat),
                let("b2", floatToInt),
                let("c2", charToInt),
                let("d", stringToPtr),
                let("e", ptrToPtr),
                let("g", ptrToInt),
                let("h", intToPtr)));
    final TypeMap typeMap = TypeResolver.deduceTypes(good);
    assertThat(typeMap.getType(intToFloat), is(PrimitiveType.FLOAT));
    assertThat(typeMap.getType(stringToPtr), is(charPtr));
    assertThat(typeMap.getType(ptrToInt), is(PrimitiveType.INT));

    // bool has no casts; float does not cast to char, nor string to int.
    final Ast.Cast[] badCasts = {
        cast(id("b"), PrimitiveType.INT),
        cast(id("x"), PrimitiveType.CHAR),
        cast(id("s"), PrimitiveType.INT),
        cast(id("x"), charPtr),
    };
    for (Ast.Cast cast : badCasts) {
      final CompileException e =
          fails(program(fn("f", params, PrimitiveType.VOID, let("y", cast))));
      assertThat(e.kind, is(ErrorKind.INVALID_OPERATION));
      assertThat(e.getMessage(), containsString("cannot cast from type"));
    }
  }

  @Test
  void testTernary() {
    final Ast.Ternary ternary =
        ast.ternary(Fixtures.P, infix(id("x"), ">", i(0)), i(1), i(2));
    final Ast.Program good =
        program(
            fn("f", ImmutableList.of(param("x", PrimitiveType.INT)),
                PrimitiveType.INT,
                ret(ternary)));
    assertThat(TypeResolver.deduceTypes(good).getType(ternary),
        is(PrimitiveType.INT));

    final Ast.Program mixed =
        program(
            fn("f", ImmutableList.of(param("x", PrimitiveType.INT)),
                PrimitiveType.VOID,
                let("y",
                    ast.ternary(Fixtures.P, b(true), i(1), s("one")))));
    assertThat(fails(mixed).kind, is(ErrorKind.TYPE_MISMATCH));

    final Ast.Program notBool =
        program(
            fn("f", ImmutableList.of(param("x", PrimitiveType.INT)),
                PrimitiveType.INT,
                ret(ast.ternary(Fixtures.P, id("x"), i(1), i(2)))));
    final CompileException e = fails(notBool);
    assertThat(e.kind, is(ErrorKind.TYPE_MISMATCH));
    assertThat(e.getMessage(), is("expected `bool`, found `int`"));
  }

  @Test
  void testUnknownField() {
    final StructType point = new StructType("Point");
    final Ast.Program access =
        programBuilder()
            .struct("Point", "x", PrimitiveType.INT, "y", PrimitiveType.INT)
            .functions(
                fn("f", ImmutableList.of(param("p", point)),
                    PrimitiveType.INT,
                    ret(ast.fieldAccess(Fixtures.P, id("p"), "z"))))
            .build();
    final CompileException e = fails(access);
    assertThat(e.kind, is(ErrorKind.UNDEFINED_VARIABLE));
    assertThat(e.getMessage(), is("struct `Point` has no field `z`"));

    final Ast.Program literal =
        programBuilder()
            .struct("Point", "x", PrimitiveType.INT, "y", PrimitiveType.INT)
            .functions(
                fn("f", ImmutableList.of(), PrimitiveType.VOID,
                    let("p",
                        ast.structLiteral(Fixtures.P, "Point",
                            ImmutableMap.of("x", i(1), "w", i(2))))))
            .build();
    final CompileException e2 = fails(literal);
    assertThat(e2.kind, is(ErrorKind.UNDEFINED_VARIABLE));
    assertThat(e2.getMessage(), is("struct `Point` has no field `w`"));
  }

  @Test
  void testJumpOutsideLoop() {
    final Ast.Program breakProgram =
        program(
            fn("f", ImmutableList.of(), PrimitiveType.VOID,
                ast.break_(Fixtures.P)));
    final CompileException e = fails(breakProgram);
    assertThat(e.kind, is(ErrorKind.INVALID_OPERATION));
    assertThat(e.getMessage(), is("`break` outside of a loop"));

    final Ast.Program continueProgram =
        program(
            fn("f", ImmutableList.of(), PrimitiveType.VOID,
                if_(b(true), ast.continue_(Fixtures.P))));
    assertThat(fails(continueProgram).getMessage(),
        is("`continue` outside of a loop"));

    final Ast.Program good =
        program(
            fn("f", ImmutableList.of(), PrimitiveType.VOID,
                ast.while_(Fixtures.P, b(true),
                    ImmutableList.of(if_(b(false), ast.break_(Fixtures.P)),
                        ast.continue_(Fixtures.P)))));
    TypeResolver.deduceTypes(good);
  }

  @Test
  void testArrayLiteral() {
    final Ast.ArrayLiteral ints =
        ast.arrayLiteral(Fixtures.P, ImmutableList.of(i(1), i(2), i(3)));
    final Ast.Program good =
        program(
            fn("f", ImmutableList.of(), PrimitiveType.VOID,
                let("xs", ints),
                let("ys", new ArrayType(PrimitiveType.INT),
                    ast.arrayLiteral(Fixtures.P, ImmutableList.of()))));
    assertThat(TypeResolver.deduceTypes(good).getType(ints),
        is(new ArrayType(PrimitiveType.INT)));

    final Ast.Program mixed =
        program(
            fn("f", ImmutableList.of(), PrimitiveType.VOID,
                let("xs",
                    ast.arrayLiteral(Fixtures.P,
                        ImmutableList.of(i(1), s("two"))))));
    final CompileException e = fails(mixed);
    assertThat(e.kind, is(ErrorKind.TYPE_MISMATCH));
    assertThat(e.getMessage(),
        is("array elements must have compatible types: `int` vs `string`"));

    final Ast.Program empty =
        program(
            fn("f", ImmutableList.of(), PrimitiveType.VOID,
                let("xs", ast.arrayLiteral(Fixtures.P, ImmutableList.of()))));
    final CompileException e2 = fails(empty);
    assertThat(e2.kind, is(ErrorKind.INVALID_SYNTAX));
    assertThat(e2.getMessage(),
        is("empty array literals need an explicit type annotation"));
  }

  @Test
  void testDerefNonPointer() {
    final Ast.Program program =
        program(
            fn("f", ImmutableList.of(param("x", PrimitiveType.INT)),
                PrimitiveType.INT,
                ret(ast.deref(Fixtures.P, id("x")))));
    final CompileException e = fails(program);
    assertThat(e.kind, is(ErrorKind.INVALID_OPERATION));
    assertThat(e.getMessage(), is("cannot dereference a value of type `int`"));

    final Ast.PrefixCall deref = ast.deref(Fixtures.P, id("p"));
    final Ast.Program good =
        program(
            fn("f",
                ImmutableList.of(
                    param("p", new PointerType(PrimitiveType.INT))),
                PrimitiveType.INT,
                ret(deref)));
    assertThat(TypeResolver.deduceTypes(good).getType(deref),
        is(PrimitiveType.INT));
  }

  /** Named types are compatible if one name qualifies the other, which is
   * not transitive: {@code a.Point} and {@code b.Point} are each
   * compatible with {@code Point} but not with each other. Every pair of
   * match arms, and every pair of array elements, must be compatible. */
  @Test
  void testCompatibilityIsPairwise() {
    final ImmutableList<Ast.Param> params =
        ImmutableList.of(param("n", PrimitiveType.INT),
            param("p", new StructType("Point")),
            param("a", new StructType("a.Point")),
            param("b", new StructType("b.Point")));
    final Ast.Program matchProgram =
        programBuilder()
            .struct("Point", "x", PrimitiveType.INT)
            .functions(
                fn("f", params, PrimitiveType.VOID,
                    let("r",
                        match(id("n"),
                            arm(ast.literalPat(Fixtures.P, i(1)), id("p")),
                            arm(ast.literalPat(Fixtures.P, i(2)), id("a")),
                            arm(ast.wildcardPat(Fixtures.P), id("b"))))))
            .build();
    final CompileException e = fails(matchProgram);
    assertThat(e.kind, is(ErrorKind.TYPE_MISMATCH));
    assertThat(e.getMessage(),
        is("match arms have incompatible types: `a.Point` vs `b.Point`"));

    final Ast.Program arrayProgram =
        programBuilder()
            .struct("Point", "x", PrimitiveType.INT)
            .functions(
                fn("f", params, PrimitiveType.VOID,
                    let("r",
                        ast.arrayLiteral(Fixtures.P,
                            ImmutableList.of(id("p"), id("a"), id("b"))))))
            .build();
    final CompileException e2 = fails(arrayProgram);
    assertThat(e2.kind, is(ErrorKind.TYPE_MISMATCH));
    assertThat(e2.getMessage(),
        is("array elements must have compatible types: `a.Point` vs "
            + "`b.Point`"));
  }

  @Test
  void testDuplicateFunction() {
    final Ast.Program program =
        program(
            fn("f", ImmutableList.of(), PrimitiveType.VOID),
            fn("f", ImmutableList.of(), PrimitiveType.VOID));
    assertThat(fails(program).kind, is(ErrorKind.DUPLICATE_DEFINITION));
  }

  @Test
  void testIntrinsicCall() {
    final Ast.Apply print = call("println", s("hi"));
    final Ast.Apply sqrt = call("sqrt", f(2.0));
    final Ast.Program program =
        program(
            fn("f", ImmutableList.of(), PrimitiveType.VOID,
                stmt(print),
                let("r", sqrt)));
    final TypeMap typeMap = TypeResolver.deduceTypes(program);
    assertThat(typeMap.getType(print), is(PrimitiveType.VOID));
    // Intrinsics return int, whatever their C signature.
    assertThat(typeMap.getType(sqrt), is(PrimitiveType.INT));
  }
}

// End TypeResolverTest.java
