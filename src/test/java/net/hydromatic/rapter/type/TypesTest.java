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
package net.hydromatic.rapter.type;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link Types}. */
public class TypesTest {
  private static final Type POINT = new StructType("Point");
  private static final Type A_POINT = new StructType("a.Point");
  private static final Type B_POINT = new StructType("b.Point");
  private static final Type STR = new StructType(StructType.STR);

  /** Sample of types, including some pairs that are compatible without
   * being equal. */
  private static final List<Type> GRID =
      ImmutableList.of(PrimitiveType.INT, PrimitiveType.FLOAT,
          PrimitiveType.BOOL, PrimitiveType.CHAR, PrimitiveType.STRING,
          PrimitiveType.VOID, STR, POINT, A_POINT, B_POINT,
          new EnumType("Point"), new EnumType("Color"),
          new PointerType(PrimitiveType.INT),
          new PointerType(PrimitiveType.CHAR),
          new PointerType(A_POINT),
          new ArrayType(PrimitiveType.INT),
          new ArrayType(STR),
          new ArrayType(PrimitiveType.STRING),
          new DynamicArrayType(PrimitiveType.INT),
          new DynamicArrayType(POINT),
          new DynamicArrayType(B_POINT),
          new GenericType("Option", ImmutableList.of(PrimitiveType.INT)),
          new GenericType("Result",
              ImmutableList.of(PrimitiveType.INT, PrimitiveType.STRING)));

  @Test
  void testCompatibleIsReflexiveAndSymmetric() {
    for (Type a : GRID) {
      assertThat(a.moniker(), Types.compatible(a, a), is(true));
      for (Type b : GRID) {
        assertThat(a.moniker() + " vs " + b.moniker(),
            Types.compatible(a, b), is(Types.compatible(b, a)));
      }
    }
  }

  @Test
  void testCompatiblePairs() {
    assertCompatible(PrimitiveType.STRING, STR);
    assertCompatible(new StructType("Color"), new EnumType("Color"));
    assertCompatible(POINT, A_POINT);
    assertCompatible(new PointerType(POINT), new PointerType(A_POINT));
    assertCompatible(new ArrayType(STR), new ArrayType(PrimitiveType.STRING));
    assertCompatible(new DynamicArrayType(POINT),
        new DynamicArrayType(B_POINT));

    assertIncompatible(PrimitiveType.INT, PrimitiveType.FLOAT);
    assertIncompatible(PrimitiveType.INT, PrimitiveType.BOOL);
    assertIncompatible(PrimitiveType.CHAR, PrimitiveType.STRING);
    assertIncompatible(new PointerType(PrimitiveType.CHAR),
        PrimitiveType.STRING);
    assertIncompatible(new ArrayType(PrimitiveType.INT),
        new DynamicArrayType(PrimitiveType.INT));
    assertIncompatible(
        new GenericType("Option", ImmutableList.of(PrimitiveType.INT)),
        new GenericType("Option", ImmutableList.of(PrimitiveType.FLOAT)));
  }

  /** Qualified names are compatible with their unqualified form, but two
   * names qualified by different modules are not compatible with each
   * other. */
  @Test
  void testCompatibleIsNotTransitive() {
    assertCompatible(A_POINT, POINT);
    assertCompatible(POINT, B_POINT);
    assertIncompatible(A_POINT, B_POINT);
    assertIncompatible(new StructType("Point"), new StructType("APoint"));
  }

  @Test
  void testNormalize() {
    assertThat(Types.normalize(STR), is(PrimitiveType.STRING));
    assertThat(Types.normalize(PrimitiveType.STRING),
        is(PrimitiveType.STRING));
    assertThat(Types.normalize(POINT), is(POINT));
    assertThat(Types.isString(STR), is(true));
    assertThat(Types.isString(POINT), is(false));
    assertThat(Types.isNumeric(PrimitiveType.FLOAT), is(true));
    assertThat(Types.isNumeric(PrimitiveType.CHAR), is(false));
  }

  @Test
  void testElementType() {
    assertThat(Types.elementType(new ArrayType(PrimitiveType.INT)),
        is(PrimitiveType.INT));
    assertThat(Types.elementType(new DynamicArrayType(POINT)), is(POINT));
    assertThat(Types.elementType(new PointerType(PrimitiveType.FLOAT)),
        is(PrimitiveType.FLOAT));
    assertThat(Types.elementType(PrimitiveType.STRING),
        is(PrimitiveType.CHAR));
    assertThat(Types.elementType(PrimitiveType.INT) == null, is(true));
  }

  @Test
  void testMoniker() {
    assertThat(new PointerType(PrimitiveType.INT).moniker(), is("*int"));
    assertThat(
        new GenericType("Result",
            ImmutableList.of(PrimitiveType.INT, PrimitiveType.STRING))
            .moniker(),
        is("Result<int, string>"));
  }

  private static void assertCompatible(Type a, Type b) {
    assertThat(a.moniker() + " vs " + b.moniker(), Types.compatible(a, b),
        is(true));
  }

  private static void assertIncompatible(Type a, Type b) {
    assertThat(a.moniker() + " vs " + b.moniker(), Types.compatible(a, b),
        is(false));
  }
}

// End TypesTest.java
