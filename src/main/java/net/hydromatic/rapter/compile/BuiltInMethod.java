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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableTable;
import java.util.Locale;
import net.hydromatic.rapter.type.DynamicArrayType;
import net.hydromatic.rapter.type.PrimitiveType;
import net.hydromatic.rapter.type.Type;
import net.hydromatic.rapter.type.Types;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Built-in method of strings and dynamic arrays.
 *
 * <p>A call "{@code receiver.name(args)}" is resolved by mapping the name to
 * a {@link Capability} and the receiver's type to a {@link Receiver}, and
 * looking up the pair in a table. The checker does this once and records the
 * result in the {@link TypeMap}; code generation dispatches on the recorded
 * constant.
 */
public enum BuiltInMethod {
  STRING_LENGTH(Capability.LENGTH, Receiver.STRING) {
    @Override
    public Type returnType(Type receiverType) {
      return PrimitiveType.INT;
    }
  },

  STRING_SUBSTRING(Capability.SUBSTRING, Receiver.STRING,
      PrimitiveType.INT, PrimitiveType.INT) {
    @Override
    public Type returnType(Type receiverType) {
      return PrimitiveType.STRING;
    }
  },

  STRING_CONTAINS(Capability.CONTAINS, Receiver.STRING,
      PrimitiveType.STRING) {
    @Override
    public Type returnType(Type receiverType) {
      return PrimitiveType.BOOL;
    }
  },

  STRING_TRIM(Capability.TRIM, Receiver.STRING) {
    @Override
    public Type returnType(Type receiverType) {
      return PrimitiveType.STRING;
    }
  },

  /** Splits a string by a delimiter, which may be a string or a char. */
  STRING_SPLIT(Capability.SPLIT, Receiver.STRING, PrimitiveType.STRING) {
    @Override
    public Type returnType(Type receiverType) {
      return new DynamicArrayType(PrimitiveType.STRING);
    }

    @Override
    public boolean accepts(int i, Type argType, Type receiverType) {
      return super.accepts(i, argType, receiverType)
          || argType == PrimitiveType.CHAR;
    }
  },

  ARRAY_PUSH(Capability.PUSH, Receiver.DYNAMIC_ARRAY) {
    @Override
    public Type paramType(int i, Type receiverType) {
      return elementType(receiverType);
    }

    @Override
    public Type returnType(Type receiverType) {
      return PrimitiveType.VOID;
    }

    @Override
    public int arity() {
      return 1;
    }
  },

  ARRAY_POP(Capability.POP, Receiver.DYNAMIC_ARRAY) {
    @Override
    public Type returnType(Type receiverType) {
      return elementType(receiverType);
    }
  },

  ARRAY_LENGTH(Capability.LENGTH, Receiver.DYNAMIC_ARRAY) {
    @Override
    public Type returnType(Type receiverType) {
      return PrimitiveType.INT;
    }
  };

  public final Capability capability;
  public final Receiver receiver;
  private final ImmutableList<Type> paramTypes;

  private static final ImmutableTable<Capability, Receiver, BuiltInMethod>
      TABLE;

  static {
    final ImmutableTable.Builder<Capability, Receiver, BuiltInMethod> b =
        ImmutableTable.builder();
    for (BuiltInMethod method : values()) {
      b.put(method.capability, method.receiver, method);
    }
    TABLE = b.build();
  }

  BuiltInMethod(Capability capability, Receiver receiver,
      Type... paramTypes) {
    this.capability = capability;
    this.receiver = receiver;
    this.paramTypes = ImmutableList.copyOf(paramTypes);
  }

  /** Looks up the method that a call "{@code receiver.name(...)}" invokes;
   * returns null if the receiver's type has no such method. */
  public static @Nullable BuiltInMethod lookup(Type receiverType,
      String name) {
    final Capability capability = Capability.BY_METHOD_NAME.get(name);
    final Receiver receiver = Receiver.of(receiverType);
    if (capability == null || receiver == null) {
      return null;
    }
    return TABLE.get(capability, receiver);
  }

  /** Method name, as written in source code. */
  public String methodName() {
    return capability.methodName;
  }

  /** Number of arguments, not including the receiver. */
  public int arity() {
    return paramTypes.size();
  }

  /** Type of the {@code i}th argument, used as the expected type when
   * checking the argument. */
  public Type paramType(int i, Type receiverType) {
    return paramTypes.get(i);
  }

  /** Returns whether an argument of a given type is acceptable. */
  public boolean accepts(int i, Type argType, Type receiverType) {
    return Types.compatible(argType, paramType(i, receiverType));
  }

  /** Type of the value returned by the method. */
  public abstract Type returnType(Type receiverType);

  /** Returns whether the method modifies its receiver, which must then be
   * something that can be assigned to. */
  public boolean mutatesReceiver() {
    return capability == Capability.PUSH || capability == Capability.POP;
  }

  private static Type elementType(Type receiverType) {
    return ((DynamicArrayType) receiverType).elementType;
  }

  /** Operation that one or more receiver types support. */
  public enum Capability {
    LENGTH,
    SUBSTRING,
    CONTAINS,
    TRIM,
    SPLIT,
    PUSH,
    POP;

    public final String methodName = name().toLowerCase(Locale.ROOT);

    static final ImmutableMap<String, Capability> BY_METHOD_NAME;

    static {
      final ImmutableMap.Builder<String, Capability> b =
          ImmutableMap.builder();
      for (Capability capability : values()) {
        b.put(capability.methodName, capability);
      }
      BY_METHOD_NAME = b.build();
    }
  }

  /** Kind of type that has built-in methods. */
  public enum Receiver {
    STRING,
    DYNAMIC_ARRAY;

    /** Returns the kind of a type, or null if it has no methods. */
    public static @Nullable Receiver of(Type type) {
      if (Types.isString(type)) {
        return STRING;
      }
      if (type instanceof DynamicArrayType) {
        return DYNAMIC_ARRAY;
      }
      return null;
    }
  }
}

// End BuiltInMethod.java
