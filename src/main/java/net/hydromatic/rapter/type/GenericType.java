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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import net.hydromatic.rapter.ast.Op;

/**
 * Instantiation of a generic type, such as "{@code Result<int, string>}".
 *
 * <p>Only the built-in families {@link BuiltInGeneric#OPTION Option} and
 * {@link BuiltInGeneric#RESULT Result} can be instantiated; the checker
 * rejects any other name.
 */
public class GenericType extends BaseType {
  public final String name;
  public final ImmutableList<Type> args;

  public GenericType(String name, List<? extends Type> args) {
    super(Op.GENERIC_TYPE);
    this.name = requireNonNull(name);
    this.args = ImmutableList.copyOf(args);
  }

  /** Returns the {@code i}th type argument. */
  public Type arg(int i) {
    return args.get(i);
  }

  @Override
  public String moniker() {
    return args.stream()
        .map(Type::moniker)
        .collect(Collectors.joining(", ", name + "<", ">"));
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof GenericType
            && name.equals(((GenericType) o).name)
            && args.equals(((GenericType) o).args);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, args);
  }
}

// End GenericType.java
