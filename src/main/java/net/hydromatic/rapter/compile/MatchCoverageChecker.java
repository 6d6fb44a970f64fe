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
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.rapter.ast.Ast;
import net.hydromatic.rapter.ast.Op;
import net.hydromatic.rapter.type.Type;

/** Checks whether the arms of a {@code match} cover every variant of an
 * enum.
 *
 * <p>Only user-defined enums are checked. A match on {@code Option} or
 * {@code Result} need not be exhaustive, nor need a match on a primitive
 * value. */
class MatchCoverageChecker {
  private MatchCoverageChecker() {}

  /** Returns the variants of the scrutinee's enum that no arm matches, in
   * declaration order; empty if the match is exhaustive, has a wildcard arm,
   * or is not on an enum. */
  static List<String> missingVariants(Environment env, Type scrutineeType,
      List<Ast.MatchArm> arms) {
    final ImmutableMap<String, Long> variants = env.enumLayout(scrutineeType);
    if (variants == null) {
      return ImmutableList.of();
    }
    final Set<String> covered = new HashSet<>();
    for (Ast.MatchArm arm : arms) {
      if (arm.pat.op == Op.WILDCARD_PAT) {
        return ImmutableList.of();
      }
      if (arm.pat.op == Op.VARIANT_PAT) {
        covered.add(((Ast.VariantPat) arm.pat).variant);
      }
    }
    final ImmutableList.Builder<String> missing = ImmutableList.builder();
    for (String variant : variants.keySet()) {
      if (!covered.contains(variant)) {
        missing.add(variant);
      }
    }
    return missing.build();
  }
}

// End MatchCoverageChecker.java
