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

import java.util.List;
import net.hydromatic.rapter.ast.Ast;

/** Checks whether every path through a block of statements returns.
 *
 * <p>A block returns if it contains a {@code return} statement at its top
 * level, or an {@code if} statement whose then-block and else-block both
 * return. Loops never count, even a {@code while true} loop with no
 * {@code break}. */
class ReturnPathChecker {
  private ReturnPathChecker() {}

  /** Returns whether every path through a block returns a value. */
  static boolean blockReturns(List<? extends Ast.Stmt> stmts) {
    for (Ast.Stmt stmt : stmts) {
      if (stmtReturns(stmt)) {
        return true; // statements after it are unreachable
      }
    }
    return false;
  }

  private static boolean stmtReturns(Ast.Stmt stmt) {
    switch (stmt.op) {
      case RETURN:
        return true;
      case IF:
        final Ast.IfStmt ifStmt = (Ast.IfStmt) stmt;
        return ifStmt.elseBlock != null
            && blockReturns(ifStmt.thenBlock)
            && blockReturns(ifStmt.elseBlock);
      default:
        return false;
    }
  }
}

// End ReturnPathChecker.java
