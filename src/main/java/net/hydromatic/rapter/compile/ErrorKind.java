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

/**
 * Kind of compilation error.
 *
 * <p>Each kind has a stable code, such as "E206", that users can search for,
 * and a short title. Lexical and syntax errors are raised by the parser; the
 * other kinds are raised by this project.
 */
public enum ErrorKind {
  // lexical
  UNEXPECTED_CHARACTER("E001", "unexpected character"),
  UNTERMINATED_STRING("E002", "unterminated string"),
  UNTERMINATED_COMMENT("E003", "unterminated comment"),
  INVALID_NUMBER("E004", "invalid number"),

  // syntax
  UNEXPECTED_TOKEN("E101", "unexpected token"),
  EXPECTED_TOKEN("E102", "expected token"),
  INVALID_SYNTAX("E103", "invalid syntax"),
  UNEXPECTED_EOF("E104", "unexpected end of file"),
  INVALID_EXPRESSION("E105", "invalid expression"),

  // semantic
  UNDEFINED_VARIABLE("E201", "undefined variable"),
  UNDEFINED_FUNCTION("E202", "undefined function"),
  UNDEFINED_TYPE("E203", "undefined type"),
  UNDEFINED_MODULE("E204", "undefined module"),
  DUPLICATE_DEFINITION("E205", "duplicate definition"),
  TYPE_MISMATCH("E206", "type mismatch"),
  INVALID_OPERATION("E207", "invalid operation"),
  WRONG_ARGUMENT_COUNT("E208", "wrong number of arguments"),
  IMMUTABLE_ASSIGNMENT("E209", "assignment to immutable variable"),
  MISSING_RETURN("E210", "missing return"),

  // modules
  MODULE_NOT_FOUND("E301", "module not found"),
  MODULE_LOAD_ERROR("E302", "module load error"),
  MODULE_EXPORT_ERROR("E303", "module export error"),
  CIRCULAR_IMPORT("E304", "circular import"),
  EXPORT_NOT_FOUND("E305", "export not found"),
  IMPORT_CONFLICT("E306", "import conflict"),

  // code generation
  UNSUPPORTED_FEATURE("E401", "unsupported feature"),
  INTERNAL_ERROR("E500", "internal compiler error");

  public final String code;
  public final String title;

  ErrorKind(String code, String title) {
    this.code = code;
    this.title = title;
  }
}

// End ErrorKind.java
