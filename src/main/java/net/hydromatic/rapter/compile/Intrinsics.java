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

import com.google.common.collect.ImmutableSet;

/**
 * Functions of the C standard library that a program may call without
 * declaring them with "{@code extern fn}".
 *
 * <p>A call to an intrinsic has type {@code int}, whatever the C return type;
 * its arguments are checked but not against any signature.
 */
public abstract class Intrinsics {
  private Intrinsics() {}

  private static final ImmutableSet<String> NAMES =
      ImmutableSet.of(
          // memory
          "malloc", "free", "realloc", "calloc",
          // strings
          "strlen", "strcmp", "strncmp", "strcpy", "strncpy", "strcat",
          "strncat", "strchr", "strstr", "strdup",
          "memcpy", "memmove", "memset", "memcmp",
          // I/O
          "printf", "fprintf", "sprintf", "snprintf",
          "scanf", "fscanf", "sscanf",
          "puts", "fputs", "putchar", "getchar",
          "fopen", "fclose", "fread", "fwrite", "fseek", "ftell", "rewind",
          // math
          "abs", "labs", "sqrt", "pow", "sin", "cos", "tan",
          "floor", "ceil", "round",
          // conversion
          "atoi", "atol", "atof", "strtol", "strtod");

  /** Returns whether a name is an intrinsic function. */
  public static boolean isIntrinsic(String name) {
    return NAMES.contains(name);
  }
}

// End Intrinsics.java
