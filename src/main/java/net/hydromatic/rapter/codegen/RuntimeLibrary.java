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

import com.google.common.collect.ImmutableList;

/**
 * C source of the helper functions that generated code calls.
 *
 * <p>Helper names start with a prefix (by default "{@code rapter}") so that
 * they do not collide with user functions.
 */
abstract class RuntimeLibrary {
  private RuntimeLibrary() {}

  /** Standard headers. {@code ctype.h} is needed by {@code trim};
   * {@code math.h} by float {@code %}. */
  static final ImmutableList<String> INCLUDES =
      ImmutableList.of("stdio.h", "stdlib.h", "string.h", "stddef.h",
          "ctype.h", "math.h");

  /** Returns the declaration of the carrier struct of a dynamic array. The
   * carrier must already have been declared by {@code typedef}. */
  static String dynamicArrayStruct(String name, String elementCType) {
    return "struct " + name + " { " + elementCType
        + "* data; size_t size; size_t capacity; };";
  }

  /** Returns the anonymous definition of the carrier of a dynamic array. */
  static String dynamicArrayTypedef(String name, String elementCType) {
    return "typedef struct { " + elementCType
        + "* data; size_t size; size_t capacity; } " + name + ";";
  }

  /** Storage for the command-line arguments, and accessors for them. Only
   * the unit that defines {@code main} has these. */
  static ImmutableList<String> arguments(String prefix) {
    return ImmutableList.of(
        "static int __" + prefix + "_argc = 0;",
        "static char** __" + prefix + "_argv = NULL;",
        "int " + prefix + "_get_argc() { return __" + prefix + "_argc; }",
        "char* " + prefix + "_get_argv(int i) { return (i >= 0 && i < __"
            + prefix + "_argc) ? __" + prefix + "_argv[i] : \"\"; }");
  }

  /** Whole-file I/O. {@code read_all} returns an empty string if the file
   * cannot be read; {@code write_all} returns 0 on success, -1 on failure. */
  static ImmutableList<String> files(String prefix) {
    return ImmutableList.of(
        "int " + prefix + "_write_all(char* path, char* data) {",
        "  FILE* f = fopen(path, \"wb\");",
        "  if (!f) return -1;",
        "  size_t n = strlen(data);",
        "  size_t w = fwrite(data, 1, n, f);",
        "  fclose(f);",
        "  return w == n ? 0 : -1;",
        "}",
        "char* " + prefix + "_read_all(char* path) {",
        "  FILE* f = fopen(path, \"rb\");",
        "  long sz = -1;",
        "  if (f && fseek(f, 0, SEEK_END) == 0) sz = ftell(f);",
        "  if (sz < 0) {",
        "    if (f) fclose(f);",
        "    char* s = (char*) malloc(1);",
        "    if (s) s[0] = 0;",
        "    return s;",
        "  }",
        "  fseek(f, 0, SEEK_SET);",
        "  char* buf = (char*) malloc((size_t) sz + 1);",
        "  if (!buf) { fclose(f); return NULL; }",
        "  size_t n = fread(buf, 1, (size_t) sz, f);",
        "  fclose(f);",
        "  buf[n] = 0;",
        "  return buf;",
        "}");
  }

  /** The string methods {@code substring}, {@code trim} and
   * {@code split}. Each returns newly allocated memory. */
  static ImmutableList<String> strings(String prefix) {
    return ImmutableList.of(
        "char* " + prefix + "_substring(char* str, int start, int end) {",
        "  if (!str) return NULL;",
        "  int len = strlen(str);",
        "  if (start < 0) start = 0;",
        "  if (end > len) end = len;",
        "  if (start >= end) return strdup(\"\");",
        "  int sublen = end - start;",
        "  char* result = (char*) malloc(sublen + 1);",
        "  if (!result) return NULL;",
        "  strncpy(result, str + start, sublen);",
        "  result[sublen] = 0;",
        "  return result;",
        "}",
        "char* " + prefix + "_trim(char* str) {",
        "  if (!str) return NULL;",
        "  while (*str && isspace((unsigned char) *str)) str++;",
        "  if (!*str) return strdup(\"\");",
        "  char* end = str + strlen(str) - 1;",
        "  while (end > str && isspace((unsigned char) *end)) end--;",
        "  size_t len = end - str + 1;",
        "  char* result = (char*) malloc(len + 1);",
        "  if (!result) return NULL;",
        "  memcpy(result, str, len);",
        "  result[len] = 0;",
        "  return result;",
        "}",
        "DynamicArray_charptr " + prefix
            + "_split(char* str, char* delim) {",
        "  DynamicArray_charptr arr;",
        "  arr.size = 0;",
        "  arr.capacity = 4;",
        "  arr.data = (char**) malloc(arr.capacity * sizeof(char*));",
        "  if (!arr.data) return arr;",
        "  char* copy = strdup(str);",
        "  char* token = strtok(copy, delim);",
        "  while (token) {",
        "    if (arr.size >= arr.capacity) {",
        "      arr.capacity *= 2;",
        "      arr.data = (char**) realloc(arr.data,"
            + " arr.capacity * sizeof(char*));",
        "    }",
        "    arr.data[arr.size++] = strdup(token);",
        "    token = strtok(NULL, delim);",
        "  }",
        "  free(copy);",
        "  return arr;",
        "}");
  }
}

// End RuntimeLibrary.java
