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
package net.hydromatic.rapter.module;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import net.hydromatic.rapter.ast.Ast;
import net.hydromatic.rapter.ast.Pos;
import net.hydromatic.rapter.compile.CompileException;
import net.hydromatic.rapter.compile.CompileException.Suggestion;
import net.hydromatic.rapter.compile.ErrorKind;
import net.hydromatic.rapter.compile.Symbol;

/**
 * Loads modules and resolves the symbols that a program imports.
 *
 * <p>Each module is loaded at most once; later requests for the same name
 * return the same {@link Module}, so checking and code generation see the
 * same trees.
 */
public class ModuleResolver {
  private final ModuleLoader loader;
  private final Map<String, Module> modules = new HashMap<>();

  public ModuleResolver(ModuleLoader loader) {
    this.loader = requireNonNull(loader);
  }

  /** Returns a module, loading it if this is the first request.
   *
   * @param name Module name
   * @param pos Position of the import that requested it */
  public Module load(String name, Pos pos) {
    final Module module = modules.get(name);
    if (module != null) {
      return module;
    }
    final Ast.Program program;
    try {
      program = loader.load(name);
    } catch (CompileException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new CompileException(ErrorKind.MODULE_LOAD_ERROR,
          format("failed to load module `%s`: %s", name, e.getMessage()),
          pos);
    }
    if (program == null) {
      throw new CompileException(ErrorKind.MODULE_NOT_FOUND,
          format("module `%s` not found", name), pos)
          .withSuggestion(
              Suggestion.of("check the module name in the import"));
    }
    final Module newModule = new Module(name, program, exports(program));
    modules.put(name, newModule);
    return newModule;
  }

  /** Returns the number of modules loaded so far. */
  public int loadedCount() {
    return modules.size();
  }

  /** Computes the symbols that a program exports. */
  static ImmutableMap<String, Symbol> exports(Ast.Program program) {
    final Map<String, Symbol> exports = new LinkedHashMap<>();
    for (Ast.Export export : program.exports) {
      final Symbol symbol;
      switch (export.kind) {
        case FUNCTION:
          final Ast.Function function = program.function(export.name);
          symbol = function == null ? null : Symbol.of(function);
          break;
        case STRUCT:
          final Ast.StructDecl struct = program.struct(export.name);
          symbol = struct == null ? null : Symbol.of(struct);
          break;
        case ENUM:
          final Ast.EnumDecl enumDecl = program.enum_(export.name);
          symbol = enumDecl == null ? null : Symbol.of(enumDecl);
          break;
        default:
          throw new AssertionError(export.kind);
      }
      if (symbol == null) {
        throw exportError(program, export);
      }
      exports.put(export.name, symbol);
    }
    return ImmutableMap.copyOf(exports);
  }

  private static CompileException exportError(Ast.Program program,
      Ast.Export export) {
    final String kind = export.kind.name().toLowerCase(Locale.ROOT);
    if (program.function(export.name) != null
        || program.struct(export.name) != null
        || program.enum_(export.name) != null) {
      return new CompileException(ErrorKind.MODULE_EXPORT_ERROR,
          format("`%s` is exported as a %s, but is not a %s", export.name,
              kind, kind),
          export.pos);
    }
    return new CompileException(ErrorKind.EXPORT_NOT_FOUND,
        format("exported %s `%s` not found in module", kind, export.name),
        export.pos)
        .withSuggestion(
            Suggestion.of(format("ensure %s `%s` is defined in the module",
                kind, export.name)));
  }

  /**
   * Returns the symbols that a program imports.
   *
   * <p>Each exported symbol is visible both under its own name and under
   * its name qualified by the import's alias (or, if there is no alias, by
   * the module name). For example, "{@code import geometry as g;}" makes
   * function {@code area} visible as "{@code area}" and "{@code g.area}".
   *
   * @throws CompileException if two imported modules export the same name
   */
  public ImmutableMap<String, Symbol> resolveImports(Ast.Program program) {
    final Map<String, Symbol> symbols = new LinkedHashMap<>();
    final Map<String, String> owners = new HashMap<>();
    for (Ast.Import import_ : program.imports) {
      final Module module = load(import_.module, import_.pos);
      final String prefix = import_.prefix();
      module.exports.forEach((name, symbol) -> {
        final String owner = owners.putIfAbsent(name, module.name);
        if (owner != null && !owner.equals(module.name)) {
          throw new CompileException(ErrorKind.IMPORT_CONFLICT,
              format("`%s` is exported by both `%s` and `%s`", name, owner,
                  module.name),
              import_.pos)
              .withSuggestion(
                  Suggestion.of("import one of the modules with an alias, "
                      + "and use qualified names"));
        }
        symbols.put(name, symbol);
        symbols.put(prefix + "." + name, symbol.withName(prefix + "." + name));
      });
    }
    return ImmutableMap.copyOf(symbols);
  }

  /**
   * Returns every module that a program imports, directly or indirectly,
   * in dependency order: each module comes after the modules it imports.
   *
   * @throws CompileException if there is a cycle of imports
   */
  public ImmutableList<Module> transitiveModules(Ast.Program program) {
    final List<Module> list = new ArrayList<>();
    final Set<String> done = new HashSet<>();
    final Deque<String> path = new ArrayDeque<>();
    for (Ast.Import import_ : program.imports) {
      visit(import_, list, done, path);
    }
    return ImmutableList.copyOf(list);
  }

  private void visit(Ast.Import import_, List<Module> list, Set<String> done,
      Deque<String> path) {
    final String name = import_.module;
    if (done.contains(name)) {
      return;
    }
    if (path.contains(name)) {
      final List<String> cycle = new ArrayList<>();
      path.descendingIterator().forEachRemaining(cycle::add);
      cycle.subList(0, cycle.indexOf(name)).clear();
      cycle.add(name);
      throw new CompileException(ErrorKind.CIRCULAR_IMPORT,
          format("circular import: %s", String.join(" -> ", cycle)),
          import_.pos);
    }
    final Module module = load(name, import_.pos);
    path.push(name);
    for (Ast.Import child : module.program.imports) {
      visit(child, list, done, path);
    }
    path.pop();
    done.add(name);
    list.add(module);
  }
}

// End ModuleResolver.java
