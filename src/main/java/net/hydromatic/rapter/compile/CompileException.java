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

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import net.hydromatic.rapter.ast.Pos;
import net.hydromatic.rapter.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An error occurred during compilation.
 *
 * <p>Instances are immutable; methods such as {@link #withSuggestion} return a
 * copy. Checking stops at the first error, so a compilation produces at most
 * one of these; {@link #related} holds secondary locations, such as the
 * previous definition of a duplicated name.
 */
public class CompileException extends RuntimeException {
  public final ErrorKind kind;
  private final Pos pos;
  public final @Nullable String context;
  public final ImmutableList<Suggestion> suggestions;
  public final ImmutableList<CompileException> related;

  public CompileException(ErrorKind kind, String message, Pos pos) {
    this(kind, message, pos, null, ImmutableList.of(), ImmutableList.of());
  }

  private CompileException(
      ErrorKind kind,
      String message,
      Pos pos,
      @Nullable String context,
      ImmutableList<Suggestion> suggestions,
      ImmutableList<CompileException> related) {
    super(message);
    this.kind = requireNonNull(kind);
    this.pos = requireNonNull(pos);
    this.context = context;
    this.suggestions = requireNonNull(suggestions);
    this.related = requireNonNull(related);
  }

  /** Creates an "undefined variable" error. */
  public static CompileException undefinedVariable(String name, Pos pos) {
    return new CompileException(ErrorKind.UNDEFINED_VARIABLE,
        format("cannot find variable `%s` in this scope", name), pos)
        .withSuggestion(
            Suggestion.of(
                format("declare `%s` before using it", name),
                format("let %s = ...;", name)));
  }

  /** Creates an "undefined function" error. */
  public static CompileException undefinedFunction(String name, Pos pos) {
    return new CompileException(ErrorKind.UNDEFINED_FUNCTION,
        format("cannot find function `%s` in this scope", name), pos);
  }

  /** Creates an "undefined type" error. */
  public static CompileException undefinedType(String name, Pos pos) {
    return new CompileException(ErrorKind.UNDEFINED_TYPE,
        format("cannot find type `%s` in this scope", name), pos);
  }

  /** Creates a "type mismatch" error. */
  public static CompileException typeMismatch(Type expected, Type found,
      Pos pos) {
    return new CompileException(ErrorKind.TYPE_MISMATCH,
        format("expected `%s`, found `%s`", expected.moniker(),
            found.moniker()),
        pos);
  }

  /** Creates an "invalid operation" error. */
  public static CompileException invalidOperation(String message, Pos pos) {
    return new CompileException(ErrorKind.INVALID_OPERATION, message, pos);
  }

  /** Creates a "duplicate definition" error that refers back to the
   * previous definition. */
  public static CompileException duplicateDefinition(String name, Pos pos,
      Pos previousPos) {
    final CompileException previous =
        new CompileException(ErrorKind.DUPLICATE_DEFINITION,
            format("previous definition of `%s` here", name), previousPos);
    return new CompileException(ErrorKind.DUPLICATE_DEFINITION,
        format("the name `%s` is defined multiple times", name), pos)
        .withRelated(previous);
  }

  /** Returns a copy of this exception with an additional suggestion. */
  public CompileException withSuggestion(Suggestion suggestion) {
    return new CompileException(kind, getMessage(), pos, context,
        ImmutableList.<Suggestion>builder().addAll(suggestions)
            .add(suggestion).build(),
        related);
  }

  /** Returns a copy of this exception with an additional related error. */
  public CompileException withRelated(CompileException e) {
    return new CompileException(kind, getMessage(), pos, context, suggestions,
        ImmutableList.<CompileException>builder().addAll(related).add(e)
            .build());
  }

  /** Returns a copy of this exception with a context description, such as
   * "in function `main`". */
  public CompileException withContext(String context) {
    return new CompileException(kind, getMessage(), pos, context, suggestions,
        related);
  }

  /** Returns the position of the error in the source. */
  public Pos pos() {
    return pos;
  }

  @Override
  public String toString() {
    return super.toString() + " at " + pos;
  }

  /** Describes this error, its suggestions and related errors, one per
   * line. */
  public StringBuilder describeTo(StringBuilder buf) {
    pos.describeTo(buf)
        .append(" Error[")
        .append(kind.code)
        .append("]: ")
        .append(getMessage());
    if (context != null) {
      buf.append(" (").append(context).append(')');
    }
    for (Suggestion suggestion : suggestions) {
      buf.append("\n  help: ").append(suggestion.message);
      if (suggestion.codeExample != null) {
        buf.append("\n    ").append(suggestion.codeExample);
      }
    }
    for (CompileException e : related) {
      buf.append("\n  note: ");
      e.pos.describeTo(buf).append(' ').append(e.getMessage());
    }
    return buf;
  }

  /** Remedy for an error. */
  public static class Suggestion {
    public final String message;
    public final @Nullable String codeExample;

    private Suggestion(String message, @Nullable String codeExample) {
      this.message = requireNonNull(message);
      this.codeExample = codeExample;
    }

    public static Suggestion of(String message) {
      return new Suggestion(message, null);
    }

    public static Suggestion of(String message, String codeExample) {
      return new Suggestion(message, codeExample);
    }

    @Override
    public String toString() {
      return message;
    }
  }
}

// End CompileException.java
