/*
 * Copyright 2026 The Minipy Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.minipy.compiler;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import io.minipy.ast.Node;
import io.minipy.ast.Token;
import java.util.Set;

/**
 * Post-render hooks keyed by statement kind.
 *
 * <p>The terminated kinds are the default set combined with a configured set by symmetric
 * difference, so toggling a kind twice restores it. Each terminated kind gets a hook that writes
 * the statement terminator after the statement's own text; further hooks run in registration
 * order.
 */
public final class StatementHooks {

  /** Statement kinds that need an explicit terminator before another statement may follow. */
  public static final ImmutableSet<Token> DEFAULT_TERMINATED =
      Sets.immutableEnumSet(
          Token.RETURN,
          Token.DELETE,
          Token.ASSIGN,
          Token.AUG_ASSIGN,
          Token.ANN_ASSIGN,
          Token.RAISE,
          Token.ASSERT,
          Token.IMPORT,
          Token.IMPORT_FROM,
          Token.GLOBAL,
          Token.NONLOCAL,
          Token.EXPR,
          Token.PASS,
          Token.BREAK,
          Token.CONTINUE);

  private static final StatementHooks NONE = new Builder().build();

  private final ImmutableSet<Token> terminated;
  private final ImmutableListMultimap<Token, StatementHook> hooks;

  private StatementHooks(
      ImmutableSet<Token> terminated, ImmutableListMultimap<Token, StatementHook> hooks) {
    this.terminated = terminated;
    this.hooks = hooks;
  }

  /** No hooks at all. */
  public static StatementHooks none() {
    return NONE;
  }

  /** A terminator after every kind in {@link #DEFAULT_TERMINATED}. */
  public static StatementHooks defaults() {
    return withToggled(ImmutableSet.of());
  }

  /** Terminators for the default set with the membership of {@code toggled} flipped. */
  public static StatementHooks withToggled(Set<Token> toggled) {
    return new Builder()
        .addTerminators(Sets.symmetricDifference(DEFAULT_TERMINATED, toggled))
        .build();
  }

  /** The kinds followed by a terminator. */
  public ImmutableSet<Token> getTerminatedKinds() {
    return terminated;
  }

  void afterStatement(Node statement, CodeConsumer cc) {
    for (StatementHook hook : hooks.get(statement.getToken())) {
      hook.afterStatement(statement, cc);
    }
  }

  static final class Builder {
    private final ImmutableSet.Builder<Token> terminated = ImmutableSet.builder();
    private final ImmutableListMultimap.Builder<Token, StatementHook> hooks =
        ImmutableListMultimap.builder();

    @CanIgnoreReturnValue
    Builder addTerminators(Set<Token> kinds) {
      for (Token kind : kinds) {
        terminated.add(kind);
        hooks.put(kind, StatementHook.TERMINATOR);
      }
      return this;
    }

    @CanIgnoreReturnValue
    Builder addHook(Token kind, StatementHook hook) {
      hooks.put(kind, hook);
      return this;
    }

    StatementHooks build() {
      return new StatementHooks(terminated.build(), hooks.build());
    }
  }
}
