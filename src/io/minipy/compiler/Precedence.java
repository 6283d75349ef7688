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

/**
 * Binding strength of Python expressions, loosest first.
 *
 * <p>A subexpression is parenthesized when its own level is lower than the minimum its position
 * accepts.
 */
public enum Precedence {
  NAMED_EXPR, // <target>:=<expr1>
  TUPLE, // <expr1>, <expr2>
  YIELD, // 'yield', 'yield from'
  TEST, // 'if'-'else', 'lambda'
  OR, // 'or'
  AND, // 'and'
  NOT, // 'not'
  CMP, // '<', '>', '==', '>=', '<=', '!=', 'in', 'not in', 'is', 'is not'
  EXPR,
  BXOR, // '^'
  BAND, // '&'
  SHIFT, // '<<', '>>'
  ARITH, // '+', '-'
  TERM, // '*', '@', '/', '%', '//'
  FACTOR, // unary '+', '-', '~'
  POWER, // '**'
  AWAIT, // 'await'
  ATOM;

  /** '|', which shares its level with the generic expression. */
  public static final Precedence BOR = EXPR;

  /** The next tighter level, saturating at {@link #ATOM}. */
  public Precedence next() {
    return this == ATOM ? ATOM : values()[ordinal() + 1];
  }

  public boolean isLowerThan(Precedence other) {
    return compareTo(other) < 0;
  }
}
