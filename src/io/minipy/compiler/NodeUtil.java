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

import io.minipy.ast.Node;
import io.minipy.ast.Token;
import org.jspecify.annotations.Nullable;

/** NodeUtil contains generally useful syntax tree utilities. */
public final class NodeUtil {

  private NodeUtil() {}

  /**
   * The precedence of an operator token.
   *
   * @throws IllegalStateException for tokens that are not operators
   */
  public static Precedence precedence(Token type) {
    switch (type) {
      case NAMED_EXPR:
        return Precedence.NAMED_EXPR;
      case OR:
        return Precedence.OR;
      case AND:
        return Precedence.AND;
      case NOT:
        return Precedence.NOT;
      case EQ:
      case NOT_EQ:
      case LT:
      case LT_E:
      case GT:
      case GT_E:
      case IS:
      case IS_NOT:
      case IN:
      case NOT_IN:
      case COMPARE:
        return Precedence.CMP;
      case BIT_OR:
        return Precedence.BOR;
      case BIT_XOR:
        return Precedence.BXOR;
      case BIT_AND:
        return Precedence.BAND;
      case LSHIFT:
      case RSHIFT:
        return Precedence.SHIFT;
      case ADD:
      case SUB:
        return Precedence.ARITH;
      case MULT:
      case MAT_MULT:
      case DIV:
      case MOD:
      case FLOOR_DIV:
        return Precedence.TERM;
      case INVERT:
      case UADD:
      case USUB:
        return Precedence.FACTOR;
      case POW:
        return Precedence.POWER;
      case AWAIT:
        return Precedence.AWAIT;
      default:
        throw new IllegalStateException("Unknown precedence for " + type);
    }
  }

  /**
   * The precedence of an expression or pattern node as it is written without parentheses.
   * Anything that is not an operator binds like an atom.
   */
  public static Precedence precedence(Node n) {
    switch (n.getToken()) {
      case TUPLE:
        return n.hasChildren() ? Precedence.TUPLE : Precedence.ATOM;
      case YIELD:
      case YIELD_FROM:
        return Precedence.YIELD;
      case LAMBDA:
      case IF_EXP:
        return Precedence.TEST;
      case MATCH_AS:
        return n.hasChildren() ? Precedence.TEST : Precedence.ATOM;
      case MATCH_OR:
        return Precedence.BOR;
      case INT:
        return n.getBigInteger().signum() < 0 ? Precedence.FACTOR : Precedence.ATOM;
      case FLOAT:
      case IMAGINARY:
        return Math.copySign(1.0, n.getDouble()) < 0 ? Precedence.FACTOR : Precedence.ATOM;
      case NAMED_EXPR:
      case OR:
      case AND:
      case NOT:
      case COMPARE:
      case BIT_OR:
      case BIT_XOR:
      case BIT_AND:
      case LSHIFT:
      case RSHIFT:
      case ADD:
      case SUB:
      case MULT:
      case MAT_MULT:
      case DIV:
      case MOD:
      case FLOOR_DIV:
      case INVERT:
      case UADD:
      case USUB:
      case POW:
      case AWAIT:
        return precedence(n.getToken());
      default:
        return Precedence.ATOM;
    }
  }

  /** Only exponentiation groups right to left. */
  public static boolean isRightAssociative(Token type) {
    return type == Token.POW;
  }

  /** Returns the source text of an operator, or null for other tokens. */
  public static @Nullable String opToStr(Token operator) {
    switch (operator) {
      case AND:
        return "and";
      case OR:
        return "or";
      case NAMED_EXPR:
        return ":=";
      case ADD:
      case UADD:
        return "+";
      case SUB:
      case USUB:
        return "-";
      case MULT:
        return "*";
      case MAT_MULT:
        return "@";
      case DIV:
        return "/";
      case MOD:
        return "%";
      case POW:
        return "**";
      case LSHIFT:
        return "<<";
      case RSHIFT:
        return ">>";
      case BIT_OR:
        return "|";
      case BIT_XOR:
        return "^";
      case BIT_AND:
        return "&";
      case FLOOR_DIV:
        return "//";
      case INVERT:
        return "~";
      case NOT:
        return "not";
      case EQ:
        return "==";
      case NOT_EQ:
        return "!=";
      case LT:
        return "<";
      case LT_E:
        return "<=";
      case GT:
        return ">";
      case GT_E:
        return ">=";
      case IS:
        return "is";
      case IS_NOT:
        return "is not";
      case IN:
        return "in";
      case NOT_IN:
        return "not in";
      default:
        return null;
    }
  }

  static String opToStrNoFail(Token operator) {
    String res = opToStr(operator);
    if (res == null) {
      throw new IllegalStateException("Unknown op " + operator);
    }
    return res;
  }

  /** Whether {@code n} is a statement consisting of a bare string literal. */
  static boolean isDocstring(Node n) {
    return n.isExprStatement() && n.getFirstChild().isString();
  }
}
