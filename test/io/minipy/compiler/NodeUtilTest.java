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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import io.minipy.ast.IR;
import io.minipy.ast.Token;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class NodeUtilTest {

  @Test
  public void testOperatorPrecedence() {
    assertThat(NodeUtil.precedence(Token.OR)).isEqualTo(Precedence.OR);
    assertThat(NodeUtil.precedence(Token.IS_NOT)).isEqualTo(Precedence.CMP);
    assertThat(NodeUtil.precedence(Token.BIT_OR)).isEqualTo(Precedence.EXPR);
    assertThat(NodeUtil.precedence(Token.MAT_MULT)).isEqualTo(Precedence.TERM);
    assertThat(NodeUtil.precedence(Token.USUB)).isEqualTo(Precedence.FACTOR);
    assertThat(NodeUtil.precedence(Token.POW)).isEqualTo(Precedence.POWER);
    assertThrows(IllegalStateException.class, () -> NodeUtil.precedence(Token.NAME));
  }

  @Test
  public void testNodePrecedence() {
    assertThat(NodeUtil.precedence(IR.tuple(IR.name("a")))).isEqualTo(Precedence.TUPLE);
    assertThat(NodeUtil.precedence(IR.tuple())).isEqualTo(Precedence.ATOM);
    assertThat(NodeUtil.precedence(IR.yield())).isEqualTo(Precedence.YIELD);
    assertThat(NodeUtil.precedence(IR.ifExp(IR.name("a"), IR.name("b"), IR.name("c"))))
        .isEqualTo(Precedence.TEST);
    assertThat(NodeUtil.precedence(IR.number(-1))).isEqualTo(Precedence.FACTOR);
    assertThat(NodeUtil.precedence(IR.number(1))).isEqualTo(Precedence.ATOM);
    assertThat(NodeUtil.precedence(IR.floatNode(-0.0))).isEqualTo(Precedence.FACTOR);
    assertThat(NodeUtil.precedence(IR.call(IR.name("f")))).isEqualTo(Precedence.ATOM);
    assertThat(NodeUtil.precedence(IR.matchAs(null, "x"))).isEqualTo(Precedence.ATOM);
    assertThat(NodeUtil.precedence(IR.matchAs(IR.matchStar(null), "x")))
        .isEqualTo(Precedence.TEST);
  }

  @Test
  public void testPrecedenceOrder() {
    assertThat(Precedence.TUPLE.isLowerThan(Precedence.TEST)).isTrue();
    assertThat(Precedence.ATOM.isLowerThan(Precedence.AWAIT)).isFalse();
    assertThat(Precedence.TEST.next()).isEqualTo(Precedence.OR);
    assertThat(Precedence.ATOM.next()).isEqualTo(Precedence.ATOM);
    assertThat(Precedence.BOR).isEqualTo(Precedence.EXPR);
  }

  @Test
  public void testOpToStr() {
    assertThat(NodeUtil.opToStr(Token.FLOOR_DIV)).isEqualTo("//");
    assertThat(NodeUtil.opToStr(Token.NOT_IN)).isEqualTo("not in");
    assertThat(NodeUtil.opToStr(Token.USUB)).isEqualTo("-");
    assertThat(NodeUtil.opToStr(Token.NAME)).isNull();
    assertThrows(IllegalStateException.class, () -> NodeUtil.opToStrNoFail(Token.CALL));
  }

  @Test
  public void testIsDocstring() {
    assertThat(NodeUtil.isDocstring(IR.exprResult(IR.string("doc")))).isTrue();
    assertThat(NodeUtil.isDocstring(IR.exprResult(IR.name("doc")))).isFalse();
    assertThat(NodeUtil.isDocstring(IR.pass())).isFalse();
  }

  @Test
  public void testAssociativity() {
    assertThat(NodeUtil.isRightAssociative(Token.POW)).isTrue();
    assertThat(NodeUtil.isRightAssociative(Token.SUB)).isFalse();
  }
}
