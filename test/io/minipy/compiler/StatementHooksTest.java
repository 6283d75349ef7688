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

import com.google.common.collect.ImmutableSet;
import io.minipy.ast.IR;
import io.minipy.ast.Node;
import io.minipy.ast.Token;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class StatementHooksTest {

  private static String print(Node tree, StatementHooks hooks) {
    return new CodePrinter.Builder(tree).setStatementHooks(hooks).build();
  }

  @Test
  public void testDefaults() {
    assertThat(StatementHooks.defaults().getTerminatedKinds())
        .containsExactlyElementsIn(StatementHooks.DEFAULT_TERMINATED);
    assertThat(StatementHooks.none().getTerminatedKinds()).isEmpty();
  }

  @Test
  public void testToggleRemovesDefaultKind() {
    StatementHooks hooks = StatementHooks.withToggled(ImmutableSet.of(Token.IMPORT));
    assertThat(hooks.getTerminatedKinds()).doesNotContain(Token.IMPORT);
    assertThat(hooks.getTerminatedKinds()).contains(Token.IMPORT_FROM);
  }

  @Test
  public void testToggleAddsOtherKind() {
    StatementHooks hooks = StatementHooks.withToggled(ImmutableSet.of(Token.IF));
    assertThat(hooks.getTerminatedKinds()).contains(Token.IF);
    assertThat(hooks.getTerminatedKinds()).contains(Token.PASS);
  }

  @Test
  public void testHooksRunInRegistrationOrder() {
    StatementHooks hooks =
        new StatementHooks.Builder()
            .addTerminators(ImmutableSet.of(Token.PASS))
            .addHook(Token.PASS, (statement, cc) -> cc.append("!"))
            .build();
    assertThat(print(IR.module(IR.pass(), IR.pass()), hooks)).isEqualTo("pass;!pass;!");
  }

  @Test
  public void testNoHooks() {
    assertThat(print(IR.module(IR.pass(), IR.pass()), StatementHooks.none()))
        .isEqualTo("pass pass");
  }

  @Test
  public void testChainedIfRunsItsHooks() {
    StatementHooks hooks =
        new StatementHooks.Builder().addHook(Token.IF, (statement, cc) -> cc.append("#")).build();
    Node chain =
        IR.ifNode(
            IR.name("a"),
            IR.block(IR.pass()),
            IR.block(IR.ifNode(IR.name("b"), IR.block(IR.pass()))));
    assertThat(print(IR.module(chain), hooks)).isEqualTo("if a:\n pass\nelif b:\n pass##");
  }
}
