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

import io.minipy.ast.IR;
import io.minipy.ast.Node;
import org.junit.Before;

/** Base class for tests that exercise {@link CodePrinter}. */
public abstract class CodePrinterTestBase {
  protected MinimizerOptions options;

  @Before
  public void setUp() throws Exception {
    options = new MinimizerOptions();
    options.setCompress(false);
  }

  /** The raw compact line buffer, terminators included. */
  String printNode(Node n) {
    return new CodePrinter.Builder(n).setOptions(options).build();
  }

  void assertPrintNode(String expected, Node ast) {
    assertThat(printNode(ast)).isEqualTo(expected);
  }

  String prettyPrintNode(Node n) {
    return new CodePrinter.Builder(n).setPrettyPrint(true).build();
  }

  void assertPrettyPrintNode(String expected, Node ast) {
    assertThat(prettyPrintNode(ast)).isEqualTo(expected);
  }

  /** Compact printing followed by block compaction, without compression. */
  String minimizeNode(Node n) {
    return new Minimizer(options).minimize(n);
  }

  void assertMinimize(String expected, Node... statements) {
    assertThat(minimizeNode(IR.module(statements))).isEqualTo(expected);
  }
}
