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
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableMap;
import io.minipy.ast.IR;
import io.minipy.ast.Node;
import io.minipy.compiler.parsing.AstReadException;
import java.io.IOException;
import java.util.Map;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class MinimizerTest {

  private static final String RAW_IF = "if True:\n    x = 1\n    y = 2\n";

  private MinimizerOptions options;

  @Before
  public void setUp() {
    options = new MinimizerOptions();
  }

  private static Node ifTree() {
    return IR.module(
        IR.ifNode(
            IR.trueNode(),
            IR.block(
                IR.assign(IR.name("x"), IR.number(1)), IR.assign(IR.name("y"), IR.number(2)))));
  }

  private static Node assignTree() {
    return IR.module(IR.assign(IR.name("x"), IR.number(1)));
  }

  /** Parses only the programs it knows. */
  private static SourceParser parserOf(Map<String, Node> programs) {
    return source -> {
      Node tree = programs.get(source);
      if (tree == null) {
        throw new AstReadException("Cannot parse " + source);
      }
      return tree;
    };
  }

  private static Node stubTree(Codec codec, String program) throws IOException {
    Node decompress =
        IR.attribute(
            IR.call(IR.name("__import__"), IR.string(codec.getModuleName())), "decompress");
    return IR.module(
        IR.exprResult(
            IR.call(
                IR.name("exec"),
                IR.call(decompress, IR.bytes(codec.compress(program.getBytes(UTF_8)))))));
  }

  @Test
  public void testEndToEnd() {
    Minimizer minimizer = new Minimizer(options);
    assertThat(minimizer.minimize(ifTree(), RAW_IF)).isEqualTo("if True:x=1;y=2");
    Node returnTree =
        IR.module(IR.ifNode(IR.trueNode(), IR.block(IR.returnNode(IR.ellipsis()))));
    assertThat(minimizer.minimize(returnTree)).isEqualTo("if True:return...");
  }

  @Test
  public void testRendersAreIndependent() {
    Minimizer minimizer = new Minimizer(options);
    Node tree = IR.module(IR.importNode(IR.alias("os")), IR.importNode(IR.alias("sys")));
    assertThat(minimizer.minimize(tree)).isEqualTo("import os,sys");
    assertThat(minimizer.minimize(tree)).isEqualTo("import os,sys");
  }

  @Test
  public void testShorterRawSourceIsKept() {
    Node tree = IR.module(IR.exprResult(IR.number(100000)));
    assertThat(new Minimizer(options).minimize(tree, "1")).isEqualTo("1");
  }

  @Test
  public void testForcedCompression() {
    options.setForceCompress(true);
    String result = new Minimizer(options).minimize(ifTree());
    assertThat(result).startsWith("exec(__import__('lzma').decompress(b");
    assertThat(StubDecoder.decode(result)).isEqualTo("if True:x=1;y=2");
  }

  @Test
  public void testMinimizeSourceText() throws AstReadException {
    Minimizer minimizer =
        new Minimizer(options, parserOf(ImmutableMap.of("x = 1", assignTree())));
    assertThat(minimizer.minimize("x = 1")).isEqualTo("x=1");
    assertThrows(AstReadException.class, () -> minimizer.minimize("x ="));
  }

  @Test
  public void testTextEntryPointsNeedParser() {
    Minimizer minimizer = new Minimizer(options);
    assertThrows(IllegalStateException.class, () -> minimizer.minimize("x = 1"));
    assertThrows(IllegalStateException.class, () -> minimizer.restore("x = 1"));
  }

  @Test
  public void testRestoreStubTree() throws IOException {
    Node stub = stubTree(Codec.ZLIB, "x=1");
    assertThat(new Minimizer(options).restore(stub)).isEqualTo("x=1");
    Minimizer parsing = new Minimizer(options, parserOf(ImmutableMap.of("x=1", assignTree())));
    assertThat(parsing.restore(stub)).isEqualTo("x = 1\n");
  }

  @Test
  public void testRestoreLegacyLzmaStub() throws IOException {
    Node stub = stubTree(Codec.LZMA_ALONE, "x=1");
    assertThat(new Minimizer(options).restore(stub)).isEqualTo("x=1");
  }

  @Test
  public void testRestoreKeepsUnparsablePayload() throws IOException {
    Minimizer minimizer = new Minimizer(options, parserOf(ImmutableMap.of()));
    assertThat(minimizer.restore(stubTree(Codec.BZ2, "x=(("))).isEqualTo("x=((");
  }

  @Test
  public void testRestorePlainTree() {
    assertThat(new Minimizer(options).restore(ifTree()))
        .isEqualTo("if True:\n    x = 1\n    y = 2\n");
  }

  @Test
  public void testRestoreSourceText() throws IOException {
    String stub = Codec.GZIP.stub(Codec.GZIP.compress("x=1".getBytes(UTF_8)));
    Minimizer minimizer =
        new Minimizer(
            options, parserOf(ImmutableMap.of("x=1", assignTree(), "x  =  1", assignTree())));
    assertThat(minimizer.restore(stub)).isEqualTo("x = 1\n");
    assertThat(minimizer.restore("x  =  1")).isEqualTo("x = 1\n");
    assertThat(minimizer.restore("x = (")).isEqualTo("x = (");
  }

  @Test
  public void testPrettyPrint() {
    Node tree = IR.module(IR.importNode(IR.alias("os")), IR.importNode(IR.alias("sys")));
    assertThat(new Minimizer(options).prettyPrint(tree)).isEqualTo("import os\nimport sys\n");
  }

  @Test
  public void testAddSemicolons() {
    Node tree =
        IR.module(
            IR.assign(IR.name("x"), IR.number(1)),
            IR.ifNode(IR.name("x"), IR.block(IR.pass())));
    assertThat(new Minimizer(options).addSemicolons(tree))
        .isEqualTo("x = 1;\nif x:\n    pass;");
  }
}
