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

import com.google.common.base.Strings;
import com.google.common.base.Utf8;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class OutputSelectorTest {

  private static final String REPETITIVE = Strings.repeat("print('hello, world')\n", 50).trim();

  private MinimizerOptions options;

  @Before
  public void setUp() {
    options = new MinimizerOptions();
  }

  private String select(String raw, String minimized) {
    return new OutputSelector(options).select(raw, minimized);
  }

  /** Selects with the given codecs throwing instead of compressing. */
  private String selectFailing(ImmutableSet<Codec> failing, String raw, String minimized) {
    OutputSelector.Compressor compressor =
        (codec, payload) -> {
          if (failing.contains(codec)) {
            throw new IOException("cannot compress with " + codec);
          }
          return codec.compress(payload);
        };
    return new OutputSelector(options, compressor).select(raw, minimized);
  }

  private static String stub(Codec codec, String text) throws IOException {
    return codec.stub(codec.compress(text.getBytes(UTF_8)));
  }

  /** The first of the shortest stubs over {@code codecs}. */
  private static String shortestStub(List<Codec> codecs, String text) throws IOException {
    String best = null;
    for (Codec codec : codecs) {
      String stub = stub(codec, text);
      if (best == null || Utf8.encodedLength(stub) < Utf8.encodedLength(best)) {
        best = stub;
      }
    }
    return best;
  }

  @Test
  public void testShortProgramStaysUncompressed() {
    assertThat(select(null, "x=1")).isEqualTo("x=1");
  }

  @Test
  public void testShorterRawSourceWins() {
    assertThat(select("x=1", "x=10")).isEqualTo("x=1");
  }

  @Test
  public void testTieKeepsEarlierCandidate() {
    assertThat(select("y=1", "x=1")).isEqualTo("y=1");
  }

  @Test
  public void testLengthsCountUtf8Bytes() {
    // Three characters, six bytes.
    assertThat(select("\u00e9\u00e9\u00e9", "abcd")).isEqualTo("abcd");
  }

  @Test
  public void testRepetitiveProgramIsCompressed() {
    String selected = select(null, REPETITIVE);
    assertThat(StubDecoder.isStub(selected)).isTrue();
    assertThat(StubDecoder.decode(selected)).isEqualTo(REPETITIVE);
  }

  @Test
  public void testCompressionDisabled() {
    options.setCompress(false);
    assertThat(select(null, REPETITIVE)).isEqualTo(REPETITIVE);
  }

  @Test
  public void testOnlyConfiguredCodecsAreTried() {
    options.setCodecs(ImmutableList.of(Codec.BZ2));
    assertThat(select(null, REPETITIVE)).startsWith("exec(__import__('bz2')");
  }

  @Test
  public void testForcedCompressionUsesForcedCodec() {
    options.setForceCompress(true);
    options.setForcedCodec(Codec.ZLIB);
    String selected = select("x=1", "x=1");
    assertThat(selected).startsWith("exec(__import__('zlib')");
    assertThat(StubDecoder.decode(selected)).isEqualTo("x=1");
  }

  @Test
  public void testSelectsShortestCandidate() throws IOException {
    String medium = "def f(a,b):\n return a*b+f(b,a)\nprint(f(1,2),f(3,4),f(5,6),f(7,8))";
    String pretty = "def f(a, b):\n    return a * b + f(b, a)\n";
    for (String minimized : ImmutableList.of("x=1", medium, REPETITIVE)) {
      List<String> candidates = new ArrayList<>();
      candidates.add(pretty + minimized);
      candidates.add(minimized);
      for (Codec codec : Codec.values()) {
        candidates.add(stub(codec, minimized));
      }
      int shortest = Integer.MAX_VALUE;
      for (String candidate : candidates) {
        shortest = Math.min(shortest, Utf8.encodedLength(candidate));
      }

      String selected = select(pretty + minimized, minimized);
      assertThat(candidates).contains(selected);
      assertThat(Utf8.encodedLength(selected)).isEqualTo(shortest);
    }
  }

  @Test
  public void testFailingCodecIsLeftOut() throws IOException {
    ImmutableSet<Codec> failing = ImmutableSet.of(Codec.LZMA, Codec.LZMA_ALONE);
    String selected = selectFailing(failing, null, REPETITIVE);
    assertThat(selected)
        .isEqualTo(shortestStub(ImmutableList.of(Codec.ZLIB, Codec.GZIP, Codec.BZ2), REPETITIVE));
    assertThat(StubDecoder.decode(selected)).isEqualTo(REPETITIVE);
  }

  @Test
  public void testEveryCodecFailingKeepsUncompressedText() {
    ImmutableSet<Codec> all = ImmutableSet.copyOf(Codec.values());
    assertThat(selectFailing(all, null, REPETITIVE)).isEqualTo(REPETITIVE);
    assertThat(selectFailing(all, "x = 1", "x=1")).isEqualTo("x=1");
  }

  @Test
  public void testFailingForcedCodecFallsBackToOtherCodecs() throws IOException {
    options.setForceCompress(true);
    options.setForcedCodec(Codec.LZMA_ALONE);
    String selected = selectFailing(ImmutableSet.of(Codec.LZMA_ALONE), "x=1", "x=1");
    assertThat(selected)
        .isEqualTo(
            shortestStub(ImmutableList.of(Codec.LZMA, Codec.ZLIB, Codec.GZIP, Codec.BZ2), "x=1"));
    assertThat(StubDecoder.decode(selected)).isEqualTo("x=1");
  }

  @Test
  public void testForcedCompressionWithEveryCodecFailing() {
    options.setForceCompress(true);
    ImmutableSet<Codec> all = ImmutableSet.copyOf(Codec.values());
    assertThat(selectFailing(all, "x = 1", "x=1")).isEqualTo("x=1");
  }
}
