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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Utf8;
import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Chooses the shortest program among the raw source, the minimized text and the compressed
 * stubs of the minimized text.
 *
 * <p>Lengths are UTF-8 byte counts. Candidates are compared in a fixed order with a strict
 * comparison, so a tie keeps the earlier candidate.
 */
final class OutputSelector {

  private static final Logger logger = Logger.getLogger(OutputSelector.class.getName());

  /** Compresses a payload with a codec. */
  @FunctionalInterface
  interface Compressor {
    byte[] compress(Codec codec, byte[] payload) throws IOException;
  }

  private final MinimizerOptions options;
  private final Compressor compressor;

  OutputSelector(MinimizerOptions options) {
    this(options, Codec::compress);
  }

  @VisibleForTesting
  OutputSelector(MinimizerOptions options, Compressor compressor) {
    this.options = options;
    this.compressor = compressor;
  }

  /**
   * Returns the program to emit.
   *
   * @param raw the original source text, or null when it is not known
   * @param minimized the compacted rendering of the tree
   */
  String select(@Nullable String raw, String minimized) {
    byte[] payload = minimized.getBytes(UTF_8);
    if (options.isForceCompress()) {
      String forced = stub(options.getForcedCodec(), payload);
      if (forced != null) {
        return forced;
      }
      String best = null;
      for (Codec codec : options.getCodecs()) {
        if (codec != options.getForcedCodec()) {
          best = shorter(best, stub(codec, payload));
        }
      }
      if (best == null) {
        logger.warning("Every codec failed, emitting uncompressed output");
        return minimized;
      }
      return best;
    }

    String best = raw;
    best = shorter(best, minimized);
    if (options.isCompress()) {
      for (Codec codec : options.getCodecs()) {
        best = shorter(best, stub(codec, payload));
      }
    }
    return best;
  }

  /** Returns the shorter candidate, keeping {@code best} on a tie. */
  private static @Nullable String shorter(@Nullable String best, @Nullable String candidate) {
    if (candidate == null) {
      return best;
    }
    if (best == null || Utf8.encodedLength(candidate) < Utf8.encodedLength(best)) {
      return candidate;
    }
    return best;
  }

  private @Nullable String stub(Codec codec, byte[] payload) {
    try {
      String stub = codec.stub(compressor.compress(codec, payload));
      if (logger.isLoggable(Level.FINE)) {
        logger.fine(codec + " stub: " + Utf8.encodedLength(stub) + " bytes");
      }
      return stub;
    } catch (IOException e) {
      logger.log(Level.WARNING, "Codec " + codec + " failed", e);
      return null;
    }
  }
}
