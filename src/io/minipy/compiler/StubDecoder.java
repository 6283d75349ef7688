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

import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/** Recovers the source text embedded in a compressed stub. */
public final class StubDecoder {

  private static final Logger logger = Logger.getLogger(StubDecoder.class.getName());

  private static final Pattern STUB =
      Pattern.compile(
          "exec\\(__import__\\('(\\w+)'\\)\\.decompress\\("
              + "(b'(?:[^'\\\\]|\\\\.)*'|b\"(?:[^\"\\\\]|\\\\.)*\")\\)\\)",
          Pattern.DOTALL);

  private static final byte[] XZ_MAGIC = {(byte) 0xFD, '7', 'z', 'X', 'Z', 0};

  private StubDecoder() {}

  /** Whether {@code text} has the shape of a stub. */
  public static boolean isStub(String text) {
    return STUB.matcher(text.strip()).matches();
  }

  /** Returns the decompressed program of a stub, or {@code text} itself on any failure. */
  public static String decode(String text) {
    String decoded = tryDecode(text);
    return decoded == null ? text : decoded;
  }

  static @Nullable String tryDecode(String text) {
    Matcher matcher = STUB.matcher(text.strip());
    if (!matcher.matches()) {
      return null;
    }
    Codec codec = codecFor(matcher.group(1));
    if (codec == null) {
      logger.fine("Unknown stub module " + matcher.group(1));
      return null;
    }
    try {
      byte[] payload = PyLiterals.parseBytesLiteral(matcher.group(2));
      if (codec == Codec.LZMA && !hasXzMagic(payload)) {
        codec = Codec.LZMA_ALONE;
      }
      return new String(codec.decompress(payload), UTF_8);
    } catch (IOException | IllegalArgumentException e) {
      logger.log(Level.WARNING, "Cannot decode " + codec + " stub", e);
      return null;
    }
  }

  private static @Nullable Codec codecFor(String moduleName) {
    for (Codec codec : Codec.values()) {
      if (codec.getModuleName().equals(moduleName)) {
        return codec;
      }
    }
    return null;
  }

  private static boolean hasXzMagic(byte[] payload) {
    if (payload.length < XZ_MAGIC.length) {
      return false;
    }
    for (int i = 0; i < XZ_MAGIC.length; i++) {
      if (payload[i] != XZ_MAGIC[i]) {
        return false;
      }
    }
    return true;
  }
}
