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

import com.google.common.io.ByteStreams;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import org.apache.commons.compress.compressors.CompressorException;
import org.apache.commons.compress.compressors.CompressorStreamFactory;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorOutputStream;
import org.apache.commons.compress.compressors.deflate.DeflateCompressorOutputStream;
import org.apache.commons.compress.compressors.deflate.DeflateParameters;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipParameters;
import org.apache.commons.compress.compressors.lzma.LZMACompressorOutputStream;
import org.apache.commons.compress.compressors.xz.XZCompressorOutputStream;

/**
 * A compression algorithm whose decompressor ships with Python, together with the module that
 * decompresses it. Each codec produces exactly the container that module's {@code decompress}
 * accepts with default arguments.
 */
public enum Codec {
  /** xz container, preset 6. */
  LZMA("lzma", CompressorStreamFactory.XZ) {
    @Override
    OutputStream compressing(OutputStream out) throws IOException {
      return new XZCompressorOutputStream(out, 6);
    }
  },

  /** Deflate with the zlib header, level 6. */
  ZLIB("zlib", CompressorStreamFactory.DEFLATE) {
    @Override
    OutputStream compressing(OutputStream out) {
      DeflateParameters parameters = new DeflateParameters();
      parameters.setWithZlibHeader(true);
      parameters.setCompressionLevel(6);
      return new DeflateCompressorOutputStream(out, parameters);
    }
  },

  /** gzip, level 9, with a zero timestamp so output is reproducible. */
  GZIP("gzip", CompressorStreamFactory.GZIP) {
    @Override
    OutputStream compressing(OutputStream out) throws IOException {
      GzipParameters parameters = new GzipParameters();
      parameters.setCompressionLevel(9);
      parameters.setModificationTime(0);
      return new GzipCompressorOutputStream(out, parameters);
    }
  },

  /** bzip2 with 900k blocks. */
  BZ2("bz2", CompressorStreamFactory.BZIP2) {
    @Override
    OutputStream compressing(OutputStream out) throws IOException {
      return new BZip2CompressorOutputStream(out, BZip2CompressorOutputStream.MAX_BLOCKSIZE);
    }
  },

  /** Legacy .lzma container; decompressed by the same module as {@link #LZMA}. */
  LZMA_ALONE("lzma", CompressorStreamFactory.LZMA) {
    @Override
    OutputStream compressing(OutputStream out) throws IOException {
      return new LZMACompressorOutputStream(out);
    }
  };

  private final String moduleName;
  private final String streamName;

  Codec(String moduleName, String streamName) {
    this.moduleName = moduleName;
    this.streamName = streamName;
  }

  /** The Python module whose {@code decompress} reverses this codec. */
  public String getModuleName() {
    return moduleName;
  }

  abstract OutputStream compressing(OutputStream out) throws IOException;

  public byte[] compress(byte[] data) throws IOException {
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    try (OutputStream out = compressing(buffer)) {
      out.write(data);
    }
    return buffer.toByteArray();
  }

  public byte[] decompress(byte[] data) throws IOException {
    try (InputStream in =
        new CompressorStreamFactory()
            .createCompressorInputStream(streamName, new ByteArrayInputStream(data))) {
      return ByteStreams.toByteArray(in);
    } catch (CompressorException e) {
      throw new IOException("Cannot decompress " + this, e);
    }
  }

  /** The self-extracting program {@code exec(__import__('<module>').decompress(b'...'))}. */
  public String stub(byte[] payload) {
    return "exec(__import__('"
        + moduleName
        + "').decompress("
        + PyLiterals.reprBytes(payload)
        + "))";
  }
}
