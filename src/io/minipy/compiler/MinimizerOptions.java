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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import io.minipy.ast.Token;
import java.io.Serializable;
import java.util.List;
import java.util.Set;

/** Output options for the minimizer. */
public class MinimizerOptions implements Serializable {

  private static final long serialVersionUID = 1L;

  /** Whether compressed stubs compete with the plain text. */
  private boolean compress = true;

  /** Emit the stub of {@link #forcedCodec} no matter how long it is. */
  private boolean forceCompress = false;

  /** Render the readable format instead of the compact one. */
  private boolean prettyPrint = false;

  /**
   * Statement kinds whose terminator membership is flipped relative to {@link
   * StatementHooks#DEFAULT_TERMINATED}. Imports are coalesced in the compact format, which writes
   * their terminator itself.
   */
  private ImmutableSet<Token> toggledTerminators = Sets.immutableEnumSet(Token.IMPORT);

  /** Codecs tried, in order. Ties go to the earlier codec. */
  private ImmutableList<Codec> codecs = ImmutableList.copyOf(Codec.values());

  private Codec forcedCodec = Codec.LZMA_ALONE;

  public MinimizerOptions() {}

  public boolean isCompress() {
    return compress;
  }

  public void setCompress(boolean compress) {
    this.compress = compress;
  }

  public boolean isForceCompress() {
    return forceCompress;
  }

  public void setForceCompress(boolean forceCompress) {
    this.forceCompress = forceCompress;
  }

  public boolean isPrettyPrint() {
    return prettyPrint;
  }

  public void setPrettyPrint(boolean prettyPrint) {
    this.prettyPrint = prettyPrint;
  }

  public ImmutableSet<Token> getToggledTerminators() {
    return toggledTerminators;
  }

  public void setToggledTerminators(Set<Token> toggledTerminators) {
    this.toggledTerminators = Sets.immutableEnumSet(toggledTerminators);
  }

  public ImmutableList<Codec> getCodecs() {
    return codecs;
  }

  public void setCodecs(List<Codec> codecs) {
    this.codecs = ImmutableList.copyOf(codecs);
  }

  public Codec getForcedCodec() {
    return forcedCodec;
  }

  public void setForcedCodec(Codec forcedCodec) {
    checkArgument(forcedCodec != null, "forced codec");
    this.forcedCodec = forcedCodec;
  }
}
