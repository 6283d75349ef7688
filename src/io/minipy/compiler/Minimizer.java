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

import static com.google.common.base.Preconditions.checkState;

import io.minipy.ast.Node;
import io.minipy.compiler.parsing.AstReadException;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Entry points for minimizing a Python program and for turning a minimized program back into
 * readable code.
 *
 * <pre>{@code
 * Minimizer minimizer = new Minimizer(options);
 * String shortest = minimizer.minimize(tree, rawSource);
 * }</pre>
 */
public class Minimizer {

  private static final Logger logger = Logger.getLogger(Minimizer.class.getName());

  private final MinimizerOptions options;
  private final @Nullable SourceParser parser;

  public Minimizer() {
    this(new MinimizerOptions(), null);
  }

  public Minimizer(MinimizerOptions options) {
    this(options, null);
  }

  /**
   * @param parser turns source text into trees, required by the text entry points
   */
  public Minimizer(MinimizerOptions options, @Nullable SourceParser parser) {
    this.options = options;
    this.parser = parser;
  }

  /** Returns the shortest rendering of {@code tree}. */
  public String minimize(Node tree) {
    return minimize(tree, null);
  }

  /**
   * Returns the shortest of {@code rawSource}, the compacted rendering of {@code tree} and,
   * when enabled, its compressed stubs.
   */
  public String minimize(Node tree, @Nullable String rawSource) {
    String minimized = BlockCompactor.compact(toCompactSource(tree));
    return new OutputSelector(options).select(rawSource, minimized);
  }

  /** Parses {@code source} and minimizes it, keeping the source itself as a candidate. */
  public String minimize(String source) throws AstReadException {
    return minimize(requireParser().parse(source), source);
  }

  /** Renders {@code tree} readably, unpacking it first if it is a compressed stub. */
  public String restore(Node tree) {
    String decoded = StubDecoder.tryDecode(BlockCompactor.compact(toCompactSource(tree)));
    if (decoded == null) {
      return prettyPrint(tree);
    }
    if (parser == null) {
      return decoded;
    }
    try {
      return prettyPrint(parser.parse(decoded));
    } catch (AstReadException e) {
      logger.log(Level.WARNING, "Cannot parse decompressed payload", e);
      return decoded;
    }
  }

  /**
   * Renders {@code source} readably, unpacking it first if it is a compressed stub. Text that
   * cannot be parsed is returned unchanged.
   */
  public String restore(String source) {
    SourceParser sourceParser = requireParser();
    String decoded = StubDecoder.tryDecode(source);
    if (decoded != null) {
      try {
        return prettyPrint(sourceParser.parse(decoded));
      } catch (AstReadException e) {
        logger.log(Level.WARNING, "Cannot parse decompressed payload", e);
      }
    }
    try {
      return prettyPrint(sourceParser.parse(source));
    } catch (AstReadException e) {
      logger.log(Level.WARNING, "Cannot parse input, keeping it as is", e);
      return source;
    }
  }

  /** Renders {@code tree} readably, one statement per line, with a final newline. */
  public String prettyPrint(Node tree) {
    return toPrettySource(tree) + "\n";
  }

  /** Renders {@code tree} readably with an explicit terminator after every simple statement. */
  public String addSemicolons(Node tree) {
    return new CodePrinter.Builder(tree)
        .setPrettyPrint(true)
        .setStatementHooks(StatementHooks.defaults())
        .build();
  }

  private String toCompactSource(Node tree) {
    return new CodePrinter.Builder(tree).setOptions(options).setPrettyPrint(false).build();
  }

  private static String toPrettySource(Node tree) {
    return new CodePrinter.Builder(tree).setPrettyPrint(true).build().strip();
  }

  private SourceParser requireParser() {
    checkState(parser != null, "No SourceParser configured");
    return parser;
  }
}
