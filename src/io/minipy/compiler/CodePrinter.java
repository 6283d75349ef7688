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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import io.minipy.ast.Node;
import org.jspecify.annotations.Nullable;

/**
 * CodePrinter prints out Python code in either a compact or a readable format.
 *
 * <p>The compact format is the line buffer the {@link BlockCompactor} post-processes: one space
 * of indentation per level, and simple statements sharing a line whenever the nesting depth
 * allows it.
 *
 * @see CodeGenerator
 */
public final class CodePrinter {

  private CodePrinter() {}

  private abstract static class BufferedCodePrinter extends CodeConsumer {
    protected final StringBuilder code = new StringBuilder(1024);

    @Override
    char getLastChar() {
      return code.length() > 0 ? code.charAt(code.length() - 1) : '\0';
    }

    @Override
    int getLength() {
      return code.length();
    }

    @Override
    void append(String str) {
      code.append(str);
    }

    @Override
    String getCode() {
      return code.toString();
    }
  }

  static class PrettyCodePrinter extends BufferedCodePrinter {
    static final String INDENT = "    ";

    private int indent = 0;

    @Override
    void startStatement(String keyword) {
      if (code.length() > 0) {
        code.append('\n');
      }
      code.append(Strings.repeat(INDENT, indent));
      add(keyword);
    }

    @Override
    CodeConsumer createNested() {
      return new PrettyCodePrinter();
    }

    @Override
    void beginBlock() {
      append(":");
      indent++;
    }

    @Override
    void endBlock() {
      indent--;
    }

    @Override
    void listSeparator() {
      add(",");
      append(" ");
    }

    @Override
    void maybeInsertSpace() {
      append(" ");
    }

    @Override
    void appendOp(String op, boolean binOp) {
      if (binOp && getLastChar() != ' ') {
        append(" ");
      }
      append(op);
      if (binOp) {
        append(" ");
      }
    }
  }

  static class CompactCodePrinter extends BufferedCodePrinter {
    // Statements opening or continuing a block always start a line of their own.
    static final ImmutableSet<String> BLOCK_KEYWORDS =
        ImmutableSet.of(
            "try", "else", "finally", "except", "except*", "class", "def", "@", "if", "elif",
            "while", "with", "match", "for", "async");

    private int indent = 0;
    // Depth the current line was started at.
    private int lineIndent = 0;
    private boolean blockStarted = false;

    @Override
    void startStatement(String keyword) {
      if (BLOCK_KEYWORDS.contains(keyword) || indent != lineIndent || blockStarted) {
        if (code.length() > 0) {
          code.append('\n');
        }
        lineIndent = indent;
        blockStarted = false;
        code.append(Strings.repeat(" ", indent));
      }
      add(keyword);
    }

    @Override
    CodeConsumer createNested() {
      return new CompactCodePrinter();
    }

    @Override
    void beginBlock() {
      append(":");
      indent++;
      blockStarted = true;
    }

    @Override
    void endBlock() {
      indent--;
    }
  }

  /** Builds a printer for one tree. */
  public static final class Builder {
    private final Node root;
    private MinimizerOptions options = new MinimizerOptions();
    private boolean prettyPrint;
    private @Nullable StatementHooks statementHooks;

    /**
     * Sets the root node from which to generate the source code.
     *
     * @param node The root node.
     */
    public Builder(Node node) {
      root = checkNotNull(node);
    }

    /** Sets the output options. */
    @CanIgnoreReturnValue
    public Builder setOptions(MinimizerOptions options) {
      this.options = options;
      this.prettyPrint = options.isPrettyPrint();
      return this;
    }

    /**
     * Sets whether pretty printing should be used.
     *
     * @param prettyPrint If true, the readable format is used.
     */
    @CanIgnoreReturnValue
    public Builder setPrettyPrint(boolean prettyPrint) {
      this.prettyPrint = prettyPrint;
      return this;
    }

    /**
     * Overrides the statement hooks. By default the compact format terminates the kinds the
     * options select and the readable format terminates none.
     */
    @CanIgnoreReturnValue
    public Builder setStatementHooks(StatementHooks statementHooks) {
      this.statementHooks = statementHooks;
      return this;
    }

    /** Generates the source code and returns it. */
    public String build() {
      Format format = Format.fromOptions(prettyPrint);
      StatementHooks hooks = statementHooks;
      if (hooks == null) {
        hooks =
            format == Format.COMPACT
                ? StatementHooks.withToggled(options.getToggledTerminators())
                : StatementHooks.none();
      }
      return toSource(root, format, hooks);
    }
  }

  /** Specifies a format for code generation. */
  public enum Format {
    COMPACT,
    PRETTY;

    static Format fromOptions(boolean prettyPrint) {
      return prettyPrint ? PRETTY : COMPACT;
    }
  }

  /** Converts a tree to Python code. */
  private static String toSource(Node root, Format outputFormat, StatementHooks hooks) {
    BufferedCodePrinter printer =
        outputFormat == Format.COMPACT ? new CompactCodePrinter() : new PrettyCodePrinter();
    CodeGenerator cg = new CodeGenerator(printer, hooks, outputFormat == Format.COMPACT);
    cg.add(root);
    return printer.getCode();
  }
}
