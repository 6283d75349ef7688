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

/**
 * Abstracted consumer of the CodeGenerator output.
 *
 * @see CodeGenerator
 * @see CodePrinter
 */
abstract class CodeConsumer {

  /** Length of the code right after the last number literal, so a word never touches it. */
  private int numberEnd = -1;

  /** Retrieve the last character of the code, or 0 when there is none. */
  abstract char getLastChar();

  abstract int getLength();

  /**
   * Appends a string to the code.
   *
   * <p>Do not directly append newlines with this method. Instead use {@link #startStatement}.
   */
  abstract void append(String str);

  abstract String getCode();

  /**
   * Starts a logical statement that begins with {@code keyword}, or with an expression when the
   * keyword is empty. The consumer decides whether the statement gets its own line.
   */
  abstract void startStatement(String keyword);

  /** A fresh consumer of the same format for code embedded in a literal. */
  abstract CodeConsumer createNested();

  void endStatement() {
    append(";");
  }

  void beginBlock() {
    append(":");
  }

  void endBlock() {}

  void listSeparator() {
    add(",");
  }

  /** Adds a space where the format wants one for readability only. */
  void maybeInsertSpace() {}

  void appendOp(String op, boolean binOp) {
    append(op);
  }

  void add(String newcode) {
    if (newcode.isEmpty()) {
      return;
    }

    if (needsSpaceBefore(newcode.charAt(0))) {
      // need space to separate. This is not pretty printing.
      // For example: "return x", "1 if y else 2"
      append(" ");
    }

    append(newcode);
  }

  void addOp(String op, boolean binOp) {
    if (needsSpaceBefore(op.charAt(0))) {
      // Keyword operators such as "in", "is not", "if".
      append(" ");
    }
    appendOp(op, binOp);
  }

  void addNumber(String number) {
    add(number);
    numberEnd = getLength();
  }

  private boolean needsSpaceBefore(char first) {
    return isWordChar(first) && (isWordChar(getLastChar()) || getLength() == numberEnd);
  }

  static boolean isWordChar(char ch) {
    return ch == '_' || Character.isLetterOrDigit(ch) || Character.isSurrogate(ch);
  }
}
