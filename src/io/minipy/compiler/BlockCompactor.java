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

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.List;

/**
 * Joins a block header with its body when the body is a single line.
 *
 * <p>Works on the line buffer of the compact printer, where each nesting level is one space. A
 * header line ending in {@code :} absorbs the next line when that line is indented deeper and the
 * line after it is not deeper than the header.
 */
final class BlockCompactor {

  private static final CharMatcher TRAILING = CharMatcher.anyOf(" \t\n\r\013\014;");
  private static final CharMatcher OUTER = CharMatcher.whitespace().or(CharMatcher.is(';'));

  private BlockCompactor() {}

  static String compact(String code) {
    List<String> lines = new ArrayList<>();
    for (String line : Splitter.on('\n').split(code)) {
      lines.add(TRAILING.trimTrailingFrom(line));
    }

    List<Integer> deleted = new ArrayList<>();
    for (int i = 0; i < lines.size(); i++) {
      String line = lines.get(i);
      if (!line.endsWith(":")) {
        continue;
      }
      if (i != lines.size() - 2) {
        int indent = indentation(lines, i);
        if (indent >= indentation(lines, i + 1) || indent < indentation(lines, i + 2)) {
          continue;
        }
      }
      if (i + 1 < lines.size()) {
        lines.set(i, line + CharMatcher.whitespace().trimFrom(lines.get(i + 1)));
        deleted.add(i + 1);
      }
    }

    int offset = 0;
    for (int index : deleted) {
      lines.remove(index - offset);
      offset++;
    }
    return OUTER.trimFrom(Joiner.on('\n').join(lines));
  }

  /** Leading spaces of line {@code i}; a missing line counts as 0. */
  private static int indentation(List<String> lines, int i) {
    if (i >= lines.size()) {
      return 0;
    }
    String line = lines.get(i);
    return line.length() - CharMatcher.whitespace().trimLeadingFrom(line).length();
  }
}
