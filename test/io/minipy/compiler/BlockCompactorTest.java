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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class BlockCompactorTest {

  private static void assertCompact(String expected, String code) {
    assertThat(BlockCompactor.compact(code)).isEqualTo(expected);
  }

  @Test
  public void testSingleLineBodyJoinsHeader() {
    assertCompact("if a:b=1", "if a:\n b=1;\n");
    assertCompact("x=1\nif a:b", "x=1\nif a:\n b");
  }

  @Test
  public void testMultiLineBodyStays() {
    assertCompact("if a:\n b=1\n c=2\nd=3", "if a:\n b=1\n c=2\nd=3");
  }

  @Test
  public void testNestedHeaders() {
    assertCompact("if a:\n if b:c\nd", "if a:\n if b:\n  c\nd");
    assertCompact("def f():\n if x:return 1\n return 2", "def f():\n if x:\n  return 1\n return 2");
  }

  @Test
  public void testLastHeaderAlwaysJoins() {
    assertCompact("else:pass", "else:\n pass");
  }

  @Test
  public void testTerminatorsAndWhitespaceAreTrimmed() {
    assertCompact("a\nb", "a\r\nb");
    assertCompact("x=1;y=2", ";x=1;y=2;");
    assertCompact("a", "a;  \n\n");
  }

  @Test
  public void testColonInsideLineIsNotHeader() {
    assertCompact("x={a:1}\ny=2", "x={a:1};\ny=2;");
  }
}
