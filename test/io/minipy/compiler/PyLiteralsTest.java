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
import static org.junit.Assert.assertThrows;

import java.math.BigInteger;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class PyLiteralsTest {

  @Test
  public void testFormatFloat() {
    assertThat(PyLiterals.formatFloat(0.5)).isEqualTo(".5");
    assertThat(PyLiterals.formatFloat(10.0)).isEqualTo("10.");
    assertThat(PyLiterals.formatFloat(100.0)).isEqualTo("1e2");
    assertThat(PyLiterals.formatFloat(1e-4)).isEqualTo("1e-4");
    assertThat(PyLiterals.formatFloat(1e16)).isEqualTo("1e16");
    assertThat(PyLiterals.formatFloat(1.5e-5)).isEqualTo("15e-6");
    assertThat(PyLiterals.formatFloat(0.0)).isEqualTo("0.");
    assertThat(PyLiterals.formatFloat(-0.5)).isEqualTo("-.5");
  }

  @Test
  public void testFormatFloatInfinity() {
    assertThat(PyLiterals.formatFloat(Double.POSITIVE_INFINITY)).isEqualTo("1e309");
    assertThrows(IllegalArgumentException.class, () -> PyLiterals.formatFloat(Double.NaN));
  }

  @Test
  public void testFormatImaginary() {
    assertThat(PyLiterals.formatImaginary(2.0)).isEqualTo("2j");
    assertThat(PyLiterals.formatImaginary(0.5)).isEqualTo(".5j");
  }

  @Test
  public void testReprFloat() {
    assertThat(PyLiterals.reprFloat(10.0)).isEqualTo("10.0");
    assertThat(PyLiterals.reprFloat(0.5)).isEqualTo("0.5");
    assertThat(PyLiterals.reprFloat(1e16)).isEqualTo("1e+16");
    assertThat(PyLiterals.reprFloat(1e15)).isEqualTo("1000000000000000.0");
    assertThat(PyLiterals.reprFloat(1.5e-5)).isEqualTo("1.5e-05");
    assertThat(PyLiterals.reprFloat(0.0)).isEqualTo("0.0");
    assertThat(PyLiterals.reprImaginary(2.0)).isEqualTo("2j");
  }

  @Test
  public void testExactPower() {
    assertThat(PyLiterals.exactPower(BigInteger.valueOf(100000), 10)).isEqualTo(5);
    assertThat(PyLiterals.exactPower(BigInteger.valueOf(131072), 2)).isEqualTo(17);
    assertThat(PyLiterals.exactPower(BigInteger.valueOf(131072), 10)).isEqualTo(-1);
    assertThat(PyLiterals.exactPower(BigInteger.ONE, 10)).isEqualTo(-1);
    assertThat(PyLiterals.exactPower(BigInteger.ONE, 2)).isEqualTo(-1);
    assertThat(PyLiterals.exactPower(BigInteger.ZERO, 2)).isEqualTo(-1);
    assertThat(PyLiterals.exactPower(BigInteger.valueOf(1001), 10)).isEqualTo(-1);
  }

  @Test
  public void testRepr() {
    assertThat(PyLiterals.repr("abc")).isEqualTo("'abc'");
    assertThat(PyLiterals.repr("it's")).isEqualTo("\"it's\"");
    assertThat(PyLiterals.repr("'\"")).isEqualTo("'\\'\"'");
    assertThat(PyLiterals.repr("a\tb")).isEqualTo("'a\\tb'");
    assertThat(PyLiterals.repr("\u0000")).isEqualTo("'\\x00'");
    assertThat(PyLiterals.repr("\u2028")).isEqualTo("'\\u2028'");
    assertThat(PyLiterals.repr("caf\u00e9")).isEqualTo("'caf\u00e9'");
  }

  @Test
  public void testReprBytes() {
    assertThat(PyLiterals.reprBytes(new byte[] {0, 'a', '\''})).isEqualTo("b\"\\x00a'\"");
    assertThat(PyLiterals.reprBytes(new byte[] {(byte) 0xff, '\\'})).isEqualTo("b'\\xff\\\\'");
  }

  @Test
  public void testParseBytesLiteral() {
    assertThat(PyLiterals.parseBytesLiteral("b'\\x00a\\''"))
        .isEqualTo(new byte[] {0, 'a', '\''});
    assertThat(PyLiterals.parseBytesLiteral("b\"\\n\\101\"")).isEqualTo(new byte[] {'\n', 'A'});
    assertThrows(IllegalArgumentException.class, () -> PyLiterals.parseBytesLiteral("'a'"));
    assertThrows(IllegalArgumentException.class, () -> PyLiterals.parseBytesLiteral("b'a"));
  }

  @Test
  public void testDedent() {
    assertThat(PyLiterals.dedent("  a\n    b")).isEqualTo("a\n  b");
    assertThat(PyLiterals.dedent("\n    Doc.\n    ")).isEqualTo("\nDoc.\n");
    assertThat(PyLiterals.dedent("a\n  b")).isEqualTo("a\n  b");
  }
}
