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

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Renders Python literals: the shortest forms used by the compact printer and the {@code repr}
 * forms used for strings, bytes and the readable printer.
 */
public final class PyLiterals {

  /** Overflows to infinity when read back. */
  static final String INFINITY = "1e309";

  private static final CharMatcher TAB_OR_SPACE = CharMatcher.anyOf(" \t");

  private PyLiterals() {}

  /** Shortest decimal digits of a positive finite double and the position of the point. */
  private static final class Digits {
    final String digits;
    final int pointPos;

    Digits(double x) {
      BigDecimal exact = new BigDecimal(x);
      BigDecimal shortest = null;
      for (int p = 1; p <= 17 && shortest == null; p++) {
        BigDecimal rounded = exact.round(new MathContext(p, RoundingMode.HALF_EVEN));
        if (rounded.doubleValue() == x) {
          shortest = rounded;
        }
      }
      // 17 significant digits always round-trip.
      shortest = shortest.stripTrailingZeros();
      this.digits = shortest.unscaledValue().toString();
      this.pointPos = digits.length() - shortest.scale();
    }

    /** 1.5 as "1.5", 10.0 as "10.", 0.05 as ".05". */
    String positional() {
      int n = digits.length();
      if (pointPos <= 0) {
        return "." + Strings.repeat("0", -pointPos) + digits;
      } else if (pointPos >= n) {
        return digits + Strings.repeat("0", pointPos - n) + ".";
      }
      return digits.substring(0, pointPos) + "." + digits.substring(pointPos);
    }

    /** The shorter of "1.5e-5" and "15e-6". */
    String exponent() {
      int n = digits.length();
      String scientific =
          digits.charAt(0)
              + (n > 1 ? "." + digits.substring(1) : "")
              + "e"
              + (pointPos - 1);
      String integral = digits + "e" + (pointPos - n);
      return integral.length() < scientific.length() ? integral : scientific;
    }
  }

  /**
   * The shortest float literal for {@code x}: the positional or the exponent form of its shortest
   * round-trip digits, the positional one on a tie.
   */
  public static String formatFloat(double x) {
    checkArgument(!Double.isNaN(x), "NaN has no literal");
    if (Math.copySign(1.0, x) < 0) {
      return "-" + formatFloat(-x);
    } else if (Double.isInfinite(x)) {
      return INFINITY;
    } else if (x == 0) {
      return "0.";
    }
    Digits d = new Digits(x);
    String positional = d.positional();
    String exponent = d.exponent();
    return exponent.length() < positional.length() ? exponent : positional;
  }

  /** The shortest imaginary literal, such as "1j" or ".5j". */
  public static String formatImaginary(double x) {
    String text = formatFloat(x);
    if (text.endsWith(".")) {
      text = text.substring(0, text.length() - 1);
    }
    return text + "j";
  }

  /** The literal Python's {@code repr(float)} produces, with infinity as an overflowing literal. */
  public static String reprFloat(double x) {
    checkArgument(!Double.isNaN(x), "NaN has no literal");
    if (Math.copySign(1.0, x) < 0) {
      return "-" + reprFloat(-x);
    } else if (Double.isInfinite(x)) {
      return INFINITY;
    } else if (x == 0) {
      return "0.0";
    }
    Digits d = new Digits(x);
    int exp = d.pointPos - 1;
    if (exp < -4 || exp >= 16) {
      String mantissa =
          d.digits.length() > 1 ? d.digits.charAt(0) + "." + d.digits.substring(1) : d.digits;
      String digits = Strings.padStart(Integer.toString(Math.abs(exp)), 2, '0');
      return mantissa + "e" + (exp < 0 ? "-" : "+") + digits;
    }
    String positional = d.positional();
    if (positional.startsWith(".")) {
      positional = "0" + positional;
    }
    return positional.endsWith(".") ? positional + "0" : positional;
  }

  /** The literal Python's {@code repr(complex)} produces for a pure imaginary number. */
  public static String reprImaginary(double x) {
    String text = reprFloat(x);
    if (text.endsWith(".0")) {
      text = text.substring(0, text.length() - 2);
    }
    return text + "j";
  }

  /**
   * Returns k when {@code value} is exactly {@code base**k} for a positive k, and -1 otherwise.
   * Only bases 2 and 10 are supported.
   */
  public static int exactPower(BigInteger value, int base) {
    checkArgument(base == 2 || base == 10, base);
    if (value.signum() <= 0 || value.equals(BigInteger.ONE)) {
      return -1;
    }
    if (base == 2) {
      return value.bitCount() == 1 ? value.bitLength() - 1 : -1;
    }
    String text = value.toString();
    return CharMatcher.is('0').matchesAllOf(text.substring(1)) && text.charAt(0) == '1'
        ? text.length() - 1
        : -1;
  }

  /** Python's {@code repr(str)}. */
  public static String repr(String s) {
    char quote = s.indexOf('\'') >= 0 && s.indexOf('"') < 0 ? '"' : '\'';
    StringBuilder sb = new StringBuilder(s.length() + 2).append(quote);
    appendEscaped(sb, s, quote);
    return sb.append(quote).toString();
  }

  /**
   * Escapes {@code s} the way {@code repr} does between its quotes. The quote character is
   * escaped when it is not 0.
   */
  static String escape(String s, char quote) {
    StringBuilder sb = new StringBuilder(s.length());
    appendEscaped(sb, s, quote);
    return sb.toString();
  }

  private static void appendEscaped(StringBuilder sb, String s, char quote) {
    for (int i = 0; i < s.length(); ) {
      int c = s.codePointAt(i);
      i += Character.charCount(c);
      if (c == '\\') {
        sb.append("\\\\");
      } else if (quote != 0 && c == quote) {
        sb.append('\\').append(quote);
      } else if (c == '\t') {
        sb.append("\\t");
      } else if (c == '\n') {
        sb.append("\\n");
      } else if (c == '\r') {
        sb.append("\\r");
      } else if (c < ' ' || c == 0x7f) {
        sb.append(String.format("\\x%02x", c));
      } else if (c < 0x7f || isPrintable(c)) {
        sb.appendCodePoint(c);
      } else if (c <= 0xff) {
        sb.append(String.format("\\x%02x", c));
      } else if (c <= 0xffff) {
        sb.append(String.format("\\u%04x", c));
      } else {
        sb.append(String.format("\\U%08x", c));
      }
    }
  }

  /** Python's {@code str.isprintable} for one code point. */
  private static boolean isPrintable(int c) {
    switch (Character.getType(c)) {
      case Character.CONTROL:
      case Character.FORMAT:
      case Character.SURROGATE:
      case Character.PRIVATE_USE:
      case Character.UNASSIGNED:
      case Character.LINE_SEPARATOR:
      case Character.PARAGRAPH_SEPARATOR:
        return false;
      case Character.SPACE_SEPARATOR:
        return c == ' ';
      default:
        return true;
    }
  }

  /** Python's {@code repr(bytes)}. */
  public static String reprBytes(byte[] bytes) {
    boolean hasSingle = false;
    boolean hasDouble = false;
    for (byte b : bytes) {
      hasSingle |= b == '\'';
      hasDouble |= b == '"';
    }
    char quote = hasSingle && !hasDouble ? '"' : '\'';
    StringBuilder sb = new StringBuilder(bytes.length + 3).append('b').append(quote);
    for (byte b : bytes) {
      int c = b & 0xff;
      if (c == '\\' || c == quote) {
        sb.append('\\').append((char) c);
      } else if (c == '\t') {
        sb.append("\\t");
      } else if (c == '\n') {
        sb.append("\\n");
      } else if (c == '\r') {
        sb.append("\\r");
      } else if (c < ' ' || c >= 0x7f) {
        sb.append(String.format("\\x%02x", c));
      } else {
        sb.append((char) c);
      }
    }
    return sb.append(quote).toString();
  }

  /**
   * Decodes a bytes literal such as {@code b'\x00a'}.
   *
   * @throws IllegalArgumentException if {@code literal} is not a plain bytes literal
   */
  public static byte[] parseBytesLiteral(String literal) {
    checkArgument(
        literal.length() >= 3 && (literal.charAt(0) == 'b' || literal.charAt(0) == 'B'),
        "not a bytes literal: %s",
        literal);
    char quote = literal.charAt(1);
    checkArgument(
        (quote == '\'' || quote == '"') && literal.charAt(literal.length() - 1) == quote,
        "unterminated bytes literal");
    ByteArrayOutputStream out = new ByteArrayOutputStream(literal.length());
    int end = literal.length() - 1;
    for (int i = 2; i < end; i++) {
      char c = literal.charAt(i);
      checkArgument(c < 0x80, "non-ASCII character in bytes literal");
      if (c == quote) {
        throw new IllegalArgumentException("unescaped quote in bytes literal");
      } else if (c != '\\') {
        out.write(c);
        continue;
      }
      checkArgument(++i < end, "dangling backslash");
      c = literal.charAt(i);
      switch (c) {
        case '\n':
          break;
        case 'a':
          out.write(0x07);
          break;
        case 'b':
          out.write('\b');
          break;
        case 'f':
          out.write('\f');
          break;
        case 'n':
          out.write('\n');
          break;
        case 'r':
          out.write('\r');
          break;
        case 't':
          out.write('\t');
          break;
        case 'v':
          out.write(0x0b);
          break;
        case 'x':
          checkArgument(i + 2 < end, "truncated \\x escape");
          out.write(Integer.parseInt(literal.substring(i + 1, i + 3), 16));
          i += 2;
          break;
        default:
          if (c >= '0' && c <= '7') {
            int value = 0;
            int digits = 0;
            while (digits < 3 && i < end && literal.charAt(i) >= '0' && literal.charAt(i) <= '7') {
              value = value * 8 + (literal.charAt(i) - '0');
              i++;
              digits++;
            }
            i--;
            out.write(value & 0xff);
          } else if (c == '\\' || c == '\'' || c == '"') {
            out.write(c);
          } else {
            out.write('\\');
            out.write(c);
          }
      }
    }
    return out.toByteArray();
  }

  /**
   * Python's {@code textwrap.dedent}: blanks whitespace-only lines and removes the longest
   * leading run of spaces and tabs common to the other lines.
   */
  public static String dedent(String text) {
    List<String> lines = new ArrayList<>();
    for (String line : Splitter.on('\n').split(text)) {
      lines.add(!line.isEmpty() && TAB_OR_SPACE.matchesAllOf(line) ? "" : line);
    }
    String margin = null;
    for (String line : lines) {
      if (line.isEmpty()) {
        continue;
      }
      String indent = line.substring(0, TAB_OR_SPACE.negate().indexIn(line));
      margin = commonPrefix(margin, indent);
    }
    if (!Strings.isNullOrEmpty(margin)) {
      for (int i = 0; i < lines.size(); i++) {
        if (lines.get(i).startsWith(margin)) {
          lines.set(i, lines.get(i).substring(margin.length()));
        }
      }
    }
    return Joiner.on('\n').join(lines);
  }

  private static String commonPrefix(@Nullable String margin, String indent) {
    return margin == null ? indent : Strings.commonPrefix(margin, indent);
  }
}
