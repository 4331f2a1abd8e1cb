/*
 * Copyright 2024 The Loom Authors. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.devtools.loom.codegen;

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;
import java.math.BigDecimal;
import java.util.Locale;

/** Canonical source spellings of literal values. */
final class Literals {
  private static final CharMatcher QUOTES = CharMatcher.anyOf("'\"");
  private static final CharMatcher RAW_MARKERS = CharMatcher.anyOf("rR");

  private Literals() {}

  /** Returns the canonical literal for a number. */
  static String reprNumber(Number n) {
    if (n instanceof Double || n instanceof Float) {
      return reprFloat(n.doubleValue());
    }
    return n.toString();
  }

  /**
   * Returns the shortest literal that reads back as {@code d}, using exponent notation for very
   * large and very small magnitudes. Infinity is written as an overflowing literal.
   */
  static String reprFloat(double d) {
    if (Double.isNaN(d)) {
      throw new IllegalArgumentException("NaN has no literal form");
    }
    String sign = d < 0 || (d == 0 && 1 / d < 0) ? "-" : "";
    if (Double.isInfinite(d)) {
      return sign + "1e309";
    }
    if (d == 0) {
      return sign + "0.0";
    }
    BigDecimal value = new BigDecimal(Double.toString(Math.abs(d))).stripTrailingZeros();
    String digits = value.unscaledValue().toString();
    int exponent = digits.length() - 1 - value.scale();
    if (exponent < -4 || exponent >= 16) {
      String mantissa =
          digits.length() == 1 ? digits : digits.charAt(0) + "." + digits.substring(1);
      return String.format(
          Locale.ROOT, "%s%se%s%02d", sign, mantissa, exponent < 0 ? "-" : "+", Math.abs(exponent));
    }
    if (exponent < 0) {
      return sign + "0." + Strings.repeat("0", -exponent - 1) + digits;
    }
    if (exponent >= digits.length() - 1) {
      return sign + digits + Strings.repeat("0", exponent - digits.length() + 1) + ".0";
    }
    return sign + digits.substring(0, exponent + 1) + "." + digits.substring(exponent + 1);
  }

  /** Returns the canonical literal for a string: single-quoted unless that needs more escapes. */
  static String reprString(String s) {
    char quote = preferredQuote(s);
    return quote + escape(s, quote, true) + quote;
  }

  /** Returns the canonical literal for a byte string. */
  static String reprBytes(byte[] bytes) {
    boolean hasSingle = false;
    boolean hasDouble = false;
    for (byte b : bytes) {
      hasSingle |= b == '\'';
      hasDouble |= b == '"';
    }
    char quote = hasSingle && !hasDouble ? '"' : '\'';
    StringBuilder out = new StringBuilder(bytes.length + 3).append('b').append(quote);
    for (byte b : bytes) {
      int c = b & 0xff;
      if (c == '\\' || c == quote) {
        out.append('\\').append((char) c);
      } else if (c == '\t') {
        out.append("\\t");
      } else if (c == '\n') {
        out.append("\\n");
      } else if (c == '\r') {
        out.append("\\r");
      } else if (c < 0x20 || c >= 0x7f) {
        out.append(String.format("\\x%02x", c));
      } else {
        out.append((char) c);
      }
    }
    return out.append(quote).toString();
  }

  /**
   * Writes {@code s} in the literal style {@code style}: string prefix letters followed by the
   * opening quote, e.g. {@code r'} or {@code """}. A raw style is only kept if {@code s} can be
   * written raw in it.
   */
  static String formatString(String s, String style) {
    int quoteStart = QUOTES.indexIn(style);
    if (quoteStart < 0) {
      return reprString(s);
    }
    String prefix = style.substring(0, quoteStart);
    String quote = style.substring(quoteStart);
    boolean triple = quote.length() == 3;
    if (RAW_MARKERS.matchesAnyOf(prefix)) {
      if (isRawRepresentable(s, quote)) {
        return prefix + quote + s + quote;
      }
      prefix = RAW_MARKERS.removeFrom(prefix);
    }
    return prefix + quote + escape(s, quote.charAt(0), !triple) + quote;
  }

  /** Escapes the literal text of an f-string, doubling braces. */
  static String escapeFStringText(String s, char quote) {
    return escape(s, quote, true).replace("{", "{{").replace("}", "}}");
  }

  static char preferredQuote(String s) {
    return s.indexOf('\'') >= 0 && s.indexOf('"') < 0 ? '"' : '\'';
  }

  private static boolean isRawRepresentable(String s, String quote) {
    boolean triple = quote.length() == 3;
    if (s.contains(quote) || s.endsWith("\\")) {
      return false;
    }
    if (triple) {
      return !s.endsWith(quote.substring(0, 1));
    }
    return s.indexOf('\n') < 0 && s.indexOf('\r') < 0;
  }

  private static String escape(String s, char quote, boolean escapeNewlines) {
    StringBuilder out = new StringBuilder(s.length());
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c == '\\' || c == quote) {
        out.append('\\').append(c);
      } else if (c == '\n') {
        out.append(escapeNewlines ? "\\n" : "\n");
      } else if (c == '\r') {
        out.append("\\r");
      } else if (c == '\t') {
        out.append("\\t");
      } else if (c < 0x20 || (c >= 0x7f && c < 0xa0)) {
        out.append(String.format("\\x%02x", (int) c));
      } else {
        out.append(c);
      }
    }
    return out.toString();
  }
}
