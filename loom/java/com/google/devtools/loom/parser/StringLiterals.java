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

package com.google.devtools.loom.parser;

import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;
import java.io.ByteArrayOutputStream;

/** Splits string literal tokens into their parts and decodes escape sequences. */
final class StringLiterals {
  private static final CharMatcher QUOTES = CharMatcher.anyOf("'\"");
  private static final CharMatcher OCTAL = CharMatcher.inRange('0', '7');
  private static final CharMatcher HEX =
      CharMatcher.inRange('0', '9')
          .or(CharMatcher.inRange('a', 'f'))
          .or(CharMatcher.inRange('A', 'F'));

  private StringLiterals() {}

  /** Returns the prefix letters of a string token, e.g. {@code rb} for {@code rb'\d'}. */
  static String prefix(String token) {
    return token.substring(0, QUOTES.indexIn(token));
  }

  /** Returns the opening quote of a string token: one or three quote characters. */
  static String quote(String token) {
    int start = QUOTES.indexIn(token);
    char q = token.charAt(start);
    if (token.length() - start >= 6
        && token.charAt(start + 1) == q
        && token.charAt(start + 2) == q) {
      return token.substring(start, start + 3);
    }
    return token.substring(start, start + 1);
  }

  /** Returns the text between the quotes of a string token. */
  static String body(String token) {
    int start = prefix(token).length() + quote(token).length();
    return token.substring(start, token.length() - quote(token).length());
  }

  static boolean isRaw(String prefix) {
    return Ascii.toLowerCase(prefix).contains("r");
  }

  static boolean isBytes(String prefix) {
    return Ascii.toLowerCase(prefix).contains("b");
  }

  static boolean isFormatted(String prefix) {
    return Ascii.toLowerCase(prefix).contains("f");
  }

  /**
   * Decodes the escape sequences of a string body.
   *
   * @throws IllegalArgumentException if an escape sequence is malformed.
   */
  static String decode(String body, boolean raw) {
    return decode(body, raw, true);
  }

  private static String decode(String body, boolean raw, boolean unicodeEscapes) {
    if (raw) {
      return body;
    }
    StringBuilder out = new StringBuilder(body.length());
    int i = 0;
    while (i < body.length()) {
      char c = body.charAt(i++);
      if (c != '\\' || i == body.length()) {
        out.append(c);
        continue;
      }
      char e = body.charAt(i++);
      switch (e) {
        case '\n':
          break;
        case '\r':
          if (i < body.length() && body.charAt(i) == '\n') {
            i++;
          }
          break;
        case 'a':
          out.append('\u0007');
          break;
        case 'b':
          out.append('\b');
          break;
        case 'f':
          out.append('\f');
          break;
        case 'n':
          out.append('\n');
          break;
        case 'r':
          out.append('\r');
          break;
        case 't':
          out.append('\t');
          break;
        case 'v':
          out.append('\u000b');
          break;
        case 'x':
          out.appendCodePoint(hex(body, i, 2));
          i += 2;
          break;
        default:
          if (unicodeEscapes && (e == 'u' || e == 'U')) {
            int digits = e == 'u' ? 4 : 8;
            out.appendCodePoint(hex(body, i, digits));
            i += digits;
          } else if (OCTAL.matches(e)) {
            int end = i - 1;
            while (end < body.length() && end < i + 2 && OCTAL.matches(body.charAt(end))) {
              end++;
            }
            out.appendCodePoint(Integer.parseInt(body.substring(i - 1, end), 8));
            i = end;
          } else {
            // Unrecognized escapes are kept as written.
            out.append('\\').append(e);
          }
      }
    }
    return out.toString();
  }

  /**
   * Decodes the body of a bytes literal. Only ASCII characters may appear unescaped.
   *
   * @throws IllegalArgumentException if the body holds a non-ASCII character or a malformed escape.
   */
  static byte[] decodeBytes(String body, boolean raw) {
    if (!CharMatcher.ascii().matchesAllOf(body)) {
      throw new IllegalArgumentException("bytes can only contain ASCII literal characters");
    }
    ByteArrayOutputStream out = new ByteArrayOutputStream(body.length());
    String decoded = decode(body, raw, false);
    for (int i = 0; i < decoded.length(); i++) {
      char c = decoded.charAt(i);
      if (c > 0xff) {
        throw new IllegalArgumentException("octal escape out of range in bytes literal");
      }
      out.write(c);
    }
    return out.toByteArray();
  }

  private static int hex(String body, int start, int digits) {
    if (start + digits > body.length()
        || !HEX.matchesAllOf(body.substring(start, start + digits))) {
      throw new IllegalArgumentException("truncated \\x, \\u or \\U escape");
    }
    return Integer.parseInt(body.substring(start, start + digits), 16);
  }
}
