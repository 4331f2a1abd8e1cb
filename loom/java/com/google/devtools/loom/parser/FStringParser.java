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

import com.google.devtools.loom.ast.FormattedValueNode;
import com.google.devtools.loom.ast.JoinedStrNode;
import com.google.devtools.loom.ast.Node;
import com.google.devtools.loom.ast.StrNode;
import com.google.devtools.loom.formatting.FStringPlaceholders;
import com.google.devtools.loom.formatting.FormattingKeys;
import com.google.devtools.loom.formatting.FormattingStore;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses the body of an f-string token into a {@link JoinedStrNode}.
 *
 * <p>Embedded expressions are parsed with their own formatting, and the token text is stored as the
 * node's {@code content} with each expression replaced by a placeholder.
 */
final class FStringParser {
  private static final String CONVERSIONS = "rsa";

  private final String body;
  private final boolean raw;
  private final FormattingStore formatting;
  private final int line;
  private final int column;
  private final StringBuilder template = new StringBuilder();
  private int pos;
  private int placeholders;

  private FStringParser(
      String body, boolean raw, FormattingStore formatting, int line, int column) {
    this.body = body;
    this.raw = raw;
    this.formatting = formatting;
    this.line = line;
    this.column = column;
  }

  /**
   * Parses an f-string token.
   *
   * @param line line of the token, for error messages
   * @param column column of the token, for error messages
   */
  static JoinedStrNode parse(String token, FormattingStore formatting, int line, int column)
      throws ParseException {
    String prefix = StringLiterals.prefix(token);
    String quote = StringLiterals.quote(token);
    FStringParser parser =
        new FStringParser(
            StringLiterals.body(token), StringLiterals.isRaw(prefix), formatting, line, column);
    parser.template.append(prefix).append(quote);
    JoinedStrNode node = new JoinedStrNode(parser.parseParts(false));
    parser.template.append(quote);
    formatting.set(node, FormattingKeys.CONTENT, parser.template.toString());
    return node;
  }

  /**
   * Parses literal text and replacement fields. At the top level this runs to the end of the body;
   * within a format spec it stops at the {@code '}'} that closes the enclosing field.
   */
  private List<Node> parseParts(boolean inFormatSpec) throws ParseException {
    List<Node> parts = new ArrayList<>();
    StringBuilder literal = new StringBuilder();
    while (pos < body.length()) {
      char c = body.charAt(pos);
      if (c == '{') {
        if (!inFormatSpec && body.startsWith("{{", pos)) {
          literal.append('{');
          template.append("{{");
          pos += 2;
          continue;
        }
        flushLiteral(literal, parts);
        parts.add(parseReplacementField());
      } else if (c == '}') {
        if (inFormatSpec) {
          break;
        }
        if (!body.startsWith("}}", pos)) {
          throw error("f-string: single '}' is not allowed");
        }
        literal.append('}');
        template.append("}}");
        pos += 2;
      } else if (c == '\\' && !raw && pos + 1 < body.length()) {
        literal.append(body, pos, pos + 2);
        template.append(body, pos, pos + 2);
        pos += 2;
      } else {
        literal.append(c);
        template.append(c);
        pos++;
      }
    }
    flushLiteral(literal, parts);
    return parts;
  }

  private FormattedValueNode parseReplacementField() throws ParseException {
    pos++;
    template.append('{');
    int end = findExpressionEnd();
    String source = body.substring(pos, end);
    if (source.trim().isEmpty()) {
      throw error("f-string: empty expression not allowed");
    }
    Node value = Parser.parseExpression(source, formatting);
    template.append(FStringPlaceholders.placeholder(placeholders++));
    pos = end;

    String conversion = null;
    if (body.charAt(pos) == '!') {
      if (pos + 1 >= body.length() || CONVERSIONS.indexOf(body.charAt(pos + 1)) < 0) {
        throw error("f-string: invalid conversion character");
      }
      conversion = String.valueOf(body.charAt(pos + 1));
      template.append('!').append(conversion);
      pos += 2;
    }
    JoinedStrNode formatSpec = null;
    if (pos < body.length() && body.charAt(pos) == ':') {
      template.append(':');
      pos++;
      formatSpec = new JoinedStrNode(parseParts(true));
    }
    if (pos >= body.length() || body.charAt(pos) != '}') {
      throw error("f-string: expecting '}'");
    }
    template.append('}');
    pos++;
    return new FormattedValueNode(value, conversion, formatSpec);
  }

  /** Returns the index of the {@code '!'}, {@code ':'} or {@code '}'} that ends the expression. */
  private int findExpressionEnd() throws ParseException {
    int depth = 0;
    int i = pos;
    while (i < body.length()) {
      char c = body.charAt(i);
      if (c == '\'' || c == '"') {
        int close = body.indexOf(c, i + 1);
        if (close < 0) {
          throw error("f-string: unterminated string");
        }
        i = close + 1;
        continue;
      }
      if (c == '(' || c == '[' || c == '{') {
        depth++;
      } else if (c == ')' || c == ']' || c == '}') {
        if (depth == 0 && c == '}') {
          return i;
        }
        depth--;
      } else if (depth == 0
          && (c == ':' || (c == '!' && (i + 1 >= body.length() || body.charAt(i + 1) != '=')))) {
        return i;
      }
      i++;
    }
    throw error("f-string: expecting '}'");
  }

  private void flushLiteral(StringBuilder literal, List<Node> parts) {
    if (literal.length() > 0) {
      parts.add(new StrNode(StringLiterals.decode(literal.toString(), raw)));
      literal.setLength(0);
    }
  }

  private ParseException error(String message) {
    return new ParseException(message, line, column);
  }
}
