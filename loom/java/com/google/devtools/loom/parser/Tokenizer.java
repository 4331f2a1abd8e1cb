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
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Splits source text into {@link Token tokens}. Nothing is discarded: every whitespace run,
 * comment, blank line and line continuation is attached as trivia to the token that follows it, and
 * whatever trails the last token is attached to {@link TokenKind#EOF}.
 *
 * <p>In statement mode the tokenizer tracks indentation and emits NEWLINE, INDENT and DEDENT tokens
 * outside of brackets. In expression mode (used for expressions embedded in f-strings) line breaks
 * are plain trivia.
 */
final class Tokenizer {
  private static final Pattern NUMBER =
      Pattern.compile(
          "0[xX](?:_?[0-9a-fA-F])+|0[oO](?:_?[0-7])+|0[bB](?:_?[01])+"
              + "|(?:(?:\\d(?:_?\\d)*)?\\.\\d(?:_?\\d)*|\\d(?:_?\\d)*\\.?)"
              + "(?:[eE][+-]?\\d(?:_?\\d)*)?[jJ]?");

  private static final ImmutableList<String> OPERATORS =
      ImmutableList.of(
          "**=", "//=", ">>=", "<<=", "...", "->", "**", "//", "<<", ">>", "<=", ">=", "==", "!=",
          "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=", ":=", "+", "-", "*", "/", "%", "@",
          "&", "|", "^", "~", "<", ">", "(", ")", "[", "]", "{", "}", ",", ":", ".", ";", "=");

  private static final ImmutableSet<String> STRING_PREFIXES =
      ImmutableSet.of("r", "u", "b", "f", "br", "rb", "fr", "rf");

  private final String text;
  private final boolean expressionMode;
  private final LineMap lineMap;
  private final ImmutableList.Builder<Token> tokens = ImmutableList.builder();
  private final Deque<String> indents = new ArrayDeque<>();
  private int pos;
  private int depth;
  private boolean atLineStart;
  private @Nullable TokenKind lastKind;

  private Tokenizer(String text, boolean expressionMode) {
    this.text = text;
    this.expressionMode = expressionMode;
    this.lineMap = new LineMap(text);
    this.atLineStart = !expressionMode;
  }

  /** Tokenizes a whole module. */
  static ImmutableList<Token> tokenize(String text) throws ParseException {
    return new Tokenizer(text, false).run();
  }

  /** Tokenizes a free-standing expression, treating line breaks as whitespace. */
  static ImmutableList<Token> tokenizeExpression(String text) throws ParseException {
    return new Tokenizer(text, true).run();
  }

  private ImmutableList<Token> run() throws ParseException {
    indents.push("");
    StringBuilder trivia = new StringBuilder();
    while (true) {
      if (atLineStart) {
        String indentation = skipBlankLines(trivia);
        if (pos == text.length()) {
          break;
        }
        atLineStart = false;
        adjustIndentation(indentation);
      } else {
        skipTrivia(trivia);
        if (pos == text.length()) {
          break;
        }
      }
      char c = text.charAt(pos);
      if (isLineBreak(c)) {
        int start = pos;
        pos = skipLineBreak(pos);
        emit(TokenKind.NEWLINE, text.substring(start, pos), trivia, start);
        atLineStart = true;
      } else {
        lexToken(trivia);
      }
    }
    int end = text.length();
    if (depth > 0) {
      throw error("unexpected EOF in multi-line statement", end);
    }
    if (!expressionMode && lastKind != null && lastKind != TokenKind.NEWLINE) {
      emit(TokenKind.NEWLINE, "", trivia, end);
    }
    while (indents.size() > 1) {
      indents.pop();
      emit(TokenKind.DEDENT, "", new StringBuilder(), end);
    }
    emit(TokenKind.EOF, "", trivia, end);
    return tokens.build();
  }

  /**
   * Consumes blank and comment-only lines plus the indentation of the next logical line, appending
   * all of it to {@code trivia}. Returns the indentation.
   */
  private String skipBlankLines(StringBuilder trivia) {
    while (true) {
      int lineBegin = pos;
      while (pos < text.length() && isIndentChar(text.charAt(pos))) {
        pos++;
      }
      String indentation = text.substring(lineBegin, pos);
      if (pos < text.length() && text.charAt(pos) == '#') {
        while (pos < text.length() && !isLineBreak(text.charAt(pos))) {
          pos++;
        }
      }
      if (pos == text.length()) {
        trivia.append(text, lineBegin, pos);
        return "";
      }
      if (isLineBreak(text.charAt(pos))) {
        pos = skipLineBreak(pos);
        trivia.append(text, lineBegin, pos);
        continue;
      }
      trivia.append(indentation);
      return indentation;
    }
  }

  /** Consumes whitespace, comments and line continuations within a logical line. */
  private void skipTrivia(StringBuilder trivia) {
    while (pos < text.length()) {
      char c = text.charAt(pos);
      int start = pos;
      if (isIndentChar(c)) {
        pos++;
      } else if (c == '#') {
        while (pos < text.length() && !isLineBreak(text.charAt(pos))) {
          pos++;
        }
      } else if (c == '\\' && pos + 1 < text.length() && isLineBreak(text.charAt(pos + 1))) {
        pos = skipLineBreak(pos + 1);
      } else if (isLineBreak(c) && (depth > 0 || expressionMode)) {
        pos = skipLineBreak(pos);
      } else {
        return;
      }
      trivia.append(text, start, pos);
    }
  }

  private void adjustIndentation(String indentation) throws ParseException {
    String current = indents.peek();
    if (indentation.equals(current)) {
      return;
    }
    if (indentation.startsWith(current)) {
      indents.push(indentation);
      emit(TokenKind.INDENT, indentation, new StringBuilder(), pos);
      return;
    }
    if (!current.startsWith(indentation)) {
      throw error("inconsistent use of tabs and spaces in indentation", pos);
    }
    while (!indents.peek().equals(indentation)) {
      indents.pop();
      emit(TokenKind.DEDENT, "", new StringBuilder(), pos);
      if (!indents.peek().startsWith(indentation)) {
        throw error("unindent does not match any outer indentation level", pos);
      }
    }
  }

  private void lexToken(StringBuilder trivia) throws ParseException {
    int start = pos;
    char c = text.charAt(pos);
    if (isIdentifierStart(c)) {
      pos++;
      while (pos < text.length() && isIdentifierPart(text.charAt(pos))) {
        pos++;
      }
      String word = text.substring(start, pos);
      if (pos < text.length()
          && isQuote(text.charAt(pos))
          && STRING_PREFIXES.contains(Ascii.toLowerCase(word))) {
        skipString(start);
        emit(TokenKind.STRING, text.substring(start, pos), trivia, start);
      } else {
        emit(TokenKind.NAME, word, trivia, start);
      }
    } else if (isQuote(c)) {
      skipString(start);
      emit(TokenKind.STRING, text.substring(start, pos), trivia, start);
    } else if (isDigit(c)
        || (c == '.' && pos + 1 < text.length() && isDigit(text.charAt(pos + 1)))) {
      Matcher matcher = NUMBER.matcher(text).region(pos, text.length());
      if (!matcher.lookingAt()) {
        throw error("invalid number literal", start);
      }
      pos = matcher.end();
      emit(TokenKind.NUMBER, text.substring(start, pos), trivia, start);
    } else {
      String op = matchOperator();
      if (op == null) {
        throw error("invalid character '" + c + "'", start);
      }
      if (op.length() == 1 && "([{".contains(op)) {
        depth++;
      } else if (op.length() == 1 && ")]}".contains(op)) {
        if (depth == 0) {
          throw error("unmatched '" + op + "'", start);
        }
        depth--;
      }
      pos += op.length();
      emit(TokenKind.OP, op, trivia, start);
    }
  }

  /** Advances past a string literal whose opening quote is at {@code pos}. */
  private void skipString(int start) throws ParseException {
    char q = text.charAt(pos);
    String quote = text.startsWith(Strings.repeat(String.valueOf(q), 3), pos)
        ? Strings.repeat(String.valueOf(q), 3)
        : String.valueOf(q);
    boolean triple = quote.length() == 3;
    pos += quote.length();
    while (true) {
      if (pos >= text.length()) {
        throw error(
            triple
                ? "EOF while scanning triple-quoted string literal"
                : "EOL while scanning string literal",
            start);
      }
      char c = text.charAt(pos);
      if (c == '\\') {
        pos = pos + 1 < text.length() && isLineBreak(text.charAt(pos + 1))
            ? skipLineBreak(pos + 1)
            : pos + 2;
      } else if (!triple && isLineBreak(c)) {
        throw error("EOL while scanning string literal", start);
      } else if (text.startsWith(quote, pos)) {
        pos += quote.length();
        return;
      } else {
        pos++;
      }
    }
  }

  private @Nullable String matchOperator() {
    for (String op : OPERATORS) {
      if (text.startsWith(op, pos)) {
        return op;
      }
    }
    return null;
  }

  private void emit(TokenKind kind, String tokenText, StringBuilder trivia, int offset) {
    tokens.add(Token.create(kind, tokenText, trivia.toString(), offset));
    trivia.setLength(0);
    lastKind = kind;
  }

  private int skipLineBreak(int at) {
    if (text.charAt(at) == '\r' && at + 1 < text.length() && text.charAt(at + 1) == '\n') {
      return at + 2;
    }
    return at + 1;
  }

  private ParseException error(String message, int offset) {
    return new ParseException(message, lineMap.charToLine(offset), lineMap.charToColumn(offset));
  }

  private static boolean isLineBreak(char c) {
    return c == '\n' || c == '\r';
  }

  private static boolean isIndentChar(char c) {
    return c == ' ' || c == '\t' || c == '\f';
  }

  private static boolean isQuote(char c) {
    return c == '\'' || c == '"';
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isIdentifierStart(char c) {
    return Character.isLetter(c) || c == '_';
  }

  private static boolean isIdentifierPart(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }
}
