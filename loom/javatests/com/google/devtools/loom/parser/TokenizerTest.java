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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link Tokenizer}. */
@RunWith(JUnit4.class)
public class TokenizerTest {

  @Test
  public void testIndentation() throws ParseException {
    ImmutableList<Token> tokens = Tokenizer.tokenize("if a:\n    b\nc\n");
    assertThat(kinds(tokens))
        .containsExactly(
            TokenKind.NAME,
            TokenKind.NAME,
            TokenKind.OP,
            TokenKind.NEWLINE,
            TokenKind.INDENT,
            TokenKind.NAME,
            TokenKind.NEWLINE,
            TokenKind.DEDENT,
            TokenKind.NAME,
            TokenKind.NEWLINE,
            TokenKind.EOF)
        .inOrder();
    assertThat(tokens.get(4).text()).isEqualTo("    ");
    assertThat(tokens.get(5).prefix()).isEqualTo("    ");
  }

  @Test
  public void testTriviaIsPreserved() throws ParseException {
    String source =
        "# header\r\n\r\nx = (1,  # inside\n     2)  \\\n  + y\n\n  # indented comment\nz = 'a#b'\n"
            + "# trailing";
    assertThat(concatenate(Tokenizer.tokenize(source))).isEqualTo(source);
  }

  @Test
  public void testTrailingTriviaGoesToEof() throws ParseException {
    ImmutableList<Token> tokens = Tokenizer.tokenize("x\n\n# end\n");
    Token eof = tokens.get(tokens.size() - 1);
    assertThat(eof.kind()).isEqualTo(TokenKind.EOF);
    assertThat(eof.prefix()).isEqualTo("\n# end\n");
  }

  @Test
  public void testMissingFinalNewline() throws ParseException {
    ImmutableList<Token> tokens = Tokenizer.tokenize("x = 1");
    Token newline = tokens.get(tokens.size() - 2);
    assertThat(newline.kind()).isEqualTo(TokenKind.NEWLINE);
    assertThat(newline.text()).isEmpty();
  }

  @Test
  public void testStrings() throws ParseException {
    ImmutableList<Token> tokens =
        Tokenizer.tokenize("a = rb'\\'' + '''x\n'y''' + Rf\"{z}\" + u'\\\n'\n");
    List<String> strings = new ArrayList<>();
    for (Token token : tokens) {
      if (token.kind() == TokenKind.STRING) {
        strings.add(token.text());
      }
    }
    assertThat(strings)
        .containsExactly("rb'\\''", "'''x\n'y'''", "Rf\"{z}\"", "u'\\\n'")
        .inOrder();
  }

  @Test
  public void testOperatorsAndNumbers() throws ParseException {
    ImmutableList<Token> tokens = Tokenizer.tokenizeExpression("a**=.5e-3//0x_F>>=...");
    List<String> texts = new ArrayList<>();
    for (Token token : tokens) {
      texts.add(token.text());
    }
    assertThat(texts).containsExactly("a", "**=", ".5e-3", "//", "0x_F", ">>=", "...", "")
        .inOrder();
  }

  @Test
  public void testExpressionModeTreatsLineBreaksAsTrivia() throws ParseException {
    ImmutableList<Token> tokens = Tokenizer.tokenizeExpression(" a\n+ b ");
    assertThat(kinds(tokens))
        .containsExactly(TokenKind.NAME, TokenKind.OP, TokenKind.NAME, TokenKind.EOF)
        .inOrder();
    assertThat(tokens.get(1).prefix()).isEqualTo("\n");
    assertThat(tokens.get(3).prefix()).isEqualTo(" ");
  }

  @Test
  public void testErrors() {
    ParseException e =
        assertThrows(ParseException.class, () -> Tokenizer.tokenize("x = 'abc\n"));
    assertThat(e).hasMessageThat().contains("EOL while scanning string literal");
    assertThat(e.getLine()).isEqualTo(1);
    assertThat(e.getColumn()).isEqualTo(5);

    e = assertThrows(ParseException.class, () -> Tokenizer.tokenize("x = (1,\n"));
    assertThat(e).hasMessageThat().contains("unexpected EOF in multi-line statement");

    e = assertThrows(ParseException.class, () -> Tokenizer.tokenize("if a:\n    b\n  c\n"));
    assertThat(e).hasMessageThat().contains("unindent does not match");
    assertThat(e.getLine()).isEqualTo(3);

    e = assertThrows(ParseException.class, () -> Tokenizer.tokenize("if a:\n\tb\n        c\n"));
    assertThat(e).hasMessageThat().contains("inconsistent use of tabs and spaces");

    e = assertThrows(ParseException.class, () -> Tokenizer.tokenize("x = 1)\n"));
    assertThat(e).hasMessageThat().contains("unmatched ')'");

    e = assertThrows(ParseException.class, () -> Tokenizer.tokenize("x = $\n"));
    assertThat(e).hasMessageThat().contains("invalid character '$'");

    e = assertThrows(ParseException.class, () -> Tokenizer.tokenize("s = '''open\n"));
    assertThat(e).hasMessageThat().contains("EOF while scanning triple-quoted string literal");
  }

  private static List<TokenKind> kinds(List<Token> tokens) {
    List<TokenKind> kinds = new ArrayList<>();
    for (Token token : tokens) {
      kinds.add(token.kind());
    }
    return kinds;
  }

  private static String concatenate(List<Token> tokens) {
    StringBuilder text = new StringBuilder();
    for (Token token : tokens) {
      if (token.kind() != TokenKind.INDENT) {
        text.append(token.prefix()).append(token.text());
      }
    }
    return text.toString();
  }
}
