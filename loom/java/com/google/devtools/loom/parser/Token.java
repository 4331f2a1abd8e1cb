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

import com.google.auto.value.AutoValue;

/**
 * A lexical token together with the trivia (whitespace, comments, line continuations and blank
 * lines) that precedes it. Concatenating {@code prefix() + text()} over all tokens except {@link
 * TokenKind#INDENT} reproduces the input exactly.
 */
@AutoValue
abstract class Token {
  abstract TokenKind kind();

  abstract String text();

  abstract String prefix();

  /** Offset of the first character of {@link #text} in the input. */
  abstract int offset();

  static Token create(TokenKind kind, String text, String prefix, int offset) {
    return new AutoValue_Token(kind, text, prefix, offset);
  }

  boolean is(TokenKind kind, String text) {
    return kind() == kind && text().equals(text);
  }
}
