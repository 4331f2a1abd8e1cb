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

package com.google.devtools.loom.formatting;

/**
 * Names of the formatting attributes shared by the parser and the printer. Attributes that only
 * one kind of node uses (operators, brackets, separators) are spelled out where they are used.
 */
public final class FormattingKeys {
  private FormattingKeys() {}

  /** Trivia before a node: blank lines, comments and indentation for statements. */
  public static final String PREFIX = "prefix";

  /** Trivia after a node: trailing comment and line break for simple statements. */
  public static final String SUFFIX = "suffix";

  /** The verbatim text of a literal. */
  public static final String CONTENT = "content";

  /** String prefix letters and opening quote of a string literal, e.g. {@code r"}. */
  public static final String FMT = "fmt";

  /** Extra indentation of a block relative to the statement that introduces it. */
  public static final String INDENT_DIFF = "indent_diff";

  /**
   * Whitespace between a keyword ({@code return}, {@code if}, {@code elif}, {@code while}, {@code
   * for} or {@code not}) and the expression after it. Stored on the node that owns the keyword, so
   * it survives replacing that expression.
   */
  public static final String AFTER_KEYWORD = "after_keyword";

  /** Byte-order mark that preceded a module's text. */
  public static final String BOM = "bom";

  /** Marker on an {@code if} statement that was written as an {@code elif} clause. */
  public static final String IS_ELIF = "is_elif";

  /** Comma written after the last element of a bracketed sequence. */
  public static final String TRAILING_COMMA = "trailing_comma";
}
