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

import com.google.common.flogger.FluentLogger;
import com.google.devtools.loom.ast.AnnotatedTree;
import com.google.devtools.loom.ast.Node;
import com.google.devtools.loom.formatting.FormattingStore;
import com.google.devtools.loom.formatting.IndentationProfile;

/**
 * Entry points for turning trees back into source text.
 *
 * <p>Printing a tree exactly as parsed reproduces the parsed text byte for byte. After edits, the
 * untouched parts still print exactly as they were written; edited parts print their recorded
 * formatting where it still applies and canonical formatting where it does not.
 */
public final class CodeGen {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private CodeGen() {}

  /** Prints a whole annotated tree with default options. */
  public static String toSource(AnnotatedTree tree) {
    return toSource(tree, PrinterOptions.defaults());
  }

  public static String toSource(AnnotatedTree tree, PrinterOptions options) {
    return toSource(tree.getRoot(), tree.getFormatting(), options);
  }

  /** Prints {@code node} and everything below it with default options. */
  public static String toSource(Node node, FormattingStore formatting) {
    return toSource(node, formatting, PrinterOptions.defaults());
  }

  /**
   * Prints {@code node} and everything below it.
   *
   * <p>Blocks without a recorded indentation step use the step that occurs most often under {@code
   * node}, or {@link PrinterOptions#fallbackIndentDiff} if none is recorded.
   *
   * @throws PrintException if a node's fields do not have the shape its kind requires
   */
  public static String toSource(Node node, FormattingStore formatting, PrinterOptions options) {
    String indentDiff =
        IndentationProfile.scan(node, formatting)
            .mostCommon()
            .orElse(options.fallbackIndentDiff());
    logger.atFine().log(
        "Printing %s with a %d-character indentation step", node, indentDiff.length());
    return new Printer(formatting, indentDiff).print(node);
  }

  /** Renders the annotated tree for debugging; see {@link #toTreeString(Node, FormattingStore)}. */
  public static String toTreeString(AnnotatedTree tree) {
    return toTreeString(tree.getRoot(), tree.getFormatting());
  }

  /**
   * Renders {@code node} as an indented outline for debugging: each node on its own line followed
   * by its recorded formatting and then its fields.
   */
  public static String toTreeString(Node node, FormattingStore formatting) {
    return new TreeDumper(formatting).dump(node);
  }
}
