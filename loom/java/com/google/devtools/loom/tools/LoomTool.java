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

package com.google.devtools.loom.tools;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.beust.jcommander.ParameterException;
import com.google.common.base.Strings;
import com.google.common.flogger.FluentLogger;
import com.google.devtools.loom.ast.AnnotatedTree;
import com.google.devtools.loom.augment.ConstantInliner;
import com.google.devtools.loom.augment.InlineException;
import com.google.devtools.loom.codegen.CodeGen;
import com.google.devtools.loom.codegen.PrintException;
import com.google.devtools.loom.codegen.PrinterOptions;
import com.google.devtools.loom.parser.ParseException;
import com.google.devtools.loom.parser.Parser;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads a source file, optionally inlines constants, and writes the result.
 *
 * <p>Usage: loom [--inline=NAME]... [--debug_tree] [--default_indent=N] [--output=FILE] FILE
 */
public class LoomTool {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  public static void main(String[] args) {
    System.exit(execute(args, System.out, System.err));
  }

  /**
   * Parses {@code args} and runs the tool. Malformed command lines are reported on {@code err} in
   * one line. Returns the process exit code.
   */
  static int execute(String[] args, PrintStream out, PrintStream err) {
    LoomToolConfig config = new LoomToolConfig("loom");
    try {
      config.parseCommandLine(args);
    } catch (ParameterException e) {
      err.printf("loom: %s%n", e.getMessage());
      return 1;
    }
    if (config.getVerboseLogging()) {
      Logger root = Logger.getLogger("");
      root.setLevel(Level.FINE);
      for (Handler handler : root.getHandlers()) {
        handler.setLevel(Level.FINE);
      }
    }
    return run(config, out, err);
  }

  /** Runs the tool as configured. Returns the process exit code. */
  static int run(LoomToolConfig config, PrintStream out, PrintStream err) {
    Path input = Paths.get(config.getInput());
    String source;
    try {
      source = new String(Files.readAllBytes(input), UTF_8);
    } catch (IOException e) {
      logger.atWarning().withCause(e).log("Failed to read %s", input);
      err.printf("%s: cannot read file: %s%n", input, e.getMessage());
      return 1;
    }

    AnnotatedTree tree;
    try {
      tree = Parser.parse(source);
    } catch (ParseException e) {
      err.printf("%s: %s%n", input, e.getMessage());
      return 1;
    }

    for (String name : config.getInlineNames()) {
      try {
        ConstantInliner.inlineName(tree, name);
      } catch (InlineException e) {
        err.printf("%s: cannot inline: %s%n", input, e.getMessage());
        return 1;
      }
    }

    String result;
    try {
      if (config.getDebugTree()) {
        result = CodeGen.toTreeString(tree);
      } else {
        PrinterOptions options =
            PrinterOptions.builder()
                .setFallbackIndentDiff(Strings.repeat(" ", config.getDefaultIndent()))
                .build();
        result = CodeGen.toSource(tree, options);
      }
    } catch (PrintException e) {
      logger.atSevere().withCause(e).log("Failed to print %s", input);
      err.printf("%s: %s%n", input, e.getMessage());
      return 1;
    }

    if (config.getOutput() == null) {
      out.print(result);
      out.flush();
      return 0;
    }
    Path output = Paths.get(config.getOutput());
    try {
      Files.write(output, result.getBytes(UTF_8));
    } catch (IOException e) {
      logger.atWarning().withCause(e).log("Failed to write %s", output);
      err.printf("%s: cannot write file: %s%n", output, e.getMessage());
      return 1;
    }
    return 0;
  }
}
