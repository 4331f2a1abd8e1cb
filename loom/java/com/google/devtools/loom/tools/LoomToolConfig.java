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

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import java.util.ArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Configuration for the loom command-line tool. */
@Parameters(separators = "=")
public class LoomToolConfig {
  private final String programName;

  @Parameter(
    names = {"--help", "-h"},
    description = "Help requested",
    help = true
  )
  private boolean help;

  @Parameter(
    names = "--inline",
    description =
        "Name of a top-level constant to inline before printing. May be repeated; names are"
            + " inlined in the order given."
  )
  private List<String> inlineNames = new ArrayList<>();

  @Parameter(
    names = "--debug_tree",
    description = "Print the annotated tree with its recorded formatting instead of source text."
  )
  private boolean debugTree;

  @Parameter(
    names = "--default_indent",
    description =
        "Number of spaces per indentation level for new blocks when the input records no"
            + " indentation of its own."
  )
  private int defaultIndent = 2;

  @Parameter(
    names = "--output",
    description = "File to write the result to. Defaults to standard output."
  )
  private String output;

  @Parameter(
    names = "--verbose",
    description = "Determines whether the tool should emit verbose logging messages for debugging."
  )
  private boolean verboseLogging;

  @Parameter(description = "<input file>")
  private List<String> inputs = new ArrayList<>();

  public LoomToolConfig(String programName) {
    this.programName = programName;
  }

  /**
   * Parses the given command-line arguments, setting each known flag. If --help is requested, the
   * binary's usage message will be printed and the program will exit with non-zero code.
   *
   * @throws ParameterException if the arguments are malformed or do not name exactly one input
   */
  public final void parseCommandLine(String[] args) {
    JCommander jc = new JCommander(this, args);
    jc.setProgramName(programName);
    if (getHelp()) {
      jc.usage();
      System.exit(1);
    }
    if (inputs.size() != 1) {
      throw new ParameterException("Expected exactly one input file, got " + inputs.size());
    }
    if (defaultIndent < 1) {
      throw new ParameterException("--default_indent must be positive");
    }
  }

  public final boolean getHelp() {
    return help;
  }

  public final List<String> getInlineNames() {
    return inlineNames;
  }

  public final boolean getDebugTree() {
    return debugTree;
  }

  public final int getDefaultIndent() {
    return defaultIndent;
  }

  public final @Nullable String getOutput() {
    return output;
  }

  public final boolean getVerboseLogging() {
    return verboseLogging;
  }

  public final String getInput() {
    return inputs.get(0);
  }
}
