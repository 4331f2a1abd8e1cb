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

/** Thrown when source text cannot be parsed. */
public final class ParseException extends Exception {
  private final int line;
  private final int column;

  public ParseException(String message, int line, int column) {
    super(String.format("line %d, column %d: %s", line, column, message));
    this.line = line;
    this.column = column;
  }

  /** Returns the 1-based line of the offending text. */
  public int getLine() {
    return line;
  }

  /** Returns the 1-based column of the offending text. */
  public int getColumn() {
    return column;
  }
}
