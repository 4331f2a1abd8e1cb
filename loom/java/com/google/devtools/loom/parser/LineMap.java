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

import java.util.Arrays;

/** Provides a mapping of character offsets in a source text to line and column numbers. */
final class LineMap {
  private final int[] lineStarts;
  private final int length;

  /**
   * Constructs a new {@link LineMap}.
   *
   * @param text The source text to be mapped.
   */
  LineMap(CharSequence text) {
    int[] starts = new int[16];
    int lines = 1;
    for (int i = 0; i < text.length(); i++) {
      if (text.charAt(i) == '\n') {
        if (lines == starts.length) {
          starts = Arrays.copyOf(starts, lines * 2);
        }
        starts[lines++] = i + 1;
      }
    }
    lineStarts = Arrays.copyOf(starts, lines);
    length = text.length();
  }

  /**
   * Returns the 1-based line number of the specified char offset.
   *
   * @return The line number for the offset, or -1 if the offset is out of bounds.
   */
  int charToLine(int charOffset) {
    if (charOffset < 0 || charOffset > length) {
      return -1;
    }
    int index = Arrays.binarySearch(lineStarts, charOffset);
    return index >= 0 ? index + 1 : -index - 1;
  }

  /**
   * Returns the 1-based column of the specified char offset within its line.
   *
   * @return The column for the offset, or -1 if the offset is out of bounds.
   */
  int charToColumn(int charOffset) {
    int line = charToLine(charOffset);
    return line < 0 ? -1 : charOffset - lineStarts[line - 1] + 1;
  }
}
