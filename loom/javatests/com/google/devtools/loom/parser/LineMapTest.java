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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link LineMap}. */
@RunWith(JUnit4.class)
public class LineMapTest {

  @Test
  public void testLinesAndColumns() {
    LineMap map = new LineMap("ab\ncde\n\nf");
    assertThat(map.charToLine(0)).isEqualTo(1);
    assertThat(map.charToColumn(0)).isEqualTo(1);
    assertThat(map.charToLine(2)).isEqualTo(1);
    assertThat(map.charToColumn(2)).isEqualTo(3);
    assertThat(map.charToLine(3)).isEqualTo(2);
    assertThat(map.charToColumn(5)).isEqualTo(3);
    assertThat(map.charToLine(7)).isEqualTo(3);
    assertThat(map.charToLine(8)).isEqualTo(4);
    assertThat(map.charToColumn(8)).isEqualTo(1);
  }

  @Test
  public void testEndOfText() {
    LineMap map = new LineMap("x\n");
    assertThat(map.charToLine(2)).isEqualTo(2);
    assertThat(map.charToColumn(2)).isEqualTo(1);
  }

  @Test
  public void testOutOfBounds() {
    LineMap map = new LineMap("abc");
    assertThat(map.charToLine(-1)).isEqualTo(-1);
    assertThat(map.charToLine(4)).isEqualTo(-1);
    assertThat(map.charToColumn(4)).isEqualTo(-1);
  }

  @Test
  public void testManyLines() {
    StringBuilder text = new StringBuilder();
    for (int i = 0; i < 100; i++) {
      text.append("line\n");
    }
    LineMap map = new LineMap(text);
    assertThat(map.charToLine(5 * 57 + 2)).isEqualTo(58);
    assertThat(map.charToColumn(5 * 57 + 2)).isEqualTo(3);
  }
}
