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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link FStringPlaceholders}. */
@RunWith(JUnit4.class)
public class FStringPlaceholdersTest {
  private static final String P0 = FStringPlaceholders.placeholder(0);
  private static final String P1 = FStringPlaceholders.placeholder(1);
  private static final String P2 = FStringPlaceholders.placeholder(2);

  @Test
  public void testCount() {
    assertThat(FStringPlaceholders.count("f'plain'")).isEqualTo(0);
    assertThat(FStringPlaceholders.count("f'{" + P0 + "}{" + P1 + "}'")).isEqualTo(2);
    // Out-of-sequence placeholders do not count.
    assertThat(FStringPlaceholders.count("f'{" + P0 + "}{" + P2 + "}'")).isEqualTo(1);
  }

  @Test
  public void testSubstitute() {
    assertThat(
            FStringPlaceholders.substitute(
                "f'{" + P0 + "!r:>{" + P1 + "}}'", ImmutableList.of("name", "width")))
        .isEqualTo("f'{name!r:>{width}}'");
  }

  @Test
  public void testSubstitutedTextIsNotRescanned() {
    assertThat(
            FStringPlaceholders.substitute(
                "f'{" + P0 + "}{" + P1 + "}'", ImmutableList.of(P1, "b")))
        .isEqualTo("f'{" + P1 + "}{b}'");
  }

  @Test
  public void testSubstituteCountMismatch() {
    assertThrows(
        IllegalArgumentException.class,
        () -> FStringPlaceholders.substitute("f'{" + P0 + "}'", ImmutableList.of("a", "b")));
    assertThrows(
        IllegalArgumentException.class,
        () -> FStringPlaceholders.substitute("f'{" + P0 + "}'", ImmutableList.of()));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            FStringPlaceholders.substitute(
                "f'{" + P0 + "}{" + P1 + "}'", ImmutableList.of("a")));
  }
}
