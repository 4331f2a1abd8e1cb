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

import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.LinkedHashMultiset;
import com.google.common.collect.Multiset;
import com.google.devtools.loom.ast.AnnotatedTree;
import com.google.devtools.loom.parser.ParseException;
import com.google.devtools.loom.parser.Parser;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link IndentationProfile}. */
@RunWith(JUnit4.class)
public class IndentationProfileTest {

  @Test
  public void testMostFrequentWins() {
    IndentationProfile profile =
        IndentationProfile.fromCounts(
            ImmutableMultiset.<String>builder().addCopies("    ", 3).addCopies("\t", 2).build());
    assertThat(profile.mostCommon()).hasValue("    ");
  }

  @Test
  public void testTieGoesToShorterString() {
    Multiset<String> spacesFirst = LinkedHashMultiset.create();
    spacesFirst.add("  ", 3);
    spacesFirst.add("\t", 3);
    Multiset<String> tabsFirst = LinkedHashMultiset.create();
    tabsFirst.add("\t", 3);
    tabsFirst.add("  ", 3);

    assertThat(IndentationProfile.fromCounts(spacesFirst).mostCommon()).hasValue("\t");
    assertThat(IndentationProfile.fromCounts(tabsFirst).mostCommon()).hasValue("\t");
  }

  @Test
  public void testTieOfEqualLengthIsLexicographic() {
    Multiset<String> counts = LinkedHashMultiset.create();
    counts.add("\t ", 2);
    counts.add(" \t", 2);
    assertThat(IndentationProfile.fromCounts(counts).mostCommon()).hasValue("\t ");
  }

  @Test
  public void testEmpty() {
    assertThat(IndentationProfile.fromCounts(ImmutableMultiset.of()).mostCommon()).isEmpty();
  }

  @Test
  public void testScan() throws ParseException {
    AnnotatedTree tree =
        Parser.parse(
            "def f():\n"
                + "    if a:\n"
                + "        pass\n"
                + "    while b:\n"
                + "      pass\n"
                + "class C: pass\n");
    IndentationProfile profile = IndentationProfile.scan(tree.getRoot(), tree.getFormatting());
    assertThat(profile.count("    ")).isEqualTo(2);
    assertThat(profile.count("  ")).isEqualTo(1);
    assertThat(profile.mostCommon()).hasValue("    ");
  }
}
