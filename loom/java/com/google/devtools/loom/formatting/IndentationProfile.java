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

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.Multiset;
import com.google.common.flogger.FluentLogger;
import com.google.devtools.loom.ast.Node;
import com.google.devtools.loom.ast.Trees;
import java.util.Comparator;
import java.util.Optional;

/**
 * Counts how often each indentation step ({@code indent_diff}) occurs in a tree, to choose the step
 * used for blocks that have no recorded indentation of their own.
 *
 * <p>The most frequent step wins; on equal counts the shorter string wins, and strings of equal
 * length are ordered lexicographically so that the choice never depends on traversal order.
 */
public final class IndentationProfile {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final Comparator<Multiset.Entry<String>> PREFERENCE =
      Comparator.<Multiset.Entry<String>>comparingInt(Multiset.Entry::getCount)
          .thenComparing(e -> e.getElement().length(), Comparator.reverseOrder())
          .thenComparing(Multiset.Entry::getElement, Comparator.reverseOrder());

  private final ImmutableMultiset<String> counts;

  private IndentationProfile(Multiset<String> counts) {
    this.counts = ImmutableMultiset.copyOf(counts);
  }

  /** Scans every node under {@code root} for a non-empty {@code indent_diff} fragment. */
  public static IndentationProfile scan(Node root, FormattingStore store) {
    Multiset<String> counts = HashMultiset.create();
    for (Node node : Trees.preOrder(root)) {
      String diff = store.get(node, FormattingKeys.INDENT_DIFF);
      if (diff != null && !diff.isEmpty()) {
        counts.add(diff);
      }
    }
    return new IndentationProfile(counts);
  }

  /** Builds a profile directly from occurrence counts. */
  public static IndentationProfile fromCounts(Multiset<String> counts) {
    return new IndentationProfile(counts);
  }

  public int count(String indentDiff) {
    return counts.count(indentDiff);
  }

  /** Returns the preferred indentation step, or empty if the tree recorded none. */
  public Optional<String> mostCommon() {
    Optional<String> choice =
        counts.entrySet().stream().max(PREFERENCE).map(Multiset.Entry::getElement);
    logger.atFine().log("indentation counts %s, chose %s", counts, choice);
    return choice;
  }
}
