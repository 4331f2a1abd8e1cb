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

package com.google.devtools.loom.ast;

import com.google.common.graph.Traverser;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Static helpers for walking and comparing syntax trees. */
public final class Trees {
  private static final Traverser<Node> TRAVERSER = Traverser.forTree(Node::getChildren);

  private Trees() {}

  /** Returns every node under and including {@code root}, parents before children. */
  public static Iterable<Node> preOrder(Node root) {
    return TRAVERSER.depthFirstPreOrder(root);
  }

  /**
   * Returns whether two trees have the same kinds and field values throughout. Formatting is not
   * part of the comparison.
   */
  public static boolean structurallyEqual(@Nullable Node a, @Nullable Node b) {
    if (a == b) {
      return true;
    }
    if (a == null || b == null || a.getKind() != b.getKind()) {
      return false;
    }
    for (String field : a.getFieldNames()) {
      if (!fieldValuesEqual(a.getField(field), b.getField(field))) {
        return false;
      }
    }
    return true;
  }

  private static boolean fieldValuesEqual(@Nullable Object a, @Nullable Object b) {
    if (a instanceof Node || b instanceof Node) {
      return a instanceof Node && b instanceof Node && structurallyEqual((Node) a, (Node) b);
    }
    if (a instanceof List && b instanceof List) {
      List<?> left = (List<?>) a;
      List<?> right = (List<?>) b;
      if (left.size() != right.size()) {
        return false;
      }
      for (int i = 0; i < left.size(); i++) {
        if (!fieldValuesEqual(left.get(i), right.get(i))) {
          return false;
        }
      }
      return true;
    }
    if (a instanceof byte[] && b instanceof byte[]) {
      return Arrays.equals((byte[]) a, (byte[]) b);
    }
    return Objects.equals(a, b);
  }
}
