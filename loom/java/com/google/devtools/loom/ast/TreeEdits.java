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

import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import java.util.List;

/**
 * Generic edit primitives that locate a child among its parent's fields by identity. Neither
 * primitive touches formatting: nodes that lose or gain neighbours keep the fragments recorded for
 * them, and fragments whose dependencies change are discarded when the tree is printed.
 */
public final class TreeEdits {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Statement lists that must hold at least one statement to be printable. */
  private static final ImmutableSet<String> BLOCK_FIELDS = ImmutableSet.of("body");

  private TreeEdits() {}

  /**
   * Replaces {@code oldChild} with {@code newChild} in whichever field of {@code parent} holds it,
   * keeping its position within a list field.
   *
   * @throws InvalidTreeException if {@code parent} does not hold {@code oldChild}.
   */
  public static void replaceChild(Node parent, Node oldChild, Node newChild) {
    for (String field : parent.getFieldNames()) {
      Object value = parent.getField(field);
      if (value == oldChild) {
        parent.setField(field, newChild);
        logger.atFine().log("replaced %s.%s: %s -> %s", parent, field, oldChild, newChild);
        return;
      }
      if (value instanceof List) {
        @SuppressWarnings("unchecked") // list fields only ever hold nodes
        List<Node> children = (List<Node>) value;
        int index = indexOf(children, oldChild);
        if (index >= 0) {
          children.set(index, newChild);
          logger.atFine().log(
              "replaced %s.%s[%d]: %s -> %s", parent, field, index, oldChild, newChild);
          return;
        }
      }
    }
    throw new InvalidTreeException(
        String.format("Unable to find child %s in any field of parent %s", oldChild, parent));
  }

  /**
   * Removes {@code child} from the list field of {@code parent} that holds it. If that leaves the
   * body of a compound statement empty, a {@code pass} statement takes its place.
   *
   * @throws InvalidTreeException if no list field of {@code parent} holds {@code child}.
   */
  public static void removeChild(Node parent, Node child) {
    for (String field : parent.getFieldNames()) {
      Object value = parent.getField(field);
      if (value instanceof List) {
        @SuppressWarnings("unchecked") // list fields only ever hold nodes
        List<Node> children = (List<Node>) value;
        int index = indexOf(children, child);
        if (index >= 0) {
          children.remove(index);
          logger.atFine().log("removed %s from %s.%s[%d]", child, parent, field, index);
          if (children.isEmpty()
              && BLOCK_FIELDS.contains(field)
              && parent.getKind() != NodeKind.MODULE) {
            children.add(SimpleStatementNode.pass());
          }
          return;
        }
      }
    }
    throw new InvalidTreeException(
        String.format("Unable to find list containing child %s on parent %s", child, parent));
  }

  private static int indexOf(List<Node> children, Node child) {
    for (int i = 0; i < children.size(); i++) {
      if (children.get(i) == child) {
        return i;
      }
    }
    return -1;
  }
}
