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

import java.util.ArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A comparison chain {@code left op0 comparators[0] op1 comparators[1] ...}. Two-word operators are
 * stored with a single space: {@code "not in"}, {@code "is not"}.
 */
public final class CompareNode extends Node {
  private Node left;
  private List<String> ops;
  private List<Node> comparators;

  public CompareNode(Node left, List<String> ops, List<Node> comparators) {
    super(NodeKind.COMPARE);
    this.left = left;
    this.ops = new ArrayList<>(ops);
    this.comparators = new ArrayList<>(comparators);
  }

  public Node getLeft() {
    return left;
  }

  public void setLeft(Node left) {
    this.left = left;
  }

  public List<String> getOps() {
    return ops;
  }

  public List<Node> getComparators() {
    return comparators;
  }

  @Override
  public @Nullable Object getField(String field) {
    switch (field) {
      case "left":
        return left;
      case "ops":
        return ops;
      case "comparators":
        return comparators;
      default:
        throw noSuchField(field);
    }
  }

  @Override
  public void setField(String field, @Nullable Object value) {
    switch (field) {
      case "left":
        left = (Node) value;
        break;
      case "ops":
        ops = mutableList(value);
        break;
      case "comparators":
        comparators = mutableList(value);
        break;
      default:
        throw noSuchField(field);
    }
  }
}
