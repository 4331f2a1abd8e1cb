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

package com.google.devtools.loom.scope;

import com.google.devtools.loom.ast.Node;
import java.util.IdentityHashMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Memoizes the parent of every node in a tree. The tree is traversed once and each node's parent
 * is recorded, so clients can look parents up in constant time.
 *
 * <p>The map reflects the tree as it was when the map was built; it is not updated by later edits.
 */
public final class ParentMap {
  private final Map<Node, Node> parents = new IdentityHashMap<>();

  private ParentMap() {}

  /** Records the parent of every node under {@code root}. */
  public static ParentMap of(Node root) {
    ParentMap map = new ParentMap();
    map.scan(root);
    return map;
  }

  private void scan(Node node) {
    for (Node child : node.getChildren()) {
      parents.put(child, node);
      scan(child);
    }
  }

  /** Returns the memoized parent of {@code node}, or null for the root and for unknown nodes. */
  public @Nullable Node getParent(Node node) {
    return parents.get(node);
  }
}
