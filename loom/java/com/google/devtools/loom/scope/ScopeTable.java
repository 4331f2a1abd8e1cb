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

import com.google.common.collect.ImmutableMap;
import com.google.devtools.loom.ast.Node;
import org.checkerframework.checker.nullness.qual.Nullable;

/** The module-level names of a tree, with a parent lookup for the nodes that mention them. */
public final class ScopeTable {
  private final ImmutableMap<String, NameEntry> names;
  private final ParentMap parents;

  ScopeTable(ImmutableMap<String, NameEntry> names, ParentMap parents) {
    this.names = names;
    this.parents = parents;
  }

  /** Returns the entry for a module-level name, or null if the module never mentions it. */
  public @Nullable NameEntry lookup(String name) {
    return names.get(name);
  }

  /** Returns all module-level names in order of first occurrence. */
  public ImmutableMap<String, NameEntry> getNames() {
    return names;
  }

  /** Returns the parent of {@code node} as of the analysis. */
  public @Nullable Node getParent(Node node) {
    return parents.getParent(node);
  }
}
