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

import com.google.common.collect.ImmutableList;
import com.google.devtools.loom.ast.ExprContext;
import com.google.devtools.loom.ast.NameNode;
import com.google.devtools.loom.ast.Node;
import java.util.ArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Everything known about one module-level name: the node that first binds it and every later
 * occurrence, in source order.
 */
public final class NameEntry {
  private final String name;
  private @Nullable Node definition;
  private final List<Node> references = new ArrayList<>();

  NameEntry(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  /**
   * Returns the node that first binds the name: a {@link NameNode} in a store position, or a
   * function or class definition. Null if the name is only ever read.
   */
  public @Nullable Node getDefinition() {
    return definition;
  }

  /** Returns every occurrence of the name other than its definition, in source order. */
  public ImmutableList<Node> getReferences() {
    return ImmutableList.copyOf(references);
  }

  /** Returns whether {@code occurrence} binds the name rather than reads it. */
  public static boolean isWrite(Node occurrence) {
    switch (occurrence.getKind()) {
      case NAME:
        return ((NameNode) occurrence).getCtx() == ExprContext.STORE;
      case FUNCTION_DEF:
      case CLASS_DEF:
        return true;
      default:
        return false;
    }
  }

  void addOccurrence(Node occurrence) {
    if (definition == null && isWrite(occurrence)) {
      definition = occurrence;
    } else {
      references.add(occurrence);
    }
  }

  @Override
  public String toString() {
    return String.format(
        "%s (defined by %s, %d references)",
        name, definition == null ? "nothing" : definition.getKind(), references.size());
  }
}
