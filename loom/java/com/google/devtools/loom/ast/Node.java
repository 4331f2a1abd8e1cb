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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A node of a syntax tree.
 *
 * <p>Each node is owned by exactly one field of its parent. Nodes hold no reference to their parent
 * and no formatting; both live in side tables keyed by node identity (see {@code ParentMap} and
 * {@code FormattingStore}). For that reason {@link #equals} and {@link #hashCode} are identity
 * based.
 *
 * <p>Besides the typed accessors of each concrete class, every field can be reached by name through
 * {@link #getField} and {@link #setField}. List-valued fields are returned live, so edits made
 * through the returned list are edits of the tree.
 */
public abstract class Node {
  private final NodeKind kind;

  protected Node(NodeKind kind) {
    this.kind = kind;
  }

  public final NodeKind getKind() {
    return kind;
  }

  /** Returns the names of this node's fields, in source order. */
  public final ImmutableList<String> getFieldNames() {
    return kind.getFields();
  }

  /**
   * Returns the current value of the named field: a {@link Node}, a {@code List<Node>}, a scalar,
   * or null.
   *
   * @throws IllegalArgumentException if this kind of node has no such field.
   */
  public abstract @Nullable Object getField(String field);

  /**
   * Replaces the value of the named field.
   *
   * @throws IllegalArgumentException if this kind of node has no such field.
   * @throws ClassCastException if the value has the wrong type for the field.
   */
  public abstract void setField(String field, @Nullable Object value);

  /** Returns the direct children of this node, in field order. */
  public final ImmutableList<Node> getChildren() {
    ImmutableList.Builder<Node> children = ImmutableList.builder();
    for (String field : getFieldNames()) {
      Object value = getField(field);
      if (value instanceof Node) {
        children.add((Node) value);
      } else if (value instanceof List) {
        for (Object item : (List<?>) value) {
          if (item instanceof Node) {
            children.add((Node) item);
          }
        }
      }
    }
    return children.build();
  }

  @Override
  public String toString() {
    return kind.getDisplayName();
  }

  protected final IllegalArgumentException noSuchField(String field) {
    return new IllegalArgumentException(kind.getDisplayName() + " has no field named " + field);
  }

  /** Copies a field value given as an untyped list into a fresh mutable list. */
  @SuppressWarnings("unchecked")
  protected static <T> List<T> mutableList(@Nullable Object value) {
    return value == null ? new ArrayList<>() : new ArrayList<>((List<T>) value);
  }
}
