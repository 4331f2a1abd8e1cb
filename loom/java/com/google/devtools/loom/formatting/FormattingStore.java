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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.devtools.loom.ast.Node;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Per-node archive of the formatting read from source text.
 *
 * <p>Entries are keyed by node identity and attribute name. An entry is either a raw text
 * fragment to be written verbatim, a boolean syntax marker (such as {@code is_elif}), or a snapshot
 * of one of the node's fields stored under {@code <field>__src}. A snapshot records the value the
 * field held when the fragments that depend on it were recorded. Comparing it with the live value
 * is left to the printer.
 *
 * <p>The store never owns nodes and entries are never removed when the tree is edited.
 */
public final class FormattingStore {
  /** Suffix of the attribute under which a field's snapshot is stored. */
  public static final String SNAPSHOT_SUFFIX = "__src";

  private final Map<Node, Map<String, Object>> entries = new IdentityHashMap<>();

  /** Returns the text fragment stored for {@code attr}, or null if there is none. */
  public @Nullable String get(Node node, String attr) {
    Object value = lookup(node, attr);
    return value instanceof String ? (String) value : null;
  }

  /** Returns whether any value, including a snapshot or a marker, is stored for {@code attr}. */
  public boolean has(Node node, String attr) {
    Map<String, Object> attrs = entries.get(node);
    return attrs != null && attrs.containsKey(attr);
  }

  /** Returns the boolean marker stored for {@code attr}, or false if there is none. */
  public boolean getFlag(Node node, String attr) {
    return Boolean.TRUE.equals(lookup(node, attr));
  }

  public void set(Node node, String attr, String fragment) {
    attrs(node).put(attr, fragment);
  }

  public void setFlag(Node node, String attr, boolean value) {
    attrs(node).put(attr, value);
  }

  /** Records the current value of {@code field} as the snapshot its fragments depend on. */
  public void recordDependency(Node node, String field) {
    attrs(node).put(field + SNAPSHOT_SUFFIX, snapshotOf(node.getField(field)));
  }

  /** Returns whether a snapshot of {@code field} has been recorded. */
  public boolean hasSnapshot(Node node, String field) {
    return has(node, field + SNAPSHOT_SUFFIX);
  }

  /** Returns the recorded snapshot of {@code field}, or null. */
  public @Nullable Object getSnapshot(Node node, String field) {
    return lookup(node, field + SNAPSHOT_SUFFIX);
  }

  /** Copies every entry of {@code from} onto {@code to}, replacing entries of the same name. */
  public void copy(Node from, Node to) {
    Map<String, Object> source = entries.get(from);
    if (source != null && !source.isEmpty()) {
      attrs(to).putAll(source);
    }
  }

  /** Returns all entries of a node in the order they were first recorded. */
  public ImmutableMap<String, Object> entries(Node node) {
    Map<String, Object> attrs = entries.get(node);
    return attrs == null ? ImmutableMap.of() : ImmutableMap.copyOf(attrs);
  }

  private @Nullable Object lookup(Node node, String attr) {
    Map<String, Object> attrs = entries.get(node);
    return attrs == null ? null : attrs.get(attr);
  }

  private Map<String, Object> attrs(Node node) {
    return entries.computeIfAbsent(node, n -> new LinkedHashMap<>());
  }

  private static @Nullable Object snapshotOf(@Nullable Object value) {
    if (value instanceof List) {
      return ImmutableList.copyOf((List<?>) value);
    } else if (value instanceof byte[]) {
      return ((byte[]) value).clone();
    }
    return value;
  }
}
