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

/** An assignment of one value to one or more chained targets: {@code a = b = value}. */
public final class AssignNode extends Node {
  private List<Node> targets;
  private Node value;

  public AssignNode(List<Node> targets, Node value) {
    super(NodeKind.ASSIGN);
    this.targets = new ArrayList<>(targets);
    this.value = value;
  }

  public List<Node> getTargets() {
    return targets;
  }

  public void setTargets(List<Node> targets) {
    this.targets = new ArrayList<>(targets);
  }

  public Node getValue() {
    return value;
  }

  public void setValue(Node value) {
    this.value = value;
  }

  @Override
  public @Nullable Object getField(String field) {
    switch (field) {
      case "targets":
        return targets;
      case "value":
        return value;
      default:
        throw noSuchField(field);
    }
  }

  @Override
  public void setField(String field, @Nullable Object value) {
    switch (field) {
      case "targets":
        targets = mutableList(value);
        break;
      case "value":
        this.value = (Node) value;
        break;
      default:
        throw noSuchField(field);
    }
  }
}
