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

import org.checkerframework.checker.nullness.qual.Nullable;

/** An augmented assignment such as {@code total += 1}; {@code op} is the binary operator. */
public final class AugAssignNode extends Node {
  private Node target;
  private String op;
  private Node value;

  public AugAssignNode(Node target, String op, Node value) {
    super(NodeKind.AUG_ASSIGN);
    this.target = target;
    this.op = op;
    this.value = value;
  }

  public Node getTarget() {
    return target;
  }

  public void setTarget(Node target) {
    this.target = target;
  }

  public String getOp() {
    return op;
  }

  public void setOp(String op) {
    this.op = op;
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
      case "target":
        return target;
      case "op":
        return op;
      case "value":
        return value;
      default:
        throw noSuchField(field);
    }
  }

  @Override
  public void setField(String field, @Nullable Object value) {
    switch (field) {
      case "target":
        target = (Node) value;
        break;
      case "op":
        op = (String) value;
        break;
      case "value":
        this.value = (Node) value;
        break;
      default:
        throw noSuchField(field);
    }
  }
}
