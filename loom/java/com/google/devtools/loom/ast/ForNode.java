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

/** A {@code for target in iter} loop with an optional {@code else} clause. */
public final class ForNode extends Node {
  private Node target;
  private Node iter;
  private List<Node> body;
  private List<Node> orelse;

  public ForNode(Node target, Node iter, List<Node> body, List<Node> orelse) {
    super(NodeKind.FOR);
    this.target = target;
    this.iter = iter;
    this.body = new ArrayList<>(body);
    this.orelse = new ArrayList<>(orelse);
  }

  public Node getTarget() {
    return target;
  }

  public void setTarget(Node target) {
    this.target = target;
  }

  public Node getIter() {
    return iter;
  }

  public void setIter(Node iter) {
    this.iter = iter;
  }

  public List<Node> getBody() {
    return body;
  }

  public List<Node> getOrelse() {
    return orelse;
  }

  @Override
  public @Nullable Object getField(String field) {
    switch (field) {
      case "target":
        return target;
      case "iter":
        return iter;
      case "body":
        return body;
      case "orelse":
        return orelse;
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
      case "iter":
        iter = (Node) value;
        break;
      case "body":
        body = mutableList(value);
        break;
      case "orelse":
        orelse = mutableList(value);
        break;
      default:
        throw noSuchField(field);
    }
  }
}
