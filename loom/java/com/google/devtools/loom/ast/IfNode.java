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
 * An {@code if} statement. An {@code elif} clause is represented as an {@link IfNode} that is the
 * only statement of its parent's {@code orelse} list.
 */
public final class IfNode extends Node {
  private Node test;
  private List<Node> body;
  private List<Node> orelse;

  public IfNode(Node test, List<Node> body, List<Node> orelse) {
    super(NodeKind.IF);
    this.test = test;
    this.body = new ArrayList<>(body);
    this.orelse = new ArrayList<>(orelse);
  }

  public Node getTest() {
    return test;
  }

  public void setTest(Node test) {
    this.test = test;
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
      case "test":
        return test;
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
      case "test":
        test = (Node) value;
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
