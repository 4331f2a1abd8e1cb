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

/** A chain of {@code and} or {@code or} operands. */
public final class BoolOpNode extends Node {
  private String op;
  private List<Node> values;

  public BoolOpNode(String op, List<Node> values) {
    super(NodeKind.BOOL_OP);
    this.op = op;
    this.values = new ArrayList<>(values);
  }

  public String getOp() {
    return op;
  }

  public void setOp(String op) {
    this.op = op;
  }

  public List<Node> getValues() {
    return values;
  }

  @Override
  public @Nullable Object getField(String field) {
    switch (field) {
      case "op":
        return op;
      case "values":
        return values;
      default:
        throw noSuchField(field);
    }
  }

  @Override
  public void setField(String field, @Nullable Object value) {
    switch (field) {
      case "op":
        op = (String) value;
        break;
      case "values":
        values = mutableList(value);
        break;
      default:
        throw noSuchField(field);
    }
  }
}
