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

/** A unary operation: {@code -x}, {@code +x}, {@code ~x} or {@code not x}. */
public final class UnaryOpNode extends Node {
  private String op;
  private Node operand;

  public UnaryOpNode(String op, Node operand) {
    super(NodeKind.UNARY_OP);
    this.op = op;
    this.operand = operand;
  }

  public String getOp() {
    return op;
  }

  public void setOp(String op) {
    this.op = op;
  }

  public Node getOperand() {
    return operand;
  }

  public void setOperand(Node operand) {
    this.operand = operand;
  }

  @Override
  public @Nullable Object getField(String field) {
    switch (field) {
      case "op":
        return op;
      case "operand":
        return operand;
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
      case "operand":
        operand = (Node) value;
        break;
      default:
        throw noSuchField(field);
    }
  }
}
