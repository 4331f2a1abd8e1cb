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

/** A binary operation; {@code op} is the operator as written, e.g. {@code "+"} or {@code "//"}. */
public final class BinOpNode extends Node {
  private Node left;
  private String op;
  private Node right;

  public BinOpNode(Node left, String op, Node right) {
    super(NodeKind.BIN_OP);
    this.left = left;
    this.op = op;
    this.right = right;
  }

  public Node getLeft() {
    return left;
  }

  public void setLeft(Node left) {
    this.left = left;
  }

  public String getOp() {
    return op;
  }

  public void setOp(String op) {
    this.op = op;
  }

  public Node getRight() {
    return right;
  }

  public void setRight(Node right) {
    this.right = right;
  }

  @Override
  public @Nullable Object getField(String field) {
    switch (field) {
      case "left":
        return left;
      case "op":
        return op;
      case "right":
        return right;
      default:
        throw noSuchField(field);
    }
  }

  @Override
  public void setField(String field, @Nullable Object value) {
    switch (field) {
      case "left":
        left = (Node) value;
        break;
      case "op":
        op = (String) value;
        break;
      case "right":
        right = (Node) value;
        break;
      default:
        throw noSuchField(field);
    }
  }
}
