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

/** A subscript {@code value[slice]}. */
public final class SubscriptNode extends Node {
  private Node value;
  private Node slice;
  private ExprContext ctx;

  public SubscriptNode(Node value, Node slice, ExprContext ctx) {
    super(NodeKind.SUBSCRIPT);
    this.value = value;
    this.slice = slice;
    this.ctx = ctx;
  }

  public Node getValue() {
    return value;
  }

  public void setValue(Node value) {
    this.value = value;
  }

  public Node getSlice() {
    return slice;
  }

  public void setSlice(Node slice) {
    this.slice = slice;
  }

  public ExprContext getCtx() {
    return ctx;
  }

  @Override
  public @Nullable Object getField(String field) {
    switch (field) {
      case "value":
        return value;
      case "slice":
        return slice;
      case "ctx":
        return ctx;
      default:
        throw noSuchField(field);
    }
  }

  @Override
  public void setField(String field, @Nullable Object value) {
    switch (field) {
      case "value":
        this.value = (Node) value;
        break;
      case "slice":
        slice = (Node) value;
        break;
      case "ctx":
        ctx = (ExprContext) value;
        break;
      default:
        throw noSuchField(field);
    }
  }
}
