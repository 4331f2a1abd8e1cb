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

/** A list display {@code [a, b]}. */
public final class ListNode extends Node {
  private List<Node> elts;
  private ExprContext ctx;

  public ListNode(List<Node> elts, ExprContext ctx) {
    super(NodeKind.LIST);
    this.elts = new ArrayList<>(elts);
    this.ctx = ctx;
  }

  public List<Node> getElts() {
    return elts;
  }

  public ExprContext getCtx() {
    return ctx;
  }

  public void setCtx(ExprContext ctx) {
    this.ctx = ctx;
  }

  @Override
  public @Nullable Object getField(String field) {
    switch (field) {
      case "elts":
        return elts;
      case "ctx":
        return ctx;
      default:
        throw noSuchField(field);
    }
  }

  @Override
  public void setField(String field, @Nullable Object value) {
    switch (field) {
      case "elts":
        elts = mutableList(value);
        break;
      case "ctx":
        ctx = (ExprContext) value;
        break;
      default:
        throw noSuchField(field);
    }
  }
}
