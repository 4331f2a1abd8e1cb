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

/** A reference to a name, either read ({@link ExprContext#LOAD}) or bound. */
public final class NameNode extends Node {
  private String id;
  private ExprContext ctx;

  public NameNode(String id, ExprContext ctx) {
    super(NodeKind.NAME);
    this.id = id;
    this.ctx = ctx;
  }

  public String getId() {
    return id;
  }

  public void setId(String id) {
    this.id = id;
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
      case "id":
        return id;
      case "ctx":
        return ctx;
      default:
        throw noSuchField(field);
    }
  }

  @Override
  public void setField(String field, @Nullable Object value) {
    switch (field) {
      case "id":
        id = (String) value;
        break;
      case "ctx":
        ctx = (ExprContext) value;
        break;
      default:
        throw noSuchField(field);
    }
  }

  @Override
  public String toString() {
    return "Name(" + id + ")";
  }
}
