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

/** An attribute access {@code value.attr}. */
public final class AttributeNode extends Node {
  private Node value;
  private String attr;
  private ExprContext ctx;

  public AttributeNode(Node value, String attr, ExprContext ctx) {
    super(NodeKind.ATTRIBUTE);
    this.value = value;
    this.attr = attr;
    this.ctx = ctx;
  }

  public Node getValue() {
    return value;
  }

  public void setValue(Node value) {
    this.value = value;
  }

  public String getAttr() {
    return attr;
  }

  public void setAttr(String attr) {
    this.attr = attr;
  }

  public ExprContext getCtx() {
    return ctx;
  }

  @Override
  public @Nullable Object getField(String field) {
    switch (field) {
      case "value":
        return value;
      case "attr":
        return attr;
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
      case "attr":
        attr = (String) value;
        break;
      case "ctx":
        ctx = (ExprContext) value;
        break;
      default:
        throw noSuchField(field);
    }
  }
}
