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

/** A keyword argument {@code arg=value} of a call. */
public final class KeywordNode extends Node {
  private String arg;
  private Node value;

  public KeywordNode(String arg, Node value) {
    super(NodeKind.KEYWORD);
    this.arg = arg;
    this.value = value;
  }

  public String getArg() {
    return arg;
  }

  public void setArg(String arg) {
    this.arg = arg;
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
      case "arg":
        return arg;
      case "value":
        return value;
      default:
        throw noSuchField(field);
    }
  }

  @Override
  public void setField(String field, @Nullable Object value) {
    switch (field) {
      case "arg":
        arg = (String) value;
        break;
      case "value":
        this.value = (Node) value;
        break;
      default:
        throw noSuchField(field);
    }
  }
}
