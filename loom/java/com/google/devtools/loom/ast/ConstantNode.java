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

/** One of the built-in singleton constants. */
public final class ConstantNode extends Node {
  /** The singleton values and their spelling. */
  public enum Value {
    NONE("None"),
    TRUE("True"),
    FALSE("False"),
    ELLIPSIS("...");

    private final String spelling;

    Value(String spelling) {
      this.spelling = spelling;
    }

    public String getSpelling() {
      return spelling;
    }
  }

  private Value value;

  public ConstantNode(Value value) {
    super(NodeKind.CONSTANT);
    this.value = value;
  }

  public Value getValue() {
    return value;
  }

  public void setValue(Value value) {
    this.value = value;
  }

  @Override
  public @Nullable Object getField(String field) {
    switch (field) {
      case "value":
        return value;
      default:
        throw noSuchField(field);
    }
  }

  @Override
  public void setField(String field, @Nullable Object value) {
    switch (field) {
      case "value":
        this.value = (Value) value;
        break;
      default:
        throw noSuchField(field);
    }
  }
}
