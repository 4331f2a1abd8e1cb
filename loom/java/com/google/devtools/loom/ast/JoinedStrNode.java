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
 * An interpolated string literal. {@code values} alternates between {@link StrNode} text segments
 * and {@link FormattedValueNode} replacement fields, in source order.
 */
public final class JoinedStrNode extends Node {
  private List<Node> values;

  public JoinedStrNode(List<Node> values) {
    super(NodeKind.JOINED_STR);
    this.values = new ArrayList<>(values);
  }

  public List<Node> getValues() {
    return values;
  }

  @Override
  public @Nullable Object getField(String field) {
    switch (field) {
      case "values":
        return values;
      default:
        throw noSuchField(field);
    }
  }

  @Override
  public void setField(String field, @Nullable Object value) {
    switch (field) {
      case "values":
        values = mutableList(value);
        break;
      default:
        throw noSuchField(field);
    }
  }
}
