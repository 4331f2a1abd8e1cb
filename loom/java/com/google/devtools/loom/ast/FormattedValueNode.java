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

/**
 * A replacement field <code>{value!conversion:format_spec}</code> of an interpolated string. The
 * conversion is one of {@code "r"}, {@code "s"} or {@code "a"}, or null; the format spec, when
 * present, is itself a {@link JoinedStrNode}.
 */
public final class FormattedValueNode extends Node {
  private Node value;
  private @Nullable String conversion;
  private @Nullable Node formatSpec;

  public FormattedValueNode(Node value, @Nullable String conversion, @Nullable Node formatSpec) {
    super(NodeKind.FORMATTED_VALUE);
    this.value = value;
    this.conversion = conversion;
    this.formatSpec = formatSpec;
  }

  public Node getValue() {
    return value;
  }

  public void setValue(Node value) {
    this.value = value;
  }

  public @Nullable String getConversion() {
    return conversion;
  }

  public void setConversion(@Nullable String conversion) {
    this.conversion = conversion;
  }

  public @Nullable Node getFormatSpec() {
    return formatSpec;
  }

  public void setFormatSpec(@Nullable Node formatSpec) {
    this.formatSpec = formatSpec;
  }

  @Override
  public @Nullable Object getField(String field) {
    switch (field) {
      case "value":
        return value;
      case "conversion":
        return conversion;
      case "format_spec":
        return formatSpec;
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
      case "conversion":
        conversion = (String) value;
        break;
      case "format_spec":
        formatSpec = (Node) value;
        break;
      default:
        throw noSuchField(field);
    }
  }
}
