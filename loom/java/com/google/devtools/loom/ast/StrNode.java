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
 * A text string literal.
 *
 * <p>{@code kind} optionally names a type prefix ({@code "u"}) that must be kept when the literal
 * is written from its value rather than from its original text.
 */
public final class StrNode extends Node {
  private String s;
  private @Nullable String kind;

  public StrNode(String s) {
    this(s, null);
  }

  public StrNode(String s, @Nullable String kind) {
    super(NodeKind.STR);
    this.s = s;
    this.kind = kind;
  }

  public String getS() {
    return s;
  }

  public void setS(String s) {
    this.s = s;
  }

  public @Nullable String getTypePrefix() {
    return kind;
  }

  public void setTypePrefix(@Nullable String kind) {
    this.kind = kind;
  }

  @Override
  public @Nullable Object getField(String field) {
    switch (field) {
      case "s":
        return s;
      case "kind":
        return kind;
      default:
        throw noSuchField(field);
    }
  }

  @Override
  public void setField(String field, @Nullable Object value) {
    switch (field) {
      case "s":
        s = (String) value;
        break;
      case "kind":
        kind = (String) value;
        break;
      default:
        throw noSuchField(field);
    }
  }

  @Override
  public String toString() {
    return "Str(" + s + ")";
  }
}
