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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Ascii;
import org.checkerframework.checker.nullness.qual.Nullable;

/** A field-less statement: {@code pass}, {@code break} or {@code continue}. */
public final class SimpleStatementNode extends Node {
  private SimpleStatementNode(NodeKind kind) {
    super(kind);
  }

  public static SimpleStatementNode of(NodeKind kind) {
    checkArgument(
        kind == NodeKind.PASS || kind == NodeKind.BREAK || kind == NodeKind.CONTINUE,
        "not a simple statement kind: %s",
        kind);
    return new SimpleStatementNode(kind);
  }

  public static SimpleStatementNode pass() {
    return new SimpleStatementNode(NodeKind.PASS);
  }

  /** Returns the statement's keyword, e.g. {@code "pass"}. */
  public String getKeyword() {
    return Ascii.toLowerCase(getKind().getDisplayName());
  }

  @Override
  public @Nullable Object getField(String field) {
    throw noSuchField(field);
  }

  @Override
  public void setField(String field, @Nullable Object value) {
    throw noSuchField(field);
  }
}
