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

/** A byte string literal. */
public final class BytesNode extends Node {
  private byte[] s;

  public BytesNode(byte[] s) {
    super(NodeKind.BYTES);
    this.s = s;
  }

  public byte[] getS() {
    return s;
  }

  public void setS(byte[] s) {
    this.s = s;
  }

  @Override
  public @Nullable Object getField(String field) {
    switch (field) {
      case "s":
        return s;
      default:
        throw noSuchField(field);
    }
  }

  @Override
  public void setField(String field, @Nullable Object value) {
    switch (field) {
      case "s":
        s = (byte[]) value;
        break;
      default:
        throw noSuchField(field);
    }
  }
}
