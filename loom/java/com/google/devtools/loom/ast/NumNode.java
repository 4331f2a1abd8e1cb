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
 * A numeric literal. The value is a {@link Long}, a {@link java.math.BigInteger} for integers that
 * do not fit, or a {@link Double}.
 */
public final class NumNode extends Node {
  private Number n;

  public NumNode(Number n) {
    super(NodeKind.NUM);
    this.n = n;
  }

  public Number getN() {
    return n;
  }

  public void setN(Number n) {
    this.n = n;
  }

  @Override
  public @Nullable Object getField(String field) {
    switch (field) {
      case "n":
        return n;
      default:
        throw noSuchField(field);
    }
  }

  @Override
  public void setField(String field, @Nullable Object value) {
    switch (field) {
      case "n":
        n = (Number) value;
        break;
      default:
        throw noSuchField(field);
    }
  }

  @Override
  public String toString() {
    return "Num(" + n + ")";
  }
}
