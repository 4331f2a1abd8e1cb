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

/** A single named parameter. */
public final class ArgNode extends Node {
  private String arg;

  public ArgNode(String arg) {
    super(NodeKind.ARG);
    this.arg = arg;
  }

  public String getArg() {
    return arg;
  }

  public void setArg(String arg) {
    this.arg = arg;
  }

  @Override
  public @Nullable Object getField(String field) {
    switch (field) {
      case "arg":
        return arg;
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
      default:
        throw noSuchField(field);
    }
  }
}
