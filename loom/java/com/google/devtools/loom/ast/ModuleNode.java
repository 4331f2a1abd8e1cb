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

/** The root of a parsed file. */
public final class ModuleNode extends Node {
  private List<Node> body;

  public ModuleNode(List<Node> body) {
    super(NodeKind.MODULE);
    this.body = new ArrayList<>(body);
  }

  public List<Node> getBody() {
    return body;
  }

  public void setBody(List<Node> body) {
    this.body = new ArrayList<>(body);
  }

  @Override
  public @Nullable Object getField(String field) {
    switch (field) {
      case "body":
        return body;
      default:
        throw noSuchField(field);
    }
  }

  @Override
  public void setField(String field, @Nullable Object value) {
    switch (field) {
      case "body":
        body = mutableList(value);
        break;
      default:
        throw noSuchField(field);
    }
  }
}
