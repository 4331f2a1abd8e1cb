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

/** A class definition with its base class expressions. */
public final class ClassDefNode extends Node {
  private String name;
  private List<Node> bases;
  private List<Node> body;

  public ClassDefNode(String name, List<Node> bases, List<Node> body) {
    super(NodeKind.CLASS_DEF);
    this.name = name;
    this.bases = new ArrayList<>(bases);
    this.body = new ArrayList<>(body);
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public List<Node> getBases() {
    return bases;
  }

  public List<Node> getBody() {
    return body;
  }

  @Override
  public @Nullable Object getField(String field) {
    switch (field) {
      case "name":
        return name;
      case "bases":
        return bases;
      case "body":
        return body;
      default:
        throw noSuchField(field);
    }
  }

  @Override
  public void setField(String field, @Nullable Object value) {
    switch (field) {
      case "name":
        name = (String) value;
        break;
      case "bases":
        bases = mutableList(value);
        break;
      case "body":
        body = mutableList(value);
        break;
      default:
        throw noSuchField(field);
    }
  }
}
