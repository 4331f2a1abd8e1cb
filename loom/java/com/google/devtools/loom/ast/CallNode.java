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

/** A call; positional arguments always precede {@link KeywordNode} arguments. */
public final class CallNode extends Node {
  private Node func;
  private List<Node> args;
  private List<Node> keywords;

  public CallNode(Node func, List<Node> args, List<Node> keywords) {
    super(NodeKind.CALL);
    this.func = func;
    this.args = new ArrayList<>(args);
    this.keywords = new ArrayList<>(keywords);
  }

  public Node getFunc() {
    return func;
  }

  public void setFunc(Node func) {
    this.func = func;
  }

  public List<Node> getArgs() {
    return args;
  }

  public List<Node> getKeywords() {
    return keywords;
  }

  @Override
  public @Nullable Object getField(String field) {
    switch (field) {
      case "func":
        return func;
      case "args":
        return args;
      case "keywords":
        return keywords;
      default:
        throw noSuchField(field);
    }
  }

  @Override
  public void setField(String field, @Nullable Object value) {
    switch (field) {
      case "func":
        func = (Node) value;
        break;
      case "args":
        args = mutableList(value);
        break;
      case "keywords":
        keywords = mutableList(value);
        break;
      default:
        throw noSuchField(field);
    }
  }
}
