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
 * The parameter list of a function definition. As in the grammar, {@code defaults} belong to the
 * last {@code defaults.size()} parameters.
 */
public final class ArgumentsNode extends Node {
  private List<Node> args;
  private List<Node> defaults;

  public ArgumentsNode(List<Node> args, List<Node> defaults) {
    super(NodeKind.ARGUMENTS);
    this.args = new ArrayList<>(args);
    this.defaults = new ArrayList<>(defaults);
  }

  public List<Node> getArgs() {
    return args;
  }

  public List<Node> getDefaults() {
    return defaults;
  }

  @Override
  public @Nullable Object getField(String field) {
    switch (field) {
      case "args":
        return args;
      case "defaults":
        return defaults;
      default:
        throw noSuchField(field);
    }
  }

  @Override
  public void setField(String field, @Nullable Object value) {
    switch (field) {
      case "args":
        args = mutableList(value);
        break;
      case "defaults":
        defaults = mutableList(value);
        break;
      default:
        throw noSuchField(field);
    }
  }
}
