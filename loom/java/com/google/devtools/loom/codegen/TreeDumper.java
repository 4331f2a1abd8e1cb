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

package com.google.devtools.loom.codegen;

import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;
import com.google.devtools.loom.ast.Node;
import com.google.devtools.loom.formatting.FormattingStore;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/** Renders a tree and its formatting as an indented outline. */
final class TreeDumper {
  private static final String STEP = "  ";
  private static final Escaper ESCAPER =
      Escapers.builder()
          .addEscape('\\', "\\\\")
          .addEscape('"', "\\\"")
          .addEscape('\n', "\\n")
          .addEscape('\r', "\\r")
          .addEscape('\t', "\\t")
          .build();

  private final FormattingStore formatting;
  private final StringBuilder out = new StringBuilder();

  TreeDumper(FormattingStore formatting) {
    this.formatting = formatting;
  }

  String dump(Node node) {
    dumpNode(node, "");
    return out.toString();
  }

  private void dumpNode(Node node, String indent) {
    out.append(indent).append(node.getKind()).append('\n');
    for (Map.Entry<String, Object> entry : formatting.entries(node).entrySet()) {
      out.append(indent).append(STEP).append(entry.getKey()).append(" -> ");
      appendValue(entry.getValue());
      out.append('\n');
    }
    for (String field : node.getFieldNames()) {
      Object value = node.getField(field);
      if (value == null) {
        continue;
      }
      out.append(indent).append(STEP).append(field);
      if (value instanceof Node) {
        out.append('\n');
        dumpNode((Node) value, indent + STEP + STEP);
      } else if (value instanceof List) {
        out.append('\n');
        for (Object item : (List<?>) value) {
          if (item instanceof Node) {
            dumpNode((Node) item, indent + STEP + STEP);
          } else {
            out.append(indent).append(STEP).append(STEP);
            appendValue(item);
            out.append('\n');
          }
        }
      } else {
        out.append(": ");
        appendValue(value);
        out.append('\n');
      }
    }
  }

  private void appendValue(Object value) {
    if (value instanceof String) {
      out.append('"').append(ESCAPER.escape((String) value)).append('"');
    } else if (value instanceof byte[]) {
      out.append(Literals.reprBytes((byte[]) value));
    } else if (value instanceof List) {
      out.append(Arrays.toString(((List<?>) value).toArray()));
    } else {
      out.append(value);
    }
  }
}
