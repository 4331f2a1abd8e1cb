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

package com.google.devtools.loom.augment;

import com.google.common.flogger.FluentLogger;
import com.google.devtools.loom.ast.AnnotatedTree;
import com.google.devtools.loom.ast.AssignNode;
import com.google.devtools.loom.ast.Node;
import com.google.devtools.loom.ast.NodeCopier;
import com.google.devtools.loom.ast.NodeKind;
import com.google.devtools.loom.ast.TreeEdits;
import com.google.devtools.loom.scope.NameEntry;
import com.google.devtools.loom.scope.ScopeAnalyzer;
import com.google.devtools.loom.scope.ScopeTable;

/**
 * Replaces every read of a module-level constant with a copy of its value and removes the
 * definition.
 *
 * <p>A name qualifies as a constant if it is bound exactly once, by a plain assignment statement at
 * the top level of the module, and is never rebound anywhere. The copies carry the formatting of
 * the assigned value, so {@code X = "foo"} inlines as {@code "foo"} rather than {@code 'foo'}.
 */
public final class ConstantInliner {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private ConstantInliner() {}

  /**
   * Inlines the module-level constant {@code name} in place.
   *
   * @throws InlineException if {@code name} is not a constant, in which case the tree is unchanged
   */
  public static void inlineName(AnnotatedTree tree, String name) throws InlineException {
    ScopeTable scope = ScopeAnalyzer.analyze(tree);
    NameEntry entry = scope.lookup(name);
    if (entry == null || entry.getDefinition() == null) {
      throw new InlineException(String.format("'%s' is not declared", name));
    }
    Node definition = entry.getDefinition();
    if (definition.getKind() != NodeKind.NAME) {
      throw new InlineException(
          String.format("'%s' is not a constant; it has type %s", name, definition.getKind()));
    }
    Node parent = scope.getParent(definition);
    if (parent == null || parent.getKind() != NodeKind.ASSIGN) {
      throw new InlineException(String.format("'%s' is not declared in an assignment", name));
    }
    AssignNode assignment = (AssignNode) parent;
    Node statementParent = scope.getParent(assignment);
    if (statementParent == null || statementParent.getKind() != NodeKind.MODULE) {
      throw new InlineException(String.format("'%s' is not a top-level name", name));
    }
    for (Node reference : entry.getReferences()) {
      if (NameEntry.isWrite(reference)) {
        throw new InlineException(String.format("'%s' is not a constant", name));
      }
    }

    for (Node reference : entry.getReferences()) {
      Node copy = NodeCopier.copy(assignment.getValue(), tree.getFormatting());
      TreeEdits.replaceChild(scope.getParent(reference), reference, copy);
    }
    if (assignment.getTargets().size() == 1) {
      TreeEdits.removeChild(statementParent, assignment);
    } else {
      assignment.getTargets().remove(definition);
    }
    logger.atFine().log("Inlined %d reads of '%s'", entry.getReferences().size(), name);
  }
}
