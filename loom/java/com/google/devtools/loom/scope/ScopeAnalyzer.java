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

package com.google.devtools.loom.scope;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import com.google.devtools.loom.ast.AnnotatedTree;
import com.google.devtools.loom.ast.ArgNode;
import com.google.devtools.loom.ast.ClassDefNode;
import com.google.devtools.loom.ast.ExprContext;
import com.google.devtools.loom.ast.FunctionDefNode;
import com.google.devtools.loom.ast.ModuleNode;
import com.google.devtools.loom.ast.NameNode;
import com.google.devtools.loom.ast.Node;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Finds every occurrence of each module-level name.
 *
 * <p>Function and class bodies open scopes of their own: a name bound anywhere in a body (by
 * assignment, loop target, parameter, or nested definition) is local to that body, and its
 * occurrences there are not occurrences of the module-level name. Names in class bodies are not
 * visible to the functions nested in them. Parameter defaults and base classes are evaluated in the
 * enclosing scope.
 */
public final class ScopeAnalyzer {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private enum ScopeKind {
    MODULE,
    FUNCTION,
    CLASS
  }

  private static final class Scope {
    final ScopeKind kind;
    final @Nullable Scope parent;
    final Set<String> locals;

    Scope(ScopeKind kind, @Nullable Scope parent, Set<String> locals) {
      this.kind = kind;
      this.parent = parent;
      this.locals = locals;
    }
  }

  private final Map<String, NameEntry> names = new LinkedHashMap<>();

  private ScopeAnalyzer() {}

  public static ScopeTable analyze(AnnotatedTree tree) {
    return analyze(tree.getRoot());
  }

  public static ScopeTable analyze(ModuleNode root) {
    ScopeAnalyzer analyzer = new ScopeAnalyzer();
    analyzer.visitAll(root.getBody(), new Scope(ScopeKind.MODULE, null, ImmutableSet.of()));
    logger.atFine().log("Found module-level names %s", analyzer.names.keySet());
    return new ScopeTable(ImmutableMap.copyOf(analyzer.names), ParentMap.of(root));
  }

  private void visitAll(List<Node> nodes, Scope scope) {
    for (Node node : nodes) {
      visit(node, scope);
    }
  }

  private void visit(Node node, Scope scope) {
    switch (node.getKind()) {
      case NAME:
        {
          String id = ((NameNode) node).getId();
          if (isModuleLevel(id, scope)) {
            record(id, node);
          }
          return;
        }
      case FUNCTION_DEF:
        {
          FunctionDefNode def = (FunctionDefNode) node;
          if (isModuleLevel(def.getName(), scope)) {
            record(def.getName(), def);
          }
          visitAll(def.getArgs().getDefaults(), scope);
          Set<String> locals = new HashSet<>();
          for (Node arg : def.getArgs().getArgs()) {
            locals.add(((ArgNode) arg).getArg());
          }
          collectBindings(def.getBody(), locals);
          visitAll(def.getBody(), new Scope(ScopeKind.FUNCTION, scope, locals));
          return;
        }
      case CLASS_DEF:
        {
          ClassDefNode def = (ClassDefNode) node;
          if (isModuleLevel(def.getName(), scope)) {
            record(def.getName(), def);
          }
          visitAll(def.getBases(), scope);
          Set<String> locals = new HashSet<>();
          collectBindings(def.getBody(), locals);
          visitAll(def.getBody(), new Scope(ScopeKind.CLASS, scope, locals));
          return;
        }
      default:
        visitAll(node.getChildren(), scope);
    }
  }

  private void record(String name, Node occurrence) {
    names.computeIfAbsent(name, NameEntry::new).addOccurrence(occurrence);
  }

  /** Returns whether {@code id}, seen in {@code scope}, resolves to the module-level name. */
  private static boolean isModuleLevel(String id, Scope scope) {
    boolean innermost = true;
    for (Scope s = scope; s.kind != ScopeKind.MODULE; s = s.parent) {
      if ((innermost || s.kind != ScopeKind.CLASS) && s.locals.contains(id)) {
        return false;
      }
      innermost = false;
    }
    return true;
  }

  /** Adds the names bound directly in {@code body}, not descending into nested definitions. */
  private static void collectBindings(List<Node> body, Set<String> into) {
    for (Node node : body) {
      switch (node.getKind()) {
        case NAME:
          NameNode name = (NameNode) node;
          if (name.getCtx() == ExprContext.STORE) {
            into.add(name.getId());
          }
          break;
        case FUNCTION_DEF:
          into.add(((FunctionDefNode) node).getName());
          break;
        case CLASS_DEF:
          into.add(((ClassDefNode) node).getName());
          break;
        default:
          collectBindings(node.getChildren(), into);
      }
    }
  }
}
