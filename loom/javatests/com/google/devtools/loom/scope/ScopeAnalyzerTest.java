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

import static com.google.common.truth.Truth.assertThat;

import com.google.devtools.loom.ast.AnnotatedTree;
import com.google.devtools.loom.ast.AssignNode;
import com.google.devtools.loom.ast.ExprContext;
import com.google.devtools.loom.ast.IfNode;
import com.google.devtools.loom.ast.NameNode;
import com.google.devtools.loom.ast.Node;
import com.google.devtools.loom.ast.NodeKind;
import com.google.devtools.loom.parser.ParseException;
import com.google.devtools.loom.parser.Parser;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link ScopeAnalyzer}. */
@RunWith(JUnit4.class)
public class ScopeAnalyzerTest {

  @Test
  public void testModuleNames() throws ParseException {
    AnnotatedTree tree = Parser.parse("x = 1\ndef f(y):\n    return x + y\nf(x)\n");
    ScopeTable scope = ScopeAnalyzer.analyze(tree);
    assertThat(scope.getNames().keySet()).containsExactly("x", "f");

    NameEntry x = scope.lookup("x");
    Node definition = x.getDefinition();
    assertThat(definition).isInstanceOf(NameNode.class);
    assertThat(((NameNode) definition).getCtx()).isEqualTo(ExprContext.STORE);
    assertThat(scope.getParent(definition)).isSameInstanceAs(tree.getRoot().getBody().get(0));
    assertThat(x.getReferences()).hasSize(2);
    for (Node reference : x.getReferences()) {
      assertThat(NameEntry.isWrite(reference)).isFalse();
    }

    NameEntry f = scope.lookup("f");
    assertThat(f.getDefinition().getKind()).isEqualTo(NodeKind.FUNCTION_DEF);
    assertThat(f.getReferences()).hasSize(1);
    assertThat(scope.lookup("y")).isNull();
  }

  @Test
  public void testLocalsShadowModuleNames() throws ParseException {
    ScopeTable scope =
        ScopeAnalyzer.analyze(
            Parser.parse(
                "x = 1\n"
                    + "def f():\n"
                    + "    x = 2\n"
                    + "    return x\n"
                    + "def g(x):\n"
                    + "    return x\n"
                    + "def h():\n"
                    + "    for x in range(3):\n"
                    + "        pass\n"
                    + "    return x\n"));
    assertThat(scope.lookup("x").getReferences()).isEmpty();
  }

  @Test
  public void testClassScopeIsInvisibleToMethods() throws ParseException {
    AnnotatedTree tree =
        Parser.parse(
            "x = 1\n"
                + "class C(x):\n"
                + "    x = 2\n"
                + "    y = x\n"
                + "    def m(self):\n"
                + "        return x\n");
    NameEntry x = ScopeAnalyzer.analyze(tree).lookup("x");
    // The base class and the read inside the method; the class body binds its own x.
    assertThat(x.getReferences()).hasSize(2);
  }

  @Test
  public void testDefaultsResolveInEnclosingScope() throws ParseException {
    ScopeTable scope =
        ScopeAnalyzer.analyze(Parser.parse("D = 1\ndef f(D=D):\n    return D\n"));
    assertThat(scope.lookup("D").getReferences()).hasSize(1);
  }

  @Test
  public void testWritesAfterDefinition() throws ParseException {
    AnnotatedTree tree = Parser.parse("x = 1\nx += 2\nx = 3\n");
    NameEntry x = ScopeAnalyzer.analyze(tree).lookup("x");
    assertThat(((AssignNode) tree.getRoot().getBody().get(0)).getTargets())
        .contains(x.getDefinition());
    assertThat(x.getReferences()).hasSize(2);
    for (Node reference : x.getReferences()) {
      assertThat(NameEntry.isWrite(reference)).isTrue();
    }
  }

  @Test
  public void testReadOnlyName() throws ParseException {
    NameEntry print = ScopeAnalyzer.analyze(Parser.parse("print(1)\n")).lookup("print");
    assertThat(print.getDefinition()).isNull();
    assertThat(print.getReferences()).hasSize(1);
  }

  @Test
  public void testParentMap() throws ParseException {
    AnnotatedTree tree = Parser.parse("if a:\n    b = c\n");
    ParentMap parents = ParentMap.of(tree.getRoot());
    Node ifNode = tree.getRoot().getBody().get(0);
    AssignNode assign = (AssignNode) ((IfNode) ifNode).getBody().get(0);
    assertThat(parents.getParent(tree.getRoot())).isNull();
    assertThat(parents.getParent(ifNode)).isSameInstanceAs(tree.getRoot());
    assertThat(parents.getParent(assign)).isSameInstanceAs(ifNode);
    assertThat(parents.getParent(assign.getValue())).isSameInstanceAs(assign);
    assertThat(parents.getParent(new NameNode("c", ExprContext.LOAD))).isNull();
  }
}
