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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.devtools.loom.codegen.CodeGen;
import com.google.devtools.loom.parser.ParseException;
import com.google.devtools.loom.parser.Parser;
import java.util.ArrayList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link TreeEdits}. */
@RunWith(JUnit4.class)
public class TreeEditsTest {

  @Test
  public void testReplaceSingleChild() throws ParseException {
    AnnotatedTree tree = Parser.parse("y = x\n");
    AssignNode assign = (AssignNode) tree.getRoot().getBody().get(0);
    Node x = assign.getValue();
    NumNode one = new NumNode(1);
    TreeEdits.replaceChild(assign, x, one);
    assertThat(assign.getValue()).isSameInstanceAs(one);
    assertThat(CodeGen.toSource(tree)).isEqualTo("y = 1\n");
  }

  @Test
  public void testReplaceChildInList() throws ParseException {
    AnnotatedTree tree = Parser.parse("f(a, b, c)\n");
    CallNode call = (CallNode) ((ExprNode) tree.getRoot().getBody().get(0)).getValue();
    Node b = call.getArgs().get(1);
    TreeEdits.replaceChild(call, b, new NameNode("z", ExprContext.LOAD));
    assertThat(CodeGen.toSource(tree)).isEqualTo("f(a, z, c)\n");
  }

  @Test
  public void testRemoveChild() throws ParseException {
    AnnotatedTree tree = Parser.parse("a = 1\nb = 2\nc = 3\n");
    ModuleNode module = tree.getRoot();
    TreeEdits.removeChild(module, module.getBody().get(1));
    assertThat(CodeGen.toSource(tree)).isEqualTo("a = 1\nc = 3\n");
  }

  @Test
  public void testRemovingLastStatementOfBlockInsertsPass() throws ParseException {
    AnnotatedTree tree = Parser.parse("if a:\n    b = 1\nelse:\n    c = 2\n");
    IfNode ifNode = (IfNode) tree.getRoot().getBody().get(0);
    TreeEdits.removeChild(ifNode, ifNode.getBody().get(0));
    assertThat(ifNode.getBody()).hasSize(1);
    assertThat(ifNode.getBody().get(0).getKind()).isEqualTo(NodeKind.PASS);
    assertThat(CodeGen.toSource(tree)).isEqualTo("if a:\n    pass\nelse:\n    c = 2\n");

    // An emptied else clause simply disappears.
    TreeEdits.removeChild(ifNode, ifNode.getOrelse().get(0));
    assertThat(ifNode.getOrelse()).isEmpty();
    assertThat(CodeGen.toSource(tree)).isEqualTo("if a:\n    pass\n");
  }

  @Test
  public void testRemovingLastStatementOfModule() throws ParseException {
    AnnotatedTree tree = Parser.parse("x = 1\n# end\n");
    ModuleNode module = tree.getRoot();
    TreeEdits.removeChild(module, module.getBody().get(0));
    assertThat(module.getBody()).isEmpty();
    assertThat(CodeGen.toSource(tree)).isEqualTo("# end\n");
  }

  @Test
  public void testMissingChild() {
    ModuleNode module = new ModuleNode(new ArrayList<>());
    NameNode stranger = new NameNode("x", ExprContext.LOAD);
    InvalidTreeException e =
        assertThrows(
            InvalidTreeException.class,
            () -> TreeEdits.replaceChild(module, stranger, new NumNode(1)));
    assertThat(e).hasMessageThat().contains("Unable to find child");
    assertThrows(InvalidTreeException.class, () -> TreeEdits.removeChild(module, stranger));
  }
}
