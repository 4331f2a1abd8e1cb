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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.devtools.loom.ast.AnnotatedTree;
import com.google.devtools.loom.ast.AssignNode;
import com.google.devtools.loom.ast.Node;
import com.google.devtools.loom.ast.Trees;
import com.google.devtools.loom.codegen.CodeGen;
import com.google.devtools.loom.parser.ParseException;
import com.google.devtools.loom.parser.Parser;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link ConstantInliner}. */
@RunWith(JUnit4.class)
public class ConstantInlinerTest {

  @Test
  public void testInlineSimple() throws Exception {
    assertThat(inline("x = 1\na = x\n", "x")).isEqualTo("a = 1\n");
  }

  @Test
  public void testInlineChained() throws Exception {
    assertThat(inline("x = y = z = 1\na = x + y\n", "y")).isEqualTo("x = z = 1\na = x + 1\n");
  }

  @Test
  public void testInlineMultipleReads() throws Exception {
    String source =
        "CONSTANT = \"foo\"\n"
            + "def a(b=CONSTANT):\n"
            + "  return b == CONSTANT\n";
    assertThat(inline(source, "CONSTANT"))
        .isEqualTo("def a(b=\"foo\"):\n  return b == \"foo\"\n");
  }

  @Test
  public void testInlineKeepsValueFormatting() throws Exception {
    String source = "# Limits.\nLIMIT = ( 0x10 )  # hex\n\nprint(LIMIT, LIMIT*2)\n";
    assertThat(inline(source, "LIMIT")).isEqualTo("\nprint(( 0x10 ), ( 0x10 )*2)\n");
  }

  @Test
  public void testInlineUnusedConstant() throws Exception {
    assertThat(inline("X = 1\nY = 2\n", "X")).isEqualTo("Y = 2\n");
  }

  @Test
  public void testInlineLastStatementOfBlock() throws Exception {
    assertThat(inline("X = 1\nif a:\n    b = X\n", "X")).isEqualTo("if a:\n    b = 1\n");
  }

  @Test
  public void testInlineAfterKeywords() throws Exception {
    String source =
        "X = \"foo\"\n"
            + "def f():\n"
            + "  return X\n"
            + "if X:\n"
            + "  pass\n"
            + "elif  X:\n"
            + "  pass\n"
            + "while not X:\n"
            + "  pass\n"
            + "for a in X:\n"
            + "  pass\n";
    assertThat(inline(source, "X"))
        .isEqualTo(
            "def f():\n"
                + "  return \"foo\"\n"
                + "if \"foo\":\n"
                + "  pass\n"
                + "elif  \"foo\":\n"
                + "  pass\n"
                + "while not \"foo\":\n"
                + "  pass\n"
                + "for a in \"foo\":\n"
                + "  pass\n");
  }

  @Test
  public void testInlineParenthesizesLooserValue() throws Exception {
    String source =
        "X = 1 + 2\n"
            + "y = X * 3\n"
            + "z = 1 - X\n"
            + "w = X - 1\n"
            + "v = -X ** X\n"
            + "u = X.real\n";
    assertThat(inline(source, "X"))
        .isEqualTo(
            "y = (1 + 2) * 3\n"
                + "z = 1 - (1 + 2)\n"
                + "w = 1 + 2 - 1\n"
                + "v = -(1 + 2) ** (1 + 2)\n"
                + "u = (1 + 2).real\n");
  }

  @Test
  public void testInlineParenthesizesBooleanAndTupleValues() throws Exception {
    assertThat(inline("X = a or b\nif not X:\n  c = [X, X == 1]\n", "X"))
        .isEqualTo("if not (a or b):\n  c = [a or b, (a or b) == 1]\n");
    assertThat(inline("X = 1, 2\nf(X)\ny = X\n", "X")).isEqualTo("f((1, 2))\ny = 1, 2\n");
  }

  @Test
  public void testInlineKeepsRecordedParentheses() throws Exception {
    assertThat(inline("X = (1 + 2)\ny = X * 3\n", "X")).isEqualTo("y = (1 + 2) * 3\n");
  }

  @Test
  public void testCopiesAreIndependent() throws Exception {
    AnnotatedTree tree = Parser.parse("X = [1]\na = X\nb = X\n");
    ConstantInliner.inlineName(tree, "X");
    Node first = ((AssignNode) tree.getRoot().getBody().get(0)).getValue();
    Node second = ((AssignNode) tree.getRoot().getBody().get(1)).getValue();
    assertThat(first).isNotSameInstanceAs(second);
    assertThat(Trees.structurallyEqual(first, second)).isTrue();
    assertThat(CodeGen.toSource(tree)).isEqualTo("a = [1]\nb = [1]\n");
  }

  @Test
  public void testReassignedName() throws Exception {
    assertFailure(
        "NOT_A_CONSTANT = \"foo\"\nNOT_A_CONSTANT += \"bar\"\n",
        "NOT_A_CONSTANT",
        "'NOT_A_CONSTANT' is not a constant");
    assertFailure("x = 1\nprint(x)\nx = 2\n", "x", "'x' is not a constant");
  }

  @Test
  public void testFunctionName() throws Exception {
    assertFailure(
        "def func(): pass\nfunc()\n", "func", "'func' is not a constant; it has type FunctionDef");
    assertFailure("class C: pass\n", "C", "'C' is not a constant; it has type ClassDef");
  }

  @Test
  public void testConditionalDefinition() throws Exception {
    assertFailure("if define:\n  x = 1\na = x\n", "x", "'x' is not a top-level name");
  }

  @Test
  public void testTupleAssignment() throws Exception {
    assertFailure(
        "CONSTANT1, CONSTANT2 = values\n",
        "CONSTANT1",
        "'CONSTANT1' is not declared in an assignment");
    assertFailure("for i in range(3):\n  pass\n", "i", "'i' is not declared in an assignment");
  }

  @Test
  public void testUndeclaredName() throws Exception {
    assertFailure("x = 1\n", "y", "'y' is not declared");
    assertFailure("print(x)\n", "x", "'x' is not declared");
  }

  private static String inline(String source, String name) throws Exception {
    AnnotatedTree tree = Parser.parse(source);
    ConstantInliner.inlineName(tree, name);
    return CodeGen.toSource(tree);
  }

  private static void assertFailure(String source, String name, String message)
      throws ParseException {
    AnnotatedTree tree = Parser.parse(source);
    InlineException e =
        assertThrows(InlineException.class, () -> ConstantInliner.inlineName(tree, name));
    assertThat(e).hasMessageThat().isEqualTo(message);
    assertThat(CodeGen.toSource(tree)).isEqualTo(source);
  }
}
