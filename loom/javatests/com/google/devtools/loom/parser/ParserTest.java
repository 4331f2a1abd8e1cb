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

package com.google.devtools.loom.parser;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.devtools.loom.ast.AnnotatedTree;
import com.google.devtools.loom.ast.AssignNode;
import com.google.devtools.loom.ast.AugAssignNode;
import com.google.devtools.loom.ast.BytesNode;
import com.google.devtools.loom.ast.CallNode;
import com.google.devtools.loom.ast.CompareNode;
import com.google.devtools.loom.ast.ConstantNode;
import com.google.devtools.loom.ast.ExprContext;
import com.google.devtools.loom.ast.ExprNode;
import com.google.devtools.loom.ast.ForNode;
import com.google.devtools.loom.ast.FormattedValueNode;
import com.google.devtools.loom.ast.FunctionDefNode;
import com.google.devtools.loom.ast.IfNode;
import com.google.devtools.loom.ast.JoinedStrNode;
import com.google.devtools.loom.ast.KeywordNode;
import com.google.devtools.loom.ast.NameNode;
import com.google.devtools.loom.ast.Node;
import com.google.devtools.loom.ast.NodeKind;
import com.google.devtools.loom.ast.NumNode;
import com.google.devtools.loom.ast.StrNode;
import com.google.devtools.loom.ast.Trees;
import com.google.devtools.loom.ast.TupleNode;
import com.google.devtools.loom.formatting.FStringPlaceholders;
import com.google.devtools.loom.formatting.FormattingKeys;
import com.google.devtools.loom.formatting.FormattingStore;
import java.math.BigInteger;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link Parser}. */
@RunWith(JUnit4.class)
public class ParserTest {

  @Test
  public void testAssignmentChain() throws ParseException {
    AnnotatedTree tree = Parser.parse("x = y  =  1  # note\n");
    AssignNode assign = (AssignNode) statement(tree, 0);
    assertThat(assign.getTargets()).hasSize(2);
    for (Node target : assign.getTargets()) {
      assertThat(((NameNode) target).getCtx()).isEqualTo(ExprContext.STORE);
    }
    FormattingStore formatting = tree.getFormatting();
    assertThat(formatting.get(assign, "equal_0")).isEqualTo(" = ");
    assertThat(formatting.get(assign, "equal_1")).isEqualTo("  =  ");
    assertThat(formatting.get(assign, FormattingKeys.SUFFIX)).isEqualTo("  # note\n");
  }

  @Test
  public void testTupleTargetsAreStored() throws ParseException {
    AssignNode assign = (AssignNode) statement(Parser.parse("a, [b, c] = value\n"), 0);
    TupleNode target = (TupleNode) assign.getTargets().get(0);
    assertThat(target.getCtx()).isEqualTo(ExprContext.STORE);
    for (Node node : Trees.preOrder(target)) {
      if (node.getKind() == NodeKind.NAME) {
        assertThat(((NameNode) node).getCtx()).isEqualTo(ExprContext.STORE);
      }
    }
    assertThat(((NameNode) assign.getValue()).getCtx()).isEqualTo(ExprContext.LOAD);
  }

  @Test
  public void testAugmentedAssignment() throws ParseException {
    AnnotatedTree tree = Parser.parse("total //= 2\n");
    AugAssignNode assign = (AugAssignNode) statement(tree, 0);
    assertThat(assign.getOp()).isEqualTo("//");
    assertThat(((NameNode) assign.getTarget()).getCtx()).isEqualTo(ExprContext.STORE);
    assertThat(tree.getFormatting().get(assign, "op")).isEqualTo(" //= ");
    assertThat(tree.getFormatting().getSnapshot(assign, "op")).isEqualTo("//");
  }

  @Test
  public void testNumbers() throws ParseException {
    AnnotatedTree tree =
        Parser.parse(
            "a = 0x1F\nb = 1_000\nc = 2.5\nd = 100000000000000000000\ne = 1 << 40\n"
                + "f = 10000000000\n");
    assertThat(number(tree, 0)).isEqualTo(31);
    assertThat(number(tree, 1)).isEqualTo(1000);
    assertThat(number(tree, 2)).isEqualTo(2.5);
    assertThat(number(tree, 3)).isEqualTo(new BigInteger("100000000000000000000"));
    assertThat(number(tree, 5)).isEqualTo(10000000000L);

    NumNode hex = (NumNode) ((AssignNode) statement(tree, 0)).getValue();
    assertThat(tree.getFormatting().get(hex, FormattingKeys.CONTENT)).isEqualTo("0x1F");
    assertThat(tree.getFormatting().getSnapshot(hex, "n")).isEqualTo(31);
  }

  @Test
  public void testStrings() throws ParseException {
    AnnotatedTree tree =
        Parser.parse(
            "a = 'x\\ty\\u00e9'\nb = r'x\\ty'\nc = u\"u\"\nd = b'\\x00a'\ne = '''one\ntwo'''\n");
    StrNode a = (StrNode) ((AssignNode) statement(tree, 0)).getValue();
    assertThat(a.getS()).isEqualTo("x\ty\u00e9");
    assertThat(a.getTypePrefix()).isNull();
    assertThat(tree.getFormatting().get(a, FormattingKeys.FMT)).isEqualTo("'");

    StrNode b = (StrNode) ((AssignNode) statement(tree, 1)).getValue();
    assertThat(b.getS()).isEqualTo("x\\ty");
    assertThat(tree.getFormatting().get(b, FormattingKeys.FMT)).isEqualTo("r'");

    StrNode c = (StrNode) ((AssignNode) statement(tree, 2)).getValue();
    assertThat(c.getTypePrefix()).isEqualTo("u");

    BytesNode d = (BytesNode) ((AssignNode) statement(tree, 3)).getValue();
    assertThat(d.getS()).isEqualTo(new byte[] {0, 'a'});

    StrNode e = (StrNode) ((AssignNode) statement(tree, 4)).getValue();
    assertThat(e.getS()).isEqualTo("one\ntwo");
    assertThat(tree.getFormatting().get(e, FormattingKeys.FMT)).isEqualTo("'''");
  }

  @Test
  public void testConstants() throws ParseException {
    AnnotatedTree tree = Parser.parse("None, True, False, ...\n");
    TupleNode tuple = (TupleNode) ((ExprNode) statement(tree, 0)).getValue();
    assertThat(((ConstantNode) tuple.getElts().get(0)).getValue())
        .isEqualTo(ConstantNode.Value.NONE);
    assertThat(((ConstantNode) tuple.getElts().get(1)).getValue())
        .isEqualTo(ConstantNode.Value.TRUE);
    assertThat(((ConstantNode) tuple.getElts().get(2)).getValue())
        .isEqualTo(ConstantNode.Value.FALSE);
    assertThat(((ConstantNode) tuple.getElts().get(3)).getValue())
        .isEqualTo(ConstantNode.Value.ELLIPSIS);
  }

  @Test
  public void testFormattedString() throws ParseException {
    AnnotatedTree tree = Parser.parse("s = f'a{x!r:>{width}}b{{c}}'\n");
    JoinedStrNode joined = (JoinedStrNode) ((AssignNode) statement(tree, 0)).getValue();
    assertThat(joined.getValues()).hasSize(3);
    assertThat(((StrNode) joined.getValues().get(0)).getS()).isEqualTo("a");
    FormattedValueNode value = (FormattedValueNode) joined.getValues().get(1);
    assertThat(((NameNode) value.getValue()).getId()).isEqualTo("x");
    assertThat(value.getConversion()).isEqualTo("r");
    JoinedStrNode spec = (JoinedStrNode) value.getFormatSpec();
    assertThat(spec.getValues()).hasSize(2);
    assertThat(((StrNode) joined.getValues().get(2)).getS()).isEqualTo("b{c}");

    assertThat(tree.getFormatting().get(joined, FormattingKeys.CONTENT))
        .isEqualTo(
            "f'a{"
                + FStringPlaceholders.placeholder(0)
                + "!r:>{"
                + FStringPlaceholders.placeholder(1)
                + "}}b{{c}}'");
  }

  @Test
  public void testComparisons() throws ParseException {
    AnnotatedTree tree = Parser.parse("a < b not in c is not d in e\n");
    CompareNode compare = (CompareNode) ((ExprNode) statement(tree, 0)).getValue();
    assertThat(compare.getOps()).containsExactly("<", "not in", "is not", "in").inOrder();
    assertThat(compare.getComparators()).hasSize(4);
    assertThat(tree.getFormatting().get(compare, "op_1")).isEqualTo(" not in ");
  }

  @Test
  public void testCallArguments() throws ParseException {
    AnnotatedTree tree = Parser.parse("f(a, b, key = 1,)\n");
    CallNode call = (CallNode) ((ExprNode) statement(tree, 0)).getValue();
    assertThat(call.getArgs()).hasSize(2);
    assertThat(call.getKeywords()).hasSize(1);
    assertThat(((KeywordNode) call.getKeywords().get(0)).getArg()).isEqualTo("key");
    assertThat(tree.getFormatting().get(call, FormattingKeys.TRAILING_COMMA)).isEqualTo(",");
    assertThat(tree.getFormatting().get(call, "comma_1")).isEqualTo(", ");
  }

  @Test
  public void testParenthesesFoldIntoPrefixAndSuffix() throws ParseException {
    AnnotatedTree tree = Parser.parse("x = ( ( a ) )\n");
    Node value = ((AssignNode) statement(tree, 0)).getValue();
    assertThat(tree.getFormatting().get(value, FormattingKeys.PREFIX)).isEqualTo("( ( ");
    assertThat(tree.getFormatting().get(value, FormattingKeys.SUFFIX)).isEqualTo(" ) )");
  }

  @Test
  public void testCompoundStatements() throws ParseException {
    AnnotatedTree tree =
        Parser.parse(
            "def f(a, b=1):\n"
                + "\tfor i in a:\n"
                + "\t\tpass\n"
                + "if x:\n"
                + "  pass\n"
                + "elif y:\n"
                + "  pass\n"
                + "else:\n"
                + "  pass\n");
    FormattingStore formatting = tree.getFormatting();
    FunctionDefNode def = (FunctionDefNode) statement(tree, 0);
    assertThat(def.getArgs().getArgs()).hasSize(2);
    assertThat(def.getArgs().getDefaults()).hasSize(1);
    assertThat(formatting.get(def, FormattingKeys.INDENT_DIFF)).isEqualTo("\t");
    ForNode loop = (ForNode) def.getBody().get(0);
    assertThat(formatting.get(loop, FormattingKeys.INDENT_DIFF)).isEqualTo("\t");
    assertThat(formatting.get(loop, FormattingKeys.PREFIX)).isEqualTo("\t");

    IfNode ifNode = (IfNode) statement(tree, 1);
    assertThat(formatting.get(ifNode, FormattingKeys.INDENT_DIFF)).isEqualTo("  ");
    IfNode elif = (IfNode) ifNode.getOrelse().get(0);
    assertThat(formatting.getFlag(elif, FormattingKeys.IS_ELIF)).isTrue();
    assertThat(formatting.getFlag(ifNode, FormattingKeys.IS_ELIF)).isFalse();
    assertThat(elif.getOrelse()).hasSize(1);
    assertThat(formatting.get(elif, "else_prefix")).isEmpty();
  }

  @Test
  public void testByteOrderMark() throws ParseException {
    AnnotatedTree tree = Parser.parse("\uFEFFx = 1\n");
    assertThat(tree.getFormatting().get(tree.getRoot(), FormattingKeys.BOM)).isEqualTo("\uFEFF");
    assertThat(tree.getFormatting().get(statement(tree, 0), FormattingKeys.PREFIX)).isEmpty();
  }

  @Test
  public void testSyntaxErrors() {
    ParseException e = assertThrows(ParseException.class, () -> Parser.parse("x = = 1\n"));
    assertThat(e.getLine()).isEqualTo(1);
    assertThat(e.getColumn()).isEqualTo(5);

    e = assertThrows(ParseException.class, () -> Parser.parse("if x:\ny = 1\n"));
    assertThat(e).hasMessageThat().contains("expected an indented block");
    assertThat(e.getLine()).isEqualTo(2);

    e = assertThrows(ParseException.class, () -> Parser.parse("x = 1\n  y = 2\n"));
    assertThat(e).hasMessageThat().contains("unexpected indent");

    e = assertThrows(ParseException.class, () -> Parser.parse("1 = x\n"));
    assertThat(e).hasMessageThat().contains("cannot assign to Num");

    e = assertThrows(ParseException.class, () -> Parser.parse("def f(a=1, b):\n  pass\n"));
    assertThat(e).hasMessageThat().contains("non-default argument follows default argument");

    e = assertThrows(ParseException.class, () -> Parser.parse("f(a=1, b)\n"));
    assertThat(e).hasMessageThat().contains("positional argument follows keyword argument");

    e = assertThrows(ParseException.class, () -> Parser.parse("s = f'{}'\n"));
    assertThat(e).hasMessageThat().contains("empty expression");

    e = assertThrows(ParseException.class, () -> Parser.parse("b = b'caf\u00e9'\n"));
    assertThat(e).hasMessageThat().contains("ASCII");
  }

  @Test
  public void testUnsupportedSyntax() {
    assertThat(messageOf("d = {}\n")).contains("dict and set displays are not supported");
    assertThat(messageOf("x = a[1:2]\n")).contains("slices are not supported");
    assertThat(messageOf("x = 1j\n")).contains("complex literals are not supported");
    assertThat(messageOf("x = 'a' 'b'\n")).contains("implicit concatenation");
    assertThat(messageOf("x = 1; y = 2\n")).contains("multiple statements on one line");
    assertThat(messageOf("def f() -> int:\n  pass\n")).contains("return annotations");
  }

  private static String messageOf(String source) {
    return assertThrows(ParseException.class, () -> Parser.parse(source)).getMessage();
  }

  private static Node statement(AnnotatedTree tree, int index) {
    return tree.getRoot().getBody().get(index);
  }

  private static Number number(AnnotatedTree tree, int index) {
    return ((NumNode) ((AssignNode) statement(tree, index)).getValue()).getN();
  }
}
