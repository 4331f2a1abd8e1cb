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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import com.google.devtools.loom.ast.ArgNode;
import com.google.devtools.loom.ast.ArgumentsNode;
import com.google.devtools.loom.ast.AssignNode;
import com.google.devtools.loom.ast.AttributeNode;
import com.google.devtools.loom.ast.AugAssignNode;
import com.google.devtools.loom.ast.BinOpNode;
import com.google.devtools.loom.ast.BoolOpNode;
import com.google.devtools.loom.ast.BytesNode;
import com.google.devtools.loom.ast.CallNode;
import com.google.devtools.loom.ast.ClassDefNode;
import com.google.devtools.loom.ast.CompareNode;
import com.google.devtools.loom.ast.ConstantNode;
import com.google.devtools.loom.ast.ExprNode;
import com.google.devtools.loom.ast.ForNode;
import com.google.devtools.loom.ast.FormattedValueNode;
import com.google.devtools.loom.ast.FunctionDefNode;
import com.google.devtools.loom.ast.IfNode;
import com.google.devtools.loom.ast.JoinedStrNode;
import com.google.devtools.loom.ast.KeywordNode;
import com.google.devtools.loom.ast.ListNode;
import com.google.devtools.loom.ast.ModuleNode;
import com.google.devtools.loom.ast.NameNode;
import com.google.devtools.loom.ast.Node;
import com.google.devtools.loom.ast.NodeKind;
import com.google.devtools.loom.ast.NumNode;
import com.google.devtools.loom.ast.ReturnNode;
import com.google.devtools.loom.ast.SimpleStatementNode;
import com.google.devtools.loom.ast.StrNode;
import com.google.devtools.loom.ast.SubscriptNode;
import com.google.devtools.loom.ast.TupleNode;
import com.google.devtools.loom.ast.UnaryOpNode;
import com.google.devtools.loom.ast.WhileNode;
import com.google.devtools.loom.formatting.FStringPlaceholders;
import com.google.devtools.loom.formatting.FormattingKeys;
import com.google.devtools.loom.formatting.FormattingStore;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Writes a tree back to source text, one print per instance.
 *
 * <p>Each piece of syntax is written from the node's recorded formatting when there is a fragment
 * for it and the fields the fragment spells out still hold the values they were recorded with;
 * otherwise a canonical default is written. Within one visit of a node each attribute is written at
 * most once.
 */
final class Printer {
  private static final CharMatcher STRING_PREFIX_LETTERS = CharMatcher.anyOf("BbRrUu");
  private static final ImmutableSet<String> NO_DEPENDENCIES = ImmutableSet.of();
  private static final CharMatcher OPENING_PARENTHESIS = CharMatcher.is('(');
  private static final Pattern COMMENT = Pattern.compile("#[^\r\n]*");

  private final FormattingStore formatting;
  private final String indentDiff;
  private final StringBuilder code = new StringBuilder();
  private final Map<Node, Set<String>> emitted = new IdentityHashMap<>();
  private String indent = "";
  private int requiredPrecedence = Precedence.TUPLE;

  /**
   * @param formatting the formatting recorded for the tree
   * @param indentDiff indentation step for blocks that record none
   */
  Printer(FormattingStore formatting, String indentDiff) {
    this.formatting = formatting;
    this.indentDiff = indentDiff;
  }

  /** Prints {@code node} and everything below it. */
  String print(Node node) {
    visit(node);
    return code.toString();
  }

  String getCode() {
    return code.toString();
  }

  void visit(Node node) {
    try {
      checkNotNull(node, "a required child node is missing");
      enter(node);
      try {
        dispatch(node);
      } finally {
        exit(node);
      }
    } catch (ClassCastException
        | IllegalArgumentException
        | IndexOutOfBoundsException
        | NullPointerException
        | IllegalStateException e) {
      throw new PrintException(String.format("Cannot print %s: %s", node, e.getMessage()), e);
    }
  }

  /** Starts a visit of {@code node}, during which its attributes may be written. */
  void enter(Node node) {
    emitted.put(node, new HashSet<>());
  }

  /** Ends the visit of {@code node}, forgetting which of its attributes were written. */
  void exit(Node node) {
    emitted.remove(node);
  }

  /** Visits {@code child} in a position that needs at least {@code precedence} to bind. */
  private void visit(Node child, int precedence) {
    requiredPrecedence = precedence;
    visit(child);
  }

  private void dispatch(Node node) {
    boolean parenthesize = needsParentheses(node, requiredPrecedence);
    requiredPrecedence = Precedence.TUPLE;
    if (node.getKind() == NodeKind.MODULE) {
      attr(node, FormattingKeys.BOM, "");
    }
    attr(node, FormattingKeys.PREFIX, defaultPrefix(node));
    if (parenthesize) {
      token("(");
    }
    switch (node.getKind()) {
      case MODULE:
        for (Node statement : ((ModuleNode) node).getBody()) {
          visit(statement);
        }
        break;
      case ASSIGN:
        {
          AssignNode assign = (AssignNode) node;
          for (int i = 0; i < assign.getTargets().size(); i++) {
            visit(assign.getTargets().get(i));
            attr(node, "equal_" + i, " = ");
          }
          visit(assign.getValue());
          break;
        }
      case AUG_ASSIGN:
        {
          AugAssignNode assign = (AugAssignNode) node;
          visit(assign.getTarget());
          attr(node, "op", ImmutableSet.of("op"), " " + assign.getOp() + "= ", false);
          visit(assign.getValue());
          break;
        }
      case EXPR:
        visit(((ExprNode) node).getValue());
        break;
      case RETURN:
        {
          token("return");
          Node value = ((ReturnNode) node).getValue();
          if (value != null) {
            attr(node, FormattingKeys.AFTER_KEYWORD, " ");
            visit(value);
          }
          break;
        }
      case PASS:
      case BREAK:
      case CONTINUE:
        token(((SimpleStatementNode) node).getKeyword());
        break;
      case IF:
        {
          IfNode ifNode = (IfNode) node;
          token(formatting.getFlag(node, FormattingKeys.IS_ELIF) ? "elif" : "if");
          attr(node, FormattingKeys.AFTER_KEYWORD, " ");
          visit(ifNode.getTest(), Precedence.TEST);
          attr(node, "body_open", ":\n");
          block(node, ifNode.getBody());
          orelse(node, ifNode.getOrelse(), true);
          break;
        }
      case WHILE:
        {
          WhileNode whileNode = (WhileNode) node;
          token("while");
          attr(node, FormattingKeys.AFTER_KEYWORD, " ");
          visit(whileNode.getTest(), Precedence.TEST);
          attr(node, "body_open", ":\n");
          block(node, whileNode.getBody());
          orelse(node, whileNode.getOrelse(), false);
          break;
        }
      case FOR:
        {
          ForNode forNode = (ForNode) node;
          token("for");
          attr(node, FormattingKeys.AFTER_KEYWORD, " ");
          visit(forNode.getTarget());
          attr(node, "in", " in ");
          visit(forNode.getIter());
          attr(node, "body_open", ":\n");
          block(node, forNode.getBody());
          orelse(node, forNode.getOrelse(), false);
          break;
        }
      case FUNCTION_DEF:
        {
          FunctionDefNode def = (FunctionDefNode) node;
          token("def");
          attr(node, "name", ImmutableSet.of("name"), " " + def.getName(), false);
          attr(node, "open_args", "(");
          visit(def.getArgs());
          attr(node, "close_args", ")");
          attr(node, "body_open", ":\n");
          block(node, def.getBody());
          break;
        }
      case CLASS_DEF:
        {
          ClassDefNode def = (ClassDefNode) node;
          token("class");
          attr(node, "name", ImmutableSet.of("name"), " " + def.getName(), false);
          if (!def.getBases().isEmpty() || formatting.has(node, "open_bases")) {
            attr(node, "open_bases", "(");
            sequence(node, def.getBases(), "");
            attr(node, "close_bases", ")");
          }
          attr(node, "body_open", ":\n");
          block(node, def.getBody());
          break;
        }
      case ARGUMENTS:
        {
          ArgumentsNode arguments = (ArgumentsNode) node;
          List<Node> args = arguments.getArgs();
          List<Node> defaults = arguments.getDefaults();
          int firstDefault = args.size() - defaults.size();
          checkArgument(
              firstDefault >= 0, "%s defaults for %s parameters", defaults.size(), args.size());
          for (int i = 0; i < args.size(); i++) {
            if (i > 0) {
              attr(node, "comma_" + (i - 1), ", ");
            }
            visit(args.get(i));
            if (i >= firstDefault) {
              attr(node, "equal_" + i, "=");
              visit(defaults.get(i - firstDefault), Precedence.TEST);
            }
          }
          if (!args.isEmpty()) {
            attr(node, FormattingKeys.TRAILING_COMMA, "");
          }
          break;
        }
      case ARG:
        token(((ArgNode) node).getArg());
        break;
      case KEYWORD:
        {
          KeywordNode keyword = (KeywordNode) node;
          token(keyword.getArg());
          attr(node, "equal", "=");
          visit(keyword.getValue(), Precedence.TEST);
          break;
        }
      case NAME:
        token(((NameNode) node).getId());
        break;
      case NUM:
        literal(node, "n", Literals.reprNumber(((NumNode) node).getN()));
        break;
      case STR:
        literal(node, "s", defaultString((StrNode) node));
        break;
      case BYTES:
        literal(node, "s", Literals.reprBytes(((BytesNode) node).getS()));
        break;
      case JOINED_STR:
        fString(node, ((JoinedStrNode) node).getValues());
        break;
      case FORMATTED_VALUE:
        fString(node, ImmutableList.of(node));
        break;
      case CONSTANT:
        literal(node, "value", ((ConstantNode) node).getValue().getSpelling());
        break;
      case BIN_OP:
        {
          BinOpNode binOp = (BinOpNode) node;
          int precedence = Precedence.ofBinaryOperator(binOp.getOp());
          boolean power = precedence == Precedence.POWER;
          visit(binOp.getLeft(), power ? Precedence.ATOM : precedence);
          attr(node, "op", ImmutableSet.of("op"), " " + binOp.getOp() + " ", false);
          visit(binOp.getRight(), power ? Precedence.FACTOR : precedence + 1);
          break;
        }
      case BOOL_OP:
        {
          BoolOpNode boolOp = (BoolOpNode) node;
          int operand = Precedence.of(node) + 1;
          for (int i = 0; i < boolOp.getValues().size(); i++) {
            if (i > 0) {
              attr(node, "op_" + (i - 1), ImmutableSet.of("op"), " " + boolOp.getOp() + " ", false);
            }
            visit(boolOp.getValues().get(i), operand);
          }
          break;
        }
      case UNARY_OP:
        {
          UnaryOpNode unaryOp = (UnaryOpNode) node;
          token(unaryOp.getOp());
          if ("not".equals(unaryOp.getOp())) {
            attr(node, FormattingKeys.AFTER_KEYWORD, " ");
          }
          visit(unaryOp.getOperand(), Precedence.of(node));
          break;
        }
      case COMPARE:
        {
          CompareNode compare = (CompareNode) node;
          checkArgument(
              compare.getOps().size() == compare.getComparators().size(),
              "%s operators for %s comparators",
              compare.getOps().size(),
              compare.getComparators().size());
          visit(compare.getLeft(), Precedence.BIT_OR);
          for (int i = 0; i < compare.getComparators().size(); i++) {
            String op = compare.getOps().get(i);
            attr(node, "op_" + i, ImmutableSet.of("ops"), " " + op + " ", false);
            visit(compare.getComparators().get(i), Precedence.BIT_OR);
          }
          break;
        }
      case CALL:
        {
          CallNode call = (CallNode) node;
          visit(call.getFunc(), Precedence.ATOM);
          attr(node, "open", "(");
          List<Node> items =
              ImmutableList.copyOf(Iterables.concat(call.getArgs(), call.getKeywords()));
          sequence(node, items, "");
          attr(node, "close", ")");
          break;
        }
      case ATTRIBUTE:
        {
          AttributeNode attribute = (AttributeNode) node;
          visit(attribute.getValue(), Precedence.ATOM);
          attr(node, "dot", ".");
          token(attribute.getAttr());
          break;
        }
      case SUBSCRIPT:
        {
          SubscriptNode subscript = (SubscriptNode) node;
          visit(subscript.getValue(), Precedence.ATOM);
          attr(node, "open", "[");
          visit(subscript.getSlice());
          attr(node, "close", "]");
          break;
        }
      case TUPLE:
        {
          List<Node> elts = ((TupleNode) node).getElts();
          sequence(node, elts, elts.size() == 1 ? "," : "");
          break;
        }
      case LIST:
        attr(node, "open", "[");
        sequence(node, ((ListNode) node).getElts(), "");
        attr(node, "close", "]");
        break;
    }
    if (parenthesize) {
      token(")");
    }
    attr(node, FormattingKeys.SUFFIX, defaultSuffix(node));
  }

  /**
   * Returns whether {@code node} binds more loosely than its position requires and carries no
   * parentheses of its own.
   */
  private boolean needsParentheses(Node node, int required) {
    if (Precedence.of(node) >= required) {
      return false;
    }
    String prefix = formatting.get(node, FormattingKeys.PREFIX);
    return prefix == null
        || !OPENING_PARENTHESIS.matchesAnyOf(COMMENT.matcher(prefix).replaceAll(""));
  }

  private String defaultPrefix(Node node) {
    if (node.getKind() == NodeKind.MODULE) {
      return "";
    } else if (node.getKind().isStatement()) {
      return indent;
    } else if (node.getKind() == NodeKind.TUPLE && ((TupleNode) node).getElts().isEmpty()) {
      return "(";
    }
    return "";
  }

  private static String defaultSuffix(Node node) {
    switch (node.getKind()) {
      case MODULE:
      case IF:
      case WHILE:
      case FOR:
      case FUNCTION_DEF:
      case CLASS_DEF:
        return "";
      case TUPLE:
        return ((TupleNode) node).getElts().isEmpty() ? ")" : "";
      default:
        return node.getKind().isStatement() ? "\n" : "";
    }
  }

  /** Prints the statements of a block one indentation step deeper than the current one. */
  private void block(Node owner, List<Node> statements) {
    String diff = formatting.get(owner, FormattingKeys.INDENT_DIFF);
    String enclosing = indent;
    indent = indent + (diff != null ? diff : indentDiff);
    for (Node statement : statements) {
      visit(statement);
    }
    indent = enclosing;
  }

  private void orelse(Node owner, List<Node> orelse, boolean allowElif) {
    if (orelse.isEmpty()) {
      return;
    }
    Node only = orelse.get(0);
    if (allowElif
        && orelse.size() == 1
        && only.getKind() == NodeKind.IF
        && formatting.getFlag(only, FormattingKeys.IS_ELIF)) {
      visit(only);
      return;
    }
    attr(owner, "else_prefix", indent);
    token("else");
    attr(owner, "orelse_open", ":\n");
    block(owner, orelse);
  }

  /** Prints comma-separated items whose separators are recorded on {@code owner}. */
  private void sequence(Node owner, List<Node> items, String defaultTrailingComma) {
    for (int i = 0; i < items.size(); i++) {
      if (i > 0) {
        attr(owner, "comma_" + (i - 1), ", ");
      }
      visit(items.get(i), Precedence.TEST);
    }
    if (!items.isEmpty()) {
      attr(owner, FormattingKeys.TRAILING_COMMA, defaultTrailingComma);
    }
  }

  private String defaultString(StrNode str) {
    String style = formatting.get(str, FormattingKeys.FMT);
    if (style != null) {
      return Literals.formatString(str.getS(), style);
    }
    String repr = Literals.reprString(str.getS());
    if (str.getTypePrefix() != null) {
      return str.getTypePrefix() + STRING_PREFIX_LETTERS.trimLeadingFrom(repr);
    }
    return repr;
  }

  private void literal(Node node, String field, String defaultText) {
    attr(node, FormattingKeys.CONTENT, ImmutableSet.of(field), defaultText, true);
  }

  /**
   * Prints an f-string. {@code parts} are its literal segments and replacement fields; the
   * expressions of the fields are printed on their own and substituted into the recorded template,
   * or into a canonical one if the recorded template no longer matches them.
   */
  private void fString(Node node, List<Node> parts) {
    if (!claim(node, FormattingKeys.CONTENT)) {
      return;
    }
    List<Node> expressions = new ArrayList<>();
    collectExpressions(parts, expressions);
    List<String> rendered = new ArrayList<>(expressions.size());
    for (Node expression : expressions) {
      rendered.add(new Printer(formatting, indentDiff).print(expression));
    }
    String template = formatting.get(node, FormattingKeys.CONTENT);
    if (template == null || FStringPlaceholders.count(template) != expressions.size()) {
      char quote = chooseQuote(parts, rendered);
      StringBuilder body = new StringBuilder();
      appendTemplate(body, parts, quote, 0);
      template = "f" + quote + body + quote;
    }
    token(FStringPlaceholders.substitute(template, rendered));
  }

  private static void collectExpressions(List<Node> parts, List<Node> into) {
    for (Node part : parts) {
      if (part.getKind() == NodeKind.FORMATTED_VALUE) {
        FormattedValueNode value = (FormattedValueNode) part;
        into.add(value.getValue());
        if (value.getFormatSpec() != null) {
          collectExpressions(((JoinedStrNode) value.getFormatSpec()).getValues(), into);
        }
      }
    }
  }

  /** Appends the canonical template for {@code parts}; returns the next placeholder index. */
  private static int appendTemplate(StringBuilder out, List<Node> parts, char quote, int index) {
    for (Node part : parts) {
      switch (part.getKind()) {
        case STR:
          out.append(Literals.escapeFStringText(((StrNode) part).getS(), quote));
          break;
        case FORMATTED_VALUE:
          {
            FormattedValueNode value = (FormattedValueNode) part;
            out.append('{').append(FStringPlaceholders.placeholder(index++));
            if (value.getConversion() != null) {
              out.append('!').append(value.getConversion());
            }
            if (value.getFormatSpec() != null) {
              out.append(':');
              index =
                  appendTemplate(
                      out, ((JoinedStrNode) value.getFormatSpec()).getValues(), quote, index);
            }
            out.append('}');
            break;
          }
        default:
          throw new IllegalArgumentException("unexpected f-string part " + part.getKind());
      }
    }
    return index;
  }

  private static char chooseQuote(List<Node> parts, List<String> rendered) {
    StringBuilder text = new StringBuilder();
    for (String expression : rendered) {
      text.append(expression);
    }
    for (Node part : parts) {
      if (part.getKind() == NodeKind.STR) {
        text.append(((StrNode) part).getS());
      }
    }
    return Literals.preferredQuote(text.toString());
  }

  // Emission

  /** Writes the recorded value of {@code name}, or {@code defaultValue} if there is none. */
  void attr(Node node, String name, String defaultValue) {
    attr(node, name, NO_DEPENDENCIES, defaultValue, false);
  }

  /**
   * Writes an attribute of the node being visited. The recorded value is used only if every field
   * in {@code dependencies} still equals its recorded snapshot. Nothing is written if the node is
   * not being visited or the attribute was already written during this visit.
   *
   * @param separate whether the value is a token that must not fuse with the preceding text
   */
  void attr(
      Node node,
      String name,
      ImmutableSet<String> dependencies,
      String defaultValue,
      boolean separate) {
    if (!claim(node, name)) {
      return;
    }
    String value = formatting.get(node, name);
    if (value == null || !dependenciesCurrent(node, dependencies)) {
      value = defaultValue;
    }
    if (separate) {
      token(value);
    } else {
      code.append(value);
    }
  }

  /** Writes a token, separating it from the preceding text if both would run together. */
  void token(String value) {
    if (code.length() > 0
        && !value.isEmpty()
        && isWordChar(code.charAt(code.length() - 1))
        && isWordChar(value.charAt(0))) {
      code.append(' ');
    }
    code.append(value);
  }

  /** Marks {@code name} as written for the current visit; returns false if it already was. */
  private boolean claim(Node node, String name) {
    Set<String> written = emitted.get(node);
    return written != null && written.add(name);
  }

  private boolean dependenciesCurrent(Node node, ImmutableSet<String> dependencies) {
    for (String field : dependencies) {
      if (!formatting.hasSnapshot(node, field)
          || !Objects.deepEquals(node.getField(field), formatting.getSnapshot(node, field))) {
        return false;
      }
    }
    return true;
  }

  private static boolean isWordChar(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }
}
