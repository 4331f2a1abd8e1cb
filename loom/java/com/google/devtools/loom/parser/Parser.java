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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import com.google.devtools.loom.ast.AnnotatedTree;
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
import com.google.devtools.loom.ast.ExprContext;
import com.google.devtools.loom.ast.ExprNode;
import com.google.devtools.loom.ast.ForNode;
import com.google.devtools.loom.ast.FunctionDefNode;
import com.google.devtools.loom.ast.IfNode;
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
import com.google.devtools.loom.formatting.FormattingKeys;
import com.google.devtools.loom.formatting.FormattingStore;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser that builds a syntax tree and annotates it with the formatting of the
 * source it was parsed from.
 *
 * <p>Every character of the input ends up in exactly one formatting fragment, so printing a freshly
 * parsed tree reproduces the input. Trivia is attributed as follows:
 *
 * <ul>
 *   <li>the blank lines, comments and indentation before a statement form its {@code prefix}, and
 *       the rest of its last line (including the line break) forms its {@code suffix};
 *   <li>whitespace before an expression forms its {@code prefix}; enclosing parentheses are folded
 *       into its {@code prefix} and {@code suffix};
 *   <li>operators, separators and brackets are stored with the whitespace around them, in
 *       attributes named after their role ({@code op}, {@code comma_0}, {@code close}, ...);
 *   <li>whatever follows the last statement forms the module's {@code suffix}.
 * </ul>
 *
 * <p>Fragments that spell out a field value (operators, definition names, literal text) record a
 * snapshot of that field, so the printer can tell when the field was edited afterwards.
 */
public final class Parser {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final String BYTE_ORDER_MARK = "\uFEFF";

  private static final ImmutableSet<String> KEYWORDS =
      ImmutableSet.of(
          "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
          "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
          "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
          "return", "try", "while", "with", "yield");
  private static final ImmutableSet<String> COMPOUND_KEYWORDS =
      ImmutableSet.of("if", "while", "for", "def", "class");
  private static final ImmutableSet<String> AUGMENTED_ASSIGNMENTS =
      ImmutableSet.of(
          "+=", "-=", "*=", "/=", "//=", "%=", "@=", "**=", ">>=", "<<=", "&=", "|=", "^=");
  private static final ImmutableSet<String> COMPARISONS =
      ImmutableSet.of("<", ">", "==", ">=", "<=", "!=");

  private static final ImmutableSet<String> BIT_OR = ImmutableSet.of("|");
  private static final ImmutableSet<String> BIT_XOR = ImmutableSet.of("^");
  private static final ImmutableSet<String> BIT_AND = ImmutableSet.of("&");
  private static final ImmutableSet<String> SHIFT = ImmutableSet.of("<<", ">>");
  private static final ImmutableSet<String> ARITH = ImmutableSet.of("+", "-");
  private static final ImmutableSet<String> TERM = ImmutableSet.of("*", "/", "//", "%", "@");
  private static final ImmutableSet<String> UNARY = ImmutableSet.of("+", "-", "~");

  private static final ImmutableSet<String> EXPRESSION_KEYWORDS =
      ImmutableSet.of("None", "True", "False", "not");
  private static final ImmutableSet<String> EXPRESSION_OPENERS =
      ImmutableSet.of("(", "[", "{", "-", "+", "~", "...");

  /** Parses one element of a larger construct. */
  private interface ElementParser {
    Node parse() throws ParseException;
  }

  private final ImmutableList<Token> tokens;
  private final FormattingStore formatting;
  private final LineMap lineMap;
  private int pos;
  private boolean prefixClaimed;
  private String indent = "";

  private Parser(ImmutableList<Token> tokens, FormattingStore formatting, LineMap lineMap) {
    this.tokens = tokens;
    this.formatting = formatting;
    this.lineMap = lineMap;
  }

  /**
   * Parses a module.
   *
   * @throws ParseException if {@code source} is not a valid module of the supported language subset
   */
  public static AnnotatedTree parse(String source) throws ParseException {
    String text = source;
    String bom = "";
    if (text.startsWith(BYTE_ORDER_MARK)) {
      bom = BYTE_ORDER_MARK;
      text = text.substring(BYTE_ORDER_MARK.length());
    }
    FormattingStore formatting = new FormattingStore();
    Parser parser = new Parser(Tokenizer.tokenize(text), formatting, new LineMap(text));
    ModuleNode module = parser.parseModule();
    if (!bom.isEmpty()) {
      formatting.set(module, FormattingKeys.BOM, bom);
    }
    logger.atFine().log(
        "Parsed %d top-level statements from %d characters",
        module.getBody().size(),
        text.length());
    return new AnnotatedTree(module, formatting);
  }

  /**
   * Parses a free-standing expression, recording its formatting in {@code formatting}. Whitespace
   * after the expression becomes part of its {@code suffix}.
   */
  static Node parseExpression(String source, FormattingStore formatting) throws ParseException {
    Parser parser =
        new Parser(Tokenizer.tokenizeExpression(source), formatting, new LineMap(source));
    Node node = parser.parseTestList();
    if (!parser.at(TokenKind.EOF)) {
      throw parser.error("unexpected '" + parser.peek().text() + "'");
    }
    String trailing = parser.ws();
    if (!trailing.isEmpty()) {
      formatting.set(node, FormattingKeys.SUFFIX, suffixOf(formatting, node) + trailing);
    }
    return node;
  }

  // Statements

  private ModuleNode parseModule() throws ParseException {
    List<Node> body = new ArrayList<>();
    while (!at(TokenKind.EOF)) {
      body.add(parseStatement());
    }
    ModuleNode module = new ModuleNode(body);
    formatting.set(module, FormattingKeys.SUFFIX, ws());
    return module;
  }

  private Node parseStatement() throws ParseException {
    String prefix = ws();
    if (at(TokenKind.INDENT)) {
      throw error("unexpected indent");
    }
    Node statement;
    if (peek().kind() == TokenKind.NAME && COMPOUND_KEYWORDS.contains(peek().text())) {
      statement = parseCompoundStatement();
    } else {
      statement = parseSimpleStatement();
      formatting.set(statement, FormattingKeys.SUFFIX, ws() + expectNewline());
    }
    formatting.set(statement, FormattingKeys.PREFIX, prefix);
    return statement;
  }

  private Node parseSimpleStatement() throws ParseException {
    if (at(TokenKind.NAME)) {
      switch (peek().text()) {
        case "pass":
          advance();
          return SimpleStatementNode.of(NodeKind.PASS);
        case "break":
          advance();
          return SimpleStatementNode.of(NodeKind.BREAK);
        case "continue":
          advance();
          return SimpleStatementNode.of(NodeKind.CONTINUE);
        case "return":
          {
            advance();
            if (at(TokenKind.NEWLINE)) {
              return new ReturnNode(null);
            }
            String space = ws();
            ReturnNode node = new ReturnNode(parseTestList());
            formatting.set(node, FormattingKeys.AFTER_KEYWORD, space);
            return node;
          }
        default:
          break;
      }
    }
    Node first = parseTestList();
    if (atOp("=")) {
      return parseAssignment(first);
    }
    if (at(TokenKind.OP) && AUGMENTED_ASSIGNMENTS.contains(peek().text())) {
      checkTarget(first, false);
      String op = peek().text();
      String fragment = spacedFragment();
      Node value = parseTestList();
      markStore(first);
      AugAssignNode node = new AugAssignNode(first, op.substring(0, op.length() - 1), value);
      formatting.set(node, "op", fragment);
      formatting.recordDependency(node, "op");
      return node;
    }
    return new ExprNode(first);
  }

  private AssignNode parseAssignment(Node first) throws ParseException {
    List<Node> targets = new ArrayList<>();
    List<String> equals = new ArrayList<>();
    targets.add(first);
    while (atOp("=")) {
      equals.add(spacedFragment());
      targets.add(parseTestList());
    }
    Node value = targets.remove(targets.size() - 1);
    for (Node target : targets) {
      checkTarget(target, true);
      markStore(target);
    }
    AssignNode node = new AssignNode(targets, value);
    for (int i = 0; i < equals.size(); i++) {
      formatting.set(node, "equal_" + i, equals.get(i));
    }
    return node;
  }

  private Node parseCompoundStatement() throws ParseException {
    switch (peek().text()) {
      case "if":
        return parseIf();
      case "while":
        return parseWhile();
      case "for":
        return parseFor();
      case "def":
        return parseFunctionDef();
      case "class":
        return parseClassDef();
      default:
        throw error("invalid syntax");
    }
  }

  /** Parses an {@code if} statement, or the {@code elif} clause at the current token. */
  private IfNode parseIf() throws ParseException {
    advance();
    String space = ws();
    Node test = parseTest();
    IfNode node = new IfNode(test, new ArrayList<>(), new ArrayList<>());
    formatting.set(node, FormattingKeys.AFTER_KEYWORD, space);
    parseSuite(node, "body_open", node.getBody());
    if (atKeyword("elif")) {
      String prefix = ws();
      IfNode elif = parseIf();
      formatting.set(elif, FormattingKeys.PREFIX, prefix);
      formatting.setFlag(elif, FormattingKeys.IS_ELIF, true);
      node.getOrelse().add(elif);
    } else {
      parseElse(node, node.getOrelse());
    }
    return node;
  }

  private WhileNode parseWhile() throws ParseException {
    advance();
    String space = ws();
    Node test = parseTest();
    WhileNode node = new WhileNode(test, new ArrayList<>(), new ArrayList<>());
    formatting.set(node, FormattingKeys.AFTER_KEYWORD, space);
    parseSuite(node, "body_open", node.getBody());
    parseElse(node, node.getOrelse());
    return node;
  }

  private ForNode parseFor() throws ParseException {
    advance();
    String space = ws();
    Node target = parseTargetList();
    checkTarget(target, true);
    markStore(target);
    if (!atKeyword("in")) {
      throw error("expected 'in'");
    }
    String in = spacedFragment();
    Node iter = parseTestList();
    ForNode node = new ForNode(target, iter, new ArrayList<>(), new ArrayList<>());
    formatting.set(node, FormattingKeys.AFTER_KEYWORD, space);
    formatting.set(node, "in", in);
    parseSuite(node, "body_open", node.getBody());
    parseElse(node, node.getOrelse());
    return node;
  }

  private void parseElse(Node owner, List<Node> orelse) throws ParseException {
    if (atKeyword("else")) {
      formatting.set(owner, "else_prefix", ws());
      advance();
      parseSuite(owner, "orelse_open", orelse);
    }
  }

  private FunctionDefNode parseFunctionDef() throws ParseException {
    advance();
    String nameSpace = ws();
    String name = expectIdentifier("expected a function name");
    ArgumentsNode args = new ArgumentsNode(new ArrayList<>(), new ArrayList<>());
    String openArgs = ws() + expectOp("(");
    parseParameters(args);
    String closeArgs = ws() + expectOp(")");
    if (atOp("->")) {
      throw error("return annotations are not supported");
    }
    FunctionDefNode node = new FunctionDefNode(name, args, new ArrayList<>());
    formatting.set(node, "name", nameSpace + name);
    formatting.recordDependency(node, "name");
    formatting.set(node, "open_args", openArgs);
    formatting.set(node, "close_args", closeArgs);
    parseSuite(node, "body_open", node.getBody());
    return node;
  }

  private void parseParameters(ArgumentsNode args) throws ParseException {
    int index = 0;
    while (!atOp(")")) {
      String prefix = ws();
      ArgNode arg = new ArgNode(expectIdentifier("invalid parameter"));
      formatting.set(arg, FormattingKeys.PREFIX, prefix);
      args.getArgs().add(arg);
      if (atOp("=")) {
        formatting.set(args, "equal_" + index, spacedFragment());
        args.getDefaults().add(parseTest());
      } else if (!args.getDefaults().isEmpty()) {
        throw error("non-default argument follows default argument");
      }
      if (!atOp(",")) {
        break;
      }
      String comma = fragment();
      if (atOp(")")) {
        formatting.set(args, FormattingKeys.TRAILING_COMMA, comma);
        break;
      }
      formatting.set(args, "comma_" + index, comma + ws());
      index++;
    }
  }

  private ClassDefNode parseClassDef() throws ParseException {
    advance();
    String nameSpace = ws();
    String name = expectIdentifier("expected a class name");
    ClassDefNode node = new ClassDefNode(name, new ArrayList<>(), new ArrayList<>());
    formatting.set(node, "name", nameSpace + name);
    formatting.recordDependency(node, "name");
    if (atOp("(")) {
      formatting.set(node, "open_bases", fragment());
      parseDelimited(node, node.getBases(), ")", this::parseTest);
      formatting.set(node, "close_bases", ws() + expectOp(")"));
    }
    parseSuite(node, "body_open", node.getBody());
    return node;
  }

  /**
   * Parses the {@code ':'} and body of a compound statement into {@code into}. The colon, with any
   * trailing comment and the line break, is stored on {@code owner} as {@code openAttr}.
   */
  private void parseSuite(Node owner, String openAttr, List<Node> into) throws ParseException {
    String open = ws() + expectOp(":");
    if (at(TokenKind.NEWLINE)) {
      open += ws() + advance();
      if (!at(TokenKind.INDENT)) {
        throw error("expected an indented block");
      }
      ws();
      String blockIndent = advance();
      if (!formatting.has(owner, FormattingKeys.INDENT_DIFF)) {
        formatting.set(
            owner,
            FormattingKeys.INDENT_DIFF,
            blockIndent.startsWith(indent) ? blockIndent.substring(indent.length()) : blockIndent);
      }
      String enclosing = indent;
      indent = blockIndent;
      while (!at(TokenKind.DEDENT)) {
        into.add(parseStatement());
      }
      indent = enclosing;
      ws();
      advance();
    } else {
      if (peek().kind() == TokenKind.NAME && COMPOUND_KEYWORDS.contains(peek().text())) {
        throw error("invalid syntax");
      }
      into.add(parseStatement());
    }
    formatting.set(owner, openAttr, open);
  }

  // Expressions

  private Node parseTestList() throws ParseException {
    Node first = parseTest();
    return atOp(",") ? parseTupleTail(first, this::parseTest) : first;
  }

  /** Parses the target of a {@code for} loop, which must stop before {@code in}. */
  private Node parseTargetList() throws ParseException {
    Node first = parseBitOr();
    return atOp(",") ? parseTupleTail(first, this::parseBitOr) : first;
  }

  /** Parses the rest of a tuple written without parentheses, starting at the first comma. */
  private TupleNode parseTupleTail(Node first, ElementParser element) throws ParseException {
    List<Node> elts = new ArrayList<>();
    List<String> commas = new ArrayList<>();
    String trailing = null;
    elts.add(first);
    while (atOp(",")) {
      String comma = fragment();
      if (!startsExpression(peek())) {
        trailing = comma;
        break;
      }
      commas.add(comma + ws());
      elts.add(element.parse());
    }
    TupleNode tuple = new TupleNode(elts, ExprContext.LOAD);
    for (int i = 0; i < commas.size(); i++) {
      formatting.set(tuple, "comma_" + i, commas.get(i));
    }
    if (trailing != null) {
      formatting.set(tuple, FormattingKeys.TRAILING_COMMA, trailing);
    }
    return tuple;
  }

  /**
   * Parses comma-separated elements up to (not including) {@code close}. Separators are stored on
   * {@code owner}.
   */
  private void parseDelimited(Node owner, List<Node> into, String close, ElementParser element)
      throws ParseException {
    int index = 0;
    while (!atOp(close)) {
      into.add(element.parse());
      if (!atOp(",")) {
        break;
      }
      String comma = fragment();
      if (atOp(close)) {
        formatting.set(owner, FormattingKeys.TRAILING_COMMA, comma);
        break;
      }
      formatting.set(owner, "comma_" + index++, comma + ws());
    }
  }

  private Node parseTest() throws ParseException {
    return parseBoolOp("or", this::parseAndTest);
  }

  private Node parseAndTest() throws ParseException {
    return parseBoolOp("and", this::parseNotTest);
  }

  private Node parseBoolOp(String op, ElementParser operand) throws ParseException {
    Node first = operand.parse();
    if (!atKeyword(op)) {
      return first;
    }
    List<Node> values = new ArrayList<>();
    List<String> ops = new ArrayList<>();
    values.add(first);
    while (atKeyword(op)) {
      ops.add(spacedFragment());
      values.add(operand.parse());
    }
    BoolOpNode node = new BoolOpNode(op, values);
    for (int i = 0; i < ops.size(); i++) {
      formatting.set(node, "op_" + i, ops.get(i));
    }
    formatting.recordDependency(node, "op");
    return node;
  }

  private Node parseNotTest() throws ParseException {
    if (atKeyword("not")) {
      String prefix = ws();
      advance();
      String space = ws();
      UnaryOpNode node = new UnaryOpNode("not", parseNotTest());
      formatting.set(node, FormattingKeys.PREFIX, prefix);
      formatting.set(node, FormattingKeys.AFTER_KEYWORD, space);
      return node;
    }
    return parseComparison();
  }

  private Node parseComparison() throws ParseException {
    Node left = parseBitOr();
    List<String> ops = new ArrayList<>();
    List<String> fragments = new ArrayList<>();
    List<Node> comparators = new ArrayList<>();
    while (true) {
      String op;
      String fragment;
      if (at(TokenKind.OP) && COMPARISONS.contains(peek().text())) {
        op = peek().text();
        fragment = spacedFragment();
      } else if (atKeyword("in")) {
        op = "in";
        fragment = spacedFragment();
      } else if (atKeyword("not") && lookahead(1).is(TokenKind.NAME, "in")) {
        op = "not in";
        fragment = ws() + advance() + ws() + advance() + ws();
      } else if (atKeyword("is")) {
        fragment = ws() + advance();
        op = "is";
        if (atKeyword("not")) {
          fragment += ws() + advance();
          op = "is not";
        }
        fragment += ws();
      } else {
        break;
      }
      ops.add(op);
      fragments.add(fragment);
      comparators.add(parseBitOr());
    }
    if (ops.isEmpty()) {
      return left;
    }
    CompareNode node = new CompareNode(left, ops, comparators);
    for (int i = 0; i < fragments.size(); i++) {
      formatting.set(node, "op_" + i, fragments.get(i));
    }
    formatting.recordDependency(node, "ops");
    return node;
  }

  private Node parseBitOr() throws ParseException {
    return parseBinary(BIT_OR, this::parseBitXor);
  }

  private Node parseBitXor() throws ParseException {
    return parseBinary(BIT_XOR, this::parseBitAnd);
  }

  private Node parseBitAnd() throws ParseException {
    return parseBinary(BIT_AND, this::parseShift);
  }

  private Node parseShift() throws ParseException {
    return parseBinary(SHIFT, this::parseArith);
  }

  private Node parseArith() throws ParseException {
    return parseBinary(ARITH, this::parseTerm);
  }

  private Node parseTerm() throws ParseException {
    return parseBinary(TERM, this::parseFactor);
  }

  private Node parseBinary(ImmutableSet<String> operators, ElementParser operand)
      throws ParseException {
    Node left = operand.parse();
    while (at(TokenKind.OP) && operators.contains(peek().text())) {
      String op = peek().text();
      String fragment = spacedFragment();
      left = binOp(left, op, fragment, operand.parse());
    }
    return left;
  }

  private Node parseFactor() throws ParseException {
    if (at(TokenKind.OP) && UNARY.contains(peek().text())) {
      String prefix = ws();
      String op = advance();
      UnaryOpNode node = new UnaryOpNode(op, parseFactor());
      formatting.set(node, FormattingKeys.PREFIX, prefix);
      return node;
    }
    return parsePower();
  }

  private Node parsePower() throws ParseException {
    Node base = parseAtomExpr();
    if (atOp("**")) {
      String fragment = spacedFragment();
      return binOp(base, "**", fragment, parseFactor());
    }
    return base;
  }

  private BinOpNode binOp(Node left, String op, String fragment, Node right) {
    BinOpNode node = new BinOpNode(left, op, right);
    formatting.set(node, "op", fragment);
    formatting.recordDependency(node, "op");
    return node;
  }

  /** Parses an atom followed by any number of calls, subscripts and attribute references. */
  private Node parseAtomExpr() throws ParseException {
    Node node = parseAtom();
    while (true) {
      if (atOp("(")) {
        node = parseCall(node);
      } else if (atOp("[")) {
        String open = fragment();
        Node slice = parseTestList();
        if (atOp(":")) {
          throw error("slices are not supported");
        }
        SubscriptNode subscript = new SubscriptNode(node, slice, ExprContext.LOAD);
        formatting.set(subscript, "open", open);
        formatting.set(subscript, "close", ws() + expectOp("]"));
        node = subscript;
      } else if (atOp(".")) {
        String dot = spacedFragment();
        String attr = expectIdentifier("expected an attribute name");
        AttributeNode attribute = new AttributeNode(node, attr, ExprContext.LOAD);
        formatting.set(attribute, "dot", dot);
        node = attribute;
      } else {
        return node;
      }
    }
  }

  private CallNode parseCall(Node func) throws ParseException {
    CallNode call = new CallNode(func, new ArrayList<>(), new ArrayList<>());
    formatting.set(call, "open", fragment());
    List<Node> items = new ArrayList<>();
    parseDelimited(call, items, ")", this::parseCallArgument);
    for (Node item : items) {
      if (item.getKind() == NodeKind.KEYWORD) {
        call.getKeywords().add(item);
      } else if (call.getKeywords().isEmpty()) {
        call.getArgs().add(item);
      } else {
        throw error("positional argument follows keyword argument");
      }
    }
    formatting.set(call, "close", ws() + expectOp(")"));
    return call;
  }

  private Node parseCallArgument() throws ParseException {
    if (at(TokenKind.NAME) && lookahead(1).is(TokenKind.OP, "=")) {
      String prefix = ws();
      String arg = expectIdentifier("invalid keyword argument");
      String equal = spacedFragment();
      KeywordNode keyword = new KeywordNode(arg, parseTest());
      formatting.set(keyword, FormattingKeys.PREFIX, prefix);
      formatting.set(keyword, "equal", equal);
      return keyword;
    }
    return parseTest();
  }

  private Node parseAtom() throws ParseException {
    String prefix = ws();
    Token token = peek();
    Node node;
    switch (token.kind()) {
      case NAME:
        node = parseNameAtom();
        break;
      case NUMBER:
        node = parseNumber();
        break;
      case STRING:
        node = parseString();
        break;
      case OP:
        switch (token.text()) {
          case "(":
            return parseParenthesized(prefix);
          case "[":
            ListNode list = new ListNode(new ArrayList<>(), ExprContext.LOAD);
            formatting.set(list, "open", fragment());
            parseDelimited(list, list.getElts(), "]", this::parseTest);
            formatting.set(list, "close", ws() + expectOp("]"));
            node = list;
            break;
          case "...":
            advance();
            node = new ConstantNode(ConstantNode.Value.ELLIPSIS);
            break;
          case "{":
            throw error("dict and set displays are not supported");
          default:
            throw error("invalid syntax");
        }
        break;
      default:
        throw error("invalid syntax");
    }
    formatting.set(node, FormattingKeys.PREFIX, prefix);
    return node;
  }

  /** Parses a parenthesized expression or tuple, folding the parentheses into its formatting. */
  private Node parseParenthesized(String prefix) throws ParseException {
    advance();
    Node node;
    if (atOp(")")) {
      node = new TupleNode(new ArrayList<>(), ExprContext.LOAD);
    } else {
      Node first = parseTest();
      node = atOp(",") ? parseTupleTail(first, this::parseTest) : first;
    }
    String close = ws() + expectOp(")");
    formatting.set(
        node,
        FormattingKeys.PREFIX,
        prefix + "(" + Strings.nullToEmpty(formatting.get(node, FormattingKeys.PREFIX)));
    formatting.set(node, FormattingKeys.SUFFIX, suffixOf(formatting, node) + close);
    return node;
  }

  private Node parseNameAtom() throws ParseException {
    String word = peek().text();
    ConstantNode.Value constant;
    switch (word) {
      case "None":
        constant = ConstantNode.Value.NONE;
        break;
      case "True":
        constant = ConstantNode.Value.TRUE;
        break;
      case "False":
        constant = ConstantNode.Value.FALSE;
        break;
      default:
        if (KEYWORDS.contains(word)) {
          throw error("invalid syntax");
        }
        advance();
        return new NameNode(word, ExprContext.LOAD);
    }
    advance();
    ConstantNode node = new ConstantNode(constant);
    formatting.set(node, FormattingKeys.CONTENT, word);
    formatting.recordDependency(node, "value");
    return node;
  }

  private NumNode parseNumber() throws ParseException {
    String text = peek().text();
    Number value;
    try {
      value = parseNumberValue(text);
    } catch (NumberFormatException e) {
      throw error("invalid number literal '" + text + "'");
    }
    advance();
    NumNode node = new NumNode(value);
    formatting.set(node, FormattingKeys.CONTENT, text);
    formatting.recordDependency(node, "n");
    return node;
  }

  private Number parseNumberValue(String text) throws ParseException {
    String digits = text.replace("_", "");
    char last = digits.charAt(digits.length() - 1);
    if (last == 'j' || last == 'J') {
      throw error("complex literals are not supported");
    }
    if (digits.length() > 2 && digits.charAt(0) == '0' && Character.isLetter(digits.charAt(1))) {
      int radix;
      switch (Character.toLowerCase(digits.charAt(1))) {
        case 'x':
          radix = 16;
          break;
        case 'o':
          radix = 8;
          break;
        default:
          radix = 2;
          break;
      }
      return narrow(new BigInteger(digits.substring(2), radix));
    }
    if (digits.indexOf('.') < 0 && digits.indexOf('e') < 0 && digits.indexOf('E') < 0) {
      return narrow(new BigInteger(digits));
    }
    return Double.parseDouble(digits);
  }

  private static Number narrow(BigInteger value) {
    if (value.bitLength() < Integer.SIZE) {
      return value.intValue();
    } else if (value.bitLength() < Long.SIZE) {
      return value.longValue();
    }
    return value;
  }

  private Node parseString() throws ParseException {
    Token token = peek();
    if (lookahead(1).kind() == TokenKind.STRING) {
      throw error("implicit concatenation of string literals is not supported");
    }
    String text = token.text();
    String prefix = StringLiterals.prefix(text);
    boolean raw = StringLiterals.isRaw(prefix);
    Node node;
    try {
      if (StringLiterals.isFormatted(prefix)) {
        node =
            FStringParser.parse(
                text,
                formatting,
                lineMap.charToLine(token.offset()),
                lineMap.charToColumn(token.offset()));
      } else if (StringLiterals.isBytes(prefix)) {
        node = new BytesNode(StringLiterals.decodeBytes(StringLiterals.body(text), raw));
        formatting.set(node, FormattingKeys.CONTENT, text);
        formatting.recordDependency(node, "s");
      } else {
        String kind = prefix.indexOf('u') >= 0 || prefix.indexOf('U') >= 0 ? "u" : null;
        node = new StrNode(StringLiterals.decode(StringLiterals.body(text), raw), kind);
        formatting.set(node, FormattingKeys.CONTENT, text);
        formatting.set(node, FormattingKeys.FMT, prefix + StringLiterals.quote(text));
        formatting.recordDependency(node, "s");
      }
    } catch (IllegalArgumentException e) {
      throw error(e.getMessage());
    }
    advance();
    return node;
  }

  // Target validation

  private void checkTarget(Node target, boolean allowSequences) throws ParseException {
    switch (target.getKind()) {
      case NAME:
      case ATTRIBUTE:
      case SUBSCRIPT:
        return;
      case TUPLE:
      case LIST:
        if (allowSequences) {
          for (Node element : target.getChildren()) {
            checkTarget(element, true);
          }
          return;
        }
        break;
      default:
        break;
    }
    throw error("cannot assign to " + target.getKind());
  }

  private static void markStore(Node target) {
    target.setField("ctx", ExprContext.STORE);
    if (target.getKind() == NodeKind.TUPLE || target.getKind() == NodeKind.LIST) {
      for (Node element : target.getChildren()) {
        markStore(element);
      }
    }
  }

  // Token access

  private Token peek() {
    return tokens.get(pos);
  }

  private Token lookahead(int distance) {
    return tokens.get(Math.min(pos + distance, tokens.size() - 1));
  }

  private boolean at(TokenKind kind) {
    return peek().kind() == kind;
  }

  private boolean atOp(String op) {
    return peek().is(TokenKind.OP, op);
  }

  private boolean atKeyword(String keyword) {
    return peek().is(TokenKind.NAME, keyword);
  }

  private static boolean startsExpression(Token token) {
    switch (token.kind()) {
      case NAME:
        return !KEYWORDS.contains(token.text()) || EXPRESSION_KEYWORDS.contains(token.text());
      case NUMBER:
      case STRING:
        return true;
      case OP:
        return EXPRESSION_OPENERS.contains(token.text());
      default:
        return false;
    }
  }

  /** Claims the trivia in front of the current token. Returns "" if it was already claimed. */
  private String ws() {
    if (prefixClaimed) {
      return "";
    }
    prefixClaimed = true;
    return peek().prefix();
  }

  /** Consumes the current token, whose trivia must have been claimed, and returns its text. */
  private String advance() {
    Token token = peek();
    checkState(
        prefixClaimed || token.prefix().isEmpty(), "Unclaimed trivia before %s", token);
    if (token.kind() != TokenKind.EOF) {
      pos++;
    }
    prefixClaimed = false;
    return token.text();
  }

  /** Returns the trivia before the current token followed by the token. */
  private String fragment() {
    return ws() + advance();
  }

  /** Returns the current token with the trivia on both of its sides. */
  private String spacedFragment() {
    String fragment = ws() + advance();
    return fragment + ws();
  }

  private String expectOp(String op) throws ParseException {
    if (!atOp(op)) {
      throw error("expected '" + op + "'");
    }
    return advance();
  }

  private String expectIdentifier(String message) throws ParseException {
    if (!at(TokenKind.NAME) || KEYWORDS.contains(peek().text())) {
      throw error(message);
    }
    return advance();
  }

  private String expectNewline() throws ParseException {
    if (at(TokenKind.NEWLINE)) {
      return advance();
    }
    if (atOp(";")) {
      throw error("multiple statements on one line are not supported");
    }
    throw error("invalid syntax");
  }

  private static String suffixOf(FormattingStore formatting, Node node) {
    return Strings.nullToEmpty(formatting.get(node, FormattingKeys.SUFFIX));
  }

  private ParseException error(String message) {
    int offset = peek().offset();
    return new ParseException(message, lineMap.charToLine(offset), lineMap.charToColumn(offset));
  }
}
