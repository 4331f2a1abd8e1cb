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

import com.google.devtools.loom.formatting.FormattingStore;
import java.util.ArrayList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Deep copies subtrees. No mutable structure is shared between a copy and its original, so copies
 * can be edited independently. When given a {@link FormattingStore}, the formatting of every copied
 * node is copied onto its counterpart, so a copy prints the way its original was written.
 */
public final class NodeCopier {
  private final @Nullable FormattingStore formatting;

  private NodeCopier(@Nullable FormattingStore formatting) {
    this.formatting = formatting;
  }

  /** Copies {@code node} and its descendants, without formatting. */
  public static <T extends Node> T copy(T node) {
    return new NodeCopier(null).copyNode(node);
  }

  /** Copies {@code node} and its descendants along with their entries in {@code formatting}. */
  public static <T extends Node> T copy(T node, FormattingStore formatting) {
    return new NodeCopier(formatting).copyNode(node);
  }

  @SuppressWarnings("unchecked") // every kind is implemented by exactly one class
  private <T extends Node> T copyNode(T node) {
    Node copy = copyFields(node);
    if (formatting != null) {
      formatting.copy(node, copy);
    }
    return (T) copy;
  }

  private Node copyFields(Node node) {
    switch (node.getKind()) {
      case MODULE:
        return new ModuleNode(copyList(((ModuleNode) node).getBody()));
      case ASSIGN:
        {
          AssignNode assign = (AssignNode) node;
          return new AssignNode(copyList(assign.getTargets()), copyNode(assign.getValue()));
        }
      case AUG_ASSIGN:
        {
          AugAssignNode assign = (AugAssignNode) node;
          return new AugAssignNode(
              copyNode(assign.getTarget()), assign.getOp(), copyNode(assign.getValue()));
        }
      case EXPR:
        return new ExprNode(copyNode(((ExprNode) node).getValue()));
      case RETURN:
        return new ReturnNode(copyOrNull(((ReturnNode) node).getValue()));
      case PASS:
      case BREAK:
      case CONTINUE:
        return SimpleStatementNode.of(node.getKind());
      case IF:
        {
          IfNode ifNode = (IfNode) node;
          return new IfNode(
              copyNode(ifNode.getTest()),
              copyList(ifNode.getBody()),
              copyList(ifNode.getOrelse()));
        }
      case WHILE:
        {
          WhileNode loop = (WhileNode) node;
          return new WhileNode(
              copyNode(loop.getTest()), copyList(loop.getBody()), copyList(loop.getOrelse()));
        }
      case FOR:
        {
          ForNode loop = (ForNode) node;
          return new ForNode(
              copyNode(loop.getTarget()),
              copyNode(loop.getIter()),
              copyList(loop.getBody()),
              copyList(loop.getOrelse()));
        }
      case FUNCTION_DEF:
        {
          FunctionDefNode def = (FunctionDefNode) node;
          return new FunctionDefNode(
              def.getName(), copyNode(def.getArgs()), copyList(def.getBody()));
        }
      case CLASS_DEF:
        {
          ClassDefNode def = (ClassDefNode) node;
          return new ClassDefNode(def.getName(), copyList(def.getBases()), copyList(def.getBody()));
        }
      case ARGUMENTS:
        {
          ArgumentsNode args = (ArgumentsNode) node;
          return new ArgumentsNode(copyList(args.getArgs()), copyList(args.getDefaults()));
        }
      case ARG:
        return new ArgNode(((ArgNode) node).getArg());
      case KEYWORD:
        {
          KeywordNode keyword = (KeywordNode) node;
          return new KeywordNode(keyword.getArg(), copyNode(keyword.getValue()));
        }
      case NAME:
        {
          NameNode name = (NameNode) node;
          return new NameNode(name.getId(), name.getCtx());
        }
      case NUM:
        return new NumNode(((NumNode) node).getN());
      case STR:
        {
          StrNode str = (StrNode) node;
          return new StrNode(str.getS(), str.getTypePrefix());
        }
      case BYTES:
        return new BytesNode(((BytesNode) node).getS().clone());
      case JOINED_STR:
        return new JoinedStrNode(copyList(((JoinedStrNode) node).getValues()));
      case FORMATTED_VALUE:
        {
          FormattedValueNode value = (FormattedValueNode) node;
          return new FormattedValueNode(
              copyNode(value.getValue()), value.getConversion(), copyOrNull(value.getFormatSpec()));
        }
      case CONSTANT:
        return new ConstantNode(((ConstantNode) node).getValue());
      case BIN_OP:
        {
          BinOpNode op = (BinOpNode) node;
          return new BinOpNode(copyNode(op.getLeft()), op.getOp(), copyNode(op.getRight()));
        }
      case BOOL_OP:
        {
          BoolOpNode op = (BoolOpNode) node;
          return new BoolOpNode(op.getOp(), copyList(op.getValues()));
        }
      case UNARY_OP:
        {
          UnaryOpNode op = (UnaryOpNode) node;
          return new UnaryOpNode(op.getOp(), copyNode(op.getOperand()));
        }
      case COMPARE:
        {
          CompareNode compare = (CompareNode) node;
          return new CompareNode(
              copyNode(compare.getLeft()),
              new ArrayList<>(compare.getOps()),
              copyList(compare.getComparators()));
        }
      case CALL:
        {
          CallNode call = (CallNode) node;
          return new CallNode(
              copyNode(call.getFunc()), copyList(call.getArgs()), copyList(call.getKeywords()));
        }
      case ATTRIBUTE:
        {
          AttributeNode attribute = (AttributeNode) node;
          return new AttributeNode(
              copyNode(attribute.getValue()), attribute.getAttr(), attribute.getCtx());
        }
      case SUBSCRIPT:
        {
          SubscriptNode subscript = (SubscriptNode) node;
          return new SubscriptNode(
              copyNode(subscript.getValue()), copyNode(subscript.getSlice()), subscript.getCtx());
        }
      case TUPLE:
        {
          TupleNode tuple = (TupleNode) node;
          return new TupleNode(copyList(tuple.getElts()), tuple.getCtx());
        }
      case LIST:
        {
          ListNode list = (ListNode) node;
          return new ListNode(copyList(list.getElts()), list.getCtx());
        }
    }
    throw new IllegalStateException("unhandled node kind: " + node.getKind());
  }

  private @Nullable Node copyOrNull(@Nullable Node node) {
    return node == null ? null : copyNode(node);
  }

  private List<Node> copyList(List<Node> nodes) {
    List<Node> copies = new ArrayList<>(nodes.size());
    for (Node node : nodes) {
      copies.add(copyNode(node));
    }
    return copies;
  }
}
