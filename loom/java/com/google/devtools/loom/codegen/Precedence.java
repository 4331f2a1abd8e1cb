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

import com.google.devtools.loom.ast.BinOpNode;
import com.google.devtools.loom.ast.BoolOpNode;
import com.google.devtools.loom.ast.Node;
import com.google.devtools.loom.ast.NumNode;
import com.google.devtools.loom.ast.TupleNode;
import com.google.devtools.loom.ast.UnaryOpNode;

/**
 * Binding strength of expressions, from loosest to tightest. A child whose precedence is lower
 * than its position requires must be parenthesized.
 */
final class Precedence {
  /** Statement-level positions, where a bare tuple is allowed. */
  static final int TUPLE = 0;

  static final int OR = 1;
  static final int AND = 2;
  static final int NOT = 3;
  static final int COMPARISON = 4;
  static final int BIT_OR = 5;
  static final int BIT_XOR = 6;
  static final int BIT_AND = 7;
  static final int SHIFT = 8;
  static final int ARITH = 9;
  static final int TERM = 10;
  static final int FACTOR = 11;
  static final int POWER = 12;

  /** Atoms and trailers: names, literals, displays, calls, attributes and subscripts. */
  static final int ATOM = 13;

  /** Any single expression: what call arguments, list elements and conditions accept. */
  static final int TEST = OR;

  private Precedence() {}

  /** Returns how tightly {@code node} binds when written without parentheses. */
  static int of(Node node) {
    switch (node.getKind()) {
      case TUPLE:
        return ((TupleNode) node).getElts().isEmpty() ? ATOM : TUPLE;
      case BOOL_OP:
        return "or".equals(((BoolOpNode) node).getOp()) ? OR : AND;
      case UNARY_OP:
        return "not".equals(((UnaryOpNode) node).getOp()) ? NOT : FACTOR;
      case COMPARE:
        return COMPARISON;
      case BIN_OP:
        return ofBinaryOperator(((BinOpNode) node).getOp());
      case NUM:
        return Literals.reprNumber(((NumNode) node).getN()).startsWith("-") ? FACTOR : ATOM;
      default:
        return ATOM;
    }
  }

  static int ofBinaryOperator(String op) {
    switch (op) {
      case "|":
        return BIT_OR;
      case "^":
        return BIT_XOR;
      case "&":
        return BIT_AND;
      case "<<":
      case ">>":
        return SHIFT;
      case "+":
      case "-":
        return ARITH;
      case "*":
      case "/":
      case "//":
      case "%":
      case "@":
        return TERM;
      case "**":
        return POWER;
      default:
        throw new IllegalArgumentException("unknown binary operator " + op);
    }
  }
}
