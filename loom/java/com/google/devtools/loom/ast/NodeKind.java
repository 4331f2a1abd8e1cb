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

import com.google.common.collect.ImmutableList;

/** The closed set of syntax node kinds, with the ordered names of each kind's fields. */
public enum NodeKind {
  // Statements
  MODULE("Module", Category.STATEMENT, "body"),
  ASSIGN("Assign", Category.STATEMENT, "targets", "value"),
  AUG_ASSIGN("AugAssign", Category.STATEMENT, "target", "op", "value"),
  EXPR("Expr", Category.STATEMENT, "value"),
  RETURN("Return", Category.STATEMENT, "value"),
  PASS("Pass", Category.STATEMENT),
  BREAK("Break", Category.STATEMENT),
  CONTINUE("Continue", Category.STATEMENT),
  IF("If", Category.STATEMENT, "test", "body", "orelse"),
  WHILE("While", Category.STATEMENT, "test", "body", "orelse"),
  FOR("For", Category.STATEMENT, "target", "iter", "body", "orelse"),
  FUNCTION_DEF("FunctionDef", Category.STATEMENT, "name", "args", "body"),
  CLASS_DEF("ClassDef", Category.STATEMENT, "name", "bases", "body"),

  // Helpers that are neither statements nor expressions
  ARGUMENTS("arguments", Category.OTHER, "args", "defaults"),
  ARG("arg", Category.OTHER, "arg"),
  KEYWORD("keyword", Category.OTHER, "arg", "value"),

  // Expressions
  NAME("Name", Category.EXPRESSION, "id", "ctx"),
  NUM("Num", Category.EXPRESSION, "n"),
  STR("Str", Category.EXPRESSION, "s", "kind"),
  BYTES("Bytes", Category.EXPRESSION, "s"),
  JOINED_STR("JoinedStr", Category.EXPRESSION, "values"),
  FORMATTED_VALUE("FormattedValue", Category.EXPRESSION, "value", "conversion", "format_spec"),
  CONSTANT("Constant", Category.EXPRESSION, "value"),
  BIN_OP("BinOp", Category.EXPRESSION, "left", "op", "right"),
  BOOL_OP("BoolOp", Category.EXPRESSION, "op", "values"),
  UNARY_OP("UnaryOp", Category.EXPRESSION, "op", "operand"),
  COMPARE("Compare", Category.EXPRESSION, "left", "ops", "comparators"),
  CALL("Call", Category.EXPRESSION, "func", "args", "keywords"),
  ATTRIBUTE("Attribute", Category.EXPRESSION, "value", "attr", "ctx"),
  SUBSCRIPT("Subscript", Category.EXPRESSION, "value", "slice", "ctx"),
  TUPLE("Tuple", Category.EXPRESSION, "elts", "ctx"),
  LIST("List", Category.EXPRESSION, "elts", "ctx");

  enum Category {
    STATEMENT,
    EXPRESSION,
    OTHER
  }

  private final String displayName;
  private final Category category;
  private final ImmutableList<String> fields;

  NodeKind(String displayName, Category category, String... fields) {
    this.displayName = displayName;
    this.category = category;
    this.fields = ImmutableList.copyOf(fields);
  }

  /** Returns the kind's name as written in tree dumps and error messages. */
  public String getDisplayName() {
    return displayName;
  }

  /** Returns the names of the kind's fields, in source order. */
  public ImmutableList<String> getFields() {
    return fields;
  }

  public boolean isStatement() {
    return category == Category.STATEMENT;
  }

  public boolean isExpression() {
    return category == Category.EXPRESSION;
  }

  @Override
  public String toString() {
    return displayName;
  }
}
