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

/** Kinds of lexical tokens. */
enum TokenKind {
  NAME,
  NUMBER,
  STRING,
  OP,
  /** End of a logical line. The text is empty when the file ends without a line break. */
  NEWLINE,
  /** Start of a deeper block; the text is the new indentation, which is never written out. */
  INDENT,
  DEDENT,
  EOF
}
