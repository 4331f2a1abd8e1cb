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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.devtools.loom.formatting.FormattingStore;

/**
 * A parsed module together with the formatting recorded while parsing it. This is the unit that is
 * transformed in place and printed; callers must not print and edit the same tree concurrently.
 */
public final class AnnotatedTree {
  private final ModuleNode root;
  private final FormattingStore formatting;

  public AnnotatedTree(ModuleNode root, FormattingStore formatting) {
    this.root = checkNotNull(root);
    this.formatting = checkNotNull(formatting);
  }

  /** Wraps a tree built in code, which has no recorded formatting. */
  public static AnnotatedTree unformatted(ModuleNode root) {
    return new AnnotatedTree(root, new FormattingStore());
  }

  public ModuleNode getRoot() {
    return root;
  }

  public FormattingStore getFormatting() {
    return formatting;
  }
}
