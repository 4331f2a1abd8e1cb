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

import com.google.auto.value.AutoValue;

/** Options for printing trees. */
@AutoValue
public abstract class PrinterOptions {
  /** Indentation step used when a tree records none. */
  public static final String DEFAULT_INDENT_DIFF = "  ";

  /** The indentation step for blocks when neither the block nor the tree records one. */
  public abstract String fallbackIndentDiff();

  public static PrinterOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_PrinterOptions.Builder().setFallbackIndentDiff(DEFAULT_INDENT_DIFF);
  }

  /** Builder for {@link PrinterOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setFallbackIndentDiff(String indentDiff);

    public abstract PrinterOptions build();
  }
}
