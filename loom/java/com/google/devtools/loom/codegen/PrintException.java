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

/**
 * Thrown when a tree cannot be printed, typically because a node's fields do not have the shape
 * its kind requires (a missing child, mismatched list lengths, a value of the wrong type).
 */
public final class PrintException extends RuntimeException {
  public PrintException(String message, Throwable cause) {
    super(message, cause);
  }
}
