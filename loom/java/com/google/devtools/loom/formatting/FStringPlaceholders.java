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

package com.google.devtools.loom.formatting;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The placeholder scheme of stored f-string templates.
 *
 * <p>The {@code content} of an f-string is its verbatim token text with the source of each embedded
 * expression replaced by a numbered placeholder. Placeholders are numbered in the order the
 * expressions appear, outer expression before the expressions nested in its format spec.
 * Substitution scans the template only, so text substituted for one placeholder is never searched
 * for another.
 */
public final class FStringPlaceholders {
  private static final Pattern PLACEHOLDER = Pattern.compile("__loom_fstring_val_(\\d+)__");

  private FStringPlaceholders() {}

  public static String placeholder(int index) {
    return "__loom_fstring_val_" + index + "__";
  }

  /** Returns the number of placeholders in {@code template}, counting only in-sequence ones. */
  public static int count(String template) {
    Matcher matcher = PLACEHOLDER.matcher(template);
    int expected = 0;
    while (matcher.find()) {
      if (isIndex(matcher, expected)) {
        expected++;
      }
    }
    return expected;
  }

  /**
   * Replaces placeholder {@code i} of {@code template} with {@code values.get(i)}.
   *
   * @throws IllegalArgumentException if the template does not hold exactly one placeholder per
   *     value.
   */
  public static String substitute(String template, List<String> values) {
    int placeholders = count(template);
    if (placeholders != values.size()) {
      throw new IllegalArgumentException(
          String.format(
              "f-string template has %d placeholders for %d values",
              placeholders, values.size()));
    }
    StringBuilder out = new StringBuilder(template.length());
    Matcher matcher = PLACEHOLDER.matcher(template);
    int expected = 0;
    int last = 0;
    while (expected < values.size() && matcher.find()) {
      if (isIndex(matcher, expected)) {
        out.append(template, last, matcher.start()).append(values.get(expected++));
        last = matcher.end();
      }
    }
    return out.append(template, last, template.length()).toString();
  }

  private static boolean isIndex(Matcher matcher, int index) {
    return matcher.group(1).equals(Integer.toString(index));
  }
}
