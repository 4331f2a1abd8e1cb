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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.devtools.loom.ast.BytesNode;
import com.google.devtools.loom.ast.CompareNode;
import com.google.devtools.loom.ast.ExprContext;
import com.google.devtools.loom.ast.NameNode;
import com.google.devtools.loom.ast.NumNode;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link FormattingStore}. */
@RunWith(JUnit4.class)
public class FormattingStoreTest {

  @Test
  public void testFragmentsAndFlags() {
    FormattingStore store = new FormattingStore();
    NameNode name = new NameNode("x", ExprContext.LOAD);
    assertThat(store.get(name, "prefix")).isNull();
    assertThat(store.has(name, "prefix")).isFalse();

    store.set(name, "prefix", "  ");
    store.setFlag(name, "is_elif", true);
    assertThat(store.get(name, "prefix")).isEqualTo("  ");
    assertThat(store.has(name, "is_elif")).isTrue();
    assertThat(store.getFlag(name, "is_elif")).isTrue();
    assertThat(store.get(name, "is_elif")).isNull();
    assertThat(store.getFlag(name, "prefix")).isFalse();
  }

  @Test
  public void testEntriesAreKeyedByIdentity() {
    FormattingStore store = new FormattingStore();
    NameNode first = new NameNode("x", ExprContext.LOAD);
    NameNode second = new NameNode("x", ExprContext.LOAD);
    store.set(first, "prefix", "#");
    assertThat(store.get(second, "prefix")).isNull();
  }

  @Test
  public void testSnapshotIsDetachedFromLiveList() {
    FormattingStore store = new FormattingStore();
    List<String> ops = new ArrayList<>(ImmutableList.of("<"));
    CompareNode compare =
        new CompareNode(
            new NameNode("a", ExprContext.LOAD), ops, ImmutableList.of(new NumNode(1)));
    store.recordDependency(compare, "ops");
    compare.getOps().set(0, ">");

    assertThat(store.hasSnapshot(compare, "ops")).isTrue();
    assertThat(store.getSnapshot(compare, "ops")).isEqualTo(ImmutableList.of("<"));
    assertThat(store.has(compare, "ops" + FormattingStore.SNAPSHOT_SUFFIX)).isTrue();
  }

  @Test
  public void testSnapshotIsDetachedFromLiveBytes() {
    FormattingStore store = new FormattingStore();
    BytesNode bytes = new BytesNode(new byte[] {1, 2});
    store.recordDependency(bytes, "s");
    bytes.getS()[0] = 9;
    assertThat((byte[]) store.getSnapshot(bytes, "s")).isEqualTo(new byte[] {1, 2});
  }

  @Test
  public void testCopy() {
    FormattingStore store = new FormattingStore();
    NumNode from = new NumNode(1);
    NumNode to = new NumNode(1);
    store.set(from, "content", "0x1");
    store.recordDependency(from, "n");
    store.set(to, "prefix", " ");
    store.set(to, "content", "1");

    store.copy(from, to);
    assertThat(store.get(to, "content")).isEqualTo("0x1");
    assertThat(store.get(to, "prefix")).isEqualTo(" ");
    assertThat(store.getSnapshot(to, "n")).isEqualTo(1);

    store.set(to, "content", "01");
    assertThat(store.get(from, "content")).isEqualTo("0x1");
  }

  @Test
  public void testEntriesKeepRecordingOrder() {
    FormattingStore store = new FormattingStore();
    NumNode num = new NumNode(5);
    store.set(num, "suffix", ")");
    store.set(num, "prefix", "(");
    store.recordDependency(num, "n");
    assertThat(store.entries(num).keySet())
        .containsExactly("suffix", "prefix", "n__src")
        .inOrder();
    assertThat(store.entries(new NumNode(5))).isEmpty();
  }
}
