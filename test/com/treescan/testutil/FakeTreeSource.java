/*
 * Copyright (c) Facebook, Inc. and its affiliates.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.treescan.testutil;

import static com.google.common.util.concurrent.MoreExecutors.directExecutor;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import com.treescan.source.TreeSource;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.Nullable;

/**
 * In-memory source that counts how often each node is listed. Listings can be held back with
 * {@link #holdFetches()} to keep several requests in flight at once.
 */
public class FakeTreeSource implements TreeSource<FakeNode> {

  private final ConcurrentMap<String, ImmutableList<FakeNode>> children = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, RuntimeException> failures = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, AtomicInteger> calls = new ConcurrentHashMap<>();
  private final AtomicInteger totalCalls = new AtomicInteger();
  @Nullable private volatile SettableFuture<Void> gate;

  /** Adds children named {@code parent + "/" + name} without a modification time. */
  public FakeTreeSource addChildren(String parent, String... names) {
    ImmutableList.Builder<FakeNode> builder = ImmutableList.builder();
    for (String name : names) {
      builder.add(FakeNode.of(parent + "/" + name));
    }
    children.put(parent, builder.build());
    return this;
  }

  public FakeTreeSource setChildren(String parent, List<FakeNode> nodes) {
    children.put(parent, ImmutableList.copyOf(nodes));
    return this;
  }

  /** Makes every listing of {@code parent} fail with {@code failure}; null restores it. */
  public void failWith(String parent, @Nullable RuntimeException failure) {
    if (failure == null) {
      failures.remove(parent);
    } else {
      failures.put(parent, failure);
    }
  }

  /** Delays all listings started from now on until the returned future is set. */
  public SettableFuture<Void> holdFetches() {
    SettableFuture<Void> newGate = SettableFuture.create();
    gate = newGate;
    return newGate;
  }

  public void releaseFetches() {
    SettableFuture<Void> current = gate;
    gate = null;
    if (current != null) {
      current.set(null);
    }
  }

  @Override
  public ListenableFuture<List<FakeNode>> getChildren(FakeNode node) {
    String id = node.identifier();
    totalCalls.incrementAndGet();
    calls.computeIfAbsent(id, k -> new AtomicInteger()).incrementAndGet();
    SettableFuture<Void> current = gate;
    if (current == null) {
      return list(id);
    }
    return Futures.transformAsync(current, ignored -> list(id), directExecutor());
  }

  private ListenableFuture<List<FakeNode>> list(String id) {
    RuntimeException failure = failures.get(id);
    if (failure != null) {
      return Futures.immediateFailedFuture(failure);
    }
    List<FakeNode> result = children.getOrDefault(id, ImmutableList.of());
    return Futures.immediateFuture(result);
  }

  public int getCallCount(String id) {
    AtomicInteger count = calls.get(id);
    return count == null ? 0 : count.get();
  }

  public int getTotalCalls() {
    return totalCalls.get();
  }
}
