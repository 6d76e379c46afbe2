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

package com.treescan.cache.impl;

import static com.google.common.util.concurrent.MoreExecutors.directExecutor;

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Runs at most one fetch per key at a time. Callers arriving while a fetch for their key is running
 * share its future and observe the same value or the same exception.
 *
 * <p>The registry entry of a fetch is removed before its waiters are released, whatever the
 * outcome, so the next caller after a failure starts a fresh fetch.
 */
@ThreadSafe
final class InFlightRequests<K, V> {

  private final ConcurrentMap<K, SettableFuture<V>> inFlight = new ConcurrentHashMap<>();
  private final AtomicLong dedupedWaits = new AtomicLong();

  /**
   * Returns the future of the fetch running for {@code key}, starting {@code fetch} if there is
   * none. Cancelling the returned future does not cancel the shared fetch.
   */
  ListenableFuture<V> run(K key, Callable<ListenableFuture<V>> fetch) {
    SettableFuture<V> placeholder = SettableFuture.create();
    SettableFuture<V> existing = inFlight.putIfAbsent(key, placeholder);
    if (existing != null) {
      dedupedWaits.incrementAndGet();
      return Futures.nonCancellationPropagating(existing);
    }

    ListenableFuture<V> fetched;
    try {
      fetched = fetch.call();
    } catch (Exception e) {
      inFlight.remove(key, placeholder);
      placeholder.setException(e);
      return Futures.nonCancellationPropagating(placeholder);
    }
    fetched.addListener(
        () -> {
          inFlight.remove(key, placeholder);
          placeholder.setFuture(fetched);
        },
        directExecutor());
    return Futures.nonCancellationPropagating(placeholder);
  }

  boolean isInFlight(K key) {
    return inFlight.containsKey(key);
  }

  int size() {
    return inFlight.size();
  }

  long getDedupedWaits() {
    return dedupedWaits.get();
  }
}
