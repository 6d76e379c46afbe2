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
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.Before;
import org.junit.Test;

public class InFlightRequestsTest {

  private InFlightRequests<String, String> requests;
  private AtomicInteger fetches;

  @Before
  public void setUp() {
    requests = new InFlightRequests<>();
    fetches = new AtomicInteger();
  }

  private ListenableFuture<String> run(String key, ListenableFuture<String> result) {
    return requests.run(
        key,
        () -> {
          fetches.incrementAndGet();
          return result;
        });
  }

  @Test
  public void concurrentCallersShareOneFetch() throws Exception {
    SettableFuture<String> fetch = SettableFuture.create();
    ListenableFuture<String> first = run("k", fetch);
    ListenableFuture<String> second = run("k", Futures.immediateFuture("other"));
    ListenableFuture<String> third = run("k", Futures.immediateFuture("other"));

    assertEquals(1, fetches.get());
    assertTrue(requests.isInFlight("k"));
    assertEquals(2, requests.getDedupedWaits());
    assertFalse(second.isDone());

    fetch.set("value");

    assertEquals("value", first.get());
    assertEquals("value", second.get());
    assertEquals("value", third.get());
    assertFalse(requests.isInFlight("k"));
    assertEquals(0, requests.size());
  }

  @Test
  public void differentKeysFetchIndependently() {
    run("a", SettableFuture.create());
    run("b", SettableFuture.create());

    assertEquals(2, fetches.get());
    assertEquals(2, requests.size());
    assertEquals(0, requests.getDedupedWaits());
  }

  @Test
  public void failureReachesEveryWaiterAndIsNotRemembered() throws Exception {
    SettableFuture<String> fetch = SettableFuture.create();
    ListenableFuture<String> first = run("k", fetch);
    ListenableFuture<String> second = run("k", fetch);
    IllegalStateException failure = new IllegalStateException("listing failed");

    fetch.setException(failure);

    assertSame(failure, causeOf(first));
    assertSame(failure, causeOf(second));
    assertFalse(requests.isInFlight("k"));

    assertEquals("retried", run("k", Futures.immediateFuture("retried")).get());
    assertEquals(2, fetches.get());
  }

  @Test
  public void fetchThrowingSynchronouslyFailsTheFuture() {
    IllegalArgumentException failure = new IllegalArgumentException("bad node");
    ListenableFuture<String> result =
        requests.run(
            "k",
            () -> {
              throw failure;
            });

    assertSame(failure, causeOf(result));
    assertFalse(requests.isInFlight("k"));
  }

  @Test
  public void registryIsClearedBeforeWaitersAreReleased() {
    SettableFuture<String> fetch = SettableFuture.create();
    ListenableFuture<String> waiter = run("k", fetch);
    AtomicBoolean stillInFlight = new AtomicBoolean(true);
    waiter.addListener(() -> stillInFlight.set(requests.isInFlight("k")), directExecutor());

    fetch.set("value");

    assertFalse(stillInFlight.get());
  }

  @Test
  public void cancellingOneCallerLeavesTheSharedFetchRunning() throws Exception {
    SettableFuture<String> fetch = SettableFuture.create();
    ListenableFuture<String> first = run("k", fetch);
    ListenableFuture<String> second = run("k", fetch);

    assertTrue(first.cancel(true));

    assertFalse(fetch.isCancelled());
    fetch.set("value");
    assertEquals("value", second.get());
  }

  private static Throwable causeOf(ListenableFuture<?> future) {
    try {
      future.get();
      fail("Expected " + future + " to fail");
      return null;
    } catch (ExecutionException e) {
      return e.getCause();
    } catch (InterruptedException e) {
      throw new AssertionError(e);
    }
  }
}
