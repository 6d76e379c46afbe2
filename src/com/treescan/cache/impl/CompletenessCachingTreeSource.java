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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.treescan.cache.CacheConfig;
import com.treescan.cache.CacheEntry;
import com.treescan.cache.CacheKey;
import com.treescan.cache.CacheKeyAllocator;
import com.treescan.cache.CacheResult;
import com.treescan.cache.CacheStats;
import com.treescan.cache.CachingTreeSource;
import com.treescan.source.TreeNode;
import com.treescan.source.TreeSource;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Caches the children a wrapped {@link TreeSource} returns, remembering how deep each target was
 * scanned.
 *
 * <p>A request is answered from the cache when an entry for the target covers the requested depth
 * and, if the node exposes a modification time, the node has not changed since. Otherwise one fetch
 * per key runs against the wrapped source, however many callers ask concurrently, and its result is
 * stored if the configured bounds allow.
 *
 * <p>Each instance owns its store and draws its own instance id, so several instances may be stacked
 * over the same source without sharing entries.
 */
public class CompletenessCachingTreeSource<N extends TreeNode> implements CachingTreeSource<N> {

  private static final Logger LOG = LoggerFactory.getLogger(CompletenessCachingTreeSource.class);

  private final TreeSource<N> delegate;
  private final CacheConfig config;
  private final CacheKeyAllocator allocator;
  private final String classId;
  private final int instanceId;
  private final CompletenessCacheStore<N> store;
  private final NodeCompletenessTracker tracker;
  private final StalenessValidator validator;
  private final InFlightRequests<CacheKey, CacheResult<N>> inFlight = new InFlightRequests<>();
  private final CacheInvalidator invalidator;

  public CompletenessCachingTreeSource(TreeSource<N> delegate, CacheConfig config) {
    this(delegate, config, CacheKeyAllocator.shared(), Ticker.systemTicker());
  }

  @VisibleForTesting
  CompletenessCachingTreeSource(
      TreeSource<N> delegate, CacheConfig config, CacheKeyAllocator allocator, Ticker ticker) {
    this.delegate = Preconditions.checkNotNull(delegate);
    this.config = Preconditions.checkNotNull(config);
    this.allocator = Preconditions.checkNotNull(allocator);
    this.classId = getClass().getName();
    this.instanceId = allocator.allocateInstanceId(getClass());
    ResourceGuard guard = new ResourceGuard(config);
    this.store = new CompletenessCacheStore<>(config, guard);
    this.tracker =
        new NodeCompletenessTracker(config.isOomProtectionEnabled(), config.getMaxTrackedNodes());
    this.validator = new StalenessValidator(config.getValidationTtlSeconds(), ticker);
    this.invalidator = new CacheInvalidator(store, tracker);
  }

  public static <N extends TreeNode> CompletenessCachingTreeSource<N> create(
      TreeSource<N> delegate) {
    return new CompletenessCachingTreeSource<>(delegate, CacheConfig.defaults());
  }

  public static <N extends TreeNode> CompletenessCachingTreeSource<N> create(
      TreeSource<N> delegate, CacheConfig config) {
    return new CompletenessCachingTreeSource<>(delegate, config);
  }

  @Override
  public ListenableFuture<List<N>> getChildren(N node) {
    return getChildren(node, true, null);
  }

  @Override
  public ListenableFuture<List<N>> getChildren(N node, boolean useCache, @Nullable Integer depth) {
    int requested = depth == null ? config.getDefaultDepth() : depth;
    return Futures.transform(
        getOrFetch(node, requested, useCache), CacheResult::getData, directExecutor());
  }

  @Override
  public ListenableFuture<CacheResult<N>> getChildrenAtDepth(N node, int depth) {
    return getOrFetch(node, depth, true);
  }

  private ListenableFuture<CacheResult<N>> getOrFetch(N node, int depth, boolean useCache) {
    Preconditions.checkNotNull(node, "node");
    Preconditions.checkArgument(
        depth == CacheEntry.COMPLETE_DEPTH || (depth >= 0 && depth <= config.getMaxDepth()),
        "depth %s must be %s or within [0, %s]",
        depth,
        CacheEntry.COMPLETE_DEPTH,
        config.getMaxDepth());

    if (!useCache) {
      store.recordBypass();
      return Futures.transform(
          fetchFromDelegate(node),
          children -> CacheResult.of(CacheResult.Outcome.BYPASS, children),
          directExecutor());
    }

    String target = TargetPaths.normalize(node.identifier());
    tracker.recordVisit(target, depth);
    return lookup(node, keyFor(target, depth));
  }

  private ListenableFuture<CacheResult<N>> lookup(N node, CacheKey key) {
    Optional<CompletenessCacheStore.Match<N>> match = store.find(key);
    if (!match.isPresent()) {
      return inFlight.run(key, () -> fetchAndStore(node, key));
    }

    CompletenessCacheStore.Match<N> found = match.get();
    if (!validator.needsValidation(found.getEntry())) {
      return Futures.immediateFuture(store.recordHit(found));
    }
    return Futures.transformAsync(
        validator.validate(node, found.getEntry()),
        verdict -> {
          if (verdict == StalenessValidator.Verdict.STALE) {
            store.removeIfSame(found.getKey(), found.getEntry());
            return lookup(node, key);
          }
          if (verdict == StalenessValidator.Verdict.FRESH) {
            found.getEntry().refresh(validator.now());
          }
          return Futures.immediateFuture(store.recordHit(found));
        },
        directExecutor());
  }

  /**
   * Fetches and stores the children for {@code key}. Runs once per key at a time. The modification
   * time is read before listing so that a change made during the listing leaves the entry stale.
   */
  private ListenableFuture<CacheResult<N>> fetchAndStore(N node, CacheKey key) {
    store.recordMiss();
    return Futures.transformAsync(
        validator.readModifiedTime(node),
        mtime ->
            Futures.transform(
                fetchFromDelegate(node),
                children -> {
                  for (N child : children) {
                    tracker.recordDiscovered(TargetPaths.normalize(child.identifier()));
                  }
                  CacheResult.Outcome outcome = store.put(key, children, mtime, validator.now());
                  return CacheResult.of(outcome, children);
                },
                directExecutor()),
        directExecutor());
  }

  private ListenableFuture<ImmutableList<N>> fetchFromDelegate(N node) {
    ListenableFuture<List<N>> children;
    try {
      children = delegate.getChildren(node);
    } catch (RuntimeException e) {
      return Futures.immediateFailedFuture(e);
    }
    ListenableFuture<ImmutableList<N>> copied =
        Futures.transform(children, list -> ImmutableList.copyOf(list), directExecutor());
    if (LOG.isDebugEnabled()) {
      Futures.addCallback(copied, new FailureLogger(node.identifier()), directExecutor());
    }
    return copied;
  }

  @Override
  public int invalidate(String target, boolean deep) {
    return invalidator.invalidate(target, deep);
  }

  @Override
  public int invalidateAll() {
    return invalidator.invalidateAll();
  }

  @Override
  public int invalidateNode(@Nullable N node, boolean deep) {
    return invalidator.invalidateNode(node, deep);
  }

  @Override
  public int invalidateNodes(Iterable<? extends N> nodes, boolean ignoreErrors) {
    return invalidator.invalidateNodes(nodes, false, ignoreErrors);
  }

  public int invalidateNodes(Iterable<? extends N> nodes, boolean deep, boolean ignoreErrors) {
    return invalidator.invalidateNodes(nodes, deep, ignoreErrors);
  }

  @Override
  public void clearCache() {
    int removed = store.clear();
    LOG.debug("Cleared {} entries", removed);
  }

  @Override
  public boolean wasVisited(String target) {
    return tracker.wasVisited(TargetPaths.normalize(target));
  }

  @Override
  public OptionalInt getVisitedDepth(String target) {
    return tracker.getVisitedDepth(TargetPaths.normalize(target));
  }

  public int getTrackedNodeCount() {
    return tracker.size();
  }

  @Override
  public CacheStats getStats() {
    return store.getStats(inFlight.getDedupedWaits());
  }

  public CacheConfig getConfig() {
    return config;
  }

  /** The key this instance stores the children of {@code target} at {@code depth} under. */
  @VisibleForTesting
  CacheKey keyFor(String target, int depth) {
    return allocator.makeKey(
        instanceId, classId, CacheKey.Kind.COMPLETENESS, TargetPaths.normalize(target), depth);
  }

  @VisibleForTesting
  CompletenessCacheStore<N> getStore() {
    return store;
  }

  @VisibleForTesting
  InFlightRequests<CacheKey, CacheResult<N>> getInFlightRequests() {
    return inFlight;
  }

  private static final class FailureLogger implements FutureCallback<Object> {
    private final String target;

    FailureLogger(String target) {
      this.target = target;
    }

    @Override
    public void onSuccess(@Nullable Object result) {}

    @Override
    public void onFailure(Throwable t) {
      LOG.debug("Fetching children of {} failed", target, t);
    }
  }
}
