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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.treescan.cache.CacheConfig;
import com.treescan.cache.CacheEntry;
import com.treescan.cache.CacheKey;
import com.treescan.cache.CacheResult;
import com.treescan.cache.CacheStats;
import com.treescan.source.TreeNode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.TreeMap;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entries of one caching adapter, with memory accounting and least-recently-used eviction.
 *
 * <p>With OOM protection enabled the entries live in an access-ordered map and every insert evicts
 * the eldest entries until both the entry and the memory bound hold again. Without it the map is
 * unordered and nothing is ever evicted.
 */
@ThreadSafe
class CompletenessCacheStore<N extends TreeNode> {

  private static final Logger LOG = LoggerFactory.getLogger(CompletenessCacheStore.class);

  @VisibleForTesting static final long ENTRY_OVERHEAD = 200;
  @VisibleForTesting static final long OBJECT_OVERHEAD = 56;
  private static final long REFERENCE_SIZE = 8;
  private static final int KEY_FIELDS = 5;
  private static final int SIZE_SAMPLE = 10;

  private final ResourceGuard guard;
  private final boolean bounded;
  private final int maxEntries;
  private final long maxMemoryBytes;

  /** Entries keyed by full key, in access order when bounded. */
  @GuardedBy("this")
  private final Map<CacheKey, CacheEntry<N>> entries;

  /**
   * The same entries grouped by target and ordered by depth, so that lookups by target neither scan
   * the whole store nor disturb the access order.
   */
  @GuardedBy("this")
  private final Map<String, TreeMap<Integer, Match<N>>> entriesByTarget = new HashMap<>();

  @GuardedBy("this")
  private long currentMemory;

  @GuardedBy("this")
  private long hits;

  @GuardedBy("this")
  private long misses;

  @GuardedBy("this")
  private long evictions;

  @GuardedBy("this")
  private long invalidations;

  @GuardedBy("this")
  private long bypasses;

  @GuardedBy("this")
  private long upgrades;

  CompletenessCacheStore(CacheConfig config, ResourceGuard guard) {
    this.guard = guard;
    this.bounded = config.isOomProtectionEnabled();
    this.maxEntries = config.getMaxEntries();
    this.maxMemoryBytes = config.getMaxMemoryBytes();
    this.entries = bounded ? new LinkedHashMap<>(16, 0.75f, true) : new HashMap<>();
  }

  /** A stored entry able to answer a request, and the key it is stored under. */
  static final class Match<N> {
    private final CacheKey key;
    private final CacheEntry<N> entry;

    Match(CacheKey key, CacheEntry<N> entry) {
      this.key = key;
      this.entry = entry;
    }

    CacheKey getKey() {
      return key;
    }

    CacheEntry<N> getEntry() {
      return entry;
    }
  }

  /**
   * Finds an entry that satisfies {@code key}'s depth: the entry at exactly that depth, else the
   * complete entry for the target, else any deeper partial entry. Staleness is not checked here.
   */
  synchronized Optional<Match<N>> find(CacheKey key) {
    TreeMap<Integer, Match<N>> byDepth = entriesByTarget.get(key.getTarget());
    if (byDepth == null) {
      return Optional.empty();
    }
    int requested = key.getDepth();
    Match<N> exact = byDepth.get(requested);
    if (exact != null) {
      return Optional.of(exact);
    }
    Match<N> complete = byDepth.get(CacheEntry.COMPLETE_DEPTH);
    if (complete != null) {
      return Optional.of(complete);
    }
    if (requested == CacheEntry.COMPLETE_DEPTH) {
      return Optional.empty();
    }
    Map.Entry<Integer, Match<N>> deeper = byDepth.higherEntry(requested);
    return deeper == null ? Optional.empty() : Optional.of(deeper.getValue());
  }

  /** Counts a hit on {@code match}, refreshes its recency and returns its data. */
  synchronized CacheResult<N> recordHit(Match<N> match) {
    hits++;
    CacheEntry<N> entry = match.getEntry();
    entry.recordAccess();
    if (entries.get(match.getKey()) != entry) {
      LOG.trace("{} was dropped while being served", match.getKey());
    }
    return CacheResult.of(CacheResult.Outcome.HIT, entry.getData());
  }

  synchronized void recordMiss() {
    misses++;
  }

  synchronized void recordBypass() {
    bypasses++;
  }

  /**
   * Stores a fetched result if the guard admits it. Entries of the same target that are shallower
   * than the new one are superseded, i.e. removed.
   *
   * @return {@link CacheResult.Outcome#SUPERSEDED} if shallower entries were replaced, {@link
   *     CacheResult.Outcome#MISS} otherwise
   */
  synchronized CacheResult.Outcome put(
      CacheKey key, ImmutableList<N> data, OptionalLong mtime, long nowNanos) {
    if (!guard.admits(key.getTarget(), key.getDepth())) {
      return CacheResult.Outcome.MISS;
    }
    long size = estimateSize(key, data);
    if (bounded && size > maxMemoryBytes) {
      LOG.debug("Not caching {}: {} bytes exceed the memory limit", key, size);
      return CacheResult.Outcome.MISS;
    }

    int superseded = supersedeShallower(key);
    removeEntry(key);
    CacheEntry<N> entry = new CacheEntry<>(data, key.getDepth(), mtime, nowNanos, size);
    entries.put(key, entry);
    entriesByTarget
        .computeIfAbsent(key.getTarget(), t -> new TreeMap<>())
        .put(key.getDepth(), new Match<>(key, entry));
    currentMemory += size;
    evictIfNeeded();
    return superseded > 0 ? CacheResult.Outcome.SUPERSEDED : CacheResult.Outcome.MISS;
  }

  @GuardedBy("this")
  private int supersedeShallower(CacheKey key) {
    TreeMap<Integer, Match<N>> byDepth = entriesByTarget.get(key.getTarget());
    if (byDepth == null) {
      return 0;
    }
    List<Integer> shallower = new ArrayList<>();
    for (Integer depth : byDepth.keySet()) {
      if (depth != key.getDepth() && CacheEntry.isDeeper(key.getDepth(), depth)) {
        shallower.add(depth);
      }
    }
    for (Integer depth : shallower) {
      removeEntry(key.withDepth(depth));
      upgrades++;
      LOG.debug("Superseded depth {} of {} with depth {}", depth, key.getTarget(), key.getDepth());
    }
    return shallower.size();
  }

  @GuardedBy("this")
  private void evictIfNeeded() {
    if (!bounded) {
      return;
    }
    while ((entries.size() > maxEntries || currentMemory > maxMemoryBytes) && !entries.isEmpty()) {
      Iterator<Map.Entry<CacheKey, CacheEntry<N>>> eldest = entries.entrySet().iterator();
      Map.Entry<CacheKey, CacheEntry<N>> next = eldest.next();
      CacheKey key = next.getKey();
      CacheEntry<N> entry = next.getValue();
      eldest.remove();
      unindex(key, entry);
      evictions++;
      LOG.debug("Evicted {} ({} bytes)", key, entry.getSizeEstimate());
    }
  }

  /** Removes {@code entry} if it is still the one stored under {@code key}. */
  synchronized boolean removeIfSame(CacheKey key, CacheEntry<N> entry) {
    if (peek(key) != entry) {
      return false;
    }
    removeEntry(key);
    return true;
  }

  /**
   * Removes every entry of {@code target}, and with {@code deep} of its descendants, counting them
   * as invalidations.
   */
  synchronized int invalidateTarget(String target, boolean deep) {
    List<String> targets = new ArrayList<>();
    if (deep) {
      for (String candidate : entriesByTarget.keySet()) {
        if (TargetPaths.isSelfOrDescendant(candidate, target)) {
          targets.add(candidate);
        }
      }
    } else if (entriesByTarget.containsKey(target)) {
      targets.add(target);
    }

    int removed = 0;
    for (String each : targets) {
      TreeMap<Integer, Match<N>> byDepth = entriesByTarget.remove(each);
      for (Match<N> match : byDepth.values()) {
        entries.remove(match.getKey());
        currentMemory -= match.getEntry().getSizeEstimate();
      }
      removed += byDepth.size();
    }
    invalidations += removed;
    return removed;
  }

  /** Removes everything, counting it as invalidations. */
  synchronized int invalidateAll() {
    int removed = clear();
    invalidations += removed;
    return removed;
  }

  /** Removes everything without touching the counters. Returns the number of entries removed. */
  synchronized int clear() {
    int removed = entries.size();
    entries.clear();
    entriesByTarget.clear();
    currentMemory = 0;
    return removed;
  }

  synchronized CacheStats getStats(long dedupedWaits) {
    return new CacheStats(
        hits,
        misses,
        evictions,
        invalidations,
        bypasses,
        upgrades,
        dedupedWaits,
        entries.size(),
        currentMemory);
  }

  /** Returns the entry stored under exactly {@code key} without refreshing its recency. */
  @Nullable
  synchronized CacheEntry<N> getIfPresent(CacheKey key) {
    return peek(key);
  }

  synchronized int size() {
    return entries.size();
  }

  synchronized long getCurrentMemory() {
    return currentMemory;
  }

  /** Keys from least to most recently used when bounded, in no particular order otherwise. */
  @VisibleForTesting
  synchronized ImmutableList<CacheKey> keys() {
    return ImmutableList.copyOf(entries.keySet());
  }

  @GuardedBy("this")
  @Nullable
  private CacheEntry<N> peek(CacheKey key) {
    TreeMap<Integer, Match<N>> byDepth = entriesByTarget.get(key.getTarget());
    if (byDepth == null) {
      return null;
    }
    Match<N> match = byDepth.get(key.getDepth());
    return match == null ? null : match.getEntry();
  }

  @GuardedBy("this")
  @Nullable
  private CacheEntry<N> removeEntry(CacheKey key) {
    CacheEntry<N> entry = entries.remove(key);
    if (entry != null) {
      unindex(key, entry);
    }
    return entry;
  }

  @GuardedBy("this")
  private void unindex(CacheKey key, CacheEntry<N> entry) {
    currentMemory -= entry.getSizeEstimate();
    TreeMap<Integer, Match<N>> byDepth = entriesByTarget.get(key.getTarget());
    if (byDepth != null) {
      byDepth.remove(key.getDepth());
      if (byDepth.isEmpty()) {
        entriesByTarget.remove(key.getTarget());
      }
    }
  }

  /**
   * Rough number of bytes an entry keeps alive: fixed overheads for the map slot, the key and the
   * list, plus the identifiers of up to {@value #SIZE_SAMPLE} children extrapolated to all of them.
   */
  static long estimateSize(CacheKey key, List<? extends TreeNode> data) {
    Preconditions.checkNotNull(data);
    long keySize = OBJECT_OVERHEAD + KEY_FIELDS * REFERENCE_SIZE + 2L * key.getTarget().length();
    long dataSize = OBJECT_OVERHEAD + REFERENCE_SIZE * data.size();
    if (!data.isEmpty()) {
      int sampled = Math.min(data.size(), SIZE_SAMPLE);
      long sampleSize = 0;
      for (int i = 0; i < sampled; i++) {
        sampleSize += OBJECT_OVERHEAD + 2L * data.get(i).identifier().length();
      }
      dataSize += sampleSize * data.size() / sampled;
    }
    return ENTRY_OVERHEAD + keySize + dataSize;
  }
}
