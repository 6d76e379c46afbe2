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

package com.treescan.cache;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

/** Point-in-time snapshot of a cache's counters. */
public final class CacheStats {

  private static final double BYTES_PER_MB = 1024.0 * 1024.0;

  private final long hits;
  private final long misses;
  private final long evictions;
  private final long invalidations;
  private final long bypasses;
  private final long upgrades;
  private final long dedupedWaits;
  private final int entries;
  private final long memoryBytes;

  public CacheStats(
      long hits,
      long misses,
      long evictions,
      long invalidations,
      long bypasses,
      long upgrades,
      long dedupedWaits,
      int entries,
      long memoryBytes) {
    this.hits = hits;
    this.misses = misses;
    this.evictions = evictions;
    this.invalidations = invalidations;
    this.bypasses = bypasses;
    this.upgrades = upgrades;
    this.dedupedWaits = dedupedWaits;
    this.entries = entries;
    this.memoryBytes = memoryBytes;
  }

  public long getHits() {
    return hits;
  }

  public long getMisses() {
    return misses;
  }

  public long getEvictions() {
    return evictions;
  }

  public long getInvalidations() {
    return invalidations;
  }

  public long getBypasses() {
    return bypasses;
  }

  public long getUpgrades() {
    return upgrades;
  }

  /** Callers that joined a fetch already in flight for the same key instead of starting one. */
  public long getDedupedWaits() {
    return dedupedWaits;
  }

  public int getEntries() {
    return entries;
  }

  public long getMemoryBytes() {
    return memoryBytes;
  }

  public double getMemoryMb() {
    return memoryBytes / BYTES_PER_MB;
  }

  /** Hits over lookups, or 0 before the first lookup. */
  public double getHitRate() {
    long lookups = hits + misses;
    return lookups == 0 ? 0.0 : (double) hits / lookups;
  }

  public ImmutableMap<String, Object> toMap() {
    return ImmutableMap.<String, Object>builder()
        .put("hits", hits)
        .put("misses", misses)
        .put("evictions", evictions)
        .put("invalidations", invalidations)
        .put("bypasses", bypasses)
        .put("upgrades", upgrades)
        .put("deduped_waits", dedupedWaits)
        .put("entries", entries)
        .put("memory_bytes", memoryBytes)
        .put("memory_mb", getMemoryMb())
        .put("hit_rate", getHitRate())
        .build();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).addValue(toMap()).toString();
  }
}
