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

import com.google.common.cache.CacheBuilder;
import com.treescan.cache.CacheEntry;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Remembers the deepest depth each target was requested at. Children seen in a fetch are recorded
 * at depth 0. This is visit history only; cache lookups never consult it.
 */
final class NodeCompletenessTracker {

  /** Cache for visit depths keyed by target, bounded independently of the entry store. */
  private final ConcurrentMap<String, Integer> visits;

  NodeCompletenessTracker(boolean bounded, int maxTrackedNodes) {
    if (bounded) {
      // A single segment keeps eviction in strict least-recently-used order.
      this.visits =
          CacheBuilder.newBuilder()
              .concurrencyLevel(1)
              .maximumSize(maxTrackedNodes)
              .<String, Integer>build()
              .asMap();
    } else {
      this.visits = new ConcurrentHashMap<>();
    }
  }

  void recordVisit(String target, int depth) {
    visits.merge(target, depth, NodeCompletenessTracker::deeperOf);
  }

  void recordDiscovered(String target) {
    recordVisit(target, 0);
  }

  boolean wasVisited(String target) {
    return visits.containsKey(target);
  }

  OptionalInt getVisitedDepth(String target) {
    Integer depth = visits.get(target);
    return depth == null ? OptionalInt.empty() : OptionalInt.of(depth);
  }

  int size() {
    return visits.size();
  }

  void clear() {
    visits.clear();
  }

  private static Integer deeperOf(Integer current, Integer candidate) {
    return CacheEntry.isDeeper(candidate, current) ? candidate : current;
  }
}
