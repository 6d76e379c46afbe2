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

import static org.junit.Assert.assertEquals;

import com.google.common.collect.ImmutableMap;
import org.junit.Test;

public class CacheStatsTest {

  @Test
  public void hitRateIsZeroWithoutLookups() {
    CacheStats stats = new CacheStats(0, 0, 0, 0, 3, 0, 0, 0, 0);
    assertEquals(0.0, stats.getHitRate(), 0.0);
  }

  @Test
  public void hitRateCountsHitsOverHitsAndMisses() {
    CacheStats stats = new CacheStats(3, 1, 0, 0, 10, 0, 5, 1, 0);
    assertEquals(0.75, stats.getHitRate(), 1e-9);
  }

  @Test
  public void exportsEveryCounter() {
    CacheStats stats = new CacheStats(1, 2, 3, 4, 5, 6, 7, 8, 1024 * 1024);
    ImmutableMap<String, Object> map = stats.toMap();
    assertEquals(1L, map.get("hits"));
    assertEquals(2L, map.get("misses"));
    assertEquals(3L, map.get("evictions"));
    assertEquals(4L, map.get("invalidations"));
    assertEquals(5L, map.get("bypasses"));
    assertEquals(6L, map.get("upgrades"));
    assertEquals(7L, map.get("deduped_waits"));
    assertEquals(8, map.get("entries"));
    assertEquals(1024L * 1024, map.get("memory_bytes"));
    assertEquals(1.0, (Double) map.get("memory_mb"), 1e-9);
  }
}
