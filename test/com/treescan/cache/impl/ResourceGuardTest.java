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

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.treescan.cache.CacheConfig;
import com.treescan.cache.CacheEntry;
import org.junit.Test;

public class ResourceGuardTest {

  @Test
  public void admitsWithinLimits() {
    ResourceGuard guard = new ResourceGuard(CacheConfig.defaults());
    assertTrue(guard.admits("/proj/src", 1));
    assertTrue(guard.admits("/proj/src", 50));
    assertTrue(guard.admits("/proj/src", CacheEntry.COMPLETE_DEPTH));
  }

  @Test
  public void rejectsDepthAboveMaxCacheDepthButNotComplete() {
    ResourceGuard guard = new ResourceGuard(CacheConfig.builder().setMaxCacheDepth(2).build());
    assertTrue(guard.admits("/p", 2));
    assertFalse(guard.admits("/p", 3));
    assertTrue(guard.admits("/p", CacheEntry.COMPLETE_DEPTH));
  }

  @Test
  public void rejectsTargetsWithTooManyComponents() {
    ResourceGuard guard = new ResourceGuard(CacheConfig.builder().setMaxPathDepth(2).build());
    assertTrue(guard.admits("/a", 1));
    assertTrue(guard.admits("a/b", 1));
    assertFalse(guard.admits("/a/b", 1));
    assertFalse(guard.admits("C:/a/b", 1));
  }

  @Test
  public void zeroDepthLimitsAreUnlimited() {
    ResourceGuard guard =
        new ResourceGuard(CacheConfig.builder().setMaxCacheDepth(0).setMaxPathDepth(0).build());
    assertTrue(guard.admits("/a/b/c/d/e/f/g/h/i/j/k/l/m/n/o/p/q/r/s/t/u/v/w/x/y/z/0/1/2/3/4", 99));
  }

  @Test
  public void zeroMaxEntriesRejectsEverything() {
    ResourceGuard guard = new ResourceGuard(CacheConfig.builder().setMaxEntries(0).build());
    assertFalse(guard.admits("/p", 1));
  }

  @Test
  public void disabledGuardAdmitsEverything() {
    ResourceGuard guard =
        new ResourceGuard(
            CacheConfig.builder()
                .setEnableOomProtection(false)
                .setMaxEntries(0)
                .setMaxCacheDepth(1)
                .setMaxPathDepth(1)
                .build());
    assertFalse(guard.isEnabled());
    assertTrue(guard.admits("/a/b/c", 5));
  }
}
