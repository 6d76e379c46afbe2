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

import com.treescan.cache.CacheConfig;
import com.treescan.cache.CacheEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a freshly fetched result may be stored. A rejected result is still handed to the
 * caller. With OOM protection disabled every result is admitted.
 *
 * <p>A {@code maxCacheDepth} or {@code maxPathDepth} of 0 switches that particular check off.
 */
final class ResourceGuard {

  private static final Logger LOG = LoggerFactory.getLogger(ResourceGuard.class);

  private final boolean enabled;
  private final int maxEntries;
  private final int maxCacheDepth;
  private final int maxPathDepth;

  ResourceGuard(CacheConfig config) {
    this.enabled = config.isOomProtectionEnabled();
    this.maxEntries = config.getMaxEntries();
    this.maxCacheDepth = config.getMaxCacheDepth();
    this.maxPathDepth = config.getMaxPathDepth();
  }

  boolean isEnabled() {
    return enabled;
  }

  boolean admits(String target, int depth) {
    if (!enabled) {
      return true;
    }
    if (maxEntries == 0) {
      LOG.trace("Not caching {}: caching is disabled by maxEntries=0", target);
      return false;
    }
    if (maxCacheDepth > 0 && depth != CacheEntry.COMPLETE_DEPTH && depth > maxCacheDepth) {
      LOG.trace("Not caching {}: depth {} exceeds {}", target, depth, maxCacheDepth);
      return false;
    }
    if (maxPathDepth > 0) {
      int components = TargetPaths.componentCount(target);
      if (components > maxPathDepth) {
        LOG.trace("Not caching {}: {} path components exceed {}", target, components, maxPathDepth);
        return false;
      }
    }
    return true;
  }
}
