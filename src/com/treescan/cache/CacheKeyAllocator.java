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

import com.google.common.base.Preconditions;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Hands out per-class instance ids and builds {@link CacheKey}s from them.
 *
 * <p>Every caching adapter draws its id once, at construction. Ids of one class are strictly
 * increasing and start at 1, so two adapters sharing an allocator never build equal keys.
 */
@ThreadSafe
public final class CacheKeyAllocator {

  private static final CacheKeyAllocator SHARED = new CacheKeyAllocator();

  private final ConcurrentMap<Class<?>, AtomicInteger> counters = new ConcurrentHashMap<>();

  /** The process-wide allocator used by adapters that are not given one explicitly. */
  public static CacheKeyAllocator shared() {
    return SHARED;
  }

  public int allocateInstanceId(Class<?> adapterClass) {
    Preconditions.checkNotNull(adapterClass);
    return counters.computeIfAbsent(adapterClass, k -> new AtomicInteger()).incrementAndGet();
  }

  public CacheKey makeKey(
      int instanceId, String classId, CacheKey.Kind kind, String target, int depth) {
    Preconditions.checkArgument(instanceId > 0, "instance id %s was not allocated", instanceId);
    Preconditions.checkArgument(
        depth >= CacheEntry.COMPLETE_DEPTH, "invalid depth %s for %s", depth, target);
    return new CacheKey(classId, instanceId, kind, target, depth);
  }
}
