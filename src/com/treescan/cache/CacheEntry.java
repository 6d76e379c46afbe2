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
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.OptionalLong;

/**
 * Children of one target, scanned to {@link #getDepth()} levels.
 *
 * <p>A depth of {@link #COMPLETE_DEPTH} means the whole subtree was scanned and nothing remains
 * below; it satisfies every request. A partial entry of depth {@code n} satisfies requests up to
 * {@code n}.
 */
public final class CacheEntry<N> {

  public static final int COMPLETE_DEPTH = -1;

  private final ImmutableList<N> data;
  private final int depth;
  private final OptionalLong mtime;
  private final long sizeEstimate;
  private volatile long cachedAtNanos;
  private volatile int accessCount;

  public CacheEntry(
      ImmutableList<N> data, int depth, OptionalLong mtime, long cachedAtNanos, long sizeEstimate) {
    Preconditions.checkArgument(depth >= COMPLETE_DEPTH, "invalid depth %s", depth);
    Preconditions.checkArgument(sizeEstimate >= 0, "negative size estimate %s", sizeEstimate);
    this.data = Preconditions.checkNotNull(data);
    this.depth = depth;
    this.mtime = Preconditions.checkNotNull(mtime);
    this.cachedAtNanos = cachedAtNanos;
    this.sizeEstimate = sizeEstimate;
  }

  /** Whether this entry holds enough of the subtree to answer a request for {@code requested}. */
  public boolean satisfies(int requested) {
    if (depth == COMPLETE_DEPTH) {
      return true;
    }
    if (requested == COMPLETE_DEPTH) {
      return false;
    }
    return depth >= requested;
  }

  public boolean isComplete() {
    return depth == COMPLETE_DEPTH;
  }

  public boolean isPartial() {
    return depth != COMPLETE_DEPTH;
  }

  /** Whether {@code candidate} covers strictly more of the subtree than {@code current}. */
  public static boolean isDeeper(int candidate, int current) {
    if (current == COMPLETE_DEPTH) {
      return false;
    }
    return candidate == COMPLETE_DEPTH || candidate > current;
  }

  public ImmutableList<N> getData() {
    return data;
  }

  public int getDepth() {
    return depth;
  }

  /** Modification time of the source node when it was scanned, if the node exposed one. */
  public OptionalLong getMtime() {
    return mtime;
  }

  public long getCachedAtNanos() {
    return cachedAtNanos;
  }

  /** Restarts the validation TTL after the entry was found to be fresh. */
  public void refresh(long nowNanos) {
    cachedAtNanos = nowNanos;
  }

  public int getAccessCount() {
    return accessCount;
  }

  /** Called by the owning store, with its lock held, on every hit. */
  public void recordAccess() {
    accessCount++;
  }

  public long getSizeEstimate() {
    return sizeEstimate;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("children", data.size())
        .add("depth", depth == COMPLETE_DEPTH ? "COMPLETE" : String.valueOf(depth))
        .add("mtime", mtime)
        .add("size", sizeEstimate)
        .toString();
  }
}
