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

import com.google.common.util.concurrent.ListenableFuture;
import com.treescan.source.TreeNode;
import com.treescan.source.TreeSource;
import java.util.List;
import java.util.OptionalInt;
import javax.annotation.Nullable;

/**
 * A {@link TreeSource} that remembers the children it enumerated. Being a source itself, one
 * caching layer may wrap another.
 */
public interface CachingTreeSource<N extends TreeNode> extends TreeSource<N> {

  /**
   * Children of {@code node}.
   *
   * @param useCache when false, the wrapped source is asked directly and the cache is left as is
   * @param depth depth the result has to cover, {@link CacheEntry#COMPLETE_DEPTH} for the whole
   *     subtree, or null for the configured default
   */
  ListenableFuture<List<N>> getChildren(N node, boolean useCache, @Nullable Integer depth);

  /** Like {@link #getChildren(TreeNode, boolean, Integer)}, but tells whether the cache answered. */
  ListenableFuture<CacheResult<N>> getChildrenAtDepth(N node, int depth);

  /**
   * Drops every entry stored for {@code target}, at any depth, and with {@code deep} those of its
   * descendants too.
   *
   * @return number of entries dropped
   */
  int invalidate(String target, boolean deep);

  /** Drops every entry and all visit tracking. Returns the number of entries dropped. */
  int invalidateAll();

  /**
   * Drops the entries of {@code node}.
   *
   * @throws InvalidTargetException if the node is null or has no identifier
   */
  int invalidateNode(@Nullable N node, boolean deep);

  /**
   * Drops the entries of each node in turn.
   *
   * @param ignoreErrors skip nodes that cannot be resolved instead of failing on them
   */
  int invalidateNodes(Iterable<? extends N> nodes, boolean ignoreErrors);

  /** Drops every entry but keeps counters and visit tracking. */
  void clearCache();

  boolean wasVisited(String target);

  /** Deepest depth {@code target} was requested at, or 0 if it was only seen as a child. */
  OptionalInt getVisitedDepth(String target);

  CacheStats getStats();
}
