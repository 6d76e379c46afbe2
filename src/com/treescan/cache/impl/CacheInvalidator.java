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

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.treescan.cache.InvalidTargetException;
import com.treescan.source.TreeNode;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual invalidation of a store. Fetches running while entries are invalidated may still store
 * their result afterwards.
 */
final class CacheInvalidator {

  private static final Logger LOG = LoggerFactory.getLogger(CacheInvalidator.class);

  private final CompletenessCacheStore<?> store;
  private final NodeCompletenessTracker tracker;

  CacheInvalidator(CompletenessCacheStore<?> store, NodeCompletenessTracker tracker) {
    this.store = store;
    this.tracker = tracker;
  }

  int invalidate(String target, boolean deep) {
    Preconditions.checkNotNull(target, "target");
    String normalized = TargetPaths.normalize(target);
    if (deep && TargetPaths.isRoot(normalized)) {
      return invalidateAll();
    }
    int removed = store.invalidateTarget(normalized, deep);
    LOG.debug("Invalidated {} entries for {} (deep={})", removed, normalized, deep);
    return removed;
  }

  int invalidateAll() {
    int removed = store.invalidateAll();
    tracker.clear();
    LOG.debug("Invalidated all {} entries", removed);
    return removed;
  }

  int invalidateNode(@Nullable TreeNode node, boolean deep) {
    return invalidate(resolve(node), deep);
  }

  int invalidateNodes(Iterable<? extends TreeNode> nodes, boolean deep, boolean ignoreErrors) {
    Preconditions.checkNotNull(nodes, "nodes");
    int total = 0;
    for (TreeNode node : nodes) {
      try {
        total += invalidateNode(node, deep);
      } catch (InvalidTargetException e) {
        if (!ignoreErrors) {
          throw e;
        }
        LOG.debug("Skipping node that cannot be invalidated", e);
      }
    }
    return total;
  }

  private static String resolve(@Nullable TreeNode node) {
    if (node == null) {
      throw new InvalidTargetException("Cannot invalidate a null node");
    }
    String identifier;
    try {
      identifier = node.identifier();
    } catch (RuntimeException e) {
      throw new InvalidTargetException("Cannot resolve the identifier of " + node, e);
    }
    if (Strings.isNullOrEmpty(identifier)) {
      throw new InvalidTargetException("Node " + node + " has no identifier");
    }
    return identifier;
  }
}
