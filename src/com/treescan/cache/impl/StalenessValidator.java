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

import static com.google.common.util.concurrent.MoreExecutors.directExecutor;

import com.google.common.base.Ticker;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.treescan.cache.CacheEntry;
import com.treescan.source.NodeMetadata;
import com.treescan.source.TreeNode;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compares the modification time stored with an entry against the node's current one.
 *
 * <p>Checks are throttled: an entry is only re-checked once the validation TTL has passed since it
 * was stored or last confirmed. Any failure to read the current time is treated as "unknown" and
 * the entry is served as is.
 */
final class StalenessValidator {

  private static final Logger LOG = LoggerFactory.getLogger(StalenessValidator.class);

  enum Verdict {
    FRESH,
    STALE,
    UNKNOWN,
  }

  private static final long DISABLED = -1;

  private final long ttlNanos;
  private final Ticker ticker;

  StalenessValidator(double ttlSeconds, Ticker ticker) {
    this.ttlNanos = ttlSeconds < 0 ? DISABLED : (long) (ttlSeconds * TimeUnit.SECONDS.toNanos(1));
    this.ticker = ticker;
  }

  long now() {
    return ticker.read();
  }

  boolean needsValidation(CacheEntry<?> entry) {
    return ttlNanos != DISABLED
        && entry.getMtime().isPresent()
        && now() - entry.getCachedAtNanos() >= ttlNanos;
  }

  ListenableFuture<Verdict> validate(TreeNode node, CacheEntry<?> entry) {
    long stored = entry.getMtime().getAsLong();
    return Futures.transform(
        readModifiedTime(node),
        current -> {
          if (!current.isPresent()) {
            return Verdict.UNKNOWN;
          }
          if (current.getAsLong() != stored) {
            LOG.debug(
                "{} changed since it was cached (mtime {} -> {})",
                node.identifier(),
                stored,
                current.getAsLong());
            return Verdict.STALE;
          }
          return Verdict.FRESH;
        },
        directExecutor());
  }

  /** The node's modification time, or empty if it has none or it cannot be read. */
  ListenableFuture<OptionalLong> readModifiedTime(TreeNode node) {
    ListenableFuture<NodeMetadata> metadata;
    try {
      metadata = node.metadata();
    } catch (RuntimeException e) {
      LOG.debug("Reading metadata of {} failed", node.identifier(), e);
      return Futures.immediateFuture(OptionalLong.empty());
    }
    return Futures.catching(
        Futures.transform(metadata, NodeMetadata::getModifiedTimeMillis, directExecutor()),
        Exception.class,
        e -> {
          LOG.debug("Reading metadata of {} failed", node.identifier(), e);
          return OptionalLong.empty();
        },
        directExecutor());
  }
}
