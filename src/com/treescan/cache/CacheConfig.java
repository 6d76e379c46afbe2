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

/**
 * Limits of a completeness-aware cache. Built through {@link #builder()}; {@link Builder#build()}
 * rejects out-of-range values with a {@link ConfigurationException}.
 */
public final class CacheConfig {

  public static final int DEFAULT_MAX_ENTRIES = 10_000;
  public static final double DEFAULT_MAX_MEMORY_MB = 100;
  public static final int DEFAULT_MAX_CACHE_DEPTH = 50;
  public static final int DEFAULT_MAX_PATH_DEPTH = 30;
  public static final int DEFAULT_MAX_TRACKED_NODES = 10_000;
  public static final double DEFAULT_VALIDATION_TTL_SECONDS = 5.0;
  public static final int DEFAULT_MAX_DEPTH = 100;
  public static final int DEFAULT_DEPTH = 1;

  private final boolean enableOomProtection;
  private final int maxEntries;
  private final double maxMemoryMb;
  private final int maxCacheDepth;
  private final int maxPathDepth;
  private final int maxTrackedNodes;
  private final double validationTtlSeconds;
  private final int maxDepth;
  private final int defaultDepth;

  private CacheConfig(Builder builder) {
    this.enableOomProtection = builder.enableOomProtection;
    this.maxEntries = builder.maxEntries;
    this.maxMemoryMb = builder.maxMemoryMb;
    this.maxCacheDepth = builder.maxCacheDepth;
    this.maxPathDepth = builder.maxPathDepth;
    this.maxTrackedNodes = builder.maxTrackedNodes;
    this.validationTtlSeconds = builder.validationTtlSeconds;
    this.maxDepth = builder.maxDepth;
    this.defaultDepth = builder.defaultDepth;
  }

  public static CacheConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** When false, every bound below is ignored and the cache grows without limit. */
  public boolean isOomProtectionEnabled() {
    return enableOomProtection;
  }

  public int getMaxEntries() {
    return maxEntries;
  }

  public double getMaxMemoryMb() {
    return maxMemoryMb;
  }

  public long getMaxMemoryBytes() {
    return (long) (maxMemoryMb * 1024 * 1024);
  }

  /** Results of requests deeper than this are returned but not stored. */
  public int getMaxCacheDepth() {
    return maxCacheDepth;
  }

  /** Targets with more path components than this are returned but not stored. */
  public int getMaxPathDepth() {
    return maxPathDepth;
  }

  public int getMaxTrackedNodes() {
    return maxTrackedNodes;
  }

  /**
   * Seconds a stored modification time is trusted before the source is asked again. Zero validates
   * on every hit; a negative value never validates.
   */
  public double getValidationTtlSeconds() {
    return validationTtlSeconds;
  }

  /** Largest depth a request may name, apart from {@link CacheEntry#COMPLETE_DEPTH}. */
  public int getMaxDepth() {
    return maxDepth;
  }

  /** Depth used when a request does not name one. */
  public int getDefaultDepth() {
    return defaultDepth;
  }

  public Builder toBuilder() {
    return new Builder()
        .setEnableOomProtection(enableOomProtection)
        .setMaxEntries(maxEntries)
        .setMaxMemoryMb(maxMemoryMb)
        .setMaxCacheDepth(maxCacheDepth)
        .setMaxPathDepth(maxPathDepth)
        .setMaxTrackedNodes(maxTrackedNodes)
        .setValidationTtlSeconds(validationTtlSeconds)
        .setMaxDepth(maxDepth)
        .setDefaultDepth(defaultDepth);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("enableOomProtection", enableOomProtection)
        .add("maxEntries", maxEntries)
        .add("maxMemoryMb", maxMemoryMb)
        .add("maxCacheDepth", maxCacheDepth)
        .add("maxPathDepth", maxPathDepth)
        .add("maxTrackedNodes", maxTrackedNodes)
        .add("validationTtlSeconds", validationTtlSeconds)
        .add("maxDepth", maxDepth)
        .add("defaultDepth", defaultDepth)
        .toString();
  }

  public static final class Builder {
    private boolean enableOomProtection = true;
    private int maxEntries = DEFAULT_MAX_ENTRIES;
    private double maxMemoryMb = DEFAULT_MAX_MEMORY_MB;
    private int maxCacheDepth = DEFAULT_MAX_CACHE_DEPTH;
    private int maxPathDepth = DEFAULT_MAX_PATH_DEPTH;
    private int maxTrackedNodes = DEFAULT_MAX_TRACKED_NODES;
    private double validationTtlSeconds = DEFAULT_VALIDATION_TTL_SECONDS;
    private int maxDepth = DEFAULT_MAX_DEPTH;
    private int defaultDepth = DEFAULT_DEPTH;

    private Builder() {}

    public Builder setEnableOomProtection(boolean enableOomProtection) {
      this.enableOomProtection = enableOomProtection;
      return this;
    }

    public Builder setMaxEntries(int maxEntries) {
      this.maxEntries = maxEntries;
      return this;
    }

    public Builder setMaxMemoryMb(double maxMemoryMb) {
      this.maxMemoryMb = maxMemoryMb;
      return this;
    }

    public Builder setMaxCacheDepth(int maxCacheDepth) {
      this.maxCacheDepth = maxCacheDepth;
      return this;
    }

    public Builder setMaxPathDepth(int maxPathDepth) {
      this.maxPathDepth = maxPathDepth;
      return this;
    }

    public Builder setMaxTrackedNodes(int maxTrackedNodes) {
      this.maxTrackedNodes = maxTrackedNodes;
      return this;
    }

    public Builder setValidationTtlSeconds(double validationTtlSeconds) {
      this.validationTtlSeconds = validationTtlSeconds;
      return this;
    }

    public Builder setMaxDepth(int maxDepth) {
      this.maxDepth = maxDepth;
      return this;
    }

    public Builder setDefaultDepth(int defaultDepth) {
      this.defaultDepth = defaultDepth;
      return this;
    }

    public CacheConfig build() {
      check(maxEntries >= 0, "maxEntries must be >= 0, got " + maxEntries);
      check(
          maxMemoryMb >= 0 && !Double.isNaN(maxMemoryMb) && !Double.isInfinite(maxMemoryMb),
          "maxMemoryMb must be a finite number >= 0, got " + maxMemoryMb);
      check(maxDepth >= 1, "maxDepth must be >= 1, got " + maxDepth);
      check(maxCacheDepth >= 0, "maxCacheDepth must be >= 0, got " + maxCacheDepth);
      check(maxPathDepth >= 0, "maxPathDepth must be >= 0, got " + maxPathDepth);
      check(maxTrackedNodes >= 0, "maxTrackedNodes must be >= 0, got " + maxTrackedNodes);
      check(
          !Double.isNaN(validationTtlSeconds),
          "validationTtlSeconds must be a number, got " + validationTtlSeconds);
      check(
          defaultDepth == CacheEntry.COMPLETE_DEPTH || (defaultDepth >= 0 && defaultDepth <= maxDepth),
          "defaultDepth must be " + CacheEntry.COMPLETE_DEPTH + " or within [0, " + maxDepth
              + "], got " + defaultDepth);
      return new CacheConfig(this);
    }

    private static void check(boolean condition, String message) {
      if (!condition) {
        throw new ConfigurationException(message);
      }
    }
  }
}
