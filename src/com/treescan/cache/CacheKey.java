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
import java.util.Objects;

/**
 * Key of a cached enumeration. The owning adapter's class and instance are part of the key so that
 * several caching layers stacked over the same source never share entries.
 */
public final class CacheKey {

  /** What kind of data is stored under the key. */
  public enum Kind {
    /** Children of a node, scanned to a given depth. */
    COMPLETENESS,
  }

  private final String adapterClassId;
  private final int adapterInstanceId;
  private final Kind kind;
  private final String target;
  private final int depth;

  CacheKey(String adapterClassId, int adapterInstanceId, Kind kind, String target, int depth) {
    this.adapterClassId = Preconditions.checkNotNull(adapterClassId);
    this.adapterInstanceId = adapterInstanceId;
    this.kind = Preconditions.checkNotNull(kind);
    this.target = Preconditions.checkNotNull(target);
    this.depth = depth;
  }

  public String getAdapterClassId() {
    return adapterClassId;
  }

  public int getAdapterInstanceId() {
    return adapterInstanceId;
  }

  public Kind getKind() {
    return kind;
  }

  public String getTarget() {
    return target;
  }

  public int getDepth() {
    return depth;
  }

  /** The key for the same owner and target at another depth. */
  public CacheKey withDepth(int newDepth) {
    if (newDepth == depth) {
      return this;
    }
    return new CacheKey(adapterClassId, adapterInstanceId, kind, target, newDepth);
  }

  /** Whether both keys name the same target of the same owner, regardless of depth. */
  public boolean sameTarget(CacheKey other) {
    return adapterInstanceId == other.adapterInstanceId
        && kind == other.kind
        && adapterClassId.equals(other.adapterClassId)
        && target.equals(other.target);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CacheKey)) {
      return false;
    }
    CacheKey that = (CacheKey) o;
    return depth == that.depth && sameTarget(that);
  }

  @Override
  public int hashCode() {
    return Objects.hash(adapterClassId, adapterInstanceId, kind, target, depth);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("class", adapterClassId)
        .add("instance", adapterInstanceId)
        .add("kind", kind)
        .add("target", target)
        .add("depth", depth == CacheEntry.COMPLETE_DEPTH ? "COMPLETE" : String.valueOf(depth))
        .toString();
  }
}
