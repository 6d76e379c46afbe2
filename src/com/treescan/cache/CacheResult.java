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

/** Children returned for a request, tagged with how the cache produced them. */
public final class CacheResult<N> {

  public enum Outcome {
    /** Served from a stored entry that satisfied the requested depth. */
    HIT,
    /** Fetched from the source. */
    MISS,
    /** Fetched from the source, and the new entry replaced shallower entries for the target. */
    SUPERSEDED,
    /** Fetched from the source with the cache bypassed entirely. */
    BYPASS,
  }

  private final Outcome outcome;
  private final ImmutableList<N> data;

  private CacheResult(Outcome outcome, ImmutableList<N> data) {
    this.outcome = Preconditions.checkNotNull(outcome);
    this.data = Preconditions.checkNotNull(data);
  }

  public static <N> CacheResult<N> of(Outcome outcome, ImmutableList<N> data) {
    return new CacheResult<>(outcome, data);
  }

  public Outcome getOutcome() {
    return outcome;
  }

  public ImmutableList<N> getData() {
    return data;
  }

  public boolean wasHit() {
    return outcome == Outcome.HIT;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("outcome", outcome)
        .add("children", data.size())
        .toString();
  }
}
