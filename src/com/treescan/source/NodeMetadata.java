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

package com.treescan.source;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import javax.annotation.Nullable;

/** Immutable bag of attributes describing a {@link TreeNode}. */
public final class NodeMetadata {

  /** Modification time in milliseconds since the epoch. */
  public static final String MODIFIED_TIME = "modified_time";

  /** Size in bytes. */
  public static final String SIZE = "size";

  public static final String IS_DIRECTORY = "is_directory";

  private static final NodeMetadata EMPTY = new NodeMetadata(ImmutableMap.of());

  private final ImmutableMap<String, Object> attributes;

  private NodeMetadata(ImmutableMap<String, Object> attributes) {
    this.attributes = attributes;
  }

  /** Metadata carrying no attributes at all, and therefore no modification time. */
  public static NodeMetadata empty() {
    return EMPTY;
  }

  public static NodeMetadata of(Map<String, ?> attributes) {
    Object modified = attributes.get(MODIFIED_TIME);
    Preconditions.checkArgument(
        modified == null || modified instanceof Long,
        "%s must be a Long of epoch millis, got %s",
        MODIFIED_TIME,
        modified);
    return attributes.isEmpty() ? EMPTY : new NodeMetadata(ImmutableMap.copyOf(attributes));
  }

  public static NodeMetadata withModifiedTime(long modifiedTimeMillis) {
    return new NodeMetadata(ImmutableMap.of(MODIFIED_TIME, modifiedTimeMillis));
  }

  public OptionalLong getModifiedTimeMillis() {
    Object value = attributes.get(MODIFIED_TIME);
    return value == null ? OptionalLong.empty() : OptionalLong.of((Long) value);
  }

  @Nullable
  public Object get(String name) {
    return attributes.get(name);
  }

  public ImmutableMap<String, Object> asMap() {
    return attributes;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof NodeMetadata)) {
      return false;
    }
    return attributes.equals(((NodeMetadata) o).attributes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(attributes);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).addValue(attributes).toString();
  }
}
