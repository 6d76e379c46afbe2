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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

import com.google.common.collect.ImmutableMap;
import java.util.OptionalLong;
import org.junit.Test;

public class NodeMetadataTest {

  @Test
  public void emptyMetadataHasNoModifiedTime() {
    assertFalse(NodeMetadata.empty().getModifiedTimeMillis().isPresent());
    assertSame(NodeMetadata.empty(), NodeMetadata.of(ImmutableMap.of()));
  }

  @Test
  public void exposesAttributes() {
    NodeMetadata metadata =
        NodeMetadata.of(ImmutableMap.of(NodeMetadata.MODIFIED_TIME, 1234L, NodeMetadata.SIZE, 5L));
    assertEquals(OptionalLong.of(1234), metadata.getModifiedTimeMillis());
    assertEquals(5L, metadata.get(NodeMetadata.SIZE));
    assertNull(metadata.get(NodeMetadata.IS_DIRECTORY));
    assertEquals(
        NodeMetadata.withModifiedTime(1234),
        NodeMetadata.of(ImmutableMap.of(NodeMetadata.MODIFIED_TIME, 1234L)));
  }

  @Test(expected = IllegalArgumentException.class)
  public void rejectsModifiedTimeOfTheWrongType() {
    NodeMetadata.of(ImmutableMap.of(NodeMetadata.MODIFIED_TIME, "yesterday"));
  }
}
