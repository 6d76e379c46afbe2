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

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;

/** A node of a hierarchical source that a {@link TreeSource} can enumerate. */
public interface TreeNode {

  /**
   * Stable identifier of this node within its source, e.g. an absolute path. Hierarchy is expressed
   * with {@code /} separators so that descendants share their ancestor's identifier as a prefix.
   */
  String identifier();

  /**
   * Metadata of this node. Nodes without any metadata, in particular without a modification time,
   * return {@link NodeMetadata#empty()}.
   */
  default ListenableFuture<NodeMetadata> metadata() {
    return Futures.immediateFuture(NodeMetadata.empty());
  }
}
