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

import com.google.common.util.concurrent.ListenableFuture;
import java.util.List;

/**
 * Enumerates the children of nodes of a hierarchical source.
 *
 * <p>Implementations may do blocking I/O on their own executor, but must not block the calling
 * thread. A failed enumeration is reported through the returned future.
 */
public interface TreeSource<N extends TreeNode> {

  ListenableFuture<List<N>> getChildren(N node);
}
