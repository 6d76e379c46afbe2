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
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;

/** A file or directory, identified by its absolute, normalized path. */
public final class FileSystemNode implements TreeNode {

  private final Path path;
  private final ListeningExecutorService executor;

  FileSystemNode(Path path, ListeningExecutorService executor) {
    this.path = Preconditions.checkNotNull(path).toAbsolutePath().normalize();
    this.executor = Preconditions.checkNotNull(executor);
  }

  public Path getPath() {
    return path;
  }

  @Override
  public String identifier() {
    return path.toString();
  }

  /**
   * Reads the node's attributes without following a trailing symlink. Fails with a {@link
   * SourceFetchException} if the file cannot be stat'ed.
   */
  @Override
  public ListenableFuture<NodeMetadata> metadata() {
    return executor.submit(this::readMetadata);
  }

  private NodeMetadata readMetadata() {
    BasicFileAttributes attributes;
    try {
      attributes = Files.readAttributes(path, BasicFileAttributes.class);
    } catch (IOException e) {
      throw new SourceFetchException(identifier(), "Cannot read attributes", e);
    }
    return NodeMetadata.of(
        ImmutableMap.of(
            NodeMetadata.MODIFIED_TIME, attributes.lastModifiedTime().toMillis(),
            NodeMetadata.SIZE, attributes.size(),
            NodeMetadata.IS_DIRECTORY, attributes.isDirectory()));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FileSystemNode)) {
      return false;
    }
    return path.equals(((FileSystemNode) o).path);
  }

  @Override
  public int hashCode() {
    return path.hashCode();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).addValue(path).toString();
  }
}
