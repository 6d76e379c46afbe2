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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists directories of the local filesystem. Listing and attribute reads run on the given
 * executor; children come back sorted by path. Regular files have no children.
 */
public class FileSystemTreeSource implements TreeSource<FileSystemNode> {

  private static final Logger LOG = LoggerFactory.getLogger(FileSystemTreeSource.class);

  private final ListeningExecutorService executor;

  public FileSystemTreeSource(ListeningExecutorService executor) {
    this.executor = Preconditions.checkNotNull(executor);
  }

  /** The node for {@code path}, which need not exist yet. */
  public FileSystemNode node(Path path) {
    return new FileSystemNode(path, executor);
  }

  @Override
  public ListenableFuture<List<FileSystemNode>> getChildren(FileSystemNode node) {
    Preconditions.checkNotNull(node);
    return executor.submit(() -> list(node.getPath()));
  }

  private List<FileSystemNode> list(Path directory) {
    if (!Files.isDirectory(directory)) {
      if (!Files.exists(directory)) {
        throw new SourceFetchException(
            directory.toString(), "Cannot list", new NoSuchFileException(directory.toString()));
      }
      return ImmutableList.of();
    }
    List<Path> paths = new ArrayList<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
      for (Path child : stream) {
        paths.add(child);
      }
    } catch (IOException e) {
      throw new SourceFetchException(directory.toString(), "Cannot list", e);
    }
    paths.sort(null);
    LOG.trace("Listed {} children of {}", paths.size(), directory);
    ImmutableList.Builder<FileSystemNode> children = ImmutableList.builder();
    for (Path child : paths) {
      children.add(node(child));
    }
    return children.build();
  }
}
