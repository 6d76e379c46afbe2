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

/**
 * Raised when a {@link TreeSource} cannot enumerate a node. Caching layers hand the same instance to
 * every caller that was waiting on the failed enumeration, and never cache it.
 */
public class SourceFetchException extends RuntimeException {

  private final String target;

  public SourceFetchException(String target, String message, Throwable cause) {
    super(message + ": " + target, cause);
    this.target = target;
  }

  public SourceFetchException(String target, String message) {
    super(message + ": " + target);
    this.target = target;
  }

  public String getTarget() {
    return target;
  }
}
