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

package com.treescan.cache.impl;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.Iterables;

/** Helpers for the {@code /}-separated identifiers used as cache targets. */
final class TargetPaths {

  private static final Splitter COMPONENTS = Splitter.on('/').omitEmptyStrings();
  private static final CharMatcher DRIVE_LETTER =
      CharMatcher.inRange('A', 'Z').or(CharMatcher.inRange('a', 'z'));

  private TargetPaths() {}

  /** Uses {@code /} as the only separator and drops trailing separators, except for roots. */
  static String normalize(String identifier) {
    String target = identifier.replace('\\', '/');
    while (target.length() > 1 && target.endsWith("/") && !isDriveRoot(target)) {
      target = target.substring(0, target.length() - 1);
    }
    return target;
  }

  /** Whether every other target is a descendant of {@code target}. */
  static boolean isRoot(String target) {
    return target.isEmpty() || target.equals("/") || isDriveRoot(target) || isDrive(target);
  }

  static boolean isSelfOrDescendant(String candidate, String ancestor) {
    if (candidate.equals(ancestor)) {
      return true;
    }
    String prefix = ancestor.endsWith("/") ? ancestor : ancestor + "/";
    return candidate.startsWith(prefix);
  }

  /**
   * Number of path parts, the root of an absolute target included: 3 for {@code /proj/src} and
   * for {@code C:/proj/src}, 2 for {@code proj/src}.
   */
  static int componentCount(String target) {
    int parts = Iterables.size(COMPONENTS.split(target));
    return target.startsWith("/") ? parts + 1 : parts;
  }

  private static boolean isDrive(String target) {
    return target.length() == 2 && DRIVE_LETTER.matches(target.charAt(0)) && target.charAt(1) == ':';
  }

  private static boolean isDriveRoot(String target) {
    return target.length() == 3 && isDrive(target.substring(0, 2)) && target.charAt(2) == '/';
  }
}
