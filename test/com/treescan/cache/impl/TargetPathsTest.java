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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class TargetPathsTest {

  @Test
  public void normalizesSeparatorsAndTrailingSlashes() {
    assertEquals("/proj/src", TargetPaths.normalize("/proj/src/"));
    assertEquals("/proj/src", TargetPaths.normalize("/proj/src//"));
    assertEquals("C:/proj/src", TargetPaths.normalize("C:\\proj\\src\\"));
    assertEquals("/", TargetPaths.normalize("/"));
    assertEquals("C:/", TargetPaths.normalize("C:\\"));
    assertEquals("", TargetPaths.normalize(""));
  }

  @Test
  public void recognizesRoots() {
    assertTrue(TargetPaths.isRoot(""));
    assertTrue(TargetPaths.isRoot("/"));
    assertTrue(TargetPaths.isRoot("C:"));
    assertTrue(TargetPaths.isRoot("d:/"));
    assertFalse(TargetPaths.isRoot("/proj"));
    assertFalse(TargetPaths.isRoot("C:/proj"));
  }

  @Test
  public void descendantsMatchOnComponentBoundaries() {
    assertTrue(TargetPaths.isSelfOrDescendant("/proj", "/proj"));
    assertTrue(TargetPaths.isSelfOrDescendant("/proj/src", "/proj"));
    assertTrue(TargetPaths.isSelfOrDescendant("/proj/src/main", "/proj"));
    assertFalse(TargetPaths.isSelfOrDescendant("/project", "/proj"));
    assertFalse(TargetPaths.isSelfOrDescendant("/pro", "/proj"));
    assertTrue(TargetPaths.isSelfOrDescendant("/proj", "/"));
  }

  @Test
  public void countsComponents() {
    assertEquals(0, TargetPaths.componentCount(""));
    assertEquals(1, TargetPaths.componentCount("/"));
    assertEquals(1, TargetPaths.componentCount("C:/"));
    assertEquals(2, TargetPaths.componentCount("/proj"));
    assertEquals(3, TargetPaths.componentCount("/proj/src"));
    assertEquals(3, TargetPaths.componentCount("C:/proj/src"));
    assertEquals(2, TargetPaths.componentCount("proj/src"));
  }
}
