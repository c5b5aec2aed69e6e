/*
 * Copyright 2025 Google Inc.
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
package com.google.common.grid;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Verifies PixelRect. */
@RunWith(JUnit4.class)
public class PixelRectTest extends GridTestCase {

  @Test
  public void testFactories() {
    PixelRect rect = PixelRect.fromLTWH(10, 20, 30, 40);
    assertExactly(10, rect.left());
    assertExactly(20, rect.top());
    assertExactly(40, rect.right());
    assertExactly(60, rect.bottom());
    assertExactly(30, rect.width());
    assertExactly(40, rect.height());
    assertEquals(rect, PixelRect.fromLTRB(10, 20, 40, 60));
    assertEquals(rect.hashCode(), PixelRect.fromLTRB(10, 20, 40, 60).hashCode());
    assertNotEquals(rect, PixelRect.fromLTRB(10, 20, 40, 61));
  }

  @Test
  public void testIsEmpty() {
    assertFalse(PixelRect.fromLTWH(0, 0, 1, 1).isEmpty());
    assertTrue(PixelRect.fromLTWH(0, 0, 0, 10).isEmpty());
    assertTrue(PixelRect.fromLTWH(0, 0, 10, 0).isEmpty());
    assertTrue(PixelRect.fromLTRB(5, 5, 0, 10).isEmpty());
  }

  @Test
  public void testContainsIsHalfOpen() {
    PixelRect rect = PixelRect.fromLTWH(0, 0, 10, 10);
    assertTrue(rect.contains(0, 0));
    assertTrue(rect.contains(9.99, 9.99));
    assertFalse(rect.contains(10, 5));
    assertFalse(rect.contains(5, 10));
    assertFalse(rect.contains(-0.01, 5));
  }

  @Test
  public void testIntersects() {
    PixelRect rect = PixelRect.fromLTWH(0, 0, 10, 10);
    assertTrue(rect.intersects(PixelRect.fromLTWH(5, 5, 10, 10)));
    assertTrue(rect.intersects(PixelRect.fromLTWH(2, 2, 1, 1)));
    // Touching edges do not intersect.
    assertFalse(rect.intersects(PixelRect.fromLTWH(10, 0, 5, 5)));
    assertFalse(rect.intersects(PixelRect.fromLTWH(0, 10, 5, 5)));
  }

  @Test
  public void testScaleAndInflate() {
    PixelRect rect = PixelRect.fromLTWH(10, 20, 30, 40);
    assertEquals(PixelRect.fromLTRB(20, 40, 80, 120), rect.scale(2));
    assertEquals(PixelRect.fromLTRB(5, 15, 45, 65), rect.inflate(5));
    assertEquals(PixelRect.fromLTRB(15, 25, 35, 55), rect.inflate(-5));
  }

  @Test
  public void testToString() {
    assertEquals("PixelRect[1.0, 2.0, 3.0, 4.0]", PixelRect.fromLTRB(1, 2, 3, 4).toString());
  }

  @Test
  public void testSerialization() {
    doSerializationTest(PixelRect.fromLTWH(0.5, 1.5, 256, 256));
  }
}
