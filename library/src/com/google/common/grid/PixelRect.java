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

import com.google.common.annotations.GwtCompatible;
import com.google.errorprone.annotations.Immutable;
import java.io.Serializable;
import org.jspecify.annotations.Nullable;

/**
 * A PixelRect is an axis-aligned rectangle in pixel space, with y increasing downward. The left and
 * top edges are inclusive and the right and bottom edges exclusive, so adjacent rectangles that
 * share an edge do not overlap.
 *
 * <p>PixelRects are used for both content coordinates (the unscaled grid) and screen coordinates
 * (after a {@link ZoomTransform}); the class itself does not know which.
 */
@Immutable
@GwtCompatible(serializable = true)
public final class PixelRect implements Serializable {
  private final double left;
  private final double top;
  private final double right;
  private final double bottom;

  private PixelRect(double left, double top, double right, double bottom) {
    this.left = left;
    this.top = top;
    this.right = right;
    this.bottom = bottom;
  }

  /** Returns the rectangle with the given top-left corner and size. */
  public static PixelRect fromLTWH(double left, double top, double width, double height) {
    return new PixelRect(left, top, left + width, top + height);
  }

  /** Returns the rectangle with the given edges. */
  public static PixelRect fromLTRB(double left, double top, double right, double bottom) {
    return new PixelRect(left, top, right, bottom);
  }

  public double left() {
    return left;
  }

  public double top() {
    return top;
  }

  public double right() {
    return right;
  }

  public double bottom() {
    return bottom;
  }

  public double width() {
    return right - left;
  }

  public double height() {
    return bottom - top;
  }

  /** Returns true if the rectangle has no area. */
  public boolean isEmpty() {
    return !(left < right && top < bottom);
  }

  /** Returns true if the point is inside, including the top-left edges but not the bottom-right. */
  public boolean contains(double x, double y) {
    return x >= left && x < right && y >= top && y < bottom;
  }

  /** Returns true if the two rectangles have an interior point in common. */
  public boolean intersects(PixelRect other) {
    return left < other.right && other.left < right && top < other.bottom && other.top < bottom;
  }

  /** Returns this rectangle with every edge multiplied by {@code factor}. */
  public PixelRect scale(double factor) {
    return new PixelRect(left * factor, top * factor, right * factor, bottom * factor);
  }

  /** Returns this rectangle grown by {@code delta} on every side (shrunk if negative). */
  public PixelRect inflate(double delta) {
    return new PixelRect(left - delta, top - delta, right + delta, bottom + delta);
  }

  @Override
  public boolean equals(@Nullable Object other) {
    if (!(other instanceof PixelRect)) {
      return false;
    }
    PixelRect that = (PixelRect) other;
    return left == that.left && top == that.top && right == that.right && bottom == that.bottom;
  }

  @Override
  public int hashCode() {
    long value = 17;
    value += 37 * value + Platform.doubleHash(left);
    value += 37 * value + Platform.doubleHash(top);
    value += 37 * value + Platform.doubleHash(right);
    value += 37 * value + Platform.doubleHash(bottom);
    return (int) (value ^ (value >>> 32));
  }

  @Override
  public String toString() {
    return "PixelRect[" + left + ", " + top + ", " + right + ", " + bottom + "]";
  }
}
