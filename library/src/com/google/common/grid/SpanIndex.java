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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkPositionIndex;
import static java.lang.Math.max;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.Map;

/**
 * A SpanIndex stores the sizes of the spans along one axis of the grid (the heights of the rows, or
 * the widths of the columns) together with their prefix sums, so that converting between span
 * indices and pixel positions is cheap in both directions.
 *
 * <p>Every span starts at {@link #defaultSize()} unless given a custom size. The position of span
 * {@code i} is the sum of the sizes of spans {@code 0..i-1}; {@code positionAt(count())} is the
 * total size. Looking up the span containing a position is a binary search over the prefix sums,
 * O(log count), which is what hit-testing and tile range computation rely on. Resizing a span
 * rebuilds the prefix sums in O(count), which is acceptable since resizes are rare compared to
 * lookups.
 *
 * <p>The number of spans is fixed at construction. Inserting or deleting rows and columns is the
 * responsibility of the owner, which builds a new SpanIndex.
 *
 * <p>This class is not thread-safe. Concurrent readers are fine as long as no call to {@link
 * #setSize} runs at the same time.
 */
public final class SpanIndex {
  /** Returned by {@link #indexAtPosition} for a position outside of all spans. */
  public static final int NOT_FOUND = -1;

  /**
   * Amount subtracted from the far end of a half-open position range before looking it up, so that
   * a range ending exactly on a span boundary does not include the following span. Must be much
   * smaller than any realistic span size.
   */
  public static final double BOUNDARY_EPSILON = 1e-6;

  private final int count;
  private final double defaultSize;
  private final double[] sizes;

  /** cumulative[i] is the start of span i; cumulative[count] is the total size. */
  private final double[] cumulative;

  /** Constructs a SpanIndex of {@code count} spans, all of size {@code defaultSize}. */
  public SpanIndex(int count, double defaultSize) {
    this(count, defaultSize, ImmutableMap.of());
  }

  /**
   * Constructs a SpanIndex of {@code count} spans of size {@code defaultSize}, except for those
   * given in {@code customSizes}. Custom sizes for indices outside of {@code [0, count)} are
   * ignored.
   *
   * @throws IllegalArgumentException if count or defaultSize, or any applicable custom size, is not
   *     positive
   */
  public SpanIndex(int count, double defaultSize, Map<Integer, Double> customSizes) {
    checkArgument(count > 0, "Count must be positive: %s", count);
    checkArgument(defaultSize > 0, "Default size must be positive: %s", defaultSize);
    this.count = count;
    this.defaultSize = defaultSize;
    this.sizes = new double[count];
    Arrays.fill(sizes, defaultSize);
    for (Map.Entry<Integer, Double> entry : customSizes.entrySet()) {
      int index = entry.getKey();
      if (index >= 0 && index < count) {
        double size = entry.getValue();
        checkArgument(
            size > 0, "Size must be positive: %s at index %s", entry.getValue(), entry.getKey());
        sizes[index] = size;
      }
    }
    this.cumulative = new double[count + 1];
    rebuildCumulative();
  }

  /** Recomputes all prefix sums from the sizes. */
  private void rebuildCumulative() {
    double sum = 0;
    for (int i = 0; i < count; i++) {
      cumulative[i] = sum;
      sum += sizes[i];
    }
    cumulative[count] = sum;
  }

  /** Returns the number of spans. */
  public int count() {
    return count;
  }

  /** Returns the size given to spans that were never resized. */
  public double defaultSize() {
    return defaultSize;
  }

  /** Returns the sum of all span sizes. */
  public double totalSize() {
    return cumulative[count];
  }

  /**
   * Returns the size of span {@code index}.
   *
   * @throws IndexOutOfBoundsException if index is not in {@code [0, count)}
   */
  public double sizeAt(int index) {
    checkElementIndex(index, count);
    return sizes[index];
  }

  /**
   * Returns the position at which span {@code index} starts. {@code index} may equal {@link
   * #count()}, in which case the total size is returned.
   *
   * @throws IndexOutOfBoundsException if index is not in {@code [0, count]}
   */
  public double positionAt(int index) {
    checkPositionIndex(index, count);
    return cumulative[index];
  }

  /**
   * Returns the index of the span containing {@code position}, i.e. the largest {@code i} with
   * {@code positionAt(i) <= position}, or {@link #NOT_FOUND} if the position is negative or not
   * less than the total size.
   */
  public int indexAtPosition(double position) {
    if (!(position >= 0) || position >= totalSize()) {
      return NOT_FOUND;
    }
    int low = 0;
    int high = count - 1;
    while (low < high) {
      // Round up so that low always advances when low + 1 == high.
      int mid = low + ((high - low + 1) >>> 1);
      if (cumulative[mid] <= position) {
        low = mid;
      } else {
        high = mid - 1;
      }
    }
    return low;
  }

  /**
   * Sets the size of span {@code index} and rebuilds the prefix sums.
   *
   * @throws IndexOutOfBoundsException if index is not in {@code [0, count)}
   * @throws IllegalArgumentException if size is not positive
   */
  public void setSize(int index, double size) {
    checkElementIndex(index, count);
    checkArgument(size > 0, "Size must be positive: %s", size);
    sizes[index] = size;
    rebuildCumulative();
  }

  /**
   * Returns the inclusive range of span indices overlapping the half-open position range {@code
   * [startPosition, endPosition)}, clamped to {@code [0, count - 1]}. A start before the first span
   * clamps to 0, and an end past the last span clamps to the last index. An empty position range
   * yields the single span containing its start.
   */
  public SpanRange getRange(double startPosition, double endPosition) {
    int startIndex = indexAtPosition(startPosition);
    int endIndex = indexAtPosition(endPosition - BOUNDARY_EPSILON);
    if (startIndex == NOT_FOUND) {
      startIndex = 0;
    }
    if (endIndex == NOT_FOUND) {
      endIndex = count - 1;
    }
    return new SpanRange(startIndex, max(startIndex, endIndex));
  }

  /** Returns a copy of the prefix sums, for tests. */
  @VisibleForTesting
  double[] cumulativeForTesting() {
    return cumulative.clone();
  }

  @Override
  public String toString() {
    return "SpanIndex[count=" + count + ", defaultSize=" + defaultSize
        + ", totalSize=" + totalSize() + "]";
  }
}
