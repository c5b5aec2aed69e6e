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

import com.google.errorprone.annotations.Immutable;
import org.jspecify.annotations.Nullable;

/** An inclusive range {@code [startIndex, endIndex]} of span indices along one axis. */
@Immutable
public final class SpanRange {
  private final int startIndex;
  private final int endIndex;

  public SpanRange(int startIndex, int endIndex) {
    checkArgument(
        startIndex >= 0 && endIndex >= startIndex, "Invalid range [%s, %s]", startIndex, endIndex);
    this.startIndex = startIndex;
    this.endIndex = endIndex;
  }

  public int startIndex() {
    return startIndex;
  }

  public int endIndex() {
    return endIndex;
  }

  /** Returns the number of indices in the range. */
  public int length() {
    return endIndex - startIndex + 1;
  }

  public boolean contains(int index) {
    return index >= startIndex && index <= endIndex;
  }

  @Override
  public boolean equals(@Nullable Object other) {
    if (!(other instanceof SpanRange)) {
      return false;
    }
    SpanRange that = (SpanRange) other;
    return startIndex == that.startIndex && endIndex == that.endIndex;
  }

  @Override
  public int hashCode() {
    return 31 * startIndex + endIndex;
  }

  @Override
  public String toString() {
    return "SpanRange(" + startIndex + ", " + endIndex + ")";
  }
}
