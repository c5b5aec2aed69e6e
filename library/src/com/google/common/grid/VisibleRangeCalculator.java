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
import static com.google.common.base.Preconditions.checkNotNull;
import static java.lang.Math.max;
import static java.lang.Math.min;

import com.google.errorprone.annotations.CheckReturnValue;

/**
 * Computes which cells of a {@link GridLayout} a content-space viewport touches. The visible range
 * is the minimal {@link CellRange} covering every cell that is at least partly inside the viewport,
 * clamped to the grid; a viewport entirely outside of the content clamps to the nearest edge.
 */
@CheckReturnValue
public final class VisibleRangeCalculator {
  private final GridLayout layout;

  public VisibleRangeCalculator(GridLayout layout) {
    this.layout = checkNotNull(layout);
  }

  public GridLayout layout() {
    return layout;
  }

  /** Returns the range of cells overlapping {@code viewport}. */
  public CellRange visibleRange(PixelRect viewport) {
    SpanRange rows = layout.rows().getRange(viewport.top(), viewport.bottom());
    SpanRange columns = layout.columns().getRange(viewport.left(), viewport.right());
    return new CellRange(
        rows.startIndex(), columns.startIndex(), rows.endIndex(), columns.endIndex());
  }

  /**
   * Returns the visible range grown by {@code rowPadding} rows and {@code columnPadding} columns on
   * each side, clamped to the grid. Used to render cells just outside of the viewport ahead of
   * scrolling.
   *
   * @throws IllegalArgumentException if either padding is negative
   */
  public CellRange visibleRangeWithPadding(
      PixelRect viewport, int rowPadding, int columnPadding) {
    checkArgument(rowPadding >= 0, "rowPadding must be non-negative: %s", rowPadding);
    checkArgument(columnPadding >= 0, "columnPadding must be non-negative: %s", columnPadding);
    CellRange base = visibleRange(viewport);
    return new CellRange(
        max(0, base.startRow() - rowPadding),
        max(0, base.startColumn() - columnPadding),
        min(layout.rowCount() - 1, base.endRow() + rowPadding),
        min(layout.columnCount() - 1, base.endColumn() + columnPadding));
  }

  /** Returns true if the cell at ({@code row}, {@code column}) is in the visible range. */
  public boolean isCellVisible(int row, int column, PixelRect viewport) {
    return visibleRange(viewport).contains(row, column);
  }

  /** Returns true if {@code range} has any cell in the visible range. */
  public boolean isRangeVisible(CellRange range, PixelRect viewport) {
    return visibleRange(viewport).intersects(range);
  }

  /** Returns the smallest content rectangle that shows every cell of {@code range}. */
  public PixelRect minimalViewportFor(CellRange range) {
    return layout.rangeBounds(range);
  }
}
