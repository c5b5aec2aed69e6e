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

import static com.google.common.base.Preconditions.checkNotNull;

import org.jspecify.annotations.Nullable;

/**
 * GridLayout combines a row {@link SpanIndex} and a column {@link SpanIndex} into two-dimensional
 * cell geometry: the content-space bounds of cells and cell ranges, and the cell under a point.
 *
 * <p>GridLayout holds no state of its own beyond the two span indices, which it shares with the
 * caller. Resizing a row or column through this class or directly through the span index is
 * immediately visible to both.
 *
 * <p>All index arguments are checked and throw {@link IndexOutOfBoundsException} when out of range.
 * Position lookups never throw, and report positions outside of the content with {@link
 * SpanIndex#NOT_FOUND} or null.
 */
public final class GridLayout {
  private final SpanIndex rows;
  private final SpanIndex columns;

  public GridLayout(SpanIndex rows, SpanIndex columns) {
    this.rows = checkNotNull(rows);
    this.columns = checkNotNull(columns);
  }

  /** Returns the span index of row heights. */
  public SpanIndex rows() {
    return rows;
  }

  /** Returns the span index of column widths. */
  public SpanIndex columns() {
    return columns;
  }

  public int rowCount() {
    return rows.count();
  }

  public int columnCount() {
    return columns.count();
  }

  public double defaultRowHeight() {
    return rows.defaultSize();
  }

  public double defaultColumnWidth() {
    return columns.defaultSize();
  }

  public double totalHeight() {
    return rows.totalSize();
  }

  public double totalWidth() {
    return columns.totalSize();
  }

  /** Returns the bounds of the cell at ({@code row}, {@code column}). */
  public PixelRect cellBounds(int row, int column) {
    return PixelRect.fromLTWH(
        columns.positionAt(column), rows.positionAt(row),
        columns.sizeAt(column), rows.sizeAt(row));
  }

  /** As {@link #cellBounds(int, int)}. */
  public PixelRect cellBounds(CellCoordinate coord) {
    return cellBounds(coord.row(), coord.column());
  }

  /** Returns the cell containing the content point (x, y), or null if there is none. */
  public @Nullable CellCoordinate cellAt(double x, double y) {
    int row = rows.indexAtPosition(y);
    int column = columns.indexAtPosition(x);
    if (row == SpanIndex.NOT_FOUND || column == SpanIndex.NOT_FOUND) {
      return null;
    }
    return new CellCoordinate(row, column);
  }

  /** Returns the row containing content position y, or {@link SpanIndex#NOT_FOUND}. */
  public int rowAt(double y) {
    return rows.indexAtPosition(y);
  }

  /** Returns the column containing content position x, or {@link SpanIndex#NOT_FOUND}. */
  public int columnAt(double x) {
    return columns.indexAtPosition(x);
  }

  public double rowTop(int row) {
    return rows.positionAt(row);
  }

  public double rowHeight(int row) {
    return rows.sizeAt(row);
  }

  /** Returns the bottom edge of {@code row}, which is the top of the next row. */
  public double rowEnd(int row) {
    return rows.positionAt(row) + rows.sizeAt(row);
  }

  public double columnLeft(int column) {
    return columns.positionAt(column);
  }

  public double columnWidth(int column) {
    return columns.sizeAt(column);
  }

  /** Returns the right edge of {@code column}, which is the left of the next column. */
  public double columnEnd(int column) {
    return columns.positionAt(column) + columns.sizeAt(column);
  }

  public void setRowHeight(int row, double height) {
    rows.setSize(row, height);
  }

  public void setColumnWidth(int column, double width) {
    columns.setSize(column, width);
  }

  /** Returns the rows overlapping {@code [startY, startY + height)}, clamped to the grid. */
  public SpanRange visibleRows(double startY, double height) {
    return rows.getRange(startY, startY + height);
  }

  /** Returns the columns overlapping {@code [startX, startX + width)}, clamped to the grid. */
  public SpanRange visibleColumns(double startX, double width) {
    return columns.getRange(startX, startX + width);
  }

  /**
   * Returns the bounds of the block of cells from ({@code startRow}, {@code startColumn}) to
   * ({@code endRow}, {@code endColumn}) inclusive. The far edges are the start positions of the
   * spans after the end indices, so for the last row or column they equal the total size.
   */
  public PixelRect rangeBounds(int startRow, int startColumn, int endRow, int endColumn) {
    return PixelRect.fromLTRB(
        columns.positionAt(startColumn),
        rows.positionAt(startRow),
        columns.positionAt(endColumn + 1),
        rows.positionAt(endRow + 1));
  }

  /** As {@link #rangeBounds(int, int, int, int)}. */
  public PixelRect rangeBounds(CellRange range) {
    return rangeBounds(range.startRow(), range.startColumn(), range.endRow(), range.endColumn());
  }

  @Override
  public String toString() {
    return "GridLayout[rows=" + rows + ", columns=" + columns + "]";
  }
}
