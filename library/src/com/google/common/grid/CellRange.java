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
import static java.lang.Math.max;
import static java.lang.Math.min;

import com.google.common.annotations.GwtCompatible;
import com.google.common.collect.AbstractIterator;
import com.google.errorprone.annotations.Immutable;
import java.io.Serializable;
import org.jspecify.annotations.Nullable;

/**
 * A CellRange is a rectangular block of cells, given by its top-left (startRow, startColumn) and
 * bottom-right (endRow, endColumn) corners. Both corners are inclusive, so a range always contains
 * at least one cell.
 */
@Immutable
@GwtCompatible(serializable = true)
public final class CellRange implements Serializable {
  private final int startRow;
  private final int startColumn;
  private final int endRow;
  private final int endColumn;

  /**
   * Constructs a range from its corner indices. Start indices must be non-negative and no greater
   * than the corresponding end indices.
   */
  public CellRange(int startRow, int startColumn, int endRow, int endColumn) {
    checkArgument(startRow >= 0, "startRow must be non-negative: %s", startRow);
    checkArgument(startColumn >= 0, "startColumn must be non-negative: %s", startColumn);
    checkArgument(endRow >= startRow, "endRow %s < startRow %s", endRow, startRow);
    checkArgument(
        endColumn >= startColumn, "endColumn %s < startColumn %s", endColumn, startColumn);
    this.startRow = startRow;
    this.startColumn = startColumn;
    this.endRow = endRow;
    this.endColumn = endColumn;
  }

  /** Returns the minimal range containing both coordinates, which may be given in any order. */
  public static CellRange fromCoordinates(CellCoordinate a, CellCoordinate b) {
    return new CellRange(
        min(a.row(), b.row()),
        min(a.column(), b.column()),
        max(a.row(), b.row()),
        max(a.column(), b.column()));
  }

  /** Returns a range containing the single given cell. */
  public static CellRange single(CellCoordinate coord) {
    return new CellRange(coord.row(), coord.column(), coord.row(), coord.column());
  }

  public int startRow() {
    return startRow;
  }

  public int startColumn() {
    return startColumn;
  }

  public int endRow() {
    return endRow;
  }

  public int endColumn() {
    return endColumn;
  }

  public int rowCount() {
    return endRow - startRow + 1;
  }

  public int columnCount() {
    return endColumn - startColumn + 1;
  }

  /** Returns the number of cells in the range, as a long since it may exceed the int range. */
  public long cellCount() {
    return (long) rowCount() * columnCount();
  }

  public CellCoordinate topLeft() {
    return new CellCoordinate(startRow, startColumn);
  }

  public CellCoordinate bottomRight() {
    return new CellCoordinate(endRow, endColumn);
  }

  public boolean contains(int row, int column) {
    return row >= startRow && row <= endRow && column >= startColumn && column <= endColumn;
  }

  public boolean contains(CellCoordinate coord) {
    return contains(coord.row(), coord.column());
  }

  /** Returns true if every cell of {@code other} is in this range. */
  public boolean contains(CellRange other) {
    return other.startRow >= startRow
        && other.endRow <= endRow
        && other.startColumn >= startColumn
        && other.endColumn <= endColumn;
  }

  /** Returns true if this range and {@code other} have at least one cell in common. */
  public boolean intersects(CellRange other) {
    return other.endRow >= startRow
        && other.startRow <= endRow
        && other.endColumn >= startColumn
        && other.startColumn <= endColumn;
  }

  /** Returns the cells common to both ranges, or null if they are disjoint. */
  public @Nullable CellRange intersection(CellRange other) {
    if (!intersects(other)) {
      return null;
    }
    return new CellRange(
        max(startRow, other.startRow),
        max(startColumn, other.startColumn),
        min(endRow, other.endRow),
        min(endColumn, other.endColumn));
  }

  /** Returns the smallest range containing both this range and {@code other}. */
  public CellRange union(CellRange other) {
    return new CellRange(
        min(startRow, other.startRow),
        min(startColumn, other.startColumn),
        max(endRow, other.endRow),
        max(endColumn, other.endColumn));
  }

  /** Returns the smallest range containing this range and the given cell. */
  public CellRange expand(CellCoordinate coord) {
    if (contains(coord)) {
      return this;
    }
    return union(single(coord));
  }

  /** Returns the cells of this range in row-major order. */
  public Iterable<CellCoordinate> cells() {
    return () -> new CellIterator();
  }

  private final class CellIterator extends AbstractIterator<CellCoordinate> {
    private int row = startRow;
    private int column = startColumn;

    @Override
    protected @Nullable CellCoordinate computeNext() {
      if (row > endRow) {
        return endOfData();
      }
      CellCoordinate next = new CellCoordinate(row, column);
      if (column == endColumn) {
        column = startColumn;
        row++;
      } else {
        column++;
      }
      return next;
    }
  }

  @Override
  public boolean equals(@Nullable Object other) {
    if (!(other instanceof CellRange)) {
      return false;
    }
    CellRange that = (CellRange) other;
    return startRow == that.startRow
        && startColumn == that.startColumn
        && endRow == that.endRow
        && endColumn == that.endColumn;
  }

  @Override
  public int hashCode() {
    int h = startRow;
    h = 31 * h + startColumn;
    h = 31 * h + endRow;
    return 31 * h + endColumn;
  }

  @Override
  public String toString() {
    return "CellRange(" + topLeft().toNotation() + ":" + bottomRight().toNotation() + ")";
  }
}
