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
package com.google.common.grid.tile;

import static com.google.common.base.Preconditions.checkArgument;
import static java.lang.Math.max;
import static java.lang.Math.min;

import com.google.common.annotations.GwtCompatible;
import com.google.common.collect.ImmutableList;
import com.google.common.grid.PixelRect;
import com.google.errorprone.annotations.Immutable;
import java.io.Serializable;
import org.jspecify.annotations.Nullable;

/**
 * A TileCoordinate is the (row, column) position of a tile in a partition of the content plane into
 * fixed-size pixel blocks. Tile (0, 0) has its top-left corner at the content origin.
 *
 * <p>The tile grid is independent of the cell grid: a tile boundary may fall anywhere inside a row
 * or column, and one tile may cover many cells or only part of one.
 */
@Immutable
@GwtCompatible(serializable = true)
public final class TileCoordinate implements Serializable {
  /**
   * Amount subtracted from the far corner of a rectangle before finding its tile, so that a
   * rectangle ending exactly on a tile edge does not include the next tile.
   */
  public static final double BOUNDARY_EPSILON = 1e-6;

  /**
   * The largest row or column index produced from pixel positions or offsets. One below {@link
   * Integer#MAX_VALUE} so that enumerating up to it cannot overflow.
   */
  public static final int MAX_INDEX = Integer.MAX_VALUE - 1;

  private final int row;
  private final int column;

  /** Constructs a tile coordinate. Throws IllegalArgumentException if either index is negative. */
  public TileCoordinate(int row, int column) {
    checkArgument(row >= 0, "Row must be non-negative: %s", row);
    checkArgument(column >= 0, "Column must be non-negative: %s", column);
    this.row = row;
    this.column = column;
  }

  /** Returns the tile containing the content point (x, y), clamped to non-negative indices. */
  public static TileCoordinate fromPixel(double x, double y, double tileWidth, double tileHeight) {
    return new TileCoordinate(floorIndex(y / tileHeight), floorIndex(x / tileWidth));
  }

  private static int floorIndex(double value) {
    // NaN and negatives clamp to 0, large values to MAX_INDEX.
    return value > 0 ? (int) min(MAX_INDEX, Math.floor(value)) : 0;
  }

  private static int clampIndex(long value) {
    return (int) min(MAX_INDEX, max(0L, value));
  }

  /**
   * Returns every tile overlapping {@code rect}, in row-major order. A rectangle whose right or
   * bottom edge falls exactly on a tile edge does not include the tiles beyond that edge.
   */
  public static ImmutableList<TileCoordinate> tilesCovering(
      PixelRect rect, double tileWidth, double tileHeight) {
    TileCoordinate start = fromPixel(rect.left(), rect.top(), tileWidth, tileHeight);
    TileCoordinate end =
        fromPixel(
            rect.right() - BOUNDARY_EPSILON,
            rect.bottom() - BOUNDARY_EPSILON,
            tileWidth,
            tileHeight);
    ImmutableList.Builder<TileCoordinate> tiles = ImmutableList.builder();
    for (int row = start.row; row <= end.row; row++) {
      for (int col = start.column; col <= end.column; col++) {
        tiles.add(new TileCoordinate(row, col));
      }
    }
    return tiles.build();
  }

  public int row() {
    return row;
  }

  public int column() {
    return column;
  }

  /** Returns the content-space bounds of this tile. */
  public PixelRect pixelBounds(double tileWidth, double tileHeight) {
    return PixelRect.fromLTWH(column * tileWidth, row * tileHeight, tileWidth, tileHeight);
  }

  /** Returns the coordinate offset by the given deltas, clamped to [0, MAX_INDEX]. */
  public TileCoordinate offset(int rowDelta, int columnDelta) {
    return new TileCoordinate(
        clampIndex((long) row + rowDelta), clampIndex((long) column + columnDelta));
  }

  @Override
  public boolean equals(@Nullable Object other) {
    if (!(other instanceof TileCoordinate)) {
      return false;
    }
    TileCoordinate that = (TileCoordinate) other;
    return row == that.row && column == that.column;
  }

  @Override
  public int hashCode() {
    return 31 * row + column;
  }

  @Override
  public String toString() {
    return "TileCoordinate(row: " + row + ", col: " + column + ")";
  }
}
