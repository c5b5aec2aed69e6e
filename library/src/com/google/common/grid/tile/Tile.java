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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.grid.CellRange;
import com.google.common.grid.ZoomBucket;
import java.util.function.Consumer;

/**
 * A Tile is one rendered block of the content plane at one zoom bucket. It owns an opaque picture
 * of type P, such as a GPU texture or a recorded drawing, which is released through the disposer
 * given at construction.
 *
 * <p>A tile starts valid. {@link #invalidate()} marks its picture stale, after which it must be
 * replaced by a newly rendered tile; it never becomes valid again. {@link #dispose()} releases the
 * picture exactly once, however many times it is called.
 *
 * @param <P> the type of the rendered picture
 */
public final class Tile<P> {
  private final TileCoordinate coordinate;
  private final ZoomBucket zoomBucket;
  private final P picture;
  private final CellRange cellRange;
  private final Consumer<? super P> disposer;

  private boolean valid = true;
  private boolean disposed = false;

  /**
   * Constructs a tile, taking ownership of {@code picture}.
   *
   * @param cellRange the cells the tile's pixel bounds cover, computed when it was rendered
   * @param disposer releases the picture when the tile is disposed
   */
  public Tile(
      TileCoordinate coordinate,
      ZoomBucket zoomBucket,
      P picture,
      CellRange cellRange,
      Consumer<? super P> disposer) {
    this.coordinate = checkNotNull(coordinate);
    this.zoomBucket = checkNotNull(zoomBucket);
    this.picture = checkNotNull(picture);
    this.cellRange = checkNotNull(cellRange);
    this.disposer = checkNotNull(disposer);
  }

  public TileCoordinate coordinate() {
    return coordinate;
  }

  public ZoomBucket zoomBucket() {
    return zoomBucket;
  }

  /** Returns the cache key of this tile. */
  public TileKey key() {
    return new TileKey(coordinate, zoomBucket);
  }

  /**
   * Returns the rendered picture.
   *
   * @throws IllegalStateException if the tile has been disposed
   */
  public P picture() {
    checkState(!disposed, "Tile %s was disposed", coordinate);
    return picture;
  }

  public CellRange cellRange() {
    return cellRange;
  }

  /** Returns false once the tile has been invalidated. */
  public boolean isValid() {
    return valid;
  }

  public boolean isDisposed() {
    return disposed;
  }

  /** Marks this tile stale. Its picture remains usable until disposed. */
  public void invalidate() {
    valid = false;
  }

  /** Releases the picture on the first call; later calls do nothing. */
  public void dispose() {
    if (!disposed) {
      disposed = true;
      disposer.accept(picture);
    }
  }

  /** Returns true if the given cell is in this tile's cell range. */
  public boolean containsCell(int row, int column) {
    return cellRange.contains(row, column);
  }

  /** Returns true if this tile's cell range intersects {@code range}. */
  public boolean intersectsCellRange(CellRange range) {
    return cellRange.intersects(range);
  }

  @Override
  public String toString() {
    return "Tile[" + coordinate + ", " + zoomBucket + ", " + cellRange
        + (valid ? "" : ", invalid") + (disposed ? ", disposed" : "") + "]";
  }
}
