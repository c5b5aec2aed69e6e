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

import com.google.common.grid.CellRange;
import com.google.common.grid.PixelRect;
import com.google.common.grid.ZoomBucket;

/**
 * Draws the content of one tile. Implementations know about cell values and styles; the tiling code
 * does not, and treats the returned picture as opaque.
 *
 * @param <P> the type of the rendered picture
 */
public interface TileRenderer<P> {

  /**
   * Renders the tile at {@code coordinate}. Called synchronously on the rendering thread, and must
   * return a non-null picture.
   *
   * @param bounds the content-space pixel bounds of the tile
   * @param cellRange the cells overlapping {@code bounds}, clamped to the grid
   * @param zoomBucket the level of detail to draw at
   */
  P renderTile(
      TileCoordinate coordinate, PixelRect bounds, CellRange cellRange, ZoomBucket zoomBucket);

  /** Releases a picture returned by {@link #renderTile}. The default does nothing. */
  default void disposePicture(P picture) {}
}
