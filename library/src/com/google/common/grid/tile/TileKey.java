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

import com.google.common.grid.ZoomBucket;
import com.google.errorprone.annotations.Immutable;
import org.jspecify.annotations.Nullable;

/**
 * Identifies a tile in a {@link TileCache}. Tiles covering the same pixels at different zoom
 * buckets are distinct entries.
 */
@Immutable
public final class TileKey {
  private final TileCoordinate coordinate;
  private final ZoomBucket zoomBucket;

  public TileKey(TileCoordinate coordinate, ZoomBucket zoomBucket) {
    this.coordinate = checkNotNull(coordinate);
    this.zoomBucket = checkNotNull(zoomBucket);
  }

  public TileCoordinate coordinate() {
    return coordinate;
  }

  public ZoomBucket zoomBucket() {
    return zoomBucket;
  }

  @Override
  public boolean equals(@Nullable Object other) {
    if (!(other instanceof TileKey)) {
      return false;
    }
    TileKey that = (TileKey) other;
    return coordinate.equals(that.coordinate) && zoomBucket == that.zoomBucket;
  }

  @Override
  public int hashCode() {
    return 31 * coordinate.hashCode() + zoomBucket.hashCode();
  }

  @Override
  public String toString() {
    return "TileKey(" + coordinate + ", " + zoomBucket + ")";
  }
}
