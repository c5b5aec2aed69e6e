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

import com.google.common.annotations.GwtCompatible;
import com.google.common.grid.ZoomBucket;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.Immutable;
import java.io.Serializable;
import org.jspecify.annotations.Nullable;

/**
 * Options for tiled rendering: the tile size, the capacity of the tile cache, and how many rings of
 * tiles beyond the viewport a caller should prefetch. Use {@link #builder()} to construct one, for
 * example:
 *
 * <pre>{@code
 * TileConfig config = TileConfig.builder().setTileSize(512).setMaxCachedTiles(64).build();
 * }</pre>
 */
@Immutable
@GwtCompatible(serializable = true)
public final class TileConfig implements Serializable {
  /** The default tile edge length in pixels. 256 suits common GPU texture sizes. */
  public static final int DEFAULT_TILE_SIZE = 256;

  /** The default capacity of the tile cache. */
  public static final int DEFAULT_MAX_CACHED_TILES = 100;

  /** The default number of tile rings to prefetch around the viewport. */
  public static final int DEFAULT_PREFETCH_RING_COUNT = 1;

  /** The default configuration. */
  public static final TileConfig DEFAULT = builder().build();

  private final int tileSize;
  private final int maxCachedTiles;
  private final int prefetchRingCount;

  private TileConfig(Builder builder) {
    this.tileSize = builder.tileSize;
    this.maxCachedTiles = builder.maxCachedTiles;
    this.prefetchRingCount = builder.prefetchRingCount;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns a builder initialized with the values of this config. */
  public Builder toBuilder() {
    return new Builder()
        .setTileSize(tileSize)
        .setMaxCachedTiles(maxCachedTiles)
        .setPrefetchRingCount(prefetchRingCount);
  }

  /** Returns the edge length of a square tile in pixels. */
  public int tileSize() {
    return tileSize;
  }

  public double tileWidth() {
    return tileSize;
  }

  public double tileHeight() {
    return tileSize;
  }

  /** Returns the maximum number of tiles the cache holds. */
  public int maxCachedTiles() {
    return maxCachedTiles;
  }

  /**
   * Returns how many rings of tiles beyond the visible ones should be prefetched. A value of 1
   * means the tiles adjacent to the visible block. This is advisory: the tile manager reports the
   * coordinates but does not render them on its own.
   */
  public int prefetchRingCount() {
    return prefetchRingCount;
  }

  /** Returns the on-screen size of a tile at the given zoom scale. */
  public double tileSizeForZoom(double scale) {
    return tileSize * scale;
  }

  /**
   * Returns the content size one tile covers at the given level of detail: more content per tile
   * when zoomed out, less when zoomed in.
   */
  public int zoomBucketTileSize(ZoomBucket bucket) {
    return (int) (tileSize * bucket.tileSpanMultiplier());
  }

  /** Returns the number of tiles needed to span {@code dimension} pixels. */
  public int tileCountForDimension(double dimension) {
    return (int) Math.ceil(dimension / tileSize);
  }

  @Override
  public boolean equals(@Nullable Object other) {
    if (!(other instanceof TileConfig)) {
      return false;
    }
    TileConfig that = (TileConfig) other;
    return tileSize == that.tileSize
        && maxCachedTiles == that.maxCachedTiles
        && prefetchRingCount == that.prefetchRingCount;
  }

  @Override
  public int hashCode() {
    return (31 * tileSize + maxCachedTiles) * 31 + prefetchRingCount;
  }

  @Override
  public String toString() {
    return "TileConfig[tileSize=" + tileSize + ", maxCachedTiles=" + maxCachedTiles
        + ", prefetchRingCount=" + prefetchRingCount + "]";
  }

  /** A builder for {@link TileConfig}. Values are validated by {@link #build()}. */
  public static final class Builder {
    private int tileSize = DEFAULT_TILE_SIZE;
    private int maxCachedTiles = DEFAULT_MAX_CACHED_TILES;
    private int prefetchRingCount = DEFAULT_PREFETCH_RING_COUNT;

    /** Users should create a Builder via the TileConfig.builder() method. */
    private Builder() {}

    /**
     * Sets the tile edge length in pixels. Must be positive.
     *
     * <p>Default: 256
     */
    @CanIgnoreReturnValue
    public Builder setTileSize(int tileSize) {
      this.tileSize = tileSize;
      return this;
    }

    /**
     * Sets the tile cache capacity. Must be positive.
     *
     * <p>Default: 100
     */
    @CanIgnoreReturnValue
    public Builder setMaxCachedTiles(int maxCachedTiles) {
      this.maxCachedTiles = maxCachedTiles;
      return this;
    }

    /**
     * Sets the number of tile rings to prefetch. Must be non-negative.
     *
     * <p>Default: 1
     */
    @CanIgnoreReturnValue
    public Builder setPrefetchRingCount(int prefetchRingCount) {
      this.prefetchRingCount = prefetchRingCount;
      return this;
    }

    /**
     * Returns a new TileConfig.
     *
     * @throws IllegalArgumentException if any value is out of range
     */
    public TileConfig build() {
      checkArgument(tileSize > 0, "Tile size must be positive: %s", tileSize);
      checkArgument(maxCachedTiles > 0, "Max cached tiles must be positive: %s", maxCachedTiles);
      checkArgument(
          prefetchRingCount >= 0,
          "Prefetch ring count must be non-negative: %s",
          prefetchRingCount);
      return new TileConfig(this);
    }
  }
}
