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
import static java.lang.Math.max;
import static java.lang.Math.min;

import com.google.common.collect.ImmutableList;
import com.google.common.grid.CellRange;
import com.google.common.grid.GridLayout;
import com.google.common.grid.PixelRect;
import com.google.common.grid.Platform;
import com.google.common.grid.SpanIndex;
import com.google.common.grid.ZoomBucket;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * TileManager answers "which tiles cover this viewport at this zoom bucket", serving cached tiles
 * and rendering missing or stale ones through a {@link TileRenderer}.
 *
 * <p>A frame goes as follows:
 *
 * <pre>{@code
 * List<Tile<Picture>> tiles = manager.getTilesForViewport(viewport, zoom.zoomBucket());
 * for (Tile<Picture> tile : tiles) {
 *   canvas.draw(tile.picture(), tile.coordinate().pixelBounds(size, size));
 * }
 * manager.cleanup();
 * }</pre>
 *
 * <p>Tiles must be composited in the order returned, which is row-major over the tile grid.
 * {@link #cleanup()} must be called exactly once per frame after painting, to release the pictures
 * of tiles evicted while fetching; until then those pictures stay usable.
 *
 * <p>When grid content changes, call one of the invalidate methods; affected tiles are re-rendered
 * the next time a viewport covers them. The manager does not push notifications.
 *
 * <p>The manager owns its {@link TileCache} but only borrows the layout and the renderer. It is not
 * thread-safe; all calls must come from the rendering thread.
 *
 * @param <P> the type of the rendered pictures
 */
public final class TileManager<P> {
  private static final Logger log = Platform.getLoggerForClass(TileManager.class);

  private final GridLayout layout;
  private final TileConfig config;
  private final TileRenderer<P> renderer;
  private final TileCache<P> cache;
  private boolean disposed = false;

  public TileManager(GridLayout layout, TileConfig config, TileRenderer<P> renderer) {
    this.layout = checkNotNull(layout);
    this.config = checkNotNull(config);
    this.renderer = checkNotNull(renderer);
    this.cache = new TileCache<>(config.maxCachedTiles());
  }

  public GridLayout layout() {
    return layout;
  }

  public TileConfig config() {
    return config;
  }

  /** Returns the number of tiles currently cached. */
  public int cachedTileCount() {
    return cache.size();
  }

  /**
   * Returns the tiles covering the content-space {@code viewport} at {@code zoomBucket}, in
   * row-major tile order. Tiles that are not cached, or cached but invalid, are rendered and cached
   * before this returns.
   */
  public ImmutableList<Tile<P>> getTilesForViewport(PixelRect viewport, ZoomBucket zoomBucket) {
    checkNotDisposed();
    ImmutableList<TileCoordinate> coordinates = tileCoordinatesForViewport(viewport);
    ImmutableList.Builder<Tile<P>> tiles =
        ImmutableList.builderWithExpectedSize(coordinates.size());
    int rendered = 0;
    for (TileCoordinate coord : coordinates) {
      TileKey key = new TileKey(coord, zoomBucket);
      Tile<P> tile = cache.get(key);
      if (tile == null || !tile.isValid()) {
        tile = renderTile(coord, zoomBucket);
        cache.put(key, tile);
        rendered++;
      }
      tiles.add(tile);
    }
    if (rendered > 0) {
      log.fine("Rendered " + rendered + " of " + coordinates.size() + " tiles at " + zoomBucket);
    }
    return tiles.build();
  }

  /** Returns the coordinates of the tiles covering {@code viewport}, in row-major order. */
  public ImmutableList<TileCoordinate> tileCoordinatesForViewport(PixelRect viewport) {
    return TileCoordinate.tilesCovering(viewport, config.tileWidth(), config.tileHeight());
  }

  /**
   * Returns the coordinates of the tiles within {@link TileConfig#prefetchRingCount()} tiles of the
   * block covering {@code viewport}, excluding that block, in row-major order. These are the tiles
   * a caller may want to render ahead of scrolling; the manager does not render them itself.
   */
  public ImmutableList<TileCoordinate> prefetchCoordinates(PixelRect viewport) {
    int rings = config.prefetchRingCount();
    ImmutableList<TileCoordinate> visible = tileCoordinatesForViewport(viewport);
    if (rings == 0 || visible.isEmpty()) {
      return ImmutableList.of();
    }
    TileCoordinate first = visible.get(0);
    TileCoordinate last = visible.get(visible.size() - 1);
    ImmutableList.Builder<TileCoordinate> result = ImmutableList.builder();
    int lastRow = (int) min(TileCoordinate.MAX_INDEX, (long) last.row() + rings);
    int lastColumn = (int) min(TileCoordinate.MAX_INDEX, (long) last.column() + rings);
    for (int row = max(0, first.row() - rings); row <= lastRow; row++) {
      for (int col = max(0, first.column() - rings); col <= lastColumn; col++) {
        boolean inside =
            row >= first.row()
                && row <= last.row()
                && col >= first.column()
                && col <= last.column();
        if (!inside) {
          result.add(new TileCoordinate(row, col));
        }
      }
    }
    return result.build();
  }

  /**
   * Returns the cells overlapping the pixel bounds of the tile at {@code coord}, clamped to the
   * grid. A tile beyond the content is given the edge rows or columns nearest to it.
   */
  public CellRange cellRangeForTile(TileCoordinate coord) {
    PixelRect bounds = coord.pixelBounds(config.tileWidth(), config.tileHeight());
    int maxRow = layout.rowCount() - 1;
    int maxColumn = layout.columnCount() - 1;

    int startRow = layout.rowAt(bounds.top());
    int startColumn = layout.columnAt(bounds.left());
    int endRow = layout.rowAt(bounds.bottom() - TileCoordinate.BOUNDARY_EPSILON);
    int endColumn = layout.columnAt(bounds.right() - TileCoordinate.BOUNDARY_EPSILON);

    // A start past the content means the whole tile is; use the last index.
    startRow = startRow == SpanIndex.NOT_FOUND ? maxRow : startRow;
    startColumn = startColumn == SpanIndex.NOT_FOUND ? maxColumn : startColumn;
    endRow = endRow == SpanIndex.NOT_FOUND ? maxRow : max(endRow, startRow);
    endColumn = endColumn == SpanIndex.NOT_FOUND ? maxColumn : max(endColumn, startColumn);
    return new CellRange(
        min(startRow, maxRow), min(startColumn, maxColumn),
        min(endRow, maxRow), min(endColumn, maxColumn));
  }

  /** Returns the cached tile at {@code key}, marking it recently used, or null if not cached. */
  public @Nullable Tile<P> getTile(TileKey key) {
    checkNotDisposed();
    return cache.get(key);
  }

  /** Marks cached tiles whose cells intersect {@code range} for re-rendering. */
  public void invalidateRange(CellRange range) {
    checkNotDisposed();
    cache.invalidateRange(range);
  }

  /** Marks cached tiles of {@code zoomBucket} for re-rendering. */
  public void invalidateZoomBucket(ZoomBucket zoomBucket) {
    checkNotDisposed();
    cache.invalidateZoomBucket(zoomBucket);
  }

  /** Marks every cached tile for re-rendering. */
  public void invalidateAll() {
    checkNotDisposed();
    cache.invalidateAll();
  }

  /** Disposes and drops every cached tile now. Must not be called while painting. */
  public void clearCache() {
    checkNotDisposed();
    cache.clear();
  }

  /** Releases tiles evicted during the last frame. Call once after each paint. */
  public void cleanup() {
    checkNotDisposed();
    cache.cleanup();
  }

  /** Releases every tile. The manager cannot be used afterwards. */
  public void dispose() {
    if (!disposed) {
      disposed = true;
      cache.dispose();
    }
  }

  private void checkNotDisposed() {
    checkState(!disposed, "TileManager has been disposed");
  }

  private Tile<P> renderTile(TileCoordinate coord, ZoomBucket zoomBucket) {
    PixelRect bounds = coord.pixelBounds(config.tileWidth(), config.tileHeight());
    CellRange cellRange = cellRangeForTile(coord);
    P picture = renderer.renderTile(coord, bounds, cellRange, zoomBucket);
    checkNotNull(picture, "Renderer returned null for %s", coord);
    return new Tile<>(coord, zoomBucket, picture, cellRange, renderer::disposePicture);
  }
}
