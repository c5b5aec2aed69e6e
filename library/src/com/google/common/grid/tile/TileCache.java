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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.grid.CellRange;
import com.google.common.grid.Platform;
import com.google.common.grid.ZoomBucket;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * A least-recently-used cache of rendered {@link Tile}s, bounded to {@code maxTiles} entries, that
 * defers releasing the pictures of tiles it drops.
 *
 * <p>A tile leaves the cache either because a new tile is put at its key or because it is the
 * least recently used entry when room is needed. Either way it is removed from the map at once, so
 * {@link #get} and {@link #containsKey} stop returning it, but its picture may still be in use by
 * the paint that fetched it. Such tiles wait on a pending-disposal list until {@link #cleanup()},
 * which the owner calls once per frame after painting. The life of a tile is thus: present and
 * valid, possibly invalidated, evicted to the pending list, and finally disposed.
 *
 * <p>Invalidation marks tiles stale in place and does not remove them; it is up to the caller to
 * notice {@link Tile#isValid()} and replace the tile.
 *
 * <p>The cache owns every tile in its map and on its pending list. It is not thread-safe; all calls
 * must come from the rendering thread.
 *
 * @param <P> the type of the rendered pictures
 */
public final class TileCache<P> {
  private static final Logger log = Platform.getLoggerForClass(TileCache.class);

  private final int maxTiles;

  /** Tiles in access order, least recently used first. */
  private final LinkedHashMap<TileKey, Tile<P>> tiles = new LinkedHashMap<>(16, 0.75f, true);

  /** Tiles removed from the map whose pictures have not been released yet. */
  private final List<Tile<P>> pendingDisposal = new ArrayList<>();

  /**
   * Constructs an empty cache holding at most {@code maxTiles} tiles.
   *
   * @throws IllegalArgumentException if maxTiles is not positive
   */
  public TileCache(int maxTiles) {
    checkArgument(maxTiles > 0, "Max tiles must be positive: %s", maxTiles);
    this.maxTiles = maxTiles;
  }

  public int maxTiles() {
    return maxTiles;
  }

  /** Returns the number of tiles in the cache, not counting those pending disposal. */
  public int size() {
    return tiles.size();
  }

  public boolean isEmpty() {
    return tiles.isEmpty();
  }

  /** Returns the number of evicted tiles waiting for {@link #cleanup()}. */
  public int pendingDisposalCount() {
    return pendingDisposal.size();
  }

  /**
   * Returns the tile at {@code key} and marks it most recently used, or returns null if there is
   * none. The returned tile may be invalid.
   */
  public @Nullable Tile<P> get(TileKey key) {
    // Access order: get() moves the entry to the most recently used end.
    return tiles.get(key);
  }

  /** Returns true if a tile is cached at {@code key}. Does not affect recency. */
  public boolean containsKey(TileKey key) {
    return tiles.containsKey(key);
  }

  /**
   * Caches {@code tile} at {@code key} as the most recently used entry. A tile previously at the
   * key, and the least recently used tiles while the cache is full, move to the pending-disposal
   * list. Nothing is disposed here.
   */
  public void put(TileKey key, Tile<P> tile) {
    checkNotNull(tile);
    Tile<P> existing = tiles.remove(key);
    if (existing != null && existing != tile) {
      pendingDisposal.add(existing);
    }
    while (tiles.size() >= maxTiles) {
      evictEldest();
    }
    tiles.put(key, tile);
  }

  private void evictEldest() {
    Iterator<Map.Entry<TileKey, Tile<P>>> it = tiles.entrySet().iterator();
    Map.Entry<TileKey, Tile<P>> eldest = it.next();
    it.remove();
    pendingDisposal.add(eldest.getValue());
    log.fine("Evicted " + eldest.getKey());
  }

  /**
   * Removes and returns the tile at {@code key} without disposing it, or returns null if there is
   * none. The caller takes ownership of the returned tile.
   */
  @CanIgnoreReturnValue
  public @Nullable Tile<P> remove(TileKey key) {
    return tiles.remove(key);
  }

  /** Marks every cached tile whose cell range intersects {@code range} invalid. */
  public void invalidateRange(CellRange range) {
    for (Tile<P> tile : tiles.values()) {
      if (tile.intersectsCellRange(range)) {
        tile.invalidate();
      }
    }
  }

  /** Marks every cached tile in {@code zoomBucket} invalid. */
  public void invalidateZoomBucket(ZoomBucket zoomBucket) {
    for (Map.Entry<TileKey, Tile<P>> entry : tiles.entrySet()) {
      if (entry.getKey().zoomBucket() == zoomBucket) {
        entry.getValue().invalidate();
      }
    }
  }

  /** Marks every cached tile invalid. */
  public void invalidateAll() {
    for (Tile<P> tile : tiles.values()) {
      tile.invalidate();
    }
  }

  /** Returns the valid cached tiles in {@code zoomBucket}, least recently used first. */
  public ImmutableList<Tile<P>> validTilesForZoom(ZoomBucket zoomBucket) {
    ImmutableList.Builder<Tile<P>> result = ImmutableList.builder();
    for (Map.Entry<TileKey, Tile<P>> entry : tiles.entrySet()) {
      if (entry.getKey().zoomBucket() == zoomBucket && entry.getValue().isValid()) {
        result.add(entry.getValue());
      }
    }
    return result.build();
  }

  /**
   * Disposes every tile evicted since the last cleanup. Call once per frame, after the paint has
   * finished with all tiles it fetched, and never while tiles are being fetched.
   */
  public void cleanup() {
    if (pendingDisposal.isEmpty()) {
      return;
    }
    log.fine("Disposing " + pendingDisposal.size() + " evicted tiles");
    for (Tile<P> tile : pendingDisposal) {
      tile.dispose();
    }
    pendingDisposal.clear();
  }

  /**
   * Disposes every cached tile immediately and empties the cache. Tiles pending disposal are left
   * for the next {@link #cleanup()}. Not for use during a paint.
   */
  public void clear() {
    for (Tile<P> tile : tiles.values()) {
      tile.dispose();
    }
    tiles.clear();
  }

  /** Disposes every tile the cache owns, cached or pending. */
  public void dispose() {
    log.info("Disposing tile cache of " + tiles.size() + " tiles, " + pendingDisposal.size()
        + " pending");
    clear();
    cleanup();
  }

  /** Returns the cached keys, least recently used first. */
  @VisibleForTesting
  ImmutableList<TileKey> keysInAccessOrder() {
    return ImmutableList.copyOf(tiles.keySet());
  }
}
