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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import com.google.common.grid.CellRange;
import com.google.common.grid.GridLayout;
import com.google.common.grid.GridTestCase;
import com.google.common.grid.PixelRect;
import com.google.common.grid.SpanIndex;
import com.google.common.grid.ZoomBucket;
import java.util.ArrayList;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Verifies TileManager. */
@RunWith(JUnit4.class)
public class TileManagerTest extends GridTestCase {

  /** A renderer that records what it is asked to draw and release. */
  private static class RecordingRenderer implements TileRenderer<String> {
    final List<TileCoordinate> rendered = new ArrayList<>();
    final List<CellRange> renderedCells = new ArrayList<>();
    final List<PixelRect> renderedBounds = new ArrayList<>();
    final List<String> disposed = new ArrayList<>();

    @Override
    public String renderTile(
        TileCoordinate coordinate, PixelRect bounds, CellRange cellRange, ZoomBucket zoomBucket) {
      rendered.add(coordinate);
      renderedCells.add(cellRange);
      renderedBounds.add(bounds);
      return coordinate.row() + "," + coordinate.column() + "@" + zoomBucket
          + "#" + rendered.size();
    }

    @Override
    public void disposePicture(String picture) {
      disposed.add(picture);
    }
  }

  private GridLayout layout;
  private RecordingRenderer renderer;

  @Before
  public void createLayout() {
    // 1000 rows of 25px by 100 columns of 100px: 10000 x 25000 content pixels.
    layout = new GridLayout(new SpanIndex(1000, 25), new SpanIndex(100, 100));
    renderer = new RecordingRenderer();
  }

  private TileManager<String> newManager(int maxCachedTiles) {
    TileConfig config = TileConfig.builder().setMaxCachedTiles(maxCachedTiles).build();
    return new TileManager<>(layout, config, renderer);
  }

  @Test
  public void testTileCountsForViewports() {
    TileManager<String> manager = newManager(10);
    assertEquals(
        4,
        manager.getTilesForViewport(PixelRect.fromLTWH(0, 0, 512, 512), ZoomBucket.FULL).size());
    assertEquals(
        8,
        manager.getTilesForViewport(PixelRect.fromLTWH(0, 0, 1024, 512), ZoomBucket.FULL).size());
    assertEquals(
        4,
        manager.tileCoordinatesForViewport(PixelRect.fromLTWH(128, 128, 256, 256)).size());
  }

  @Test
  public void testTilesInRowMajorOrder() {
    TileManager<String> manager = newManager(10);
    ImmutableList<Tile<String>> tiles =
        manager.getTilesForViewport(PixelRect.fromLTWH(0, 0, 512, 512), ZoomBucket.FULL);
    assertEquals(new TileCoordinate(0, 0), tiles.get(0).coordinate());
    assertEquals(new TileCoordinate(0, 1), tiles.get(1).coordinate());
    assertEquals(new TileCoordinate(1, 0), tiles.get(2).coordinate());
    assertEquals(new TileCoordinate(1, 1), tiles.get(3).coordinate());
    assertEquals(
        ImmutableList.of(
            new TileCoordinate(0, 0),
            new TileCoordinate(0, 1),
            new TileCoordinate(1, 0),
            new TileCoordinate(1, 1)),
        renderer.rendered);
  }

  @Test
  public void testRendererReceivesGeometry() {
    TileManager<String> manager = newManager(10);
    manager.getTilesForViewport(PixelRect.fromLTWH(10, 10, 100, 25), ZoomBucket.FULL);
    assertEquals(ImmutableList.of(new TileCoordinate(0, 0)), renderer.rendered);
    assertEquals(PixelRect.fromLTWH(0, 0, 256, 256), renderer.renderedBounds.get(0));
    assertEquals(new CellRange(0, 0, 10, 2), renderer.renderedCells.get(0));
  }

  @Test
  public void testCellRangeForTile() {
    TileManager<String> manager = newManager(10);
    assertEquals(new CellRange(0, 0, 10, 2), manager.cellRangeForTile(new TileCoordinate(0, 0)));
    // Rows 256..512 start inside row 10 and end inside row 20.
    assertEquals(new CellRange(10, 2, 20, 5), manager.cellRangeForTile(new TileCoordinate(1, 1)));
  }

  @Test
  public void testCellRangeForTileBeyondContent() {
    TileManager<String> manager = newManager(10);
    // Column tile 39 straddles the right edge at 10000; tile 40 lies entirely past it.
    assertEquals(
        new CellRange(0, 99, 10, 99), manager.cellRangeForTile(new TileCoordinate(0, 39)));
    assertEquals(
        new CellRange(0, 99, 10, 99), manager.cellRangeForTile(new TileCoordinate(0, 40)));
    assertEquals(
        new CellRange(999, 0, 999, 2), manager.cellRangeForTile(new TileCoordinate(500, 0)));
  }

  @Test
  public void testCachedTilesAreReused() {
    TileManager<String> manager = newManager(10);
    PixelRect viewport = PixelRect.fromLTWH(0, 0, 512, 512);
    ImmutableList<Tile<String>> first = manager.getTilesForViewport(viewport, ZoomBucket.FULL);
    ImmutableList<Tile<String>> second = manager.getTilesForViewport(viewport, ZoomBucket.FULL);
    assertEquals(4, renderer.rendered.size());
    for (int i = 0; i < first.size(); i++) {
      assertSame(first.get(i), second.get(i));
    }
    assertEquals(4, manager.cachedTileCount());
    assertSame(
        first.get(0), manager.getTile(new TileKey(new TileCoordinate(0, 0), ZoomBucket.FULL)));
    assertNull(manager.getTile(new TileKey(new TileCoordinate(0, 0), ZoomBucket.HALF)));
  }

  @Test
  public void testZoomBucketsAreCachedSeparately() {
    TileManager<String> manager = newManager(10);
    PixelRect viewport = PixelRect.fromLTWH(0, 0, 100, 100);
    Tile<String> full = manager.getTilesForViewport(viewport, ZoomBucket.FULL).get(0);
    Tile<String> half = manager.getTilesForViewport(viewport, ZoomBucket.HALF).get(0);
    assertNotSame(full, half);
    assertEquals(ZoomBucket.HALF, half.zoomBucket());
    assertEquals(2, renderer.rendered.size());
  }

  @Test
  public void testInvalidateRangeRerendersIntersectingTiles() {
    TileManager<String> manager = newManager(10);
    PixelRect viewport = PixelRect.fromLTWH(0, 0, 512, 512);
    ImmutableList<Tile<String>> before = manager.getTilesForViewport(viewport, ZoomBucket.FULL);
    String replacedPicture = before.get(0).picture();

    manager.invalidateRange(new CellRange(0, 0, 0, 0));
    ImmutableList<Tile<String>> after = manager.getTilesForViewport(viewport, ZoomBucket.FULL);
    assertEquals(5, renderer.rendered.size());
    assertEquals(new TileCoordinate(0, 0), renderer.rendered.get(4));
    assertNotSame(before.get(0), after.get(0));
    assertSame(before.get(1), after.get(1));
    assertTrue(after.get(0).isValid());

    // The replaced tile is released by the next cleanup, not before.
    assertTrue(renderer.disposed.isEmpty());
    manager.cleanup();
    assertEquals(ImmutableList.of(replacedPicture), renderer.disposed);
  }

  @Test
  public void testInvalidateSharedCellRerendersAllTouchingTiles() {
    TileManager<String> manager = newManager(10);
    PixelRect viewport = PixelRect.fromLTWH(0, 0, 512, 512);
    manager.getTilesForViewport(viewport, ZoomBucket.FULL);
    // Cell (10, 2) straddles the corner shared by all four tiles.
    manager.invalidateRange(new CellRange(10, 2, 10, 2));
    manager.getTilesForViewport(viewport, ZoomBucket.FULL);
    assertEquals(8, renderer.rendered.size());
  }

  @Test
  public void testInvalidateZoomBucketAndAll() {
    TileManager<String> manager = newManager(10);
    PixelRect viewport = PixelRect.fromLTWH(0, 0, 100, 100);
    manager.getTilesForViewport(viewport, ZoomBucket.FULL);
    manager.getTilesForViewport(viewport, ZoomBucket.HALF);

    manager.invalidateZoomBucket(ZoomBucket.HALF);
    manager.getTilesForViewport(viewport, ZoomBucket.FULL);
    assertEquals(2, renderer.rendered.size());
    manager.getTilesForViewport(viewport, ZoomBucket.HALF);
    assertEquals(3, renderer.rendered.size());

    manager.invalidateAll();
    manager.getTilesForViewport(viewport, ZoomBucket.FULL);
    manager.getTilesForViewport(viewport, ZoomBucket.HALF);
    assertEquals(5, renderer.rendered.size());
  }

  @Test
  public void testEvictedTilesStayUsableUntilCleanup() {
    TileManager<String> manager = newManager(2);
    ImmutableList<Tile<String>> tiles =
        manager.getTilesForViewport(PixelRect.fromLTWH(0, 0, 512, 512), ZoomBucket.FULL);
    assertEquals(4, tiles.size());
    assertEquals(2, manager.cachedTileCount());
    for (Tile<String> tile : tiles) {
      assertFalse(tile.isDisposed());
    }
    manager.cleanup();
    assertTrue(tiles.get(0).isDisposed());
    assertTrue(tiles.get(1).isDisposed());
    assertFalse(tiles.get(2).isDisposed());
    assertFalse(tiles.get(3).isDisposed());
    assertEquals(2, renderer.disposed.size());
  }

  @Test
  public void testScrollingEvictsOldTiles() {
    TileManager<String> manager = newManager(10);
    manager.getTilesForViewport(PixelRect.fromLTWH(0, 0, 1024, 512), ZoomBucket.FULL);
    manager.cleanup();
    manager.getTilesForViewport(PixelRect.fromLTWH(0, 5120, 1024, 512), ZoomBucket.FULL);
    manager.cleanup();
    assertEquals(16, renderer.rendered.size());
    assertEquals(10, manager.cachedTileCount());
    assertEquals(6, renderer.disposed.size());
  }

  @Test
  public void testClearCache() {
    TileManager<String> manager = newManager(10);
    manager.getTilesForViewport(PixelRect.fromLTWH(0, 0, 512, 512), ZoomBucket.FULL);
    manager.clearCache();
    assertEquals(0, manager.cachedTileCount());
    assertEquals(4, renderer.disposed.size());
    manager.getTilesForViewport(PixelRect.fromLTWH(0, 0, 512, 512), ZoomBucket.FULL);
    assertEquals(8, renderer.rendered.size());
  }

  @Test
  public void testPrefetchCoordinates() {
    TileManager<String> manager = newManager(10);
    ImmutableList<TileCoordinate> ring =
        manager.prefetchCoordinates(PixelRect.fromLTWH(300, 300, 200, 200));
    assertEquals(
        ImmutableList.of(
            new TileCoordinate(0, 0),
            new TileCoordinate(0, 1),
            new TileCoordinate(0, 2),
            new TileCoordinate(1, 0),
            new TileCoordinate(1, 2),
            new TileCoordinate(2, 0),
            new TileCoordinate(2, 1),
            new TileCoordinate(2, 2)),
        ring);
    // Prefetching reports coordinates only.
    assertTrue(renderer.rendered.isEmpty());
  }

  @Test
  public void testPrefetchCoordinatesAtOrigin() {
    TileManager<String> manager = newManager(10);
    assertEquals(
        ImmutableList.of(
            new TileCoordinate(0, 1), new TileCoordinate(1, 0), new TileCoordinate(1, 1)),
        manager.prefetchCoordinates(PixelRect.fromLTWH(0, 0, 100, 100)));
  }

  @Test
  public void testViewportFarBeyondContent() {
    TileManager<String> manager = newManager(10);
    int max = TileCoordinate.MAX_INDEX;
    PixelRect viewport = PixelRect.fromLTWH(1e12, 0, 100, 100);
    ImmutableList<Tile<String>> tiles = manager.getTilesForViewport(viewport, ZoomBucket.FULL);
    assertEquals(1, tiles.size());
    assertEquals(new TileCoordinate(0, max), tiles.get(0).coordinate());
    assertEquals(new CellRange(0, 99, 10, 99), tiles.get(0).cellRange());
    assertEquals(
        ImmutableList.of(
            new TileCoordinate(0, max - 1),
            new TileCoordinate(1, max - 1),
            new TileCoordinate(1, max)),
        manager.prefetchCoordinates(viewport));
  }

  @Test
  public void testPrefetchDisabled() {
    TileConfig config = TileConfig.builder().setPrefetchRingCount(0).build();
    TileManager<String> manager = new TileManager<>(layout, config, renderer);
    assertTrue(manager.prefetchCoordinates(PixelRect.fromLTWH(300, 300, 200, 200)).isEmpty());
  }

  @Test
  public void testNullPictureFails() {
    TileManager<Object> manager =
        new TileManager<>(layout, TileConfig.DEFAULT, (coord, bounds, cells, bucket) -> null);
    assertThrows(
        NullPointerException.class,
        () -> manager.getTilesForViewport(PixelRect.fromLTWH(0, 0, 10, 10), ZoomBucket.FULL));
  }

  @Test
  public void testDispose() {
    TileManager<String> manager = newManager(10);
    manager.getTilesForViewport(PixelRect.fromLTWH(0, 0, 512, 512), ZoomBucket.FULL);
    manager.dispose();
    assertEquals(4, renderer.disposed.size());
    manager.dispose();
    assertEquals(4, renderer.disposed.size());

    PixelRect viewport = PixelRect.fromLTWH(0, 0, 512, 512);
    assertThrows(
        IllegalStateException.class,
        () -> manager.getTilesForViewport(viewport, ZoomBucket.FULL));
    assertThrows(IllegalStateException.class, manager::cleanup);
    assertThrows(IllegalStateException.class, manager::invalidateAll);
    assertThrows(IllegalStateException.class, manager::clearCache);
  }
}
