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

/**
 * A discrete level of detail derived from a continuous zoom scale. Tiles are cached per bucket,
 * and the bucket decides what a renderer draws: text is skipped in the lowest bucket, gridlines in
 * the two lowest, and the gridline stroke is chosen so that lines stay about one screen pixel wide.
 *
 * <p>Buckets are declared in order of increasing scale, so {@link #ordinal()} and {@link
 * #compareTo} can be used to compare levels.
 */
public enum ZoomBucket {
  /** Scales below 0.25. */
  TENTH(0.25, 5.0, 10.0),
  /** Scales in [0.25, 0.40). */
  QUARTER(0.40, 5.0, 4.0),
  /** Scales in [0.40, 0.50). */
  FORTY(0.50, 2.0, 2.0),
  /** Scales in [0.50, 1.00). */
  HALF(1.00, 1.5, 2.0),
  /** Scales in [1.00, 2.00). */
  FULL(2.00, 1.0, 1.0),
  /** Scales in [2.00, 3.00). */
  TWO_X(3.00, 0.5, 0.5),
  /** Scales of 3.00 and above. */
  QUADRUPLE(Double.POSITIVE_INFINITY, 0.25, 0.25);

  private final double upperBound;
  private final double gridlineStrokeWidth;
  private final double tileSpanMultiplier;

  ZoomBucket(double upperBound, double gridlineStrokeWidth, double tileSpanMultiplier) {
    this.upperBound = upperBound;
    this.gridlineStrokeWidth = gridlineStrokeWidth;
    this.tileSpanMultiplier = tileSpanMultiplier;
  }

  /** Returns the bucket containing the given zoom scale, where 1.0 is 100%. */
  public static ZoomBucket fromScale(double scale) {
    for (ZoomBucket bucket : values()) {
      if (scale < bucket.upperBound) {
        return bucket;
      }
    }
    return QUADRUPLE;
  }

  /** Returns the exclusive upper scale bound of this bucket. */
  public double upperBound() {
    return upperBound;
  }

  /** Returns true if cell text should be drawn at this level. */
  public boolean rendersText() {
    return this != TENTH;
  }

  /** Returns true if gridlines should be drawn at this level. */
  public boolean rendersGridlines() {
    return compareTo(FORTY) >= 0;
  }

  /**
   * Returns the gridline stroke width in content pixels, thicker when zoomed out and thinner when
   * zoomed in so the line is about one screen pixel wide.
   */
  public double gridlineStrokeWidth() {
    return gridlineStrokeWidth;
  }

  /** Returns how many base tile sizes of content one tile covers at this level. */
  public double tileSpanMultiplier() {
    return tileSpanMultiplier;
  }
}
