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

/**
 * ZoomTransform converts between screen pixels and content pixels for a uniform zoom scale. At
 * scale 2.0 content appears twice as large, so screen point (200, 100) is content point (100, 50).
 *
 * <p>The scale is always clamped to {@code [minScale, maxScale]}, which are fixed at construction.
 * Any platform-driven scaling (accessibility text size, device pixel ratio) is the caller's to fold
 * into the value passed to {@link #setScale}.
 */
public final class ZoomTransform {
  public static final double DEFAULT_MIN_SCALE = 0.1;
  public static final double DEFAULT_MAX_SCALE = 4.0;

  private final double minScale;
  private final double maxScale;
  private double scale;

  /** Constructs a transform at scale 1.0 with the default bounds. */
  public ZoomTransform() {
    this(1.0);
  }

  /** Constructs a transform at the given scale, clamped to the default bounds. */
  public ZoomTransform(double scale) {
    this(scale, DEFAULT_MIN_SCALE, DEFAULT_MAX_SCALE);
  }

  /**
   * Constructs a transform at the given scale, clamped to {@code [minScale, maxScale]}.
   *
   * @throws IllegalArgumentException if scale is NaN, or minScale is not positive or exceeds
   *     maxScale
   */
  public ZoomTransform(double scale, double minScale, double maxScale) {
    checkArgument(minScale > 0, "minScale must be positive: %s", minScale);
    checkArgument(minScale <= maxScale, "minScale %s > maxScale %s", minScale, maxScale);
    this.minScale = minScale;
    this.maxScale = maxScale;
    this.scale = clamp(scale);
  }

  private double clamp(double value) {
    checkArgument(!Double.isNaN(value), "Scale must not be NaN");
    return max(minScale, min(maxScale, value));
  }

  public double minScale() {
    return minScale;
  }

  public double maxScale() {
    return maxScale;
  }

  /** Returns the current scale, where 1.0 is 100%. */
  public double scale() {
    return scale;
  }

  /**
   * Sets the scale, clamped to the bounds.
   *
   * @throws IllegalArgumentException if value is NaN
   */
  public void setScale(double value) {
    scale = clamp(value);
  }

  /** Returns the scale as a rounded percentage. */
  public int percentage() {
    return (int) Math.round(scale * 100);
  }

  /** Sets the scale from a percentage, clamped to the bounds. */
  public void setPercentage(int percent) {
    setScale(percent / 100.0);
  }

  public boolean canZoomIn() {
    return scale < maxScale;
  }

  public boolean canZoomOut() {
    return scale > minScale;
  }

  /** Converts a screen distance or coordinate to content space. */
  public double screenToContent(double screenValue) {
    return screenValue / scale;
  }

  /** Converts a content distance or coordinate to screen space. */
  public double contentToScreen(double contentValue) {
    return contentValue * scale;
  }

  /** Converts a screen rectangle to content space. */
  public PixelRect screenToContent(PixelRect screenRect) {
    return PixelRect.fromLTRB(
        screenRect.left() / scale,
        screenRect.top() / scale,
        screenRect.right() / scale,
        screenRect.bottom() / scale);
  }

  /** Converts a content rectangle to screen space. */
  public PixelRect contentToScreen(PixelRect contentRect) {
    return contentRect.scale(scale);
  }

  /** Returns the level-of-detail bucket for the current scale. */
  public ZoomBucket zoomBucket() {
    return ZoomBucket.fromScale(scale);
  }

  @Override
  public String toString() {
    return "ZoomTransform[scale=" + scale + ", min=" + minScale + ", max=" + maxScale + "]";
  }
}
