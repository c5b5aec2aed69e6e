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

import com.google.common.annotations.GwtCompatible;
import com.google.common.math.IntMath;
import com.google.common.primitives.Ints;
import com.google.errorprone.annotations.Immutable;
import java.io.Serializable;
import org.jspecify.annotations.Nullable;

/**
 * A CellCoordinate is the zero-based (row, column) address of a single cell in the grid. Both
 * indices are non-negative.
 *
 * <p>Coordinates can be converted to and from spreadsheet notation, where columns are lettered
 * "A".."Z", "AA".."ZZ", "AAA"... and rows are numbered from 1, so that (0, 0) is "A1" and (9, 27)
 * is "AB10".
 */
@Immutable
@GwtCompatible(serializable = true)
public final class CellCoordinate implements Serializable {
  private static final int LETTERS = 26;

  private final int row;
  private final int column;

  /** Constructs a coordinate. Throws IllegalArgumentException if either index is negative. */
  public CellCoordinate(int row, int column) {
    checkArgument(row >= 0, "Row must be non-negative: %s", row);
    checkArgument(column >= 0, "Column must be non-negative: %s", column);
    this.row = row;
    this.column = column;
  }

  /**
   * Parses spreadsheet notation such as "A1" or "ab10". Letters are case-insensitive.
   *
   * @throws IllegalArgumentException if the notation is empty or malformed, names row 0, or names
   *     a row or column beyond the int range
   */
  public static CellCoordinate fromNotation(String notation) {
    checkArgument(!notation.isEmpty(), "Cell notation cannot be empty");
    int i = 0;
    int column = 0;
    while (i < notation.length()) {
      char c = Character.toUpperCase(notation.charAt(i));
      if (c < 'A' || c > 'Z') {
        break;
      }
      column = appendDigit(column, LETTERS, c - 'A' + 1, notation);
      i++;
    }
    checkArgument(i > 0 && i < notation.length(), "Invalid cell notation: %s", notation);

    int rowNumber = 0;
    for (int j = i; j < notation.length(); j++) {
      char c = notation.charAt(j);
      checkArgument(c >= '0' && c <= '9', "Invalid cell notation: %s", notation);
      rowNumber = appendDigit(rowNumber, 10, c - '0', notation);
    }
    checkArgument(rowNumber >= 1, "Row number must be at least 1: %s", notation);
    return new CellCoordinate(rowNumber - 1, column - 1);
  }

  /** Returns {@code value * radix + digit}, failing if the result does not fit in an int. */
  private static int appendDigit(int value, int radix, int digit, String notation) {
    try {
      return IntMath.checkedAdd(IntMath.checkedMultiply(value, radix), digit);
    } catch (ArithmeticException e) {
      throw new IllegalArgumentException("Cell notation out of range: " + notation, e);
    }
  }

  public int row() {
    return row;
  }

  public int column() {
    return column;
  }

  /** Returns this coordinate in spreadsheet notation, e.g. "AB10". */
  public String toNotation() {
    StringBuilder letters = new StringBuilder();
    // Bijective base 26: there is no zero digit.
    long c = column + 1L;
    while (c > 0) {
      c--;
      letters.append((char) ('A' + c % LETTERS));
      c /= LETTERS;
    }
    return letters.reverse().append(row + 1L).toString();
  }

  /** Returns a coordinate offset by the given deltas, clamped to [0, Integer.MAX_VALUE]. */
  public CellCoordinate offset(int rowDelta, int columnDelta) {
    return new CellCoordinate(
        max(0, Ints.saturatedCast((long) row + rowDelta)),
        max(0, Ints.saturatedCast((long) column + columnDelta)));
  }

  @Override
  public boolean equals(@Nullable Object other) {
    if (!(other instanceof CellCoordinate)) {
      return false;
    }
    CellCoordinate that = (CellCoordinate) other;
    return row == that.row && column == that.column;
  }

  @Override
  public int hashCode() {
    return 31 * row + column;
  }

  @Override
  public String toString() {
    return "CellCoordinate(" + toNotation() + ")";
  }
}
