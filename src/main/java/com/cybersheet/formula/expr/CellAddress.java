/*
Copyright (c) 2024 CyberSheet

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

    http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package com.cybersheet.formula.expr;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Immutable address of a worksheet cell.  Rows and columns are 1-based, so
 * {@code A1} is row 1, column 1.
 */
public final class CellAddress implements Comparable<CellAddress>
{
  private static final Pattern A1_PAT =
    Pattern.compile("^\\$?([A-Za-z]{1,3})\\$?([0-9]{1,7})$");
  private static final int ALPHA_RADIX = 26;

  private final int _row;
  private final int _col;

  public CellAddress(int row, int col) {
    _row = row;
    _col = col;
  }

  public int getRow() {
    return _row;
  }

  public int getColumn() {
    return _col;
  }

  /**
   * @return a new address offset from this one by the given number of rows
   *         and columns
   */
  public CellAddress offset(int rowDelta, int colDelta) {
    return new CellAddress(_row + rowDelta, _col + colDelta);
  }

  /**
   * Parses an A1 style address (dollar signs are accepted and ignored).
   *
   * @throws IllegalArgumentException if the given string is not a cell
   *         address
   */
  public static CellAddress parse(String a1) {
    Matcher m = ((a1 != null) ? A1_PAT.matcher(a1.trim()) : null);
    if((m == null) || !m.matches()) {
      throw new IllegalArgumentException("Invalid cell address '" + a1 + "'");
    }
    return new CellAddress(Integer.parseInt(m.group(2)),
                           fromColumnLetters(m.group(1)));
  }

  /**
   * @return the 1-based column index for the given column letters, e.g.
   *         {@code "AA"} is 27
   */
  public static int fromColumnLetters(String letters) {
    int col = 0;
    for(int i = 0; i < letters.length(); ++i) {
      char c = Character.toUpperCase(letters.charAt(i));
      col = (col * ALPHA_RADIX) + (c - 'A' + 1);
    }
    return col;
  }

  /**
   * @return the column letters for the given 1-based column index
   */
  public static String toColumnLetters(int col) {
    StringBuilder sb = new StringBuilder();
    while(col > 0) {
      int rem = (col - 1) % ALPHA_RADIX;
      sb.insert(0, (char)('A' + rem));
      col = (col - 1) / ALPHA_RADIX;
    }
    return sb.toString();
  }

  public int compareTo(CellAddress other) {
    int cmp = Integer.compare(_row, other._row);
    return ((cmp != 0) ? cmp : Integer.compare(_col, other._col));
  }

  @Override
  public boolean equals(Object o) {
    if(this == o) {
      return true;
    }
    if(!(o instanceof CellAddress)) {
      return false;
    }
    CellAddress other = (CellAddress)o;
    return ((_row == other._row) && (_col == other._col));
  }

  @Override
  public int hashCode() {
    return (_row * 31) + _col;
  }

  @Override
  public String toString() {
    if((_row < 1) || (_col < 1)) {
      return "R" + _row + "C" + _col;
    }
    return toColumnLetters(_col) + _row;
  }
}
