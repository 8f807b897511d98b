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

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

/**
 * A cell reference as written in formula text: the literal coordinates plus
 * whether each axis is absolute ({@code $}) or relative.  A range contributes
 * one Reference per corner.
 */
public final class Reference
{
  private final String _sheetName;
  private final int _col;
  private final int _row;
  private final boolean _colAbsolute;
  private final boolean _rowAbsolute;

  public Reference(int col, int row, boolean colAbsolute, boolean rowAbsolute) {
    this(null, col, row, colAbsolute, rowAbsolute);
  }

  public Reference(String sheetName, int col, int row, boolean colAbsolute,
                   boolean rowAbsolute) {
    _sheetName = sheetName;
    _col = col;
    _row = row;
    _colAbsolute = colAbsolute;
    _rowAbsolute = rowAbsolute;
  }

  /**
   * @return the sheet qualifier of this reference, {@code null} for the
   *         current sheet
   */
  public String getSheetName() {
    return _sheetName;
  }

  public int getColumn() {
    return _col;
  }

  public int getRow() {
    return _row;
  }

  public boolean isColumnAbsolute() {
    return _colAbsolute;
  }

  public boolean isRowAbsolute() {
    return _rowAbsolute;
  }

  /**
   * @return the literal (unshifted) address of this reference
   */
  public CellAddress getAddress() {
    return new CellAddress(_row, _col);
  }

  @Override
  public boolean equals(Object o) {
    if(this == o) {
      return true;
    }
    if(!(o instanceof Reference)) {
      return false;
    }
    Reference other = (Reference)o;
    return new EqualsBuilder()
      .append(_sheetName, other._sheetName)
      .append(_col, other._col)
      .append(_row, other._row)
      .append(_colAbsolute, other._colAbsolute)
      .append(_rowAbsolute, other._rowAbsolute)
      .isEquals();
  }

  @Override
  public int hashCode() {
    return new HashCodeBuilder()
      .append(_sheetName).append(_col).append(_row)
      .append(_colAbsolute).append(_rowAbsolute)
      .toHashCode();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    if(_sheetName != null) {
      if(_sheetName.matches("[A-Za-z_][\\w.]*")) {
        sb.append(_sheetName);
      } else {
        sb.append("'").append(_sheetName.replace("'", "''")).append("'");
      }
      sb.append("!");
    }
    if(_colAbsolute) {
      sb.append("$");
    }
    sb.append(CellAddress.toColumnLetters(_col));
    if(_rowAbsolute) {
      sb.append("$");
    }
    return sb.append(_row).toString();
  }
}
