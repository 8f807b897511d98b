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

package com.cybersheet.formula.impl.expr;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.cybersheet.formula.expr.FormulaValue;

/**
 * A rectangular array of values.  A one dimensional array is stored (and
 * viewed) as a single row.  Arrays never convert to scalars, callers which
 * accept a single value must unwrap 1x1 arrays themselves.
 */
public final class ArrayValue extends BaseValue
{
  private final FormulaValue[][] _rows;
  private final boolean _oneDim;

  ArrayValue(FormulaValue[][] rows, boolean oneDim) {
    _rows = rows;
    _oneDim = oneDim;
  }

  @Override
  public Type getType() {
    return (_oneDim ? Type.ARRAY_1D : Type.ARRAY_2D);
  }

  @Override
  public Object get() {
    return this;
  }

  @Override
  public int getRowCount() {
    return _rows.length;
  }

  @Override
  public int getColumnCount() {
    return ((_rows.length > 0) ? _rows[0].length : 0);
  }

  /**
   * @return the element at the given position, {@code #N/A} for positions
   *         outside of this array
   */
  @Override
  public FormulaValue getElement(int row, int col) {
    if((row < 0) || (row >= _rows.length) || (col < 0) ||
       (col >= _rows[row].length)) {
      return ValueSupport.NA_VAL;
    }
    return _rows[row][col];
  }

  public List<FormulaValue> getRow(int row) {
    return Arrays.asList(_rows[row].clone());
  }

  public List<FormulaValue> getColumn(int col) {
    List<FormulaValue> vals = new ArrayList<FormulaValue>(_rows.length);
    for(FormulaValue[] row : _rows) {
      vals.add(row[col]);
    }
    return vals;
  }

  /**
   * @return a copy of the elements as a 2D java array
   */
  public FormulaValue[][] toRows() {
    FormulaValue[][] copy = new FormulaValue[_rows.length][];
    for(int i = 0; i < _rows.length; ++i) {
      copy[i] = _rows[i].clone();
    }
    return copy;
  }

  @Override
  public boolean equals(Object o) {
    return ((o instanceof ArrayValue) &&
            Arrays.deepEquals(_rows, ((ArrayValue)o)._rows));
  }

  @Override
  public int hashCode() {
    return Arrays.deepHashCode(_rows);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder().append("FormulaValue[")
      .append(getType()).append("] {");
    for(int i = 0; i < _rows.length; ++i) {
      if(i > 0) {
        sb.append(";");
      }
      for(int j = 0; j < _rows[i].length; ++j) {
        if(j > 0) {
          sb.append(",");
        }
        FormulaValue val = _rows[i][j];
        if(val.getType() == Type.TEXT) {
          sb.append('"').append(val.getAsString()).append('"');
        } else if(val.getType().isScalar()) {
          sb.append(val.getAsString());
        } else {
          sb.append(val.get());
        }
      }
    }
    return sb.append("}").toString();
  }
}
