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

package com.cybersheet.formula;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.cybersheet.formula.expr.CellAccessor;
import com.cybersheet.formula.expr.CellAddress;
import com.cybersheet.formula.expr.FormulaValue;
import com.cybersheet.formula.impl.expr.ValueSupport;

/**
 * Simple in memory sheet for tests.  Records every address read.
 */
public class TestSheet implements CellAccessor
{
  private final Map<CellAddress,FormulaValue> _cells =
    new HashMap<CellAddress,FormulaValue>();
  private final Map<String,TestSheet> _otherSheets =
    new HashMap<String,TestSheet>();
  private final List<CellAddress> _reads = new ArrayList<CellAddress>();
  private int _rowCount = Integer.MAX_VALUE;
  private int _colCount = Integer.MAX_VALUE;

  public TestSheet set(String a1, Object val) {
    return set(CellAddress.parse(a1), val);
  }

  public TestSheet set(CellAddress addr, Object val) {
    _cells.put(addr, ValueSupport.toValue(val));
    return this;
  }

  /**
   * Fills a block of cells starting at the given top left cell.
   */
  public TestSheet setRows(String topLeft, Object[]... rows) {
    CellAddress start = CellAddress.parse(topLeft);
    for(int i = 0; i < rows.length; ++i) {
      for(int j = 0; j < rows[i].length; ++j) {
        set(start.offset(i, j), rows[i][j]);
      }
    }
    return this;
  }

  public TestSheet setBounds(int rowCount, int colCount) {
    _rowCount = rowCount;
    _colCount = colCount;
    return this;
  }

  public TestSheet addSheet(String name, TestSheet sheet) {
    _otherSheets.put(name.toUpperCase(), sheet);
    return this;
  }

  public List<CellAddress> getReads() {
    return _reads;
  }

  public void clearReads() {
    _reads.clear();
  }

  @Override
  public FormulaValue getCellValue(CellAddress address) {
    _reads.add(address);
    return _cells.get(address);
  }

  @Override
  public FormulaValue getCellValue(String sheetName, CellAddress address) {
    TestSheet sheet = _otherSheets.get(sheetName.toUpperCase());
    return ((sheet != null) ? sheet.getCellValue(address) : null);
  }

  @Override
  public int getRowCount() {
    return _rowCount;
  }

  @Override
  public int getColumnCount() {
    return _colCount;
  }
}
