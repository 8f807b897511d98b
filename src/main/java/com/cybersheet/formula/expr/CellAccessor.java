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

/**
 * Read-only source of cell values for formula evaluation, supplied by the
 * worksheet which owns the cells.  The engine never writes back through an
 * accessor.  Implementations used from multiple threads must be safe for
 * concurrent reads.
 */
@FunctionalInterface
public interface CellAccessor
{
  /**
   * accessor for a sheet with no cells, every read returns an empty value
   */
  public static final CellAccessor EMPTY = new CellAccessor() {
      @Override
      public FormulaValue getCellValue(CellAddress address) {
        return null;
      }
    };

  /**
   * @return the value of the cell at the given address on the current
   *         sheet.  {@code null} is treated as an empty cell.
   */
  public FormulaValue getCellValue(CellAddress address);

  /**
   * @return the value of the cell at the given address on the named sheet.
   *         The default implementation ignores the sheet name.
   */
  default public FormulaValue getCellValue(String sheetName,
                                           CellAddress address) {
    return getCellValue(address);
  }

  /**
   * @return the number of addressable rows, references beyond this bound
   *         evaluate to {@link ErrorKind#REF}
   */
  default public int getRowCount() {
    return Integer.MAX_VALUE;
  }

  /**
   * @return the number of addressable columns, references beyond this bound
   *         evaluate to {@link ErrorKind#REF}
   */
  default public int getColumnCount() {
    return Integer.MAX_VALUE;
  }
}
