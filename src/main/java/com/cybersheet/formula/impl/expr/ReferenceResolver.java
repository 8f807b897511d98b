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

import com.cybersheet.formula.expr.CellAddress;
import com.cybersheet.formula.expr.Reference;

/**
 * Maps a parsed reference to a concrete cell for a given anchor (the cell
 * the formula was written for) and target (the cell it is evaluated for).
 * Each axis is handled independently: an absolute coordinate is used as
 * written, a relative coordinate moves by the target's offset from the
 * anchor.
 */
public class ReferenceResolver
{
  private ReferenceResolver() {}

  public static CellAddress resolve(Reference ref, CellAddress anchor,
                                    CellAddress target)
  {
    return new CellAddress(resolveRow(ref, anchor, target),
                           resolveColumn(ref, anchor, target));
  }

  public static int resolveRow(Reference ref, CellAddress anchor,
                               CellAddress target)
  {
    if(ref.isRowAbsolute()) {
      return ref.getRow();
    }
    return ref.getRow() + (target.getRow() - anchor.getRow());
  }

  public static int resolveColumn(Reference ref, CellAddress anchor,
                                  CellAddress target)
  {
    if(ref.isColumnAbsolute()) {
      return ref.getColumn();
    }
    return ref.getColumn() + (target.getColumn() - anchor.getColumn());
  }
}
