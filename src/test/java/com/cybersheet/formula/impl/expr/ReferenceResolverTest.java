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
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ReferenceResolverTest
{
  private static final CellAddress B2 = CellAddress.parse("B2");

  @Test
  public void testRelative() throws Exception
  {
    Reference a1 = new Reference(1, 1, false, false);
    assertEquals(CellAddress.parse("B4"),
                 ReferenceResolver.resolve(a1, B2, CellAddress.parse("C5")));
    assertEquals(CellAddress.parse("A1"),
                 ReferenceResolver.resolve(a1, B2, B2));
    // moving above/left of the anchor can leave the sheet
    CellAddress resolved = ReferenceResolver.resolve(
        a1, B2, CellAddress.parse("A1"));
    assertEquals(0, resolved.getRow());
    assertEquals(0, resolved.getColumn());
  }

  @Test
  public void testAbsolute() throws Exception
  {
    Reference abs = new Reference(1, 1, true, true);
    assertEquals(CellAddress.parse("A1"),
                 ReferenceResolver.resolve(abs, B2, CellAddress.parse("Z99")));

    Reference colAbs = new Reference(1, 1, true, false);
    assertEquals(new CellAddress(4, 1),
                 ReferenceResolver.resolve(colAbs, B2, new CellAddress(5, 2)));

    Reference rowAbs = new Reference(1, 1, false, true);
    assertEquals(new CellAddress(1, 4),
                 ReferenceResolver.resolve(rowAbs, B2, new CellAddress(2, 5)));
  }

  @Test
  public void testAxesIndependent() throws Exception
  {
    Reference ref = new Reference(3, 10, false, true);
    assertEquals(10, ReferenceResolver.resolveRow(
                     ref, B2, CellAddress.parse("F20")));
    assertEquals(7, ReferenceResolver.resolveColumn(
                     ref, B2, CellAddress.parse("F20")));
  }
}
