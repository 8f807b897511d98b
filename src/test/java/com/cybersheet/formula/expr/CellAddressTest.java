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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CellAddressTest
{

  @Test
  public void testParse() throws Exception
  {
    CellAddress addr = CellAddress.parse("C5");
    assertEquals(5, addr.getRow());
    assertEquals(3, addr.getColumn());
    assertEquals("C5", addr.toString());

    assertEquals(new CellAddress(12, 28), CellAddress.parse("$ab$12"));
    assertEquals("AB12", CellAddress.parse("$ab$12").toString());

    for(String bad : new String[]{null, "", "5C", "A", "ABCD1", "A1:B2"}) {
      try {
        CellAddress.parse(bad);
        fail("IllegalArgumentException should have been thrown for " + bad);
      } catch(IllegalArgumentException expected) {
        // success
      }
    }
  }

  @Test
  public void testColumnLetters() throws Exception
  {
    assertEquals(1, CellAddress.fromColumnLetters("A"));
    assertEquals(26, CellAddress.fromColumnLetters("Z"));
    assertEquals(27, CellAddress.fromColumnLetters("aa"));
    assertEquals(16384, CellAddress.fromColumnLetters("XFD"));

    assertEquals("A", CellAddress.toColumnLetters(1));
    assertEquals("Z", CellAddress.toColumnLetters(26));
    assertEquals("AA", CellAddress.toColumnLetters(27));
    assertEquals("AZ", CellAddress.toColumnLetters(52));
    assertEquals("XFD", CellAddress.toColumnLetters(16384));
  }

  @Test
  public void testOffsetAndOrder() throws Exception
  {
    CellAddress b2 = CellAddress.parse("B2");
    assertEquals(CellAddress.parse("D3"), b2.offset(1, 2));
    assertEquals("R0C1", b2.offset(-2, -1).toString());

    assertTrue(CellAddress.parse("Z1").compareTo(CellAddress.parse("A2")) < 0);
    assertTrue(CellAddress.parse("B2").compareTo(CellAddress.parse("A2")) > 0);
    assertEquals(0, b2.compareTo(new CellAddress(2, 2)));
    assertEquals(b2.hashCode(), new CellAddress(2, 2).hashCode());
  }

  @Test
  public void testReferenceToString() throws Exception
  {
    assertEquals("$B$3", new Reference(2, 3, true, true).toString());
    assertEquals("B$3", new Reference(2, 3, false, true).toString());
    assertEquals("Data!$B3",
                 new Reference("Data", 2, 3, true, false).toString());
    assertEquals("'My Data'!B3",
                 new Reference("My Data", 2, 3, false, false).toString());
    assertEquals(new CellAddress(3, 2),
                 new Reference(2, 3, false, false).getAddress());
  }
}
