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

import com.cybersheet.formula.TestSheet;
import com.cybersheet.formula.expr.ErrorKind;
import org.junit.jupiter.api.Test;

import static com.cybersheet.formula.impl.expr.FormulaParserTest.*;
import static org.junit.jupiter.api.Assertions.*;

public class DatabaseFunctionsTest
{
  private static final String TREES = "A1:E7";

  private static TestSheet createTrees() {
    return new TestSheet().setRows(
        "A1",
        new Object[]{"Tree", "Height", "Age", "Yield", "Profit"},
        new Object[]{"Apple", 18, 20, 14, 105},
        new Object[]{"Pear", 12, 12, 10, 96},
        new Object[]{"Cherry", 13, 14, 9, 105},
        new Object[]{"Apple", 14, 15, 10, 75},
        new Object[]{"Pear", 9, 8, 8, 76.8},
        new Object[]{"Apple", 8, 9, 6, 45});
  }

  @Test
  public void testDSum() throws Exception
  {
    TestSheet sheet = createTrees()
      .setRows("G1", new Object[]{"Tree"}, new Object[]{"Apple"});

    assertEquals(30d, evalDb("DSUM", "\"Yield\"", "G1:G2", sheet));
    assertEquals(30d, evalDb("DSUM", "\"yield\"", "G1:G2", sheet));
    assertEquals(30d, evalDb("DSUM", "4", "G1:G2", sheet));

    // columns of a criteria row are ANDed
    sheet.setRows("G1", new Object[]{"Tree", "Height"},
                  new Object[]{"Apple", ">10"});
    assertEquals(24d, evalDb("DSUM", "\"Yield\"", "G1:H2", sheet));

    // criteria rows are ORed
    sheet = createTrees().setRows("G1", new Object[]{"Tree"},
                                  new Object[]{"Apple"}, new Object[]{"Pear"});
    assertEquals(397.8d, (Double)evalDb("DSUM", "\"Profit\"", "G1:G3", sheet),
                 1e-9);

    sheet = createTrees().setRows("G1", new Object[]{"Height"},
                                  new Object[]{">12"});
    assertEquals(49d, evalDb("DSUM", "\"Age\"", "G1:G2", sheet));

    sheet = createTrees().setRows("G1", new Object[]{"Tree"},
                                  new Object[]{"*e*"});
    assertEquals(57d, evalDb("DSUM", "\"Yield\"", "G1:G2", sheet));

    // blank criteria matches everything, header alone matches nothing
    sheet = createTrees().set("G1", "Tree");
    assertEquals(57d, evalDb("DSUM", "\"Yield\"", "G1:G2", sheet));
    assertEquals(0d, evalDb("DSUM", "\"Yield\"", "G1", sheet));
    assertEquals(ErrorKind.DIV_ZERO,
                 evalDb("DAVERAGE", "\"Yield\"", "G1", sheet));
  }

  @Test
  public void testReductions() throws Exception
  {
    TestSheet sheet = createTrees()
      .setRows("G1", new Object[]{"Tree"}, new Object[]{"Apple"});

    assertEquals(10d, evalDb("DAVERAGE", "\"Yield\"", "G1:G2", sheet));
    assertEquals(3d, evalDb("DCOUNT", "\"Age\"", "G1:G2", sheet));
    assertEquals(0d, evalDb("DCOUNT", "\"Tree\"", "G1:G2", sheet));
    assertEquals(3d, evalDb("DCOUNTA", "\"Tree\"", "G1:G2", sheet));
    assertEquals(105d, evalDb("DMAX", "\"Profit\"", "G1:G2", sheet));
    assertEquals(45d, evalDb("DMIN", "\"Profit\"", "G1:G2", sheet));

    assertEquals(5.0332d, (Double)evalDb("DSTDEV", "\"Height\"", "G1:G2",
                                         sheet), 1e-4);
    assertEquals(4.1096d, (Double)evalDb("DSTDEVP", "\"Height\"", "G1:G2",
                                         sheet), 1e-4);
    assertEquals(25.3333d, (Double)evalDb("DVAR", "\"Height\"", "G1:G2",
                                          sheet), 1e-4);
    assertEquals(16.8889d, (Double)evalDb("DVARP", "\"Height\"", "G1:G2",
                                          sheet), 1e-4);

    sheet.set("G2", "Cherry");
    assertEquals(ErrorKind.DIV_ZERO,
                 evalDb("DSTDEV", "\"Height\"", "G1:G2", sheet));
    assertEquals(0d, evalDb("DVARP", "\"Height\"", "G1:G2", sheet));
  }

  @Test
  public void testDGet() throws Exception
  {
    TestSheet sheet = createTrees()
      .setRows("G1", new Object[]{"Tree"}, new Object[]{"Cherry"});
    assertEquals(9d, evalDb("DGET", "\"Yield\"", "G1:G2", sheet));

    sheet.set("G2", "Apple");
    assertEquals(ErrorKind.NUM, evalDb("DGET", "\"Yield\"", "G1:G2", sheet));

    sheet.set("G2", "Plum");
    assertEquals(ErrorKind.VALUE, evalDb("DGET", "\"Yield\"", "G1:G2", sheet));
  }

  @Test
  public void testEmployees() throws Exception
  {
    TestSheet sheet = new TestSheet().setRows(
        "A1",
        new Object[]{"Name", "Department", "Salary", "Experience"},
        new Object[]{"Alice", "Engineering", 80000, 6},
        new Object[]{"Bob", "Sales", 60000, 3},
        new Object[]{"Carol", "Engineering", 70000, 4},
        new Object[]{"Diana", "Engineering", 90000, 12},
        new Object[]{"Eve", "Marketing", 65000, 7})
      .setRows("G1", new Object[]{"Name"}, new Object[]{"Diana"})
      .setRows("I1", new Object[]{"Department", "Salary"},
               new Object[]{"Engineering", ">75000"});

    assertEquals(90000d, eval("=DGET(A1:D6,\"Salary\",G1:G2)", sheet));
    assertEquals(9d, eval("=DAVERAGE(A1:D6,\"Experience\",I1:J2)", sheet));
    assertEquals(2d, eval("=DCOUNT(A1:D6,3,I1:J2)", sheet));
  }

  @Test
  public void testInvalidParams() throws Exception
  {
    TestSheet sheet = createTrees()
      .setRows("G1", new Object[]{"Tree"}, new Object[]{"Apple"});

    assertEquals(ErrorKind.VALUE, evalDb("DSUM", "\"Weight\"", "G1:G2", sheet));
    assertEquals(ErrorKind.VALUE, evalDb("DSUM", "0", "G1:G2", sheet));
    assertEquals(ErrorKind.VALUE, evalDb("DSUM", "6", "G1:G2", sheet));
    assertEquals(ErrorKind.VALUE, evalDb("DSUM", "1.5", "G1:G2", sheet));
    assertEquals(ErrorKind.VALUE, evalDb("DSUM", "TRUE", "G1:G2", sheet));
    assertEquals(ErrorKind.NA, evalDb("DSUM", "#N/A", "G1:G2", sheet));

    // header row only
    assertEquals(ErrorKind.VALUE,
                 eval("=DSUM(A1:E1,\"Yield\",G1:G2)", sheet));
    assertEquals(ErrorKind.VALUE, eval("=DSUM(A1:E7,\"Yield\")", sheet));

    // unknown criteria header fails the row
    sheet.set("G1", "Weight");
    assertEquals(0d, evalDb("DSUM", "\"Yield\"", "G1:G2", sheet));
  }

  private static Object evalDb(String func, String field, String criteria,
                               TestSheet sheet) {
    return eval("=" + func + "(" + TREES + "," + field + "," + criteria + ")",
                sheet);
  }
}
