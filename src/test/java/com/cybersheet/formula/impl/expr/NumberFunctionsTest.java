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

public class NumberFunctionsTest
{
  @Test
  public void testAggregates() throws Exception
  {
    TestSheet sheet = new TestSheet()
      .setRows("A1", new Object[]{1, "a"}, new Object[]{5, "b"},
               new Object[]{10, "a"}, new Object[]{20, "c"})
      .set("C1", "text").set("C2", true).set("C3", ErrorKind.NA);

    assertEquals(36d, eval("=SUM(A1:A4)", sheet));
    assertEquals(9d, eval("=AVERAGE(A1:A4)", sheet));
    assertEquals(4d, eval("=SUM(\"3\",TRUE)"));
    assertEquals(ErrorKind.VALUE, eval("=SUM(\"x\")"));
    assertEquals(ErrorKind.NA, eval("=SUM(1,#N/A)"));
    // text, booleans and errors inside a range are skipped
    assertEquals(1d, eval("=SUM(A1,C1:C3)", sheet));
    assertEquals(ErrorKind.DIV_ZERO, eval("=AVERAGE(C1:C2)", sheet));

    assertEquals(3d, eval("=COUNT(1,\"2\",\"x\",TRUE)"));
    assertEquals(1d, eval("=COUNT({1,\"2\",TRUE})"));
    assertEquals(4d, eval("=COUNT(A1:C4)", sheet));
    assertEquals(11d, eval("=COUNTA(A1:C4)", sheet));
    assertEquals(4d, eval("=COUNTA(1,\"\",{1,2})"));
    assertEquals(3d, eval("=COUNTBLANK(C3:D4)", sheet));

    assertEquals(1d, eval("=MIN(A1:A4)", sheet));
    assertEquals(20d, eval("=MAX(A1:A4,-3)", sheet));
    assertEquals(-3d, eval("=MIN(A1:A4,-3)", sheet));
    assertEquals(0d, eval("=MAX(C1:C2)", sheet));
    assertEquals(0d, eval("=MIN(D1:D4)", sheet));
    assertEquals(24d, eval("=PRODUCT(2,3,4)"));
    assertEquals(0d, eval("=PRODUCT(D1:D2)", sheet));
  }

  @Test
  public void testConditionalAggregates() throws Exception
  {
    TestSheet sheet = new TestSheet()
      .setRows("A1", new Object[]{1, "a"}, new Object[]{5, "b"},
               new Object[]{10, "a"}, new Object[]{20, "c"});

    assertEquals(35d, eval("=SUMIF(A1:A4,\">4\")", sheet));
    assertEquals(11d, eval("=SUMIF(B1:B4,\"a\",A1:A4)", sheet));
    assertEquals(25d, eval("=SUMIF(B1:B4,\"<>a\",A1:A4)", sheet));
    assertEquals(0d, eval("=SUMIF(B1:B4,\"z\",A1:A4)", sheet));
    assertEquals(5.5d, eval("=AVERAGEIF(B1:B4,\"a\",A1:A4)", sheet));
    assertEquals(ErrorKind.DIV_ZERO, eval("=AVERAGEIF(A1:A4,\">100\")", sheet));
    assertEquals(2d, eval("=COUNTIF(B1:B4,\"a\")", sheet));
    assertEquals(2d, eval("=COUNTIF(A1:A4,\">=10\")", sheet));
    assertEquals(1d, eval("=COUNTIF(A1:A4,5)", sheet));
    assertEquals(4d, eval("=COUNTIF(B1:B4,\"?\")", sheet));
    assertEquals(4d, eval("=COUNTIF(A1:B2,\"*\")", sheet));
  }

  @Test
  public void testMultiCriteriaAggregates() throws Exception
  {
    TestSheet sheet = new TestSheet()
      .setRows("A1", new Object[]{1, "a", "x"}, new Object[]{5, "b", "y"},
               new Object[]{10, "a", "y"}, new Object[]{20, "c", "x"},
               new Object[]{30, "a", "y"})
      .set("D1", "text").set("D2", true);

    assertEquals(3d, eval("=COUNTIFS(B1:B5,\"a\")", sheet));
    assertEquals(2d, eval("=COUNTIFS(B1:B5,\"a\",C1:C5,\"y\")", sheet));
    assertEquals(2d, eval("=COUNTIFS(B1:B5,\"a\",A1:A5,\">5\")", sheet));
    assertEquals(0d, eval("=COUNTIFS(B1:B5,\"a\",C1:C5,\"z\")", sheet));

    assertEquals(40d, eval("=SUMIFS(A1:A5,B1:B5,\"a\",C1:C5,\"y\")", sheet));
    assertEquals(61d, eval("=SUMIFS(A1:A5,B1:B5,\"<>b\",A1:A5,\"<=30\")",
                           sheet));
    assertEquals(0d, eval("=SUMIFS(A1:A5,B1:B5,\"z\")", sheet));
    // only numbers in the value range are summed
    assertEquals(0d, eval("=SUMIFS(D1:D2,A1:A2,\">0\")", sheet));

    assertEquals(10.5d, eval("=AVERAGEIFS(A1:A5,C1:C5,\"x\")", sheet));
    assertEquals(20d, eval("=AVERAGEIFS(A1:A5,B1:B5,\"a\",C1:C5,\"y\")",
                           sheet));
    assertEquals(ErrorKind.DIV_ZERO,
                 eval("=AVERAGEIFS(A1:A5,B1:B5,\"z\")", sheet));

    assertEquals(30d, eval("=MAXIFS(A1:A5,B1:B5,\"a\")", sheet));
    assertEquals(5d, eval("=MINIFS(A1:A5,C1:C5,\"y\")", sheet));
    assertEquals(0d, eval("=MAXIFS(A1:A5,B1:B5,\"z\")", sheet));
    assertEquals(0d, eval("=MINIFS(A1:A5,B1:B5,\"z\")", sheet));

    // criteria ranges must match in shape and come in pairs
    assertEquals(ErrorKind.VALUE, eval("=SUMIFS(A1:A5,B1:B4,\"a\")", sheet));
    assertEquals(ErrorKind.VALUE,
                 eval("=COUNTIFS(B1:B5,\"a\",C1:C5)", sheet));
    assertEquals(ErrorKind.NA, eval("=COUNTIFS(B1:B5,#N/A)", sheet));
  }

  @Test
  public void testMath() throws Exception
  {
    assertEquals(3d, eval("=ABS(-3)"));
    assertArrayEquals(rows(row(1d, 2d)), evalArray("=ABS({-1,2})"));
    assertEquals(ErrorKind.VALUE, eval("=ABS(\"x\")"));
    assertEquals(ErrorKind.NA, eval("=ABS(#N/A)"));
    assertEquals(-2d, eval("=INT(-1.5)"));
    assertEquals(1d, eval("=INT(1.9)"));
    assertEquals(-1d, eval("=SIGN(-3)"));
    assertEquals(0d, eval("=SIGN(0)"));
    assertEquals(4d, eval("=SQRT(16)"));
    assertEquals(ErrorKind.NUM, eval("=SQRT(-1)"));

    assertEquals(2.35d, eval("=ROUND(2.345,2)"));
    assertEquals(-3d, eval("=ROUND(-2.5,0)"));
    assertEquals(1200d, eval("=ROUND(1234.5,-2)"));
    assertEquals(0.3d, eval("=ROUND(0.1+0.2,10)"));

    assertEquals(1d, eval("=MOD(-3,2)"));
    assertEquals(-1d, eval("=MOD(3,-2)"));
    assertEquals(1.5d, eval("=MOD(5.5,2)"));
    assertEquals(ErrorKind.DIV_ZERO, eval("=MOD(5,0)"));

    assertEquals(1024d, eval("=POWER(2,10)"));
    assertEquals(ErrorKind.NUM, eval("=POWER(0,0)"));
    assertEquals(ErrorKind.NUM, eval("=POWER(-8,1/3)"));
    assertEquals(ErrorKind.NUM, eval("=10^400"));
  }
}
