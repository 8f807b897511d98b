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

public class LogicalFunctionsTest
{

  @Test
  public void testIf() throws Exception
  {
    assertEquals("b", eval("=IF(1>2,\"a\",\"b\")"));
    assertEquals("a", eval("=IF(2>1,\"a\",\"b\")"));
    assertEquals(Boolean.FALSE, eval("=IF(FALSE,1)"));
    // only the chosen branch is evaluated
    assertEquals(1d, eval("=IF(TRUE,1,1/0)"));
    assertEquals(2d, eval("=IF(0,1/0,2)"));
    assertEquals(ErrorKind.DIV_ZERO, eval("=IF(1/0,1,2)"));
    assertEquals(ErrorKind.VALUE, eval("=IF(\"x\",1,2)"));
    assertEquals(ErrorKind.VALUE, eval("=IF(TRUE)"));

    assertArrayEquals(rows(row(1d, 2d)), evalArray("=IF({TRUE,FALSE},1,2)"));
    assertArrayEquals(rows(row("a", "b")),
                      evalArray("=IF({1,5}<3,\"a\",\"b\")"));
  }

  @Test
  public void testErrorHandlers() throws Exception
  {
    assertEquals("x", eval("=IFERROR(1/0,\"x\")"));
    assertEquals(3d, eval("=IFERROR(1+2,\"x\")"));
    assertArrayEquals(rows(row(1d, 0d)), evalArray("=IFERROR({1,#N/A},0)"));

    assertEquals(0d, eval("=IFNA(NA(),0)"));
    assertEquals(ErrorKind.DIV_ZERO, eval("=IFNA(1/0,0)"));
    assertArrayEquals(rows(row(0d, ErrorKind.REF)),
                      evalArray("=IFNA({#N/A,#REF!},0)"));
  }

  @Test
  public void testIfsChooseSwitch() throws Exception
  {
    assertEquals("b", eval("=IFS(1>2,\"a\",TRUE,\"b\")"));
    assertEquals(ErrorKind.NA, eval("=IFS(FALSE,1)"));
    assertEquals(ErrorKind.VALUE, eval("=IFS(TRUE,1,FALSE)"));
    assertEquals(ErrorKind.VALUE, eval("=IFS(TRUE)"));
    assertEquals(1d, eval("=IFS(TRUE,1,1/0,2)"));

    assertEquals("b", eval("=CHOOSE(2,\"a\",\"b\",\"c\")"));
    assertEquals("c", eval("=CHOOSE(3.7,\"a\",\"b\",\"c\")"));
    assertEquals(ErrorKind.VALUE, eval("=CHOOSE(4,\"a\",\"b\",\"c\")"));
    assertEquals(ErrorKind.VALUE, eval("=CHOOSE(0,\"a\",\"b\")"));
    assertEquals("a", eval("=CHOOSE(1,\"a\",1/0)"));

    assertEquals("two", eval("=SWITCH(2,1,\"one\",2,\"two\")"));
    assertEquals("none", eval("=SWITCH(3,1,\"one\",\"none\")"));
    assertEquals(ErrorKind.NA, eval("=SWITCH(3,1,\"one\",2,\"two\")"));
    assertEquals(2d, eval("=SWITCH(\"B\",\"a\",1,\"b\",2)"));
  }

  @Test
  public void testBooleanOps() throws Exception
  {
    assertEquals(Boolean.TRUE, eval("=AND(TRUE,1)"));
    assertEquals(Boolean.FALSE, eval("=AND(TRUE,0)"));
    assertEquals(Boolean.TRUE, eval("=AND({TRUE,\"x\",1})"));
    assertEquals(ErrorKind.VALUE, eval("=AND(\"x\")"));
    assertEquals(ErrorKind.NA, eval("=AND(TRUE,#N/A)"));
    assertEquals(Boolean.FALSE, eval("=OR(FALSE,0)"));
    assertEquals(Boolean.TRUE, eval("=OR(FALSE,{0,1})"));
    assertEquals(Boolean.TRUE, eval("=XOR(TRUE,TRUE,TRUE)"));
    assertEquals(Boolean.FALSE, eval("=XOR(TRUE,1)"));

    TestSheet sheet = new TestSheet();
    // only empty cells, no logical values at all
    assertEquals(ErrorKind.VALUE, eval("=AND(A1:A3)", sheet));

    assertEquals(Boolean.TRUE, eval("=NOT(0)"));
    assertEquals(Boolean.FALSE, eval("=NOT(\"true\")"));
    assertArrayEquals(rows(row(Boolean.FALSE, Boolean.TRUE)),
                      evalArray("=NOT({TRUE,FALSE})"));
    assertEquals(Boolean.TRUE, eval("=TRUE()"));
    assertEquals(Boolean.FALSE, eval("=FALSE()"));
    assertEquals(ErrorKind.NA, eval("=NA()"));
    assertEquals(ErrorKind.VALUE, eval("=NA(1)"));
  }

  @Test
  public void testIsFunctions() throws Exception
  {
    TestSheet sheet = new TestSheet().set("A1", 1);

    assertEquals(Boolean.TRUE, eval("=ISERROR(1/0)"));
    assertEquals(Boolean.FALSE, eval("=ISERROR(1)"));
    assertEquals(Boolean.FALSE, eval("=ISNA(1/0)"));
    assertEquals(Boolean.TRUE, eval("=ISNA(#N/A)"));
    assertEquals(Boolean.TRUE, eval("=ISNUMBER(1)"));
    assertEquals(Boolean.FALSE, eval("=ISNUMBER(\"1\")"));
    assertEquals(Boolean.TRUE, eval("=ISTEXT(\"1\")"));
    assertEquals(Boolean.TRUE, eval("=ISLOGICAL(FALSE)"));
    assertEquals(Boolean.FALSE, eval("=ISLOGICAL(0)"));
    assertEquals(Boolean.TRUE, eval("=ISBLANK(B1)", sheet));
    assertEquals(Boolean.FALSE, eval("=ISBLANK(A1)", sheet));
    assertEquals(Boolean.FALSE, eval("=ISBLANK(\"\")"));
    assertArrayEquals(rows(row(Boolean.FALSE, Boolean.TRUE)),
                      evalArray("=ISERROR({1,#VALUE!})"));
  }
}
