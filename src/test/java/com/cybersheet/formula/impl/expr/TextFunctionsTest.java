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

public class TextFunctionsTest
{

  @Test
  public void testConcat() throws Exception
  {
    assertEquals("a1TRUE", eval("=CONCAT(\"a\",1,TRUE)"));
    assertEquals("abc", eval("=CONCAT({\"a\",\"b\"},\"c\")"));
    assertEquals("1.5", eval("=CONCAT(1.5)"));
    assertEquals(ErrorKind.NA, eval("=CONCAT(\"a\",#N/A)"));

    assertEquals("ab", eval("=CONCATENATE(\"a\",\"b\")"));
    assertArrayEquals(rows(row("ax", "ay")),
                      evalArray("=CONCATENATE(\"a\",{\"x\",\"y\"})"));

    TestSheet sheet = new TestSheet().set("A1", "b").set("A3", "c");
    assertEquals("a,b,c", eval("=TEXTJOIN(\",\",TRUE,\"a\",A1:A3)", sheet));
    assertEquals("a,b,,c", eval("=TEXTJOIN(\",\",FALSE,\"a\",A1:A3)", sheet));
    assertEquals("a-b-c", eval("=TEXTJOIN(\"-\",TRUE,{\"a\",\"\";\"b\",\"c\"})"));
    assertEquals(ErrorKind.VALUE, eval("=TEXTJOIN(\",\",TRUE)"));
  }

  @Test
  public void testCaseAndLength() throws Exception
  {
    assertEquals(5d, eval("=LEN(\"hello\")"));
    assertEquals(5d, eval("=LEN(123.5)"));
    assertEquals(0d, eval("=LEN(\"\")"));
    assertEquals(ErrorKind.DIV_ZERO, eval("=LEN(1/0)"));
    assertEquals("ABC", eval("=UPPER(\"aBc\")"));
    assertEquals("abc", eval("=LOWER(\"aBc\")"));
    assertArrayEquals(rows(row("A", "B")), evalArray("=UPPER({\"a\",\"b\"})"));
    assertEquals("a b", eval("=TRIM(\"  a   b  \")"));
    assertEquals(Boolean.FALSE, eval("=EXACT(\"a\",\"A\")"));
    assertEquals(Boolean.TRUE, eval("=EXACT(\"a\",\"a\")"));
    assertEquals(Boolean.TRUE, eval("=EXACT(1,\"1\")"));
  }

  @Test
  public void testSubstrings() throws Exception
  {
    assertEquals("he", eval("=LEFT(\"hello\",2)"));
    assertEquals("h", eval("=LEFT(\"hello\")"));
    assertEquals("hello", eval("=LEFT(\"hello\",10)"));
    assertEquals(ErrorKind.VALUE, eval("=LEFT(\"hello\",-1)"));
    assertEquals("llo", eval("=RIGHT(\"hello\",3)"));
    assertEquals("o", eval("=RIGHT(\"hello\")"));
    assertEquals("ell", eval("=MID(\"hello\",2,3)"));
    assertEquals("", eval("=MID(\"hello\",10,2)"));
    assertEquals("lo", eval("=MID(\"hello\",4,10)"));
    assertEquals(ErrorKind.VALUE, eval("=MID(\"hello\",0,1)"));
    assertEquals(ErrorKind.VALUE, eval("=MID(\"hello\",1,-1)"));
    assertArrayEquals(rows(row("ab", "cd")),
                      evalArray("=LEFT({\"abc\",\"cde\"},2)"));
  }
}
