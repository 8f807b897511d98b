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

import com.cybersheet.formula.expr.ErrorKind;
import org.junit.jupiter.api.Test;

import static com.cybersheet.formula.impl.expr.FormulaParserTest.*;
import static org.junit.jupiter.api.Assertions.*;

public class EngineeringFunctionsTest
{

  @Test
  public void testToDecimal() throws Exception
  {
    assertEquals(100d, eval("=BIN2DEC(\"1100100\")"));
    assertEquals(100d, eval("=BIN2DEC(1100100)"));
    assertEquals(-1d, eval("=BIN2DEC(\"1111111111\")"));
    assertEquals(-512d, eval("=BIN2DEC(\"1000000000\")"));
    assertEquals(0d, eval("=BIN2DEC(\"\")"));
    assertEquals(ErrorKind.NUM, eval("=BIN2DEC(\"12\")"));
    assertEquals(ErrorKind.NUM, eval("=BIN2DEC(\"11111111111\")"));
    assertEquals(ErrorKind.VALUE, eval("=BIN2DEC(TRUE)"));

    assertEquals(15d, eval("=OCT2DEC(\"17\")"));
    assertEquals(-1d, eval("=OCT2DEC(\"7777777777\")"));
    assertEquals(ErrorKind.NUM, eval("=OCT2DEC(\"8\")"));

    assertEquals(255d, eval("=HEX2DEC(\"FF\")"));
    assertEquals(255d, eval("=HEX2DEC(\"ff\")"));
    assertEquals(-1d, eval("=HEX2DEC(\"FFFFFFFFFF\")"));
    assertEquals(ErrorKind.NUM, eval("=HEX2DEC(\"G1\")"));

    assertArrayEquals(rows(row(1d, 2d, 3d)),
                      evalArray("=BIN2DEC({\"1\",\"10\",\"11\"})"));
  }

  @Test
  public void testFromDecimal() throws Exception
  {
    assertEquals("1001", eval("=DEC2BIN(9)"));
    assertEquals("00001001", eval("=DEC2BIN(9,8)"));
    assertEquals("1001", eval("=DEC2BIN(9.9)"));
    assertEquals("1111111111", eval("=DEC2BIN(-1)"));
    assertEquals("1000000000", eval("=DEC2BIN(-512)"));
    assertEquals(ErrorKind.NUM, eval("=DEC2BIN(512)"));
    assertEquals(ErrorKind.NUM, eval("=DEC2BIN(-513)"));
    assertEquals(ErrorKind.NUM, eval("=DEC2BIN(9,2)"));
    assertEquals(ErrorKind.NUM, eval("=DEC2BIN(9,11)"));
    assertEquals(ErrorKind.VALUE, eval("=DEC2BIN(\"abc\")"));

    assertEquals("10", eval("=DEC2OCT(8)"));
    assertEquals("7777777777", eval("=DEC2OCT(-1)"));
    assertEquals("FF", eval("=DEC2HEX(255)"));
    assertEquals("00FF", eval("=DEC2HEX(255,4)"));
    assertEquals("FFFFFFFFFF", eval("=DEC2HEX(-1)"));
  }

  @Test
  public void testConversions() throws Exception
  {
    assertEquals("FF", eval("=BIN2HEX(\"11111111\")"));
    assertEquals("7777777777", eval("=BIN2OCT(\"1111111111\")"));
    assertEquals("111", eval("=OCT2BIN(\"7\")"));
    assertEquals("F", eval("=OCT2HEX(\"17\")"));
    assertEquals("00001111", eval("=HEX2BIN(\"F\",8)"));
    assertEquals("1111111111", eval("=HEX2BIN(\"FFFFFFFFFF\")"));
    assertEquals(ErrorKind.NUM, eval("=HEX2BIN(\"200\")"));
    assertEquals("377", eval("=HEX2OCT(\"FF\")"));
  }

  @Test
  public void testBitOps() throws Exception
  {
    assertEquals(8d, eval("=BITAND(12,10)"));
    assertEquals(14d, eval("=BITOR(12,10)"));
    assertEquals(6d, eval("=BITXOR(12,10)"));
    assertEquals(ErrorKind.NUM, eval("=BITAND(-1,1)"));
    assertEquals(ErrorKind.NUM, eval("=BITAND(1.5,1)"));
    assertEquals(ErrorKind.NUM, eval("=BITOR(2^48,1)"));
    assertEquals(ErrorKind.VALUE, eval("=BITXOR(\"x\",1)"));

    assertEquals(16d, eval("=BITLSHIFT(1,4)"));
    assertEquals(4d, eval("=BITRSHIFT(16,2)"));
    assertEquals(4d, eval("=BITLSHIFT(16,-2)"));
    assertEquals(64d, eval("=BITRSHIFT(16,-2)"));
    assertEquals(140737488355328d, eval("=BITLSHIFT(2^46,1)"));
    assertEquals(ErrorKind.NUM, eval("=BITLSHIFT(2^47,1)"));
    assertEquals(ErrorKind.NUM, eval("=BITLSHIFT(1,54)"));
    assertArrayEquals(rows(row(1d, 2d, 4d)),
                      evalArray("=BITLSHIFT(1,{0,1,2})"));
  }
}
