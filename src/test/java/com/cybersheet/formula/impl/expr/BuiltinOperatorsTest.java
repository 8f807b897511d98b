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

import java.util.Arrays;

import com.cybersheet.formula.expr.ErrorKind;
import com.cybersheet.formula.expr.EvalException;
import com.cybersheet.formula.expr.FormulaValue;
import org.junit.jupiter.api.Test;

import static com.cybersheet.formula.impl.expr.BuiltinOperators.*;
import static com.cybersheet.formula.impl.expr.FormulaParserTest.*;
import static org.junit.jupiter.api.Assertions.*;

public class BuiltinOperatorsTest
{
  private static final FormulaValue EMPTY = ValueSupport.EMPTY_VAL;

  @Test
  public void testCompareValues() throws Exception
  {
    assertEquals(0, compareValues(EMPTY, num(0)));
    assertEquals(0, compareValues(EMPTY, str("")));
    assertEquals(0, compareValues(str(""), EMPTY));
    assertEquals(0, compareValues(EMPTY, ValueSupport.FALSE_VAL));
    assertEquals(0, compareValues(EMPTY, EMPTY));
    assertTrue(compareValues(EMPTY, num(1)) < 0);
    assertTrue(compareValues(num(-1), EMPTY) < 0);

    assertEquals(0, compareValues(str("abc"), str("ABC")));
    assertTrue(compareValues(str("a"), str("B")) < 0);
    assertTrue(compareValues(num(10), num(9)) > 0);

    // numbers before text before booleans
    assertTrue(compareValues(num(100), str("1")) < 0);
    assertTrue(compareValues(str("zzz"), ValueSupport.FALSE_VAL) < 0);
    assertTrue(compareValues(ValueSupport.TRUE_VAL, num(1)) > 0);
    assertTrue(compareValues(ValueSupport.FALSE_VAL,
                             ValueSupport.TRUE_VAL) < 0);

    EvalException e = assertThrows(EvalException.class, () ->
        compareValues(ValueSupport.NA_VAL, num(1)));
    assertEquals(ErrorKind.NA, e.getErrorKind());
    e = assertThrows(EvalException.class, () ->
        compareValues(num(1), ValueSupport.toArray1D(
                          Arrays.asList(num(1), num(2)))));
    assertEquals(ErrorKind.VALUE, e.getErrorKind());
  }

  @Test
  public void testScalarOperators() throws Exception
  {
    assertEquals(5d, add(str("2"), num(3)).get());
    assertEquals(1d, add(ValueSupport.TRUE_VAL, EMPTY).get());
    assertEquals(-4d, negate(num(4)).get());
    assertEquals("0.3", concat(EMPTY, add(num(0.1), num(0.2))).get());
    assertEquals("a1TRUE",
                 concat(concat(str("a"), num(1)), ValueSupport.TRUE_VAL).get());
    assertEquals(ErrorKind.VALUE, add(str("abc"), num(1)).get());
    assertEquals(ErrorKind.DIV_ZERO, divide(num(1), EMPTY).get());
    assertEquals(ErrorKind.NUM, multiply(num(1e300), num(1e300)).get());
    assertEquals(8d, exp(num(2), num(3)).get());

    assertEquals(Boolean.TRUE, BuiltinOperators.equals(str("A"), str("a")).get());
    assertEquals(Boolean.FALSE, notEquals(EMPTY, num(0)).get());
    assertEquals(Boolean.TRUE, lessThanEq(num(1), str("0")).get());
    assertEquals(Boolean.TRUE, greaterThan(ValueSupport.TRUE_VAL, str("x")).get());
    // the first error operand wins
    assertEquals(ErrorKind.NA,
                 lessThan(ValueSupport.NA_VAL, ValueSupport.DIV_ZERO_VAL).get());
    assertEquals(ErrorKind.DIV_ZERO,
                 add(ValueSupport.DIV_ZERO_VAL, ValueSupport.NA_VAL).get());
  }

  @Test
  public void testBroadcastShapes() throws Exception
  {
    FormulaValue col = ValueSupport.toArray(new FormulaValue[][]{
        {num(1)}, {num(2)}});
    FormulaValue row = ValueSupport.toArray(new FormulaValue[][]{
        {num(10), num(20)}});
    FormulaValue row1D = ValueSupport.toArray1D(Arrays.asList(num(1), num(2)));

    assertArrayEquals(rows(row(11d, 21d), row(12d, 22d)),
                      (Object[][])toJava(add(col, row)));

    FormulaValue result = multiply(row1D, num(3));
    assertEquals(FormulaValue.Type.ARRAY_1D, result.getType());
    assertArrayEquals(rows(row(3d, 6d)), (Object[][])toJava(result));

    result = add(row1D, col);
    assertEquals(FormulaValue.Type.ARRAY_2D, result.getType());
    assertArrayEquals(rows(row(2d, 3d), row(3d, 4d)),
                      (Object[][])toJava(result));

    FormulaValue mixed = ValueSupport.toArray(new FormulaValue[][]{
        {num(1), ValueSupport.NA_VAL, str("x")}});
    assertArrayEquals(rows(row(2d, ErrorKind.NA, ErrorKind.VALUE)),
                      (Object[][])toJava(add(mixed, num(1))));

    FormulaValue square = ValueSupport.toArray(new FormulaValue[][]{
        {num(1), num(2)}, {num(3), num(4)}});
    FormulaValue wide = ValueSupport.toArray(new FormulaValue[][]{
        {num(1), num(1), num(1)}, {num(1), num(1), num(1)},
        {num(1), num(1), num(1)}});
    assertArrayEquals(rows(row(2d, 3d, ErrorKind.NA),
                           row(4d, 5d, ErrorKind.NA),
                           row(ErrorKind.NA, ErrorKind.NA, ErrorKind.NA)),
                      (Object[][])toJava(add(square, wide)));
  }

  private static FormulaValue num(double d) {
    return ValueSupport.toValue(d);
  }

  private static FormulaValue str(String s) {
    return ValueSupport.toValue(s);
  }
}
