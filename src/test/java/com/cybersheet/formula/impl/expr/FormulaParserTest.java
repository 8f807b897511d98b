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

import java.util.List;

import com.cybersheet.formula.FormulaEngine;
import com.cybersheet.formula.FormulaEngineBuilder;
import com.cybersheet.formula.TestSheet;
import com.cybersheet.formula.expr.CellAccessor;
import com.cybersheet.formula.expr.CompiledFormula;
import com.cybersheet.formula.expr.ErrorKind;
import com.cybersheet.formula.expr.FormulaContext;
import com.cybersheet.formula.expr.FormulaValue;
import com.cybersheet.formula.expr.ParseException;
import com.cybersheet.formula.expr.Reference;
import org.apache.commons.lang3.StringUtils;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class FormulaParserTest
{
  static final FormulaEngine ENGINE = new FormulaEngineBuilder()
    .setCacheEnabled(false).build();

  @Test
  public void testOrderOfOperations() throws Exception
  {
    validateExpr("=1+2*3",
                 "<EBinaryOp>{<ELiteralValue>{1} + <EBinaryOp>{<ELiteralValue>{2} * <ELiteralValue>{3}}}",
                 "1 + 2 * 3");
    validateExpr("=1*2+3",
                 "<EBinaryOp>{<EBinaryOp>{<ELiteralValue>{1} * <ELiteralValue>{2}} + <ELiteralValue>{3}}",
                 "1 * 2 + 3");
    validateExpr("=1-2-3",
                 "<EBinaryOp>{<EBinaryOp>{<ELiteralValue>{1} - <ELiteralValue>{2}} - <ELiteralValue>{3}}",
                 "1 - 2 - 3");
    validateExpr("=2^3^2",
                 "<EBinaryOp>{<ELiteralValue>{2} ^ <EBinaryOp>{<ELiteralValue>{3} ^ <ELiteralValue>{2}}}",
                 "2 ^ 3 ^ 2");
    validateExpr("=-2^2",
                 "<EUnaryOp>{- <EBinaryOp>{<ELiteralValue>{2} ^ <ELiteralValue>{2}}}",
                 "-2 ^ 2");
    validateExpr("=\"a\"&1+2",
                 "<EBinaryOp>{<ELiteralValue>{\"a\"} & <EBinaryOp>{<ELiteralValue>{1} + <ELiteralValue>{2}}}",
                 "\"a\" & 1 + 2");
    validateExpr("=A1>1+2",
                 "<ECompOp>{<ECellRef>{A1} > <EBinaryOp>{<ELiteralValue>{1} + <ELiteralValue>{2}}}",
                 "A1 > 1 + 2");
    validateExpr("=(1+2)*3",
                 "<EBinaryOp>{<EParen>{(<EBinaryOp>{<ELiteralValue>{1} + <ELiteralValue>{2}})} * <ELiteralValue>{3}}",
                 "(1 + 2) * 3");

    assertEquals(7d, eval("=1+2*3"));
    assertEquals(9d, eval("=(1+2)*3"));
    assertEquals(-4d, eval("=1-2-3"));
    assertEquals(512d, eval("=2^3^2"));
    assertEquals(-4d, eval("=-2^2"));
    assertEquals(0.5d, eval("=2^-1"));
    assertEquals("a3", eval("=\"a\"&1+2"));
    assertEquals(Boolean.TRUE, eval("=1+1=2"));
    assertEquals(Boolean.FALSE, eval("=1<2=FALSE"));
  }

  @Test
  public void testLiterals() throws Exception
  {
    assertEquals(1.5d, eval("1.5"));
    assertEquals(1500d, eval("=1.5e3"));
    assertEquals("say \"hi\"", eval("=\"say \"\"hi\"\"\""));
    assertEquals(Boolean.TRUE, eval("=true"));
    assertEquals(ErrorKind.NA, eval("=#N/A"));
    assertEquals(ErrorKind.DIV_ZERO, eval("=#DIV/0!"));
    assertEquals(1d, eval("=IFERROR(#N/A, 1)"));

    assertArrayEquals(rows(row(1d, 2d), row(3d, 4d)),
                      evalArray("={1,2;3,4}"));
    assertArrayEquals(rows(row("a", Boolean.TRUE, -1d)),
                      evalArray("={\"a\",TRUE,-1}"));
  }

  @Test
  public void testParseErrors() throws Exception
  {
    assertParseError(ErrorKind.VALUE, "");
    assertParseError(ErrorKind.VALUE, "=");
    assertParseError(ErrorKind.VALUE, "=(1+2");
    assertParseError(ErrorKind.VALUE, "=SUM(1,2");
    assertParseError(ErrorKind.VALUE, "=1+");
    assertParseError(ErrorKind.VALUE, "=1 2");
    assertParseError(ErrorKind.VALUE, "=\"abc");
    assertParseError(ErrorKind.VALUE, "={1,2;3}");
    assertParseError(ErrorKind.VALUE, "={1,2");
    assertParseError(ErrorKind.VALUE, "=*2");
    assertParseError(ErrorKind.NAME, "=1+@");
    assertParseError(ErrorKind.NAME, "=#BOGUS!");

    try {
      FormulaParser.parseFormula("=(1", DefaultFunctions.LOOKUP);
      fail("ParseException should have been thrown");
    } catch(ParseException expected) {
      assertEquals(ErrorKind.VALUE, expected.getErrorKind());
    }
  }

  @Test
  public void testNestingLimits() throws Exception
  {
    // far too deep to parse by plain recursion
    CompiledFormula formula = ENGINE.compile("=" + wrap("(", "1", ")", 20000));
    assertEquals(ErrorKind.VALUE, formula.getParseError());
    assertEquals(ErrorKind.VALUE, toJava(evalValue(formula, null)));

    assertParseError(ErrorKind.VALUE, "=" + wrap("-", "1", "", 20000));
    assertParseError(ErrorKind.VALUE, "=" + wrap("ABS(", "1", ")", 5000));
    assertParseError(ErrorKind.VALUE, "=" + wrap("{", "1", "}", 20000));
    assertParseError(ErrorKind.VALUE, "=2" + StringUtils.repeat("^2", 20000));
    assertParseError(ErrorKind.VALUE, "=1" + StringUtils.repeat("+1", 20000));

    // up to the limits formulas parse and evaluate normally
    int depth = FormulaParser.MAX_NESTING_DEPTH - 1;
    assertEquals(1d, eval("=" + wrap("(", "1", ")", depth)));
    assertEquals(-1d, eval("=" + wrap("-", "1", "", depth)));
    assertEquals(5d, eval("=" + wrap("ABS(", "-5", ")", 100)));
    assertEquals(1d, eval("=1" + StringUtils.repeat("^1", 200)));

    int terms = FormulaParser.MAX_EXPRESSION_HEIGHT - 1;
    assertEquals((double)terms,
                 eval("=1" + StringUtils.repeat("+1", terms - 1)));
  }

  @Test
  public void testNames() throws Exception
  {
    // unknown names are only an error when evaluated
    CompiledFormula formula = ENGINE.compile("=foo+1");
    assertNull(formula.getParseError());
    assertEquals(ErrorKind.NAME, toJava(evalValue(formula, null)));
    assertEquals(ErrorKind.NAME, eval("=UNKNOWNFUNC(1)"));

    assertTrue(FormulaParser.isIdentifier("x"));
    assertTrue(FormulaParser.isIdentifier("_total.2"));
    assertFalse(FormulaParser.isIdentifier("TRUE"));
    assertFalse(FormulaParser.isIdentifier("1x"));
    assertFalse(FormulaParser.isIdentifier("a-b"));
  }

  @Test
  public void testFunctionNamesCaseInsensitive() throws Exception
  {
    assertEquals(6d, eval("=sum(1,2,3)"));
    assertEquals(6d, eval("=Sum(1,2,3)"));
    assertEquals("SUM(1,2,3)", ENGINE.compile("=sum(1, 2, 3)").toCleanString());
  }

  @Test
  public void testReferences() throws Exception
  {
    TestSheet sheet = new TestSheet()
      .set("A1", 1).set("A2", 2).set("A3", 3).set("B1", "x");

    assertEquals(1d, eval("=A1", sheet));
    assertEquals(6d, eval("=SUM(A1:A3)", sheet));
    assertEquals(6d, eval("=SUM($A$1:A$3)", sheet));
    assertEquals(6d, eval("=SUM(A3:A1)", sheet));
    assertArrayEquals(rows(row(1d), row(2d), row(3d)),
                      evalArray("=A1:A3", sheet));
    assertNull(eval("=C5", sheet));
    assertEquals(0d, eval("=C5+0", sheet));

    // union of areas
    assertEquals(7d, eval("=SUM((A1:A2,A3,B1,1))", sheet));

    CompiledFormula formula = ENGINE.compile("=SUM($A1:B$2)+C3");
    List<Reference> refs = formula.getReferences();
    assertEquals(3, refs.size());
    assertTrue(refs.get(0).isColumnAbsolute());
    assertFalse(refs.get(0).isRowAbsolute());
    assertFalse(refs.get(1).isColumnAbsolute());
    assertTrue(refs.get(1).isRowAbsolute());
    assertEquals("C3", refs.get(2).toString());
    assertEquals("SUM($A1:B$2) + C3", formula.toCleanString());

    sheet.setBounds(10, 5);
    assertEquals(ErrorKind.REF, eval("=A11", sheet));
    assertEquals(ErrorKind.REF, eval("=F1", sheet));
    assertEquals(ErrorKind.REF, eval("=SUM(A1:A11)", sheet));
  }

  @Test
  public void testSheetReferences() throws Exception
  {
    TestSheet other = new TestSheet().set("A1", 5).set("A2", 6);
    TestSheet sheet = new TestSheet().set("A1", 1)
      .addSheet("Data", other).addSheet("My Sheet", other);

    assertEquals(5d, eval("=Data!A1", sheet));
    assertEquals(11d, eval("=SUM('My Sheet'!A1:A2)", sheet));
    assertEquals(6d, eval("=A1+Data!A1", sheet));

    CompiledFormula formula = ENGINE.compile("='My Sheet'!$A$1");
    Reference ref = formula.getReferences().get(0);
    assertEquals("My Sheet", ref.getSheetName());
    assertEquals("'My Sheet'!$A$1", formula.toCleanString());
  }

  @Test
  public void testArrayBroadcast() throws Exception
  {
    assertArrayEquals(rows(row(2d, 4d, 6d)), evalArray("={1,2,3}*2"));
    assertArrayEquals(rows(row(11d, 22d), row(13d, 24d)),
                      evalArray("={1,2;3,4}+{10,20}"));
    assertArrayEquals(rows(row(2d, 4d, ErrorKind.NA)),
                      evalArray("={1,2,3}+{1,2}"));
    assertArrayEquals(rows(row(1d, ErrorKind.DIV_ZERO)),
                      evalArray("=1/{1,0}"));
    assertArrayEquals(rows(row(Boolean.TRUE, Boolean.FALSE)),
                      evalArray("={1,5}<3"));
  }

  @Test
  public void testConstantFormulas() throws Exception
  {
    CompiledFormula formula = ENGINE.compile("=1+2");
    assertTrue(formula.isConstant());
    assertEquals("=1+2", formula.toRawString());
    assertEquals(3d, toJava(evalValue(formula, null)));
    assertFalse(ENGINE.compile("=A1+2").isConstant());
    assertFalse(ENGINE.compile("=LAMBDA(x,x)(1)").isConstant());
  }

  @Test
  public void testLambdaAndLet() throws Exception
  {
    assertEquals(3d, eval("=LAMBDA(x, x+1)(2)"));
    assertEquals(10d, eval("=LAMBDA(a, b, a*b)(2, 5)"));
    assertEquals(ErrorKind.VALUE, eval("=LAMBDA(x, x+1)(1, 2)"));
    assertEquals(ErrorKind.VALUE, eval("=LAMBDA(x, x, x+1)(1, 2)"));
    assertEquals(ErrorKind.VALUE, eval("=LAMBDA(1, 2)(1)"));
    assertEquals(ErrorKind.VALUE, eval("=(1+2)(3)"));

    assertEquals(15d, eval("=LET(x, 5, y, x*2, x+y)"));
    assertEquals(ErrorKind.VALUE, eval("=LET(x, 5)"));
    assertEquals(ErrorKind.VALUE, eval("=LET(1, 5, 2)"));

    // closures capture the variables visible at definition
    assertEquals(15d, eval("=LET(n, 10, add, LAMBDA(x, x+n), add(5))"));
    assertEquals(12d, eval("=LET(mk, LAMBDA(n, LAMBDA(x, x+n)), mk(2)(10))"));
    assertEquals(ErrorKind.NAME,
                 eval("=LET(f, LAMBDA(x, x+y), y, 1, f(1))"));

    FormulaValue lambda = evalValue(ENGINE.compile("=LAMBDA(x, x*2)"), null);
    assertEquals(FormulaValue.Type.LAMBDA, lambda.getType());
    assertEquals("LAMBDA(x,x * 2)", lambda.toString());
  }

  @Test
  public void testErrorPropagation() throws Exception
  {
    assertEquals(ErrorKind.DIV_ZERO, eval("=1/0"));
    assertEquals(ErrorKind.DIV_ZERO, eval("=(1/0)+#N/A"));
    assertEquals(ErrorKind.NA, eval("=#N/A+(1/0)"));
    assertEquals(ErrorKind.VALUE, eval("=\"abc\"+1"));
    assertEquals(ErrorKind.NUM, eval("=0^0"));
    assertEquals(ErrorKind.DIV_ZERO, eval("=0^-1"));
    assertEquals(ErrorKind.VALUE, eval("=SUM(1,2"));
    assertEquals(ErrorKind.VALUE, eval("=ABS(1,2)"));
  }

  static Object eval(String formula) {
    return eval(formula, null);
  }

  static Object eval(String formula, CellAccessor sheet) {
    return toJava(evalValue(ENGINE.compile(formula), sheet));
  }

  static Object[][] evalArray(String formula) {
    return evalArray(formula, null);
  }

  static Object[][] evalArray(String formula, CellAccessor sheet) {
    Object result = eval(formula, sheet);
    assertTrue(result instanceof Object[][], "Expected array, got " + result);
    return (Object[][])result;
  }

  static FormulaValue evalValue(CompiledFormula formula, CellAccessor sheet) {
    FormulaContext ctx = ENGINE.newContext().setCellAccessor(sheet)
      .toContext();
    return ENGINE.evaluate(formula, ctx);
  }

  /**
   * Converts a result value to a plain java value for comparison: Double,
   * String, Boolean, ErrorKind, null for empty, Object[][] for arrays.
   */
  static Object toJava(FormulaValue val) {
    val = BaseDelayedValue.resolve(val);
    if(val.isArray()) {
      Object[][] result = new Object[val.getRowCount()][val.getColumnCount()];
      for(int i = 0; i < result.length; ++i) {
        for(int j = 0; j < result[i].length; ++j) {
          result[i][j] = toJava(val.getElement(i, j));
        }
      }
      return result;
    }
    return val.get();
  }

  static Object[][] rows(Object[]... rows) {
    return rows;
  }

  static Object[] row(Object... vals) {
    return vals;
  }

  private static String wrap(String open, String inner, String close,
                             int count) {
    return StringUtils.repeat(open, count) + inner +
      StringUtils.repeat(close, count);
  }

  private static void assertParseError(ErrorKind kind, String formulaStr) {
    CompiledFormula formula = FormulaParser.parse(formulaStr,
                                                  DefaultFunctions.LOOKUP);
    assertEquals(kind, formula.getParseError(), formulaStr);
    assertEquals(kind, toJava(evalValue(formula, null)), formulaStr);
    assertEquals(kind.getLiteral(), formula.toCleanString());
  }

  private static void validateExpr(String formulaStr, String debugStr,
                                   String cleanStr) {
    CompiledFormula formula = ENGINE.compile(formulaStr);
    assertEquals(debugStr, formula.toDebugString());
    assertEquals(cleanStr, formula.toCleanString());
    assertEquals(formulaStr, formula.toRawString());
  }
}
