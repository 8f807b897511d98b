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

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import com.cybersheet.formula.expr.ErrorKind;
import com.cybersheet.formula.expr.EvalException;
import com.cybersheet.formula.expr.FormulaValue;

/**
 * Factory methods and shared constants for values, along with the number
 * parsing and display formatting used by the value conversions.
 */
public class ValueSupport
{
  public static final FormulaValue EMPTY_VAL = new BaseValue() {
    @Override
    public Type getType() {
      return Type.EMPTY;
    }
    @Override
    public Object get() {
      return null;
    }
    @Override
    public boolean getAsBoolean() {
      return false;
    }
    @Override
    public String getAsString() {
      return "";
    }
    @Override
    public double getAsDouble() {
      return 0.0d;
    }
  };
  public static final FormulaValue TRUE_VAL = new BooleanValue(true);
  public static final FormulaValue FALSE_VAL = new BooleanValue(false);
  public static final FormulaValue EMPTY_STR_VAL = new StringValue("");
  public static final FormulaValue ZERO_VAL = new NumberValue(0d);
  public static final FormulaValue ONE_VAL = new NumberValue(1d);

  private static final Map<ErrorKind,FormulaValue> ERROR_VALS =
    new EnumMap<ErrorKind,FormulaValue>(ErrorKind.class);
  static {
    for(ErrorKind kind : ErrorKind.values()) {
      ERROR_VALS.put(kind, new ErrorValue(kind));
    }
  }

  public static final FormulaValue NA_VAL = toError(ErrorKind.NA);
  public static final FormulaValue VALUE_ERR_VAL = toError(ErrorKind.VALUE);
  public static final FormulaValue NUM_ERR_VAL = toError(ErrorKind.NUM);
  public static final FormulaValue DIV_ZERO_VAL = toError(ErrorKind.DIV_ZERO);

  static final Pattern NUMBER_PAT =
    Pattern.compile("[+-]?(([0-9]+[.]?[0-9]*)|([.][0-9]+))([eE][+-]?[0-9]+)?");
  private static final MathContext DISPLAY_PRECISION = new MathContext(15);
  private static final double MAX_PLAIN_LONG = 1e15;

  private ValueSupport() {}

  public static FormulaValue toValue(boolean b) {
    return (b ? TRUE_VAL : FALSE_VAL);
  }

  public static FormulaValue toValue(String s) {
    return ((s.length() == 0) ? EMPTY_STR_VAL : new StringValue(s));
  }

  public static FormulaValue toValue(int i) {
    return new NumberValue(i);
  }

  /**
   * @return a number value for the given double, or a {@code #NUM!} error
   *         for NaN and infinite results
   */
  public static FormulaValue toValue(double d) {
    if(Double.isNaN(d) || Double.isInfinite(d)) {
      return NUM_ERR_VAL;
    }
    return new NumberValue(d);
  }

  /**
   * Converts a plain java value (as supplied by callers outside of the
   * engine) into a FormulaValue.
   */
  public static FormulaValue toValue(Object obj) {
    if(obj == null) {
      return EMPTY_VAL;
    }
    if(obj instanceof FormulaValue) {
      return (FormulaValue)obj;
    }
    if(obj instanceof Boolean) {
      return toValue(((Boolean)obj).booleanValue());
    }
    if(obj instanceof Number) {
      return toValue(((Number)obj).doubleValue());
    }
    if(obj instanceof ErrorKind) {
      return toError((ErrorKind)obj);
    }
    if(obj instanceof Object[][]) {
      Object[][] objRows = (Object[][])obj;
      FormulaValue[][] rows = new FormulaValue[objRows.length][];
      for(int i = 0; i < objRows.length; ++i) {
        rows[i] = new FormulaValue[objRows[i].length];
        for(int j = 0; j < objRows[i].length; ++j) {
          rows[i][j] = toValue(objRows[i][j]);
        }
      }
      return toArray(rows);
    }
    return toValue(obj.toString());
  }

  public static FormulaValue toError(ErrorKind kind) {
    return ERROR_VALS.get(kind);
  }

  /**
   * @return a value for a cell, treating a missing cell as empty
   */
  public static FormulaValue toCellValue(FormulaValue val) {
    return ((val != null) ? val : EMPTY_VAL);
  }

  public static ArrayValue toArray(FormulaValue[][] rows) {
    return new ArrayValue(rows, false);
  }

  public static ArrayValue toArray1D(List<FormulaValue> vals) {
    return new ArrayValue(
        new FormulaValue[][]{vals.toArray(new FormulaValue[0])}, true);
  }

  /**
   * @return a rows x cols 2D array built from the given row-major values
   */
  public static ArrayValue toArray(int rows, int cols, List<FormulaValue> vals)
  {
    FormulaValue[][] result = new FormulaValue[rows][cols];
    int idx = 0;
    for(int i = 0; i < rows; ++i) {
      for(int j = 0; j < cols; ++j) {
        result[i][j] = ((idx < vals.size()) ? vals.get(idx) : NA_VAL);
        ++idx;
      }
    }
    return toArray(result);
  }

  /**
   * @return all the scalar elements of the given value in row-major order,
   *         nested arrays are flattened
   */
  public static List<FormulaValue> flatten(FormulaValue val) {
    List<FormulaValue> vals = new ArrayList<FormulaValue>();
    flatten(val, vals);
    return vals;
  }

  private static void flatten(FormulaValue val, List<FormulaValue> vals) {
    if(!val.isArray()) {
      vals.add(val);
      return;
    }
    for(int i = 0; i < val.getRowCount(); ++i) {
      for(int j = 0; j < val.getColumnCount(); ++j) {
        flatten(val.getElement(i, j), vals);
      }
    }
  }

  /**
   * Reduces a 1x1 array to its only element.
   */
  public static FormulaValue unwrapSingle(FormulaValue val) {
    while(val.isArray() && (val.getRowCount() == 1) &&
          (val.getColumnCount() == 1)) {
      val = val.getElement(0, 0);
    }
    return val;
  }

  /**
   * Throws the error of the given value if it is an error value.
   */
  public static FormulaValue checkError(FormulaValue val) {
    if(val.isError()) {
      throw new EvalException(val.getErrorKind(), "Error value " + val.get());
    }
    return val;
  }

  /**
   * @return the numeric interpretation of the given text: the empty string is
   *         0, otherwise the trimmed text must be a plain number, or
   *         {@code null}
   */
  public static Double parseNumber(String str) {
    String trimmed = str.trim();
    if(trimmed.length() == 0) {
      return 0.0d;
    }
    if(!NUMBER_PAT.matcher(trimmed).matches()) {
      return null;
    }
    double d = Double.parseDouble(trimmed);
    return (Double.isInfinite(d) ? null : d);
  }

  /**
   * @return the given number as display text with at most 15 significant
   *         digits and no trailing zeros
   */
  public static String formatNumber(double d) {
    if((d == Math.rint(d)) && (Math.abs(d) < MAX_PLAIN_LONG)) {
      return Long.toString((long)d);
    }
    BigDecimal bd = new BigDecimal(d).round(DISPLAY_PRECISION)
      .stripTrailingZeros();
    return bd.toPlainString();
  }

  /**
   * @return {@code true} if the given value is a number or text which can
   *         be read as a number (excluding the empty string)
   */
  public static boolean isNumeric(FormulaValue val) {
    switch(val.getType()) {
    case NUMBER:
      return true;
    case TEXT:
      String str = val.getAsString();
      return ((str.trim().length() > 0) && (parseNumber(str) != null));
    default:
      return false;
    }
  }

  /**
   * @return the integral value of the given number, {@code null} if it has a
   *         fractional part
   */
  static Long toIntegral(double d) {
    if((d != Math.rint(d)) || Double.isInfinite(d)) {
      return null;
    }
    return (long)d;
  }
}
