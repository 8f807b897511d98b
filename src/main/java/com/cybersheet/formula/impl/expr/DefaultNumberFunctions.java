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
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.cybersheet.formula.expr.ErrorKind;
import com.cybersheet.formula.expr.EvalException;
import com.cybersheet.formula.expr.FormulaContext;
import com.cybersheet.formula.expr.FormulaValue;
import com.cybersheet.formula.expr.Function;
import static com.cybersheet.formula.impl.expr.DefaultFunctions.*;
import static com.cybersheet.formula.impl.expr.FunctionSupport.*;

/**
 * Math and aggregate functions.
 * <p>
 * The aggregates read numbers the same way: within an array (or range)
 * only number cells count, text, boolean, empty and error cells are
 * skipped.  A value passed directly as a parameter counts if it is a
 * number, numeric text or a boolean, and an error passed directly is the
 * result.
 */
public class DefaultNumberFunctions
{
  private DefaultNumberFunctions() {}

  static void init() {
    // dummy method to ensure this class is loaded
  }

  public static final Function SUM = registerFunc(new FuncVar("SUM") {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      double sum = 0.0d;
      for(double d : collectNumbers(params)) {
        sum += d;
      }
      return ValueSupport.toValue(sum);
    }
  });

  public static final Function AVERAGE = registerFunc(new FuncVar("AVERAGE") {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      return average(collectNumbers(params));
    }
  });

  public static final Function COUNT = registerFunc(new FuncVar("COUNT") {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      int count = 0;
      for(FormulaValue param : params) {
        if(param.isArray()) {
          for(FormulaValue val : ValueSupport.flatten(param)) {
            if(val.getType() == FormulaValue.Type.NUMBER) {
              ++count;
            }
          }
        } else if(ValueSupport.isNumeric(param) ||
                  (param.getType() == FormulaValue.Type.BOOLEAN)) {
          ++count;
        }
      }
      return ValueSupport.toValue(count);
    }
  });

  public static final Function COUNTA = registerFunc(new FuncVar("COUNTA") {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      int count = 0;
      for(FormulaValue val : flattenParams(params)) {
        if(!val.isEmpty()) {
          ++count;
        }
      }
      return ValueSupport.toValue(count);
    }
  });

  public static final Function COUNTBLANK = registerFunc(new Func1("COUNTBLANK", Function.ArrayPolicy.AGGREGATE) {
    @Override
    protected FormulaValue eval1(FormulaContext ctx, FormulaValue param1) {
      int count = 0;
      for(FormulaValue val : ValueSupport.flatten(param1)) {
        if(val.isEmpty() || ((val.getType() == FormulaValue.Type.TEXT) &&
                             (val.getAsString().length() == 0))) {
          ++count;
        }
      }
      return ValueSupport.toValue(count);
    }
  });

  public static final Function MIN = registerFunc(new FuncVar("MIN") {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      List<Double> nums = collectNumbers(params);
      if(nums.isEmpty()) {
        return ValueSupport.ZERO_VAL;
      }
      double min = Double.POSITIVE_INFINITY;
      for(double d : nums) {
        min = Math.min(min, d);
      }
      return ValueSupport.toValue(min);
    }
  });

  public static final Function MAX = registerFunc(new FuncVar("MAX") {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      List<Double> nums = collectNumbers(params);
      if(nums.isEmpty()) {
        return ValueSupport.ZERO_VAL;
      }
      double max = Double.NEGATIVE_INFINITY;
      for(double d : nums) {
        max = Math.max(max, d);
      }
      return ValueSupport.toValue(max);
    }
  });

  public static final Function PRODUCT = registerFunc(new FuncVar("PRODUCT") {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      List<Double> nums = collectNumbers(params);
      if(nums.isEmpty()) {
        return ValueSupport.ZERO_VAL;
      }
      double product = 1.0d;
      for(double d : nums) {
        product *= d;
      }
      return ValueSupport.toValue(product);
    }
  });

  public static final Function ABS = registerFunc(new Func1("ABS", Function.ArrayPolicy.ELEMENTWISE) {
    @Override
    protected FormulaValue eval1(FormulaContext ctx, FormulaValue param1) {
      return ValueSupport.toValue(Math.abs(param1.getAsDouble()));
    }
  });

  public static final Function INT = registerFunc(new Func1("INT", Function.ArrayPolicy.ELEMENTWISE) {
    @Override
    protected FormulaValue eval1(FormulaContext ctx, FormulaValue param1) {
      return ValueSupport.toValue(Math.floor(param1.getAsDouble()));
    }
  });

  public static final Function SIGN = registerFunc(new Func1("SIGN", Function.ArrayPolicy.ELEMENTWISE) {
    @Override
    protected FormulaValue eval1(FormulaContext ctx, FormulaValue param1) {
      return ValueSupport.toValue(Math.signum(param1.getAsDouble()));
    }
  });

  public static final Function SQRT = registerFunc(new Func1("SQRT", Function.ArrayPolicy.ELEMENTWISE) {
    @Override
    protected FormulaValue eval1(FormulaContext ctx, FormulaValue param1) {
      double dv = param1.getAsDouble();
      if(dv < 0.0d) {
        throw new EvalException(ErrorKind.NUM, "Invalid value '" + dv + "'");
      }
      return ValueSupport.toValue(Math.sqrt(dv));
    }
  });

  public static final Function ROUND = registerFunc(new Func2("ROUND", Function.ArrayPolicy.ELEMENTWISE) {
    @Override
    protected FormulaValue eval2(FormulaContext ctx, FormulaValue param1,
                                 FormulaValue param2) {
      double dv = param1.getAsDouble();
      int scale = getAsInt(param2);
      // half away from zero on the decimal representation
      BigDecimal bd = BigDecimal.valueOf(dv).setScale(scale,
                                                      RoundingMode.HALF_UP);
      return ValueSupport.toValue(bd.doubleValue());
    }
  });

  public static final Function MOD = registerFunc(new Func2("MOD", Function.ArrayPolicy.ELEMENTWISE) {
    @Override
    protected FormulaValue eval2(FormulaContext ctx, FormulaValue param1,
                                 FormulaValue param2) {
      double num = param1.getAsDouble();
      double div = param2.getAsDouble();
      if(div == 0.0d) {
        throw new EvalException(ErrorKind.DIV_ZERO, "Modulo by zero");
      }
      // result has the sign of the divisor
      return ValueSupport.toValue(num - (div * Math.floor(num / div)));
    }
  });

  public static final Function POWER = registerFunc(new Func2("POWER", Function.ArrayPolicy.ELEMENTWISE) {
    @Override
    protected FormulaValue eval2(FormulaContext ctx, FormulaValue param1,
                                 FormulaValue param2) {
      return BuiltinOperators.exp(param1, param2);
    }
  });

  public static final Function SUMIF = registerFunc(new FuncVar("SUMIF", 2, 3, Function.ArrayPolicy.AGGREGATE) {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      double sum = 0.0d;
      for(double d : collectMatching(params)) {
        sum += d;
      }
      return ValueSupport.toValue(sum);
    }
  });

  public static final Function AVERAGEIF = registerFunc(new FuncVar("AVERAGEIF", 2, 3, Function.ArrayPolicy.AGGREGATE) {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      return average(collectMatching(params));
    }
  });

  public static final Function COUNTIF = registerFunc(new Func2("COUNTIF", Function.ArrayPolicy.AGGREGATE) {
    @Override
    protected FormulaValue eval2(FormulaContext ctx, FormulaValue param1,
                                 FormulaValue param2) {
      CriteriaMatcher.Criterion crit = CriteriaMatcher.compile(
          ValueSupport.unwrapSingle(param2));
      int count = 0;
      for(FormulaValue val : ValueSupport.flatten(param1)) {
        if(crit.matches(val)) {
          ++count;
        }
      }
      return ValueSupport.toValue(count);
    }
  });


  public static final Function COUNTIFS = registerFunc(new FuncVar("COUNTIFS", 2, Integer.MAX_VALUE, Function.ArrayPolicy.AGGREGATE) {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      int count = 0;
      for(boolean matched : matchAllCriteria(params[0], params, 0)) {
        if(matched) {
          ++count;
        }
      }
      return ValueSupport.toValue(count);
    }
  });

  public static final Function SUMIFS = registerFunc(new FuncVar("SUMIFS", 3, Integer.MAX_VALUE, Function.ArrayPolicy.AGGREGATE) {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      double sum = 0.0d;
      for(double d : collectMatchingAll(params)) {
        sum += d;
      }
      return ValueSupport.toValue(sum);
    }
  });

  public static final Function AVERAGEIFS = registerFunc(new FuncVar("AVERAGEIFS", 3, Integer.MAX_VALUE, Function.ArrayPolicy.AGGREGATE) {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      return average(collectMatchingAll(params));
    }
  });

  public static final Function MAXIFS = registerFunc(new FuncVar("MAXIFS", 3, Integer.MAX_VALUE, Function.ArrayPolicy.AGGREGATE) {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      List<Double> nums = collectMatchingAll(params);
      // no match is 0, not an error
      return ValueSupport.toValue((double)(nums.isEmpty() ? 0.0d :
                                  Collections.max(nums)));
    }
  });

  public static final Function MINIFS = registerFunc(new FuncVar("MINIFS", 3, Integer.MAX_VALUE, Function.ArrayPolicy.AGGREGATE) {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      List<Double> nums = collectMatchingAll(params);
      return ValueSupport.toValue((double)(nums.isEmpty() ? 0.0d :
                                  Collections.min(nums)));
    }
  });

  private static FormulaValue average(List<Double> nums) {
    if(nums.isEmpty()) {
      throw new EvalException(ErrorKind.DIV_ZERO, "No values to average");
    }
    double sum = 0.0d;
    for(double d : nums) {
      sum += d;
    }
    return ValueSupport.toValue(sum / nums.size());
  }

  /**
   * @return the numbers in the given aggregate function params
   */
  static List<Double> collectNumbers(FormulaValue[] params) {
    List<Double> nums = new ArrayList<Double>();
    for(FormulaValue param : params) {
      if(param.isArray()) {
        for(FormulaValue val : ValueSupport.flatten(param)) {
          if(val.getType() == FormulaValue.Type.NUMBER) {
            nums.add(val.getAsDouble());
          }
        }
      } else if(!param.isEmpty()) {
        nums.add(ValueSupport.checkError(param).getAsDouble());
      }
    }
    return nums;
  }

  /**
   * Common handling for SUMIF/AVERAGEIF: the numbers of the (optional)
   * value range at the positions where the test range matches the criteria.
   */
  private static List<Double> collectMatching(FormulaValue[] params) {
    FormulaValue range = params[0];
    FormulaValue valRange = ((params.length > 2) ? params[2] : range);
    CriteriaMatcher.Criterion crit = CriteriaMatcher.compile(
        ValueSupport.unwrapSingle(params[1]));

    List<Double> nums = new ArrayList<Double>();
    for(int i = 0; i < range.getRowCount(); ++i) {
      for(int j = 0; j < range.getColumnCount(); ++j) {
        if(!crit.matches(range.getElement(i, j))) {
          continue;
        }
        FormulaValue val = valRange.getElement(i, j);
        if(val.getType() == FormulaValue.Type.NUMBER) {
          nums.add(val.getAsDouble());
        }
      }
    }
    return nums;
  }

  /**
   * Common handling for SUMIFS/AVERAGEIFS/MAXIFS/MINIFS: the numbers of the
   * first param at the positions where every criteria range matches.
   */
  private static List<Double> collectMatchingAll(FormulaValue[] params) {
    FormulaValue valRange = params[0];
    boolean[] matched = matchAllCriteria(valRange, params, 1);
    int numCols = valRange.getColumnCount();

    List<Double> nums = new ArrayList<Double>();
    for(int idx = 0; idx < matched.length; ++idx) {
      if(!matched[idx]) {
        continue;
      }
      FormulaValue val = valRange.getElement(idx / numCols, idx % numCols);
      if(val.getType() == FormulaValue.Type.NUMBER) {
        nums.add(val.getAsDouble());
      }
    }
    return nums;
  }

  /**
   * Applies the (criteria range, criterion) pairs starting at
   * {@code firstPair}.  Every criteria range must have the shape of the given
   * range.
   *
   * @return for each position of the range in row order, whether all
   *         criteria match
   */
  private static boolean[] matchAllCriteria(
      FormulaValue shape, FormulaValue[] params, int firstPair) {
    if(((params.length - firstPair) % 2) != 0) {
      throw new EvalException(ErrorKind.VALUE,
                              "Criteria ranges and criteria must be paired");
    }
    int numRows = shape.getRowCount();
    int numCols = shape.getColumnCount();
    ValueSupport.checkError(shape);

    boolean[] matched = new boolean[numRows * numCols];
    Arrays.fill(matched, true);
    for(int p = firstPair; p < params.length; p += 2) {
      FormulaValue range = ValueSupport.checkError(params[p]);
      if((range.getRowCount() != numRows) ||
         (range.getColumnCount() != numCols)) {
        throw new EvalException(ErrorKind.VALUE, "Criteria range is " +
                                range.getRowCount() + "x" +
                                range.getColumnCount() + ", expected " +
                                numRows + "x" + numCols);
      }
      CriteriaMatcher.Criterion crit = CriteriaMatcher.compile(
          ValueSupport.checkError(ValueSupport.unwrapSingle(params[p + 1])));
      for(int idx = 0; idx < matched.length; ++idx) {
        if(matched[idx] &&
           !crit.matches(range.getElement(idx / numCols, idx % numCols))) {
          matched[idx] = false;
        }
      }
    }
    return matched;
  }
}
