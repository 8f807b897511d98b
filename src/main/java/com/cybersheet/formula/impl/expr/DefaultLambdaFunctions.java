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
import java.util.List;

import com.cybersheet.formula.expr.EvalConfig;
import com.cybersheet.formula.expr.EvalException;
import com.cybersheet.formula.expr.FormulaContext;
import com.cybersheet.formula.expr.FormulaValue;
import com.cybersheet.formula.expr.Function;
import com.cybersheet.formula.expr.LambdaFunction;
import static com.cybersheet.formula.impl.expr.DefaultFunctions.*;
import static com.cybersheet.formula.impl.expr.FunctionSupport.*;

/**
 * Functions which apply a LAMBDA to generated or given values.  The first
 * error produced by the lambda is the result of the whole call.
 */
public class DefaultLambdaFunctions
{
  private DefaultLambdaFunctions() {}

  static void init() {
    // dummy method to ensure this class is loaded
  }

  public static final Function MAKEARRAY = registerFunc(new Func3("MAKEARRAY", Function.ArrayPolicy.AGGREGATE) {
    @Override
    protected FormulaValue eval3(FormulaContext ctx, FormulaValue param1,
                                 FormulaValue param2, FormulaValue param3) {
      EvalConfig cfg = ctx.getEvalConfig();
      int numRows = getDimension(param1, cfg);
      int numCols = getDimension(param2, cfg);
      if(((long)numRows * numCols) > cfg.getMaxArrayCells()) {
        throw new EvalException("Array too large " + numRows + "x" + numCols);
      }
      LambdaFunction lambda = getAsLambda(param3);

      FormulaValue[][] result = new FormulaValue[numRows][numCols];
      for(int i = 0; i < numRows; ++i) {
        for(int j = 0; j < numCols; ++j) {
          result[i][j] = invokeScalar(
              ctx, lambda, ValueSupport.toValue(i + 1),
              ValueSupport.toValue(j + 1));
          if(result[i][j].isError()) {
            return result[i][j];
          }
        }
      }
      return ValueSupport.toArray(result);
    }
  });

  public static final Function MAP = registerFunc(new FuncVar("MAP", 2, Integer.MAX_VALUE, Function.ArrayPolicy.AGGREGATE) {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      LambdaFunction lambda = getAsLambda(params[params.length - 1]);
      FormulaValue first = ValueSupport.checkError(params[0]);
      int numRows = first.getRowCount();
      int numCols = first.getColumnCount();
      for(int k = 1; k < (params.length - 1); ++k) {
        FormulaValue other = ValueSupport.checkError(params[k]);
        if((other.getRowCount() != numRows) ||
           (other.getColumnCount() != numCols)) {
          throw new EvalException("Array shapes differ");
        }
      }

      FormulaValue[][] result = new FormulaValue[numRows][numCols];
      FormulaValue[] args = new FormulaValue[params.length - 1];
      for(int i = 0; i < numRows; ++i) {
        for(int j = 0; j < numCols; ++j) {
          for(int k = 0; k < args.length; ++k) {
            args[k] = params[k].getElement(i, j);
          }
          result[i][j] = invokeScalar(ctx, lambda, args.clone());
          if(result[i][j].isError()) {
            return result[i][j];
          }
        }
      }
      return toShape(first, result);
    }
  });

  public static final Function REDUCE = registerFunc(new Func3("REDUCE", Function.ArrayPolicy.AGGREGATE) {
    @Override
    protected FormulaValue eval3(FormulaContext ctx, FormulaValue param1,
                                 FormulaValue param2, FormulaValue param3) {
      LambdaFunction lambda = getAsLambda(param3);
      FormulaValue acc = ValueSupport.unwrapSingle(param1);
      for(FormulaValue val : ValueSupport.flatten(
              ValueSupport.checkError(param2))) {
        acc = invokeScalar(ctx, lambda, acc, val);
        if(acc.isError()) {
          return acc;
        }
      }
      return acc;
    }
  });

  public static final Function SCAN = registerFunc(new FuncVar("SCAN", 2, 3, Function.ArrayPolicy.AGGREGATE) {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      boolean seeded = (params.length == 3);
      FormulaValue array = ValueSupport.checkError(params[seeded ? 1 : 0]);
      LambdaFunction lambda = getAsLambda(params[params.length - 1]);

      List<FormulaValue> vals = ValueSupport.flatten(array);
      FormulaValue[] accs = new FormulaValue[vals.size()];
      int start = 0;
      FormulaValue acc = null;
      if(seeded) {
        acc = ValueSupport.unwrapSingle(params[0]);
      } else {
        // the first element is the initial accumulator
        acc = vals.get(0);
        accs[0] = acc;
        start = 1;
      }
      for(int i = start; i < vals.size(); ++i) {
        acc = invokeScalar(ctx, lambda, acc, vals.get(i));
        if(acc.isError()) {
          return acc;
        }
        accs[i] = acc;
      }

      FormulaValue[][] result =
        new FormulaValue[array.getRowCount()][array.getColumnCount()];
      int idx = 0;
      for(FormulaValue[] row : result) {
        for(int j = 0; j < row.length; ++j) {
          row[j] = accs[idx++];
        }
      }
      return toShape(array, result);
    }
  });

  public static final Function BYROW = registerFunc(new Func2("BYROW", Function.ArrayPolicy.AGGREGATE) {
    @Override
    protected FormulaValue eval2(FormulaContext ctx, FormulaValue param1,
                                 FormulaValue param2) {
      FormulaValue[][] rows = toRows(ValueSupport.checkError(param1));
      LambdaFunction lambda = getAsLambda(param2);

      FormulaValue[][] result = new FormulaValue[rows.length][1];
      for(int i = 0; i < rows.length; ++i) {
        result[i][0] = invokeScalar(
            ctx, lambda, ValueSupport.toArray1D(Arrays.asList(rows[i])));
        if(result[i][0].isError()) {
          return result[i][0];
        }
      }
      return ValueSupport.toArray(result);
    }
  });

  public static final Function BYCOL = registerFunc(new Func2("BYCOL", Function.ArrayPolicy.AGGREGATE) {
    @Override
    protected FormulaValue eval2(FormulaContext ctx, FormulaValue param1,
                                 FormulaValue param2) {
      FormulaValue[][] rows = toRows(ValueSupport.checkError(param1));
      LambdaFunction lambda = getAsLambda(param2);

      int numCols = rows[0].length;
      FormulaValue[][] result = new FormulaValue[1][numCols];
      for(int j = 0; j < numCols; ++j) {
        FormulaValue[][] col = new FormulaValue[rows.length][1];
        for(int i = 0; i < rows.length; ++i) {
          col[i][0] = rows[i][j];
        }
        result[0][j] = invokeScalar(ctx, lambda, ValueSupport.toArray(col));
        if(result[0][j].isError()) {
          return result[0][j];
        }
      }
      return ValueSupport.toArray(result);
    }
  });


  /**
   * @return a generated array dimension, a positive integer within the
   *         configured limit
   */
  private static int getDimension(FormulaValue param, EvalConfig cfg) {
    FormulaValue val = ValueSupport.checkError(ValueSupport.unwrapSingle(param));
    if(val.getType() != FormulaValue.Type.NUMBER) {
      throw new EvalException("Array dimension must be a number " + val);
    }
    Long dim = ValueSupport.toIntegral(val.getAsDouble());
    if((dim == null) || (dim < 1) || (dim > cfg.getMaxArrayDimension())) {
      throw new EvalException("Invalid array dimension " + val.get());
    }
    return dim.intValue();
  }

  /**
   * Invokes the given lambda for a single result value, a (non 1x1) array
   * result is {@code #VALUE!}.
   */
  private static FormulaValue invokeScalar(FormulaContext ctx,
                                           LambdaFunction lambda,
                                           FormulaValue... args) {
    FormulaValue result = ValueSupport.unwrapSingle(
        BaseDelayedValue.resolve(lambda.invoke(ctx, args)));
    if(result.isArray()) {
      return ValueSupport.VALUE_ERR_VAL;
    }
    return result;
  }

  private static FormulaValue toShape(FormulaValue source,
                                      FormulaValue[][] result) {
    if(source.getType() == FormulaValue.Type.ARRAY_1D) {
      return ValueSupport.toArray1D(Arrays.asList(result[0]));
    }
    return ValueSupport.toArray(result);
  }
}
