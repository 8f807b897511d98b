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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.cybersheet.formula.expr.ErrorKind;
import com.cybersheet.formula.expr.EvalException;
import com.cybersheet.formula.expr.FormulaContext;
import com.cybersheet.formula.expr.FormulaValue;
import com.cybersheet.formula.expr.Function;
import com.cybersheet.formula.expr.LambdaFunction;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Base classes for the built-in functions, by parameter count, and the
 * param conversion helpers they share.
 */
public class FunctionSupport
{
  private static final Log LOG = LogFactory.getLog(FunctionSupport.class);

  private FunctionSupport() {}

  /**
   * Base class for the built-in functions.  Validates the number of
   * parameters, applies the declared array policy and converts any failure
   * into an error value, so {@link #eval} never throws for user input.
   */
  public static abstract class BaseFunction implements Function
  {
    private final String _name;
    private final int _minParams;
    private final int _maxParams;
    private final ArrayPolicy _arrayPolicy;

    protected BaseFunction(String name, int minParams, int maxParams,
                           ArrayPolicy arrayPolicy)
    {
      _name = name;
      _minParams = minParams;
      _maxParams = maxParams;
      _arrayPolicy = arrayPolicy;
    }

    @Override
    public String getName() {
      return _name;
    }

    @Override
    public boolean isPure() {
      // most functions are probably pure, so make this the default
      return true;
    }

    @Override
    public boolean isLazy() {
      return false;
    }

    @Override
    public ArrayPolicy getArrayPolicy() {
      return _arrayPolicy;
    }

    @Override
    public final FormulaValue eval(final FormulaContext ctx,
                                   FormulaValue... params) {
      try {
        validateNumParams(params);
        if(isLazy()) {
          return evalImpl(ctx, params);
        }
        switch(_arrayPolicy) {
        case SCALAR:
          return evalScalar(ctx, params);
        case ELEMENTWISE:
          return BuiltinOperators.applyElementwise(
              new BuiltinOperators.ElementOp() {
                @Override
                public FormulaValue apply(FormulaValue[] elemParams) {
                  return evalImpl(ctx, elemParams.clone());
                }
              }, false, params);
        default:
          return evalImpl(ctx, params);
        }
      } catch(EvalException e) {
        return toErrorResult(e, params);
      } catch(ArithmeticException e) {
        return toErrorResult(
            new EvalException(ErrorKind.NUM, e.getMessage(), e), params);
      }
    }

    private FormulaValue evalScalar(FormulaContext ctx, FormulaValue[] params)
    {
      FormulaValue[] scalarParams = new FormulaValue[params.length];
      for(int i = 0; i < params.length; ++i) {
        FormulaValue param = ValueSupport.unwrapSingle(params[i]);
        if(param.isArray()) {
          throw new EvalException(ErrorKind.VALUE,
                                  _name + " does not accept arrays");
        }
        scalarParams[i] = param;
      }
      return evalImpl(ctx, scalarParams);
    }

    protected abstract FormulaValue evalImpl(FormulaContext ctx,
                                             FormulaValue[] params);

    protected void validateNumParams(FormulaValue[] params) {
      int num = params.length;
      if((num < _minParams) || (num > _maxParams)) {
        String range = ((_minParams == _maxParams) ? "" + _minParams :
                        _minParams + " to " + _maxParams);
        throw new EvalException(
            "Invalid number of parameters " +
            num + " passed to " + _name + ", expected " + range);
      }
    }

    private FormulaValue toErrorResult(EvalException e, FormulaValue[] params) {
      if(LOG.isDebugEnabled()) {
        LOG.debug(invalidFunctionCall(params) + " evaluated to " +
                  e.getErrorKind() + ": " + e.getMessage());
      }
      return ValueSupport.toError(e.getErrorKind());
    }

    protected String invalidFunctionCall(FormulaValue[] params) {
      String paramStr = Arrays.toString(params);
      return "Function call {" + _name + "(" +
        paramStr.substring(1, paramStr.length() - 1) + ")}";
    }

    @Override
    public String toString() {
      return getName() + "()";
    }
  }

  public static abstract class Func0 extends BaseFunction
  {
    protected Func0(String name) {
      super(name, 0, 0, ArrayPolicy.SCALAR);
    }

    @Override
    protected final FormulaValue evalImpl(FormulaContext ctx,
                                          FormulaValue[] params) {
      return eval0(ctx);
    }

    protected abstract FormulaValue eval0(FormulaContext ctx);
  }

  public static abstract class Func1 extends BaseFunction
  {
    protected Func1(String name) {
      this(name, ArrayPolicy.SCALAR);
    }

    protected Func1(String name, ArrayPolicy arrayPolicy) {
      super(name, 1, 1, arrayPolicy);
    }

    @Override
    protected final FormulaValue evalImpl(FormulaContext ctx,
                                          FormulaValue[] params) {
      return eval1(ctx, params[0]);
    }

    protected abstract FormulaValue eval1(FormulaContext ctx,
                                          FormulaValue param);
  }

  /**
   * A single param function which returns an error param unchanged.
   */
  public static abstract class Func1ErrorIsError extends Func1
  {
    protected Func1ErrorIsError(String name) {
      super(name, ArrayPolicy.ELEMENTWISE);
    }

    @Override
    protected final FormulaValue eval1(FormulaContext ctx,
                                       FormulaValue param) {
      if(param.isError()) {
        return BaseDelayedValue.resolve(param);
      }
      return evalNonError(ctx, param);
    }

    protected abstract FormulaValue evalNonError(FormulaContext ctx,
                                                 FormulaValue param);
  }

  public static abstract class Func2 extends BaseFunction
  {
    protected Func2(String name) {
      this(name, ArrayPolicy.SCALAR);
    }

    protected Func2(String name, ArrayPolicy arrayPolicy) {
      super(name, 2, 2, arrayPolicy);
    }

    @Override
    protected final FormulaValue evalImpl(FormulaContext ctx,
                                          FormulaValue[] params) {
      return eval2(ctx, params[0], params[1]);
    }

    protected abstract FormulaValue eval2(FormulaContext ctx,
                                          FormulaValue param1,
                                          FormulaValue param2);
  }

  public static abstract class Func3 extends BaseFunction
  {
    protected Func3(String name) {
      this(name, ArrayPolicy.SCALAR);
    }

    protected Func3(String name, ArrayPolicy arrayPolicy) {
      super(name, 3, 3, arrayPolicy);
    }

    @Override
    protected final FormulaValue evalImpl(FormulaContext ctx,
                                          FormulaValue[] params) {
      return eval3(ctx, params[0], params[1], params[2]);
    }

    protected abstract FormulaValue eval3(FormulaContext ctx,
                                          FormulaValue param1,
                                          FormulaValue param2,
                                          FormulaValue param3);
  }

  public static abstract class FuncVar extends BaseFunction
  {
    protected FuncVar(String name) {
      this(name, 1, Integer.MAX_VALUE, ArrayPolicy.AGGREGATE);
    }

    protected FuncVar(String name, int minParams, int maxParams) {
      this(name, minParams, maxParams, ArrayPolicy.SCALAR);
    }

    protected FuncVar(String name, int minParams, int maxParams,
                      ArrayPolicy arrayPolicy) {
      super(name, minParams, maxParams, arrayPolicy);
    }

    @Override
    protected final FormulaValue evalImpl(FormulaContext ctx,
                                          FormulaValue[] params) {
      return evalVar(ctx, params);
    }

    protected abstract FormulaValue evalVar(FormulaContext ctx,
                                            FormulaValue[] params);
  }

  /**
   * A function whose params are only evaluated on demand.  Each param is a
   * delayed value which computes itself when first accessed.
   */
  public static abstract class LazyFuncVar extends FuncVar
  {
    protected LazyFuncVar(String name, int minParams, int maxParams) {
      super(name, minParams, maxParams, ArrayPolicy.AGGREGATE);
    }

    @Override
    public boolean isLazy() {
      return true;
    }
  }

  /**
   * @return the given value as an integer, truncating any fraction
   * @throws EvalException (#VALUE!) if not numeric or outside the int range
   */
  public static int getAsInt(FormulaValue val) {
    double d = val.getAsDouble();
    if((d < Integer.MIN_VALUE) || (d > Integer.MAX_VALUE)) {
      throw new EvalException(ErrorKind.VALUE, "Number out of range " + d);
    }
    return (int)d;
  }

  /**
   * @return the given value as an integer which must not have a fraction
   * @throws EvalException with the given kind if the value is not integral
   */
  public static long getAsIntegral(FormulaValue val, ErrorKind errorKind) {
    Long l = ValueSupport.toIntegral(val.getAsDouble());
    if(l == null) {
      throw new EvalException(errorKind, "Expected integer, got " + val);
    }
    return l;
  }

  /**
   * @return the lambda in the given value
   * @throws EvalException (#VALUE!) if the value is not a lambda
   */
  public static LambdaFunction getAsLambda(FormulaValue val) {
    val = BaseDelayedValue.resolve(ValueSupport.unwrapSingle(val));
    if(val.isError()) {
      throw new EvalException(val.getErrorKind(), "Expected lambda");
    }
    if(!(val instanceof LambdaFunction)) {
      throw new EvalException(ErrorKind.VALUE, "Expected lambda, got " + val);
    }
    return (LambdaFunction)val;
  }

  /**
   * @return all the scalars in the given params, nested arrays flattened
   */
  public static List<FormulaValue> flattenParams(FormulaValue[] params) {
    List<FormulaValue> vals = new ArrayList<FormulaValue>();
    for(FormulaValue param : params) {
      vals.addAll(ValueSupport.flatten(param));
    }
    return vals;
  }

  /**
   * @return the given value as a 2D array of rows (a scalar is a 1x1 array)
   */
  public static FormulaValue[][] toRows(FormulaValue val) {
    int numRows = val.getRowCount();
    int numCols = val.getColumnCount();
    FormulaValue[][] rows = new FormulaValue[numRows][numCols];
    for(int i = 0; i < numRows; ++i) {
      for(int j = 0; j < numCols; ++j) {
        rows[i][j] = val.getElement(i, j);
      }
    }
    return rows;
  }
}
