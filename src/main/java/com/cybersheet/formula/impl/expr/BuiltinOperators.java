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
import com.cybersheet.formula.expr.EvalException;
import com.cybersheet.formula.expr.FormulaValue;
import static com.cybersheet.formula.impl.expr.ValueSupport.*;


/**
 * Implementations of the formula operators.  All operators broadcast over
 * array operands and propagate errors (the left operand's error wins).
 */
public class BuiltinOperators
{
  private static final String DIV_BY_ZERO = "/ by zero";

  /** an operation on scalar values, applied per element to arrays */
  public interface ElementOp
  {
    public FormulaValue apply(FormulaValue[] params);
  }

  private static final ElementOp NEGATE = new ElementOp() {
    @Override
    public FormulaValue apply(FormulaValue[] params) {
      return toValue(-params[0].getAsDouble());
    }
  };
  private static final ElementOp POSITIVE = new ElementOp() {
    @Override
    public FormulaValue apply(FormulaValue[] params) {
      return params[0];
    }
  };
  private static final ElementOp ADD = new ElementOp() {
    @Override
    public FormulaValue apply(FormulaValue[] params) {
      return toValue(params[0].getAsDouble() + params[1].getAsDouble());
    }
  };
  private static final ElementOp SUBTRACT = new ElementOp() {
    @Override
    public FormulaValue apply(FormulaValue[] params) {
      return toValue(params[0].getAsDouble() - params[1].getAsDouble());
    }
  };
  private static final ElementOp MULTIPLY = new ElementOp() {
    @Override
    public FormulaValue apply(FormulaValue[] params) {
      return toValue(params[0].getAsDouble() * params[1].getAsDouble());
    }
  };
  private static final ElementOp DIVIDE = new ElementOp() {
    @Override
    public FormulaValue apply(FormulaValue[] params) {
      double d1 = params[0].getAsDouble();
      double d2 = params[1].getAsDouble();
      if(d2 == 0.0d) {
        throw new EvalException(ErrorKind.DIV_ZERO, DIV_BY_ZERO);
      }
      return toValue(d1 / d2);
    }
  };
  private static final ElementOp EXP = new ElementOp() {
    @Override
    public FormulaValue apply(FormulaValue[] params) {
      double base = params[0].getAsDouble();
      double exp = params[1].getAsDouble();
      if(base == 0.0d) {
        if(exp == 0.0d) {
          return NUM_ERR_VAL;
        }
        if(exp < 0.0d) {
          return DIV_ZERO_VAL;
        }
      }
      return toValue(Math.pow(base, exp));
    }
  };
  private static final ElementOp CONCAT = new ElementOp() {
    @Override
    public FormulaValue apply(FormulaValue[] params) {
      return toValue(params[0].getAsString().concat(params[1].getAsString()));
    }
  };
  private static final ElementOp LESS_THAN = new CompareOp() {
    @Override
    protected boolean test(int cmp) {
      return (cmp < 0);
    }
  };
  private static final ElementOp GREATER_THAN = new CompareOp() {
    @Override
    protected boolean test(int cmp) {
      return (cmp > 0);
    }
  };
  private static final ElementOp LESS_THAN_EQ = new CompareOp() {
    @Override
    protected boolean test(int cmp) {
      return (cmp <= 0);
    }
  };
  private static final ElementOp GREATER_THAN_EQ = new CompareOp() {
    @Override
    protected boolean test(int cmp) {
      return (cmp >= 0);
    }
  };
  private static final ElementOp EQUALS = new CompareOp() {
    @Override
    protected boolean test(int cmp) {
      return (cmp == 0);
    }
  };
  private static final ElementOp NOT_EQUALS = new CompareOp() {
    @Override
    protected boolean test(int cmp) {
      return (cmp != 0);
    }
  };

  private BuiltinOperators() {}

  public static FormulaValue negate(FormulaValue param1) {
    return applyElementwise(NEGATE, param1);
  }

  public static FormulaValue positive(FormulaValue param1) {
    return applyElementwise(POSITIVE, param1);
  }

  public static FormulaValue add(FormulaValue param1, FormulaValue param2) {
    return applyElementwise(ADD, param1, param2);
  }

  public static FormulaValue subtract(FormulaValue param1,
                                      FormulaValue param2) {
    return applyElementwise(SUBTRACT, param1, param2);
  }

  public static FormulaValue multiply(FormulaValue param1,
                                      FormulaValue param2) {
    return applyElementwise(MULTIPLY, param1, param2);
  }

  public static FormulaValue divide(FormulaValue param1, FormulaValue param2) {
    return applyElementwise(DIVIDE, param1, param2);
  }

  public static FormulaValue exp(FormulaValue param1, FormulaValue param2) {
    return applyElementwise(EXP, param1, param2);
  }

  public static FormulaValue concat(FormulaValue param1, FormulaValue param2) {
    return applyElementwise(CONCAT, param1, param2);
  }

  public static FormulaValue lessThan(FormulaValue param1,
                                      FormulaValue param2) {
    return applyElementwise(LESS_THAN, param1, param2);
  }

  public static FormulaValue greaterThan(FormulaValue param1,
                                         FormulaValue param2) {
    return applyElementwise(GREATER_THAN, param1, param2);
  }

  public static FormulaValue lessThanEq(FormulaValue param1,
                                        FormulaValue param2) {
    return applyElementwise(LESS_THAN_EQ, param1, param2);
  }

  public static FormulaValue greaterThanEq(FormulaValue param1,
                                           FormulaValue param2) {
    return applyElementwise(GREATER_THAN_EQ, param1, param2);
  }

  public static FormulaValue equals(FormulaValue param1, FormulaValue param2) {
    return applyElementwise(EQUALS, param1, param2);
  }

  public static FormulaValue notEquals(FormulaValue param1,
                                       FormulaValue param2) {
    return applyElementwise(NOT_EQUALS, param1, param2);
  }

  /**
   * Applies the given operation to the given params.  If any param is an
   * array, the operation is applied per element and the result is an array
   * with the largest shape of the params: single row/column arrays (and
   * scalars) are stretched, other positions outside a smaller array get
   * {@code #N/A}.  Each element result which fails becomes an error value,
   * and an error operand (first one wins) is the result for its element.
   */
  public static FormulaValue applyElementwise(ElementOp op,
                                              FormulaValue... params)
  {
    return applyElementwise(op, true, params);
  }

  /**
   * Variant of {@link #applyElementwise(ElementOp,FormulaValue...)} where
   * error operands are optionally passed through to the operation.
   */
  public static FormulaValue applyElementwise(ElementOp op,
                                              boolean propagateErrors,
                                              FormulaValue... params)
  {
    boolean anyArray = false;
    boolean any2D = false;
    int numRows = 1;
    int numCols = 1;
    for(FormulaValue param : params) {
      if(param.isArray()) {
        anyArray = true;
        any2D |= (param.getType() == FormulaValue.Type.ARRAY_2D);
        numRows = Math.max(numRows, param.getRowCount());
        numCols = Math.max(numCols, param.getColumnCount());
      }
    }

    if(!anyArray) {
      return applyScalar(op, propagateErrors, params);
    }

    FormulaValue[][] result = new FormulaValue[numRows][numCols];
    FormulaValue[] elemParams = new FormulaValue[params.length];
    for(int i = 0; i < numRows; ++i) {
      for(int j = 0; j < numCols; ++j) {
        for(int k = 0; k < params.length; ++k) {
          elemParams[k] = elementAt(params[k], i, j);
        }
        result[i][j] = applyScalar(op, propagateErrors, elemParams);
      }
    }

    if(!any2D && (numRows == 1)) {
      return new ArrayValue(result, true);
    }
    return toArray(result);
  }

  private static FormulaValue elementAt(FormulaValue val, int row, int col) {
    if(!val.isArray()) {
      return val;
    }
    int r = ((val.getRowCount() == 1) ? 0 : row);
    int c = ((val.getColumnCount() == 1) ? 0 : col);
    return val.getElement(r, c);
  }

  private static FormulaValue applyScalar(ElementOp op,
                                          boolean propagateErrors,
                                          FormulaValue[] params) {
    if(propagateErrors) {
      for(FormulaValue param : params) {
        if(param.isError()) {
          return BaseDelayedValue.resolve(param);
        }
      }
    }
    try {
      return op.apply(params);
    } catch(EvalException e) {
      return toError(e.getErrorKind());
    }
  }

  /**
   * Compares two scalar values the way the comparison operators do: an
   * empty value compares as the "zero" of the other value's type (0, "" or
   * FALSE), text compares case-insensitively, and values of different types
   * order numbers before text before booleans.
   *
   * @return negative, zero or positive
   * @throws EvalException for error, array or lambda operands
   */
  public static int compareValues(FormulaValue param1, FormulaValue param2) {
    FormulaValue.Type t1 = param1.getType();
    FormulaValue.Type t2 = param2.getType();
    if(t1 == FormulaValue.Type.EMPTY) {
      param1 = emptyAs(t2);
      t1 = param1.getType();
    }
    if(t2 == FormulaValue.Type.EMPTY) {
      param2 = emptyAs(t1);
      t2 = param2.getType();
    }

    checkComparable(param1);
    checkComparable(param2);

    if(t1 != t2) {
      return Integer.compare(typeOrder(t1), typeOrder(t2));
    }

    switch(t1) {
    case NUMBER:
      return Double.compare(param1.getAsDouble(), param2.getAsDouble());
    case TEXT:
      return Integer.signum(
          param1.getAsString().compareToIgnoreCase(param2.getAsString()));
    case BOOLEAN:
      return Boolean.compare(param1.getAsBoolean(), param2.getAsBoolean());
    default:
      throw new EvalException("Unexpected type " + t1);
    }
  }

  private static FormulaValue emptyAs(FormulaValue.Type otherType) {
    switch(otherType) {
    case TEXT:
      return EMPTY_STR_VAL;
    case BOOLEAN:
      return FALSE_VAL;
    default:
      return ZERO_VAL;
    }
  }

  private static void checkComparable(FormulaValue param) {
    if(param.isError()) {
      throw new EvalException(param.getErrorKind(),
                              "Cannot compare error " + param.get());
    }
    if(!param.getType().isScalar()) {
      throw new EvalException("Cannot compare " + param);
    }
  }

  private static int typeOrder(FormulaValue.Type type) {
    switch(type) {
    case NUMBER:
      return 0;
    case TEXT:
      return 1;
    default:
      return 2;
    }
  }

  private static abstract class CompareOp implements ElementOp
  {
    @Override
    public FormulaValue apply(FormulaValue[] params) {
      return toValue(test(compareValues(params[0], params[1])));
    }

    protected abstract boolean test(int cmp);
  }
}
