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
import static com.cybersheet.formula.impl.expr.DefaultFunctions.*;
import static com.cybersheet.formula.impl.expr.FunctionSupport.*;

/**
 * Conditional, boolean and value type test functions.
 */
public class DefaultLogicalFunctions
{
  private DefaultLogicalFunctions() {}

  static void init() {
    // dummy method to ensure this class is loaded
  }

  private static final BuiltinOperators.ElementOp IF_OP =
    new BuiltinOperators.ElementOp() {
      @Override
      public FormulaValue apply(FormulaValue[] params) {
        if(params[0].isError()) {
          return params[0];
        }
        return (params[0].getAsBoolean() ? params[1] : params[2]);
      }
    };

  public static final Function IF = registerFunc(new LazyFuncVar("IF", 2, 3) {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      FormulaValue cond = ValueSupport.unwrapSingle(
          BaseDelayedValue.resolve(params[0]));
      FormulaValue elseVal = ((params.length > 2) ? params[2] :
                              ValueSupport.FALSE_VAL);
      if(cond.isArray()) {
        // per element condition, both branches are needed
        return BuiltinOperators.applyElementwise(
            IF_OP, false, cond, BaseDelayedValue.resolve(params[1]),
            BaseDelayedValue.resolve(elseVal));
      }
      ValueSupport.checkError(cond);
      return (cond.getAsBoolean() ? params[1] : elseVal);
    }
  });

  public static final Function IFERROR = registerFunc(new LazyFuncVar("IFERROR", 2, 2) {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      return replaceErrors(params[0], params[1], null);
    }
  });

  public static final Function IFNA = registerFunc(new LazyFuncVar("IFNA", 2, 2) {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      return replaceErrors(params[0], params[1], ErrorKind.NA);
    }
  });

  public static final Function IFS = registerFunc(new LazyFuncVar("IFS", 2, Integer.MAX_VALUE) {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      if((params.length % 2) != 0) {
        throw new EvalException("Odd number of parameters");
      }
      for(int i = 0; i < params.length; i += 2) {
        FormulaValue cond = ValueSupport.checkError(
            ValueSupport.unwrapSingle(BaseDelayedValue.resolve(params[i])));
        if(cond.getAsBoolean()) {
          return params[i + 1];
        }
      }
      return ValueSupport.NA_VAL;
    }
  });

  public static final Function CHOOSE = registerFunc(new LazyFuncVar("CHOOSE", 2, Integer.MAX_VALUE) {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      FormulaValue idxVal = ValueSupport.checkError(
          ValueSupport.unwrapSingle(BaseDelayedValue.resolve(params[0])));
      int idx = getAsInt(idxVal);
      if((idx < 1) || (idx >= params.length)) {
        throw new EvalException("Invalid index " + idx);
      }
      return params[idx];
    }
  });

  public static final Function SWITCH = registerFunc(new LazyFuncVar("SWITCH", 3, Integer.MAX_VALUE) {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      FormulaValue expr = ValueSupport.checkError(
          ValueSupport.unwrapSingle(BaseDelayedValue.resolve(params[0])));
      int numPairs = (params.length - 1) / 2;
      for(int i = 0; i < numPairs; ++i) {
        int valIdx = 1 + (i * 2);
        FormulaValue val = ValueSupport.checkError(
            ValueSupport.unwrapSingle(BaseDelayedValue.resolve(params[valIdx])));
        if(BuiltinOperators.compareValues(expr, val) == 0) {
          return params[valIdx + 1];
        }
      }
      boolean hasDefault = ((params.length % 2) == 0);
      return (hasDefault ? params[params.length - 1] : ValueSupport.NA_VAL);
    }
  });

  public static final Function AND = registerFunc(new FuncVar("AND") {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      boolean result = true;
      for(Boolean b : collectBooleans(getName(), params)) {
        result &= b;
      }
      return ValueSupport.toValue(result);
    }
  });

  public static final Function OR = registerFunc(new FuncVar("OR") {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      boolean result = false;
      for(Boolean b : collectBooleans(getName(), params)) {
        result |= b;
      }
      return ValueSupport.toValue(result);
    }
  });

  public static final Function XOR = registerFunc(new FuncVar("XOR") {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      boolean result = false;
      for(Boolean b : collectBooleans(getName(), params)) {
        result ^= b;
      }
      return ValueSupport.toValue(result);
    }
  });

  public static final Function NOT = registerFunc(new Func1("NOT", Function.ArrayPolicy.ELEMENTWISE) {
    @Override
    protected FormulaValue eval1(FormulaContext ctx, FormulaValue param1) {
      return ValueSupport.toValue(!param1.getAsBoolean());
    }
  });

  public static final Function TRUE = registerFunc(new Func0("TRUE") {
    @Override
    protected FormulaValue eval0(FormulaContext ctx) {
      return ValueSupport.TRUE_VAL;
    }
  });

  public static final Function FALSE = registerFunc(new Func0("FALSE") {
    @Override
    protected FormulaValue eval0(FormulaContext ctx) {
      return ValueSupport.FALSE_VAL;
    }
  });

  public static final Function NA = registerFunc(new Func0("NA") {
    @Override
    protected FormulaValue eval0(FormulaContext ctx) {
      return ValueSupport.NA_VAL;
    }
  });

  public static final Function ISERROR = registerFunc(new Func1("ISERROR", Function.ArrayPolicy.ELEMENTWISE) {
    @Override
    protected FormulaValue eval1(FormulaContext ctx, FormulaValue param1) {
      return ValueSupport.toValue(param1.isError());
    }
  });

  public static final Function ISNA = registerFunc(new Func1("ISNA", Function.ArrayPolicy.ELEMENTWISE) {
    @Override
    protected FormulaValue eval1(FormulaContext ctx, FormulaValue param1) {
      return ValueSupport.toValue(param1.isError() &&
                                  (param1.getErrorKind() == ErrorKind.NA));
    }
  });

  public static final Function ISNUMBER = registerFunc(new Func1("ISNUMBER", Function.ArrayPolicy.ELEMENTWISE) {
    @Override
    protected FormulaValue eval1(FormulaContext ctx, FormulaValue param1) {
      return ValueSupport.toValue(
          param1.getType() == FormulaValue.Type.NUMBER);
    }
  });

  public static final Function ISTEXT = registerFunc(new Func1("ISTEXT", Function.ArrayPolicy.ELEMENTWISE) {
    @Override
    protected FormulaValue eval1(FormulaContext ctx, FormulaValue param1) {
      return ValueSupport.toValue(param1.getType() == FormulaValue.Type.TEXT);
    }
  });

  public static final Function ISBLANK = registerFunc(new Func1("ISBLANK", Function.ArrayPolicy.ELEMENTWISE) {
    @Override
    protected FormulaValue eval1(FormulaContext ctx, FormulaValue param1) {
      return ValueSupport.toValue(param1.isEmpty());
    }
  });

  public static final Function ISLOGICAL = registerFunc(new Func1("ISLOGICAL", Function.ArrayPolicy.ELEMENTWISE) {
    @Override
    protected FormulaValue eval1(FormulaContext ctx, FormulaValue param1) {
      return ValueSupport.toValue(
          param1.getType() == FormulaValue.Type.BOOLEAN);
    }
  });


  private static FormulaValue replaceErrors(FormulaValue param,
                                            FormulaValue replacement,
                                            ErrorKind onlyKind) {
    FormulaValue val = BaseDelayedValue.resolve(param);
    if(!val.isArray()) {
      return (isReplaceable(val, onlyKind) ? replacement : val);
    }

    FormulaValue[][] rows = toRows(val);
    FormulaValue replaceVal = null;
    for(FormulaValue[] row : rows) {
      for(int j = 0; j < row.length; ++j) {
        if(isReplaceable(row[j], onlyKind)) {
          if(replaceVal == null) {
            replaceVal = ValueSupport.unwrapSingle(
                BaseDelayedValue.resolve(replacement));
          }
          row[j] = replaceVal;
        }
      }
    }
    return ((val.getType() == FormulaValue.Type.ARRAY_1D) ?
            ValueSupport.toArray1D(Arrays.asList(rows[0])) :
            ValueSupport.toArray(rows));
  }

  private static boolean isReplaceable(FormulaValue val, ErrorKind onlyKind) {
    return (val.isError() &&
            ((onlyKind == null) || (val.getErrorKind() == onlyKind)));
  }

  /**
   * Collects the logical values for AND/OR/XOR: text and empty cells within
   * arrays are ignored, any error is the result.
   */
  private static List<Boolean> collectBooleans(
      String funcName, FormulaValue[] params) {
    List<Boolean> vals = new ArrayList<Boolean>();
    for(FormulaValue param : params) {
      if(param.isArray()) {
        for(FormulaValue val : ValueSupport.flatten(param)) {
          ValueSupport.checkError(val);
          switch(val.getType()) {
          case NUMBER:
          case BOOLEAN:
            vals.add(val.getAsBoolean());
            break;
          default:
            // ignored
          }
        }
      } else if(!param.isEmpty()) {
        vals.add(ValueSupport.checkError(param).getAsBoolean());
      }
    }
    if(vals.isEmpty()) {
      throw new EvalException(funcName + " has no logical values");
    }
    return vals;
  }
}
