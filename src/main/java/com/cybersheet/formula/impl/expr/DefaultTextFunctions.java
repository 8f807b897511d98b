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

import com.cybersheet.formula.expr.EvalException;
import com.cybersheet.formula.expr.FormulaContext;
import com.cybersheet.formula.expr.FormulaValue;
import com.cybersheet.formula.expr.Function;
import org.apache.commons.lang3.StringUtils;
import static com.cybersheet.formula.impl.expr.DefaultFunctions.*;
import static com.cybersheet.formula.impl.expr.FunctionSupport.*;

public class DefaultTextFunctions
{
  // Excel's cell text limit
  private static final int MAX_TEXT_LEN = 32767;

  private DefaultTextFunctions() {}

  static void init() {
    // dummy method to ensure this class is loaded
  }

  public static final Function CONCAT = registerFunc(new FuncVar("CONCAT") {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      StringBuilder sb = new StringBuilder();
      for(FormulaValue val : flattenParams(params)) {
        sb.append(ValueSupport.checkError(val).getAsString());
      }
      return toTextValue(sb);
    }
  });

  public static final Function CONCATENATE = registerFunc(new FuncVar("CONCATENATE", 1, 255, Function.ArrayPolicy.ELEMENTWISE) {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      StringBuilder sb = new StringBuilder();
      for(FormulaValue param : params) {
        sb.append(param.getAsString());
      }
      return toTextValue(sb);
    }
  });

  public static final Function TEXTJOIN = registerFunc(new FuncVar("TEXTJOIN", 3, 255, Function.ArrayPolicy.AGGREGATE) {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      String delim = ValueSupport.checkError(
          ValueSupport.unwrapSingle(params[0])).getAsString();
      boolean ignoreEmpty = ValueSupport.checkError(
          ValueSupport.unwrapSingle(params[1])).getAsBoolean();

      StringBuilder sb = new StringBuilder();
      boolean first = true;
      for(int i = 2; i < params.length; ++i) {
        for(FormulaValue val : ValueSupport.flatten(params[i])) {
          String str = ValueSupport.checkError(val).getAsString();
          if(ignoreEmpty && (str.length() == 0)) {
            continue;
          }
          if(!first) {
            sb.append(delim);
          }
          sb.append(str);
          first = false;
        }
      }
      return toTextValue(sb);
    }
  });

  public static final Function LEN = registerFunc(new Func1ErrorIsError("LEN") {
    @Override
    protected FormulaValue evalNonError(FormulaContext ctx,
                                        FormulaValue param1) {
      return ValueSupport.toValue(param1.getAsString().length());
    }
  });

  public static final Function UPPER = registerFunc(new Func1ErrorIsError("UPPER") {
    @Override
    protected FormulaValue evalNonError(FormulaContext ctx,
                                        FormulaValue param1) {
      return ValueSupport.toValue(param1.getAsString().toUpperCase());
    }
  });

  public static final Function LOWER = registerFunc(new Func1ErrorIsError("LOWER") {
    @Override
    protected FormulaValue evalNonError(FormulaContext ctx,
                                        FormulaValue param1) {
      return ValueSupport.toValue(param1.getAsString().toLowerCase());
    }
  });

  public static final Function TRIM = registerFunc(new Func1ErrorIsError("TRIM") {
    @Override
    protected FormulaValue evalNonError(FormulaContext ctx,
                                        FormulaValue param1) {
      // leading/trailing spaces removed, inner runs collapsed to one
      return ValueSupport.toValue(
          StringUtils.normalizeSpace(param1.getAsString()));
    }
  });

  public static final Function LEFT = registerFunc(new FuncVar("LEFT", 1, 2, Function.ArrayPolicy.ELEMENTWISE) {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      String str = params[0].getAsString();
      int len = getLength(params);
      return ValueSupport.toValue(StringUtils.left(str, len));
    }
  });

  public static final Function RIGHT = registerFunc(new FuncVar("RIGHT", 1, 2, Function.ArrayPolicy.ELEMENTWISE) {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      String str = params[0].getAsString();
      int len = getLength(params);
      return ValueSupport.toValue(StringUtils.right(str, len));
    }
  });

  public static final Function MID = registerFunc(new Func3("MID", Function.ArrayPolicy.ELEMENTWISE) {
    @Override
    protected FormulaValue eval3(FormulaContext ctx, FormulaValue param1,
                                 FormulaValue param2, FormulaValue param3) {
      String str = param1.getAsString();
      int start = getAsInt(param2);
      int len = getAsInt(param3);
      if((start < 1) || (len < 0)) {
        throw new EvalException("Invalid start " + start + " or length " +
                                len);
      }
      return ValueSupport.toValue(StringUtils.mid(str, start - 1, len));
    }
  });

  public static final Function EXACT = registerFunc(new Func2("EXACT", Function.ArrayPolicy.ELEMENTWISE) {
    @Override
    protected FormulaValue eval2(FormulaContext ctx, FormulaValue param1,
                                 FormulaValue param2) {
      return ValueSupport.toValue(
          param1.getAsString().equals(param2.getAsString()));
    }
  });


  private static int getLength(FormulaValue[] params) {
    int len = ((params.length > 1) ? getAsInt(params[1]) : 1);
    if(len < 0) {
      throw new EvalException("Invalid length " + len);
    }
    return len;
  }

  private static FormulaValue toTextValue(StringBuilder sb) {
    if(sb.length() > MAX_TEXT_LEN) {
      throw new EvalException("Text result is too long");
    }
    return ValueSupport.toValue(sb.toString());
  }
}
