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
import java.util.List;

import com.cybersheet.formula.expr.ErrorKind;
import com.cybersheet.formula.expr.EvalException;
import com.cybersheet.formula.expr.FormulaContext;
import com.cybersheet.formula.expr.FormulaValue;
import com.cybersheet.formula.expr.Function;
import static com.cybersheet.formula.impl.expr.DefaultFunctions.*;

/**
 * The database functions, {@code Dxxx(database, field, criteria)}.  The
 * database and criteria are arrays with a header row first.  The field is a
 * header name (case-insensitive) or a 1 based column index.  The rows
 * selected by the criteria (see {@link CriteriaMatcher#filterRows}) are
 * reduced over the field column.
 */
public class DefaultDatabaseFunctions
{
  private DefaultDatabaseFunctions() {}

  static void init() {
    // dummy method to ensure this class is loaded
  }

  public static final Function DSUM = registerFunc(new DbNumberFunc("DSUM") {
    @Override
    protected FormulaValue evalNumbers(List<Double> nums) {
      double sum = 0.0d;
      for(double d : nums) {
        sum += d;
      }
      return ValueSupport.toValue(sum);
    }
  });

  public static final Function DAVERAGE = registerFunc(new DbNumberFunc("DAVERAGE") {
    @Override
    protected FormulaValue evalNumbers(List<Double> nums) {
      if(nums.isEmpty()) {
        throw new EvalException(ErrorKind.DIV_ZERO, "No matching values");
      }
      return ValueSupport.toValue(mean(nums));
    }
  });

  public static final Function DCOUNT = registerFunc(new DbNumberFunc("DCOUNT") {
    @Override
    protected FormulaValue evalNumbers(List<Double> nums) {
      return ValueSupport.toValue(nums.size());
    }
  });

  public static final Function DCOUNTA = registerFunc(new DbFunc("DCOUNTA") {
    @Override
    protected FormulaValue evalDb(List<FormulaValue> vals) {
      int count = 0;
      for(FormulaValue val : vals) {
        if(!val.isEmpty() &&
           !((val.getType() == FormulaValue.Type.TEXT) &&
             (val.getAsString().length() == 0))) {
          ++count;
        }
      }
      return ValueSupport.toValue(count);
    }
  });

  public static final Function DMAX = registerFunc(new DbNumberFunc("DMAX") {
    @Override
    protected FormulaValue evalNumbers(List<Double> nums) {
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

  public static final Function DMIN = registerFunc(new DbNumberFunc("DMIN") {
    @Override
    protected FormulaValue evalNumbers(List<Double> nums) {
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

  public static final Function DGET = registerFunc(new DbFunc("DGET") {
    @Override
    protected FormulaValue evalDb(List<FormulaValue> vals) {
      if(vals.isEmpty()) {
        throw new EvalException(ErrorKind.VALUE, "No matching record");
      }
      if(vals.size() > 1) {
        throw new EvalException(ErrorKind.NUM,
                                "Multiple matching records " + vals.size());
      }
      return vals.get(0);
    }
  });

  public static final Function DSTDEV = registerFunc(new DbNumberFunc("DSTDEV") {
    @Override
    protected FormulaValue evalNumbers(List<Double> nums) {
      return ValueSupport.toValue(Math.sqrt(variance(nums, true)));
    }
  });

  public static final Function DSTDEVP = registerFunc(new DbNumberFunc("DSTDEVP") {
    @Override
    protected FormulaValue evalNumbers(List<Double> nums) {
      return ValueSupport.toValue(Math.sqrt(variance(nums, false)));
    }
  });

  public static final Function DVAR = registerFunc(new DbNumberFunc("DVAR") {
    @Override
    protected FormulaValue evalNumbers(List<Double> nums) {
      return ValueSupport.toValue(variance(nums, true));
    }
  });

  public static final Function DVARP = registerFunc(new DbNumberFunc("DVARP") {
    @Override
    protected FormulaValue evalNumbers(List<Double> nums) {
      return ValueSupport.toValue(variance(nums, false));
    }
  });


  private static double mean(List<Double> nums) {
    double sum = 0.0d;
    for(double d : nums) {
      sum += d;
    }
    return sum / nums.size();
  }

  private static double variance(List<Double> nums, boolean sample) {
    int minCount = (sample ? 2 : 1);
    if(nums.size() < minCount) {
      throw new EvalException(ErrorKind.DIV_ZERO, "Too few matching values " +
                              nums.size());
    }
    double mean = mean(nums);
    double sumSq = 0.0d;
    for(double d : nums) {
      double diff = d - mean;
      sumSq += diff * diff;
    }
    return sumSq / (sample ? (nums.size() - 1) : nums.size());
  }

  /**
   * @return the zero based database column for the given field
   * @throws EvalException (#VALUE!) if the field does not name a column
   */
  static int resolveField(FormulaValue database, FormulaValue field) {
    field = ValueSupport.checkError(ValueSupport.unwrapSingle(field));
    switch(field.getType()) {
    case NUMBER:
      Long idx = ValueSupport.toIntegral(field.getAsDouble());
      if((idx == null) || (idx < 1) || (idx > database.getColumnCount())) {
        throw new EvalException("Invalid field index " + field.get());
      }
      return (int)(idx - 1);
    case TEXT:
      int col = CriteriaMatcher.findHeader(database, field);
      if(col < 0) {
        throw new EvalException("Unknown field '" + field.get() + "'");
      }
      return col;
    default:
      throw new EvalException("Invalid field " + field);
    }
  }

  /**
   * Base class for the database functions, handles validation of the
   * params and selection of the matching field values.
   */
  private static abstract class DbFunc extends FunctionSupport.Func3
  {
    private DbFunc(String name) {
      super(name, Function.ArrayPolicy.AGGREGATE);
    }

    @Override
    protected final FormulaValue eval3(FormulaContext ctx,
                                       FormulaValue database,
                                       FormulaValue field,
                                       FormulaValue criteria) {
      ValueSupport.checkError(database);
      ValueSupport.checkError(criteria);
      if(!database.isArray() || (database.getRowCount() < 2)) {
        throw new EvalException(
            "Database must have a header row and at least one record");
      }

      int col = resolveField(database, field);

      List<FormulaValue> vals = new ArrayList<FormulaValue>();
      for(int row : CriteriaMatcher.filterRows(database, criteria)) {
        vals.add(database.getElement(row, col));
      }
      return evalDb(vals);
    }

    protected abstract FormulaValue evalDb(List<FormulaValue> vals);
  }

  /**
   * A database function which reduces the numeric field values, numbers
   * and numeric text.
   */
  private static abstract class DbNumberFunc extends DbFunc
  {
    private DbNumberFunc(String name) {
      super(name);
    }

    @Override
    protected final FormulaValue evalDb(List<FormulaValue> vals) {
      List<Double> nums = new ArrayList<Double>();
      for(FormulaValue val : vals) {
        if(ValueSupport.isNumeric(val)) {
          nums.add(val.getAsDouble());
        }
      }
      return evalNumbers(nums);
    }

    protected abstract FormulaValue evalNumbers(List<Double> nums);
  }
}
