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
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.cybersheet.formula.expr.ErrorKind;
import com.cybersheet.formula.expr.EvalException;
import com.cybersheet.formula.expr.FormulaContext;
import com.cybersheet.formula.expr.FormulaValue;
import com.cybersheet.formula.expr.Function;
import static com.cybersheet.formula.impl.expr.DefaultFunctions.*;
import static com.cybersheet.formula.impl.expr.FunctionSupport.*;

/**
 * Dynamic array functions.  A scalar param is treated as a 1x1 array.  An
 * empty result is {@code #CALC!}.
 */
public class DefaultArrayFunctions
{
  private static final Function.ArrayPolicy AGGREGATE =
    Function.ArrayPolicy.AGGREGATE;

  private DefaultArrayFunctions() {}

  static void init() {
    // dummy method to ensure this class is loaded
  }

  public static final Function TRANSPOSE = registerFunc(new Func1("TRANSPOSE", AGGREGATE) {
    @Override
    protected FormulaValue eval1(FormulaContext ctx, FormulaValue param1) {
      FormulaValue[][] rows = toRows(checkArrayParam(param1));
      FormulaValue[][] result =
        new FormulaValue[rows[0].length][rows.length];
      for(int i = 0; i < rows.length; ++i) {
        for(int j = 0; j < rows[i].length; ++j) {
          result[j][i] = rows[i][j];
        }
      }
      return ValueSupport.toArray(result);
    }
  });

  public static final Function ROWS = registerFunc(new Func1("ROWS", AGGREGATE) {
    @Override
    protected FormulaValue eval1(FormulaContext ctx, FormulaValue param1) {
      return ValueSupport.toValue(checkArrayParam(param1).getRowCount());
    }
  });

  public static final Function COLUMNS = registerFunc(new Func1("COLUMNS", AGGREGATE) {
    @Override
    protected FormulaValue eval1(FormulaContext ctx, FormulaValue param1) {
      return ValueSupport.toValue(checkArrayParam(param1).getColumnCount());
    }
  });

  public static final Function UNIQUE = registerFunc(new FuncVar("UNIQUE", 1, 3, AGGREGATE) {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      boolean byCol = getFlag(params, 1);
      boolean exactlyOnce = getFlag(params, 2);

      FormulaValue[][] rows = toRows(checkArrayParam(params[0]));
      if(byCol) {
        rows = transpose(rows);
      }

      // row key -> [first row, occurrence count]
      Map<List<String>,Object[]> uniq =
        new LinkedHashMap<List<String>,Object[]>();
      for(FormulaValue[] row : rows) {
        List<String> key = toRowKey(row);
        Object[] entry = uniq.get(key);
        if(entry == null) {
          uniq.put(key, new Object[]{row, 1});
        } else {
          entry[1] = ((Integer)entry[1]) + 1;
        }
      }

      List<FormulaValue[]> result = new ArrayList<FormulaValue[]>();
      for(Object[] entry : uniq.values()) {
        if(!exactlyOnce || (((Integer)entry[1]) == 1)) {
          result.add((FormulaValue[])entry[0]);
        }
      }

      FormulaValue[][] resultRows = toResultRows(result);
      return ValueSupport.toArray(byCol ? transpose(resultRows) : resultRows);
    }
  });

  public static final Function SORT = registerFunc(new FuncVar("SORT", 1, 4, AGGREGATE) {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      FormulaValue[][] rows = toRows(checkArrayParam(params[0]));
      int sortIdx = (isGiven(params, 1) ? getAsInt(getScalar(params[1])) : 1);
      int order = (isGiven(params, 2) ? getAsInt(getScalar(params[2])) : 1);
      boolean byCol = getFlag(params, 3);

      if((order != 1) && (order != -1)) {
        throw new EvalException("Invalid sort order " + order);
      }
      if(byCol) {
        rows = transpose(rows);
      }
      if((sortIdx < 1) || (sortIdx > rows[0].length)) {
        throw new EvalException("Invalid sort index " + sortIdx);
      }

      List<FormulaValue[]> sorted =
        new ArrayList<FormulaValue[]>(Arrays.asList(rows));
      // stable, so equal keys keep their original order
      Collections.sort(sorted, new RowComparator(sortIdx - 1, order));

      FormulaValue[][] resultRows = toResultRows(sorted);
      return ValueSupport.toArray(byCol ? transpose(resultRows) : resultRows);
    }
  });

  public static final Function FILTER = registerFunc(new FuncVar("FILTER", 2, 3, AGGREGATE) {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      FormulaValue[][] rows = toRows(checkArrayParam(params[0]));
      FormulaValue include = checkArrayParam(params[1]);
      int numRows = rows.length;
      int numCols = rows[0].length;

      FormulaValue[][] result = null;
      if((include.getColumnCount() == 1) &&
         (include.getRowCount() == numRows)) {
        List<FormulaValue[]> kept = new ArrayList<FormulaValue[]>();
        for(int i = 0; i < numRows; ++i) {
          if(isIncluded(include.getElement(i, 0))) {
            kept.add(rows[i]);
          }
        }
        if(!kept.isEmpty()) {
          result = kept.toArray(new FormulaValue[0][]);
        }
      } else if((include.getRowCount() == 1) &&
                (include.getColumnCount() == numCols)) {
        List<FormulaValue[]> kept = new ArrayList<FormulaValue[]>();
        FormulaValue[][] cols = transpose(rows);
        for(int j = 0; j < numCols; ++j) {
          if(isIncluded(include.getElement(0, j))) {
            kept.add(cols[j]);
          }
        }
        if(!kept.isEmpty()) {
          result = transpose(kept.toArray(new FormulaValue[0][]));
        }
      } else {
        throw new EvalException("Include array shape does not match");
      }

      if(result == null) {
        if(isGiven(params, 2)) {
          return params[2];
        }
        throw new EvalException(ErrorKind.CALC, "No matching values");
      }
      return ValueSupport.toArray(result);
    }
  });

  public static final Function SEQUENCE = registerFunc(new FuncVar("SEQUENCE", 1, 4) {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      // fractional dimensions are floored
      double numRowsD = Math.floor(params[0].getAsDouble());
      double numColsD = (isGiven(params, 1) ?
                         Math.floor(params[1].getAsDouble()) : 1.0d);
      double start = (isGiven(params, 2) ? params[2].getAsDouble() : 1.0d);
      double step = (isGiven(params, 3) ? params[3].getAsDouble() : 1.0d);

      if((numRowsD < 1.0d) || (numColsD < 1.0d)) {
        throw new EvalException("Invalid dimensions " + numRowsD + "x" +
                                numColsD);
      }
      if((numRowsD * numColsD) > ctx.getEvalConfig().getMaxArrayCells()) {
        throw new EvalException(ErrorKind.NUM, "Sequence too large " +
                                numRowsD + "x" + numColsD);
      }

      int numRows = (int)numRowsD;
      int numCols = (int)numColsD;
      FormulaValue[][] result = new FormulaValue[numRows][numCols];
      for(int i = 0; i < numRows; ++i) {
        for(int j = 0; j < numCols; ++j) {
          result[i][j] = ValueSupport.toValue(
              start + (((i * (double)numCols) + j) * step));
        }
      }
      return ValueSupport.toArray(result);
    }
  });

  public static final Function TAKE = registerFunc(new FuncVar("TAKE", 2, 3, AGGREGATE) {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      FormulaValue[][] rows = toRows(checkArrayParam(params[0]));
      int[] rowRange = takeRange(params, 1, rows.length);
      int[] colRange = takeRange(params, 2, rows[0].length);
      return ValueSupport.toArray(slice(rows, rowRange, colRange));
    }
  });

  public static final Function DROP = registerFunc(new FuncVar("DROP", 2, 3, AGGREGATE) {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      FormulaValue[][] rows = toRows(checkArrayParam(params[0]));
      int[] rowRange = dropRange(params, 1, rows.length);
      int[] colRange = dropRange(params, 2, rows[0].length);
      return ValueSupport.toArray(slice(rows, rowRange, colRange));
    }
  });

  public static final Function CHOOSEROWS = registerFunc(new FuncVar("CHOOSEROWS", 2, Integer.MAX_VALUE, AGGREGATE) {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      FormulaValue[][] rows = toRows(checkArrayParam(params[0]));
      return ValueSupport.toArray(chooseRows(rows, params));
    }
  });

  public static final Function CHOOSECOLS = registerFunc(new FuncVar("CHOOSECOLS", 2, Integer.MAX_VALUE, AGGREGATE) {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      FormulaValue[][] cols = transpose(toRows(checkArrayParam(params[0])));
      return ValueSupport.toArray(transpose(chooseRows(cols, params)));
    }
  });

  public static final Function VSTACK = registerFunc(new FuncVar("VSTACK", 1, Integer.MAX_VALUE, AGGREGATE) {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      List<FormulaValue[]> result = new ArrayList<FormulaValue[]>();
      int width = 0;
      for(FormulaValue param : params) {
        width = Math.max(width, checkArrayParam(param).getColumnCount());
      }
      for(FormulaValue param : params) {
        for(FormulaValue[] row : toRows(param)) {
          result.add(pad(row, width));
        }
      }
      return ValueSupport.toArray(toResultRows(result));
    }
  });

  public static final Function HSTACK = registerFunc(new FuncVar("HSTACK", 1, Integer.MAX_VALUE, AGGREGATE) {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      List<FormulaValue[]> result = new ArrayList<FormulaValue[]>();
      int height = 0;
      for(FormulaValue param : params) {
        height = Math.max(height, checkArrayParam(param).getRowCount());
      }
      for(FormulaValue param : params) {
        for(FormulaValue[] col : transpose(toRows(param))) {
          result.add(pad(col, height));
        }
      }
      return ValueSupport.toArray(transpose(toResultRows(result)));
    }
  });

  public static final Function TOROW = registerFunc(new FuncVar("TOROW", 1, 3, AGGREGATE) {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      return ValueSupport.toArray1D(toVector(params));
    }
  });

  public static final Function TOCOL = registerFunc(new FuncVar("TOCOL", 1, 3, AGGREGATE) {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      List<FormulaValue> vals = toVector(params);
      return ValueSupport.toArray(vals.size(), 1, vals);
    }
  });

  public static final Function WRAPROWS = registerFunc(new FuncVar("WRAPROWS", 2, 3, AGGREGATE) {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      List<FormulaValue> vals = getVector(params[0]);
      int count = getWrapCount(params[1]);
      int numRows = (vals.size() + count - 1) / count;
      return ValueSupport.toArray(
          wrap(vals, numRows, count, getPadding(params)));
    }
  });

  public static final Function WRAPCOLS = registerFunc(new FuncVar("WRAPCOLS", 2, 3, AGGREGATE) {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      List<FormulaValue> vals = getVector(params[0]);
      int count = getWrapCount(params[1]);
      int numCols = (vals.size() + count - 1) / count;
      return ValueSupport.toArray(
          transpose(wrap(vals, numCols, count, getPadding(params))));
    }
  });


  private static FormulaValue checkArrayParam(FormulaValue param) {
    ValueSupport.checkError(param);
    if(param.getType() == FormulaValue.Type.LAMBDA) {
      throw new EvalException("Expected array, got lambda");
    }
    return param;
  }

  private static FormulaValue getScalar(FormulaValue param) {
    return ValueSupport.checkError(ValueSupport.unwrapSingle(param));
  }

  /**
   * @return {@code true} if the given optional param was given and is not
   *         empty
   */
  private static boolean isGiven(FormulaValue[] params, int idx) {
    return ((params.length > idx) && !params[idx].isEmpty());
  }

  private static boolean getFlag(FormulaValue[] params, int idx) {
    return (isGiven(params, idx) && getScalar(params[idx]).getAsBoolean());
  }

  private static boolean isIncluded(FormulaValue val) {
    return ValueSupport.checkError(val).getAsBoolean();
  }

  private static FormulaValue[][] transpose(FormulaValue[][] rows) {
    if(rows.length == 0) {
      return rows;
    }
    FormulaValue[][] result = new FormulaValue[rows[0].length][rows.length];
    for(int i = 0; i < rows.length; ++i) {
      for(int j = 0; j < rows[i].length; ++j) {
        result[j][i] = rows[i][j];
      }
    }
    return result;
  }

  private static FormulaValue[][] toResultRows(List<FormulaValue[]> rows) {
    if(rows.isEmpty()) {
      throw new EvalException(ErrorKind.CALC, "Empty array result");
    }
    return rows.toArray(new FormulaValue[0][]);
  }

  private static List<String> toRowKey(FormulaValue[] row) {
    List<String> key = new ArrayList<String>(row.length);
    for(FormulaValue val : row) {
      // text matches case-insensitively
      String str = (val.isError() ? val.getErrorKind().getLiteral() :
                    val.getAsString());
      key.add(val.getType() + ":" + str.toUpperCase());
    }
    return key;
  }

  /**
   * @return the [start, end) range for a TAKE count: positive from the
   *         start, negative from the end
   */
  private static int[] takeRange(FormulaValue[] params, int idx, int total) {
    if(!isGiven(params, idx)) {
      return new int[]{0, total};
    }
    int count = getAsInt(getScalar(params[idx]));
    if((count == 0) || (Math.abs(count) > total)) {
      throw new EvalException("Invalid count " + count + " for " + total);
    }
    return ((count > 0) ? new int[]{0, count} :
            new int[]{total + count, total});
  }

  /**
   * @return the [start, end) range left after a DROP count: positive drops
   *         from the start, negative from the end
   */
  private static int[] dropRange(FormulaValue[] params, int idx, int total) {
    if(!isGiven(params, idx)) {
      return new int[]{0, total};
    }
    int count = getAsInt(getScalar(params[idx]));
    if(Math.abs(count) >= total) {
      throw new EvalException("Invalid count " + count + " for " + total);
    }
    return ((count >= 0) ? new int[]{count, total} :
            new int[]{0, total + count});
  }

  private static FormulaValue[][] slice(FormulaValue[][] rows, int[] rowRange,
                                        int[] colRange) {
    FormulaValue[][] result =
      new FormulaValue[rowRange[1] - rowRange[0]][];
    for(int i = 0; i < result.length; ++i) {
      result[i] = Arrays.copyOfRange(rows[rowRange[0] + i], colRange[0],
                                     colRange[1]);
    }
    return result;
  }

  private static FormulaValue[][] chooseRows(FormulaValue[][] rows,
                                             FormulaValue[] params) {
    List<FormulaValue[]> result = new ArrayList<FormulaValue[]>();
    for(int i = 1; i < params.length; ++i) {
      for(FormulaValue val : ValueSupport.flatten(params[i])) {
        int idx = getAsInt(ValueSupport.checkError(val));
        if((idx == 0) || (Math.abs(idx) > rows.length)) {
          throw new EvalException("Invalid index " + idx);
        }
        // negative counts from the end
        result.add(rows[(idx > 0) ? (idx - 1) : (rows.length + idx)]);
      }
    }
    return toResultRows(result);
  }

  private static FormulaValue[] pad(FormulaValue[] vals, int len) {
    if(vals.length >= len) {
      return vals;
    }
    FormulaValue[] result = Arrays.copyOf(vals, len);
    Arrays.fill(result, vals.length, len, ValueSupport.NA_VAL);
    return result;
  }

  /**
   * Common handling for TOROW/TOCOL(array, [ignore], [scan_by_column]).
   * The ignore mode is 0 (keep all), 1 (skip blanks), 2 (skip errors) or 3
   * (skip both).
   */
  private static List<FormulaValue> toVector(FormulaValue[] params) {
    FormulaValue[][] rows = toRows(checkArrayParam(params[0]));
    int ignore = (isGiven(params, 1) ? getAsInt(getScalar(params[1])) : 0);
    if((ignore < 0) || (ignore > 3)) {
      throw new EvalException("Invalid ignore mode " + ignore);
    }
    if(getFlag(params, 2)) {
      rows = transpose(rows);
    }

    boolean skipBlanks = ((ignore & 1) != 0);
    boolean skipErrors = ((ignore & 2) != 0);
    List<FormulaValue> vals = new ArrayList<FormulaValue>();
    for(FormulaValue[] row : rows) {
      for(FormulaValue val : row) {
        if((skipBlanks && val.isEmpty()) || (skipErrors && val.isError())) {
          continue;
        }
        vals.add(val);
      }
    }
    if(vals.isEmpty()) {
      throw new EvalException(ErrorKind.CALC, "Empty array result");
    }
    return vals;
  }

  private static List<FormulaValue> getVector(FormulaValue param) {
    checkArrayParam(param);
    if((param.getRowCount() != 1) && (param.getColumnCount() != 1)) {
      throw new EvalException("Expected a single row or column");
    }
    return ValueSupport.flatten(param);
  }

  private static int getWrapCount(FormulaValue param) {
    int count = getAsInt(getScalar(param));
    if(count < 1) {
      throw new EvalException("Invalid wrap count " + count);
    }
    return count;
  }

  private static FormulaValue getPadding(FormulaValue[] params) {
    return (isGiven(params, 2) ? ValueSupport.unwrapSingle(params[2]) :
            ValueSupport.NA_VAL);
  }

  private static FormulaValue[][] wrap(List<FormulaValue> vals, int numRows,
                                       int numCols, FormulaValue padding) {
    FormulaValue[][] result = new FormulaValue[numRows][numCols];
    for(int i = 0; i < numRows; ++i) {
      for(int j = 0; j < numCols; ++j) {
        int idx = (i * numCols) + j;
        result[i][j] = ((idx < vals.size()) ? vals.get(idx) : padding);
      }
    }
    return result;
  }

  /**
   * Orders rows by one column: numbers before text before booleans, blanks
   * and errors always last.
   */
  private static final class RowComparator implements Comparator<FormulaValue[]>
  {
    private final int _col;
    private final int _order;

    private RowComparator(int col, int order) {
      _col = col;
      _order = order;
    }

    @Override
    public int compare(FormulaValue[] row1, FormulaValue[] row2) {
      FormulaValue v1 = row1[_col];
      FormulaValue v2 = row2[_col];
      int rank1 = rank(v1);
      int rank2 = rank(v2);
      if((rank1 != 0) || (rank2 != 0)) {
        return Integer.compare(rank1, rank2);
      }
      return _order * BuiltinOperators.compareValues(v1, v2);
    }

    private static int rank(FormulaValue val) {
      if(val.isError()) {
        return 2;
      }
      return (val.isEmpty() ? 1 : 0);
    }
  }
}
