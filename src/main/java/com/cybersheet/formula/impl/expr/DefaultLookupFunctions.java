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
import java.util.regex.Pattern;

import com.cybersheet.formula.expr.ErrorKind;
import com.cybersheet.formula.expr.EvalException;
import com.cybersheet.formula.expr.FormulaContext;
import com.cybersheet.formula.expr.FormulaValue;
import com.cybersheet.formula.expr.Function;
import static com.cybersheet.formula.impl.expr.DefaultFunctions.*;
import static com.cybersheet.formula.impl.expr.FunctionSupport.*;

/**
 * Lookup and reference functions over range/array values.  Lookups only
 * match candidates of the same type as the lookup value (numbers never match
 * text), text compares case-insensitively.  Exact text lookups in VLOOKUP,
 * HLOOKUP and MATCH honor the criteria wildcards, XLOOKUP and XMATCH only in
 * wildcard match mode.
 * <p/>
 * The approximate modes of VLOOKUP, HLOOKUP and MATCH expect sorted data and
 * stop at the first candidate past the lookup value.
 */
public class DefaultLookupFunctions
{
  private static final Function.ArrayPolicy AGGREGATE =
    Function.ArrayPolicy.AGGREGATE;

  private static final int NOT_FOUND = -1;

  /** XLOOKUP/XMATCH match modes */
  private static final int MATCH_EXACT = 0;
  private static final int MATCH_NEXT_SMALLER = -1;
  private static final int MATCH_NEXT_LARGER = 1;
  private static final int MATCH_WILDCARD = 2;

  /** XLOOKUP/XMATCH search modes */
  private static final int SEARCH_FIRST = 1;
  private static final int SEARCH_LAST = -1;
  private static final int SEARCH_BINARY_ASC = 2;
  private static final int SEARCH_BINARY_DESC = -2;

  private DefaultLookupFunctions() {}

  static void init() {
    // dummy method to ensure this class is loaded
  }

  public static final Function VLOOKUP = registerFunc(new FuncVar("VLOOKUP", 3, 4, AGGREGATE) {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      return tableLookup(params, true);
    }
  });

  public static final Function HLOOKUP = registerFunc(new FuncVar("HLOOKUP", 3, 4, AGGREGATE) {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      return tableLookup(params, false);
    }
  });

  public static final Function INDEX = registerFunc(new FuncVar("INDEX", 2, 3, AGGREGATE) {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      FormulaValue[][] rows = toRows(checkArrayParam(params[0]));
      int numRows = rows.length;
      int numCols = rows[0].length;

      int rowNum = getIndexParam(params, 1);
      int colNum = 0;
      if(isGiven(params, 2)) {
        colNum = getIndexParam(params, 2);
      } else if((numRows == 1) && (numCols > 1)) {
        // a single index into a row picks the column
        colNum = rowNum;
        rowNum = 1;
      } else if(numCols == 1) {
        colNum = 1;
      }

      if((rowNum > numRows) || (colNum > numCols)) {
        throw new EvalException(ErrorKind.REF, "Index " + rowNum + "," +
                                colNum + " outside " + numRows + "x" +
                                numCols);
      }

      if((rowNum == 0) && (colNum == 0)) {
        return ValueSupport.toArray(rows);
      }
      if(rowNum == 0) {
        FormulaValue[][] col = new FormulaValue[numRows][1];
        for(int i = 0; i < numRows; ++i) {
          col[i][0] = rows[i][colNum - 1];
        }
        return ValueSupport.toArray(col);
      }
      if(colNum == 0) {
        return ValueSupport.toArray(new FormulaValue[][]{rows[rowNum - 1]});
      }
      return rows[rowNum - 1][colNum - 1];
    }
  });

  public static final Function MATCH = registerFunc(new FuncVar("MATCH", 2, 3, AGGREGATE) {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      FormulaValue lookup = getLookupValue(params[0]);
      List<FormulaValue> vector = getVector(checkArrayParam(params[1]));
      if(vector == null) {
        return ValueSupport.NA_VAL;
      }

      int matchType = (isGiven(params, 2) ?
                       Integer.signum(getAsInt(getScalar(params[2]))) : 1);
      int idx = ((matchType == 0) ?
                 findExact(vector, lookup, true) :
                 findSorted(vector, lookup, (matchType > 0)));
      return toPosition(idx);
    }
  });

  public static final Function XLOOKUP = registerFunc(new FuncVar("XLOOKUP", 3, 6, AGGREGATE) {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      FormulaValue lookup = getLookupValue(params[0]);
      FormulaValue lookupArr = checkArrayParam(params[1]);
      List<FormulaValue> vector = getVector(lookupArr);
      if(vector == null) {
        throw new EvalException("Lookup array must be a single row or column");
      }

      FormulaValue[][] returnRows = toRows(checkArrayParam(params[2]));
      boolean byRow = ((lookupArr.getColumnCount() == 1) &&
                       (returnRows.length == vector.size()));
      if(!byRow && (returnRows[0].length != vector.size())) {
        throw new EvalException("Return array does not match lookup array");
      }

      int idx = findIndex(vector, lookup, getMatchMode(params, 4),
                          getSearchMode(params, 5));
      if(idx == NOT_FOUND) {
        return (isGiven(params, 3) ? params[3] : ValueSupport.NA_VAL);
      }

      if(byRow) {
        FormulaValue[] row = returnRows[idx];
        return ((row.length == 1) ? row[0] :
                ValueSupport.toArray(new FormulaValue[][]{row}));
      }
      if(returnRows.length == 1) {
        return returnRows[0][idx];
      }
      FormulaValue[][] col = new FormulaValue[returnRows.length][1];
      for(int i = 0; i < returnRows.length; ++i) {
        col[i][0] = returnRows[i][idx];
      }
      return ValueSupport.toArray(col);
    }
  });

  public static final Function XMATCH = registerFunc(new FuncVar("XMATCH", 2, 4, AGGREGATE) {
    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      FormulaValue lookup = getLookupValue(params[0]);
      List<FormulaValue> vector = getVector(checkArrayParam(params[1]));
      if(vector == null) {
        throw new EvalException("Lookup array must be a single row or column");
      }
      return toPosition(findIndex(vector, lookup, getMatchMode(params, 2),
                                  getSearchMode(params, 3)));
    }
  });

  private static FormulaValue tableLookup(FormulaValue[] params,
                                          boolean vertical) {
    FormulaValue lookup = getLookupValue(params[0]);
    FormulaValue[][] rows = toRows(checkArrayParam(params[1]));
    if(!vertical) {
      rows = transpose(rows);
    }

    int resultIdx = getAsInt(getScalar(params[2]));
    if(resultIdx < 1) {
      throw new EvalException("Result index " + resultIdx + " below 1");
    }
    if(resultIdx > rows[0].length) {
      throw new EvalException(ErrorKind.REF, "Result index " + resultIdx +
                              " past end of table");
    }

    List<FormulaValue> keys = new ArrayList<FormulaValue>(rows.length);
    for(FormulaValue[] row : rows) {
      keys.add(row[0]);
    }

    boolean approximate = (!isGiven(params, 3) ||
                           getScalar(params[3]).getAsBoolean());
    int idx = (approximate ? findSorted(keys, lookup, true) :
               findExact(keys, lookup, true));
    if(idx == NOT_FOUND) {
      return ValueSupport.NA_VAL;
    }
    return rows[idx][resultIdx - 1];
  }

  private static int findIndex(List<FormulaValue> vector, FormulaValue lookup,
                               int matchMode, int searchMode) {
    if((searchMode == SEARCH_BINARY_ASC) || (searchMode == SEARCH_BINARY_DESC)) {
      if(matchMode == MATCH_WILDCARD) {
        throw new EvalException("Wildcard match not supported by binary search");
      }
      return binarySearch(vector, lookup, matchMode,
                          (searchMode == SEARCH_BINARY_ASC));
    }

    boolean reverse = (searchMode == SEARCH_LAST);
    Pattern wildcard = ((matchMode == MATCH_WILDCARD) ?
                        getWildcard(lookup) : null);
    int best = NOT_FOUND;
    FormulaValue bestVal = null;
    int len = vector.size();
    for(int i = 0; i < len; ++i) {
      int idx = (reverse ? (len - 1 - i) : i);
      FormulaValue candidate = vector.get(idx);
      if(isExactMatch(candidate, lookup, wildcard)) {
        return idx;
      }
      if((matchMode != MATCH_NEXT_SMALLER) && (matchMode != MATCH_NEXT_LARGER)) {
        continue;
      }
      boolean smaller = (matchMode == MATCH_NEXT_SMALLER);
      Integer cmp = compareSameType(candidate, lookup);
      if((cmp == null) || ((cmp < 0) != smaller)) {
        continue;
      }
      // keep the closest candidate, ties keep the first one found
      if((bestVal == null) || isCloser(candidate, bestVal, smaller)) {
        best = idx;
        bestVal = candidate;
      }
    }
    return best;
  }

  private static boolean isCloser(FormulaValue candidate, FormulaValue best,
                                  boolean smaller) {
    int cmp = BuiltinOperators.compareValues(candidate, best);
    return (smaller ? (cmp > 0) : (cmp < 0));
  }

  private static int binarySearch(List<FormulaValue> vector,
                                  FormulaValue lookup, int matchMode,
                                  boolean ascending) {
    int low = 0;
    int high = vector.size() - 1;
    while(low <= high) {
      int mid = (low + high) >>> 1;
      int cmp = compareForSearch(vector.get(mid), lookup);
      if(!ascending) {
        cmp = -cmp;
      }
      if(cmp == 0) {
        return mid;
      }
      if(cmp < 0) {
        low = mid + 1;
      } else {
        high = mid - 1;
      }
    }

    // low is the insertion point, high the entry before it
    int idx = NOT_FOUND;
    if(matchMode == MATCH_NEXT_SMALLER) {
      idx = (ascending ? high : low);
    } else if(matchMode == MATCH_NEXT_LARGER) {
      idx = (ascending ? low : high);
    }
    if((idx < 0) || (idx >= vector.size()) ||
       (compareSameType(vector.get(idx), lookup) == null)) {
      return NOT_FOUND;
    }
    return idx;
  }

  /**
   * @return the index of the first exact match for the lookup value
   */
  private static int findExact(List<FormulaValue> vector, FormulaValue lookup,
                               boolean allowWildcards) {
    Pattern wildcard = (allowWildcards ? getWildcard(lookup) : null);
    for(int i = 0; i < vector.size(); ++i) {
      if(isExactMatch(vector.get(i), lookup, wildcard)) {
        return i;
      }
    }
    return NOT_FOUND;
  }

  /**
   * Linear search of sorted data, ascending for the largest value not
   * greater than the lookup value, descending for the smallest value not
   * less than it.
   *
   * @return the index of the last qualifying candidate before the sort order
   *         is passed
   */
  private static int findSorted(List<FormulaValue> vector, FormulaValue lookup,
                                boolean ascending) {
    int best = NOT_FOUND;
    for(int i = 0; i < vector.size(); ++i) {
      Integer cmp = compareSameType(vector.get(i), lookup);
      if(cmp == null) {
        continue;
      }
      if(!ascending) {
        cmp = -cmp;
      }
      if(cmp > 0) {
        break;
      }
      best = i;
    }
    return best;
  }

  private static boolean isExactMatch(FormulaValue candidate,
                                      FormulaValue lookup, Pattern wildcard) {
    if(wildcard != null) {
      return ((candidate.getType() == FormulaValue.Type.TEXT) &&
              wildcard.matcher(candidate.getAsString()).matches());
    }
    Integer cmp = compareSameType(candidate, lookup);
    return ((cmp != null) && (cmp == 0));
  }

  /**
   * @return the comparison of the given scalars if they share a type,
   *         {@code null} otherwise (errors and empty cells never compare)
   */
  private static Integer compareSameType(FormulaValue candidate,
                                         FormulaValue lookup) {
    FormulaValue.Type type = candidate.getType();
    if((type != lookup.getType()) || (type == FormulaValue.Type.EMPTY) ||
       !type.isScalar()) {
      return null;
    }
    return BuiltinOperators.compareValues(candidate, lookup);
  }

  private static int compareForSearch(FormulaValue candidate,
                                      FormulaValue lookup) {
    if(!candidate.getType().isScalar()) {
      // errors sort last
      return 1;
    }
    return BuiltinOperators.compareValues(candidate, lookup);
  }

  private static Pattern getWildcard(FormulaValue lookup) {
    if(lookup.getType() != FormulaValue.Type.TEXT) {
      return null;
    }
    String str = lookup.getAsString();
    return (CriteriaMatcher.hasWildcards(str) ?
            CriteriaMatcher.wildcardToRegex(str) : null);
  }

  private static FormulaValue getLookupValue(FormulaValue param) {
    FormulaValue lookup = getScalar(param);
    if(!lookup.getType().isScalar()) {
      throw new EvalException("Lookup value must be a single value");
    }
    return lookup;
  }

  /**
   * @return the elements of a single row or column, {@code null} for a two
   *         dimensional value
   */
  private static List<FormulaValue> getVector(FormulaValue val) {
    int numRows = val.getRowCount();
    int numCols = val.getColumnCount();
    if((numRows != 1) && (numCols != 1)) {
      return null;
    }
    List<FormulaValue> vals = new ArrayList<FormulaValue>(numRows * numCols);
    for(int i = 0; i < numRows; ++i) {
      for(int j = 0; j < numCols; ++j) {
        vals.add(val.getElement(i, j));
      }
    }
    return vals;
  }

  private static int getIndexParam(FormulaValue[] params, int idx) {
    if(!isGiven(params, idx)) {
      return 0;
    }
    int val = getAsInt(getScalar(params[idx]));
    if(val < 0) {
      throw new EvalException("Negative index " + val);
    }
    return val;
  }

  private static int getMatchMode(FormulaValue[] params, int idx) {
    int mode = (isGiven(params, idx) ?
                getAsInt(getScalar(params[idx])) : MATCH_EXACT);
    switch(mode) {
    case MATCH_EXACT:
    case MATCH_NEXT_SMALLER:
    case MATCH_NEXT_LARGER:
    case MATCH_WILDCARD:
      return mode;
    default:
      throw new EvalException("Invalid match mode " + mode);
    }
  }

  private static int getSearchMode(FormulaValue[] params, int idx) {
    int mode = (isGiven(params, idx) ?
                getAsInt(getScalar(params[idx])) : SEARCH_FIRST);
    switch(mode) {
    case SEARCH_FIRST:
    case SEARCH_LAST:
    case SEARCH_BINARY_ASC:
    case SEARCH_BINARY_DESC:
      return mode;
    default:
      throw new EvalException("Invalid search mode " + mode);
    }
  }

  private static FormulaValue toPosition(int idx) {
    return ((idx == NOT_FOUND) ? ValueSupport.NA_VAL :
            ValueSupport.toValue(idx + 1));
  }

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

  private static boolean isGiven(FormulaValue[] params, int idx) {
    return ((params.length > idx) && !params[idx].isEmpty());
  }

  private static FormulaValue[][] transpose(FormulaValue[][] rows) {
    FormulaValue[][] result = new FormulaValue[rows[0].length][rows.length];
    for(int i = 0; i < rows.length; ++i) {
      for(int j = 0; j < rows[i].length; ++j) {
        result[j][i] = rows[i][j];
      }
    }
    return result;
  }
}
