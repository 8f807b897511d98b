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
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.cybersheet.formula.expr.FormulaValue;

/**
 * Criteria support shared by the database functions and the *IF
 * aggregates.  A criterion is text (or a value rendered as text) with an
 * optional leading comparator.  The remainder is matched as a wildcard
 * pattern (for {@code =} and {@code <>} only), then numerically, then as
 * case-insensitive text.
 */
public class CriteriaMatcher
{
  private static final Set<Character> REGEX_SPEC_CHARS = new HashSet<Character>(
      Arrays.asList('\\','.','%','=','+', '$','^','|','(',')','{','}','&',
                    '[',']','*','?'));
  private static final Pattern UNMATCHABLE_REGEX = Pattern.compile("(?!)");
  private static final char WILDCARD_ESCAPE = '~';

  /** criteria comparators, in the order they are tried as prefixes */
  public enum Comparator
  {
    GREATER_THAN_EQ(">=") {
      @Override boolean test(int cmp) { return (cmp >= 0); }
    },
    LESS_THAN_EQ("<=") {
      @Override boolean test(int cmp) { return (cmp <= 0); }
    },
    NOT_EQ("<>") {
      @Override boolean test(int cmp) { return (cmp != 0); }
    },
    GREATER_THAN(">") {
      @Override boolean test(int cmp) { return (cmp > 0); }
    },
    LESS_THAN("<") {
      @Override boolean test(int cmp) { return (cmp < 0); }
    },
    EQ("=") {
      @Override boolean test(int cmp) { return (cmp == 0); }
    };

    private final String _str;

    private Comparator(String str) {
      _str = str;
    }

    public String toRawString() {
      return _str;
    }

    abstract boolean test(int cmp);
  }

  private CriteriaMatcher() {}

  /**
   * @return {@code true} if the given criterion value matches everything
   */
  public static boolean isEmptyCriterion(FormulaValue criterion) {
    return ((criterion == null) || criterion.isEmpty() ||
            ((criterion.getType() == FormulaValue.Type.TEXT) &&
             (criterion.getAsString().length() == 0)));
  }

  /**
   * Parses the given criterion value into a reusable matcher.
   */
  public static Criterion compile(FormulaValue criterion) {
    if(isEmptyCriterion(criterion)) {
      return Criterion.MATCH_ALL;
    }

    String critStr = criterion.getAsString();
    Comparator comp = Comparator.EQ;
    for(Comparator c : Comparator.values()) {
      if(critStr.startsWith(c.toRawString())) {
        comp = c;
        critStr = critStr.substring(c.toRawString().length()).trim();
        break;
      }
    }

    Pattern wildcard = null;
    if(((comp == Comparator.EQ) || (comp == Comparator.NOT_EQ)) &&
       hasWildcards(critStr)) {
      wildcard = wildcardToRegex(critStr);
    }

    return new Criterion(comp, critStr, ValueSupport.parseNumber(critStr),
                         wildcard);
  }

  public static boolean matches(FormulaValue value, FormulaValue criterion) {
    return compile(criterion).matches(value);
  }

  /**
   * Filters the data rows of a database (header row first) with a criteria
   * range (header row first).  Columns within a criteria row are ANDed,
   * criteria rows are ORed.  A criteria range without any criteria rows
   * matches nothing.
   *
   * @return the (zero based, header is row 0) indexes of the matching
   *         database rows
   */
  public static List<Integer> filterRows(FormulaValue database,
                                         FormulaValue criteria)
  {
    List<Integer> matches = new ArrayList<Integer>();
    int numCritRows = criteria.getRowCount();
    int numCritCols = criteria.getColumnCount();
    if(numCritRows < 2) {
      return matches;
    }

    // resolve criteria headers once, -1 marks an unknown column
    int[] critDbCols = new int[numCritCols];
    for(int j = 0; j < numCritCols; ++j) {
      critDbCols[j] = findHeader(database, criteria.getElement(0, j));
    }

    List<Criterion[]> critRows = new ArrayList<Criterion[]>();
    for(int i = 1; i < numCritRows; ++i) {
      Criterion[] critRow = new Criterion[numCritCols];
      for(int j = 0; j < numCritCols; ++j) {
        critRow[j] = compile(criteria.getElement(i, j));
      }
      critRows.add(critRow);
    }

    for(int row = 1; row < database.getRowCount(); ++row) {
      for(Criterion[] critRow : critRows) {
        if(matchesRow(database, row, critRow, critDbCols)) {
          matches.add(row);
          break;
        }
      }
    }
    return matches;
  }

  private static boolean matchesRow(FormulaValue database, int row,
                                    Criterion[] critRow, int[] critDbCols)
  {
    for(int j = 0; j < critRow.length; ++j) {
      Criterion crit = critRow[j];
      if(crit.isMatchAll()) {
        continue;
      }
      if(critDbCols[j] < 0) {
        return false;
      }
      if(!crit.matches(database.getElement(row, critDbCols[j]))) {
        return false;
      }
    }
    return true;
  }

  /**
   * @return the zero based column of the database header matching the
   *         given name (case-insensitive), -1 if none
   */
  public static int findHeader(FormulaValue database, FormulaValue name) {
    if(name.isError() || name.isArray()) {
      return -1;
    }
    String nameStr = name.getAsString();
    for(int j = 0; j < database.getColumnCount(); ++j) {
      FormulaValue header = database.getElement(0, j);
      if(!header.isError() && !header.isArray() &&
         nameStr.equalsIgnoreCase(header.getAsString())) {
        return j;
      }
    }
    return -1;
  }

  static boolean hasWildcards(String str) {
    return ((str.indexOf('*') >= 0) || (str.indexOf('?') >= 0));
  }

  /**
   * Converts a criteria wildcard pattern (where '*' matches any run of
   * chars, '?' matches one char and '~' escapes the next char) to an
   * anchored, case-insensitive regex.
   */
  public static Pattern wildcardToRegex(String pattern) {
    StringBuilder sb = new StringBuilder(pattern.length() + 8);
    for(int i = 0; i < pattern.length(); ++i) {
      char c = pattern.charAt(i);
      if((c == WILDCARD_ESCAPE) && (i + 1 < pattern.length())) {
        appendLiteral(sb, pattern.charAt(++i));
      } else if(c == '*') {
        sb.append(".*");
      } else if(c == '?') {
        sb.append('.');
      } else {
        appendLiteral(sb, c);
      }
    }

    try {
      return Pattern.compile(sb.toString(),
                             Pattern.CASE_INSENSITIVE | Pattern.DOTALL |
                             Pattern.UNICODE_CASE);
    } catch(PatternSyntaxException ignored) {
      return UNMATCHABLE_REGEX;
    }
  }

  private static void appendLiteral(StringBuilder sb, char c) {
    if(REGEX_SPEC_CHARS.contains(c)) {
      sb.append('\\');
    }
    sb.append(c);
  }

  /**
   * A parsed criterion.
   */
  public static final class Criterion
  {
    static final Criterion MATCH_ALL = new Criterion(
        Comparator.EQ, "", null, null);

    private final Comparator _comp;
    private final String _operand;
    private final Double _numOperand;
    private final Pattern _wildcard;

    private Criterion(Comparator comp, String operand, Double numOperand,
                      Pattern wildcard) {
      _comp = comp;
      _operand = operand;
      _numOperand = numOperand;
      _wildcard = wildcard;
    }

    public Comparator getComparator() {
      return _comp;
    }

    public String getOperand() {
      return _operand;
    }

    public boolean isMatchAll() {
      return (this == MATCH_ALL);
    }

    public boolean matches(FormulaValue value) {
      if(isMatchAll()) {
        return true;
      }
      value = ValueSupport.unwrapSingle(value);
      if(value.isError() || value.isArray()) {
        return false;
      }

      if(_wildcard != null) {
        boolean found = _wildcard.matcher(value.getAsString()).matches();
        return ((_comp == Comparator.NOT_EQ) ? !found : found);
      }

      Double numVal = toNumberOrNull(value);
      if((numVal != null) && (_numOperand != null)) {
        return _comp.test(Double.compare(numVal, _numOperand));
      }

      return _comp.test(compareText(value.getAsString(), _operand));
    }

    private static Double toNumberOrNull(FormulaValue value) {
      switch(value.getType()) {
      case NUMBER:
      case BOOLEAN:
      case EMPTY:
        return value.getAsDouble();
      case TEXT:
        return ValueSupport.parseNumber(value.getAsString());
      default:
        return null;
      }
    }

    private static int compareText(String s1, String s2) {
      return Integer.signum(s1.compareToIgnoreCase(s2));
    }

    @Override
    public String toString() {
      return _comp.toRawString() + _operand;
    }
  }
}
