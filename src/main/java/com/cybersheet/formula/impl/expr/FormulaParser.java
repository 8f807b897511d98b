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
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import com.cybersheet.formula.expr.CellAccessor;
import com.cybersheet.formula.expr.CellAddress;
import com.cybersheet.formula.expr.CompiledFormula;
import com.cybersheet.formula.expr.ErrorKind;
import com.cybersheet.formula.expr.EvalException;
import com.cybersheet.formula.expr.FormulaContext;
import com.cybersheet.formula.expr.FormulaValue;
import com.cybersheet.formula.expr.Function;
import com.cybersheet.formula.expr.FunctionLookup;
import com.cybersheet.formula.expr.LambdaFunction;
import com.cybersheet.formula.expr.ParseException;
import com.cybersheet.formula.expr.Reference;
import com.cybersheet.formula.impl.expr.FormulaTokenizer.Token;
import com.cybersheet.formula.impl.expr.FormulaTokenizer.TokenType;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Parses formula text into an expression tree and wraps the tree in a
 * {@link CompiledFormula}.  Parsing is total: malformed text produces a
 * compiled formula which evaluates to the relevant error.
 * <p>
 * Operators are handled by precedence climbing.  From loosest to tightest:
 * comparisons, {@code &}, {@code + -}, {@code * /}, a leading sign, then
 * {@code ^}.  All binary operators group to the left except {@code ^}, so
 * {@code 2^3^2} is {@code 2^(3^2)} and {@code -2^2} is {@code -(2^2)}.
 * Parentheses hold either a single grouped expression or a union of areas,
 * braces hold an array literal with {@code ,} between columns and {@code ;}
 * between rows.
 */
public class FormulaParser
{
  private static final Log LOG = LogFactory.getLog(FormulaParser.class);

  /** max depth of the recursive descent (parentheses, calls, signs, "^") */
  static final int MAX_NESTING_DEPTH = 256;
  /** max height of the parsed expression tree */
  static final int MAX_EXPRESSION_HEIGHT = 1024;

  private static final String OPEN_PAREN = "(";
  private static final String CLOSE_PAREN = ")";
  private static final String OPEN_BRACE = "{";
  private static final String CLOSE_BRACE = "}";
  private static final String ARG_SEP = ",";
  private static final String ROW_SEP = ";";

  static final String LAMBDA_NAME = "LAMBDA";
  static final String LET_NAME = "LET";
  private static final String TRUE_STR = "TRUE";
  private static final String FALSE_STR = "FALSE";

  private static final Pattern IDENTIFIER_PAT =
    Pattern.compile("[\\p{L}_\\\\][\\p{L}\\p{N}_.]*");

  // binding strength of the infix operators, higher binds tighter
  private static final int COMPARISON = 1;
  private static final int CONCATENATION = 2;
  private static final int ADDITIVE = 3;
  private static final int MULTIPLICATIVE = 4;
  private static final int EXPONENT = 6;

  private interface InfixOp
  {
    public int getPrecedence();

    public boolean isRightAssociative();

    public FormulaValue eval(FormulaValue left, FormulaValue right);
  }

  private enum UnaryOp {
    NEG("-") {
      @Override public FormulaValue eval(FormulaValue operand) {
        return BuiltinOperators.negate(operand);
      }
    },
    POS("+") {
      @Override public FormulaValue eval(FormulaValue operand) {
        return BuiltinOperators.positive(operand);
      }
    };

    private final String _symbol;

    private UnaryOp(String symbol) {
      _symbol = symbol;
    }

    @Override
    public String toString() {
      return _symbol;
    }

    public abstract FormulaValue eval(FormulaValue operand);
  }

  private enum BinaryOp implements InfixOp {
    PLUS("+", ADDITIVE) {
      @Override public FormulaValue eval(FormulaValue left,
                                         FormulaValue right) {
        return BuiltinOperators.add(left, right);
      }
    },
    MINUS("-", ADDITIVE) {
      @Override public FormulaValue eval(FormulaValue left,
                                         FormulaValue right) {
        return BuiltinOperators.subtract(left, right);
      }
    },
    MULT("*", MULTIPLICATIVE) {
      @Override public FormulaValue eval(FormulaValue left,
                                         FormulaValue right) {
        return BuiltinOperators.multiply(left, right);
      }
    },
    DIV("/", MULTIPLICATIVE) {
      @Override public FormulaValue eval(FormulaValue left,
                                         FormulaValue right) {
        return BuiltinOperators.divide(left, right);
      }
    },
    EXP("^", EXPONENT) {
      @Override public FormulaValue eval(FormulaValue left,
                                         FormulaValue right) {
        return BuiltinOperators.exp(left, right);
      }
      @Override public boolean isRightAssociative() {
        return true;
      }
    },
    CONCAT("&", CONCATENATION) {
      @Override public FormulaValue eval(FormulaValue left,
                                         FormulaValue right) {
        return BuiltinOperators.concat(left, right);
      }
    };

    private final String _symbol;
    private final int _precedence;

    private BinaryOp(String symbol, int precedence) {
      _symbol = symbol;
      _precedence = precedence;
    }

    @Override
    public int getPrecedence() {
      return _precedence;
    }

    @Override
    public boolean isRightAssociative() {
      return false;
    }

    @Override
    public String toString() {
      return _symbol;
    }
  }

  private enum CompOp implements InfixOp {
    LT("<") {
      @Override public FormulaValue eval(FormulaValue left,
                                         FormulaValue right) {
        return BuiltinOperators.lessThan(left, right);
      }
    },
    LTE("<=") {
      @Override public FormulaValue eval(FormulaValue left,
                                         FormulaValue right) {
        return BuiltinOperators.lessThanEq(left, right);
      }
    },
    GT(">") {
      @Override public FormulaValue eval(FormulaValue left,
                                         FormulaValue right) {
        return BuiltinOperators.greaterThan(left, right);
      }
    },
    GTE(">=") {
      @Override public FormulaValue eval(FormulaValue left,
                                         FormulaValue right) {
        return BuiltinOperators.greaterThanEq(left, right);
      }
    },
    EQ("=") {
      @Override public FormulaValue eval(FormulaValue left,
                                         FormulaValue right) {
        return BuiltinOperators.equals(left, right);
      }
    },
    NE("<>") {
      @Override public FormulaValue eval(FormulaValue left,
                                         FormulaValue right) {
        return BuiltinOperators.notEquals(left, right);
      }
    };

    private final String _symbol;

    private CompOp(String symbol) {
      _symbol = symbol;
    }

    @Override
    public int getPrecedence() {
      return COMPARISON;
    }

    @Override
    public boolean isRightAssociative() {
      return false;
    }

    @Override
    public String toString() {
      return _symbol;
    }
  }

  private static final Expr TRUE_VALUE = new EConstValue(
      ValueSupport.TRUE_VAL, TRUE_STR);
  private static final Expr FALSE_VALUE = new EConstValue(
      ValueSupport.FALSE_VAL, FALSE_STR);
  private static final Expr EMPTY_ARG = new EConstValue(
      ValueSupport.EMPTY_VAL, "");


  private FormulaParser() {}

  /**
   * Parses the given formula text.  Never throws for malformed text, the
   * returned formula evaluates to the parse error instead (see
   * {@link CompiledFormula#getParseError}).
   *
   * @param formulaStr the formula text, optionally with a leading '='
   * @param lookup resolves the names of called functions
   */
  public static CompiledFormula parse(String formulaStr, FunctionLookup lookup)
  {
    try {
      return parseFormula(formulaStr, lookup);
    } catch(ParseException pe) {
      if(LOG.isDebugEnabled()) {
        LOG.debug("Failed parsing formula '" + formulaStr + "': " +
                  pe.getMessage());
      }
      return new ErrorExprWrapper(formulaStr, pe.getErrorKind());
    }
  }

  /**
   * Parses the given formula text.
   *
   * @throws ParseException if the formula text is malformed
   */
  public static CompiledFormula parseFormula(String formulaStr,
                                             FunctionLookup lookup) {

    List<Token> tokens = dropSpaces(FormulaTokenizer.tokenize(formulaStr));
    if((tokens == null) || tokens.isEmpty()) {
      throw new ParseException("Formula has no content");
    }

    TokenCursor cursor = new TokenCursor(formulaStr, tokens, lookup);
    Expr expr = parseInfix(cursor, COMPARISON);
    if(cursor.hasNext()) {
      throw cursor.error("Unexpected '" + cursor.peek().getValueStr() + "'");
    }

    List<Reference> refs = new ArrayList<Reference>();
    expr.collectReferences(refs);
    refs = Collections.unmodifiableList(refs);

    // a constant formula evaluates once, the first time it is needed
    return (expr.isConstant() ?
            new MemoizedExprWrapper(formulaStr, expr, refs) :
            new ExprWrapper(formulaStr, expr, refs));
  }

  /**
   * @return {@code true} if the given name is valid for a LET or LAMBDA
   *         variable
   */
  public static boolean isIdentifier(String name) {
    return ((name != null) && IDENTIFIER_PAT.matcher(name).matches() &&
            !TRUE_STR.equalsIgnoreCase(name) &&
            !FALSE_STR.equalsIgnoreCase(name));
  }

  private static List<Token> dropSpaces(List<Token> tokens) {
    if(tokens == null) {
      return null;
    }
    // the intersection operator is not supported, so whitespace carries no
    // meaning between tokens
    List<Token> result = new ArrayList<Token>(tokens.size());
    for(Token t : tokens) {
      if(t.getType() != TokenType.SPACE) {
        result.add(t);
      }
    }
    return result;
  }

  /**
   * Parses a run of operands joined by infix operators which bind at least
   * as tightly as {@code minPrecedence}.  The right operand of each operator
   * is parsed one level tighter, or at the same level for "^", which is what
   * makes "^" group to the right.
   */
  private static Expr parseInfix(TokenCursor cursor, int minPrecedence) {
    cursor.descend();
    try {
      Expr left = checkHeight(cursor, parseOperand(cursor));
      while(true) {
        InfixOp op = toInfixOp(cursor.peek());
        if((op == null) || (op.getPrecedence() < minPrecedence)) {
          return left;
        }
        cursor.next();
        int rightPrecedence = (op.isRightAssociative() ? op.getPrecedence() :
                               op.getPrecedence() + 1);
        Expr right = parseInfix(cursor, rightPrecedence);
        left = checkHeight(cursor, ((op instanceof CompOp) ?
                                    new ECompOp((CompOp)op, left, right) :
                                    new EBinaryOp((BinaryOp)op, left, right)));
      }
    } finally {
      cursor.ascend();
    }
  }

  /**
   * Parses a single operand: an optionally signed primary expression
   * followed by any number of call argument lists.
   */
  private static Expr parseOperand(TokenCursor cursor) {
    Token t = cursor.next();

    UnaryOp sign = toUnaryOp(t);
    if(sign != null) {
      // only "^" binds tighter than a leading sign
      return new EUnaryOp(sign, parseInfix(cursor, EXPONENT));
    }

    Expr expr = parsePrimary(t, cursor);

    // lambda values may be called directly, e.g. LAMBDA(x,x+1)(2) or
    // mk(2)(10)
    while(isDelim(cursor.peek(), OPEN_PAREN)) {
      if(!expr.isInvocable()) {
        throw cursor.error("Unexpected '" + OPEN_PAREN + "'");
      }
      cursor.next();
      expr = new EInvoke(expr, parseArguments(cursor));
    }
    return expr;
  }

  private static Expr parsePrimary(Token t, TokenCursor cursor) {
    switch(t.getType()) {
    case LITERAL:
      return toLiteralExpr(t);

    case REF:
      if(isDelim(cursor.peek(), OPEN_PAREN) && isPlainWord(t)) {
        // a function whose name looks like a cell, e.g. LOG10
        return parseCall(t.getValueStr(), cursor);
      }
      return toRefExpr(t);

    case STRING:
      if(isDelim(cursor.peek(), OPEN_PAREN)) {
        return parseCall(t.getValueStr(), cursor);
      }
      return toNameExpr(t, cursor);

    case DELIM:
      if(isDelim(t, OPEN_PAREN)) {
        return parseGroup(cursor);
      }
      if(isDelim(t, OPEN_BRACE)) {
        return parseArrayLiteral(cursor);
      }
      throw cursor.error("Unexpected '" + t.getValueStr() + "'");

    case OP:
      throw cursor.error("Operator '" + t.getValueStr() +
                         "' is missing its left operand");

    default:
      throw cursor.error("Unexpected token " + t);
    }
  }

  /**
   * A cell-like word may only name a function when it has no sheet, no '$'
   * and no range part.
   */
  private static boolean isPlainWord(Token t) {
    Reference[] refs = t.getReferences();
    return ((refs.length == 1) && (refs[0].getSheetName() == null) &&
            (t.getValueStr().indexOf('$') < 0));
  }

  private static Expr toRefExpr(Token t) {
    Reference[] refs = t.getReferences();
    return ((refs.length == 1) ? new ECellRef(refs[0]) :
            new ERangeRef(refs[0], refs[1]));
  }

  private static Expr toLiteralExpr(Token t) {
    switch(t.getValueType()) {
    case NUMBER:
      return new ELiteralValue(ValueSupport.toValue((Double)t.getValue()));
    case TEXT:
      return new ELiteralValue(ValueSupport.toValue((String)t.getValue()));
    case ERROR:
      return new EConstValue(ValueSupport.toError((ErrorKind)t.getValue()),
                             t.getValueStr());
    default:
      throw new ParseException("unexpected literal type " + t.getValueType());
    }
  }

  private static Expr toNameExpr(Token t, TokenCursor cursor) {
    String name = t.getValueStr();
    if(TRUE_STR.equalsIgnoreCase(name)) {
      return TRUE_VALUE;
    }
    if(FALSE_STR.equalsIgnoreCase(name)) {
      return FALSE_VALUE;
    }
    if(!isIdentifier(name)) {
      throw new ParseException(ErrorKind.NAME, "Invalid name '" + name +
                               "' " + cursor);
    }
    return new EName(name);
  }

  /**
   * Parses a call of the given name, the cursor is on the opening paren.
   * LAMBDA and LET are special forms, other names resolve to a registered
   * function or else to a variable or named lambda at evaluation time.
   */
  private static Expr parseCall(String name, TokenCursor cursor) {
    cursor.next();
    List<Expr> args = parseArguments(cursor);

    if(LAMBDA_NAME.equalsIgnoreCase(name)) {
      return toLambdaExpr(args);
    }
    if(LET_NAME.equalsIgnoreCase(name)) {
      return toLetExpr(args);
    }

    Function func = cursor.getFunction(name);
    if(func != null) {
      return new EFunc(func, args);
    }

    if(!isIdentifier(name)) {
      throw new ParseException(ErrorKind.NAME, "Could not find function '" +
                               name + "' " + cursor);
    }
    return new ENamedCall(name, args);
  }

  /**
   * Parses a comma separated argument list up to and including the closing
   * paren.  An omitted argument becomes an empty value.
   */
  private static List<Expr> parseArguments(TokenCursor cursor) {
    List<Expr> args = new ArrayList<Expr>(3);
    if(cursor.skipDelim(CLOSE_PAREN)) {
      return args;
    }
    while(true) {
      Token t = cursor.peek();
      args.add((isDelim(t, ARG_SEP) || isDelim(t, CLOSE_PAREN)) ? EMPTY_ARG :
               parseInfix(cursor, COMPARISON));
      if(cursor.skipDelim(CLOSE_PAREN)) {
        return args;
      }
      if(!cursor.skipDelim(ARG_SEP)) {
        throw cursor.error("Expected '" + ARG_SEP + "' or '" + CLOSE_PAREN +
                           "'");
      }
    }
  }

  /**
   * Parses "(expr)" or a union of areas "(A1:A2,B5)", the cursor is just
   * past the opening paren.
   */
  private static Expr parseGroup(TokenCursor cursor) {
    if(isDelim(cursor.peek(), CLOSE_PAREN)) {
      throw cursor.error("Empty parentheses");
    }
    List<Expr> exprs = parseArguments(cursor);
    return ((exprs.size() == 1) ? new EParen(exprs.get(0)) :
            new EUnion(exprs));
  }

  /**
   * Parses "{1,2;3,4}", the cursor is just past the opening brace.
   */
  private static Expr parseArrayLiteral(TokenCursor cursor) {
    List<List<Expr>> rows = new ArrayList<List<Expr>>();
    List<Expr> curRow = new ArrayList<Expr>();
    while(true) {
      Token t = cursor.peek();
      if(isDelim(t, ARG_SEP) || isDelim(t, ROW_SEP) ||
         isDelim(t, CLOSE_BRACE)) {
        throw cursor.error("Missing array element");
      }
      curRow.add(parseInfix(cursor, COMPARISON));

      if(cursor.skipDelim(CLOSE_BRACE)) {
        rows.add(curRow);
        return new EArray(rows);
      }
      if(cursor.skipDelim(ROW_SEP)) {
        rows.add(curRow);
        curRow = new ArrayList<Expr>();
      } else if(!cursor.skipDelim(ARG_SEP)) {
        throw cursor.error("Expected '" + ARG_SEP + "', '" + ROW_SEP +
                           "' or '" + CLOSE_BRACE + "'");
      }
    }
  }

  private static Expr toLambdaExpr(List<Expr> params) {
    if(params.isEmpty()) {
      return new EInvalid(LAMBDA_NAME, params);
    }
    List<String> names = new ArrayList<String>();
    Set<String> seen = new HashSet<String>();
    for(Expr param : params.subList(0, params.size() - 1)) {
      String name = param.getIdentifier();
      if((name == null) || !seen.add(name.toUpperCase())) {
        return new EInvalid(LAMBDA_NAME, params);
      }
      names.add(name);
    }
    return new ELambdaDef(names, params.get(params.size() - 1));
  }

  private static Expr toLetExpr(List<Expr> params) {
    if((params.size() < 3) || ((params.size() % 2) == 0)) {
      return new EInvalid(LET_NAME, params);
    }
    List<String> names = new ArrayList<String>();
    List<Expr> values = new ArrayList<Expr>();
    for(int i = 0; i < (params.size() - 1); i += 2) {
      String name = params.get(i).getIdentifier();
      if(name == null) {
        return new EInvalid(LET_NAME, params);
      }
      names.add(name);
      values.add(params.get(i + 1));
    }
    return new ELet(names, values, params.get(params.size() - 1));
  }

  private static Expr checkHeight(TokenCursor cursor, Expr expr) {
    if(expr.getHeight() > MAX_EXPRESSION_HEIGHT) {
      throw cursor.error("Expression is more than " + MAX_EXPRESSION_HEIGHT +
                         " levels deep");
    }
    return expr;
  }

  private static InfixOp toInfixOp(Token t) {
    if((t == null) || (t.getType() != TokenType.OP)) {
      return null;
    }
    String symbol = t.getValueStr();
    for(CompOp op : CompOp.values()) {
      if(op.toString().equals(symbol)) {
        return op;
      }
    }
    for(BinaryOp op : BinaryOp.values()) {
      if(op.toString().equals(symbol)) {
        return op;
      }
    }
    return null;
  }

  private static UnaryOp toUnaryOp(Token t) {
    if(t.getType() == TokenType.OP) {
      for(UnaryOp op : UnaryOp.values()) {
        if(op.toString().equals(t.getValueStr())) {
          return op;
        }
      }
    }
    return null;
  }

  private static boolean isDelim(Token t, String delim) {
    return ((t != null) && (t.getType() == TokenType.DELIM) &&
            delim.equals(t.getValueStr()));
  }

  /**
   * Read position within the tokens of one formula, plus the current depth
   * of the recursive descent.
   */
  private static final class TokenCursor
  {
    private final String _formulaStr;
    private final List<Token> _tokens;
    private final FunctionLookup _lookup;
    private int _pos;
    private int _depth;

    private TokenCursor(String formulaStr, List<Token> tokens,
                        FunctionLookup lookup) {
      _formulaStr = formulaStr;
      _tokens = tokens;
      _lookup = lookup;
    }

    public boolean hasNext() {
      return (_pos < _tokens.size());
    }

    /**
     * @return the next token without consuming it, {@code null} at the end
     */
    public Token peek() {
      return (hasNext() ? _tokens.get(_pos) : null);
    }

    public Token next() {
      if(!hasNext()) {
        throw error("Unexpected end of formula");
      }
      return _tokens.get(_pos++);
    }

    /**
     * Consumes the next token if it is the given delimiter.
     */
    public boolean skipDelim(String delim) {
      if(isDelim(peek(), delim)) {
        ++_pos;
        return true;
      }
      return false;
    }

    public void descend() {
      if(++_depth > MAX_NESTING_DEPTH) {
        throw error("Formula is nested more than " + MAX_NESTING_DEPTH +
                    " levels deep");
      }
    }

    public void ascend() {
      --_depth;
    }

    public Function getFunction(String name) {
      return ((_lookup != null) ? _lookup.getFunction(name) : null);
    }

    public ParseException error(String msg) {
      return new ParseException(msg + " " + this);
    }

    @Override
    public String toString() {
      return "at token " + _pos + " of '" + StringUtils.abbreviate(
          _formulaStr, 200) + "'";
    }
  }

  private static void exprListToString(
      List<Expr> exprs, String sep, StringBuilder sb, boolean isDebug) {
    for(int i = 0; i < exprs.size(); ++i) {
      if(i > 0) {
        sb.append(sep);
      }
      exprs.get(i).toString(sb, isDebug);
    }
  }

  private static FormulaValue[] evalAll(List<Expr> exprs, FormulaContext ctx) {
    FormulaValue[] vals = new FormulaValue[exprs.size()];
    for(int i = 0; i < vals.length; ++i) {
      vals[i] = exprs.get(i).eval(ctx);
    }
    return vals;
  }

  /**
   * Wraps each expression for evaluation on demand, used for the arguments
   * of lazy functions like IF.
   */
  private static FormulaValue[] deferAll(List<Expr> exprs,
                                         FormulaContext ctx) {
    FormulaValue[] vals = new FormulaValue[exprs.size()];
    for(int i = 0; i < vals.length; ++i) {
      vals[i] = new DelayedValue(exprs.get(i), ctx);
    }
    return vals;
  }

  private static boolean areConstant(List<Expr> exprs) {
    for(Expr expr : exprs) {
      if(!expr.isConstant()) {
        return false;
      }
    }
    return true;
  }

  private static int heightOf(List<Expr> exprs) {
    int max = 0;
    for(Expr expr : exprs) {
      max = Math.max(max, expr.getHeight());
    }
    return max + 1;
  }

  private static int arrayHeight(List<List<Expr>> rows) {
    int max = 1;
    for(List<Expr> row : rows) {
      max = Math.max(max, heightOf(row));
    }
    return max;
  }

  private static void appendQuoted(String str, StringBuilder sb) {
    sb.append('"').append(StringUtils.replace(str, "\"", "\"\"")).append('"');
  }

  private static FormulaValue invokeLambda(FormulaValue target,
                                           FormulaContext ctx,
                                           FormulaValue[] args) {
    target = BaseDelayedValue.resolve(target);
    if(target.isError()) {
      return target;
    }
    if(!(target instanceof LambdaFunction)) {
      return ValueSupport.VALUE_ERR_VAL;
    }
    return ((LambdaFunction)target).invoke(ctx, args);
  }

  /**
   * @return the cell value for the given reference, {@code #REF!} if it
   *         resolves outside of the sheet
   */
  private static FormulaValue getCellValue(
      FormulaContext ctx, Reference ref, int row, int col) {
    CellAccessor accessor = ctx.getCellAccessor();
    if(!isValidCell(accessor, row, col)) {
      return ValueSupport.toError(ErrorKind.REF);
    }
    CellAddress addr = new CellAddress(row, col);
    return ValueSupport.toCellValue(
        ((ref.getSheetName() != null) ?
         accessor.getCellValue(ref.getSheetName(), addr) :
         accessor.getCellValue(addr)));
  }

  private static boolean isValidCell(CellAccessor accessor, int row, int col) {
    return ((row >= 1) && (col >= 1) && (row <= accessor.getRowCount()) &&
            (col <= accessor.getColumnCount()));
  }

  private static int resolveRow(FormulaContext ctx, Reference ref) {
    CellAddress anchor = ctx.getAnchorCell();
    CellAddress target = ctx.getCurrentCell();
    if((anchor == null) || (target == null)) {
      return ref.getRow();
    }
    return ReferenceResolver.resolveRow(ref, anchor, target);
  }

  private static int resolveColumn(FormulaContext ctx, Reference ref) {
    CellAddress anchor = ctx.getAnchorCell();
    CellAddress target = ctx.getCurrentCell();
    if((anchor == null) || (target == null)) {
      return ref.getColumn();
    }
    return ReferenceResolver.resolveColumn(ref, anchor, target);
  }

  private static final class DelayedValue extends BaseDelayedValue
  {
    private final Expr _expr;
    private final FormulaContext _ctx;

    private DelayedValue(Expr expr, FormulaContext ctx) {
      _expr = expr;
      _ctx = ctx;
    }

    @Override
    public FormulaValue eval() {
      try {
        return BaseDelayedValue.resolve(_expr.eval(_ctx));
      } catch(EvalException e) {
        return ValueSupport.toError(e.getErrorKind());
      }
    }
  }

  /**
   * Node of the parsed expression tree.  Nodes are immutable once built, the
   * height is fixed at construction so that parsing can bound it without
   * walking the tree.
   */
  private static abstract class Expr
  {
    private final int _height;

    protected Expr() {
      this(1);
    }

    protected Expr(int height) {
      _height = height;
    }

    public int getHeight() {
      return _height;
    }

    public String toCleanString() {
      return toString(new StringBuilder(), false).toString();
    }

    public String toDebugString() {
      return toString(new StringBuilder(), true).toString();
    }

    protected StringBuilder toString(StringBuilder sb, boolean isDebug) {
      if(!isDebug) {
        toExprString(sb, false);
        return sb;
      }
      sb.append('<').append(getClass().getSimpleName()).append(">{");
      toExprString(sb, true);
      return sb.append('}');
    }

    /**
     * @return {@code true} if the value of this expression may be invoked as
     *         a lambda, e.g. {@code LAMBDA(x,x+1)(2)}
     */
    protected boolean isInvocable() {
      return false;
    }

    /**
     * @return the name if this expression is a plain identifier,
     *         {@code null} otherwise
     */
    protected String getIdentifier() {
      return null;
    }

    public abstract boolean isConstant();

    public abstract FormulaValue eval(FormulaContext ctx);

    public abstract void collectReferences(List<Reference> refs);

    protected abstract void toExprString(StringBuilder sb, boolean isDebug);
  }

  private static final class EConstValue extends Expr
  {
    private final FormulaValue _val;
    private final String _str;

    private EConstValue(FormulaValue val, String str) {
      _val = val;
      _str = str;
    }

    @Override
    public boolean isConstant() {
      return true;
    }

    @Override
    public FormulaValue eval(FormulaContext ctx) {
      return _val;
    }

    @Override
    public void collectReferences(List<Reference> refs) {
      // none
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      sb.append(_str);
    }
  }

  private static final class ELiteralValue extends Expr
  {
    private final FormulaValue _val;

    private ELiteralValue(FormulaValue val) {
      _val = val;
    }

    @Override
    public boolean isConstant() {
      return true;
    }

    @Override
    public FormulaValue eval(FormulaContext ctx) {
      return _val;
    }

    @Override
    public void collectReferences(List<Reference> refs) {
      // none
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      if(_val.getType() == FormulaValue.Type.TEXT) {
        appendQuoted(_val.getAsString(), sb);
      } else {
        sb.append(_val.getAsString());
      }
    }
  }

  private static final class ECellRef extends Expr
  {
    private final Reference _ref;

    private ECellRef(Reference ref) {
      _ref = ref;
    }

    @Override
    public boolean isConstant() {
      return false;
    }

    @Override
    public FormulaValue eval(FormulaContext ctx) {
      return getCellValue(ctx, _ref, resolveRow(ctx, _ref),
                          resolveColumn(ctx, _ref));
    }

    @Override
    public void collectReferences(List<Reference> refs) {
      refs.add(_ref);
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      sb.append(_ref);
    }
  }

  private static final class ERangeRef extends Expr
  {
    private final Reference _from;
    private final Reference _to;

    private ERangeRef(Reference from, Reference to) {
      _from = from;
      _to = to;
    }

    @Override
    public boolean isConstant() {
      return false;
    }

    @Override
    public FormulaValue eval(FormulaContext ctx) {
      int row1 = resolveRow(ctx, _from);
      int col1 = resolveColumn(ctx, _from);
      int row2 = resolveRow(ctx, _to);
      int col2 = resolveColumn(ctx, _to);

      int minRow = Math.min(row1, row2);
      int maxRow = Math.max(row1, row2);
      int minCol = Math.min(col1, col2);
      int maxCol = Math.max(col1, col2);

      CellAccessor accessor = ctx.getCellAccessor();
      if(!isValidCell(accessor, minRow, minCol) ||
         !isValidCell(accessor, maxRow, maxCol)) {
        return ValueSupport.toError(ErrorKind.REF);
      }

      long numRows = (maxRow - minRow) + 1L;
      long numCols = (maxCol - minCol) + 1L;
      if((numRows * numCols) > ctx.getEvalConfig().getMaxArrayCells()) {
        return ValueSupport.NUM_ERR_VAL;
      }

      FormulaValue[][] rows = new FormulaValue[(int)numRows][(int)numCols];
      for(int i = 0; i < numRows; ++i) {
        for(int j = 0; j < numCols; ++j) {
          rows[i][j] = getCellValue(ctx, _from, minRow + i, minCol + j);
        }
      }
      return ValueSupport.toArray(rows);
    }

    @Override
    public void collectReferences(List<Reference> refs) {
      refs.add(_from);
      refs.add(_to);
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      sb.append(_from).append(":");
      // the sheet prefix is only written once
      sb.append(new Reference(_to.getColumn(), _to.getRow(),
                              _to.isColumnAbsolute(), _to.isRowAbsolute()));
    }
  }

  private static final class EName extends Expr
  {
    private final String _name;

    private EName(String name) {
      _name = name;
    }

    @Override
    protected String getIdentifier() {
      return _name;
    }

    @Override
    protected boolean isInvocable() {
      return true;
    }

    @Override
    public boolean isConstant() {
      return false;
    }

    @Override
    public FormulaValue eval(FormulaContext ctx) {
      FormulaValue val = ctx.getVariable(_name);
      if(val != null) {
        return val;
      }
      LambdaFunction lambda = ctx.getNamedLambdas().getNamedLambda(_name);
      if(lambda != null) {
        return lambda;
      }
      return ValueSupport.toError(ErrorKind.NAME);
    }

    @Override
    public void collectReferences(List<Reference> refs) {
      // none
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      sb.append(_name);
    }
  }

  private static class EParen extends Expr
  {
    private final Expr _expr;

    private EParen(Expr expr) {
      super(expr.getHeight() + 1);
      _expr = expr;
    }

    @Override
    public boolean isConstant() {
      return _expr.isConstant();
    }

    @Override
    protected boolean isInvocable() {
      return true;
    }

    @Override
    public FormulaValue eval(FormulaContext ctx) {
      return _expr.eval(ctx);
    }

    @Override
    public void collectReferences(List<Reference> refs) {
      _expr.collectReferences(refs);
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      sb.append("(");
      _expr.toString(sb, isDebug);
      sb.append(")");
    }
  }

  private static class EUnion extends Expr
  {
    private final List<Expr> _exprs;

    private EUnion(List<Expr> exprs) {
      super(heightOf(exprs));
      _exprs = exprs;
    }

    @Override
    public boolean isConstant() {
      return areConstant(_exprs);
    }

    @Override
    public FormulaValue eval(FormulaContext ctx) {
      List<FormulaValue> vals = new ArrayList<FormulaValue>(_exprs.size());
      for(Expr expr : _exprs) {
        vals.add(expr.eval(ctx));
      }
      return ValueSupport.toArray1D(vals);
    }

    @Override
    public void collectReferences(List<Reference> refs) {
      for(Expr expr : _exprs) {
        expr.collectReferences(refs);
      }
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      sb.append("(");
      exprListToString(_exprs, ",", sb, isDebug);
      sb.append(")");
    }
  }

  private static class EArray extends Expr
  {
    private final List<List<Expr>> _rows;

    private EArray(List<List<Expr>> rows) {
      super(arrayHeight(rows));
      int numCols = rows.get(0).size();
      for(List<Expr> row : rows) {
        if(row.size() != numCols) {
          throw new ParseException("Array literal rows have different sizes");
        }
      }
      _rows = rows;
    }

    @Override
    public boolean isConstant() {
      for(List<Expr> row : _rows) {
        if(!areConstant(row)) {
          return false;
        }
      }
      return true;
    }

    @Override
    public FormulaValue eval(FormulaContext ctx) {
      FormulaValue[][] rows = new FormulaValue[_rows.size()][];
      for(int i = 0; i < rows.length; ++i) {
        List<Expr> row = _rows.get(i);
        rows[i] = new FormulaValue[row.size()];
        for(int j = 0; j < rows[i].length; ++j) {
          FormulaValue val = ValueSupport.unwrapSingle(row.get(j).eval(ctx));
          rows[i][j] = (val.getType().isScalar() || val.isError() ? val :
                        ValueSupport.VALUE_ERR_VAL);
        }
      }
      return ValueSupport.toArray(rows);
    }

    @Override
    public void collectReferences(List<Reference> refs) {
      for(List<Expr> row : _rows) {
        for(Expr expr : row) {
          expr.collectReferences(refs);
        }
      }
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      sb.append("{");
      for(int i = 0; i < _rows.size(); ++i) {
        if(i > 0) {
          sb.append(";");
        }
        exprListToString(_rows.get(i), ",", sb, isDebug);
      }
      sb.append("}");
    }
  }

  private static class EFunc extends Expr
  {
    private final Function _func;
    private final List<Expr> _params;

    private EFunc(Function func, List<Expr> params) {
      super(heightOf(params));
      _func = func;
      _params = params;
    }

    @Override
    public boolean isConstant() {
      return _func.isPure() && areConstant(_params);
    }

    @Override
    protected boolean isInvocable() {
      return true;
    }

    @Override
    public FormulaValue eval(FormulaContext ctx) {
      FormulaValue[] paramVals = (_func.isLazy() ?
                                  deferAll(_params, ctx) :
                                  evalAll(_params, ctx));
      try {
        return BaseDelayedValue.resolve(_func.eval(ctx, paramVals));
      } catch(EvalException e) {
        // registered functions may not handle their own failures
        return ValueSupport.toError(e.getErrorKind());
      }
    }

    @Override
    public void collectReferences(List<Reference> refs) {
      for(Expr param : _params) {
        param.collectReferences(refs);
      }
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      sb.append(_func.getName()).append("(");
      exprListToString(_params, ",", sb, isDebug);
      sb.append(")");
    }
  }

  /**
   * Call of a name which is not a built-in function: a LET/LAMBDA variable
   * holding a lambda, or a named lambda.
   */
  private static class ENamedCall extends Expr
  {
    private final String _name;
    private final List<Expr> _params;

    private ENamedCall(String name, List<Expr> params) {
      super(heightOf(params));
      _name = name;
      _params = params;
    }

    @Override
    public boolean isConstant() {
      return false;
    }

    @Override
    protected boolean isInvocable() {
      return true;
    }

    @Override
    public FormulaValue eval(FormulaContext ctx) {
      FormulaValue target = ctx.getVariable(_name);
      if(target == null) {
        target = ctx.getNamedLambdas().getNamedLambda(_name);
        if(target == null) {
          return ValueSupport.toError(ErrorKind.NAME);
        }
      }
      return invokeLambda(target, ctx, evalAll(_params, ctx));
    }

    @Override
    public void collectReferences(List<Reference> refs) {
      for(Expr param : _params) {
        param.collectReferences(refs);
      }
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      sb.append(_name).append("(");
      exprListToString(_params, ",", sb, isDebug);
      sb.append(")");
    }
  }

  private static class EInvoke extends Expr
  {
    private final Expr _target;
    private final List<Expr> _params;

    private EInvoke(Expr target, List<Expr> params) {
      super(Math.max(target.getHeight(), heightOf(params)) + 1);
      _target = target;
      _params = params;
    }

    @Override
    public boolean isConstant() {
      return false;
    }

    @Override
    protected boolean isInvocable() {
      return true;
    }

    @Override
    public FormulaValue eval(FormulaContext ctx) {
      FormulaValue target = _target.eval(ctx);
      return invokeLambda(target, ctx, evalAll(_params, ctx));
    }

    @Override
    public void collectReferences(List<Reference> refs) {
      _target.collectReferences(refs);
      for(Expr param : _params) {
        param.collectReferences(refs);
      }
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      _target.toString(sb, isDebug);
      sb.append("(");
      exprListToString(_params, ",", sb, isDebug);
      sb.append(")");
    }
  }

  private static class ELambdaDef extends Expr
  {
    private final List<String> _paramNames;
    private final Expr _body;

    private ELambdaDef(List<String> paramNames, Expr body) {
      super(body.getHeight() + 1);
      _paramNames = Collections.unmodifiableList(paramNames);
      _body = body;
    }

    @Override
    public boolean isConstant() {
      return false;
    }

    @Override
    protected boolean isInvocable() {
      return true;
    }

    @Override
    public FormulaValue eval(FormulaContext ctx) {
      // the body is evaluated on invocation, against a snapshot of the
      // current variables
      return new LambdaValue(this, ctx.getLambdaContext());
    }

    @Override
    public void collectReferences(List<Reference> refs) {
      _body.collectReferences(refs);
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      sb.append(LAMBDA_NAME).append("(");
      for(String name : _paramNames) {
        sb.append(name).append(",");
      }
      _body.toString(sb, isDebug);
      sb.append(")");
    }
  }

  private static class ELet extends Expr
  {
    private final List<String> _names;
    private final List<Expr> _values;
    private final Expr _body;

    private ELet(List<String> names, List<Expr> values, Expr body) {
      super(Math.max(heightOf(values), body.getHeight() + 1));
      _names = names;
      _values = values;
      _body = body;
    }

    @Override
    public boolean isConstant() {
      return false;
    }

    @Override
    public FormulaValue eval(FormulaContext ctx) {
      FormulaContext letCtx = ctx;
      for(int i = 0; i < _names.size(); ++i) {
        FormulaValue val = BaseDelayedValue.resolve(_values.get(i).eval(letCtx));
        letCtx = letCtx.withVariables(
            Collections.singletonMap(_names.get(i), val));
      }
      return _body.eval(letCtx);
    }

    @Override
    public void collectReferences(List<Reference> refs) {
      for(Expr value : _values) {
        value.collectReferences(refs);
      }
      _body.collectReferences(refs);
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      sb.append(LET_NAME).append("(");
      for(int i = 0; i < _names.size(); ++i) {
        sb.append(_names.get(i)).append(",");
        _values.get(i).toString(sb, isDebug);
        sb.append(",");
      }
      _body.toString(sb, isDebug);
      sb.append(")");
    }
  }

  /**
   * A syntactically valid but malformed special form (e.g. a LAMBDA with a
   * duplicate parameter), which evaluates to {@code #VALUE!}.
   */
  private static class EInvalid extends Expr
  {
    private final String _name;
    private final List<Expr> _params;

    private EInvalid(String name, List<Expr> params) {
      super(heightOf(params));
      _name = name;
      _params = params;
    }

    @Override
    public boolean isConstant() {
      return true;
    }

    @Override
    public FormulaValue eval(FormulaContext ctx) {
      return ValueSupport.VALUE_ERR_VAL;
    }

    @Override
    public void collectReferences(List<Reference> refs) {
      for(Expr param : _params) {
        param.collectReferences(refs);
      }
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      sb.append(_name).append("(");
      exprListToString(_params, ",", sb, isDebug);
      sb.append(")");
    }
  }

  private static abstract class EInfixOp extends Expr
  {
    private final InfixOp _op;
    private final Expr _left;
    private final Expr _right;

    private EInfixOp(InfixOp op, Expr left, Expr right) {
      super(Math.max(left.getHeight(), right.getHeight()) + 1);
      _op = op;
      _left = left;
      _right = right;
    }

    @Override
    public boolean isConstant() {
      return (_left.isConstant() && _right.isConstant());
    }

    @Override
    public FormulaValue eval(FormulaContext ctx) {
      return _op.eval(_left.eval(ctx), _right.eval(ctx));
    }

    @Override
    public void collectReferences(List<Reference> refs) {
      _left.collectReferences(refs);
      _right.collectReferences(refs);
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      _left.toString(sb, isDebug);
      sb.append(' ').append(_op).append(' ');
      _right.toString(sb, isDebug);
    }
  }

  private static final class EBinaryOp extends EInfixOp
  {
    private EBinaryOp(BinaryOp op, Expr left, Expr right) {
      super(op, left, right);
    }
  }

  private static final class ECompOp extends EInfixOp
  {
    private ECompOp(CompOp op, Expr left, Expr right) {
      super(op, left, right);
    }
  }

  private static final class EUnaryOp extends Expr
  {
    private final UnaryOp _op;
    private final Expr _operand;

    private EUnaryOp(UnaryOp op, Expr operand) {
      super(operand.getHeight() + 1);
      _op = op;
      _operand = operand;
    }

    @Override
    public boolean isConstant() {
      return _operand.isConstant();
    }

    @Override
    public FormulaValue eval(FormulaContext ctx) {
      return _op.eval(_operand.eval(ctx));
    }

    @Override
    public void collectReferences(List<Reference> refs) {
      _operand.collectReferences(refs);
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      sb.append(_op);
      if(isDebug) {
        sb.append(' ');
      }
      _operand.toString(sb, isDebug);
    }
  }

  /**
   * A closure: the lambda definition plus the variables visible where it was
   * evaluated.
   */
  private static final class LambdaValue extends BaseValue
    implements LambdaFunction
  {
    private final ELambdaDef _def;
    private final Map<String,FormulaValue> _captured;

    private LambdaValue(ELambdaDef def, Map<String,FormulaValue> captured) {
      _def = def;
      _captured = captured;
    }

    @Override
    public Type getType() {
      return Type.LAMBDA;
    }

    @Override
    public Object get() {
      return this;
    }

    @Override
    public List<String> getParameters() {
      return _def._paramNames;
    }

    @Override
    public Map<String,FormulaValue> getCapturedContext() {
      return _captured;
    }

    @Override
    public String getBodyString() {
      return _def._body.toCleanString();
    }

    @Override
    public FormulaValue invoke(FormulaContext ctx, FormulaValue... args) {
      List<String> paramNames = _def._paramNames;
      if(args.length != paramNames.size()) {
        return ValueSupport.VALUE_ERR_VAL;
      }

      Map<String,FormulaValue> params =
        new LinkedHashMap<String,FormulaValue>();
      for(int i = 0; i < args.length; ++i) {
        params.put(paramNames.get(i), BaseDelayedValue.resolve(args[i]));
      }

      try {
        // throws once the configured call depth is exceeded
        final FormulaContext lambdaCtx = ctx.enterLambda(_captured, params);
        if(StackSegments.isSegmentStart(lambdaCtx.getCallDepth())) {
          return StackSegments.evalOnNewSegment(() -> evalBody(lambdaCtx));
        }
        return evalBody(lambdaCtx);
      } catch(EvalException e) {
        return ValueSupport.toError(e.getErrorKind());
      }
    }

    private FormulaValue evalBody(FormulaContext lambdaCtx) {
      return BaseDelayedValue.resolve(_def._body.eval(lambdaCtx));
    }

    @Override
    public String toString() {
      return _def.toCleanString();
    }
  }

  /**
   * Compiled formula for an expression tree.
   */
  private static class ExprWrapper implements CompiledFormula
  {
    private final String _rawFormulaStr;
    private final Expr _expr;
    private final List<Reference> _refs;

    private ExprWrapper(String rawFormulaStr, Expr expr,
                        List<Reference> refs) {
      _rawFormulaStr = rawFormulaStr;
      _expr = expr;
      _refs = refs;
    }

    @Override
    public FormulaValue eval(FormulaContext ctx) {
      try {
        return BaseDelayedValue.resolve(_expr.eval(ctx));
      } catch(EvalException e) {
        if(LOG.isDebugEnabled()) {
          LOG.debug("Formula '" + _rawFormulaStr + "' evaluated to " +
                    e.getErrorKind() + ": " + e.getMessage());
        }
        return ValueSupport.toError(e.getErrorKind());
      } catch(StackOverflowError e) {
        // lambda recursion runs on stack segments, so only a caller with a
        // very small thread stack gets here
        LOG.warn("Formula '" + _rawFormulaStr + "' exhausted the stack of " +
                 Thread.currentThread().getName());
        return ValueSupport.VALUE_ERR_VAL;
      }
    }

    @Override
    public List<Reference> getReferences() {
      return _refs;
    }

    @Override
    public ErrorKind getParseError() {
      return null;
    }

    @Override
    public String toDebugString() {
      return _expr.toDebugString();
    }

    @Override
    public String toRawString() {
      return _rawFormulaStr;
    }

    @Override
    public String toCleanString() {
      return _expr.toCleanString();
    }

    @Override
    public boolean isConstant() {
      return _expr.isConstant();
    }

    @Override
    public String toString() {
      return toRawString();
    }
  }

  /**
   * Compiled formula for an expression without references or volatile
   * calls, evaluated at most once.
   */
  private static final class MemoizedExprWrapper extends ExprWrapper
  {
    private volatile FormulaValue _val;

    private MemoizedExprWrapper(String rawFormulaStr, Expr expr,
                                List<Reference> refs) {
      super(rawFormulaStr, expr, refs);
    }

    @Override
    public FormulaValue eval(FormulaContext ctx) {
      FormulaValue val = _val;
      if(val == null) {
        val = super.eval(ctx);
        _val = val;
      }
      return val;
    }
  }

  /**
   * Compiled formula for text which could not be parsed.
   */
  private static final class ErrorExprWrapper implements CompiledFormula
  {
    private final String _rawFormulaStr;
    private final ErrorKind _errorKind;

    private ErrorExprWrapper(String rawFormulaStr, ErrorKind errorKind) {
      _rawFormulaStr = rawFormulaStr;
      _errorKind = errorKind;
    }

    @Override
    public FormulaValue eval(FormulaContext ctx) {
      return ValueSupport.toError(_errorKind);
    }

    @Override
    public List<Reference> getReferences() {
      return Collections.emptyList();
    }

    @Override
    public ErrorKind getParseError() {
      return _errorKind;
    }

    @Override
    public String toDebugString() {
      return "<ParseError>{" + _errorKind + "}";
    }

    @Override
    public String toRawString() {
      return _rawFormulaStr;
    }

    @Override
    public String toCleanString() {
      return _errorKind.getLiteral();
    }

    @Override
    public boolean isConstant() {
      return true;
    }

    @Override
    public String toString() {
      return toRawString();
    }
  }
}
