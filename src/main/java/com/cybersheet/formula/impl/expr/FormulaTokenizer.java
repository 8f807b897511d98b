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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.cybersheet.formula.expr.CellAddress;
import com.cybersheet.formula.expr.ErrorKind;
import com.cybersheet.formula.expr.FormulaValue;
import com.cybersheet.formula.expr.ParseException;
import com.cybersheet.formula.expr.Reference;
import org.apache.commons.lang3.StringUtils;


/**
 * Splits formula text into tokens.  Cell and range references (with an
 * optional sheet prefix) are recognized here, so the parser sees them as
 * single tokens.
 */
class FormulaTokenizer
{
  private static final int EOF = -1;
  static final char QUOTED_STR_CHAR = '"';
  static final char SHEET_QUOTE_CHAR = '\'';
  private static final char ERROR_LIT_START_CHAR = '#';
  private static final char SHEET_SEP_CHAR = '!';
  private static final char DECIMAL_SEP_CHAR = '.';

  private static final byte IS_OP_FLAG =     0x01;
  private static final byte IS_COMP_FLAG =   0x02;
  private static final byte IS_DELIM_FLAG =  0x04;
  private static final byte IS_SPACE_FLAG =  0x08;
  private static final byte IS_QUOTE_FLAG =  0x10;

  enum TokenType {
    REF, LITERAL, OP, DELIM, STRING, SPACE;
  }

  private static final byte[] CHAR_FLAGS = new byte[128];
  private static final Set<String> TWO_CHAR_COMP_OPS = new HashSet<String>(
      Arrays.asList("<=", ">=", "<>"));

  private static final String CELL_REGEX = "(\\$?)([A-Za-z]{1,3})(\\$?)([0-9]{1,7})";
  private static final Pattern CELL_PAT = Pattern.compile(CELL_REGEX);
  private static final Pattern REF_PAT = Pattern.compile(
      "(?:([A-Za-z_][\\w.]*)!)?(" + CELL_REGEX + ")(?::(" + CELL_REGEX + "))?");

  static {
    setCharFlag(IS_OP_FLAG, '+', '-', '*', '/', '^', '&');
    setCharFlag(IS_COMP_FLAG, '<', '>', '=');
    setCharFlag(IS_DELIM_FLAG, ',', ';', '(', ')', '{', '}');
    setCharFlag(IS_SPACE_FLAG, ' ', '\n', '\r', '\t');
    setCharFlag(IS_QUOTE_FLAG, '"', '\'', '#');
  }

  private FormulaTokenizer() {}

  /**
   * Tokenizes a formula string.  A single leading '=' is dropped.
   *
   * @return the tokens, or {@code null} if the formula is empty
   */
  static List<Token> tokenize(String formulaStr) {

    formulaStr = StringUtils.trimToNull(formulaStr);
    if((formulaStr != null) && (formulaStr.charAt(0) == '=')) {
      formulaStr = StringUtils.trimToNull(formulaStr.substring(1));
    }

    if(formulaStr == null) {
      return null;
    }

    List<Token> tokens = new ArrayList<Token>();

    ExprBuf buf = new ExprBuf(formulaStr);

    while(buf.hasNext()) {
      char c = buf.next();

      byte charFlag = getCharFlag(c);
      if(charFlag != 0) {

        // what could it be?
        switch(charFlag) {
        case IS_OP_FLAG:

          // all simple operator chars are single character operators
          tokens.add(new Token(TokenType.OP, String.valueOf(c)));
          break;

        case IS_COMP_FLAG:

          tokens.add(new Token(TokenType.OP, parseCompOp(c, buf)));
          break;

        case IS_DELIM_FLAG:

          // all delimiter chars are single character symbols
          tokens.add(new Token(TokenType.DELIM, String.valueOf(c)));
          break;

        case IS_SPACE_FLAG:

          // normalize whitespace into single space
          consumeWhitespace(buf);
          tokens.add(new Token(TokenType.SPACE, " "));
          break;

        case IS_QUOTE_FLAG:

          switch(c) {
          case QUOTED_STR_CHAR:
            String str = parseStringUntil(buf, QUOTED_STR_CHAR);
            tokens.add(new Token(TokenType.LITERAL, str, str,
                                 FormulaValue.Type.TEXT));
            break;
          case SHEET_QUOTE_CHAR:
            tokens.add(parseQuotedSheetRef(buf));
            break;
          case ERROR_LIT_START_CHAR:
            tokens.add(parseErrorLiteral(buf));
            break;
          default:
            throw new ParseException(
                "Invalid leading quote character " + c + " " + buf);
          }

          break;

        default:
          throw new RuntimeException("unknown char flag " + charFlag);
        }

      } else {

        if(isDigit(c) || (c == DECIMAL_SEP_CHAR)) {
          Token numLit = maybeParseNumberLiteral(c, buf);
          if(numLit != null) {
            tokens.add(numLit);
            continue;
          }
        }

        // standalone word of some sort
        String word = parseBareString(c, buf);
        Token refTok = maybeParseReference(null, word);
        tokens.add((refTok != null) ? refTok :
                   new Token(TokenType.STRING, word));
      }

    }

    return tokens;
  }

  private static byte getCharFlag(char c) {
    return ((c < 128) ? CHAR_FLAGS[c] : 0);
  }

  private static boolean isSpecialChar(char c) {
    return (getCharFlag(c) != 0);
  }

  private static String parseCompOp(char firstChar, ExprBuf buf) {
    String opStr = String.valueOf(firstChar);

    int c = buf.peekNext();
    if((c != EOF) && hasFlag(getCharFlag((char)c), IS_COMP_FLAG)) {

      // is the combo a valid comparison operator?
      String tmpStr = opStr + (char)c;
      if(TWO_CHAR_COMP_OPS.contains(tmpStr)) {
        opStr = tmpStr;
        buf.next();
      }
    }

    return opStr;
  }

  private static void consumeWhitespace(ExprBuf buf) {
    int c = EOF;
    while(((c = buf.peekNext()) != EOF) &&
          hasFlag(getCharFlag((char)c), IS_SPACE_FLAG)) {
        buf.next();
    }
  }

  private static String parseBareString(char firstChar, ExprBuf buf) {
    StringBuilder sb = buf.getScratchBuffer().append(firstChar);

    byte stopFlags = (IS_OP_FLAG | IS_COMP_FLAG | IS_DELIM_FLAG |
                      IS_SPACE_FLAG | IS_QUOTE_FLAG);

    while(buf.hasNext()) {
      char c = buf.next();
      byte charFlag = getCharFlag(c);
      if(hasFlag(charFlag, stopFlags)) {
        buf.popPrev();
        break;
      }
      sb.append(c);
    }

    return sb.toString();
  }

  static String parseStringUntil(ExprBuf buf, char endChar)
  {
    StringBuilder sb = buf.getScratchBuffer();
    boolean complete = false;
    while(buf.hasNext()) {
      char c = buf.next();
      if(c == endChar) {
        if(buf.peekNext() == endChar) {
          buf.next();
        } else {
          complete = true;
          break;
        }
      }

      sb.append(c);
    }

    if(!complete) {
      throw new ParseException("Missing closing '" + endChar +
                               "' for quoted string " + buf);
    }

    return sb.toString();
  }

  private static Token parseQuotedSheetRef(ExprBuf buf) {
    String sheetName = parseStringUntil(buf, SHEET_QUOTE_CHAR);
    if(buf.peekNext() != SHEET_SEP_CHAR) {
      throw new ParseException("Expected '" + SHEET_SEP_CHAR +
                               "' after sheet name " + buf);
    }
    buf.next();
    if(!buf.hasNext()) {
      throw new ParseException("Missing reference after sheet name " + buf);
    }
    String word = parseBareString(buf.next(), buf);
    Token refTok = maybeParseReference(sheetName, word);
    if(refTok == null) {
      throw new ParseException(ErrorKind.NAME, "Invalid reference '" +
                               sheetName + "'!" + word + " " + buf);
    }
    return refTok;
  }

  private static Token parseErrorLiteral(ExprBuf buf) {
    int startPos = buf.prevPos();
    for(ErrorKind kind : ErrorKind.values()) {
      String lit = kind.getLiteral();
      if(buf.regionMatches(startPos, lit)) {
        buf.reset(startPos + lit.length());
        return new Token(TokenType.LITERAL, kind, lit,
                         FormulaValue.Type.ERROR);
      }
    }
    throw new ParseException(ErrorKind.NAME,
                             "Invalid error literal " + buf);
  }

  /**
   * @return a REF token if the given word is a cell or range reference,
   *         {@code null} otherwise
   */
  private static Token maybeParseReference(String quotedSheetName,
                                           String word) {
    Matcher m = REF_PAT.matcher(word);
    if(!m.matches()) {
      return null;
    }

    String sheetName = quotedSheetName;
    if(m.group(1) != null) {
      if(sheetName != null) {
        return null;
      }
      sheetName = m.group(1);
    }

    Reference from = toReference(sheetName, m.group(2));
    Reference[] refs = ((m.group(7) != null) ?
                        new Reference[]{from, toReference(sheetName, m.group(7))} :
                        new Reference[]{from});
    String rawStr = ((quotedSheetName != null) ?
                     "'" + quotedSheetName.replace("'", "''") + "'!" + word :
                     word);
    return new Token(TokenType.REF, refs, rawStr, null);
  }

  private static Reference toReference(String sheetName, String cellStr) {
    Matcher m = CELL_PAT.matcher(cellStr);
    if(!m.matches()) {
      throw new IllegalStateException("Invalid cell " + cellStr);
    }
    return new Reference(sheetName, CellAddress.fromColumnLetters(m.group(2)),
                         Integer.parseInt(m.group(4)),
                         (m.group(1).length() > 0),
                         (m.group(3).length() > 0));
  }

  private static Token maybeParseNumberLiteral(char firstChar, ExprBuf buf) {
    int startPos = buf.curPos();
    boolean foundNum = false;
    boolean hasDigit = isDigit(firstChar);
    int expPos = -1;

    try {

      StringBuilder sb = buf.getScratchBuffer().append(firstChar);

      int c = EOF;
      while((c = buf.peekNext()) != EOF) {
        if(isDigit(c)) {
          hasDigit = true;
          sb.append((char)c);
          buf.next();
        } else if((c == DECIMAL_SEP_CHAR) && (expPos < 0)) {
          sb.append((char)c);
          buf.next();
        } else if(hasDigit && (expPos < 0) && ((c == 'e') || (c == 'E'))) {
          sb.append((char)c);
          expPos = sb.length();
          buf.next();
        } else if((expPos == sb.length()) && ((c == '-') || (c == '+'))) {
          sb.append((char)c);
          buf.next();
        } else if(isSpecialChar((char)c)) {
          break;
        } else {
          // found a non-number, non-special string
          return null;
        }
      }

      if(!hasDigit) {
        // no digits, no number
        return null;
      }

      String numStr = sb.toString();
      Double num = ValueSupport.parseNumber(numStr);
      if(num == null) {
        throw new ParseException("Invalid number literal " + numStr + " " +
                                 buf);
      }

      foundNum = true;
      return new Token(TokenType.LITERAL, num, numStr,
                       FormulaValue.Type.NUMBER);

    } finally {
      if(!foundNum) {
        buf.reset(startPos);
      }
    }
  }

  private static boolean hasFlag(byte charFlag, byte flag) {
    return ((charFlag & flag) != 0);
  }

  private static void setCharFlag(byte flag, char... chars) {
    for(char c : chars) {
      CHAR_FLAGS[c] |= flag;
    }
  }

  private static boolean isDigit(int c) {
    return ((c >= '0') && (c <= '9'));
  }

  static final class ExprBuf
  {
    private final String _str;
    private int _pos;
    private final StringBuilder _scratch = new StringBuilder();

    ExprBuf(String str) {
      _str = str;
    }

    private int len() {
      return _str.length();
    }

    public int curPos() {
      return _pos;
    }

    public int prevPos() {
      return _pos - 1;
    }

    public boolean hasNext() {
      return _pos < len();
    }

    public char next() {
      return _str.charAt(_pos++);
    }

    public void popPrev() {
      --_pos;
    }

    public int peekNext() {
      if(!hasNext()) {
        return EOF;
      }
      return _str.charAt(_pos);
    }

    public void reset(int pos) {
      _pos = pos;
    }

    public boolean regionMatches(int pos, String str) {
      return _str.regionMatches(true, pos, str, 0, str.length());
    }

    public StringBuilder getScratchBuffer() {
      _scratch.setLength(0);
      return _scratch;
    }

    @Override
    public String toString() {
      return "[char " + _pos + "] '" + _str + "'";
    }
  }


  static final class Token
  {
    private final TokenType _type;
    private final Object _val;
    private final String _valStr;
    private final FormulaValue.Type _valType;

    private Token(TokenType type, String val) {
      this(type, val, val, null);
    }

    private Token(TokenType type, Object val, String valStr,
                  FormulaValue.Type valType) {
      _type = type;
      _val = ((val != null) ? val : valStr);
      _valStr = valStr;
      _valType = valType;
    }

    public TokenType getType() {
      return _type;
    }

    public Object getValue() {
      return _val;
    }

    public String getValueStr() {
      return _valStr;
    }

    public FormulaValue.Type getValueType() {
      return _valType;
    }

    /**
     * @return the references of a REF token (one for a cell, two for a
     *         range)
     */
    public Reference[] getReferences() {
      return (Reference[])_val;
    }

    @Override
    public String toString() {
      if(_type == TokenType.SPACE) {
        return "' '";
      }
      String str = "[" + _type + "] '" + _valStr + "'";
      if(_valType != null) {
        str += " (" + _valType + ")";
      }
      return str;
    }
  }

}
