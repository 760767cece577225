/*
Copyright (c) 2024 James Ahlborn

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

package com.healthmarketscience.sheetcalc.impl.expr;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.healthmarketscience.sheetcalc.CellKey;
import com.healthmarketscience.sheetcalc.expr.CellReference;
import com.healthmarketscience.sheetcalc.expr.FormulaError;
import com.healthmarketscience.sheetcalc.expr.ParseException;
import com.healthmarketscience.sheetcalc.expr.Value;
import org.apache.commons.lang3.StringUtils;


/**
 *
 * @author James Ahlborn
 */
class FormulaTokenizer
{
  private static final int EOF = -1;
  static final char QUOTED_STR_CHAR = '"';
  private static final char SHEET_QUOTE_CHAR = '\'';
  private static final char ESCAPE_CHAR = '\\';
  private static final char ERROR_START_CHAR = '#';
  private static final char SHEET_SEP_CHAR = '!';
  private static final char DECIMAL_SEP_CHAR = '.';

  private static final byte IS_OP_FLAG =     0x01;
  private static final byte IS_COMP_FLAG =   0x02;
  private static final byte IS_DELIM_FLAG =  0x04;
  private static final byte IS_SPACE_FLAG =  0x08;
  private static final byte IS_QUOTE_FLAG =  0x10;

  enum TokenType {
    LITERAL, REF, NAME, OP, DELIM;
  }

  private static final byte[] CHAR_FLAGS = new byte[128];
  private static final Set<String> TWO_CHAR_COMP_OPS = new HashSet<String>(
      Arrays.asList("<=", ">=", "<>"));

  private static final Pattern CELL_REF_PAT = Pattern.compile(
      "^(\\$?)([A-Za-z]{1,3})(\\$?)([1-9][0-9]*)$");

  static {
    setCharFlag(IS_OP_FLAG, '+', '-', '*', '/', '^', '&', '%');
    setCharFlag(IS_COMP_FLAG, '<', '>', '=');
    setCharFlag(IS_DELIM_FLAG, ',', '(', ')', ':', '!');
    setCharFlag(IS_SPACE_FLAG, ' ', '\n', '\r', '\t');
    setCharFlag(IS_QUOTE_FLAG, '"', '\'', '#');
  }

  private FormulaTokenizer() {}

  /**
   * Tokenizes a formula string (without the leading "=").
   */
  static List<Token> tokenize(String exprStr) {

    if(exprStr != null) {
      exprStr = exprStr.trim();
    }

    if(StringUtils.isEmpty(exprStr)) {
      return null;
    }

    List<Token> tokens = new ArrayList<Token>();

    ExprBuf buf = new ExprBuf(exprStr);

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

          // whitespace only separates tokens
          consumeWhitespace(buf);
          break;

        case IS_QUOTE_FLAG:

          switch(c) {
          case QUOTED_STR_CHAR:
            String str = parseQuotedString(buf);
            tokens.add(new Token(TokenType.LITERAL, ValueSupport.toValue(str),
                                 str));
            break;
          case SHEET_QUOTE_CHAR:
            String sheet = parseStringUntil(buf, SHEET_QUOTE_CHAR, true, false);
            tokens.add(parseSheetRef(sheet, buf));
            break;
          case ERROR_START_CHAR:
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
        String str = parseBareString(c, buf);
        if(buf.peekNext() == SHEET_SEP_CHAR) {
          tokens.add(parseSheetRef(str, buf));
        } else {
          tokens.add(toWordToken(str, buf));
        }
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

  private static Token toWordToken(String str, ExprBuf buf) {
    // a word followed by '(' is always a function name (e.g. LOG10)
    if(buf.peekNext() != '(') {
      CellReference ref = toCellRef(null, str);
      if(ref != null) {
        return new Token(TokenType.REF, ref, str);
      }
      if("TRUE".equalsIgnoreCase(str)) {
        return new Token(TokenType.LITERAL, ValueSupport.TRUE_VAL, str);
      }
      if("FALSE".equalsIgnoreCase(str)) {
        return new Token(TokenType.LITERAL, ValueSupport.FALSE_VAL, str);
      }
    }

    if(!isValidName(str)) {
      throw new ParseException("Invalid name '" + str + "' " + buf);
    }
    return new Token(TokenType.NAME, str);
  }

  private static Token parseSheetRef(String sheet, ExprBuf buf) {
    if(buf.peekNext() != SHEET_SEP_CHAR) {
      throw new ParseException("Expected '" + SHEET_SEP_CHAR +
                               "' after sheet name " + buf);
    }
    buf.next();
    if(!buf.hasNext()) {
      throw new ParseException("Missing cell reference after sheet name " +
                               buf);
    }
    String refStr = parseBareString(buf.next(), buf);
    CellReference ref = toCellRef(sheet, refStr);
    if(ref == null) {
      throw new ParseException("Invalid cell reference '" + refStr + "' " +
                               buf);
    }
    return new Token(TokenType.REF, ref, ref.toString());
  }

  static CellReference toCellRef(String sheet, String str) {
    Matcher m = CELL_REF_PAT.matcher(str);
    if(!m.matches()) {
      return null;
    }
    int col = CellKey.fromColumnLetters(m.group(2));
    int row = 0;
    try {
      row = Integer.parseInt(m.group(4)) - 1;
    } catch(NumberFormatException e) {
      throw new ParseException("Row out of range in cell reference '" +
                               str + "'", e);
    }
    return new CellReference(sheet, col, row, (m.group(1).length() > 0),
                             (m.group(3).length() > 0));
  }

  private static boolean isValidName(String str) {
    char first = str.charAt(0);
    if(!Character.isLetter(first) && (first != '_')) {
      return false;
    }
    for(int i = 1; i < str.length(); ++i) {
      char c = str.charAt(i);
      if(!Character.isLetterOrDigit(c) && (c != '_') && (c != '.')) {
        return false;
      }
    }
    return true;
  }

  private static String parseQuotedString(ExprBuf buf) {
    return parseStringUntil(buf, QUOTED_STR_CHAR, true, true);
  }

  static String parseStringUntil(ExprBuf buf, char endChar,
                                 boolean allowDoubledEscape,
                                 boolean allowBackslashEscape)
  {
    StringBuilder sb = buf.getScratchBuffer();
    boolean complete = false;
    while(buf.hasNext()) {
      char c = buf.next();
      if(allowBackslashEscape && (c == ESCAPE_CHAR)) {
        if(!buf.hasNext()) {
          break;
        }
        // escaped char is taken literally
        sb.append(buf.next());
        continue;
      }
      if(c == endChar) {
        if(allowDoubledEscape && (buf.peekNext() == endChar)) {
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

  private static Token parseErrorLiteral(ExprBuf buf) {
    int startPos = buf.prevPos();
    for(FormulaError err : FormulaError.values()) {
      String sentinel = err.getSentinel();
      if(buf.regionMatches(startPos, sentinel)) {
        buf.reset(startPos + sentinel.length());
        return new Token(TokenType.LITERAL, ValueSupport.toError(err),
                         sentinel);
      }
    }
    throw new ParseException("Invalid error literal " + buf);
  }

  private static Token maybeParseNumberLiteral(char firstChar, ExprBuf buf) {
    StringBuilder sb = buf.getScratchBuffer().append(firstChar);
    boolean hasDigit = isDigit(firstChar);

    int startPos = buf.curPos();
    boolean foundNum = false;
    int expPos = -1;

    try {

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
      try {
        double num = Double.parseDouble(numStr);
        foundNum = true;
        return new Token(TokenType.LITERAL, ValueSupport.toValue(num),
                         numStr);
      } catch(NumberFormatException ne) {
        throw new ParseException(
            "Invalid number literal " + numStr + " " + buf, ne);
      }

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

    private Token(TokenType type, String val) {
      this(type, val, val);
    }

    private Token(TokenType type, Object val, String valStr) {
      _type = type;
      _val = ((val != null) ? val : valStr);
      _valStr = valStr;
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

    public boolean is(TokenType type, String valStr) {
      return ((_type == type) && _valStr.equals(valStr));
    }

    @Override
    public String toString() {
      String str = "[" + _type + "] '" + _val + "'";
      if(_val instanceof Value) {
        str += " (" + ((Value)_val).getType() + ")";
      }
      return str;
    }
  }

}
