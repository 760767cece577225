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

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import com.healthmarketscience.sheetcalc.expr.FormulaError;
import com.healthmarketscience.sheetcalc.expr.FormulaErrorException;
import com.healthmarketscience.sheetcalc.expr.Value;

/**
 *
 * @author James Ahlborn
 */
public class ValueSupport
{
  public static final Value NULL_VAL = new BaseValue() {
    @Override public boolean isNull() {
      return true;
    }
    @Override public Type getType() {
      return Type.NULL;
    }
    @Override public Object get() {
      return null;
    }
    @Override public boolean getAsBoolean() {
      return false;
    }
    @Override public String getAsString() {
      return "";
    }
    @Override public Double getAsDouble() {
      return 0.0d;
    }
  };
  public static final Value TRUE_VAL = new BooleanValue(true);
  public static final Value FALSE_VAL = new BooleanValue(false);
  public static final Value EMPTY_STR_VAL = new StringValue("");
  public static final Value ZERO_VAL = new NumberValue(0.0d);
  public static final Value ONE_VAL = new NumberValue(1.0d);

  private static final Map<FormulaError,Value> ERROR_VALS =
    new EnumMap<FormulaError,Value>(FormulaError.class);

  static {
    for(FormulaError err : FormulaError.values()) {
      ERROR_VALS.put(err, new ErrorValue(err));
    }
  }

  public static final Value VALUE_ERR_VAL = toError(FormulaError.VALUE);
  public static final Value NA_ERR_VAL = toError(FormulaError.NA);

  /** longest text any formula may produce (the cell text limit) */
  public static final int MAX_TEXT_LENGTH = 32767;

  static final Pattern NUMBER_PAT =
    Pattern.compile("^[+-]?(([0-9]+[.]?[0-9]*)|([.][0-9]+))([eE][+-]?[0-9]+)?$");
  static final Pattern WHITESPACE_PAT = Pattern.compile("\\s+");

  // integral values beyond this print in plain decimal notation
  private static final double MAX_LONG_PRINT = 1.0e15d;

  private ValueSupport() {}

  public static Value toValue(boolean b) {
    return (b ? TRUE_VAL : FALSE_VAL);
  }

  public static Value toValue(String s) {
    return new StringValue(s);
  }

  public static Value toValue(int i) {
    return new NumberValue(i);
  }

  public static Value toValue(double d) {
    return new NumberValue(d);
  }

  public static Value toError(FormulaError err) {
    return ERROR_VALS.get(err);
  }

  public static Value toArray(Value[][] vals) {
    return new ArrayValue(vals);
  }

  /**
   * Converts a plain java object into a Value.  Strings which match an error
   * sentinel (e.g. {@code "#DIV/0!"}) become error values.
   */
  public static Value toValue(Object obj) {
    if(obj == null) {
      return NULL_VAL;
    }
    if(obj instanceof Value) {
      return (Value)obj;
    }
    if(obj instanceof Number) {
      return toValue(((Number)obj).doubleValue());
    }
    if(obj instanceof Boolean) {
      return toValue(((Boolean)obj).booleanValue());
    }
    if(obj instanceof FormulaError) {
      return toError((FormulaError)obj);
    }
    if(obj instanceof Value[][]) {
      return toArray((Value[][])obj);
    }
    String str = obj.toString();
    FormulaError err = FormulaError.fromString(str);
    return ((err != null) ? toError(err) : toValue(str));
  }

  /**
   * @return the number formatted without a fractional part if integral,
   *         otherwise in plain decimal notation
   */
  public static String formatNumber(double d) {
    if(Double.isNaN(d) || Double.isInfinite(d)) {
      return String.valueOf(d);
    }
    if((d == Math.rint(d)) && (Math.abs(d) < MAX_LONG_PRINT)) {
      return Long.toString((long)d);
    }
    return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
  }

  /**
   * @return a Value for the given numeric result, {@code #NUM!} if it is not
   *         finite
   */
  public static Value toNumericResult(double d) {
    if(Double.isNaN(d) || Double.isInfinite(d)) {
      return toError(FormulaError.NUM);
    }
    return toValue(d);
  }

  /**
   * @return all the given values with arrays expanded in row-major order
   */
  public static List<Value> flatten(Value... params) {
    List<Value> vals = new ArrayList<Value>();
    for(Value param : params) {
      if(param.getType() == Value.Type.ARRAY) {
        for(Value[] row : param.getAsArray()) {
          for(Value val : row) {
            vals.add(val);
          }
        }
      } else {
        vals.add(param);
      }
    }
    return vals;
  }

  /**
   * @return the numbers among the given values (arrays expanded).  Within
   *         arrays only actual numbers count, direct arguments are coerced.
   *
   * @throws FormulaErrorException for the first error value found
   */
  public static List<Double> collectNumbers(Value... params) {
    List<Double> nums = new ArrayList<Double>();
    for(Value param : params) {
      if(param.getType() == Value.Type.ARRAY) {
        for(Value[] row : param.getAsArray()) {
          for(Value val : row) {
            if(val.isError()) {
              throw new FormulaErrorException(val.getError());
            }
            if(val.getType() == Value.Type.NUMBER) {
              nums.add(val.getAsDouble());
            }
          }
        }
      } else if(!param.isNull()) {
        nums.add(param.getAsDouble());
      }
    }
    return nums;
  }

  /**
   * @return the first error among the given values (arrays expanded), or
   *         {@code null} if none
   */
  public static Value findError(Value... params) {
    for(Value val : flatten(params)) {
      if(val.isError()) {
        return val;
      }
    }
    return null;
  }

  /**
   * @return {@code true} if the value is a blank cell or an empty string
   */
  public static boolean isBlank(Value val) {
    return (val.isNull() ||
            ((val.getType() == Value.Type.STRING) &&
             (val.getAsString().length() == 0)));
  }

  /**
   * @return the number for the given value if it is a number or numeric
   *         string, {@code null} otherwise (blank counts as a number only if
   *         requested)
   */
  public static Double toNumberOrNull(Value val, boolean blankIsZero) {
    switch(val.getType()) {
    case NULL:
      return (blankIsZero ? 0.0d : null);
    case NUMBER:
      return val.getAsDouble();
    case BOOLEAN:
      return val.getAsDouble();
    case STRING:
      String str = val.getAsString().trim();
      if(str.length() == 0) {
        return (blankIsZero ? 0.0d : null);
      }
      return (NUMBER_PAT.matcher(str).matches() ? Double.valueOf(str) : null);
    default:
      return null;
    }
  }
}
