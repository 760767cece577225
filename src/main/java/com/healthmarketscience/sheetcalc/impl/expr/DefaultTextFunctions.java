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

import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.healthmarketscience.sheetcalc.expr.EvalContext;
import com.healthmarketscience.sheetcalc.expr.FormulaError;
import com.healthmarketscience.sheetcalc.expr.Function;
import com.healthmarketscience.sheetcalc.expr.Value;
import org.apache.commons.lang3.StringUtils;
import static com.healthmarketscience.sheetcalc.impl.expr.DefaultFunctions.*;
import static com.healthmarketscience.sheetcalc.impl.expr.FunctionSupport.*;

/**
 * Text and regular expression functions.  Character positions are 1-based.
 *
 * @author James Ahlborn
 */
public class DefaultTextFunctions
{
  // only plain numeric patterns are supported by TEXT
  private static final Pattern NUMERIC_FORMAT_PAT =
    Pattern.compile("^[0#,]*(\\.[0#]+)?%?$");
  private static final Pattern CURRENCY_CHARS_PAT = Pattern.compile("[$,]");

  private DefaultTextFunctions() {}

  static void init() {
    // dummy method to ensure this class is loaded
  }

  public static final Function CONCATENATE = registerFunc(new FuncVar("CONCATENATE", 1, Integer.MAX_VALUE) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      StringBuilder sb = new StringBuilder();
      for(Value val : ValueSupport.flatten(params)) {
        sb.append(val.getAsString());
        if(sb.length() > ValueSupport.MAX_TEXT_LENGTH) {
          return ValueSupport.VALUE_ERR_VAL;
        }
      }
      return ValueSupport.toValue(sb.toString());
    }
  });

  public static final Function LEFT = registerFunc(new FuncVar("LEFT", 1, 2) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      String str = toScalar(params[0]).getAsString();
      int len = getOptionalIntParam(params, 1, 1);
      if(len < 0) {
        return ValueSupport.VALUE_ERR_VAL;
      }
      return ValueSupport.toValue(StringUtils.left(str, len));
    }
  });

  public static final Function RIGHT = registerFunc(new FuncVar("RIGHT", 1, 2) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      String str = toScalar(params[0]).getAsString();
      int len = getOptionalIntParam(params, 1, 1);
      if(len < 0) {
        return ValueSupport.VALUE_ERR_VAL;
      }
      return ValueSupport.toValue(StringUtils.right(str, len));
    }
  });

  public static final Function MID = registerFunc(new Func3("MID") {
    @Override
    protected Value eval3(EvalContext ctx, Value param1, Value param2,
                          Value param3) {
      String str = toScalar(param1).getAsString();
      int start = toScalar(param2).getAsInt();
      int len = toScalar(param3).getAsInt();
      if((start < 1) || (len < 0)) {
        return ValueSupport.VALUE_ERR_VAL;
      }
      return ValueSupport.toValue(StringUtils.mid(str, start - 1, len));
    }
  });

  public static final Function LEN = registerFunc(new Func1("LEN") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      return ValueSupport.toValue(toScalar(param1).getAsString().length());
    }
  });

  public static final Function TRIM = registerFunc(new Func1("TRIM") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      String str = toScalar(param1).getAsString();
      return ValueSupport.toValue(
          ValueSupport.WHITESPACE_PAT.matcher(str).replaceAll(" ").trim());
    }
  });

  public static final Function UPPER = registerFunc(new Func1("UPPER") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      return ValueSupport.toValue(
          toScalar(param1).getAsString().toUpperCase(Locale.ROOT));
    }
  });

  public static final Function LOWER = registerFunc(new Func1("LOWER") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      return ValueSupport.toValue(
          toScalar(param1).getAsString().toLowerCase(Locale.ROOT));
    }
  });

  public static final Function PROPER = registerFunc(new Func1("PROPER") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      String str = toScalar(param1).getAsString();
      StringBuilder sb = new StringBuilder(str.length());
      boolean prevLetter = false;
      for(int i = 0; i < str.length(); ++i) {
        char c = str.charAt(i);
        sb.append(prevLetter ? Character.toLowerCase(c) :
                  Character.toUpperCase(c));
        prevLetter = Character.isLetter(c);
      }
      return ValueSupport.toValue(sb.toString());
    }
  });

  public static final Function SUBSTITUTE = registerFunc(new FuncVar("SUBSTITUTE", 3, 4) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      String str = toScalar(params[0]).getAsString();
      String oldStr = toScalar(params[1]).getAsString();
      String newStr = toScalar(params[2]).getAsString();
      if(oldStr.isEmpty()) {
        return ValueSupport.toValue(str);
      }
      if(params.length < 4) {
        long newLen = str.length() +
          ((long)StringUtils.countMatches(str, oldStr) *
           (newStr.length() - oldStr.length()));
        if(newLen > ValueSupport.MAX_TEXT_LENGTH) {
          return ValueSupport.VALUE_ERR_VAL;
        }
        return ValueSupport.toValue(str.replace(oldStr, newStr));
      }

      int instance = toScalar(params[3]).getAsInt();
      if(instance < 1) {
        return ValueSupport.VALUE_ERR_VAL;
      }
      int idx = -1;
      for(int i = 0; i < instance; ++i) {
        idx = str.indexOf(oldStr, idx + 1);
        if(idx < 0) {
          return ValueSupport.toValue(str);
        }
      }
      return ValueSupport.toValue(
          str.substring(0, idx) + newStr + str.substring(idx + oldStr.length()));
    }
  });

  public static final Function FIND = registerFunc(new FuncVar("FIND", 2, 3) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      String find = toScalar(params[0]).getAsString();
      String within = toScalar(params[1]).getAsString();
      int start = getOptionalIntParam(params, 2, 1);
      if((start < 1) || (start > within.length() + 1)) {
        return ValueSupport.VALUE_ERR_VAL;
      }
      int idx = within.indexOf(find, start - 1);
      return ((idx >= 0) ? ValueSupport.toValue(idx + 1) :
              ValueSupport.VALUE_ERR_VAL);
    }
  });

  public static final Function SEARCH = registerFunc(new FuncVar("SEARCH", 2, 3) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      String find = toScalar(params[0]).getAsString();
      String within = toScalar(params[1]).getAsString();
      int start = getOptionalIntParam(params, 2, 1);
      if((start < 1) || (start > within.length() + 1)) {
        return ValueSupport.VALUE_ERR_VAL;
      }
      Matcher m = CriteriaMatcher.wildcardToPattern(find, false)
        .matcher(within);
      return (m.find(start - 1) ? ValueSupport.toValue(m.start() + 1) :
              ValueSupport.VALUE_ERR_VAL);
    }
  });

  public static final Function TEXT = registerFunc(new Func2("TEXT") {
    @Override
    protected Value eval2(EvalContext ctx, Value param1, Value param2) {
      Value val = toScalar(param1);
      String fmt = toScalar(param2).getAsString();
      Double num = ValueSupport.toNumberOrNull(val, false);
      if((num == null) || !NUMERIC_FORMAT_PAT.matcher(fmt).matches() ||
         fmt.isEmpty()) {
        // unsupported formats leave the value as is
        return ValueSupport.toValue(val.getAsString());
      }
      DecimalFormat df = new DecimalFormat(
          fmt, DecimalFormatSymbols.getInstance(Locale.US));
      df.setRoundingMode(RoundingMode.HALF_UP);
      return ValueSupport.toValue(df.format(num));
    }
  });

  public static final Function VALUE = registerFunc(new Func1("VALUE") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      Value val = toScalar(param1);
      if(val.getType() == Value.Type.NUMBER) {
        return val;
      }
      String str = CURRENCY_CHARS_PAT.matcher(val.getAsString())
        .replaceAll("").trim();
      if(!ValueSupport.NUMBER_PAT.matcher(str).matches()) {
        return ValueSupport.VALUE_ERR_VAL;
      }
      return ValueSupport.toValue(Double.parseDouble(str));
    }
  });

  public static final Function REPT = registerFunc(new Func2("REPT") {
    @Override
    protected Value eval2(EvalContext ctx, Value param1, Value param2) {
      String str = toScalar(param1).getAsString();
      int num = toScalar(param2).getAsInt();
      if((num < 0) ||
         (((long)str.length() * num) > ValueSupport.MAX_TEXT_LENGTH)) {
        return ValueSupport.VALUE_ERR_VAL;
      }
      return ValueSupport.toValue(StringUtils.repeat(str, num));
    }
  });

  public static final Function EXACT = registerFunc(new Func2("EXACT") {
    @Override
    protected Value eval2(EvalContext ctx, Value param1, Value param2) {
      return ValueSupport.toValue(
          toScalar(param1).getAsString().equals(toScalar(param2).getAsString()));
    }
  });

  public static final Function CLEAN = registerFunc(new Func1("CLEAN") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      String str = toScalar(param1).getAsString();
      StringBuilder sb = new StringBuilder(str.length());
      for(int i = 0; i < str.length(); ++i) {
        char c = str.charAt(i);
        if(c >= ' ') {
          sb.append(c);
        }
      }
      return ValueSupport.toValue(sb.toString());
    }
  });

  public static final Function CHAR = registerFunc(new Func1("CHAR") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      int code = toScalar(param1).getAsInt();
      if((code < 1) || (code > 0xFFFF)) {
        return ValueSupport.VALUE_ERR_VAL;
      }
      return ValueSupport.toValue(String.valueOf((char)code));
    }
  });

  public static final Function CODE = registerFunc(new Func1("CODE") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      String str = toScalar(param1).getAsString();
      if(str.isEmpty()) {
        return ValueSupport.VALUE_ERR_VAL;
      }
      return ValueSupport.toValue((int)str.charAt(0));
    }
  });

  public static final Function REGEXMATCH = registerFunc(new Func2("REGEXMATCH") {
    @Override
    protected Value eval2(EvalContext ctx, Value param1, Value param2) {
      String str = toScalar(param1).getAsString();
      Pattern pat = Pattern.compile(toScalar(param2).getAsString());
      return ValueSupport.toValue(pat.matcher(str).find());
    }
  });

  public static final Function REGEXEXTRACT = registerFunc(new Func2("REGEXEXTRACT") {
    @Override
    protected Value eval2(EvalContext ctx, Value param1, Value param2) {
      String str = toScalar(param1).getAsString();
      Matcher m = Pattern.compile(toScalar(param2).getAsString()).matcher(str);
      if(!m.find()) {
        return ValueSupport.toError(FormulaError.NA);
      }
      // the first capture group if there is one, else the whole match
      String match = ((m.groupCount() > 0) ? m.group(1) : m.group());
      return ValueSupport.toValue(StringUtils.defaultString(match));
    }
  });

  public static final Function REGEXREPLACE = registerFunc(new Func3("REGEXREPLACE") {
    @Override
    protected Value eval3(EvalContext ctx, Value param1, Value param2,
                          Value param3) {
      String str = toScalar(param1).getAsString();
      Pattern pat = Pattern.compile(toScalar(param2).getAsString());
      String replacement = toScalar(param3).getAsString();
      Matcher m = pat.matcher(str);
      StringBuilder sb = new StringBuilder();
      while(m.find()) {
        m.appendReplacement(sb, replacement);
        if(sb.length() > ValueSupport.MAX_TEXT_LENGTH) {
          return ValueSupport.VALUE_ERR_VAL;
        }
      }
      m.appendTail(sb);
      return ValueSupport.toValue(sb.toString());
    }
  });
}
