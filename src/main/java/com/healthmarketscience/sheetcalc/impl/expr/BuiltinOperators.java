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

import com.healthmarketscience.sheetcalc.expr.EvalException;
import com.healthmarketscience.sheetcalc.expr.FormulaError;
import com.healthmarketscience.sheetcalc.expr.Value;
import static com.healthmarketscience.sheetcalc.impl.expr.ValueSupport.*;


/**
 * Implementations of the formula operators.  Callers handle error operands
 * (errors short-circuit before an operator is applied).
 *
 * @author James Ahlborn
 */
public class BuiltinOperators
{
  private BuiltinOperators() {}

  // coercion rules:
  // - number ops coerce both operands to numbers, blank and "" are 0,
  //   booleans are 1/0, non-numeric strings and arrays are #VALUE!
  // - non-finite results are #NUM!
  // - concat stringifies both sides, blank is "", longer than
  //   MAX_TEXT_LENGTH is #VALUE!
  // - comparisons are numeric unless either side is a string, strings
  //   compare case insensitively

  public static Value negate(Value param1) {
    return toNumericResult(-toOperand(param1));
  }

  public static Value add(Value param1, Value param2) {
    return toNumericResult(toOperand(param1) + toOperand(param2));
  }

  public static Value subtract(Value param1, Value param2) {
    return toNumericResult(toOperand(param1) - toOperand(param2));
  }

  public static Value multiply(Value param1, Value param2) {
    return toNumericResult(toOperand(param1) * toOperand(param2));
  }

  public static Value divide(Value param1, Value param2) {
    double d1 = toOperand(param1);
    double d2 = toOperand(param2);
    if(d2 == 0.0d) {
      return toError(FormulaError.DIV0);
    }
    return toNumericResult(d1 / d2);
  }

  /**
   * The binary percent operator (also the target of the postfix form, e.g.
   * {@code 50%} is {@code 50 % 100}).  This divides, exactly like
   * {@link #divide}.
   */
  public static Value percent(Value param1, Value param2) {
    return divide(param1, param2);
  }

  public static Value power(Value param1, Value param2) {
    return toNumericResult(Math.pow(toOperand(param1), toOperand(param2)));
  }

  public static Value concat(Value param1, Value param2) {
    // note, this op converts null to empty string
    String str1 = toConcatString(param1);
    String str2 = toConcatString(param2);
    if((str1.length() + str2.length()) > MAX_TEXT_LENGTH) {
      return VALUE_ERR_VAL;
    }
    return toValue(str1.concat(str2));
  }

  public static Value equals(Value param1, Value param2) {
    return toValue(compare(param1, param2) == 0);
  }

  public static Value notEquals(Value param1, Value param2) {
    return toValue(compare(param1, param2) != 0);
  }

  public static Value lessThan(Value param1, Value param2) {
    return toValue(compare(param1, param2) < 0);
  }

  public static Value greaterThan(Value param1, Value param2) {
    return toValue(compare(param1, param2) > 0);
  }

  public static Value lessThanEq(Value param1, Value param2) {
    return toValue(compare(param1, param2) <= 0);
  }

  public static Value greaterThanEq(Value param1, Value param2) {
    return toValue(compare(param1, param2) >= 0);
  }

  /**
   * Compares two scalar values the way the comparison operators do: blank
   * equals blank (and the empty string), numbers and booleans compare
   * numerically (blank is 0), and any string operand makes it a case
   * insensitive string comparison.
   */
  public static int compare(Value param1, Value param2) {
    if(isBlank(param1) && isBlank(param2)) {
      return 0;
    }

    if((param1.getType() != Value.Type.STRING) &&
       (param2.getType() != Value.Type.STRING)) {
      Double num1 = toNumberOrNull(param1, true);
      Double num2 = toNumberOrNull(param2, true);
      if((num1 != null) && (num2 != null)) {
        return Double.compare(num1, num2);
      }
    }

    return compareText(param1, param2);
  }

  /**
   * Compares a lookup key against a table value: numeric strings, numbers
   * and booleans compare numerically, everything else (blank included)
   * compares as case insensitive strings.
   */
  public static int compareLookup(Value param1, Value param2) {
    Double num1 = toNumberOrNull(param1, false);
    Double num2 = toNumberOrNull(param2, false);
    if((num1 != null) && (num2 != null)) {
      return Double.compare(num1, num2);
    }
    return compareText(param1, param2);
  }

  private static int compareText(Value param1, Value param2) {
    return String.CASE_INSENSITIVE_ORDER.compare(
        toConcatString(param1), toConcatString(param2));
  }

  static double toOperand(Value param) {
    Value.Type type = param.getType();
    if((type == Value.Type.ARRAY) || (type == Value.Type.LAMBDA)) {
      throw new EvalException(param + " cannot be used as an operand");
    }
    return param.getAsDouble();
  }

  static String toConcatString(Value param) {
    Value.Type type = param.getType();
    if((type == Value.Type.ARRAY) || (type == Value.Type.LAMBDA)) {
      throw new EvalException(param + " cannot be used as an operand");
    }
    return param.getAsString();
  }
}
