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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.healthmarketscience.sheetcalc.expr.Value;

/**
 * Matches cell values against the criteria strings used by SUMIF, COUNTIF
 * and friends.  A criterion may start with one of the comparison operators
 * {@code <>, >=, <=, >, <, =}.  When both sides are numeric the comparison
 * is numeric, otherwise text is compared case-insensitively, with {@code *}
 * and {@code ?} wildcards (escaped by {@code ~}) for equality tests.
 *
 * @author James Ahlborn
 */
class CriteriaMatcher
{
  private static final Pattern OP_PAT =
    Pattern.compile("^(<>|>=|<=|>|<|=)(.*)$", Pattern.DOTALL);

  private enum Op {
    EQ, NE, GT, GE, LT, LE;

    private static Op fromString(String str) {
      switch(str) {
      case "<>":
        return NE;
      case ">=":
        return GE;
      case "<=":
        return LE;
      case ">":
        return GT;
      case "<":
        return LT;
      default:
        return EQ;
      }
    }

    private boolean test(int cmp) {
      switch(this) {
      case NE:
        return (cmp != 0);
      case GT:
        return (cmp > 0);
      case GE:
        return (cmp >= 0);
      case LT:
        return (cmp < 0);
      case LE:
        return (cmp <= 0);
      default:
        return (cmp == 0);
      }
    }
  }

  private final Op _op;
  private final String _operand;
  private final Double _numOperand;
  private final Pattern _wildcardPat;

  private CriteriaMatcher(Op op, String operand, Double numOperand) {
    _op = op;
    _operand = operand;
    _numOperand = numOperand;
    _wildcardPat = (((numOperand == null) && ((op == Op.EQ) || (op == Op.NE))) ?
                    wildcardToPattern(operand, true) : null);
  }

  /**
   * @return a matcher for the given criterion value
   */
  static CriteriaMatcher create(Value criterion) {
    criterion = DefaultFunctions.toScalar(criterion);
    switch(criterion.getType()) {
    case NUMBER:
      return new CriteriaMatcher(Op.EQ, criterion.getAsString(),
                                 criterion.getAsDouble());
    case NULL:
      return new CriteriaMatcher(Op.EQ, "", null);
    default:
      // booleans match by their text form
    }

    String str = criterion.getAsString();
    Op op = Op.EQ;
    Matcher m = OP_PAT.matcher(str);
    if(m.matches()) {
      op = Op.fromString(m.group(1));
      str = m.group(2);
    }
    Double num = null;
    String trimmed = str.trim();
    if(ValueSupport.NUMBER_PAT.matcher(trimmed).matches()) {
      num = Double.valueOf(trimmed);
    }
    return new CriteriaMatcher(op, str, num);
  }

  /**
   * @return {@code true} if the given cell value satisfies this criterion
   */
  boolean matches(Value val) {
    if(val.isError()) {
      return false;
    }

    if(_numOperand != null) {
      Double num = ((val.getType() == Value.Type.BOOLEAN) ? null :
                    ValueSupport.toNumberOrNull(val, false));
      if(num == null) {
        // text never satisfies a numeric comparison, except not-equals
        return (_op == Op.NE);
      }
      return _op.test(Double.compare(num, _numOperand));
    }

    if(_operand.isEmpty()) {
      // "" and "=" match blanks, "<>" matches anything non-blank
      boolean blank = ValueSupport.isBlank(val);
      return ((_op == Op.NE) ? !blank : ((_op == Op.EQ) && blank));
    }

    String str = val.getAsString();
    if(_wildcardPat != null) {
      boolean eq = _wildcardPat.matcher(str).matches();
      return ((_op == Op.EQ) ? eq : !eq);
    }
    if(ValueSupport.toNumberOrNull(val, false) != null) {
      // numbers are not ordered against text
      return false;
    }
    return _op.test(String.CASE_INSENSITIVE_ORDER.compare(str, _operand));
  }

  /**
   * Converts a pattern using {@code *} (any run of characters), {@code ?}
   * (any single character) and {@code ~} (escape) into a case-insensitive
   * regular expression.
   *
   * @param fullMatch if {@code true} the pattern is anchored at both ends
   */
  static Pattern wildcardToPattern(String wildcard, boolean fullMatch) {
    StringBuilder sb = new StringBuilder();
    if(fullMatch) {
      sb.append("^");
    }
    for(int i = 0; i < wildcard.length(); ++i) {
      char c = wildcard.charAt(i);
      switch(c) {
      case '*':
        sb.append(".*");
        break;
      case '?':
        sb.append('.');
        break;
      case '~':
        if(i + 1 < wildcard.length()) {
          c = wildcard.charAt(++i);
        }
        sb.append(Pattern.quote(String.valueOf(c)));
        break;
      default:
        sb.append(Pattern.quote(String.valueOf(c)));
      }
    }
    if(fullMatch) {
      sb.append("$");
    }
    return Pattern.compile(sb.toString(), Pattern.CASE_INSENSITIVE |
                           Pattern.UNICODE_CASE | Pattern.DOTALL);
  }

  @Override
  public String toString() {
    return _op + " " + _operand;
  }
}
