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

import java.util.List;

import com.healthmarketscience.sheetcalc.expr.EvalContext;
import com.healthmarketscience.sheetcalc.expr.FormulaError;
import com.healthmarketscience.sheetcalc.expr.Function;
import com.healthmarketscience.sheetcalc.expr.Value;
import static com.healthmarketscience.sheetcalc.impl.expr.DefaultFunctions.*;
import static com.healthmarketscience.sheetcalc.impl.expr.FunctionSupport.*;

/**
 * Lookup and reference functions.  ROW and COLUMN need the reference itself
 * (not its values), so the parser handles them.
 *
 * @author James Ahlborn
 */
public class DefaultLookupFunctions
{
  private static final int NOT_FOUND = -1;

  private DefaultLookupFunctions() {}

  static void init() {
    // dummy method to ensure this class is loaded
  }

  public static final Function VLOOKUP = registerFunc(new FuncVar("VLOOKUP", 3, 4) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      Value key = toScalar(params[0]);
      Value[][] table = toGrid(params[1]);
      int col = toScalar(params[2]).getAsInt();
      boolean sorted = getOptionalBooleanParam(params, 3, true);
      if(col < 1) {
        return ValueSupport.VALUE_ERR_VAL;
      }
      if((table.length == 0) || (col > table[0].length)) {
        return ValueSupport.toError(FormulaError.REF);
      }

      Value[] keys = new Value[table.length];
      for(int i = 0; i < table.length; ++i) {
        keys[i] = table[i][0];
      }
      int row = (sorted ? findSorted(key, keys, 1) : findExact(key, keys));
      return ((row != NOT_FOUND) ? table[row][col - 1] :
              ValueSupport.NA_ERR_VAL);
    }
  });

  public static final Function HLOOKUP = registerFunc(new FuncVar("HLOOKUP", 3, 4) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      Value key = toScalar(params[0]);
      Value[][] table = toGrid(params[1]);
      int row = toScalar(params[2]).getAsInt();
      boolean sorted = getOptionalBooleanParam(params, 3, true);
      if(row < 1) {
        return ValueSupport.VALUE_ERR_VAL;
      }
      if(row > table.length) {
        return ValueSupport.toError(FormulaError.REF);
      }

      Value[] keys = table[0];
      int col = (sorted ? findSorted(key, keys, 1) : findExact(key, keys));
      return ((col != NOT_FOUND) ? table[row - 1][col] :
              ValueSupport.NA_ERR_VAL);
    }
  });

  public static final Function INDEX = registerFunc(new FuncVar("INDEX", 2, 3) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      Value[][] vals = toGrid(params[0]);
      int row = toScalar(params[1]).getAsInt();
      int col = getOptionalIntParam(params, 2, 0);
      if((row < 0) || (col < 0)) {
        return ValueSupport.VALUE_ERR_VAL;
      }
      int numRows = vals.length;
      int numCols = ((numRows > 0) ? vals[0].length : 0);
      if((params.length < 3) && (numRows == 1) && (numCols > 1)) {
        // a single index into a row picks the column
        col = row;
        row = 1;
      }
      if((row > numRows) || (col > numCols)) {
        return ValueSupport.toError(FormulaError.REF);
      }

      if(row == 0) {
        if(col == 0) {
          return params[0];
        }
        // the whole column
        Value[][] result = new Value[numRows][1];
        for(int i = 0; i < numRows; ++i) {
          result[i][0] = vals[i][col - 1];
        }
        return ValueSupport.toArray(result);
      }
      if(col == 0) {
        if(numCols == 1) {
          return vals[row - 1][0];
        }
        return ValueSupport.toArray(new Value[][]{vals[row - 1].clone()});
      }
      return vals[row - 1][col - 1];
    }
  });

  public static final Function MATCH = registerFunc(new FuncVar("MATCH", 2, 3) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      Value key = toScalar(params[0]);
      toGrid(params[1]);
      Value[] vals = ValueSupport.flatten(params[1]).toArray(new Value[0]);
      int matchType = getOptionalIntParam(params, 2, 1);

      int idx;
      if(matchType == 0) {
        idx = findExact(key, vals);
      } else {
        idx = findSorted(key, vals, ((matchType > 0) ? 1 : -1));
      }
      return ((idx != NOT_FOUND) ? ValueSupport.toValue(idx + 1) :
              ValueSupport.NA_ERR_VAL);
    }
  });

  public static final Function XLOOKUP = registerFunc(new FuncVar("XLOOKUP", 3, 4) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      Value key = toScalar(params[0]);
      Value[][] lookup = toGrid(params[1]);
      Value[][] results = toGrid(params[2]);
      boolean byRow = ((lookup.length > 1) || (lookup[0].length == 1));

      List<Value> keys = ValueSupport.flatten(params[1]);
      int idx = findExact(key, keys.toArray(new Value[0]));
      if(idx == NOT_FOUND) {
        return ((params.length > 3) ? params[3] : ValueSupport.NA_ERR_VAL);
      }

      if(byRow) {
        if(idx >= results.length) {
          return ValueSupport.toError(FormulaError.REF);
        }
        Value[] row = results[idx];
        return ((row.length == 1) ? row[0] :
                ValueSupport.toArray(new Value[][]{row.clone()}));
      }

      if(idx >= results[0].length) {
        return ValueSupport.toError(FormulaError.REF);
      }
      if(results.length == 1) {
        return results[0][idx];
      }
      Value[][] col = new Value[results.length][1];
      for(int i = 0; i < results.length; ++i) {
        col[i][0] = results[i][idx];
      }
      return ValueSupport.toArray(col);
    }
  });

  public static final Function ROWS = registerFunc(new Func1("ROWS") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      return ValueSupport.toValue(toGrid(param1).length);
    }
  });

  public static final Function COLUMNS = registerFunc(new Func1("COLUMNS") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      Value[][] vals = toGrid(param1);
      return ValueSupport.toValue((vals.length > 0) ? vals[0].length : 0);
    }
  });

  public static final Function CHOOSE = registerFunc(new FuncVar("CHOOSE", 2, Integer.MAX_VALUE) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      int idx = toScalar(params[0]).getAsInt();
      if((idx < 1) || (idx >= params.length)) {
        return ValueSupport.VALUE_ERR_VAL;
      }
      return params[idx];
    }
  });

  /**
   * @return the index of the first value equal to the key, or
   *         {@link #NOT_FOUND}
   */
  private static int findExact(Value key, Value[] vals) {
    for(int i = 0; i < vals.length; ++i) {
      Value val = vals[i];
      if(!val.isError() && (BuiltinOperators.compareLookup(key, val) == 0)) {
        return i;
      }
    }
    return NOT_FOUND;
  }

  /**
   * Finds the last position at which the key still sorts after (order 1,
   * ascending values) or before (order -1, descending values) the value,
   * stopping at the first value past the key.
   *
   * @return the matching index, or {@link #NOT_FOUND}
   */
  private static int findSorted(Value key, Value[] vals, int order) {
    int found = NOT_FOUND;
    for(int i = 0; i < vals.length; ++i) {
      Value val = vals[i];
      if(val.isError() || val.isNull()) {
        continue;
      }
      int cmp = BuiltinOperators.compareLookup(val, key) * order;
      if(cmp > 0) {
        break;
      }
      found = i;
      if(cmp == 0) {
        break;
      }
    }
    return found;
  }
}
