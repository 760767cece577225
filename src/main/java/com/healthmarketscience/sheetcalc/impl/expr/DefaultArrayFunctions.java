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
import java.util.Comparator;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.healthmarketscience.sheetcalc.expr.EvalContext;
import com.healthmarketscience.sheetcalc.expr.EvalException;
import com.healthmarketscience.sheetcalc.expr.Function;
import com.healthmarketscience.sheetcalc.expr.Value;
import static com.healthmarketscience.sheetcalc.impl.expr.DefaultFunctions.*;
import static com.healthmarketscience.sheetcalc.impl.expr.FunctionSupport.*;

/**
 * Functions producing arrays (which spill) and the rendering markers
 * produced by SPARKLINE and IMAGE.  A marker is an opaque string: a prefix
 * followed by a JSON object which only the rendering layer interprets.
 *
 * @author James Ahlborn
 */
public class DefaultArrayFunctions
{
  public static final String SPARKLINE_MARKER = "__SPARKLINE__";
  public static final String IMAGE_MARKER = "__IMAGE__";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private DefaultArrayFunctions() {}

  static void init() {
    // dummy method to ensure this class is loaded
  }

  public static final Function SORT = registerFunc(new FuncVar("SORT", 1, 3) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      Value[][] rows = toGrid(params[0]).clone();
      int numCols = ((rows.length > 0) ? rows[0].length : 0);
      int sortCol = getOptionalIntParam(params, 1, 1);
      boolean ascending = getOptionalBooleanParam(params, 2, true);
      if((sortCol < 1) || (sortCol > numCols)) {
        return ValueSupport.VALUE_ERR_VAL;
      }

      final int idx = sortCol - 1;
      Comparator<Value[]> cmp = new Comparator<Value[]>() {
        @Override
        public int compare(Value[] r1, Value[] r2) {
          return BuiltinOperators.compare(r1[idx], r2[idx]);
        }
      };
      // stable, so equal keys keep their original order
      Arrays.sort(rows, (ascending ? cmp : cmp.reversed()));
      return ValueSupport.toArray(rows);
    }
  });

  public static final Function FILTER = registerFunc(new Func2("FILTER") {
    @Override
    protected Value eval2(EvalContext ctx, Value param1, Value param2) {
      Value[][] rows = toGrid(param1);
      Value[][] cond = toGrid(param2);
      int numRows = rows.length;
      int numCols = ((numRows > 0) ? rows[0].length : 0);

      if((cond.length == numRows) && (cond[0].length == 1)) {
        List<Value[]> kept = new ArrayList<Value[]>();
        for(int r = 0; r < numRows; ++r) {
          if(isTruthy(cond[r][0])) {
            kept.add(rows[r]);
          }
        }
        return toFilterResult(kept.toArray(new Value[0][]));
      }

      if((cond.length == 1) && (cond[0].length == numCols)) {
        List<Integer> keptCols = new ArrayList<Integer>();
        for(int c = 0; c < numCols; ++c) {
          if(isTruthy(cond[0][c])) {
            keptCols.add(c);
          }
        }
        Value[][] result = new Value[numRows][keptCols.size()];
        for(int r = 0; r < numRows; ++r) {
          for(int i = 0; i < keptCols.size(); ++i) {
            result[r][i] = rows[r][keptCols.get(i)];
          }
        }
        return toFilterResult(keptCols.isEmpty() ? new Value[0][] : result);
      }

      return ValueSupport.VALUE_ERR_VAL;
    }
  });

  public static final Function UNIQUE = registerFunc(new Func1("UNIQUE") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      List<Value[]> unique = new ArrayList<Value[]>();
      for(Value[] row : toGrid(param1)) {
        boolean seen = false;
        for(Value[] other : unique) {
          if(rowsEqual(row, other)) {
            seen = true;
            break;
          }
        }
        if(!seen) {
          unique.add(row);
        }
      }
      return ValueSupport.toArray(unique.toArray(new Value[0][]));
    }
  });

  public static final Function TRANSPOSE = registerFunc(new Func1("TRANSPOSE") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      Value[][] vals = toGrid(param1);
      int numRows = vals.length;
      int numCols = ((numRows > 0) ? vals[0].length : 0);
      Value[][] result = new Value[numCols][numRows];
      for(int r = 0; r < numRows; ++r) {
        for(int c = 0; c < numCols; ++c) {
          result[c][r] = vals[r][c];
        }
      }
      return ValueSupport.toArray(result);
    }
  });

  public static final Function SPARKLINE = registerFunc(new FuncVar("SPARKLINE", 1, 2) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      ObjectNode node = MAPPER.createObjectNode();
      ArrayNode data = node.putArray("data");
      for(Value val : ValueSupport.flatten(params[0])) {
        if(val.getType() == Value.Type.NUMBER) {
          data.add(val.getAsDouble());
        }
      }
      Value type = getOptionalParam(params, 1);
      if((type != null) && !type.isNull()) {
        node.put("type", toScalar(type).getAsString());
      }
      return toMarker(SPARKLINE_MARKER, node);
    }
  });

  public static final Function IMAGE = registerFunc(new FuncVar("IMAGE", 1, 4) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      String url = toScalar(params[0]).getAsString().trim();
      if(url.isEmpty()) {
        return ValueSupport.VALUE_ERR_VAL;
      }
      ObjectNode node = MAPPER.createObjectNode();
      node.put("url", url);
      putOptionalNumber(node, "mode", params, 1);
      putOptionalNumber(node, "height", params, 2);
      putOptionalNumber(node, "width", params, 3);
      return toMarker(IMAGE_MARKER, node);
    }
  });

  private static boolean isTruthy(Value val) {
    return (!val.isNull() && toScalar(val).getAsBoolean());
  }

  private static Value toFilterResult(Value[][] rows) {
    // nothing left to spill
    if((rows.length == 0) || (rows[0].length == 0)) {
      return ValueSupport.NA_ERR_VAL;
    }
    return ValueSupport.toArray(rows);
  }

  private static boolean rowsEqual(Value[] row1, Value[] row2) {
    if(row1.length != row2.length) {
      return false;
    }
    for(int i = 0; i < row1.length; ++i) {
      Value v1 = row1[i];
      Value v2 = row2[i];
      if(v1.isError() || v2.isError()) {
        if(v1.getError() != v2.getError()) {
          return false;
        }
      } else if((v1.getType() != v2.getType()) ||
                (BuiltinOperators.compare(v1, v2) != 0)) {
        return false;
      }
    }
    return true;
  }

  private static void putOptionalNumber(ObjectNode node, String name,
                                        Value[] params, int idx) {
    Value param = getOptionalParam(params, idx);
    if((param == null) || param.isNull()) {
      return;
    }
    double num = toScalar(param).getAsDouble();
    if((num == Math.rint(num)) && (Math.abs(num) < Integer.MAX_VALUE)) {
      node.put(name, (int)num);
    } else {
      node.put(name, num);
    }
  }

  private static Value toMarker(String prefix, ObjectNode node) {
    try {
      return ValueSupport.toValue(prefix + MAPPER.writeValueAsString(node));
    } catch(JsonProcessingException e) {
      throw new EvalException(e);
    }
  }
}
