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

import java.util.HashMap;
import java.util.Map;

import com.healthmarketscience.sheetcalc.expr.EvalContext;
import com.healthmarketscience.sheetcalc.expr.EvalException;
import com.healthmarketscience.sheetcalc.expr.FormulaErrorException;
import com.healthmarketscience.sheetcalc.expr.Function;
import com.healthmarketscience.sheetcalc.expr.FunctionLookup;
import com.healthmarketscience.sheetcalc.expr.Value;
import static com.healthmarketscience.sheetcalc.impl.expr.FunctionSupport.*;

/**
 * Registry of the default functions, along with the logical and information
 * functions.
 *
 * @author James Ahlborn
 */
public class DefaultFunctions
{
  private static final Map<String,Function> FUNCS =
    new HashMap<String,Function>();

  static {
    // load all default functions
    DefaultTextFunctions.init();
    DefaultNumberFunctions.init();
    DefaultDateFunctions.init();
    DefaultFinancialFunctions.init();
    DefaultLookupFunctions.init();
    DefaultStatFunctions.init();
    DefaultArrayFunctions.init();
  }

  public static final FunctionLookup LOOKUP = new FunctionLookup() {
    @Override
    public Function getFunction(String name) {
      return FUNCS.get(Scope.toLookupName(name));
    }
  };

  private static final int TYPE_NUMBER = 1;
  private static final int TYPE_TEXT = 2;
  private static final int TYPE_LOGICAL = 4;
  private static final int TYPE_ERROR = 16;
  private static final int TYPE_ARRAY = 64;
  private static final int TYPE_LAMBDA = 128;

  private DefaultFunctions() {}


  public static final Function IFS = registerFunc(new FuncVar("IFS", 2, Integer.MAX_VALUE) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      if((params.length % 2) != 0) {
        throw new EvalException("Odd number of parameters");
      }
      for(int i = 0; i < params.length; i += 2) {
        if(params[i].getAsBoolean()) {
          return params[i + 1];
        }
      }
      return ValueSupport.NA_ERR_VAL;
    }
  });

  public static final Function SWITCH = registerFunc(new FuncVar("SWITCH", 3, Integer.MAX_VALUE) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      Value expr = params[0];
      if(expr.isError()) {
        return expr;
      }
      int numCases = (params.length - 1) / 2;
      for(int i = 0; i < numCases; ++i) {
        int idx = 1 + (i * 2);
        if(BuiltinOperators.compare(expr, params[idx]) == 0) {
          return params[idx + 1];
        }
      }
      // a trailing unpaired value is the default
      boolean hasDefault = ((params.length % 2) == 0);
      return (hasDefault ? params[params.length - 1] :
              ValueSupport.NA_ERR_VAL);
    }
  });

  public static final Function AND = registerFunc(new FuncVar("AND", 1, Integer.MAX_VALUE) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      boolean result = true;
      for(Value val : ValueSupport.flatten(params)) {
        if(!val.isNull()) {
          result &= val.getAsBoolean();
        }
      }
      return ValueSupport.toValue(result);
    }
  });

  public static final Function OR = registerFunc(new FuncVar("OR", 1, Integer.MAX_VALUE) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      boolean result = false;
      for(Value val : ValueSupport.flatten(params)) {
        if(!val.isNull()) {
          result |= val.getAsBoolean();
        }
      }
      return ValueSupport.toValue(result);
    }
  });

  public static final Function XOR = registerFunc(new FuncVar("XOR", 1, Integer.MAX_VALUE) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      int numTrue = 0;
      for(Value val : ValueSupport.flatten(params)) {
        if(!val.isNull() && val.getAsBoolean()) {
          ++numTrue;
        }
      }
      return ValueSupport.toValue((numTrue % 2) == 1);
    }
  });

  public static final Function NOT = registerFunc(new Func1("NOT") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      return ValueSupport.toValue(!toScalar(param1).getAsBoolean());
    }
  });

  public static final Function ISBLANK = registerFunc(new Func1("ISBLANK") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      return ValueSupport.toValue(param1.isNull());
    }
  });

  public static final Function ISERROR = registerFunc(new Func1("ISERROR") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      return ValueSupport.toValue(param1.isError());
    }
  });

  public static final Function ISNUMBER = registerFunc(new Func1("ISNUMBER") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      return ValueSupport.toValue(param1.getType() == Value.Type.NUMBER);
    }
  });

  public static final Function ISTEXT = registerFunc(new Func1("ISTEXT") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      return ValueSupport.toValue(param1.getType() == Value.Type.STRING);
    }
  });

  public static final Function ISLOGICAL = registerFunc(new Func1("ISLOGICAL") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      return ValueSupport.toValue(param1.getType() == Value.Type.BOOLEAN);
    }
  });

  public static final Function TYPE = registerFunc(new Func1("TYPE") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      switch(param1.getType()) {
      case STRING:
        return ValueSupport.toValue(TYPE_TEXT);
      case BOOLEAN:
        return ValueSupport.toValue(TYPE_LOGICAL);
      case ERROR:
        return ValueSupport.toValue(TYPE_ERROR);
      case ARRAY:
        return ValueSupport.toValue(TYPE_ARRAY);
      case LAMBDA:
        return ValueSupport.toValue(TYPE_LAMBDA);
      default:
        // blank cells count as numbers
        return ValueSupport.toValue(TYPE_NUMBER);
      }
    }
  });

  /**
   * @return the given value, which must not be an array (or closure)
   *
   * @throws FormulaErrorException if the value is an error
   */
  static Value toScalar(Value val) {
    if(val.isError()) {
      throw new FormulaErrorException(val.getError());
    }
    if(!val.getType().isScalar()) {
      throw new EvalException(val + " is not a single value");
    }
    return val;
  }

  /**
   * @return the rows of the given value, a single value being a 1x1 array
   *
   * @throws FormulaErrorException if the value is an error
   */
  static Value[][] toGrid(Value val) {
    if(val.isError()) {
      throw new FormulaErrorException(val.getError());
    }
    if(val.getType() == Value.Type.LAMBDA) {
      throw new EvalException(val + " is not an array");
    }
    return val.getAsArray();
  }

  static Function registerFunc(Function func) {
    registerFunc(func.getName(), func);
    return func;
  }

  private static void registerFunc(String fname, Function func) {
    String lookupFname = Scope.toLookupName(fname);
    if(FUNCS.put(lookupFname, func) != null) {
      throw new IllegalStateException("Duplicate function " + fname);
    }
  }
}
