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
import java.math.RoundingMode;
import java.util.List;

import com.healthmarketscience.sheetcalc.expr.EvalContext;
import com.healthmarketscience.sheetcalc.expr.FormulaError;
import com.healthmarketscience.sheetcalc.expr.Function;
import com.healthmarketscience.sheetcalc.expr.Value;
import static com.healthmarketscience.sheetcalc.impl.expr.DefaultFunctions.*;
import static com.healthmarketscience.sheetcalc.impl.expr.FunctionSupport.*;

/**
 * Math functions and the basic aggregates.
 *
 * @author James Ahlborn
 */
public class DefaultNumberFunctions
{

  private DefaultNumberFunctions() {}

  static void init() {
    // dummy method to ensure this class is loaded
  }

  public static final Function SUM = registerFunc(new FuncVar("SUM", 1, Integer.MAX_VALUE) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      return ValueSupport.toNumericResult(
          sum(ValueSupport.collectNumbers(params)));
    }
  });

  public static final Function AVERAGE = registerFunc(new FuncVar("AVERAGE", 1, Integer.MAX_VALUE) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      List<Double> nums = ValueSupport.collectNumbers(params);
      if(nums.isEmpty()) {
        return ValueSupport.toError(FormulaError.DIV0);
      }
      return ValueSupport.toNumericResult(sum(nums) / nums.size());
    }
  });

  public static final Function COUNT = registerFunc(new FuncVar("COUNT", 1, Integer.MAX_VALUE) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      int count = 0;
      for(Value val : ValueSupport.flatten(params)) {
        if(val.getType() == Value.Type.NUMBER) {
          ++count;
        }
      }
      return ValueSupport.toValue(count);
    }
  });

  public static final Function COUNTA = registerFunc(new FuncVar("COUNTA", 1, Integer.MAX_VALUE) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      int count = 0;
      for(Value val : ValueSupport.flatten(params)) {
        if(!ValueSupport.isBlank(val)) {
          ++count;
        }
      }
      return ValueSupport.toValue(count);
    }
  });

  public static final Function COUNTBLANK = registerFunc(new FuncVar("COUNTBLANK", 1, Integer.MAX_VALUE) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      int count = 0;
      for(Value val : ValueSupport.flatten(params)) {
        if(ValueSupport.isBlank(val)) {
          ++count;
        }
      }
      return ValueSupport.toValue(count);
    }
  });

  public static final Function MIN = registerFunc(new FuncVar("MIN", 1, Integer.MAX_VALUE) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      List<Double> nums = ValueSupport.collectNumbers(params);
      if(nums.isEmpty()) {
        return ValueSupport.ZERO_VAL;
      }
      double min = Double.POSITIVE_INFINITY;
      for(double d : nums) {
        min = Math.min(min, d);
      }
      return ValueSupport.toValue(min);
    }
  });

  public static final Function MAX = registerFunc(new FuncVar("MAX", 1, Integer.MAX_VALUE) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      List<Double> nums = ValueSupport.collectNumbers(params);
      if(nums.isEmpty()) {
        return ValueSupport.ZERO_VAL;
      }
      double max = Double.NEGATIVE_INFINITY;
      for(double d : nums) {
        max = Math.max(max, d);
      }
      return ValueSupport.toValue(max);
    }
  });

  public static final Function ROUND = registerFunc(new RoundFunc("ROUND", RoundingMode.HALF_UP));

  public static final Function ROUNDUP = registerFunc(new RoundFunc("ROUNDUP", RoundingMode.UP));

  public static final Function ROUNDDOWN = registerFunc(new RoundFunc("ROUNDDOWN", RoundingMode.DOWN));

  public static final Function ABS = registerFunc(new Func1("ABS") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      return ValueSupport.toValue(Math.abs(toScalar(param1).getAsDouble()));
    }
  });

  public static final Function SQRT = registerFunc(new Func1("SQRT") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      double d = toScalar(param1).getAsDouble();
      if(d < 0.0d) {
        return ValueSupport.toError(FormulaError.NUM);
      }
      return ValueSupport.toValue(Math.sqrt(d));
    }
  });

  public static final Function POWER = registerFunc(new Func2("POWER") {
    @Override
    protected Value eval2(EvalContext ctx, Value param1, Value param2) {
      return ValueSupport.toNumericResult(
          Math.pow(toScalar(param1).getAsDouble(),
                   toScalar(param2).getAsDouble()));
    }
  });

  public static final Function MOD = registerFunc(new Func2("MOD") {
    @Override
    protected Value eval2(EvalContext ctx, Value param1, Value param2) {
      double num = toScalar(param1).getAsDouble();
      double div = toScalar(param2).getAsDouble();
      if(div == 0.0d) {
        return ValueSupport.toError(FormulaError.DIV0);
      }
      // result takes the sign of the divisor
      return ValueSupport.toNumericResult(num - (div * Math.floor(num / div)));
    }
  });

  public static final Function CEILING = registerFunc(new FuncVar("CEILING", 1, 2) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      double num = toScalar(params[0]).getAsDouble();
      double sig = getOptionalDoubleParam(params, 1, 1.0d);
      if(sig == 0.0d) {
        return ValueSupport.ZERO_VAL;
      }
      return ValueSupport.toNumericResult(Math.ceil(num / sig) * sig);
    }
  });

  public static final Function FLOOR = registerFunc(new FuncVar("FLOOR", 1, 2) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      double num = toScalar(params[0]).getAsDouble();
      double sig = getOptionalDoubleParam(params, 1, 1.0d);
      if(sig == 0.0d) {
        return ValueSupport.ZERO_VAL;
      }
      return ValueSupport.toNumericResult(Math.floor(num / sig) * sig);
    }
  });

  public static final Function LOG = registerFunc(new FuncVar("LOG", 1, 2) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      double num = toScalar(params[0]).getAsDouble();
      double base = getOptionalDoubleParam(params, 1, 10.0d);
      if((num <= 0.0d) || (base <= 0.0d) || (base == 1.0d)) {
        return ValueSupport.toError(FormulaError.NUM);
      }
      return ValueSupport.toNumericResult(Math.log(num) / Math.log(base));
    }
  });

  public static final Function LOG10 = registerFunc(new Func1("LOG10") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      double num = toScalar(param1).getAsDouble();
      if(num <= 0.0d) {
        return ValueSupport.toError(FormulaError.NUM);
      }
      return ValueSupport.toValue(Math.log10(num));
    }
  });

  public static final Function EXP = registerFunc(new Func1("EXP") {
    @Override
    protected Value eval1(EvalContext ctx, Value param1) {
      return ValueSupport.toNumericResult(
          Math.exp(toScalar(param1).getAsDouble()));
    }
  });

  public static final Function PI = registerFunc(new Func0("PI") {
    @Override
    protected Value eval0(EvalContext ctx) {
      return ValueSupport.toValue(Math.PI);
    }
  });

  public static final Function RAND = registerFunc(new Func0("RAND") {
    @Override
    public boolean isVolatile() {
      return true;
    }
    @Override
    protected Value eval0(EvalContext ctx) {
      return ValueSupport.toValue(ctx.getRandom().nextDouble());
    }
  });

  public static final Function RANDBETWEEN = registerFunc(new Func2("RANDBETWEEN") {
    @Override
    public boolean isVolatile() {
      return true;
    }
    @Override
    protected Value eval2(EvalContext ctx, Value param1, Value param2) {
      double low = Math.ceil(toScalar(param1).getAsDouble());
      double high = Math.floor(toScalar(param2).getAsDouble());
      if(low > high) {
        return ValueSupport.toError(FormulaError.NUM);
      }
      long span = (long)(high - low) + 1L;
      double offset = Math.floor(ctx.getRandom().nextDouble() * span);
      return ValueSupport.toValue(low + offset);
    }
  });

  private static final class RoundFunc extends FuncVar
  {
    private final RoundingMode _mode;

    private RoundFunc(String name, RoundingMode mode) {
      super(name, 1, 2);
      _mode = mode;
    }

    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      double num = toScalar(params[0]).getAsDouble();
      int digits = getOptionalIntParam(params, 1, 0);
      if(Double.isNaN(num) || Double.isInfinite(num)) {
        return ValueSupport.toError(FormulaError.NUM);
      }
      // BigDecimal rounds the decimal representation, so 2.675 -> 2.68
      BigDecimal bd = BigDecimal.valueOf(num).setScale(digits, _mode);
      return ValueSupport.toValue(bd.doubleValue());
    }
  }

  static double sum(List<Double> nums) {
    double sum = 0.0d;
    for(double d : nums) {
      sum += d;
    }
    return sum;
  }
}
