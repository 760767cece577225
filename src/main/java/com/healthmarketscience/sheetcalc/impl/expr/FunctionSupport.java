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

import com.healthmarketscience.sheetcalc.expr.EvalContext;
import com.healthmarketscience.sheetcalc.expr.EvalException;
import com.healthmarketscience.sheetcalc.expr.FormulaErrorException;
import com.healthmarketscience.sheetcalc.expr.Function;
import com.healthmarketscience.sheetcalc.expr.Value;
import org.apache.commons.lang3.StringUtils;

/**
 * Base classes for the built-in functions.  Subclasses pick the base class
 * matching their argument count (or {@link FuncVar} for optional and
 * repeated arguments) and only implement the computation, the argument
 * count is checked before it is invoked.
 *
 * @author James Ahlborn
 */
public class FunctionSupport
{
  private FunctionSupport() {}

  public static abstract class BaseFunction implements Function
  {
    private final String _name;
    private final int _minArgs;
    private final int _maxArgs;

    protected BaseFunction(String name, int minArgs, int maxArgs) {
      _name = name;
      _minArgs = minArgs;
      _maxArgs = maxArgs;
    }

    @Override
    public String getName() {
      return _name;
    }

    @Override
    public boolean isVolatile() {
      return false;
    }

    @Override
    public final Value eval(EvalContext ctx, Value... args) {
      if((args.length < _minArgs) || (args.length > _maxArgs)) {
        throw new EvalException(_name + " takes " + describeArgCount() +
                                " arguments, got " + args.length);
      }
      try {
        return evalArgs(ctx, args);
      } catch(FormulaErrorException fe) {
        // an error argument (or result) is reported as that error
        throw fe;
      } catch(RuntimeException e) {
        throw new EvalException(
            "Invalid function call {" + _name + "(" +
            StringUtils.join(args, ", ") + ")}", e);
      }
    }

    /**
     * Computes the result for an argument list of valid length.
     */
    protected abstract Value evalArgs(EvalContext ctx, Value[] args);

    private String describeArgCount() {
      if(_minArgs == _maxArgs) {
        return String.valueOf(_minArgs);
      }
      if(_maxArgs == Integer.MAX_VALUE) {
        return "at least " + _minArgs;
      }
      return _minArgs + " to " + _maxArgs;
    }

    @Override
    public String toString() {
      return getName() + "()";
    }
  }

  public static abstract class Func0 extends BaseFunction
  {
    protected Func0(String name) {
      super(name, 0, 0);
    }

    @Override
    protected final Value evalArgs(EvalContext ctx, Value[] args) {
      return eval0(ctx);
    }

    protected abstract Value eval0(EvalContext ctx);
  }

  public static abstract class Func1 extends BaseFunction
  {
    protected Func1(String name) {
      super(name, 1, 1);
    }

    @Override
    protected final Value evalArgs(EvalContext ctx, Value[] args) {
      return eval1(ctx, args[0]);
    }

    protected abstract Value eval1(EvalContext ctx, Value param);
  }

  public static abstract class Func2 extends BaseFunction
  {
    protected Func2(String name) {
      super(name, 2, 2);
    }

    @Override
    protected final Value evalArgs(EvalContext ctx, Value[] args) {
      return eval2(ctx, args[0], args[1]);
    }

    protected abstract Value eval2(EvalContext ctx, Value param1, Value param2);
  }

  public static abstract class Func3 extends BaseFunction
  {
    protected Func3(String name) {
      super(name, 3, 3);
    }

    @Override
    protected final Value evalArgs(EvalContext ctx, Value[] args) {
      return eval3(ctx, args[0], args[1], args[2]);
    }

    protected abstract Value eval3(EvalContext ctx,
                                   Value param1, Value param2, Value param3);
  }

  /**
   * Function taking between {@code minArgs} and {@code maxArgs} arguments
   * ({@link Integer#MAX_VALUE} for no limit).  Trailing optional arguments
   * are read with the {@code getOptional*Param} helpers.
   */
  public static abstract class FuncVar extends BaseFunction
  {
    protected FuncVar(String name, int minArgs, int maxArgs) {
      super(name, minArgs, maxArgs);
    }

    @Override
    protected final Value evalArgs(EvalContext ctx, Value[] args) {
      return evalVar(ctx, args);
    }

    protected abstract Value evalVar(EvalContext ctx, Value[] params);
  }

  /**
   * @return the optional argument at the given index, or {@code null} if
   *         omitted
   */
  static Value getOptionalParam(Value[] params, int idx) {
    return ((params.length > idx) ? params[idx] : null);
  }

  // an omitted or blank optional argument takes the default

  static double getOptionalDoubleParam(Value[] params, int idx,
                                       double defValue) {
    Value param = getOptionalParam(params, idx);
    return (((param != null) && !param.isNull()) ? param.getAsDouble() :
            defValue);
  }

  static int getOptionalIntParam(Value[] params, int idx, int defValue) {
    Value param = getOptionalParam(params, idx);
    return (((param != null) && !param.isNull()) ? param.getAsInt() :
            defValue);
  }

  static boolean getOptionalBooleanParam(Value[] params, int idx,
                                         boolean defValue) {
    Value param = getOptionalParam(params, idx);
    return (((param != null) && !param.isNull()) ? param.getAsBoolean() :
            defValue);
  }
}
