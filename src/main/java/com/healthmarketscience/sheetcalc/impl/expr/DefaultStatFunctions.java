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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.healthmarketscience.sheetcalc.expr.EvalContext;
import com.healthmarketscience.sheetcalc.expr.EvalException;
import com.healthmarketscience.sheetcalc.expr.FormulaError;
import com.healthmarketscience.sheetcalc.expr.FormulaErrorException;
import com.healthmarketscience.sheetcalc.expr.Function;
import com.healthmarketscience.sheetcalc.expr.Value;
import static com.healthmarketscience.sheetcalc.impl.expr.DefaultFunctions.*;
import static com.healthmarketscience.sheetcalc.impl.expr.FunctionSupport.*;

/**
 * Statistical and conditional aggregate functions.
 *
 * @author James Ahlborn
 */
public class DefaultStatFunctions
{
  private DefaultStatFunctions() {}

  static void init() {
    // dummy method to ensure this class is loaded
  }

  public static final Function STDEV = registerFunc(new FuncVar("STDEV", 1, Integer.MAX_VALUE) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      return ValueSupport.toNumericResult(
          Math.sqrt(sampleVariance(ValueSupport.collectNumbers(params))));
    }
  });

  public static final Function VAR = registerFunc(new FuncVar("VAR", 1, Integer.MAX_VALUE) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      return ValueSupport.toNumericResult(
          sampleVariance(ValueSupport.collectNumbers(params)));
    }
  });

  public static final Function MEDIAN = registerFunc(new FuncVar("MEDIAN", 1, Integer.MAX_VALUE) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      List<Double> nums = sorted(ValueSupport.collectNumbers(params));
      return ValueSupport.toNumericResult(percentile(nums, 0.5d));
    }
  });

  public static final Function MODE = registerFunc(new FuncVar("MODE", 1, Integer.MAX_VALUE) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      Map<Double,Integer> counts = new LinkedHashMap<Double,Integer>();
      for(Double num : ValueSupport.collectNumbers(params)) {
        counts.merge(num, 1, Integer::sum);
      }
      // ties go to the value seen first
      Double mode = null;
      int maxCount = 1;
      for(Map.Entry<Double,Integer> e : counts.entrySet()) {
        if(e.getValue() > maxCount) {
          mode = e.getKey();
          maxCount = e.getValue();
        }
      }
      return ((mode != null) ? ValueSupport.toValue(mode.doubleValue()) :
              ValueSupport.NA_ERR_VAL);
    }
  });

  public static final Function PERCENTILE = registerFunc(new Func2("PERCENTILE") {
    @Override
    protected Value eval2(EvalContext ctx, Value param1, Value param2) {
      List<Double> nums = sorted(ValueSupport.collectNumbers(param1));
      double k = toScalar(param2).getAsDouble();
      if((k < 0d) || (k > 1d)) {
        return ValueSupport.toError(FormulaError.NUM);
      }
      return ValueSupport.toNumericResult(percentile(nums, k));
    }
  });

  public static final Function QUARTILE = registerFunc(new Func2("QUARTILE") {
    @Override
    protected Value eval2(EvalContext ctx, Value param1, Value param2) {
      List<Double> nums = sorted(ValueSupport.collectNumbers(param1));
      int quart = toScalar(param2).getAsInt();
      if((quart < 0) || (quart > 4)) {
        return ValueSupport.toError(FormulaError.NUM);
      }
      return ValueSupport.toNumericResult(percentile(nums, quart / 4d));
    }
  });

  public static final Function RANK = registerFunc(new FuncVar("RANK", 2, 3) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      double num = toScalar(params[0]).getAsDouble();
      List<Double> nums = ValueSupport.collectNumbers(params[1]);
      boolean ascending = (getOptionalIntParam(params, 2, 0) != 0);
      if(!nums.contains(num)) {
        return ValueSupport.NA_ERR_VAL;
      }
      int rank = 1;
      for(double other : nums) {
        if(ascending ? (other < num) : (other > num)) {
          ++rank;
        }
      }
      return ValueSupport.toValue(rank);
    }
  });

  public static final Function LARGE = registerFunc(new Func2("LARGE") {
    @Override
    protected Value eval2(EvalContext ctx, Value param1, Value param2) {
      List<Double> nums = sorted(ValueSupport.collectNumbers(param1));
      int k = toScalar(param2).getAsInt();
      if((k < 1) || (k > nums.size())) {
        return ValueSupport.toError(FormulaError.NUM);
      }
      return ValueSupport.toValue(nums.get(nums.size() - k).doubleValue());
    }
  });

  public static final Function SMALL = registerFunc(new Func2("SMALL") {
    @Override
    protected Value eval2(EvalContext ctx, Value param1, Value param2) {
      List<Double> nums = sorted(ValueSupport.collectNumbers(param1));
      int k = toScalar(param2).getAsInt();
      if((k < 1) || (k > nums.size())) {
        return ValueSupport.toError(FormulaError.NUM);
      }
      return ValueSupport.toValue(nums.get(k - 1).doubleValue());
    }
  });

  public static final Function CORREL = registerFunc(new Func2("CORREL") {
    @Override
    protected Value eval2(EvalContext ctx, Value param1, Value param2) {
      double[][] pairs = numericPairs(param1, param2);
      double[] xs = pairs[0];
      double[] ys = pairs[1];
      if(xs.length < 2) {
        return ValueSupport.toError(FormulaError.DIV0);
      }
      double meanX = mean(xs);
      double meanY = mean(ys);
      double cov = 0d;
      double varX = 0d;
      double varY = 0d;
      for(int i = 0; i < xs.length; ++i) {
        double dx = xs[i] - meanX;
        double dy = ys[i] - meanY;
        cov += dx * dy;
        varX += dx * dx;
        varY += dy * dy;
      }
      if((varX == 0d) || (varY == 0d)) {
        return ValueSupport.toError(FormulaError.DIV0);
      }
      return ValueSupport.toNumericResult(cov / Math.sqrt(varX * varY));
    }
  });

  public static final Function FORECAST = registerFunc(new Func3("FORECAST") {
    @Override
    protected Value eval3(EvalContext ctx, Value param1, Value param2,
                          Value param3) {
      double x = toScalar(param1).getAsDouble();
      // known y values come first
      double[][] pairs = numericPairs(param3, param2);
      double[] xs = pairs[0];
      double[] ys = pairs[1];
      if(xs.length == 0) {
        return ValueSupport.toError(FormulaError.DIV0);
      }
      double meanX = mean(xs);
      double meanY = mean(ys);
      double num = 0d;
      double den = 0d;
      for(int i = 0; i < xs.length; ++i) {
        num += (xs[i] - meanX) * (ys[i] - meanY);
        den += (xs[i] - meanX) * (xs[i] - meanX);
      }
      if(den == 0d) {
        return ValueSupport.toError(FormulaError.DIV0);
      }
      double slope = num / den;
      return ValueSupport.toNumericResult(meanY + (slope * (x - meanX)));
    }
  });

  public static final Function SUMIF = registerFunc(new FuncVar("SUMIF", 2, 3) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      Value sumRange = ((params.length > 2) ? params[2] : params[0]);
      List<Double> nums = matchingNumbers(
          sumRange, new Value[]{params[0], params[1]});
      return ValueSupport.toNumericResult(DefaultNumberFunctions.sum(nums));
    }
  });

  public static final Function COUNTIF = registerFunc(new Func2("COUNTIF") {
    @Override
    protected Value eval2(EvalContext ctx, Value param1, Value param2) {
      return ValueSupport.toValue(
          countMatches(new Value[]{param1, param2}));
    }
  });

  public static final Function AVERAGEIF = registerFunc(new FuncVar("AVERAGEIF", 2, 3) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      Value avgRange = ((params.length > 2) ? params[2] : params[0]);
      return average(matchingNumbers(
                         avgRange, new Value[]{params[0], params[1]}));
    }
  });

  public static final Function SUMIFS = registerFunc(new FuncVar("SUMIFS", 3, Integer.MAX_VALUE) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      List<Double> nums = matchingNumbers(params[0], criteriaPairs(params, 1));
      return ValueSupport.toNumericResult(DefaultNumberFunctions.sum(nums));
    }
  });

  public static final Function COUNTIFS = registerFunc(new FuncVar("COUNTIFS", 2, Integer.MAX_VALUE) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      return ValueSupport.toValue(countMatches(criteriaPairs(params, 0)));
    }
  });

  public static final Function AVERAGEIFS = registerFunc(new FuncVar("AVERAGEIFS", 3, Integer.MAX_VALUE) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      return average(matchingNumbers(params[0], criteriaPairs(params, 1)));
    }
  });

  private static double sampleVariance(List<Double> nums) {
    int n = nums.size();
    if(n < 2) {
      throw new FormulaErrorException(FormulaError.DIV0);
    }
    double mean = DefaultNumberFunctions.sum(nums) / n;
    double sumSq = 0d;
    for(double num : nums) {
      sumSq += (num - mean) * (num - mean);
    }
    return sumSq / (n - 1);
  }

  private static List<Double> sorted(List<Double> nums) {
    List<Double> result = new ArrayList<Double>(nums);
    Collections.sort(result);
    return result;
  }

  /**
   * @return the k-th percentile (0 to 1) of the given sorted numbers,
   *         interpolating linearly between neighbors
   */
  private static double percentile(List<Double> sortedNums, double k) {
    if(sortedNums.isEmpty()) {
      throw new FormulaErrorException(FormulaError.NUM);
    }
    double pos = k * (sortedNums.size() - 1);
    int lower = (int)Math.floor(pos);
    int upper = (int)Math.ceil(pos);
    double lowerVal = sortedNums.get(lower);
    return lowerVal + ((pos - lower) * (sortedNums.get(upper) - lowerVal));
  }

  private static double mean(double[] vals) {
    double sum = 0d;
    for(double val : vals) {
      sum += val;
    }
    return sum / vals.length;
  }

  /**
   * @return the x and y values of the positions where both arrays hold
   *         numbers
   */
  private static double[][] numericPairs(Value xParam, Value yParam) {
    List<Value> xVals = ValueSupport.flatten(xParam);
    List<Value> yVals = ValueSupport.flatten(yParam);
    if(xVals.size() != yVals.size()) {
      throw new FormulaErrorException(FormulaError.NA);
    }
    Value err = ValueSupport.findError(xParam, yParam);
    if(err != null) {
      throw new FormulaErrorException(err.getError());
    }
    List<double[]> pairs = new ArrayList<double[]>();
    for(int i = 0; i < xVals.size(); ++i) {
      Value x = xVals.get(i);
      Value y = yVals.get(i);
      if((x.getType() == Value.Type.NUMBER) &&
         (y.getType() == Value.Type.NUMBER)) {
        pairs.add(new double[]{x.getAsDouble(), y.getAsDouble()});
      }
    }
    double[][] result = new double[2][pairs.size()];
    for(int i = 0; i < pairs.size(); ++i) {
      result[0][i] = pairs.get(i)[0];
      result[1][i] = pairs.get(i)[1];
    }
    return result;
  }

  private static Value[] criteriaPairs(Value[] params, int start) {
    int num = params.length - start;
    if((num % 2) != 0) {
      throw new EvalException("Criteria ranges and criteria must be paired");
    }
    Value[] pairs = new Value[num];
    System.arraycopy(params, start, pairs, 0, num);
    return pairs;
  }

  /**
   * @return a grid marking the positions (relative to the first criteria
   *         range) matched by all the given range/criterion pairs
   */
  private static boolean[][] matchAll(Value[] pairs) {
    Value[][] first = toGrid(pairs[0]);
    int numRows = first.length;
    int numCols = ((numRows > 0) ? first[0].length : 0);
    boolean[][] matched = new boolean[numRows][numCols];
    for(boolean[] row : matched) {
      Arrays.fill(row, true);
    }

    for(int p = 0; p < pairs.length; p += 2) {
      Value[][] range = toGrid(pairs[p]);
      CriteriaMatcher matcher = CriteriaMatcher.create(pairs[p + 1]);
      for(int r = 0; r < numRows; ++r) {
        for(int c = 0; c < numCols; ++c) {
          if(matched[r][c] && !matcher.matches(getCell(range, r, c))) {
            matched[r][c] = false;
          }
        }
      }
    }
    return matched;
  }

  private static int countMatches(Value[] pairs) {
    int count = 0;
    for(boolean[] row : matchAll(pairs)) {
      for(boolean m : row) {
        if(m) {
          ++count;
        }
      }
    }
    return count;
  }

  /**
   * @return the numbers in the value range at the positions matched by all
   *         the given range/criterion pairs
   */
  private static List<Double> matchingNumbers(Value valueParam, Value[] pairs) {
    Value[][] vals = toGrid(valueParam);
    boolean[][] matched = matchAll(pairs);
    List<Double> nums = new ArrayList<Double>();
    for(int r = 0; r < matched.length; ++r) {
      for(int c = 0; c < matched[r].length; ++c) {
        if(!matched[r][c]) {
          continue;
        }
        Value val = getCell(vals, r, c);
        if(val.isError()) {
          throw new FormulaErrorException(val.getError());
        }
        if(val.getType() == Value.Type.NUMBER) {
          nums.add(val.getAsDouble());
        }
      }
    }
    return nums;
  }

  private static Value average(List<Double> nums) {
    if(nums.isEmpty()) {
      return ValueSupport.toError(FormulaError.DIV0);
    }
    return ValueSupport.toNumericResult(
        DefaultNumberFunctions.sum(nums) / nums.size());
  }

  private static Value getCell(Value[][] vals, int row, int col) {
    if((row < vals.length) && (col < vals[row].length)) {
      return vals[row][col];
    }
    return ValueSupport.NULL_VAL;
  }
}
