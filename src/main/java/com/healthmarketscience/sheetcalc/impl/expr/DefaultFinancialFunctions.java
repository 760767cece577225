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
import com.healthmarketscience.sheetcalc.expr.FormulaErrorException;
import com.healthmarketscience.sheetcalc.expr.Function;
import com.healthmarketscience.sheetcalc.expr.Value;
import static com.healthmarketscience.sheetcalc.impl.expr.DefaultFunctions.*;
import static com.healthmarketscience.sheetcalc.impl.expr.FunctionSupport.*;

/**
 * Time value of money functions.  Cash paid out is negative, cash received
 * is positive.
 *
 * @author James Ahlborn
 */
public class DefaultFinancialFunctions
{
  /** 0 - payment at the end of the period (default) */
  private static final int PMT_END_PERIOD = 0;
  /** 1 - payment at the start of the period */
  private static final int PMT_BEG_PERIOD = 1;

  private static final int MAX_ITERATIONS = 100;
  private static final double PRECISION = 1.0e-10;
  private static final double DEFAULT_GUESS = 0.1;

  private DefaultFinancialFunctions() {}

  static void init() {
    // dummy method to ensure this class is loaded
  }


  public static final Function PMT = registerFunc(new FuncVar("PMT", 3, 5) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      double rate = toScalar(params[0]).getAsDouble();
      double nper = toScalar(params[1]).getAsDouble();
      double pv = toScalar(params[2]).getAsDouble();
      double fv = getOptionalDoubleParam(params, 3, 0d);
      int pmtType = getPaymentType(params, 4);

      return ValueSupport.toNumericResult(
          calculatePayment(rate, nper, pv, fv, pmtType));
    }
  });

  public static final Function FV = registerFunc(new FuncVar("FV", 3, 5) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      double rate = toScalar(params[0]).getAsDouble();
      double nper = toScalar(params[1]).getAsDouble();
      double pmt = toScalar(params[2]).getAsDouble();
      double pv = getOptionalDoubleParam(params, 3, 0d);
      int pmtType = getPaymentType(params, 4);

      return ValueSupport.toNumericResult(
          calculateFutureValue(rate, nper, pmt, pv, pmtType));
    }
  });

  public static final Function PV = registerFunc(new FuncVar("PV", 3, 5) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      double rate = toScalar(params[0]).getAsDouble();
      double nper = toScalar(params[1]).getAsDouble();
      double pmt = toScalar(params[2]).getAsDouble();
      double fv = getOptionalDoubleParam(params, 3, 0d);
      int pmtType = getPaymentType(params, 4);

      return ValueSupport.toNumericResult(
          calculatePresentValue(rate, nper, pmt, fv, pmtType));
    }
  });

  public static final Function NPER = registerFunc(new FuncVar("NPER", 3, 5) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      double rate = toScalar(params[0]).getAsDouble();
      double pmt = toScalar(params[1]).getAsDouble();
      double pv = toScalar(params[2]).getAsDouble();
      double fv = getOptionalDoubleParam(params, 3, 0d);
      int pmtType = getPaymentType(params, 4);

      return ValueSupport.toNumericResult(
          calculatePaymentPeriods(rate, pmt, pv, fv, pmtType));
    }
  });

  public static final Function NPV = registerFunc(new FuncVar("NPV", 2, Integer.MAX_VALUE) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      double rate = toScalar(params[0]).getAsDouble();
      Value[] flowParams = new Value[params.length - 1];
      System.arraycopy(params, 1, flowParams, 0, flowParams.length);
      List<Double> flows = ValueSupport.collectNumbers(flowParams);

      // the first cash flow is discounted one full period
      double npv = 0d;
      for(int i = 0; i < flows.size(); ++i) {
        npv += flows.get(i) / Math.pow(1d + rate, i + 1);
      }
      return ValueSupport.toNumericResult(npv);
    }
  });

  public static final Function IRR = registerFunc(new FuncVar("IRR", 1, 2) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      List<Double> flows = ValueSupport.collectNumbers(params[0]);
      double guess = getOptionalDoubleParam(params, 1, DEFAULT_GUESS);
      if(flows.isEmpty()) {
        return ValueSupport.toError(FormulaError.NUM);
      }
      return ValueSupport.toNumericResult(calculateIrr(flows, guess));
    }
  });

  public static final Function RATE = registerFunc(new FuncVar("RATE", 3, 6) {
    @Override
    protected Value evalVar(EvalContext ctx, Value[] params) {
      double nper = toScalar(params[0]).getAsDouble();
      double pmt = toScalar(params[1]).getAsDouble();
      double pv = toScalar(params[2]).getAsDouble();
      double fv = getOptionalDoubleParam(params, 3, 0d);
      int pmtType = getPaymentType(params, 4);
      double guess = getOptionalDoubleParam(params, 5, DEFAULT_GUESS);

      return ValueSupport.toNumericResult(
          calculateRate(nper, pmt, pv, fv, pmtType, guess));
    }
  });

  private static double calculateFutureValue(
      double rate, double nper, double pmt, double pv, int pmtType) {
    if(rate == 0d) {
      return -1 * (pv + (nper * pmt));
    }
    double r1 = ((pmtType == PMT_BEG_PERIOD) ? (rate + 1) : 1);
    double p1 = Math.pow((rate + 1), nper);
    return ((((1 - p1) * r1 * pmt) / rate) - (pv * p1));
  }

  private static double calculatePresentValue(
      double rate, double nper, double pmt, double fv, int pmtType) {
    if(rate == 0d) {
      return -1 * ((nper * pmt) + fv);
    }
    double r1 = ((pmtType == PMT_BEG_PERIOD) ? (rate + 1) : 1);
    double p1 = Math.pow((rate + 1), nper);
    return ((((1 - p1) / rate) * r1 * pmt) - fv) / p1;
  }

  private static double calculatePayment(
      double rate, double nper, double pv, double fv, int pmtType) {
    if(rate == 0d) {
      if(nper == 0d) {
        throw new FormulaErrorException(FormulaError.DIV0);
      }
      return -1 * (fv + pv) / nper;
    }
    double r1 = ((pmtType == PMT_BEG_PERIOD) ? (rate + 1) : 1);
    double p1 = Math.pow((rate + 1), nper);
    return (fv + (pv * p1)) * rate / (r1 * (1 - p1));
  }

  private static double calculatePaymentPeriods(
      double rate, double pmt, double pv, double fv, int pmtType) {
    if(rate == 0d) {
      if(pmt == 0d) {
        throw new FormulaErrorException(FormulaError.NUM);
      }
      return -1 * (fv + pv) / pmt;
    }

    double cr = ((pmtType == PMT_BEG_PERIOD) ? (1 + rate) : 1) * pmt / rate;
    double ratio = (cr - fv) / (pv + cr);
    if(ratio <= 0d) {
      throw new FormulaErrorException(FormulaError.NUM);
    }
    return Math.log(ratio) / Math.log(1 + rate);
  }

  /**
   * Newton-Raphson search for the rate which zeroes the net present value
   * of the given flows (the first flow is undiscounted).
   */
  private static double calculateIrr(List<Double> flows, double guess) {
    double rate = guess;
    for(int iter = 0; iter < MAX_ITERATIONS; ++iter) {
      double npv = 0d;
      double dnpv = 0d;
      for(int i = 0; i < flows.size(); ++i) {
        double pow = Math.pow(1d + rate, i);
        npv += flows.get(i) / pow;
        dnpv -= (i * flows.get(i)) / (pow * (1d + rate));
      }
      if(Math.abs(npv) < PRECISION) {
        return rate;
      }
      if(dnpv == 0d) {
        break;
      }
      rate -= npv / dnpv;
    }
    throw new FormulaErrorException(FormulaError.NUM);
  }

  /**
   * Newton-Raphson search for the periodic rate satisfying the annuity
   * equation.
   */
  private static double calculateRate(double nper, double pmt, double pv,
                                      double fv, int pmtType, double guess) {
    double rate = guess;
    for(int iter = 0; iter < MAX_ITERATIONS; ++iter) {
      double y = annuityBalance(rate, nper, pmt, pv, fv, pmtType);
      if(Math.abs(y) < PRECISION) {
        return rate;
      }
      // central difference derivative
      double h = Math.max(Math.abs(rate) * 1.0e-6, 1.0e-9);
      double dy = (annuityBalance(rate + h, nper, pmt, pv, fv, pmtType) -
                   annuityBalance(rate - h, nper, pmt, pv, fv, pmtType)) /
        (2 * h);
      if((dy == 0d) || Double.isNaN(dy)) {
        break;
      }
      rate -= y / dy;
    }
    throw new FormulaErrorException(FormulaError.NUM);
  }

  private static double annuityBalance(double rate, double nper, double pmt,
                                       double pv, double fv, int pmtType) {
    if(rate == 0d) {
      return pv + (pmt * nper) + fv;
    }
    double p1 = Math.pow(1 + rate, nper);
    return (pv * p1) + (pmt * (1 + (rate * pmtType)) * (p1 - 1) / rate) + fv;
  }

  private static int getPaymentType(Value[] params, int idx) {
    int pmtType = getOptionalIntParam(params, idx, PMT_END_PERIOD);
    return ((pmtType != PMT_END_PERIOD) ? PMT_BEG_PERIOD : PMT_END_PERIOD);
  }
}
