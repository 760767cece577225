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

/**
 *
 * @author James Ahlborn
 */
public abstract class BaseValue implements Value
{
  @Override
  public boolean isNull() {
    return(getType() == Type.NULL);
  }

  @Override
  public boolean isError() {
    return false;
  }

  @Override
  public FormulaError getError() {
    return null;
  }

  @Override
  public boolean getAsBoolean() {
    throw invalidConversion(Type.BOOLEAN);
  }

  @Override
  public String getAsString() {
    throw invalidConversion(Type.STRING);
  }

  @Override
  public Double getAsDouble() {
    throw invalidConversion(Type.NUMBER);
  }

  @Override
  public Integer getAsInt() {
    double d = getAsDouble();
    if(Double.isNaN(d) || Double.isInfinite(d)) {
      throw invalidConversion(Type.NUMBER);
    }
    return (int)d;
  }

  @Override
  public Value[][] getAsArray() {
    return new Value[][]{{this}};
  }

  protected EvalException invalidConversion(Type newType) {
    return new EvalException(
        this + " cannot be converted to " + newType);
  }

  @Override
  public String toString() {
    return "Value[" + getType() + "] '" + get() + "'";
  }
}
