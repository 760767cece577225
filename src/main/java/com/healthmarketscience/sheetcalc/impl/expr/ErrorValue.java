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

import com.healthmarketscience.sheetcalc.expr.FormulaError;
import com.healthmarketscience.sheetcalc.expr.FormulaErrorException;

/**
 * An error result.  Every conversion throws a {@link FormulaErrorException}
 * so that the error propagates out of whatever computation uses it.
 *
 * @author James Ahlborn
 */
public class ErrorValue extends BaseValue
{
  private final FormulaError _error;

  ErrorValue(FormulaError error)
  {
    _error = error;
  }

  @Override
  public Type getType() {
    return Type.ERROR;
  }

  @Override
  public Object get() {
    return _error.getSentinel();
  }

  @Override
  public boolean isError() {
    return true;
  }

  @Override
  public FormulaError getError() {
    return _error;
  }

  @Override
  public boolean getAsBoolean() {
    throw new FormulaErrorException(_error);
  }

  @Override
  public String getAsString() {
    throw new FormulaErrorException(_error);
  }

  @Override
  public Double getAsDouble() {
    throw new FormulaErrorException(_error);
  }
}
