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

package com.healthmarketscience.sheetcalc.expr;

/**
 * Exception which carries a specific {@link FormulaError} out of a
 * computation.  The evaluator converts it back to the corresponding error
 * value instead of the generic {@link FormulaError#VALUE}.
 *
 * @author James Ahlborn
 */
public class FormulaErrorException extends EvalException
{
  private static final long serialVersionUID = 20240312L;

  private final FormulaError _error;

  public FormulaErrorException(FormulaError error) {
    this(error, error.getSentinel());
  }

  public FormulaErrorException(FormulaError error, String message) {
    super(message);
    _error = error;
  }

  public FormulaError getError() {
    return _error;
  }
}
