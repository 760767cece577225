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

import java.time.Clock;
import java.util.Random;

/**
 * The EvalConfig allows for customization of the formula evaluation for a
 * given {@link com.healthmarketscience.sheetcalc.FormulaEngine} instance.
 *
 * @see com.healthmarketscience.sheetcalc.expr formula package docs
 *
 * @author James Ahlborn
 */
public interface EvalConfig
{
  /**
   * @return the currently configured FunctionLookup
   */
  public FunctionLookup getFunctionLookup();

  /**
   * Sets the {@link Function} provider to use during formula evaluation.
   * The Functions supported by the default FunctionLookup are documented in
   * {@link com.healthmarketscience.sheetcalc.expr}.  Custom Functions can be
   * implemented and provided to the evaluation engine by installing a custom
   * FunctionLookup instance (which would presumably wrap and delegate to the
   * default FunctionLookup instance for any default implementations).
   */
  public void setFunctionLookup(FunctionLookup lookup);

  /**
   * @return the currently configured Clock
   */
  public Clock getClock();

  /**
   * Sets the Clock used by the date functions which depend on the current
   * date and time.  The default is the system clock in the zone configured
   * by the {@link com.healthmarketscience.sheetcalc.FormulaEngine#TIMEZONE_PROPERTY}.
   */
  public void setClock(Clock clock);

  /**
   * @return the currently configured Random
   */
  public Random getRandom();

  /**
   * Sets the source of random numbers.  Installing a seeded instance makes
   * the random functions repeatable.
   */
  public void setRandom(Random random);
}
