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

package com.healthmarketscience.sheetcalc;

import java.time.Clock;
import java.util.Random;

import com.healthmarketscience.sheetcalc.expr.FunctionLookup;
import com.healthmarketscience.sheetcalc.impl.FormulaEngineImpl;

/**
 * Builder style class for creating a {@link FormulaEngine}.
 * <p/>
 * Simple example usage:
 * <pre>
 *   FormulaEngine engine = new FormulaEngineBuilder().create();
 * </pre>
 * <p/>
 * Advanced example usage:
 * <pre>
 *   FormulaEngine engine = new FormulaEngineBuilder()
 *     .setClock(Clock.fixed(instant, ZoneOffset.UTC))
 *     .setRandom(new Random(42L))
 *     .create();
 * </pre>
 *
 * @author James Ahlborn
 * @usage _general_class_
 */
public class FormulaEngineBuilder
{
  /** the function provider, default lookup if {@code null} */
  private FunctionLookup _funcLookup;
  /** the clock for TODAY/NOW, system clock if {@code null} */
  private Clock _clock;
  /** the source of random numbers, new Random if {@code null} */
  private Random _random;
  /** decides whether spill targets hold user content, derived from the
      accessor if {@code null} */
  private CellContentChecker _contentChecker;

  public FormulaEngineBuilder() {}

  /**
   * Sets the {@link FunctionLookup} used to resolve function names.
   * @usage _intermediate_method_
   */
  public FormulaEngineBuilder setFunctionLookup(FunctionLookup funcLookup) {
    _funcLookup = funcLookup;
    return this;
  }

  /**
   * Sets the Clock used for the current date and time.
   * @usage _general_method_
   */
  public FormulaEngineBuilder setClock(Clock clock) {
    _clock = clock;
    return this;
  }

  /**
   * Sets the source of random numbers.
   * @usage _general_method_
   */
  public FormulaEngineBuilder setRandom(Random random) {
    _random = random;
    return this;
  }

  /**
   * Sets the checker consulted before writing spilled values into a cell.
   * If unset, a cell holds content when the accessor returns a non-blank
   * value for it.
   * @usage _general_method_
   */
  public FormulaEngineBuilder setContentChecker(
      CellContentChecker contentChecker) {
    _contentChecker = contentChecker;
    return this;
  }

  /**
   * Creates a new FormulaEngine using the current configuration.
   * @usage _general_method_
   */
  public FormulaEngine create() {
    return new FormulaEngineImpl(_funcLookup, _clock, _random,
                                 _contentChecker);
  }
}
