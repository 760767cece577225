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

import com.healthmarketscience.sheetcalc.CellKey;

/**
 * EvalContext encapsulates the state of a single top-level formula
 * evaluation which is visible to {@link Function} implementations.
 *
 * @author James Ahlborn
 */
public interface EvalContext
{
  /**
   * @return the clock used for the current date and time (TODAY, NOW)
   */
  public Clock getClock();

  /**
   * @return the source of random numbers (RAND, RANDBETWEEN)
   */
  public Random getRandom();

  /**
   * @return the cell whose formula is being evaluated, or {@code null} if the
   *         formula is being evaluated without a cell
   */
  public CellKey getCurrentCell();
}
