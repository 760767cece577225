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

package com.healthmarketscience.sheetcalc.impl;

import java.time.Clock;
import java.time.ZoneId;
import java.util.Random;

import com.healthmarketscience.sheetcalc.FormulaEngine;
import com.healthmarketscience.sheetcalc.expr.EvalConfig;
import com.healthmarketscience.sheetcalc.expr.FunctionLookup;
import com.healthmarketscience.sheetcalc.impl.expr.DefaultFunctions;

/**
 *
 * @author James Ahlborn
 */
public class EngineEvalConfig implements EvalConfig
{
  private FunctionLookup _funcs = DefaultFunctions.LOOKUP;
  private Clock _clock;
  private Random _random;

  public EngineEvalConfig(FunctionLookup funcs, Clock clock, Random random) {
    setFunctionLookup(funcs);
    setClock(clock);
    setRandom(random);
  }

  @Override
  public FunctionLookup getFunctionLookup() {
    return _funcs;
  }

  @Override
  public void setFunctionLookup(FunctionLookup lookup) {
    _funcs = ((lookup != null) ? lookup : DefaultFunctions.LOOKUP);
  }

  @Override
  public Clock getClock() {
    return _clock;
  }

  @Override
  public void setClock(Clock clock) {
    _clock = ((clock != null) ? clock : Clock.system(getDefaultZoneId()));
  }

  @Override
  public Random getRandom() {
    return _random;
  }

  @Override
  public void setRandom(Random random) {
    _random = ((random != null) ? random : new Random());
  }

  /**
   * Returns the default ZoneId.  This is normally the platform default
   * ZoneId but can be overridden using the system property
   * {@value com.healthmarketscience.sheetcalc.FormulaEngine#TIMEZONE_PROPERTY}.
   * @usage _advanced_method_
   */
  public static ZoneId getDefaultZoneId()
  {
    String tzProp = System.getProperty(FormulaEngine.TIMEZONE_PROPERTY);
    if(tzProp != null) {
      tzProp = tzProp.trim();
      if(tzProp.length() > 0) {
        return ZoneId.of(tzProp);
      }
    }

    // use system default
    return ZoneId.systemDefault();
  }
}
