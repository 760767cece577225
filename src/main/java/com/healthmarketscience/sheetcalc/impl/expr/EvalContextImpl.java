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

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import com.healthmarketscience.sheetcalc.CellKey;
import com.healthmarketscience.sheetcalc.expr.EvalContext;
import com.healthmarketscience.sheetcalc.expr.Function;
import com.healthmarketscience.sheetcalc.expr.FunctionLookup;

/**
 * State of one top-level formula evaluation.  A new instance is created for
 * every top-level evaluation, so the LAMBDA closures registered here can
 * never leak into (or collide with ids from) another evaluation.
 *
 * @author James Ahlborn
 */
public class EvalContextImpl implements EvalContext
{
  private final FunctionLookup _funcs;
  private final Clock _clock;
  private final Random _random;
  private final CellKey _currentCell;
  private final List<Closure> _closures = new ArrayList<Closure>();

  public EvalContextImpl(FunctionLookup funcs, Clock clock, Random random,
                         CellKey currentCell) {
    _funcs = funcs;
    _clock = clock;
    _random = random;
    _currentCell = currentCell;
  }

  @Override
  public Clock getClock() {
    return _clock;
  }

  @Override
  public Random getRandom() {
    return _random;
  }

  @Override
  public CellKey getCurrentCell() {
    return _currentCell;
  }

  public Function getFunction(String name) {
    return _funcs.getFunction(name);
  }

  LambdaValue registerClosure(Closure closure) {
    _closures.add(closure);
    return new LambdaValue(_closures.size() - 1);
  }

  Closure getClosure(LambdaValue lambda) {
    int id = lambda.getId();
    return (((id >= 0) && (id < _closures.size())) ? _closures.get(id) :
            null);
  }

  int getClosureCount() {
    return _closures.size();
  }

  /**
   * A LAMBDA body bundled with its parameter names and the scope (and
   * therefore the cell accessor) it was defined in.
   */
  static final class Closure
  {
    private final List<String> _paramNames;
    private final FormulaParser.Expr _body;
    private final Scope _scope;

    Closure(List<String> paramNames, FormulaParser.Expr body, Scope scope) {
      _paramNames = paramNames;
      _body = body;
      _scope = scope;
    }

    List<String> getParamNames() {
      return _paramNames;
    }

    FormulaParser.Expr getBody() {
      return _body;
    }

    Scope getScope() {
      return _scope;
    }
  }
}
