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
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import com.healthmarketscience.sheetcalc.CellContentChecker;
import com.healthmarketscience.sheetcalc.CellKey;
import com.healthmarketscience.sheetcalc.CellValueAccessor;
import com.healthmarketscience.sheetcalc.FormulaEngine;
import com.healthmarketscience.sheetcalc.FormulaSource;
import com.healthmarketscience.sheetcalc.expr.CellReference;
import com.healthmarketscience.sheetcalc.expr.EvalConfig;
import com.healthmarketscience.sheetcalc.expr.EvalException;
import com.healthmarketscience.sheetcalc.expr.Expression;
import com.healthmarketscience.sheetcalc.expr.FormulaError;
import com.healthmarketscience.sheetcalc.expr.FormulaErrorException;
import com.healthmarketscience.sheetcalc.expr.FunctionLookup;
import com.healthmarketscience.sheetcalc.expr.ParseException;
import com.healthmarketscience.sheetcalc.expr.RangeReference;
import com.healthmarketscience.sheetcalc.expr.Reference;
import com.healthmarketscience.sheetcalc.expr.Value;
import com.healthmarketscience.sheetcalc.impl.expr.EvalContextImpl;
import com.healthmarketscience.sheetcalc.impl.expr.FormulaParser;
import com.healthmarketscience.sheetcalc.impl.expr.FormulaParser.ParsedFormula;
import com.healthmarketscience.sheetcalc.impl.expr.ValueSupport;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 *
 * @author James Ahlborn
 * @usage _intermediate_class_
 */
public class FormulaEngineImpl implements FormulaEngine
{
  private static final Log LOG = LogFactory.getLog(FormulaEngineImpl.class);

  private static final String FORMULA_PREFIX = "=";

  private final EngineEvalConfig _evalConfig;
  /** parsed formula per cell, reparsed only when the text changes */
  private final Map<CellKey,ParsedFormula> _formulas =
    new HashMap<CellKey,ParsedFormula>();
  /** last computed value per cell, including spilled values */
  private final Map<CellKey,Value> _values = new HashMap<CellKey,Value>();
  private final DependencyGraph _graph = new DependencyGraph();
  private final SpillManager _spills;

  public FormulaEngineImpl(FunctionLookup funcLookup, Clock clock,
                           Random random, CellContentChecker contentChecker)
  {
    _evalConfig = new EngineEvalConfig(funcLookup, clock, random);
    _spills = new SpillManager(_values, contentChecker);
  }

  @Override
  public EvalConfig getEvalConfig() {
    return _evalConfig;
  }

  DependencyGraph getDependencyGraph() {
    return _graph;
  }

  @Override
  public Expression parseFormula(String text) {
    return FormulaParser.parse(text);
  }

  @Override
  public Value evaluateFormula(String text, CellValueAccessor accessor) {
    ParsedFormula formula = null;
    try {
      formula = FormulaParser.parse(text);
    } catch(ParseException pe) {
      logParseFailure(null, text, pe);
      return ValueSupport.VALUE_ERR_VAL;
    }

    Value result = eval(formula, accessor, null);
    if(result.getType() == Value.Type.ARRAY) {
      Value[][] vals = result.getAsArray();
      if((vals.length == 0) || (vals[0].length == 0)) {
        return ValueSupport.NA_ERR_VAL;
      }
    }
    return result;
  }

  @Override
  public Value evaluateFormula(String text, CellValueAccessor accessor,
                               CellKey cellKey) {
    if(cellKey == null) {
      return evaluateFormula(text, accessor);
    }

    Value result = null;
    ParsedFormula formula = getFormula(cellKey, text);
    if(formula != null) {
      result = eval(formula, accessor, cellKey);
    } else {
      result = ValueSupport.VALUE_ERR_VAL;
    }

    result = _spills.applyResult(cellKey, result, accessor);
    _values.put(cellKey, result);
    return result;
  }

  @Override
  public boolean updateDependencies(CellKey cellKey, String text) {
    ParsedFormula formula = (isFormula(text) ? getFormula(cellKey, text) :
                             null);
    if(formula == null) {
      // plain values and unparseable formulas read nothing
      _formulas.remove(cellKey);
      _graph.setDependencies(cellKey, Collections.<CellKey>emptySet());
      return true;
    }

    Collection<Reference> refs = new ArrayList<Reference>();
    formula.collectReferences(refs);
    Set<CellKey> precedents = new LinkedHashSet<CellKey>();
    for(Reference ref : refs) {
      if(ref instanceof CellReference) {
        precedents.add(resolveSheet(((CellReference)ref).toCellKey(),
                                    cellKey));
      } else if(ref instanceof RangeReference) {
        for(CellKey key : ((RangeReference)ref).getCellKeys()) {
          precedents.add(resolveSheet(key, cellKey));
        }
      }
    }

    if(!_graph.setDependencies(cellKey, precedents)) {
      LOG.warn("Circular reference in formula for " + cellKey + " '" +
               text + "'");
      return false;
    }
    return true;
  }

  @Override
  public Map<CellKey,Value> recalculate(CellKey changedKey,
                                        FormulaSource formulas,
                                        CellValueAccessor accessor) {
    Map<CellKey,Value> results = new LinkedHashMap<CellKey,Value>();
    if(_graph.isCircular(changedKey)) {
      results.put(changedKey, ValueSupport.toError(FormulaError.REF));
    }

    List<CellKey> order = _graph.getRecalcOrder(changedKey);
    for(CellKey key : order) {
      if(_graph.isCircular(key)) {
        results.put(key, ValueSupport.toError(FormulaError.REF));
        continue;
      }
      String text = formulas.getFormula(key);
      if(!isFormula(text)) {
        // no longer a formula, nothing to compute
        continue;
      }
      Value val = evaluateFormula(
          text, new RecalcAccessor(key, results, accessor), key);
      results.put(key, val);
    }

    if(LOG.isDebugEnabled()) {
      LOG.debug("Recalculated " + results.size() + " cells after change to " +
                changedKey);
    }
    return results;
  }

  @Override
  public Value getSpillValue(CellKey cellKey) {
    return _spills.getSpillValue(cellKey);
  }

  @Override
  public boolean isSpillTarget(CellKey cellKey) {
    return _spills.isSpillTarget(cellKey);
  }

  @Override
  public CellKey getSpillSource(CellKey cellKey) {
    return _spills.getSpillSource(cellKey);
  }

  @Override
  public void clearSpill(CellKey sourceKey) {
    _spills.clearSpill(sourceKey);
  }

  @Override
  public Value getCachedValue(CellKey cellKey) {
    return _values.get(cellKey);
  }

  @Override
  public boolean isCircular(CellKey cellKey) {
    return _graph.isCircular(cellKey);
  }

  @Override
  public void removeCell(CellKey cellKey) {
    _spills.clearSpill(cellKey);
    _formulas.remove(cellKey);
    _values.remove(cellKey);
    _graph.removeCell(cellKey);
  }

  @Override
  public void clearCache() {
    _spills.clear();
    _formulas.clear();
    _values.clear();
  }

  /**
   * @return the parsed formula for the given cell, reparsing only if the
   *         text changed, or {@code null} if the text does not parse
   */
  private ParsedFormula getFormula(CellKey cellKey, String text) {
    ParsedFormula formula = _formulas.get(cellKey);
    if((formula != null) && formula.toRawString().equals(text)) {
      return formula;
    }
    try {
      formula = FormulaParser.parse(text);
      _formulas.put(cellKey, formula);
      return formula;
    } catch(ParseException pe) {
      logParseFailure(cellKey, text, pe);
      _formulas.remove(cellKey);
      return null;
    }
  }

  private Value eval(ParsedFormula formula, CellValueAccessor accessor,
                     CellKey cellKey) {
    // fresh context per top-level call, so closures never outlive it
    EvalContextImpl ctx = new EvalContextImpl(
        _evalConfig.getFunctionLookup(), _evalConfig.getClock(),
        _evalConfig.getRandom(), cellKey);
    Value result = null;
    try {
      result = formula.eval(ctx, accessor);
    } catch(FormulaErrorException fe) {
      return ValueSupport.toError(fe.getError());
    } catch(EvalException ee) {
      if(LOG.isDebugEnabled()) {
        LOG.debug("Failed evaluating '" + formula + "', result is " +
                  FormulaError.VALUE, ee);
      }
      return ValueSupport.VALUE_ERR_VAL;
    }

    if(result.getType() == Value.Type.LAMBDA) {
      // closures cannot be stored in a cell
      return ValueSupport.VALUE_ERR_VAL;
    }
    return result;
  }

  private static void logParseFailure(CellKey cellKey, String text,
                                      ParseException pe) {
    if(LOG.isDebugEnabled()) {
      LOG.debug("Failed parsing formula " +
                ((cellKey != null) ? "for " + cellKey + " " : "") +
                "'" + text + "', result is " + FormulaError.VALUE, pe);
    }
  }

  private static boolean isFormula(String text) {
    return ((text != null) && text.trim().startsWith(FORMULA_PREFIX));
  }

  private static CellKey resolveSheet(CellKey key, CellKey cellKey) {
    if((key.getSheet() == null) && (cellKey.getSheet() != null)) {
      return new CellKey(cellKey.getSheet(), key.getRow(), key.getCol());
    }
    return key;
  }

  /**
   * Accessor used during a recalculation pass: values computed earlier in
   * the pass and spilled values shadow those of the caller's accessor.
   */
  private final class RecalcAccessor implements CellValueAccessor
  {
    private final CellKey _cellKey;
    private final Map<CellKey,Value> _results;
    private final CellValueAccessor _accessor;

    private RecalcAccessor(CellKey cellKey, Map<CellKey,Value> results,
                           CellValueAccessor accessor) {
      _cellKey = cellKey;
      _results = results;
      _accessor = accessor;
    }

    @Override
    public Value getCellValue(String sheet, int col, int row) {
      CellKey key = resolveSheet(new CellKey(sheet, row, col), _cellKey);
      Value val = _results.get(key);
      if(val == null) {
        val = _spills.getSpillValue(key);
      }
      return ((val != null) ? val : _accessor.getCellValue(sheet, col, row));
    }
  }
}
