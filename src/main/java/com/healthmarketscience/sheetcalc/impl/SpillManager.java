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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.healthmarketscience.sheetcalc.CellContentChecker;
import com.healthmarketscience.sheetcalc.CellKey;
import com.healthmarketscience.sheetcalc.CellValueAccessor;
import com.healthmarketscience.sheetcalc.expr.FormulaError;
import com.healthmarketscience.sheetcalc.expr.Value;
import com.healthmarketscience.sheetcalc.impl.expr.ValueSupport;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Tracks which cells were written by array ("spill") results.  Each spill
 * target has exactly one owning source cell.  Spilled values live in the
 * engine's value cache.
 *
 * @author James Ahlborn
 */
public class SpillManager
{
  private static final Log LOG = LogFactory.getLog(SpillManager.class);

  private final Map<CellKey,Value> _valueCache;
  private final CellContentChecker _contentChecker;
  /** target cell -> owning source cell */
  private final Map<CellKey,CellKey> _owners = new HashMap<CellKey,CellKey>();
  /** source cell -> its current spill targets (row-major) */
  private final Map<CellKey,List<CellKey>> _spills =
    new HashMap<CellKey,List<CellKey>>();

  /**
   * @param contentChecker may be {@code null}, in which case a cell has
   *                       content if the accessor returns a non-blank value
   *                       for it
   */
  public SpillManager(Map<CellKey,Value> valueCache,
                      CellContentChecker contentChecker) {
    _valueCache = valueCache;
    _contentChecker = contentChecker;
  }

  /**
   * Applies the result of evaluating the given source cell.  Any spill the
   * source previously owned is torn down first.  An array result is then
   * spilled into the cells below and to the right of the source unless one
   * of them holds content (or belongs to another source).
   *
   * @return the scalar value of the source cell itself: the array's first
   *         element, {@code #SPILL!} if the spill was blocked, {@code #N/A}
   *         for an empty array, otherwise the result unchanged
   */
  public Value applyResult(CellKey source, Value result,
                           CellValueAccessor accessor) {
    List<CellKey> oldTargets = clearSpill(source);

    if(result.getType() != Value.Type.ARRAY) {
      return result;
    }

    Value[][] vals = result.getAsArray();
    if((vals.length == 0) || (vals[0].length == 0)) {
      return ValueSupport.NA_ERR_VAL;
    }

    Set<CellKey> previouslyOwned = new HashSet<CellKey>(oldTargets);
    List<CellKey> targets = new ArrayList<CellKey>();
    for(int r = 0; r < vals.length; ++r) {
      for(int c = 0; c < vals[r].length; ++c) {
        if((r == 0) && (c == 0)) {
          continue;
        }
        CellKey target = source.offset(r, c);
        CellKey owner = _owners.get(target);
        if(((owner != null) && !owner.equals(source)) ||
           (!previouslyOwned.contains(target) &&
            hasContent(target, accessor))) {
          if(LOG.isDebugEnabled()) {
            LOG.debug("Spill from " + source + " blocked by " + target);
          }
          return ValueSupport.toError(FormulaError.SPILL);
        }
        targets.add(target);
      }
    }

    for(CellKey target : targets) {
      Value val = vals[target.getRow() - source.getRow()]
        [target.getCol() - source.getCol()];
      _valueCache.put(target, val);
      _owners.put(target, source);
    }
    if(!targets.isEmpty()) {
      _spills.put(source, targets);
    }
    return vals[0][0];
  }

  /**
   * Tears down the spill owned by the given source cell.
   *
   * @return the cells which were spill targets of the source
   */
  public List<CellKey> clearSpill(CellKey source) {
    List<CellKey> targets = _spills.remove(source);
    if(targets == null) {
      return Collections.emptyList();
    }
    for(CellKey target : targets) {
      _owners.remove(target);
      _valueCache.remove(target);
    }
    return targets;
  }

  public boolean isSpillTarget(CellKey cell) {
    return _owners.containsKey(cell);
  }

  public CellKey getSpillSource(CellKey cell) {
    return _owners.get(cell);
  }

  public Value getSpillValue(CellKey cell) {
    return (isSpillTarget(cell) ? _valueCache.get(cell) : null);
  }

  public void clear() {
    for(CellKey target : _owners.keySet()) {
      _valueCache.remove(target);
    }
    _owners.clear();
    _spills.clear();
  }

  private boolean hasContent(CellKey cell, CellValueAccessor accessor) {
    if(_contentChecker != null) {
      return _contentChecker.hasCellContent(cell.getRow(), cell.getCol());
    }
    Value val = ValueSupport.toValue(
        accessor.getCellValue(cell.getSheet(), cell.getCol(), cell.getRow()));
    return !ValueSupport.isBlank(val);
  }
}
