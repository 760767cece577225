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
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import com.healthmarketscience.sheetcalc.expr.Value;
import com.healthmarketscience.sheetcalc.impl.expr.ValueSupport;

/**
 * In memory sheet used by the tests.  Each cell holds either a plain value
 * or formula text (starting with "="), computed formula values are tracked
 * separately.
 *
 * @author James Ahlborn
 */
public class SheetFixture
  implements CellValueAccessor, FormulaSource, CellContentChecker
{
  /** 2024-03-15 10:30:00 UTC, a friday */
  public static final Clock FIXED_CLOCK = Clock.fixed(
      Instant.parse("2024-03-15T10:30:00Z"), ZoneOffset.UTC);
  public static final double FIXED_TODAY = 45366d;

  private final Map<CellKey,Object> _contents = new HashMap<CellKey,Object>();
  private final Map<CellKey,Value> _computed = new HashMap<CellKey,Value>();

  public SheetFixture() {}

  public static FormulaEngine newEngine() {
    return newEngine(null);
  }

  /**
   * @return a new engine which asks the given checker (if any) whether a
   *         spill target holds content
   */
  public static FormulaEngine newEngine(CellContentChecker contentChecker) {
    return new FormulaEngineBuilder()
      .setClock(FIXED_CLOCK)
      .setRandom(new Random(42L))
      .setContentChecker(contentChecker)
      .create();
  }

  public static CellKey key(String str) {
    return CellKey.parse(str);
  }

  /**
   * Sets the content of the given cell, a String starting with "=" is a
   * formula.
   */
  public SheetFixture set(String cell, Object content) {
    CellKey key = CellKey.parse(cell);
    _computed.remove(key);
    if(content == null) {
      _contents.remove(key);
    } else {
      _contents.put(key, content);
    }
    return this;
  }

  /**
   * Sets a column of values starting at the given cell.
   */
  public SheetFixture setColumn(String startCell, Object... contents) {
    CellKey start = CellKey.parse(startCell);
    for(int i = 0; i < contents.length; ++i) {
      set(start.offset(i, 0).toString(), contents[i]);
    }
    return this;
  }

  public void setComputed(CellKey key, Value val) {
    _computed.put(key, val);
  }

  public void setComputed(Map<CellKey,Value> vals) {
    _computed.putAll(vals);
  }

  /**
   * Registers the formula in the given cell with the engine and evaluates
   * it, storing the result.
   *
   * @return the result of {@link FormulaEngine#updateDependencies}
   */
  public boolean enter(FormulaEngine engine, String cell, String formula) {
    set(cell, formula);
    CellKey key = CellKey.parse(cell);
    boolean ok = engine.updateDependencies(key, formula);
    if(ok) {
      _computed.put(key, engine.evaluateFormula(formula, this, key));
    }
    return ok;
  }

  @Override
  public Value getCellValue(String sheet, int col, int row) {
    CellKey key = new CellKey(sheet, row, col);
    Value val = _computed.get(key);
    if(val != null) {
      return val;
    }
    Object content = _contents.get(key);
    if((content == null) || isFormulaText(content)) {
      return null;
    }
    return ValueSupport.toValue(content);
  }

  @Override
  public String getFormula(CellKey key) {
    Object content = _contents.get(key);
    return ((content != null) ? content.toString() : null);
  }

  @Override
  public boolean hasCellContent(int row, int col) {
    return _contents.containsKey(new CellKey(row, col));
  }

  private static boolean isFormulaText(Object content) {
    return ((content instanceof String) &&
            ((String)content).startsWith("="));
  }

  /**
   * @return the plain java form of the given value: {@code null} for blank,
   *         Double, String, Boolean, the sentinel String for errors and
   *         nested Lists (rows of columns) for arrays
   */
  public static Object toJava(Value val) {
    if(val == null) {
      return null;
    }
    if(val.getType() == Value.Type.ARRAY) {
      List<List<Object>> rows = new ArrayList<List<Object>>();
      for(Value[] row : val.getAsArray()) {
        List<Object> cols = new ArrayList<Object>();
        for(Value cell : row) {
          cols.add(toJava(cell));
        }
        rows.add(cols);
      }
      return rows;
    }
    return val.get();
  }

  /**
   * @return the expected java form of an array result, see
   *         {@link #toJava}
   */
  public static List<List<Object>> rows(Object[]... rows) {
    List<List<Object>> result = new ArrayList<List<Object>>();
    for(Object[] row : rows) {
      result.add(Arrays.asList(row));
    }
    return result;
  }

  public static Object[] row(Object... vals) {
    return vals;
  }
}
