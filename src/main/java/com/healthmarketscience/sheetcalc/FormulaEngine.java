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

import java.util.Map;

import com.healthmarketscience.sheetcalc.expr.EvalConfig;
import com.healthmarketscience.sheetcalc.expr.Expression;
import com.healthmarketscience.sheetcalc.expr.ParseException;
import com.healthmarketscience.sheetcalc.expr.Value;

/**
 * A FormulaEngine parses, evaluates and recalculates spreadsheet formulas.
 * It owns the dependency graph between formula cells, the per-cell formula
 * and value caches, and the ownership of cells written by array ("spill")
 * results.  The engine never touches cell storage, cell values are read
 * through a {@link CellValueAccessor} and computed values are returned to the
 * caller for storage and display.
 * <p>
 * Formula content problems never surface as exceptions, they are reported as
 * error values (see {@link com.healthmarketscience.sheetcalc.expr.FormulaError}).
 * <p>
 * An engine is not thread-safe, it is expected to be driven by a single
 * thread.
 * <p>
 * Simple example usage:
 * <pre>
 *   FormulaEngine engine = new FormulaEngineBuilder().create();
 *   Value result = engine.evaluateFormula("=SUM(A1:A3)", accessor);
 * </pre>
 *
 * @author James Ahlborn
 * @usage _general_class_
 */
public interface FormulaEngine
{
  /** system property which can be used to set the default TimeZone used for
   *  the current date and time (TODAY, NOW).
   * @usage _general_field_
   */
  public static final String TIMEZONE_PROPERTY =
    "com.healthmarketscience.sheetcalc.timeZone";

  /**
   * @return the evaluation configuration for this engine, which may be
   *         modified at any time
   */
  public EvalConfig getEvalConfig();

  /**
   * Parses the given formula text (the leading "=" is optional).
   *
   * @throws ParseException if the text is not a valid formula
   */
  public Expression parseFormula(String text);

  /**
   * Evaluates the given formula text without associating it with a cell.
   * Array results are returned as is.
   */
  public Value evaluateFormula(String text, CellValueAccessor accessor);

  /**
   * Evaluates the given formula text for the given cell.  The parsed formula
   * is cached for the cell until the text changes.  An array result is
   * spilled into the neighboring cells (or replaced with a {@code #SPILL!}
   * error if blocked) and the origin cell's own scalar value is returned.
   *
   * @param cellKey the cell owning the formula, may be {@code null}
   */
  public Value evaluateFormula(String text, CellValueAccessor accessor,
                               CellKey cellKey);

  /**
   * Replaces the dependency edges of the given cell with those referenced by
   * the given formula text.  Non-formula text simply clears the cell's
   * edges.
   *
   * @return {@code false} if the formula would create a circular reference
   *         (in which case no edges are added for the cell and the caller
   *         should store {@code #REF!}), {@code true} otherwise
   */
  public boolean updateDependencies(CellKey cellKey, String text);

  /**
   * Recalculates all formulas transitively depending on the given changed
   * cell, each after all of its own precedents.
   *
   * @return the new values keyed by cell, in recalculation order
   */
  public Map<CellKey,Value> recalculate(CellKey changedKey,
                                        FormulaSource formulas,
                                        CellValueAccessor accessor);

  /**
   * @return the value spilled into the given cell, or {@code null} if the
   *         cell is not a spill target
   */
  public Value getSpillValue(CellKey cellKey);

  public boolean isSpillTarget(CellKey cellKey);

  /**
   * @return the cell whose array result spilled into the given cell, or
   *         {@code null} if the cell is not a spill target
   */
  public CellKey getSpillSource(CellKey cellKey);

  /**
   * Tears down any spill owned by the given source cell.
   */
  public void clearSpill(CellKey sourceKey);

  /**
   * @return the last value computed for the given cell (including spilled
   *         values), or {@code null} if none
   */
  public Value getCachedValue(CellKey cellKey);

  /**
   * @return {@code true} if the given cell's formula was rejected because it
   *         would create a circular reference
   */
  public boolean isCircular(CellKey cellKey);

  /**
   * Forgets everything about the given cell: its parsed formula, its
   * dependency edges, its cached value and any spill it owns.
   */
  public void removeCell(CellKey cellKey);

  /**
   * Clears the parsed formula and value caches and all spills.  The
   * dependency graph is retained.
   */
  public void clearCache();
}
