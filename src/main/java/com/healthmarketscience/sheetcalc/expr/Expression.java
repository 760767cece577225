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

import java.util.Collection;

/**
 * An Expression is a parsed handle to a formula.  Expressions are evaluated
 * by the {@link com.healthmarketscience.sheetcalc.FormulaEngine}, which
 * caches them per cell until the formula text changes.
 *
 * @author James Ahlborn
 */
public interface Expression
{
  /**
   * @return a detailed string which indicates how the formula was
   *         interpreted by the parser.
   */
  public String toDebugString();

  /**
   * @return a parsed and re-formated version of the formula.  This may look
   *         slightly different than the original, raw string, although it
   *         should be an equivalent formula.
   */
  public String toCleanString();

  /**
   * @return the original, unparsed formula string.  This is the same as the
   *         value which will be returned by {@link Object#toString}.
   */
  public String toRawString();

  /**
   * @return {@code true} if this is a constant formula.  A constant formula
   *         will always return the same result when evaluated and does not
   *         read any cells.
   */
  public boolean isConstant();

  /**
   * Adds any cell and range references from this formula to the given
   * collection, in the order they appear in the formula.
   */
  public void collectReferences(Collection<Reference> refs);
}
