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

import com.healthmarketscience.sheetcalc.expr.Value;

/**
 * Source of the current values of cells, supplied by the cell store.
 * Implementations must be pure and synchronous.  Plain values may be
 * converted with
 * {@link com.healthmarketscience.sheetcalc.impl.expr.ValueSupport#toValue(Object)}.
 *
 * @author James Ahlborn
 * @usage _general_class_
 */
@FunctionalInterface
public interface CellValueAccessor
{
  /**
   * @param sheet the sheet name, {@code null} for the current sheet
   * @param col the 0-based column
   * @param row the 0-based row
   *
   * @return the value of the given cell, never {@code null} (empty cells are
   *         a {@link Value.Type#NULL} value)
   */
  public Value getCellValue(String sheet, int col, int row);
}
