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

import java.util.Objects;

import com.healthmarketscience.sheetcalc.CellKey;

/**
 * A reference to a single cell, e.g. {@code Sheet1!$B3}.  Rows and columns
 * are 0-based.
 *
 * @author James Ahlborn
 */
public final class CellReference implements Reference
{
  private final String _sheet;
  private final int _col;
  private final int _row;
  private final boolean _colAbsolute;
  private final boolean _rowAbsolute;

  public CellReference(String sheet, int col, int row,
                       boolean colAbsolute, boolean rowAbsolute) {
    if((col < 0) || (row < 0)) {
      throw new IllegalArgumentException(
          "Invalid cell position col " + col + " row " + row);
    }
    _sheet = sheet;
    _col = col;
    _row = row;
    _colAbsolute = colAbsolute;
    _rowAbsolute = rowAbsolute;
  }

  @Override
  public String getSheet() {
    return _sheet;
  }

  public int getCol() {
    return _col;
  }

  public int getRow() {
    return _row;
  }

  public boolean isColAbsolute() {
    return _colAbsolute;
  }

  public boolean isRowAbsolute() {
    return _rowAbsolute;
  }

  /**
   * @return a copy of this reference pointing at the given cell in the same
   *         sheet
   */
  public CellReference moveTo(int col, int row) {
    return new CellReference(_sheet, col, row, _colAbsolute, _rowAbsolute);
  }

  /**
   * @return a copy of this reference with the given sheet qualifier
   */
  public CellReference withSheet(String sheet) {
    return new CellReference(sheet, _col, _row, _colAbsolute, _rowAbsolute);
  }

  public CellKey toCellKey() {
    return new CellKey(_sheet, _row, _col);
  }

  /**
   * @return this reference without the sheet qualifier
   */
  public String toLocalString() {
    StringBuilder sb = new StringBuilder();
    if(_colAbsolute) {
      sb.append('$');
    }
    sb.append(CellKey.toColumnLetters(_col));
    if(_rowAbsolute) {
      sb.append('$');
    }
    return sb.append(_row + 1).toString();
  }

  @Override
  public boolean equals(Object o) {
    if(this == o) {
      return true;
    }
    if(!(o instanceof CellReference)) {
      return false;
    }
    CellReference other = (CellReference)o;
    return ((_col == other._col) && (_row == other._row) &&
            (_colAbsolute == other._colAbsolute) &&
            (_rowAbsolute == other._rowAbsolute) &&
            Objects.equals(_sheet, other._sheet));
  }

  @Override
  public int hashCode() {
    return Objects.hash(_sheet, _col, _row);
  }

  @Override
  public String toString() {
    String str = toLocalString();
    return ((_sheet != null) ? CellKey.quoteSheetName(_sheet) + "!" + str :
            str);
  }
}
