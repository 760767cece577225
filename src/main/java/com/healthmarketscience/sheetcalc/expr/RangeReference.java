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

import java.util.ArrayList;
import java.util.List;

import com.healthmarketscience.sheetcalc.CellKey;

/**
 * A reference to a rectangular block of cells, e.g. {@code A1:B3}.  The two
 * corners are kept as written, the min/max accessors normalize them.
 *
 * @author James Ahlborn
 */
public final class RangeReference implements Reference
{
  private final CellReference _start;
  private final CellReference _end;

  public RangeReference(CellReference start, CellReference end) {
    _start = start;
    _end = end;
  }

  @Override
  public String getSheet() {
    return _start.getSheet();
  }

  public CellReference getStart() {
    return _start;
  }

  public CellReference getEnd() {
    return _end;
  }

  public int getMinRow() {
    return Math.min(_start.getRow(), _end.getRow());
  }

  public int getMaxRow() {
    return Math.max(_start.getRow(), _end.getRow());
  }

  public int getMinCol() {
    return Math.min(_start.getCol(), _end.getCol());
  }

  public int getMaxCol() {
    return Math.max(_start.getCol(), _end.getCol());
  }

  public int getRowCount() {
    return getMaxRow() - getMinRow() + 1;
  }

  public int getColCount() {
    return getMaxCol() - getMinCol() + 1;
  }

  /**
   * @return the cell at the given offset from the top left corner of this
   *         range, with the offset clamped to the bounds of this range
   */
  public CellReference getClampedCell(int rowOff, int colOff) {
    int row = getMinRow() + Math.min(rowOff, getRowCount() - 1);
    int col = getMinCol() + Math.min(colOff, getColCount() - 1);
    return _start.moveTo(col, row);
  }

  /**
   * @return the keys of all the cells currently within this range, in
   *         row-major order
   */
  public List<CellKey> getCellKeys() {
    List<CellKey> keys = new ArrayList<CellKey>(getRowCount() * getColCount());
    for(int r = getMinRow(); r <= getMaxRow(); ++r) {
      for(int c = getMinCol(); c <= getMaxCol(); ++c) {
        keys.add(new CellKey(getSheet(), r, c));
      }
    }
    return keys;
  }

  @Override
  public boolean equals(Object o) {
    if(this == o) {
      return true;
    }
    if(!(o instanceof RangeReference)) {
      return false;
    }
    RangeReference other = (RangeReference)o;
    return (_start.equals(other._start) && _end.equals(other._end));
  }

  @Override
  public int hashCode() {
    return _start.hashCode() * 31 + _end.hashCode();
  }

  @Override
  public String toString() {
    return _start + ":" + _end.toLocalString();
  }
}
