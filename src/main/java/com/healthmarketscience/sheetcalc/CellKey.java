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

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

/**
 * Canonical identifier for a cell, combining an optional sheet name with a
 * 0-based row and column.  CellKeys are the node ids of the dependency graph
 * and the keys of the engine's caches.
 *
 * @author James Ahlborn
 * @usage _general_class_
 */
public final class CellKey implements Comparable<CellKey>
{
  private static final Pattern KEY_PAT = Pattern.compile(
      "^(?:(?:'((?:[^']|'')+)'|([^!']+))!)?\\$?([A-Za-z]{1,3})\\$?([0-9]+)$");
  private static final Pattern PLAIN_SHEET_PAT = Pattern.compile("^\\w+$");

  private final String _sheet;
  private final int _row;
  private final int _col;

  public CellKey(int row, int col) {
    this(null, row, col);
  }

  public CellKey(String sheet, int row, int col) {
    if((row < 0) || (col < 0)) {
      throw new IllegalArgumentException(
          "Invalid cell position row " + row + " col " + col);
    }
    _sheet = StringUtils.trimToNull(sheet);
    _row = row;
    _col = col;
  }

  /**
   * @return the sheet name, or {@code null} for the current sheet
   */
  public String getSheet() {
    return _sheet;
  }

  /**
   * @return the 0-based row
   */
  public int getRow() {
    return _row;
  }

  /**
   * @return the 0-based column
   */
  public int getCol() {
    return _col;
  }

  /**
   * @return the key of the cell at the given offset from this cell in the
   *         same sheet
   */
  public CellKey offset(int rowOff, int colOff) {
    return new CellKey(_sheet, _row + rowOff, _col + colOff);
  }

  /**
   * Parses a key in the form {@code B3}, {@code Sheet1!B3} or
   * {@code 'My Sheet'!$B$3}.
   *
   * @throws IllegalArgumentException if the string is not a valid key
   */
  public static CellKey parse(String str) {
    Matcher m = KEY_PAT.matcher(StringUtils.trimToEmpty(str));
    if(!m.matches()) {
      throw new IllegalArgumentException("Invalid cell key '" + str + "'");
    }
    String sheet = ((m.group(1) != null) ? m.group(1).replace("''", "'") :
                    m.group(2));
    int row = 0;
    try {
      row = Integer.parseInt(m.group(4)) - 1;
    } catch(NumberFormatException e) {
      throw new IllegalArgumentException("Invalid cell key '" + str + "'", e);
    }
    return new CellKey(sheet, row, fromColumnLetters(m.group(3)));
  }

  /**
   * @return the 0-based column index for the given letters (A=0, Z=25,
   *         AA=26, ...)
   */
  public static int fromColumnLetters(String letters) {
    int col = 0;
    for(int i = 0; i < letters.length(); ++i) {
      char c = Character.toUpperCase(letters.charAt(i));
      if((c < 'A') || (c > 'Z')) {
        throw new IllegalArgumentException(
            "Invalid column letters '" + letters + "'");
      }
      col = (col * 26) + (c - 'A' + 1);
    }
    return col - 1;
  }

  /**
   * @return the column letters for the given 0-based column index
   */
  public static String toColumnLetters(int col) {
    StringBuilder sb = new StringBuilder();
    int cur = col + 1;
    while(cur > 0) {
      int rem = (cur - 1) % 26;
      sb.append((char)('A' + rem));
      cur = (cur - 1) / 26;
    }
    return sb.reverse().toString();
  }

  /**
   * @return the given sheet name, quoted if it contains anything other than
   *         word characters
   */
  public static String quoteSheetName(String sheet) {
    if(PLAIN_SHEET_PAT.matcher(sheet).matches()) {
      return sheet;
    }
    return "'" + sheet.replace("'", "''") + "'";
  }

  @Override
  public int compareTo(CellKey other) {
    int cmp = StringUtils.compare(_sheet, other._sheet);
    if(cmp != 0) {
      return cmp;
    }
    cmp = Integer.compare(_row, other._row);
    return ((cmp != 0) ? cmp : Integer.compare(_col, other._col));
  }

  @Override
  public boolean equals(Object o) {
    if(this == o) {
      return true;
    }
    if(!(o instanceof CellKey)) {
      return false;
    }
    CellKey other = (CellKey)o;
    return ((_row == other._row) && (_col == other._col) &&
            Objects.equals(_sheet, other._sheet));
  }

  @Override
  public int hashCode() {
    return Objects.hash(_sheet, _row, _col);
  }

  @Override
  public String toString() {
    String local = toColumnLetters(_col) + (_row + 1);
    return ((_sheet != null) ? quoteSheetName(_sheet) + "!" + local : local);
  }
}
