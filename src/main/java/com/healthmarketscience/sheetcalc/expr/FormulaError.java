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

/**
 * The error results a formula may produce.  The string form of each error is
 * the sentinel displayed in (and stored for) the cell.
 *
 * @author James Ahlborn
 */
public enum FormulaError
{
  /** type, arity or parse failure */
  VALUE("#VALUE!"),
  /** zero divisor */
  DIV0("#DIV/0!"),
  /** non-finite or otherwise invalid numeric result */
  NUM("#NUM!"),
  /** unknown function or identifier */
  NAME("#NAME?"),
  /** lookup miss */
  NA("#N/A"),
  /** circular reference or invalid reference offset */
  REF("#REF!"),
  /** array result blocked from spilling */
  SPILL("#SPILL!"),
  NULL("#NULL!");

  private final String _str;

  private FormulaError(String str) {
    _str = str;
  }

  public String getSentinel() {
    return _str;
  }

  /**
   * @return the error with the given sentinel string (case insensitive), or
   *         {@code null} if the string is not an error sentinel
   */
  public static FormulaError fromString(String str) {
    if((str == null) || (str.length() < 3) || (str.charAt(0) != '#')) {
      return null;
    }
    for(FormulaError err : values()) {
      if(err._str.equalsIgnoreCase(str)) {
        return err;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return _str;
  }
}
