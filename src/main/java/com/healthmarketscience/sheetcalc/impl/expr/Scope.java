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

package com.healthmarketscience.sheetcalc.impl.expr;

import java.util.Locale;

import com.healthmarketscience.sheetcalc.CellValueAccessor;
import com.healthmarketscience.sheetcalc.expr.CellReference;
import com.healthmarketscience.sheetcalc.expr.FormulaError;
import com.healthmarketscience.sheetcalc.expr.Value;

/**
 * Immutable chain of name bindings (from LET and LAMBDA) active while
 * evaluating a formula, along with the accessor for cell values.  Binding a
 * name creates a new child scope, so a LAMBDA closure can simply capture the
 * scope it was defined in.
 *
 * @author James Ahlborn
 */
final class Scope
{
  private static final int NO_OFFSET = -1;

  private final Scope _parent;
  private final String _name;
  private final Value _value;
  private final CellValueAccessor _accessor;
  private final int _rowOff;
  private final int _colOff;

  private Scope(Scope parent, String name, Value value,
                CellValueAccessor accessor, int rowOff, int colOff) {
    _parent = parent;
    _name = name;
    _value = value;
    _accessor = accessor;
    _rowOff = rowOff;
    _colOff = colOff;
  }

  static Scope root(CellValueAccessor accessor) {
    return new Scope(null, null, null, accessor, NO_OFFSET, NO_OFFSET);
  }

  /**
   * @return a child scope binding the given name (case insensitive)
   */
  Scope bind(String name, Value value) {
    return new Scope(this, toLookupName(name), value, _accessor, _rowOff,
                     _colOff);
  }

  /**
   * @return a child scope in which every range reference resolves to the
   *         single cell at the given offset (ARRAYFORMULA evaluation)
   */
  Scope withArrayOffset(int rowOff, int colOff) {
    return new Scope(this, null, null, _accessor, rowOff, colOff);
  }

  /**
   * @return the value bound to the given name, or {@code null} if the name
   *         is not bound
   */
  Value lookup(String name) {
    String lookupName = toLookupName(name);
    for(Scope cur = this; cur != null; cur = cur._parent) {
      if(lookupName.equals(cur._name)) {
        return cur._value;
      }
    }
    return null;
  }

  boolean hasArrayOffset() {
    return (_rowOff != NO_OFFSET);
  }

  int getRowOffset() {
    return _rowOff;
  }

  int getColOffset() {
    return _colOff;
  }

  CellValueAccessor getAccessor() {
    return _accessor;
  }

  Value getCellValue(CellReference ref) {
    Value val = _accessor.getCellValue(ref.getSheet(), ref.getCol(),
                                       ref.getRow());
    if(val == null) {
      return ValueSupport.NULL_VAL;
    }
    if(val.getType() == Value.Type.STRING) {
      // stored error results come back as their sentinel strings
      FormulaError err = FormulaError.fromString(val.getAsString());
      if(err != null) {
        return ValueSupport.toError(err);
      }
    }
    return val;
  }

  static String toLookupName(String name) {
    return name.toUpperCase(Locale.ROOT);
  }
}
