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

import java.util.Arrays;

import com.healthmarketscience.sheetcalc.expr.Value;

/**
 * A rectangular, row-major 2-D array of scalar values.  Arrays exist only
 * during evaluation (range arguments and array results), they are never
 * stored in a cell.
 *
 * @author James Ahlborn
 */
public class ArrayValue extends BaseValue
{
  private final Value[][] _vals;

  ArrayValue(Value[][] vals)
  {
    _vals = vals;
  }

  @Override
  public Type getType() {
    return Type.ARRAY;
  }

  @Override
  public Object get() {
    return _vals;
  }

  @Override
  public Value[][] getAsArray() {
    return _vals;
  }

  public int getRowCount() {
    return _vals.length;
  }

  public int getColCount() {
    return ((_vals.length > 0) ? _vals[0].length : 0);
  }

  public boolean isEmpty() {
    return ((getRowCount() == 0) || (getColCount() == 0));
  }

  @Override
  public boolean equals(Object o) {
    return ((o instanceof ArrayValue) &&
            Arrays.deepEquals(_vals, ((ArrayValue)o)._vals));
  }

  @Override
  public int hashCode() {
    return Arrays.deepHashCode(_vals);
  }

  @Override
  public String toString() {
    return "Value[" + getType() + "] " + Arrays.deepToString(_vals);
  }
}
