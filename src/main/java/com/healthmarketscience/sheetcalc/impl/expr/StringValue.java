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

/**
 *
 * @author James Ahlborn
 */
public class StringValue extends BaseValue
{
  private static final Object NOT_A_NUMBER = new Object();

  private final String _val;
  private Object _num;

  public StringValue(String val)
  {
    _val = val;
  }

  @Override
  public Type getType() {
    return Type.STRING;
  }

  @Override
  public Object get() {
    return _val;
  }

  @Override
  public boolean getAsBoolean() {
    // only the literal boolean strings are recognized
    return "TRUE".equalsIgnoreCase(_val);
  }

  @Override
  public String getAsString() {
    return _val;
  }

  @Override
  public Double getAsDouble() {
    Double num = getNumber();
    if(num == null) {
      throw invalidConversion(Type.NUMBER);
    }
    return num;
  }

  /**
   * @return {@code true} if this string is blank or parses as a number
   */
  public boolean isNumeric() {
    return (getNumber() != null);
  }

  protected Double getNumber() {
    if(_num instanceof Double) {
      return (Double)_num;
    }
    if(_num == NOT_A_NUMBER) {
      return null;
    }

    String tmpVal = _val.trim();
    if(tmpVal.length() == 0) {
      // empty strings act like blank cells in arithmetic
      _num = 0.0d;
      return 0.0d;
    }

    if(ValueSupport.NUMBER_PAT.matcher(tmpVal).matches()) {
      _num = Double.valueOf(tmpVal);
      return (Double)_num;
    }

    _num = NOT_A_NUMBER;
    return null;
  }

  @Override
  public boolean equals(Object o) {
    return ((o instanceof StringValue) && _val.equals(((StringValue)o)._val));
  }

  @Override
  public int hashCode() {
    return _val.hashCode();
  }
}
