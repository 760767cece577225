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
 * Opaque handle to a LAMBDA closure registered with the current evaluation.
 * The handle is only meaningful within the top-level evaluation which
 * created it.
 *
 * @author James Ahlborn
 */
public class LambdaValue extends BaseValue
{
  private final int _id;

  LambdaValue(int id)
  {
    _id = id;
  }

  @Override
  public Type getType() {
    return Type.LAMBDA;
  }

  @Override
  public Object get() {
    return _id;
  }

  public int getId() {
    return _id;
  }
}
