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
 * Wrapper for a typed value used within the formula evaluation engine.  Note
 * that an empty cell is represented by an actual Value instance with the type
 * of {@link Type#NULL}.  Error results (e.g. {@code #DIV/0!}) are values of
 * type {@link Type#ERROR}, never exceptions.
 * <p>
 * All the conversion methods will throw an {@link EvalException} if the
 * conversion is not supported for the current value.  Converting an error
 * value throws a {@link FormulaErrorException} carrying that error, which
 * allows errors to propagate through any computation which attempts to use
 * them.
 *
 * @author James Ahlborn
 */
public interface Value
{
  /** the types supported within the formula evaluation engine */
  public enum Type
  {
    NULL, STRING, NUMBER, BOOLEAN, ERROR, ARRAY, LAMBDA;

    /**
     * @return {@code true} if values of this type may be stored in a cell
     */
    public boolean isScalar() {
      return (ordinal() <= ERROR.ordinal());
    }
  }

  /**
   * @return the type of this value
   */
  public Type getType();

  /**
   * @return the raw value
   */
  public Object get();

  /**
   * @return {@code true} if this value represents an empty cell,
   *         {@code false} otherwise.
   */
  public boolean isNull();

  /**
   * @return {@code true} if this value represents an error result
   */
  public boolean isError();

  /**
   * @return the error for an error value, {@code null} otherwise
   */
  public FormulaError getError();

  /**
   * @return this value converted to a boolean.  Numbers are true when
   *         non-zero, the strings "TRUE" and "FALSE" are recognized in any
   *         case, everything else is false.
   */
  public boolean getAsBoolean();

  /**
   * @return this value converted to a String (empty cells are the empty
   *         string)
   */
  public String getAsString();

  /**
   * @return this value converted to a double (empty cells and empty strings
   *         are 0)
   */
  public Double getAsDouble();

  /**
   * @return this value converted (truncated) to an int
   */
  public Integer getAsInt();

  /**
   * @return this value as a row-major 2-D array (scalars are a 1x1 array)
   */
  public Value[][] getAsArray();
}
