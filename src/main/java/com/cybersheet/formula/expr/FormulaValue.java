/*
Copyright (c) 2024 CyberSheet

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

package com.cybersheet.formula.expr;

/**
 * Wrapper for a typed value used within the formula evaluation engine.  Note
 * that an "empty" cell is represented by an actual FormulaValue instance with
 * the type of {@link Type#EMPTY} and spreadsheet errors are represented by
 * values with the type {@link Type#ERROR}.  Values are immutable once
 * produced.
 * <p/>
 * The conversion methods follow spreadsheet coercion rules and throw an
 * {@link EvalException} carrying the relevant {@link ErrorKind} if the
 * conversion is not supported for the current value (an error value always
 * fails conversion with its own kind).
 */
public interface FormulaValue
{
  /** the types supported within the formula evaluation engine */
  public enum Type
  {
    EMPTY, NUMBER, TEXT, BOOLEAN, ERROR, ARRAY_1D, ARRAY_2D, LAMBDA;

    public boolean isArray() {
      return ((this == ARRAY_1D) || (this == ARRAY_2D));
    }

    public boolean isScalar() {
      return (ordinal() <= BOOLEAN.ordinal());
    }
  }

  /**
   * @return the type of this value
   */
  public Type getType();

  /**
   * @return the raw value: a {@link Double}, {@link String}, {@link Boolean},
   *         {@link ErrorKind}, {@code null} for empty, the value itself for
   *         arrays and lambdas
   */
  public Object get();

  /**
   * @return {@code true} if this value represents an empty cell
   */
  public boolean isEmpty();

  /**
   * @return {@code true} if this value is a spreadsheet error
   */
  public boolean isError();

  /**
   * @return {@code true} if this value is a one or two dimensional array
   */
  public boolean isArray();

  /**
   * @return the error kind of an error value, {@code null} otherwise
   */
  public ErrorKind getErrorKind();

  /**
   * @return this value converted to a boolean
   */
  public boolean getAsBoolean();

  /**
   * @return this value converted to a String
   */
  public String getAsString();

  /**
   * @return this value converted to a double
   */
  public double getAsDouble();

  /**
   * @return the number of rows of this value (1 for scalars and one
   *         dimensional arrays)
   */
  public int getRowCount();

  /**
   * @return the number of columns of this value (1 for scalars)
   */
  public int getColumnCount();

  /**
   * @param row zero based row index
   * @param col zero based column index
   * @return the element at the given position (a scalar returns itself for
   *         every position)
   */
  public FormulaValue getElement(int row, int col);
}
