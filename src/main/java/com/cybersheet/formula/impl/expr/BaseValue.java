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

package com.cybersheet.formula.impl.expr;

import com.cybersheet.formula.expr.ErrorKind;
import com.cybersheet.formula.expr.EvalException;
import com.cybersheet.formula.expr.FormulaValue;

/**
 * Base class for scalar values.  A scalar viewed as an array is a 1x1 array
 * which returns itself for every position (so it broadcasts against real
 * arrays).
 */
public abstract class BaseValue implements FormulaValue
{
  @Override
  public boolean isEmpty() {
    return(getType() == Type.EMPTY);
  }

  @Override
  public boolean isError() {
    return false;
  }

  @Override
  public boolean isArray() {
    return getType().isArray();
  }

  @Override
  public ErrorKind getErrorKind() {
    return null;
  }

  @Override
  public boolean getAsBoolean() {
    throw invalidConversion(Type.BOOLEAN);
  }

  @Override
  public String getAsString() {
    throw invalidConversion(Type.TEXT);
  }

  @Override
  public double getAsDouble() {
    throw invalidConversion(Type.NUMBER);
  }

  @Override
  public int getRowCount() {
    return 1;
  }

  @Override
  public int getColumnCount() {
    return 1;
  }

  @Override
  public FormulaValue getElement(int row, int col) {
    return this;
  }

  protected EvalException invalidConversion(Type newType) {
    return new EvalException(
        ErrorKind.VALUE, this + " cannot be converted to " + newType);
  }

  @Override
  public String toString() {
    return "FormulaValue[" + getType() + "] '" + get() + "'";
  }
}
