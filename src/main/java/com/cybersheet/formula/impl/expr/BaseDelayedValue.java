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
import com.cybersheet.formula.expr.FormulaValue;

/**
 * A value which is only computed the first time it is needed.  Used for the
 * arguments of functions which do not evaluate all of their arguments.
 */
public abstract class BaseDelayedValue implements FormulaValue
{
  private FormulaValue _val;

  protected BaseDelayedValue() {
  }

  /**
   * @return the computed value (evaluated on first access)
   */
  public FormulaValue getDelegate() {
    if(_val == null) {
      _val = eval();
    }
    return _val;
  }

  @Override
  public Type getType() {
    return getDelegate().getType();
  }

  @Override
  public Object get() {
    return getDelegate().get();
  }

  @Override
  public boolean isEmpty() {
    return getDelegate().isEmpty();
  }

  @Override
  public boolean isError() {
    return getDelegate().isError();
  }

  @Override
  public boolean isArray() {
    return getDelegate().isArray();
  }

  @Override
  public ErrorKind getErrorKind() {
    return getDelegate().getErrorKind();
  }

  @Override
  public boolean getAsBoolean() {
    return getDelegate().getAsBoolean();
  }

  @Override
  public String getAsString() {
    return getDelegate().getAsString();
  }

  @Override
  public double getAsDouble() {
    return getDelegate().getAsDouble();
  }

  @Override
  public int getRowCount() {
    return getDelegate().getRowCount();
  }

  @Override
  public int getColumnCount() {
    return getDelegate().getColumnCount();
  }

  @Override
  public FormulaValue getElement(int row, int col) {
    return getDelegate().getElement(row, col);
  }

  protected abstract FormulaValue eval();

  /**
   * @return the computed value behind the given value, if it is delayed
   */
  public static FormulaValue resolve(FormulaValue val) {
    return ((val instanceof BaseDelayedValue) ?
            ((BaseDelayedValue)val).getDelegate() : val);
  }
}
