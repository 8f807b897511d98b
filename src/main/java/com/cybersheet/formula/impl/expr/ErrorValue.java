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

/**
 * A spreadsheet error used as an ordinary value.  Any attempt to convert it
 * raises its own error kind, which is how errors propagate through
 * operators and functions.  One shared instance exists per kind.
 */
public final class ErrorValue extends BaseValue
{
  private final ErrorKind _kind;

  ErrorValue(ErrorKind kind) {
    _kind = kind;
  }

  @Override
  public Type getType() {
    return Type.ERROR;
  }

  @Override
  public Object get() {
    return _kind;
  }

  @Override
  public boolean isError() {
    return true;
  }

  @Override
  public ErrorKind getErrorKind() {
    return _kind;
  }

  @Override
  protected EvalException invalidConversion(Type newType) {
    return new EvalException(_kind, "Error value " + _kind);
  }

  @Override
  public String toString() {
    return "FormulaValue[ERROR] '" + _kind + "'";
  }
}
