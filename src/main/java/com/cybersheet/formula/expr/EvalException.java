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
 * Base class for exceptions thrown internally during formula evaluation.
 * Every instance carries the spreadsheet error which the failure surfaces
 * as.  These exceptions never escape formula evaluation, they are converted
 * into error values at the function and evaluator boundaries.
 */
public class EvalException extends IllegalStateException
{
  private static final long serialVersionUID = 20240311L;

  private final ErrorKind _errorKind;

  public EvalException(ErrorKind errorKind, String message) {
    super(message);
    _errorKind = errorKind;
  }

  public EvalException(ErrorKind errorKind, String message, Throwable cause) {
    super(message, cause);
    _errorKind = errorKind;
  }

  public EvalException(String message) {
    this(ErrorKind.VALUE, message);
  }

  /**
   * @return the spreadsheet error this failure surfaces as
   */
  public ErrorKind getErrorKind() {
    return _errorKind;
  }
}
