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
 * Exception thrown internally for failures which occur during formula
 * parsing.  Structural problems surface as {@link ErrorKind#VALUE},
 * unrecognized names and tokens as {@link ErrorKind#NAME}.
 */
public class ParseException extends EvalException
{
  private static final long serialVersionUID = 20240311L;

  public ParseException(String message) {
    super(ErrorKind.VALUE, message);
  }

  public ParseException(ErrorKind errorKind, String message) {
    super(errorKind, message);
  }

  public ParseException(String message, Throwable cause) {
    super(ErrorKind.VALUE, message, cause);
  }
}
