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

import java.util.HashMap;
import java.util.Map;

/**
 * The closed set of spreadsheet error values.  Each kind renders as the
 * literal token a spreadsheet user would see in a cell (e.g. {@code #DIV/0!}).
 */
public enum ErrorKind
{
  DIV_ZERO("#DIV/0!"),
  NA("#N/A"),
  NAME("#NAME?"),
  NULL("#NULL!"),
  NUM("#NUM!"),
  REF("#REF!"),
  VALUE("#VALUE!"),
  SPILL("#SPILL!"),
  CALC("#CALC!");

  private static final Map<String,ErrorKind> LITERALS =
    new HashMap<String,ErrorKind>();

  static {
    for(ErrorKind kind : values()) {
      LITERALS.put(kind._literal, kind);
    }
  }

  private final String _literal;

  private ErrorKind(String literal) {
    _literal = literal;
  }

  /**
   * @return the literal token for this error, e.g. {@code #N/A}
   */
  public String getLiteral() {
    return _literal;
  }

  /**
   * @return the error kind for the given literal token (case-insensitive),
   *         or {@code null} if the token is not an error literal
   */
  public static ErrorKind fromLiteral(String literal) {
    if(literal == null) {
      return null;
    }
    return LITERALS.get(literal.toUpperCase());
  }

  @Override
  public String toString() {
    return _literal;
  }
}
