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

import java.util.List;

/**
 * A CompiledFormula is an executable handle to a parsed formula.  It is
 * produced once per formula text, is immutable, and may be evaluated
 * repeatedly and concurrently.  Formula text which could not be parsed still
 * produces a CompiledFormula, one which evaluates to the parse error.
 */
public interface CompiledFormula
{
  /**
   * Evaluates the formula and returns the result.  Never throws for any user
   * input, failures are returned as error values.
   *
   * @param ctx the context within which to evaluate the formula
   */
  public FormulaValue eval(FormulaContext ctx);

  /**
   * @return every cell reference of the formula in parse order (a range
   *         contributes both of its corners)
   */
  public List<Reference> getReferences();

  /**
   * @return the error the formula text failed to parse with, {@code null} if
   *         it parsed successfully
   */
  public ErrorKind getParseError();

  /**
   * @return a detailed string which indicates how the formula was
   *         interpreted by the parser
   */
  public String toDebugString();

  /**
   * @return a parsed and re-formatted version of the formula.  This may look
   *         slightly different than the original, raw string, although it is
   *         an equivalent formula.
   */
  public String toCleanString();

  /**
   * @return the original, unparsed formula string.  This is the same as the
   *         value which will be returned by {@link Object#toString}.
   */
  public String toRawString();

  /**
   * @return {@code true} if this is a constant formula.  A constant formula
   *         reads no cells or variables and always returns the same result.
   */
  public boolean isConstant();
}
