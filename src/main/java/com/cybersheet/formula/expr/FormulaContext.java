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

import java.util.Map;

/**
 * FormulaContext encapsulates all state for a single formula evaluation.  It
 * provides a bridge between the evaluation engine and the worksheet which
 * owns the cells.  A context is created by the caller for each evaluation and
 * is never retained by the engine.  Contexts are immutable, new variable
 * scopes are created as child contexts.
 */
public interface FormulaContext
{
  /**
   * @return the source of cell values
   */
  public CellAccessor getCellAccessor();

  /**
   * @return the cell at which the formula is being evaluated, relative
   *         references are shifted by the distance between the anchor cell
   *         and this cell
   */
  public CellAddress getCurrentCell();

  /**
   * @return the cell relative to which the formula's references were
   *         written.  Equal to the current cell for ordinary evaluation.
   */
  public CellAddress getAnchorCell();

  /**
   * @return the value of the LET/LAMBDA variable with the given name, or
   *         {@code null} if no such variable is in scope
   */
  public FormulaValue getVariable(String name);

  /**
   * @return the immutable map of all variables in scope (names are in
   *         normalized, upper case form)
   */
  public Map<String,FormulaValue> getLambdaContext();

  /**
   * @return the workbook scoped named lambdas, never {@code null}
   */
  public NamedLambdaRegistry getNamedLambdas();

  /**
   * @return the number of lambda invocations currently in progress
   */
  public int getCallDepth();

  /**
   * @return the configuration of the engine evaluating the formula
   */
  public EvalConfig getEvalConfig();

  /**
   * @return a child context whose scope is this context's scope plus the
   *         given variables
   */
  public FormulaContext withVariables(Map<String,FormulaValue> variables);

  /**
   * @return a child context for invoking a lambda: its scope is the given
   *         captured scope plus the given parameter bindings and its call
   *         depth is one deeper than this context
   * @throws EvalException with {@link ErrorKind#VALUE} if the maximum call
   *         depth would be exceeded
   */
  public FormulaContext enterLambda(Map<String,FormulaValue> capturedContext,
                                    Map<String,FormulaValue> parameters);
}
