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
 * The EvalConfig allows for customization of formula parsing and evaluation
 * for a given {@link com.cybersheet.formula.FormulaEngine} instance.  The
 * defaults for the limits may be set globally through the system properties
 * documented on {@link com.cybersheet.formula.FormulaEngine}.
 */
public interface EvalConfig
{
  /**
   * @return the currently configured FunctionLookup
   */
  public FunctionLookup getFunctionLookup();

  /**
   * Sets the {@link Function} provider to use during formula parsing.
   * Custom Functions can be provided either through
   * {@link #registerFunction} or by installing a custom FunctionLookup
   * instance (which would presumably delegate to the default lookup for any
   * built-in functions).  Clears any cached compiled formulas.
   */
  public void setFunctionLookup(FunctionLookup lookup);

  /**
   * Registers a user function with the engine's function registry.  A user
   * function takes precedence over a built-in function of the same name.
   * Clears any cached compiled formulas.
   */
  public void registerFunction(Function func);

  /**
   * @return the maximum nesting depth of lambda invocations
   */
  public int getMaxCallDepth();

  public void setMaxCallDepth(int maxCallDepth);

  /**
   * @return the maximum number of rows or columns a generated array may have
   */
  public int getMaxArrayDimension();

  public void setMaxArrayDimension(int maxArrayDimension);

  /**
   * @return the maximum number of cells a generated or referenced array may
   *         have
   */
  public int getMaxArrayCells();

  public void setMaxArrayCells(int maxArrayCells);
}
