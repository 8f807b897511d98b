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

package com.cybersheet.formula;

import com.cybersheet.formula.expr.Function;
import com.cybersheet.formula.expr.FunctionLookup;
import com.cybersheet.formula.impl.FormulaEngineImpl;

/**
 * Builder style class for constructing a {@link FormulaEngine}.  Any
 * setting which is not given explicitly uses the default from the relevant
 * system property (see the property constants on {@link FormulaEngine}).
 * <p>
 * Simple example usage:
 * <pre>
 *   FormulaEngine engine = new FormulaEngineBuilder()
 *     .setMaxCallDepth(100)
 *     .setCacheEnabled(false)
 *     .build();
 * </pre>
 */
public class FormulaEngineBuilder
{
  /** lambda call depth limit */
  private int _maxCallDepth = FormulaEngineImpl.getDefaultMaxCallDepth();
  /** limit on generated array rows/columns */
  private int _maxArrayDimension =
    FormulaEngineImpl.getDefaultMaxArrayDimension();
  /** limit on array cells */
  private int _maxArrayCells = FormulaEngineImpl.getDefaultMaxArrayCells();
  /** whether or not compiled formulas are cached by text */
  private boolean _cacheEnabled = FormulaEngineImpl.getDefaultCacheEnabled();
  /** capacity of the compiled formula cache */
  private int _maxCacheSize = FormulaEngineImpl.getDefaultMaxCacheSize();
  /** optional replacement for the built-in function lookup */
  private FunctionLookup _functionLookup;
  /** optional user functions */
  private Function[] _functions = new Function[0];

  public FormulaEngineBuilder() {}

  /**
   * Sets the maximum nesting of lambda invocations.  Exceeding it evaluates
   * to #VALUE!.
   */
  public FormulaEngineBuilder setMaxCallDepth(int maxCallDepth) {
    _maxCallDepth = checkPositive(maxCallDepth, "maxCallDepth");
    return this;
  }

  /**
   * Sets the largest row or column count of an array generated by a formula
   * (MAKEARRAY, SEQUENCE).
   */
  public FormulaEngineBuilder setMaxArrayDimension(int maxArrayDimension) {
    _maxArrayDimension = checkPositive(maxArrayDimension, "maxArrayDimension");
    return this;
  }

  /**
   * Sets the largest cell count of an array generated or referenced by a
   * formula.
   */
  public FormulaEngineBuilder setMaxArrayCells(int maxArrayCells) {
    _maxArrayCells = checkPositive(maxArrayCells, "maxArrayCells");
    return this;
  }

  public FormulaEngineBuilder setCacheEnabled(boolean cacheEnabled) {
    _cacheEnabled = cacheEnabled;
    return this;
  }

  /**
   * Sets the number of compiled formulas the engine will cache, formulas
   * compiled once the cache is full are not cached.
   */
  public FormulaEngineBuilder setMaxCacheSize(int maxCacheSize) {
    _maxCacheSize = checkPositive(maxCacheSize, "maxCacheSize");
    return this;
  }

  /**
   * Sets the lookup for functions which are not registered with the engine,
   * if {@code null}, uses the built-in functions.
   */
  public FormulaEngineBuilder setFunctionLookup(FunctionLookup lookup) {
    _functionLookup = lookup;
    return this;
  }

  /**
   * Adds functions available to the formulas of the built engine.  A
   * function with the name of a built-in function replaces it.
   */
  public FormulaEngineBuilder addFunctions(Function... functions) {
    Function[] newFuncs = new Function[_functions.length + functions.length];
    System.arraycopy(_functions, 0, newFuncs, 0, _functions.length);
    for(int i = 0; i < functions.length; ++i) {
      if(functions[i] == null) {
        throw new IllegalArgumentException("Function must be given");
      }
      newFuncs[_functions.length + i] = functions[i];
    }
    _functions = newFuncs;
    return this;
  }

  /**
   * Creates a new FormulaEngine using the current settings of this builder.
   */
  public FormulaEngine build() {
    FormulaEngineImpl engine = new FormulaEngineImpl(
        _cacheEnabled, _maxCacheSize);
    engine.setMaxCallDepth(_maxCallDepth);
    engine.setMaxArrayDimension(_maxArrayDimension);
    engine.setMaxArrayCells(_maxArrayCells);
    if(_functionLookup != null) {
      engine.setFunctionLookup(_functionLookup);
    }
    for(Function func : _functions) {
      engine.registerFunction(func);
    }
    return engine;
  }

  private static int checkPositive(int val, String name) {
    if(val < 1) {
      throw new IllegalArgumentException(
          "Invalid " + name + " " + val + ", must be positive");
    }
    return val;
  }
}
