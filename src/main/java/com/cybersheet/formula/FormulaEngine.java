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

import com.cybersheet.formula.expr.CompiledFormula;
import com.cybersheet.formula.expr.EvalConfig;
import com.cybersheet.formula.expr.FormulaContext;
import com.cybersheet.formula.expr.FormulaValue;
import com.cybersheet.formula.expr.LambdaFunction;
import com.cybersheet.formula.expr.ParseException;

/**
 * Entry point for compiling and evaluating formulas.  An engine holds the
 * function lookup, the evaluation limits and (optionally) a cache of
 * compiled formulas keyed by formula text.  Engines are safe for use from
 * multiple threads.
 * <p>
 * Instances are created with a {@link FormulaEngineBuilder}, evaluation
 * contexts with {@link #newContext}.  For example:
 * <pre>
 *   FormulaEngine engine = new FormulaEngineBuilder().build();
 *   FormulaValue val = engine.evaluate("=SUM(A1:A3)",
 *       engine.newContext().setCellAccessor(sheet).toContext());
 * </pre>
 */
public interface FormulaEngine
{
  /** system property which can be used to set the default lambda call
      depth limit */
  public static final String MAX_CALL_DEPTH_PROPERTY =
    "com.cybersheet.formula.maxCallDepth";
  /** system property which can be used to set the default limit on the row
      or column count of a generated array */
  public static final String MAX_ARRAY_DIMENSION_PROPERTY =
    "com.cybersheet.formula.maxArrayDimension";
  /** system property which can be used to set the default limit on the cell
      count of a generated or referenced array */
  public static final String MAX_ARRAY_CELLS_PROPERTY =
    "com.cybersheet.formula.maxArrayCells";
  /** system property which can be used to disable the compiled formula
      cache ("false") */
  public static final String CACHE_ENABLED_PROPERTY =
    "com.cybersheet.formula.cacheEnabled";
  /** system property which can be used to set the default compiled formula
      cache capacity */
  public static final String MAX_CACHE_SIZE_PROPERTY =
    "com.cybersheet.formula.maxCacheSize";

  /**
   * @return the configuration used when evaluating formulas of this engine
   */
  public EvalConfig getEvalConfig();

  /**
   * Compiles the given formula text (with or without a leading '=').  Never
   * fails for malformed text, see {@link CompiledFormula#getParseError}.
   */
  public CompiledFormula compile(String formulaText);

  /**
   * Compiles and evaluates a formula which produces a LAMBDA, for use with
   * {@link com.cybersheet.formula.expr.NamedLambdaRegistry#defineNamedLambda}.
   *
   * @throws ParseException if the formula is malformed or does not evaluate
   *                        to a lambda
   */
  public LambdaFunction compileLambda(String formulaText);

  public FormulaValue evaluate(String formulaText, FormulaContext ctx);

  public FormulaValue evaluate(CompiledFormula formula, FormulaContext ctx);

  /**
   * @return a builder for an evaluation context using this engine's
   *         configuration
   */
  public FormulaContextBuilder newContext();

  public boolean isCacheEnabled();

  public int getCacheSize();

  public void clearCache();
}
