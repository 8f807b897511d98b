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

import com.cybersheet.formula.expr.CellAddress;
import com.cybersheet.formula.expr.CompiledFormula;
import com.cybersheet.formula.expr.NamedLambdaRegistry;
import com.cybersheet.formula.impl.FormulaEngineImpl;

/**
 * Compiles conditional formatting rule formulas.  A rule formula is written
 * relative to the rule's base cell (the top left cell of the range the rule
 * applies to) and is evaluated for every cell of that range.  The formula is
 * parsed once; each evaluation only resolves its references for the target
 * cell.
 * <p>
 * Example:
 * <pre>
 *   ConditionalFormattingFormulaCompiler cfc =
 *     new ConditionalFormattingFormulaCompiler();
 *   CompiledConditionalFormula rule =
 *     cfc.compile("=A1&gt;10", CellAddress.parse("B2"));
 *   // reads A1 for B2, B4 for C5
 *   boolean highlight = rule.matches(CellAddress.parse("C5"), sheet);
 * </pre>
 */
public class ConditionalFormattingFormulaCompiler
{
  private final FormulaEngine _engine;
  private final NamedLambdaRegistry _namedLambdas;

  public ConditionalFormattingFormulaCompiler() {
    this(null, null);
  }

  /**
   * @param engine engine used to compile rule formulas, if {@code null} a
   *               default engine is created
   * @param namedLambdas named lambdas visible to rule formulas, may be
   *                     {@code null}
   */
  public ConditionalFormattingFormulaCompiler(
      FormulaEngine engine, NamedLambdaRegistry namedLambdas) {
    _engine = ((engine != null) ? engine : new FormulaEngineImpl());
    _namedLambdas = namedLambdas;
  }

  public FormulaEngine getEngine() {
    return _engine;
  }

  /**
   * Compiles the given rule formula for the given rule base cell.  Malformed
   * formulas do not fail here, they evaluate to their parse error.
   */
  public CompiledConditionalFormula compile(String formulaText,
                                            CellAddress ruleBase) {
    if(ruleBase == null) {
      throw new IllegalArgumentException("Rule base address must be given");
    }
    CompiledFormula formula = _engine.compile(formulaText);
    return new CompiledConditionalFormula(
        formulaText, formula, ruleBase, _engine.getEvalConfig(),
        _namedLambdas);
  }
}
