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

import java.util.Collections;
import java.util.List;

import com.cybersheet.formula.expr.CellAccessor;
import com.cybersheet.formula.expr.CellAddress;
import com.cybersheet.formula.expr.CompiledFormula;
import com.cybersheet.formula.expr.EvalConfig;
import com.cybersheet.formula.expr.FormulaValue;
import com.cybersheet.formula.expr.NamedLambdaRegistry;
import com.cybersheet.formula.expr.Reference;
import com.cybersheet.formula.impl.BaseFormulaContext;
import com.cybersheet.formula.impl.expr.BaseDelayedValue;
import com.cybersheet.formula.impl.expr.ValueSupport;

/**
 * A conditional formatting rule formula compiled for its rule base cell.
 * Instances are immutable and may be evaluated concurrently, as long as the
 * given cell accessors allow it.
 * <p>
 * Empty cells (and empty strings) read by the formula are presented as the
 * number 0, so {@code =A1<10} holds for an empty {@code A1}.
 */
public class CompiledConditionalFormula
{
  private final String _formulaText;
  private final CompiledFormula _formula;
  private final CellAddress _ruleBase;
  private final EvalConfig _config;
  private final NamedLambdaRegistry _namedLambdas;

  CompiledConditionalFormula(String formulaText, CompiledFormula formula,
                             CellAddress ruleBase, EvalConfig config,
                             NamedLambdaRegistry namedLambdas) {
    _formulaText = formulaText;
    _formula = formula;
    _ruleBase = ruleBase;
    _config = config;
    _namedLambdas = namedLambdas;
  }

  public String getFormulaText() {
    return _formulaText;
  }

  public CellAddress getRuleBaseAddress() {
    return _ruleBase;
  }

  public CompiledFormula getFormula() {
    return _formula;
  }

  /**
   * @return the references in the formula, as written for the rule base
   *         cell
   */
  public List<Reference> getReferences() {
    return Collections.unmodifiableList(_formula.getReferences());
  }

  /**
   * Evaluates the formula for the given target cell, shifting relative
   * references by the target's offset from the rule base cell.
   */
  public FormulaValue evaluate(CellAddress target, CellAccessor provider) {
    if(target == null) {
      throw new IllegalArgumentException("Target address must be given");
    }
    BaseFormulaContext ctx = new BaseFormulaContext(
        _config, new ZeroForEmptyAccessor(provider), target, _ruleBase,
        _namedLambdas, null);
    return BaseDelayedValue.resolve(_formula.eval(ctx));
  }

  /**
   * @return {@code true} if the formula evaluates to TRUE or a non-zero
   *         number for the given target cell, {@code false} for any other
   *         result (including errors)
   */
  public boolean matches(CellAddress target, CellAccessor provider) {
    FormulaValue val = ValueSupport.unwrapSingle(evaluate(target, provider));
    switch(val.getType()) {
    case BOOLEAN:
      return val.getAsBoolean();
    case NUMBER:
      return (val.getAsDouble() != 0.0d);
    default:
      return false;
    }
  }

  @Override
  public String toString() {
    return _formulaText + " @" + _ruleBase;
  }

  /**
   * Presents empty cells as the number 0.
   */
  private static final class ZeroForEmptyAccessor implements CellAccessor
  {
    private final CellAccessor _delegate;

    private ZeroForEmptyAccessor(CellAccessor delegate) {
      _delegate = ((delegate != null) ? delegate : CellAccessor.EMPTY);
    }

    @Override
    public FormulaValue getCellValue(CellAddress address) {
      return toZero(_delegate.getCellValue(address));
    }

    @Override
    public FormulaValue getCellValue(String sheetName, CellAddress address) {
      return toZero(_delegate.getCellValue(sheetName, address));
    }

    @Override
    public int getRowCount() {
      return _delegate.getRowCount();
    }

    @Override
    public int getColumnCount() {
      return _delegate.getColumnCount();
    }

    private static FormulaValue toZero(FormulaValue val) {
      if((val == null) || val.isEmpty() ||
         ((val.getType() == FormulaValue.Type.TEXT) &&
          (val.getAsString().length() == 0))) {
        return ValueSupport.ZERO_VAL;
      }
      return val;
    }
  }
}
