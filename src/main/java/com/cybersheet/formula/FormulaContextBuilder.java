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

import java.util.HashMap;
import java.util.Map;

import com.cybersheet.formula.expr.CellAccessor;
import com.cybersheet.formula.expr.CellAddress;
import com.cybersheet.formula.expr.EvalConfig;
import com.cybersheet.formula.expr.FormulaContext;
import com.cybersheet.formula.expr.FormulaValue;
import com.cybersheet.formula.expr.NamedLambdaRegistry;
import com.cybersheet.formula.impl.BaseFormulaContext;
import com.cybersheet.formula.impl.expr.ValueSupport;

/**
 * Builder style class for constructing a {@link FormulaContext}, usually
 * obtained from {@link FormulaEngine#newContext}.
 */
public class FormulaContextBuilder
{
  private final EvalConfig _config;
  private CellAccessor _accessor;
  private CellAddress _currentCell;
  private CellAddress _anchorCell;
  private NamedLambdaRegistry _namedLambdas;
  private final Map<String,FormulaValue> _vars =
    new HashMap<String,FormulaValue>();

  public FormulaContextBuilder(FormulaEngine engine) {
    this(engine.getEvalConfig());
  }

  public FormulaContextBuilder(EvalConfig config) {
    if(config == null) {
      throw new IllegalArgumentException("EvalConfig must be given");
    }
    _config = config;
  }

  /**
   * Sets the source of cell values, if {@code null}, all cells are empty.
   */
  public FormulaContextBuilder setCellAccessor(CellAccessor accessor) {
    _accessor = accessor;
    return this;
  }

  /**
   * Sets the cell containing the formula.  Relative references are shifted
   * by the distance from the anchor cell to this cell.
   */
  public FormulaContextBuilder setCurrentCell(CellAddress currentCell) {
    _currentCell = currentCell;
    return this;
  }

  public FormulaContextBuilder setCurrentCell(String a1) {
    return setCurrentCell(CellAddress.parse(a1));
  }

  /**
   * Sets the cell relative to which the formula's references were written,
   * if {@code null}, the current cell.
   */
  public FormulaContextBuilder setAnchorCell(CellAddress anchorCell) {
    _anchorCell = anchorCell;
    return this;
  }

  public FormulaContextBuilder setAnchorCell(String a1) {
    return setAnchorCell(CellAddress.parse(a1));
  }

  public FormulaContextBuilder setNamedLambdas(
      NamedLambdaRegistry namedLambdas) {
    _namedLambdas = namedLambdas;
    return this;
  }

  /**
   * Binds a name visible to the formula as if defined by LET.  The value
   * may be a {@link FormulaValue} or any simple java value (String, Number,
   * Boolean, {@code null}).
   */
  public FormulaContextBuilder setVariable(String name, Object value) {
    if(name == null) {
      throw new IllegalArgumentException("Variable name must be given");
    }
    _vars.put(name, ValueSupport.toValue(value));
    return this;
  }

  public FormulaContext toContext() {
    return new BaseFormulaContext(_config, _accessor, _currentCell,
                                  _anchorCell, _namedLambdas, _vars);
  }
}
