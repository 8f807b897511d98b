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

package com.cybersheet.formula.impl;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import com.cybersheet.formula.expr.CellAccessor;
import com.cybersheet.formula.expr.CellAddress;
import com.cybersheet.formula.expr.ErrorKind;
import com.cybersheet.formula.expr.EvalConfig;
import com.cybersheet.formula.expr.EvalException;
import com.cybersheet.formula.expr.FormulaContext;
import com.cybersheet.formula.expr.FormulaValue;
import com.cybersheet.formula.expr.NamedLambdaRegistry;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Immutable evaluation context.  The "with" methods return a new context
 * sharing everything but the changed state.  Variable names are
 * case-insensitive.
 */
public class BaseFormulaContext implements FormulaContext
{
  private static final Log LOG = LogFactory.getLog(BaseFormulaContext.class);

  private static final NamedLambdaRegistry NO_NAMED_LAMBDAS =
    new NamedLambdaRegistry();

  private final EvalConfig _config;
  private final CellAccessor _accessor;
  private final CellAddress _currentCell;
  private final CellAddress _anchorCell;
  private final NamedLambdaRegistry _namedLambdas;
  private final Map<String,FormulaValue> _vars;
  private final int _callDepth;

  public BaseFormulaContext(EvalConfig config, CellAccessor accessor,
                            CellAddress currentCell, CellAddress anchorCell,
                            NamedLambdaRegistry namedLambdas,
                            Map<String,FormulaValue> vars) {
    this(config, accessor, currentCell, anchorCell, namedLambdas,
         normalize(Collections.<String,FormulaValue>emptyMap(), vars), 0);
  }

  private BaseFormulaContext(EvalConfig config, CellAccessor accessor,
                             CellAddress currentCell, CellAddress anchorCell,
                             NamedLambdaRegistry namedLambdas,
                             Map<String,FormulaValue> vars, int callDepth) {
    if(config == null) {
      throw new IllegalArgumentException("EvalConfig must be given");
    }
    _config = config;
    _accessor = ((accessor != null) ? accessor : CellAccessor.EMPTY);
    _currentCell = currentCell;
    _anchorCell = ((anchorCell != null) ? anchorCell : currentCell);
    _namedLambdas = ((namedLambdas != null) ? namedLambdas :
                     NO_NAMED_LAMBDAS);
    _vars = vars;
    _callDepth = callDepth;
  }

  @Override
  public CellAccessor getCellAccessor() {
    return _accessor;
  }

  @Override
  public CellAddress getCurrentCell() {
    return _currentCell;
  }

  @Override
  public CellAddress getAnchorCell() {
    return _anchorCell;
  }

  @Override
  public FormulaValue getVariable(String name) {
    return ((name != null) ? _vars.get(toVarName(name)) : null);
  }

  @Override
  public Map<String,FormulaValue> getLambdaContext() {
    return _vars;
  }

  @Override
  public NamedLambdaRegistry getNamedLambdas() {
    return _namedLambdas;
  }

  @Override
  public int getCallDepth() {
    return _callDepth;
  }

  @Override
  public EvalConfig getEvalConfig() {
    return _config;
  }

  @Override
  public FormulaContext withVariables(Map<String,FormulaValue> variables) {
    return new BaseFormulaContext(_config, _accessor, _currentCell,
                                  _anchorCell, _namedLambdas,
                                  normalize(_vars, variables), _callDepth);
  }

  @Override
  public FormulaContext enterLambda(Map<String,FormulaValue> capturedContext,
                                    Map<String,FormulaValue> parameters) {
    int depth = _callDepth + 1;
    int maxDepth = _config.getMaxCallDepth();
    if(depth > maxDepth) {
      LOG.warn("Lambda call depth limit " + maxDepth + " exceeded" +
               ((_currentCell != null) ? " at " + _currentCell : ""));
      throw new EvalException(ErrorKind.VALUE,
                              "Call depth limit " + maxDepth + " exceeded");
    }
    Map<String,FormulaValue> vars = normalize(capturedContext, parameters);
    return new BaseFormulaContext(_config, _accessor, _currentCell,
                                  _anchorCell, _namedLambdas, vars, depth);
  }

  /**
   * @return an unmodifiable copy of the base variables overlaid with the
   *         given variables
   */
  private static Map<String,FormulaValue> normalize(
      Map<String,FormulaValue> base, Map<String,FormulaValue> vars) {
    if(vars == null) {
      vars = Collections.emptyMap();
    }
    if(base.isEmpty() && vars.isEmpty()) {
      return Collections.emptyMap();
    }
    Map<String,FormulaValue> result =
      new HashMap<String,FormulaValue>(base.size() + vars.size());
    putAll(base, result);
    putAll(vars, result);
    return Collections.unmodifiableMap(result);
  }

  private static void putAll(Map<String,FormulaValue> from,
                             Map<String,FormulaValue> to) {
    for(Map.Entry<String,FormulaValue> e : from.entrySet()) {
      to.put(toVarName(e.getKey()), e.getValue());
    }
  }

  private static String toVarName(String name) {
    return name.toUpperCase();
  }
}
