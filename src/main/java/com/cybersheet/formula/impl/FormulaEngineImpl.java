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

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

import com.cybersheet.formula.FormulaContextBuilder;
import com.cybersheet.formula.FormulaEngine;
import com.cybersheet.formula.expr.CompiledFormula;
import com.cybersheet.formula.expr.ErrorKind;
import com.cybersheet.formula.expr.EvalConfig;
import com.cybersheet.formula.expr.FormulaContext;
import com.cybersheet.formula.expr.FormulaValue;
import com.cybersheet.formula.expr.Function;
import com.cybersheet.formula.expr.FunctionLookup;
import com.cybersheet.formula.expr.LambdaFunction;
import com.cybersheet.formula.expr.ParseException;
import com.cybersheet.formula.impl.expr.BaseDelayedValue;
import com.cybersheet.formula.impl.expr.FormulaParser;
import com.cybersheet.formula.impl.expr.FunctionRegistry;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Default engine implementation.  Holds the evaluation limits and the
 * function lookup, compiles formulas through an optional bounded cache keyed by the
 * formula text and evaluates them with any failure surfacing as an error
 * value.
 */
public class FormulaEngineImpl implements FormulaEngine, EvalConfig
{
  private static final Log LOG = LogFactory.getLog(FormulaEngineImpl.class);

  public static final int DEFAULT_MAX_CALL_DEPTH = 1000;
  public static final int DEFAULT_MAX_ARRAY_DIMENSION = 10000;
  public static final int DEFAULT_MAX_ARRAY_CELLS = 1000000;
  public static final int DEFAULT_MAX_CACHE_SIZE = 10000;

  private final FunctionRegistry _funcs = new FunctionRegistry();
  private volatile int _maxCallDepth = getDefaultMaxCallDepth();
  private volatile int _maxArrayDimension = getDefaultMaxArrayDimension();
  private volatile int _maxArrayCells = getDefaultMaxArrayCells();
  private final boolean _cacheEnabled;
  private final int _maxCacheSize;
  private final ConcurrentMap<String,CompiledFormula> _cache =
    new ConcurrentHashMap<String,CompiledFormula>();
  private final AtomicBoolean _cacheFullLogged = new AtomicBoolean();

  public FormulaEngineImpl() {
    this(getDefaultCacheEnabled(), getDefaultMaxCacheSize());
  }

  public FormulaEngineImpl(boolean cacheEnabled, int maxCacheSize) {
    _cacheEnabled = cacheEnabled;
    _maxCacheSize = maxCacheSize;
  }

  @Override
  public EvalConfig getEvalConfig() {
    return this;
  }

  @Override
  public FunctionLookup getFunctionLookup() {
    return _funcs;
  }

  /**
   * Replaces the lookup consulted for names which are not registered
   * functions of this engine, {@code null} restores the built-ins.
   */
  @Override
  public void setFunctionLookup(FunctionLookup lookup) {
    _funcs.setBaseLookup(lookup);
    // functions are resolved at compile time
    clearCache();
  }

  @Override
  public void registerFunction(Function func) {
    _funcs.registerFunction(func);
    clearCache();
  }

  @Override
  public int getMaxCallDepth() {
    return _maxCallDepth;
  }

  @Override
  public void setMaxCallDepth(int maxCallDepth) {
    _maxCallDepth = checkLimit(maxCallDepth, "maxCallDepth");
  }

  @Override
  public int getMaxArrayDimension() {
    return _maxArrayDimension;
  }

  @Override
  public void setMaxArrayDimension(int maxArrayDimension) {
    _maxArrayDimension = checkLimit(maxArrayDimension, "maxArrayDimension");
  }

  @Override
  public int getMaxArrayCells() {
    return _maxArrayCells;
  }

  @Override
  public void setMaxArrayCells(int maxArrayCells) {
    _maxArrayCells = checkLimit(maxArrayCells, "maxArrayCells");
  }

  @Override
  public CompiledFormula compile(String formulaText) {
    if(formulaText == null) {
      throw new IllegalArgumentException("Formula text must be given");
    }
    if(!_cacheEnabled) {
      return FormulaParser.parse(formulaText, _funcs);
    }

    CompiledFormula formula = _cache.get(formulaText);
    if(formula == null) {
      formula = FormulaParser.parse(formulaText, _funcs);
      if(_cache.size() < _maxCacheSize) {
        CompiledFormula existing = _cache.putIfAbsent(formulaText, formula);
        if(existing != null) {
          formula = existing;
        }
      } else if(_cacheFullLogged.compareAndSet(false, true)) {
        LOG.info("Compiled formula cache is full (" + _maxCacheSize +
                 " entries), further formulas will not be cached");
      }
    }
    return formula;
  }

  @Override
  public LambdaFunction compileLambda(String formulaText) {
    CompiledFormula formula = compile(formulaText);
    ErrorKind parseError = formula.getParseError();
    if(parseError != null) {
      throw new ParseException(parseError, "Invalid lambda formula '" +
                               formulaText + "'");
    }
    FormulaValue val = BaseDelayedValue.resolve(
        formula.eval(newContext().toContext()));
    if(!(val instanceof LambdaFunction)) {
      throw new ParseException(ErrorKind.VALUE, "Formula '" + formulaText +
                               "' is not a lambda, got " + val);
    }
    return (LambdaFunction)val;
  }

  @Override
  public FormulaValue evaluate(String formulaText, FormulaContext ctx) {
    return evaluate(compile(formulaText), ctx);
  }

  @Override
  public FormulaValue evaluate(CompiledFormula formula, FormulaContext ctx) {
    if(ctx == null) {
      throw new IllegalArgumentException("FormulaContext must be given");
    }
    return formula.eval(ctx);
  }

  @Override
  public FormulaContextBuilder newContext() {
    return new FormulaContextBuilder((FormulaEngine)this);
  }

  @Override
  public boolean isCacheEnabled() {
    return _cacheEnabled;
  }

  @Override
  public int getCacheSize() {
    return _cache.size();
  }

  @Override
  public void clearCache() {
    _cache.clear();
    _cacheFullLogged.set(false);
  }

  private static int checkLimit(int limit, String name) {
    if(limit < 1) {
      throw new IllegalArgumentException(
          "Invalid " + name + " " + limit + ", must be positive");
    }
    return limit;
  }

  /**
   * Returns the default lambda call depth limit.  This defaults to
   * {@value #DEFAULT_MAX_CALL_DEPTH}, but can be overridden using the system
   * property {@value com.cybersheet.formula.FormulaEngine#MAX_CALL_DEPTH_PROPERTY}.
   */
  public static int getDefaultMaxCallDepth() {
    return getIntProperty(MAX_CALL_DEPTH_PROPERTY, DEFAULT_MAX_CALL_DEPTH);
  }

  /**
   * Returns the default limit on generated array rows/columns.  This
   * defaults to {@value #DEFAULT_MAX_ARRAY_DIMENSION}, but can be overridden
   * using the system property
   * {@value com.cybersheet.formula.FormulaEngine#MAX_ARRAY_DIMENSION_PROPERTY}.
   */
  public static int getDefaultMaxArrayDimension() {
    return getIntProperty(MAX_ARRAY_DIMENSION_PROPERTY,
                          DEFAULT_MAX_ARRAY_DIMENSION);
  }

  /**
   * Returns the default limit on array cells.  This defaults to
   * {@value #DEFAULT_MAX_ARRAY_CELLS}, but can be overridden using the system
   * property {@value com.cybersheet.formula.FormulaEngine#MAX_ARRAY_CELLS_PROPERTY}.
   */
  public static int getDefaultMaxArrayCells() {
    return getIntProperty(MAX_ARRAY_CELLS_PROPERTY, DEFAULT_MAX_ARRAY_CELLS);
  }

  /**
   * Returns whether compiled formulas are cached by default.  This defaults
   * to {@code true}, but can be overridden using the system property
   * {@value com.cybersheet.formula.FormulaEngine#CACHE_ENABLED_PROPERTY}.
   */
  public static boolean getDefaultCacheEnabled() {
    String prop = System.getProperty(CACHE_ENABLED_PROPERTY);
    if(prop != null) {
      return Boolean.TRUE.toString().equalsIgnoreCase(prop.trim());
    }
    return true;
  }

  /**
   * Returns the default compiled formula cache capacity.  This defaults to
   * {@value #DEFAULT_MAX_CACHE_SIZE}, but can be overridden using the system
   * property {@value com.cybersheet.formula.FormulaEngine#MAX_CACHE_SIZE_PROPERTY}.
   */
  public static int getDefaultMaxCacheSize() {
    return getIntProperty(MAX_CACHE_SIZE_PROPERTY, DEFAULT_MAX_CACHE_SIZE);
  }

  private static int getIntProperty(String name, int defaultValue) {
    String prop = System.getProperty(name);
    if(prop != null) {
      prop = prop.trim();
      if(prop.length() > 0) {
        try {
          return Integer.parseInt(prop);
        } catch(NumberFormatException e) {
          LOG.warn("Ignoring invalid value '" + prop + "' for system property " +
                   name, e);
        }
      }
    }

    // use built-in default
    return defaultValue;
  }
}
