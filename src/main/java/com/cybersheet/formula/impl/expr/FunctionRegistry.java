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

package com.cybersheet.formula.impl.expr;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.cybersheet.formula.expr.Function;
import com.cybersheet.formula.expr.FunctionLookup;

/**
 * Per engine function lookup: user registered functions first, then the
 * built-ins.  A user function with the name of a built-in replaces it for
 * this registry only.
 */
public class FunctionRegistry implements FunctionLookup
{
  private final Map<String,Function> _userFuncs =
    new ConcurrentHashMap<String,Function>();
  private volatile FunctionLookup _builtins;

  public FunctionRegistry() {
    this(DefaultFunctions.LOOKUP);
  }

  public FunctionRegistry(FunctionLookup builtins) {
    setBaseLookup(builtins);
  }

  public FunctionLookup getBaseLookup() {
    return _builtins;
  }

  /**
   * Replaces the lookup consulted after the user functions, {@code null}
   * restores the built-ins.
   */
  public void setBaseLookup(FunctionLookup builtins) {
    _builtins = ((builtins != null) ? builtins : DefaultFunctions.LOOKUP);
  }

  public void registerFunction(Function func) {
    if(func == null) {
      throw new IllegalArgumentException("Function must be given");
    }
    _userFuncs.put(DefaultFunctions.toLookupName(func.getName()), func);
  }

  public Function removeFunction(String name) {
    return _userFuncs.remove(DefaultFunctions.toLookupName(name));
  }

  @Override
  public Function getFunction(String name) {
    if(name == null) {
      return null;
    }
    Function func = _userFuncs.get(DefaultFunctions.toLookupName(name));
    return ((func != null) ? func : _builtins.getFunction(name));
  }
}
