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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.cybersheet.formula.expr.Function;
import com.cybersheet.formula.expr.FunctionLookup;

/**
 * Registry of the built-in functions.  Each function family registers its
 * functions when its class is loaded, the table is complete once this class
 * is initialized and is never modified afterwards.
 */
public class DefaultFunctions
{
  private static final Map<String,Function> FUNCS =
    new HashMap<String,Function>();

  static {
    // load all default functions
    DefaultLogicalFunctions.init();
    DefaultNumberFunctions.init();
    DefaultTextFunctions.init();
    DefaultDatabaseFunctions.init();
    DefaultEngineeringFunctions.init();
    DefaultArrayFunctions.init();
    DefaultLambdaFunctions.init();
    DefaultLookupFunctions.init();
  }

  public static final FunctionLookup LOOKUP = new FunctionLookup() {
    @Override
    public Function getFunction(String name) {
      return FUNCS.get(toLookupName(name));
    }
  };

  private DefaultFunctions() {}

  /**
   * @return the names of all the built-in functions
   */
  public static Set<String> getFunctionNames() {
    return Collections.unmodifiableSet(new TreeSet<String>(FUNCS.keySet()));
  }

  public static String toLookupName(String name) {
    return ((name != null) ? name.toUpperCase() : null);
  }

  static Function registerFunc(Function func) {
    registerFunc(func.getName(), func);
    return func;
  }

  static void registerFunc(String fname, Function func) {
    String lookupFname = toLookupName(fname);
    if(FUNCS.put(lookupFname, func) != null) {
      throw new IllegalStateException("Duplicate function " + fname);
    }
  }
}
