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

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import org.apache.commons.lang3.StringUtils;

/**
 * Workbook scoped set of named lambdas.  An instance is owned by the
 * document which defines the names and is passed into each evaluation
 * through the {@link FormulaContext}; the engine only reads from it.  Names
 * are case-insensitive.  Safe for concurrent use.
 */
public class NamedLambdaRegistry
{
  private final Map<String,Entry> _lambdas =
    new ConcurrentHashMap<String,Entry>();

  public NamedLambdaRegistry() {}

  /**
   * Defines (or replaces) the lambda with the given name.
   *
   * @throws IllegalArgumentException if the name is blank or the lambda is
   *         {@code null}
   */
  public void defineNamedLambda(String name, LambdaFunction lambda) {
    if(StringUtils.isBlank(name)) {
      throw new IllegalArgumentException("Lambda name must be given");
    }
    if(lambda == null) {
      throw new IllegalArgumentException("Lambda must be given for " + name);
    }
    String trimmed = name.trim();
    _lambdas.put(toLookupName(trimmed), new Entry(trimmed, lambda));
  }

  /**
   * @return the lambda with the given name, or {@code null} if none is
   *         defined
   */
  public LambdaFunction getNamedLambda(String name) {
    if(name == null) {
      return null;
    }
    Entry e = _lambdas.get(toLookupName(name.trim()));
    return ((e != null) ? e._lambda : null);
  }

  /**
   * @return the removed lambda, or {@code null} if none was defined
   */
  public LambdaFunction removeNamedLambda(String name) {
    Entry e = _lambdas.remove(toLookupName(name.trim()));
    return ((e != null) ? e._lambda : null);
  }

  /**
   * @return the defined names (as originally given), sorted
   */
  public Set<String> getNames() {
    Set<String> names = new TreeSet<String>(String.CASE_INSENSITIVE_ORDER);
    for(Entry e : _lambdas.values()) {
      names.add(e._name);
    }
    return Collections.unmodifiableSet(names);
  }

  public void clear() {
    _lambdas.clear();
  }

  public int size() {
    return _lambdas.size();
  }

  private static String toLookupName(String name) {
    return name.toUpperCase();
  }

  private static final class Entry
  {
    private final String _name;
    private final LambdaFunction _lambda;

    private Entry(String name, LambdaFunction lambda) {
      _name = name;
      _lambda = lambda;
    }
  }
}
