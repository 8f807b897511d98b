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

/**
 * A Function provides an invokable handle to built-in (or user supplied)
 * functionality to a formula.
 */
public interface Function
{
  /** how a function treats array arguments */
  public enum ArrayPolicy
  {
    /** an array argument is an error (a 1x1 array is unwrapped) */
    SCALAR,
    /** the function is applied to each element of the array arguments,
        producing an array of the same shape */
    ELEMENTWISE,
    /** array arguments are passed through unchanged, typically to be
        reduced to a scalar */
    AGGREGATE;
  }

  /**
   * @return the name of this function
   */
  public String getName();

  /**
   * Evaluates this function within the given context with the given
   * parameters.  Failures are returned as error values, never thrown.
   *
   * @return the result of the function evaluation
   */
  public FormulaValue eval(FormulaContext ctx, FormulaValue... params);

  /**
   * @return {@code true} if this function is a "pure" function, {@code false}
   *         otherwise.  A pure function will always return the same result
   *         for a given set of parameters and has no side effects.
   */
  public boolean isPure();

  /**
   * @return {@code true} if the parameters of this function should be
   *         evaluated only when the function reads them (e.g. the branches of
   *         {@code IF})
   */
  public boolean isLazy();

  /**
   * @return the array handling of this function
   */
  public ArrayPolicy getArrayPolicy();
}
