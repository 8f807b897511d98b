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

import java.util.List;
import java.util.Map;

/**
 * A closure produced by evaluating a {@code LAMBDA(...)} definition.  The
 * body is not evaluated until the lambda is invoked.  The variables visible
 * at definition time are captured as an immutable snapshot, later changes to
 * the defining scope are never observed.
 */
public interface LambdaFunction extends FormulaValue
{
  /**
   * @return the parameter names, in declaration order
   */
  public List<String> getParameters();

  /**
   * @return the immutable snapshot of the variables captured when this
   *         lambda was created
   */
  public Map<String,FormulaValue> getCapturedContext();

  /**
   * Invokes this lambda.  The parameters are bound positionally into a new
   * scope chained to the captured context and the body is evaluated there.
   * A parameter count mismatch or exceeding the configured call depth
   * yields {@link ErrorKind#VALUE}.
   *
   * @param ctx the context of the caller (supplies cells, named lambdas and
   *            the current call depth)
   * @return the result of evaluating the body
   */
  public FormulaValue invoke(FormulaContext ctx, FormulaValue... args);

  /**
   * @return the formula text of the body
   */
  public String getBodyString();
}
