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

/**
 * Only two instances exist, see {@link ValueSupport#TRUE_VAL} and
 * {@link ValueSupport#FALSE_VAL}.
 */
public final class BooleanValue extends BaseValue
{
  private final boolean _val;

  BooleanValue(boolean val) {
    _val = val;
  }

  @Override
  public Type getType() {
    return Type.BOOLEAN;
  }

  @Override
  public Object get() {
    return _val;
  }

  @Override
  public boolean getAsBoolean() {
    return _val;
  }

  @Override
  public String getAsString() {
    return (_val ? "TRUE" : "FALSE");
  }

  @Override
  public double getAsDouble() {
    return (_val ? 1.0d : 0.0d);
  }
}
