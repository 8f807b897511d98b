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
 * Numeric value, only created for finite doubles (see
 * {@link ValueSupport#toValue(double)}).
 */
public class NumberValue extends BaseValue
{
  private final double _val;

  NumberValue(double val) {
    // normalize negative zero
    _val = ((val == 0.0d) ? 0.0d : val);
  }

  @Override
  public Type getType() {
    return Type.NUMBER;
  }

  @Override
  public Object get() {
    return _val;
  }

  @Override
  public boolean getAsBoolean() {
    return (_val != 0.0d);
  }

  @Override
  public String getAsString() {
    return ValueSupport.formatNumber(_val);
  }

  @Override
  public double getAsDouble() {
    return _val;
  }

  @Override
  public boolean equals(Object o) {
    return ((o instanceof NumberValue) &&
            (Double.compare(_val, ((NumberValue)o)._val) == 0));
  }

  @Override
  public int hashCode() {
    return Double.hashCode(_val);
  }
}
