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
 * Text value.  Conversion to a number accepts anything that parses as a
 * number, otherwise fails with {@code #VALUE!}.
 */
public class StringValue extends BaseValue
{
  private final String _val;

  StringValue(String val) {
    _val = val;
  }

  @Override
  public Type getType() {
    return Type.TEXT;
  }

  @Override
  public Object get() {
    return _val;
  }

  @Override
  public boolean getAsBoolean() {
    if("TRUE".equalsIgnoreCase(_val)) {
      return true;
    }
    if("FALSE".equalsIgnoreCase(_val)) {
      return false;
    }
    throw invalidConversion(Type.BOOLEAN);
  }

  @Override
  public String getAsString() {
    return _val;
  }

  @Override
  public double getAsDouble() {
    Double num = getNumber();
    if(num == null) {
      throw invalidConversion(Type.NUMBER);
    }
    return num;
  }

  /**
   * @return the numeric interpretation of this string ("" is 0), {@code null}
   *         if it is not numeric
   */
  Double getNumber() {
    return ValueSupport.parseNumber(_val);
  }

  @Override
  public boolean equals(Object o) {
    return ((o instanceof StringValue) && _val.equals(((StringValue)o)._val));
  }

  @Override
  public int hashCode() {
    return _val.hashCode();
  }
}
