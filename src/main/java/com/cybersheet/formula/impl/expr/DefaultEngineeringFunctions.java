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

import com.cybersheet.formula.expr.ErrorKind;
import com.cybersheet.formula.expr.EvalException;
import com.cybersheet.formula.expr.FormulaContext;
import com.cybersheet.formula.expr.FormulaValue;
import com.cybersheet.formula.expr.Function;
import org.apache.commons.lang3.StringUtils;
import static com.cybersheet.formula.impl.expr.DefaultFunctions.*;
import static com.cybersheet.formula.impl.expr.FunctionSupport.*;

/**
 * Base conversion and bitwise functions.
 * <p>
 * Each numeral system has a fixed signed width: binary 10 bits, octal 30
 * bits (10 digits) and hexadecimal 40 bits (10 digits).  Negative numbers
 * are written as the two's complement within that width.
 */
public class DefaultEngineeringFunctions
{
  private static final int MAX_DIGITS = 10;
  private static final long MAX_BIT_VALUE = (1L << 48) - 1L;
  private static final int MAX_SHIFT = 53;

  enum NumberBase
  {
    BIN(2, 10),
    OCT(8, 30),
    HEX(16, 40);

    private final int _radix;
    private final int _bits;

    private NumberBase(int radix, int bits) {
      _radix = radix;
      _bits = bits;
    }

    public long getMinValue() {
      return -(1L << (_bits - 1));
    }

    public long getMaxValue() {
      return (1L << (_bits - 1)) - 1L;
    }

    /**
     * Parses a numeral of this system, a full width numeral with the top
     * bit set is negative.
     */
    public long parse(FormulaValue param) {
      if(param.getType() == FormulaValue.Type.BOOLEAN) {
        throw new EvalException("Invalid " + this + " numeral " + param);
      }
      String str = param.getAsString().trim();
      if(str.length() > MAX_DIGITS) {
        throw new EvalException(ErrorKind.NUM, "Too many digits '" + str + "'");
      }
      if(str.length() == 0) {
        return 0L;
      }
      for(int i = 0; i < str.length(); ++i) {
        if(Character.digit(str.charAt(i), _radix) < 0) {
          throw new EvalException(ErrorKind.NUM, "Invalid " + this +
                                  " numeral '" + str + "'");
        }
      }
      long val = Long.parseLong(str, _radix);
      if(val > getMaxValue()) {
        val -= (1L << _bits);
      }
      return val;
    }

    /**
     * Writes the given number as a numeral of this system, zero padded to
     * the given number of places (ignored for negative numbers).
     */
    public String format(long val, FormulaValue places) {
      if((val < getMinValue()) || (val > getMaxValue())) {
        throw new EvalException(ErrorKind.NUM, "Number " + val +
                                " out of range for " + this);
      }
      if(val < 0) {
        return Long.toString(val + (1L << _bits), _radix).toUpperCase();
      }
      String str = Long.toString(val, _radix).toUpperCase();
      if(places == null) {
        return str;
      }
      long numPlaces = getAsIntegral(places, ErrorKind.NUM);
      if((numPlaces < 1) || (numPlaces > MAX_DIGITS) ||
         (str.length() > numPlaces)) {
        throw new EvalException(ErrorKind.NUM, "Invalid places " + numPlaces +
                                " for '" + str + "'");
      }
      return StringUtils.leftPad(str, (int)numPlaces, '0');
    }
  }

  private DefaultEngineeringFunctions() {}

  static void init() {
    // dummy method to ensure this class is loaded
  }

  public static final Function BIN2DEC = registerFunc(new ToDecimalFunc("BIN2DEC", NumberBase.BIN));
  public static final Function OCT2DEC = registerFunc(new ToDecimalFunc("OCT2DEC", NumberBase.OCT));
  public static final Function HEX2DEC = registerFunc(new ToDecimalFunc("HEX2DEC", NumberBase.HEX));

  public static final Function DEC2BIN = registerFunc(new FromDecimalFunc("DEC2BIN", NumberBase.BIN));
  public static final Function DEC2OCT = registerFunc(new FromDecimalFunc("DEC2OCT", NumberBase.OCT));
  public static final Function DEC2HEX = registerFunc(new FromDecimalFunc("DEC2HEX", NumberBase.HEX));

  public static final Function BIN2OCT = registerFunc(new ConvertFunc("BIN2OCT", NumberBase.BIN, NumberBase.OCT));
  public static final Function BIN2HEX = registerFunc(new ConvertFunc("BIN2HEX", NumberBase.BIN, NumberBase.HEX));
  public static final Function OCT2BIN = registerFunc(new ConvertFunc("OCT2BIN", NumberBase.OCT, NumberBase.BIN));
  public static final Function OCT2HEX = registerFunc(new ConvertFunc("OCT2HEX", NumberBase.OCT, NumberBase.HEX));
  public static final Function HEX2BIN = registerFunc(new ConvertFunc("HEX2BIN", NumberBase.HEX, NumberBase.BIN));
  public static final Function HEX2OCT = registerFunc(new ConvertFunc("HEX2OCT", NumberBase.HEX, NumberBase.OCT));

  public static final Function BITAND = registerFunc(new Func2("BITAND", Function.ArrayPolicy.ELEMENTWISE) {
    @Override
    protected FormulaValue eval2(FormulaContext ctx, FormulaValue param1,
                                 FormulaValue param2) {
      return ValueSupport.toValue(
          (double)(getBitOperand(param1) & getBitOperand(param2)));
    }
  });

  public static final Function BITOR = registerFunc(new Func2("BITOR", Function.ArrayPolicy.ELEMENTWISE) {
    @Override
    protected FormulaValue eval2(FormulaContext ctx, FormulaValue param1,
                                 FormulaValue param2) {
      return ValueSupport.toValue(
          (double)(getBitOperand(param1) | getBitOperand(param2)));
    }
  });

  public static final Function BITXOR = registerFunc(new Func2("BITXOR", Function.ArrayPolicy.ELEMENTWISE) {
    @Override
    protected FormulaValue eval2(FormulaContext ctx, FormulaValue param1,
                                 FormulaValue param2) {
      return ValueSupport.toValue(
          (double)(getBitOperand(param1) ^ getBitOperand(param2)));
    }
  });

  public static final Function BITLSHIFT = registerFunc(new Func2("BITLSHIFT", Function.ArrayPolicy.ELEMENTWISE) {
    @Override
    protected FormulaValue eval2(FormulaContext ctx, FormulaValue param1,
                                 FormulaValue param2) {
      return shift(getBitOperand(param1), getShiftAmount(param2));
    }
  });

  public static final Function BITRSHIFT = registerFunc(new Func2("BITRSHIFT", Function.ArrayPolicy.ELEMENTWISE) {
    @Override
    protected FormulaValue eval2(FormulaContext ctx, FormulaValue param1,
                                 FormulaValue param2) {
      return shift(getBitOperand(param1), -getShiftAmount(param2));
    }
  });


  private static long getBitOperand(FormulaValue param) {
    long val = getAsIntegral(param, ErrorKind.NUM);
    if((val < 0L) || (val > MAX_BIT_VALUE)) {
      throw new EvalException(ErrorKind.NUM, "Invalid bit operand " + val);
    }
    return val;
  }

  private static int getShiftAmount(FormulaValue param) {
    int amount = getAsInt(param);
    if(Math.abs(amount) > MAX_SHIFT) {
      throw new EvalException(ErrorKind.NUM, "Invalid shift amount " + amount);
    }
    return amount;
  }

  /**
   * Shifts left for a positive amount, right for a negative amount.
   */
  private static FormulaValue shift(long val, int amount) {
    if(amount < 0) {
      return ValueSupport.toValue((double)(val >>> -amount));
    }
    if(val > (MAX_BIT_VALUE >>> amount)) {
      throw new EvalException(ErrorKind.NUM, "Shift overflow " + val +
                              " << " + amount);
    }
    return ValueSupport.toValue((double)(val << amount));
  }

  private static final class ToDecimalFunc extends Func1
  {
    private final NumberBase _from;

    private ToDecimalFunc(String name, NumberBase from) {
      super(name, Function.ArrayPolicy.ELEMENTWISE);
      _from = from;
    }

    @Override
    protected FormulaValue eval1(FormulaContext ctx, FormulaValue param1) {
      return ValueSupport.toValue((double)_from.parse(param1));
    }
  }

  private static final class FromDecimalFunc extends FuncVar
  {
    private final NumberBase _to;

    private FromDecimalFunc(String name, NumberBase to) {
      super(name, 1, 2, Function.ArrayPolicy.ELEMENTWISE);
      _to = to;
    }

    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      // fractions are truncated
      long val = (long)params[0].getAsDouble();
      return ValueSupport.toValue(
          _to.format(val, ((params.length > 1) ? params[1] : null)));
    }
  }

  private static final class ConvertFunc extends FuncVar
  {
    private final NumberBase _from;
    private final NumberBase _to;

    private ConvertFunc(String name, NumberBase from, NumberBase to) {
      super(name, 1, 2, Function.ArrayPolicy.ELEMENTWISE);
      _from = from;
      _to = to;
    }

    @Override
    protected FormulaValue evalVar(FormulaContext ctx, FormulaValue[] params) {
      long val = _from.parse(params[0]);
      return ValueSupport.toValue(
          _to.format(val, ((params.length > 1) ? params[1] : null)));
    }
  }
}
