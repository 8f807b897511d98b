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

import java.util.Arrays;
import java.util.ArrayList;

import com.cybersheet.formula.FormulaEngine;
import com.cybersheet.formula.FormulaEngineBuilder;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class NamedLambdaRegistryTest
{

  @Test
  public void testDefineAndLookup() throws Exception
  {
    FormulaEngine engine = new FormulaEngineBuilder().build();
    LambdaFunction dbl = engine.compileLambda("=LAMBDA(x, x*2)");
    LambdaFunction inc = engine.compileLambda("=LAMBDA(x, x+1)");

    NamedLambdaRegistry reg = new NamedLambdaRegistry();
    reg.defineNamedLambda(" Double ", dbl);
    reg.defineNamedLambda("Inc", inc);

    assertSame(dbl, reg.getNamedLambda("DOUBLE"));
    assertSame(dbl, reg.getNamedLambda("double"));
    assertSame(inc, reg.getNamedLambda("inc"));
    assertNull(reg.getNamedLambda("missing"));
    assertNull(reg.getNamedLambda(null));
    assertEquals(2, reg.size());
    assertEquals(Arrays.asList("Double", "Inc"),
                 new ArrayList<String>(reg.getNames()));

    reg.defineNamedLambda("DOUBLE", inc);
    assertSame(inc, reg.getNamedLambda("Double"));
    assertEquals(2, reg.size());

    assertSame(inc, reg.removeNamedLambda("double"));
    assertNull(reg.removeNamedLambda("double"));
    assertEquals(1, reg.size());

    reg.clear();
    assertEquals(0, reg.size());
  }

  @Test
  public void testInvalidDefinitions() throws Exception
  {
    NamedLambdaRegistry reg = new NamedLambdaRegistry();
    LambdaFunction lambda = new FormulaEngineBuilder().build()
      .compileLambda("LAMBDA(x, x)");

    try {
      reg.defineNamedLambda("  ", lambda);
      fail("IllegalArgumentException should have been thrown");
    } catch(IllegalArgumentException expected) {
      // success
    }

    try {
      reg.defineNamedLambda("Ident", null);
      fail("IllegalArgumentException should have been thrown");
    } catch(IllegalArgumentException expected) {
      // success
    }
  }

  @Test
  public void testNamedLambdaEvaluation() throws Exception
  {
    FormulaEngine engine = new FormulaEngineBuilder().build();
    NamedLambdaRegistry reg = new NamedLambdaRegistry();
    reg.defineNamedLambda("Hyp",
        engine.compileLambda("=LAMBDA(a, b, SQRT(a^2 + b^2))"));

    FormulaContext ctx = engine.newContext().setNamedLambdas(reg).toContext();
    assertEquals(5.0d, engine.evaluate("=hyp(3, 4)", ctx).getAsDouble(), 0d);
    assertEquals(ErrorKind.VALUE,
                 engine.evaluate("=Hyp(3)", ctx).getErrorKind());
    assertEquals(FormulaValue.Type.LAMBDA,
                 engine.evaluate("=Hyp", ctx).getType());
    assertEquals(ErrorKind.NAME,
                 engine.evaluate("=Other(3)", ctx).getErrorKind());
  }
}
