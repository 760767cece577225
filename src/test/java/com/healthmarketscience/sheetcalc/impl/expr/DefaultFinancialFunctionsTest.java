/*
Copyright (c) 2024 James Ahlborn

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

package com.healthmarketscience.sheetcalc.impl.expr;

import com.healthmarketscience.sheetcalc.SheetFixture;
import org.junit.jupiter.api.Test;

import static com.healthmarketscience.sheetcalc.impl.expr.FormulaParserTest.eval;
import static org.junit.jupiter.api.Assertions.*;

/**
 *
 * @author James Ahlborn
 */
public class DefaultFinancialFunctionsTest
{
  private static final double DELTA = 1e-6;

  @Test
  public void testAnnuities() throws Exception
  {
    assertEquals(-57.6190476d, num("=PMT(0.1,2,100)"), DELTA);
    assertEquals(-52.3809524d, num("=PMT(0.1,2,100,0,1)"), DELTA);
    assertEquals(-100d, num("=PMT(0,10,1000)"), DELTA);
    assertEquals("#DIV/0!", eval("=PMT(0,0,1000)"));

    assertEquals(210d, num("=FV(0.1,2,-100)"), DELTA);
    assertEquals(1000d, num("=FV(0,10,-100)"), DELTA);

    assertEquals(173.553719d, num("=PV(0.1,2,-100)"), DELTA);
    assertEquals(1000d, num("=PV(0,10,-100)"), DELTA);

    assertEquals(2d, num("=NPER(0.1,PMT(0.1,2,100),100)"), DELTA);
    assertEquals(10d, num("=NPER(0,-100,1000)"), DELTA);
    assertEquals("#NUM!", eval("=NPER(0,0,1000)"));
    assertEquals("#NUM!", eval("=NPER(0.1,-5,100)"));

    assertEquals(0.05d, num("=RATE(10,PMT(0.05,10,1000),1000)"), DELTA);
    assertEquals(0.1d, num("=RATE(2,PMT(0.1,2,100),100)"), DELTA);
  }

  @Test
  public void testCashFlows() throws Exception
  {
    assertEquals(200d, num("=NPV(0.1,110,121)"), DELTA);

    SheetFixture cells = new SheetFixture()
      .setColumn("A1", -100, 110)
      .setColumn("B1", -100, 60, 60)
      .setColumn("C1", 110, 121);
    assertEquals(200d, num("=NPV(0.1,C1:C2)", cells), DELTA);
    assertEquals(0.1d, num("=IRR(A1:A2)", cells), DELTA);
    assertEquals(0.130662386d, num("=IRR(B1:B3)", cells), DELTA);
    assertEquals(0.130662386d, num("=IRR(B1:B3,0.5)", cells), DELTA);
    assertEquals("#NUM!", eval("=IRR(D1:D3)", cells));
  }

  private static double num(String formula) {
    return num(formula, new SheetFixture());
  }

  private static double num(String formula, SheetFixture cells) {
    Object result = eval(formula, cells);
    assertTrue(result instanceof Double, formula + " gave " + result);
    return (Double)result;
  }
}
