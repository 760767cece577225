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
public class DefaultDateFunctionsTest
{

  @Test
  public void testCurrentDate() throws Exception
  {
    assertEquals(SheetFixture.FIXED_TODAY, eval("=TODAY()"));
    assertEquals(45366.4375d, eval("=NOW()"));
    assertEquals(2024d, eval("=YEAR(TODAY())"));
    assertEquals(6d, eval("=WEEKDAY(TODAY())"));
    assertEquals(10d, eval("=HOUR(NOW())"));
  }

  @Test
  public void testDateParts() throws Exception
  {
    assertEquals(45306d, eval("=DATE(2024,1,15)"));
    assertEquals(45658d, eval("=DATE(2024,13,1)"));
    assertEquals(45351d, eval("=DATE(2024,3,0)"));
    assertEquals(36525d, eval("=DATE(99,12,31)"));
    assertEquals("#NUM!", eval("=DATE(-1,1,1)"));

    assertEquals(2024d, eval("=YEAR(45306)"));
    assertEquals(1d, eval("=MONTH(45306)"));
    assertEquals(15d, eval("=DAY(45306.75)"));
    assertEquals(2024d, eval("=YEAR(\"2024-01-15\")"));
    assertEquals(3d, eval("=MONTH(\"3/15/2024\")"));
    assertEquals(15d, eval("=DAY(\"45366\")"));
    assertEquals("#VALUE!", eval("=YEAR(\"abc\")"));

    assertEquals(10d, eval("=HOUR(\"3/15/2024 10:30\")"));
    assertEquals(30d, eval("=MINUTE(\"3/15/2024 10:30:45\")"));
    assertEquals(45d, eval("=SECOND(\"3/15/2024 10:30:45\")"));
    assertEquals(12d, eval("=HOUR(0.5)"));
    assertEquals(18d, eval("=HOUR(\"2024-03-15T18:05:00\")"));
  }

  @Test
  public void testDateDif() throws Exception
  {
    String start = "DATE(2020,1,15)";
    String end = "DATE(2024,3,10)";
    assertEquals(4d, eval("=DATEDIF(" + start + "," + end + ",\"Y\")"));
    assertEquals(49d, eval("=DATEDIF(" + start + "," + end + ",\"M\")"));
    assertEquals(1516d, eval("=DATEDIF(" + start + "," + end + ",\"D\")"));
    assertEquals(24d, eval("=DATEDIF(" + start + "," + end + ",\"MD\")"));
    assertEquals(1d, eval("=DATEDIF(" + start + "," + end + ",\"ym\")"));
    assertEquals(55d, eval("=DATEDIF(" + start + "," + end + ",\"YD\")"));
    assertEquals("#NUM!", eval("=DATEDIF(" + end + "," + start + ",\"D\")"));
    assertEquals("#NUM!", eval("=DATEDIF(" + start + "," + end + ",\"X\")"));
  }

  @Test
  public void testMonthArithmetic() throws Exception
  {
    assertEquals(45351d, eval("=EDATE(DATE(2024,1,31),1)"));
    assertEquals(45306d, eval("=EDATE(DATE(2024,2,15),-1)"));
    assertEquals(45351d, eval("=EOMONTH(DATE(2024,1,15),1)"));
    assertEquals(45322d, eval("=EOMONTH(DATE(2024,1,15),0)"));
  }

  @Test
  public void testWeeks() throws Exception
  {
    assertEquals(6d, eval("=WEEKDAY(DATE(2024,3,15))"));
    assertEquals(5d, eval("=WEEKDAY(DATE(2024,3,15),2)"));
    assertEquals(4d, eval("=WEEKDAY(DATE(2024,3,15),3)"));
    assertEquals(1d, eval("=WEEKDAY(DATE(2024,3,17))"));
    assertEquals("#NUM!", eval("=WEEKDAY(DATE(2024,3,15),4)"));

    // 2024-01-01 is a monday
    assertEquals(1d, eval("=WEEKNUM(DATE(2024,1,1))"));
    assertEquals(2d, eval("=WEEKNUM(DATE(2024,1,7))"));
    assertEquals(1d, eval("=WEEKNUM(DATE(2024,1,7),2)"));
    assertEquals(2d, eval("=WEEKNUM(DATE(2024,1,8),2)"));
    assertEquals(11d, eval("=WEEKNUM(DATE(2024,3,15))"));
    assertEquals("#NUM!", eval("=WEEKNUM(DATE(2024,3,15),3)"));
  }

  @Test
  public void testWorkdays() throws Exception
  {
    assertEquals(45369d, eval("=WORKDAY(DATE(2024,3,15),1)"));
    assertEquals(45359d, eval("=WORKDAY(DATE(2024,3,15),-5)"));
    assertEquals(45366d, eval("=WORKDAY(DATE(2024,3,15),0)"));
    assertEquals(45370d,
                 eval("=WORKDAY(DATE(2024,3,15),1,DATE(2024,3,18))"));

    assertEquals(5d, eval("=NETWORKDAYS(DATE(2024,3,11),DATE(2024,3,15))"));
    assertEquals(-5d, eval("=NETWORKDAYS(DATE(2024,3,15),DATE(2024,3,11))"));
    assertEquals(21d, eval("=NETWORKDAYS(DATE(2024,3,1),DATE(2024,3,31))"));
    assertEquals(0d, eval("=NETWORKDAYS(DATE(2024,3,16),DATE(2024,3,17))"));

    SheetFixture holidays = new SheetFixture()
      .setColumn("A1", 45366, null);
    assertEquals(20d, eval(
        "=NETWORKDAYS(DATE(2024,3,1),DATE(2024,3,31),A1:A2)", holidays));
  }
}
