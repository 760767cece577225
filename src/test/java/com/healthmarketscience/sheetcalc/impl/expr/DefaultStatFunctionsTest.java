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

import java.util.Random;

import com.healthmarketscience.sheetcalc.SheetFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.healthmarketscience.sheetcalc.impl.expr.FormulaParserTest.eval;
import static org.junit.jupiter.api.Assertions.*;

/**
 *
 * @author James Ahlborn
 */
public class DefaultStatFunctionsTest
{
  private static final String[] OPS = {"", "=", "<>", ">", ">=", "<", "<="};

  private SheetFixture _cells;

  @BeforeEach
  public void setUp() {
    _cells = new SheetFixture()
      .setColumn("A1", 1, 2, 3, 4)
      .setColumn("B1", 2, 4, 6, 8)
      .setColumn("C1", "apple", "banana", "avocado", null)
      .setColumn("D1", 8, 6, 4, 2);
  }

  @Test
  public void testDistribution() throws Exception
  {
    assertEquals(Math.sqrt(32d / 7d),
                 (Double)eval("=STDEV(2,4,4,4,5,5,7,9)"), 1e-12);
    assertEquals(32d / 7d, (Double)eval("=VAR(2,4,4,4,5,5,7,9)"), 1e-12);
    assertEquals("#DIV/0!", eval("=VAR(1)"));
    assertEquals("#DIV/0!", eval("=STDEV(C1:C4)", _cells));

    assertEquals(2d, eval("=MEDIAN(3,1,2)"));
    assertEquals(2.5d, eval("=MEDIAN(A1:A4)", _cells));
    assertEquals(2d, eval("=MODE(1,2,2,3,3)"));
    assertEquals("#N/A", eval("=MODE(1,2,3)"));

    assertEquals(1.75d, eval("=PERCENTILE(A1:A4,0.25)", _cells));
    assertEquals(4d, eval("=PERCENTILE(A1:A4,1)", _cells));
    assertEquals("#NUM!", eval("=PERCENTILE(A1:A4,1.5)", _cells));
    assertEquals(2.5d, eval("=QUARTILE(A1:A4,2)", _cells));
    assertEquals(1d, eval("=QUARTILE(A1:A4,0)", _cells));
    assertEquals("#NUM!", eval("=QUARTILE(A1:A4,5)", _cells));
  }

  @Test
  public void testRanking() throws Exception
  {
    assertEquals(2d, eval("=RANK(3,A1:A4)", _cells));
    assertEquals(3d, eval("=RANK(3,A1:A4,1)", _cells));
    assertEquals("#N/A", eval("=RANK(9,A1:A4)", _cells));
    assertEquals(4d, eval("=LARGE(A1:A4,1)", _cells));
    assertEquals(2d, eval("=SMALL(A1:A4,2)", _cells));
    assertEquals("#NUM!", eval("=LARGE(A1:A4,5)", _cells));
    assertEquals("#NUM!", eval("=SMALL(A1:A4,0)", _cells));
  }

  @Test
  public void testRegression() throws Exception
  {
    assertEquals(1d, (Double)eval("=CORREL(A1:A4,B1:B4)", _cells), 1e-12);
    assertEquals(-1d, (Double)eval("=CORREL(A1:A4,D1:D4)", _cells), 1e-12);
    assertEquals("#N/A", eval("=CORREL(A1:A4,B1:B3)", _cells));
    assertEquals(10d, (Double)eval("=FORECAST(5,B1:B4,A1:A4)", _cells), 1e-12);
    assertEquals(0d, (Double)eval("=FORECAST(5,D1:D4,A1:A4)", _cells), 1e-12);
  }

  @Test
  public void testConditionalAggregates() throws Exception
  {
    assertEquals(7d, eval("=SUMIF(A1:A4,\">2\")", _cells));
    assertEquals(14d, eval("=SUMIF(A1:A4,\">2\",B1:B4)", _cells));
    assertEquals(2d, eval("=COUNTIF(C1:C4,\"a*\")", _cells));
    assertEquals(1d, eval("=COUNTIF(C1:C4,\"APPLE\")", _cells));
    assertEquals(1d, eval("=COUNTIF(C1:C4,\"\")", _cells));
    assertEquals(3d, eval("=COUNTIF(C1:C4,\"<>\")", _cells));
    assertEquals(1d, eval("=COUNTIF(A1:A4,3)", _cells));
    assertEquals(3d, eval("=COUNTIF(A1:A4,\"<>3\")", _cells));
    assertEquals(3d, eval("=AVERAGEIF(A1:A4,\">=2\")", _cells));
    assertEquals(4d, eval("=AVERAGEIF(C1:C4,\"b*\",B1:B4)", _cells));
    assertEquals("#DIV/0!", eval("=AVERAGEIF(A1:A4,\">10\")", _cells));

    assertEquals(6d, eval("=SUMIFS(B1:B4,A1:A4,\">1\",C1:C4,\"a*\")", _cells));
    assertEquals(2d, eval("=COUNTIFS(A1:A4,\">1\",A1:A4,\"<4\")", _cells));
    assertEquals(3d, eval("=AVERAGEIFS(B1:B4,A1:A4,\"<=2\")", _cells));
    assertEquals("#VALUE!", eval("=SUMIFS(B1:B4,A1:A4)", _cells));
    assertEquals("#VALUE!", eval("=COUNTIFS(A1:A4,\">1\",A1:A4)", _cells));
  }

  @Test
  public void testConditionalAggregatesAgainstBruteForce() throws Exception
  {
    Random rand = new Random(1234L);
    for(int iter = 0; iter < 200; ++iter) {
      int numVals = 1 + rand.nextInt(10);
      Object[] vals = new Object[numVals];
      for(int i = 0; i < numVals; ++i) {
        vals[i] = rand.nextInt(21) - 5;
      }
      String op = OPS[rand.nextInt(OPS.length)];
      int threshold = rand.nextInt(21) - 5;
      String crit = op + threshold;

      double expectedSum = 0d;
      int expectedCount = 0;
      for(Object val : vals) {
        int num = (Integer)val;
        if(satisfies(num, op, threshold)) {
          expectedSum += num;
          ++expectedCount;
        }
      }

      SheetFixture cells = new SheetFixture().setColumn("A1", vals);
      String range = "A1:A" + numVals;
      String msg = crit + " over " + java.util.Arrays.toString(vals);
      assertEquals(expectedSum,
                   eval("=SUMIF(" + range + ",\"" + crit + "\")", cells), msg);
      assertEquals((double)expectedCount,
                   eval("=COUNTIF(" + range + ",\"" + crit + "\")", cells),
                   msg);
      Object expectedAvg = ((expectedCount > 0) ?
                            (Object)(expectedSum / expectedCount) :
                            (Object)"#DIV/0!");
      assertEquals(expectedAvg,
                   eval("=AVERAGEIF(" + range + ",\"" + crit + "\")", cells),
                   msg);
    }
  }

  private static boolean satisfies(int num, String op, int threshold) {
    switch(op) {
    case "<>":
      return (num != threshold);
    case ">":
      return (num > threshold);
    case ">=":
      return (num >= threshold);
    case "<":
      return (num < threshold);
    case "<=":
      return (num <= threshold);
    default:
      return (num == threshold);
    }
  }
}
