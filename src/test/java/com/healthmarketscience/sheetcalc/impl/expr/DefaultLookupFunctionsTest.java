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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.healthmarketscience.sheetcalc.SheetFixture.row;
import static com.healthmarketscience.sheetcalc.SheetFixture.rows;
import static com.healthmarketscience.sheetcalc.impl.expr.FormulaParserTest.eval;
import static org.junit.jupiter.api.Assertions.*;

/**
 *
 * @author James Ahlborn
 */
public class DefaultLookupFunctionsTest
{
  private SheetFixture _cells;

  @BeforeEach
  public void setUp() {
    // vertical table A1:B3, horizontal table A5:C6, descending C1:C3
    _cells = new SheetFixture()
      .setColumn("A1", 1, 2, 3)
      .setColumn("B1", "one", "two", "three")
      .setColumn("C1", 3, 2, 1)
      .set("A5", 1).set("B5", 2).set("C5", 3)
      .set("A6", "a").set("B6", "b").set("C6", "c");
  }

  @Test
  public void testVLookup() throws Exception
  {
    assertEquals("two", eval("=VLOOKUP(2,A1:B3,2,FALSE)", _cells));
    assertEquals("#N/A", eval("=VLOOKUP(5,A1:B3,2,FALSE)", _cells));
    assertEquals("two", eval("=VLOOKUP(2.5,A1:B3,2)", _cells));
    assertEquals("three", eval("=VLOOKUP(9,A1:B3,2,TRUE)", _cells));
    assertEquals("#N/A", eval("=VLOOKUP(0,A1:B3,2,TRUE)", _cells));
    assertEquals("#REF!", eval("=VLOOKUP(2,A1:B3,3,FALSE)", _cells));
    assertEquals("#VALUE!", eval("=VLOOKUP(2,A1:B3,0,FALSE)", _cells));
    assertEquals("three", eval("=VLOOKUP(\"THREE\",B1:B3,1,FALSE)", _cells));
  }

  @Test
  public void testHLookup() throws Exception
  {
    assertEquals("c", eval("=HLOOKUP(3,A5:C6,2,FALSE)", _cells));
    assertEquals("b", eval("=HLOOKUP(2.9,A5:C6,2)", _cells));
    assertEquals("#N/A", eval("=HLOOKUP(4,A5:C6,2,FALSE)", _cells));
    assertEquals("#REF!", eval("=HLOOKUP(3,A5:C6,3,FALSE)", _cells));
  }

  @Test
  public void testIndexAndMatch() throws Exception
  {
    assertEquals("two", eval("=INDEX(A1:B3,2,2)", _cells));
    assertEquals(3d, eval("=INDEX(A1:B3,3,1)", _cells));
    assertEquals(2d, eval("=INDEX(A1:A3,2)", _cells));
    assertEquals(3d, eval("=INDEX(A5:C5,3)", _cells));
    assertEquals("#REF!", eval("=INDEX(A1:B3,4,1)", _cells));
    assertEquals(rows(row("one"), row("two"), row("three")),
                 eval("=INDEX(A1:B3,0,2)", _cells));
    assertEquals(rows(row(2d, "two")), eval("=INDEX(A1:B3,2,0)", _cells));
    assertEquals("two",
                 eval("=INDEX(B1:B3,MATCH(2,A1:A3,0))", _cells));

    assertEquals(2d, eval("=MATCH(2,A1:A3,0)", _cells));
    assertEquals(2d, eval("=MATCH(2.5,A1:A3)", _cells));
    assertEquals("#N/A", eval("=MATCH(5,A1:A3,0)", _cells));
    assertEquals("#N/A", eval("=MATCH(0.5,A1:A3,1)", _cells));
    assertEquals(2d, eval("=MATCH(\"TWO\",B1:B3,0)", _cells));
    // lookups coerce numeric strings
    assertEquals(2d, eval("=MATCH(\"2\",A1:A3,0)", _cells));
    assertEquals(3d, eval("=MATCH(\"10\",A1:A3)", _cells));
    assertEquals(2d, eval("=MATCH(2,C1:C3,-1)", _cells));
    assertEquals(1d, eval("=MATCH(2.5,C1:C3,-1)", _cells));
    assertEquals(3d, eval("=MATCH(\"c\",A6:C6,0)", _cells));
  }

  @Test
  public void testXLookup() throws Exception
  {
    assertEquals("two", eval("=XLOOKUP(2,A1:A3,B1:B3)", _cells));
    assertEquals("#N/A", eval("=XLOOKUP(9,A1:A3,B1:B3)", _cells));
    assertEquals("none", eval("=XLOOKUP(9,A1:A3,B1:B3,\"none\")", _cells));
    assertEquals("b", eval("=XLOOKUP(2,A5:C5,A6:C6)", _cells));
    assertEquals(rows(row(2d, "two")),
                 eval("=XLOOKUP(2,A1:A3,A1:B3)", _cells));
  }

  @Test
  public void testMisc() throws Exception
  {
    assertEquals(3d, eval("=ROWS(A1:B3)", _cells));
    assertEquals(2d, eval("=COLUMNS(A1:B3)", _cells));
    assertEquals(1d, eval("=ROWS(5)"));
    assertEquals("b", eval("=CHOOSE(2,\"a\",\"b\",\"c\")"));
    assertEquals("#VALUE!", eval("=CHOOSE(4,\"a\",\"b\")"));
    assertEquals("#VALUE!", eval("=CHOOSE(0,\"a\")"));
  }
}
