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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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
public class DefaultArrayFunctionsTest
{
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private SheetFixture _cells;

  @BeforeEach
  public void setUp() {
    _cells = new SheetFixture()
      .setColumn("A1", 3, 1, 2)
      .setColumn("B1", "b", "c", "a")
      .setColumn("C1", Boolean.TRUE, Boolean.FALSE, Boolean.TRUE)
      .setColumn("D1", "x", "y", "X", 1);
  }

  @Test
  public void testSort() throws Exception
  {
    assertEquals(rows(row(1d), row(2d), row(3d)), eval("=SORT(A1:A3)", _cells));
    assertEquals(rows(row(3d), row(2d), row(1d)),
                 eval("=SORT(A1:A3,1,FALSE)", _cells));
    assertEquals(rows(row(1d, "c"), row(3d, "b"), row(2d, "a")),
                 eval("=SORT(A1:B3,2,FALSE)", _cells));
    assertEquals(rows(row(2d, "a"), row(3d, "b"), row(1d, "c")),
                 eval("=SORT(A1:B3,2)", _cells));
    assertEquals("#VALUE!", eval("=SORT(A1:B3,3)", _cells));
  }

  @Test
  public void testFilter() throws Exception
  {
    assertEquals(rows(row(3d, "b"), row(2d, "a")),
                 eval("=FILTER(A1:B3,C1:C3)", _cells));
    // a single row condition picks columns
    assertEquals(rows(row(3d)), eval("=FILTER(A1:B1,C1:D1)", _cells));
    assertEquals("#N/A", eval("=FILTER(A1:B3,E1:E3)", _cells));
    assertEquals("#VALUE!", eval("=FILTER(A1:B3,C1:C2)", _cells));
  }

  @Test
  public void testUniqueAndTranspose() throws Exception
  {
    assertEquals(rows(row("x"), row("y"), row(1d)),
                 eval("=UNIQUE(D1:D4)", _cells));
    assertEquals(rows(row(3d, 1d), row("b", "c")),
                 eval("=TRANSPOSE(A1:B2)", _cells));
    assertEquals(rows(row(3d, 1d, 2d)), eval("=TRANSPOSE(A1:A3)", _cells));
  }

  @Test
  public void testSparkline() throws Exception
  {
    JsonNode node = parseMarker(DefaultArrayFunctions.SPARKLINE_MARKER,
                                eval("=SPARKLINE(A1:A3)", _cells));
    JsonNode data = node.get("data");
    assertEquals(3, data.size());
    assertEquals(3d, data.get(0).asDouble());
    assertEquals(1d, data.get(1).asDouble());
    assertEquals(2d, data.get(2).asDouble());
    assertFalse(node.has("type"));

    node = parseMarker(DefaultArrayFunctions.SPARKLINE_MARKER,
                       eval("=SPARKLINE(A1:B3,\"bar\")", _cells));
    assertEquals(3, node.get("data").size());
    assertEquals("bar", node.get("type").asText());
  }

  @Test
  public void testImage() throws Exception
  {
    assertEquals("__IMAGE__{\"url\":\"http://example.com/a.png\"}",
                 eval("=IMAGE(\" http://example.com/a.png \")"));
    assertEquals("__IMAGE__{\"url\":\"a.png\",\"mode\":4,\"height\":50,\"width\":100.5}",
                 eval("=IMAGE(\"a.png\",4,50,100.5)"));
    assertEquals("#VALUE!", eval("=IMAGE(\"  \")"));
  }

  private static JsonNode parseMarker(String prefix, Object result)
    throws Exception
  {
    assertTrue(result instanceof String);
    String str = (String)result;
    assertTrue(str.startsWith(prefix), str);
    return MAPPER.readTree(str.substring(prefix.length()));
  }
}
