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

package com.healthmarketscience.sheetcalc;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 *
 * @author James Ahlborn
 */
public class CellKeyTest
{

  @Test
  public void testColumnLetters() throws Exception
  {
    assertEquals(0, CellKey.fromColumnLetters("A"));
    assertEquals(25, CellKey.fromColumnLetters("Z"));
    assertEquals(26, CellKey.fromColumnLetters("AA"));
    assertEquals(27, CellKey.fromColumnLetters("ab"));
    assertEquals(701, CellKey.fromColumnLetters("ZZ"));
    assertEquals(702, CellKey.fromColumnLetters("AAA"));

    assertEquals("A", CellKey.toColumnLetters(0));
    assertEquals("Z", CellKey.toColumnLetters(25));
    assertEquals("AA", CellKey.toColumnLetters(26));
    assertEquals("ZZ", CellKey.toColumnLetters(701));
    assertEquals("AAA", CellKey.toColumnLetters(702));

    for(int col = 0; col < 2000; col += 37) {
      assertEquals(col, CellKey.fromColumnLetters(
                       CellKey.toColumnLetters(col)));
    }

    assertThrows(IllegalArgumentException.class,
                 () -> CellKey.fromColumnLetters("A1"));
  }

  @Test
  public void testParse() throws Exception
  {
    CellKey key = CellKey.parse("B3");
    assertNull(key.getSheet());
    assertEquals(2, key.getRow());
    assertEquals(1, key.getCol());
    assertEquals("B3", key.toString());

    assertEquals(new CellKey(2, 1), CellKey.parse("$B$3"));
    assertEquals(new CellKey("Sheet2", 0, 27), CellKey.parse("Sheet2!AB1"));
    assertEquals(new CellKey("My Sheet", 2, 1),
                 CellKey.parse("'My Sheet'!B3"));
    assertEquals(new CellKey("Bob's", 0, 0), CellKey.parse("'Bob''s'!A1"));

    assertEquals("'My Sheet'!B3", new CellKey("My Sheet", 2, 1).toString());
    assertEquals("Sheet2!AB1", new CellKey("Sheet2", 0, 27).toString());
    assertEquals("'Bob''s'!A1", new CellKey("Bob's", 0, 0).toString());

    for(String bad : new String[]{"", "B", "3", "A0", "B3:C4", "!A1",
                                  "'Sheet!A1", "A99999999999",
                                  "ABCDEFGHIJKLMN1"}) {
      assertThrows(IllegalArgumentException.class, () -> CellKey.parse(bad),
                   bad);
    }
    assertThrows(IllegalArgumentException.class, () -> new CellKey(-1, 0));
  }

  @Test
  public void testEqualityAndOrder() throws Exception
  {
    assertEquals(new CellKey(1, 2), new CellKey(" ", 1, 2));
    assertEquals(new CellKey(1, 2).hashCode(),
                 new CellKey(null, 1, 2).hashCode());
    assertNotEquals(new CellKey(1, 2), new CellKey("S", 1, 2));
    assertEquals(new CellKey(4, 3), new CellKey(1, 1).offset(3, 2));
    assertEquals("S", new CellKey("S", 0, 0).offset(1, 1).getSheet());

    List<CellKey> keys = new ArrayList<CellKey>(Arrays.asList(
        CellKey.parse("S!A1"), CellKey.parse("B2"), CellKey.parse("A2"),
        CellKey.parse("C1")));
    Collections.sort(keys);
    assertEquals(Arrays.asList(CellKey.parse("C1"), CellKey.parse("A2"),
                               CellKey.parse("B2"), CellKey.parse("S!A1")),
                 keys);
  }

  @Test
  public void testQuoteSheetName() throws Exception
  {
    assertEquals("Sheet1", CellKey.quoteSheetName("Sheet1"));
    assertEquals("'My Sheet'", CellKey.quoteSheetName("My Sheet"));
    assertEquals("'a-b'", CellKey.quoteSheetName("a-b"));
  }
}
