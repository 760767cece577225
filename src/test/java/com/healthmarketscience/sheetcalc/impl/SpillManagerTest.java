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

package com.healthmarketscience.sheetcalc.impl;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import com.healthmarketscience.sheetcalc.CellContentChecker;
import com.healthmarketscience.sheetcalc.CellKey;
import com.healthmarketscience.sheetcalc.CellValueAccessor;
import com.healthmarketscience.sheetcalc.expr.FormulaError;
import com.healthmarketscience.sheetcalc.expr.Value;
import com.healthmarketscience.sheetcalc.impl.expr.ValueSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.healthmarketscience.sheetcalc.SheetFixture.key;
import static org.junit.jupiter.api.Assertions.*;

/**
 *
 * @author James Ahlborn
 */
public class SpillManagerTest
{
  private final Map<CellKey,Value> _cache = new HashMap<CellKey,Value>();
  private final Set<CellKey> _userContent = new HashSet<CellKey>();
  private final CellValueAccessor _accessor = new CellValueAccessor() {
    @Override
    public Value getCellValue(String sheet, int col, int row) {
      return _cache.get(new CellKey(sheet, row, col));
    }
  };
  private SpillManager _spills;

  @BeforeEach
  public void setUp() {
    _cache.clear();
    _userContent.clear();
    _spills = new SpillManager(_cache, new CellContentChecker() {
      @Override
      public boolean hasCellContent(int row, int col) {
        return _userContent.contains(new CellKey(row, col));
      }
    });
  }

  @Test
  public void testSpill() throws Exception
  {
    CellKey a1 = key("A1");
    Value result = _spills.applyResult(a1, grid(2, 2, 1), _accessor);
    assertEquals(1d, result.get());

    assertTrue(_spills.isSpillTarget(key("B1")));
    assertTrue(_spills.isSpillTarget(key("A2")));
    assertTrue(_spills.isSpillTarget(key("B2")));
    assertFalse(_spills.isSpillTarget(a1));
    assertEquals(a1, _spills.getSpillSource(key("B2")));
    assertEquals(2d, _spills.getSpillValue(key("B1")).get());
    assertEquals(3d, _spills.getSpillValue(key("A2")).get());
    assertEquals(4d, _spills.getSpillValue(key("B2")).get());
    assertNull(_spills.getSpillValue(key("C3")));
    assertEquals(4d, _cache.get(key("B2")).get());

    // shrinking the result releases the old targets
    result = _spills.applyResult(a1, grid(2, 1, 10), _accessor);
    assertEquals(10d, result.get());
    assertTrue(_spills.isSpillTarget(key("A2")));
    assertFalse(_spills.isSpillTarget(key("B1")));
    assertFalse(_spills.isSpillTarget(key("B2")));
    assertNull(_cache.get(key("B2")));

    // a scalar result clears the spill
    Value scalar = ValueSupport.toValue(5);
    assertSame(scalar, _spills.applyResult(a1, scalar, _accessor));
    assertFalse(_spills.isSpillTarget(key("A2")));
    assertTrue(_cache.isEmpty());
  }

  @Test
  public void testSingleCellArray() throws Exception
  {
    Value result = _spills.applyResult(key("C3"), grid(1, 1, 7), _accessor);
    assertEquals(7d, result.get());
    assertFalse(_spills.isSpillTarget(key("C3")));
    assertTrue(_cache.isEmpty());

    assertEquals(FormulaError.NA, _spills.applyResult(
                     key("C3"), ValueSupport.toArray(new Value[0][]),
                     _accessor).getError());
  }

  @Test
  public void testBlockedByContent() throws Exception
  {
    CellKey a1 = key("A1");
    _spills.applyResult(a1, grid(3, 1, 1), _accessor);
    assertTrue(_spills.isSpillTarget(key("A3")));

    _userContent.add(key("A4"));
    Value result = _spills.applyResult(a1, grid(4, 1, 1), _accessor);
    assertEquals(FormulaError.SPILL, result.getError());
    // nothing is left spilled and the blocking cell is untouched
    assertFalse(_spills.isSpillTarget(key("A2")));
    assertFalse(_spills.isSpillTarget(key("A4")));
    assertTrue(_cache.isEmpty());

    _userContent.remove(key("A4"));
    result = _spills.applyResult(a1, grid(4, 1, 1), _accessor);
    assertEquals(1d, result.get());
    assertTrue(_spills.isSpillTarget(key("A4")));
  }

  @Test
  public void testBlockedByOtherSpill() throws Exception
  {
    _spills.applyResult(key("B1"), grid(3, 1, 1), _accessor);
    Value result = _spills.applyResult(key("A2"), grid(1, 2, 1), _accessor);
    assertEquals(FormulaError.SPILL, result.getError());
    assertEquals(key("B1"), _spills.getSpillSource(key("B2")));

    _spills.clearSpill(key("B1"));
    assertFalse(_spills.isSpillTarget(key("B2")));
    result = _spills.applyResult(key("A2"), grid(1, 2, 1), _accessor);
    assertEquals(1d, result.get());
    assertEquals(key("A2"), _spills.getSpillSource(key("B2")));
  }

  @Test
  public void testAccessorContent() throws Exception
  {
    // without a checker, non-blank accessor values block a spill
    final Map<CellKey,Value> sheet = new HashMap<CellKey,Value>();
    CellValueAccessor accessor = new CellValueAccessor() {
      @Override
      public Value getCellValue(String sheetName, int col, int row) {
        CellKey cell = new CellKey(sheetName, row, col);
        Value val = sheet.get(cell);
        return ((val != null) ? val : _cache.get(cell));
      }
    };
    SpillManager spills = new SpillManager(_cache, null);

    sheet.put(key("A2"), ValueSupport.toValue(""));
    assertEquals(1d, spills.applyResult(key("A1"), grid(2, 1, 1), accessor)
                 .get());
    // re-spilling over its own previous values is fine
    assertEquals(5d, spills.applyResult(key("A1"), grid(2, 1, 5), accessor)
                 .get());
    assertEquals(6d, spills.getSpillValue(key("A2")).get());

    sheet.put(key("A3"), ValueSupport.toValue("x"));
    assertEquals(FormulaError.SPILL,
                 spills.applyResult(key("A1"), grid(3, 1, 1), accessor)
                 .getError());

    spills.applyResult(key("A1"), grid(2, 1, 1), accessor);
    spills.clear();
    assertFalse(spills.isSpillTarget(key("A2")));
    assertTrue(_cache.isEmpty());
  }

  /**
   * @return a rows x cols array holding consecutive numbers starting at the
   *         given value
   */
  private static Value grid(int rows, int cols, int start) {
    Value[][] vals = new Value[rows][cols];
    int num = start;
    for(Value[] row : vals) {
      for(int c = 0; c < cols; ++c) {
        row[c] = ValueSupport.toValue(num++);
      }
    }
    return ValueSupport.toArray(vals);
  }

}
