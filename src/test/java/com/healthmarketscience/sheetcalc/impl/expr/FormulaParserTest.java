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

import java.util.ArrayList;
import java.util.List;

import com.healthmarketscience.sheetcalc.SheetFixture;
import com.healthmarketscience.sheetcalc.expr.Expression;
import com.healthmarketscience.sheetcalc.expr.ParseException;
import com.healthmarketscience.sheetcalc.expr.Reference;
import org.junit.jupiter.api.Test;

import static com.healthmarketscience.sheetcalc.SheetFixture.row;
import static com.healthmarketscience.sheetcalc.SheetFixture.rows;
import static org.junit.jupiter.api.Assertions.*;

/**
 *
 * @author James Ahlborn
 */
public class FormulaParserTest
{

  @Test
  public void testParseSimpleExpressions() throws Exception
  {
    validateExpr("=1+2*3",
                 "<EBinaryOp>{<ELiteralValue>{1} + <EBinaryOp>{<ELiteralValue>{2} * <ELiteralValue>{3}}}",
                 "1 + 2 * 3");
    validateExpr("=(1+2)*3",
                 "<EBinaryOp>{<EParen>{(<EBinaryOp>{<ELiteralValue>{1} + <ELiteralValue>{2}})} * <ELiteralValue>{3}}",
                 "(1 + 2) * 3");
    validateExpr("=10-2-3",
                 "<EBinaryOp>{<EBinaryOp>{<ELiteralValue>{10} - <ELiteralValue>{2}} - <ELiteralValue>{3}}",
                 "10 - 2 - 3");
    validateExpr("=\"a\"&B2",
                 "<EBinaryOp>{<ELiteralValue>{\"a\"} & <ECellRef>{B2}}",
                 "\"a\" & B2");
    validateExpr("=A1>=2.5",
                 "<ECompOp>{<ECellRef>{A1} >= <ELiteralValue>{2.5}}",
                 "A1 >= 2.5");
    validateExpr("=\"say \"\"hi\"\"\"",
                 "<ELiteralValue>{\"say \"\"hi\"\"\"}",
                 "\"say \"\"hi\"\"\"");
    validateExpr("=#N/A",
                 "<ELiteralValue>{#N/A}",
                 "#N/A");
    validateExpr("=true",
                 "<ELiteralValue>{TRUE}",
                 "TRUE");
  }

  @Test
  public void testParsePrecedence() throws Exception
  {
    // unary minus binds looser than the exponent
    validateExpr("=-2^2",
                 "<EUnaryOp>{- <EBinaryOp>{<ELiteralValue>{2} ^ <ELiteralValue>{2}}}",
                 "-2 ^ 2");
    // exponent is right associative
    validateExpr("=2^3^2",
                 "<EBinaryOp>{<ELiteralValue>{2} ^ <EBinaryOp>{<ELiteralValue>{3} ^ <ELiteralValue>{2}}}",
                 "2 ^ 3 ^ 2");
    validateExpr("=2^-1",
                 "<EBinaryOp>{<ELiteralValue>{2} ^ <EUnaryOp>{- <ELiteralValue>{1}}}",
                 "2 ^ -1");
    validateExpr("=-A1*2",
                 "<EBinaryOp>{<EUnaryOp>{- <ECellRef>{A1}} * <ELiteralValue>{2}}",
                 "-A1 * 2");
    validateExpr("=50%",
                 "<EPercentOp>{<ELiteralValue>{50} % <ELiteralValue>{100}}",
                 "50%");
    validateExpr("=2*50%",
                 "<EBinaryOp>{<ELiteralValue>{2} * <EPercentOp>{<ELiteralValue>{50} % <ELiteralValue>{100}}}",
                 "2 * 50%");
    validateExpr("=1&2=\"12\"",
                 "<ECompOp>{<EBinaryOp>{<ELiteralValue>{1} & <ELiteralValue>{2}} = <ELiteralValue>{\"12\"}}",
                 "1 & 2 = \"12\"");
  }

  @Test
  public void testParseFunctionsAndReferences() throws Exception
  {
    validateExpr("=sum(A1:A3)",
                 "<EFunc>{SUM(<ERangeRef>{A1:A3})}",
                 "SUM(A1:A3)");
    validateExpr("=TODAY()",
                 "<EFunc>{TODAY()}",
                 "TODAY()");
    validateExpr("=Sheet2!$B$3+'My Sheet'!C1:D2",
                 "<EBinaryOp>{<ECellRef>{Sheet2!$B$3} + <ERangeRef>{'My Sheet'!C1:D2}}",
                 "Sheet2!$B$3 + 'My Sheet'!C1:D2");
    validateExpr("=IF(A1,1,)",
                 "<EIf>{IF(<ECellRef>{A1},<ELiteralValue>{1},<ELiteralValue>{})}",
                 "IF(A1,1,)");
    validateExpr("=LET(x,1,x)",
                 "<ELet>{LET(<EIdentifier>{x},<ELiteralValue>{1},<EIdentifier>{x})}",
                 "LET(x,1,x)");
    validateExpr("=LAMBDA(x,x*2)(3)",
                 "<ECall>{<ELambda>{LAMBDA(<EIdentifier>{x},<EBinaryOp>{<EIdentifier>{x} * <ELiteralValue>{2}})}(<ELiteralValue>{3})}",
                 "LAMBDA(x,x * 2)(3)");
    validateExpr("=IFERROR(1/0,\"x\")",
                 "<EIfError>{IFERROR(<EBinaryOp>{<ELiteralValue>{1} / <ELiteralValue>{0}},<ELiteralValue>{\"x\"})}",
                 "IFERROR(1 / 0,\"x\")");
    validateExpr("=ARRAYFORMULA(A1:A3+B1:B3)",
                 "<EArrayFormula>{ARRAYFORMULA(<EBinaryOp>{<ERangeRef>{A1:A3} + <ERangeRef>{B1:B3}})}",
                 "ARRAYFORMULA(A1:A3 + B1:B3)");
    validateExpr("=ROW(B3)",
                 "<ERowColumn>{ROW(<ECellRef>{B3})}",
                 "ROW(B3)");
  }

  @Test
  public void testParseRawString() throws Exception
  {
    String text = "= 1 +  2";
    Expression expr = FormulaParser.parse(text);
    assertEquals(text, expr.toRawString());
    assertEquals("1 + 2", expr.toCleanString());

    // the leading "=" is optional
    assertEquals("1 + 2", FormulaParser.parse("1+2").toCleanString());
  }

  @Test
  public void testParseErrors() throws Exception
  {
    String[] badExprs = {"=", "=1+", "=SUM(1", "=SUM(1,2", "=\"abc",
                         "=1 2", "=A1:", "=A1:3", "=)", "=(1+2",
                         "=@foo", "=#BOGUS", "=Sheet1!", "=A99999999999",
                         "=SUM(A1:A99999999999)", "=Sheet1!B99999999999"};
    for(String badExpr : badExprs) {
      assertThrows(ParseException.class, () -> FormulaParser.parse(badExpr),
                   badExpr);
    }
  }

  @Test
  public void testParseLimits() throws Exception
  {
    assertEquals(1d, eval("=" + nest("(", "1", ")", 99)));
    assertThrows(ParseException.class,
                 () -> FormulaParser.parse("=" + nest("(", "1", ")", 101)));
    assertThrows(ParseException.class,
                 () -> FormulaParser.parse("=" + nest("(", "1", ")", 5000)));
    assertThrows(ParseException.class,
                 () -> FormulaParser.parse("=" + nest("ABS(", "1", ")", 200)));
    assertThrows(ParseException.class,
                 () -> FormulaParser.parse("=" + nest("-", "1", "", 200)));
    assertThrows(ParseException.class,
                 () -> FormulaParser.parse("=" + nest("2^", "1", "", 200)));
    assertEquals(-1d, eval("=" + nest("-", "1", "", 51)));

    StringBuilder sb = new StringBuilder("=1");
    for(int i = 0; i < 5000; ++i) {
      sb.append("+1");
    }
    assertThrows(ParseException.class,
                 () -> FormulaParser.parse(sb.toString()));
    assertEquals("#VALUE!", eval(sb.toString()));
    assertEquals("#VALUE!", eval("=" + nest("(", "1", ")", 5000)));
  }

  @Test
  public void testIsConstant() throws Exception
  {
    assertTrue(FormulaParser.parse("=1+2").isConstant());
    assertTrue(FormulaParser.parse("=ROUND(PI(),2)").isConstant());
    assertFalse(FormulaParser.parse("=A1+1").isConstant());
    assertFalse(FormulaParser.parse("=RAND()").isConstant());
    assertFalse(FormulaParser.parse("=TODAY()+1").isConstant());
  }

  @Test
  public void testCollectReferences() throws Exception
  {
    List<Reference> refs = new ArrayList<Reference>();
    FormulaParser.parse("=A1+SUM(B1:B2,IF(C3,1,D4))").collectReferences(refs);
    assertEquals(4, refs.size());
    assertEquals("A1", refs.get(0).toString());
    assertEquals("B1:B2", refs.get(1).toString());
    assertEquals("C3", refs.get(2).toString());
    assertEquals("D4", refs.get(3).toString());
  }

  @Test
  public void testArithmetic() throws Exception
  {
    assertEquals(7d, eval("=1+2*3"));
    assertEquals(9d, eval("=(1+2)*3"));
    assertEquals(5d, eval("=10-2-3"));
    assertEquals(2d, eval("=8/2/2"));
    assertEquals(-4d, eval("=-2^2"));
    assertEquals(512d, eval("=2^3^2"));
    assertEquals(0.5d, eval("=2^-1"));
    assertEquals(3d, eval("=+3"));
    assertEquals(0.5d, eval("=50%"));
    assertEquals(2d, eval("=50%*4"));
    assertEquals(2d, eval("=TRUE+1"));
    assertEquals(7d, eval("=\"3\"+4"));

    assertEquals("#DIV/0!", eval("=1/0"));
    assertEquals("#VALUE!", eval("=\"abc\"+1"));
    assertEquals("#NUM!", eval("=(-8)^0.5"));
  }

  @Test
  public void testPercentOperatorDivides() throws Exception
  {
    // the percent operator divides its operands, postfix x% is x % 100
    assertEquals(2.5d, BuiltinOperators.percent(
                     ValueSupport.toValue(10), ValueSupport.toValue(4)).get());
    assertEquals("#DIV/0!", BuiltinOperators.percent(
                     ValueSupport.toValue(10), ValueSupport.ZERO_VAL).get());
    assertEquals(0.25d, eval("=25%"));

    // there is no infix form
    assertEquals("#VALUE!", eval("=10%4"));
  }

  @Test
  public void testConcatAndCompare() throws Exception
  {
    assertEquals("ab", eval("=\"a\"&\"b\""));
    assertEquals("12", eval("=1&2"));
    assertEquals("x", eval("=A1&\"x\""));
    assertEquals("2.5TRUE", eval("=2.5&TRUE"));

    assertEquals(Boolean.TRUE, eval("=1<2"));
    assertEquals(Boolean.FALSE, eval("=2<=1"));
    assertEquals(Boolean.TRUE, eval("=\"abc\"=\"ABC\""));
    assertEquals(Boolean.TRUE, eval("=\"b\">\"a\""));
    assertEquals(Boolean.TRUE, eval("=\"10\"=10"));
    assertEquals(Boolean.TRUE, eval("=2<10"));
    // a string on either side makes it a text comparison
    assertEquals(Boolean.FALSE, eval("=\"2\"<\"10\""));
    assertEquals(Boolean.FALSE, eval("=\"10\">9"));
    assertEquals(Boolean.TRUE, eval("=\"b2\">\"B10\""));
    assertEquals(Boolean.TRUE, eval("=A1=0"));
    assertEquals(Boolean.TRUE, eval("=A1=\"\""));
    assertEquals(Boolean.FALSE, eval("=0=\"\""));
    assertEquals(Boolean.TRUE, eval("=1<>2"));
    // booleans are numbers
    assertEquals(Boolean.TRUE, eval("=TRUE=1"));
    assertEquals(Boolean.TRUE, eval("=FALSE<0.5"));
    assertEquals(Boolean.TRUE, eval("=TRUE>FALSE"));
    assertEquals(Boolean.TRUE, eval("=TRUE=\"true\""));
  }

  @Test
  public void testErrors() throws Exception
  {
    assertEquals("#DIV/0!", eval("=1/0+1"));
    assertEquals("#N/A", eval("=#N/A+1"));
    assertEquals("#REF!", eval("=#REF!"));
    assertEquals("#NAME?", eval("=FOO(1)"));
    assertEquals("#NAME?", eval("=foo"));
    assertEquals("#VALUE!", eval("=1+"));
    assertEquals("#VALUE!", eval("=SUM(1,"));
    assertEquals("#VALUE!", eval("=A1:A2"));
    assertEquals("#VALUE!", eval("=ABS()"));
    assertEquals("#VALUE!", eval("=ABS(1,2)"));
    assertEquals("#VALUE!", eval("=ABS(\"x\")"));

    // the first error wins
    assertEquals("#N/A", eval("=#N/A+1/0"));

    // stored error results read back as errors
    SheetFixture cells = new SheetFixture().set("A1", "#DIV/0!");
    assertEquals("#DIV/0!", eval("=A1*2", cells));
    assertEquals(Boolean.TRUE, eval("=ISERROR(A1)", cells));
  }

  @Test
  public void testIf() throws Exception
  {
    assertEquals("b", eval("=IF(1>2,\"a\",\"b\")"));
    assertEquals("a", eval("=IF(1<2,\"a\")"));
    assertEquals(Boolean.FALSE, eval("=IF(1>2,\"a\")"));
    assertEquals(1d, eval("=IF(TRUE,1,1/0)"));
    assertEquals("#DIV/0!", eval("=IF(1/0,1,2)"));
    assertEquals("#VALUE!", eval("=IF(TRUE)"));
    assertEquals(2d, eval("=if(0,1,2)"));

    assertEquals("x", eval("=IFERROR(1/0,\"x\")"));
    assertEquals(5d, eval("=IFERROR(5,\"x\")"));
    assertEquals(1d, eval("=IFNA(#N/A,1)"));
    assertEquals("#DIV/0!", eval("=IFNA(1/0,1)"));
    assertEquals(3d, eval("=IFNA(3,1)"));
  }

  @Test
  public void testLetAndLambda() throws Exception
  {
    assertEquals(15d, eval("=LET(x,5,y,x*2,x+y)"));
    assertEquals(6d, eval("=LET(X,2,x*3)"));
    assertEquals("#VALUE!", eval("=LET(x,1)"));
    assertEquals("#VALUE!", eval("=LET(1,2,3)"));
    // inner bindings shadow outer ones
    assertEquals(3d, eval("=LET(x,1,LET(x,2,x+1))"));

    assertEquals(5d, eval("=LAMBDA(x,y,x+y)(2,3)"));
    assertEquals(16d, eval("=LET(f,LAMBDA(x,x*x),f(4))"));
    assertEquals(11d, eval("=LET(a,10,f,LAMBDA(x,x+a),LET(a,1,f(1)))"));
    assertEquals("#VALUE!", eval("=LAMBDA(x,x)(1,2)"));
    assertEquals("#VALUE!", eval("=LET(f,1,f(2))"));
    // a closure cannot be a result
    assertEquals("#VALUE!", eval("=LAMBDA(x,x)"));

    SheetFixture cells = new SheetFixture().set("A1", 7);
    assertEquals(14d, eval("=LET(double,LAMBDA(v,v*2),double(A1))", cells));
  }

  @Test
  public void testArrayFormula() throws Exception
  {
    SheetFixture cells = new SheetFixture()
      .setColumn("A1", 1, 2, 3)
      .setColumn("B1", 10, 20, 30);

    assertEquals(rows(row(11d), row(22d), row(33d)),
                 eval("=ARRAYFORMULA(A1:A3+B1:B3)", cells));
    // each element matches the per cell formula
    for(int i = 1; i <= 3; ++i) {
      assertEquals(eval("=A" + i + "+B" + i, cells),
                   ((List<?>)((List<?>)eval("=ARRAYFORMULA(A1:A3+B1:B3)",
                                            cells)).get(i - 1)).get(0));
    }

    assertEquals(rows(row(2d), row(4d), row(6d)),
                 eval("=ARRAYFORMULA(A1:A3*2)", cells));
    assertEquals(rows(row("1x"), row("2x"), row("3x")),
                 eval("=ARRAYFORMULA(A1:A3&\"x\")", cells));
    assertEquals(rows(row(Boolean.FALSE), row(Boolean.TRUE), row(Boolean.TRUE)),
                 eval("=ARRAYFORMULA(A1:A3>1)", cells));
    assertEquals(2d, eval("=ARRAYFORMULA(1+1)", cells));
    // array producing functions pass through
    assertEquals(rows(row(1d, 2d, 3d)),
                 eval("=ARRAYFORMULA(TRANSPOSE(A1:A3))", cells));
  }

  @Test
  public void testRowColumn() throws Exception
  {
    assertEquals(3d, eval("=ROW(B3)"));
    assertEquals(3d, eval("=COLUMN(C1)"));
    assertEquals(2d, eval("=COLUMN(B2:D4)"));
    assertEquals(1d, eval("=ROW()"));
    assertEquals("#VALUE!", eval("=ROW(1)"));
  }

  static Object eval(String formula) {
    return eval(formula, new SheetFixture());
  }

  static Object eval(String formula, SheetFixture cells) {
    return SheetFixture.toJava(
        SheetFixture.newEngine().evaluateFormula(formula, cells));
  }

  private static String nest(String prefix, String inner, String suffix,
                             int depth) {
    StringBuilder sb = new StringBuilder();
    for(int i = 0; i < depth; ++i) {
      sb.append(prefix);
    }
    sb.append(inner);
    for(int i = 0; i < depth; ++i) {
      sb.append(suffix);
    }
    return sb.toString();
  }

  private static void validateExpr(String exprStr, String debugStr,
                                   String cleanStr) {
    Expression expr = FormulaParser.parse(exprStr);
    assertEquals(debugStr, expr.toDebugString());
    assertEquals(cleanStr, expr.toCleanString());
  }
}
