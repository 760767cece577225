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
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.healthmarketscience.sheetcalc.CellKey;
import com.healthmarketscience.sheetcalc.CellValueAccessor;
import com.healthmarketscience.sheetcalc.expr.CellReference;
import com.healthmarketscience.sheetcalc.expr.EvalException;
import com.healthmarketscience.sheetcalc.expr.Expression;
import com.healthmarketscience.sheetcalc.expr.FormulaError;
import com.healthmarketscience.sheetcalc.expr.FormulaErrorException;
import com.healthmarketscience.sheetcalc.expr.Function;
import com.healthmarketscience.sheetcalc.expr.ParseException;
import com.healthmarketscience.sheetcalc.expr.RangeReference;
import com.healthmarketscience.sheetcalc.expr.Reference;
import com.healthmarketscience.sheetcalc.expr.Value;
import com.healthmarketscience.sheetcalc.impl.expr.FormulaTokenizer.Token;
import com.healthmarketscience.sheetcalc.impl.expr.FormulaTokenizer.TokenType;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import static com.healthmarketscience.sheetcalc.impl.expr.ValueSupport.*;

/**
 * Parses formula text into an evaluable tree of expressions.
 * <p>
 * Operator precedence, lowest to highest: comparisons, concatenation (&amp;),
 * additive, multiplicative, unary sign, exponent (^, right associative),
 * postfix percent.  The special forms IF, IFERROR, IFNA, ARRAYFORMULA, LET,
 * LAMBDA, ROW and COLUMN get dedicated expression types, all other calls are
 * resolved through the configured {@link
 * com.healthmarketscience.sheetcalc.expr.FunctionLookup} at evaluation time.
 *
 * @author James Ahlborn
 */
public class FormulaParser
{
  private static final Log LOG = LogFactory.getLog(FormulaParser.class);

  private static final String FORMULA_PREFIX = "=";
  private static final String OPEN_PAREN = "(";
  private static final String CLOSE_PAREN = ")";
  private static final String FUNC_PARAM_SEP = ",";
  private static final String RANGE_SEP = ":";
  private static final int MAX_FORMULA_LENGTH = 8192;
  private static final int MAX_NESTING_DEPTH = 100;

  private static final Value HUNDRED_VAL = toValue(100);

  private interface OpType {}

  private enum UnaryOp implements OpType {
    NEG("-") {
      @Override public Value eval(Value param1) {
        return BuiltinOperators.negate(param1);
      }
    },
    POS("+") {
      @Override public Value eval(Value param1) {
        // still coerces to a number
        return toValue(BuiltinOperators.toOperand(param1));
      }
    };

    private final String _str;

    private UnaryOp(String str) {
      _str = str;
    }

    @Override
    public String toString() {
      return _str;
    }

    public abstract Value eval(Value param1);
  }

  private enum BinaryOp implements OpType {
    PLUS("+") {
      @Override public Value eval(Value param1, Value param2) {
        return BuiltinOperators.add(param1, param2);
      }
    },
    MINUS("-") {
      @Override public Value eval(Value param1, Value param2) {
        return BuiltinOperators.subtract(param1, param2);
      }
    },
    MULT("*") {
      @Override public Value eval(Value param1, Value param2) {
        return BuiltinOperators.multiply(param1, param2);
      }
    },
    DIV("/") {
      @Override public Value eval(Value param1, Value param2) {
        return BuiltinOperators.divide(param1, param2);
      }
    },
    EXP("^") {
      @Override public Value eval(Value param1, Value param2) {
        return BuiltinOperators.power(param1, param2);
      }
    },
    CONCAT("&") {
      @Override public Value eval(Value param1, Value param2) {
        return BuiltinOperators.concat(param1, param2);
      }
    },
    PERCENT("%") {
      @Override public Value eval(Value param1, Value param2) {
        return BuiltinOperators.percent(param1, param2);
      }
    };

    private final String _str;

    private BinaryOp(String str) {
      _str = str;
    }

    @Override
    public String toString() {
      return _str;
    }

    public abstract Value eval(Value param1, Value param2);
  }

  private enum CompOp implements OpType {
    LT("<") {
      @Override public Value eval(Value param1, Value param2) {
        return BuiltinOperators.lessThan(param1, param2);
      }
    },
    LTE("<=") {
      @Override public Value eval(Value param1, Value param2) {
        return BuiltinOperators.lessThanEq(param1, param2);
      }
    },
    GT(">") {
      @Override public Value eval(Value param1, Value param2) {
        return BuiltinOperators.greaterThan(param1, param2);
      }
    },
    GTE(">=") {
      @Override public Value eval(Value param1, Value param2) {
        return BuiltinOperators.greaterThanEq(param1, param2);
      }
    },
    EQ("=") {
      @Override public Value eval(Value param1, Value param2) {
        return BuiltinOperators.equals(param1, param2);
      }
    },
    NE("<>") {
      @Override public Value eval(Value param1, Value param2) {
        return BuiltinOperators.notEquals(param1, param2);
      }
    };

    private final String _str;

    private CompOp(String str) {
      _str = str;
    }

    @Override
    public String toString() {
      return _str;
    }

    public abstract Value eval(Value param1, Value param2);
  }

  private static final Map<String,UnaryOp> UNARY_OPS = opMap(UnaryOp.values());
  private static final Map<String,BinaryOp> CONCAT_OPS =
    opMap(BinaryOp.CONCAT);
  private static final Map<String,BinaryOp> ADD_OPS =
    opMap(BinaryOp.PLUS, BinaryOp.MINUS);
  private static final Map<String,BinaryOp> MULT_OPS =
    opMap(BinaryOp.MULT, BinaryOp.DIV);
  private static final Map<String,BinaryOp> EXP_OPS = opMap(BinaryOp.EXP);
  private static final Map<String,BinaryOp> PERCENT_OPS =
    opMap(BinaryOp.PERCENT);
  private static final Map<String,CompOp> COMP_OPS = opMap(CompOp.values());

  private FormulaParser() {}

  @SafeVarargs
  private static <T extends OpType> Map<String,T> opMap(T... ops) {
    Map<String,T> map = new HashMap<String,T>();
    for(T op : ops) {
      map.put(op.toString(), op);
    }
    return map;
  }

  /**
   * Parses the given formula text.  A single leading "=" is optional.
   *
   * @throws ParseException if the text is not a valid formula
   */
  public static ParsedFormula parse(String exprStr) {
    String str = StringUtils.trimToEmpty(exprStr);
    if(str.startsWith(FORMULA_PREFIX)) {
      str = str.substring(FORMULA_PREFIX.length());
    }
    if(str.length() > MAX_FORMULA_LENGTH) {
      throw new ParseException("Formula longer than " + MAX_FORMULA_LENGTH +
                               " characters");
    }

    List<Token> tokens = FormulaTokenizer.tokenize(str);
    if(tokens == null) {
      throw new ParseException("Empty formula '" + exprStr + "'");
    }

    TokBuf buf = new TokBuf(tokens);
    Expr expr = parseComparison(buf);
    if(buf.hasNext()) {
      throw new ParseException("Unexpected trailing tokens " + buf);
    }

    return new ParsedFormula(exprStr, expr);
  }

  private static Expr parseComparison(TokBuf buf) {
    buf.enterNested();
    Expr left = parseConcat(buf);
    CompOp op = null;
    while((op = maybeParseOp(buf, COMP_OPS)) != null) {
      left = new ECompOp(op, left, parseConcat(buf));
    }
    buf.exitNested();
    return left;
  }

  private static Expr parseConcat(TokBuf buf) {
    Expr left = parseAdditive(buf);
    BinaryOp op = null;
    while((op = maybeParseOp(buf, CONCAT_OPS)) != null) {
      left = new EBinaryOp(op, left, parseAdditive(buf));
    }
    return left;
  }

  private static Expr parseAdditive(TokBuf buf) {
    Expr left = parseMultiplicative(buf);
    BinaryOp op = null;
    while((op = maybeParseOp(buf, ADD_OPS)) != null) {
      left = new EBinaryOp(op, left, parseMultiplicative(buf));
    }
    return left;
  }

  private static Expr parseMultiplicative(TokBuf buf) {
    Expr left = parseUnary(buf);
    BinaryOp op = null;
    while((op = maybeParseOp(buf, MULT_OPS)) != null) {
      left = new EBinaryOp(op, left, parseUnary(buf));
    }
    return left;
  }

  private static Expr parseUnary(TokBuf buf) {
    UnaryOp op = maybeParseOp(buf, UNARY_OPS);
    if(op != null) {
      buf.enterNested();
      Expr operand = parseUnary(buf);
      buf.exitNested();
      return new EUnaryOp(op, operand);
    }
    return parsePower(buf);
  }

  private static Expr parsePower(TokBuf buf) {
    Expr base = parsePostfix(buf);
    if(maybeParseOp(buf, EXP_OPS) != null) {
      // right associative, and the exponent may carry its own sign
      return new EBinaryOp(BinaryOp.EXP, base, parsePowerOperand(buf));
    }
    return base;
  }

  private static Expr parsePowerOperand(TokBuf buf) {
    UnaryOp op = maybeParseOp(buf, UNARY_OPS);
    buf.enterNested();
    Expr operand = null;
    if(op != null) {
      operand = new EUnaryOp(op, parsePowerOperand(buf));
    } else {
      operand = parsePower(buf);
    }
    buf.exitNested();
    return operand;
  }

  private static Expr parsePostfix(TokBuf buf) {
    Expr expr = parsePrimary(buf);
    while(maybeParseOp(buf, PERCENT_OPS) != null) {
      expr = new EPercentOp(expr);
    }
    return expr;
  }

  private static Expr parsePrimary(TokBuf buf) {
    Token t = buf.next();
    Expr expr = null;

    switch(t.getType()) {
    case LITERAL:
      expr = new ELiteralValue((Value)t.getValue());
      break;
    case REF:
      expr = parseRef(t, buf);
      break;
    case NAME:
      if(buf.isNextDelim(OPEN_PAREN)) {
        buf.next();
        expr = newFuncExpr(t.getValueStr(), parseArgs(buf));
      } else {
        expr = new EIdentifier(t.getValueStr());
      }
      break;
    case DELIM:
      if(t.getValueStr().equals(OPEN_PAREN)) {
        Expr inner = parseComparison(buf);
        buf.expectDelim(CLOSE_PAREN);
        expr = new EParen(inner);
        break;
      }
      throw new ParseException("Unexpected delimiter " + t + " " + buf);
    default:
      throw new ParseException("Unexpected token " + t + " " + buf);
    }

    // anything may be invoked (only lambdas actually succeed)
    while(buf.isNextDelim(OPEN_PAREN)) {
      buf.next();
      expr = new ECall(expr, parseArgs(buf));
    }

    return expr;
  }

  private static Expr parseRef(Token t, TokBuf buf) {
    CellReference start = (CellReference)t.getValue();
    if(!buf.isNextDelim(RANGE_SEP)) {
      return new ECellRef(start);
    }
    buf.next();

    Token endTok = buf.next();
    if(endTok.getType() != TokenType.REF) {
      throw new ParseException("Invalid range end " + endTok + " " + buf);
    }
    CellReference end = (CellReference)endTok.getValue();
    if((end.getSheet() == null) && (start.getSheet() != null)) {
      // end corner lives in the same sheet as the start corner
      end = end.withSheet(start.getSheet());
    }
    return new ERangeRef(new RangeReference(start, end));
  }

  private static List<Expr> parseArgs(TokBuf buf) {
    List<Expr> args = new ArrayList<Expr>();
    if(buf.isNextDelim(CLOSE_PAREN)) {
      buf.next();
      return args;
    }

    while(true) {
      if(buf.isNextDelim(FUNC_PARAM_SEP) || buf.isNextDelim(CLOSE_PAREN)) {
        // omitted argument
        args.add(new ELiteralValue(NULL_VAL));
      } else {
        args.add(parseComparison(buf));
      }

      Token t = buf.next();
      if(t.is(TokenType.DELIM, CLOSE_PAREN)) {
        break;
      }
      if(!t.is(TokenType.DELIM, FUNC_PARAM_SEP)) {
        throw new ParseException("Expected ',' or ')' but found " + t + " " +
                                 buf);
      }
    }

    return args;
  }

  private static Expr newFuncExpr(String name, List<Expr> params) {
    switch(Scope.toLookupName(name)) {
    case "IF":
      return new EIf(params);
    case "IFERROR":
      return new EIfError(params, false);
    case "IFNA":
      return new EIfError(params, true);
    case "ARRAYFORMULA":
      return new EArrayFormula(params);
    case "LET":
      return new ELet(params);
    case "LAMBDA":
      return new ELambda(params);
    case "ROW":
      return new ERowColumn(params, true);
    case "COLUMN":
      return new ERowColumn(params, false);
    default:
      return new EFunc(name, params);
    }
  }

  private static <T extends OpType> T maybeParseOp(
      TokBuf buf, Map<String,T> ops) {
    Token t = buf.peekNext();
    if((t == null) || (t.getType() != TokenType.OP)) {
      return null;
    }
    T op = ops.get(t.getValueStr());
    if(op != null) {
      buf.next();
    }
    return op;
  }

  private static boolean areConstant(List<Expr> exprs) {
    for(Expr expr : exprs) {
      if(!expr.isConstant()) {
        return false;
      }
    }
    return true;
  }

  private static void collectReferences(List<Expr> exprs,
                                        Collection<Reference> refs) {
    for(Expr expr : exprs) {
      expr.collectReferences(refs);
    }
  }

  private static void exprListToString(
      List<Expr> exprs, StringBuilder sb, boolean isDebug) {
    Iterator<Expr> iter = exprs.iterator();
    iter.next().toString(sb, isDebug);
    while(iter.hasNext()) {
      sb.append(FUNC_PARAM_SEP);
      iter.next().toString(sb, isDebug);
    }
  }

  private static void funcToString(String name, List<Expr> params,
                                   StringBuilder sb, boolean isDebug) {
    sb.append(name).append(OPEN_PAREN);
    if(!params.isEmpty()) {
      exprListToString(params, sb, isDebug);
    }
    sb.append(CLOSE_PAREN);
  }

  private static Value[] evalArgs(List<Expr> params, EvalContextImpl ctx,
                                  Scope scope) {
    Value[] vals = new Value[params.size()];
    for(int i = 0; i < vals.length; ++i) {
      vals[i] = params.get(i).evalArg(ctx, scope);
    }
    return vals;
  }

  /**
   * Invokes the given function, converting any failure into an error value.
   */
  static Value callFunction(EvalContextImpl ctx, Function func,
                            Value[] params) {
    try {
      Value result = func.eval(ctx, params);
      return ((result != null) ? result : NULL_VAL);
    } catch(FormulaErrorException fe) {
      return toError(fe.getError());
    } catch(Exception e) {
      if(LOG.isDebugEnabled()) {
        LOG.debug("Function " + func.getName() + " failed, result is " +
                  FormulaError.VALUE, e);
      }
      return VALUE_ERR_VAL;
    }
  }

  private static Value invokeClosure(EvalContextImpl ctx, LambdaValue lambda,
                                     Value[] args) {
    EvalContextImpl.Closure closure = ctx.getClosure(lambda);
    if((closure == null) || (closure.getParamNames().size() != args.length)) {
      return VALUE_ERR_VAL;
    }
    // the body sees the scope (and accessor) the lambda was defined in
    Scope scope = closure.getScope();
    List<String> names = closure.getParamNames();
    for(int i = 0; i < args.length; ++i) {
      scope = scope.bind(names.get(i), args[i]);
    }
    return closure.getBody().eval(ctx, scope);
  }

  private static Value applyOp(OpType op, Value param1, Value param2) {
    try {
      if(op instanceof BinaryOp) {
        return ((BinaryOp)op).eval(param1, param2);
      }
      if(op instanceof CompOp) {
        return ((CompOp)op).eval(param1, param2);
      }
      return ((UnaryOp)op).eval(param1);
    } catch(FormulaErrorException fe) {
      return toError(fe.getError());
    } catch(EvalException e) {
      return VALUE_ERR_VAL;
    }
  }

  private static Expr unwrapParens(Expr expr) {
    while(expr instanceof EParen) {
      expr = ((EParen)expr)._expr;
    }
    return expr;
  }

  private static final class TokBuf
  {
    private final List<Token> _tokens;
    private int _pos;
    private int _depth;

    private TokBuf(List<Token> tokens) {
      _tokens = tokens;
    }

    public boolean hasNext() {
      return (_pos < _tokens.size());
    }

    public Token peekNext() {
      if(!hasNext()) {
        return null;
      }
      return _tokens.get(_pos);
    }

    public Token next() {
      if(!hasNext()) {
        throw new ParseException(
            "Unexpected end of formula " + this);
      }
      return _tokens.get(_pos++);
    }

    public void enterNested() {
      if(++_depth > MAX_NESTING_DEPTH) {
        throw new ParseException("Formula nested deeper than " +
                                 MAX_NESTING_DEPTH + " levels [token " +
                                 _pos + "]");
      }
    }

    public void exitNested() {
      --_depth;
    }

    public boolean isNextDelim(String delim) {
      Token t = peekNext();
      return ((t != null) && t.is(TokenType.DELIM, delim));
    }

    public void expectDelim(String delim) {
      Token t = next();
      if(!t.is(TokenType.DELIM, delim)) {
        throw new ParseException("Expected '" + delim + "' but found " + t +
                                 " " + this);
      }
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder()
        .append("[token ").append(_pos).append("] (");

      for(Iterator<Token> iter = _tokens.iterator(); iter.hasNext(); ) {
        Token t = iter.next();
        sb.append("'").append(t.getValueStr()).append("'");
        if(iter.hasNext()) {
          sb.append(",");
        }
      }

      return sb.append(")").toString();
    }
  }

  abstract static class Expr
  {
    public String toCleanString() {
      return toString(new StringBuilder(), false).toString();
    }

    public String toDebugString() {
      return toString(new StringBuilder(), true).toString();
    }

    protected StringBuilder toString(StringBuilder sb, boolean isDebug) {
      if(isDebug) {
        sb.append("<").append(getClass().getSimpleName()).append(">{");
      }
      toExprString(sb, isDebug);
      if(isDebug) {
        sb.append("}");
      }
      return sb;
    }

    public abstract boolean isConstant();

    public abstract Value eval(EvalContextImpl ctx, Scope scope);

    /**
     * Evaluates this expression as a function argument, where range
     * references expand to arrays.
     */
    public Value evalArg(EvalContextImpl ctx, Scope scope) {
      return eval(ctx, scope);
    }

    public abstract void collectReferences(Collection<Reference> refs);

    protected abstract void toExprString(StringBuilder sb, boolean isDebug);
  }

  private static final class ELiteralValue extends Expr
  {
    private final Value _val;

    private ELiteralValue(Value val) {
      _val = val;
    }

    @Override
    public boolean isConstant() {
      return true;
    }

    @Override
    public Value eval(EvalContextImpl ctx, Scope scope) {
      return _val;
    }

    @Override
    public void collectReferences(Collection<Reference> refs) {
      // none
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      switch(_val.getType()) {
      case NULL:
        break;
      case STRING:
        literalStrToString(_val.getAsString(), sb);
        break;
      case ERROR:
        sb.append(_val.getError());
        break;
      default:
        sb.append(_val.getAsString());
      }
    }
  }

  private static final class ECellRef extends Expr
  {
    private final CellReference _ref;

    private ECellRef(CellReference ref) {
      _ref = ref;
    }

    @Override
    public boolean isConstant() {
      return false;
    }

    @Override
    public Value eval(EvalContextImpl ctx, Scope scope) {
      return scope.getCellValue(_ref);
    }

    @Override
    public void collectReferences(Collection<Reference> refs) {
      refs.add(_ref);
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      sb.append(_ref);
    }
  }

  private static final class ERangeRef extends Expr
  {
    private final RangeReference _range;

    private ERangeRef(RangeReference range) {
      _range = range;
    }

    @Override
    public boolean isConstant() {
      return false;
    }

    @Override
    public Value eval(EvalContextImpl ctx, Scope scope) {
      if(scope.hasArrayOffset()) {
        return evalOffsetCell(scope);
      }
      // a range is only meaningful as a function argument
      return VALUE_ERR_VAL;
    }

    @Override
    public Value evalArg(EvalContextImpl ctx, Scope scope) {
      if(scope.hasArrayOffset()) {
        return evalOffsetCell(scope);
      }

      int minRow = _range.getMinRow();
      int minCol = _range.getMinCol();
      Value[][] vals = new Value[_range.getRowCount()][_range.getColCount()];
      for(int r = 0; r < vals.length; ++r) {
        for(int c = 0; c < vals[r].length; ++c) {
          vals[r][c] = scope.getCellValue(
              _range.getStart().moveTo(minCol + c, minRow + r));
        }
      }
      return toArray(vals);
    }

    private Value evalOffsetCell(Scope scope) {
      return scope.getCellValue(_range.getClampedCell(
                                    scope.getRowOffset(),
                                    scope.getColOffset()));
    }

    @Override
    public void collectReferences(Collection<Reference> refs) {
      refs.add(_range);
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      sb.append(_range);
    }
  }

  private static final class EIdentifier extends Expr
  {
    private final String _name;

    private EIdentifier(String name) {
      _name = name;
    }

    public String getName() {
      return _name;
    }

    @Override
    public boolean isConstant() {
      return false;
    }

    @Override
    public Value eval(EvalContextImpl ctx, Scope scope) {
      Value val = scope.lookup(_name);
      if(val != null) {
        return val;
      }
      Function func = ctx.getFunction(_name);
      if(func != null) {
        return callFunction(ctx, func, new Value[0]);
      }
      return toError(FormulaError.NAME);
    }

    @Override
    public void collectReferences(Collection<Reference> refs) {
      // none
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      sb.append(_name);
    }
  }

  private static class EParen extends Expr
  {
    private final Expr _expr;

    private EParen(Expr expr) {
      _expr = expr;
    }

    @Override
    public boolean isConstant() {
      return _expr.isConstant();
    }

    @Override
    public Value eval(EvalContextImpl ctx, Scope scope) {
      return _expr.eval(ctx, scope);
    }

    @Override
    public Value evalArg(EvalContextImpl ctx, Scope scope) {
      return _expr.evalArg(ctx, scope);
    }

    @Override
    public void collectReferences(Collection<Reference> refs) {
      _expr.collectReferences(refs);
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      sb.append(OPEN_PAREN);
      _expr.toString(sb, isDebug);
      sb.append(CLOSE_PAREN);
    }
  }

  private static class EUnaryOp extends Expr
  {
    private final UnaryOp _op;
    private final Expr _expr;

    private EUnaryOp(UnaryOp op, Expr expr) {
      _op = op;
      _expr = expr;
    }

    @Override
    public boolean isConstant() {
      return _expr.isConstant();
    }

    @Override
    public Value eval(EvalContextImpl ctx, Scope scope) {
      Value val = _expr.eval(ctx, scope);
      if(val.isError()) {
        return val;
      }
      return applyOp(_op, val, null);
    }

    @Override
    public void collectReferences(Collection<Reference> refs) {
      _expr.collectReferences(refs);
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      sb.append(_op);
      if(isDebug) {
        sb.append(" ");
      }
      _expr.toString(sb, isDebug);
    }
  }

  private static abstract class EBaseBinaryOp extends Expr
  {
    protected final OpType _op;
    protected final Expr _left;
    protected final Expr _right;

    private EBaseBinaryOp(OpType op, Expr left, Expr right) {
      _op = op;
      _left = left;
      _right = right;
    }

    @Override
    public boolean isConstant() {
      return _left.isConstant() && _right.isConstant();
    }

    @Override
    public Value eval(EvalContextImpl ctx, Scope scope) {
      // the first error wins, the right side is not evaluated after an error
      Value left = _left.eval(ctx, scope);
      if(left.isError()) {
        return left;
      }
      Value right = _right.eval(ctx, scope);
      if(right.isError()) {
        return right;
      }
      return applyOp(_op, left, right);
    }

    @Override
    public void collectReferences(Collection<Reference> refs) {
      _left.collectReferences(refs);
      _right.collectReferences(refs);
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      _left.toString(sb, isDebug);
      sb.append(" ").append(_op).append(" ");
      _right.toString(sb, isDebug);
    }
  }

  private static class EBinaryOp extends EBaseBinaryOp
  {
    private EBinaryOp(BinaryOp op, Expr left, Expr right) {
      super(op, left, right);
    }
  }

  private static class EPercentOp extends EBaseBinaryOp
  {
    private EPercentOp(Expr expr) {
      super(BinaryOp.PERCENT, expr, new ELiteralValue(HUNDRED_VAL));
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      if(isDebug) {
        super.toExprString(sb, isDebug);
        return;
      }
      _left.toString(sb, isDebug);
      sb.append(_op);
    }
  }

  private static class ECompOp extends EBaseBinaryOp
  {
    private ECompOp(CompOp op, Expr left, Expr right) {
      super(op, left, right);
    }
  }

  private static class EFunc extends Expr
  {
    private final String _name;
    private final List<Expr> _params;

    private EFunc(String name, List<Expr> params) {
      _name = name;
      _params = params;
    }

    @Override
    public boolean isConstant() {
      Function func = DefaultFunctions.LOOKUP.getFunction(_name);
      return (func != null) && !func.isVolatile() && areConstant(_params);
    }

    @Override
    public Value eval(EvalContextImpl ctx, Scope scope) {
      Value bound = scope.lookup(_name);
      if(bound != null) {
        // calling a name bound by LET (or a lambda parameter)
        if(bound.getType() != Value.Type.LAMBDA) {
          return VALUE_ERR_VAL;
        }
        return invokeClosure(ctx, (LambdaValue)bound,
                             evalArgs(_params, ctx, scope));
      }

      Function func = ctx.getFunction(_name);
      if(func == null) {
        return toError(FormulaError.NAME);
      }
      return callFunction(ctx, func, evalArgs(_params, ctx, scope));
    }

    @Override
    public void collectReferences(Collection<Reference> refs) {
      FormulaParser.collectReferences(_params, refs);
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      funcToString(Scope.toLookupName(_name), _params, sb, isDebug);
    }
  }

  /**
   * Base class for the functions which control how (or whether) their
   * arguments are evaluated.
   */
  private static abstract class ESpecialForm extends Expr
  {
    private final String _name;
    protected final List<Expr> _params;

    private ESpecialForm(String name, List<Expr> params) {
      _name = name;
      _params = params;
    }

    @Override
    public boolean isConstant() {
      return areConstant(_params);
    }

    @Override
    public void collectReferences(Collection<Reference> refs) {
      FormulaParser.collectReferences(_params, refs);
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      funcToString(_name, _params, sb, isDebug);
    }
  }

  private static class EIf extends ESpecialForm
  {
    private EIf(List<Expr> params) {
      super("IF", params);
    }

    @Override
    public Value eval(EvalContextImpl ctx, Scope scope) {
      int num = _params.size();
      if((num < 2) || (num > 3)) {
        return VALUE_ERR_VAL;
      }

      Value cond = _params.get(0).eval(ctx, scope);
      if(cond.isError()) {
        return cond;
      }
      if(!cond.getType().isScalar()) {
        return VALUE_ERR_VAL;
      }

      // only the taken branch is evaluated
      if(cond.getAsBoolean()) {
        return _params.get(1).eval(ctx, scope);
      }
      return ((num == 3) ? _params.get(2).eval(ctx, scope) : FALSE_VAL);
    }
  }

  private static class EIfError extends ESpecialForm
  {
    private final boolean _naOnly;

    private EIfError(List<Expr> params, boolean naOnly) {
      super((naOnly ? "IFNA" : "IFERROR"), params);
      _naOnly = naOnly;
    }

    @Override
    public Value eval(EvalContextImpl ctx, Scope scope) {
      if(_params.size() != 2) {
        return VALUE_ERR_VAL;
      }

      Value val = _params.get(0).eval(ctx, scope);
      if(val.isError() &&
         (!_naOnly || (val.getError() == FormulaError.NA))) {
        return _params.get(1).eval(ctx, scope);
      }
      return val;
    }
  }

  private static class EArrayFormula extends ESpecialForm
  {
    private EArrayFormula(List<Expr> params) {
      super("ARRAYFORMULA", params);
    }

    @Override
    public Value eval(EvalContextImpl ctx, Scope scope) {
      if(_params.size() != 1) {
        return VALUE_ERR_VAL;
      }

      Expr expr = _params.get(0);
      Value result = expr.eval(ctx, scope);
      if(result.getType() == Value.Type.ARRAY) {
        return result;
      }

      List<Reference> refs = new ArrayList<Reference>();
      expr.collectReferences(refs);
      int numRows = 0;
      int numCols = 0;
      for(Reference ref : refs) {
        if(ref instanceof RangeReference) {
          RangeReference range = (RangeReference)ref;
          numRows = Math.max(numRows, range.getRowCount());
          numCols = Math.max(numCols, range.getColCount());
        }
      }

      if(numRows == 0) {
        // no ranges to broadcast over
        return result;
      }

      // evaluate once per output position, each range resolving to the cell
      // at that position (clamped to the range's own bounds)
      Value[][] vals = new Value[numRows][numCols];
      for(int r = 0; r < numRows; ++r) {
        for(int c = 0; c < numCols; ++c) {
          Value val = expr.eval(ctx, scope.withArrayOffset(r, c));
          if(val.getType() == Value.Type.ARRAY) {
            ArrayValue arr = (ArrayValue)val;
            val = (arr.isEmpty() ? NULL_VAL : arr.getAsArray()[0][0]);
          }
          vals[r][c] = val;
        }
      }

      if((numRows == 1) && (numCols == 1)) {
        return vals[0][0];
      }
      return toArray(vals);
    }
  }

  private static class ELet extends ESpecialForm
  {
    private ELet(List<Expr> params) {
      super("LET", params);
    }

    @Override
    public Value eval(EvalContextImpl ctx, Scope scope) {
      int num = _params.size();
      if((num < 3) || ((num % 2) == 0)) {
        return VALUE_ERR_VAL;
      }

      Scope cur = scope;
      for(int i = 0; i < (num - 1); i += 2) {
        Expr nameExpr = _params.get(i);
        if(!(nameExpr instanceof EIdentifier)) {
          return VALUE_ERR_VAL;
        }
        // each value sees the bindings before it
        Value val = _params.get(i + 1).evalArg(ctx, cur);
        cur = cur.bind(((EIdentifier)nameExpr).getName(), val);
      }

      return _params.get(num - 1).eval(ctx, cur);
    }
  }

  private static class ELambda extends ESpecialForm
  {
    private ELambda(List<Expr> params) {
      super("LAMBDA", params);
    }

    @Override
    public boolean isConstant() {
      return false;
    }

    @Override
    public Value eval(EvalContextImpl ctx, Scope scope) {
      int num = _params.size();
      if(num < 2) {
        return VALUE_ERR_VAL;
      }

      List<String> names = new ArrayList<String>(num - 1);
      for(int i = 0; i < (num - 1); ++i) {
        Expr nameExpr = _params.get(i);
        if(!(nameExpr instanceof EIdentifier)) {
          return VALUE_ERR_VAL;
        }
        names.add(((EIdentifier)nameExpr).getName());
      }

      return ctx.registerClosure(new EvalContextImpl.Closure(
                                     names, _params.get(num - 1), scope));
    }
  }

  private static class ECall extends Expr
  {
    private final Expr _callee;
    private final List<Expr> _params;

    private ECall(Expr callee, List<Expr> params) {
      _callee = callee;
      _params = params;
    }

    @Override
    public boolean isConstant() {
      return false;
    }

    @Override
    public Value eval(EvalContextImpl ctx, Scope scope) {
      Value callee = _callee.eval(ctx, scope);
      if(callee.isError()) {
        return callee;
      }
      if(callee.getType() != Value.Type.LAMBDA) {
        return VALUE_ERR_VAL;
      }
      return invokeClosure(ctx, (LambdaValue)callee,
                           evalArgs(_params, ctx, scope));
    }

    @Override
    public void collectReferences(Collection<Reference> refs) {
      _callee.collectReferences(refs);
      FormulaParser.collectReferences(_params, refs);
    }

    @Override
    protected void toExprString(StringBuilder sb, boolean isDebug) {
      _callee.toString(sb, isDebug);
      sb.append(OPEN_PAREN);
      if(!_params.isEmpty()) {
        exprListToString(_params, sb, isDebug);
      }
      sb.append(CLOSE_PAREN);
    }
  }

  private static class ERowColumn extends ESpecialForm
  {
    private final boolean _isRow;

    private ERowColumn(List<Expr> params, boolean isRow) {
      super((isRow ? "ROW" : "COLUMN"), params);
      _isRow = isRow;
    }

    @Override
    public boolean isConstant() {
      return false;
    }

    @Override
    public Value eval(EvalContextImpl ctx, Scope scope) {
      if(_params.isEmpty()) {
        CellKey cur = ctx.getCurrentCell();
        if(cur == null) {
          return ONE_VAL;
        }
        return toValue((_isRow ? cur.getRow() : cur.getCol()) + 1);
      }
      if(_params.size() > 1) {
        return VALUE_ERR_VAL;
      }

      Expr param = unwrapParens(_params.get(0));
      if(param instanceof ECellRef) {
        CellReference ref = ((ECellRef)param)._ref;
        return toValue((_isRow ? ref.getRow() : ref.getCol()) + 1);
      }
      if(param instanceof ERangeRef) {
        RangeReference range = ((ERangeRef)param)._range;
        return toValue((_isRow ? range.getMinRow() : range.getMinCol()) + 1);
      }
      return VALUE_ERR_VAL;
    }
  }

  private static void literalStrToString(String str, StringBuilder sb) {
    sb.append("\"")
      .append(str.replace("\\", "\\\\").replace("\"", "\"\""))
      .append("\"");
  }

  /**
   * Handle to a parsed formula, see {@link Expression}.
   */
  public static final class ParsedFormula implements Expression
  {
    private final String _rawStr;
    private final Expr _expr;

    private ParsedFormula(String rawStr, Expr expr) {
      _rawStr = rawStr;
      _expr = expr;
    }

    /**
     * Evaluates this formula within the given top-level context, reading
     * cells through the given accessor.
     */
    public Value eval(EvalContextImpl ctx, CellValueAccessor accessor) {
      return _expr.eval(ctx, Scope.root(accessor));
    }

    @Override
    public String toRawString() {
      return _rawStr;
    }

    @Override
    public String toCleanString() {
      return _expr.toCleanString();
    }

    @Override
    public String toDebugString() {
      return _expr.toDebugString();
    }

    @Override
    public boolean isConstant() {
      return _expr.isConstant();
    }

    @Override
    public void collectReferences(Collection<Reference> refs) {
      _expr.collectReferences(refs);
    }

    @Override
    public String toString() {
      return toRawString();
    }
  }
}
