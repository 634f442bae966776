package com.gridcalc.formula;

import com.gridcalc.exceptions.FormulaException;
import com.gridcalc.formula.functions.FunctionContext;
import com.gridcalc.formula.functions.FunctionDefinition;
import com.gridcalc.formula.functions.FunctionRegistry;
import com.gridcalc.models.ErrorKind;
import com.gridcalc.models.Value;
import com.gridcalc.references.CellReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Parses and computes a formula in one pass.
 * <p>
 * Precedence, lowest first: comparisons ({@code = <> < > <= >=}, left-associative,
 * one level), then {@code + -}, then {@code * / %}, then {@code ^} (also
 * left-associative), then atoms. A unary sign applies to the atom right after it,
 * so {@code -2^2} is 4.
 * <p>
 * {@link #evaluate} never throws: every failure ends as an error value. Once an
 * operand is an error the enclosing operators pass it up untouched.
 */
public class FormulaEvaluator {

    private static final Logger log = LoggerFactory.getLogger(FormulaEvaluator.class);

    private final SpreadsheetAccess spreadsheet;
    private final FunctionRegistry functions;
    private final Clock clock;
    private final Random random;
    private final int maxDepth;

    public FormulaEvaluator(SpreadsheetAccess spreadsheet, FunctionRegistry functions,
                            Clock clock, Random random, int maxDepth) {
        this.spreadsheet = spreadsheet;
        this.functions = functions;
        this.clock = clock;
        this.random = random;
        this.maxDepth = maxDepth;
    }

    public FunctionRegistry getFunctions() {
        return functions;
    }

    /**
     * Computes {@code formula} (with or without its leading "=") in {@code context}.
     */
    public Value evaluate(String formula, EvaluationContext context) {
        if (formula == null) {
            return Value.EMPTY;
        }
        if (context.getDepth() > maxDepth) {
            context.markTruncated();
            return Value.error(ErrorKind.REF);
        }
        String body = formula.startsWith("=") ? formula.substring(1) : formula;
        try {
            Parser parser = new Parser(Tokenizer.tokenize(body, spreadsheet.getNamedRanges()), context);
            Value result = parser.parseFormula();
            if (result.isArray()) {
                return Value.error(ErrorKind.VALUE);
            }
            return result;
        } catch (FormulaException e) {
            return Value.error(e.getKind());
        } catch (ArithmeticException e) {
            return Value.error(ErrorKind.DIV_ZERO);
        } catch (StackOverflowError e) {
            context.markTruncated();
            log.warn("Formula nested too deeply: {}", abbreviate(formula));
            return Value.error(ErrorKind.REF);
        } catch (RuntimeException e) {
            log.debug("Formula failed: {}", abbreviate(formula), e);
            return Value.error(ErrorKind.ERR);
        }
    }

    private static String abbreviate(String formula) {
        return formula.length() > 80 ? formula.substring(0, 80) + "..." : formula;
    }

    static int precedence(String operator) {
        switch (operator) {
            case "+":
            case "-":
                return 1;
            case "*":
            case "/":
            case "%":
                return 2;
            case "^":
                return 3;
            default:
                return -1;
        }
    }

    /**
     * Applies an arithmetic operator to two non-error operands.
     */
    static Value arithmetic(String operator, Value left, Value right) {
        double a = left.toNumber();
        double b = right.toNumber();
        double result;
        switch (operator) {
            case "+":
                result = a + b;
                break;
            case "-":
                result = a - b;
                break;
            case "*":
                result = a * b;
                break;
            case "/":
                if (b == 0) {
                    return Value.error(ErrorKind.DIV_ZERO);
                }
                result = a / b;
                break;
            case "%":
                if (b == 0) {
                    return Value.error(ErrorKind.DIV_ZERO);
                }
                result = a - b * Math.floor(a / b);
                break;
            case "^":
                result = Math.pow(a, b);
                break;
            default:
                return Value.error(ErrorKind.ERR);
        }
        if (Double.isNaN(result)) {
            return Value.error(ErrorKind.NUM);
        }
        if (Double.isInfinite(result)) {
            return Value.error(ErrorKind.ERR);
        }
        return Value.number(result);
    }

    /**
     * Compares two non-error operands. Numbers (and booleans) compare numerically,
     * text compares case-sensitively, blank counts as 0 against a number.
     * A number and a text are only ever unequal; ordering them is #ERR!.
     */
    static Value compare(String operator, Value left, Value right) {
        int cmp;
        boolean leftNumeric = left.isNumber() || left.isBoolean();
        boolean rightNumeric = right.isNumber() || right.isBoolean();
        if (leftNumeric && rightNumeric) {
            cmp = Double.compare(left.toNumber(), right.toNumber());
        } else if (leftNumeric && right.isEmpty() || rightNumeric && left.isEmpty()) {
            cmp = Double.compare(left.toNumber(), right.toNumber());
        } else if (left.isText() && right.isText()) {
            cmp = left.getText().compareTo(right.getText());
        } else if (left.isArray() || right.isArray()) {
            return Value.error(ErrorKind.VALUE);
        } else {
            switch (operator) {
                case "=":
                case "==":
                    return Value.FALSE;
                case "<>":
                case "!=":
                    return Value.TRUE;
                default:
                    return Value.error(ErrorKind.ERR);
            }
        }
        switch (operator) {
            case "=":
            case "==":
                return Value.bool(cmp == 0);
            case "<>":
            case "!=":
                return Value.bool(cmp != 0);
            case "<":
                return Value.bool(cmp < 0);
            case ">":
                return Value.bool(cmp > 0);
            case "<=":
                return Value.bool(cmp <= 0);
            case ">=":
                return Value.bool(cmp >= 0);
            default:
                return Value.error(ErrorKind.ERR);
        }
    }

    /**
     * Cursor over one token list. Each parse method consumes its construct in full
     * even when the value is already an error, so the token stream stays in step.
     */
    private final class Parser {
        private final List<Token> tokens;
        private final EvaluationContext context;
        private int pos;
        private int depth;

        Parser(List<Token> tokens, EvaluationContext context) {
            this.tokens = tokens;
            this.context = context;
        }

        private Token peek() {
            return tokens.get(pos);
        }

        private Token next() {
            Token token = tokens.get(pos);
            if (!token.is(TokenType.EOF)) {
                pos++;
            }
            return token;
        }

        private void expect(TokenType type) {
            if (!peek().is(type)) {
                throw new FormulaException(ErrorKind.ERR, "Expected " + type + " at " + peek().getPosition());
            }
            next();
        }

        private void descend() {
            if (++depth > maxDepth) {
                throw new FormulaException(ErrorKind.REF, "Formula nested too deeply");
            }
        }

        Value parseFormula() {
            if (peek().is(TokenType.EOF)) {
                return Value.EMPTY;
            }
            Value result = parseComparison();
            if (!peek().is(TokenType.EOF)) {
                throw new FormulaException(ErrorKind.ERR, "Unexpected " + peek().getValue());
            }
            return result;
        }

        private Value parseComparison() {
            Value left = parseArithmetic(1);
            while (peek().is(TokenType.COMPARISON)) {
                String operator = next().getValue();
                Value right = parseArithmetic(1);
                if (left.isError()) {
                    continue;
                }
                left = right.isError() ? right : compare(operator, left, right);
            }
            return left;
        }

        private Value parseArithmetic(int minPrecedence) {
            Value left = parseAtom();
            while (peek().is(TokenType.OPERATOR)) {
                String operator = peek().getValue();
                int precedence = precedence(operator);
                if (precedence < minPrecedence) {
                    break;
                }
                next();
                Value right = parseArithmetic(precedence + 1);
                if (left.isError()) {
                    continue;
                }
                left = right.isError() ? right : applyArithmetic(operator, left, right);
            }
            return left;
        }

        private Value applyArithmetic(String operator, Value left, Value right) {
            if (left.isArray() || right.isArray()) {
                return Value.error(ErrorKind.VALUE);
            }
            try {
                return arithmetic(operator, left, right);
            } catch (FormulaException e) {
                return Value.error(e.getKind());
            }
        }

        private Value parseAtom() {
            descend();
            try {
                return atom();
            } finally {
                depth--;
            }
        }

        private Value atom() {
            Token token = peek();
            switch (token.getType()) {
                case NUMBER:
                    next();
                    return Value.number(Double.parseDouble(token.getValue()));
                case STRING:
                    next();
                    return Value.text(token.getValue());
                case OPERATOR:
                    if ("-".equals(token.getValue()) || "+".equals(token.getValue())) {
                        next();
                        Value operand = parseAtom();
                        if (operand.isError() || "+".equals(token.getValue())) {
                            return operand;
                        }
                        try {
                            return Value.number(-operand.toNumber());
                        } catch (FormulaException e) {
                            return Value.error(e.getKind());
                        }
                    }
                    throw new FormulaException(ErrorKind.ERR, "Unexpected operator " + token.getValue());
                case CELL:
                    next();
                    return reference(token);
                case RANGE:
                    next();
                    return range(token.getValue());
                case FUNCTION:
                    next();
                    return call(token.getValue());
                case LPAREN:
                    next();
                    Value inner = parseComparison();
                    expect(TokenType.RPAREN);
                    return inner;
                case EOF:
                case COMMA:
                case RPAREN:
                    return Value.EMPTY;
                default:
                    throw new FormulaException(ErrorKind.ERR, "Unexpected " + token.getValue());
            }
        }

        private Value reference(Token token) {
            String name = token.getValue();
            if (peek().is(TokenType.COLON)) {
                next();
                Token end = next();
                if (!end.is(TokenType.CELL)) {
                    throw new FormulaException(ErrorKind.ERR, "Range needs a closing cell");
                }
                if (!CellReference.looksLikeReference(name) || !CellReference.looksLikeReference(end.getValue())) {
                    return Value.error(ErrorKind.REF);
                }
                return Value.array(spreadsheet.getRange(name, end.getValue(), context));
            }
            if (CellReference.looksLikeReference(name)) {
                return spreadsheet.getValueByRef(name, context);
            }
            if ("TRUE".equals(name)) {
                return Value.TRUE;
            }
            if ("FALSE".equals(name)) {
                return Value.FALSE;
            }
            return Value.error(ErrorKind.REF);
        }

        private Value range(String text) {
            int colon = text.indexOf(':');
            if (colon < 0) {
                return spreadsheet.getValueByRef(text, context);
            }
            return Value.array(spreadsheet.getRange(text.substring(0, colon), text.substring(colon + 1), context));
        }

        private Value call(String name) {
            expect(TokenType.LPAREN);
            List<Value> args = new ArrayList<>();
            if (peek().is(TokenType.RPAREN)) {
                next();
            } else {
                while (true) {
                    args.add(parseComparison());
                    if (peek().is(TokenType.COMMA)) {
                        next();
                        continue;
                    }
                    expect(TokenType.RPAREN);
                    break;
                }
            }

            FunctionDefinition definition = functions.get(name);
            if (definition == null) {
                return Value.error(ErrorKind.NAME);
            }
            if (!definition.acceptsErrors()) {
                for (Value arg : args) {
                    if (arg.isError()) {
                        return arg;
                    }
                }
            }
            FunctionContext functionContext = new FunctionContext(clock, random, context, spreadsheet);
            Value result;
            try {
                result = definition.getFunction().apply(args, functionContext);
            } catch (FormulaException e) {
                return Value.error(e.getKind());
            } catch (ArithmeticException e) {
                return Value.error(ErrorKind.DIV_ZERO);
            }
            if (result == null) {
                return Value.EMPTY;
            }
            if (result.isNumber() && (Double.isNaN(result.getNumber()) || Double.isInfinite(result.getNumber()))) {
                return Value.error(ErrorKind.NUM);
            }
            return result;
        }
    }
}
