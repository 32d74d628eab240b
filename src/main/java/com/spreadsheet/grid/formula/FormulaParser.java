package com.spreadsheet.grid.formula;

import com.spreadsheet.grid.exceptions.FormulaErrorKind;
import com.spreadsheet.grid.exceptions.FormulaException;
import com.spreadsheet.grid.models.CellRange;
import com.spreadsheet.grid.models.CellRef;
import com.spreadsheet.grid.models.CellValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Recursive descent parser for formula bodies. One method per precedence
 * level, lowest first:
 * <pre>
 * comparison    -> concatenation (("=" | "&lt;&gt;" | "&lt;" | "&lt;=" | "&gt;" | "&gt;=") concatenation)*
 * concatenation -> additive ("&amp;" additive)*
 * additive      -> multiplicative (("+" | "-") multiplicative)*
 * multiplicative-> power (("*" | "/") power)*
 * power         -> unary ("^" unary)*
 * unary         -> ("-" | "+") unary | primary "%"*
 * primary       -> NUMBER | STRING | TRUE | FALSE | ref | ref ":" ref
 *                | NAME "(" [comparison ("," comparison)*] ")" | "(" comparison ")"
 * </pre>
 */
public class FormulaParser {

    private static final Pattern REFERENCE = Pattern.compile("\\$?[A-Za-z]+\\$?\\d+");
    private static final Pattern FUNCTION_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_.]*");

    private final List<Token> tokens;
    private int index;

    public FormulaParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses a formula body (the text after '=').
     */
    public static FormulaExpr parseBody(String body) {
        return new FormulaParser(FormulaLexer.tokenize(body)).parse();
    }

    public FormulaExpr parse() {
        if (peek() == TokenType.EOF) {
            throw syntaxError("Empty formula");
        }
        FormulaExpr expr = comparison();
        if (peek() != TokenType.EOF) {
            throw syntaxError("Unexpected " + current() + " at position " + current().getPosition());
        }
        return expr;
    }

    private FormulaExpr comparison() {
        FormulaExpr left = concatenation();
        while (true) {
            BinaryOperator op;
            switch (peek()) {
                case EQUAL: op = BinaryOperator.EQUAL; break;
                case NOT_EQUAL: op = BinaryOperator.NOT_EQUAL; break;
                case LESS: op = BinaryOperator.LESS; break;
                case LESS_EQUAL: op = BinaryOperator.LESS_EQUAL; break;
                case GREATER: op = BinaryOperator.GREATER; break;
                case GREATER_EQUAL: op = BinaryOperator.GREATER_EQUAL; break;
                default: return left;
            }
            consume();
            left = new FormulaExpr.BinaryOperation(op, left, concatenation());
        }
    }

    private FormulaExpr concatenation() {
        FormulaExpr left = additive();
        while (peek() == TokenType.AMPERSAND) {
            consume();
            left = new FormulaExpr.BinaryOperation(BinaryOperator.CONCAT, left, additive());
        }
        return left;
    }

    private FormulaExpr additive() {
        FormulaExpr left = multiplicative();
        while (peek() == TokenType.PLUS || peek() == TokenType.MINUS) {
            BinaryOperator op = consume().getType() == TokenType.PLUS ? BinaryOperator.ADD : BinaryOperator.SUBTRACT;
            left = new FormulaExpr.BinaryOperation(op, left, multiplicative());
        }
        return left;
    }

    private FormulaExpr multiplicative() {
        FormulaExpr left = power();
        while (peek() == TokenType.STAR || peek() == TokenType.SLASH) {
            BinaryOperator op = consume().getType() == TokenType.STAR ? BinaryOperator.MULTIPLY : BinaryOperator.DIVIDE;
            left = new FormulaExpr.BinaryOperation(op, left, power());
        }
        return left;
    }

    private FormulaExpr power() {
        FormulaExpr left = unary();
        while (peek() == TokenType.CARET) {
            consume();
            left = new FormulaExpr.BinaryOperation(BinaryOperator.POWER, left, unary());
        }
        return left;
    }

    private FormulaExpr unary() {
        if (peek() == TokenType.MINUS) {
            consume();
            return new FormulaExpr.UnaryOperation(UnaryOperator.NEGATE, unary());
        }
        if (peek() == TokenType.PLUS) {
            consume();
            return unary();
        }
        FormulaExpr expr = primary();
        while (peek() == TokenType.PERCENT) {
            consume();
            expr = new FormulaExpr.UnaryOperation(UnaryOperator.PERCENT, expr);
        }
        return expr;
    }

    private FormulaExpr primary() {
        Token token = current();
        switch (token.getType()) {
            case NUMBER:
                consume();
                return new FormulaExpr.Literal(CellValue.number(Double.parseDouble(token.getText())));
            case STRING:
                consume();
                String raw = token.getText();
                return new FormulaExpr.Literal(CellValue.text(raw.substring(1, raw.length() - 1).replace("\"\"", "\"")));
            case LPAREN:
                consume();
                FormulaExpr inner = comparison();
                expect(TokenType.RPAREN);
                return inner;
            case IDENTIFIER:
                return identifier();
            case EOF:
                throw syntaxError("Unexpected end of formula");
            default:
                throw syntaxError("Unexpected " + token + " at position " + token.getPosition());
        }
    }

    /**
     * An identifier is a function call when '(' follows, a boolean when it
     * reads TRUE or FALSE, and otherwise must be a cell or range reference.
     */
    private FormulaExpr identifier() {
        Token token = consume();
        String name = token.getText();
        if (peek() == TokenType.LPAREN) {
            if (!FUNCTION_NAME.matcher(name).matches()) {
                throw syntaxError("Invalid function name '" + name + "'");
            }
            consume();
            return new FormulaExpr.FunctionCall(name.toUpperCase(), arguments());
        }
        if ("TRUE".equalsIgnoreCase(name)) {
            return new FormulaExpr.Literal(CellValue.bool(true));
        }
        if ("FALSE".equalsIgnoreCase(name)) {
            return new FormulaExpr.Literal(CellValue.bool(false));
        }
        CellRef start = reference(name);
        if (peek() != TokenType.COLON) {
            return new FormulaExpr.CellReference(start);
        }
        consume();
        if (peek() != TokenType.IDENTIFIER) {
            throw new FormulaException(FormulaErrorKind.INVALID_REF,
                    "Incomplete range starting at " + name);
        }
        CellRef end = reference(consume().getText());
        return new FormulaExpr.RangeReference(new CellRange(start, end));
    }

    private List<FormulaExpr> arguments() {
        List<FormulaExpr> args = new ArrayList<>();
        if (peek() == TokenType.RPAREN) {
            consume();
            return args;
        }
        while (true) {
            args.add(comparison());
            if (peek() == TokenType.COMMA) {
                consume();
                continue;
            }
            if (peek() != TokenType.RPAREN) {
                throw syntaxError("Expected ',' or ')' but found " + current());
            }
            consume();
            return args;
        }
    }

    private static CellRef reference(String text) {
        if (REFERENCE.matcher(text).matches()) {
            Optional<CellRef> ref = CellRef.parse(text.replace("$", ""));
            if (ref.isPresent()) {
                return ref.get();
            }
        }
        throw new FormulaException(FormulaErrorKind.INVALID_REF, "Invalid cell reference: " + text);
    }

    // ----------------------------------------------------------------
    // Token stream helpers
    // ----------------------------------------------------------------

    private Token current() {
        return tokens.get(index);
    }

    private TokenType peek() {
        return tokens.get(index).getType();
    }

    private Token consume() {
        Token token = tokens.get(index);
        if (token.getType() != TokenType.EOF) {
            index++;
        }
        return token;
    }

    private Token expect(TokenType type) {
        if (peek() != type) {
            throw syntaxError("Expected " + type + " but found " + current());
        }
        return consume();
    }

    private static FormulaException syntaxError(String message) {
        return new FormulaException(FormulaErrorKind.INVALID_SYNTAX, message);
    }
}
