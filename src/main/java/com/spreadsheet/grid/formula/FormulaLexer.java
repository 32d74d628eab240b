package com.spreadsheet.grid.formula;

import com.spreadsheet.grid.exceptions.FormulaErrorKind;
import com.spreadsheet.grid.exceptions.FormulaException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Splits a formula body into tokens by matching the {@link TokenType}
 * patterns at the current position. Whitespace is dropped; the list always
 * ends with an EOF token.
 */
public final class FormulaLexer {

    private FormulaLexer() {
    }

    public static List<Token> tokenize(String body) {
        List<Token> tokens = new ArrayList<>();
        int pos = 0;
        scanning:
        while (pos < body.length()) {
            for (TokenType type : TokenType.values()) {
                if (type.getPattern() == null) {
                    continue;
                }
                Matcher matcher = type.getPattern().matcher(body);
                matcher.region(pos, body.length());
                if (matcher.lookingAt()) {
                    if (type != TokenType.WHITESPACE) {
                        tokens.add(new Token(type, matcher.group(), pos));
                    }
                    pos = matcher.end();
                    continue scanning;
                }
            }
            if (body.charAt(pos) == '"') {
                throw new FormulaException(FormulaErrorKind.INVALID_SYNTAX,
                        "Unterminated string literal at position " + pos);
            }
            throw new FormulaException(FormulaErrorKind.INVALID_SYNTAX,
                    "Unexpected character '" + body.charAt(pos) + "' at position " + pos);
        }
        tokens.add(new Token(TokenType.EOF, "", body.length()));
        return tokens;
    }
}
