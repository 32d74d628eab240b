package com.spreadsheet.grid.formula;

import java.util.regex.Pattern;

/**
 * Token types of the formula language together with their lexical pattern.
 * The lexer tries them in declaration order, so two-character operators come
 * before their one-character prefixes.
 */
public enum TokenType {
    WHITESPACE("\\s+"),
    NUMBER("(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?"),
    // Possessive quantifiers; a plain alternation overflows the stack on long literals
    STRING("\"[^\"]*+(?:\"\"[^\"]*+)*+\""),
    // Function names, TRUE/FALSE and cell references ("B3", "$A$1"); the parser tells them apart
    IDENTIFIER("[A-Za-z_$][A-Za-z0-9_.$]*"),
    LESS_EQUAL("<="),
    GREATER_EQUAL(">="),
    NOT_EQUAL("<>"),
    LESS("<"),
    GREATER(">"),
    EQUAL("="),
    PLUS("\\+"),
    MINUS("-"),
    STAR("\\*"),
    SLASH("/"),
    CARET("\\^"),
    AMPERSAND("&"),
    PERCENT("%"),
    LPAREN("\\("),
    RPAREN("\\)"),
    COMMA(","),
    COLON(":"),
    EOF(null);

    private final Pattern pattern;

    TokenType(String pattern) {
        this.pattern = pattern == null ? null : Pattern.compile(pattern);
    }

    /**
     * @return pattern matching tokens of this type, or null for EOF
     */
    public Pattern getPattern() {
        return pattern;
    }
}
