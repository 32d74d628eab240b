package com.spreadsheet.grid.formula;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The built-in function table: canonical name, accepted synonyms and arity.
 * Name lookup is case-insensitive.
 */
public enum BuiltinFunction {
    // Math
    SUM(1, BuiltinFunction.VARIADIC),
    AVERAGE(1, BuiltinFunction.VARIADIC, "AVG"),
    COUNT(1, BuiltinFunction.VARIADIC),
    COUNTA(1, BuiltinFunction.VARIADIC),
    MAX(1, BuiltinFunction.VARIADIC),
    MIN(1, BuiltinFunction.VARIADIC),
    ABS(1, 1),
    ROUND(1, 2),
    FLOOR(1, 1),
    CEIL(1, 1, "CEILING"),
    SQRT(1, 1),
    POWER(2, 2, "POW"),

    // Logical
    IF(2, 3),
    AND(1, BuiltinFunction.VARIADIC),
    OR(1, BuiltinFunction.VARIADIC),
    NOT(1, 1),
    TRUE(0, 0),
    FALSE(0, 0),

    // Text
    CONCATENATE(1, BuiltinFunction.VARIADIC, "CONCAT"),
    LEN(1, 1, "LENGTH"),
    UPPER(1, 1),
    LOWER(1, 1),
    TRIM(1, 1),
    LEFT(1, 2),
    RIGHT(1, 2),
    MID(3, 3),
    FIND(2, 3, "SEARCH"),
    SUBSTITUTE(3, 4, "REPLACE"),
    CHAR(1, 1),
    CODE(1, 1),

    // Date
    TODAY(0, 0),
    NOW(0, 0);

    public static final int VARIADIC = Integer.MAX_VALUE;

    private static final Map<String, BuiltinFunction> BY_NAME;

    static {
        Map<String, BuiltinFunction> names = new HashMap<>();
        for (BuiltinFunction function : values()) {
            names.put(function.name(), function);
            for (String alias : function.aliases) {
                names.put(alias, function);
            }
        }
        BY_NAME = Collections.unmodifiableMap(names);
    }

    private final int minArgs;
    private final int maxArgs;
    private final String[] aliases;

    BuiltinFunction(int minArgs, int maxArgs, String... aliases) {
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
        this.aliases = aliases;
    }

    public static Optional<BuiltinFunction> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_NAME.get(name.trim().toUpperCase()));
    }

    public boolean acceptsArgumentCount(int count) {
        return count >= minArgs && count <= maxArgs;
    }

    public int getMinArgs() {
        return minArgs;
    }

    public int getMaxArgs() {
        return maxArgs;
    }
}
