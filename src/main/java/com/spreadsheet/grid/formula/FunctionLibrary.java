package com.spreadsheet.grid.formula;

import com.spreadsheet.grid.exceptions.FormulaErrorKind;
import com.spreadsheet.grid.exceptions.FormulaException;
import com.spreadsheet.grid.models.CellValue;
import com.spreadsheet.grid.models.ValueType;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Implementations of the built-in functions over already evaluated arguments.
 * Aggregates take the flattened argument list (ranges expanded).
 */
public final class FunctionLibrary {

    public static final String NO_NUMERIC_VALUES = "no-numeric-values";
    public static final String NEGATIVE_SQRT = "negative-sqrt";

    /** Past this many digits either side of the point every double is already exact or zero. */
    public static final int MAX_ROUND_DIGITS = 350;

    private FunctionLibrary() {
    }

    // ----------------------------------------------------------------
    // Aggregates
    // ----------------------------------------------------------------

    /**
     * Sum of the numerically coercible values; everything else is skipped.
     */
    public static CellValue sum(List<CellValue> values) {
        double total = 0.0;
        for (CellValue value : values) {
            OptionalDouble n = value.asNumber();
            if (n.isPresent()) {
                total += n.getAsDouble();
            }
        }
        return CellValue.number(total);
    }

    /**
     * Mean of the coercible values, 0 when there are none.
     */
    public static CellValue average(List<CellValue> values) {
        double total = 0.0;
        int count = 0;
        for (CellValue value : values) {
            OptionalDouble n = value.asNumber();
            if (n.isPresent()) {
                total += n.getAsDouble();
                count++;
            }
        }
        if (count == 0) {
            return CellValue.number(0.0);
        }
        return CellValue.number(total / count);
    }

    /**
     * Number of values that are Numbers (numeric text does not count).
     */
    public static CellValue count(List<CellValue> values) {
        int count = 0;
        for (CellValue value : values) {
            if (value.getType() == ValueType.NUMBER) {
                count++;
            }
        }
        return CellValue.number(count);
    }

    public static CellValue countA(List<CellValue> values) {
        int count = 0;
        for (CellValue value : values) {
            if (!value.isEmpty()) {
                count++;
            }
        }
        return CellValue.number(count);
    }

    public static CellValue max(List<CellValue> values) {
        return extreme(values, true);
    }

    public static CellValue min(List<CellValue> values) {
        return extreme(values, false);
    }

    private static CellValue extreme(List<CellValue> values, boolean max) {
        boolean found = false;
        double best = 0.0;
        for (CellValue value : values) {
            OptionalDouble n = value.asNumber();
            if (n.isEmpty()) {
                continue;
            }
            double d = n.getAsDouble();
            if (!found || (max ? d > best : d < best)) {
                best = d;
                found = true;
            }
        }
        return found ? CellValue.number(best) : CellValue.error(NO_NUMERIC_VALUES);
    }

    // ----------------------------------------------------------------
    // Scalar math: a value that does not coerce is passed through unchanged
    // ----------------------------------------------------------------

    public static CellValue abs(CellValue value) {
        OptionalDouble n = value.asNumber();
        return n.isPresent() ? CellValue.number(Math.abs(n.getAsDouble())) : value;
    }

    /**
     * Rounds half away from zero. Negative digit counts round left of the point.
     * Digit counts beyond {@link #MAX_ROUND_DIGITS} either way give the same
     * result as the bound, so they are clamped to it.
     */
    public static CellValue round(CellValue value, int digits) {
        OptionalDouble n = value.asNumber();
        if (n.isEmpty()) {
            return value;
        }
        double d = n.getAsDouble();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return CellValue.number(d);
        }
        int scale = Math.max(-MAX_ROUND_DIGITS, Math.min(MAX_ROUND_DIGITS, digits));
        return CellValue.number(BigDecimal.valueOf(d).setScale(scale, RoundingMode.HALF_UP).doubleValue());
    }

    public static CellValue sqrt(CellValue value) {
        OptionalDouble n = value.asNumber();
        if (n.isEmpty()) {
            return value;
        }
        if (n.getAsDouble() < 0) {
            return CellValue.error(NEGATIVE_SQRT);
        }
        return CellValue.number(Math.sqrt(n.getAsDouble()));
    }

    public static CellValue floor(CellValue value) {
        OptionalDouble n = value.asNumber();
        return n.isPresent() ? CellValue.number(Math.floor(n.getAsDouble())) : value;
    }

    public static CellValue ceil(CellValue value) {
        OptionalDouble n = value.asNumber();
        return n.isPresent() ? CellValue.number(Math.ceil(n.getAsDouble())) : value;
    }

    public static CellValue power(CellValue base, CellValue exponent) {
        OptionalDouble b = base.asNumber();
        if (b.isEmpty()) {
            return base;
        }
        OptionalDouble e = exponent.asNumber();
        if (e.isEmpty()) {
            return exponent;
        }
        double result = Math.pow(b.getAsDouble(), e.getAsDouble());
        if (Double.isNaN(result)) {
            throw new FormulaException(FormulaErrorKind.INVALID_ARGUMENT,
                    "POWER(" + base.toDisplayString() + ", " + exponent.toDisplayString() + ") is not a real number");
        }
        return CellValue.number(result);
    }

    // ----------------------------------------------------------------
    // Logical
    // ----------------------------------------------------------------

    /**
     * Total truthiness: Boolean as-is, Number non-zero, Text "TRUE"/"FALSE"
     * (any case) or numeric text, Date non-zero; Empty and Error are false.
     */
    public static boolean isTruthy(CellValue value) {
        switch (value.getType()) {
            case BOOLEAN:
                return value.getBoolean();
            case NUMBER:
                return value.getNumber() != 0.0;
            case TEXT:
                String text = value.getText().trim();
                if ("TRUE".equalsIgnoreCase(text)) {
                    return true;
                }
                if ("FALSE".equalsIgnoreCase(text)) {
                    return false;
                }
                OptionalDouble n = value.asNumber();
                return n.isPresent() && n.getAsDouble() != 0.0;
            case DATE:
                return value.getDays() != 0;
            default:
                return false;
        }
    }

    /**
     * AND over the values; blanks are ignored and the first error wins.
     */
    public static CellValue and(List<CellValue> values) {
        boolean result = true;
        for (CellValue value : values) {
            if (value.isError()) {
                return value;
            }
            if (!value.isEmpty()) {
                result &= isTruthy(value);
            }
        }
        return CellValue.bool(result);
    }

    public static CellValue or(List<CellValue> values) {
        boolean result = false;
        for (CellValue value : values) {
            if (value.isError()) {
                return value;
            }
            if (!value.isEmpty()) {
                result |= isTruthy(value);
            }
        }
        return CellValue.bool(result);
    }

    public static CellValue not(CellValue value) {
        if (value.isError()) {
            return value;
        }
        return CellValue.bool(!isTruthy(value));
    }

    // ----------------------------------------------------------------
    // Text: every argument is read through its display string
    // ----------------------------------------------------------------

    public static CellValue concatenate(List<CellValue> values) {
        StringBuilder sb = new StringBuilder();
        for (CellValue value : values) {
            sb.append(value.toDisplayString());
        }
        return CellValue.text(sb.toString());
    }

    public static CellValue len(CellValue value) {
        return CellValue.number(value.toDisplayString().length());
    }

    public static CellValue upper(CellValue value) {
        return CellValue.text(value.toDisplayString().toUpperCase(Locale.ROOT));
    }

    public static CellValue lower(CellValue value) {
        return CellValue.text(value.toDisplayString().toLowerCase(Locale.ROOT));
    }

    /**
     * Strips both ends and collapses inner runs of spaces to one.
     */
    public static CellValue trim(CellValue value) {
        return CellValue.text(value.toDisplayString().trim().replaceAll(" {2,}", " "));
    }

    public static CellValue left(CellValue value, int count) {
        requireNonNegative(count, "LEFT");
        String s = value.toDisplayString();
        return CellValue.text(s.substring(0, Math.min(count, s.length())));
    }

    public static CellValue right(CellValue value, int count) {
        requireNonNegative(count, "RIGHT");
        String s = value.toDisplayString();
        return CellValue.text(s.substring(s.length() - Math.min(count, s.length())));
    }

    /**
     * @param start 1-based start position
     */
    public static CellValue mid(CellValue value, int start, int count) {
        if (start < 1) {
            throw new FormulaException(FormulaErrorKind.INVALID_ARGUMENT, "MID start must be at least 1: " + start);
        }
        requireNonNegative(count, "MID");
        String s = value.toDisplayString();
        if (start > s.length()) {
            return CellValue.text("");
        }
        int from = start - 1;
        return CellValue.text(s.substring(from, (int) Math.min((long) from + count, s.length())));
    }

    /**
     * 1-based position of 'needle' in 'haystack' at or after 'start'. Case-sensitive.
     */
    public static CellValue find(CellValue needle, CellValue haystack, int start) {
        String n = needle.toDisplayString();
        String h = haystack.toDisplayString();
        if (start < 1 || start > h.length() + 1) {
            throw new FormulaException(FormulaErrorKind.INVALID_ARGUMENT, "FIND start out of range: " + start);
        }
        int index = h.indexOf(n, start - 1);
        if (index < 0) {
            throw new FormulaException(FormulaErrorKind.INVALID_ARGUMENT, "'" + n + "' not found in '" + h + "'");
        }
        return CellValue.number(index + 1);
    }

    /**
     * Replaces every occurrence of 'search', or only the given 1-based
     * occurrence when 'instance' is positive.
     */
    public static CellValue substitute(CellValue text, CellValue search, CellValue replacement, int instance) {
        String s = text.toDisplayString();
        String from = search.toDisplayString();
        String to = replacement.toDisplayString();
        if (from.isEmpty()) {
            return CellValue.text(s);
        }
        if (instance <= 0) {
            return CellValue.text(s.replace(from, to));
        }
        int index = -1;
        for (int i = 0; i < instance; i++) {
            index = s.indexOf(from, index + 1);
            if (index < 0) {
                return CellValue.text(s);
            }
        }
        return CellValue.text(s.substring(0, index) + to + s.substring(index + from.length()));
    }

    public static CellValue charOf(int code) {
        if (code < 1 || code > Character.MAX_VALUE) {
            throw new FormulaException(FormulaErrorKind.INVALID_ARGUMENT, "CHAR code out of range: " + code);
        }
        return CellValue.text(String.valueOf((char) code));
    }

    public static CellValue code(CellValue value) {
        String s = value.toDisplayString();
        if (s.isEmpty()) {
            throw new FormulaException(FormulaErrorKind.INVALID_ARGUMENT, "CODE of empty text");
        }
        return CellValue.number(s.codePointAt(0));
    }

    private static void requireNonNegative(int count, String function) {
        if (count < 0) {
            throw new FormulaException(FormulaErrorKind.INVALID_ARGUMENT,
                    function + " length must not be negative: " + count);
        }
    }
}
