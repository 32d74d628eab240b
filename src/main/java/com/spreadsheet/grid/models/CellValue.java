package com.spreadsheet.grid.models;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Typed value held by a cell: Empty, Text, Number, Boolean, Error(kind) or
 * Date (days since 1970-01-01). A single immutable class tagged by
 * {@link ValueType}; coercion and display switch over the tag.
 */
public final class CellValue {

    private static final CellValue EMPTY = new CellValue(ValueType.EMPTY, null, 0.0, 0L);
    private static final CellValue TRUE = new CellValue(ValueType.BOOLEAN, null, 1.0, 0L);
    private static final CellValue FALSE = new CellValue(ValueType.BOOLEAN, null, 0.0, 0L);

    // Plain decimal numbers only; Double.parseDouble alone would also take "NaN", "0x1p3" or "1d"
    private static final Pattern NUMERIC_TEXT = Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?$");

    private final ValueType type;
    // Text payload for TEXT, error kind for ERROR
    private final String text;
    private final double number;
    private final long days;

    private CellValue(ValueType type, String text, double number, long days) {
        this.type = type;
        this.text = text;
        this.number = number;
        this.days = days;
    }

    public static CellValue empty() {
        return EMPTY;
    }

    public static CellValue text(String text) {
        return new CellValue(ValueType.TEXT, Objects.requireNonNull(text, "text"), 0.0, 0L);
    }

    public static CellValue number(double number) {
        // -0.0 folds into 0.0 so equal-looking results compare equal
        return new CellValue(ValueType.NUMBER, null, number == 0.0 ? 0.0 : number, 0L);
    }

    public static CellValue bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static CellValue error(String kind) {
        return new CellValue(ValueType.ERROR, Objects.requireNonNull(kind, "kind"), 0.0, 0L);
    }

    public static CellValue date(long daysSinceEpoch) {
        return new CellValue(ValueType.DATE, null, 0.0, daysSinceEpoch);
    }

    public ValueType getType() {
        return type;
    }

    public boolean isEmpty() {
        return type == ValueType.EMPTY;
    }

    public boolean isError() {
        return type == ValueType.ERROR;
    }

    public String getText() {
        require(ValueType.TEXT);
        return text;
    }

    public double getNumber() {
        require(ValueType.NUMBER);
        return number;
    }

    public boolean getBoolean() {
        require(ValueType.BOOLEAN);
        return number != 0.0;
    }

    public String getErrorKind() {
        require(ValueType.ERROR);
        return text;
    }

    public long getDays() {
        require(ValueType.DATE);
        return days;
    }

    /**
     * Numeric coercion: Number as-is, Boolean 0/1, Text when it reads as a
     * number. Empty, Error and Date do not coerce.
     */
    public OptionalDouble asNumber() {
        switch (type) {
            case NUMBER:
            case BOOLEAN:
                return OptionalDouble.of(number);
            case TEXT:
                String trimmed = text.trim();
                if (NUMERIC_TEXT.matcher(trimmed).matches()) {
                    return OptionalDouble.of(Double.parseDouble(trimmed));
                }
                return OptionalDouble.empty();
            default:
                return OptionalDouble.empty();
        }
    }

    /**
     * Fallback display form. Locale-aware number formatting belongs to the UI layer.
     */
    public String toDisplayString() {
        switch (type) {
            case EMPTY:
                return "";
            case TEXT:
                return text;
            case NUMBER:
                return formatNumber(number);
            case BOOLEAN:
                return number != 0.0 ? "TRUE" : "FALSE";
            case ERROR:
                return "#" + text + "!";
            case DATE:
                return LocalDate.ofEpochDay(days).toString();
            default:
                throw new IllegalStateException("Unhandled value type: " + type);
        }
    }

    static String formatNumber(double n) {
        if (Double.isNaN(n) || Double.isInfinite(n)) {
            return Double.toString(n);
        }
        if (n == Math.rint(n) && Math.abs(n) < 1e15) {
            return Long.toString((long) n);
        }
        return BigDecimal.valueOf(n).stripTrailingZeros().toPlainString();
    }

    private void require(ValueType expected) {
        if (type != expected) {
            throw new IllegalStateException("Expected " + expected + " value but was " + type);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellValue)) {
            return false;
        }
        CellValue other = (CellValue) o;
        return type == other.type
                && Double.compare(number, other.number) == 0
                && days == other.days
                && Objects.equals(text, other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, number, days);
    }

    @Override
    public String toString() {
        switch (type) {
            case EMPTY:
                return "Empty";
            case TEXT:
                return "Text(" + text + ")";
            case ERROR:
                return "Error(" + text + ")";
            case DATE:
                return "Date(" + days + ")";
            default:
                return type.name().charAt(0) + type.name().substring(1).toLowerCase() + "(" + toDisplayString() + ")";
        }
    }
}
