package com.spreadsheet.grid.models;

/**
 * Read-only JSON view of one stored cell.
 * For example:
 * {
 *   "ref": "C1",
 *   "type": "NUMBER",
 *   "value": 6.0,
 *   "display": "6",
 *   "formula": "=SUM(A1:B1)",
 *   "state": "CLEAN"
 * }
 */
public class CellSnapshot {
    private final String ref;
    private final ValueType type;
    private final Object value;
    private final String display;
    private final String formula;
    private final CellState state;

    public CellSnapshot(String ref, ValueType type, Object value, String display, String formula, CellState state) {
        this.ref = ref;
        this.type = type;
        this.value = value;
        this.display = display;
        this.formula = formula;
        this.state = state;
    }

    public static CellSnapshot of(CellRef ref, Cell cell) {
        CellValue value = cell.getValue();
        return new CellSnapshot(ref.toA1(), value.getType(), jsonValue(value), value.toDisplayString(),
                cell.getFormulaText(), cell.getState());
    }

    /**
     * Payload of a value as a plain JSON scalar; dates as ISO strings, errors as their kind.
     */
    public static Object jsonValue(CellValue value) {
        switch (value.getType()) {
            case TEXT:
                return value.getText();
            case NUMBER:
                return value.getNumber();
            case BOOLEAN:
                return value.getBoolean();
            case ERROR:
                return value.getErrorKind();
            case DATE:
                return value.toDisplayString();
            default:
                return null;
        }
    }

    public String getRef() {
        return ref;
    }

    public ValueType getType() {
        return type;
    }

    public Object getValue() {
        return value;
    }

    public String getDisplay() {
        return display;
    }

    public String getFormula() {
        return formula;
    }

    public CellState getState() {
        return state;
    }
}
