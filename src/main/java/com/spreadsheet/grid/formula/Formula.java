package com.spreadsheet.grid.formula;

import com.spreadsheet.grid.exceptions.FormulaErrorKind;
import com.spreadsheet.grid.exceptions.FormulaException;
import com.spreadsheet.grid.models.CellRange;
import com.spreadsheet.grid.models.CellRef;

import java.util.Set;

/**
 * A parsed formula: its text, its AST and the cells and ranges it reads.
 */
public final class Formula {

    private final String text;
    private final FormulaExpr expression;
    private final ReferenceCollector.References references;

    private Formula(String text, FormulaExpr expression) {
        this.text = text;
        this.expression = expression;
        this.references = ReferenceCollector.collect(expression);
    }

    /**
     * Parses formula text such as "=SUM(A1:A3) * 2".
     *
     * @throws FormulaException with INVALID_SYNTAX or INVALID_REF
     */
    public static Formula parse(String text) {
        if (text == null) {
            throw new FormulaException(FormulaErrorKind.INVALID_SYNTAX, "Formula text is missing");
        }
        String trimmed = text.trim();
        if (!trimmed.startsWith("=")) {
            throw new FormulaException(FormulaErrorKind.INVALID_SYNTAX, "Formula must start with '='");
        }
        return new Formula(trimmed, FormulaParser.parseBody(trimmed.substring(1)));
    }

    public String getText() {
        return text;
    }

    public FormulaExpr getExpression() {
        return expression;
    }

    public Set<CellRef> getReferencedCells() {
        return references.getCells();
    }

    public Set<CellRange> getReferencedRanges() {
        return references.getRanges();
    }

    @Override
    public String toString() {
        return text;
    }
}
