package com.spreadsheet.grid.formula;

import com.spreadsheet.grid.models.CellRange;
import com.spreadsheet.grid.models.CellRef;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Walks an AST and gathers every cell and range it references.
 * These become the formula cell's edges in the dependency graph.
 */
public class ReferenceCollector implements FormulaExpr.Visitor<Void> {

    private final Set<CellRef> cells = new LinkedHashSet<>();
    private final Set<CellRange> ranges = new LinkedHashSet<>();

    public static References collect(FormulaExpr expression) {
        ReferenceCollector collector = new ReferenceCollector();
        expression.accept(collector);
        return new References(collector.cells, collector.ranges);
    }

    @Override
    public Void visitLiteral(FormulaExpr.Literal literal) {
        return null;
    }

    @Override
    public Void visitCellReference(FormulaExpr.CellReference reference) {
        cells.add(reference.getRef());
        return null;
    }

    @Override
    public Void visitRangeReference(FormulaExpr.RangeReference reference) {
        ranges.add(reference.getRange());
        return null;
    }

    @Override
    public Void visitFunctionCall(FormulaExpr.FunctionCall call) {
        for (FormulaExpr argument : call.getArguments()) {
            argument.accept(this);
        }
        return null;
    }

    @Override
    public Void visitBinary(FormulaExpr.BinaryOperation operation) {
        operation.getLeft().accept(this);
        operation.getRight().accept(this);
        return null;
    }

    @Override
    public Void visitUnary(FormulaExpr.UnaryOperation operation) {
        operation.getOperand().accept(this);
        return null;
    }

    public static final class References {
        private final Set<CellRef> cells;
        private final Set<CellRange> ranges;

        References(Set<CellRef> cells, Set<CellRange> ranges) {
            this.cells = Collections.unmodifiableSet(cells);
            this.ranges = Collections.unmodifiableSet(ranges);
        }

        public Set<CellRef> getCells() {
            return cells;
        }

        public Set<CellRange> getRanges() {
            return ranges;
        }
    }
}
