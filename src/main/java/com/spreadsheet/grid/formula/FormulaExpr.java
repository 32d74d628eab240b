package com.spreadsheet.grid.formula;

import com.spreadsheet.grid.models.CellRange;
import com.spreadsheet.grid.models.CellRef;
import com.spreadsheet.grid.models.CellValue;
import com.spreadsheet.grid.models.ValueType;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Immutable formula AST. Consumers walk it with a {@link Visitor}.
 * toString() renders a fully parenthesised form, handy when checking precedence.
 */
public abstract class FormulaExpr {

    public interface Visitor<R> {
        R visitLiteral(Literal literal);

        R visitCellReference(CellReference reference);

        R visitRangeReference(RangeReference reference);

        R visitFunctionCall(FunctionCall call);

        R visitBinary(BinaryOperation operation);

        R visitUnary(UnaryOperation operation);
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public static final class Literal extends FormulaExpr {
        private final CellValue value;

        public Literal(CellValue value) {
            this.value = value;
        }

        public CellValue getValue() {
            return value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLiteral(this);
        }

        @Override
        public String toString() {
            if (value.getType() == ValueType.TEXT) {
                return "\"" + value.getText().replace("\"", "\"\"") + "\"";
            }
            return value.toDisplayString();
        }
    }

    public static final class CellReference extends FormulaExpr {
        private final CellRef ref;

        public CellReference(CellRef ref) {
            this.ref = ref;
        }

        public CellRef getRef() {
            return ref;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCellReference(this);
        }

        @Override
        public String toString() {
            return ref.toA1();
        }
    }

    public static final class RangeReference extends FormulaExpr {
        private final CellRange range;

        public RangeReference(CellRange range) {
            this.range = range;
        }

        public CellRange getRange() {
            return range;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRangeReference(this);
        }

        @Override
        public String toString() {
            return range.toRangeString();
        }
    }

    public static final class FunctionCall extends FormulaExpr {
        private final String name;
        private final List<FormulaExpr> arguments;

        public FunctionCall(String name, List<FormulaExpr> arguments) {
            this.name = name;
            this.arguments = Collections.unmodifiableList(arguments);
        }

        public String getName() {
            return name;
        }

        public List<FormulaExpr> getArguments() {
            return arguments;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunctionCall(this);
        }

        @Override
        public String toString() {
            return name + "(" + arguments.stream().map(Object::toString).collect(Collectors.joining(", ")) + ")";
        }
    }

    public static final class BinaryOperation extends FormulaExpr {
        private final BinaryOperator operator;
        private final FormulaExpr left;
        private final FormulaExpr right;

        public BinaryOperation(BinaryOperator operator, FormulaExpr left, FormulaExpr right) {
            this.operator = operator;
            this.left = left;
            this.right = right;
        }

        public BinaryOperator getOperator() {
            return operator;
        }

        public FormulaExpr getLeft() {
            return left;
        }

        public FormulaExpr getRight() {
            return right;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinary(this);
        }

        @Override
        public String toString() {
            return "(" + left + " " + operator.getSymbol() + " " + right + ")";
        }
    }

    public static final class UnaryOperation extends FormulaExpr {
        private final UnaryOperator operator;
        private final FormulaExpr operand;

        public UnaryOperation(UnaryOperator operator, FormulaExpr operand) {
            this.operator = operator;
            this.operand = operand;
        }

        public UnaryOperator getOperator() {
            return operator;
        }

        public FormulaExpr getOperand() {
            return operand;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnary(this);
        }

        @Override
        public String toString() {
            if (operator == UnaryOperator.PERCENT) {
                return "(" + operand + "%)";
            }
            return "(-" + operand + ")";
        }
    }
}
