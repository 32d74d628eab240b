package com.spreadsheet.grid.formula;

import com.spreadsheet.grid.exceptions.FormulaErrorKind;
import com.spreadsheet.grid.exceptions.FormulaException;
import com.spreadsheet.grid.models.CellValue;
import com.spreadsheet.grid.models.ValueType;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Evaluates a formula AST against a {@link FormulaContext}.
 * <p>
 * Operator rules:
 * - arithmetic coerces both sides to numbers; an Error operand is returned as
 *   is, an Empty operand counts as 0, a Date as its day number, anything else
 *   that does not coerce is a TYPE_ERROR
 * - comparison compares same-typed values (numbers numerically, text
 *   lexicographically, FALSE &lt; TRUE, dates by day); Empty takes the other
 *   side's zero value; differently typed values are never equal and cannot be
 *   ordered (Error "unequal-types")
 * - '&amp;' joins the display strings of both sides
 */
public class Evaluator {

    public static final String UNEQUAL_TYPES = "unequal-types";

    private static final double MILLIS_PER_DAY = 86_400_000.0;

    private final Clock clock;

    public Evaluator() {
        this(Clock.systemDefaultZone());
    }

    public Evaluator(Clock clock) {
        this.clock = clock;
    }

    /**
     * @throws FormulaException for evaluation-time failures (division by zero,
     *                          unknown function, bad arguments, type errors, cycles)
     */
    public CellValue evaluate(FormulaExpr expression, FormulaContext context) {
        return expression.accept(new EvaluationVisitor(context));
    }

    public CellValue evaluate(Formula formula, FormulaContext context) {
        return evaluate(formula.getExpression(), context);
    }

    private final class EvaluationVisitor implements FormulaExpr.Visitor<CellValue> {
        private final FormulaContext context;

        EvaluationVisitor(FormulaContext context) {
            this.context = context;
        }

        @Override
        public CellValue visitLiteral(FormulaExpr.Literal literal) {
            return literal.getValue();
        }

        @Override
        public CellValue visitCellReference(FormulaExpr.CellReference reference) {
            return context.getCell(reference.getRef()).orElse(CellValue.empty());
        }

        @Override
        public CellValue visitRangeReference(FormulaExpr.RangeReference reference) {
            throw new FormulaException(FormulaErrorKind.TYPE_ERROR,
                    "Range " + reference.getRange().toRangeString() + " used where a single value is expected");
        }

        @Override
        public CellValue visitBinary(FormulaExpr.BinaryOperation operation) {
            CellValue left = operation.getLeft().accept(this);
            CellValue right = operation.getRight().accept(this);
            BinaryOperator op = operation.getOperator();
            if (op == BinaryOperator.CONCAT) {
                return CellValue.text(left.toDisplayString() + right.toDisplayString());
            }
            if (op.isComparison()) {
                return compare(op, left, right);
            }
            return arithmetic(op, left, right);
        }

        @Override
        public CellValue visitUnary(FormulaExpr.UnaryOperation operation) {
            CellValue operand = operation.getOperand().accept(this);
            if (operand.isError()) {
                return operand;
            }
            double n = toNumber(operand, operation.getOperator().getSymbol());
            switch (operation.getOperator()) {
                case NEGATE:
                    return CellValue.number(-n);
                case PERCENT:
                    return CellValue.number(n / 100.0);
                default:
                    throw new IllegalStateException("Unhandled operator: " + operation.getOperator());
            }
        }

        @Override
        public CellValue visitFunctionCall(FormulaExpr.FunctionCall call) {
            BuiltinFunction function = BuiltinFunction.fromName(call.getName())
                    .orElseThrow(() -> new FormulaException(FormulaErrorKind.UNKNOWN_FUNCTION,
                            "Unknown function: " + call.getName()));
            List<FormulaExpr> args = call.getArguments();
            if (!function.acceptsArgumentCount(args.size())) {
                throw new FormulaException(FormulaErrorKind.INVALID_ARGUMENT,
                        function + " takes " + arityText(function) + " argument(s), got " + args.size());
            }
            switch (function) {
                case SUM:
                    return FunctionLibrary.sum(flatten(args));
                case AVERAGE:
                    return FunctionLibrary.average(flatten(args));
                case COUNT:
                    return FunctionLibrary.count(flatten(args));
                case COUNTA:
                    return FunctionLibrary.countA(flatten(args));
                case MAX:
                    return FunctionLibrary.max(flatten(args));
                case MIN:
                    return FunctionLibrary.min(flatten(args));
                case ABS:
                    return FunctionLibrary.abs(scalar(args, 0));
                case ROUND:
                    return FunctionLibrary.round(scalar(args, 0), optionalInteger(args, 1, 0));
                case FLOOR:
                    return FunctionLibrary.floor(scalar(args, 0));
                case CEIL:
                    return FunctionLibrary.ceil(scalar(args, 0));
                case SQRT:
                    return FunctionLibrary.sqrt(scalar(args, 0));
                case POWER:
                    return FunctionLibrary.power(scalar(args, 0), scalar(args, 1));
                case IF:
                    return conditional(args);
                case AND:
                    return FunctionLibrary.and(flatten(args));
                case OR:
                    return FunctionLibrary.or(flatten(args));
                case NOT:
                    return FunctionLibrary.not(scalar(args, 0));
                case TRUE:
                    return CellValue.bool(true);
                case FALSE:
                    return CellValue.bool(false);
                case CONCATENATE:
                    return FunctionLibrary.concatenate(flatten(args));
                case LEN:
                    return FunctionLibrary.len(scalar(args, 0));
                case UPPER:
                    return FunctionLibrary.upper(scalar(args, 0));
                case LOWER:
                    return FunctionLibrary.lower(scalar(args, 0));
                case TRIM:
                    return FunctionLibrary.trim(scalar(args, 0));
                case LEFT:
                    return FunctionLibrary.left(scalar(args, 0), optionalInteger(args, 1, 1));
                case RIGHT:
                    return FunctionLibrary.right(scalar(args, 0), optionalInteger(args, 1, 1));
                case MID:
                    return FunctionLibrary.mid(scalar(args, 0), integer(args, 1), integer(args, 2));
                case FIND:
                    return FunctionLibrary.find(scalar(args, 0), scalar(args, 1), optionalInteger(args, 2, 1));
                case SUBSTITUTE:
                    return FunctionLibrary.substitute(scalar(args, 0), scalar(args, 1), scalar(args, 2),
                            optionalInteger(args, 3, 0));
                case CHAR:
                    return FunctionLibrary.charOf(integer(args, 0));
                case CODE:
                    return FunctionLibrary.code(scalar(args, 0));
                case TODAY:
                    return CellValue.date(LocalDate.now(clock).toEpochDay());
                case NOW:
                    return CellValue.number(clock.millis() / MILLIS_PER_DAY);
                default:
                    throw new IllegalStateException("Unhandled function: " + function);
            }
        }

        /**
         * IF evaluates only the branch it takes; a missing else-branch is FALSE.
         */
        private CellValue conditional(List<FormulaExpr> args) {
            CellValue condition = scalar(args, 0);
            if (condition.isError()) {
                return condition;
            }
            if (FunctionLibrary.isTruthy(condition)) {
                return scalar(args, 1);
            }
            return args.size() > 2 ? scalar(args, 2) : CellValue.bool(false);
        }

        // ----------------------------------------------------------------
        // Argument helpers
        // ----------------------------------------------------------------

        private List<CellValue> flatten(List<FormulaExpr> args) {
            List<CellValue> values = new ArrayList<>();
            for (FormulaExpr arg : args) {
                if (arg instanceof FormulaExpr.RangeReference) {
                    values.addAll(context.getRange(((FormulaExpr.RangeReference) arg).getRange()));
                } else {
                    values.add(arg.accept(this));
                }
            }
            return values;
        }

        private CellValue scalar(List<FormulaExpr> args, int index) {
            return args.get(index).accept(this);
        }

        private int integer(List<FormulaExpr> args, int index) {
            CellValue value = scalar(args, index);
            OptionalDouble n = value.asNumber();
            if (value.isEmpty()) {
                return 0;
            }
            if (n.isEmpty()) {
                throw new FormulaException(FormulaErrorKind.INVALID_ARGUMENT,
                        "Expected a number but got " + value.toDisplayString());
            }
            double d = n.getAsDouble();
            if (d > Integer.MAX_VALUE || d < Integer.MIN_VALUE || Double.isNaN(d)) {
                throw new FormulaException(FormulaErrorKind.INVALID_ARGUMENT, "Number out of range: " + d);
            }
            return (int) d;
        }

        private int optionalInteger(List<FormulaExpr> args, int index, int fallback) {
            return args.size() > index ? integer(args, index) : fallback;
        }
    }

    private static String arityText(BuiltinFunction function) {
        if (function.getMaxArgs() == BuiltinFunction.VARIADIC) {
            return "at least " + function.getMinArgs();
        }
        if (function.getMinArgs() == function.getMaxArgs()) {
            return String.valueOf(function.getMinArgs());
        }
        return function.getMinArgs() + " to " + function.getMaxArgs();
    }

    // ----------------------------------------------------------------
    // Operators
    // ----------------------------------------------------------------

    private static CellValue arithmetic(BinaryOperator op, CellValue left, CellValue right) {
        if (left.isError()) {
            return left;
        }
        if (right.isError()) {
            return right;
        }
        double a = toNumber(left, op.getSymbol());
        double b = toNumber(right, op.getSymbol());
        switch (op) {
            case ADD:
                return CellValue.number(a + b);
            case SUBTRACT:
                return CellValue.number(a - b);
            case MULTIPLY:
                return CellValue.number(a * b);
            case DIVIDE:
                if (b == 0.0) {
                    throw new FormulaException(FormulaErrorKind.DIV_BY_ZERO, "Division by zero");
                }
                return CellValue.number(a / b);
            case POWER:
                double result = Math.pow(a, b);
                if (Double.isNaN(result)) {
                    throw new FormulaException(FormulaErrorKind.INVALID_ARGUMENT,
                            a + " ^ " + b + " is not a real number");
                }
                return CellValue.number(result);
            default:
                throw new IllegalStateException("Not an arithmetic operator: " + op);
        }
    }

    private static double toNumber(CellValue value, String operator) {
        switch (value.getType()) {
            case EMPTY:
                return 0.0;
            case DATE:
                return value.getDays();
            default:
                OptionalDouble n = value.asNumber();
                if (n.isEmpty()) {
                    throw new FormulaException(FormulaErrorKind.TYPE_ERROR,
                            "Cannot use " + value + " as a number in '" + operator + "'");
                }
                return n.getAsDouble();
        }
    }

    private static CellValue compare(BinaryOperator op, CellValue left, CellValue right) {
        if (left.isError()) {
            return left;
        }
        if (right.isError()) {
            return right;
        }
        CellValue l = zeroIfEmpty(left, right);
        CellValue r = zeroIfEmpty(right, left);
        if (l.getType() != r.getType()) {
            switch (op) {
                case EQUAL:
                    return CellValue.bool(false);
                case NOT_EQUAL:
                    return CellValue.bool(true);
                default:
                    return CellValue.error(UNEQUAL_TYPES);
            }
        }
        int c = compareSameType(l, r);
        switch (op) {
            case EQUAL:
                return CellValue.bool(c == 0);
            case NOT_EQUAL:
                return CellValue.bool(c != 0);
            case LESS:
                return CellValue.bool(c < 0);
            case LESS_EQUAL:
                return CellValue.bool(c <= 0);
            case GREATER:
                return CellValue.bool(c > 0);
            case GREATER_EQUAL:
                return CellValue.bool(c >= 0);
            default:
                throw new IllegalStateException("Not a comparison operator: " + op);
        }
    }

    private static CellValue zeroIfEmpty(CellValue value, CellValue other) {
        if (!value.isEmpty()) {
            return value;
        }
        switch (other.getType()) {
            case NUMBER:
                return CellValue.number(0.0);
            case TEXT:
                return CellValue.text("");
            case BOOLEAN:
                return CellValue.bool(false);
            case DATE:
                return CellValue.date(0);
            default:
                return value;
        }
    }

    private static int compareSameType(CellValue l, CellValue r) {
        ValueType type = l.getType();
        switch (type) {
            case EMPTY:
                return 0;
            case NUMBER:
                return Double.compare(l.getNumber(), r.getNumber());
            case TEXT:
                return l.getText().compareTo(r.getText());
            case BOOLEAN:
                return Boolean.compare(l.getBoolean(), r.getBoolean());
            case DATE:
                return Long.compare(l.getDays(), r.getDays());
            default:
                throw new IllegalStateException("Cannot compare " + type);
        }
    }
}
