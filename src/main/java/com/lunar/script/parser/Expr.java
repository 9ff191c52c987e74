package com.lunar.script.parser;

import java.util.List;

/**
 * Expression nodes. Every node is immutable once parsed; consumers dispatch
 * through {@link ExprVisitor}, which has one method per node kind.
 */
public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
    }

    public interface ExprVisitor<R> {
        R visitLogicalExpr(Logical expr);
        R visitBinaryExpr(Binary expr);
        R visitUnaryExpr(Unary expr);
        R visitLiteralExpr(Literal expr);
        R visitVariableExpr(Variable expr);
        R visitIndexExpr(Index expr);
        R visitCallExpr(Call expr);
        R visitMethodCallExpr(MethodCall expr);
        R visitFunctionExpr(Function expr);
        R visitTableExpr(TableConstructor expr);
    }

    /** Expressions that may appear on the left of '='. */
    public interface Assignable extends ExprInterface {}

    /** Call expressions: the only ones that expand to several values at the end of a list. */
    public interface MultiValued extends ExprInterface {}

    public enum LogicalOp { OR, AND }

    public enum BinaryOp {
        LT("<"), GT(">"), LE("<="), GE(">="), NE("~="), EQ("=="),
        CONCAT(".."),
        ADD("+"), SUB("-"), MUL("*"), DIV("/"), MOD("%"), POW("^");

        public final String symbol;

        BinaryOp(String symbol) {
            this.symbol = symbol;
        }
    }

    public enum UnaryOp {
        NOT("not "), NEG("-"), LEN("#");

        public final String symbol;

        UnaryOp(String symbol) {
            this.symbol = symbol;
        }
    }

    // -------------------------
    // Operators
    // -------------------------

    /** {@code or}/{@code and}: the right operand is evaluated only when needed. */
    public static final class Logical implements ExprInterface {
        public final LogicalOp operator;
        public final ExprInterface left;
        public final ExprInterface right;

        public Logical(LogicalOp operator, ExprInterface left, ExprInterface right) {
            this.operator = operator;
            this.left = left;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLogicalExpr(this);
        }
    }

    public static final class Binary implements ExprInterface {
        public final BinaryOp operator;
        public final ExprInterface left;
        public final ExprInterface right;

        public Binary(BinaryOp operator, ExprInterface left, ExprInterface right) {
            this.operator = operator;
            this.left = left;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }
    }

    public static final class Unary implements ExprInterface {
        public final UnaryOp operator;
        public final ExprInterface operand;

        public Unary(UnaryOp operator, ExprInterface operand) {
            this.operator = operator;
            this.operand = operand;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }
    }

    // -------------------------
    // Primaries
    // -------------------------

    public static final class Literal implements ExprInterface {
        public final Value value;

        public Literal(Value value) {
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }
    }

    /** A name reference; {@code ...} is the variable bound to a function's extra arguments. */
    public static final class Variable implements Assignable {
        public final String name;

        public Variable(String name) {
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVariableExpr(this);
        }
    }

    /** {@code t[k]}, and {@code t.name} as sugar for {@code t["name"]}. */
    public static final class Index implements Assignable {
        public final ExprInterface table;
        public final ExprInterface key;

        public Index(ExprInterface table, ExprInterface key) {
            this.table = table;
            this.key = key;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIndexExpr(this);
        }
    }

    public static final class Call implements MultiValued {
        public final ExprInterface callee;
        public final List<ExprInterface> arguments;

        public Call(ExprInterface callee, List<ExprInterface> arguments) {
            this.callee = callee;
            this.arguments = arguments;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }
    }

    /** {@code receiver:method(args)}: the receiver is evaluated once and passed first. */
    public static final class MethodCall implements MultiValued {
        public final ExprInterface receiver;
        public final String method;
        public final List<ExprInterface> arguments;

        public MethodCall(ExprInterface receiver, String method, List<ExprInterface> arguments) {
            this.receiver = receiver;
            this.method = method;
            this.arguments = arguments;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitMethodCallExpr(this);
        }
    }

    /** A function literal. The last parameter may be {@link UserFunction#VARARGS}. */
    public static final class Function implements ExprInterface {
        public final String name; // debug name only, may be null
        public final List<String> params;
        public final Statement.Block body;

        public Function(String name, List<String> params, Statement.Block body) {
            this.name = name;
            this.params = params;
            this.body = body;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitFunctionExpr(this);
        }
    }

    /** One table-constructor field; a null key means the next positional index. */
    public static final class Field {
        public final ExprInterface key;
        public final ExprInterface value;

        public Field(ExprInterface key, ExprInterface value) {
            this.key = key;
            this.value = value;
        }

        public boolean isPositional() {
            return key == null;
        }
    }

    public static final class TableConstructor implements ExprInterface {
        public final List<Field> fields;

        public TableConstructor(List<Field> fields) {
            this.fields = fields;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitTableExpr(this);
        }
    }
}
