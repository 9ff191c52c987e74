package com.lunar.script.parser;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import com.lunar.script.parser.Expr.ExprInterface;
import com.lunar.script.parser.Statement.Stmt;

/**
 * Prints an AST back as source text that parses to an equivalent tree.
 * Operator expressions are fully parenthesized, so the output does not
 * depend on precedence rules.
 */
public class AstPrinter implements Expr.ExprVisitor<String>, Statement.StmtVisitor<String> {

    public String print(Statement.Block chunk) {
        return statements(chunk);
    }

    public String print(ExprInterface expr) {
        return expr.accept(this);
    }

    private String statements(Statement.Block block) {
        List<String> parts = new ArrayList<>();
        for (Stmt s : block.statements) parts.add(s.accept(this));
        return String.join("; ", parts);
    }

    private String body(Statement.Block block) {
        String s = statements(block);
        return s.isEmpty() ? " " : " " + s + " ";
    }

    private String list(List<ExprInterface> exprs) {
        List<String> parts = new ArrayList<>();
        for (ExprInterface e : exprs) parts.add(e.accept(this));
        return String.join(", ", parts);
    }

    private String functionTail(List<String> params, Statement.Block block) {
        return "(" + String.join(", ", params) + ")" + body(block) + "end";
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public String visitBlockStmt(Statement.Block stmt) {
        return "do" + body(stmt) + "end";
    }

    @Override
    public String visitWhileStmt(Statement.While stmt) {
        return "while " + print(stmt.condition) + " do" + body(stmt.body) + "end";
    }

    @Override
    public String visitRepeatStmt(Statement.Repeat stmt) {
        return "repeat" + body(stmt.body) + "until " + print(stmt.condition);
    }

    @Override
    public String visitIfStmt(Statement.If stmt) {
        StringBuilder sb = new StringBuilder();
        sb.append("if ").append(print(stmt.condition)).append(" then").append(body(stmt.thenBranch));
        if (!stmt.elseBranch.statements.isEmpty()) {
            sb.append("else").append(body(stmt.elseBranch));
        }
        return sb.append("end").toString();
    }

    @Override
    public String visitNumericForStmt(Statement.NumericFor stmt) {
        return "for " + stmt.name + " = " + print(stmt.start) + ", " + print(stmt.stop) + ", "
                + print(stmt.step) + " do" + body(stmt.body) + "end";
    }

    @Override
    public String visitGenericForStmt(Statement.GenericFor stmt) {
        return "for " + String.join(", ", stmt.names) + " in " + list(stmt.iterators)
                + " do" + body(stmt.body) + "end";
    }

    @Override
    public String visitFunctionStmt(Statement.FunctionStmt stmt) {
        return "function " + String.join(".", stmt.names)
                + functionTail(stmt.function.params, stmt.function.body);
    }

    @Override
    public String visitMethodStmt(Statement.MethodStmt stmt) {
        return "function " + String.join(".", stmt.names) + ":" + stmt.method
                + functionTail(stmt.function.params, stmt.function.body);
    }

    @Override
    public String visitLocalFunctionStmt(Statement.LocalFunctionStmt stmt) {
        return "local function " + stmt.name + functionTail(stmt.function.params, stmt.function.body);
    }

    @Override
    public String visitLocalStmt(Statement.LocalStmt stmt) {
        String names = "local " + String.join(", ", stmt.names);
        return stmt.values.isEmpty() ? names : names + " = " + list(stmt.values);
    }

    @Override
    public String visitReturnStmt(Statement.ReturnStmt stmt) {
        return stmt.values.isEmpty() ? "return" : "return " + list(stmt.values);
    }

    @Override
    public String visitBreakStmt(Statement.BreakStmt stmt) {
        return "break";
    }

    @Override
    public String visitAssignStmt(Statement.AssignStmt stmt) {
        return list(new ArrayList<ExprInterface>(stmt.targets)) + " = " + list(stmt.values);
    }

    @Override
    public String visitExprStmt(Statement.ExprStmt stmt) {
        return print(stmt.call);
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override
    public String visitLogicalExpr(Expr.Logical expr) {
        String op = (expr.operator == Expr.LogicalOp.OR) ? " or " : " and ";
        return "(" + print(expr.left) + op + print(expr.right) + ")";
    }

    @Override
    public String visitBinaryExpr(Expr.Binary expr) {
        return "(" + print(expr.left) + " " + expr.operator.symbol + " " + print(expr.right) + ")";
    }

    @Override
    public String visitUnaryExpr(Expr.Unary expr) {
        return "(" + expr.operator.symbol + print(expr.operand) + ")";
    }

    @Override
    public String visitLiteralExpr(Expr.Literal expr) {
        Value v = expr.value;
        switch (v.getType()) {
            case NUMBER: return number(v.asNumber());
            case STRING: return quote(v.asString());
            case NIL:
            case BOOLEAN: return v.toString();
            default:
                throw new IllegalArgumentException("Literal cannot hold a " + v.typeName());
        }
    }

    @Override
    public String visitVariableExpr(Expr.Variable expr) {
        return expr.name;
    }

    @Override
    public String visitIndexExpr(Expr.Index expr) {
        return prefix(expr.table) + "[" + print(expr.key) + "]";
    }

    @Override
    public String visitCallExpr(Expr.Call expr) {
        return prefix(expr.callee) + "(" + list(expr.arguments) + ")";
    }

    @Override
    public String visitMethodCallExpr(Expr.MethodCall expr) {
        return prefix(expr.receiver) + ":" + expr.method + "(" + list(expr.arguments) + ")";
    }

    @Override
    public String visitFunctionExpr(Expr.Function expr) {
        return "function" + functionTail(expr.params, expr.body);
    }

    @Override
    public String visitTableExpr(Expr.TableConstructor expr) {
        List<String> parts = new ArrayList<>();
        for (Expr.Field f : expr.fields) {
            parts.add(f.isPositional() ? print(f.value) : "[" + print(f.key) + "] = " + print(f.value));
        }
        return "{" + String.join(", ", parts) + "}";
    }

    /** Only names, indexes and calls can be indexed or called without parentheses. */
    private String prefix(ExprInterface e) {
        String s = print(e);
        boolean bare = e instanceof Expr.Variable || e instanceof Expr.Index
                || e instanceof Expr.Call || e instanceof Expr.MethodCall;
        return (bare && !UserFunction.VARARGS.equals(s)) ? s : "(" + s + ")";
    }

    /** Exact: re-scanning the text yields the same double. */
    static String number(double d) {
        if (Double.isNaN(d)) return "(0 / 0)";
        if (Double.isInfinite(d)) return d > 0 ? "(1 / 0)" : "(-1 / 0)";
        if (d < 0 || (d == 0 && 1 / d < 0)) return "(-" + number(-d) + ")";
        if (d == Math.rint(d) && d < 9007199254740992.0) return Long.toString((long) d);
        return new BigDecimal(Double.toString(d)).toPlainString();
    }

    static String quote(String s) {
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"': sb.append("\\\""); break;
                case '\\': sb.append("\\\\"); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                case '\b': sb.append("\\b"); break;
                case '\f': sb.append("\\f"); break;
                default:
                    if (c < 0x20) sb.append(String.format("\\u%04x", (int) c));
                    else sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
