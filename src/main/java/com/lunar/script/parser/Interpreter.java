package com.lunar.script.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import com.lunar.debug.Debug;
import com.lunar.debug.DebugLevel;
import com.lunar.script.LuaRuntimeException;
import com.lunar.script.LuaRuntimeException.Kind;
import com.lunar.script.parser.Expr.Assignable;
import com.lunar.script.parser.Expr.Binary;
import com.lunar.script.parser.Expr.Call;
import com.lunar.script.parser.Expr.ExprInterface;
import com.lunar.script.parser.Expr.ExprVisitor;
import com.lunar.script.parser.Expr.Field;
import com.lunar.script.parser.Expr.Index;
import com.lunar.script.parser.Expr.Literal;
import com.lunar.script.parser.Expr.Logical;
import com.lunar.script.parser.Expr.MethodCall;
import com.lunar.script.parser.Expr.MultiValued;
import com.lunar.script.parser.Expr.TableConstructor;
import com.lunar.script.parser.Expr.Unary;
import com.lunar.script.parser.Expr.Variable;
import com.lunar.script.parser.Statement.AssignStmt;
import com.lunar.script.parser.Statement.Block;
import com.lunar.script.parser.Statement.BreakStmt;
import com.lunar.script.parser.Statement.ExprStmt;
import com.lunar.script.parser.Statement.FunctionStmt;
import com.lunar.script.parser.Statement.GenericFor;
import com.lunar.script.parser.Statement.If;
import com.lunar.script.parser.Statement.LocalFunctionStmt;
import com.lunar.script.parser.Statement.LocalStmt;
import com.lunar.script.parser.Statement.MethodStmt;
import com.lunar.script.parser.Statement.NumericFor;
import com.lunar.script.parser.Statement.Repeat;
import com.lunar.script.parser.Statement.ReturnStmt;
import com.lunar.script.parser.Statement.Stmt;
import com.lunar.script.parser.Statement.StmtVisitor;
import com.lunar.script.parser.Statement.While;

/**
 * Tree-walking evaluator. Expressions evaluate to a {@link Value};
 * statements answer an {@link Outcome} that loops and function activations
 * inspect instead of catching exceptions.
 *
 * One interpreter runs one logical thread of evaluation; it is not safe to
 * share between threads.
 */
public class Interpreter implements ExprVisitor<Value>, StmtVisitor<Outcome> {
    private static final String TAG = "interpreter";

    Environment env;
    private final ExecutionState state;
    private final Operators operators;
    private final Deque<CallFrame> callStack = new ArrayDeque<>();

    public Interpreter(ExecutionState state, Environment env) {
        this.state = state;
        this.env = env;
        this.operators = new Operators(state, this);
    }

    public Operators operators() {
        return operators;
    }

    public ExecutionState state() {
        return state;
    }

    public Environment environment() {
        return env;
    }

    public String currentFunctionName() {
        return callStack.isEmpty() ? null : callStack.peek().functionName;
    }

    public int callDepth() {
        return callStack.size();
    }

    /**
     * Runs a chunk directly in the current environment (no child scope, so
     * top-level locals stay visible to the host). A BREAK or RETURN outcome is
     * handed back unchanged for the caller to judge.
     */
    public Outcome execute(Block chunk) {
        return executeBlock(chunk.statements, env);
    }

    /** Calls any callable value with host-supplied arguments. */
    public List<Value> call(Value fn, List<Value> args) {
        return operators.call(fn, args);
    }

    Outcome executeBlock(List<Stmt> statements, Environment scope) {
        Environment previous = this.env;
        this.env = scope;
        try {
            for (Stmt s : statements) {
                Outcome outcome = s.accept(this);
                if (!outcome.isNormal()) return outcome;
            }
            return Outcome.NORMAL;
        } finally {
            this.env = previous;
        }
    }

    List<Value> invoke(UserFunction fn, List<Value> args) {
        int max = state.getMaxCallDepth();
        if (max > 0 && callStack.size() >= max) {
            Debug.get().w(TAG, "call depth limit " + max + " hit calling " + fn.name);
            throw new LuaRuntimeException(Kind.CALL_DEPTH_EXCEEDED,
                    "stack overflow: call depth exceeded " + max + " calling '" + fn.name + "'");
        }
        callStack.push(new CallFrame(fn.name, args));
        if (Debug.get().isEnabled(DebugLevel.TRACE)) {
            Debug.get().t(TAG, "call " + fn.name + " depth=" + callStack.size() + " args=" + args);
        }
        try {
            return fn.call(this, args);
        } finally {
            callStack.pop();
        }
    }

    private Value eval(ExprInterface expr) {
        return expr.accept(this);
    }

    private Value evalIn(Environment scope, ExprInterface expr) {
        Environment previous = this.env;
        this.env = scope;
        try {
            return eval(expr);
        } finally {
            this.env = previous;
        }
    }

    /** Only a trailing call contributes all of its results; every other position one value. */
    private List<Value> evalList(List<ExprInterface> exprs) {
        List<Value> values = new ArrayList<>(exprs.size());
        for (int i = 0; i < exprs.size(); i++) {
            ExprInterface e = exprs.get(i);
            if (i == exprs.size() - 1 && e instanceof MultiValued) {
                values.addAll(callResults((MultiValued) e));
            } else {
                values.add(eval(e));
            }
        }
        return values;
    }

    private List<Value> callResults(MultiValued expr) {
        if (expr instanceof MethodCall) {
            MethodCall mc = (MethodCall) expr;
            Value receiver = eval(mc.receiver);
            Value fn = operators.index(receiver, Value.string(mc.method));
            List<Value> args = new ArrayList<>();
            args.add(receiver);
            args.addAll(evalList(mc.arguments));
            return operators.call(fn, args);
        }
        Call call = (Call) expr;
        Value fn = eval(call.callee);
        return operators.call(fn, evalList(call.arguments));
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public Outcome visitBlockStmt(Block stmt) {
        return executeBlock(stmt.statements, env.childScope());
    }

    @Override
    public Outcome visitWhileStmt(While stmt) {
        while (eval(stmt.condition).isTruthy()) {
            Outcome outcome = visitBlockStmt(stmt.body);
            if (outcome.isBreak()) break;
            if (outcome.isReturn()) return outcome;
        }
        return Outcome.NORMAL;
    }

    @Override
    public Outcome visitRepeatStmt(Repeat stmt) {
        while (true) {
            Environment scope = env.childScope();
            Outcome outcome = executeBlock(stmt.body.statements, scope);
            if (outcome.isBreak()) break;
            if (outcome.isReturn()) return outcome;
            if (evalIn(scope, stmt.condition).isTruthy()) break;
        }
        return Outcome.NORMAL;
    }

    @Override
    public Outcome visitIfStmt(If stmt) {
        if (eval(stmt.condition).isTruthy()) {
            return visitBlockStmt(stmt.thenBranch);
        }
        return visitBlockStmt(stmt.elseBranch);
    }

    @Override
    public Outcome visitNumericForStmt(NumericFor stmt) {
        Value start = eval(stmt.start);
        Value stop = eval(stmt.stop);
        Value step = eval(stmt.step);
        if (!start.isNumber() || !stop.isNumber() || !step.isNumber()) {
            throw new LuaRuntimeException(Kind.FOR_BOUNDS_NOT_NUMBERS,
                    "'for' start, limit and step must be numbers, got "
                            + start.typeName() + ", " + stop.typeName() + ", " + step.typeName());
        }
        double i = start.asNumber();
        double limit = stop.asNumber();
        double delta = step.asNumber();
        while ((delta > 0 && i <= limit) || (delta <= 0 && i >= limit)) {
            // fresh frame per iteration: closures capture this iteration's value
            Environment iteration = env.childScope();
            iteration.bind(stmt.name, Value.number(i));
            Outcome outcome = executeBlock(stmt.body.statements, iteration);
            if (outcome.isBreak()) break;
            if (outcome.isReturn()) return outcome;
            i += delta;
        }
        return Outcome.NORMAL;
    }

    /**
     * {@code for n1, n2 in f, s, c do ... end}: calls {@code f(s, c)} each pass,
     * binds the results to the names in a fresh frame, stops when the first is
     * nil and otherwise feeds it back as the next control value.
     */
    @Override
    public Outcome visitGenericForStmt(GenericFor stmt) {
        List<Value> init = evalList(stmt.iterators);
        Value fn = valueAt(init, 0);
        Value invariant = valueAt(init, 1);
        Value control = valueAt(init, 2);
        while (true) {
            List<Value> results = operators.call(fn, List.of(invariant, control));
            Environment iteration = env.childScope();
            for (int i = 0; i < stmt.names.size(); i++) {
                iteration.bind(stmt.names.get(i), valueAt(results, i));
            }
            Value first = valueAt(results, 0);
            if (first.isNil()) break;
            control = first;
            Outcome outcome = executeBlock(stmt.body.statements, iteration);
            if (outcome.isBreak()) break;
            if (outcome.isReturn()) return outcome;
        }
        return Outcome.NORMAL;
    }

    @Override
    public Outcome visitFunctionStmt(FunctionStmt stmt) {
        assignFunction(stmt.names, null, closure(stmt.function.name, stmt.function.params, stmt.function));
        return Outcome.NORMAL;
    }

    @Override
    public Outcome visitMethodStmt(MethodStmt stmt) {
        List<String> params = new ArrayList<>(stmt.function.params.size() + 1);
        params.add("self");
        params.addAll(stmt.function.params);
        assignFunction(stmt.names, stmt.method, closure(stmt.function.name, params, stmt.function));
        return Outcome.NORMAL;
    }

    /**
     * A plain name updates the nearest binding or, if there is none, binds in
     * the current frame. A dotted path indexes down to the last table and sets
     * the final field there.
     */
    private void assignFunction(List<String> names, String method, Value fn) {
        List<String> path = new ArrayList<>(names);
        if (method != null) path.add(method);
        if (path.size() == 1) {
            String name = path.get(0);
            if (env.exists(name)) env.update(name, fn);
            else env.bind(name, fn);
            return;
        }
        Value target = env.lookup(path.get(0));
        for (int i = 1; i < path.size() - 1; i++) {
            target = operators.index(target, Value.string(path.get(i)));
        }
        operators.newIndex(target, Value.string(path.get(path.size() - 1)), fn);
    }

    @Override
    public Outcome visitLocalFunctionStmt(LocalFunctionStmt stmt) {
        env.bind(stmt.name, Value.NIL);
        env.update(stmt.name, closure(stmt.function.name, stmt.function.params, stmt.function));
        return Outcome.NORMAL;
    }

    @Override
    public Outcome visitLocalStmt(LocalStmt stmt) {
        List<Value> values = evalList(stmt.values);
        for (int i = 0; i < stmt.names.size(); i++) {
            env.bind(stmt.names.get(i), valueAt(values, i));
        }
        return Outcome.NORMAL;
    }

    @Override
    public Outcome visitReturnStmt(ReturnStmt stmt) {
        return Outcome.returning(evalList(stmt.values));
    }

    @Override
    public Outcome visitBreakStmt(BreakStmt stmt) {
        return Outcome.BREAK;
    }

    @Override
    public Outcome visitAssignStmt(AssignStmt stmt) {
        List<Value> values = evalList(stmt.values);
        for (int i = 0; i < stmt.targets.size(); i++) {
            assign(stmt.targets.get(i), valueAt(values, i));
        }
        return Outcome.NORMAL;
    }

    private void assign(Assignable target, Value value) {
        if (target instanceof Variable) {
            env.update(((Variable) target).name, value);
        } else {
            Index index = (Index) target;
            operators.newIndex(eval(index.table), eval(index.key), value);
        }
    }

    @Override
    public Outcome visitExprStmt(ExprStmt stmt) {
        callResults(stmt.call);
        return Outcome.NORMAL;
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override
    public Value visitLogicalExpr(Logical expr) {
        Value left = eval(expr.left);
        switch (expr.operator) {
            case OR: return left.isTruthy() ? left : eval(expr.right);
            default: return left.isTruthy() ? eval(expr.right) : left;
        }
    }

    @Override
    public Value visitBinaryExpr(Binary expr) {
        Value left = eval(expr.left);
        Value right = eval(expr.right);
        switch (expr.operator) {
            case LT: return Value.bool(operators.lt(left, right));
            case GT: return Value.bool(operators.gt(left, right));
            case LE: return Value.bool(operators.le(left, right));
            case GE: return Value.bool(operators.ge(left, right));
            case EQ: return Value.bool(operators.eq(left, right));
            case NE: return Value.bool(!operators.eq(left, right));
            case CONCAT: return operators.concat(left, right);
            default: return operators.arithmetic(expr.operator, left, right);
        }
    }

    @Override
    public Value visitUnaryExpr(Unary expr) {
        Value operand = eval(expr.operand);
        switch (expr.operator) {
            case NOT: return Value.bool(!operand.isTruthy());
            case NEG: return operators.unm(operand);
            default: return operators.len(operand);
        }
    }

    @Override
    public Value visitLiteralExpr(Literal expr) {
        return expr.value;
    }

    @Override
    public Value visitVariableExpr(Variable expr) {
        return env.lookup(expr.name);
    }

    @Override
    public Value visitIndexExpr(Index expr) {
        Value table = eval(expr.table);
        return operators.index(table, eval(expr.key));
    }

    @Override
    public Value visitCallExpr(Call expr) {
        return Operators.first(callResults(expr));
    }

    @Override
    public Value visitMethodCallExpr(MethodCall expr) {
        return Operators.first(callResults(expr));
    }

    @Override
    public Value visitFunctionExpr(Expr.Function expr) {
        return closure(expr.name, expr.params, expr);
    }

    private Value closure(String name, List<String> params, Expr.Function fn) {
        return Value.function(new UserFunction(name, params, fn.body, env));
    }

    /** Positional fields take 1, 2, 3, ... in order; a trailing call field expands. */
    @Override
    public Value visitTableExpr(TableConstructor expr) {
        LuaTable table = new LuaTable();
        int position = 1;
        for (int i = 0; i < expr.fields.size(); i++) {
            Field field = expr.fields.get(i);
            if (field.isPositional()) {
                if (i == expr.fields.size() - 1 && field.value instanceof MultiValued) {
                    for (Value v : callResults((MultiValued) field.value)) {
                        table.rawSet(position++, v);
                    }
                } else {
                    table.rawSet(position++, eval(field.value));
                }
            } else {
                Value key = eval(field.key);
                table.rawSet(key, eval(field.value));
            }
        }
        return Value.table(table);
    }

    private static Value valueAt(List<Value> values, int i) {
        return i < values.size() ? values.get(i) : Value.NIL;
    }
}
