package com.lunar.script.parser;

import java.util.List;

import com.lunar.script.parser.Expr.ExprInterface;

/**
 * Statement nodes, executed for effect. Dispatch goes through
 * {@link StmtVisitor}; the interpreter's visitor answers an {@link Outcome}.
 */
public class Statement {

    public interface Stmt {
        <R> R accept(StmtVisitor<R> visitor);
    }

    public interface StmtVisitor<R> {
        R visitBlockStmt(Block stmt);
        R visitWhileStmt(While stmt);
        R visitRepeatStmt(Repeat stmt);
        R visitIfStmt(If stmt);
        R visitNumericForStmt(NumericFor stmt);
        R visitGenericForStmt(GenericFor stmt);
        R visitFunctionStmt(FunctionStmt stmt);
        R visitMethodStmt(MethodStmt stmt);
        R visitLocalFunctionStmt(LocalFunctionStmt stmt);
        R visitLocalStmt(LocalStmt stmt);
        R visitReturnStmt(ReturnStmt stmt);
        R visitBreakStmt(BreakStmt stmt);
        R visitAssignStmt(AssignStmt stmt);
        R visitExprStmt(ExprStmt stmt);
    }

    public static final class Block implements Stmt {
        public final List<Stmt> statements;
        public Block(List<Stmt> statements) { this.statements = statements; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitBlockStmt(this); }
    }

    public static final class While implements Stmt {
        public final ExprInterface condition;
        public final Block body;
        public While(ExprInterface condition, Block body) {
            this.condition = condition;
            this.body = body;
        }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitWhileStmt(this); }
    }

    /** {@code repeat body until condition}; the condition sees the body's locals. */
    public static final class Repeat implements Stmt {
        public final Block body;
        public final ExprInterface condition;
        public Repeat(Block body, ExprInterface condition) {
            this.body = body;
            this.condition = condition;
        }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitRepeatStmt(this); }
    }

    /** {@code elseif} chains nest as a single If inside the else block. */
    public static final class If implements Stmt {
        public final ExprInterface condition;
        public final Block thenBranch;
        public final Block elseBranch;
        public If(ExprInterface condition, Block thenBranch, Block elseBranch) {
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitIfStmt(this); }
    }

    public static final class NumericFor implements Stmt {
        public final String name;
        public final ExprInterface start;
        public final ExprInterface stop;
        public final ExprInterface step;
        public final Block body;
        public NumericFor(String name, ExprInterface start, ExprInterface stop, ExprInterface step, Block body) {
            this.name = name;
            this.start = start;
            this.stop = stop;
            this.step = step;
            this.body = body;
        }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitNumericForStmt(this); }
    }

    public static final class GenericFor implements Stmt {
        public final List<String> names;
        public final List<ExprInterface> iterators;
        public final Block body;
        public GenericFor(List<String> names, List<ExprInterface> iterators, Block body) {
            this.names = names;
            this.iterators = iterators;
            this.body = body;
        }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitGenericForStmt(this); }
    }

    /** {@code function a.b.c(params) body end}. */
    public static final class FunctionStmt implements Stmt {
        public final List<String> names;
        public final Expr.Function function;
        public FunctionStmt(List<String> names, Expr.Function function) {
            this.names = names;
            this.function = function;
        }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitFunctionStmt(this); }
    }

    /** {@code function a.b:m(params) body end}; {@code function} excludes the implicit self. */
    public static final class MethodStmt implements Stmt {
        public final List<String> names;
        public final String method;
        public final Expr.Function function;
        public MethodStmt(List<String> names, String method, Expr.Function function) {
            this.names = names;
            this.method = method;
            this.function = function;
        }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitMethodStmt(this); }
    }

    public static final class LocalFunctionStmt implements Stmt {
        public final String name;
        public final Expr.Function function;
        public LocalFunctionStmt(String name, Expr.Function function) {
            this.name = name;
            this.function = function;
        }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitLocalFunctionStmt(this); }
    }

    public static final class LocalStmt implements Stmt {
        public final List<String> names;
        public final List<ExprInterface> values; // empty when there is no '='
        public LocalStmt(List<String> names, List<ExprInterface> values) {
            this.names = names;
            this.values = values;
        }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitLocalStmt(this); }
    }

    public static final class ReturnStmt implements Stmt {
        public final List<ExprInterface> values;
        public ReturnStmt(List<ExprInterface> values) { this.values = values; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitReturnStmt(this); }
    }

    public static final class BreakStmt implements Stmt {
        public BreakStmt() {}
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitBreakStmt(this); }
    }

    public static final class AssignStmt implements Stmt {
        public final List<Expr.Assignable> targets;
        public final List<ExprInterface> values;
        public AssignStmt(List<Expr.Assignable> targets, List<ExprInterface> values) {
            this.targets = targets;
            this.values = values;
        }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitAssignStmt(this); }
    }

    /** A call used as a statement; its results are dropped. */
    public static final class ExprStmt implements Stmt {
        public final Expr.MultiValued call;
        public ExprStmt(Expr.MultiValued call) { this.call = call; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitExprStmt(this); }
    }
}
