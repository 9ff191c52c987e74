package com.lunar.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.lunar.script.LuaSyntaxException;
import com.lunar.script.parser.Expr.Assignable;
import com.lunar.script.parser.Expr.BinaryOp;
import com.lunar.script.parser.Expr.ExprInterface;
import com.lunar.script.parser.Expr.Field;
import com.lunar.script.parser.Expr.Literal;
import com.lunar.script.parser.Expr.LogicalOp;
import com.lunar.script.parser.Expr.MultiValued;
import com.lunar.script.parser.Expr.UnaryOp;
import com.lunar.script.parser.Expr.Variable;
import com.lunar.script.parser.Statement.Block;
import com.lunar.script.parser.Statement.Stmt;

/**
 * Recursive-descent parser over a {@link Scanner}. Statements must be
 * separated by ';'. Any structural mismatch raises a
 * {@link LuaSyntaxException} at the current token's offset; there is no
 * recovery.
 */
public class Parser {
    private final Scanner scanner;

    public Parser(Scanner scanner) { this.scanner = scanner; }

    /** A whole source text: a block followed by end of input. */
    public Block chunk() {
        Block block = block();
        expect(TokenType.EOF);
        return block;
    }

    /**
     * <pre>
     *     block = [stat {";" {";"} stat}] [";"]
     * </pre>
     * Stops before {@code else}, {@code elseif}, {@code end}, {@code until} or end of input.
     */
    public Block block() {
        List<Stmt> statements = new ArrayList<>();
        while (match(TokenType.SEMICOLON)) { }
        if (!isBlockEnd()) {
            statements.add(statement());
            while (match(TokenType.SEMICOLON)) {
                while (match(TokenType.SEMICOLON)) { }
                if (isBlockEnd()) break;
                statements.add(statement());
            }
        }
        return new Block(statements);
    }

    // -------------------------
    // Statements
    // -------------------------

    private Stmt statement() {
        if (match(TokenType.DO)) return doStatement();
        if (match(TokenType.WHILE)) return whileStatement();
        if (match(TokenType.REPEAT)) return repeatStatement();
        if (match(TokenType.IF)) return ifStatement();
        if (match(TokenType.FOR)) return forStatement();
        if (match(TokenType.FUNCTION)) return functionStatement();
        if (match(TokenType.LOCAL)) return localStatement();
        if (match(TokenType.RETURN)) return returnStatement();
        if (match(TokenType.BREAK)) return new Statement.BreakStmt();
        return exprStatement();
    }

    /** varlist "=" explist | call */
    private Stmt exprStatement() {
        ExprInterface e = expression();
        if (e instanceof Assignable) {
            List<Assignable> targets = new ArrayList<>();
            targets.add((Assignable) e);
            while (match(TokenType.COMMA)) {
                targets.add(assignable());
            }
            expect(TokenType.EQUAL);
            return new Statement.AssignStmt(targets, expressionList());
        }
        if (e instanceof MultiValued) {
            return new Statement.ExprStmt((MultiValued) e);
        }
        throw error("do, while, repeat, if, for, function, local, function call or assignment expected");
    }

    private Assignable assignable() {
        ExprInterface e = expression();
        if (e instanceof Assignable) return (Assignable) e;
        throw error("expression must not occur on left hand side");
    }

    private Stmt doStatement() {
        Block b = block();
        expect(TokenType.END);
        return b;
    }

    private Stmt whileStatement() {
        ExprInterface condition = expression();
        expect(TokenType.DO);
        Block body = block();
        expect(TokenType.END);
        return new Statement.While(condition, body);
    }

    private Stmt repeatStatement() {
        Block body = block();
        expect(TokenType.UNTIL);
        return new Statement.Repeat(body, expression());
    }

    /** Also parses the rest of an {@code elseif} chain, which shares the final {@code end}. */
    private Stmt ifStatement() {
        ExprInterface condition = expression();
        expect(TokenType.THEN);
        Block thenBranch = block();
        Block elseBranch;
        if (match(TokenType.ELSEIF)) {
            return new Statement.If(condition, thenBranch,
                    new Block(Collections.singletonList(ifStatement())));
        } else if (match(TokenType.ELSE)) {
            elseBranch = block();
        } else {
            elseBranch = new Block(Collections.emptyList());
        }
        expect(TokenType.END);
        return new Statement.If(condition, thenBranch, elseBranch);
    }

    private Stmt forStatement() {
        List<String> names = nameList();
        if (match(TokenType.EQUAL)) {
            if (names.size() != 1) throw error("only one name allowed before '='");
            ExprInterface start = expression();
            expect(TokenType.COMMA);
            ExprInterface stop = expression();
            ExprInterface step = match(TokenType.COMMA) ? expression() : new Literal(Value.number(1));
            expect(TokenType.DO);
            Block body = block();
            expect(TokenType.END);
            return new Statement.NumericFor(names.get(0), start, stop, step, body);
        }
        expect(TokenType.IN);
        List<ExprInterface> iterators = expressionList();
        expect(TokenType.DO);
        Block body = block();
        expect(TokenType.END);
        return new Statement.GenericFor(names, iterators, body);
    }

    /** "function" Name {"." Name} [":" Name] funcbody */
    private Stmt functionStatement() {
        List<String> names = new ArrayList<>();
        names.add(name());
        while (match(TokenType.DOT)) {
            names.add(name());
        }
        if (match(TokenType.COLON)) {
            String method = name();
            Expr.Function fn = functionBody(String.join(".", names) + ":" + method);
            return new Statement.MethodStmt(names, method, fn);
        }
        return new Statement.FunctionStmt(names, functionBody(String.join(".", names)));
    }

    private Stmt localStatement() {
        if (match(TokenType.FUNCTION)) {
            String name = name();
            return new Statement.LocalFunctionStmt(name, functionBody(name));
        }
        List<String> names = nameList();
        List<ExprInterface> values = match(TokenType.EQUAL) ? expressionList() : Collections.emptyList();
        return new Statement.LocalStmt(names, values);
    }

    private Stmt returnStatement() {
        if (isBlockEnd() || check(TokenType.SEMICOLON)) {
            return new Statement.ReturnStmt(Collections.emptyList());
        }
        return new Statement.ReturnStmt(expressionList());
    }

    /** funcbody = "(" [parlist] ")" block "end" */
    private Expr.Function functionBody(String debugName) {
        expect(TokenType.LEFT_PAREN);
        List<String> params = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                if (match(TokenType.DOTS)) {
                    params.add(UserFunction.VARARGS);
                    break;
                }
                params.add(name());
            } while (match(TokenType.COMMA));
        }
        expect(TokenType.RIGHT_PAREN);
        Block body = block();
        expect(TokenType.END);
        return new Expr.Function(debugName, params, body);
    }

    private List<String> nameList() {
        List<String> names = new ArrayList<>();
        names.add(name());
        while (match(TokenType.COMMA)) {
            names.add(name());
        }
        return names;
    }

    private String name() {
        Token t = expect(TokenType.NAME);
        return (String) t.literal;
    }

    // -------------------------
    // Expressions, lowest precedence first
    // -------------------------

    public ExprInterface expression() {
        ExprInterface e = and();
        while (match(TokenType.OR)) {
            e = new Expr.Logical(LogicalOp.OR, e, and());
        }
        return e;
    }

    private ExprInterface and() {
        ExprInterface e = comparison();
        while (match(TokenType.AND)) {
            e = new Expr.Logical(LogicalOp.AND, e, comparison());
        }
        return e;
    }

    /** Left-chaining: {@code a < b < c} compares the boolean {@code a < b} with {@code c}. */
    private ExprInterface comparison() {
        ExprInterface e = concat();
        while (true) {
            BinaryOp op;
            if (match(TokenType.LESS)) op = BinaryOp.LT;
            else if (match(TokenType.GREATER)) op = BinaryOp.GT;
            else if (match(TokenType.LESS_EQUAL)) op = BinaryOp.LE;
            else if (match(TokenType.GREATER_EQUAL)) op = BinaryOp.GE;
            else if (match(TokenType.TILDE_EQUAL)) op = BinaryOp.NE;
            else if (match(TokenType.EQUAL_EQUAL)) op = BinaryOp.EQ;
            else return e;
            e = new Expr.Binary(op, e, concat());
        }
    }

    /** Right-associative. */
    private ExprInterface concat() {
        ExprInterface e = additive();
        if (match(TokenType.CONCAT)) {
            return new Expr.Binary(BinaryOp.CONCAT, e, concat());
        }
        return e;
    }

    private ExprInterface additive() {
        ExprInterface e = multiplicative();
        while (true) {
            if (match(TokenType.PLUS)) e = new Expr.Binary(BinaryOp.ADD, e, multiplicative());
            else if (match(TokenType.MINUS)) e = new Expr.Binary(BinaryOp.SUB, e, multiplicative());
            else return e;
        }
    }

    private ExprInterface multiplicative() {
        ExprInterface e = unary();
        while (true) {
            if (match(TokenType.STAR)) e = new Expr.Binary(BinaryOp.MUL, e, unary());
            else if (match(TokenType.SLASH)) e = new Expr.Binary(BinaryOp.DIV, e, unary());
            else if (match(TokenType.PERCENT)) e = new Expr.Binary(BinaryOp.MOD, e, unary());
            else return e;
        }
    }

    private ExprInterface unary() {
        if (match(TokenType.NOT)) return new Expr.Unary(UnaryOp.NOT, unary());
        if (match(TokenType.HASH)) return new Expr.Unary(UnaryOp.LEN, unary());
        if (match(TokenType.MINUS)) return new Expr.Unary(UnaryOp.NEG, unary());
        return power();
    }

    /** Right-associative; {@code -2^2} is {@code -(2^2)}, {@code 2^-1} is allowed. */
    private ExprInterface power() {
        ExprInterface e = primary();
        if (match(TokenType.CARET)) {
            ExprInterface exponent = isUnaryOperator() ? unary() : power();
            return new Expr.Binary(BinaryOp.POW, e, exponent);
        }
        return e;
    }

    private boolean isUnaryOperator() {
        return check(TokenType.NOT) || check(TokenType.HASH) || check(TokenType.MINUS);
    }

    private ExprInterface primary() {
        if (match(TokenType.NIL)) return new Literal(Value.NIL);
        if (match(TokenType.TRUE)) return new Literal(Value.TRUE);
        if (match(TokenType.FALSE)) return new Literal(Value.FALSE);
        if (check(TokenType.NUMBER)) return new Literal(Value.number((Double) consume().literal));
        if (check(TokenType.STRING)) return new Literal(Value.string((String) consume().literal));
        if (match(TokenType.DOTS)) return new Variable(UserFunction.VARARGS);
        if (match(TokenType.FUNCTION)) return functionBody(null);
        if (match(TokenType.LEFT_BRACE)) return tableConstructor();
        if (check(TokenType.NAME)) return postfix(new Variable(name()));
        if (match(TokenType.LEFT_PAREN)) {
            ExprInterface e = expression();
            expect(TokenType.RIGHT_PAREN);
            return postfix(e);
        }
        throw error("unexpected symbol");
    }

    /** Chains of {@code [exp]}, {@code .Name}, {@code :Name args} and {@code args}. */
    private ExprInterface postfix(ExprInterface e) {
        while (true) {
            if (match(TokenType.LEFT_BRACKET)) {
                ExprInterface key = expression();
                expect(TokenType.RIGHT_BRACKET);
                e = new Expr.Index(e, key);
            } else if (match(TokenType.DOT)) {
                e = new Expr.Index(e, new Literal(Value.string(name())));
            } else if (match(TokenType.COLON)) {
                String method = name();
                if (!isArgsStart()) throw error("function arguments expected");
                e = new Expr.MethodCall(e, method, arguments());
            } else if (isArgsStart()) {
                e = new Expr.Call(e, arguments());
            } else {
                return e;
            }
        }
    }

    private boolean isArgsStart() {
        return check(TokenType.LEFT_PAREN) || check(TokenType.LEFT_BRACE) || check(TokenType.STRING);
    }

    /** args = "(" [explist] ")" | tableconstructor | String */
    private List<ExprInterface> arguments() {
        if (check(TokenType.STRING)) {
            return Collections.singletonList(new Literal(Value.string((String) consume().literal)));
        }
        if (match(TokenType.LEFT_BRACE)) {
            return Collections.singletonList(tableConstructor());
        }
        expect(TokenType.LEFT_PAREN);
        if (match(TokenType.RIGHT_PAREN)) return Collections.emptyList();
        List<ExprInterface> args = expressionList();
        expect(TokenType.RIGHT_PAREN);
        return args;
    }

    public List<ExprInterface> expressionList() {
        List<ExprInterface> exprs = new ArrayList<>();
        exprs.add(expression());
        while (match(TokenType.COMMA)) {
            exprs.add(expression());
        }
        return exprs;
    }

    /**
     * Called after '{'.
     * <pre>
     *     field = "[" exp "]" "=" exp | Name "=" exp | exp
     *     fieldsep = "," | ";"
     * </pre>
     */
    private ExprInterface tableConstructor() {
        List<Field> fields = new ArrayList<>();
        while (!match(TokenType.RIGHT_BRACE)) {
            fields.add(field());
            if (!check(TokenType.RIGHT_BRACE)) {
                if (!match(TokenType.COMMA) && !match(TokenType.SEMICOLON)) {
                    throw expected("}");
                }
            }
        }
        return new Expr.TableConstructor(fields);
    }

    private Field field() {
        if (match(TokenType.LEFT_BRACKET)) {
            ExprInterface key = expression();
            expect(TokenType.RIGHT_BRACKET);
            expect(TokenType.EQUAL);
            return new Field(key, expression());
        }
        ExprInterface e = expression();
        if (e instanceof Variable && !UserFunction.VARARGS.equals(((Variable) e).name)
                && match(TokenType.EQUAL)) {
            return new Field(new Literal(Value.string(((Variable) e).name)), expression());
        }
        return new Field(null, e);
    }

    // -------------------------
    // Helpers
    // -------------------------

    private boolean isBlockEnd() {
        TokenType t = scanner.token().type;
        return t == TokenType.EOF || t == TokenType.ELSE || t == TokenType.ELSEIF
                || t == TokenType.END || t == TokenType.UNTIL;
    }

    private boolean check(TokenType type) {
        return scanner.token().type == type;
    }

    private boolean match(TokenType type) {
        if (!check(type)) return false;
        scanner.advance();
        return true;
    }

    private Token consume() {
        Token t = scanner.token();
        scanner.advance();
        return t;
    }

    private Token expect(TokenType type) {
        if (check(type)) return consume();
        throw expected(type.text);
    }

    private LuaSyntaxException expected(String what) {
        Token t = scanner.token();
        if (t.type == TokenType.ERROR) return error(null);
        String found = (t.type == TokenType.EOF) ? TokenType.EOF.text : "'" + t.lexeme + "'";
        return error("expected '" + what + "' but found " + found);
    }

    /** Reports at the current token; an ERROR token reports its own reason instead. */
    private LuaSyntaxException error(String message) {
        Token t = scanner.token();
        if (t.type == TokenType.ERROR) {
            return new LuaSyntaxException((String) t.literal, t.offset);
        }
        return new LuaSyntaxException(message, t.offset);
    }
}
