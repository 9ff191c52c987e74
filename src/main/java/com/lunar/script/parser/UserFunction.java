package com.lunar.script.parser;

import java.util.Collections;
import java.util.List;

import com.lunar.script.parser.Statement.Block;

/**
 * A closure: parameter names, a body and the environment it was created in.
 * The environment is captured by reference, so later changes to captured
 * variables are visible inside the function.
 */
public class UserFunction {
    /** Parameter (and variable) name collecting the extra arguments into a table. */
    public static final String VARARGS = "...";

    final String name;
    final List<String> params;
    final Block body;
    final Environment closure;

    public UserFunction(String name, List<String> params, Block body, Environment closure) {
        this.name = (name == null) ? "?" : name;
        this.params = params;
        this.body = body;
        this.closure = closure;
    }

    public String getName() {
        return name;
    }

    public List<String> getParams() {
        return Collections.unmodifiableList(params);
    }

    /**
     * Runs the body in a fresh child of the closure environment. Missing
     * arguments bind nil; extra ones are dropped unless the last parameter is
     * {@link #VARARGS}.
     */
    List<Value> call(Interpreter interpreter, List<Value> args) {
        Environment activation = closure.childScope();
        for (int i = 0; i < params.size(); i++) {
            String p = params.get(i);
            if (VARARGS.equals(p)) {
                List<Value> rest = (i < args.size()) ? args.subList(i, args.size()) : Collections.emptyList();
                activation.bind(p, Value.table(LuaTable.of(rest)));
            } else {
                activation.bind(p, i < args.size() ? args.get(i) : Value.NIL);
            }
        }

        Outcome outcome = interpreter.executeBlock(body.statements, activation);
        if (outcome.isReturn()) {
            return outcome.values;
        }
        if (outcome.isBreak()) {
            throw new IllegalStateException("'break' escaped the body of function '" + name + "'");
        }
        return Collections.emptyList();
    }

    @Override
    public String toString() {
        return "function " + name + "(" + String.join(", ", params) + ")";
    }
}
