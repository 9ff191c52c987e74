package com.lunar.script;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lunar.debug.Debug;
import com.lunar.protocol.util.JsonBridge;
import com.lunar.protocol.util.StateSnapshot;
import com.lunar.script.parser.Environment;
import com.lunar.script.parser.ExecutionState;
import com.lunar.script.parser.Interpreter;
import com.lunar.script.parser.Outcome;
import com.lunar.script.parser.Parser;
import com.lunar.script.parser.Scanner;
import com.lunar.script.parser.Statement.Block;
import com.lunar.script.parser.Value;

/**
 * Core LunarScript engine: an embeddable interpreter for a Lua 5.1 subset.
 *
 * - Lua syntax, statements separated by ';'
 * - Types: nil, boolean, number (double), string, table, function
 * - Metatables: per table, plus one shared metatable per other value kind
 * - No standard library: the host registers every global built-in
 * - Names must be bound before use; assigning an unknown name is an error
 *
 * Each engine owns its own {@link ExecutionState}; engines never share
 * metatables. An engine is single-threaded.
 */
public class LunarScript {
    private static final String TAG = "lunar";

    /** A host function: ordered arguments in, ordered results out. */
    public interface BuiltinFunction {
        List<Value> call(List<Value> args);
    }

    private final Map<String, BuiltinFunction> functions = new LinkedHashMap<>();
    private final ExecutionState state = new ExecutionState();

    public void registerFunction(String name, BuiltinFunction fn) { functions.put(name, fn); }

    public void setMaxCallDepth(int depth) { state.setMaxCallDepth(depth); }

    public int getMaxCallDepth() { return state.getMaxCallDepth(); }

    public void setMaxIndexChainDepth(int depth) { state.setMaxIndexChainDepth(depth); }

    public int getMaxIndexChainDepth() { return state.getMaxIndexChainDepth(); }

    /** The per-kind metatables and limits of this engine. */
    public ExecutionState metatables() { return state; }

    /** Parses a whole source text; trailing input is a syntax error. */
    public Block compile(String source) {
        Debug.get().d("parser", "parsing " + source.length() + " chars");
        Block chunk = new Parser(new Scanner(source)).chunk();
        Debug.get().d("parser", "parsed " + chunk.statements.size() + " top-level statements");
        return chunk;
    }

    /** A root environment with every registered built-in bound. */
    public Environment newEnvironment() {
        Environment env = new Environment();
        for (Map.Entry<String, BuiltinFunction> e : functions.entrySet()) {
            env.bind(e.getKey(), Value.function(e.getValue()));
        }
        return env;
    }

    /**
     * Runs a chunk as if it were a function body: a top-level {@code return}
     * yields its values, normal completion yields none. A {@code break} with
     * no enclosing loop is malformed input and raises IllegalStateException.
     * <p>
     * A top-level {@code return} is accepted here even though it has no
     * enclosing function activation; hosts that want to reject it should use
     * {@link Interpreter#execute(Block)}, which hands back the raw
     * {@link Outcome}.
     */
    public List<Value> execute(Block chunk, Environment env) {
        Interpreter interpreter = new Interpreter(state, env);
        Outcome outcome;
        try {
            outcome = interpreter.execute(chunk);
        } catch (LuaRuntimeException e) {
            Debug.get().w("interpreter", "runtime error: " + e.getMessage(), e);
            throw e;
        }
        if (outcome.isBreak()) {
            throw new IllegalStateException("'break' outside of a loop reached the top level");
        }
        return outcome.isReturn() ? outcome.values : Collections.emptyList();
    }

    /** Compiles and runs {@code source} in a fresh root environment; returns its bindings. */
    public Map<String, Value> run(String source) {
        Environment env = newEnvironment();
        execute(compile(source), env);
        return env.snapshot();
    }

    /** Compiles and runs {@code source} in a fresh root environment; returns what it returned. */
    public List<Value> eval(String source) {
        return eval(source, newEnvironment());
    }

    public List<Value> eval(String source, Environment env) {
        Debug.get().t(TAG, "eval in " + (env.parent == null ? "root" : "nested") + " environment");
        return execute(compile(source), env);
    }

    /** Calls a script or built-in function from host code. */
    public List<Value> call(Value fn, List<Value> args, Environment env) {
        return new Interpreter(state, env).call(fn, args);
    }

    /** Binds {@code name} to the script form of a JSON document. */
    public void bindJson(Environment env, String name, JsonNode json) {
        env.bind(name, JsonBridge.fromJson(json));
    }

    /** The bindings of {@code env}'s own frame as a JSON object with sorted keys. */
    public ObjectNode snapshot(Environment env) {
        return StateSnapshot.capture(env);
    }
}
