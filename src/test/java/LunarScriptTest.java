import com.lunar.script.LunarScript;
import com.lunar.script.parser.Environment;
import com.lunar.script.parser.Value;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class LunarScriptTest {

    private static LunarScript engine(List<String> printed) {
        LunarScript lua = new LunarScript();
        lua.registerFunction("print", args -> {
            List<String> parts = new ArrayList<>();
            for (Value v : args) parts.add(v.toString());
            printed.add(String.join("\t", parts));
            return Collections.emptyList();
        });
        return lua;
    }

    @Test
    void print_arithmetic() {
        List<String> out = new ArrayList<>();
        engine(out).eval("print(3 + 4)");
        assertEquals(List.of("7"), out);
    }

    @Test
    void numeric_for_prints_each_value() {
        List<String> out = new ArrayList<>();
        engine(out).eval("for i = 0, 5 do print(i) end");
        assertEquals(List.of("0", "1", "2", "3", "4", "5"), out);
    }

    @Test
    void recursive_factorial() {
        String src = String.join("\n",
            "function fac(n)",
            "    if n <= 1 then return 1 end;",
            "    return n * fac(n - 1)",
            "end;",
            "return fac(6)"
        );
        List<Value> out = new LunarScript().eval(src);
        assertEquals(1, out.size());
        assertEquals(720.0, out.get(0).asNumber(), 0.0);
    }

    @Test
    void multiple_results_spread_over_locals() {
        String src = String.join("\n",
            "local function f() return 1, 2 end;",
            "local a, b = f();",
            "return b"
        );
        assertEquals(2.0, new LunarScript().eval(src).get(0).asNumber(), 0.0);
    }

    @Test
    void only_trailing_call_expands() {
        String src = String.join("\n",
            "local function f() return 1, 2 end;",
            "return f(), f()"
        );
        List<Value> out = new LunarScript().eval(src);
        assertEquals(3, out.size());
        assertEquals("1", out.get(0).toString());
        assertEquals("1", out.get(1).toString());
        assertEquals("2", out.get(2).toString());
    }

    @Test
    void method_definition_and_call() {
        String src = String.join("\n",
            "local c = {v = 42};",
            "function c:m() return self.v end;",
            "return c:m()"
        );
        assertEquals(42.0, new LunarScript().eval(src).get(0).asNumber(), 0.0);
    }

    @Test
    void length_stops_at_first_hole() {
        List<Value> out = new LunarScript().eval("return #{1, [2] = 2, [4] = 4, n = 5}");
        assertEquals(2.0, out.get(0).asNumber(), 0.0);
    }

    @Test
    void number_formatting_in_print() {
        List<String> out = new ArrayList<>();
        engine(out).eval(String.join("\n",
            "print(10 / 2);",
            "print(0.1 + 0.2);",
            "print(10 / 3);",
            "print(1 / 0, -1 / 0);",
            "print(2 ^ 0.5 * 0)"
        ));
        assertEquals(List.of("5", "0.3", "3.3333333333333", "inf\t-inf", "0"), out);
    }

    @Test
    void concat_numbers_and_strings() {
        List<Value> out = new LunarScript().eval("return \"a\" .. 1 .. 2, 1 .. 2");
        assertEquals("a12", out.get(0).asString());
        assertEquals("12", out.get(1).asString());
    }

    @Test
    void varargs_collect_extra_arguments() {
        String src = String.join("\n",
            "local function count(first, ...) return #..., first end;",
            "return count(\"x\", 1, 2, 3)"
        );
        List<Value> out = new LunarScript().eval(src);
        assertEquals(3.0, out.get(0).asNumber(), 0.0);
        assertEquals("x", out.get(1).asString());
    }

    @Test
    void closures_share_captured_variable() {
        String src = String.join("\n",
            "local function counter()",
            "    local n = 0;",
            "    return function() n = n + 1; return n end",
            "end;",
            "local c = counter();",
            "c(); c();",
            "return c()"
        );
        assertEquals(3.0, new LunarScript().eval(src).get(0).asNumber(), 0.0);
    }

    @Test
    void run_returns_top_level_bindings() {
        LunarScript lua = new LunarScript();
        Map<String, Value> vars = lua.run("local x = 1; local y = \"a\" .. x; function f() end");

        assertEquals(1.0, vars.get("x").asNumber(), 0.0);
        assertEquals("a1", vars.get("y").asString());
        assertTrue(vars.get("f").isUserFunction());
    }

    @Test
    void host_calls_script_function() {
        LunarScript lua = new LunarScript();
        Environment env = lua.newEnvironment();
        lua.eval("function add(a, b) return a + b end", env);

        List<Value> out = lua.call(env.lookup("add"), List.of(Value.number(2), Value.number(40)), env);
        assertEquals(42.0, out.get(0).asNumber(), 0.0);
    }

    @Test
    void builtin_receives_arguments_and_returns_many() {
        LunarScript lua = new LunarScript();
        lua.registerFunction("swap", args -> List.of(args.get(1), args.get(0)));

        List<Value> out = lua.eval("local a, b = swap(1, 2); return a * 10 + b");
        assertEquals(21.0, out.get(0).asNumber(), 0.0);
    }

    @Test
    void builtin_returning_null_yields_nil() {
        LunarScript lua = new LunarScript();
        lua.registerFunction("nothing", args -> null);

        List<Value> out = lua.eval("return nothing() == nil");
        assertTrue(out.get(0).asBool());
    }

    @Test
    void environment_is_reused_across_evals() {
        LunarScript lua = new LunarScript();
        Environment env = lua.newEnvironment();
        lua.eval("local total = 1", env);
        lua.eval("total = total + 41", env);
        assertEquals(42.0, env.lookup("total").asNumber(), 0.0);
    }

    @Test
    void string_call_and_table_call_sugar() {
        LunarScript lua = new LunarScript();
        lua.registerFunction("id", args -> List.of(args.get(0)));

        List<Value> out = lua.eval("return id \"text\", id{7}[1]");
        assertEquals("text", out.get(0).asString());
        assertEquals(7.0, out.get(1).asNumber(), 0.0);
    }

    @Test
    void defaults_and_limits_are_configurable() {
        LunarScript lua = new LunarScript();
        assertEquals(200, lua.getMaxCallDepth());
        assertEquals(100, lua.getMaxIndexChainDepth());

        lua.setMaxCallDepth(10);
        lua.setMaxIndexChainDepth(3);
        assertEquals(10, lua.metatables().getMaxCallDepth());
        assertEquals(3, lua.metatables().getMaxIndexChainDepth());
    }

    @Test
    void method_sees_later_table_mutation() {
        List<String> out = new ArrayList<>();
        engine(out).eval("local c = {}; function c:m() return self.b end; c.b = 42; print(c:m())");
        assertEquals(List.of("42"), out);
    }

    @Test
    void runs_without_a_debug_sink_installed() {
        List<Value> out = new LunarScript().eval("local x = 0 / 0; return x == x, x ~= x");
        assertFalse(out.get(0).asBool());
        assertTrue(out.get(1).asBool());
    }
}
