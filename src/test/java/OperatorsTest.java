import com.lunar.script.LuaRuntimeException;
import com.lunar.script.LunarScript;
import com.lunar.script.parser.Environment;
import com.lunar.script.parser.ExecutionState;
import com.lunar.script.parser.Interpreter;
import com.lunar.script.parser.LuaTable;
import com.lunar.script.parser.Operators;
import com.lunar.script.parser.Value;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class OperatorsTest {

    /** Engine with a host-provided setmetatable, the only way scripts attach metatables. */
    private static LunarScript engine() {
        LunarScript lua = new LunarScript();
        lua.registerFunction("setmetatable", args -> {
            Value mt = args.get(1);
            args.get(0).asTable().setMetatable(mt.isNil() ? null : mt.asTable());
            return List.of(args.get(0));
        });
        return lua;
    }

    private static Operators operators() {
        return new Interpreter(new ExecutionState(), new Environment()).operators();
    }

    @Test
    void arithmetic_on_numbers() {
        List<Value> out = engine().eval("return 5 % 3, -5 % 3, 5.5 % 2, 2 ^ 3 ^ 2, -2 ^ 2, 2 ^ -1, 7 / 2");
        assertEquals(2.0, out.get(0).asNumber(), 0.0);
        assertEquals(1.0, out.get(1).asNumber(), 0.0);
        assertEquals(1.5, out.get(2).asNumber(), 0.0);
        assertEquals(512.0, out.get(3).asNumber(), 0.0);
        assertEquals(-4.0, out.get(4).asNumber(), 0.0);
        assertEquals(0.5, out.get(5).asNumber(), 0.0);
        assertEquals(3.5, out.get(6).asNumber(), 0.0);
    }

    @Test
    void strings_do_not_coerce_in_arithmetic() {
        LuaRuntimeException ex = assertThrows(LuaRuntimeException.class, () -> engine().eval("return \"1\" + 1"));
        assertEquals(LuaRuntimeException.Kind.OPERATION_UNSUPPORTED, ex.getKind());
        assertEquals("cannot add string '1' and number 1", ex.getMessage());
    }

    @Test
    void string_comparison_is_lexicographic() {
        List<Value> out = engine().eval("return \"a\" < \"b\", \"abc\" <= \"abc\", \"b\" > \"abc\"");
        assertTrue(out.get(0).asBool());
        assertTrue(out.get(1).asBool());
        assertTrue(out.get(2).asBool());
    }

    @Test
    void arithmetic_metamethods() {
        String src = String.join("\n",
            "local V = {};",
            "V.__add = function(a, b) return setmetatable({x = a.x + b.x}, V) end;",
            "V.__unm = function(a) return setmetatable({x = -a.x}, V) end;",
            "V.__len = function(a) return 99 end;",
            "local p = setmetatable({x = 1}, V);",
            "local q = setmetatable({x = 2}, V);",
            "return (p + q).x, (-p).x, #p"
        );
        List<Value> out = engine().eval(src);
        assertEquals(3.0, out.get(0).asNumber(), 0.0);
        assertEquals(-1.0, out.get(1).asNumber(), 0.0);
        assertEquals(99.0, out.get(2).asNumber(), 0.0);
    }

    @Test
    void second_operand_handler_is_used_when_first_has_none() {
        String src = String.join("\n",
            "local mt = {__mul = function(a, b) return \"mul\" end, __concat = function(a, b) return \"cat\" end};",
            "local t = setmetatable({}, mt);",
            "return 2 * t, \"x\" .. t, t .. \"x\""
        );
        List<Value> out = engine().eval(src);
        assertEquals("mul", out.get(0).asString());
        assertEquals("cat", out.get(1).asString());
        assertEquals("cat", out.get(2).asString());
    }

    @Test
    void le_falls_back_to_lt() {
        String src = String.join("\n",
            "local mt = {};",
            "mt.__lt = function(a, b) return a.v < b.v end;",
            "local x = setmetatable({v = 1}, mt);",
            "local y = setmetatable({v = 2}, mt);",
            "return x <= y, y <= x, x >= y, x > y, x < y"
        );
        List<Value> out = engine().eval(src);
        assertTrue(out.get(0).asBool());
        assertFalse(out.get(1).asBool());
        assertFalse(out.get(2).asBool());
        assertFalse(out.get(3).asBool());
        assertTrue(out.get(4).asBool());
    }

    @Test
    void eq_requires_same_handler_on_both_sides() {
        String src = String.join("\n",
            "local always = function(a, b) return true end;",
            "local m1 = {__eq = always};",
            "local m2 = {__eq = always};",
            "local m3 = {__eq = function(a, b) return true end};",
            "local a = setmetatable({}, m1);",
            "local b = setmetatable({}, m2);",
            "local c = setmetatable({}, m3);",
            "return a == b, a == c, a ~= c, {} == {}, a == 1"
        );
        List<Value> out = engine().eval(src);
        assertTrue(out.get(0).asBool());
        assertFalse(out.get(1).asBool());
        assertTrue(out.get(2).asBool());
        assertFalse(out.get(3).asBool());
        assertFalse(out.get(4).asBool());
    }

    @Test
    void index_chain_through_tables() {
        String src = String.join("\n",
            "local base = {greet = \"hi\"};",
            "local mid = setmetatable({}, {__index = base});",
            "local obj = setmetatable({}, {__index = mid});",
            "return obj.greet, obj.missing"
        );
        List<Value> out = engine().eval(src);
        assertEquals("hi", out.get(0).asString());
        assertTrue(out.get(1).isNil());
    }

    @Test
    void index_function_receives_table_and_key() {
        List<Value> out = engine().eval(
            "return setmetatable({}, {__index = function(t, k) return k .. \"!\" end}).foo");
        assertEquals("foo!", out.get(0).asString());
    }

    @Test
    void newindex_only_for_absent_keys() {
        String src = String.join("\n",
            "local store = {};",
            "local t = setmetatable({present = 1}, {__newindex = store});",
            "t.present = 2;",
            "t.absent = 3;",
            "return t.present, store.absent, t.absent"
        );
        List<Value> out = engine().eval(src);
        assertEquals(2.0, out.get(0).asNumber(), 0.0);
        assertEquals(3.0, out.get(1).asNumber(), 0.0);
        assertTrue(out.get(2).isNil());
    }

    @Test
    void newindex_function_is_called() {
        String src = String.join("\n",
            "local seen = {};",
            "local t = setmetatable({}, {__newindex = function(t, k, v) seen[k] = v * 2 end});",
            "t.a = 21;",
            "return seen.a, t.a"
        );
        List<Value> out = engine().eval(src);
        assertEquals(42.0, out.get(0).asNumber(), 0.0);
        assertTrue(out.get(1).isNil());
    }

    @Test
    void cyclic_index_chain_is_cut_off() {
        LunarScript lua = engine();
        lua.setMaxIndexChainDepth(5);
        String src = String.join("\n",
            "local t = {};",
            "setmetatable(t, {__index = t});",
            "return t.x"
        );
        LuaRuntimeException ex = assertThrows(LuaRuntimeException.class, () -> lua.eval(src));
        assertEquals(LuaRuntimeException.Kind.INDEX_CHAIN_TOO_DEEP, ex.getKind());
    }

    @Test
    void call_metamethod_gets_self_first() {
        String src = String.join("\n",
            "local f = setmetatable({k = 2}, {__call = function(self, a) return a * self.k end});",
            "return f(21)"
        );
        assertEquals(42.0, engine().eval(src).get(0).asNumber(), 0.0);
    }

    @Test
    void kind_metatables_are_per_engine() {
        LunarScript lua = engine();
        LuaTable strings = new LuaTable();
        strings.rawSet("upper", Value.function(args -> List.of(Value.string(args.get(0).asString().toUpperCase()))));
        lua.metatables().stringMetatable().rawSet("__index", Value.table(strings));

        assertEquals("ABC", lua.eval("return (\"abc\"):upper()").get(0).asString());

        LuaRuntimeException ex = assertThrows(LuaRuntimeException.class,
            () -> engine().eval("return (\"abc\"):upper()"));
        assertEquals(LuaRuntimeException.Kind.CANNOT_INDEX, ex.getKind());
    }

    @Test
    void number_metatable_handles_mixed_arithmetic() {
        LunarScript lua = engine();
        lua.metatables().numberMetatable().rawSet("__add",
            Value.function(args -> List.of(Value.string("added"))));
        assertEquals("added", lua.eval("return 1 + true").get(0).asString());
    }

    @Test
    void direct_operator_calls() {
        Operators ops = operators();
        assertTrue(ops.eq(Value.number(0.0), Value.number(-0.0)));
        assertFalse(ops.eq(Value.number(Double.NaN), Value.number(Double.NaN)));
        assertTrue(ops.ge(Value.number(2), Value.number(2)));
        assertFalse(ops.gt(Value.string("a"), Value.string("b")));
        assertEquals(3.0, ops.len(Value.string("abc")).asNumber(), 0.0);
        assertEquals("1.5x", ops.concat(Value.number(1.5), Value.string("x")).asString());

        LuaRuntimeException ex = assertThrows(LuaRuntimeException.class,
            () -> ops.lt(Value.number(1), Value.string("2")));
        assertEquals(LuaRuntimeException.Kind.CANNOT_COMPARE, ex.getKind());
    }

    @Test
    void greater_than_is_not_less_or_equal() {
        String src = String.join("\n",
            "local mt = {};",
            "mt.__le = function(a, b) return a.v <= b.v end;",
            "local x = setmetatable({v = 1}, mt);",
            "local y = setmetatable({v = 2}, mt);",
            "return y > x, x > y, x <= y"
        );
        List<Value> out = engine().eval(src);
        assertTrue(out.get(0).asBool());
        assertFalse(out.get(1).asBool());
        assertTrue(out.get(2).asBool());
    }

    @Test
    void greater_or_equal_is_not_less_than() {
        String src = String.join("\n",
            "local mt = {__lt = function(a, b) return a.v < b.v end};",
            "local x = setmetatable({v = 1}, mt);",
            "local y = setmetatable({v = 2}, mt);",
            "return y >= x, x >= y"
        );
        List<Value> out = engine().eval(src);
        assertTrue(out.get(0).asBool());
        assertFalse(out.get(1).asBool());
    }

    @Test
    void nan_comparisons() {
        List<Value> out = engine().eval("local n = 0 / 0; return n > 1, n >= 1, n < 1, n == n, n ~= n");
        assertTrue(out.get(0).asBool());
        assertTrue(out.get(1).asBool());
        assertFalse(out.get(2).asBool());
        assertFalse(out.get(3).asBool());
        assertTrue(out.get(4).asBool());

        Value nan = Value.number(Double.NaN);
        assertFalse(operators().eq(nan, nan));
    }
}
