import com.lunar.script.parser.LuaTable;
import com.lunar.script.parser.Value;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ValueTest {

    @Test
    void canonical_number_strings() {
        assertEquals("3", Value.numberToString(3.0));
        assertEquals("-0.5", Value.numberToString(-0.5));
        assertEquals("0.33333333333333", Value.numberToString(1.0 / 3));
        assertEquals("nan", Value.numberToString(Double.NaN));
        assertEquals("inf", Value.numberToString(Double.POSITIVE_INFINITY));
    }

    @Test
    void truthiness() {
        assertFalse(Value.NIL.isTruthy());
        assertFalse(Value.FALSE.isTruthy());
        assertTrue(Value.number(0).isTruthy());
        assertTrue(Value.string("").isTruthy());
    }

    @Test
    void raw_equality_and_hashing() {
        assertEquals(Value.number(0.0), Value.number(-0.0));
        assertEquals(Value.number(0.0).hashCode(), Value.number(-0.0).hashCode());
        assertEquals(Value.string("a"), Value.string("a"));
        assertNotEquals(Value.table(new LuaTable()), Value.table(new LuaTable()));
        assertNotEquals(Value.number(1), Value.string("1"));
    }

    @Test
    void accessors_check_the_type() {
        assertThrows(IllegalStateException.class, () -> Value.string("x").asNumber());
        assertThrows(IllegalStateException.class, () -> Value.NIL.asTable());
        assertEquals("nil", Value.NIL.typeName());
        assertEquals("function", Value.function(args -> List.of()).typeName());
    }

    @Test
    void table_keys_normalize_and_nil_removes() {
        LuaTable t = LuaTable.of(List.of(Value.string("a"), Value.string("b")));
        assertEquals("a", t.rawGet(1).asString());
        assertEquals(2, t.length());

        t.rawSet(1, Value.NIL);
        assertFalse(t.containsKey(Value.number(1)));
        assertEquals(0, t.length());
        assertEquals(1, t.size());
    }

    @Test
    void next_walks_insertion_order() {
        LuaTable t = new LuaTable();
        t.rawSet("b", Value.number(1));
        t.rawSet("a", Value.number(2));

        Map.Entry<Value, Value> first = t.next(Value.NIL);
        assertEquals("b", first.getKey().asString());
        Map.Entry<Value, Value> second = t.next(first.getKey());
        assertEquals("a", second.getKey().asString());
        assertNull(t.next(second.getKey()));
        assertNull(t.next(Value.string("missing")));
    }
}
