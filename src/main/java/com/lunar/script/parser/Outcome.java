package com.lunar.script.parser;

import java.util.Collections;
import java.util.List;

/**
 * How a statement finished: normally, by {@code break}, or by {@code return}
 * with its values. Loops consume BREAK, function activations consume RETURN;
 * every other statement hands the outcome up unchanged.
 */
public final class Outcome {
    public enum Kind { NORMAL, BREAK, RETURN }

    public static final Outcome NORMAL = new Outcome(Kind.NORMAL, Collections.emptyList());
    public static final Outcome BREAK = new Outcome(Kind.BREAK, Collections.emptyList());

    public final Kind kind;
    public final List<Value> values;

    private Outcome(Kind kind, List<Value> values) {
        this.kind = kind;
        this.values = values;
    }

    public static Outcome returning(List<Value> values) {
        return new Outcome(Kind.RETURN, Collections.unmodifiableList(values));
    }

    public boolean isNormal() { return kind == Kind.NORMAL; }
    public boolean isBreak() { return kind == Kind.BREAK; }
    public boolean isReturn() { return kind == Kind.RETURN; }

    @Override
    public String toString() {
        return isReturn() ? "RETURN" + values : kind.name();
    }
}
