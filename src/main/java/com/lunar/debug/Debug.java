package com.lunar.debug;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Debug hub shared by the scanner, parser and interpreter.
 *
 * - Singleton access via Debug.get()
 * - Pluggable sink via setSink(...)
 * - Silent until a host installs a sink
 */
public final class Debug {

    // must be assigned before INSTANCE is constructed
    private static final DebugSink NOOP = (level, tag, message, error) -> { };

    private static final Debug INSTANCE = new Debug();

    private final AtomicReference<DebugSink> sinkRef = new AtomicReference<>(NOOP);
    private volatile DebugLevel threshold = DebugLevel.TRACE;

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    public void setSink(DebugSink sink) {
        sinkRef.set(sink == null ? NOOP : sink);
    }

    public DebugSink getSink() {
        return sinkRef.get();
    }

    /** Messages below this level are dropped before reaching the sink. */
    public void setThreshold(DebugLevel level) {
        this.threshold = (level == null) ? DebugLevel.TRACE : level;
    }

    public boolean isEnabled(DebugLevel level) {
        return sinkRef.get() != NOOP && level.ordinal() >= threshold.ordinal();
    }

    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO,  tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }
    public void w(String tag, String msg, Throwable err) { log(DebugLevel.WARN, tag, msg, err); }
    public void e(String tag, String msg) { log(DebugLevel.ERROR, tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (!isEnabled(level)) return;
        sinkRef.get().log(level, tag, message, error);
    }
}
