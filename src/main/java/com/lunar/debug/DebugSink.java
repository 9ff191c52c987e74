package com.lunar.debug;

/** Pluggable debug output target (stdout, file, host logger, test recorder). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
