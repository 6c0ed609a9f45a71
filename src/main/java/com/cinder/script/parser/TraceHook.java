package com.cinder.script.parser;

import com.cinder.script.parser.Statement.Stmt;

/** Observer called after each executed statement; {@code value} is set for expression statements only. */
@FunctionalInterface
public interface TraceHook {
    void onStatement(Stmt stmt, Value value);
}
