package com.cinder.script.print;

import java.io.PrintStream;

import com.cinder.script.parser.Statement.Stmt;
import com.cinder.script.parser.TraceHook;
import com.cinder.script.parser.Value;

/** Trace hook that prints {@code Trace: <label>[ -> <value>]} per executed statement. */
public final class TracePrinter implements TraceHook {

    private final PrintStream out;

    public TracePrinter(PrintStream out) {
        this.out = out;
    }

    @Override
    public void onStatement(Stmt stmt, Value value) {
        StringBuilder sb = new StringBuilder("Trace: ").append(AstPrinter.label(stmt));
        if (value != null) sb.append(" -> ").append(value);
        out.println(sb);
    }
}
