package com.cinder.script;

import com.cinder.script.parser.Value;

public class EntryRunResult {
    private final RunResult run;
    private final Value value;

    public EntryRunResult(RunResult run, Value value) {
        this.run = run;
        this.value = value;
    }

    public RunResult run() { return run; }

    /** Return value of the entry function; null if the run or the call failed. */
    public Value value() { return value; }
}
