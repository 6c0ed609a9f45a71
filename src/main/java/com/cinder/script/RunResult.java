package com.cinder.script;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.cinder.script.parser.Value;

/** Outcome of one pipeline run: which stage failed (if any), its errors, and the final globals. */
public class RunResult {

    public enum Stage { LEX, PARSE, RUNTIME }

    private final Stage failedStage;
    private final List<String> errors;
    private final Map<String, Value> globals;

    RunResult(Stage failedStage, List<String> errors, Map<String, Value> globals) {
        this.failedStage = failedStage;
        this.errors = (errors == null) ? Collections.emptyList() : List.copyOf(errors);
        this.globals = (globals == null) ? Collections.emptyMap() : globals;
    }

    public boolean ok() { return failedStage == null; }

    /** Null when every stage succeeded. */
    public Stage failedStage() { return failedStage; }

    public List<String> errors() { return errors; }

    /** Global bindings after execution; empty when lexing or parsing failed. */
    public Map<String, Value> globals() { return globals; }
}
