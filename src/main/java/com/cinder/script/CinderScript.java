package com.cinder.script;

import java.io.PrintStream;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.cinder.debug.Debug;
import com.cinder.script.parser.Builtin;
import com.cinder.script.parser.BuiltinFunction;
import com.cinder.script.parser.Builtins;
import com.cinder.script.parser.Interpreter;
import com.cinder.script.parser.Lexer;
import com.cinder.script.parser.Parser;
import com.cinder.script.parser.Statement.Block;
import com.cinder.script.parser.Statement.FnStmt;
import com.cinder.script.parser.Statement.If;
import com.cinder.script.parser.Statement.Stmt;
import com.cinder.script.parser.Statement.While;
import com.cinder.script.parser.Token;
import com.cinder.script.parser.TraceHook;
import com.cinder.script.parser.Value;

/**
 * Core Cinder engine: lexer -> parser -> interpreter.
 *
 * - C-like syntax (let / fn / if / else / while / break / continue / return)
 * - Types: number (32-bit int), bool, nil, function, builtin
 * - Each stage reports its own errors; a later stage only runs when the earlier one
 *   produced none
 * - Builtins: print, assert, plus whatever the host registers
 */
public class CinderScript {
    private static final String TAG = "CinderScript";

    private final Map<String, Builtin> functions = new LinkedHashMap<>();
    private PrintStream out = System.out;
    private int maxCallDepth = Interpreter.DEFAULT_MAX_CALL_DEPTH;
    private TraceHook traceHook;

    public CinderScript() {}

    public void setOutput(PrintStream out) {
        if (out == null) throw new IllegalArgumentException("output stream must not be null");
        this.out = out;
    }

    public void setMaxCallDepth(int depth) {
        if (depth < 1) throw new IllegalArgumentException("max call depth must be positive: " + depth);
        this.maxCallDepth = depth;
    }

    public int getMaxCallDepth() { return maxCallDepth; }

    public void setTraceHook(TraceHook hook) { this.traceHook = hook; }

    public void registerFunction(String name, int arity, BuiltinFunction fn) {
        register(new Builtin(name, arity, fn));
    }

    public void registerVariadicFunction(String name, BuiltinFunction fn) {
        register(Builtin.variadic(name, fn));
    }

    private void register(Builtin builtin) {
        if (Builtins.CORE_NAMES.contains(builtin.name)) {
            throw new IllegalArgumentException("Function name conflicts with core builtin: " + builtin.name);
        }
        if (Lexer.isKeyword(builtin.name)) {
            throw new IllegalArgumentException("Function name is a keyword: " + builtin.name);
        }
        functions.put(builtin.name, builtin);
    }

    public RunResult run(String source) {
        return execute(source, null, null).run();
    }

    /**
     * Runs the top level, then calls the user function {@code entryFunctionName}.
     * The entry call is skipped when an earlier stage failed.
     */
    public EntryRunResult runWithEntry(String source, String entryFunctionName, List<Value> entryArgs) {
        if (entryFunctionName == null || entryFunctionName.trim().isEmpty()) {
            throw new IllegalArgumentException("entryFunctionName must not be empty");
        }
        return execute(source, entryFunctionName, entryArgs == null ? Collections.emptyList() : entryArgs);
    }

    private EntryRunResult execute(String source, String entry, List<Value> entryArgs) {
        if (source == null) throw new IllegalArgumentException("source must not be null");

        Lexer lexer = new Lexer(source);
        List<Token> tokens = lexer.scanTokens();
        if (!lexer.errors().isEmpty()) {
            Debug.get().d(TAG, "lexing failed with " + lexer.errors().size() + " errors");
            return new EntryRunResult(new RunResult(RunResult.Stage.LEX, lexer.errors(), null), null);
        }

        Parser parser = new Parser(tokens);
        List<Stmt> program = parser.parse();
        if (!parser.errors().isEmpty()) {
            Debug.get().d(TAG, "parsing failed with " + parser.errors().size() + " errors");
            return new EntryRunResult(new RunResult(RunResult.Stage.PARSE, parser.errors(), null), null);
        }

        Interpreter interpreter = newInterpreter();
        interpreter.interpret(program);

        Value value = null;
        if (entry != null && interpreter.errors().isEmpty()) {
            value = interpreter.invoke(entry, entryArgs);
        }

        List<String> errors = interpreter.errors();
        RunResult.Stage failed = errors.isEmpty() ? null : RunResult.Stage.RUNTIME;
        Debug.get().d(TAG, "run finished: " + (failed == null ? "ok" : errors.size() + " runtime error(s)"));
        return new EntryRunResult(new RunResult(failed, errors, interpreter.globals().snapshot()), value);
    }

    /** A fresh interpreter carrying this engine's builtins and settings. */
    public Interpreter newInterpreter() {
        Interpreter interpreter = new Interpreter(out);
        interpreter.setMaxCallDepth(maxCallDepth);
        interpreter.setTraceHook(traceHook);
        for (Builtin b : functions.values()) interpreter.defineBuiltin(b);
        return interpreter;
    }

    /**
     * Parse-only check for a {@code fn <name>} declaration anywhere in the program.
     * Nothing is executed.
     */
    public boolean hasUserFunction(String source, String fnName) {
        if (source == null) return false;
        if (fnName == null || fnName.trim().isEmpty()) return false;
        return userFunctionNames(source).contains(fnName);
    }

    public static Set<String> userFunctionNames(String source) {
        Lexer lexer = new Lexer(source);
        Parser parser = new Parser(lexer.scanTokens());
        Set<String> out = new HashSet<>();
        collectFunctionNames(parser.parse(), out);
        return out;
    }

    private static void collectFunctionNames(List<Stmt> program, Set<String> out) {
        for (Stmt s : program) {
            if (s instanceof FnStmt) {
                FnStmt fn = (FnStmt) s;
                out.add(fn.name.lexeme);
                collectFunctionNames(fn.body, out);
            } else if (s instanceof Block) {
                collectFunctionNames(((Block) s).statements, out);
            } else if (s instanceof If) {
                If is = (If) s;
                collectFunctionNames(Collections.singletonList(is.thenBranch), out);
                if (is.elseBranch != null) collectFunctionNames(Collections.singletonList(is.elseBranch), out);
            } else if (s instanceof While) {
                collectFunctionNames(Collections.singletonList(((While) s).body), out);
            }
            // ExprStmt / LetStmt / ReturnStmt / BreakStmt / ContinueStmt: nothing to collect
        }
    }
}
