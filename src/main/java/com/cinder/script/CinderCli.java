package com.cinder.script;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.cinder.debug.Debug;
import com.cinder.debug.DebugLevel;
import com.cinder.debug.DebugSink;
import com.cinder.debug.StreamDebugSink;
import com.cinder.script.parser.Interpreter;
import com.cinder.script.parser.Lexer;
import com.cinder.script.parser.Parser;
import com.cinder.script.parser.Statement.Stmt;
import com.cinder.script.parser.Token;
import com.cinder.script.print.AstJson;
import com.cinder.script.print.AstPrinter;
import com.cinder.script.print.TokenPrinter;
import com.cinder.script.print.TracePrinter;

/**
 * Command line runner:
 *   CinderCli app.cn
 *   CinderCli app.cn --tokens --json
 *   CinderCli app.cn --ast
 *   CinderCli app.cn --trace --verbose --max-depth=64
 */
public final class CinderCli {

    private static final String TAG = "CinderCli";

    static final int EXIT_OK = 0;
    static final int EXIT_SCRIPT_ERROR = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_IO = 3;

    private static final String USAGE =
            "Usage: CinderCli <script-file> [--tokens|--ast] [--json] [--trace] [--verbose] [--max-depth=N]";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    public static int run(String[] args, PrintStream out, PrintStream err) {
        List<String> positional = new ArrayList<>();
        Map<String, String> flags = parseArgs(args, positional);

        if (positional.size() != 1 || (flags.containsKey("tokens") && flags.containsKey("ast"))) {
            err.println(USAGE);
            return EXIT_USAGE;
        }

        Integer maxDepth = null;
        if (flags.containsKey("max-depth")) {
            try {
                maxDepth = Integer.parseInt(flags.get("max-depth"));
            } catch (NumberFormatException e) {
                maxDepth = -1;
            }
            if (maxDepth < 1) {
                err.println("Invalid --max-depth: " + flags.get("max-depth"));
                err.println(USAGE);
                return EXIT_USAGE;
            }
        }

        DebugSink previousSink = Debug.get().getSink();
        if (flags.containsKey("verbose")) {
            Debug.get().setSink(new StreamDebugSink(err, DebugLevel.DEBUG));
        }
        try {
            final Path scriptPath = Path.of(positional.get(0));
            final String script;
            try {
                script = Files.readString(scriptPath, StandardCharsets.UTF_8);
            } catch (IOException e) {
                Debug.get().e(TAG, "read failed: " + scriptPath, e);
                err.println("Failed to read script file: " + scriptPath);
                return EXIT_IO;
            }

            Debug.get().i(TAG, "running " + scriptPath + " with flags " + flags.keySet());
            return execute(script, flags, maxDepth, out, err);
        } finally {
            Debug.get().setSink(previousSink);
        }
    }

    private static int execute(String script, Map<String, String> flags, Integer maxDepth,
                               PrintStream out, PrintStream err) {
        boolean json = flags.containsKey("json");

        Lexer lexer = new Lexer(script);
        List<Token> tokens = lexer.scanTokens();
        if (!lexer.errors().isEmpty()) {
            return reportErrors("lex", lexer.errors(), json, err);
        }
        if (flags.containsKey("tokens")) {
            out.print(json ? AstJson.pretty(AstJson.tokens(tokens)) + "\n" : TokenPrinter.print(tokens));
            return EXIT_OK;
        }

        Parser parser = new Parser(tokens);
        List<Stmt> program = parser.parse();
        if (!parser.errors().isEmpty()) {
            return reportErrors("parse", parser.errors(), json, err);
        }
        if (flags.containsKey("ast")) {
            out.print(json ? AstJson.pretty(AstJson.program(program)) + "\n" : AstPrinter.print(program));
            return EXIT_OK;
        }

        CinderScript engine = new CinderScript();
        engine.setOutput(out);
        if (maxDepth != null) engine.setMaxCallDepth(maxDepth);
        if (flags.containsKey("trace")) engine.setTraceHook(new TracePrinter(err));

        Interpreter interpreter = engine.newInterpreter();
        interpreter.interpret(program);
        if (!interpreter.errors().isEmpty()) {
            return reportErrors("runtime", interpreter.errors(), json, err);
        }
        return EXIT_OK;
    }

    private static int reportErrors(String stage, List<String> errors, boolean json, PrintStream err) {
        if (json) {
            err.println(AstJson.pretty(AstJson.errors(stage, errors)));
        } else {
            for (String e : errors) err.println(e);
        }
        return EXIT_SCRIPT_ERROR;
    }

    /**
     * Minimal arg parser:
     *   --max-depth=64   valued flag
     *   --ast            boolean flag
     *   anything else    positional
     */
    private static Map<String, String> parseArgs(String[] args, List<String> positional) {
        Map<String, String> out = new HashMap<>();
        for (String a : args) {
            if (a.startsWith("--") && a.contains("=")) {
                int i = a.indexOf('=');
                out.put(a.substring(2, i), a.substring(i + 1));
            } else if (a.startsWith("--")) {
                out.put(a.substring(2), "true");
            } else {
                positional.add(a);
            }
        }
        return out;
    }

    private CinderCli() {}
}
