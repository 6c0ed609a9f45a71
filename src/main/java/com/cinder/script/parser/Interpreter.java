package com.cinder.script.parser;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.cinder.debug.Debug;
import com.cinder.script.parser.Expr.Assign;
import com.cinder.script.parser.Expr.Binary;
import com.cinder.script.parser.Expr.Call;
import com.cinder.script.parser.Expr.ExprNode;
import com.cinder.script.parser.Expr.ExprVisitor;
import com.cinder.script.parser.Expr.Grouping;
import com.cinder.script.parser.Expr.Identifier;
import com.cinder.script.parser.Expr.Literal;
import com.cinder.script.parser.Expr.Unary;
import com.cinder.script.parser.Statement.Block;
import com.cinder.script.parser.Statement.BreakStmt;
import com.cinder.script.parser.Statement.ContinueStmt;
import com.cinder.script.parser.Statement.ExprStmt;
import com.cinder.script.parser.Statement.FnStmt;
import com.cinder.script.parser.Statement.If;
import com.cinder.script.parser.Statement.LetStmt;
import com.cinder.script.parser.Statement.ReturnStmt;
import com.cinder.script.parser.Statement.Stmt;
import com.cinder.script.parser.Statement.StmtVisitor;
import com.cinder.script.parser.Statement.While;

/**
 * Tree-walking evaluator.
 *
 * Statements return an {@link ExecSignal}; break, continue and return travel as
 * values and are consumed by the nearest loop or call. Runtime faults are
 * {@link RuntimeError}s: the first one ends the current {@link #interpret} call and
 * is recorded in {@link #errors()}.
 */
public class Interpreter implements ExprVisitor<Value>, StmtVisitor<ExecSignal> {
    private static final String TAG = "Interpreter";
    public static final int DEFAULT_MAX_CALL_DEPTH = 4096;

    private final Environment globals = new Environment();
    private final List<String> errors = new ArrayList<>();
    Environment env = globals;

    private int loopDepth = 0;
    private int functionDepth = 0;
    private int callDepth = 0;
    private int maxCallDepth = DEFAULT_MAX_CALL_DEPTH;
    private TraceHook traceHook;
    private Value lastExprValue;

    public Interpreter() {
        this(System.out);
    }

    public Interpreter(PrintStream out) {
        Builtins.registerAll(globals, out);
    }

    public void interpret(List<Stmt> program) {
        errors.clear();
        Stmt current = null;
        try {
            for (Stmt stmt : program) {
                if (stmt == null) continue;
                current = stmt;
                execute(stmt);
            }
        } catch (RuntimeError e) {
            recordError(e);
        } catch (StackOverflowError e) {
            // deep expression trees outside any call; calls are handled in callFunction
            resetDepths();
            recordError(new RuntimeError(current.span(), "Evaluation nested too deeply."));
        }
    }

    /**
     * Host entry point: calls a global user function with already-built values. Errors
     * are appended to {@link #errors()} (previous ones are kept) and null is returned.
     */
    public Value invoke(String name, List<Value> args) {
        if (!globals.exists(name) || globals.get(name).getType() != Value.Type.FUNCTION) {
            throw new IllegalArgumentException("No global function named '" + name + "'");
        }
        UserFunction fn = globals.get(name).asFunction();
        List<Value> actual = (args == null) ? Collections.emptyList() : args;
        if (fn.arity() != actual.size()) {
            throw new IllegalArgumentException(name + "() expects " + fn.arity() + " arguments, got " + actual.size());
        }
        Span at = fn.declaration.name.span;
        try {
            return callFunction(fn, actual, at);
        } catch (RuntimeError e) {
            recordError(e);
            return null;
        } catch (StackOverflowError e) {
            resetDepths();
            recordError(new RuntimeError(at, "Evaluation nested too deeply."));
            return null;
        }
    }

    public List<String> errors() {
        return Collections.unmodifiableList(errors);
    }

    public Environment globals() { return globals; }

    public void defineBuiltin(Builtin builtin) {
        if (globals.existsInCurrentScope(builtin.name)) {
            throw new IllegalArgumentException("Global already defined: " + builtin.name);
        }
        globals.define(builtin.name, Value.builtin(builtin));
    }

    public void setMaxCallDepth(int depth) {
        if (depth < 1) throw new IllegalArgumentException("max call depth must be positive: " + depth);
        this.maxCallDepth = depth;
    }

    public void setTraceHook(TraceHook hook) { this.traceHook = hook; }

    private void resetDepths() {
        env = globals;
        loopDepth = 0;
        functionDepth = 0;
        callDepth = 0;
    }

    private void recordError(RuntimeError e) {
        String msg = e.formatted();
        Debug.get().w(TAG, "runtime error: " + msg);
        errors.add(msg);
    }

    // -------------------------
    // Statements
    // -------------------------

    ExecSignal execute(Stmt stmt) {
        lastExprValue = null;
        ExecSignal signal = stmt.accept(this);
        if (traceHook != null) traceHook.onStatement(stmt, (stmt instanceof ExprStmt) ? lastExprValue : null);
        return signal;
    }

    ExecSignal executeBlock(List<Stmt> statements, Environment scope) {
        Environment previous = env;
        env = scope;
        try {
            for (Stmt s : statements) {
                ExecSignal signal = execute(s);
                if (!signal.isNormal()) return signal;
            }
            return ExecSignal.NORMAL;
        } finally {
            env = previous;
        }
    }

    public ExecSignal visitExprStmt(ExprStmt stmt) {
        Value v = eval(stmt.expression);
        lastExprValue = v;
        return ExecSignal.NORMAL;
    }

    public ExecSignal visitLetStmt(LetStmt stmt) {
        Value value = eval(stmt.initializer);
        String name = stmt.name.lexeme;
        if (env.existsInCurrentScope(name)) {
            throw new RuntimeError(stmt.name.span, "Variable already declared in this scope: '" + name + "'.");
        }
        env.define(name, value);
        return ExecSignal.NORMAL;
    }

    public ExecSignal visitBlockStmt(Block stmt) {
        return executeBlock(stmt.statements, env.childScope());
    }

    public ExecSignal visitIfStmt(If stmt) {
        if (expectBool(eval(stmt.condition), stmt.condition.span(), "if condition")) {
            return execute(stmt.thenBranch);
        }
        if (stmt.elseBranch != null) return execute(stmt.elseBranch);
        return ExecSignal.NORMAL;
    }

    public ExecSignal visitWhileStmt(While stmt) {
        loopDepth++;
        try {
            while (expectBool(eval(stmt.condition), stmt.condition.span(), "while condition")) {
                ExecSignal signal = execute(stmt.body);
                if (signal.kind == ExecSignal.Kind.BREAK) break;
                if (signal.kind == ExecSignal.Kind.RETURN) return signal;
            }
            return ExecSignal.NORMAL;
        } finally {
            loopDepth--;
        }
    }

    public ExecSignal visitBreakStmt(BreakStmt stmt) {
        if (loopDepth == 0) throw new RuntimeError(stmt.span, "Break used outside of a loop.");
        return ExecSignal.BREAK;
    }

    public ExecSignal visitContinueStmt(ContinueStmt stmt) {
        if (loopDepth == 0) throw new RuntimeError(stmt.span, "Continue used outside of a loop.");
        return ExecSignal.CONTINUE;
    }

    public ExecSignal visitReturnStmt(ReturnStmt stmt) {
        if (functionDepth == 0) throw new RuntimeError(stmt.span, "Return used outside of a function.");
        return ExecSignal.returning(stmt.value == null ? Value.nil() : eval(stmt.value));
    }

    public ExecSignal visitFnStmt(FnStmt stmt) {
        String name = stmt.name.lexeme;
        if (env.existsInCurrentScope(name)) {
            throw new RuntimeError(stmt.name.span, "Function already declared in this scope: '" + name + "'.");
        }
        // the closure is the live scope, so later updates to captured names stay visible
        env.define(name, Value.function(new UserFunction(stmt, env)));
        return ExecSignal.NORMAL;
    }

    // -------------------------
    // Expressions
    // -------------------------

    private Value eval(ExprNode expr) { return expr.accept(this); }

    public Value visitLiteralExpr(Literal expr) {
        return Value.fromLiteral(expr.value);
    }

    public Value visitIdentifierExpr(Identifier expr) {
        String name = expr.name.lexeme;
        if (!env.exists(name)) {
            throw new RuntimeError(expr.span, "Undefined identifier '" + name + "'.");
        }
        return env.get(name);
    }

    public Value visitGroupingExpr(Grouping expr) {
        return eval(expr.expression);
    }

    public Value visitUnaryExpr(Unary expr) {
        Value right = eval(expr.right);
        switch (expr.operator.type) {
            case MINUS:
                return Value.number(-expectNumber(right, expr.operator.span, "unary minus"));
            case BANG:
                return Value.bool(!expectBool(right, expr.operator.span, "logical not"));
            default:
                throw new RuntimeError(expr.operator.span, "Unsupported unary operator.");
        }
    }

    public Value visitBinaryExpr(Binary expr) {
        TokenType op = expr.operator.type;

        // short-circuit: the right operand is only evaluated when it decides the result
        if (op == TokenType.AND_AND) {
            if (!expectBool(eval(expr.left), expr.left.span(), "logical and")) return Value.bool(false);
            return Value.bool(expectBool(eval(expr.right), expr.right.span(), "logical and"));
        }
        if (op == TokenType.OR_OR) {
            if (expectBool(eval(expr.left), expr.left.span(), "logical or")) return Value.bool(true);
            return Value.bool(expectBool(eval(expr.right), expr.right.span(), "logical or"));
        }

        Value left = eval(expr.left);
        Value right = eval(expr.right);
        Span at = expr.operator.span;

        switch (op) {
            case PLUS:
                return Value.number(expectNumber(left, at, "addition") + expectNumber(right, at, "addition"));
            case MINUS:
                return Value.number(expectNumber(left, at, "subtraction") - expectNumber(right, at, "subtraction"));
            case STAR:
                return Value.number(expectNumber(left, at, "multiplication") * expectNumber(right, at, "multiplication"));
            case SLASH: {
                // denominator first: `true / 0` reports the division by zero
                int denominator = expectNumber(right, at, "division");
                if (denominator == 0) throw new RuntimeError(at, "Division by zero.");
                return Value.number(expectNumber(left, at, "division") / denominator);
            }

            case GREATER:
                return Value.bool(expectNumber(left, at, "comparison") > expectNumber(right, at, "comparison"));
            case GREATER_EQUAL:
                return Value.bool(expectNumber(left, at, "comparison") >= expectNumber(right, at, "comparison"));
            case LESS:
                return Value.bool(expectNumber(left, at, "comparison") < expectNumber(right, at, "comparison"));
            case LESS_EQUAL:
                return Value.bool(expectNumber(left, at, "comparison") <= expectNumber(right, at, "comparison"));

            case EQUAL_EQUAL:
                return Value.bool(left.isEqual(right));
            case BANG_EQUAL:
                return Value.bool(!left.isEqual(right));

            default:
                throw new RuntimeError(at, "Unsupported binary operator.");
        }
    }

    public Value visitAssignExpr(Assign expr) {
        Value value = eval(expr.value);
        String name = expr.name.lexeme;
        if (!env.exists(name)) {
            throw new RuntimeError(expr.name.span, "Undefined variable '" + name + "'.");
        }
        env.assign(name, value);
        return value;
    }

    public Value visitCallExpr(Call expr) {
        Value callee = eval(expr.callee);
        int argc = expr.arguments.size();

        if (callee.getType() == Value.Type.BUILTIN) {
            Builtin builtin = callee.asBuiltin();
            if (!builtin.isVariadic() && argc != builtin.arity) {
                throw arityError(expr, builtin.arity);
            }
            return callBuiltin(builtin, evalArguments(expr), expr.span);
        }

        if (callee.getType() != Value.Type.FUNCTION) {
            throw new RuntimeError(expr.span, "Can only call functions or builtins.");
        }

        UserFunction fn = callee.asFunction();
        if (argc != fn.arity()) throw arityError(expr, fn.arity());
        return callFunction(fn, evalArguments(expr), expr.span);
    }

    private List<Value> evalArguments(Call expr) {
        List<Value> args = new ArrayList<>(expr.arguments.size());
        for (ExprNode arg : expr.arguments) args.add(eval(arg));
        return args;
    }

    private RuntimeError arityError(Call expr, int expected) {
        return new RuntimeError(expr.paren.span,
                "Expected " + expected + " arguments but got " + expr.arguments.size() + ".");
    }

    private Value callBuiltin(Builtin builtin, List<Value> args, Span at) {
        try {
            return builtin.call(args);
        } catch (RuntimeError e) {
            throw e;
        } catch (RuntimeException e) {
            // host code reports with plain exceptions; anchor them at the call site
            String msg = (e.getMessage() == null) ? e.toString() : e.getMessage();
            throw new RuntimeError(at, msg);
        }
    }

    private Value callFunction(UserFunction fn, List<Value> args, Span at) {
        if (callDepth >= maxCallDepth) throw new RuntimeError(at, "Max call depth exceeded.");
        if (Debug.get().enabled()) Debug.get().t(TAG, "call " + fn + " at depth " + callDepth);
        try {
            return fn.call(this, args);
        } catch (StackOverflowError e) {
            // the Java stack ran out before the configured limit
            throw new RuntimeError(at, "Max call depth exceeded.");
        }
    }

    /** Runs a function body in {@code frame}; loops of the caller are not visible inside it. */
    Value executeFunctionBody(UserFunction fn, Environment frame) {
        int savedLoopDepth = loopDepth;
        loopDepth = 0;
        functionDepth++;
        callDepth++;
        try {
            ExecSignal signal = executeBlock(fn.declaration.body, frame);
            return signal.kind == ExecSignal.Kind.RETURN ? signal.value : Value.nil();
        } finally {
            callDepth--;
            functionDepth--;
            loopDepth = savedLoopDepth;
        }
    }

    // -------------------------
    // Type checks
    // -------------------------

    private int expectNumber(Value value, Span at, String context) {
        if (value.getType() == Value.Type.NUMBER) return value.asNumber();
        throw new RuntimeError(at, "Expected number in " + context + ", got " + value.typeName() + ".");
    }

    private boolean expectBool(Value value, Span at, String context) {
        if (value.getType() == Value.Type.BOOL) return value.asBool();
        throw new RuntimeError(at, "Expected boolean in " + context + ", got " + value.typeName() + ".");
    }
}
