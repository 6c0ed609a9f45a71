package com.cinder.script.parser;

import java.util.List;

import com.cinder.script.parser.Statement.FnStmt;

/**
 * A declared function together with the scope it was declared in. Calls run in a
 * fresh child of that scope, never of the caller's.
 */
public class UserFunction {
    final String name;
    final FnStmt declaration;
    final Environment closure;

    UserFunction(FnStmt declaration, Environment closure) {
        this.name = declaration.name.lexeme;
        this.declaration = declaration;
        this.closure = closure;
    }

    public String name() { return name; }

    public int arity() { return declaration.params.size(); }

    /** Binds already-evaluated arguments and runs the body; arity was checked by the caller. */
    Value call(Interpreter interpreter, List<Value> args) {
        Environment frame = closure.childScope();
        List<Token> params = declaration.params;
        for (int i = 0; i < params.size(); i++) {
            Token param = params.get(i);
            if (frame.existsInCurrentScope(param.lexeme)) {
                throw new RuntimeError(param.span, "Duplicate parameter name '" + param.lexeme + "'.");
            }
            frame.define(param.lexeme, args.get(i));
        }
        return interpreter.executeFunctionBody(this, frame);
    }

    @Override
    public String toString() {
        return "<fn " + name + "/" + arity() + ">";
    }
}
