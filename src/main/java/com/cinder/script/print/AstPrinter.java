package com.cinder.script.print;

import java.util.List;

import com.cinder.script.parser.Expr;
import com.cinder.script.parser.Expr.ExprNode;
import com.cinder.script.parser.Statement;
import com.cinder.script.parser.Statement.Stmt;
import com.cinder.script.parser.Token;

/**
 * Indented text form of a program, two spaces per level:
 *
 * <pre>
 * Program
 *   Let x
 *     Binary +
 *       Literal 1
 *       Literal 2
 * </pre>
 */
public final class AstPrinter implements Expr.ExprVisitor<Void>, Statement.StmtVisitor<Void> {

    private final StringBuilder out = new StringBuilder();
    private int level = 0;

    private AstPrinter() {}

    public static String print(List<Stmt> program) {
        AstPrinter p = new AstPrinter();
        p.line("Program");
        p.level++;
        for (Stmt s : program) p.stmt(s);
        return p.out.toString();
    }

    public static String print(ExprNode expr) {
        AstPrinter p = new AstPrinter();
        p.expr(expr);
        return p.out.toString();
    }

    private void line(String text) {
        for (int i = 0; i < level; i++) out.append("  ");
        out.append(text).append('\n');
    }

    private void stmt(Stmt s) {
        s.accept(this);
    }

    private void expr(ExprNode e) {
        e.accept(this);
    }

    private void nested(String label, Runnable body) {
        line(label);
        level++;
        body.run();
        level--;
    }

    // -------------------------
    // Statements
    // -------------------------

    public Void visitExprStmt(Statement.ExprStmt stmt) {
        nested("ExprStmt", () -> expr(stmt.expression));
        return null;
    }

    public Void visitLetStmt(Statement.LetStmt stmt) {
        nested("Let " + stmt.name.lexeme, () -> expr(stmt.initializer));
        return null;
    }

    public Void visitBlockStmt(Statement.Block stmt) {
        nested("Block", () -> stmt.statements.forEach(this::stmt));
        return null;
    }

    public Void visitIfStmt(Statement.If stmt) {
        nested("If", () -> {
            nested("Condition", () -> expr(stmt.condition));
            nested("Then", () -> stmt(stmt.thenBranch));
            if (stmt.elseBranch != null) nested("Else", () -> stmt(stmt.elseBranch));
        });
        return null;
    }

    public Void visitWhileStmt(Statement.While stmt) {
        nested("While", () -> {
            nested("Condition", () -> expr(stmt.condition));
            nested("Body", () -> stmt(stmt.body));
        });
        return null;
    }

    public Void visitBreakStmt(Statement.BreakStmt stmt) {
        line("Break");
        return null;
    }

    public Void visitContinueStmt(Statement.ContinueStmt stmt) {
        line("Continue");
        return null;
    }

    public Void visitReturnStmt(Statement.ReturnStmt stmt) {
        nested("Return", () -> {
            if (stmt.value != null) expr(stmt.value);
        });
        return null;
    }

    public Void visitFnStmt(Statement.FnStmt stmt) {
        StringBuilder header = new StringBuilder("Fn ").append(stmt.name.lexeme);
        if (!stmt.params.isEmpty()) {
            header.append(" (");
            for (int i = 0; i < stmt.params.size(); i++) {
                if (i > 0) header.append(", ");
                header.append(stmt.params.get(i).lexeme);
            }
            header.append(')');
        }
        nested(header.toString(), () -> stmt.body.forEach(this::stmt));
        return null;
    }

    // -------------------------
    // Expressions
    // -------------------------

    public Void visitLiteralExpr(Expr.Literal expr) {
        line("Literal " + (expr.value == null ? "nil" : expr.value));
        return null;
    }

    public Void visitIdentifierExpr(Expr.Identifier expr) {
        line("Identifier " + expr.name.lexeme);
        return null;
    }

    public Void visitGroupingExpr(Expr.Grouping expr) {
        nested("Grouping", () -> expr(expr.expression));
        return null;
    }

    public Void visitUnaryExpr(Expr.Unary expr) {
        nested("Unary " + expr.operator.lexeme, () -> expr(expr.right));
        return null;
    }

    public Void visitBinaryExpr(Expr.Binary expr) {
        nested("Binary " + expr.operator.lexeme, () -> {
            expr(expr.left);
            expr(expr.right);
        });
        return null;
    }

    public Void visitAssignExpr(Expr.Assign expr) {
        nested("Assign " + expr.name.lexeme, () -> expr(expr.value));
        return null;
    }

    public Void visitCallExpr(Expr.Call expr) {
        nested("Call", () -> {
            nested("Callee", () -> expr(expr.callee));
            if (!expr.arguments.isEmpty()) nested("Args", () -> expr.arguments.forEach(this::expr));
        });
        return null;
    }

    /** Short label for a statement, as used by trace output. */
    public static String label(Stmt stmt) {
        if (stmt instanceof Statement.LetStmt) return "Let " + name(((Statement.LetStmt) stmt).name);
        if (stmt instanceof Statement.FnStmt) return "Fn " + name(((Statement.FnStmt) stmt).name);
        if (stmt instanceof Statement.ExprStmt) return "ExprStmt";
        if (stmt instanceof Statement.Block) return "Block";
        if (stmt instanceof Statement.If) return "If";
        if (stmt instanceof Statement.While) return "While";
        if (stmt instanceof Statement.BreakStmt) return "Break";
        if (stmt instanceof Statement.ContinueStmt) return "Continue";
        if (stmt instanceof Statement.ReturnStmt) return "Return";
        return "Stmt";
    }

    private static String name(Token t) { return t.lexeme; }
}
