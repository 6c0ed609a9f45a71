package com.cinder.script.parser;

import java.util.Collections;
import java.util.List;

public class Statement {

    public interface Stmt {
        <R> R accept(StmtVisitor<R> visitor);
        Span span();
    }

    public interface StmtVisitor<R> {
        R visitExprStmt(ExprStmt stmt);
        R visitLetStmt(LetStmt stmt);
        R visitBlockStmt(Block stmt);
        R visitIfStmt(If stmt);
        R visitWhileStmt(While stmt);
        R visitBreakStmt(BreakStmt stmt);
        R visitContinueStmt(ContinueStmt stmt);
        R visitReturnStmt(ReturnStmt stmt);
        R visitFnStmt(FnStmt stmt);
    }

    public static final class ExprStmt implements Stmt {
        public final Expr.ExprNode expression;
        public final Span span;

        ExprStmt(Expr.ExprNode expression, Span span) {
            this.expression = expression;
            this.span = span;
        }

        public Span span() { return span; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitExprStmt(this); }
    }

    public static final class LetStmt implements Stmt {
        public final Token name;
        public final Expr.ExprNode initializer;
        public final Span span;

        LetStmt(Token name, Expr.ExprNode initializer, Span span) {
            this.name = name;
            this.initializer = initializer;
            this.span = span;
        }

        public Span span() { return span; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitLetStmt(this); }
    }

    public static final class Block implements Stmt {
        public final List<Stmt> statements;
        public final Span span;

        Block(List<Stmt> statements, Span span) {
            this.statements = Collections.unmodifiableList(statements);
            this.span = span;
        }

        public Span span() { return span; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitBlockStmt(this); }
    }

    public static final class If implements Stmt {
        public final Expr.ExprNode condition;
        public final Stmt thenBranch;
        public final Stmt elseBranch; // may be null
        public final Span span;

        If(Expr.ExprNode condition, Stmt thenBranch, Stmt elseBranch, Span span) {
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
            this.span = span;
        }

        public Span span() { return span; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitIfStmt(this); }
    }

    public static final class While implements Stmt {
        public final Expr.ExprNode condition;
        public final Stmt body;
        public final Span span;

        While(Expr.ExprNode condition, Stmt body, Span span) {
            this.condition = condition;
            this.body = body;
            this.span = span;
        }

        public Span span() { return span; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitWhileStmt(this); }
    }

    public static final class BreakStmt implements Stmt {
        public final Token keyword;
        public final Span span;

        BreakStmt(Token keyword, Span span) {
            this.keyword = keyword;
            this.span = span;
        }

        public Span span() { return span; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitBreakStmt(this); }
    }

    public static final class ContinueStmt implements Stmt {
        public final Token keyword;
        public final Span span;

        ContinueStmt(Token keyword, Span span) {
            this.keyword = keyword;
            this.span = span;
        }

        public Span span() { return span; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitContinueStmt(this); }
    }

    public static final class ReturnStmt implements Stmt {
        public final Token keyword;
        public final Expr.ExprNode value; // may be null
        public final Span span;

        ReturnStmt(Token keyword, Expr.ExprNode value, Span span) {
            this.keyword = keyword;
            this.value = value;
            this.span = span;
        }

        public Span span() { return span; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitReturnStmt(this); }
    }

    public static final class FnStmt implements Stmt {
        public final Token name;
        public final List<Token> params;
        public final List<Stmt> body;
        public final Span span;

        FnStmt(Token name, List<Token> params, List<Stmt> body, Span span) {
            this.name = name;
            this.params = Collections.unmodifiableList(params);
            this.body = Collections.unmodifiableList(body);
            this.span = span;
        }

        public Span span() { return span; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitFnStmt(this); }
    }
}
