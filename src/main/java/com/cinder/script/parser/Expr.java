package com.cinder.script.parser;

import java.util.Collections;
import java.util.List;

public class Expr {

    public interface ExprNode {
        <R> R accept(ExprVisitor<R> visitor);
        Span span();
    }

    public interface ExprVisitor<R> {
        R visitLiteralExpr(Literal expr);
        R visitIdentifierExpr(Identifier expr);
        R visitGroupingExpr(Grouping expr);
        R visitUnaryExpr(Unary expr);
        R visitBinaryExpr(Binary expr);
        R visitAssignExpr(Assign expr);
        R visitCallExpr(Call expr);
    }

    /** Integer, boolean, or null (nil). */
    public static final class Literal implements ExprNode {
        public final Object value;
        public final Span span;

        public Literal(Object value, Span span) {
            this.value = value;
            this.span = span;
        }

        @Override
        public Span span() { return span; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }
    }

    public static final class Identifier implements ExprNode {
        public final Token name;
        public final Span span;

        public Identifier(Token name) {
            this.name = name;
            this.span = name.span;
        }

        @Override
        public Span span() { return span; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIdentifierExpr(this);
        }
    }

    public static final class Grouping implements ExprNode {
        public final ExprNode expression;
        public final Span span;

        public Grouping(ExprNode expression, Span span) {
            this.expression = expression;
            this.span = span;
        }

        @Override
        public Span span() { return span; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitGroupingExpr(this);
        }
    }

    public static final class Unary implements ExprNode {
        public final Token operator;
        public final ExprNode right;
        public final Span span;

        public Unary(Token operator, ExprNode right) {
            this.operator = operator;
            this.right = right;
            this.span = Span.from(operator.span, right.span());
        }

        @Override
        public Span span() { return span; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }
    }

    /** Arithmetic, comparison, equality and the short-circuit operators. */
    public static final class Binary implements ExprNode {
        public final ExprNode left;
        public final Token operator;
        public final ExprNode right;
        public final Span span;

        public Binary(ExprNode left, Token operator, ExprNode right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
            this.span = Span.from(left.span(), right.span());
        }

        @Override
        public Span span() { return span; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }
    }

    public static final class Assign implements ExprNode {
        public final Token name;
        public final ExprNode value;
        public final Span span;

        public Assign(Token name, ExprNode value) {
            this.name = name;
            this.value = value;
            this.span = Span.from(name.span, value.span());
        }

        @Override
        public Span span() { return span; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitAssignExpr(this);
        }
    }

    public static final class Call implements ExprNode {
        public final ExprNode callee;
        public final Token paren; // closing ')', arity errors point here
        public final List<ExprNode> arguments;
        public final Span span;

        public Call(ExprNode callee, Token paren, List<ExprNode> arguments) {
            this.callee = callee;
            this.paren = paren;
            this.arguments = Collections.unmodifiableList(arguments);
            this.span = Span.from(callee.span(), paren.span);
        }

        @Override
        public Span span() { return span; }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }
    }
}
