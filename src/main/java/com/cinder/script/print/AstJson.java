package com.cinder.script.print;

import java.util.List;

import com.cinder.script.parser.Expr;
import com.cinder.script.parser.Expr.ExprNode;
import com.cinder.script.parser.Span;
import com.cinder.script.parser.Statement;
import com.cinder.script.parser.Statement.Stmt;
import com.cinder.script.parser.Token;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * JSON form of tokens, programs and diagnostics. Every node carries a {@code kind}
 * and a {@code span} object ({@code start}, {@code end}, {@code line}, {@code col}).
 */
public final class AstJson implements Expr.ExprVisitor<JsonNode>, Statement.StmtVisitor<JsonNode> {

    private static final ObjectMapper om = new ObjectMapper();

    private AstJson() {}

    public static ArrayNode tokens(List<Token> tokens) {
        ArrayNode arr = om.createArrayNode();
        for (Token t : tokens) {
            ObjectNode n = om.createObjectNode();
            n.put("type", t.type.name());
            n.put("lexeme", t.lexeme);
            if (t.literal instanceof Integer) n.put("literal", (Integer) t.literal);
            else if (t.literal instanceof Boolean) n.put("literal", (Boolean) t.literal);
            n.set("span", span(t.span));
            arr.add(n);
        }
        return arr;
    }

    public static ArrayNode program(List<Stmt> program) {
        AstJson v = new AstJson();
        ArrayNode arr = om.createArrayNode();
        for (Stmt s : program) arr.add(s.accept(v));
        return arr;
    }

    public static JsonNode expression(ExprNode expr) {
        return expr.accept(new AstJson());
    }

    /** {@code {"stage": ..., "errors": [...]}} */
    public static ObjectNode errors(String stage, List<String> errors) {
        ObjectNode n = om.createObjectNode();
        n.put("stage", stage);
        ArrayNode arr = n.putArray("errors");
        for (String e : errors) arr.add(e);
        return n;
    }

    public static String pretty(JsonNode n) {
        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsString(n);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize JSON", e);
        }
    }

    static ObjectNode span(Span s) {
        ObjectNode n = om.createObjectNode();
        n.put("start", s.start);
        n.put("end", s.end);
        n.put("line", s.line);
        n.put("col", s.col);
        return n;
    }

    private static ObjectNode node(String kind, Span s) {
        ObjectNode n = om.createObjectNode();
        n.put("kind", kind);
        n.set("span", span(s));
        return n;
    }

    private ArrayNode stmts(List<Stmt> list) {
        ArrayNode arr = om.createArrayNode();
        for (Stmt s : list) arr.add(s.accept(this));
        return arr;
    }

    // -------------------------
    // Statements
    // -------------------------

    public JsonNode visitExprStmt(Statement.ExprStmt stmt) {
        ObjectNode n = node("ExprStmt", stmt.span);
        n.set("expression", stmt.expression.accept(this));
        return n;
    }

    public JsonNode visitLetStmt(Statement.LetStmt stmt) {
        ObjectNode n = node("Let", stmt.span);
        n.put("name", stmt.name.lexeme);
        n.set("initializer", stmt.initializer.accept(this));
        return n;
    }

    public JsonNode visitBlockStmt(Statement.Block stmt) {
        ObjectNode n = node("Block", stmt.span);
        n.set("statements", stmts(stmt.statements));
        return n;
    }

    public JsonNode visitIfStmt(Statement.If stmt) {
        ObjectNode n = node("If", stmt.span);
        n.set("condition", stmt.condition.accept(this));
        n.set("then", stmt.thenBranch.accept(this));
        if (stmt.elseBranch != null) n.set("else", stmt.elseBranch.accept(this));
        return n;
    }

    public JsonNode visitWhileStmt(Statement.While stmt) {
        ObjectNode n = node("While", stmt.span);
        n.set("condition", stmt.condition.accept(this));
        n.set("body", stmt.body.accept(this));
        return n;
    }

    public JsonNode visitBreakStmt(Statement.BreakStmt stmt) {
        return node("Break", stmt.span);
    }

    public JsonNode visitContinueStmt(Statement.ContinueStmt stmt) {
        return node("Continue", stmt.span);
    }

    public JsonNode visitReturnStmt(Statement.ReturnStmt stmt) {
        ObjectNode n = node("Return", stmt.span);
        if (stmt.value != null) n.set("value", stmt.value.accept(this));
        return n;
    }

    public JsonNode visitFnStmt(Statement.FnStmt stmt) {
        ObjectNode n = node("Fn", stmt.span);
        n.put("name", stmt.name.lexeme);
        ArrayNode params = n.putArray("params");
        for (Token p : stmt.params) params.add(p.lexeme);
        n.set("body", stmts(stmt.body));
        return n;
    }

    // -------------------------
    // Expressions
    // -------------------------

    public JsonNode visitLiteralExpr(Expr.Literal expr) {
        ObjectNode n = node("Literal", expr.span);
        if (expr.value instanceof Integer) n.put("value", (Integer) expr.value);
        else if (expr.value instanceof Boolean) n.put("value", (Boolean) expr.value);
        else n.putNull("value");
        return n;
    }

    public JsonNode visitIdentifierExpr(Expr.Identifier expr) {
        ObjectNode n = node("Identifier", expr.span);
        n.put("name", expr.name.lexeme);
        return n;
    }

    public JsonNode visitGroupingExpr(Expr.Grouping expr) {
        ObjectNode n = node("Grouping", expr.span);
        n.set("expression", expr.expression.accept(this));
        return n;
    }

    public JsonNode visitUnaryExpr(Expr.Unary expr) {
        ObjectNode n = node("Unary", expr.span);
        n.put("op", expr.operator.lexeme);
        n.set("right", expr.right.accept(this));
        return n;
    }

    public JsonNode visitBinaryExpr(Expr.Binary expr) {
        ObjectNode n = node("Binary", expr.span);
        n.put("op", expr.operator.lexeme);
        n.set("left", expr.left.accept(this));
        n.set("right", expr.right.accept(this));
        return n;
    }

    public JsonNode visitAssignExpr(Expr.Assign expr) {
        ObjectNode n = node("Assign", expr.span);
        n.put("name", expr.name.lexeme);
        n.set("value", expr.value.accept(this));
        return n;
    }

    public JsonNode visitCallExpr(Expr.Call expr) {
        ObjectNode n = node("Call", expr.span);
        n.set("callee", expr.callee.accept(this));
        ArrayNode args = n.putArray("args");
        for (ExprNode a : expr.arguments) args.add(a.accept(this));
        return n;
    }
}
