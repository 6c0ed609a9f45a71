package com.cinder.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.cinder.debug.Debug;
import com.cinder.script.parser.Expr.Assign;
import com.cinder.script.parser.Expr.Binary;
import com.cinder.script.parser.Expr.Call;
import com.cinder.script.parser.Expr.ExprNode;
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
import com.cinder.script.parser.Statement.While;

/**
 * Recursive-descent parser with one token of lookahead.
 *
 * A syntax error is recorded, then the parser skips ahead to the next statement
 * boundary and keeps going, so one run reports every independent error. The
 * statement that failed is simply left out of the result.
 */
public class Parser {
    private static final String TAG = "Parser";
    static final int MAX_NESTING = 256;

    private final List<Token> tokens;
    private final List<String> errors = new ArrayList<>();
    private int current = 0;
    private int nesting = 0;
    private boolean abandoned = false;

    /** Unwinds to the enclosing declaration; the message is already recorded. */
    private static final class ParseError extends RuntimeException {
        ParseError() { super(null, null, false, false); }
    }

    public Parser(List<Token> tokens) {
        if (tokens == null || tokens.isEmpty() || tokens.get(tokens.size() - 1).type != TokenType.EOF) {
            throw new IllegalArgumentException("token list must end with EOF");
        }
        this.tokens = tokens;
    }

    public List<Stmt> parse() {
        List<Stmt> statements = new ArrayList<>();
        while (!isAtEnd()) {
            Stmt decl = declaration();
            if (decl != null) statements.add(decl);
        }
        Debug.get().d(TAG, "parsed " + statements.size() + " statements, " + errors.size() + " errors");
        return statements;
    }

    public List<String> errors() {
        return Collections.unmodifiableList(errors);
    }

    private Stmt declaration() {
        try {
            if (match(TokenType.FN)) return fnDeclaration();
            if (match(TokenType.LET)) return letDeclaration();
            return statement();
        } catch (ParseError e) {
            synchronize();
            return null;
        }
    }

    private Stmt fnDeclaration() {
        enter("Statements nested too deeply.");
        try {
            return function(previous());
        } finally {
            nesting--;
        }
    }

    private Stmt function(Token fnToken) {
        Token name = consume(TokenType.IDENTIFIER, "Expect function name after 'fn'.");
        consume(TokenType.LEFT_PAREN, "Expect '(' after function name.");

        List<Token> params = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                params.add(consume(TokenType.IDENTIFIER, "Expect parameter name."));
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expect ')' after parameters.");
        consume(TokenType.LEFT_BRACE, "Expect '{' before function body.");

        List<Stmt> body = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            Stmt decl = declaration();
            if (decl != null) body.add(decl);
        }
        Token rightBrace = consume(TokenType.RIGHT_BRACE, "Expect '}' after function body.");

        return new FnStmt(name, params, body, Span.from(fnToken.span, rightBrace.span));
    }

    private Stmt letDeclaration() {
        Token letToken = previous();
        Token name = consume(TokenType.IDENTIFIER, "Expect variable name after 'let'.");
        consume(TokenType.EQUAL, "Expect '=' after variable name.");
        ExprNode initializer = expression();
        Token semi = consume(TokenType.SEMICOLON, "Expect ';' after variable declaration.");
        return new LetStmt(name, initializer, Span.from(letToken.span, semi.span));
    }

    private Stmt statement() {
        enter("Statements nested too deeply.");
        try {
            return simpleOrCompound();
        } finally {
            nesting--;
        }
    }

    private Stmt simpleOrCompound() {
        if (match(TokenType.IF)) return ifStatement();
        if (match(TokenType.WHILE)) return whileStatement();
        if (match(TokenType.BREAK)) return breakStatement();
        if (match(TokenType.CONTINUE)) return continueStatement();
        if (match(TokenType.RETURN)) return returnStatement();
        if (match(TokenType.LEFT_BRACE)) return blockStatement(previous());
        return exprStatement();
    }

    private Stmt ifStatement() {
        Token ifToken = previous();
        consume(TokenType.LEFT_PAREN, "Expect '(' after 'if'.");
        ExprNode condition = expression();
        consume(TokenType.RIGHT_PAREN, "Expect ')' after if condition.");

        Stmt thenBranch = statement();
        Stmt elseBranch = null;
        Span end = thenBranch.span();
        if (match(TokenType.ELSE)) {
            elseBranch = statement();
            end = elseBranch.span();
        }
        return new If(condition, thenBranch, elseBranch, Span.from(ifToken.span, end));
    }

    private Stmt whileStatement() {
        Token whileToken = previous();
        consume(TokenType.LEFT_PAREN, "Expect '(' after 'while'.");
        ExprNode condition = expression();
        consume(TokenType.RIGHT_PAREN, "Expect ')' after while condition.");
        Stmt body = statement();
        return new While(condition, body, Span.from(whileToken.span, body.span()));
    }

    // break/continue/return are checked against their enclosing construct at run time
    private Stmt breakStatement() {
        Token keyword = previous();
        Token semi = consume(TokenType.SEMICOLON, "Expect ';' after 'break'.");
        return new BreakStmt(keyword, Span.from(keyword.span, semi.span));
    }

    private Stmt continueStatement() {
        Token keyword = previous();
        Token semi = consume(TokenType.SEMICOLON, "Expect ';' after 'continue'.");
        return new ContinueStmt(keyword, Span.from(keyword.span, semi.span));
    }

    private Stmt returnStatement() {
        Token keyword = previous();
        ExprNode value = null;
        if (!check(TokenType.SEMICOLON)) {
            value = expression();
        }
        Token semi = consume(TokenType.SEMICOLON, "Expect ';' after return value.");
        return new ReturnStmt(keyword, value, Span.from(keyword.span, semi.span));
    }

    private Stmt blockStatement(Token leftBrace) {
        List<Stmt> statements = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            Stmt decl = declaration();
            if (decl != null) statements.add(decl);
        }
        Token rightBrace = consume(TokenType.RIGHT_BRACE, "Expect '}' after block.");
        return new Block(statements, Span.from(leftBrace.span, rightBrace.span));
    }

    private Stmt exprStatement() {
        ExprNode expr = expression();
        Token semi = consume(TokenType.SEMICOLON, "Expect ';' after expression.");
        return new ExprStmt(expr, Span.from(expr.span(), semi.span));
    }

    private ExprNode expression() {
        enter("Expression nested too deeply.");
        try {
            return assignment();
        } finally {
            nesting--;
        }
    }

    private ExprNode assignment() {
        ExprNode expr = or();
        if (match(TokenType.EQUAL)) {
            Token equals = previous();
            ExprNode value = assignment();
            if (expr instanceof Identifier) {
                return new Assign(((Identifier) expr).name, value);
            }
            // recorded, not thrown: the left side stands in for the whole expression
            error(equals, "Invalid assignment target.");
        }
        return expr;
    }

    private ExprNode or() {
        ExprNode expr = and();
        while (match(TokenType.OR_OR)) {
            Token op = previous();
            ExprNode right = and();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private ExprNode and() {
        ExprNode expr = equality();
        while (match(TokenType.AND_AND)) {
            Token op = previous();
            ExprNode right = equality();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private ExprNode equality() {
        ExprNode expr = comparison();
        while (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL)) {
            Token op = previous();
            ExprNode right = comparison();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private ExprNode comparison() {
        ExprNode expr = term();
        while (match(TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL)) {
            Token op = previous();
            ExprNode right = term();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private ExprNode term() {
        ExprNode expr = factor();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            ExprNode right = factor();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private ExprNode factor() {
        ExprNode expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH)) {
            Token op = previous();
            ExprNode right = unary();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private ExprNode unary() {
        if (match(TokenType.BANG, TokenType.MINUS)) {
            Token op = previous();
            enter("Expression nested too deeply.");
            try {
                return new Unary(op, unary());
            } finally {
                nesting--;
            }
        }
        return call();
    }

    private ExprNode call() {
        ExprNode expr = primary();
        while (match(TokenType.LEFT_PAREN)) {
            expr = finishCall(expr);
        }
        return expr;
    }

    private ExprNode finishCall(ExprNode callee) {
        List<ExprNode> arguments = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                arguments.add(expression());
            } while (match(TokenType.COMMA));
        }
        Token paren = consume(TokenType.RIGHT_PAREN, "Expect ')' after arguments.");
        return new Call(callee, paren, arguments);
    }

    private ExprNode primary() {
        if (match(TokenType.NUMBER, TokenType.TRUE, TokenType.FALSE)) {
            Token lit = previous();
            return new Literal(lit.literal, lit.span);
        }
        if (match(TokenType.IDENTIFIER)) return new Identifier(previous());

        if (match(TokenType.LEFT_PAREN)) {
            Token left = previous();
            ExprNode expr = expression();
            Token right = consume(TokenType.RIGHT_PAREN, "Expect ')' after expression.");
            return new Grouping(expr, Span.from(left.span, right.span));
        }

        throw error(peek(), "Expect expression.");
    }

    /** Skip to just past the next ';' or to the next token that starts a statement. */
    private void synchronize() {
        advance();
        while (!isAtEnd()) {
            if (previous().type == TokenType.SEMICOLON) return;
            switch (peek().type) {
                case LET:
                case IF:
                case WHILE:
                case BREAK:
                case CONTINUE:
                case RETURN:
                case FN:
                    return;
                default:
                    advance();
            }
        }
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    /**
     * Counts one level of recursion. Past {@link #MAX_NESTING} the rest of the input is
     * abandoned: the error is recorded once and the cursor jumps to EOF, so the
     * enclosing constructs unwind without reporting follow-on errors.
     */
    private void enter(String message) {
        if (++nesting <= MAX_NESTING) return;
        nesting--;
        Token at = peek();
        ParseError err = error(at, message);
        abandoned = true;
        current = tokens.size() - 1;
        throw err;
    }

    private ParseError error(Token token, String message) {
        if (!abandoned) errors.add(ErrorFormat.format(token.span, message));
        return new ParseError();
    }
}
