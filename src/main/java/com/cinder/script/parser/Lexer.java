package com.cinder.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.cinder.debug.Debug;

/**
 * Single-pass scanner. Errors are collected, never thrown: scanning always runs to the
 * end of the source and returns every token it recognized, terminated by EOF.
 */
public class Lexer {
    private static final String TAG = "Lexer";

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();
    private boolean scanned = false;

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int col = 1;
    private int startLine = 1;
    private int startCol = 1;

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("let", TokenType.LET);
        map.put("if", TokenType.IF);
        map.put("else", TokenType.ELSE);
        map.put("while", TokenType.WHILE);
        map.put("break", TokenType.BREAK);
        map.put("continue", TokenType.CONTINUE);
        map.put("return", TokenType.RETURN);
        map.put("fn", TokenType.FN);
        map.put("true", TokenType.TRUE);
        map.put("false", TokenType.FALSE);
        keywords = Collections.unmodifiableMap(map);
    }

    public Lexer(String source) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        this.source = source;
    }

    public List<Token> scanTokens() {
        if (scanned) return Collections.unmodifiableList(tokens);

        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startCol = col;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", null, new Span(current, current, line, col)));
        scanned = true;

        Debug.get().d(TAG, "scanned " + tokens.size() + " tokens, " + errors.size() + " errors");
        return Collections.unmodifiableList(tokens);
    }

    public List<String> errors() {
        return Collections.unmodifiableList(errors);
    }

    public static boolean isKeyword(String text) {
        return keywords.containsKey(text);
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case ',': addToken(TokenType.COMMA); break;
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case '*': addToken(TokenType.STAR); break;

            case '!': addToken(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG); break;
            case '=': addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL); break;
            case '<': addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS); break;
            case '>': addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER); break;

            // no bitwise operators: a lone '&' or '|' is always a mistake
            case '&':
                if (match('&')) addToken(TokenType.AND_AND);
                else error("Unexpected '&' without pair.");
                break;
            case '|':
                if (match('|')) addToken(TokenType.OR_OR);
                else error("Unexpected '|' without pair.");
                break;

            case '/':
                if (match('/')) {
                    while (!isAtEnd() && peek() != '\n') advance();
                } else {
                    addToken(TokenType.SLASH);
                }
                break;

            case ' ': case '\r': case '\t': case '\n':
                break;

            default:
                if (isDigit(c)) number();
                else if (isAlpha(c)) identifier();
                else error("Unexpected character.");
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
        if (type == TokenType.TRUE) addToken(type, Boolean.TRUE);
        else if (type == TokenType.FALSE) addToken(type, Boolean.FALSE);
        else addToken(type);
    }

    private void number() {
        while (isDigit(peek())) advance();
        String digits = source.substring(start, current);
        int value;
        try {
            value = Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            // keep the token so the parser still sees a well-formed stream
            error("Integer literal out of range.");
            value = Integer.MAX_VALUE;
        }
        addToken(TokenType.NUMBER, value);
    }

    private boolean isAtEnd() { return current >= source.length(); }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            col = 1;
        } else {
            col++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }
    private boolean isAlphaNumeric(char c) { return isAlpha(c) || isDigit(c); }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, new Span(start, current, startLine, startCol)));
    }

    private void error(String message) {
        errors.add(ErrorFormat.format(startLine, startCol, message));
    }
}
