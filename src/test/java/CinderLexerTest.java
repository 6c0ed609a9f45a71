import org.junit.jupiter.api.Test;

import com.cinder.script.parser.Lexer;
import com.cinder.script.parser.Token;
import com.cinder.script.parser.TokenType;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class CinderLexerTest {

    private static List<TokenType> types(List<Token> tokens) {
        return tokens.stream().map(t -> t.type).collect(Collectors.toList());
    }

    @Test
    void punctuationAndOperators() {
        Lexer lexer = new Lexer("(){};,+-*/ ! != = == < <= > >= && ||");
        List<Token> tokens = lexer.scanTokens();

        assertTrue(lexer.errors().isEmpty());
        assertEquals(List.of(
                TokenType.LEFT_PAREN, TokenType.RIGHT_PAREN, TokenType.LEFT_BRACE, TokenType.RIGHT_BRACE,
                TokenType.SEMICOLON, TokenType.COMMA, TokenType.PLUS, TokenType.MINUS, TokenType.STAR,
                TokenType.SLASH, TokenType.BANG, TokenType.BANG_EQUAL, TokenType.EQUAL, TokenType.EQUAL_EQUAL,
                TokenType.LESS, TokenType.LESS_EQUAL, TokenType.GREATER, TokenType.GREATER_EQUAL,
                TokenType.AND_AND, TokenType.OR_OR, TokenType.EOF
        ), types(tokens));
    }

    @Test
    void keywordsIdentifiersAndLiterals() {
        Lexer lexer = new Lexer("let if else while break continue return fn true false lets _x9 42");
        List<Token> tokens = lexer.scanTokens();

        assertEquals(List.of(
                TokenType.LET, TokenType.IF, TokenType.ELSE, TokenType.WHILE, TokenType.BREAK,
                TokenType.CONTINUE, TokenType.RETURN, TokenType.FN, TokenType.TRUE, TokenType.FALSE,
                TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.NUMBER, TokenType.EOF
        ), types(tokens));

        assertEquals(Boolean.TRUE, tokens.get(8).literal);
        assertEquals(Boolean.FALSE, tokens.get(9).literal);
        assertNull(tokens.get(10).literal);
        assertEquals(42, tokens.get(12).literal);
    }

    @Test
    void lineCommentsAreDiscarded() {
        Lexer lexer = new Lexer("let x = 1; // trailing @ comment\n// whole line\nx");
        List<Token> tokens = lexer.scanTokens();

        assertTrue(lexer.errors().isEmpty());
        assertEquals(7, tokens.size());
        assertEquals("x", tokens.get(5).lexeme);
        assertEquals(3, tokens.get(5).span.line);
    }

    @Test
    void positionsAreOneBasedAndTrackNewlines() {
        List<Token> tokens = new Lexer("let x\n  = 1;").scanTokens();

        Token eq = tokens.get(2);
        assertEquals(TokenType.EQUAL, eq.type);
        assertEquals(2, eq.span.line);
        assertEquals(3, eq.span.col);
        assertEquals(8, eq.span.start);
        assertEquals(9, eq.span.end);
    }

    @Test
    void eofIsZeroLengthAtEnd() {
        List<Token> tokens = new Lexer("x").scanTokens();
        Token eof = tokens.get(tokens.size() - 1);

        assertEquals(TokenType.EOF, eof.type);
        assertEquals(1, eof.span.start);
        assertEquals(1, eof.span.end);

        List<Token> empty = new Lexer("").scanTokens();
        assertEquals(1, empty.size());
        assertEquals(TokenType.EOF, empty.get(0).type);
    }

    @Test
    void loneAmpersandAndPipeAreErrors() {
        Lexer lexer = new Lexer("a & b | c");
        List<Token> tokens = lexer.scanTokens();

        assertEquals(List.of(
                "Line 1, col 3: Unexpected '&' without pair.",
                "Line 1, col 7: Unexpected '|' without pair."
        ), lexer.errors());
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.EOF),
                types(tokens));
    }

    @Test
    void unexpectedCharacterDoesNotStopScanning() {
        Lexer lexer = new Lexer("let @ x\n# = 1;");
        List<Token> tokens = lexer.scanTokens();

        assertEquals(List.of(
                "Line 1, col 5: Unexpected character.",
                "Line 2, col 1: Unexpected character."
        ), lexer.errors());
        assertEquals(List.of(TokenType.LET, TokenType.IDENTIFIER, TokenType.EQUAL, TokenType.NUMBER,
                TokenType.SEMICOLON, TokenType.EOF), types(tokens));
    }

    @Test
    void integerLiteralBoundary() {
        Lexer ok = new Lexer("2147483647");
        assertEquals(Integer.MAX_VALUE, ok.scanTokens().get(0).literal);
        assertTrue(ok.errors().isEmpty());

        Lexer over = new Lexer("x 2147483648");
        List<Token> tokens = over.scanTokens();
        assertEquals(List.of("Line 1, col 3: Integer literal out of range."), over.errors());
        assertEquals(TokenType.NUMBER, tokens.get(1).type);
        assertEquals(Integer.MAX_VALUE, tokens.get(1).literal);
        assertEquals("2147483648", tokens.get(1).lexeme);
    }

    @Test
    void scanTokensIsIdempotent() {
        Lexer lexer = new Lexer("let a = 1 @;");
        List<Token> first = lexer.scanTokens();
        List<Token> second = lexer.scanTokens();

        assertEquals(first, second);
        assertEquals(1, lexer.errors().size());
        assertThrows(UnsupportedOperationException.class, () -> first.clear());
    }

    @Test
    void lexemesReconstructSourceWithoutWhitespace() {
        String src = "fn add(a, b) {\n  return a + b;\n}\nlet r = add(1, 2) >= 3 && !false;";
        List<Token> tokens = new Lexer(src).scanTokens();

        String joined = tokens.stream().map(t -> t.lexeme).collect(Collectors.joining());
        assertEquals(src.replaceAll("\\s+", ""), joined);
    }

    @Test
    void tokenToString() {
        assertEquals("LET 'let'", new Lexer("let").scanTokens().get(0).toString());
    }

    @Test
    void nullSourceRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Lexer(null));
    }

    @Test
    void isKeyword() {
        assertTrue(Lexer.isKeyword("while"));
        assertFalse(Lexer.isKeyword("print"));
    }
}
