import org.junit.jupiter.api.Test;

import com.cinder.script.parser.Lexer;
import com.cinder.script.parser.Parser;
import com.cinder.script.print.AstJson;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AstJsonTest {

    private static final ObjectMapper om = new ObjectMapper();

    @Test
    void tokensCarryTypeLexemeLiteralAndSpan() {
        ArrayNode tokens = AstJson.tokens(new Lexer("let x = 12;\ntrue").scanTokens());

        assertEquals(7, tokens.size());
        assertEquals("LET", tokens.get(0).get("type").asText());
        assertEquals("let", tokens.get(0).get("lexeme").asText());
        assertFalse(tokens.get(0).has("literal"));
        assertEquals(12, tokens.get(3).get("literal").asInt());
        assertTrue(tokens.get(5).get("literal").asBoolean());

        JsonNode span = tokens.get(5).get("span");
        assertEquals(12, span.get("start").asInt());
        assertEquals(16, span.get("end").asInt());
        assertEquals(2, span.get("line").asInt());
        assertEquals(1, span.get("col").asInt());

        assertEquals("EOF", tokens.get(6).get("type").asText());
    }

    @Test
    void programNodes() {
        Parser parser = new Parser(new Lexer("let x = 1 + 2;\nfn f(a) { return a; }").scanTokens());
        ArrayNode program = AstJson.program(parser.parse());

        assertEquals(2, program.size());

        JsonNode let = program.get(0);
        assertEquals("Let", let.get("kind").asText());
        assertEquals("x", let.get("name").asText());
        assertEquals(0, let.get("span").get("start").asInt());
        assertEquals(14, let.get("span").get("end").asInt());

        JsonNode init = let.get("initializer");
        assertEquals("Binary", init.get("kind").asText());
        assertEquals("+", init.get("op").asText());
        assertEquals(1, init.get("left").get("value").asInt());
        assertEquals(2, init.get("right").get("value").asInt());

        JsonNode fn = program.get(1);
        assertEquals("Fn", fn.get("kind").asText());
        assertEquals("a", fn.get("params").get(0).asText());
        assertEquals("Return", fn.get("body").get(0).get("kind").asText());
        assertEquals("Identifier", fn.get("body").get(0).get("value").get("kind").asText());
    }

    @Test
    void errorsObject() {
        ObjectNode n = AstJson.errors("parse", List.of("Line 1, col 1: Expect expression."));

        assertEquals("parse", n.get("stage").asText());
        assertEquals(1, n.get("errors").size());
        assertEquals("Line 1, col 1: Expect expression.", n.get("errors").get(0).asText());
    }

    @Test
    void prettyOutputParsesBack() throws Exception {
        ArrayNode tokens = AstJson.tokens(new Lexer("x;").scanTokens());
        String text = AstJson.pretty(tokens);

        assertTrue(text.contains("\n"));
        assertEquals(tokens, om.readTree(text));
    }
}
