import org.junit.jupiter.api.Test;

import com.cinder.debug.Debug;
import com.cinder.script.CinderScript;
import com.cinder.script.RunResult;
import com.cinder.script.parser.Lexer;
import com.cinder.script.parser.Parser;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs in its own JVM (surefire does not reuse forks), so nothing here has
 * touched the debug hub before these tests.
 */
public class DefaultDebugSinkTest {

    @Test
    void hubStartsWithDiscardingSink() {
        assertNotNull(Debug.get().getSink());
        assertFalse(Debug.get().enabled());
        Debug.get().d("Test", "dropped");
    }

    @Test
    void pipelineRunsWithoutInstalledSink() {
        Lexer lexer = new Lexer("let x = 1;");
        Parser parser = new Parser(lexer.scanTokens());
        assertEquals(1, parser.parse().size());

        RunResult r = new CinderScript().run("fn f(n) { return n * 2; } let y = f(21);");
        assertTrue(r.ok(), () -> r.errors().toString());
        assertEquals(42, r.globals().get("y").asNumber());
    }
}
