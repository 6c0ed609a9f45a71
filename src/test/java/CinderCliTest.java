import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.cinder.debug.Debug;
import com.cinder.script.CinderCli;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class CinderCliTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream outBuf = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBuf = new ByteArrayOutputStream();

    private int cli(String... args) {
        return CinderCli.run(args,
                new PrintStream(outBuf, true, StandardCharsets.UTF_8),
                new PrintStream(errBuf, true, StandardCharsets.UTF_8));
    }

    private String out() { return outBuf.toString(StandardCharsets.UTF_8).replace("\r\n", "\n"); }
    private String err() { return errBuf.toString(StandardCharsets.UTF_8).replace("\r\n", "\n"); }

    private String script(String source) throws IOException {
        Path p = dir.resolve("main.cn");
        Files.writeString(p, source, StandardCharsets.UTF_8);
        return p.toString();
    }

    @Test
    void usageErrors() throws IOException {
        assertEquals(2, cli());
        assertTrue(err().startsWith("Usage:"));

        String path = script("print(1);");
        assertEquals(2, cli(path, "other.cn"));
        assertEquals(2, cli(path, "--tokens", "--ast"));
        assertEquals(2, cli(path, "--max-depth=abc"));
        assertEquals(2, cli(path, "--max-depth=0"));
        assertEquals("", out());
    }

    @Test
    void unreadableFile() {
        assertEquals(3, cli(dir.resolve("missing.cn").toString()));
        assertTrue(err().contains("Failed to read script file"));
    }

    @Test
    void successfulRun() throws IOException {
        assertEquals(0, cli(script("fn add(a, b) { return a + b; }\nprint(add(2, 3));")));
        assertEquals("5\n", out());
        assertEquals("", err());
    }

    @Test
    void lexAndParseErrorsExitBeforeRunning() throws IOException {
        assertEquals(1, cli(script("print(1);\nlet a = 1 & 2;")));
        assertEquals("", out());
        assertEquals("Line 2, col 11: Unexpected '&' without pair.\n", err());

        errBuf.reset();
        assertEquals(1, cli(script("print(1);\nlet = 1;\nlet b = ;")));
        assertEquals("", out());
        assertEquals("Line 2, col 5: Expect variable name after 'let'.\nLine 3, col 9: Expect expression.\n", err());
    }

    @Test
    void runtimeErrorExitsNonZero() throws IOException {
        assertEquals(1, cli(script("print(1);\nbreak;\nprint(2);")));
        assertEquals("1\n", out());
        assertEquals("Line 2, col 1: Break used outside of a loop.\n", err());
    }

    @Test
    void jsonErrors() throws IOException {
        assertEquals(1, cli(script("let x = 1 / 0;"), "--json"));
        assertTrue(err().contains("\"stage\" : \"runtime\""));
        assertTrue(err().contains("Line 1, col 11: Division by zero."));
    }

    @Test
    void tokensAndAstDoNotRun() throws IOException {
        String path = script("print(1);");

        assertEquals(0, cli(path, "--tokens"));
        assertEquals("IDENTIFIER 'print'\nLEFT_PAREN '('\nNUMBER '1'\nRIGHT_PAREN ')'\nSEMICOLON ';'\nEOF ''\n", out());

        outBuf.reset();
        assertEquals(0, cli(path, "--ast"));
        assertTrue(out().startsWith("Program\n  ExprStmt\n    Call\n"));

        outBuf.reset();
        assertEquals(0, cli(path, "--ast", "--json"));
        assertTrue(out().contains("\"kind\" : \"ExprStmt\""));
    }

    @Test
    void traceAndMaxDepth() throws IOException {
        String path = script("let x = 2;\nx + 1;\nfn r() { return r(); }\nr();");

        assertEquals(1, cli(path, "--trace", "--max-depth=3"));
        String err = err();
        assertTrue(err.contains("Trace: Let x\n"));
        assertTrue(err.contains("Trace: ExprStmt -> 3\n"));
        assertTrue(err.contains("Trace: Fn r\n"));
        assertTrue(err.contains("Line 3, col 17: Max call depth exceeded."));
    }

    @Test
    void scriptIsScannedAndParsedOnce() throws IOException {
        assertEquals(0, cli(script("print(7);"), "--verbose"));
        assertEquals("7\n", out());
        assertEquals(1, count(err(), "[DEBUG] Lexer: scanned"));
        assertEquals(1, count(err(), "[DEBUG] Parser: parsed"));
    }

    private static int count(String text, String needle) {
        int n = 0;
        for (int i = text.indexOf(needle); i >= 0; i = text.indexOf(needle, i + 1)) n++;
        return n;
    }

    @Test
    void verboseLogsToStderrAndRestoresSink() throws IOException {
        assertFalse(Debug.get().enabled());
        assertEquals(0, cli(script("let x = 1;"), "--verbose"));
        assertTrue(err().contains("[DEBUG] Lexer: "));
        assertTrue(err().contains("[DEBUG] Parser: "));
        assertTrue(err().contains("[INFO] CinderCli: running "));
        assertFalse(Debug.get().enabled());
    }
}
