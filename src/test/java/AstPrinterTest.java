import org.junit.jupiter.api.Test;

import com.cinder.script.parser.Lexer;
import com.cinder.script.parser.Parser;
import com.cinder.script.parser.Statement.Stmt;
import com.cinder.script.print.AstPrinter;
import com.cinder.script.print.TokenPrinter;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AstPrinterTest {

    private static List<Stmt> parse(String src) {
        Parser parser = new Parser(new Lexer(src).scanTokens());
        List<Stmt> program = parser.parse();
        assertTrue(parser.errors().isEmpty(), () -> parser.errors().toString());
        return program;
    }

    @Test
    void printsStatementsAsIndentedTree() {
        String src = String.join("\n",
                "fn add(a, b) { return a + b; }",
                "if (x) { break; } else continue;",
                "while (true) print(1);");

        assertEquals(String.join("\n",
                "Program",
                "  Fn add (a, b)",
                "    Return",
                "      Binary +",
                "        Identifier a",
                "        Identifier b",
                "  If",
                "    Condition",
                "      Identifier x",
                "    Then",
                "      Block",
                "        Break",
                "    Else",
                "      Continue",
                "  While",
                "    Condition",
                "      Literal true",
                "    Body",
                "      ExprStmt",
                "        Call",
                "          Callee",
                "            Identifier print",
                "          Args",
                "            Literal 1",
                ""), AstPrinter.print(parse(src)));
    }

    @Test
    void printsLetAssignGroupingAndBareFunctions() {
        assertEquals(String.join("\n",
                "Program",
                "  Let y",
                "    Grouping",
                "      Unary !",
                "        Literal false",
                "  Fn f",
                "    Return",
                "  ExprStmt",
                "    Assign y",
                "      Call",
                "        Callee",
                "          Identifier f",
                ""), AstPrinter.print(parse("let y = (!false); fn f() { return; } y = f();")));
    }

    @Test
    void emptyProgram() {
        assertEquals("Program\n", AstPrinter.print(parse("// nothing here")));
    }

    @Test
    void tokenPrinterListsTypeAndLexeme() {
        assertEquals("LET 'let'\nIDENTIFIER 'x'\nEQUAL '='\nNUMBER '7'\nSEMICOLON ';'\nEOF ''\n",
                TokenPrinter.print(new Lexer("let x = 7;").scanTokens()));
    }
}
