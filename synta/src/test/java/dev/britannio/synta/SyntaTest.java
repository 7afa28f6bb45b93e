package dev.britannio.synta;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

class SyntaTest {

    @Test void tokenize() {
        List<TokenView> tokens = Synta.tokenize("bind x := 10;");
        assertEquals(List.of("BIND", "IDENTIFIER", "BIND_ASSIGN", "INTEGER", "STATEMENT_END", "EOF"),
                tokens.stream().map(TokenView::kind).collect(Collectors.toList()));
        assertEquals(List.of("DECLARATION", "IDENTIFIER", "ASSIGNMENT", "NUMBER", "DELIMITER", "EOF"),
                tokens.stream().map(TokenView::semanticGroup).collect(Collectors.toList()));
        assertEquals(new TokenView("x", "IDENTIFIER", "IDENTIFIER", 1, 6), tokens.get(1));
    }

    @Test void parse() {
        ParseResult result = Synta.parse("if x > 0 { return 1; } else { return 2; }");
        assertTrue(result.success());
        assertInstanceOf(Node.IfStatement.class, result.program().statements.get(0));
    }

    @Test void analyzeValidSource() {
        AnalysisResult result = Synta.analyze("bind x := 10;");
        assertTrue(result.success());
        assertTrue(result.errors().isEmpty());
        assertTrue(result.warnings().isEmpty());
        assertTrue(result.parseTree().startsWith("SYNTA_PROGRAM\n"));
        assertEquals("EOF", result.tokens().get(result.tokens().size() - 1).kind());
    }

    @Test void analyzeInvalidSource() {
        AnalysisResult result = Synta.analyze("bind x 10");
        assertFalse(result.success());
        assertEquals(ParseError.Kind.SYNTAX, result.errors().get(0).kind());
        assertTrue(result.parseTree().contains("DECL_STMT \"bind\""));
    }

    @Test void sourceTooLong() {
        AnalysisResult result = Synta.analyze("bind x := 1;", new Synta.Config(false, true, 5));
        assertFalse(result.success());
        assertTrue(result.tokens().isEmpty());
        assertEquals("", result.parseTree());
        assertEquals(1, result.errors().size());
        assertEquals("source is longer than 5 characters", result.errors().get(0).message());
    }

    @Test void defaults() {
        Synta.Config config = Synta.Config.defaults();
        assertFalse(config.showTokens());
        assertTrue(config.showTree());
        assertEquals(1_000_000, config.maxSourceLength());
    }

    @Test void nullSource() {
        assertThrows(NullPointerException.class, () -> Synta.tokenize(null));
        assertThrows(NullPointerException.class, () -> Synta.parse(null));
        assertThrows(NullPointerException.class, () -> Synta.analyze(null));
        assertThrows(NullPointerException.class, () -> Synta.analyze("x", null));
    }

    @Test void resultListsAreCopies() {
        AnalysisResult result = Synta.analyze("x");
        assertThrows(UnsupportedOperationException.class, () -> result.tokens().clear());
    }

    @Test void deeplyNestedSourceIsAnError() {
        List<String> sources = List.of(
                "bind x := " + "(".repeat(1000) + "1" + ")".repeat(1000),
                "(".repeat(20000),
                "[".repeat(20000),
                "-".repeat(50000) + "1",
                "a ->".repeat(20000) + " b",
                "if x {".repeat(10000));

        for (String source : sources) {
            AnalysisResult result = assertDoesNotThrow(() -> Synta.analyze(source));
            assertFalse(result.success());
            assertTrue(result.parseTree().startsWith("SYNTA_PROGRAM\n"));
        }
    }

    @Test void concurrentCallsAgree() {
        String source = "@agent Bot { role: \"helper\" }\nfn run() { Bot -> task |> report }";
        String expected = Synta.analyze(source).parseTree();
        List<String> trees = IntStream.range(0, 32).parallel()
                .mapToObj(i -> Synta.analyze(source).parseTree())
                .distinct()
                .collect(Collectors.toList());
        assertEquals(List.of(expected), trees);
    }
}
