package dev.britannio.synta;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import java.util.Objects;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Entry point of the Synta front end: tokenizes and parses source text, and
 * runs as a command line tool over a script or an interactive prompt.
 *
 * Every operation here is a pure function of its input. Each call builds its
 * own {@link Scanner} and {@link Parser}, so calls may run on any number of
 * threads at once.
 */
public final class Synta {
    private static final Logger log = LogManager.getLogger(Synta.class);

    /**
     * @param showTokens      print the token list before the tree
     * @param showTree        print the formatted syntax tree
     * @param maxSourceLength sources longer than this many characters are
     *                        rejected without being scanned
     */
    public static record Config(boolean showTokens, boolean showTree, int maxSourceLength) {
        public static final int DEFAULT_MAX_SOURCE_LENGTH = 1_000_000;

        public static Config defaults() {
            return new Config(false, true, DEFAULT_MAX_SOURCE_LENGTH);
        }
    }

    private Synta() {
    }

    public static void main(String[] args) throws IOException {
        boolean showTokens = false;
        boolean showTree = true;
        String script = null;

        for (String arg : args) {
            if (arg.equals("--tokens")) {
                showTokens = true;
            } else if (arg.equals("--no-tree")) {
                showTree = false;
            } else if (arg.startsWith("--") || script != null) {
                usage();
            } else {
                script = arg;
            }
        }

        var config = new Config(showTokens, showTree, Config.DEFAULT_MAX_SOURCE_LENGTH);
        if (script != null) {
            runFile(script, config);
        } else {
            runPrompt(config);
        }
    }

    private static void usage() {
        System.out.println("Usage: synta [--tokens] [--no-tree] [script]");
        System.exit(64);
    }

    /**
     * Splits source text into tokens. Never fails: unknown characters become
     * {@code ILLEGAL} tokens and the list always ends with {@code EOF}.
     */
    public static List<TokenView> tokenize(String source) {
        Objects.requireNonNull(source, "source");
        return new Scanner(source).scanTokens().stream().map(TokenView::of).toList();
    }

    /**
     * Parses source text into a syntax tree, collecting every syntax error
     * instead of stopping at the first.
     */
    public static ParseResult parse(String source) {
        Objects.requireNonNull(source, "source");
        return new Parser(new Scanner(source).scanTokens()).parse();
    }

    public static AnalysisResult analyze(String source) {
        return analyze(source, Config.defaults());
    }

    /**
     * Tokenizes and parses {@code source}, returning the tokens, the formatted
     * tree and the errors together.
     */
    public static AnalysisResult analyze(String source, Config config) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(config, "config");

        if (source.length() > config.maxSourceLength()) {
            log.warn("Rejected source of {} characters, the limit is {}", source.length(), config.maxSourceLength());
            var error = new ParseError(1, 1, "source is longer than " + config.maxSourceLength() + " characters",
                    ParseError.Kind.SYNTAX);
            return new AnalysisResult(false, List.of(), "", List.of(error), List.of());
        }

        List<Token> tokens = new Scanner(source).scanTokens();
        ParseResult result = new Parser(tokens).parse();
        String tree = new AstFormatter().format(result.program());

        return new AnalysisResult(result.success(), tokens.stream().map(TokenView::of).toList(), tree,
                result.errors(), result.warnings());
    }

    /**
     * Reads the provided file from its path then analyzes it
     *
     * @param path the path of the file to analyze
     * @throws IOException if the file cannot be read
     */
    private static void runFile(String path, Config config) throws IOException {
        byte[] bytes = Files.readAllBytes(Paths.get(path));
        boolean success = run(new String(bytes, StandardCharsets.UTF_8), config);

        // The code has a syntax error
        if (!success) System.exit(65);
    }

    /**
     * Analyzes one line at a time until the input ends.
     */
    private static void runPrompt(Config config) throws IOException {
        InputStreamReader input = new InputStreamReader(System.in, StandardCharsets.UTF_8);
        BufferedReader reader = new BufferedReader(input);

        for (;;) {
            System.out.print("> ");
            String line = reader.readLine();
            // Exit shortcut was triggered
            if (line == null) break;
            run(line, config);
        }
    }

    private static boolean run(String source, Config config) {
        AnalysisResult result = analyze(source, config);

        if (config.showTokens()) {
            for (TokenView token : result.tokens()) {
                System.out.printf("%-16s %-14s %d:%d  %s%n", token.kind(), token.semanticGroup(), token.line(),
                        token.column(), token.lexeme());
            }
        }
        if (config.showTree()) System.out.print(result.parseTree());

        for (ParseError error : result.errors()) {
            System.err.println(error);
        }
        return result.success();
    }
}
