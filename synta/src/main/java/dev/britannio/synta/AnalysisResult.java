package dev.britannio.synta;

import java.util.List;

/**
 * Everything {@link Synta#analyze(String)} learns about a source text.
 *
 * @param success   true when {@code errors} is empty
 * @param tokens    every token, ending with {@code EOF}
 * @param parseTree the formatted syntax tree
 * @param errors    syntax errors in source order
 * @param warnings  reserved, currently always empty
 */
public record AnalysisResult(boolean success, List<TokenView> tokens, String parseTree, List<ParseError> errors,
        List<String> warnings) {

    public AnalysisResult {
        tokens = List.copyOf(tokens);
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }
}
