package dev.britannio.synta;

import java.util.List;

/**
 * Output of {@link Parser#parse()}: the program, never null, and everything
 * that went wrong while building it.
 */
public record ParseResult(Node.Program program, List<ParseError> errors, List<String> warnings) {

    public ParseResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public boolean success() {
        return errors.isEmpty();
    }
}
