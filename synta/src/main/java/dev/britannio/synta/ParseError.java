package dev.britannio.synta;

/**
 * A problem found while parsing. Errors are collected in source order and
 * returned with the tree, parsing continues after each one.
 */
public record ParseError(int line, int column, String message, Kind kind) {

    public enum Kind {
        SYNTAX("syntax"),
        /** Not produced by the parser, kept for checks layered on top of it. */
        SEMANTIC("semantic");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    static ParseError syntax(Token token, String message) {
        return new ParseError(token.line, token.column, message, Kind.SYNTAX);
    }

    @Override
    public String toString() {
        return "[line " + line + ", column " + column + "] Error: " + message;
    }
}
