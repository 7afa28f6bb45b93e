package dev.britannio.synta;

/**
 * A token as presented outside the scanner, with its kind and semantic group
 * as stable strings.
 */
public record TokenView(String lexeme, String kind, String semanticGroup, int line, int column) {

    static TokenView of(Token token) {
        return new TokenView(token.lexeme, token.type.name(), token.type.semanticGroup(), token.line, token.column);
    }
}
