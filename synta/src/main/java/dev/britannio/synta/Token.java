package dev.britannio.synta;

public class Token {
    final TokenType type;

    /**
     * The text this token was scanned from. Strings drop their quotes, line
     * comments drop their marker.
     */
    final String lexeme;

    /**
     * 1-based position of the first character of the token.
     */
    final int line;
    final int column;

    public Token(TokenType type, String lexeme, int line, int column) {
        this.type = type;
        this.lexeme = lexeme;
        this.line = line;
        this.column = column;
    }

    public TokenType type() {
        return type;
    }

    public String lexeme() {
        return lexeme;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    public String toString() {
        return "<" + type + ", " + lexeme + ", " + line + ":" + column + ">";
    }
}
