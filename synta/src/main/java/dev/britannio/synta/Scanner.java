package dev.britannio.synta;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import static dev.britannio.synta.TokenType.*;

/**
 * Splits Synta source text into tokens.
 *
 * Scanning never fails. Characters that start no token become {@code ILLEGAL}
 * tokens, unterminated strings and comments keep whatever was consumed, and the
 * token list always ends with {@code EOF}.
 *
 * Columns count code points, so a character outside the Basic Multilingual
 * Plane is one column wide and one token.
 */
class Scanner {
    private static final Logger log = LogManager.getLogger(Scanner.class);

    private final String source;
    private final List<Token> tokens = new ArrayList<>();

    /**
     * Location of the <b>first</b> character of the lexeme being scanned.
     */
    private int start = 0;
    private int startLine = 1;
    private int startColumn = 1;

    /**
     * Location of the <b>current</b> character being scanned.
     */
    private int current = 0;

    private int line = 1;
    private int column = 1;

    /**
     * Delimiters that never begin a longer operator.
     */
    private static final Map<Character, TokenType> delimiters;

    static {
        delimiters = new HashMap<>();
        delimiters.put('(', LPAREN);
        delimiters.put(')', RPAREN);
        delimiters.put('[', LBRACKET);
        delimiters.put(']', RBRACKET);
        delimiters.put('{', LBRACE);
        delimiters.put('}', RBRACE);
        delimiters.put(',', COMMA);
        delimiters.put('^', BITWISE_XOR);
        delimiters.put(';', STATEMENT_END);
        delimiters.put('~', STATEMENT_END);
        delimiters.put('$', DOLLAR);
    }

    Scanner(String source) {
        this.source = source;
    }

    List<Token> scanTokens() {
        while (!isAtEnd()) {
            skipWhitespace();
            if (isAtEnd()) break;

            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }

        tokens.add(new Token(EOF, "", line, column));
        log.debug("Scanned {} tokens from {} characters", tokens.size(), source.length());
        return tokens;
    }

    private void scanToken() {
        char c = peek();

        // Comment openers share their first character with '<' and '!'.
        if (c == '<' && peekNext() == '!') {
            blockComment();
            return;
        }
        if (c == '!' && peekNext() == '>') {
            lineComment();
            return;
        }

        if (c == '@') {
            decorator();
        } else if (isAlpha(peekCodePoint())) {
            identifier();
        } else if (isDigit(c)) {
            number();
        } else if (c == '"' || c == '\'') {
            string();
        } else if (delimiters.containsKey(c)) {
            advance();
            addToken(delimiters.get(c));
        } else {
            operator(advance());
        }
    }

    /**
     * Resolves an operator from its leading character, preferring the longest
     * spelling that matches.
     */
    private void operator(char c) {
        switch (c) {
            case '+' -> addToken(match('+') ? INCREMENT : match('=') ? PLUS_ASSIGN : PLUS);
            case '-' -> addToken(match('-') ? DECREMENT : match('=') ? MINUS_ASSIGN : match('>') ? ARROW : MINUS);
            case '*' -> addToken(match('=') ? MULT_ASSIGN : MULTIPLY);
            case '/' -> addToken(match('=') ? DIV_ASSIGN : DIVIDE);
            case '%' -> addToken(match('=') ? MOD_ASSIGN : MODULO);
            // A lone '=' is not an operator, assignment is spelled ':=' or '=:'.
            case '=' -> addToken(match('=') ? EQ : match(':') ? ASSIGN : match('>') ? FAT_ARROW : ILLEGAL);
            case ':' -> addToken(match('=') ? BIND_ASSIGN : match(':') ? DOUBLE_COLON : COLON);
            case '!' -> addToken(match('=') ? NEQ : NOT);
            case '<' -> addToken(match('=') ? LTE : LT);
            case '>' -> addToken(match('=') ? GTE : GT);
            case '&' -> addToken(match('&') ? AND : AMPERSAND);
            case '|' -> {
                if (match('|')) {
                    addToken(OR);
                } else if (match('>')) {
                    addToken(match('>') ? PIPE_PARALLEL : PIPE_RIGHT);
                } else {
                    addToken(PIPE_OP);
                }
            }
            case '.' -> addToken(DOT);
            case '\n' -> addToken(NEWLINE, "\\n");
            default -> addToken(ILLEGAL);
        }
    }

    /**
     * Consumes an identifier or a keyword.
     */
    private void identifier() {
        while (isAlphaNumeric(peekCodePoint())) advance();

        String text = source.substring(start, current);
        addToken(TokenType.lookupIdent(text));
    }

    /**
     * Consumes an integer or decimal literal with an optional time unit, e.g.
     * 1234, 12.34, 30s.
     */
    private void number() {
        TokenType type = INTEGER;
        while (isDigit(peek())) advance();

        // Look for a fractional part followed by at least one digit.
        if (peek() == '.' && isDigit(peekNext())) {
            type = FLOAT;
            // Consume the "."
            advance();

            while (isDigit(peek())) advance();
        }

        char unit = peek();
        if (unit == 's' || unit == 'm' || unit == 'h') advance();

        addToken(type);
    }

    /**
     * Scans a string literal delimited by the opening quote character. Three
     * opening quotes start a raw string that may span lines and ends at three
     * closing quotes. Escapes are kept as written.
     */
    private void string() {
        char quote = advance();

        if (peek() == quote && peekNext() == quote) {
            advance();
            advance();
            tripleQuotedString(quote);
            return;
        }

        int contentStart = current;
        while (!isAtEnd() && peek() != quote) {
            if (peek() == '\\' && current + 1 < source.length()) {
                // The backslash and the character it escapes.
                advance();
            }
            advance();
        }

        String value = source.substring(contentStart, current);
        // The closing quote, if the string was terminated.
        if (!isAtEnd()) advance();
        addToken(STRING, value);
    }

    private void tripleQuotedString(char quote) {
        int contentStart = current;
        while (!isAtEnd()) {
            if (peek() == quote && peekNext() == quote && peek(2) == quote) {
                String value = source.substring(contentStart, current);
                advance();
                advance();
                advance();
                addToken(STRING, value);
                return;
            }
            advance();
        }

        addToken(STRING, source.substring(contentStart, current));
    }

    /**
     * {@code !> text}. The newline ending the comment is left for the next token.
     */
    private void lineComment() {
        advance();
        advance();

        int textStart = current;
        while (!isAtEnd() && peek() != '\n') advance();

        addToken(COMMENT_LINE, source.substring(textStart, current));
    }

    /**
     * {@code <! text !>}, possibly spanning lines. An unclosed comment runs to
     * the end of the source.
     */
    private void blockComment() {
        advance();
        advance();

        while (!isAtEnd()) {
            if (peek() == '!' && peekNext() == '>') {
                advance();
                advance();
                break;
            }
            advance();
        }

        addToken(COMMENT_MULTI);
    }

    /**
     * {@code @name}. Known role markers get their own kind, any other name is a
     * generic decorator.
     */
    private void decorator() {
        advance();
        if (!Character.isLetter(peekCodePoint())) {
            addToken(ILLEGAL);
            return;
        }

        while (isAlphaNumeric(peekCodePoint())) advance();

        String name = source.substring(start + 1, current);
        TokenType type = switch (name) {
            case "agent" -> AT_AGENT;
            case "task" -> AT_TASK;
            case "step" -> AT_STEP;
            case "intent" -> AT_INTENT;
            case "explain" -> AT_EXPLAIN;
            default -> DECORATOR;
        };
        addToken(type);
    }

    private void skipWhitespace() {
        while (!isAtEnd() && peek() != '\n' && Character.isWhitespace(peek())) advance();
    }

    private boolean match(char expected) {
        // There is no character at `current`.
        if (isAtEnd()) return false;
        // The current character is not the one we're looking for.
        if (source.charAt(current) != expected) return false;

        advance();
        return true;
    }

    /**
     * @return the current character without advancing the scanner to the next character.
     */
    private char peek() {
        return peek(0);
    }

    /**
     * @return the next character without advancing the scanner.
     */
    private char peekNext() {
        return peek(1);
    }

    private char peek(int offset) {
        // \0 is the null character.
        if (current + offset >= source.length()) return '\0';
        return source.charAt(current + offset);
    }

    /**
     * @return the code point at {@code current}, or 0 at the end.
     */
    private int peekCodePoint() {
        if (isAtEnd()) return 0;
        return source.codePointAt(current);
    }

    private boolean isAlpha(int codePoint) {
        return Character.isLetter(codePoint) || codePoint == '_';
    }

    private boolean isAlphaNumeric(int codePoint) {
        return isAlpha(codePoint) || (codePoint >= '0' && codePoint <= '9');
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    /**
     * Consumes one code point and returns its first char. A surrogate pair is
     * consumed whole.
     */
    private char advance() {
        char c = source.charAt(current);
        current += Character.charCount(source.codePointAt(current));
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private void addToken(TokenType type) {
        addToken(type, source.substring(start, current));
    }

    private void addToken(TokenType type, String lexeme) {
        tokens.add(new Token(type, lexeme, startLine, startColumn));
    }
}
