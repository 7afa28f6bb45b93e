package dev.britannio.synta;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import static dev.britannio.synta.TokenType.*;

/* Synta GRAMMAR (lowest to highest precedence)
--------------------------------------------------------------
program        → statement* EOF
statement      → configBlock | decoratorStmt | allowStmt | agentDecl | taskDecl
               | varDecl | typedDecl | fnDecl | structDecl | ifStmt | whileStmt
               | forStmt | loopStmt | guardStmt | matchStmt | switchStmt
               | returnStmt | asyncStmt | emitStmt | listenStmt | tryStmt
               | watchStmt | onStmt | withStmt | snapshotStmt | restoreStmt
               | expression
configBlock    → NAME ":" map
agentDecl      → "@agent" IDENTIFIER "{" ( NAME ":" expression )* "}"
taskDecl       → "task" IDENTIFIER "{" ( NAME ":" expression )* "}"
varDecl        → ( "bind" | "const" | "craft" ) NAME ( ":" TYPE )? ( ( ":=" | "=:" ) expression )?
typedDecl      → TYPE NAME ( ( ":=" | "=:" ) expression )?
fnDecl         → "async"? "fn" DECORATOR? IDENTIFIER "(" params? ")" ( ( "->" | "=>" ) TYPE )? "::"? block
structDecl     → "struct" IDENTIFIER "{" ( NAME ( ":" TYPE )? )* "}"
ifStmt         → "if" expression ( "::" statement | block ) ( ( "else" | "elif" ) ... )?
whileStmt      → "while" expression ( "::" statement | block )
forStmt        → "for" NAME "in" expression block
               | "for" expression? ";" expression? ";" expression? "concurrent"? block
loopStmt       → "loop" ( "while" ( NAME "from" expression "to" expression | expression )
               | "foreach" NAME "in" expression | "parallel" NAME "in" expression )? "::"? body
guardStmt      → "guard" expression "::" body ( "else" "::"? body )?
matchStmt      → "match" expression "::" "{" ( ( expression | "default" ) "::" body )* "}"
switchStmt     → "switch" expression "{" ( "case" expression block | "default" block )* "}"
block          → "{" statement* "}"
expression     → assignment
assignment     → pipeline ( ( ":=" | "=:" | "+=" | "-=" | "*=" | "/=" | "%=" ) assignment )?
pipeline       → logic_or ( ( "|>" | "|>>" ) logic_or )*
logic_or       → logic_and ( "||" logic_and )*
logic_and      → equality ( "&&" equality )*
equality       → comparison ( ( "!=" | "==" ) comparison )*
comparison     → term ( ( ">" | ">=" | "<" | "<=" ) term )*
term           → factor ( ( "-" | "+" ) factor )*
factor         → unary ( ( "/" | "*" | "%" ) unary )*
unary          → ( "!" | "-" | "+" ) unary | "await" unary | postfix
postfix        → primary ( "(" arguments? ")" | "[" expression "]" | "." NAME | "++" | "--" | "->" expression )*
primary        → literal | NAME | "(" expression ( "," expression )* ")" | array | map | "async" block
*/

/**
 * Converts a sequence of tokens into a syntax tree using Recursive Descent.
 *
 * The parser never throws. Every problem becomes a {@link ParseError} and the
 * parser recovers locally: a bad leading token is skipped, a construct missing
 * a required brace is abandoned, and a malformed declaration skips to the next
 * statement boundary. Productions return {@code null} when they recorded an
 * error and built nothing, callers drop those results. Input nested more than
 * {@link #MAX_DEPTH} levels deep is reported and skipped.
 */
class Parser {
    private static final Logger log = LogManager.getLogger(Parser.class);

    /**
     * Keywords that may name a field of an agent, task or configuration block.
     */
    private static final Set<TokenType> fieldNames = EnumSet.of(
            AGENT, CORE, MODEL, TOOLS, ROLE, MODE, SYS_PROMPT, MAX_CONCURRENT_REQUESTS, RETRY_POLICY,
            TYPE, CONTEXT, MEMORY, FLOW, TIMEOUT, TASK, EMIT, PROMPT, STRATEGY, WINDOW, ALERT_THRESHOLD,
            INPUT, ACTION, EXECUTION, RETRY, ENABLED, MAX, DEPENDS_ON, CONFIG, OUTPUTS, BREAKPOINTS,
            ON_CONCUR_DEADLOCK, ON_LOOP, ON_TIMEOUT, GLOBAL);

    /**
     * Keywords that read as plain names inside expressions, so that calls like
     * {@code print(x)} or {@code now()} parse.
     */
    private static final Set<TokenType> expressionNames = EnumSet.of(
            // I/O
            READ, WRITE, PRINT, LOG, SAVE, FLOW, CONTEXT, MEMORY,
            // Debug
            DEBUG, CHECKPOINT, TRACE, ASSERT, CONFIGURE, GENERATE_REPORT, BREAKPOINT,
            // AI
            THINK, ASK, PROMPT, ADAPT, CALL_API, TRAIN, EVALUATE, REASON, OBSERVE,
            // Agent operations
            DELEGATE, ROUTE, COMPOSE, INSPECT, CREATE_POOL, MAX_WORKERS, SUBMIT, SUBMIT_DELAYED, JOIN, NOW,
            EXECUTION_TIME, REPORT,
            // Concurrency
            EMIT, LISTEN, DISPATCH, MERGE, TASK, CONCURRENT, STAGE, GATHER,
            // Special constructs
            WITH, THEN, DEFER, PIPE, PASS, THROUGH, RANGE, ALLOW, PSEUDO, STRATEGY, TIMEOUT, WINDOW,
            ALERT_THRESHOLD, WATCH, ON, SNAPSHOT, RESTORE,
            // Types
            TYPE, CAST, ANY, NONE, TRAIT);

    private static final Set<TokenType> typeNames = EnumSet.of(
            INT_TYPE, FLOAT_TYPE, STR_TYPE, BOOL_TYPE, CHAR_TYPE, MAP_TYPE, ARRAY_TYPE, ANY, NONE, IDENTIFIER);

    private static final Set<TokenType> assignments = EnumSet.of(
            ASSIGN, BIND_ASSIGN, PLUS_ASSIGN, MINUS_ASSIGN, MULT_ASSIGN, DIV_ASSIGN, MOD_ASSIGN);

    /**
     * Tokens that begin a statement, where {@link #synchronize()} stops.
     */
    private static final Set<TokenType> statementStarts = EnumSet.of(
            BIND, CONST, CRAFT, FN, STRUCT, IF, WHILE, FOR, LOOP, GUARD, MATCH, SWITCH, RETURN, ASYNC,
            EMIT, LISTEN, TRY, WATCH, ON, WITH, SNAPSHOT, RESTORE, TASK, AT_AGENT, DECORATOR);

    /**
     * Deepest nesting of statements and expressions the parser descends into.
     * Each level costs a handful of Java stack frames, so the limit keeps deep
     * input from overflowing the stack.
     */
    static final int MAX_DEPTH = 255;

    private final List<Token> tokens;
    private final List<ParseError> errors = new ArrayList<>();
    private int current = 0;
    private int depth = 0;

    Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    ParseResult parse() {
        List<Node> statements = new ArrayList<>();

        while (true) {
            skipTrivia();
            if (isAtEnd()) break;

            int start = current;
            append(statements, statement());
            skipTerminators();
            // A production that consumed nothing would loop forever.
            if (current == start) advance();
        }

        log.debug("Parsed {} statements with {} errors", statements.size(), errors.size());
        return new ParseResult(new Node.Program(statements), errors, List.of());
    }

    private Node statement() {
        return nested(this::dispatchStatement);
    }

    private Node dispatchStatement() {
        skipTrivia();
        if (isAtEnd()) return null;

        if (isConfigBlockStart()) return configBlock();

        return switch (peek().type) {
            case DECORATOR, AT_TASK, AT_STEP, AT_INTENT, AT_EXPLAIN -> decoratorStatement();
            case ALLOW -> allowStatement();
            case AT_AGENT -> fieldBlockDeclaration(Node.Declaration.Kind.AGENT);
            case TASK -> fieldBlockDeclaration(Node.Declaration.Kind.TASK);
            case LOOP -> loopStatement();
            case GUARD -> guardStatement();
            case MATCH -> matchStatement();
            case WATCH -> watchStatement();
            case BIND, CONST, CRAFT -> varDeclaration();
            case INT_TYPE, FLOAT_TYPE, STR_TYPE, BOOL_TYPE, CHAR_TYPE ->
                    peek(1).type == IDENTIFIER ? typedDeclaration() : expression();
            case FN -> {
                advance();
                yield function(false);
            }
            case IF -> {
                advance();
                yield ifStatement();
            }
            case WHILE -> whileStatement();
            case FOR -> forStatement();
            case SWITCH -> switchStatement();
            case RETURN -> returnStatement();
            case STRUCT -> structDeclaration();
            case ASYNC -> async();
            case EMIT -> emitStatement();
            case LISTEN -> listenStatement();
            case TRY -> tryStatement();
            case ON -> onStatement();
            case WITH -> withStatement();
            case SNAPSHOT -> snapshotStatement();
            case RESTORE -> restoreStatement();
            default -> expression();
        };
    }

    /**
     * {@code name: { ... }} is a labelled map, not a name followed by a type.
     */
    private boolean isConfigBlockStart() {
        TokenType type = peek().type;
        boolean named = type == IDENTIFIER || type == BIND || type == CONST || type == CRAFT
                || fieldNames.contains(type);
        return named && peek(1).type == COLON && peek(2).type == LBRACE;
    }

    /**
     * BNF: NAME ":" map
     */
    private Node configBlock() {
        Token name = advance();
        advance();
        return new Node.ConfigBlock(name.lexeme, mapLiteral());
    }

    /**
     * BNF: DECORATOR IDENTIFIER? ( "(" arguments? ")" )?
     */
    private Node decoratorStatement() {
        Token decorator = advance();

        String name = null;
        if (check(IDENTIFIER)) name = advance().lexeme;

        List<Node> arguments = List.of();
        if (match(LPAREN)) arguments = arguments();

        return new Node.Decorator(decorator.lexeme, name, arguments);
    }

    /**
     * BNF: "allow" NAME ( "(" arguments? ")" )?
     *
     * Sugar for a call to {@code allow_NAME}.
     */
    private Node allowStatement() {
        advance();

        if (!isName(peek().type)) {
            error(peek(), "expected function name after 'allow'");
            return null;
        }
        Token name = advance();

        List<Node> arguments = List.of();
        if (match(LPAREN)) arguments = arguments();

        return new Node.CallExpression(new Node.Identifier("allow_" + name.lexeme), arguments);
    }

    /**
     * BNF: ( "@agent" | "task" ) IDENTIFIER "{" ( NAME ":" expression )* "}"
     *
     * A bad field name or a missing ':' is reported and skipped, the rest of
     * the block is still read.
     */
    private Node fieldBlockDeclaration(Node.Declaration.Kind kind) {
        advance();
        String what = kind.keyword();

        Token name = consume(IDENTIFIER, "expected " + what + " name");
        if (name == null) return null;
        skipNewlines();
        if (consume(LBRACE, "expected '{' after " + what + " name") == null) return null;

        List<Node.Field> fields = new ArrayList<>();
        while (true) {
            skipSeparators();
            if (check(RBRACE) || isAtEnd()) break;

            Token field = peek();
            if (!isFieldName(field.type)) {
                error(field, "expected field name, got " + field.type);
                advance();
                continue;
            }
            advance();

            if (!match(COLON)) {
                error(peek(), "expected ':' after field name");
                if (!check(RBRACE)) advance();
                continue;
            }

            Node value = expression();
            if (value != null) fields.add(new Node.Field(field.lexeme, null, value));
        }

        consume(RBRACE, "expected '}' after " + what + " body");
        return Node.Declaration.withFields(kind, name.lexeme, fields);
    }

    /**
     * BNF: ( "bind" | "const" | "craft" ) NAME ( ":" TYPE )? ( ( ":=" | "=:" ) expression )?
     */
    private Node varDeclaration() {
        Token keyword = advance();
        Node.Declaration.Kind kind = Node.Declaration.Kind.fromKeyword(keyword.type);

        if (!isFieldName(peek().type)) {
            error(peek(), "expected variable name after '" + keyword.lexeme + "'");
            synchronize();
            return null;
        }
        Token name = advance();

        String type = null;
        if (match(COLON)) {
            if (typeNames.contains(peek().type)) {
                type = advance().lexeme;
            } else {
                error(peek(), "expected type after ':'");
            }
        }

        return initializer(kind, name, type);
    }

    /**
     * BNF: TYPE IDENTIFIER ( ( ":=" | "=:" ) expression )?
     *
     * Shorthand for a {@code bind} with an explicit type.
     */
    private Node typedDeclaration() {
        Token type = advance();
        Token name = advance();
        return initializer(Node.Declaration.Kind.BIND, name, type.lexeme);
    }

    private Node initializer(Node.Declaration.Kind kind, Token name, String type) {
        if (match(ASSIGN, BIND_ASSIGN)) {
            return Node.Declaration.variable(kind, name.lexeme, type, expression());
        }

        if (!isAtBoundary()) {
            error(peek(), "expected ':=' or '=:' after '" + name.lexeme + "'");
            synchronize();
        }
        return Node.Declaration.variable(kind, name.lexeme, type, null);
    }

    /**
     * BNF: DECORATOR? IDENTIFIER "(" parameters? ")" ( ( "->" | "=>" ) TYPE )? "::"? block
     *
     * Called with the {@code fn} keyword already consumed.
     */
    private Node function(boolean async) {
        String decorator = null;
        if (check(AT_AGENT, AT_TASK, AT_STEP, AT_INTENT, AT_EXPLAIN, DECORATOR)) {
            decorator = advance().lexeme;
        }

        Token name = consume(IDENTIFIER, "expected function name");
        if (name == null) return null;
        if (consume(LPAREN, "expected '(' after function name") == null) return null;

        List<Node.Parameter> parameters = new ArrayList<>();
        skipNewlines();
        while (!check(RPAREN) && !isAtEnd()) {
            if (!isName(peek().type)) {
                error(peek(), "expected parameter name");
                break;
            }
            Token parameter = advance();

            String type = null;
            if (match(COLON) && typeNames.contains(peek().type)) type = advance().lexeme;
            parameters.add(new Node.Parameter(parameter.lexeme, type));

            skipNewlines();
            if (!match(COMMA)) break;
            skipNewlines();
        }
        if (consume(RPAREN, "expected ')' after parameters") == null) return null;

        String returnType = null;
        if (match(ARROW, FAT_ARROW) && typeNames.contains(peek().type)) {
            returnType = advance().lexeme;
        }

        match(DOUBLE_COLON);
        skipNewlines();
        if (consume(LBRACE, "expected '{' before function body") == null) return null;
        List<Node> body = block();

        return Node.Declaration.function(name.lexeme, parameters, returnType, body, decorator, async);
    }

    /**
     * BNF: "struct" IDENTIFIER "{" ( NAME ( ":" TYPE )? )* "}"
     */
    private Node structDeclaration() {
        advance();

        Token name = consume(IDENTIFIER, "expected struct name");
        if (name == null) return null;
        skipNewlines();
        if (consume(LBRACE, "expected '{' after struct name") == null) return null;

        List<Node.Field> fields = new ArrayList<>();
        while (true) {
            skipSeparators();
            if (check(RBRACE) || isAtEnd()) break;

            Token field = peek();
            if (!isFieldName(field.type)) {
                error(field, "expected field name, got " + field.type);
                advance();
                continue;
            }
            advance();

            String type = null;
            if (match(COLON)) {
                if (typeNames.contains(peek().type)) {
                    type = advance().lexeme;
                } else {
                    error(peek(), "expected type after ':'");
                }
            }
            fields.add(new Node.Field(field.lexeme, type, null));
        }

        consume(RBRACE, "expected '}' after struct body");
        return Node.Declaration.withFields(Node.Declaration.Kind.STRUCT, name.lexeme, fields);
    }

    /**
     * BNF: expression ( "::" statement | block ) ( ( "else" | "elif" ) ... )?
     *
     * Called with {@code if} or {@code elif} already consumed. An {@code elif}
     * becomes a nested if in the else branch.
     */
    private Node ifStatement() {
        Token keyword = previous();
        Node condition = expression();
        if (condition == null) {
            error(peek(), "expected condition after '" + keyword.lexeme + "'");
            return null;
        }

        boolean inline;
        List<Node> thenBody;
        if (match(DOUBLE_COLON)) {
            inline = true;
            thenBody = single(statement());
        } else if (match(LBRACE)) {
            inline = false;
            thenBody = block();
        } else {
            error(peek(), "expected '{' or '::' after if condition");
            return null;
        }

        List<Node> elseBody = List.of();
        if (matchAfterSeparators(ELIF)) {
            elseBody = single(nested(this::ifStatement));
        } else if (matchAfterSeparators(ELSE)) {
            if (match(IF)) {
                elseBody = single(nested(this::ifStatement));
            } else {
                elseBody = body();
            }
        }

        return new Node.IfStatement(condition, thenBody, elseBody, inline);
    }

    /**
     * BNF: "while" expression ( "::" statement | block )
     */
    private Node whileStatement() {
        advance();
        Node condition = expression();
        if (condition == null) {
            error(peek(), "expected condition after 'while'");
            return null;
        }

        if (match(DOUBLE_COLON)) {
            return new Node.WhileStatement(condition, single(statement()), true);
        }
        if (match(LBRACE)) {
            return new Node.WhileStatement(condition, block(), false);
        }

        error(peek(), "expected '{' or '::' after while condition");
        return null;
    }

    /**
     * BNF: "for" NAME "in" expression "concurrent"? block
     *    | "for" expression? ";" expression? ";" expression? "concurrent"? block
     */
    private Node forStatement() {
        advance();

        String variable = null;
        Node iterable = null;
        Node init = null;
        Node condition = null;
        Node update = null;

        if (isName(peek().type) && isWord(peek(1), "in")) {
            variable = advance().lexeme;
            advance();
            iterable = expression();
        } else {
            if (!check(STATEMENT_END)) init = expression();
            consume(STATEMENT_END, "expected ';' after loop initializer");

            if (!check(STATEMENT_END)) condition = expression();
            consume(STATEMENT_END, "expected ';' after loop condition");

            if (!check(LBRACE, CONCURRENT)) update = expression();
        }

        boolean concurrent = match(CONCURRENT);

        if (consume(LBRACE, "expected '{' before loop body") == null) return null;
        List<Node> body = block();

        return new Node.ForStatement(variable, init, condition, update, iterable, body, concurrent);
    }

    /**
     * BNF: "loop" ( "while" ( NAME "from" expression "to" expression | expression )
     *             | "foreach" NAME "in" expression
     *             | "parallel" NAME "in" expression )? "::"? body
     */
    private Node loopStatement() {
        advance();

        String variable = null;
        Node init = null;
        Node condition = null;
        Node iterable = null;
        boolean concurrent = false;

        if (match(WHILE)) {
            if (isName(peek().type) && peek(1).type == FROM) {
                // loop while i from 0 to 10
                variable = advance().lexeme;
                advance();
                init = new Node.BinaryOp(new Node.Identifier(variable), ":=", expression());
                if (isWord(peek(), "to")) {
                    advance();
                    condition = new Node.BinaryOp(new Node.Identifier(variable), "to", expression());
                } else {
                    error(peek(), "expected 'to' after loop start");
                }
            } else {
                condition = expression();
            }
        } else if (isWord(peek(), "foreach") || isWord(peek(), "parallel")) {
            concurrent = advance().lexeme.equals("parallel");
            if (isName(peek().type)) {
                variable = advance().lexeme;
            } else {
                error(peek(), "expected loop variable");
            }

            if (isWord(peek(), "in")) {
                advance();
            } else {
                error(peek(), "expected 'in' after loop variable");
            }
            iterable = expression();
        }

        match(DOUBLE_COLON);
        List<Node> body = body();

        return new Node.ForStatement(variable, init, condition, null, iterable, body, concurrent);
    }

    /**
     * BNF: "guard" expression "::" body ( "else" "::"? body )?
     */
    private Node guardStatement() {
        advance();
        Node condition = expression();

        if (!match(DOUBLE_COLON)) error(peek(), "expected '::' after guard condition");
        List<Node> thenBody = body();

        List<Node> elseBody = List.of();
        if (matchAfterSeparators(ELSE)) elseBody = body();

        return new Node.IfStatement(condition, thenBody, elseBody, true);
    }

    /**
     * BNF: "match" expression "::" "{" ( ( expression | "default" ) "::" body )* "}"
     */
    private Node matchStatement() {
        advance();
        Node expression = expression();

        if (!match(DOUBLE_COLON)) error(peek(), "expected '::' after match expression");
        skipNewlines();
        if (consume(LBRACE, "expected '{' after match expression") == null) return null;

        List<Node.Case> cases = new ArrayList<>();
        List<Node> defaultBody = List.of();
        while (true) {
            skipSeparators();
            if (check(RBRACE) || isAtEnd()) break;

            boolean isDefault = match(DEFAULT);
            Node value = isDefault ? null : expression();

            if (!match(DOUBLE_COLON)) {
                error(peek(), "expected '::' after match case");
                if (!check(RBRACE)) advance();
                continue;
            }

            List<Node> body = body();
            if (isDefault) {
                defaultBody = body;
            } else {
                cases.add(new Node.Case(value, body));
            }
        }

        consume(RBRACE, "expected '}' after match arms");
        return new Node.SwitchStatement(expression, cases, defaultBody);
    }

    /**
     * BNF: "switch" expression "{" ( "case" expression block | "default" block )* "}"
     */
    private Node switchStatement() {
        advance();
        Node expression = expression();
        if (expression == null) {
            error(peek(), "expected expression after 'switch'");
            return null;
        }
        if (consume(LBRACE, "expected '{' after switch expression") == null) return null;

        List<Node.Case> cases = new ArrayList<>();
        List<Node> defaultBody = List.of();
        while (true) {
            skipSeparators();
            if (check(RBRACE) || isAtEnd()) break;

            if (match(CASE)) {
                Node value = expression();
                if (consume(LBRACE, "expected '{' after case value") == null) continue;
                cases.add(new Node.Case(value, block()));
            } else if (match(DEFAULT)) {
                if (consume(LBRACE, "expected '{' after 'default'") == null) continue;
                defaultBody = block();
            } else {
                error(peek(), "expected 'case' or 'default' in switch statement");
                advance();
            }
        }

        consume(RBRACE, "expected '}' after switch body");
        return new Node.SwitchStatement(expression, cases, defaultBody);
    }

    /**
     * BNF: "return" expression?
     */
    private Node returnStatement() {
        advance();

        Node value = null;
        if (!isAtBoundary()) value = expression();

        return new Node.ReturnStatement(value);
    }

    /**
     * BNF: "async" ( "fn" fnDecl | block )
     */
    private Node async() {
        advance();

        if (match(FN)) return function(true);
        if (match(LBRACE)) return new Node.AsyncStatement(block());

        error(peek(), "expected '{' or 'fn' after 'async'");
        return null;
    }

    /**
     * BNF: "await" ( ( "all" | "race" ) "{" expression* "}" | unary )
     *
     * Called with {@code await} already consumed.
     */
    private Node await() {
        if ((isWord(peek(), "all") || isWord(peek(), "race")) && peek(1).type == LBRACE) {
            String combinator = advance().lexeme;
            advance();

            List<Node> operations = new ArrayList<>();
            while (true) {
                skipSeparators();
                if (check(RBRACE) || isAtEnd()) break;

                int start = current;
                append(operations, expression());
                if (current == start) advance();
            }
            consume(RBRACE, "expected '}' after " + combinator + " block");

            return new Node.AwaitExpression(new Node.ArrayLiteral(operations), combinator);
        }

        return new Node.AwaitExpression(unary(), null);
    }

    /**
     * BNF: "emit" NAME map?
     */
    private Node emitStatement() {
        advance();

        if (!isName(peek().type)) {
            error(peek(), "expected event name after 'emit'");
            return null;
        }
        String event = advance().lexeme;

        Node data = check(LBRACE) ? mapLiteral() : null;
        return new Node.EmitStatement(event, data);
    }

    /**
     * BNF: "listen" NAME "{" expression? "}"
     */
    private Node listenStatement() {
        advance();

        if (!isName(peek().type)) {
            error(peek(), "expected event name after 'listen'");
            return null;
        }
        String event = advance().lexeme;

        if (consume(LBRACE, "expected '{' after event name") == null) return null;
        skipTrivia();
        Node handler = check(RBRACE) ? null : expression();
        skipSeparators();
        if (consume(RBRACE, "expected '}' after listen handler") == null) return null;

        return new Node.ListenStatement(event, handler);
    }

    /**
     * BNF: "try" block ( "catch" IDENTIFIER? block )?
     */
    private Node tryStatement() {
        advance();
        if (consume(LBRACE, "expected '{' after 'try'") == null) return null;
        List<Node> tryBody = block();

        if (!matchAfterSeparators(CATCH)) {
            return new Node.TryCatch(tryBody, false, null, List.of());
        }

        String parameter = null;
        if (check(IDENTIFIER)) parameter = advance().lexeme;
        if (consume(LBRACE, "expected '{' after 'catch'") == null) return null;

        return new Node.TryCatch(tryBody, true, parameter, block());
    }

    /**
     * BNF: "watch" expression "::"? ( block | "(" arguments? ")" ( "->" expression )? | expression )
     */
    private Node watchStatement() {
        advance();
        Node expression = expression();
        match(DOUBLE_COLON);

        if (match(LBRACE)) {
            return new Node.Watch(expression, List.of(), null, block());
        }

        if (match(LPAREN)) {
            List<Node> parameters = arguments();
            if (match(ARROW)) {
                return new Node.Watch(expression, parameters, expression(), List.of());
            }
            return new Node.Watch(expression, List.of(), group(parameters), List.of());
        }

        Node handler = isAtBoundary() ? null : expression();
        return new Node.Watch(expression, List.of(), handler, List.of());
    }

    /**
     * BNF: "on" expression "::"? ( block | "(" arguments? ")" "->" statement | statement )
     */
    private Node onStatement() {
        advance();
        Node event = expression();
        match(DOUBLE_COLON);

        if (match(LBRACE)) {
            return new Node.On(event, List.of(), null, block());
        }

        if (match(LPAREN)) {
            List<Node> parameters = arguments();
            if (match(ARROW)) {
                return new Node.On(event, parameters, statement(), List.of());
            }
            return new Node.On(event, List.of(), group(parameters), List.of());
        }

        Node handler = isAtBoundary() ? null : statement();
        return new Node.On(event, List.of(), handler, List.of());
    }

    /**
     * BNF: "with" "context" map? "::"? block?
     */
    private Node withStatement() {
        advance();

        if (!match(CONTEXT)) error(peek(), "expected 'context' after 'with'");
        Node context = check(LBRACE) ? mapLiteral() : null;

        match(DOUBLE_COLON);
        skipNewlines();
        List<Node> body = match(LBRACE) ? block() : List.of();

        return new Node.With(context, body);
    }

    /**
     * BNF: "snapshot" expression ( "->" expression )?
     */
    private Node snapshotStatement() {
        advance();
        Node source = expression();

        // The arrow binds as a postfix operator, so the target arrives inside
        // the source expression.
        if (source instanceof Node.BinaryOp && ((Node.BinaryOp) source).operator.equals("->")) {
            Node.BinaryOp arrow = (Node.BinaryOp) source;
            return new Node.Snapshot(arrow.left, arrow.right);
        }

        return new Node.Snapshot(source, null);
    }

    /**
     * BNF: "restore" expression "from" expression
     */
    private Node restoreStatement() {
        advance();
        Node target = expression();

        if (!match(FROM)) error(peek(), "expected 'from' in restore statement");
        Node source = expression();

        return new Node.Restore(target, source);
    }

    /**
     * BNF: "{" statement* "}"
     *
     * Called with the opening brace already consumed.
     */
    private List<Node> block() {
        List<Node> statements = new ArrayList<>();

        while (true) {
            skipTrivia();
            if (check(RBRACE) || isAtEnd()) break;

            int start = current;
            append(statements, statement());
            skipTerminators();
            if (current == start) advance();
        }

        consume(RBRACE, "expected '}' after block");
        return statements;
    }

    /**
     * A braced block, or a single statement when no brace follows.
     */
    private List<Node> body() {
        match(DOUBLE_COLON);
        if (match(LBRACE)) return block();
        return single(statement());
    }

    /**
     * BNF: assignment
     */
    private Node expression() {
        return nested(this::assignment);
    }

    /**
     * BNF: pipeline ( ( ":=" | "=:" | "+=" | "-=" | "*=" | "/=" | "%=" ) assignment )?
     */
    private Node assignment() {
        Node expr = pipeline();

        if (assignments.contains(peek().type)) {
            Token operator = advance();
            Node value = nested(this::assignment);
            return new Node.BinaryOp(expr, operator.lexeme, value);
        }

        return expr;
    }

    /**
     * BNF: logic_or ( ( "|>" | "|>>" ) logic_or )*
     */
    private Node pipeline() {
        Node expr = or();

        while (match(PIPE_RIGHT, PIPE_PARALLEL)) {
            Token operator = previous();
            Node right = or();
            expr = new Node.BinaryOp(expr, operator.lexeme, right);
        }

        return expr;
    }

    private Node or() {
        Node expr = and();

        while (match(OR)) {
            Token operator = previous();
            Node right = and();
            expr = new Node.BinaryOp(expr, operator.lexeme, right);
        }

        return expr;
    }

    private Node and() {
        Node expr = equality();

        while (match(AND)) {
            Token operator = previous();
            Node right = equality();
            expr = new Node.BinaryOp(expr, operator.lexeme, right);
        }

        return expr;
    }

    private Node equality() {
        Node expr = comparison();

        while (match(NEQ, EQ)) {
            Token operator = previous();
            Node right = comparison();
            expr = new Node.BinaryOp(expr, operator.lexeme, right);
        }

        return expr;
    }

    private Node comparison() {
        Node expr = term();

        while (match(GT, GTE, LT, LTE)) {
            Token operator = previous();
            Node right = term();
            expr = new Node.BinaryOp(expr, operator.lexeme, right);
        }

        return expr;
    }

    private Node term() {
        Node expr = factor();

        while (match(MINUS, PLUS)) {
            Token operator = previous();
            Node right = factor();
            expr = new Node.BinaryOp(expr, operator.lexeme, right);
        }

        return expr;
    }

    private Node factor() {
        Node expr = unary();

        while (match(DIVIDE, MULTIPLY, MODULO)) {
            Token operator = previous();
            Node right = unary();
            expr = new Node.BinaryOp(expr, operator.lexeme, right);
        }

        return expr;
    }

    /**
     * BNF: ( "!" | "-" | "+" ) unary | "await" unary | postfix
     */
    private Node unary() {
        if (match(NOT, MINUS, PLUS)) {
            Token operator = previous();
            Node right = nested(this::unary);
            return new Node.UnaryOp(operator.lexeme, right);
        }

        if (match(AWAIT)) return nested(this::await);

        return postfix();
    }

    /**
     * BNF: primary ( "(" arguments? ")" | "[" expression "]" | "." NAME | "++" | "--" | "->" expression )*
     *
     * {@code a -> b} sends {@code a} to the agent {@code b} and binds like a
     * call, with everything after the arrow as its right side.
     */
    private Node postfix() {
        Node expr = primary();

        while (true) {
            if (match(LPAREN)) {
                expr = new Node.CallExpression(expr, arguments());
            } else if (match(LBRACKET)) {
                Node index = expression();
                consume(RBRACKET, "expected ']' after index");
                expr = new Node.BinaryOp(expr, "[]", index);
            } else if (match(DOT)) {
                if (!isWord(peek())) {
                    error(peek(), "expected property name after '.'");
                    break;
                }
                expr = new Node.BinaryOp(expr, ".", new Node.Identifier(advance().lexeme));
            } else if (match(INCREMENT, DECREMENT)) {
                expr = new Node.UnaryOp(previous().lexeme + "_post", expr);
            } else if (match(ARROW)) {
                expr = new Node.BinaryOp(expr, "->", expression());
            } else {
                break;
            }
        }

        return expr;
    }

    /**
     * BNF: literal | NAME | "(" expression ( "," expression )* ")" | array | map | "async" block
     */
    private Node primary() {
        Token token = peek();
        Node.Literal.Kind literal = switch (token.type) {
            case INTEGER -> Node.Literal.Kind.INT;
            case FLOAT -> Node.Literal.Kind.FLOAT;
            case STRING -> Node.Literal.Kind.STRING;
            case TRUE, FALSE -> Node.Literal.Kind.BOOL;
            case NULL -> Node.Literal.Kind.NULL;
            default -> null;
        };
        if (literal != null) {
            advance();
            return new Node.Literal(literal, token.lexeme);
        }

        if (match(LPAREN)) return group(arguments());
        if (check(LBRACKET)) return arrayLiteral();
        if (check(LBRACE)) return mapLiteral();
        if (check(ASYNC)) return async();

        if (isName(token.type)) {
            advance();
            return new Node.Identifier(token.lexeme);
        }

        error(token, "unexpected token: " + token.type + " '" + token.lexeme + "'");
        advance();
        return null;
    }

    /**
     * A parenthesized list is its only element, or a tuple when it has more.
     */
    private Node group(List<Node> elements) {
        if (elements.size() == 1) return elements.get(0);
        return new Node.ArrayLiteral(elements);
    }

    /**
     * BNF: ( expression ( "," expression )* )? ")"
     *
     * Called with the opening parenthesis already consumed.
     */
    private List<Node> arguments() {
        List<Node> arguments = new ArrayList<>();

        skipTrivia();
        while (!check(RPAREN) && !isAtEnd()) {
            append(arguments, expression());
            skipTrivia();
            if (!match(COMMA)) break;
            skipTrivia();
        }

        consume(RPAREN, "expected ')' after arguments");
        return arguments;
    }

    /**
     * BNF: "[" ( expression ( "," expression )* )? "]"
     */
    private Node arrayLiteral() {
        advance();
        List<Node> elements = new ArrayList<>();

        skipTrivia();
        while (!check(RBRACKET) && !isAtEnd()) {
            append(elements, expression());
            skipTrivia();
            if (!match(COMMA)) break;
            skipTrivia();
        }

        consume(RBRACKET, "expected ']' after array elements");
        return new Node.ArrayLiteral(elements);
    }

    /**
     * BNF: "{" ( KEY ( ":" expression )? )* "}"
     *
     * A key on its own, {@code { name }}, is short for {@code { name: name }}.
     */
    private Node mapLiteral() {
        advance();
        List<Node.Pair> pairs = new ArrayList<>();

        while (true) {
            skipSeparators();
            if (check(RBRACE) || isAtEnd()) break;

            Token key = peek();
            if (key.type != STRING && !isWord(key)) {
                error(key, "expected field name, got " + key.type);
                advance();
                continue;
            }
            advance();

            Node keyNode = key.type == STRING
                    ? new Node.Literal(Node.Literal.Kind.STRING, key.lexeme)
                    : new Node.Identifier(key.lexeme);

            if (key.type != STRING && check(COMMA, RBRACE, NEWLINE, STATEMENT_END, COMMENT_LINE, COMMENT_MULTI)) {
                pairs.add(new Node.Pair(keyNode, new Node.Identifier(key.lexeme)));
                continue;
            }

            if (!match(COLON)) {
                error(peek(), "expected ':' after field name");
                if (!check(RBRACE)) advance();
                continue;
            }

            Node value = expression();
            if (value != null) pairs.add(new Node.Pair(keyNode, value));
        }

        consume(RBRACE, "expected '}' after map literal");
        return new Node.MapLiteral(pairs);
    }

    /**
     * Skips tokens after a malformed statement, stopping at its end or at the
     * start of the next one.
     */
    private void synchronize() {
        int skipped = 0;
        while (!isAtEnd()) {
            TokenType type = peek().type;
            if (type == STATEMENT_END || type == NEWLINE || type == RBRACE) break;
            if (statementStarts.contains(type)) break;

            advance();
            skipped++;
        }
        log.trace("Synchronized after skipping {} tokens", skipped);
    }

    /**
     * Runs a production one nesting level deeper. Past {@link #MAX_DEPTH} the
     * production is not run: the error is recorded, the rest of the nested
     * construct is skipped and the result is null.
     */
    private Node nested(Supplier<Node> production) {
        if (depth >= MAX_DEPTH) {
            error(peek(), "nested too deeply");
            skipNested();
            return null;
        }

        depth++;
        try {
            return production.get();
        } finally {
            depth--;
        }
    }

    /**
     * Skips tokens up to the closing bracket of the innermost construct still
     * open, or a terminator outside any bracket opened while skipping. The
     * closing bracket is left for the construct that owns it.
     */
    private void skipNested() {
        int open = 0;
        int skipped = 0;
        while (!isAtEnd()) {
            TokenType type = peek().type;
            if (type == LPAREN || type == LBRACKET || type == LBRACE) {
                open++;
            } else if (type == RPAREN || type == RBRACKET || type == RBRACE) {
                if (open == 0) break;
                open--;
            } else if (type == STATEMENT_END && open == 0) {
                break;
            }

            advance();
            skipped++;
        }
        log.trace("Skipped {} tokens of deeply nested input", skipped);
    }

    private boolean isAtBoundary() {
        return check(STATEMENT_END, NEWLINE, RBRACE, COMMENT_LINE, COMMENT_MULTI) || isAtEnd();
    }

    /**
     * @return true for tokens that may be used as a plain name in expressions.
     */
    private boolean isName(TokenType type) {
        return type == IDENTIFIER || expressionNames.contains(type) || fieldNames.contains(type);
    }

    private boolean isFieldName(TokenType type) {
        return type == IDENTIFIER || fieldNames.contains(type);
    }

    /**
     * @return true for identifiers and keywords, any token spelled as a word.
     */
    private boolean isWord(Token token) {
        return token.type == IDENTIFIER || TokenType.lookupIdent(token.lexeme) == token.type;
    }

    /**
     * @return true when the token is the unreserved word {@code word}, as used
     *         by {@code in}, {@code to} and the loop forms.
     */
    private boolean isWord(Token token, String word) {
        return token.type == IDENTIFIER && token.lexeme.equals(word);
    }

    private void append(List<Node> nodes, Node node) {
        if (node != null) nodes.add(node);
    }

    private List<Node> single(Node node) {
        return node == null ? List.of() : List.of(node);
    }

    private void skipNewlines() {
        while (check(NEWLINE)) advance();
    }

    /**
     * Skips newlines and comments.
     */
    private void skipTrivia() {
        while (check(NEWLINE, COMMENT_LINE, COMMENT_MULTI)) advance();
    }

    private void skipTerminators() {
        while (check(STATEMENT_END, NEWLINE, COMMENT_LINE, COMMENT_MULTI)) advance();
    }

    /**
     * Skips list separators along with trivia.
     */
    private void skipSeparators() {
        while (check(COMMA, STATEMENT_END, NEWLINE, COMMENT_LINE, COMMENT_MULTI)) advance();
    }

    /**
     * Consumes a token of the given type if it follows, looking past
     * terminators, newlines and comments. Nothing is consumed otherwise.
     */
    private boolean matchAfterSeparators(TokenType type) {
        int offset = 0;
        while (true) {
            TokenType next = peek(offset).type;
            if (next != STATEMENT_END && next != NEWLINE && next != COMMENT_LINE && next != COMMENT_MULTI) break;
            offset++;
        }

        if (peek(offset).type != type) return false;
        current += offset + 1;
        return true;
    }

    /**
     * Checks if the current token is of any of the given types, consuming it if so.
     */
    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }

        return false;
    }

    /**
     * Consumes a token of the given type, or records an error and returns null.
     */
    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();

        error(peek(), message);
        return null;
    }

    private boolean check(TokenType... types) {
        TokenType actual = peek().type;
        for (TokenType type : types) {
            if (actual == type) return true;
        }
        return false;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type == EOF;
    }

    private Token peek() {
        return peek(0);
    }

    /**
     * Bounds-checked lookahead. Past the end of the tokens this is an EOF
     * token positioned at the last token.
     */
    private Token peek(int offset) {
        int index = current + offset;
        if (index < tokens.size()) return tokens.get(index);

        if (tokens.isEmpty()) return new Token(EOF, "", 1, 1);
        Token last = tokens.get(tokens.size() - 1);
        return last.type == EOF ? last : new Token(EOF, "", last.line, last.column);
    }

    private Token previous() {
        if (current == 0) return peek();
        return tokens.get(current - 1);
    }

    private void error(Token token, String message) {
        ParseError error = ParseError.syntax(token, message);
        log.debug("Syntax error {}", error);
        errors.add(error);
    }
}
