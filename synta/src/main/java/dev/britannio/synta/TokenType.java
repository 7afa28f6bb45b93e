package dev.britannio.synta;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Every lexical category of Synta.
 *
 * Each kind carries its semantic group, a coarser label used when tokens and
 * identifiers are presented to a reader. The parser never looks at the group.
 */
public enum TokenType {
    // Literals
    IDENTIFIER("IDENTIFIER"),
    INTEGER("NUMBER"),
    FLOAT("NUMBER"),
    STRING("STRING"),
    TRUE("BOOLEAN"),
    FALSE("BOOLEAN"),
    NULL("NULL"),

    // Control flow
    IF("IF"),
    ELIF("IF"),
    ELSE("IF"),
    GUARD("IF"),
    WHILE("LOOP"),
    FOR("LOOP"),
    LOOP("LOOP"),
    SWITCH("SWITCH"),
    MATCH("SWITCH"),
    CASE("SWITCH"),
    DEFAULT("SWITCH"),
    RETURN("JUMP"),
    BREAK("JUMP"),
    CONTINUE("JUMP"),

    // Declarations
    BIND("DECLARATION"),
    CONST("DECLARATION"),
    CRAFT("DECLARATION"),
    USE("DECLARATION"),
    AS("DECLARATION"),
    FROM("DECLARATION"),
    FN("DECLARATION"),
    STRUCT("DECLARATION"),

    // Error handling
    TRY("ERROR_HANDLING"),
    CATCH("ERROR_HANDLING"),
    RAISE("ERROR_HANDLING"),

    // Type system
    TYPE("TYPE"),
    CAST("TYPE"),
    ANY("TYPE"),
    NONE("TYPE"),
    TRAIT("TYPE"),
    INT_TYPE("TYPE"),
    FLOAT_TYPE("TYPE"),
    CHAR_TYPE("TYPE"),
    BOOL_TYPE("TYPE"),
    STR_TYPE("TYPE"),
    MAP_TYPE("TYPE"),
    ARRAY_TYPE("TYPE"),

    // Concurrency
    ASYNC("CONCURRENCY"),
    AWAIT("CONCURRENCY"),
    EMIT("CONCURRENCY"),
    LISTEN("CONCURRENCY"),
    DISPATCH("CONCURRENCY"),
    MERGE("CONCURRENCY"),
    TASK("CONCURRENCY"),
    CONCURRENT("CONCURRENCY"),
    STAGE("CONCURRENCY"),
    GATHER("CONCURRENCY"),

    // Special constructs
    WITH("SPECIAL"),
    THEN("SPECIAL"),
    DEFER("SPECIAL"),
    PIPE("SPECIAL"),
    PASS("SPECIAL"),
    THROUGH("SPECIAL"),
    RANGE("SPECIAL"),
    ALLOW("SPECIAL"),
    PSEUDO("SPECIAL"),
    STRATEGY("SPECIAL"),
    TIMEOUT("SPECIAL"),
    WINDOW("SPECIAL"),
    ALERT_THRESHOLD("SPECIAL"),
    WATCH("SPECIAL"),
    ON("SPECIAL"),
    SNAPSHOT("SPECIAL"),
    RESTORE("SPECIAL"),

    // AI integration
    THINK("AI"),
    ASK("AI"),
    PROMPT("AI"),
    ADAPT("AI"),
    CALL_API("AI"),
    TRAIN("AI"),
    EVALUATE("AI"),
    REASON("AI"),
    OBSERVE("AI"),

    // Decorators
    AT_AGENT("DECORATOR"),
    AT_TASK("DECORATOR"),
    AT_STEP("DECORATOR"),
    AT_INTENT("DECORATOR"),
    AT_EXPLAIN("DECORATOR"),
    DECORATOR("DECORATOR"),

    // I/O
    READ("IO"),
    WRITE("IO"),
    PRINT("IO"),
    LOG("IO"),
    SAVE("IO"),
    FLOW("IO"),
    CONTEXT("IO"),
    MEMORY("IO"),

    // Debug
    DEBUG("DEBUG"),
    CHECKPOINT("DEBUG"),
    TRACE("DEBUG"),
    ASSERT("DEBUG"),
    CONFIGURE("DEBUG"),
    GENERATE_REPORT("DEBUG"),
    BREAKPOINT("DEBUG"),

    // Execution and configuration field words
    INPUT("EXECUTION"),
    ACTION("EXECUTION"),
    EXECUTION("EXECUTION"),
    RETRY("EXECUTION"),
    ENABLED("EXECUTION"),
    MAX("EXECUTION"),
    DEPENDS_ON("EXECUTION"),
    CONFIG("EXECUTION"),
    OUTPUTS("EXECUTION"),
    BREAKPOINTS("EXECUTION"),
    ON_CONCUR_DEADLOCK("EXECUTION"),
    ON_LOOP("EXECUTION"),
    ON_TIMEOUT("EXECUTION"),

    // Agent and system words
    AGENT("AGENT_SYSTEM"),
    CORE("AGENT_SYSTEM"),
    MODEL("AGENT_SYSTEM"),
    TOOLS("AGENT_SYSTEM"),
    ROLE("AGENT_SYSTEM"),
    MODE("AGENT_SYSTEM"),
    SYS_PROMPT("AGENT_SYSTEM"),
    MAX_CONCURRENT_REQUESTS("AGENT_SYSTEM"),
    RETRY_POLICY("AGENT_SYSTEM"),

    // Ownership and visibility modifiers
    OWN("MODIFIER"),
    MOVE("MODIFIER"),
    DROP("MODIFIER"),
    LET("MODIFIER"),
    PUB("MODIFIER"),
    PRIV("MODIFIER"),
    GLOBAL("MODIFIER"),
    UNSAFE("MODIFIER"),
    RAW("MODIFIER"),
    FUTURE("MODIFIER"),
    MACRO("MODIFIER"),

    // Agent operations
    DELEGATE("AGENT_OP"),
    ROUTE("AGENT_OP"),
    COMPOSE("AGENT_OP"),
    INSPECT("AGENT_OP"),
    CREATE_POOL("AGENT_OP"),
    MAX_WORKERS("AGENT_OP"),
    SUBMIT("AGENT_OP"),
    SUBMIT_DELAYED("AGENT_OP"),
    JOIN("AGENT_OP"),
    NOW("AGENT_OP"),
    EXECUTION_TIME("AGENT_OP"),
    REPORT("AGENT_OP"),

    // Noise words
    PLEASE("NOISE"),
    MAYBE("NOISE"),
    DO("NOISE"),

    // Arithmetic and bitwise operators
    PLUS("OPERATOR"),
    MINUS("OPERATOR"),
    MULTIPLY("OPERATOR"),
    DIVIDE("OPERATOR"),
    MODULO("OPERATOR"),
    INCREMENT("OPERATOR"),
    DECREMENT("OPERATOR"),
    BITWISE_XOR("OPERATOR"),
    AMPERSAND("OPERATOR"),
    PIPE_OP("OPERATOR"),
    DOLLAR("OPERATOR"),

    // Assignment
    ASSIGN("ASSIGNMENT"),       // =:
    BIND_ASSIGN("ASSIGNMENT"),  // :=
    PLUS_ASSIGN("ASSIGNMENT"),
    MINUS_ASSIGN("ASSIGNMENT"),
    MULT_ASSIGN("ASSIGNMENT"),
    DIV_ASSIGN("ASSIGNMENT"),
    MOD_ASSIGN("ASSIGNMENT"),

    // Comparison
    EQ("COMPARISON"),
    NEQ("COMPARISON"),
    LT("COMPARISON"),
    GT("COMPARISON"),
    LTE("COMPARISON"),
    GTE("COMPARISON"),

    // Logic
    AND("LOGICAL"),
    OR("LOGICAL"),
    NOT("LOGICAL"),

    // Arrows and pipelines
    ARROW("ARROW"),             // ->
    FAT_ARROW("ARROW"),         // =>
    PIPE_RIGHT("PIPELINE"),     // |>
    PIPE_PARALLEL("PIPELINE"),  // |>>

    // Delimiters
    LPAREN("DELIMITER"),
    RPAREN("DELIMITER"),
    LBRACKET("DELIMITER"),
    RBRACKET("DELIMITER"),
    LBRACE("DELIMITER"),
    RBRACE("DELIMITER"),
    COMMA("DELIMITER"),
    COLON("DELIMITER"),
    DOUBLE_COLON("DELIMITER"),
    DOT("DELIMITER"),
    STATEMENT_END("DELIMITER"),

    // Structural
    COMMENT_LINE("COMMENT"),
    COMMENT_MULTI("COMMENT"),
    NEWLINE("NEWLINE"),
    EOF("EOF"),
    ILLEGAL("ILLEGAL");

    private final String semanticGroup;

    TokenType(String semanticGroup) {
        this.semanticGroup = semanticGroup;
    }

    /**
     * @return the presentation group of this kind, e.g. {@code IF} for
     *         {@code ELIF} or {@code OPERATOR} for {@code MODULO}.
     */
    public String semanticGroup() {
        return semanticGroup;
    }

    /**
     * Spellings that are always reserved.
     */
    private static final Map<String, TokenType> keywords;

    /**
     * Spellings that only act as keywords inside agent and task bodies. The
     * scanner never applies this table, these always lex as identifiers.
     */
    private static final Map<String, TokenType> contextKeywords;

    static {
        Map<String, TokenType> map = new HashMap<>();
        // Control flow
        map.put("if", IF);
        map.put("elif", ELIF);
        map.put("else", ELSE);
        map.put("guard", GUARD);
        map.put("while", WHILE);
        map.put("for", FOR);
        map.put("loop", LOOP);
        map.put("switch", SWITCH);
        map.put("match", MATCH);
        map.put("case", CASE);
        map.put("default", DEFAULT);
        map.put("return", RETURN);
        map.put("await", AWAIT);
        map.put("break", BREAK);
        map.put("continue", CONTINUE);

        // Declarations
        map.put("bind", BIND);
        map.put("const", CONST);
        map.put("craft", CRAFT);
        map.put("use", USE);
        map.put("as", AS);
        map.put("from", FROM);
        map.put("fn", FN);
        map.put("struct", STRUCT);

        // Error handling
        map.put("try", TRY);
        map.put("catch", CATCH);
        map.put("raise", RAISE);

        // Type system and literals
        map.put("type", TYPE);
        map.put("cast", CAST);
        map.put("any", ANY);
        map.put("none", NONE);
        map.put("trait", TRAIT);
        map.put("int", INT_TYPE);
        map.put("float", FLOAT_TYPE);
        map.put("char", CHAR_TYPE);
        map.put("bool", BOOL_TYPE);
        map.put("str", STR_TYPE);
        map.put("Map", MAP_TYPE);
        map.put("Array", ARRAY_TYPE);
        map.put("true", TRUE);
        map.put("false", FALSE);
        map.put("null", NULL);

        // Concurrency
        map.put("async", ASYNC);
        map.put("emit", EMIT);
        map.put("listen", LISTEN);
        map.put("dispatch", DISPATCH);
        map.put("merge", MERGE);
        map.put("task", TASK);
        map.put("concurrent", CONCURRENT);
        map.put("stage", STAGE);
        map.put("gather", GATHER);

        // Special constructs
        map.put("with", WITH);
        map.put("then", THEN);
        map.put("defer", DEFER);
        map.put("pipe", PIPE);
        map.put("pass", PASS);
        map.put("through", THROUGH);
        map.put("range", RANGE);
        map.put("allow", ALLOW);
        map.put("strategy", STRATEGY);
        map.put("timeout", TIMEOUT);
        map.put("window", WINDOW);
        map.put("alert_threshold", ALERT_THRESHOLD);
        map.put("watch", WATCH);
        map.put("on", ON);
        map.put("snapshot", SNAPSHOT);
        map.put("restore", RESTORE);

        // AI integration
        map.put("think", THINK);
        map.put("ask", ASK);
        map.put("prompt", PROMPT);
        map.put("adapt", ADAPT);
        map.put("call_api", CALL_API);
        map.put("train", TRAIN);
        map.put("evaluate", EVALUATE);
        map.put("reason", REASON);
        map.put("observe", OBSERVE);

        // I/O
        map.put("read", READ);
        map.put("write", WRITE);
        map.put("print", PRINT);
        map.put("log", LOG);
        map.put("save", SAVE);
        map.put("flow", FLOW);
        map.put("context", CONTEXT);
        map.put("memory", MEMORY);

        // Debug. "debug", "trace" and "checkpoint" stay usable as names.
        map.put("assert", ASSERT);
        map.put("configure", CONFIGURE);
        map.put("generate_report", GENERATE_REPORT);
        map.put("breakpoint", BREAKPOINT);

        // Execution and configuration field words
        map.put("input", INPUT);
        map.put("action", ACTION);
        map.put("execution", EXECUTION);
        map.put("retry", RETRY);
        map.put("enabled", ENABLED);
        map.put("max", MAX);
        map.put("depends_on", DEPENDS_ON);
        map.put("config", CONFIG);
        map.put("outputs", OUTPUTS);
        map.put("breakpoints", BREAKPOINTS);
        map.put("on_concur_deadlock", ON_CONCUR_DEADLOCK);
        map.put("on_loop", ON_LOOP);
        map.put("on_timeout", ON_TIMEOUT);

        // Reserved words
        map.put("Agent", AGENT);
        map.put("Core", CORE);
        map.put("max_concurrent_requests", MAX_CONCURRENT_REQUESTS);
        map.put("retry_policy", RETRY_POLICY);
        map.put("own", OWN);
        map.put("move", MOVE);
        map.put("drop", DROP);
        map.put("let", LET);
        map.put("pub", PUB);
        map.put("priv", PRIV);
        map.put("global", GLOBAL);
        map.put("unsafe", UNSAFE);
        map.put("raw", RAW);
        map.put("future", FUTURE);
        map.put("macro", MACRO);
        map.put("delegate", DELEGATE);
        map.put("route", ROUTE);
        map.put("compose", COMPOSE);
        map.put("inspect", INSPECT);
        map.put("create_pool", CREATE_POOL);
        map.put("max_workers", MAX_WORKERS);
        map.put("submit", SUBMIT);
        map.put("submit_delayed", SUBMIT_DELAYED);
        map.put("join", JOIN);
        map.put("now", NOW);
        map.put("execution_time", EXECUTION_TIME);
        map.put("Report", REPORT);

        // Noise words
        map.put("do", DO);
        map.put("please", PLEASE);
        map.put("maybe", MAYBE);
        keywords = Collections.unmodifiableMap(map);

        Map<String, TokenType> context = new HashMap<>();
        context.put("model", MODEL);
        context.put("tools", TOOLS);
        context.put("role", ROLE);
        context.put("mode", MODE);
        context.put("sys_prompt", SYS_PROMPT);
        context.put("pseudo", PSEUDO);
        context.put("debug", DEBUG);
        context.put("trace", TRACE);
        context.put("checkpoint", CHECKPOINT);
        contextKeywords = Collections.unmodifiableMap(context);
    }

    /**
     * Resolves a scanned word against the reserved keyword table.
     *
     * @param word a maximal run of letters, digits and underscores
     * @return the keyword kind, or {@link #IDENTIFIER} when the word is not reserved
     */
    public static TokenType lookupIdent(String word) {
        return keywords.getOrDefault(word, IDENTIFIER);
    }

    /**
     * @return the agent/system kind a word stands for inside a declaration
     *         body, or {@code null} when the word has no such role.
     */
    public static TokenType lookupContextKeyword(String word) {
        return contextKeywords.get(word);
    }

    /**
     * Presentation group of a word used as a name. Reserved and context
     * keywords report their own group so a keyword used as an identifier still
     * shows its lexical role.
     */
    public static String semanticGroupOf(String word) {
        TokenType type = keywords.get(word);
        if (type == null) type = contextKeywords.get(word);
        return type == null ? IDENTIFIER.semanticGroup : type.semanticGroup;
    }
}
