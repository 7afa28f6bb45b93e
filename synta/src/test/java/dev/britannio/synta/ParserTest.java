package dev.britannio.synta;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.stream.Collectors;

class ParserTest {

    static ParseResult parse(String source) {
        return new Parser(new Scanner(source).scanTokens()).parse();
    }

    /**
     * Parses a source that must hold exactly one statement and no errors.
     */
    static Node only(String source) {
        ParseResult result = parse(source);
        assertEquals(List.of(), result.errors(), source);
        assertEquals(1, result.program().statements.size(), source);
        return result.program().statements.get(0);
    }

    static void assertIdentifier(String name, Node node) {
        assertEquals(name, assertInstanceOf(Node.Identifier.class, node).name);
    }

    static void assertLiteral(Node.Literal.Kind kind, String value, Node node) {
        Node.Literal literal = assertInstanceOf(Node.Literal.class, node);
        assertEquals(kind, literal.kind);
        assertEquals(value, literal.value);
    }

    static Node.BinaryOp binary(String operator, Node node) {
        Node.BinaryOp binary = assertInstanceOf(Node.BinaryOp.class, node);
        assertEquals(operator, binary.operator);
        return binary;
    }

    // --- Programs ---

    @Test void emptySource() {
        ParseResult result = parse("");
        assertTrue(result.success());
        assertTrue(result.program().statements.isEmpty());
    }

    @Test void emptyTokenList() {
        ParseResult result = new Parser(List.of()).parse();
        assertTrue(result.success());
        assertTrue(result.program().statements.isEmpty());
    }

    @Test void missingEofIsTolerated() {
        ParseResult result = new Parser(List.of(new Token(TokenType.IDENTIFIER, "x", 1, 1))).parse();
        assertTrue(result.success());
        assertIdentifier("x", result.program().statements.get(0));
    }

    @Test void commentsProduceNoStatements() {
        Node statement = only("!> hello\n<! a\nblock !>\nbind x := 1;");
        assertInstanceOf(Node.Declaration.class, statement);
    }

    @Test void statementSeparators() {
        ParseResult result = parse("bind a := 1 ~ bind b := 2; bind c := 3\nbind d := 4");
        assertTrue(result.success());
        List<String> names = result.program().statements.stream()
                .map(node -> ((Node.Declaration) node).name)
                .collect(Collectors.toList());
        assertEquals(List.of("a", "b", "c", "d"), names);
    }

    @Test void statementListIsImmutable() {
        ParseResult result = parse("x");
        assertThrows(UnsupportedOperationException.class, () -> result.program().statements.add(null));
    }

    // --- Declarations ---

    @Test void bindDeclaration() {
        var declaration = assertInstanceOf(Node.Declaration.class, only("bind x := 10;"));
        assertEquals(Node.Declaration.Kind.BIND, declaration.kind);
        assertEquals("x", declaration.name);
        assertNull(declaration.type);
        assertLiteral(Node.Literal.Kind.INT, "10", declaration.value);
    }

    @Test void declarationKinds() {
        assertEquals(Node.Declaration.Kind.CONST, ((Node.Declaration) only("const limit := 5")).kind);
        assertEquals(Node.Declaration.Kind.CRAFT, ((Node.Declaration) only("craft tool =: make()")).kind);
    }

    @Test void typeAnnotation() {
        var declaration = (Node.Declaration) only("bind count: int := 0");
        assertEquals("int", declaration.type);
        assertLiteral(Node.Literal.Kind.INT, "0", declaration.value);
    }

    @Test void typedDeclaration() {
        var declaration = (Node.Declaration) only("int total := 1 + 2");
        assertEquals(Node.Declaration.Kind.BIND, declaration.kind);
        assertEquals("total", declaration.name);
        assertEquals("int", declaration.type);
        binary("+", declaration.value);
    }

    @Test void agentWithKeywordFieldNames() {
        String source = "@agent Researcher {\n"
                + "    role: \"analyst\",\n"
                + "    model: \"gpt-4\",\n"
                + "    tools: [search, summarize]\n"
                + "    timeout: 30s\n"
                + "}";
        var agent = (Node.Declaration) only(source);
        assertEquals(Node.Declaration.Kind.AGENT, agent.kind);
        assertEquals("Researcher", agent.name);
        assertEquals(List.of("role", "model", "tools", "timeout"),
                agent.fields.stream().map(Node.Field::name).collect(Collectors.toList()));
        assertLiteral(Node.Literal.Kind.STRING, "analyst", agent.fields.get(0).value());
        assertEquals(2, assertInstanceOf(Node.ArrayLiteral.class, agent.fields.get(2).value()).elements.size());
        assertLiteral(Node.Literal.Kind.INT, "30s", agent.fields.get(3).value());
    }

    @Test void task() {
        var task = (Node.Declaration) only("task Fetch { input: url, retry: 3, depends_on: [setup] }");
        assertEquals(Node.Declaration.Kind.TASK, task.kind);
        assertEquals(List.of("input", "retry", "depends_on"),
                task.fields.stream().map(Node.Field::name).collect(Collectors.toList()));
    }

    @Test void function() {
        var fn = (Node.Declaration) only("fn add(a: int, b: int) -> int { return a + b; }");
        assertEquals(Node.Declaration.Kind.FN, fn.kind);
        assertEquals(List.of(new Node.Parameter("a", "int"), new Node.Parameter("b", "int")), fn.params);
        assertEquals("int", fn.type);
        assertFalse(fn.async);
        var ret = assertInstanceOf(Node.ReturnStatement.class, fn.body.get(0));
        binary("+", ret.value);
    }

    @Test void decoratedFunction() {
        var fn = (Node.Declaration) only("fn @agent helper() => str :: { }");
        assertEquals("@agent", fn.decorator);
        assertEquals("helper", fn.name);
        assertEquals("str", fn.type);
        assertTrue(fn.params.isEmpty());
        assertTrue(fn.body.isEmpty());
    }

    @Test void asyncFunction() {
        var fn = (Node.Declaration) only("async fn fetch(url) { }");
        assertTrue(fn.async);
        assertEquals(List.of(new Node.Parameter("url", null)), fn.params);
    }

    @Test void parametersMaySpanLines() {
        var fn = (Node.Declaration) only("fn f(\n  a,\n  b\n) { }");
        assertEquals(2, fn.params.size());
    }

    @Test void struct() {
        var struct = (Node.Declaration) only("struct Point { x: int, y: float }");
        assertEquals(Node.Declaration.Kind.STRUCT, struct.kind);
        assertEquals(List.of(new Node.Field("x", "int", null), new Node.Field("y", "float", null)), struct.fields);
    }

    @Test void configBlock() {
        var config = assertInstanceOf(Node.ConfigBlock.class, only("settings: { retries: 3, timeout: 10s }"));
        assertEquals("settings", config.name);
        assertEquals(2, assertInstanceOf(Node.MapLiteral.class, config.value).pairs.size());
    }

    @Test void configBlockNamedByKeyword() {
        assertEquals("bind", assertInstanceOf(Node.ConfigBlock.class, only("bind: { x: 1 }")).name);
    }

    // --- Expressions ---

    @Test void arithmeticPrecedence() {
        var assign = binary(":=", only("x := 1 + 2 * 3"));
        assertIdentifier("x", assign.left);
        var sum = binary("+", assign.right);
        assertLiteral(Node.Literal.Kind.INT, "1", sum.left);
        binary("*", sum.right);
    }

    @Test void assignmentIsRightAssociative() {
        var outer = binary(":=", only("a := b := 1"));
        assertIdentifier("a", outer.left);
        binary(":=", outer.right);
    }

    @Test void pipelineBindsLooserThanLogic() {
        var parallel = binary("|>>", only("data |> clean || fallback |>> publish"));
        var pipe = binary("|>", parallel.left);
        binary("||", pipe.right);
        assertIdentifier("publish", parallel.right);
    }

    @Test void postfixChain() {
        var increment = assertInstanceOf(Node.UnaryOp.class, only("agent.run(task)[0]++"));
        assertEquals("++_post", increment.operator);
        var index = binary("[]", increment.operand);
        var call = assertInstanceOf(Node.CallExpression.class, index.left);
        var member = binary(".", call.callee);
        assertIdentifier("agent", member.left);
        assertIdentifier("run", member.right);
        assertIdentifier("task", call.arguments.get(0));
    }

    @Test void sendArrow() {
        var arrow = binary("->", only("request -> Researcher"));
        assertIdentifier("request", arrow.left);
        assertIdentifier("Researcher", arrow.right);
    }

    @Test void unaryOperators() {
        var not = assertInstanceOf(Node.UnaryOp.class, only("!ready"));
        assertEquals("!", not.operator);
        var product = binary("*", only("-x * 2"));
        assertEquals("-", assertInstanceOf(Node.UnaryOp.class, product.left).operator);
    }

    @Test void keywordsCallableAsNames() {
        var call = assertInstanceOf(Node.CallExpression.class, only("print(now())"));
        assertIdentifier("print", call.callee);
        assertIdentifier("now", assertInstanceOf(Node.CallExpression.class, call.arguments.get(0)).callee);
    }

    @Test void groupingAndTuples() {
        assertLiteral(Node.Literal.Kind.INT, "1", only("(1)"));
        assertEquals(2, assertInstanceOf(Node.ArrayLiteral.class, only("(1, 2)")).elements.size());
    }

    @Test void literals() {
        assertLiteral(Node.Literal.Kind.FLOAT, "2.5", only("2.5"));
        assertLiteral(Node.Literal.Kind.BOOL, "true", only("true"));
        assertLiteral(Node.Literal.Kind.NULL, "null", only("null"));
        assertLiteral(Node.Literal.Kind.STRING, "hi", only("\"hi\""));
    }

    @Test void mapLiteral() {
        var map = assertInstanceOf(Node.MapLiteral.class, only("{ name, config: { retries: 3 }, \"k\": 1 }"));
        assertEquals(3, map.pairs.size());

        Node.Pair shorthand = map.pairs.get(0);
        assertIdentifier("name", shorthand.key());
        assertIdentifier("name", shorthand.value());
        assertNotSame(shorthand.key(), shorthand.value());

        assertIdentifier("config", map.pairs.get(1).key());
        assertInstanceOf(Node.MapLiteral.class, map.pairs.get(1).value());
        assertLiteral(Node.Literal.Kind.STRING, "k", map.pairs.get(2).key());
    }

    @Test void listsMaySpanLinesWithComments() {
        var call = assertInstanceOf(Node.CallExpression.class, only("call(\n  a, !> first\n  b\n)"));
        assertEquals(2, call.arguments.size());
        var array = assertInstanceOf(Node.ArrayLiteral.class, only("[\n  1,\n  2,\n]"));
        assertEquals(2, array.elements.size());
    }

    @Test void await() {
        var await = assertInstanceOf(Node.AwaitExpression.class, only("await fetch()"));
        assertNull(await.combinator);
        assertInstanceOf(Node.CallExpression.class, await.expression);
    }

    @Test void awaitAll() {
        var await = assertInstanceOf(Node.AwaitExpression.class, only("await all { a(), b() }"));
        assertEquals("all", await.combinator);
        assertEquals(2, assertInstanceOf(Node.ArrayLiteral.class, await.expression).elements.size());
    }

    @Test void awaitRace() {
        assertEquals("race", ((Node.AwaitExpression) only("await race {\n a()\n b()\n}")).combinator);
    }

    // --- Control flow ---

    @Test void ifElse() {
        var statement = assertInstanceOf(Node.IfStatement.class, only("if x > 0 { return 1; } else { return 2; }"));
        binary(">", statement.condition);
        assertFalse(statement.inline);
        assertInstanceOf(Node.ReturnStatement.class, statement.thenBody.get(0));
        assertEquals(1, statement.thenBody.size());
        assertEquals(1, statement.elseBody.size());
    }

    @Test void inlineIf() {
        var statement = (Node.IfStatement) only("if ready :: start() else :: stop()");
        assertTrue(statement.inline);
        assertEquals(1, statement.thenBody.size());
        assertEquals(1, statement.elseBody.size());
    }

    @Test void elifChain() {
        var statement = (Node.IfStatement) only("if a { x() } elif b { y() } else { z() }");
        var nested = assertInstanceOf(Node.IfStatement.class, statement.elseBody.get(0));
        assertIdentifier("b", nested.condition);
        assertEquals(1, nested.elseBody.size());
    }

    @Test void elseIf() {
        var statement = (Node.IfStatement) only("if a { x() } else if b { y() }");
        assertInstanceOf(Node.IfStatement.class, statement.elseBody.get(0));
    }

    @Test void elseOnNextLine() {
        var statement = (Node.IfStatement) only("if a {\n  x()\n}\nelse {\n  y()\n}");
        assertEquals(1, statement.elseBody.size());
    }

    @Test void whileForms() {
        assertTrue(((Node.WhileStatement) only("while running :: tick()")).inline);

        var loop = (Node.WhileStatement) only("while i < 3 { i += 1 }");
        assertFalse(loop.inline);
        binary("+=", loop.body.get(0));
    }

    @Test void forIn() {
        var loop = assertInstanceOf(Node.ForStatement.class, only("for item in items { print(item) }"));
        assertEquals("item", loop.variable);
        assertIdentifier("items", loop.iterable);
        assertNull(loop.init);
        assertEquals(1, loop.body.size());
    }

    @Test void forClauses() {
        var loop = (Node.ForStatement) only("for i := 0; i < 10; i++ { }");
        binary(":=", loop.init);
        binary("<", loop.condition);
        assertEquals("++_post", assertInstanceOf(Node.UnaryOp.class, loop.update).operator);
        assertFalse(loop.concurrent);
    }

    @Test void concurrentFor() {
        assertTrue(((Node.ForStatement) only("for i := 0; i < n; i++ concurrent { }")).concurrent);
    }

    @Test void loopWhileFromTo() {
        var loop = (Node.ForStatement) only("loop while i from 0 to 10 { tick() }");
        assertEquals("i", loop.variable);
        var init = binary(":=", loop.init);
        assertIdentifier("i", init.left);
        assertLiteral(Node.Literal.Kind.INT, "0", init.right);
        var bound = binary("to", loop.condition);
        assertLiteral(Node.Literal.Kind.INT, "10", bound.right);
        assertEquals(1, loop.body.size());
    }

    @Test void loopForeach() {
        var loop = (Node.ForStatement) only("loop foreach doc in docs :: summarize(doc)");
        assertEquals("doc", loop.variable);
        assertIdentifier("docs", loop.iterable);
        assertFalse(loop.concurrent);
        assertInstanceOf(Node.CallExpression.class, loop.body.get(0));
    }

    @Test void loopParallel() {
        var loop = (Node.ForStatement) only("loop parallel job in jobs { run(job) }");
        assertTrue(loop.concurrent);
        assertEquals("job", loop.variable);
    }

    @Test void guard() {
        var statement = assertInstanceOf(Node.IfStatement.class, only("guard ok :: proceed() else :: abort()"));
        assertTrue(statement.inline);
        assertEquals(1, statement.thenBody.size());
        assertEquals(1, statement.elseBody.size());
    }

    @Test void match() {
        String source = "match status :: {\n"
                + "    \"ok\" :: print(\"fine\"),\n"
                + "    \"fail\" :: retry_job()\n"
                + "    default :: print(\"unknown\")\n"
                + "}";
        var statement = assertInstanceOf(Node.SwitchStatement.class, only(source));
        assertIdentifier("status", statement.expression);
        assertEquals(2, statement.cases.size());
        assertLiteral(Node.Literal.Kind.STRING, "ok", statement.cases.get(0).value());
        assertEquals(1, statement.defaultBody.size());
    }

    @Test void switchCases() {
        var statement = (Node.SwitchStatement) only("switch mode { case 1 { a() } case 2 { b() } default { c() } }");
        assertEquals(2, statement.cases.size());
        assertEquals(1, statement.cases.get(1).body().size());
        assertEquals(1, statement.defaultBody.size());
    }

    @Test void returnWithoutValue() {
        var fn = (Node.Declaration) only("fn f() { return }");
        assertNull(((Node.ReturnStatement) fn.body.get(0)).value);
    }

    // --- Other statements ---

    @Test void tryCatch() {
        var statement = assertInstanceOf(Node.TryCatch.class, only("try { risky() } catch err { log(err) }"));
        assertEquals("try-catch", statement.kind);
        assertTrue(statement.hasCatch);
        assertEquals("err", statement.catchParam);
        assertEquals(1, statement.tryBody.size());
        assertEquals(1, statement.catchBody.size());
    }

    @Test void tryWithoutCatch() {
        assertFalse(((Node.TryCatch) only("try { risky() }")).hasCatch);
    }

    @Test void asyncBlock() {
        assertEquals(1, assertInstanceOf(Node.AsyncStatement.class, only("async { fetch() }")).body.size());
    }

    @Test void emit() {
        var emit = assertInstanceOf(Node.EmitStatement.class, only("emit done { status: \"ok\" }"));
        assertEquals("done", emit.eventName);
        assertEquals(1, assertInstanceOf(Node.MapLiteral.class, emit.data).pairs.size());
        assertNull(((Node.EmitStatement) only("emit ready")).data);
    }

    @Test void listen() {
        var listen = assertInstanceOf(Node.ListenStatement.class, only("listen done { handle }"));
        assertEquals("done", listen.eventName);
        assertIdentifier("handle", listen.handler);
    }

    @Test void watchWithParameters() {
        var watch = assertInstanceOf(Node.Watch.class, only("watch temperature :: (old, new) -> alert(new)"));
        assertEquals("watch", watch.kind);
        assertIdentifier("temperature", watch.expression);
        assertEquals(2, watch.params.size());
        assertInstanceOf(Node.CallExpression.class, watch.handler);
    }

    @Test void watchBlock() {
        var watch = (Node.Watch) only("watch x { react() }");
        assertNull(watch.handler);
        assertEquals(1, watch.body.size());
    }

    @Test void on() {
        var on = assertInstanceOf(Node.On.class, only("on message :: (msg) -> reply(msg)"));
        assertEquals("on", on.kind);
        assertEquals(1, on.params.size());
        assertInstanceOf(Node.CallExpression.class, on.handler);
    }

    @Test void withContext() {
        var with = assertInstanceOf(Node.With.class, only("with context { timeout: 5s } :: { run() }"));
        assertInstanceOf(Node.MapLiteral.class, with.context);
        assertEquals(1, with.body.size());
    }

    @Test void snapshotSplitsArrow() {
        var snapshot = assertInstanceOf(Node.Snapshot.class, only("snapshot agent.state -> \"state.json\""));
        binary(".", snapshot.source);
        assertLiteral(Node.Literal.Kind.STRING, "state.json", snapshot.target);
    }

    @Test void snapshotWithoutTarget() {
        var snapshot = (Node.Snapshot) only("snapshot memory");
        assertIdentifier("memory", snapshot.source);
        assertNull(snapshot.target);
    }

    @Test void restore() {
        var restore = assertInstanceOf(Node.Restore.class, only("restore agent from \"state.json\""));
        assertIdentifier("agent", restore.target);
        assertLiteral(Node.Literal.Kind.STRING, "state.json", restore.source);
    }

    @Test void decoratorStatements() {
        var retry = assertInstanceOf(Node.Decorator.class, only("@retry(3)"));
        assertEquals("@retry", retry.decorator);
        assertNull(retry.name);
        assertEquals(1, retry.arguments.size());

        var step = (Node.Decorator) only("@step fetch_data");
        assertEquals("fetch_data", step.name);
        assertTrue(step.arguments.isEmpty());
    }

    @Test void allowIsACall() {
        var call = assertInstanceOf(Node.CallExpression.class, only("allow pseudo(anno, trace, breakpoint, 15);"));
        assertIdentifier("allow_pseudo", call.callee);
        assertEquals(4, call.arguments.size());
        assertIdentifier("breakpoint", call.arguments.get(2));
    }
}
