package dev.britannio.synta;

import java.util.List;

/**
 * Syntax tree of a Synta program.
 *
 * The tree is owned top-down: a node never points at its parent and no node
 * is shared between two parents. Optional children are {@code null} when the
 * source did not contain them, bodies that were not written are empty lists.
 * Every list keeps source order and is unmodifiable.
 */
public abstract class Node {
    public interface Visitor<R> {
        R visitProgram(Program node);

        R visitDeclaration(Declaration node);

        R visitBinaryOp(BinaryOp node);

        R visitUnaryOp(UnaryOp node);

        R visitLiteral(Literal node);

        R visitIdentifier(Identifier node);

        R visitIfStatement(IfStatement node);

        R visitWhileStatement(WhileStatement node);

        R visitForStatement(ForStatement node);

        R visitSwitchStatement(SwitchStatement node);

        R visitReturnStatement(ReturnStatement node);

        R visitArrayLiteral(ArrayLiteral node);

        R visitMapLiteral(MapLiteral node);

        R visitAsyncStatement(AsyncStatement node);

        R visitAwaitExpression(AwaitExpression node);

        R visitEmitStatement(EmitStatement node);

        R visitListenStatement(ListenStatement node);

        R visitCallExpression(CallExpression node);

        R visitConfigBlock(ConfigBlock node);

        R visitTryCatch(TryCatch node);

        R visitWatch(Watch node);

        R visitOn(On node);

        R visitWith(With node);

        R visitSnapshot(Snapshot node);

        R visitRestore(Restore node);

        R visitDecorator(Decorator node);
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public static final class Program extends Node {
        public final List<Node> statements;

        Program(List<Node> statements) {
            this.statements = List.copyOf(statements);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitProgram(this);
        }
    }

    /**
     * A named definition: variable bindings, functions, structs, agents and
     * tasks share this shape and use the fields relevant to their kind.
     */
    public static final class Declaration extends Node {
        public enum Kind {
            BIND, CONST, CRAFT, FN, STRUCT, AGENT, TASK;

            /**
             * @return the kind as the language spells it, e.g. {@code bind}.
             */
            public String keyword() {
                return name().toLowerCase();
            }

            static Kind fromKeyword(TokenType type) {
                switch (type) {
                    case CONST:
                        return CONST;
                    case CRAFT:
                        return CRAFT;
                    default:
                        return BIND;
                }
            }
        }

        public final Kind kind;
        public final String name;
        /** Declared type, or the return type of a function. */
        public final String type;
        public final Node value;
        public final List<Parameter> params;
        public final List<Node> body;
        public final List<Field> fields;
        /** Decorator written between {@code fn} and the name, e.g. {@code @agent}. */
        public final String decorator;
        public final boolean async;

        private Declaration(Kind kind, String name, String type, Node value, List<Parameter> params,
                List<Node> body, List<Field> fields, String decorator, boolean async) {
            this.kind = kind;
            this.name = name;
            this.type = type;
            this.value = value;
            this.params = List.copyOf(params);
            this.body = List.copyOf(body);
            this.fields = List.copyOf(fields);
            this.decorator = decorator;
            this.async = async;
        }

        static Declaration variable(Kind kind, String name, String type, Node value) {
            return new Declaration(kind, name, type, value, List.of(), List.of(), List.of(), null, false);
        }

        static Declaration function(String name, List<Parameter> params, String returnType, List<Node> body,
                String decorator, boolean async) {
            return new Declaration(Kind.FN, name, returnType, null, params, body, List.of(), decorator, async);
        }

        static Declaration withFields(Kind kind, String name, List<Field> fields) {
            return new Declaration(kind, name, null, null, List.of(), List.of(), fields, null, false);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDeclaration(this);
        }
    }

    public record Parameter(String name, String type) {
    }

    /**
     * A struct field carries a type, an agent or task field carries a value.
     */
    public record Field(String name, String type, Node value) {
    }

    public static final class BinaryOp extends Node {
        public final Node left;
        public final String operator;
        public final Node right;

        BinaryOp(Node left, String operator, Node right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinaryOp(this);
        }
    }

    /**
     * Prefix operators keep their spelling, postfix increment and decrement
     * are recorded as {@code ++_post} and {@code --_post}.
     */
    public static final class UnaryOp extends Node {
        public final String operator;
        public final Node operand;

        UnaryOp(String operator, Node operand) {
            this.operator = operator;
            this.operand = operand;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnaryOp(this);
        }
    }

    public static final class Literal extends Node {
        public enum Kind {
            INT, FLOAT, STRING, BOOL, NULL
        }

        public final Kind kind;
        /** The lexeme as scanned, numbers keep any time unit suffix. */
        public final String value;

        Literal(Kind kind, String value) {
            this.kind = kind;
            this.value = value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLiteral(this);
        }
    }

    public static final class Identifier extends Node {
        public final String name;

        Identifier(String name) {
            this.name = name;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIdentifier(this);
        }
    }

    /**
     * Produced by {@code if}, {@code elif} chains and {@code guard}.
     */
    public static final class IfStatement extends Node {
        public final Node condition;
        public final List<Node> thenBody;
        public final List<Node> elseBody;
        /** True when the branches were written in the {@code ::} form. */
        public final boolean inline;

        IfStatement(Node condition, List<Node> thenBody, List<Node> elseBody, boolean inline) {
            this.condition = condition;
            this.thenBody = List.copyOf(thenBody);
            this.elseBody = List.copyOf(elseBody);
            this.inline = inline;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIfStatement(this);
        }
    }

    public static final class WhileStatement extends Node {
        public final Node condition;
        public final List<Node> body;
        public final boolean inline;

        WhileStatement(Node condition, List<Node> body, boolean inline) {
            this.condition = condition;
            this.body = List.copyOf(body);
            this.inline = inline;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWhileStatement(this);
        }
    }

    /**
     * Covers the C style {@code for}, {@code for x in xs} and every
     * {@code loop} form. Iterating loops set {@link #variable} and
     * {@link #iterable}, counted loops set {@link #init} and {@link #condition}.
     */
    public static final class ForStatement extends Node {
        public final String variable;
        public final Node init;
        public final Node condition;
        public final Node update;
        public final Node iterable;
        public final List<Node> body;
        public final boolean concurrent;

        ForStatement(String variable, Node init, Node condition, Node update, Node iterable, List<Node> body,
                boolean concurrent) {
            this.variable = variable;
            this.init = init;
            this.condition = condition;
            this.update = update;
            this.iterable = iterable;
            this.body = List.copyOf(body);
            this.concurrent = concurrent;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitForStatement(this);
        }
    }

    /**
     * Produced by {@code switch} and by {@code match}.
     */
    public static final class SwitchStatement extends Node {
        public final Node expression;
        public final List<Case> cases;
        public final List<Node> defaultBody;

        SwitchStatement(Node expression, List<Case> cases, List<Node> defaultBody) {
            this.expression = expression;
            this.cases = List.copyOf(cases);
            this.defaultBody = List.copyOf(defaultBody);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSwitchStatement(this);
        }
    }

    public record Case(Node value, List<Node> body) {
        public Case {
            body = List.copyOf(body);
        }
    }

    public static final class ReturnStatement extends Node {
        public final Node value;

        ReturnStatement(Node value) {
            this.value = value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReturnStatement(this);
        }
    }

    /**
     * Bracketed arrays, and parenthesized groups of more than one element.
     */
    public static final class ArrayLiteral extends Node {
        public final List<Node> elements;

        ArrayLiteral(List<Node> elements) {
            this.elements = List.copyOf(elements);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitArrayLiteral(this);
        }
    }

    public static final class MapLiteral extends Node {
        public final List<Pair> pairs;

        MapLiteral(List<Pair> pairs) {
            this.pairs = List.copyOf(pairs);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMapLiteral(this);
        }
    }

    public record Pair(Node key, Node value) {
    }

    public static final class AsyncStatement extends Node {
        public final List<Node> body;

        AsyncStatement(List<Node> body) {
            this.body = List.copyOf(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAsyncStatement(this);
        }
    }

    public static final class AwaitExpression extends Node {
        public final Node expression;
        /** {@code all} or {@code race} for the braced forms, otherwise null. */
        public final String combinator;

        AwaitExpression(Node expression, String combinator) {
            this.expression = expression;
            this.combinator = combinator;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAwaitExpression(this);
        }
    }

    public static final class EmitStatement extends Node {
        public final String eventName;
        public final Node data;

        EmitStatement(String eventName, Node data) {
            this.eventName = eventName;
            this.data = data;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitEmitStatement(this);
        }
    }

    public static final class ListenStatement extends Node {
        public final String eventName;
        public final Node handler;

        ListenStatement(String eventName, Node handler) {
            this.eventName = eventName;
            this.handler = handler;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitListenStatement(this);
        }
    }

    public static final class CallExpression extends Node {
        public final Node callee;
        public final List<Node> arguments;

        CallExpression(Node callee, List<Node> arguments) {
            this.callee = callee;
            this.arguments = List.copyOf(arguments);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCallExpression(this);
        }
    }

    /**
     * {@code name: { ... }}, a map literal labelled with a name.
     */
    public static final class ConfigBlock extends Node {
        public final String name;
        public final Node value;

        ConfigBlock(String name, Node value) {
            this.name = name;
            this.value = value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConfigBlock(this);
        }
    }

    /**
     * Statement forms without a dedicated core node. Each subclass keeps the
     * pieces of its own syntax and reports a kind string.
     */
    public abstract static class Statement extends Node {
        public final String kind;

        Statement(String kind) {
            this.kind = kind;
        }
    }

    public static final class TryCatch extends Statement {
        public final List<Node> tryBody;
        public final boolean hasCatch;
        public final String catchParam;
        public final List<Node> catchBody;

        TryCatch(List<Node> tryBody, boolean hasCatch, String catchParam, List<Node> catchBody) {
            super("try-catch");
            this.tryBody = List.copyOf(tryBody);
            this.hasCatch = hasCatch;
            this.catchParam = catchParam;
            this.catchBody = List.copyOf(catchBody);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTryCatch(this);
        }
    }

    /**
     * Shared shape of {@code watch} and {@code on}: the observed expression
     * and a handler written either as a block, as {@code (params) -> handler},
     * or as a bare handler.
     */
    public abstract static class Reactive extends Statement {
        public final Node expression;
        public final List<Node> params;
        public final Node handler;
        public final List<Node> body;

        Reactive(String kind, Node expression, List<Node> params, Node handler, List<Node> body) {
            super(kind);
            this.expression = expression;
            this.params = List.copyOf(params);
            this.handler = handler;
            this.body = List.copyOf(body);
        }
    }

    public static final class Watch extends Reactive {
        Watch(Node expression, List<Node> params, Node handler, List<Node> body) {
            super("watch", expression, params, handler, body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWatch(this);
        }
    }

    public static final class On extends Reactive {
        On(Node expression, List<Node> params, Node handler, List<Node> body) {
            super("on", expression, params, handler, body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitOn(this);
        }
    }

    public static final class With extends Statement {
        public final Node context;
        public final List<Node> body;

        With(Node context, List<Node> body) {
            super("with");
            this.context = context;
            this.body = List.copyOf(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWith(this);
        }
    }

    public static final class Snapshot extends Statement {
        public final Node source;
        /** Where the snapshot goes, null when no {@code ->} target was written. */
        public final Node target;

        Snapshot(Node source, Node target) {
            super("snapshot");
            this.source = source;
            this.target = target;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSnapshot(this);
        }
    }

    public static final class Restore extends Statement {
        public final Node target;
        public final Node source;

        Restore(Node target, Node source) {
            super("restore");
            this.target = target;
            this.source = source;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRestore(this);
        }
    }

    public static final class Decorator extends Statement {
        /** The sigil and name, e.g. {@code @retry}. */
        public final String decorator;
        public final String name;
        public final List<Node> arguments;

        Decorator(String decorator, String name, List<Node> arguments) {
            super("decorator");
            this.decorator = decorator;
            this.name = name;
            this.arguments = List.copyOf(arguments);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDecorator(this);
        }
    }
}
