package dev.britannio.synta;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a syntax tree as an indented outline labelled with grammar rule
 * names, e.g.
 *
 * <pre>
 * SYNTA_PROGRAM
 * └── STMT_LIST
 *     └── DECL_STMT "bind"
 *         ├── IDENTIFIER "x"
 *         └── INT_LIT "10"
 * </pre>
 *
 * Left-nested chains such as {@code a.b.c} or {@code 1 + 2 + 3} build trees
 * deeper than the parser ever recurses, so nodes nested more than
 * {@link #MAX_DEPTH} levels below the root are shown as a single
 * {@code TRUNCATED} line.
 */
public class AstFormatter implements Node.Visitor<AstFormatter.Tree> {
    static final int MAX_DEPTH = 2 * Parser.MAX_DEPTH;

    private int depth = 0;

    /**
     * One line of the outline and the lines nested under it.
     */
    static final class Tree {
        final String label;
        final List<Tree> children = new ArrayList<>();

        Tree(String label) {
            this.label = label;
        }

        Tree(String label, String value) {
            this(label + " \"" + value + "\"");
        }
    }

    public String format(Node node) {
        if (node == null) return "";

        Tree root = visit(node);
        StringBuilder builder = new StringBuilder();
        builder.append(root.label).append('\n');
        renderChildren(root, "", builder);
        return builder.toString();
    }

    private void render(Tree tree, String prefix, boolean last, StringBuilder builder) {
        builder.append(prefix).append(last ? "└── " : "├── ").append(tree.label).append('\n');
        renderChildren(tree, prefix + (last ? "    " : "│   "), builder);
    }

    private void renderChildren(Tree tree, String prefix, StringBuilder builder) {
        for (int i = 0; i < tree.children.size(); i++) {
            render(tree.children.get(i), prefix, i == tree.children.size() - 1, builder);
        }
    }

    /**
     * Adds the tree of each node under {@code parent}, skipping absent nodes.
     */
    private Tree add(Tree parent, Node... nodes) {
        for (Node node : nodes) {
            if (node != null) parent.children.add(visit(node));
        }
        return parent;
    }

    private Tree visit(Node node) {
        if (depth >= MAX_DEPTH) return new Tree("TRUNCATED");

        depth++;
        try {
            return node.accept(this);
        } finally {
            depth--;
        }
    }

    private Tree addAll(Tree parent, List<Node> nodes) {
        for (Node node : nodes) {
            add(parent, node);
        }
        return parent;
    }

    /**
     * @return a labelled group holding {@code node}, or null when it is absent.
     */
    private Tree wrap(String label, Node node) {
        if (node == null) return null;
        return add(new Tree(label), node);
    }

    private Tree block(String label, List<Node> statements) {
        return addAll(new Tree(label), statements);
    }

    private static void child(Tree parent, Tree child) {
        if (child != null) parent.children.add(child);
    }

    @Override
    public Tree visitProgram(Node.Program node) {
        Tree program = new Tree("SYNTA_PROGRAM");
        if (!node.statements.isEmpty()) {
            child(program, block("STMT_LIST", node.statements));
        }
        return program;
    }

    @Override
    public Tree visitDeclaration(Node.Declaration node) {
        Tree tree = switch (node.kind) {
            case AGENT -> new Tree("AGENT_DECL");
            case TASK -> new Tree("TASK_DECL");
            case STRUCT -> new Tree("STRUCT_DECL");
            case FN -> new Tree("FN_DECL");
            default -> new Tree("DECL_STMT", node.kind.keyword());
        };

        if (node.async) child(tree, new Tree("MODIFIER", "async"));
        if (node.decorator != null) child(tree, new Tree("DECORATOR", node.decorator));
        child(tree, new Tree("IDENTIFIER", node.name));

        if (node.kind == Node.Declaration.Kind.FN) {
            if (!node.params.isEmpty()) {
                Tree params = new Tree("PARAM_LIST");
                for (Node.Parameter parameter : node.params) {
                    Tree param = new Tree("PARAM", parameter.name());
                    if (parameter.type() != null) child(param, new Tree("TYPE", parameter.type()));
                    child(params, param);
                }
                child(tree, params);
            }
            if (node.type != null) child(tree, new Tree("RETURN_TYPE", node.type));
            child(tree, block("BLOCK", node.body));
            return tree;
        }

        if (node.type != null) child(tree, new Tree("TYPE", node.type));
        add(tree, node.value);

        for (Node.Field field : node.fields) {
            if (node.kind == Node.Declaration.Kind.STRUCT) {
                Tree member = new Tree("FIELD", field.name());
                if (field.type() != null) child(member, new Tree("TYPE", field.type()));
                child(tree, member);
            } else {
                Tree pair = new Tree("PAIR");
                child(pair, identifier(field.name()));
                add(pair, field.value());
                child(tree, pair);
            }
        }
        return tree;
    }

    @Override
    public Tree visitBinaryOp(Node.BinaryOp node) {
        Tree tree = new Tree("BINARY_EXPR");
        child(tree, wrap("EXPR", node.left));
        child(tree, new Tree("OPERATOR", node.operator));
        child(tree, wrap("EXPR", node.right));
        return tree;
    }

    @Override
    public Tree visitUnaryOp(Node.UnaryOp node) {
        Tree tree = new Tree("UNARY_EXPR");
        child(tree, new Tree("OPERATOR", node.operator));
        child(tree, wrap("EXPR", node.operand));
        return tree;
    }

    @Override
    public Tree visitLiteral(Node.Literal node) {
        String label = switch (node.kind) {
            case INT -> "INT_LIT";
            case FLOAT -> "FLOAT_LIT";
            case STRING -> "STRING_LIT";
            case BOOL -> "BOOL_LIT";
            case NULL -> "NULL_LIT";
        };
        return new Tree(label, node.value);
    }

    @Override
    public Tree visitIdentifier(Node.Identifier node) {
        return identifier(node.name);
    }

    /**
     * A name spelled like a keyword is shown under that keyword's group.
     */
    private Tree identifier(String name) {
        return new Tree(TokenType.semanticGroupOf(name), name);
    }

    @Override
    public Tree visitIfStatement(Node.IfStatement node) {
        Tree tree = new Tree("IF_STMT");
        child(tree, wrap("CONDITION", node.condition));
        child(tree, block("BLOCK", node.thenBody));
        if (!node.elseBody.isEmpty()) child(tree, block("ELSE_BLOCK", node.elseBody));
        return tree;
    }

    @Override
    public Tree visitWhileStatement(Node.WhileStatement node) {
        Tree tree = new Tree("WHILE_STMT");
        child(tree, wrap("CONDITION", node.condition));
        child(tree, block("BLOCK", node.body));
        return tree;
    }

    @Override
    public Tree visitForStatement(Node.ForStatement node) {
        Tree tree = node.concurrent ? new Tree("FOR_STMT", "concurrent") : new Tree("FOR_STMT");
        if (node.variable != null) child(tree, new Tree("VARIABLE", node.variable));
        child(tree, wrap("INIT", node.init));
        child(tree, wrap("CONDITION", node.condition));
        child(tree, wrap("UPDATE", node.update));
        child(tree, wrap("ITERABLE", node.iterable));
        child(tree, block("BLOCK", node.body));
        return tree;
    }

    @Override
    public Tree visitSwitchStatement(Node.SwitchStatement node) {
        Tree tree = new Tree("SWITCH_STMT");
        child(tree, wrap("EXPR", node.expression));
        for (Node.Case arm : node.cases) {
            Tree branch = add(new Tree("CASE"), arm.value());
            child(branch, block("BLOCK", arm.body()));
            child(tree, branch);
        }
        if (!node.defaultBody.isEmpty()) child(tree, block("DEFAULT", node.defaultBody));
        return tree;
    }

    @Override
    public Tree visitReturnStatement(Node.ReturnStatement node) {
        return add(new Tree("RETURN_STMT"), node.value);
    }

    @Override
    public Tree visitArrayLiteral(Node.ArrayLiteral node) {
        return addAll(new Tree("ARRAY_LITERAL"), node.elements);
    }

    @Override
    public Tree visitMapLiteral(Node.MapLiteral node) {
        Tree tree = new Tree("MAP_LITERAL");
        for (Node.Pair pair : node.pairs) {
            child(tree, add(new Tree("PAIR"), pair.key(), pair.value()));
        }
        return tree;
    }

    @Override
    public Tree visitAsyncStatement(Node.AsyncStatement node) {
        return addAll(new Tree("ASYNC_STMT"), node.body);
    }

    @Override
    public Tree visitAwaitExpression(Node.AwaitExpression node) {
        Tree tree = node.combinator == null ? new Tree("AWAIT_EXPR") : new Tree("AWAIT_EXPR", node.combinator);
        return add(tree, node.expression);
    }

    @Override
    public Tree visitEmitStatement(Node.EmitStatement node) {
        Tree tree = new Tree("EMIT_STMT");
        child(tree, new Tree("IDENTIFIER", node.eventName));
        return add(tree, node.data);
    }

    @Override
    public Tree visitListenStatement(Node.ListenStatement node) {
        Tree tree = new Tree("LISTEN_STMT");
        child(tree, new Tree("IDENTIFIER", node.eventName));
        return add(tree, node.handler);
    }

    @Override
    public Tree visitCallExpression(Node.CallExpression node) {
        Tree tree = new Tree("CALL_EXPR");
        child(tree, wrap("MEMBER_EXPR", node.callee));
        if (!node.arguments.isEmpty()) child(tree, block("ARG_LIST", node.arguments));
        return tree;
    }

    @Override
    public Tree visitConfigBlock(Node.ConfigBlock node) {
        Tree tree = new Tree("CONFIG_BLOCK");
        child(tree, new Tree("IDENTIFIER", node.name));
        return add(tree, node.value);
    }

    // Statement forms without a core node share the STMT label.

    private Tree statement(Node.Statement node) {
        return new Tree("STMT", node.kind);
    }

    @Override
    public Tree visitTryCatch(Node.TryCatch node) {
        Tree tree = statement(node);
        child(tree, block("BLOCK", node.tryBody));
        if (node.hasCatch) {
            Tree handler = node.catchParam == null ? new Tree("CATCH") : new Tree("CATCH", node.catchParam);
            child(tree, addAll(handler, node.catchBody));
        }
        return tree;
    }

    @Override
    public Tree visitWatch(Node.Watch node) {
        return reactive(node);
    }

    @Override
    public Tree visitOn(Node.On node) {
        return reactive(node);
    }

    private Tree reactive(Node.Reactive node) {
        Tree tree = statement(node);
        child(tree, wrap("EXPR", node.expression));
        if (!node.params.isEmpty()) child(tree, block("PARAM_LIST", node.params));
        child(tree, wrap("HANDLER", node.handler));
        if (!node.body.isEmpty()) child(tree, block("BLOCK", node.body));
        return tree;
    }

    @Override
    public Tree visitWith(Node.With node) {
        Tree tree = statement(node);
        child(tree, wrap("CONTEXT", node.context));
        child(tree, block("BLOCK", node.body));
        return tree;
    }

    @Override
    public Tree visitSnapshot(Node.Snapshot node) {
        Tree tree = statement(node);
        child(tree, wrap("SOURCE", node.source));
        child(tree, wrap("TARGET", node.target));
        return tree;
    }

    @Override
    public Tree visitRestore(Node.Restore node) {
        Tree tree = statement(node);
        child(tree, wrap("TARGET", node.target));
        child(tree, wrap("SOURCE", node.source));
        return tree;
    }

    @Override
    public Tree visitDecorator(Node.Decorator node) {
        Tree tree = statement(node);
        child(tree, new Tree("DECORATOR", node.decorator));
        if (node.name != null) child(tree, identifier(node.name));
        if (!node.arguments.isEmpty()) child(tree, block("ARG_LIST", node.arguments));
        return tree;
    }
}
