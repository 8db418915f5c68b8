package com.quanta.playground.compiler;

import com.quanta.playground.compiler.ast.Block;
import com.quanta.playground.compiler.ast.Declaration;
import com.quanta.playground.compiler.ast.If;
import com.quanta.playground.compiler.ast.Node;
import com.quanta.playground.compiler.ast.Print;
import com.quanta.playground.compiler.ast.Program;
import com.quanta.playground.compiler.ast.Repeat;
import com.quanta.playground.compiler.ast.Statement;
import com.quanta.playground.exception.UnrecognizedNodeException;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Tree walk rendering a Quanta AST as Python 3 source. Expression text is
 * emitted as-is; whether it is valid Python is only found out when the
 * result runs.
 */
public final class CodeGenerator {

    public static final String DEFAULT_INDENT = "    ";
    public static final String UNINITIALIZED = "None";
    static final String END_MARKER = "# end";

    private final String indentUnit;
    private final boolean endMarkers;

    public CodeGenerator() {
        this(DEFAULT_INDENT, true);
    }

    /**
     * @param indentUnit text prepended once per nesting level
     * @param endMarkers whether a {@code # end} comment closes every block
     */
    public CodeGenerator(String indentUnit, boolean endMarkers) {
        Objects.requireNonNull(indentUnit, "indentUnit");
        if (indentUnit.isEmpty() || !indentUnit.isBlank()) {
            throw new IllegalArgumentException("indent unit must be non-empty whitespace");
        }
        this.indentUnit = indentUnit;
        this.endMarkers = endMarkers;
    }

    public String generate(Program program) {
        return render(program, 0);
    }

    String render(Node node, int depth) {
        if (node == null) {
            throw new UnrecognizedNodeException("Unrecognized node: null");
        }
        return switch (node.kind()) {
            case PROGRAM -> renderAll(as(node, Program.class).body(), depth);
            case BLOCK -> renderAll(as(node, Block.class).body(), depth);
            case DECLARATION -> renderDeclaration(as(node, Declaration.class), depth);
            case PRINT -> indent(depth) + "print(" + as(node, Print.class).expression() + ")";
            case IF -> renderIf(as(node, If.class), depth, "if");
            case REPEAT -> renderRepeat(as(node, Repeat.class), depth);
        };
    }

    private String renderDeclaration(Declaration declaration, int depth) {
        return indent(depth) + declaration.name() + " = " + declaration.initializer().orElse(UNINITIALIZED);
    }

    private String renderIf(If node, int depth, String keyword) {
        StringBuilder code = new StringBuilder();
        code.append(indent(depth)).append(keyword).append(' ').append(node.test()).append(':');
        appendBody(code, node.consequent(), depth);

        if (node.alternate() instanceof If elif) {
            code.append('\n').append(renderIf(elif, depth, "elif"));
        } else if (node.alternate() instanceof Block otherwise) {
            code.append('\n').append(indent(depth)).append("else:");
            appendBody(code, otherwise.body(), depth);
        }
        return code.toString();
    }

    private String renderRepeat(Repeat node, int depth) {
        StringBuilder code = new StringBuilder();
        code.append(indent(depth)).append("for _ in range(int(").append(node.count()).append(")):");
        appendBody(code, node.body(), depth);
        return code.toString();
    }

    /**
     * Body one level deeper than {@code depth}, then the closing marker at {@code depth}.
     */
    private void appendBody(StringBuilder code, List<Statement> body, int depth) {
        code.append('\n');
        if (body.isEmpty()) {
            code.append(indent(depth + 1)).append("pass");
        } else {
            code.append(renderAll(body, depth + 1));
        }
        if (endMarkers) {
            code.append('\n').append(indent(depth)).append(END_MARKER);
        }
    }

    private String renderAll(List<? extends Node> nodes, int depth) {
        return nodes.stream()
                .map(n -> render(n, depth))
                .collect(Collectors.joining("\n"));
    }

    private static <T extends Node> T as(Node node, Class<T> type) {
        if (!type.isInstance(node)) {
            throw new UnrecognizedNodeException("Unrecognized node type: " + node.kind()
                    + " (" + node.getClass().getName() + ")");
        }
        return type.cast(node);
    }

    private String indent(int depth) {
        return indentUnit.repeat(depth);
    }
}
