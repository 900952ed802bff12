package org.pragmatica.sgf;

import org.pragmatica.sgf.proof.PropertyInterpreter;
import org.pragmatica.sgf.tree.GameTree;
import org.pragmatica.sgf.tree.SgfNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Renders annotated trees back to SGF text.
 *
 * <p>Every comment property gets the node statistics appended as {@code key = value} lines,
 * so a later read sees the same solver flags plus the computed sizes.
 */
public final class SgfWriter {

    // Pending output: either a node to render or literal text
    private sealed interface Step {
        record Visit(SgfNode node, boolean followSiblings) implements Step {}

        record Emit(String text) implements Step {}
    }

    private SgfWriter() {}

    /**
     * Render the whole tree, or an empty string for an empty tree.
     */
    public static String write(GameTree tree) {
        return tree.root()
                   .map(SgfWriter::write)
                   .orElse("");
    }

    /**
     * Render the subtree rooted at {@code node} as one parenthesized game tree.
     * Siblings of {@code node} itself are not included.
     */
    public static String write(SgfNode node) {
        var sb = new StringBuilder();
        sb.append('(');
        Deque<Step> steps = new ArrayDeque<>();
        steps.push(new Step.Visit(node, false));
        while (!steps.isEmpty()) {
            var step = steps.pop();
            if (step instanceof Step.Emit emit) {
                sb.append(emit.text());
            } else if (step instanceof Step.Visit visit) {
                visit(sb, steps, visit.node(), visit.followSiblings());
            }
        }
        sb.append(')');
        return sb.toString();
    }

    public static void writeTo(GameTree tree, Path path) throws IOException {
        Files.writeString(path, write(tree), StandardCharsets.UTF_8);
    }

    /**
     * Render one node: {@code ;} followed by its properties in document order.
     */
    public static String nodeText(SgfNode node) {
        var sb = new StringBuilder();
        appendNode(sb, node);
        return sb.toString();
    }

    private static void visit(StringBuilder sb, Deque<Step> steps, SgfNode node, boolean followSiblings) {
        var next = followSiblings ? node.nextSibling() : Optional.<SgfNode>empty();
        var child = node.firstChild();

        if (next.isEmpty()) {
            appendNode(sb, node);
            child.ifPresent(c -> steps.push(new Step.Visit(c, true)));
            return;
        }

        sb.append('(');
        appendNode(sb, node);
        // steps run last-in first-out, so push in reverse order
        if (next.get().nextSibling().isPresent()) {
            steps.push(new Step.Visit(next.get(), true));
            steps.push(new Step.Emit(")"));
        } else {
            steps.push(new Step.Emit(")"));
            steps.push(new Step.Visit(next.get(), true));
            steps.push(new Step.Emit(")("));
        }
        child.ifPresent(c -> steps.push(new Step.Visit(c, true)));
    }

    private static void appendNode(StringBuilder sb, SgfNode node) {
        sb.append(';');
        for (var property : node.properties()) {
            sb.append(property.tag());
            if (property.tag().equals(PropertyInterpreter.COMMENT)) {
                sb.append('[').append(property.firstValue()).append('\n');
                appendStatistics(sb, node);
                sb.append(']');
            } else {
                for (var value : property.values()) {
                    sb.append('[').append(value).append(']');
                }
            }
        }
    }

    private static void appendStatistics(StringBuilder sb, SgfNode node) {
        sb.append("id = ").append(node.id()).append('\n')
          .append("type = ").append(node.type()).append('\n')
          .append("tree_size = ").append(node.treeSize()).append('\n')
          .append("proof_tree_size = ").append(node.proofSize()).append('\n')
          .append("solved = ").append(node.solved()).append('\n')
          .append("match_tt = ").append(node.matchedTransposition()).append('\n')
          .append("pruned_by_rzone = ").append(node.prunedBySearchWindow());
    }
}
