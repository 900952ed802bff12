package org.pragmatica.sgf.proof;

import org.pragmatica.sgf.error.InconsistentTreeException;
import org.pragmatica.sgf.tree.GameTree;
import org.pragmatica.sgf.tree.NodeType;
import org.pragmatica.sgf.tree.SgfNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes subtree size and proof size for every node of a fully built tree.
 *
 * <p>Proof size counts the nodes needed to certify a solved status:
 * <ul>
 *   <li>leaf: 1 if solved, else 0;</li>
 *   <li>AND node: 1 + sum over solved children;</li>
 *   <li>OR node: 1 + minimum over solved children;</li>
 *   <li>untyped node: 1 when solved;</li>
 *   <li>unsolved node: 0.</li>
 * </ul>
 * A solved node without any solved child is accepted only when its status came from a
 * transposition match or a search-window cutoff; its proof size is then 1.
 */
public final class ProofAnnotator {
    private static final Logger log = LoggerFactory.getLogger(ProofAnnotator.class);

    private ProofAnnotator() {}

    public static void annotate(GameTree tree) {
        tree.root().ifPresent(ProofAnnotator::annotate);
    }

    /**
     * Annotate the subtree rooted at {@code root}.
     *
     * @throws InconsistentTreeException when a solved node has no solved child and no provenance flag
     */
    public static void annotate(SgfNode root) {
        var nodes = GameTree.preOrder(root);
        // reverse pre-order visits every child before its parent
        for (int i = nodes.size() - 1; i >= 0; i--) {
            annotateNode(nodes.get(i));
        }
    }

    private static void annotateNode(SgfNode node) {
        if (node.isLeaf()) {
            node.setSizes(1, node.solved() ? 1 : 0);
            return;
        }

        long treeSize = 1;
        long proofSum = 0;
        long proofMin = Long.MAX_VALUE;
        boolean solvedChild = false;
        for (var child : node.children()) {
            treeSize += child.treeSize();
            if (child.solved()) {
                solvedChild = true;
                proofSum += child.proofSize();
                proofMin = Math.min(proofMin, child.proofSize());
            }
        }

        if (!node.solved()) {
            node.setSizes(treeSize, 0);
            return;
        }
        if (!solvedChild) {
            node.setSizes(treeSize, fallbackProofSize(node));
            return;
        }
        long proofSize = switch (node.type()) {
            case AND -> proofSum + 1;
            case OR -> proofMin + 1;
            case NONE -> 1;
        };
        node.setSizes(treeSize, proofSize);
    }

    private static long fallbackProofSize(SgfNode node) {
        if (!node.matchedTransposition() && !node.prunedBySearchWindow()) {
            throw new InconsistentTreeException(node.id(),
                                                "solved " + node.type() + " node has no solved child"
                                                + " and no transposition or search-window provenance");
        }
        log.debug("Node {} ({}) solved by {} without solved children, proof size set to 1",
                  node.id(),
                  node.type() == NodeType.NONE ? "untyped" : node.type(),
                  node.matchedTransposition() ? "transposition match" : "search-window cutoff");
        return 1;
    }
}
