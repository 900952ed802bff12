package org.pragmatica.sgf.tree;

/**
 * AND/OR typing of a game-tree node.
 */
public enum NodeType {
    /**
     * Solving the node requires every child to be solved.
     */
    AND,

    /**
     * Solving the node requires at least one solved child.
     */
    OR,

    /**
     * No move marker present.
     */
    NONE
}
