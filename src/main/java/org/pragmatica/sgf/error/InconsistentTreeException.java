package org.pragmatica.sgf.error;

/**
 * Solver metadata that contradicts itself, e.g. a solved node whose status neither its
 * children nor a transposition or search-window flag explain.
 */
public final class InconsistentTreeException extends IllegalStateException {
    private final long nodeId;

    public InconsistentTreeException(long nodeId, String message) {
        super("Node " + nodeId + ": " + message);
        this.nodeId = nodeId;
    }

    public long nodeId() {
        return nodeId;
    }
}
