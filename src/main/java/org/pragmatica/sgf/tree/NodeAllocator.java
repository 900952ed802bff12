package org.pragmatica.sgf.tree;

/**
 * Allocation strategy for tree nodes.
 *
 * <p>Implementations track every node they hand out so the owner can release them as a unit.
 * Nodes resolve their links through the {@link NodeArena} that created them, so a custom
 * allocator delegates creation to an arena and adds its own policy around it:
 * <pre>{@code
 * class CountingAllocator implements NodeAllocator {
 *     private final NodeArena arena = new NodeArena();
 *     private int allocations;
 *
 *     public SgfNode allocate() {
 *         allocations++;
 *         return arena.allocate();
 *     }
 *
 *     public boolean deallocate(SgfNode node) {
 *         return arena.deallocate(node);
 *     }
 * }
 * }</pre>
 */
public interface NodeAllocator {

    /**
     * Allocate a fresh, unlinked node and start tracking it.
     */
    SgfNode allocate();

    /**
     * Release a node if this allocator tracks it.
     *
     * @return {@code false} when the node is not tracked (never allocated here or already released)
     */
    boolean deallocate(SgfNode node);
}
