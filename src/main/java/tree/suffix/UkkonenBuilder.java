package tree.suffix;

import utilities.SuffixTreeLogger;

/**
 * Online construction engine running Ukkonen's algorithm over a shared text buffer.
 *
 * The engine consumes the buffer one symbol at a time and can resume where it stopped,
 * which is how {@link SuffixTree#addString(String)} indexes several strings in the same
 * tree. Every indexed string ends with a terminator that occurs nowhere else, so once a
 * string is consumed all of its suffixes are explicit and the active point is back at the
 * root with nothing pending. {@link #extend(int, int)} checks that boundary state before
 * consuming more text.
 */
final class UkkonenBuilder {

    private static final int NONE = -1;

    private final NodeArena arena;
    private final CharSequence text;
    private final boolean trace;

    // Ukkonen state
    private int activeNode = NodeArena.ROOT;
    private int activeEdgeIndex = NONE;  // index in 'text' that names the active edge
    private int activeLength = 0;        // how many symbols we have matched on that edge
    private int remaining = 0;
    private int lastCreatedNode = NONE;

    // Exclusive end shared by every open leaf edge.
    private int leafEnd = 0;

    UkkonenBuilder(NodeArena arena, CharSequence text, boolean trace) {
        this.arena = arena;
        this.text = text;
        this.trace = trace;
    }

    int leafEnd() {
        return leafEnd;
    }

    /**
     * Consume text[from .. to). {@code from} must be where the previous call stopped.
     */
    void extend(int from, int to) {
        if (from != leafEnd) {
            throw new IllegalStateException("engine consumed " + leafEnd + " symbols but was asked to resume at " + from);
        }
        if (to > text.length() || to < from) {
            throw new IllegalStateException("range [" + from + ", " + to + ") outside text of length " + text.length());
        }
        if (remaining != 0 || activeLength != 0 || activeNode != NodeArena.ROOT) {
            // Only reachable if the consumed text did not end with a unique terminator.
            String msg = "active point not at root between strings: node=" + activeNode
                    + " length=" + activeLength + " remaining=" + remaining;
            SuffixTreeLogger.error(msg);
            throw new IllegalStateException(msg);
        }
        for (int pos = from; pos < to; pos++) {
            phase(pos);
        }
    }

    /**
     * Process text[pos]. This is one Ukkonen phase.
     */
    private void phase(int pos) {
        // The new symbol is now part of every open leaf.
        leafEnd = pos + 1;
        remaining++;
        lastCreatedNode = NONE;
        char symbol = text.charAt(pos);

        while (remaining > 0) {
            if (activeLength == 0) {
                activeEdgeIndex = pos;
            }

            char edgeSymbol = text.charAt(activeEdgeIndex);
            SuffixTreeNode active = arena.get(activeNode);
            Edge edge = active.getTransition(edgeSymbol);

            if (edge == null) {
                // Rule 2 (no edge starting with edgeSymbol)
                addLeaf(active, pos, edgeSymbol);
                if (lastCreatedNode != NONE) {
                    arena.get(lastCreatedNode).setSuffixLink(activeNode);
                    lastCreatedNode = NONE;
                }
            } else {
                if (walkDown(edge)) {
                    continue;
                }

                char edgeNextSymbol = text.charAt(edge.getStart() + activeLength);
                if (edgeNextSymbol == symbol) {
                    // Rule 3 (already in the tree) ends the phase.
                    if (lastCreatedNode != NONE && activeNode != NodeArena.ROOT) {
                        arena.get(lastCreatedNode).setSuffixLink(activeNode);
                        lastCreatedNode = NONE;
                    }
                    activeLength++;
                    return;
                }

                int split = split(active, edge, edgeSymbol, edgeNextSymbol, pos);
                if (lastCreatedNode != NONE) {
                    arena.get(lastCreatedNode).setSuffixLink(split);
                }
                lastCreatedNode = split;
            }

            remaining--;

            if (activeNode == NodeArena.ROOT && activeLength > 0) {
                activeLength--;
                activeEdgeIndex = pos - remaining + 1;
            } else if (activeNode != NodeArena.ROOT) {
                // Unset links already point at the root.
                activeNode = arena.get(activeNode).getSuffixLink();
            }
        }
    }

    private void addLeaf(SuffixTreeNode parent, int pos, char symbol) {
        int leaf = arena.allocate();
        arena.get(leaf).markTerminal(pos - remaining + 1);
        parent.addTransition(leaf, pos, Edge.OPEN, symbol);
    }

    /**
     * Split {@code edge} after activeLength symbols and hang a new leaf for text[pos] off the
     * new internal node. Returns the internal node.
     */
    private int split(SuffixTreeNode parent, Edge edge, char edgeSymbol, char edgeNextSymbol, int pos) {
        int splitAt = edge.getStart() + activeLength;
        int internal = arena.allocate();
        SuffixTreeNode internalNode = arena.get(internal);

        // Edge prefix from the active node to the new internal node.
        parent.addTransition(internal, edge.getStart(), splitAt, edgeSymbol);
        // Remainder of the old edge, keeping its open end if it had one.
        internalNode.addTransition(edge.getTarget(), splitAt, edge.isOpen() ? Edge.OPEN : edge.resolveEnd(leafEnd), edgeNextSymbol);
        addLeaf(internalNode, pos, text.charAt(pos));

        if (trace) {
            SuffixTreeLogger.trace("split edge [" + edge.getStart() + ", " + edge.resolveEnd(leafEnd)
                    + ") at " + splitAt + " into node " + internal + " for symbol at " + pos);
        }
        return internal;
    }

    /**
     * Skip down the given edge if activeLength covers it entirely.
     * Return true if we moved to the child and must re-evaluate this extension.
     */
    private boolean walkDown(Edge edge) {
        int edgeLength = edge.length(leafEnd);
        if (activeLength >= edgeLength) {
            activeEdgeIndex += edgeLength;
            activeLength -= edgeLength;
            activeNode = edge.getTarget();
            return true;
        }
        return false;
    }
}
