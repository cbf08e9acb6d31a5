package tree.suffix;

/**
 * A compressed edge in the suffix tree. The label is text[start .. end), end exclusive.
 * Leaf edges carry {@link #OPEN} as their end and are resolved against the tree's current
 * leaf end when read, so every open leaf grows with the text without being rewritten.
 */
public final class Edge {

    public static final int OPEN = Integer.MIN_VALUE;

    private final int target;
    private final int start;
    private final int end;

    Edge(int target, int start, int end) {
        this.target = target;
        this.start = start;
        this.end = end;
    }

    /**
     * Arena index of the node this edge leads to.
     */
    public int getTarget() {
        return target;
    }

    public int getStart() {
        return start;
    }

    public boolean isOpen() {
        return end == OPEN;
    }

    /**
     * Return the exclusive end of the label, substituting {@code leafEnd} for open edges.
     */
    public int resolveEnd(int leafEnd) {
        return (end == OPEN) ? leafEnd : end;
    }

    public int length(int leafEnd) {
        return resolveEnd(leafEnd) - start;
    }
}
