package tree.suffix;

/**
 * One step of a {@link SuffixTreeIterator} walk: the visited node, its path label, its depth
 * and, for leaves, the suffix start.
 *
 * The path to a node always spells a contiguous range of the text buffer, so an entry keeps
 * only that range and builds {@link #pathLabel()} when asked.
 */
public final class TraversalEntry {

    private final SuffixTreeNode node;
    private final CharSequence text;
    private final int start;
    private final int depth;

    TraversalEntry(SuffixTreeNode node, CharSequence text, int start, int depth) {
        this.node = node;
        this.text = text;
        this.start = start;
        this.depth = depth;
    }

    public SuffixTreeNode node() {
        return node;
    }

    /**
     * Text spelled from the root, without reserved symbols and cut at the first terminator.
     */
    public String pathLabel() {
        StringBuilder label = new StringBuilder();
        for (int i = start; i < start + depth; i++) {
            char c = text.charAt(i);
            if (Symbols.isTerminator(c)) {
                break;
            }
            if (c != Symbols.SEPARATOR) {
                label.append(c);
            }
        }
        return label.toString();
    }

    /**
     * Number of text symbols from the root to {@link #node()}, reserved ones included.
     */
    public int depth() {
        return depth;
    }

    // -1 for internal nodes.
    public int suffixStart() {
        return node.getSuffixStart();
    }

    public boolean isLeaf() {
        return node.isLeaf();
    }

    @Override
    public String toString() {
        return "TraversalEntry{" + node + ", depth=" + depth + '}';
    }
}
