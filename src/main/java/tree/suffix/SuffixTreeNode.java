package tree.suffix;

import java.util.List;

/**
 * A node of the suffix tree, addressed by its index in the {@link NodeArena}.
 * Callers get read-only access; only the construction engine mutates nodes.
 */
public final class SuffixTreeNode {

    private final int id;

    // LAZY: null until first transition is added
    private ChildMap children;

    // Weak back-reference as an arena index. Construction only.
    private int suffixLink = NodeArena.ROOT;

    private int totalTransitions;
    private boolean terminal;

    // suffixStart is meaningful for leaves.
    private int suffixStart = -1;

    SuffixTreeNode(int id) {
        this.id = id;
    }

    public int getId() {
        return id;
    }

    /**
     * Record or overwrite the edge leaving this node on {@code symbol}.
     */
    void addTransition(int child, int start, int end, char symbol) {
        if (children == null) {
            children = new ChildMap();
        }
        children.put(symbol, new Edge(child, start, end));
        totalTransitions++;
    }

    public Edge getTransition(char symbol) {
        return (children == null) ? null : children.get(symbol);
    }

    public List<Edge> getTransitions() {
        return (children == null) ? List.of() : children.edges();
    }

    char[] transitionSymbols() {
        return (children == null) ? new char[0] : children.keys();
    }

    public int childCount() {
        return (children == null) ? 0 : children.size();
    }

    public boolean isLeaf() {
        return children == null || children.isEmpty();
    }

    /**
     * Number of {@code addTransition} calls, overwrites included.
     */
    public int getTotalTransitions() {
        return totalTransitions;
    }

    public boolean isTerminal() {
        return terminal;
    }

    void markTerminal(int suffixStart) {
        this.terminal = true;
        this.suffixStart = suffixStart;
    }

    /**
     * Start offset of the suffix spelled by the path to this leaf, or -1 for internal nodes.
     */
    public int getSuffixStart() {
        return suffixStart;
    }

    int getSuffixLink() {
        return suffixLink;
    }

    void setSuffixLink(int suffixLink) {
        this.suffixLink = suffixLink;
    }

    @Override
    public String toString() {
        return isLeaf() ? "Leaf{" + id + ", suffix=" + suffixStart + '}'
                : "Node{" + id + ", children=" + childCount() + '}';
    }
}
