package tree.suffix;

import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Depth-first pre-order walk over the nodes of a {@link SuffixTree}, yielding each node with
 * the path label leading to it. Uses an explicit stack so deep trees do not hit the
 * Java Virtual Machine stack limit.
 *
 * The iterator reads the live tree; adding strings while iterating gives undefined results.
 */
public final class SuffixTreeIterator implements Iterator<TraversalEntry> {

    private final NodeArena arena;
    private final CharSequence text;
    private final int leafEnd;
    private final ArrayDeque<Frame> stack = new ArrayDeque<>();
    private TraversalEntry current;

    SuffixTreeIterator(NodeArena arena, CharSequence text, int leafEnd) {
        this.arena = arena;
        this.text = text;
        this.leafEnd = leafEnd;
        stack.push(new Frame(NodeArena.ROOT, 0, 0));
    }

    @Override
    public boolean hasNext() {
        return !stack.isEmpty();
    }

    @Override
    public TraversalEntry next() {
        if (stack.isEmpty()) {
            throw new NoSuchElementException("No more nodes in the traversal");
        }
        Frame frame = stack.pop();
        SuffixTreeNode node = arena.get(frame.node);
        for (Edge edge : node.getTransitions()) {
            stack.push(extend(frame, edge));
        }
        current = new TraversalEntry(node, text, frame.start, frame.depth);
        return current;
    }

    /**
     * Return the entry produced by the last call to {@link #next()}.
     */
    public TraversalEntry current() {
        if (current == null) {
            throw new IllegalStateException("current() called before next()");
        }
        return current;
    }

    // The path to the child spells text[edge.start - parent.depth, edge.end).
    private Frame extend(Frame parent, Edge edge) {
        int end = edge.resolveEnd(leafEnd);
        return new Frame(edge.getTarget(), edge.getStart() - parent.depth, parent.depth + (end - edge.getStart()));
    }

    private static final class Frame {
        final int node;
        final int start;
        final int depth;

        Frame(int node, int start, int depth) {
            this.node = node;
            this.start = start;
            this.depth = depth;
        }
    }
}
