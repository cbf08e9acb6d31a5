package tree.suffix;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrays;
import it.unimi.dsi.fastutil.objects.ObjectLinkedOpenHashSet;
import org.openjdk.jol.info.GraphLayout;
import utilities.MemoryUsageReport;
import utilities.SuffixTreeLogger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * SuffixTree
 *
 * In-memory suffix tree over one or more strings, built online with Ukkonen's algorithm.
 * Strings are concatenated into a single text buffer:
 *   - the first string is stored as is,
 *   - every later string is preceded by {@link Symbols#SEPARATOR},
 *   - every string is followed by its own unique terminator.
 * Reserved symbols are never part of query results.
 *
 * Query:
 *   findSubstring / findAllSubstring / findAllOccurrences walk the tree from the root in
 *   time linear in the pattern length (plus the size of the matched subtree for counting).
 *
 * Instances are not thread-safe; the caller owns synchronization between addString and queries.
 */
public final class SuffixTree implements Iterable<TraversalEntry> {

    public static final int NOT_FOUND = -1;

    private final SuffixTreeConfiguration configuration;
    private final List<String> strings = new ArrayList<>();

    private StringBuilder text;
    private NodeArena arena;
    private UkkonenBuilder builder;

    public SuffixTree() {
        this("", SuffixTreeConfiguration.defaults());
    }

    public SuffixTree(String text) {
        this(text, SuffixTreeConfiguration.defaults());
    }

    public SuffixTree(String text, SuffixTreeConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        reset();
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        if (!text.isEmpty()) {
            addString(text);
        }
    }

    private void reset() {
        int capacity = configuration.initialCapacity();
        this.text = new StringBuilder(capacity);
        // A text of length n never needs more than 2n + 1 nodes.
        this.arena = new NodeArena(2 * capacity + 1);
        this.builder = new UkkonenBuilder(arena, text, configuration.traceConstruction());
        this.strings.clear();
    }

    /**
     * Index another string. It is appended to the text buffer after a separator (unless it is
     * the first one) and closed with a fresh terminator.
     *
     * The whole Basic Multilingual Plane private-use block U+E000..U+F8FF is reserved for
     * separators and terminators, so strings carrying private-use characters (icon-font
     * glyphs, for instance) cannot be indexed; callers must map them out first.
     *
     * @return this tree
     * @throws IllegalArgumentException if {@code s} is null or contains a reserved symbol
     * @throws IllegalStateException    if the tree already holds {@link Symbols#MAX_STRINGS} strings
     */
    public SuffixTree addString(String s) {
        if (s == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        if (Symbols.containsReserved(s)) {
            throw new IllegalArgumentException("text contains a reserved symbol (U+E000..U+F8FF)");
        }
        char terminator = Symbols.terminator(strings.size());

        int from = text.length();
        if (from > 0) {
            text.append(Symbols.SEPARATOR);
        }
        text.append(s).append(terminator);
        builder.extend(from, text.length());
        strings.add(s);

        if (SuffixTreeLogger.isDebugEnabled()) {
            SuffixTreeLogger.debug("Indexed string #" + strings.size() + " of length " + s.length()
                    + "; text=" + text.length() + " nodes=" + arena.size());
        }
        return this;
    }

    /**
     * Find an offset in the text buffer where {@code pattern} occurs.
     *
     * @return a start offset, or {@link #NOT_FOUND} if the pattern does not occur or contains a
     *         reserved symbol. The empty pattern matches at 0 in any non-empty tree.
     */
    public int findSubstring(String pattern) {
        Locus locus = locate(pattern);
        return (locus == null) ? NOT_FOUND : locus.index;
    }

    /**
     * Like {@link #findSubstring(String)}, also reporting the node below the match point and
     * how many times the pattern occurs.
     */
    public SubstringMatch findAllSubstring(String pattern) {
        Locus locus = locate(pattern);
        if (locus == null) {
            return SubstringMatch.NONE;
        }
        SuffixTreeNode node = arena.get(locus.node);
        return new SubstringMatch(locus.index, node, countLeaves(node));
    }

    /**
     * Every start offset of {@code pattern} in the text buffer, in ascending order.
     */
    public IntList findAllOccurrences(String pattern) {
        Locus locus = locate(pattern);
        if (locus == null) {
            return new IntArrayList();
        }
        IntArrayList matches = new IntArrayList();
        IntArrayList stack = new IntArrayList();
        stack.add(locus.node);
        while (!stack.isEmpty()) {
            SuffixTreeNode cur = arena.get(stack.popInt());
            if (cur.isLeaf()) {
                matches.add(cur.getSuffixStart());
                continue;
            }
            for (Edge e : cur.getTransitions()) {
                stack.add(e.getTarget());
            }
        }
        int[] sorted = matches.toIntArray();
        Arrays.sort(sorted);
        return IntArrayList.wrap(sorted);
    }

    /**
     * Number of leaves in the subtree rooted at {@code node}; a leaf counts as one.
     */
    public int countLeaves(SuffixTreeNode node) {
        Objects.requireNonNull(node, "node");
        int count = 0;
        IntArrayList stack = new IntArrayList();
        stack.add(node.getId());
        while (!stack.isEmpty()) {
            SuffixTreeNode cur = arena.get(stack.popInt());
            if (cur.isLeaf()) {
                count++;
                continue;
            }
            for (Edge e : cur.getTransitions()) {
                stack.add(e.getTarget());
            }
        }
        return count;
    }

    // Walk from the root matching the pattern symbol by symbol.
    private Locus locate(String pattern) {
        if (pattern == null) {
            throw new IllegalArgumentException("pattern cannot be null");
        }
        if (text.length() == 0 || Symbols.containsReserved(pattern)) {
            return null;
        }
        if (pattern.isEmpty()) {
            return new Locus(0, NodeArena.ROOT);
        }

        int leafEnd = builder.leafEnd();
        SuffixTreeNode current = arena.root();
        int depth = 0;
        int patternIndex = 0;

        while (true) {
            Edge edge = current.getTransition(pattern.charAt(patternIndex));
            if (edge == null) {
                return null;
            }

            int edgeStart = edge.getStart();
            int edgeEnd = edge.resolveEnd(leafEnd);
            int edgeIndex = edgeStart;
            // Reserved symbols on the edge never equal a pattern symbol.
            while (edgeIndex < edgeEnd && patternIndex < pattern.length()) {
                if (text.charAt(edgeIndex) != pattern.charAt(patternIndex)) {
                    return null;
                }
                edgeIndex++;
                patternIndex++;
            }

            if (patternIndex == pattern.length()) {
                // The edge label starts 'depth' symbols into an occurrence of the path.
                return new Locus(edgeStart - depth, edge.getTarget());
            }

            depth += edgeEnd - edgeStart;
            current = arena.get(edge.getTarget());
        }
    }

    public List<String> findLongestRepeatedSubstrings() {
        return findLongestRepeatedSubstrings(configuration.repeatLimit());
    }

    /**
     * Return up to {@code n} repeated substrings, longest first.
     *
     * Candidates are the path labels of internal nodes, each shared by at least two suffixes.
     * Candidates of equal length keep their depth-first discovery order. Labels are only
     * materialized for the returned strings.
     */
    public List<String> findLongestRepeatedSubstrings(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must be non-negative");
        }
        int leafEnd = builder.leafEnd();
        int[] reservedBefore = reservedPrefixCounts();
        ObjectArrayList<Repeat> candidates = new ObjectArrayList<>();
        ArrayDeque<Pending> stack = new ArrayDeque<>();
        stack.push(new Pending(NodeArena.ROOT, 0, 0));

        while (!stack.isEmpty()) {
            Pending pending = stack.pop();
            List<Edge> edges = arena.get(pending.node).getTransitions();
            // Push in reverse so children are visited in insertion order.
            for (int i = edges.size() - 1; i >= 0; i--) {
                Edge e = edges.get(i);
                if (arena.get(e.getTarget()).isLeaf()) {
                    continue;
                }
                int end = e.resolveEnd(leafEnd);
                stack.push(new Pending(e.getTarget(), end, pending.depth + (end - e.getStart())));
            }
            if (pending.node == NodeArena.ROOT) {
                continue;
            }
            int start = pending.end - pending.depth;
            int length = pending.depth - (reservedBefore[pending.end] - reservedBefore[start]);
            if (length > 0) {
                candidates.add(new Repeat(start, pending.end, length));
            }
        }

        Repeat[] sorted = candidates.toArray(new Repeat[0]);
        // mergeSort is stable: equal lengths keep discovery order.
        ObjectArrays.mergeSort(sorted, Comparator.comparingInt(Repeat::length).reversed());

        ObjectLinkedOpenHashSet<String> result = new ObjectLinkedOpenHashSet<>();
        for (int i = 0; i < sorted.length && result.size() < n; i++) {
            // Stripping can make two candidates equal, e.g. separator + "ab" and "ab".
            result.add(Symbols.strip(text.subSequence(sorted[i].start, sorted[i].end)));
        }
        return new ArrayList<>(result);
    }

    // reservedBefore[i] = number of reserved symbols in text[0, i).
    private int[] reservedPrefixCounts() {
        int[] counts = new int[text.length() + 1];
        for (int i = 0; i < text.length(); i++) {
            counts[i + 1] = counts[i] + (Symbols.isReserved(text.charAt(i)) ? 1 : 0);
        }
        return counts;
    }

    /**
     * Structural dump, one {@code ["label", start, end]} line per edge, indented by depth.
     * Meant for debugging; the format is not stable.
     */
    @Override
    public String toString() {
        int leafEnd = builder.leafEnd();
        StringBuilder sb = new StringBuilder();
        ArrayDeque<Printed> stack = new ArrayDeque<>();
        pushEdges(stack, NodeArena.ROOT, 0);
        while (!stack.isEmpty()) {
            Printed p = stack.pop();
            int end = p.edge.resolveEnd(leafEnd);
            for (int t = 0; t < p.depth; t++) {
                sb.append('\t');
            }
            sb.append("[\"")
                    .append(Symbols.render(text.subSequence(p.edge.getStart(), end),
                            configuration.terminatorGlyph(), configuration.separatorGlyph()))
                    .append("\", ").append(p.edge.getStart()).append(", ").append(end).append("]\n");
            pushEdges(stack, p.edge.getTarget(), p.depth + 1);
        }
        return sb.toString();
    }

    private void pushEdges(ArrayDeque<Printed> stack, int node, int depth) {
        List<Edge> edges = arena.get(node).getTransitions();
        for (int i = edges.size() - 1; i >= 0; i--) {
            stack.push(new Printed(edges.get(i), depth));
        }
    }

    @Override
    public SuffixTreeIterator iterator() {
        return new SuffixTreeIterator(arena, text, builder.leafEnd());
    }

    public TraversalEntry[] toArray() {
        List<TraversalEntry> result = new ArrayList<>(arena.size());
        Iterator<TraversalEntry> it = iterator();
        while (it.hasNext()) {
            result.add(it.next());
        }
        return result.toArray(new TraversalEntry[0]);
    }

    /**
     * Number of strings added so far.
     */
    public int size() {
        return strings.size();
    }

    public boolean isEmpty() {
        return strings.isEmpty();
    }

    /**
     * A suffix tree has no notion of element containment; always false.
     * Use {@link #findSubstring(String)} for substring membership.
     */
    public boolean contains(Object element) {
        return false;
    }

    /**
     * Drop every node and all indexed text, starting over from an empty root.
     */
    public void clear() {
        int dropped = arena.size();
        reset();
        SuffixTreeLogger.debug("Cleared suffix tree, released " + dropped + " nodes");
    }

    /**
     * The raw text buffer, separators and terminators included.
     */
    public String getText() {
        return text.toString();
    }

    public List<String> getStrings() {
        return Collections.unmodifiableList(strings);
    }

    public SuffixTreeNode getRoot() {
        return arena.root();
    }

    public int nodeCount() {
        return arena.size();
    }

    public SuffixTreeConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * Memory footprint of the node arena and the text buffer, measured with JOL.
     */
    public MemoryUsageReport memoryReport() {
        long nodesBytes;
        long textBytes;
        try {
            nodesBytes = GraphLayout.parseInstance(arena.storage()).totalSize();
            textBytes = GraphLayout.parseInstance(text).totalSize();
        } catch (RuntimeException e) {
            SuffixTreeLogger.warning("JOL layout unavailable, estimating footprint: " + e.getMessage());
            nodesBytes = (long) arena.size() * 48L;
            textBytes = (long) text.capacity() * 2L;
        }
        long totalBytes = nodesBytes + textBytes;

        Locale L = Locale.ROOT;
        String report = String.format(L, "Total: %d B (%.3f MiB)%n", totalBytes, totalBytes / (1024.0 * 1024.0))
                + String.format(L, "Nodes: %d B (%.3f MiB) across %d nodes%n", nodesBytes, nodesBytes / (1024.0 * 1024.0), arena.size())
                + String.format(L, "Text: %d B (%.3f MiB) for %d symbols", textBytes, textBytes / (1024.0 * 1024.0), text.length());
        return new MemoryUsageReport(report, totalBytes / (1024.0 * 1024.0));
    }

    // Package-private hooks for invariant checks.
    NodeArena arena() {
        return arena;
    }

    int leafEnd() {
        return builder.leafEnd();
    }

    private static final class Locus {
        final int index;
        final int node;

        Locus(int index, int node) {
            this.index = index;
            this.node = node;
        }
    }

    // Internal node reached by the DFS, with the text end offset and raw depth of its path.
    private record Pending(int node, int end, int depth) {}

    // Path label text[start, end) whose stripped length is 'length'.
    private record Repeat(int start, int end, int length) {}

    private record Printed(Edge edge, int depth) {}
}
