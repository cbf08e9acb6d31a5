package tree.suffix;

/**
 * Result of {@link SuffixTree#findAllSubstring(String)}.
 *
 * @param index       an offset in the text where the pattern occurs, or {@link SuffixTree#NOT_FOUND}
 * @param node        the node right below the match point, or null when there is no match
 * @param occurrences number of leaves under {@code node}, i.e. how often the pattern occurs
 */
public record SubstringMatch(int index, SuffixTreeNode node, int occurrences) {

    public static final SubstringMatch NONE = new SubstringMatch(SuffixTree.NOT_FOUND, null, 0);

    public boolean found() {
        return index != SuffixTree.NOT_FOUND;
    }
}
