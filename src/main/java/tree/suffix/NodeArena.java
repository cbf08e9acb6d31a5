package tree.suffix;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;

/**
 * Growable store owning every node of one tree. Nodes reference each other by index,
 * so suffix links are plain integers and never create ownership cycles.
 */
final class NodeArena {

    static final int ROOT = 0;

    private final ObjectArrayList<SuffixTreeNode> nodes;

    NodeArena(int expectedNodes) {
        this.nodes = new ObjectArrayList<>(Math.max(1, expectedNodes));
        allocate();
    }

    int allocate() {
        int id = nodes.size();
        nodes.add(new SuffixTreeNode(id));
        return id;
    }

    SuffixTreeNode get(int id) {
        return nodes.get(id);
    }

    SuffixTreeNode root() {
        return nodes.get(ROOT);
    }

    int size() {
        return nodes.size();
    }

    // Backing list, handed to JOL for footprint reports.
    Object storage() {
        return nodes;
    }
}
