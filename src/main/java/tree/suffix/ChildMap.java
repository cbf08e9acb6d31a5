package tree.suffix;

import it.unimi.dsi.fastutil.chars.Char2ObjectLinkedOpenHashMap;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Outgoing edges of a node keyed by their first symbol.
 *
 * Most suffix tree nodes have very few children, so the first four edges live in inline
 * slots and only a node that needs a fifth one is upgraded to a fastutil hash map. The
 * linked map keeps insertion order, which makes traversal order stable across builds.
 */
final class ChildMap {
    // mode 0 empty, 1..4 number of inline entries, 5 upgraded hash table
    private byte mode = 0;

    private char k1, k2, k3, k4;
    private Edge v1, v2, v3, v4;

    private Char2ObjectLinkedOpenHashMap<Edge> map;

    boolean isEmpty() {
        return mode == 0;
    }

    int size() {
        return (mode == 5) ? map.size() : mode;
    }

    Edge get(char key) {
        switch (mode) {
            case 0:  return null;
            case 1:  return k1 == key ? v1 : null;
            case 2:  return (k1 == key ? v1 : (k2 == key ? v2 : null));
            case 3:  return (k1 == key ? v1 : (k2 == key ? v2 : (k3 == key ? v3 : null)));
            case 4:  return (k1 == key ? v1 : (k2 == key ? v2 : (k3 == key ? v3 : (k4 == key ? v4 : null))));
            default: return map.get(key);
        }
    }

    void put(char key, Edge value) {
        switch (mode) {
            case 0:
                k1 = key; v1 = value; mode = 1; return;
            case 1:
                if (k1 == key) { v1 = value; return; }
                k2 = key; v2 = value; mode = 2; return;
            case 2:
                if (k1 == key) { v1 = value; return; }
                if (k2 == key) { v2 = value; return; }
                k3 = key; v3 = value; mode = 3; return;
            case 3:
                if (k1 == key) { v1 = value; return; }
                if (k2 == key) { v2 = value; return; }
                if (k3 == key) { v3 = value; return; }
                k4 = key; v4 = value; mode = 4; return;
            case 4:
                if (k1 == key) { v1 = value; return; }
                if (k2 == key) { v2 = value; return; }
                if (k3 == key) { v3 = value; return; }
                if (k4 == key) { v4 = value; return; }
                // upgrade
                map = new Char2ObjectLinkedOpenHashMap<>(8);
                map.put(k1, v1); map.put(k2, v2); map.put(k3, v3); map.put(k4, v4);
                // free inline slots
                v1 = v2 = v3 = v4 = null;
                mode = 5;
                map.put(key, value);
                return;
            default:
                map.put(key, value);
        }
    }

    /**
     * Edges in insertion order of their first symbol.
     */
    List<Edge> edges() {
        switch (mode) {
            case 0:  return Collections.emptyList();
            case 1:  return Collections.singletonList(v1);
            case 2:  return Arrays.asList(v1, v2);
            case 3:  return Arrays.asList(v1, v2, v3);
            case 4:  return Arrays.asList(v1, v2, v3, v4);
            default: return List.copyOf(map.values());
        }
    }

    char[] keys() {
        switch (mode) {
            case 0:  return new char[0];
            case 1:  return new char[]{k1};
            case 2:  return new char[]{k1, k2};
            case 3:  return new char[]{k1, k2, k3};
            case 4:  return new char[]{k1, k2, k3, k4};
            default: return map.keySet().toCharArray();
        }
    }
}
