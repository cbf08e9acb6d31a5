package tree.suffix;

import datagenerators.TextGenerator;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.junit.Test;
import utilities.SuffixTreeLogger;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class UkkonenBuilderTest {

    @Test
    public void testStructuralInvariantsOnRandomTexts() {
        TextGenerator gen = new TextGenerator(11L);
        for (int trial = 0; trial < 300; trial++) {
            SuffixTree tree = new SuffixTree();
            int count = 1 + gen.nextInt(4);
            for (int i = 0; i < count; i++) {
                tree.addString(gen.uniform(gen.nextInt(20), 'a', 1 + gen.nextInt(3)));
            }
            checkInvariants(tree);
        }
    }

    @Test
    public void testInvariantsOnClassicInputs() {
        checkInvariants(new SuffixTree("mississippi"));
        checkInvariants(new SuffixTree("abcabxabcd"));
        checkInvariants(new SuffixTree("aaaaaaaa").addString("aaaa").addString("aa"));
        checkInvariants(new SuffixTree("banana").addString("ananas").addString("nab"));
    }

    @Test
    public void testResumeMustStartWhereItStopped() {
        StringBuilder text = new StringBuilder("ab" + Symbols.terminator(0));
        UkkonenBuilder builder = new UkkonenBuilder(new NodeArena(8), text, false);
        builder.extend(0, text.length());
        assertEquals(3, builder.leafEnd());
        try {
            builder.extend(0, text.length());
            fail("re-consuming text accepted");
        } catch (IllegalStateException expected) {
            assertTrue(expected.getMessage(), expected.getMessage().contains("resume"));
        }
    }

    @Test
    public void testUnterminatedTextLeavesPendingSuffixes() {
        // Without a unique terminator the trailing "a" stays implicit.
        StringBuilder text = new StringBuilder("aa");
        UkkonenBuilder builder = new UkkonenBuilder(new NodeArena(8), text, false);
        builder.extend(0, 2);
        text.append('b');
        try {
            builder.extend(2, 3);
            fail("resumed with a pending active point");
        } catch (IllegalStateException expected) {
            assertTrue(expected.getMessage(), expected.getMessage().contains("active point"));
        }
    }

    @Test
    public void testPendingStateIsLoggedAsError() {
        List<LogRecord> records = new ArrayList<>();
        Handler capture = new Handler() {
            @Override
            public void publish(LogRecord record) {
                records.add(record);
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        Logger logger = Logger.getLogger(SuffixTreeLogger.class.getName());
        logger.addHandler(capture);
        try {
            StringBuilder text = new StringBuilder("abab");
            UkkonenBuilder builder = new UkkonenBuilder(new NodeArena(8), text, false);
            builder.extend(0, 4);
            text.append('c');
            try {
                builder.extend(4, 5);
                fail("resumed with a pending active point");
            } catch (IllegalStateException expected) {
                // logged below
            }
        } finally {
            logger.removeHandler(capture);
        }
        assertEquals(1, records.size());
        assertEquals(Level.SEVERE, records.get(0).getLevel());
        assertTrue(records.get(0).getMessage(), records.get(0).getMessage().contains("remaining=2"));
    }

    @Test
    public void testTraceConstructionBuildsSameTree() {
        SuffixTreeConfiguration traced = SuffixTreeConfiguration.builder().traceConstruction(true).build();
        assertEquals(new SuffixTree("mississippi").toString(), new SuffixTree("mississippi", traced).toString());
    }

    private static void checkInvariants(SuffixTree tree) {
        NodeArena arena = tree.arena();
        String text = tree.getText();
        int leafEnd = tree.leafEnd();
        assertEquals(text.length(), leafEnd);
        assertTrue(text, arena.size() <= 2 * text.length() + 1);

        // Path labels by DFS, keyed by arena index.
        Int2ObjectOpenHashMap<String> labels = new Int2ObjectOpenHashMap<>();
        labels.put(NodeArena.ROOT, "");
        IntArrayList stack = new IntArrayList();
        stack.add(NodeArena.ROOT);
        BitSet suffixStarts = new BitSet();
        while (!stack.isEmpty()) {
            int id = stack.popInt();
            SuffixTreeNode node = arena.get(id);
            char[] symbols = node.transitionSymbols();
            assertEquals(node.childCount(), symbols.length);
            for (char symbol : symbols) {
                Edge edge = node.getTransition(symbol);
                // Every edge is keyed by the first symbol of its label.
                assertEquals(text.charAt(edge.getStart()), symbol);
                assertTrue(edge.length(leafEnd) > 0);
                labels.put(edge.getTarget(), labels.get(id) + text.substring(edge.getStart(), edge.resolveEnd(leafEnd)));
                stack.add(edge.getTarget());
            }
            if (node.isLeaf() && id != NodeArena.ROOT) {
                String label = labels.get(id);
                int start = node.getSuffixStart();
                assertTrue(node.isTerminal());
                assertEquals(text.substring(start), label);
                assertTrue(!suffixStarts.get(start));
                suffixStarts.set(start);
            }
        }
        // Every suffix of the terminated text ends at its own leaf.
        assertEquals(text.length(), suffixStarts.cardinality());
        assertEquals(arena.size(), labels.size());

        for (int id = 1; id < arena.size(); id++) {
            SuffixTreeNode node = arena.get(id);
            if (!node.isLeaf()) {
                assertTrue(node.childCount() >= 2);
                String label = labels.get(id);
                assertEquals(text + " node " + id, label.substring(1), labels.get(node.getSuffixLink()));
            }
        }
    }
}
