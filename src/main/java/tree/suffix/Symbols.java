package tree.suffix;

/**
 * Reserved symbols used to close and join the strings of a generalized suffix tree.
 *
 * Both live in the Unicode private-use block so they can never collide with ordinary text:
 * U+E000 separates consecutive strings and U+E001..U+F8FF are handed out as terminators,
 * one per indexed string. A terminator is unique within a tree, which guarantees that every
 * suffix ends at a leaf and that the construction engine returns to the root between strings.
 */
public final class Symbols {

    public static final char SEPARATOR = '\uE000';

    static final char FIRST_TERMINATOR = '\uE001';
    static final char LAST_TERMINATOR = '\uF8FF';

    // Number of strings a single tree can hold.
    public static final int MAX_STRINGS = LAST_TERMINATOR - FIRST_TERMINATOR + 1;

    private Symbols() {
    }

    /**
     * Return the terminator assigned to the string with the given ordinal (0-based).
     */
    public static char terminator(int ordinal) {
        if (ordinal < 0) {
            throw new IllegalArgumentException("ordinal must be non-negative");
        }
        if (ordinal >= MAX_STRINGS) {
            throw new IllegalStateException("terminal symbols exhausted after " + MAX_STRINGS + " strings");
        }
        return (char) (FIRST_TERMINATOR + ordinal);
    }

    public static boolean isReserved(char c) {
        return c >= SEPARATOR && c <= LAST_TERMINATOR;
    }

    public static boolean isTerminator(char c) {
        return c >= FIRST_TERMINATOR && c <= LAST_TERMINATOR;
    }

    public static boolean containsReserved(CharSequence s) {
        for (int i = 0; i < s.length(); i++) {
            if (isReserved(s.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Copy of {@code s} without any reserved symbol.
     */
    public static String strip(CharSequence s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (!isReserved(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    // Replace reserved symbols with printable glyphs for debug output.
    static String render(CharSequence s, char terminatorGlyph, char separatorGlyph) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == SEPARATOR) {
                sb.append(separatorGlyph);
            } else if (isTerminator(c)) {
                sb.append(terminatorGlyph);
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
