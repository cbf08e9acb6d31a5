package tree.suffix;

// Immutable configuration for constructing SuffixTree instances.
public final class SuffixTreeConfiguration {

    private static final SuffixTreeConfiguration DEFAULTS = builder().build();

    private final int initialCapacity;
    private final char terminatorGlyph;
    private final char separatorGlyph;
    private final int repeatLimit;
    private final boolean traceConstruction;

    private SuffixTreeConfiguration(Builder builder) {
        this.initialCapacity = builder.initialCapacity;
        this.terminatorGlyph = builder.terminatorGlyph;
        this.separatorGlyph = builder.separatorGlyph;
        this.repeatLimit = builder.repeatLimit;
        this.traceConstruction = builder.traceConstruction;
        validate();
    }

    public static Builder builder() { return new Builder(); }

    public static SuffixTreeConfiguration defaults() { return DEFAULTS; }

    private void validate() {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("initialCapacity must be positive");
        }
        if (repeatLimit <= 0) {
            throw new IllegalArgumentException("repeatLimit must be positive");
        }
        if (Symbols.isReserved(terminatorGlyph) || Symbols.isReserved(separatorGlyph)) {
            throw new IllegalArgumentException("glyphs must be printable, not reserved symbols");
        }
    }

    public int initialCapacity() { return initialCapacity; }
    public char terminatorGlyph() { return terminatorGlyph; }
    public char separatorGlyph() { return separatorGlyph; }
    public int repeatLimit() { return repeatLimit; }
    public boolean traceConstruction() { return traceConstruction; }

    public static final class Builder {
        private int initialCapacity = 16;
        private char terminatorGlyph = '$';
        private char separatorGlyph = '⚇';
        private int repeatLimit = 3;
        private boolean traceConstruction;

        private Builder() {
        }

        /**
         * Expected text length; sizes the text buffer and the node arena up front.
         */
        public Builder initialCapacity(int initialCapacity) {
            this.initialCapacity = initialCapacity;
            return this;
        }

        public Builder terminatorGlyph(char terminatorGlyph) {
            this.terminatorGlyph = terminatorGlyph;
            return this;
        }

        public Builder separatorGlyph(char separatorGlyph) {
            this.separatorGlyph = separatorGlyph;
            return this;
        }

        // Default n for findLongestRepeatedSubstrings().
        public Builder repeatLimit(int repeatLimit) {
            this.repeatLimit = repeatLimit;
            return this;
        }

        public Builder traceConstruction(boolean traceConstruction) {
            this.traceConstruction = traceConstruction;
            return this;
        }

        public SuffixTreeConfiguration build() {
            return new SuffixTreeConfiguration(this);
        }
    }
}
