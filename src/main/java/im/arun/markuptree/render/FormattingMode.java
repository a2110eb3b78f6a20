package im.arun.markuptree.render;

/**
 * Output formats understood by {@link Serializer}.
 */
public enum FormattingMode {
    /** no whitespace beyond what payloads and attributes contain */
    COMPACT("compact"),
    /** one node per line, indented one unit per nesting level */
    INDENTED("indented"),
    /** one node per line without indentation */
    LINE_PER_NODE("line-per-node"),
    /** Java statements that rebuild the tree */
    RECONSTRUCTION_SOURCE("source");

    private final String key;

    FormattingMode(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * Resolves the option key used on the command line and in configuration files.
     *
     * @throws IllegalArgumentException if the key names no mode
     */
    public static FormattingMode fromKey(String key) {
        for (FormattingMode mode : values()) {
            if (mode.key.equalsIgnoreCase(key) || mode.name().equalsIgnoreCase(key)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown formatting mode '" + key
                + "', expected one of: compact, indented, line-per-node, source");
    }
}
