package work.lcod.minsub.params;

/**
 * Splits {@code key=value} flag values on the first separator.
 */
final class PairSplitter {
    private PairSplitter() {}

    record Pair(String name, String value) {}

    /**
     * Missing separator keeps the whole string as the name ({@code --env KEY}).
     */
    static Pair nameRequired(String raw, char separator) {
        int idx = raw.indexOf(separator);
        if (idx < 0) {
            return new Pair(raw, null);
        }
        return new Pair(raw.substring(0, idx), raw.substring(idx + 1));
    }

    /**
     * Missing separator keeps the whole string as the value ({@code --input gs://b/f}).
     */
    static Pair nameOptional(String raw, char separator) {
        int idx = raw.indexOf(separator);
        if (idx < 0) {
            return new Pair(null, raw);
        }
        return new Pair(raw.substring(0, idx), raw.substring(idx + 1));
    }
}
