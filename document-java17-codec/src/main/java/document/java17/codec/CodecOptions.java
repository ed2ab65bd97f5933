package document.java17.codec;

/// Settings for [DocumentCodec].
/// @param maxDepth deepest document accepted by decode; a leaf at the root has depth 1
/// @param prettyPrint whether [DocumentCodec#encodeToString] indents its output
/// @param rejectUnknownFields whether decode fails on fields a tag does not define
public record CodecOptions(int maxDepth, boolean prettyPrint, boolean rejectUnknownFields) {

    public static final int DEFAULT_MAX_DEPTH = 10_000;

    private static final CodecOptions DEFAULTS = new CodecOptions(DEFAULT_MAX_DEPTH, false, false);

    public CodecOptions {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be > 0");
        }
    }

    public static CodecOptions defaults() {
        return DEFAULTS;
    }

    public CodecOptions withMaxDepth(int newMaxDepth) {
        return new CodecOptions(newMaxDepth, prettyPrint, rejectUnknownFields);
    }

    public CodecOptions withPrettyPrint(boolean newPrettyPrint) {
        return new CodecOptions(maxDepth, newPrettyPrint, rejectUnknownFields);
    }

    public CodecOptions withRejectUnknownFields(boolean newRejectUnknownFields) {
        return new CodecOptions(maxDepth, prettyPrint, newRejectUnknownFields);
    }
}
