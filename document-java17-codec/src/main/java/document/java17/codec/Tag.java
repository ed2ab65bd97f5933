package document.java17.codec;

/// Values of the `type` discriminator in the wire format.
enum Tag {
    LEAF("leaf"),
    HORIZONTAL("horizontal"),
    VERTICAL("vertical"),
    EMPTY("empty");

    static final String TYPE = "type";
    static final String VALUE = "value";
    static final String CELLS = "cells";

    private final String key;

    Tag(String key) {
        this.key = key;
    }

    String key() {
        return key;
    }

    /// The field a tagged object must carry besides `type`, or null for `empty`.
    String payloadField() {
        return switch (this) {
            case LEAF -> VALUE;
            case HORIZONTAL, VERTICAL -> CELLS;
            case EMPTY -> null;
        };
    }

    /// @return the tag, or null if `key` names none
    static Tag fromKey(String key) {
        for (Tag tag : values()) {
            if (tag.key.equals(key)) {
                return tag;
            }
        }
        return null;
    }
}
