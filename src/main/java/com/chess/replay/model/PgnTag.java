package com.chess.replay.model;

/**
 * The tag pairs the engine keeps, in the order they are written back out.
 * Any other tag found in a source is dropped.
 */
public enum PgnTag {
    EVENT("Event"),
    SITE("Site"),
    DATE("Date"),
    ROUND("Round"),
    WHITE("White"),
    BLACK("Black"),
    RESULT("Result");

    private final String tagName;

    PgnTag(String tagName) {
        this.tagName = tagName;
    }

    public String getTagName() {
        return tagName;
    }

    /** @return the matching tag, or {@code null} for a tag the engine does not keep */
    public static PgnTag fromName(String name) {
        for (PgnTag tag : values()) {
            if (tag.tagName.equals(name)) {
                return tag;
            }
        }
        return null;
    }
}
