package com.chess.replay.model;

/**
 * Tag-pair values of one game. Every field is optional and {@code null} when the source
 * did not carry the tag.
 */
public record GameMetadata(String event, String site, String date, String round,
                           String white, String black, String result) {

    public static final GameMetadata EMPTY = new GameMetadata(null, null, null, null, null, null, null);

    public String get(PgnTag tag) {
        switch (tag) {
            case EVENT:
                return event;
            case SITE:
                return site;
            case DATE:
                return date;
            case ROUND:
                return round;
            case WHITE:
                return white;
            case BLACK:
                return black;
            case RESULT:
                return result;
            default:
                throw new IllegalArgumentException("Unknown tag " + tag);
        }
    }

    public boolean isEmpty() {
        for (PgnTag tag : PgnTag.values()) {
            if (get(tag) != null) {
                return false;
            }
        }
        return true;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String event;
        private String site;
        private String date;
        private String round;
        private String white;
        private String black;
        private String result;

        private Builder() {
        }

        public Builder set(PgnTag tag, String value) {
            switch (tag) {
                case EVENT:
                    event = value;
                    break;
                case SITE:
                    site = value;
                    break;
                case DATE:
                    date = value;
                    break;
                case ROUND:
                    round = value;
                    break;
                case WHITE:
                    white = value;
                    break;
                case BLACK:
                    black = value;
                    break;
                case RESULT:
                    result = value;
                    break;
                default:
                    throw new IllegalArgumentException("Unknown tag " + tag);
            }
            return this;
        }

        public GameMetadata build() {
            return new GameMetadata(event, site, date, round, white, black, result);
        }
    }
}
