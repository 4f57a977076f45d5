package com.chess.replay.model;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A parsed game. Identity is an id generated at parse time; two games with equal
 * metadata and moves are still different games.
 */
public final class Game {

    private final UUID id;
    private final GameMetadata metadata;
    private final List<MoveRecord> moves;
    private final String rawText;

    public Game(GameMetadata metadata, List<MoveRecord> moves, String rawText) {
        this(UUID.randomUUID(), metadata, moves, rawText);
    }

    public Game(UUID id, GameMetadata metadata, List<MoveRecord> moves, String rawText) {
        this.id = Objects.requireNonNull(id, "id");
        this.metadata = metadata != null ? metadata : GameMetadata.EMPTY;
        this.moves = List.copyOf(moves);
        this.rawText = rawText != null ? rawText : "";
    }

    public UUID getId() {
        return id;
    }

    public GameMetadata getMetadata() {
        return metadata;
    }

    public List<MoveRecord> getMoves() {
        return moves;
    }

    public String getRawText() {
        return rawText;
    }

    /** e.g. {@code "Carlsen vs Nepo - World Championship 2021.12.03"}. */
    public String title() {
        String white = metadata.white() != null ? metadata.white() : "Unknown";
        String black = metadata.black() != null ? metadata.black() : "Unknown";
        String event = metadata.event() != null ? metadata.event() : "Chess Game";
        String date = metadata.date() != null ? metadata.date() : "";
        return white + " vs " + black + " - " + event + " " + date;
    }

    /** Short form with surnames only, e.g. {@code "Carlsen vs Nepomniachtchi (1-0)"}. */
    public String summary() {
        String result = metadata.result() != null ? metadata.result() : "*";
        String white = metadata.white() != null ? metadata.white().split(",")[0] : "White";
        String black = metadata.black() != null ? metadata.black().split(",")[0] : "Black";
        return white + " vs " + black + " (" + result + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Game)) {
            return false;
        }
        return id.equals(((Game) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Game{" + id + ", " + summary() + ", " + moves.size() + " moves}";
    }
}
