package com.chess.replay.service;

import com.chess.replay.model.GameMetadata;
import com.chess.replay.model.MoveRecord;
import com.chess.replay.model.PgnTag;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders games back to PGN text: the full game for saving, or the game cut at a replay
 * position for use as move context.
 */
@Component
public class PgnWriter {

    public String tagSection(GameMetadata metadata) {
        StringBuilder sb = new StringBuilder();
        for (PgnTag tag : PgnTag.values()) {
            String value = metadata.get(tag);
            if (value != null) {
                sb.append('[').append(tag.getTagName()).append(" \"").append(value).append("\"]\n");
            }
        }
        return sb.toString();
    }

    /**
     * Tags plus the moves played before {@code plies}. When the cut falls after White's
     * half of a move only that half is written, e.g. {@code "1. e4 e5 2. Nf3"}.
     */
    public String movesUpTo(GameMetadata metadata, List<MoveRecord> moves, int plies) {
        List<String> parts = new ArrayList<>();
        int fullMoves = Math.min(plies / 2, moves.size());
        for (int i = 0; i < fullMoves; i++) {
            parts.add(moves.get(i).text());
        }
        if (plies % 2 == 1 && fullMoves < moves.size()) {
            parts.add(moves.get(fullMoves).whiteHalfText());
        }
        return withTags(metadata, String.join(" ", parts));
    }

    /** The whole game, terminated by the result token when one is known. */
    public String serialize(GameMetadata metadata, List<MoveRecord> moves) {
        List<String> parts = new ArrayList<>();
        for (MoveRecord move : moves) {
            parts.add(move.text());
        }
        if (metadata.result() != null) {
            parts.add(metadata.result());
        }
        return withTags(metadata, String.join(" ", parts)) + "\n";
    }

    public String serialize(GameState state) {
        return serialize(state.getMetadata(), state.getMoves());
    }

    private String withTags(GameMetadata metadata, String moveText) {
        String tags = tagSection(metadata);
        if (tags.isEmpty()) {
            return moveText;
        }
        return moveText.isEmpty() ? tags : tags + "\n" + moveText;
    }
}
