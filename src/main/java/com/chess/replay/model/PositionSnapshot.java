package com.chess.replay.model;

import java.util.Map;

/**
 * What a renderer needs to draw the current replay position. The board map is a copy and
 * does not change when the session moves on.
 *
 * @param board         occupied squares only
 * @param cursor        replay position in full moves, a multiple of 0.5
 * @param hasPrevious   whether {@code previous()} would move
 * @param hasNext       whether {@code next()} would move
 * @param highlightFrom source square of the last applied move, or {@code null}
 * @param highlightTo   destination square of the last applied move, or {@code null}
 */
public record PositionSnapshot(Map<String, Piece> board, double cursor, boolean hasPrevious, boolean hasNext,
                               String highlightFrom, String highlightTo) {

    public PositionSnapshot {
        board = Map.copyOf(board);
    }

    public Piece pieceAt(String square) {
        return board.get(square);
    }
}
