package com.chess.replay.model;

/** A move token replay could not map to a piece on the board. */
public record UnresolvedMove(int moveNumber, Side side, String token) {

    @Override
    public String toString() {
        return moveNumber + (side == Side.WHITE ? ". " : "... ") + token;
    }
}
