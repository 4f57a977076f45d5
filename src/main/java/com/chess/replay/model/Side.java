package com.chess.replay.model;

public enum Side {
    WHITE,
    BLACK;

    /** Rank the side's king and rooks start on. */
    public int homeRank() {
        return this == WHITE ? 1 : 8;
    }
}
