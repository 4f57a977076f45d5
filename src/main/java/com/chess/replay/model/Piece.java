package com.chess.replay.model;

import java.util.Objects;

public record Piece(Side side, PieceKind kind) {

    public Piece {
        Objects.requireNonNull(side, "side");
        Objects.requireNonNull(kind, "kind");
    }

    public static Piece white(PieceKind kind) {
        return new Piece(Side.WHITE, kind);
    }

    public static Piece black(PieceKind kind) {
        return new Piece(Side.BLACK, kind);
    }

    public boolean is(Side side, PieceKind kind) {
        return this.side == side && this.kind == kind;
    }
}
