package com.chess.replay.model;

public enum PieceKind {
    KING('K'),
    QUEEN('Q'),
    ROOK('R'),
    BISHOP('B'),
    KNIGHT('N'),
    PAWN('P');

    private final char letter;

    PieceKind(char letter) {
        this.letter = letter;
    }

    public char getLetter() {
        return letter;
    }

    /**
     * Maps a SAN piece letter to its kind. Anything that is not one of K, Q, R, B or N
     * is a pawn move.
     */
    public static PieceKind fromLetter(char c) {
        switch (c) {
            case 'K':
                return KING;
            case 'Q':
                return QUEEN;
            case 'R':
                return ROOK;
            case 'B':
                return BISHOP;
            case 'N':
                return KNIGHT;
            default:
                return PAWN;
        }
    }
}
