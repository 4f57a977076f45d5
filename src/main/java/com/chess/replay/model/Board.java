package com.chess.replay.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Sparse square-to-piece mapping. An absent key is an empty square.
 * <p>
 * Only the replay session and the notation resolver mutate a live board; everything
 * handed to callers is a copy or an unmodifiable view.
 */
public final class Board {

    private static final PieceKind[] BACK_RANK = {
            PieceKind.ROOK, PieceKind.KNIGHT, PieceKind.BISHOP, PieceKind.QUEEN,
            PieceKind.KING, PieceKind.BISHOP, PieceKind.KNIGHT, PieceKind.ROOK
    };

    private final Map<String, Piece> squares;

    private Board(Map<String, Piece> squares) {
        this.squares = squares;
    }

    public static Board empty() {
        return new Board(new HashMap<>());
    }

    /** The standard starting position. */
    public static Board standard() {
        Board board = empty();
        for (int i = 0; i < Square.FILES.length(); i++) {
            char file = Square.FILES.charAt(i);
            board.place(Square.of(file, 1), Piece.white(BACK_RANK[i]));
            board.place(Square.of(file, 2), Piece.white(PieceKind.PAWN));
            board.place(Square.of(file, 7), Piece.black(PieceKind.PAWN));
            board.place(Square.of(file, 8), Piece.black(BACK_RANK[i]));
        }
        return board;
    }

    public Board copy() {
        return new Board(new HashMap<>(squares));
    }

    /** @return the occupant of {@code square}, or {@code null} when it is empty */
    public Piece pieceAt(String square) {
        return squares.get(square);
    }

    public boolean isEmpty(String square) {
        return !squares.containsKey(square);
    }

    public void place(String square, Piece piece) {
        if (!Square.isValid(square)) {
            throw new IllegalArgumentException("Not a square: " + square);
        }
        squares.put(square, Objects.requireNonNull(piece, "piece"));
    }

    public Piece clear(String square) {
        return squares.remove(square);
    }

    public int pieceCount() {
        return squares.size();
    }

    public Map<String, Piece> asMap() {
        return Collections.unmodifiableMap(squares);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Board)) {
            return false;
        }
        return squares.equals(((Board) o).squares);
    }

    @Override
    public int hashCode() {
        return squares.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int rank = 8; rank >= 1; rank--) {
            for (int i = 0; i < Square.FILES.length(); i++) {
                Piece p = squares.get(Square.of(Square.FILES.charAt(i), rank));
                if (p == null) {
                    sb.append('.');
                } else {
                    char c = p.kind().getLetter();
                    sb.append(p.side() == Side.WHITE ? c : Character.toLowerCase(c));
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
