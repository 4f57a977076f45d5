package com.chess.replay.model;

/**
 * One numbered move: White's token, Black's reply and the rendered text.
 *
 * @param number  1-based move number
 * @param white   White's SAN token, {@code null} only for a pending slot
 * @param black   Black's SAN token, {@code null} when the game stops after White's move
 * @param text    display form, e.g. {@code "1. e4 e5"}
 * @param comment annotation comment, always empty for now
 */
public record MoveRecord(int number, String white, String black, String text, String comment) {

    public static MoveRecord of(int number, String white, String black) {
        StringBuilder text = new StringBuilder().append(number).append('.');
        if (white != null) {
            text.append(' ').append(white);
        }
        if (black != null) {
            text.append(' ').append(black);
        }
        return new MoveRecord(number, white, black, text.toString(), "");
    }

    public boolean hasBlack() {
        return black != null;
    }

    /** @return the token played by {@code side} in this record, possibly {@code null} */
    public String tokenFor(Side side) {
        return side == Side.WHITE ? white : black;
    }

    /** Display text cut after White's half, e.g. {@code "2. Nf3"}. */
    public String whiteHalfText() {
        return white == null ? number + "." : number + ". " + white;
    }
}
