package com.chess.replay.model;

/**
 * Helpers for two-character square names such as {@code "e4"}. Squares are kept as plain
 * strings throughout the engine; everything it emits passes {@link #isValid(String)}.
 */
public final class Square {

    public static final String FILES = "abcdefgh";

    private Square() {
    }

    public static boolean isValid(String square) {
        return square != null
                && square.length() == 2
                && square.charAt(0) >= 'a' && square.charAt(0) <= 'h'
                && square.charAt(1) >= '1' && square.charAt(1) <= '8';
    }

    public static String of(char file, int rank) {
        return String.valueOf(file) + rank;
    }

    public static char file(String square) {
        return square.charAt(0);
    }

    public static int rank(String square) {
        return square.charAt(1) - '0';
    }

    public static int fileDistance(String from, String to) {
        return Math.abs(file(to) - file(from));
    }

    public static int rankDistance(String from, String to) {
        return Math.abs(rank(to) - rank(from));
    }
}
