package com.chess.replay.service;

import com.chess.replay.model.Side;

/**
 * Raised when a move token cannot be mapped to a piece on the board. The board is left
 * exactly as it was.
 */
public class UnresolvedMoveException extends RuntimeException {

    private final String token;
    private final Side side;

    public UnresolvedMoveException(String token, Side side, String reason) {
        super("Cannot resolve " + side + " move '" + token + "': " + reason);
        this.token = token;
        this.side = side;
    }

    public String getToken() {
        return token;
    }

    public Side getSide() {
        return side;
    }
}
