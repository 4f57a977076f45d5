package com.chess.replay.service;

import java.io.IOException;

/**
 * A PGN file could not be read, decoded or written.
 */
public class UnreadableSourceException extends IOException {

    public UnreadableSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
