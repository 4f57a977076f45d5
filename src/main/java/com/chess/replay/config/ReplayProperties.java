package com.chess.replay.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Settings under {@code pgn.replay.*}.
 */
@ConfigurationProperties(prefix = "pgn.replay")
public class ReplayProperties {

    /**
     * Read SAN disambiguation (Nbd7, R1e2, exd5) before falling back to the proximity
     * search. When false every candidate of the right kind competes on distance alone.
     */
    private boolean honorDisambiguation = true;

    /** Encoding of PGN files read and written by the file service. */
    private Charset charset = StandardCharsets.UTF_8;

    /** Default number of move records handed out as move context. */
    private int contextMoves = 10;

    public boolean isHonorDisambiguation() {
        return honorDisambiguation;
    }

    public void setHonorDisambiguation(boolean honorDisambiguation) {
        this.honorDisambiguation = honorDisambiguation;
    }

    public Charset getCharset() {
        return charset;
    }

    public void setCharset(Charset charset) {
        this.charset = charset;
    }

    public int getContextMoves() {
        return contextMoves;
    }

    public void setContextMoves(int contextMoves) {
        this.contextMoves = contextMoves;
    }
}
