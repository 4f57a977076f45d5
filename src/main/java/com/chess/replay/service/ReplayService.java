package com.chess.replay.service;

import com.chess.replay.config.ReplayProperties;
import com.chess.replay.model.Game;
import org.springframework.stereotype.Service;

/**
 * Hands out replay sessions. Each call returns a new, independent session; nothing about
 * the active game is shared between callers.
 */
@Service
public class ReplayService {

    private final NotationResolver resolver;
    private final PgnWriter writer;
    private final ReplayProperties properties;

    public ReplayService(NotationResolver resolver, PgnWriter writer, ReplayProperties properties) {
        this.resolver = resolver;
        this.writer = writer;
        this.properties = properties;
    }

    public ReplaySession openSession() {
        return new ReplaySession(resolver, writer, properties.getContextMoves());
    }

    public ReplaySession openSession(Game game) {
        ReplaySession session = openSession();
        session.loadGame(game);
        return session;
    }
}
