package com.chess.replay.service;

import com.chess.replay.model.Game;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns raw PGN text into games. A game whose moves cannot be read still comes back,
 * with its tags and whatever moves were recognized.
 */
@Service
public class PgnLoaderService {

    private static final Logger log = LoggerFactory.getLogger(PgnLoaderService.class);

    private final PgnSplitter splitter;
    private final PgnGameParser parser;

    public PgnLoaderService(PgnSplitter splitter, PgnGameParser parser) {
        this.splitter = splitter;
        this.parser = parser;
    }

    public List<Game> loadText(String raw) {
        List<Game> games = new ArrayList<>();
        for (String span : splitter.split(raw)) {
            PgnGameParser.ParsedGame parsed = parser.parse(span);
            games.add(new Game(parsed.metadata(), parsed.moves(), span));
        }
        log.info("Loaded {} games from PGN text", games.size());
        return games;
    }
}
