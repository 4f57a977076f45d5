package com.chess.replay.service;

import com.chess.replay.config.ReplayProperties;
import com.chess.replay.model.Game;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads and writes PGN files. The only place in the engine where a failure reaches the
 * caller.
 */
@Service
public class PgnFileService {

    private static final Logger log = LoggerFactory.getLogger(PgnFileService.class);

    private final PgnLoaderService loader;
    private final PgnWriter writer;
    private final ReplayProperties properties;

    public PgnFileService(PgnLoaderService loader, PgnWriter writer, ReplayProperties properties) {
        this.loader = loader;
        this.writer = writer;
        this.properties = properties;
    }

    public List<Game> read(Path file) throws UnreadableSourceException {
        String content;
        try {
            content = Files.readString(file, properties.getCharset());
        } catch (IOException e) {
            throw new UnreadableSourceException("Cannot read PGN file " + file, e);
        }
        log.info("Read {} ({} chars)", file, content.length());
        return loader.loadText(content);
    }

    public void write(Path file, GameState state) throws UnreadableSourceException {
        try {
            Files.writeString(file, writer.serialize(state), properties.getCharset());
        } catch (IOException e) {
            throw new UnreadableSourceException("Cannot write PGN file " + file, e);
        }
        log.info("Wrote {} move records to {}", state.getMoves().size(), file);
    }
}
