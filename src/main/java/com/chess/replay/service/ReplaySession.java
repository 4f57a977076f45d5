package com.chess.replay.service;

import com.chess.replay.model.Game;
import com.chess.replay.model.MoveRecord;
import com.chess.replay.model.PositionSnapshot;
import com.chess.replay.model.Side;
import com.chess.replay.model.UnresolvedMove;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Steps through one game at a time, half a move per step.
 * <p>
 * Forward steps apply a single ply to the live board. Every other move (backwards,
 * to the end, jumps) rebuilds the board from the start position, which keeps the board
 * identical to a straight replay at every cursor. Navigation never throws; moves that
 * cannot be resolved are skipped and reported by {@link #unresolvedMoves()}.
 * <p>
 * Not thread-safe. A session belongs to one owner, obtained from
 * {@link ReplayService#openSession()}.
 */
public class ReplaySession {

    private static final Logger log = LoggerFactory.getLogger(ReplaySession.class);

    private final NotationResolver resolver;
    private final PgnWriter writer;
    private final int contextMoves;
    private final List<ReplayListener> listeners = new CopyOnWriteArrayList<>();
    private final Set<Integer> reportedPlies = new HashSet<>();

    private Game game;
    private GameState state = GameState.empty();

    public ReplaySession(NotationResolver resolver, PgnWriter writer, int contextMoves) {
        this.resolver = resolver;
        this.writer = writer;
        this.contextMoves = contextMoves;
    }

    public void addListener(ReplayListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ReplayListener listener) {
        listeners.remove(listener);
    }

    /** Makes {@code game} the replay target, positioned at the start. */
    public void loadGame(Game game) {
        this.game = game;
        this.state = new GameState(game.getMetadata(), game.getMoves());
        reportedPlies.clear();
        log.debug("Loaded {} ({} move records)", game.summary(), game.getMoves().size());
        fireChanged();
    }

    /** @return the active game, or {@code null} before the first {@link #loadGame(Game)} */
    public Game getGame() {
        return game;
    }

    public GameState getGameState() {
        return state;
    }

    public void first() {
        state.reset();
        fireChanged();
    }

    public void last() {
        replayTo(state.totalPlies());
    }

    public void next() {
        if (!state.hasNextMove()) {
            return;
        }
        int ply = state.getPlies() + 1;
        applyPly(ply);
        state.setPlies(ply);
        fireChanged();
    }

    public void previous() {
        if (state.getPlies() <= 0) {
            return;
        }
        replayTo(state.getPlies() - 1);
    }

    /**
     * Moves to {@code cursor}, clamped to the recorded range. A cursor between two half
     * moves is rounded down.
     */
    public void jumpTo(double cursor) {
        int plies = Double.isNaN(cursor) || cursor <= 0 ? 0 : (int) Math.floor(cursor * 2);
        replayTo(Math.min(plies, state.totalPlies()));
    }

    public PositionSnapshot currentPosition() {
        return new PositionSnapshot(state.board().asMap(), state.getCursor(), state.hasPreviousMove(),
                state.hasNextMove(), state.getHighlightFrom(), state.getHighlightTo());
    }

    public double cursor() {
        return state.getCursor();
    }

    public List<UnresolvedMove> unresolvedMoves() {
        return state.getUnresolvedMoves();
    }

    /** PGN text of the game up to the current cursor. */
    public String movesUpTo() {
        return writer.movesUpTo(state.getMetadata(), state.getMoves(), state.getPlies());
    }

    /**
     * PGN text of the game up to {@code cursor}, independent of where the session stands.
     *
     * @throws IllegalArgumentException if the cursor is negative or not a multiple of 0.5
     */
    public String movesUpTo(double cursor) {
        return writer.movesUpTo(state.getMetadata(), state.getMoves(), toPlies(cursor));
    }

    public String serialize() {
        return writer.serialize(state);
    }

    public List<MoveRecord> previousMoves() {
        return previousMoves(contextMoves);
    }

    /**
     * The last {@code count} move records up to and including the one the cursor is in.
     * Empty at the start position.
     */
    public List<MoveRecord> previousMoves(int count) {
        int plies = state.getPlies();
        if (plies == 0 || count <= 0) {
            return List.of();
        }
        int end = Math.min((plies + 1) / 2, state.getMoves().size());
        int start = Math.max(0, end - count);
        return new ArrayList<>(state.getMoves().subList(start, end));
    }

    /**
     * Playing moves from the board is not supported; games are replay-only.
     *
     * @throws UnsupportedOperationException always
     */
    public void makeMove(Side side, String from, String to) {
        throw new UnsupportedOperationException("Making moves is not supported, games are replay-only");
    }

    private void replayTo(int plies) {
        state.reset();
        for (int ply = 1; ply <= plies; ply++) {
            applyPly(ply);
        }
        state.setPlies(plies);
        fireChanged();
    }

    private void applyPly(int ply) {
        MoveRecord record = state.getMoves().get((ply - 1) / 2);
        Side side = ply % 2 == 1 ? Side.WHITE : Side.BLACK;
        String token = record.tokenFor(side);
        if (token == null) {
            return;
        }
        try {
            NotationResolver.ResolvedMove move = resolver.apply(token, side, state.board());
            state.highlight(move.from(), move.to());
        } catch (UnresolvedMoveException e) {
            state.addUnresolved(new UnresolvedMove(record.number(), side, token));
            if (reportedPlies.add(ply)) {
                log.warn("Skipping move {}: {}", record.number(), e.getMessage());
            }
        }
    }

    private static int toPlies(double cursor) {
        double doubled = cursor * 2;
        if (cursor < 0 || doubled != Math.rint(doubled)) {
            throw new IllegalArgumentException("Cursor must be a non-negative multiple of 0.5: " + cursor);
        }
        return (int) doubled;
    }

    private void fireChanged() {
        if (listeners.isEmpty()) {
            return;
        }
        PositionSnapshot position = currentPosition();
        for (ReplayListener listener : listeners) {
            try {
                listener.positionChanged(position);
            } catch (RuntimeException e) {
                log.warn("Replay listener {} failed", listener, e);
            }
        }
    }
}
