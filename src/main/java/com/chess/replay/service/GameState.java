package com.chess.replay.service;

import com.chess.replay.model.Board;
import com.chess.replay.model.GameMetadata;
import com.chess.replay.model.MoveRecord;
import com.chess.replay.model.UnresolvedMove;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Replay state of the active game. Owned and mutated by a single {@link ReplaySession};
 * callers only read it between navigation calls.
 * <p>
 * The position is counted in plies internally. The cursor reported outside is plies / 2,
 * so {@code 1.0} is "after Black's first move" and {@code 1.5} is "after White's second
 * move". The board always equals the start position with every ply before the cursor
 * applied.
 */
public class GameState {

    private final GameMetadata metadata;
    private final List<MoveRecord> moves;
    private final List<UnresolvedMove> unresolved = new ArrayList<>();
    private Board board = Board.standard();
    private int plies;
    private String highlightFrom;
    private String highlightTo;

    GameState(GameMetadata metadata, List<MoveRecord> moves) {
        this.metadata = metadata != null ? metadata : GameMetadata.EMPTY;
        this.moves = List.copyOf(moves);
    }

    static GameState empty() {
        return new GameState(GameMetadata.EMPTY, List.of());
    }

    public GameMetadata getMetadata() {
        return metadata;
    }

    public List<MoveRecord> getMoves() {
        return moves;
    }

    public int getPlies() {
        return plies;
    }

    public double getCursor() {
        return plies / 2.0;
    }

    /** Ply count of the final recorded position. */
    public int totalPlies() {
        if (moves.isEmpty()) {
            return 0;
        }
        MoveRecord last = moves.get(moves.size() - 1);
        return 2 * (moves.size() - 1) + (last.hasBlack() ? 2 : 1);
    }

    public boolean hasPreviousMove() {
        return plies > 0;
    }

    public boolean hasNextMove() {
        return plies < totalPlies();
    }

    /** A copy of the current board. */
    public Board getBoard() {
        return board.copy();
    }

    public String getHighlightFrom() {
        return highlightFrom;
    }

    public String getHighlightTo() {
        return highlightTo;
    }

    /** Moves before the cursor that could not be applied, in replay order. */
    public List<UnresolvedMove> getUnresolvedMoves() {
        return Collections.unmodifiableList(unresolved);
    }

    Board board() {
        return board;
    }

    void reset() {
        board = Board.standard();
        plies = 0;
        highlightFrom = null;
        highlightTo = null;
        unresolved.clear();
    }

    void setPlies(int plies) {
        this.plies = plies;
    }

    void highlight(String from, String to) {
        this.highlightFrom = from;
        this.highlightTo = to;
    }

    void addUnresolved(UnresolvedMove move) {
        unresolved.add(move);
    }
}
