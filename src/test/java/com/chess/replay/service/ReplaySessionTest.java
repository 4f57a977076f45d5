package com.chess.replay.service;

import com.chess.replay.model.Board;
import com.chess.replay.model.Game;
import com.chess.replay.model.MoveRecord;
import com.chess.replay.model.Piece;
import com.chess.replay.model.PieceKind;
import com.chess.replay.model.PositionSnapshot;
import com.chess.replay.model.Side;
import com.chess.replay.model.UnresolvedMove;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class ReplaySessionTest {

    private static final String ITALIAN = "[White \"A\"]\n[Black \"B\"]\n[Result \"*\"]\n\n1. e4 e5 2. Nf3 Nc6 *";

    private PgnLoaderService loader;
    private ReplaySession session;

    @BeforeEach
    public void setUp() {
        loader = new PgnLoaderService(new PgnSplitter(), new PgnGameParser());
        session = newSession();
    }

    private static ReplaySession newSession() {
        return new ReplaySession(NotationResolverTest.resolver(true), new PgnWriter(), 10);
    }

    private Game load(String pgn) {
        List<Game> games = loader.loadText(pgn);
        assertEquals(1, games.size());
        session.loadGame(games.get(0));
        return games.get(0);
    }

    private List<Game> fixtureGames() throws Exception {
        return loader.loadText(PgnSplitterTest.resource("/pgn/three-games.pgn"));
    }

    @Test
    public void testFirstMovesMoveThePawns() {
        Game game = load(ITALIAN);
        assertEquals("A", game.getMetadata().white());
        assertEquals("B", game.getMetadata().black());
        assertEquals("*", game.getMetadata().result());

        session.next();
        PositionSnapshot position = session.currentPosition();
        assertEquals(0.5, position.cursor());
        assertNull(position.pieceAt("e2"));
        assertEquals(Piece.white(PieceKind.PAWN), position.pieceAt("e4"));

        session.next();
        position = session.currentPosition();
        assertEquals(1.0, position.cursor());
        assertNull(position.pieceAt("e7"));
        assertEquals(Piece.black(PieceKind.PAWN), position.pieceAt("e5"));
        assertTrue(position.hasPrevious());
        assertTrue(position.hasNext());
    }

    @Test
    public void testHighlightsLastMove() {
        load(ITALIAN);
        session.next();
        session.next();
        session.next();

        PositionSnapshot position = session.currentPosition();
        assertEquals("g1", position.highlightFrom());
        assertEquals("f3", position.highlightTo());

        session.first();
        assertNull(session.currentPosition().highlightFrom());
        assertNull(session.currentPosition().highlightTo());
    }

    @Test
    public void testBoundariesAreNoOps() {
        load(ITALIAN);

        session.first();
        session.previous();
        assertEquals(0.0, session.cursor());
        assertFalse(session.currentPosition().hasPrevious());
        assertEquals(Board.standard().asMap(), session.currentPosition().board());

        session.last();
        session.last();
        assertEquals(2.0, session.cursor());
        session.next();
        assertEquals(2.0, session.cursor());
        assertFalse(session.currentPosition().hasNext());
    }

    @Test
    public void testSteppingToTheEndMatchesLast() throws Exception {
        for (Game game : fixtureGames()) {
            session.loadGame(game);
            while (session.getGameState().hasNextMove()) {
                session.next();
            }
            PositionSnapshot stepped = session.currentPosition();

            ReplaySession other = newSession();
            other.loadGame(game);
            other.last();
            PositionSnapshot jumped = other.currentPosition();

            assertEquals(jumped.cursor(), stepped.cursor(), game.summary());
            assertEquals(jumped.board(), stepped.board(), game.summary());
            assertThat(session.unresolvedMoves()).as(game.summary()).isEmpty();
        }
    }

    @Test
    public void testPreviousRestoresEarlierBoards() throws Exception {
        session.loadGame(fixtureGames().get(0));
        List<Map<String, Piece>> boards = new ArrayList<>();
        boards.add(session.currentPosition().board());
        while (session.getGameState().hasNextMove()) {
            session.next();
            boards.add(session.currentPosition().board());
        }
        assertEquals(21, boards.size());

        for (int ply = boards.size() - 2; ply >= 0; ply--) {
            session.previous();
            assertEquals(ply / 2.0, session.cursor());
            assertEquals(boards.get(ply), session.currentPosition().board(), "after stepping back to ply " + ply);
        }
    }

    @Test
    public void testLastPositionOfCastledGame() throws Exception {
        session.loadGame(fixtureGames().get(0));
        session.last();

        PositionSnapshot position = session.currentPosition();
        assertEquals(10.0, position.cursor());
        assertEquals(Piece.white(PieceKind.KING), position.pieceAt("g1"));
        assertEquals(Piece.white(PieceKind.ROOK), position.pieceAt("f1"));
        assertEquals(Piece.white(PieceKind.KNIGHT), position.pieceAt("d2"));
        assertEquals(Piece.white(PieceKind.KNIGHT), position.pieceAt("f3"));
        assertEquals(Piece.white(PieceKind.BISHOP), position.pieceAt("g2"));
        assertEquals(Piece.black(PieceKind.KING), position.pieceAt("g8"));
        assertEquals(Piece.black(PieceKind.ROOK), position.pieceAt("f8"));
        assertEquals(Piece.black(PieceKind.BISHOP), position.pieceAt("b7"));
        assertEquals(Piece.black(PieceKind.KNIGHT), position.pieceAt("e7"));
        assertEquals(32, position.board().size());
    }

    @Test
    public void testLastStopsOnWhiteHalfWhenBlackNeverReplied() throws Exception {
        session.loadGame(fixtureGames().get(1));
        session.last();

        PositionSnapshot position = session.currentPosition();
        assertEquals(3.5, position.cursor());
        assertFalse(position.hasNext());
        assertEquals(Piece.white(PieceKind.QUEEN), position.pieceAt("f7"));
        assertNull(position.pieceAt("d1"));
        assertEquals(31, position.board().size());
    }

    @Test
    public void testLoadGameStartsOver() throws Exception {
        List<Game> games = fixtureGames();
        session.loadGame(games.get(0));
        session.last();

        session.loadGame(games.get(2));

        PositionSnapshot position = session.currentPosition();
        assertEquals(0.0, position.cursor());
        assertFalse(position.hasPrevious());
        assertTrue(position.hasNext());
        assertNull(position.highlightFrom());
        assertEquals(Board.standard().asMap(), position.board());
        assertEquals(Board.standard(), session.getGameState().getBoard());
        assertSame(games.get(2), session.getGame());
        assertEquals("B", session.getGameState().getMetadata().white());
    }

    @Test
    public void testSessionsDoNotShareState() throws Exception {
        Game game = fixtureGames().get(0);
        ReplaySession other = newSession();
        session.loadGame(game);
        other.loadGame(game);

        session.last();

        assertEquals(0.0, other.cursor());
        assertEquals(Board.standard().asMap(), other.currentPosition().board());
    }

    @Test
    public void testMovesUpToHalfCursor() {
        load(ITALIAN);

        assertEquals("[White \"A\"]\n[Black \"B\"]\n[Result \"*\"]\n\n1. e4 e5 2. Nf3", session.movesUpTo(1.5));
        assertEquals("[White \"A\"]\n[Black \"B\"]\n[Result \"*\"]\n\n1. e4 e5", session.movesUpTo(1.0));
        assertEquals("[White \"A\"]\n[Black \"B\"]\n[Result \"*\"]\n", session.movesUpTo(0));
        assertEquals("[White \"A\"]\n[Black \"B\"]\n[Result \"*\"]\n\n1. e4 e5 2. Nf3 Nc6", session.movesUpTo(40));
    }

    @Test
    public void testMovesUpToFollowsCursor() {
        load(ITALIAN);
        session.next();
        session.next();
        session.next();

        assertEquals(session.movesUpTo(1.5), session.movesUpTo());
    }

    @Test
    public void testMovesUpToRejectsOffGridCursor() {
        load(ITALIAN);

        assertThrows(IllegalArgumentException.class, () -> session.movesUpTo(1.25));
        assertThrows(IllegalArgumentException.class, () -> session.movesUpTo(-0.5));
    }

    @Test
    public void testSerializeWritesWholeGame() {
        load(ITALIAN);
        session.next();

        assertEquals("[White \"A\"]\n[Black \"B\"]\n[Result \"*\"]\n\n1. e4 e5 2. Nf3 Nc6 *\n", session.serialize());
    }

    @Test
    public void testPreviousMoves() {
        load(ITALIAN);
        assertThat(session.previousMoves()).isEmpty();

        session.jumpTo(1.5);
        assertThat(session.previousMoves(10)).extracting(MoveRecord::text).containsExactly("1. e4 e5", "2. Nf3 Nc6");
        assertThat(session.previousMoves(1)).extracting(MoveRecord::number).containsExactly(2);

        session.jumpTo(1.0);
        assertThat(session.previousMoves()).extracting(MoveRecord::number).containsExactly(1);
    }

    @Test
    public void testJumpTo() {
        load(ITALIAN);
        session.next();
        session.next();
        session.next();
        Map<String, Piece> stepped = session.currentPosition().board();

        session.jumpTo(1.5);
        assertEquals(stepped, session.currentPosition().board());

        session.jumpTo(100);
        assertEquals(2.0, session.cursor());
        session.jumpTo(-3);
        assertEquals(0.0, session.cursor());
        session.jumpTo(1.2);
        assertEquals(1.0, session.cursor());
    }

    @Test
    public void testUnresolvedMovesAreReported() throws Exception {
        load(PgnSplitterTest.resource("/pgn/unresolved-move.pgn"));

        session.last();

        assertEquals(2.0, session.cursor());
        assertThat(session.unresolvedMoves()).containsExactly(new UnresolvedMove(2, Side.WHITE, "Qa5"));
        PositionSnapshot position = session.currentPosition();
        assertEquals(Piece.white(PieceKind.QUEEN), position.pieceAt("d1"));
        assertNull(position.pieceAt("a5"));
        assertEquals(Piece.black(PieceKind.KNIGHT), position.pieceAt("c6"));

        session.previous();
        assertThat(session.unresolvedMoves()).hasSize(1);
        session.previous();
        assertThat(session.unresolvedMoves()).isEmpty();
    }

    @Test
    public void testMakeMoveIsNotSupported() {
        load(ITALIAN);

        assertThrows(UnsupportedOperationException.class, () -> session.makeMove(Side.WHITE, "d2", "d4"));
        assertEquals(0.0, session.cursor());
    }

    @Test
    public void testNavigationWithoutGame() {
        session.next();
        session.previous();
        session.last();
        session.first();

        PositionSnapshot position = session.currentPosition();
        assertEquals(0.0, position.cursor());
        assertFalse(position.hasNext());
        assertFalse(position.hasPrevious());
        assertNull(session.getGame());
        assertEquals("", session.movesUpTo());
    }

    @Test
    public void testListenerSeesEveryChange() {
        ReplayListener listener = mock(ReplayListener.class);
        session.addListener(listener);

        load(ITALIAN);
        session.previous();
        session.next();

        ArgumentCaptor<PositionSnapshot> captor = ArgumentCaptor.forClass(PositionSnapshot.class);
        verify(listener, times(2)).positionChanged(captor.capture());
        assertThat(captor.getAllValues()).extracting(PositionSnapshot::cursor).containsExactly(0.0, 0.5);

        session.removeListener(listener);
        session.next();
        verifyNoMoreInteractions(listener);
    }

    @Test
    public void testFailingListenerDoesNotStopNavigation() {
        ReplayListener listener = mock(ReplayListener.class);
        doThrow(new IllegalStateException("renderer gone")).when(listener).positionChanged(any());
        session.addListener(listener);

        load(ITALIAN);
        session.next();

        assertEquals(0.5, session.cursor());
    }
}
