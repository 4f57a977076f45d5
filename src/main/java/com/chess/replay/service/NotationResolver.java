package com.chess.replay.service;

import com.chess.replay.config.ReplayProperties;
import com.chess.replay.model.Board;
import com.chess.replay.model.Piece;
import com.chess.replay.model.PieceKind;
import com.chess.replay.model.Side;
import com.chess.replay.model.Square;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies one SAN token to a board.
 * <p>
 * This is not a move validator. The mover is found by geometry alone: every piece of the
 * right kind and side whose movement pattern lines up with the destination is a candidate,
 * blocking pieces and checks are ignored, and among several candidates the one closest
 * to the destination (file distance plus rank distance) wins. Pawns line up with any
 * square.
 * <p>
 * With {@link ReplayProperties#isHonorDisambiguation()} set, the file and rank hints
 * written between the piece letter and the destination narrow the candidates first, and
 * a pawn push only considers pawns on the destination file.
 */
@Component
public class NotationResolver {

    private final ReplayProperties properties;

    public NotationResolver(ReplayProperties properties) {
        this.properties = properties;
    }

    /** Source and destination of an applied move. For castling these are the king's squares. */
    public record ResolvedMove(String from, String to) {
    }

    /**
     * Applies {@code token} for {@code side} to {@code board}.
     *
     * @throws UnresolvedMoveException if no piece can be found to make the move; the board
     *                                 is not modified in that case
     */
    public ResolvedMove apply(String token, Side side, Board board) {
        if (token == null || token.isBlank()) {
            throw new UnresolvedMoveException(String.valueOf(token), side, "empty token");
        }
        String san = stripAnnotations(token.trim());

        if (san.equals("O-O") || san.equals("0-0")) {
            return castle(token, side, board, 'g', 'h', 'f');
        }
        if (san.equals("O-O-O") || san.equals("0-0-0")) {
            return castle(token, side, board, 'c', 'a', 'd');
        }

        PieceKind promotion = null;
        int eq = san.indexOf('=');
        if (eq > 0) {
            if (eq + 1 < san.length()) {
                promotion = PieceKind.fromLetter(san.charAt(eq + 1));
            }
            san = san.substring(0, eq);
        } else if (san.length() >= 3 && Character.isLowerCase(san.charAt(0))
                && Character.isDigit(san.charAt(san.length() - 2))
                && "QRBN".indexOf(san.charAt(san.length() - 1)) >= 0) {
            // e8Q
            promotion = PieceKind.fromLetter(san.charAt(san.length() - 1));
            san = san.substring(0, san.length() - 1);
        }

        boolean capture = san.indexOf('x') >= 0;
        san = san.replace("x", "");
        if (san.length() < 2) {
            throw new UnresolvedMoveException(token, side, "no destination square");
        }

        String to = san.substring(san.length() - 2);
        if (!Square.isValid(to)) {
            throw new UnresolvedMoveException(token, side, "bad destination '" + to + "'");
        }

        char lead = san.charAt(0);
        PieceKind kind = Character.isUpperCase(lead) ? PieceKind.fromLetter(lead) : PieceKind.PAWN;
        String hints = san.substring(Character.isUpperCase(lead) ? 1 : 0, san.length() - 2);

        String from = findSource(kind, side, to, capture, hints, board);
        if (from == null) {
            throw new UnresolvedMoveException(token, side, "no " + kind + " can reach " + to);
        }

        if (capture) {
            board.clear(to);
        }
        Piece mover = board.clear(from);
        board.place(to, promotion != null && kind == PieceKind.PAWN ? new Piece(side, promotion) : mover);
        return new ResolvedMove(from, to);
    }

    private static String stripAnnotations(String san) {
        int end = san.length();
        while (end > 0 && "+#!?".indexOf(san.charAt(end - 1)) >= 0) {
            end--;
        }
        return san.substring(0, end);
    }

    private ResolvedMove castle(String token, Side side, Board board, char kingFile, char rookFile,
                                char rookTargetFile) {
        int rank = side.homeRank();
        String kingFrom = Square.of('e', rank);
        String kingTo = Square.of(kingFile, rank);
        String rookFrom = Square.of(rookFile, rank);
        String rookTo = Square.of(rookTargetFile, rank);

        Piece king = board.pieceAt(kingFrom);
        Piece rook = board.pieceAt(rookFrom);
        if (king == null || !king.is(side, PieceKind.KING) || rook == null || !rook.is(side, PieceKind.ROOK)) {
            throw new UnresolvedMoveException(token, side, "king or rook not on its home square");
        }

        board.clear(kingFrom);
        board.clear(rookFrom);
        board.place(kingTo, king);
        board.place(rookTo, rook);
        return new ResolvedMove(kingFrom, kingTo);
    }

    private String findSource(PieceKind kind, Side side, String to, boolean capture, String hints, Board board) {
        char hintFile = 0;
        int hintRank = 0;
        if (properties.isHonorDisambiguation()) {
            for (char c : hints.toCharArray()) {
                if (c >= 'a' && c <= 'h' && hintFile == 0) {
                    hintFile = c;
                } else if (c >= '1' && c <= '8' && hintRank == 0) {
                    hintRank = c - '0';
                }
            }
            if (kind == PieceKind.PAWN && !capture && hintFile == 0) {
                hintFile = Square.file(to);
            }
        }

        List<String> candidates = new ArrayList<>();
        for (char file : Square.FILES.toCharArray()) {
            if (hintFile != 0 && file != hintFile) {
                continue;
            }
            for (int rank = 1; rank <= 8; rank++) {
                if (hintRank != 0 && rank != hintRank) {
                    continue;
                }
                String square = Square.of(file, rank);
                if (square.equals(to)) {
                    continue;
                }
                Piece piece = board.pieceAt(square);
                if (piece != null && piece.is(side, kind) && canReach(kind, square, to)) {
                    candidates.add(square);
                }
            }
        }

        if (candidates.isEmpty()) {
            return null;
        }
        if (candidates.size() == 1) {
            return candidates.get(0);
        }
        return closest(candidates, to);
    }

    static boolean canReach(PieceKind kind, String from, String to) {
        int df = Square.fileDistance(from, to);
        int dr = Square.rankDistance(from, to);
        switch (kind) {
            case KING:
                return df <= 1 && dr <= 1;
            case QUEEN:
                return df == 0 || dr == 0 || df == dr;
            case ROOK:
                return df == 0 || dr == 0;
            case BISHOP:
                return df == dr;
            case KNIGHT:
                return (df == 1 && dr == 2) || (df == 2 && dr == 1);
            case PAWN:
            default:
                return true;
        }
    }

    private static String closest(List<String> candidates, String to) {
        String best = candidates.get(0);
        int bestDistance = Integer.MAX_VALUE;
        for (String candidate : candidates) {
            int distance = Square.fileDistance(candidate, to) + Square.rankDistance(candidate, to);
            if (distance < bestDistance) {
                bestDistance = distance;
                best = candidate;
            }
        }
        return best;
    }
}
