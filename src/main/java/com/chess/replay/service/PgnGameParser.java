package com.chess.replay.service;

import com.chess.replay.model.GameMetadata;
import com.chess.replay.model.MoveRecord;
import com.chess.replay.model.PgnTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the text of a single game into its tag metadata and numbered move records.
 * Parsing is best effort: malformed tags are skipped and whatever movetext can be read is
 * returned.
 */
@Component
public class PgnGameParser {

    private static final Logger log = LoggerFactory.getLogger(PgnGameParser.class);

    public static final Set<String> RESULT_TOKENS = Set.of("1-0", "0-1", "1/2-1/2", "*");

    private static final Pattern TAG_LINE = Pattern.compile("^\\[([A-Za-z0-9_]+)\\s+\"(.*)\"\\s*]$");
    private static final Pattern TAG_HEADER = Pattern.compile("^\\[[A-Za-z]");
    private static final Pattern MOVE_NUMBER = Pattern.compile("^(\\d{1,9})\\.$");
    private static final Pattern BLACK_CONTINUATION = Pattern.compile("^\\d+\\.\\.\\.$");
    private static final Pattern BRACE_COMMENT = Pattern.compile("\\{[^}]*}");
    // a comment may wrap onto following lines; tag lines outside comments are kept as they are
    private static final Pattern TAG_LINE_OR_COMMENT = Pattern.compile("(?m)(^[ \\t]*\\[[A-Za-z].*$)|\\{[^}]*}");

    public record ParsedGame(GameMetadata metadata, List<MoveRecord> moves) {
    }

    public ParsedGame parse(String gameText) {
        GameMetadata.Builder metadata = GameMetadata.builder();
        StringBuilder moveText = new StringBuilder();

        String text = stripComments(PgnSplitter.normalizeLineEndings(gameText));

        for (String line : text.split("\n")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (TAG_HEADER.matcher(trimmed).find()) {
                readTag(trimmed, metadata);
            } else {
                moveText.append(trimmed).append(' ');
            }
        }

        List<MoveRecord> moves = parseMoves(moveText.toString());
        GameMetadata parsed = metadata.build();
        log.debug("Parsed game {} vs {}: {} move records", parsed.white(), parsed.black(), moves.size());
        return new ParsedGame(parsed, moves);
    }

    private static String stripComments(String text) {
        return TAG_LINE_OR_COMMENT.matcher(text)
                .replaceAll(m -> m.group(1) != null ? Matcher.quoteReplacement(m.group(1)) : " ");
    }

    private void readTag(String line, GameMetadata.Builder metadata) {
        Matcher m = TAG_LINE.matcher(line);
        if (!m.matches()) {
            log.debug("Skipping malformed tag line: {}", line);
            return;
        }
        PgnTag tag = PgnTag.fromName(m.group(1));
        if (tag != null) {
            metadata.set(tag, m.group(2));
        }
    }

    List<MoveRecord> parseMoves(String moveText) {
        String cleaned = BRACE_COMMENT.matcher(moveText).replaceAll(" ");

        List<MoveRecord> moves = new ArrayList<>();
        int number = 1;
        String pendingWhite = null;

        for (String token : cleaned.trim().split("\\s+")) {
            if (token.isEmpty() || RESULT_TOKENS.contains(token) || token.startsWith("$")
                    || BLACK_CONTINUATION.matcher(token).matches()) {
                continue;
            }

            Matcher numberMatcher = MOVE_NUMBER.matcher(token);
            if (numberMatcher.matches()) {
                if (pendingWhite != null) {
                    moves.add(MoveRecord.of(number, pendingWhite, null));
                    pendingWhite = null;
                }
                number = Integer.parseInt(numberMatcher.group(1));
            } else if (pendingWhite == null) {
                pendingWhite = token;
            } else {
                moves.add(MoveRecord.of(number, pendingWhite, token));
                pendingWhite = null;
                number++;
            }
        }

        if (pendingWhite != null) {
            moves.add(MoveRecord.of(number, pendingWhite, null));
        }
        return moves;
    }
}
