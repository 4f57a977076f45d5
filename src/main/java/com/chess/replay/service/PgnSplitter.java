package com.chess.replay.service;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cuts a multi-game PGN text into one span per game.
 * <p>
 * A game ends at a result token that is followed either by a blank line and the next
 * game's opening tag bracket, or by the end of the input. The bracket itself belongs to
 * the next span, so the spans concatenate back to the (line-ending normalized) input.
 */
@Component
public class PgnSplitter {

    // \z rather than $: $ would stop before a final line break and leave it behind
    private static final Pattern GAME_END = Pattern.compile(
            "(\\s+)(1-0|0-1|1/2-1/2|\\*)\\s*?(\\n\\s*\\n\\s*\\[|\\z)");

    public static String normalizeLineEndings(String raw) {
        return raw.replace("\r\n", "\n").replace('\r', '\n');
    }

    public List<String> split(String raw) {
        List<String> spans = new ArrayList<>();
        if (raw == null) {
            return spans;
        }
        String text = normalizeLineEndings(raw);
        if (text.isBlank()) {
            return spans;
        }

        Matcher matcher = GAME_END.matcher(text);
        int start = 0;
        boolean matched = false;
        while (matcher.find()) {
            matched = true;
            int end = matcher.end();
            // leave the next game's '[' for the next span
            if (end > 0 && text.charAt(end - 1) == '[') {
                end--;
            }
            addSpan(spans, text.substring(start, end));
            start = end;
        }

        if (!matched) {
            spans.add(text);
            return spans;
        }
        if (start < text.length()) {
            addSpan(spans, text.substring(start));
        }
        return spans;
    }

    private void addSpan(List<String> spans, String span) {
        if (!span.isBlank()) {
            spans.add(span);
        }
    }
}
