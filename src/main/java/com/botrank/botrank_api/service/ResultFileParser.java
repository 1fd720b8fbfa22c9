package com.botrank.botrank_api.service;

import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads game results from a delimited text file.
 *
 * Format: one header line, then one row per finisher:
 * <pre>
 *   competitor  contest  finish
 *   halite_v3   1        1
 *   basic_bot   1        2
 * </pre>
 * Columns are separated by whitespace or commas. Rows are grouped into games
 * by contest id, in the order contests first appear.
 */
@Component
public class ResultFileParser {

    private static final String SEPARATOR = "[\\s,]+";

    public List<ParsedGame> parse(Path file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parse(reader);
        }
    }

    public List<ParsedGame> parse(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);
        Map<String, Map<String, Integer>> games = new LinkedHashMap<>();

        // Header line is dropped
        reader.readLine();
        int lineNumber = 1;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }

            String[] columns = trimmed.split(SEPARATOR);
            if (columns.length != 3) {
                throw new MalformedResultFileException(lineNumber,
                        "expected 3 columns (competitor contest finish), found " + columns.length);
            }
            String competitor = columns[0];
            String contest = columns[1];
            int finish;
            try {
                finish = Integer.parseInt(columns[2]);
            } catch (NumberFormatException e) {
                throw new MalformedResultFileException(lineNumber, "finish '" + columns[2] + "' is not an integer");
            }

            Map<String, Integer> finishes = games.computeIfAbsent(contest, k -> new LinkedHashMap<>());
            if (finishes.putIfAbsent(competitor, finish) != null) {
                throw new MalformedResultFileException(lineNumber,
                        competitor + " appears twice in contest " + contest);
            }
        }

        List<ParsedGame> parsed = new ArrayList<>(games.size());
        games.forEach((contest, finishes) -> parsed.add(new ParsedGame(contest, finishes)));
        return parsed;
    }

    // =========================================================================
    // DTOs & Exception
    // =========================================================================

    public record ParsedGame(String gameId, Map<String, Integer> finishes) {}

    public static class MalformedResultFileException extends RuntimeException {
        private final int lineNumber;

        public MalformedResultFileException(int lineNumber, String message) {
            super("Line " + lineNumber + ": " + message);
            this.lineNumber = lineNumber;
        }

        public int getLineNumber() {
            return lineNumber;
        }
    }
}
