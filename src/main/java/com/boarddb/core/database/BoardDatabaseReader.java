package com.boarddb.core.database;

import com.boarddb.core.model.Board;
import com.boarddb.core.model.BoardList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Reads a board database back into {@link Board}s.
 * <p>
 * Tolerates hand-edited files: lines with fewer than eight fields are padded
 * with empty strings and extra fields (usually the maintainers) are dropped.
 */
@Component
public class BoardDatabaseReader {

    private static final Logger log = LoggerFactory.getLogger(BoardDatabaseReader.class);

    public BoardList read(Path file) throws IOException {
        var boards = new BoardList();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                parseLine(line).ifPresent(boards::add);
            }
        }
        log.debug("Read {} boards from {}", boards.size(), file);
        return boards;
    }

    static Optional<Board> parseLine(String line) {
        if (line.startsWith("#")) {
            return Optional.empty();
        }
        String trimmed = line.strip();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        List<String> fields = new ArrayList<>(Arrays.asList(trimmed.split("\\s+")));
        fields.replaceAll(f -> "-".equals(f) ? "" : f);
        while (fields.size() < Board.FIELD_COUNT) {
            fields.add("");
        }
        return Optional.of(Board.fromFields(fields.subList(0, Board.FIELD_COUNT)));
    }
}
