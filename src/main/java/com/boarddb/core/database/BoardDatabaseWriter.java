package com.boarddb.core.database;

import com.boarddb.core.model.BoardParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Writes board parameters as a column-aligned, case-insensitively sorted text file.
 */
@Component
public class BoardDatabaseWriter {

    private static final Logger log = LoggerFactory.getLogger(BoardDatabaseWriter.class);

    public static final String COMMENT_BLOCK = """
            #
            # List of boards
            #   Automatically generated by boarddb: don't edit
            #
            # Status, Arch, CPU, SoC, Vendor, Board, Target, Config, Maintainers

            """;

    private static final String GUTTER = "  ";

    /**
     * Writes the database, replacing any existing file. The content goes to a
     * temporary file next to {@code output} that is then moved into place, so an
     * existing database stays intact if writing fails.
     *
     * @throws IOException if the file cannot be written
     */
    public void write(List<BoardParams> params, Path output) throws IOException {
        List<String> lines = format(params);
        Path target = output.toAbsolutePath();
        Path parent = target.getParent();
        Files.createDirectories(parent);
        Path tmp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
        try {
            Files.writeString(tmp, COMMENT_BLOCK + String.join("\n", lines) + "\n", StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            tryRemove(tmp);
        }
        log.info("Wrote {} boards to {}", lines.size(), output);
    }

    /**
     * Renders one line per record. Each column is padded to the widest value in
     * that column, columns are separated by two spaces, surrounding whitespace is
     * trimmed and the lines are sorted ignoring case.
     */
    public List<String> format(List<BoardParams> params) {
        int columns = BoardParams.COLUMNS.size();
        int[] widths = new int[columns];
        for (BoardParams p : params) {
            List<String> values = p.columns();
            for (int i = 0; i < columns; i++) {
                widths[i] = Math.max(widths[i], displayLength(values.get(i)));
            }
        }

        var lines = new ArrayList<String>(params.size());
        for (BoardParams p : params) {
            List<String> values = p.columns();
            var line = new StringBuilder();
            for (int i = 0; i < columns; i++) {
                line.append(GUTTER).append(leftJustify(values.get(i), widths[i]));
            }
            lines.add(line.toString().strip());
        }
        lines.sort(Comparator.comparing(s -> s.toLowerCase(Locale.ROOT)));
        return lines;
    }

    /**
     * Removes a file, doing nothing if it does not exist.
     *
     * @throws IOException if the file exists but cannot be removed
     */
    public static void tryRemove(Path file) throws IOException {
        try {
            Files.delete(file);
        } catch (NoSuchFileException e) {
            log.debug("{} already absent", file);
        }
    }

    private static int displayLength(String value) {
        return value.codePointCount(0, value.length());
    }

    private static String leftJustify(String value, int width) {
        int pad = width - displayLength(value);
        return pad > 0 ? value + " ".repeat(pad) : value;
    }
}
