package com.boarddb.core.database;

import com.boarddb.core.scanner.Defconfigs;
import com.boarddb.core.scanner.SourceTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Optional;

/**
 * Decides whether an existing board database still reflects the source tree.
 * <p>
 * The database is stale when it is missing, when any defconfig, Kconfig or
 * MAINTAINERS file was modified after it, when it lists a target whose
 * defconfig no longer exists, or when it still uses the old format with an
 * {@code Options} column.
 */
@Component
public class OutputFreshnessChecker {

    private static final Logger log = LoggerFactory.getLogger(OutputFreshnessChecker.class);

    static final String LEGACY_MARKER = "Options,";

    /** Zero-based index of the target column in a database line. */
    private static final int TARGET_FIELD = 6;

    /**
     * @param output    the database file
     * @param configDir directory containing the defconfig files
     * @param srcDir    source tree containing the Kconfig and MAINTAINERS files
     * @return {@code true} if the database exists and is newer than all of its inputs
     * @throws IOException if the database exists but cannot be read, or a tree cannot be walked
     */
    public boolean isUpToDate(Path output, Path configDir, Path srcDir) throws IOException {
        FileTime generated;
        try {
            generated = Files.getLastModifiedTime(output);
        } catch (NoSuchFileException e) {
            log.debug("{} does not exist", output);
            return false;
        }

        Optional<Path> newer = findNewer(Defconfigs.findAll(configDir), generated);
        if (newer.isPresent()) {
            log.debug("{} is newer than {}", newer.get(), output);
            return false;
        }

        newer = findNewer(SourceTree.regularFiles(srcDir, OutputFreshnessChecker::isKconfigOrMaintainers), generated);
        if (newer.isPresent()) {
            log.debug("{} is newer than {}", newer.get(), output);
            return false;
        }

        try (BufferedReader reader = Files.newBufferedReader(output, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.contains(LEGACY_MARKER)) {
                    log.debug("{} uses the legacy format", output);
                    return false;
                }
                if (line.startsWith("#") || line.isBlank()) {
                    continue;
                }
                String[] fields = line.strip().split("\\s+");
                if (fields.length <= TARGET_FIELD) {
                    log.debug("Malformed line in {}: {}", output, line);
                    return false;
                }
                Path defconfig = configDir.resolve(fields[TARGET_FIELD] + Defconfigs.SUFFIX);
                if (!Files.exists(defconfig)) {
                    log.debug("{} lists removed target {}", output, fields[TARGET_FIELD]);
                    return false;
                }
            }
        }
        return true;
    }

    static boolean isKconfigOrMaintainers(Path path) {
        String name = path.getFileName().toString();
        if (name.endsWith("~")) {
            return false;
        }
        return name.startsWith("Kconfig") || name.equals("MAINTAINERS");
    }

    private static Optional<Path> findNewer(Iterable<Path> files, FileTime generated) throws IOException {
        for (Path file : files) {
            if (Files.getLastModifiedTime(file).compareTo(generated) > 0) {
                return Optional.of(file);
            }
        }
        return Optional.empty();
    }
}
