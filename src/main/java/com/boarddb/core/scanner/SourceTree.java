package com.boarddb.core.scanner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * Walks source trees for regular files.
 * <p>
 * A missing root yields nothing. Directories and files that cannot be read are
 * logged and skipped, so one unreadable subdirectory does not end the walk.
 */
public final class SourceTree {

    private static final Logger log = LoggerFactory.getLogger(SourceTree.class);

    private SourceTree() {}

    /**
     * Returns every regular file below {@code root} accepted by {@code filter},
     * sorted by path. Symbolic links to regular files are included.
     *
     * @throws IOException if the walk itself fails
     */
    public static List<Path> regularFiles(Path root, Predicate<Path> filter) throws IOException {
        if (!Files.isDirectory(root)) {
            log.debug("{} is not a directory, nothing to walk", root);
            return List.of();
        }
        var files = new ArrayList<Path>();
        Files.walkFileTree(root, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                boolean regular = attrs.isRegularFile()
                        || (attrs.isSymbolicLink() && Files.isRegularFile(file));
                if (regular && filter.test(file)) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                log.warn("Skipping unreadable {}: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
                if (exc != null) {
                    log.warn("Directory {} was only partly read: {}", dir, exc.getMessage());
                }
                return FileVisitResult.CONTINUE;
            }
        });
        Collections.sort(files);
        return files;
    }
}
