package com.boarddb.core.scanner;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Naming and discovery rules for defconfig fragments.
 */
public final class Defconfigs {

    public static final String SUFFIX = "_defconfig";

    /** Directory, relative to the source tree, that holds the fragments. */
    public static final String CONFIG_DIR = "configs";

    private Defconfigs() {}

    /**
     * Returns the build-target name for a fragment file name, i.e. the name with
     * the trailing {@value #SUFFIX} removed, or empty if the name does not end
     * with the suffix.
     */
    public static Optional<String> targetName(String fileName) {
        if (!fileName.endsWith(SUFFIX)) {
            return Optional.empty();
        }
        return Optional.of(fileName.substring(0, fileName.length() - SUFFIX.length()));
    }

    /**
     * Hidden files are never treated as fragments.
     */
    public static boolean isFragment(Path path) {
        String name = path.getFileName().toString();
        return name.endsWith(SUFFIX) && !name.startsWith(".");
    }

    /**
     * Walks {@code configDir} and returns every fragment below it, sorted by path.
     * A missing directory has no fragments.
     *
     * @throws IOException if the directory walk fails
     */
    public static List<Path> findAll(Path configDir) throws IOException {
        return SourceTree.regularFiles(configDir, Defconfigs::isFragment);
    }
}
