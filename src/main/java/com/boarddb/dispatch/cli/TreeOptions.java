package com.boarddb.dispatch.cli;

import com.boarddb.config.BoardDbProperties;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Location options shared by the subcommands. Unset options fall back to the
 * {@code boarddb.*} application properties.
 */
public class TreeOptions {

    @Option(names = {"--output", "-o"}, description = "Board database file")
    Path output;

    @Option(names = {"--config-dir"}, description = "Directory containing the defconfig files")
    Path configDir;

    @Option(names = {"--src-dir"}, description = "Source tree with Kconfig and MAINTAINERS files")
    Path srcDir;

    Path output(BoardDbProperties properties) {
        return output != null ? output : Path.of(properties.getOutput());
    }

    Path srcDir(BoardDbProperties properties) {
        return srcDir != null ? srcDir : Path.of(properties.getSrcDir());
    }

    /**
     * A relative configured directory is taken relative to the source tree.
     */
    Path configDir(BoardDbProperties properties) {
        if (configDir != null) {
            return configDir;
        }
        Path configured = Path.of(properties.getConfigDir());
        return configured.isAbsolute() ? configured : srcDir(properties).resolve(configured);
    }
}
