package com.boarddb.core.engine;

import java.nio.file.Path;

/**
 * Parameters of a board database build.
 *
 * @param output      database file to write
 * @param configDir   directory containing the defconfig files
 * @param srcDir      source tree holding Kconfig and MAINTAINERS files
 * @param jobs        number of scan workers
 * @param force       regenerate even if the database looks up to date
 * @param warnTargets check each defconfig for exactly one {@code TARGET_xxx}
 */
public record BuildRequest(
    Path output,
    Path configDir,
    Path srcDir,
    int jobs,
    boolean force,
    boolean warnTargets
) {}
