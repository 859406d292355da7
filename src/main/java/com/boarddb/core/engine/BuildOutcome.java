package com.boarddb.core.engine;

import java.util.List;

/**
 * Result of {@link BoardDatabaseService#ensureBoardList}.
 *
 * @param regenerated {@code false} if the existing database was up to date and left alone
 * @param boardCount  number of boards written, or 0 when nothing was regenerated
 * @param warnings    scan warnings followed by maintainer warnings
 */
public record BuildOutcome(
    boolean regenerated,
    int boardCount,
    List<String> warnings
) {

    public static BuildOutcome upToDate() {
        return new BuildOutcome(false, 0, List.of());
    }

    /** {@code true} if no warnings were raised. */
    public boolean ok() {
        return warnings.isEmpty();
    }
}
