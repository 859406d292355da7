package com.boarddb.core.model;

import java.util.List;

/**
 * Result of scanning a single defconfig fragment.
 */
public record ScanOutcome(
    BoardParams params,
    List<String> warnings
) {}
