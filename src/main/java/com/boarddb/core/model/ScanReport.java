package com.boarddb.core.model;

import java.util.List;

/**
 * Aggregated output of a full fragment scan.
 *
 * @param params   one entry per scanned fragment, in no particular cross-worker order
 * @param warnings de-duplicated, sorted warnings
 */
public record ScanReport(
    List<BoardParams> params,
    List<String> warnings
) {}
