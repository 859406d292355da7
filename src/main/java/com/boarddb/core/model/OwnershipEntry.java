package com.boarddb.core.model;

import java.util.List;

/**
 * Status and maintainers that a MAINTAINERS record binds to a target.
 *
 * @param status      free-text {@code S:} value, {@code "-"} when the record has none
 * @param maintainers {@code M:} values in file order
 */
public record OwnershipEntry(
    String status,
    List<String> maintainers
) {}
