package com.boarddb.core.model;

import java.util.List;

/**
 * A board as read back from the generated database.
 * <p>
 * Fields that were written as {@code -} come back as empty strings.
 */
public record Board(
    String status,
    String arch,
    String cpu,
    String soc,
    String vendor,
    String boardName,
    String target,
    String cfgName
) {

    /** Number of positional fields a database line contributes to a board. */
    public static final int FIELD_COUNT = 8;

    public static Board fromFields(List<String> fields) {
        if (fields.size() != FIELD_COUNT) {
            throw new IllegalArgumentException("Expected " + FIELD_COUNT + " fields, got " + fields.size());
        }
        return new Board(fields.get(0), fields.get(1), fields.get(2), fields.get(3),
                fields.get(4), fields.get(5), fields.get(6), fields.get(7));
    }

    /**
     * Properties that selection expressions are matched against.
     */
    public List<String> props() {
        return List.of(target, arch, cpu, boardName, vendor, soc, cfgName);
    }
}
