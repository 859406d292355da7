package com.boarddb.core.model;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of a board selection.
 *
 * @param byTerm   targets keyed by the term that selected them; always starts with
 *                 the {@link #ALL} bucket, followed by one entry per term in argument order
 * @param selected every selected target, in board order
 * @param warnings problems found while selecting, e.g. explicitly named boards that do not exist
 */
public record SelectionResult(
    Map<String, List<String>> byTerm,
    Set<String> selected,
    List<String> warnings
) {

    public static final String ALL = "all";

    public List<String> all() {
        return byTerm.getOrDefault(ALL, List.of());
    }

    public boolean isSelected(String target) {
        return selected.contains(target);
    }
}
