package com.boarddb.core.scanner;

import java.nio.file.Path;
import java.util.Map;

/**
 * Settings handed to each {@link FragmentEvaluator} when it is created.
 *
 * @param srcTree  root of the source tree; {@code #include} lines that cannot be
 *                 resolved next to the including fragment are looked up here
 * @param defaults symbol values in effect before a fragment is loaded, keyed by
 *                 symbol name without the {@code CONFIG_} prefix
 */
public record EvaluatorContext(
    Path srcTree,
    Map<String, String> defaults
) {

    public EvaluatorContext {
        defaults = Map.copyOf(defaults);
    }

    public static EvaluatorContext of(Path srcTree) {
        return new EvaluatorContext(srcTree, Map.of());
    }
}
