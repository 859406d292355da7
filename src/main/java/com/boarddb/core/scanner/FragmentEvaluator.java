package com.boarddb.core.scanner;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Loads a defconfig fragment and answers symbol queries about it.
 * <p>
 * Symbol names are given without the {@code CONFIG_} prefix. One evaluator is
 * used by one scan worker at a time; it is closed when the worker is done.
 */
public interface FragmentEvaluator extends AutoCloseable {

    /**
     * Loads a fragment, replacing whatever was loaded before.
     *
     * @throws IOException if the fragment or one of its includes cannot be read
     */
    void load(Path fragment) throws IOException;

    /**
     * Returns the value of a symbol, or empty if it is unset or has an empty value.
     */
    Optional<String> value(String symbol);

    /**
     * Returns {@code true} if a boolean symbol is set to {@code y}. Undefined
     * symbols read as unset and never cause an exception.
     */
    boolean flag(String symbol);

    /**
     * All symbols defined by the loaded fragment and the defaults, with their values.
     */
    Map<String, String> symbols();

    @Override
    void close();
}
