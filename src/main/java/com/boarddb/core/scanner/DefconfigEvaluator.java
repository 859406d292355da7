package com.boarddb.core.scanner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-based evaluator for defconfig fragments.
 * <p>
 * Understands {@code CONFIG_NAME=value} assignments (double quotes around the
 * value are removed), {@code # CONFIG_NAME is not set} and
 * {@code #include "file"} / {@code #include <file>}. Every other line is ignored.
 * Symbols not assigned by the fragment take their value from
 * {@link EvaluatorContext#defaults()}.
 * <p>
 * This is a fragment-only evaluator: it never reads Kconfig files, so values
 * that a real tree derives from Kconfig defaults (most {@code SYS_*} symbols)
 * are unset unless the fragment or the configured defaults assign them. Plug in
 * a Kconfig-aware {@link EvaluatorFactory} bean for full results.
 */
public class DefconfigEvaluator implements FragmentEvaluator {

    private static final Logger log = LoggerFactory.getLogger(DefconfigEvaluator.class);

    private static final Pattern ASSIGNMENT = Pattern.compile("^CONFIG_([A-Za-z0-9_]+)=(.*)$");
    private static final Pattern NOT_SET = Pattern.compile("^# CONFIG_([A-Za-z0-9_]+) is not set\\s*$");
    private static final Pattern INCLUDE = Pattern.compile("^#include\\s+[<\"]([^>\"]+)[>\"]\\s*$");

    private static final int MAX_INCLUDE_DEPTH = 16;

    private final EvaluatorContext context;
    private final Map<String, String> symbols = new LinkedHashMap<>();
    private boolean closed;

    public DefconfigEvaluator(EvaluatorContext context) {
        this.context = context;
    }

    @Override
    public void load(Path fragment) throws IOException {
        ensureOpen();
        symbols.clear();
        symbols.putAll(context.defaults());
        readFragment(fragment, new ArrayDeque<>());
        log.debug("Loaded {} with {} symbols", fragment.getFileName(), symbols.size());
    }

    private void readFragment(Path fragment, Deque<Path> includeStack) throws IOException {
        if (includeStack.size() >= MAX_INCLUDE_DEPTH) {
            throw new IOException("Include depth exceeded at " + fragment + " (included from " + includeStack.peek() + ")");
        }
        includeStack.push(fragment);
        for (String line : Files.readAllLines(fragment, StandardCharsets.UTF_8)) {
            String trimmed = line.strip();
            Matcher m = ASSIGNMENT.matcher(trimmed);
            if (m.matches()) {
                symbols.put(m.group(1), unquote(m.group(2)));
                continue;
            }
            m = NOT_SET.matcher(trimmed);
            if (m.matches()) {
                symbols.put(m.group(1), "");
                continue;
            }
            m = INCLUDE.matcher(trimmed);
            if (m.matches()) {
                readFragment(resolveInclude(fragment, m.group(1)), includeStack);
            }
        }
        includeStack.pop();
    }

    private Path resolveInclude(Path fragment, String name) throws IOException {
        Path parent = fragment.toAbsolutePath().getParent();
        if (parent != null) {
            Path sibling = parent.resolve(name);
            if (Files.isRegularFile(sibling)) {
                return sibling;
            }
        }
        Path fromTree = context.srcTree().resolve(name);
        if (Files.isRegularFile(fromTree)) {
            return fromTree;
        }
        throw new IOException("Cannot resolve #include \"" + name + "\" in " + fragment);
    }

    private static String unquote(String raw) {
        if (raw.length() >= 2 && raw.startsWith("\"") && raw.endsWith("\"")) {
            return raw.substring(1, raw.length() - 1)
                    .replace("\\\"", "\"")
                    .replace("\\\\", "\\");
        }
        return raw;
    }

    @Override
    public Optional<String> value(String symbol) {
        ensureOpen();
        String value = symbols.get(symbol);
        return value == null || value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    @Override
    public boolean flag(String symbol) {
        return "y".equals(symbols.get(symbol));
    }

    @Override
    public Map<String, String> symbols() {
        ensureOpen();
        return Collections.unmodifiableMap(symbols);
    }

    @Override
    public void close() {
        symbols.clear();
        closed = true;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Evaluator already closed");
        }
    }
}
