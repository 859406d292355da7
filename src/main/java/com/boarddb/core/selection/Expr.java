package com.boarddb.core.selection;

import java.util.List;
import java.util.regex.Pattern;

/**
 * A single regular expression for matching boards to build.
 * <p>
 * The expression is anchored at the start of a property but not at its end, so
 * {@code tegra} matches {@code tegra20} while {@code 20} does not.
 */
public final class Expr {

    private final String expr;
    private final Pattern pattern;

    public Expr(String expr) {
        this.expr = expr;
        this.pattern = Pattern.compile(expr);
    }

    /**
     * Returns {@code true} if any of the properties matches the expression.
     */
    public boolean matches(List<String> props) {
        for (String prop : props) {
            if (pattern.matcher(prop).lookingAt()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return expr;
    }
}
