package com.boarddb.core.selection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A list of expressions each of which must match the board properties for
 * the board to be selected.
 */
public final class Term {

    private final List<Expr> exprs = new ArrayList<>();

    public void addExpr(String expr) {
        exprs.add(new Expr(expr));
    }

    public List<Expr> exprs() {
        return Collections.unmodifiableList(exprs);
    }

    /**
     * Returns {@code true} if every expression matches at least one property.
     */
    public boolean matches(List<String> props) {
        for (Expr expr : exprs) {
            if (!expr.matches(props)) {
                return false;
            }
        }
        return true;
    }

    /** The expressions joined with {@code &}, used as the provenance key. */
    @Override
    public String toString() {
        return exprs.stream().map(Expr::toString).collect(Collectors.joining("&"));
    }
}
